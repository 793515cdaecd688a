package com.metabolite.classification.core.model;

/**
 * Per-source status recorded on a metabolite's partial record.
 *
 * @param kind    the outcome kind
 * @param message failure description for {@link Kind#ERROR}, null otherwise
 */
public record SourceStatus(Kind kind, String message) {

    public enum Kind {
        FOUND,
        ID_NOT_FOUND,
        ERROR
    }

    private static final SourceStatus FOUND = new SourceStatus(Kind.FOUND, null);
    private static final SourceStatus ID_NOT_FOUND = new SourceStatus(Kind.ID_NOT_FOUND, null);

    public static SourceStatus found() {
        return FOUND;
    }

    public static SourceStatus idNotFound() {
        return ID_NOT_FOUND;
    }

    public static SourceStatus error(String message) {
        return new SourceStatus(Kind.ERROR, message != null ? message : "");
    }

    public boolean isFound() {
        return kind == Kind.FOUND;
    }

    /**
     * Text written to the status column of the result table.
     */
    public String label() {
        return switch (kind) {
            case FOUND -> "Found";
            case ID_NOT_FOUND -> "ID not found";
            case ERROR -> "Error: " + message;
        };
    }

    @Override
    public String toString() {
        return label();
    }
}
