package com.metabolite.classification.core.model;

/**
 * Final classification of a metabolite.
 * KEGG only ever reports {@link #PRIMARY} or {@link #SECONDARY}; {@link #UNKNOWN}
 * is produced when neither the KEGG tag nor the HMDB keyword heuristic applies.
 */
public enum MetaboliteType {
    PRIMARY("primary"),
    SECONDARY("secondary"),
    UNKNOWN("unknown");

    private final String label;

    MetaboliteType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
