package com.metabolite.classification.core.model;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a resolver or fetcher call: either a value or a {@link LookupError}
 * with a human readable message. Lookups never throw for network or parse failures.
 *
 * @param value   the value on success, null otherwise
 * @param error   the failure variant, null on success
 * @param message description of the failure, null on success
 * @param <T>     the value type
 */
public record LookupResult<T>(T value, LookupError error, String message) {

    public LookupResult {
        if (error == null) {
            Objects.requireNonNull(value, "value must not be null on success");
        } else if (value != null) {
            throw new IllegalArgumentException("a failed lookup cannot carry a value");
        }
    }

    public static <T> LookupResult<T> found(T value) {
        return new LookupResult<>(value, null, null);
    }

    public static <T> LookupResult<T> notFound(String message) {
        return new LookupResult<>(null, LookupError.NOT_FOUND, message);
    }

    public static <T> LookupResult<T> requestError(String message) {
        return new LookupResult<>(null, LookupError.REQUEST_ERROR, message);
    }

    public static <T> LookupResult<T> parseError(String message) {
        return new LookupResult<>(null, LookupError.PARSE_ERROR, message);
    }

    public boolean isFound() {
        return error == null;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    /**
     * Maps the value if found, carrying the failure over otherwise.
     */
    public <U> LookupResult<U> map(Function<T, U> mapper) {
        if (isFound()) {
            return found(mapper.apply(value));
        }
        return new LookupResult<>(null, error, message);
    }

    /**
     * Chains another lookup if this one succeeded.
     */
    public <U> LookupResult<U> flatMap(Function<T, LookupResult<U>> mapper) {
        if (isFound()) {
            return mapper.apply(value);
        }
        return new LookupResult<>(null, error, message);
    }

    @Override
    public String toString() {
        return isFound()
                ? "LookupResult.found(" + value + ")"
                : "LookupResult." + error + "(" + message + ")";
    }
}
