package com.metabolite.classification.core.model;

/**
 * Failure variants of a single lookup against an external source.
 */
public enum LookupError {
    /** The source answered but had no candidate for the query. */
    NOT_FOUND,
    /** Non-2xx status, transport exception or deadline breach. */
    REQUEST_ERROR,
    /** The response body could not be interpreted. */
    PARSE_ERROR
}
