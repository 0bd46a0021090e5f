package com.citationformatter;

import java.util.Objects;

/**
 * A diagnostic attached to a formatting result. Issues never abort processing.
 *
 * @param type    what kind of problem
 * @param field   the field concerned, or {@code null} when not field-specific
 * @param message human-readable detail
 */
public record Issue(IssueType type, CitationField field, String message) {

    public enum IssueType {
        UNRECOGNIZED_TYPE,
        FIELD_NOT_FOUND,
        MISSING_REQUIRED_FIELD,
        AMBIGUOUS_RANGE,
        PUNCTUATION,
        FIELD_DROPPED,
        COLLABORATOR_FAILURE
    }

    public Issue {
        Objects.requireNonNull(type, "type");
        if (message == null) message = "";
    }

    public static Issue of(IssueType type, String message) {
        return new Issue(type, null, message);
    }

    public static Issue of(IssueType type, CitationField field, String message) {
        return new Issue(type, field, message);
    }
}
