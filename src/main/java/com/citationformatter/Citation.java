package com.citationformatter;

import java.util.Objects;

/**
 * Pipeline input: either a raw citation string or a structured {@link SourceRecord}.
 * Exactly one of {@code text} and {@code record} is non-null.
 */
public record Citation(String text, SourceRecord record) {

    public Citation {
        if ((text == null) == (record == null)) {
            throw new IllegalArgumentException("Citation needs exactly one of text or record");
        }
    }

    public static Citation of(String text) {
        return new Citation(Objects.requireNonNull(text, "text"), null);
    }

    public static Citation of(SourceRecord record) {
        return new Citation(null, Objects.requireNonNull(record, "record"));
    }

    public boolean isStructured() {
        return record != null;
    }
}
