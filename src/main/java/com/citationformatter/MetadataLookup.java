package com.citationformatter;

import java.io.IOException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves a DOI or ISBN to a structured record. Implementations typically call a remote service;
 * the formatter treats any failure as non-fatal.
 */
@FunctionalInterface
public interface MetadataLookup {

    Optional<SourceRecord> lookup(Identifier identifier) throws IOException;

    /**
     * A recognized bibliographic identifier.
     */
    record Identifier(Kind kind, String value) {

        public enum Kind { DOI, ISBN }

        private static final Pattern DOI = Pattern.compile("^10\\.\\d{4,}/\\S+$");
        private static final Pattern DOI_PREFIX = Pattern.compile("^(?:https?://(?:dx\\.)?doi\\.org/|doi:\\s*)",
                Pattern.CASE_INSENSITIVE);
        private static final Pattern ISBN_10 = Pattern.compile("^\\d{9}[\\dXx]$");
        private static final Pattern ISBN_13 = Pattern.compile("^97[89]\\d{10}$");

        /**
         * Recognizes a bare DOI (optionally prefixed with {@code doi:} or a doi.org URL) or an
         * ISBN-10/13 with or without hyphens. Anything else yields an empty result.
         */
        public static Optional<Identifier> detect(String text) {
            if (text == null) return Optional.empty();
            String t = text.strip();
            if (t.isEmpty()) return Optional.empty();

            String doi = DOI_PREFIX.matcher(t).replaceFirst("");
            if (DOI.matcher(doi).matches()) return Optional.of(new Identifier(Kind.DOI, doi));

            String isbn = t.replaceFirst("(?i)^ISBN[:\\s]*", "").replace("-", "").replace(" ", "");
            if (ISBN_13.matcher(isbn).matches() || ISBN_10.matcher(isbn).matches()) {
                return Optional.of(new Identifier(Kind.ISBN, isbn.toUpperCase(Locale.ROOT)));
            }
            return Optional.empty();
        }
    }
}
