package com.citationformatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable set of values extracted from one citation.
 *
 * <p>A field that was not found has no entry. A field found with an empty value keeps its entry,
 * so "absent" and "present but empty" stay distinguishable. Authors are kept in inverted form
 * ("Фамилия, И. О.").
 */
public final class ExtractedFields {

    private static final ExtractedFields EMPTY = new ExtractedFields(List.of(), new EnumMap<>(CitationField.class));

    private static final Pattern PAGE_PREFIX = Pattern.compile("^(?:[СC]\\.|[Pp]p?\\.)\\s*");
    private static final Pattern PAGE_SUFFIX = Pattern.compile("\\s*[сcp]\\.$");
    private static final Pattern PAGE_RANGE = Pattern.compile("(\\d+)\\s*[-–—]\\s*(\\d+)");
    private static final Pattern DOI_PREFIX = Pattern.compile("^(?:https?://(?:dx\\.)?doi\\.org/|doi:\\s*)",
            Pattern.CASE_INSENSITIVE);

    private final List<String> authors;
    private final Map<CitationField, String> values;

    private ExtractedFields(List<String> authors, Map<CitationField, String> values) {
        this.authors = List.copyOf(authors);
        this.values = values;
    }

    public static ExtractedFields empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Maps a structured record onto the field set. Direct-form author names are inverted.
     */
    public static ExtractedFields fromRecord(SourceRecord record) {
        Builder b = builder();
        List<String> names = new ArrayList<>();
        for (String author : record.authors()) {
            if (author == null || author.isBlank()) continue;
            names.add(FieldExtractor.toInverted(PunctuationNormalizer.normalize(author)));
        }
        b.authors(names);
        b.put(CitationField.TITLE, trim(record.title()));
        b.put(CitationField.YEAR, trim(record.year()));
        b.put(CitationField.PUBLISHER, trim(record.publisher()));
        b.put(CitationField.CITY, trim(record.city()));
        b.put(CitationField.PAGES, cleanPages(record.pages()));
        b.put(CitationField.JOURNAL, trim(record.journal()));
        b.put(CitationField.VOLUME, trim(record.volume()));
        b.put(CitationField.ISSUE, trim(record.issue()));
        b.put(CitationField.URL, trim(record.url()));
        b.put(CitationField.ACCESS_DATE, trim(record.accessDate()));
        if (record.doi() != null) {
            b.put(CitationField.DOI, DOI_PREFIX.matcher(record.doi().trim()).replaceFirst(""));
        }
        return b.build();
    }

    public boolean isFound(CitationField field) {
        if (field == CitationField.AUTHORS) return !authors.isEmpty();
        return values.containsKey(field);
    }

    /**
     * The value of {@code field}, empty when it was not found. Authors are joined with "; ".
     */
    public Optional<String> get(CitationField field) {
        if (field == CitationField.AUTHORS) {
            return authors.isEmpty() ? Optional.empty() : Optional.of(String.join("; ", authors));
        }
        return Optional.ofNullable(values.get(field));
    }

    /**
     * The value of {@code field}, or {@code null} when it was not found.
     */
    public String value(CitationField field) {
        return get(field).orElse(null);
    }

    public List<String> authors() {
        return authors;
    }

    /**
     * All fields that were found, in declaration order.
     */
    public Set<CitationField> found() {
        EnumSet<CitationField> set = EnumSet.noneOf(CitationField.class);
        if (!authors.isEmpty()) set.add(CitationField.AUTHORS);
        set.addAll(values.keySet());
        return Collections.unmodifiableSet(set);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractedFields other)) return false;
        return authors.equals(other.authors) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return 31 * authors.hashCode() + values.hashCode();
    }

    @Override
    public String toString() {
        return "ExtractedFields{authors=" + authors + ", values=" + values + "}";
    }

    private static String trim(String s) {
        return s == null ? null : s.strip();
    }

    private static String cleanPages(String pages) {
        if (pages == null) return null;
        String p = PAGE_PREFIX.matcher(pages.strip()).replaceFirst("");
        p = PAGE_SUFFIX.matcher(p).replaceFirst("");
        return PAGE_RANGE.matcher(p).replaceAll("$1–$2");
    }

    public static final class Builder {
        private final List<String> authors = new ArrayList<>();
        private final EnumMap<CitationField, String> values = new EnumMap<>(CitationField.class);

        private Builder() {}

        public Builder authors(List<String> names) {
            authors.clear();
            if (names != null) authors.addAll(names);
            return this;
        }

        /**
         * Records a found value. {@code null} is ignored, so callers can pass match results directly.
         */
        public Builder put(CitationField field, String value) {
            if (field == CitationField.AUTHORS) {
                throw new IllegalArgumentException("Use authors(...) for the author list");
            }
            if (value != null) values.put(field, value);
            return this;
        }

        public ExtractedFields build() {
            return new ExtractedFields(authors, new EnumMap<>(values));
        }
    }
}
