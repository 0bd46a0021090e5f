package com.citationformatter;

import java.util.List;

/**
 * Structured bibliographic data, as supplied by a caller, a metadata lookup or a free-text parser.
 *
 * <p>{@code null} means the value is absent; an empty string means it is present but empty.
 * Authors are given in inverted form ("Иванов, И. И.") or direct form ("И. И. Иванов").
 */
public record SourceRecord(
        List<String> authors,
        String title,
        String year,
        String publisher,
        String city,
        String pages,
        String journal,
        String volume,
        String issue,
        String doi,
        String url,
        String accessDate,
        String language,
        String type
) {

    public SourceRecord {
        authors = authors == null ? List.of() : List.copyOf(authors);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<String> authors = List.of();
        private String title;
        private String year;
        private String publisher;
        private String city;
        private String pages;
        private String journal;
        private String volume;
        private String issue;
        private String doi;
        private String url;
        private String accessDate;
        private String language;
        private String type;

        private Builder() {}

        public Builder authors(List<String> authors) { this.authors = authors; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder year(String year) { this.year = year; return this; }
        public Builder publisher(String publisher) { this.publisher = publisher; return this; }
        public Builder city(String city) { this.city = city; return this; }
        public Builder pages(String pages) { this.pages = pages; return this; }
        public Builder journal(String journal) { this.journal = journal; return this; }
        public Builder volume(String volume) { this.volume = volume; return this; }
        public Builder issue(String issue) { this.issue = issue; return this; }
        public Builder doi(String doi) { this.doi = doi; return this; }
        public Builder url(String url) { this.url = url; return this; }
        public Builder accessDate(String accessDate) { this.accessDate = accessDate; return this; }
        public Builder language(String language) { this.language = language; return this; }
        public Builder type(String type) { this.type = type; return this; }

        public SourceRecord build() {
            return new SourceRecord(authors, title, year, publisher, city, pages, journal,
                    volume, issue, doi, url, accessDate, language, type);
        }
    }
}
