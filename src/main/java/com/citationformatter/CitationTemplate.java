package com.citationformatter;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered slot layout of a bibliographic record for one category.
 */
public record CitationTemplate(CitationCategory category, List<Segment> segments) {

    public CitationTemplate {
        segments = List.copyOf(segments);
    }

    /**
     * How a missing slot is treated.
     */
    public enum Presence {
        /** Rendered as the gap marker when missing. */
        REQUIRED,
        /** Dropped when missing, but reported. */
        EXPECTED,
        /** Dropped silently. */
        OPTIONAL
    }

    /**
     * A renderable position of the record, with the fields it consumes and the punctuation that
     * introduces it.
     */
    public enum Slot {
        AUTHOR_HEADING(" ", CitationField.AUTHORS),
        TITLE(" ", CitationField.TITLE),
        MEDIUM(" ", CitationField.MEDIUM),
        SUBTITLE(" : ", CitationField.SUBTITLE),
        RESPONSIBILITY(" / ", CitationField.RESPONSIBILITY, CitationField.AUTHORS),
        EDITION(". – ", CitationField.EDITION),
        JOURNAL(" // ", CitationField.JOURNAL),
        IMPRINT(". – ", CitationField.CITY, CitationField.PUBLISHER, CitationField.YEAR),
        YEAR(". – ", CitationField.YEAR),
        ISSUE_DATE(". – ", CitationField.ISSUE_DATE),
        VOLUME_ISSUE(". – ", CitationField.VOLUME, CitationField.ISSUE),
        PAGES(". – ", CitationField.PAGES),
        EXTENT(". – ", CitationField.EXTENT),
        NOTES(". – ", CitationField.NOTES),
        URL(". – ", CitationField.URL),
        ACCESS_DATE(". – ", CitationField.ACCESS_DATE),
        DOI(". – ", CitationField.DOI),
        ISBN(". – ", CitationField.ISBN);

        private final String joiner;
        private final Set<CitationField> fields;

        Slot(String joiner, CitationField first, CitationField... rest) {
            this.joiner = joiner;
            this.fields = EnumSet.of(first, rest);
        }

        public String joiner() {
            return joiner;
        }

        public Set<CitationField> fields() {
            return fields;
        }

        /**
         * The slot a stray field is rendered with when its template has no place for it.
         */
        public static Slot forField(CitationField field) {
            return switch (field) {
                case AUTHORS, RESPONSIBILITY -> RESPONSIBILITY;
                case TITLE -> TITLE;
                case SUBTITLE -> SUBTITLE;
                case MEDIUM -> MEDIUM;
                case EDITION -> EDITION;
                case CITY, PUBLISHER, YEAR -> IMPRINT;
                case JOURNAL -> JOURNAL;
                case ISSUE_DATE -> ISSUE_DATE;
                case VOLUME, ISSUE -> VOLUME_ISSUE;
                case PAGES -> PAGES;
                case EXTENT -> EXTENT;
                case NOTES -> NOTES;
                case URL -> URL;
                case ACCESS_DATE -> ACCESS_DATE;
                case DOI -> DOI;
                case ISBN -> ISBN;
            };
        }
    }

    /**
     * @param joiner       punctuation placed before the slot, dropped for the first rendered slot
     * @param defaultValue rendered when the slot's fields are missing, may be {@code null}
     */
    public record Segment(String joiner, Slot slot, Presence presence, String defaultValue) {

        static Segment required(Slot slot) {
            return new Segment(slot.joiner(), slot, Presence.REQUIRED, null);
        }

        static Segment expected(Slot slot) {
            return new Segment(slot.joiner(), slot, Presence.EXPECTED, null);
        }

        static Segment optional(Slot slot) {
            return new Segment(slot.joiner(), slot, Presence.OPTIONAL, null);
        }

        Segment withDefault(String value) {
            return new Segment(joiner, slot, presence, value);
        }
    }

    boolean hasSlot(Slot slot) {
        return segments.stream().anyMatch(s -> s.slot() == slot);
    }

    /**
     * Template for {@code category}. Categories that can describe either a whole publication or a
     * part of one (conference proceedings, catalogs, guides) switch to the component-part layout
     * when a host document was found.
     */
    public static CitationTemplate forCategory(CitationCategory category, ExtractedFields fields) {
        boolean hosted = fields.isFound(CitationField.JOURNAL);
        return switch (category) {
            case BOOK_FEW_AUTHORS -> of(category, headed(), book());
            case BOOK_MANY_AUTHORS -> of(category, titled(), book());
            case JOURNAL_ARTICLE -> of(category, headed(), List.of(
                    Segment.required(Slot.JOURNAL),
                    Segment.expected(Slot.YEAR),
                    Segment.expected(Slot.VOLUME_ISSUE),
                    Segment.expected(Slot.PAGES),
                    Segment.optional(Slot.NOTES)));
            case NEWSPAPER_ARTICLE -> of(category, headed(), List.of(
                    Segment.required(Slot.JOURNAL),
                    Segment.expected(Slot.YEAR),
                    Segment.optional(Slot.ISSUE_DATE),
                    Segment.optional(Slot.VOLUME_ISSUE),
                    Segment.expected(Slot.PAGES),
                    Segment.optional(Slot.NOTES)));
            case COLLECTION_ARTICLE -> of(category, headed(), componentPart());
            case CONFERENCE, CATALOG, METHODICAL_GUIDE -> hosted
                    ? of(category, headed(), componentPart())
                    : of(category, titled(), List.of(
                            Segment.optional(Slot.EDITION),
                            Segment.expected(Slot.IMPRINT),
                            Segment.expected(Slot.PAGES),
                            Segment.optional(Slot.NOTES)));
            case DISSERTATION -> of(category, headed(), List.of(
                    Segment.expected(Slot.IMPRINT),
                    Segment.optional(Slot.EXTENT),
                    Segment.optional(Slot.PAGES),
                    Segment.optional(Slot.NOTES)));
            case ABSTRACT, PREPRINT -> of(category, headed(), List.of(
                    Segment.expected(Slot.IMPRINT),
                    Segment.expected(Slot.PAGES),
                    Segment.optional(Slot.NOTES)));
            case LAW -> of(category, titled(), List.of(
                    Segment.optional(Slot.JOURNAL),
                    Segment.optional(Slot.YEAR),
                    Segment.optional(Slot.VOLUME_ISSUE),
                    Segment.optional(Slot.NOTES),
                    Segment.optional(Slot.IMPRINT),
                    Segment.optional(Slot.PAGES)));
            case STANDARD -> of(category, titled(), List.of(
                    Segment.optional(Slot.NOTES),
                    Segment.expected(Slot.IMPRINT),
                    Segment.expected(Slot.PAGES)));
            case PATENT -> of(category, titled(), List.of(
                    Segment.expected(Slot.NOTES)));
            case ELECTRONIC_RESOURCE -> of(category, List.of(
                    Segment.required(Slot.TITLE),
                    Segment.optional(Slot.MEDIUM).withDefault("Электронный ресурс"),
                    Segment.optional(Slot.SUBTITLE),
                    Segment.optional(Slot.RESPONSIBILITY),
                    Segment.optional(Slot.EDITION),
                    Segment.optional(Slot.IMPRINT),
                    Segment.optional(Slot.NOTES),
                    Segment.required(Slot.URL),
                    Segment.expected(Slot.ACCESS_DATE)));
            case MAP -> of(category, titled(), List.of(
                    Segment.optional(Slot.NOTES),
                    Segment.expected(Slot.IMPRINT),
                    Segment.optional(Slot.EXTENT)));
            case MULTIMEDIA, MUSIC_SCORE -> of(category, headed(), List.of(
                    Segment.expected(Slot.IMPRINT),
                    Segment.optional(Slot.PAGES),
                    Segment.optional(Slot.EXTENT),
                    Segment.optional(Slot.NOTES)));
            case VISUAL_MATERIAL -> of(category, titled(), List.of(
                    Segment.expected(Slot.IMPRINT),
                    Segment.optional(Slot.EXTENT),
                    Segment.optional(Slot.NOTES)));
            case ARCHIVE -> of(category, titled(), List.of(
                    Segment.expected(Slot.NOTES)));
            case REVIEW -> of(category, List.of(
                    Segment.expected(Slot.AUTHOR_HEADING),
                    Segment.optional(Slot.TITLE),
                    Segment.optional(Slot.MEDIUM),
                    Segment.optional(Slot.SUBTITLE),
                    Segment.optional(Slot.RESPONSIBILITY),
                    Segment.required(Slot.JOURNAL),
                    Segment.optional(Slot.YEAR),
                    Segment.optional(Slot.VOLUME_ISSUE),
                    Segment.optional(Slot.PAGES),
                    Segment.expected(Slot.NOTES)));
            case RESEARCH_REPORT -> of(category, titled(), List.of(
                    Segment.expected(Slot.IMPRINT),
                    Segment.optional(Slot.PAGES),
                    Segment.optional(Slot.EXTENT),
                    Segment.optional(Slot.NOTES)));
            case DEPOSITED -> of(category, headed(), List.of(
                    Segment.expected(Slot.IMPRINT),
                    Segment.optional(Slot.PAGES),
                    Segment.expected(Slot.NOTES)));
            case MULTIVOLUME -> of(category, headed(), List.of(
                    Segment.optional(Slot.EDITION),
                    Segment.expected(Slot.IMPRINT),
                    Segment.optional(Slot.EXTENT),
                    Segment.optional(Slot.PAGES),
                    Segment.optional(Slot.NOTES)));
            case UNKNOWN -> of(category, List.of(
                    Segment.optional(Slot.TITLE),
                    Segment.optional(Slot.MEDIUM),
                    Segment.optional(Slot.SUBTITLE),
                    Segment.optional(Slot.RESPONSIBILITY),
                    Segment.optional(Slot.JOURNAL),
                    Segment.optional(Slot.EDITION),
                    Segment.optional(Slot.IMPRINT),
                    Segment.optional(Slot.ISSUE_DATE),
                    Segment.optional(Slot.VOLUME_ISSUE),
                    Segment.optional(Slot.PAGES),
                    Segment.optional(Slot.EXTENT),
                    Segment.optional(Slot.NOTES),
                    Segment.optional(Slot.URL),
                    Segment.optional(Slot.ACCESS_DATE),
                    Segment.optional(Slot.DOI),
                    Segment.optional(Slot.ISBN)));
        };
    }

    // Heading form: "Фамилия, И. О. Заглавие : сведения / ответственность"
    private static List<Segment> headed() {
        List<Segment> list = new ArrayList<>();
        list.add(Segment.expected(Slot.AUTHOR_HEADING));
        list.addAll(titled());
        return list;
    }

    // Title form, used for four or more authors and for records without personal authors
    private static List<Segment> titled() {
        return List.of(
                Segment.required(Slot.TITLE),
                Segment.optional(Slot.MEDIUM),
                Segment.optional(Slot.SUBTITLE),
                Segment.optional(Slot.RESPONSIBILITY));
    }

    private static List<Segment> book() {
        return List.of(
                Segment.optional(Slot.EDITION),
                Segment.expected(Slot.IMPRINT),
                Segment.expected(Slot.PAGES),
                Segment.optional(Slot.EXTENT),
                Segment.optional(Slot.NOTES));
    }

    private static List<Segment> componentPart() {
        return List.of(
                Segment.required(Slot.JOURNAL),
                Segment.expected(Slot.IMPRINT),
                Segment.optional(Slot.VOLUME_ISSUE),
                Segment.expected(Slot.PAGES),
                Segment.optional(Slot.NOTES));
    }

    private static CitationTemplate of(CitationCategory category, List<Segment> head, List<Segment> tail) {
        List<Segment> all = new ArrayList<>(head);
        all.addAll(tail);
        return new CitationTemplate(category, all);
    }

    private static CitationTemplate of(CitationCategory category, List<Segment> segments) {
        return new CitationTemplate(category, segments);
    }
}
