package com.citationformatter;

import java.util.Locale;

/**
 * Closed set of bibliographic record categories.
 *
 * <p>Each category carries the tag used in corpus files ({@code "book_1_3_authors"},
 * {@code "journal_article"}, ...).
 */
public enum CitationCategory {
    BOOK_FEW_AUTHORS("book_1_3_authors"),
    BOOK_MANY_AUTHORS("book_4plus_authors"),
    JOURNAL_ARTICLE("journal_article"),
    COLLECTION_ARTICLE("collection_article"),
    DISSERTATION("dissertation"),
    ABSTRACT("abstract"),
    LAW("law"),
    STANDARD("standard"),
    PATENT("patent"),
    CONFERENCE("conference"),
    ELECTRONIC_RESOURCE("electronic_resource"),
    NEWSPAPER_ARTICLE("newspaper_article"),
    PREPRINT("preprint"),
    MULTIMEDIA("multimedia"),
    MAP("map"),
    MUSIC_SCORE("music_score"),
    VISUAL_MATERIAL("visual_material"),
    ARCHIVE("archive"),
    RESEARCH_REPORT("research_report"),
    DEPOSITED("deposited"),
    MULTIVOLUME("multivolume"),
    REVIEW("review"),
    CATALOG("catalog"),
    METHODICAL_GUIDE("methodical_guide"),
    UNKNOWN("unknown");

    private final String tag;

    CitationCategory(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolves a corpus tag or an enum name. Unrecognized or blank input maps to {@link #UNKNOWN}.
     */
    public static CitationCategory fromTag(String tag) {
        if (tag == null) return UNKNOWN;
        String t = tag.trim().toLowerCase(Locale.ROOT);
        if (t.isEmpty()) return UNKNOWN;
        for (CitationCategory c : values()) {
            if (c.tag.equals(t) || c.name().toLowerCase(Locale.ROOT).equals(t)) return c;
        }
        // "book" alone is how loose sources label monographs
        if (t.equals("book")) return BOOK_FEW_AUTHORS;
        return UNKNOWN;
    }
}
