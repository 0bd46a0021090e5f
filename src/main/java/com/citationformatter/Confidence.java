package com.citationformatter;

/**
 * Confidence score of a formatting result, 0..100.
 */
public final class Confidence {

    private Confidence() {}

    public static final int MAX = 100;
    public static final int FLOOR = 30;

    static final int NO_AUTHORS_PENALTY = 20;
    static final int NO_TITLE_PENALTY = 30;
    static final int NO_YEAR_PENALTY = 10;

    /**
     * Starts from {@link #MAX} and subtracts a penalty per missing core field, never going below
     * {@link #FLOOR}. An unrecognized category scores the floor outright.
     */
    public static int score(CitationCategory category, ExtractedFields fields) {
        if (category == CitationCategory.UNKNOWN) return FLOOR;

        int score = MAX;
        if (!fields.isFound(CitationField.AUTHORS)) score -= NO_AUTHORS_PENALTY;
        if (fields.get(CitationField.TITLE).filter(t -> !t.isBlank()).isEmpty()) score -= NO_TITLE_PENALTY;
        if (!fields.isFound(CitationField.YEAR)) score -= NO_YEAR_PENALTY;
        return Math.max(FLOOR, score);
    }
}
