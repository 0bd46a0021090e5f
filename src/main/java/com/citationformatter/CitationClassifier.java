package com.citationformatter;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns a {@link CitationCategory} to a citation using an ordered rule table. The first rule whose
 * predicate accepts the (normalized) text wins.
 */
public final class CitationClassifier {

    private CitationClassifier() {}

    /**
     * One row of the rule table.
     */
    public record Rule(String name, Predicate<String> predicate, CitationCategory category) {

        boolean matches(String text) {
            return predicate.test(text);
        }
    }

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern PATENT = Pattern.compile("пат\\.\\s*[A-Z]{2}|а\\.\\s*с\\.\\s*[A-Z]{2}|полез\\.\\s*модель");
    private static final Pattern DISSERTATION = Pattern.compile("дис\\.\\s*\\.{3}|дыс\\.\\s*\\.{3}", FLAGS);
    private static final Pattern STANDARD = Pattern.compile("гост\\s*(?:р\\s*)?\\d|стб\\s*(?:iso\\s*)?\\d|ткп\\s*\\d|тр\\s*тс\\s*\\d", FLAGS);
    private static final Pattern LAW = Pattern.compile(
            "конституц|\\bкодекс\\b|\\bзакон\\b|\\bуказ\\b|\\bпостановлени|\\bдекрет\\b|приказ\\s+\\w+\\.", FLAGS);
    private static final Pattern CONFERENCE = Pattern.compile("матер.*конф|тезис.*докл|чтения\\s*:", FLAGS);
    private static final Pattern COLLECTION = Pattern.compile("сб\\.\\s*(?:науч\\.|ст\\.|тр\\.)", FLAGS);
    private static final Pattern REVIEW = Pattern.compile("\\[рецензия]|(?<!\\w)рец\\.\\s+на\\s", FLAGS);
    private static final Pattern RESEARCH_REPORT = Pattern.compile("отч[её]т\\s+о\\s+нир", FLAGS);
    private static final Pattern DEPOSITED = Pattern.compile("(?<!\\w)деп\\.\\s+в\\s", FLAGS);
    private static final Pattern ARCHIVE_FOND = Pattern.compile("\\bф\\.\\s*\\d+\\.\\s*оп\\.", FLAGS);
    private static final Pattern ARCHIVE = Pattern.compile("\\bархив\\b", FLAGS);
    // "Собрание сочинений : у 4 т." as other title information
    private static final Pattern MULTIVOLUME = Pattern.compile("(?:^|[:.])\\s*[ув]\\s+\\d+\\s+т\\.", FLAGS);
    private static final Pattern METHODICAL_GUIDE = Pattern.compile(
            "(?<![-.\\w])метод\\.\\s*(?:указания|рекомендации|пособие)", FLAGS);
    private static final Pattern CATALOG = Pattern.compile("\\bкаталог", FLAGS);
    private static final Pattern JOURNAL_MARKERS = Pattern.compile("[ТT]\\.\\s*\\d|№\\s*\\d|Vol\\.\\s*\\d|No\\.\\s*\\d");
    private static final Pattern NEWSPAPER_MARKERS = Pattern.compile(
            "\\.by\\b|газет|(?<!\\d)\\d{1,2}\\s+(?:янв|февр|марта|апр|мая|июня|июля|авг|сент|окт|нояб|дек)", FLAGS);
    private static final Pattern ELECTRONIC = Pattern.compile("\\[электронный ресурс]|\\[сайт]|режим доступа|\\burl:", FLAGS);

    // Distinct "Фамилия, И." pairs; four or more means a collective heading
    private static final Pattern INVERTED_SURNAME = Pattern.compile("([А-ЯЁA-Z][а-яёa-z]+),\\s+[А-ЯЁA-Z]\\.");

    private static final List<Rule> RULES = List.of(
            contains("multimedia", CitationCategory.MULTIMEDIA, "[звукозапись]", "[видеозапись]"),
            contains("visual-material", CitationCategory.VISUAL_MATERIAL, "[изоматериал]", "плакат]"),
            contains("music-score", CitationCategory.MUSIC_SCORE, "[ноты]"),
            contains("map", CitationCategory.MAP, "[карт"),
            new Rule("patent", t -> PATENT.matcher(t).find(), CitationCategory.PATENT),
            // Abstracts always contain "дис. ..." too, so they go first
            contains("abstract", CitationCategory.ABSTRACT, "автореф"),
            matches("dissertation", CitationCategory.DISSERTATION, DISSERTATION),
            contains("preprint", CitationCategory.PREPRINT, "препринт"),
            matches("standard", CitationCategory.STANDARD, STANDARD),
            matches("law", CitationCategory.LAW, LAW),
            matches("conference", CitationCategory.CONFERENCE, CONFERENCE),
            matches("collection-article", CitationCategory.COLLECTION_ARTICLE, COLLECTION),
            matches("review", CitationCategory.REVIEW, REVIEW),
            matches("research-report", CitationCategory.RESEARCH_REPORT, RESEARCH_REPORT),
            matches("deposited", CitationCategory.DEPOSITED, DEPOSITED),
            matches("archive-fond", CitationCategory.ARCHIVE, ARCHIVE_FOND),
            new Rule("multivolume", t -> headMatches(t, MULTIVOLUME), CitationCategory.MULTIVOLUME),
            new Rule("methodical-guide", t -> headMatches(t, METHODICAL_GUIDE), CitationCategory.METHODICAL_GUIDE),
            new Rule("journal-article", t -> hostMatches(t, JOURNAL_MARKERS), CitationCategory.JOURNAL_ARTICLE),
            new Rule("newspaper-article", t -> hostMatches(t, NEWSPAPER_MARKERS), CitationCategory.NEWSPAPER_ARTICLE),
            new Rule("et-al", t -> t.contains("[и др.]") || t.contains("[et al.]") || t.contains("[і інш.]"),
                    CitationCategory.BOOK_MANY_AUTHORS),
            new Rule("many-authors", t -> countInvertedSurnames(t) >= 4, CitationCategory.BOOK_MANY_AUTHORS),
            new Rule("few-authors", t -> countInvertedSurnames(t) >= 1, CitationCategory.BOOK_FEW_AUTHORS),
            // Plain words: only for records no periodical or author rule has claimed
            new Rule("archive", t -> headMatches(t, ARCHIVE), CitationCategory.ARCHIVE),
            new Rule("catalog", t -> headMatches(t, CATALOG), CitationCategory.CATALOG),
            matches("electronic-resource", CitationCategory.ELECTRONIC_RESOURCE, ELECTRONIC)
    );

    /**
     * The rule table in evaluation order. Anything no rule accepts is {@link CitationCategory#UNKNOWN}.
     */
    public static List<Rule> rules() {
        return RULES;
    }

    public static CitationCategory classify(String text) {
        if (text == null || text.isBlank()) return CitationCategory.UNKNOWN;
        String normalized = PunctuationNormalizer.normalize(text);
        for (Rule rule : RULES) {
            if (rule.matches(normalized)) return rule.category();
        }
        return CitationCategory.UNKNOWN;
    }

    /**
     * Classifies a structured record from its type hint, or from the fields it carries when the
     * hint is missing or unrecognized.
     */
    public static CitationCategory classify(SourceRecord record) {
        CitationCategory hinted = CitationCategory.fromTag(record.type());
        if (hinted == CitationCategory.BOOK_FEW_AUTHORS && record.authors().size() >= 4) {
            return CitationCategory.BOOK_MANY_AUTHORS;
        }
        if (hinted != CitationCategory.UNKNOWN) return hinted;

        boolean hasJournal = notBlank(record.journal());
        if (hasJournal && (notBlank(record.volume()) || notBlank(record.issue()))) {
            return CitationCategory.JOURNAL_ARTICLE;
        }
        if (hasJournal) return CitationCategory.COLLECTION_ARTICLE;
        if (notBlank(record.url()) && !notBlank(record.publisher())) return CitationCategory.ELECTRONIC_RESOURCE;
        int authors = record.authors().size();
        if (authors >= 4) return CitationCategory.BOOK_MANY_AUTHORS;
        if (authors >= 1) return CitationCategory.BOOK_FEW_AUTHORS;
        return CitationCategory.UNKNOWN;
    }

    static int countInvertedSurnames(String text) {
        Set<String> surnames = new HashSet<>();
        Matcher m = INVERTED_SURNAME.matcher(text);
        while (m.find()) {
            surnames.add(m.group(1));
        }
        return surnames.size();
    }

    // Part of the record before the host document
    private static boolean headMatches(String text, Pattern pattern) {
        int idx = text.indexOf(" // ");
        return pattern.matcher(idx < 0 ? text : text.substring(0, idx)).find();
    }

    private static boolean hostMatches(String text, Pattern markers) {
        int idx = text.indexOf(" // ");
        if (idx < 0) return false;
        return markers.matcher(text.substring(idx + 4)).find();
    }

    private static Rule contains(String name, CitationCategory category, String... needles) {
        return new Rule(name, t -> {
            String lower = t.toLowerCase(Locale.ROOT);
            for (String needle : needles) {
                if (lower.contains(needle)) return true;
            }
            return false;
        }, category);
    }

    private static Rule matches(String name, CitationCategory category, Pattern pattern) {
        return new Rule(name, t -> pattern.matcher(t).find(), category);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
