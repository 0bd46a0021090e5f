package com.citationformatter;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes formatted results out as a numbered reference list or as BibTeX.
 */
public final class BibliographyExporter {

    private BibliographyExporter() {}

    private static final Pattern PAGE_RANGE = Pattern.compile("(\\d+)–(\\d+)");
    private static final Pattern FIRST_YEAR = Pattern.compile("\\d{4}");

    private static final Map<Character, String> TRANSLIT = Map.ofEntries(
            Map.entry('а', "a"), Map.entry('б', "b"), Map.entry('в', "v"), Map.entry('г', "g"),
            Map.entry('д', "d"), Map.entry('е', "e"), Map.entry('ё', "e"), Map.entry('ж', "zh"),
            Map.entry('з', "z"), Map.entry('и', "i"), Map.entry('й', "i"), Map.entry('к', "k"),
            Map.entry('л', "l"), Map.entry('м', "m"), Map.entry('н', "n"), Map.entry('о', "o"),
            Map.entry('п', "p"), Map.entry('р', "r"), Map.entry('с', "s"), Map.entry('т', "t"),
            Map.entry('у', "u"), Map.entry('ф', "f"), Map.entry('х', "kh"), Map.entry('ц', "ts"),
            Map.entry('ч', "ch"), Map.entry('ш', "sh"), Map.entry('щ', "shch"), Map.entry('ъ', ""),
            Map.entry('ы', "y"), Map.entry('ь', ""), Map.entry('э', "e"), Map.entry('ю', "iu"),
            Map.entry('я', "ia"), Map.entry('і', "i"), Map.entry('ў', "u"));

    /**
     * Numbered list, one record per line: "1. Фамилия, И. О. Заглавие ...".
     */
    public static String toText(List<FormatResult> results) {
        StringBuilder sb = new StringBuilder();
        int n = 1;
        for (FormatResult r : results) {
            sb.append(n++).append(". ").append(r.formatted()).append('\n');
        }
        return sb.toString();
    }

    /**
     * BibTeX database for the results. Keys are built from the transliterated first surname and the
     * year, with a letter suffix on collisions.
     */
    public static String toBibTeX(List<FormatResult> results) {
        StringBuilder sb = new StringBuilder();
        Set<String> usedKeys = new HashSet<>();
        for (FormatResult r : results) {
            if (sb.length() > 0) sb.append("\n\n");
            sb.append(toBibTeXEntry(r, uniqueKey(generateKey(r.fields()), usedKeys)));
        }
        return sb.toString();
    }

    static String toBibTeXEntry(FormatResult result, String key) {
        ExtractedFields f = result.fields();
        StringBuilder sb = new StringBuilder();
        sb.append('@').append(entryType(result.category())).append('{').append(key).append(",\n");

        if (!f.authors().isEmpty()) {
            field(sb, "author", String.join(" and ", f.authors()));
        }
        String title = f.value(CitationField.TITLE);
        String subtitle = f.value(CitationField.SUBTITLE);
        if (title != null && subtitle != null) title = title + " : " + subtitle;
        field(sb, "title", title);

        String host = f.value(CitationField.JOURNAL);
        if (host != null) {
            field(sb, result.category() == CitationCategory.JOURNAL_ARTICLE
                    || result.category() == CitationCategory.NEWSPAPER_ARTICLE ? "journal" : "booktitle", host);
        }
        field(sb, "address", f.value(CitationField.CITY));
        field(sb, "publisher", f.value(CitationField.PUBLISHER));
        field(sb, "year", f.value(CitationField.YEAR));
        field(sb, "volume", f.value(CitationField.VOLUME));
        field(sb, "number", f.value(CitationField.ISSUE));
        String pages = f.value(CitationField.PAGES);
        field(sb, "pages", pages == null ? null : PAGE_RANGE.matcher(pages).replaceAll("$1--$2"));
        field(sb, "edition", f.value(CitationField.EDITION));
        field(sb, "doi", f.value(CitationField.DOI));
        field(sb, "isbn", f.value(CitationField.ISBN));
        field(sb, "url", f.value(CitationField.URL));
        field(sb, "urldate", f.value(CitationField.ACCESS_DATE));
        field(sb, "note", f.value(CitationField.NOTES));
        sb.append("  langid = {russian}\n");
        sb.append('}');
        return sb.toString();
    }

    static String entryType(CitationCategory category) {
        return switch (category) {
            case BOOK_FEW_AUTHORS, BOOK_MANY_AUTHORS, MULTIVOLUME, CATALOG, METHODICAL_GUIDE -> "book";
            case JOURNAL_ARTICLE, NEWSPAPER_ARTICLE, REVIEW -> "article";
            case COLLECTION_ARTICLE -> "incollection";
            case CONFERENCE -> "inproceedings";
            case DISSERTATION, ABSTRACT -> "phdthesis";
            case RESEARCH_REPORT, PREPRINT, DEPOSITED -> "techreport";
            case ELECTRONIC_RESOURCE -> "online";
            default -> "misc";
        };
    }

    /**
     * Generates a BibTeX key from the first surname and the year, e.g. "drobyshevskii2013".
     */
    static String generateKey(ExtractedFields fields) {
        StringBuilder key = new StringBuilder();
        if (!fields.authors().isEmpty()) {
            key.append(transliterate(FieldExtractor.surname(fields.authors().get(0))));
        } else {
            String title = fields.value(CitationField.TITLE);
            if (title != null) {
                for (String word : title.split("\\s+")) {
                    String t = transliterate(word);
                    if (t.length() > 3) {
                        key.append(t);
                        break;
                    }
                }
            }
        }
        if (key.length() == 0) key.append("ref");

        String year = fields.value(CitationField.YEAR);
        if (year != null) {
            Matcher m = FIRST_YEAR.matcher(year);
            if (m.find()) key.append(m.group());
        }
        return key.toString();
    }

    static String transliterate(String text) {
        StringBuilder sb = new StringBuilder();
        for (char c : text.toLowerCase(Locale.ROOT).toCharArray()) {
            String mapped = TRANSLIT.get(c);
            if (mapped != null) {
                sb.append(mapped);
            } else if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String uniqueKey(String base, Set<String> used) {
        String key = base;
        for (int n = 0; !used.add(key); n++) {
            key = base + suffix(n);
        }
        return key;
    }

    /**
     * Collision suffix: a, b, ..., z, aa, ab, ...
     */
    static String suffix(int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = n; i >= 0; i = i / 26 - 1) {
            sb.append((char) ('a' + i % 26));
        }
        return sb.reverse().toString();
    }

    private static void field(StringBuilder sb, String name, String value) {
        if (value == null || value.isBlank()) return;
        sb.append("  ").append(name).append(" = {").append(escapeBibTeX(value)).append("},\n");
    }

    /**
     * Escapes special BibTeX characters.
     */
    static String escapeBibTeX(String text) {
        if (text == null) return "";
        return text
                .replace("&", "\\&")
                .replace("%", "\\%")
                .replace("$", "\\$")
                .replace("#", "\\#")
                .replace("_", "\\_")
                .replace("{", "\\{")
                .replace("}", "\\}")
                .replace("~", "\\textasciitilde{}")
                .replace("^", "\\textasciicircum{}");
    }
}
