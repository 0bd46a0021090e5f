package com.citationformatter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls bibliographic fields out of a citation string.
 *
 * <p>The text is normalized first and then cut into areas at the ". – " separator. The first area
 * holds the heading, title, responsibility and (after " // ") the host document. Every following
 * area is matched against the area kinds below; areas no kind accepts are kept as notes, so the
 * extractor never loses source text.
 */
public final class FieldExtractor {

    private FieldExtractor() {}

    static final int MAX_AUTHORS = 10;

    private static final String SURNAME = "\\p{Lu}\\p{Ll}[\\p{L}ʼ'’\\-]*";
    private static final String INITIALS = "\\p{Lu}\\.(?:\\s?\\p{Lu}\\.)?";
    private static final String YEAR = "(?:19[5-9]\\d|20[0-2]\\d)";

    private static final Pattern AREA_SEPARATOR = Pattern.compile("\\.\\s[–—]\\s");
    private static final Pattern REVIEW_TAIL = Pattern.compile("\\.\\s[–—]\\s(Рец\\.\\s+на\\s.*)$", Pattern.DOTALL);

    // "Фамилия, И. О." at the very start of the record
    private static final Pattern HEADING = Pattern.compile("^(" + SURNAME + "),\\s*(" + INITIALS + ")\\s*");
    private static final Pattern INVERTED_NAME = Pattern.compile("(?<!\\p{L})(" + SURNAME + "),\\s*(" + INITIALS + ")");
    private static final Pattern DIRECT_NAME = Pattern.compile("(?<!\\p{L})(" + INITIALS + ")\\s?(" + SURNAME + ")");
    private static final Pattern INVERTED_FULL = Pattern.compile("^(" + SURNAME + "),\\s*(" + INITIALS + ")$");
    private static final Pattern DIRECT_FULL = Pattern.compile("^(" + INITIALS + ")\\s?(" + SURNAME + ")$");
    private static final Pattern MEDIUM = Pattern.compile("\\s*\\[([^\\]]+)]");

    // Area kinds
    private static final Pattern IMPRINT = Pattern.compile(
            "^(?:(?<city>\\p{Lu}[\\p{L}.\\-]*(?:\\s\\p{Lu}[\\p{L}.\\-]*)?(?:\\s*;\\s*\\p{Lu}[\\p{L}.\\-]*)?)\\s*)?"
                    + "(?::\\s*(?<publisher>[^,]+?))?\\s*,\\s*(?<year>" + YEAR + "(?:–" + YEAR + ")?)$");
    private static final Pattern YEAR_AREA = Pattern.compile("^(" + YEAR + "(?:–" + YEAR + ")?)$");
    private static final Pattern VOLUME_ISSUE_AREA = Pattern.compile(
            "^(?:(?:Т|T|Vol)\\.\\s*(?<volume>\\d+))?(?:(?:,\\s*|^)(?:№|No\\.)\\s*(?<issue>\\d+(?:[–/]\\d+)?))?$");
    // "Вып. 3", "Т. 2, кн. 1": the label is kept with the issue value
    private static final Pattern LABELLED_ISSUE_AREA = Pattern.compile(
            "^(?:(?:Т|T|Vol)\\.\\s*(?<volume>\\d+),\\s*)?(?<issue>(?:Вып|вып|Кн|кн)\\.\\s*\\d+)$");
    private static final Pattern PAGE_COUNT_AREA = Pattern.compile("^(\\d+)\\s*(?:с|c|p)$");
    private static final Pattern PAGE_RANGE_AREA = Pattern.compile(
            "^(?:[СC]|[Pp]p?)\\.\\s*(\\d+(?:\\s*[–—-]\\s*\\d+)?(?:,\\s*\\d+(?:\\s*[–—-]\\s*\\d+)?)*)$");
    private static final Pattern EXTENT_AREA = Pattern.compile(
            "^(\\d+\\s*(?:л|к|т|зв\\.\\s*диск|диск|CD-ROM|DVD(?:\\s*video)?|электрон\\.\\s*опт\\.\\s*диск)\\.?(?:\\s*\\([^)]*\\))?)$");
    // The area's closing period is already gone: "2-е изд", "3-е изд., перераб. и доп"
    private static final Pattern EDITION_AREA = Pattern.compile(
            "^(\\d+-е\\s+(?:изд|выд)\\.?.*|(?:Изд|Выд)\\.\\s*\\d+-е.*)$", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern ISSUE_DATE_AREA = Pattern.compile(
            "^(\\d{1,2}(?:–\\d{1,2})?\\s+(?:янв|февр|мар|апр|ма[яй]|июн|июл|авг|сент|окт|нояб|дек"
                    + "|студз|лют|сак|крас|трав|чэрв|ліп|жн|вер|каст|ліст|снеж)\\p{L}*\\.?)$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern DOI_AREA = Pattern.compile("^DOI\\s*:?\\s*(10\\.\\d{4,}/\\S+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISBN_AREA = Pattern.compile("^ISBN\\s*([\\dXx-]{10,17})$");
    private static final Pattern ACCESS_DATE_AREA = Pattern.compile(
            "^(?:дата доступа|дата обращения)\\s*:?\\s*(\\d{2}\\.\\d{2}\\.\\d{4})$", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    // Found anywhere inside an area
    private static final Pattern URL = Pattern.compile("(?:https?://|www\\.)[^\\s<>\"()]+");
    private static final Pattern ACCESS_DATE = Pattern.compile(
            "(?:дата обращения|дата доступа)\\s*:?\\s*(\\d{2}\\.\\d{2}\\.\\d{4})", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern ANY_YEAR = Pattern.compile("(?<![\\d.\\-/])(" + YEAR + ")(?!\\d)");

    /**
     * Extracts fields from a citation string. Never modifies or rejects the input; text that
     * fits no field ends up in {@link CitationField#NOTES}.
     */
    public static ExtractedFields extract(String text) {
        if (text == null) return ExtractedFields.empty();
        String body = PunctuationNormalizer.normalize(text);
        if (body.isEmpty()) return ExtractedFields.empty();

        ExtractedFields.Builder b = ExtractedFields.builder();
        List<String> notes = new ArrayList<>();

        String reviewTail = null;
        Matcher review = REVIEW_TAIL.matcher(body);
        if (review.find()) {
            reviewTail = stripPeriod(review.group(1));
            body = body.substring(0, review.start());
        }

        String[] areas = AREA_SEPARATOR.split(body);
        parseHead(stripPeriod(areas[0]), b);

        Map<CitationField, String> seen = new LinkedHashMap<>();
        for (int i = 1; i < areas.length; i++) {
            String area = stripPeriod(areas[i].strip());
            if (area.isEmpty()) continue;
            if (!parseArea(area, b, seen)) {
                notes.add(area);
            }
        }

        ExtractedFields partial = b.build();
        if (!partial.isFound(CitationField.YEAR)) {
            b.put(CitationField.YEAR, fallbackYear(areas));
        }

        if (reviewTail != null) notes.add(reviewTail);
        if (!notes.isEmpty()) {
            b.put(CitationField.NOTES, String.join(". – ", notes));
        }
        return b.build();
    }

    private static void parseHead(String head, ExtractedFields.Builder b) {
        String record = head;
        int slashes = head.indexOf(" // ");
        if (slashes >= 0) {
            b.put(CitationField.JOURNAL, head.substring(slashes + 4).strip());
            record = head.substring(0, slashes).strip();
        }

        List<String> authors = new ArrayList<>();
        String rest = record;
        Matcher heading = HEADING.matcher(record);
        if (heading.find()) {
            authors.add(invert(heading.group(1), heading.group(2)));
            rest = record.substring(heading.end());
        }

        String titlePart = rest;
        String responsibility = null;
        int resp = rest.indexOf(" / ");
        if (resp >= 0) {
            responsibility = rest.substring(resp + 3).strip();
            b.put(CitationField.RESPONSIBILITY, responsibility);
            titlePart = rest.substring(0, resp).strip();
        }

        // Further inverted names listed before the title
        Matcher inverted = INVERTED_NAME.matcher(titlePart);
        while (inverted.find()) {
            authors.add(invert(inverted.group(1), inverted.group(2)));
        }

        // Direct names only when there is no inverted one, and only from the first group:
        // editors and compilers follow " ; "
        if (authors.isEmpty() && responsibility != null) {
            int group = responsibility.indexOf(" ; ");
            Matcher direct = DIRECT_NAME.matcher(group >= 0 ? responsibility.substring(0, group) : responsibility);
            while (direct.find()) {
                authors.add(invert(direct.group(2), direct.group(1)));
            }
        }
        b.authors(distinct(authors));

        parseTitle(titlePart, b);
    }

    private static void parseTitle(String titlePart, ExtractedFields.Builder b) {
        String part = titlePart.strip();
        if (part.isEmpty()) return;

        int colon = part.indexOf(" : ");
        Matcher medium = MEDIUM.matcher(part);
        while (medium.find()) {
            if (colon >= 0 && medium.start() > colon) break;
            String designator = medium.group(1).strip();
            if (isEtAl(designator)) continue;
            if (medium.start() == 0 && medium.end() == part.length()) break;
            b.put(CitationField.MEDIUM, designator);
            part = (part.substring(0, medium.start()) + part.substring(medium.end())).strip();
            break;
        }

        int split = part.indexOf(" : ");
        int width = 3;
        if (split < 0) {
            split = part.indexOf(": ");
            width = 2;
        }
        if (split > 0) {
            b.put(CitationField.TITLE, part.substring(0, split).strip());
            String subtitle = part.substring(split + width).strip();
            if (!subtitle.isEmpty()) b.put(CitationField.SUBTITLE, subtitle);
        } else if (!part.isEmpty()) {
            b.put(CitationField.TITLE, part);
        }
    }

    /**
     * Recognizes one area after the first. Returns {@code false} when the area belongs to no
     * known kind, or when its kind was already filled by an earlier area.
     */
    private static boolean parseArea(String area, ExtractedFields.Builder b, Map<CitationField, String> seen) {
        Matcher m;
        if ((m = IMPRINT.matcher(area)).matches()) {
            if (seen.containsKey(CitationField.YEAR)) return false;
            b.put(CitationField.CITY, trimToNull(m.group("city")));
            b.put(CitationField.PUBLISHER, trimToNull(m.group("publisher")));
            return mark(seen, CitationField.YEAR, b, m.group("year"));
        }
        if ((m = YEAR_AREA.matcher(area)).matches()) {
            return mark(seen, CitationField.YEAR, b, m.group(1));
        }
        if ((m = VOLUME_ISSUE_AREA.matcher(area)).matches()
                && (m.group("volume") != null || m.group("issue") != null)) {
            if (seen.containsKey(CitationField.ISSUE) || seen.containsKey(CitationField.VOLUME)) return false;
            if (m.group("volume") != null) mark(seen, CitationField.VOLUME, b, m.group("volume"));
            if (m.group("issue") != null) mark(seen, CitationField.ISSUE, b, m.group("issue"));
            return true;
        }
        if ((m = LABELLED_ISSUE_AREA.matcher(area)).matches()) {
            if (seen.containsKey(CitationField.ISSUE) || seen.containsKey(CitationField.VOLUME)) return false;
            if (m.group("volume") != null) mark(seen, CitationField.VOLUME, b, m.group("volume"));
            return mark(seen, CitationField.ISSUE, b, m.group("issue"));
        }
        if ((m = PAGE_RANGE_AREA.matcher(area)).matches()) {
            return mark(seen, CitationField.PAGES, b, m.group(1).replaceAll("\\s*[–—-]\\s*", "–"));
        }
        if ((m = PAGE_COUNT_AREA.matcher(area)).matches()) {
            return mark(seen, CitationField.PAGES, b, m.group(1));
        }
        if ((m = EXTENT_AREA.matcher(area)).matches()) {
            return mark(seen, CitationField.EXTENT, b, stripPeriod(m.group(1)));
        }
        if ((m = EDITION_AREA.matcher(area)).matches()) {
            return mark(seen, CitationField.EDITION, b, m.group(1));
        }
        if ((m = ISSUE_DATE_AREA.matcher(area)).matches()) {
            return mark(seen, CitationField.ISSUE_DATE, b, stripPeriod(m.group(1)));
        }
        if ((m = DOI_AREA.matcher(area)).matches()) {
            return mark(seen, CitationField.DOI, b, stripPeriod(m.group(1)));
        }
        if ((m = ISBN_AREA.matcher(area)).matches()) {
            return mark(seen, CitationField.ISBN, b, m.group(1));
        }
        if ((m = ACCESS_DATE_AREA.matcher(area)).matches()) {
            return mark(seen, CitationField.ACCESS_DATE, b, m.group(1));
        }
        if (isOnlineAccessArea(area)) {
            Matcher url = URL.matcher(area);
            if (!url.find() || seen.containsKey(CitationField.URL)) return false;
            mark(seen, CitationField.URL, b, trimUrl(url.group()));
            Matcher date = ACCESS_DATE.matcher(area);
            if (date.find()) mark(seen, CitationField.ACCESS_DATE, b, date.group(1));
            return true;
        }
        return false;
    }

    private static boolean isOnlineAccessArea(String area) {
        String lower = area.toLowerCase(Locale.ROOT);
        return lower.startsWith("режим доступа") || lower.startsWith("url:")
                || lower.startsWith("http://") || lower.startsWith("https://")
                || lower.startsWith("www.") || lower.startsWith("электронная копия");
    }

    private static boolean mark(Map<CitationField, String> seen, CitationField field,
                                ExtractedFields.Builder b, String value) {
        if (seen.containsKey(field)) return false;
        seen.put(field, value);
        b.put(field, value);
        return true;
    }

    private static String fallbackYear(String[] areas) {
        // Later areas first: the head may contain dates that are part of the title
        for (int i = areas.length - 1; i >= 0; i--) {
            if (URL.matcher(areas[i]).find()) continue;
            Matcher m = ANY_YEAR.matcher(areas[i]);
            if (m.find()) return m.group(1);
        }
        return null;
    }

    /**
     * Converts "И. О. Фамилия" to "Фамилия, И. О."; inverted names get their initials respaced.
     * Anything else is returned stripped.
     */
    public static String toInverted(String name) {
        if (name == null) return null;
        String n = name.strip();
        Matcher inv = INVERTED_FULL.matcher(n);
        if (inv.matches()) return invert(inv.group(1), inv.group(2));
        Matcher dir = DIRECT_FULL.matcher(n);
        if (dir.matches()) return invert(dir.group(2), dir.group(1));
        return n;
    }

    /**
     * Converts "Фамилия, И. О." to "И. О. Фамилия". Anything else is returned stripped.
     */
    public static String toDirect(String name) {
        if (name == null) return null;
        String n = name.strip();
        Matcher inv = INVERTED_FULL.matcher(n);
        if (inv.matches()) return spaceInitials(inv.group(2)) + " " + inv.group(1);
        return n;
    }

    /**
     * Surname part of an author name in either form.
     */
    public static String surname(String name) {
        String inverted = toInverted(name);
        int comma = inverted.indexOf(',');
        return comma > 0 ? inverted.substring(0, comma) : inverted;
    }

    private static String invert(String surname, String initials) {
        return surname + ", " + spaceInitials(initials);
    }

    private static String spaceInitials(String initials) {
        return initials.replaceAll("\\s+", "").replace(".", ". ").strip();
    }

    private static List<String> distinct(List<String> names) {
        Map<String, String> byKey = new LinkedHashMap<>();
        for (String name : names) {
            String key = name.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
            byKey.putIfAbsent(key, name);
            if (byKey.size() == MAX_AUTHORS) break;
        }
        return new ArrayList<>(byKey.values());
    }

    private static boolean isEtAl(String designator) {
        String d = designator.toLowerCase(Locale.ROOT);
        return d.equals("и др.") || d.equals("і інш.") || d.equals("et al.");
    }

    private static String stripPeriod(String s) {
        String t = s.strip();
        if (t.endsWith(".") && !t.endsWith("...")) {
            return t.substring(0, t.length() - 1).strip();
        }
        return t;
    }

    private static String trimUrl(String url) {
        return url.replaceAll("[.,;:)]+$", "");
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.strip();
        return t.isEmpty() ? null : t;
    }
}
