package com.citationformatter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Punctuation and spacing normalizer for GOST / VAK citation strings.
 *
 * <p>Rules run in a fixed order. The whole rule list is re-applied until the text stops
 * changing, so {@code normalize(normalize(s)).equals(normalize(s))} holds. Matches that start
 * inside a URL are left alone.
 */
public final class PunctuationNormalizer {

    private PunctuationNormalizer() {}

    /**
     * A single rewrite rule.
     *
     * @param name      stable identifier, used in tests and logs
     * @param pattern   what to look for
     * @param replacement replacement with {@code $n} group references
     * @param guard     decides per match whether the rewrite applies
     * @param onRefusal issue to record when the guard refuses a match, may return {@code null}
     * @param skipUrls  whether matches starting inside a URL are ignored
     */
    public record Rule(String name,
                       Pattern pattern,
                       String replacement,
                       Predicate<MatchResult> guard,
                       Function<MatchResult, Issue> onRefusal,
                       boolean skipUrls) {

        static Rule of(String name, String regex, String replacement) {
            return new Rule(name, Pattern.compile(regex), replacement, m -> true, m -> null, true);
        }
    }

    public record Result(String text, List<Issue> issues) {}

    // Private-use character that stands in for "..." while the other rules run
    private static final String ELLIPSIS_SENTINEL = "\uE000";

    private static final Pattern URL_SPAN = Pattern.compile("(?:https?://|www\\.)\\S+");

    private static final int MAX_PASSES = 8;

    private static final List<Rule> RULES = List.of(
            new Rule("protect-ellipsis", Pattern.compile("(?<!\\.)\\.{3}(?!\\.)"), ELLIPSIS_SENTINEL,
                    m -> true, m -> null, false),
            Rule.of("collapse-double-period", "(\\p{L})\\.\\.(?!\\.)", "$1."),
            new Rule("collapse-whitespace", Pattern.compile("\\s{2,}|[\\t\\n\\r\\u00A0]"), " ",
                    m -> true, m -> null, false),
            // ". –X", ".– X", ". —X" all become ". – X"; a dash that opens "88–91" is left alone
            Rule.of("space-after-separator-dash", "\\.\\s?[–—](?!\\d+–\\d)\\s*(?=\\S)", ". – "),
            Rule.of("space-after-colon", "(?<!\\d):(?!//)(?=[\\p{L}\\d\\[])", ": "),
            new Rule("year-range-dash",
                    Pattern.compile("(?<![\\d.])(?<!(?:ГОСТ|СТБ|ТКП|СТП|ISO|ISSN)\\s?)(\\d{4})-(\\d{4})(?![\\d-])"),
                    "$1–$2",
                    PunctuationNormalizer::isPlausibleYearRange,
                    PunctuationNormalizer::ambiguousRange,
                    true),
            Rule.of("tighten-numeric-range", "(?<=\\d) ?– ?(?=\\d)", "–"),
            Rule.of("page-range", "([СC]\\.\\s?\\d+)\\s*[–-]\\s*(\\d+)", "$1–$2"),
            Rule.of("space-after-initials",
                    "(?<!\\p{L})(\\p{Lu}\\.)\\s?(\\p{Lu}\\.)\\s?(?=\\p{Lu}\\p{Ll})", "$1 $2 "),
            Rule.of("space-between-initials", "(?<!\\p{L})(\\p{Lu}\\.)(\\p{Lu}\\.)(?!\\p{L})", "$1 $2"),
            Rule.of("space-after-marker",
                    "(?<!\\p{L})(Т\\.|T\\.|Вып\\.|вып\\.|кн\\.|Кн\\.|С\\.|Vol\\.|No\\.)(?=\\d)", "$1 "),
            Rule.of("space-after-number-sign", "№(?=[\\p{L}\\d])", "№ "),
            Rule.of("no-space-before-punctuation", " +(?=[.,])", ""),
            new Rule("restore-ellipsis", Pattern.compile(ELLIPSIS_SENTINEL), "...",
                    m -> true, m -> null, false)
    );

    /**
     * The rule list in application order.
     */
    public static List<Rule> rules() {
        return RULES;
    }

    public static String normalize(String text) {
        return normalizeDetailed(text).text();
    }

    /**
     * Normalizes {@code text} and reports what the rules refused to touch.
     */
    public static Result normalizeDetailed(String text) {
        if (text == null) return new Result(null, List.of());

        Set<Issue> issues = new LinkedHashSet<>();
        String current = text.strip();
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = applyAll(current, issues).strip();
            if (next.equals(current)) break;
            current = next;
        }
        return new Result(current, List.copyOf(issues));
    }

    private static String applyAll(String text, Set<Issue> issues) {
        String result = text;
        for (Rule rule : RULES) {
            result = apply(rule, result, issues);
        }
        return result;
    }

    static String apply(Rule rule, String text, Set<Issue> issues) {
        Matcher m = rule.pattern().matcher(text);
        if (!m.find()) return text;

        List<int[]> urls = rule.skipUrls() ? urlSpans(text) : List.of();
        StringBuilder sb = new StringBuilder(text.length() + 16);
        do {
            if (insideUrl(m.start(), urls)) {
                m.appendReplacement(sb, Matcher.quoteReplacement(m.group()));
            } else if (rule.guard().test(m)) {
                m.appendReplacement(sb, rule.replacement());
            } else {
                Issue issue = rule.onRefusal().apply(m);
                if (issue != null) issues.add(issue);
                m.appendReplacement(sb, Matcher.quoteReplacement(m.group()));
            }
        } while (m.find());
        m.appendTail(sb);
        return sb.toString();
    }

    private static List<int[]> urlSpans(String text) {
        List<int[]> spans = new ArrayList<>();
        Matcher m = URL_SPAN.matcher(text);
        while (m.find()) {
            int end = m.end();
            // sentence punctuation after a URL is not part of it
            while (end > m.start() && ".,;:)".indexOf(text.charAt(end - 1)) >= 0) end--;
            spans.add(new int[]{m.start(), end});
        }
        return spans;
    }

    private static boolean insideUrl(int pos, List<int[]> spans) {
        for (int[] span : spans) {
            if (pos >= span[0] && pos < span[1]) return true;
        }
        return false;
    }

    private static boolean isPlausibleYearRange(MatchResult m) {
        int from = Integer.parseInt(m.group(1));
        int to = Integer.parseInt(m.group(2));
        return 1990 <= from && from < to && to <= 2030;
    }

    private static Issue ambiguousRange(MatchResult m) {
        int from = Integer.parseInt(m.group(1));
        int to = Integer.parseInt(m.group(2));
        // Standard designations such as "ТКП 7696-2024" are not ranges at all
        if (!looksLikeYear(from) || !looksLikeYear(to)) return null;
        return Issue.of(Issue.IssueType.AMBIGUOUS_RANGE,
                "Hyphenated span '" + m.group() + "' left unchanged");
    }

    private static boolean looksLikeYear(int value) {
        return value >= 1800 && value <= 2099;
    }
}
