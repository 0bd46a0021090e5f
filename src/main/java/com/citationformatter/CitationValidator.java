package com.citationformatter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Post-render checks: punctuation conventions and field preservation.
 */
public final class CitationValidator {

    private CitationValidator() {}

    private static final Pattern MISSING_SPACE_AFTER_DASH = Pattern.compile("\\. –([^\\s\\d])");
    private static final Pattern MISSING_SPACE_AFTER_COLON = Pattern.compile(":([^\\s/\\d])");
    private static final Pattern MISSING_SPACE_AFTER_INITIALS = Pattern.compile("(?<!\\p{L})(\\p{L}\\. \\p{L}\\.)(\\p{L})");
    private static final Pattern SPACES_IN_RANGE = Pattern.compile("(\\d) – (\\d)");
    private static final Pattern TRAILING_SPACE_IN_RANGE = Pattern.compile("(\\d)– (\\d)");
    private static final Pattern LEADING_SPACE_IN_RANGE = Pattern.compile("(\\d) –(\\d)");
    private static final Pattern DOUBLE_SPACES = Pattern.compile(" {2,}");
    private static final Pattern HYPHEN_YEAR_RANGE = Pattern.compile("(\\d{4})-(\\d{4})");
    private static final Pattern HYPHEN_PAGE_RANGE = Pattern.compile("С\\. (\\d+)-(\\d+)");
    private static final Pattern URL = Pattern.compile("(?:https?://|www\\.)\\S+");

    /**
     * Reports punctuation that breaks the separator conventions. URLs are not inspected.
     */
    public static List<Issue> checkPunctuation(String text) {
        List<Issue> issues = new ArrayList<>();
        if (text == null || text.isEmpty()) return issues;
        String t = URL.matcher(text).replaceAll("URL");

        report(issues, t, MISSING_SPACE_AFTER_DASH, "missing_space_after_dash");
        report(issues, t, MISSING_SPACE_AFTER_COLON, "missing_space_after_colon");
        report(issues, t, MISSING_SPACE_AFTER_INITIALS, "missing_space_after_initials");
        report(issues, t, SPACES_IN_RANGE, "spaces_in_range");
        report(issues, t, TRAILING_SPACE_IN_RANGE, "trailing_space_in_range");
        report(issues, t, LEADING_SPACE_IN_RANGE, "leading_space_in_range");
        report(issues, t, DOUBLE_SPACES, "double_spaces");

        Matcher years = HYPHEN_YEAR_RANGE.matcher(t);
        while (years.find()) {
            int from = Integer.parseInt(years.group(1));
            int to = Integer.parseInt(years.group(2));
            if (1990 <= from && from < to && to <= 2030) {
                issues.add(Issue.of(Issue.IssueType.PUNCTUATION,
                        "hyphen_instead_of_dash: " + years.group()));
            }
        }
        report(issues, t, HYPHEN_PAGE_RANGE, "hyphen_in_page_range");
        return issues;
    }

    /**
     * Reports every found field whose value cannot be located in {@code formatted}. For authors only
     * the first surname is required, since long author lists are shortened with "[и др.]".
     */
    public static List<Issue> checkFieldPreservation(ExtractedFields fields, String formatted) {
        List<Issue> issues = new ArrayList<>();
        String out = formatted == null ? "" : formatted;
        for (CitationField field : fields.found()) {
            if (field == CitationField.AUTHORS) {
                String surname = FieldExtractor.surname(fields.authors().get(0));
                if (!out.contains(surname)) issues.add(dropped(field, surname));
                continue;
            }
            String value = fields.value(field);
            if (value == null || value.isBlank()) continue;
            if (!out.contains(value) && !out.contains(PunctuationNormalizer.normalize(value))) {
                issues.add(dropped(field, value));
            }
        }
        return issues;
    }

    private static Issue dropped(CitationField field, String value) {
        return Issue.of(Issue.IssueType.FIELD_DROPPED, field, "Value '" + value + "' is missing from the output");
    }

    private static void report(List<Issue> issues, String text, Pattern pattern, String code) {
        Matcher m = pattern.matcher(text);
        List<String> hits = new ArrayList<>();
        while (m.find()) {
            hits.add(m.group());
        }
        if (!hits.isEmpty()) {
            issues.add(Issue.of(Issue.IssueType.PUNCTUATION, code + ": " + hits));
        }
    }
}
