package com.citationformatter;

import com.citationformatter.CitationTemplate.Segment;
import com.citationformatter.CitationTemplate.Slot;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fills a {@link CitationTemplate} with extracted fields.
 *
 * <p>A missing optional slot disappears together with the punctuation that introduces it. A missing
 * required slot is rendered as {@link #GAP_MARKER}. Found fields the template has no slot for are
 * appended at the end, unless their value is already part of the record.
 */
public final class TemplateRenderer {

    private TemplateRenderer() {}

    public static final String GAP_MARKER = "[?]";

    private static final int MAX_LISTED_AUTHORS = 4;
    private static final int LISTED_BEFORE_ET_AL = 3;

    private static final Pattern CYRILLIC = Pattern.compile("\\p{IsCyrillic}");
    private static final Pattern LATIN = Pattern.compile("\\p{IsLatin}");

    /**
     * @param draft    rendered record, not yet normalized
     * @param issues   missing required and expected fields
     * @param consumed fields that made it into the draft
     */
    public record Rendering(String draft, List<Issue> issues, Set<CitationField> consumed) {}

    // Rendered text of one slot and the fields it used
    private record Piece(String text, Set<CitationField> fields) {}

    public static Rendering render(CitationCategory category, ExtractedFields fields) {
        return render(category, fields, FormattingStandard.VAK_RB);
    }

    public static Rendering render(CitationCategory category, ExtractedFields fields, FormattingStandard standard) {
        return render(CitationTemplate.forCategory(category, fields), fields, standard);
    }

    public static Rendering render(CitationTemplate template, ExtractedFields fields, FormattingStandard standard) {
        StringBuilder out = new StringBuilder();
        List<Issue> issues = new ArrayList<>();
        Set<CitationField> consumed = EnumSet.noneOf(CitationField.class);

        for (Segment segment : template.segments()) {
            String joiner = joinerFor(segment.slot(), segment.joiner(), standard);
            Piece piece = renderSlot(segment.slot(), fields, consumed, standard);
            if (piece != null) {
                append(out, joiner, piece.text());
                consumed.addAll(piece.fields());
                continue;
            }
            if (segment.defaultValue() != null) {
                append(out, joiner, decorate(segment.slot(), segment.defaultValue(), standard));
                continue;
            }
            switch (segment.presence()) {
                case REQUIRED -> {
                    append(out, joiner, GAP_MARKER);
                    CitationField field = primaryField(segment.slot());
                    issues.add(Issue.of(Issue.IssueType.MISSING_REQUIRED_FIELD, field,
                            "Required field " + field + " is missing"));
                }
                case EXPECTED -> {
                    for (CitationField field : segment.slot().fields()) {
                        if (!fields.isFound(field)) {
                            issues.add(Issue.of(Issue.IssueType.FIELD_NOT_FOUND, field,
                                    "Field " + field + " not found"));
                        }
                    }
                }
                case OPTIONAL -> {
                    // dropped with its joiner
                }
            }
        }

        for (CitationField field : fields.found()) {
            if (consumed.contains(field)) continue;
            if (isPresent(field, fields, out)) {
                consumed.add(field);
                continue;
            }
            Slot slot = Slot.forField(field);
            Piece piece = renderSlot(slot, fields, consumed, standard);
            if (piece != null) {
                append(out, joinerFor(slot, slot.joiner(), standard), piece.text());
                consumed.addAll(piece.fields());
            }
        }

        if (out.length() > 0 && out.charAt(out.length() - 1) != '.') {
            out.append('.');
        }
        return new Rendering(out.toString(), List.copyOf(issues), Set.copyOf(consumed));
    }

    /**
     * Author names in direct form as they appear after " / ": up to four listed in full, otherwise
     * the first three followed by "[и др.]".
     */
    public static String responsibilityFromAuthors(List<String> authors) {
        if (authors.isEmpty()) return "";
        if (authors.size() <= MAX_LISTED_AUTHORS) {
            return authors.stream().map(FieldExtractor::toDirect).collect(Collectors.joining(", "));
        }
        return authors.subList(0, LISTED_BEFORE_ET_AL).stream()
                .map(FieldExtractor::toDirect)
                .collect(Collectors.joining(", ")) + " [и др.]";
    }

    private static Piece renderSlot(Slot slot, ExtractedFields fields, Set<CitationField> consumed,
                                    FormattingStandard standard) {
        return switch (slot) {
            case AUTHOR_HEADING -> fields.authors().isEmpty()
                    ? null
                    : new Piece(FieldExtractor.toInverted(fields.authors().get(0)), Set.of());
            case RESPONSIBILITY -> {
                String resp = unconsumed(fields, consumed, CitationField.RESPONSIBILITY);
                if (resp != null) yield new Piece(resp, EnumSet.of(CitationField.RESPONSIBILITY));
                if (!consumed.contains(CitationField.AUTHORS) && !fields.authors().isEmpty()) {
                    yield new Piece(responsibilityFromAuthors(fields.authors()), EnumSet.of(CitationField.AUTHORS));
                }
                yield null;
            }
            case IMPRINT -> imprint(fields, consumed);
            case YEAR -> {
                // Year goes with the imprint whenever there is a place of publication or a publisher
                if (fields.isFound(CitationField.CITY) || fields.isFound(CitationField.PUBLISHER)) yield null;
                yield single(fields, consumed, slot, CitationField.YEAR, standard);
            }
            case VOLUME_ISSUE -> volumeIssue(fields, consumed);
            case PAGES -> {
                String pages = unconsumed(fields, consumed, CitationField.PAGES);
                if (pages == null) yield null;
                yield new Piece(formatPages(pages, fields), EnumSet.of(CitationField.PAGES));
            }
            default -> single(fields, consumed, slot, primaryField(slot), standard);
        };
    }

    private static Piece single(ExtractedFields fields, Set<CitationField> consumed, Slot slot,
                                CitationField field, FormattingStandard standard) {
        String value = unconsumed(fields, consumed, field);
        if (value == null) return null;
        return new Piece(value.isEmpty() ? "" : decorate(slot, value, standard), EnumSet.of(field));
    }

    private static Piece imprint(ExtractedFields fields, Set<CitationField> consumed) {
        String city = unconsumed(fields, consumed, CitationField.CITY);
        String publisher = unconsumed(fields, consumed, CitationField.PUBLISHER);
        String year = unconsumed(fields, consumed, CitationField.YEAR);
        if (city == null && publisher == null && year == null) return null;

        Set<CitationField> used = EnumSet.noneOf(CitationField.class);
        StringBuilder sb = new StringBuilder();
        if (city != null) {
            sb.append(city);
            used.add(CitationField.CITY);
        }
        if (publisher != null) {
            if (sb.length() > 0) sb.append(" : ");
            sb.append(publisher);
            used.add(CitationField.PUBLISHER);
        }
        if (year != null) {
            if (sb.length() > 0) sb.append(", ");
            sb.append(year);
            used.add(CitationField.YEAR);
        }
        return new Piece(sb.toString(), used);
    }

    private static Piece volumeIssue(ExtractedFields fields, Set<CitationField> consumed) {
        String volume = unconsumed(fields, consumed, CitationField.VOLUME);
        String issue = unconsumed(fields, consumed, CitationField.ISSUE);
        if (volume == null && issue == null) return null;

        boolean latin = isLatinRecord(fields);
        Set<CitationField> used = EnumSet.noneOf(CitationField.class);
        StringBuilder sb = new StringBuilder();
        if (volume != null) {
            sb.append(latin ? "Vol. " : "Т. ").append(volume);
            used.add(CitationField.VOLUME);
        }
        if (issue != null) {
            if (sb.length() > 0) sb.append(", ");
            // Labelled issues ("Вып. 3") keep their own label
            boolean bare = !issue.isEmpty() && Character.isDigit(issue.charAt(0));
            sb.append(bare ? (latin ? "No. " : "№ ") + issue : issue);
            used.add(CitationField.ISSUE);
        }
        return new Piece(sb.toString(), used);
    }

    private static String formatPages(String pages, ExtractedFields fields) {
        boolean span = pages.contains("–") || pages.contains(",") || fields.isFound(CitationField.JOURNAL);
        if (isLatinRecord(fields)) {
            return span ? "P. " + pages : pages + " p.";
        }
        return span ? "С. " + pages : pages + " с.";
    }

    /**
     * A record whose title (and host, if any) is written in Latin script keeps the Latin area
     * markers "Vol.", "No." and "P.".
     */
    static boolean isLatinRecord(ExtractedFields fields) {
        String title = fields.value(CitationField.TITLE);
        if (title == null || !LATIN.matcher(title).find() || CYRILLIC.matcher(title).find()) return false;
        String host = fields.value(CitationField.JOURNAL);
        return host == null || !CYRILLIC.matcher(host).find();
    }

    private static String decorate(Slot slot, String value, FormattingStandard standard) {
        return switch (slot) {
            case MEDIUM -> "[" + value + "]";
            case URL -> standard == FormattingStandard.GOST_2018 ? "URL: " + value : "Режим доступа: " + value;
            case ACCESS_DATE -> standard == FormattingStandard.GOST_2018
                    ? "(дата обращения: " + value + ")"
                    : "Дата доступа: " + value;
            case DOI -> "DOI: " + value;
            case ISBN -> "ISBN " + value;
            default -> value;
        };
    }

    private static String joinerFor(Slot slot, String joiner, FormattingStandard standard) {
        if (slot == Slot.ACCESS_DATE && standard == FormattingStandard.GOST_2018) return " ";
        return joiner;
    }

    private static void append(StringBuilder out, String joiner, String text) {
        if (text.isEmpty()) return;
        if (out.length() == 0) {
            out.append(text);
            return;
        }
        String j = joiner;
        char last = out.charAt(out.length() - 1);
        if (j.startsWith(".") && (last == '.' || last == '!' || last == '?')) {
            j = j.substring(1);
        }
        out.append(j).append(text);
    }

    private static String unconsumed(ExtractedFields fields, Set<CitationField> consumed, CitationField field) {
        if (consumed.contains(field)) return null;
        return fields.value(field);
    }

    private static boolean isPresent(CitationField field, ExtractedFields fields, CharSequence out) {
        String text = out.toString();
        if (field == CitationField.AUTHORS) {
            return text.contains(FieldExtractor.surname(fields.authors().get(0)));
        }
        String value = fields.value(field);
        return value == null || value.isEmpty() || text.contains(value);
    }

    private static CitationField primaryField(Slot slot) {
        return switch (slot) {
            case AUTHOR_HEADING -> CitationField.AUTHORS;
            case RESPONSIBILITY -> CitationField.RESPONSIBILITY;
            case IMPRINT -> CitationField.YEAR;
            case VOLUME_ISSUE -> CitationField.ISSUE;
            default -> slot.fields().iterator().next();
        };
    }
}
