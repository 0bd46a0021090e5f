package com.citationformatter;

import java.util.List;

/**
 * Outcome of formatting one citation.
 *
 * @param category   assigned category
 * @param fields     what the extractor found
 * @param formatted  normalized output record
 * @param confidence 0..100, see {@link Confidence}
 * @param issues     everything worth a second look; never fatal
 */
public record FormatResult(
        CitationCategory category,
        ExtractedFields fields,
        String formatted,
        int confidence,
        List<Issue> issues
) {

    public FormatResult {
        issues = List.copyOf(issues);
    }

    public boolean hasIssue(Issue.IssueType type) {
        return issues.stream().anyMatch(i -> i.type() == type);
    }
}
