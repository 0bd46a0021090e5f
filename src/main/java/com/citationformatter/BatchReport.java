package com.citationformatter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Results of a batch run together with its statistics.
 */
public record BatchReport(List<FormatResult> results, Statistics statistics) {

    public BatchReport {
        results = List.copyOf(results);
    }

    /**
     * @param total             number of citations processed
     * @param byCategory        count per assigned category
     * @param issueCounts       count per issue type over all results
     * @param averageConfidence mean confidence, 0 for an empty batch
     */
    public record Statistics(int total,
                             Map<CitationCategory, Integer> byCategory,
                             Map<Issue.IssueType, Integer> issueCounts,
                             double averageConfidence) {

        public int count(CitationCategory category) {
            return byCategory.getOrDefault(category, 0);
        }

        public int count(Issue.IssueType type) {
            return issueCounts.getOrDefault(type, 0);
        }
    }

    public static BatchReport of(List<FormatResult> results) {
        Map<CitationCategory, Integer> byCategory = new EnumMap<>(CitationCategory.class);
        Map<Issue.IssueType, Integer> issueCounts = new EnumMap<>(Issue.IssueType.class);
        long confidenceSum = 0;
        for (FormatResult r : results) {
            byCategory.merge(r.category(), 1, Integer::sum);
            for (Issue issue : r.issues()) {
                issueCounts.merge(issue.type(), 1, Integer::sum);
            }
            confidenceSum += r.confidence();
        }
        double average = results.isEmpty() ? 0.0 : (double) confidenceSum / results.size();
        Statistics stats = new Statistics(results.size(),
                Collections.unmodifiableMap(byCategory),
                Collections.unmodifiableMap(issueCounts),
                average);
        return new BatchReport(results, stats);
    }
}
