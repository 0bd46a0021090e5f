package com.citationformatter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the classify, extract, render, normalize and validate pipeline.
 *
 * <p>The pipeline itself is stateless; an instance only holds settings and the optional
 * collaborators, so one formatter can be shared between threads.
 */
public final class CitationFormatter {

    private static final Logger log = LoggerFactory.getLogger(CitationFormatter.class);

    private final FormatterSettings settings;
    private final MetadataLookup metadataLookup;
    private final FreeTextParser freeTextParser;

    private CitationFormatter(Builder builder) {
        this.settings = builder.settings;
        this.metadataLookup = builder.metadataLookup;
        this.freeTextParser = builder.freeTextParser;
    }

    public CitationFormatter() {
        this(builder());
    }

    public static Builder builder() {
        return new Builder();
    }

    public FormatterSettings settings() {
        return settings;
    }

    public FormatResult process(String text) {
        return process(Citation.of(text));
    }

    /**
     * Formats one citation. Problems are reported as issues on the result; unusual input never
     * makes this method throw.
     */
    public FormatResult process(Citation citation) {
        Objects.requireNonNull(citation, "citation");
        Set<Issue> issues = new LinkedHashSet<>();
        if (citation.isStructured()) {
            return formatRecord(citation.record(), issues);
        }

        String text = citation.text();
        Optional<SourceRecord> resolved = resolveIdentifier(text, issues);
        if (resolved.isPresent()) {
            return formatRecord(resolved.get(), issues);
        }

        PunctuationNormalizer.Result normalized = PunctuationNormalizer.normalizeDetailed(text);
        issues.addAll(normalized.issues());
        CitationCategory category = CitationClassifier.classify(normalized.text());

        if (category == CitationCategory.UNKNOWN) {
            Optional<SourceRecord> parsed = parseFreeText(text, issues);
            if (parsed.isPresent()) {
                return formatRecord(parsed.get(), issues);
            }
        }
        return finish(category, FieldExtractor.extract(normalized.text()), issues);
    }

    /**
     * Formats all citations in parallel. The result list has the order of the input.
     *
     * @throws CancellationException if the calling thread is interrupted; the interrupt flag stays set
     */
    public List<FormatResult> processAll(List<Citation> citations) {
        Objects.requireNonNull(citations, "citations");
        if (citations.isEmpty()) return List.of();

        int workers = Math.min(settings.effectiveWorkers(), citations.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        try {
            List<Future<FormatResult>> futures = new ArrayList<>(citations.size());
            for (Citation citation : citations) {
                futures.add(pool.submit(() -> process(citation)));
            }
            List<FormatResult> results = new ArrayList<>(citations.size());
            for (Future<FormatResult> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Citation batch interrupted");
            cancelled.initCause(e);
            throw cancelled;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("Citation formatting failed", cause);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Formats all citations and summarizes the run.
     */
    public BatchReport processBatch(List<Citation> citations) {
        long start = System.nanoTime();
        BatchReport report = BatchReport.of(processAll(citations));
        long millis = (System.nanoTime() - start) / 1_000_000;
        log.info("Formatted {} citations in {} ms, {} unrecognized, average confidence {}",
                report.statistics().total(), millis,
                report.statistics().count(CitationCategory.UNKNOWN),
                String.format("%.1f", report.statistics().averageConfidence()));
        return report;
    }

    private FormatResult formatRecord(SourceRecord record, Set<Issue> issues) {
        CitationCategory category = CitationClassifier.classify(record);
        return finish(category, ExtractedFields.fromRecord(record), issues);
    }

    private FormatResult finish(CitationCategory category, ExtractedFields fields, Set<Issue> issues) {
        if (category == CitationCategory.UNKNOWN) {
            issues.add(Issue.of(Issue.IssueType.UNRECOGNIZED_TYPE, "No category rule matched"));
        }

        TemplateRenderer.Rendering rendering = TemplateRenderer.render(category, fields, settings.standard());
        for (Issue issue : rendering.issues()) {
            if (issue.type() == Issue.IssueType.FIELD_NOT_FOUND && !settings.reportMissingFields()) continue;
            issues.add(issue);
        }

        PunctuationNormalizer.Result normalized = PunctuationNormalizer.normalizeDetailed(rendering.draft());
        String formatted = normalized.text();
        issues.addAll(normalized.issues());
        issues.addAll(CitationValidator.checkPunctuation(formatted));
        issues.addAll(CitationValidator.checkFieldPreservation(fields, formatted));

        int confidence = Confidence.score(category, fields);
        if (log.isDebugEnabled()) {
            log.debug("{} ({}%): {}", category.tag(), confidence, formatted);
        }
        return new FormatResult(category, fields, formatted, confidence, new ArrayList<>(issues));
    }

    private Optional<SourceRecord> resolveIdentifier(String text, Set<Issue> issues) {
        if (metadataLookup == null) return Optional.empty();
        Optional<MetadataLookup.Identifier> id = MetadataLookup.Identifier.detect(text);
        if (id.isEmpty()) return Optional.empty();
        try {
            Optional<SourceRecord> record = metadataLookup.lookup(id.get());
            if (record.isEmpty()) {
                log.debug("No metadata for {} {}", id.get().kind(), id.get().value());
            }
            return record;
        } catch (Exception e) {
            log.warn("Metadata lookup failed for {} {}: {}", id.get().kind(), id.get().value(), e.getMessage());
            issues.add(Issue.of(Issue.IssueType.COLLABORATOR_FAILURE,
                    "Metadata lookup failed: " + e.getMessage()));
            return Optional.empty();
        }
    }

    private Optional<SourceRecord> parseFreeText(String text, Set<Issue> issues) {
        if (freeTextParser == null) return Optional.empty();
        try {
            return freeTextParser.parse(text);
        } catch (Exception e) {
            log.warn("Free-text parser failed: {}", e.getMessage());
            issues.add(Issue.of(Issue.IssueType.COLLABORATOR_FAILURE,
                    "Free-text parser failed: " + e.getMessage()));
            return Optional.empty();
        }
    }

    public static final class Builder {
        private FormatterSettings settings = FormatterSettings.load();
        private MetadataLookup metadataLookup;
        private FreeTextParser freeTextParser;

        private Builder() {}

        public Builder settings(FormatterSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
            return this;
        }

        public Builder metadataLookup(MetadataLookup metadataLookup) {
            this.metadataLookup = metadataLookup;
            return this;
        }

        public Builder freeTextParser(FreeTextParser freeTextParser) {
            this.freeTextParser = freeTextParser;
            return this;
        }

        public CitationFormatter build() {
            return new CitationFormatter(this);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL = new AtomicInteger();
        private final int pool = POOL.incrementAndGet();
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "citation-formatter-" + pool + "-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
