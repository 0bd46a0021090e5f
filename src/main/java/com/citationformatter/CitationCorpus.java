package com.citationformatter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named collection of example records in the corpus JSON layout:
 *
 * <pre>
 * {
 *   "description": "...",
 *   "total_examples": 2,
 *   "type_distribution": {"journal_article": 1, "law": 1},
 *   "examples": [{"type": "journal_article", "example": "..."}, ...]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CitationCorpus(
        @JsonProperty("description") String description,
        @JsonProperty("source") String source,
        @JsonProperty("generated_at") String generatedAt,
        @JsonProperty("total_examples") Integer totalExamples,
        @JsonProperty("type_distribution") Map<String, Integer> typeDistribution,
        @JsonProperty("examples") List<CorpusRecord> examples
) {

    private static final Logger log = LoggerFactory.getLogger(CitationCorpus.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * One example: a category tag and a canonical citation string.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CorpusRecord(@JsonProperty("type") String type, @JsonProperty("example") String example) {

        public CitationCategory category() {
            return CitationCategory.fromTag(type);
        }
    }

    /**
     * Structure problems plus punctuation findings per example index.
     */
    public record ValidationReport(List<String> structureErrors, Map<Integer, List<Issue>> punctuation) {

        public boolean isValid() {
            return structureErrors.isEmpty() && punctuation.isEmpty();
        }

        public int punctuationErrorCount() {
            return punctuation.values().stream().mapToInt(List::size).sum();
        }
    }

    /**
     * Builds a corpus with {@code total_examples} and {@code type_distribution} computed from the records.
     */
    public static CitationCorpus of(String description, List<CorpusRecord> examples) {
        List<CorpusRecord> copy = List.copyOf(examples);
        return new CitationCorpus(description, null, null, copy.size(), countByType(copy), copy);
    }

    public static CitationCorpus read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public static CitationCorpus read(InputStream in) throws IOException {
        return MAPPER.readValue(in, CitationCorpus.class);
    }

    public void write(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        MAPPER.writeValue(path.toFile(), this);
    }

    public String toJson() throws IOException {
        return MAPPER.writeValueAsString(this);
    }

    /**
     * Checks the required keys and runs the punctuation checks on every example.
     */
    public ValidationReport validate() {
        List<String> errors = new ArrayList<>();
        if (description == null) errors.add("Missing required field: description");
        if (totalExamples == null) errors.add("Missing required field: total_examples");
        if (examples == null) {
            errors.add("Missing required field: examples");
            return new ValidationReport(errors, Map.of());
        }
        if (totalExamples != null && totalExamples != examples.size()) {
            errors.add("total_examples is " + totalExamples + " but there are " + examples.size() + " examples");
        }

        Map<Integer, List<Issue>> punctuation = new LinkedHashMap<>();
        for (int i = 0; i < examples.size(); i++) {
            CorpusRecord r = examples.get(i);
            if (r == null) {
                errors.add("Example " + i + ": not an object");
                continue;
            }
            if (r.type() == null) errors.add("Example " + i + ": missing 'type' field");
            if (r.example() == null) {
                errors.add("Example " + i + ": missing 'example' field");
                continue;
            }
            List<Issue> found = CitationValidator.checkPunctuation(r.example());
            if (!found.isEmpty()) punctuation.put(i, found);
        }
        return new ValidationReport(errors, punctuation);
    }

    /**
     * Returns a copy with every example normalized and the counts recomputed.
     */
    public CitationCorpus cleanup() {
        List<CorpusRecord> cleaned = new ArrayList<>();
        int changed = 0;
        for (CorpusRecord r : examples == null ? List.<CorpusRecord>of() : examples) {
            if (r == null) continue;
            String text = r.example() == null ? null : PunctuationNormalizer.normalize(r.example());
            if (text != null && !text.equals(r.example())) changed++;
            cleaned.add(new CorpusRecord(r.type(), text));
        }
        log.info("Cleaned corpus: {} of {} examples changed", changed, cleaned.size());
        return new CitationCorpus(description, source, generatedAt, cleaned.size(), countByType(cleaned), cleaned);
    }

    public Map<String, Integer> countByType() {
        return countByType(examples == null ? List.of() : examples);
    }

    public List<Citation> citations() {
        List<Citation> citations = new ArrayList<>();
        if (examples == null) return citations;
        for (CorpusRecord r : examples) {
            if (r != null && r.example() != null) citations.add(Citation.of(r.example()));
        }
        return citations;
    }

    private static Map<String, Integer> countByType(List<CorpusRecord> records) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (CorpusRecord r : records) {
            if (r == null) continue;
            counts.merge(r.type() == null ? CitationCategory.UNKNOWN.tag() : r.type(), 1, Integer::sum);
        }
        return counts;
    }
}
