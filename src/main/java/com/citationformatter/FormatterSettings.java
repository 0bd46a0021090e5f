package com.citationformatter;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

/**
 * Formatter configuration.
 *
 * @param standard            target bibliographic standard
 * @param workers             batch worker threads; 0 or less means one per available processor
 * @param reportMissingFields whether {@link Issue.IssueType#FIELD_NOT_FOUND} issues are reported
 */
public record FormatterSettings(FormattingStandard standard, int workers, boolean reportMissingFields) {

    public static final String RESOURCE = "citation-formatter.properties";

    static final String KEY_STANDARD = "formatter.standard";
    static final String KEY_WORKERS = "formatter.workers";
    static final String KEY_REPORT_MISSING = "formatter.report-missing-fields";

    public FormatterSettings {
        if (standard == null) standard = FormattingStandard.VAK_RB;
    }

    public static FormatterSettings defaults() {
        return new FormatterSettings(FormattingStandard.VAK_RB, 0, true);
    }

    /**
     * Loads {@value #RESOURCE} from the classpath; falls back to {@link #defaults()} when it is absent.
     */
    public static FormatterSettings load() {
        try (InputStream in = FormatterSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) return defaults();
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
    }

    /**
     * Reads settings from {@code props}; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static FormatterSettings fromProperties(Properties props) {
        FormatterSettings d = defaults();

        FormattingStandard standard = d.standard();
        String s = props.getProperty(KEY_STANDARD);
        if (s != null && !s.isBlank()) {
            try {
                standard = FormattingStandard.valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown " + KEY_STANDARD + ": " + s, e);
            }
        }

        int workers = d.workers();
        String w = props.getProperty(KEY_WORKERS);
        if (w != null && !w.isBlank()) {
            try {
                workers = Integer.parseInt(w.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid " + KEY_WORKERS + ": " + w, e);
            }
        }

        boolean report = d.reportMissingFields();
        String r = props.getProperty(KEY_REPORT_MISSING);
        if (r != null && !r.isBlank()) {
            report = Boolean.parseBoolean(r.trim());
        }
        return new FormatterSettings(standard, workers, report);
    }

    public int effectiveWorkers() {
        return workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
    }

    public FormatterSettings withStandard(FormattingStandard standard) {
        return new FormatterSettings(standard, workers, reportMissingFields);
    }

    public FormatterSettings withWorkers(int workers) {
        return new FormatterSettings(standard, workers, reportMissingFields);
    }
}
