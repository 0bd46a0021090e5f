package com.citationformatter;

import java.util.Optional;

/**
 * Best-effort structuring of text the rule engine could not classify. Its output is formatted like
 * any structured input, so punctuation is normalized regardless of what the parser returns.
 */
@FunctionalInterface
public interface FreeTextParser {

    Optional<SourceRecord> parse(String text) throws Exception;
}
