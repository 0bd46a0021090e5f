package com.citationformatter;

/**
 * Bibliographic standard the renderer targets.
 */
public enum FormattingStandard {
    /** Belarusian VAK rules (STB 7.1-2003 conventions). */
    VAK_RB,
    /** Russian GOST R 7.0.100-2018. */
    GOST_2018
}
