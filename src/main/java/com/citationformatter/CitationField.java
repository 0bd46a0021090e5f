package com.citationformatter;

/**
 * Fields the extractor recognizes in a citation.
 */
public enum CitationField {
    AUTHORS,
    TITLE,
    SUBTITLE,
    MEDIUM,          // general material designation, e.g. [Электронный ресурс]
    RESPONSIBILITY,  // statement after " / "
    EDITION,
    CITY,
    PUBLISHER,
    YEAR,
    PAGES,
    EXTENT,          // non-page extent: "148 л.", "1 CD-ROM", "5 т."
    JOURNAL,
    VOLUME,
    ISSUE,
    ISSUE_DATE,      // newspaper date, e.g. "3 окт."
    URL,
    ACCESS_DATE,
    DOI,
    ISBN,
    NOTES
}
