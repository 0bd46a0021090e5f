package com.citationformatter;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the reference list of a thesis or paper from a PDF file.
 *
 * <p>This class:
 * <ul>
 *   <li>Extracts text from PDF files using Apache PDFBox</li>
 *   <li>Locates the reference list by its heading (Russian, Belarusian or English)</li>
 *   <li>Splits the list into individual citation strings</li>
 * </ul>
 */
public final class PdfBibliographyReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBibliographyReader.class);

    private PdfBibliographyReader() {}

    // Headings that open a reference list
    private static final Pattern SECTION_HEADER = Pattern.compile(
            "(?iu)^\\s*(Список\\s+(?:использованн(?:ых|ой)\\s+|цитированн(?:ых|ой)\\s+)?(?:источников|литературы)"
                    + "|Библиографический\\s+список|Литература|Літаратура"
                    + "|Спіс\\s+(?:выкарыстаных\\s+крыніц|выкарыстанай\\s+літаратуры|літаратуры)"
                    + "|References|Bibliography)\\s*:?\\s*$",
            Pattern.MULTILINE);

    // Headings that close it
    private static final Pattern NEXT_SECTION = Pattern.compile(
            "(?iu)^\\s*(Приложени[ея]|Дадатак|Дадаткі|Appendix|Acknowledgments?)\\b.*$",
            Pattern.MULTILINE);

    // "[12] ..." and "12. ..." / "12) ..." at the start of a line
    private static final Pattern BRACKET_NUMBER = Pattern.compile("^\\s*\\[(\\d{1,3})]\\s*(.*)$");
    private static final Pattern DOT_NUMBER = Pattern.compile("^\\s*(\\d{1,3})[.)]\\s+(.*)$");

    private static final int MIN_ENTRY_LENGTH = 15;

    /**
     * Entries found in a document, with notes about how they were found.
     */
    public record Bibliography(List<String> entries, List<String> messages) {

        public List<Citation> citations() {
            return entries.stream().map(Citation::of).toList();
        }
    }

    public static Bibliography read(Path pdfPath) throws IOException {
        return fromText(extractText(pdfPath));
    }

    public static List<Citation> readCitations(Path pdfPath) throws IOException {
        return read(pdfPath).citations();
    }

    /**
     * Extracts text content from a PDF file.
     */
    public static String extractText(Path pdfPath) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            String text = stripper.getText(document);
            log.debug("Extracted {} characters from {} ({} pages)", text.length(), pdfPath, document.getNumberOfPages());
            return text;
        }
    }

    /**
     * Finds the reference list in plain document text and splits it into entries.
     */
    public static Bibliography fromText(String text) {
        List<String> messages = new ArrayList<>();
        String section = findSection(text);
        if (section == null || section.isBlank()) {
            messages.add("Could not locate the reference list in the document.");
            return new Bibliography(List.of(), messages);
        }
        messages.add("Found reference list (" + section.length() + " characters)");

        List<String> entries = splitEntries(section);
        messages.add("Split " + entries.size() + " entries");
        log.debug("Reference list split into {} entries", entries.size());
        return new Bibliography(entries, messages);
    }

    /**
     * Text between the last reference-list heading and the next section heading (or the end).
     */
    static String findSection(String text) {
        if (text == null) return null;
        Matcher header = SECTION_HEADER.matcher(text);
        int start = -1;
        while (header.find()) {
            // the last match skips tables of contents that mention the heading first
            start = header.end();
        }
        if (start < 0) return null;

        Matcher next = NEXT_SECTION.matcher(text);
        int end = next.find(start) ? next.start() : text.length();
        return text.substring(start, end).trim();
    }

    /**
     * Splits a reference list. Tries bracket numbering, then dot numbering, then blank lines.
     */
    static List<String> splitEntries(String section) {
        List<String> entries = splitNumbered(section, BRACKET_NUMBER);
        if (!entries.isEmpty()) return entries;

        entries = splitNumbered(section, DOT_NUMBER);
        if (!entries.isEmpty()) return entries;

        return splitByBlankLines(section);
    }

    // A numbered line opens a new entry only when it carries the next expected number
    private static List<String> splitNumbered(String section, Pattern numbering) {
        List<String> entries = new ArrayList<>();
        StringBuilder current = null;
        int expected = 1;
        for (String line : section.split("\\R")) {
            Matcher m = numbering.matcher(line);
            if (m.matches() && Integer.parseInt(m.group(1)) == expected) {
                if (current != null) addEntry(entries, current.toString());
                current = new StringBuilder(m.group(2).strip());
                expected++;
            } else if (current != null && !line.isBlank()) {
                current.append('\n').append(line.strip());
            }
        }
        if (current != null) addEntry(entries, current.toString());
        return entries;
    }

    private static List<String> splitByBlankLines(String section) {
        List<String> entries = new ArrayList<>();
        for (String block : section.split("\\n\\s*\\n+")) {
            addEntry(entries, block);
        }
        return entries;
    }

    private static void addEntry(List<String> entries, String raw) {
        String text = joinLines(raw);
        if (text.length() >= MIN_ENTRY_LENGTH) {
            entries.add(text);
        }
    }

    /**
     * Undoes line wrapping: soft hyphens between lowercase letters are removed, a hyphen after an
     * abbreviation ("учеб.-метод.") is kept, every other break becomes a space.
     */
    static String joinLines(String text) {
        String t = text.replaceAll("(?<=\\p{Ll})-[ \\t]*\\R[ \\t]*(?=\\p{Ll})", "");
        t = t.replaceAll("(?<=\\.)-[ \\t]*\\R[ \\t]*", "-");
        return t.replaceAll("\\s+", " ").trim();
    }
}
