package com.citationformatter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemplateRendererJUnitTest {

    @Test
    void render_missingRequiredSlotGetsGapMarker() {
        var fields = ExtractedFields.builder()
                .authors(List.of("Иванов, И. И."))
                .put(CitationField.TITLE, "Статья")
                .put(CitationField.YEAR, "2020")
                .build();

        var rendering = TemplateRenderer.render(CitationCategory.JOURNAL_ARTICLE, fields);

        assertEquals("Иванов, И. И. Статья / И. И. Иванов // [?]. – 2020.", rendering.draft());
        assertTrue(rendering.issues().stream().anyMatch(i ->
                i.type() == Issue.IssueType.MISSING_REQUIRED_FIELD && i.field() == CitationField.JOURNAL));
        assertTrue(rendering.issues().stream().anyMatch(i ->
                i.type() == Issue.IssueType.FIELD_NOT_FOUND && i.field() == CitationField.PAGES));
    }

    @Test
    void render_missingOptionalSlotDropsItsPunctuation() {
        var fields = ExtractedFields.builder()
                .authors(List.of("Иванов, И. И."))
                .put(CitationField.TITLE, "Книга")
                .put(CitationField.CITY, "Минск")
                .put(CitationField.YEAR, "2010")
                .put(CitationField.PAGES, "120")
                .build();

        var rendering = TemplateRenderer.render(CitationCategory.BOOK_FEW_AUTHORS, fields);

        assertEquals("Иванов, И. И. Книга / И. И. Иванов. – Минск, 2010. – 120 с.", rendering.draft());
        assertFalse(rendering.draft().contains(". – . –"));
        assertTrue(rendering.issues().isEmpty());
    }

    @Test
    void render_journalArticleRoundTrip() {
        var fields = FieldExtractor.extract(CitationClassifierJUnitTest.JOURNAL);

        var rendering = TemplateRenderer.render(CitationCategory.JOURNAL_ARTICLE, fields);

        assertEquals(CitationClassifierJUnitTest.JOURNAL, rendering.draft());
    }

    @Test
    void render_electronicResourceDiffersByStandard() {
        var fields = ExtractedFields.builder()
                .put(CitationField.TITLE, "Портал")
                .put(CitationField.URL, "http://example.by")
                .put(CitationField.ACCESS_DATE, "01.02.2024")
                .build();

        var vak = TemplateRenderer.render(CitationCategory.ELECTRONIC_RESOURCE, fields, FormattingStandard.VAK_RB);
        var gost = TemplateRenderer.render(CitationCategory.ELECTRONIC_RESOURCE, fields, FormattingStandard.GOST_2018);

        assertEquals("Портал [Электронный ресурс]. – Режим доступа: http://example.by. – Дата доступа: 01.02.2024.",
                vak.draft());
        assertEquals("Портал [Электронный ресурс]. – URL: http://example.by (дата обращения: 01.02.2024).",
                gost.draft());
    }

    @Test
    void render_unslottedFieldsAreAppended() {
        var fields = ExtractedFields.builder()
                .authors(List.of("Иванов, И. И."))
                .put(CitationField.TITLE, "Книга")
                .put(CitationField.CITY, "Минск")
                .put(CitationField.YEAR, "2010")
                .put(CitationField.PAGES, "120")
                .put(CitationField.DOI, "10.1000/xyz")
                .build();

        var rendering = TemplateRenderer.render(CitationCategory.BOOK_FEW_AUTHORS, fields);

        assertTrue(rendering.draft().endsWith(". – 120 с. – DOI: 10.1000/xyz."), rendering.draft());
        assertTrue(rendering.consumed().contains(CitationField.DOI));
    }

    @Test
    void render_valueAlreadyInOutputIsNotRepeated() {
        var fields = ExtractedFields.builder()
                .put(CitationField.TITLE, "Способ получения сплава")
                .put(CitationField.NOTES, "Опубл. 30.04.2010")
                .put(CitationField.YEAR, "2010")
                .build();

        var rendering = TemplateRenderer.render(CitationCategory.PATENT, fields);

        assertEquals("Способ получения сплава. – Опубл. 30.04.2010.", rendering.draft());
    }

    @Test
    void render_pagesDependOnHostDocument() {
        var book = ExtractedFields.builder().put(CitationField.TITLE, "Книга").put(CitationField.PAGES, "415").build();
        var part = ExtractedFields.builder()
                .put(CitationField.TITLE, "Статья")
                .put(CitationField.JOURNAL, "Сборник")
                .put(CitationField.PAGES, "15")
                .build();

        assertTrue(TemplateRenderer.render(CitationCategory.UNKNOWN, book).draft().endsWith("415 с."));
        assertTrue(TemplateRenderer.render(CitationCategory.COLLECTION_ARTICLE, part).draft().endsWith("С. 15."));
    }

    @Test
    void responsibilityFromAuthors_shortensLongLists() {
        var four = List.of("Первый, А. А.", "Второй, Б. Б.", "Третий, В. В.", "Четвертый, Г. Г.");
        var five = List.of("Первый, А. А.", "Второй, Б. Б.", "Третий, В. В.", "Четвертый, Г. Г.", "Пятый, Д. Д.");

        assertEquals("А. А. Первый, Б. Б. Второй, В. В. Третий, Г. Г. Четвертый",
                TemplateRenderer.responsibilityFromAuthors(four));
        assertEquals("А. А. Первый, Б. Б. Второй, В. В. Третий [и др.]",
                TemplateRenderer.responsibilityFromAuthors(five));
        assertEquals("", TemplateRenderer.responsibilityFromAuthors(List.of()));
    }

    @Test
    void forCategory_conferenceSwitchesToComponentPartWhenHosted() {
        var hosted = ExtractedFields.builder().put(CitationField.JOURNAL, "Материалы конф.").build();

        assertTrue(CitationTemplate.forCategory(CitationCategory.CONFERENCE, hosted)
                .hasSlot(CitationTemplate.Slot.JOURNAL));
        assertFalse(CitationTemplate.forCategory(CitationCategory.CONFERENCE, ExtractedFields.empty())
                .hasSlot(CitationTemplate.Slot.JOURNAL));
    }

    @Test
    void forCategory_everyCategoryHasATemplate() {
        for (CitationCategory category : CitationCategory.values()) {
            var template = CitationTemplate.forCategory(category, ExtractedFields.empty());
            assertEquals(category, template.category());
            assertFalse(template.segments().isEmpty(), category + " has no segments");
        }
    }
}
