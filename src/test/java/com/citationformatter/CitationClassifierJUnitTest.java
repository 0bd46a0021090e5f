package com.citationformatter;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CitationClassifierJUnitTest {

    static final String BOOK = "Дробышевский, Н. П. Ревизия и аудит : учеб.-метод. пособие / Н. П. Дробышевский. "
            + "– Минск : Амалфея, 2013. – 415 с.";
    static final String JOURNAL = "Иванов, И. И. Методы обучения / И. И. Иванов // Нар. асвета. – 2013. – № 5. – С. 88–91.";
    static final String DISSERTATION = "Иванов, И. И. История образования : дыс. ... канд. гіст. навук : 07.00.09 "
            + "/ Иванов Иван Иванович. – Минск, 2015. – 150 л.";
    static final String ELECTRONIC = "Национальный правовой Интернет-портал Республики Беларусь [Электронный ресурс]. "
            + "– Режим доступа: http://www.pravo.by. – Дата доступа: 24.06.2024.";

    // One record per category
    static final Map<CitationCategory, String> SAMPLES = Map.ofEntries(
            Map.entry(CitationCategory.BOOK_FEW_AUTHORS, BOOK),
            Map.entry(CitationCategory.BOOK_MANY_AUTHORS,
                    "История Беларуси / И. И. Иванов [и др.]. – Минск, 2018. – 300 с."),
            Map.entry(CitationCategory.JOURNAL_ARTICLE, JOURNAL),
            Map.entry(CitationCategory.COLLECTION_ARTICLE,
                    "Петров, П. П. Статья / П. П. Петров // Сб. науч. тр. – Минск, 2019. – Вып. 3. – С. 10–15."),
            Map.entry(CitationCategory.NEWSPAPER_ARTICLE,
                    "Иванов, И. Новости региона / И. Иванов // Звязда. – 2020. – 12 мая. – С. 3."),
            Map.entry(CitationCategory.DISSERTATION, DISSERTATION),
            Map.entry(CitationCategory.ABSTRACT,
                    "Иванов, И. И. Тема исследования : автореф. дис. ... канд. техн. наук : 05.13.01 "
                            + "/ И. И. Иванов. – Минск, 2010. – 20 с."),
            Map.entry(CitationCategory.PREPRINT,
                    "Иванов, И. И. Моделирование процессов / И. И. Иванов. – Минск : Ин-т математики, 2015. "
                            + "– 24 с. – (Препринт / Ин-т математики ; № 2)."),
            Map.entry(CitationCategory.STANDARD,
                    "Библиографическая запись. Библиографическое описание : ГОСТ 7.1-2003. "
                            + "– Введ. 01.07.2004. – Минск : Госстандарт, 2004. – 48 с."),
            Map.entry(CitationCategory.LAW,
                    "О защите прав потребителей : Закон Респ. Беларусь от 9 янв. 2002 г. № 90-З "
                            + "// Нац. реестр правовых актов Респ. Беларусь. – 2002. – № 10. – 2/839."),
            Map.entry(CitationCategory.PATENT,
                    "Способ получения сплава : пат. BY 12345 / И. И. Иванов. – Опубл. 30.04.2010."),
            Map.entry(CitationCategory.CONFERENCE,
                    "Иванов, И. И. Доклад / И. И. Иванов // Материалы междунар. науч. конф. "
                            + "– Минск, 2020. – С. 5–7."),
            Map.entry(CitationCategory.ELECTRONIC_RESOURCE, ELECTRONIC),
            Map.entry(CitationCategory.MULTIMEDIA, "Песни о Беларуси [Звукозапись]. – Минск : Белмузфонд, 2005."),
            Map.entry(CitationCategory.MAP, "Беларусь [Карты] : атлас. – Минск : Белкартография, 2017."),
            Map.entry(CitationCategory.MUSIC_SCORE, "Вальсы [Ноты] : для фп. – Минск : Беларусь, 2001. – 30 с."),
            Map.entry(CitationCategory.VISUAL_MATERIAL,
                    "Беларусь туристическая [Изоматериал] : плакат. – Минск : Беларусь, 2019. – 1 л."),
            Map.entry(CitationCategory.ARCHIVE, "Национальный архив Республики Беларусь. – Ф. 4. Оп. 1. Д. 25. Л. 10."),
            Map.entry(CitationCategory.RESEARCH_REPORT,
                    "Разработка методики оценки : отчет о НИР (заключ.) / БГУ ; рук. И. И. Иванов. "
                            + "– Минск, 2018. – 120 с."),
            Map.entry(CitationCategory.DEPOSITED,
                    "Иванов, И. И. Анализ данных / И. И. Иванов ; БГУ. – Минск, 2012. – 15 с. "
                            + "– Деп. в ГУ «БелИСА» 12.03.2012, № Д201212."),
            Map.entry(CitationCategory.MULTIVOLUME,
                    "Быков, В. В. Собрание сочинений : у 4 т. / В. В. Быков. "
                            + "– Минск : Мастацкая літаратура, 2010–2014. – 4 т."),
            Map.entry(CitationCategory.REVIEW,
                    "Петров, П. П. [Рецензия] / П. П. Петров // Нар. асвета. – 2019. – № 4. – С. 90–93. "
                            + "– Рец. на кн.: История Беларуси / И. И. Иванов. – Минск : Беларусь, 2018. – 300 с."),
            Map.entry(CitationCategory.CATALOG,
                    "Каталог древесных растений / Ин-т леса ; сост. И. И. Иванов. – Гомель, 2015. – 120 с."),
            Map.entry(CitationCategory.METHODICAL_GUIDE,
                    "Ревизия и контроль : метод. указания / сост. И. И. Иванов. – Минск : БГЭУ, 2016. – 40 с."),
            Map.entry(CitationCategory.UNKNOWN, "просто какой-то текст без маркеров"));

    @Test
    void classify_bookWithFewAuthors() {
        assertEquals(CitationCategory.BOOK_FEW_AUTHORS, CitationClassifier.classify(BOOK));
    }

    @Test
    void classify_journalArticle() {
        assertEquals(CitationCategory.JOURNAL_ARTICLE, CitationClassifier.classify(JOURNAL));
    }

    @Test
    void classify_dissertation() {
        assertEquals(CitationCategory.DISSERTATION, CitationClassifier.classify(DISSERTATION));
    }

    @Test
    void classify_electronicResource() {
        assertEquals(CitationCategory.ELECTRONIC_RESOURCE, CitationClassifier.classify(ELECTRONIC));
    }

    @Test
    void classify_abstractWinsOverDissertation() {
        String text = "Иванов, И. И. Тема исследования : автореф. дис. ... канд. техн. наук : 05.13.01 "
                + "/ И. И. Иванов. – Минск, 2010. – 20 с.";
        assertEquals(CitationCategory.ABSTRACT, CitationClassifier.classify(text));
    }

    @Test
    void classify_patent() {
        String text = "Способ получения сплава : пат. BY 12345 / И. И. Иванов. – Опубл. 30.04.2010.";
        assertEquals(CitationCategory.PATENT, CitationClassifier.classify(text));
    }

    @Test
    void classify_standard() {
        String text = "Библиографическая запись. Библиографическое описание : ГОСТ 7.1-2003. "
                + "– Введ. 01.07.2004. – Минск : Госстандарт, 2004. – 48 с.";
        assertEquals(CitationCategory.STANDARD, CitationClassifier.classify(text));
    }

    @Test
    void classify_lawWinsOverPeriodicalHost() {
        String text = "О защите прав потребителей : Закон Респ. Беларусь от 9 янв. 2002 г. № 90-З "
                + "// Нац. реестр правовых актов Респ. Беларусь. – 2002. – № 10. – 2/839.";
        assertEquals(CitationCategory.LAW, CitationClassifier.classify(text));
    }

    @Test
    void classify_conference() {
        String text = "Иванов, И. И. Доклад / И. И. Иванов // Материалы междунар. науч. конф. "
                + "– Минск, 2020. – С. 5–7.";
        assertEquals(CitationCategory.CONFERENCE, CitationClassifier.classify(text));
    }

    @Test
    void classify_collectionArticle() {
        String text = "Петров, П. П. Статья / П. П. Петров // Сб. науч. тр. – Минск, 2019. – Вып. 3. – С. 10–15.";
        assertEquals(CitationCategory.COLLECTION_ARTICLE, CitationClassifier.classify(text));
    }

    @Test
    void classify_newspaperArticle() {
        String text = "Иванов, И. Новости региона / И. Иванов // Звязда. – 2020. – 12 мая. – С. 3.";
        assertEquals(CitationCategory.NEWSPAPER_ARTICLE, CitationClassifier.classify(text));
    }

    @Test
    void classify_etAlMeansManyAuthors() {
        String text = "История Беларуси / И. И. Иванов [и др.]. – Минск, 2018. – 300 с.";
        assertEquals(CitationCategory.BOOK_MANY_AUTHORS, CitationClassifier.classify(text));
    }

    @Test
    void classify_bracketedDesignators() {
        assertEquals(CitationCategory.MULTIMEDIA,
                CitationClassifier.classify("Песни о Беларуси [Звукозапись]. – Минск : Белмузфонд, 2005."));
        assertEquals(CitationCategory.MAP,
                CitationClassifier.classify("Беларусь [Карты] : атлас. – Минск : Белкартография, 2017."));
        assertEquals(CitationCategory.MUSIC_SCORE,
                CitationClassifier.classify("Вальсы [Ноты] : для фп. – Минск : Беларусь, 2001. – 30 с."));
    }

    @Test
    void classify_noMarkersIsUnknown() {
        assertEquals(CitationCategory.UNKNOWN, CitationClassifier.classify("просто какой-то текст без маркеров"));
        assertEquals(CitationCategory.UNKNOWN, CitationClassifier.classify(""));
        assertEquals(CitationCategory.UNKNOWN, CitationClassifier.classify((String) null));
    }

    @Test
    void classify_everyCategoryHasASample() {
        for (CitationCategory category : CitationCategory.values()) {
            String sample = SAMPLES.get(category);
            assertNotNull(sample, category + " has no sample");
            assertEquals(category, CitationClassifier.classify(sample), sample);
        }
    }

    @Test
    void classify_isStableUnderNormalization() {
        for (String text : SAMPLES.values()) {
            assertEquals(CitationClassifier.classify(PunctuationNormalizer.normalize(text)),
                    CitationClassifier.classify(text), text);
        }
    }

    @Test
    void classify_periodicalAboutAnArchiveIsAJournalArticle() {
        String text = "Иванов, И. И. Документы эпохи / И. И. Иванов // Исторический архив. – 2005. – № 3. – С. 10–20.";
        assertEquals(CitationCategory.JOURNAL_ARTICLE, CitationClassifier.classify(text));
    }

    @Test
    void classify_wordCatalogInTitleDoesNotMakeACatalog() {
        String article = "Петрова, А. А. Электронный каталог библиотеки / А. А. Петрова "
                + "// Библиотека. – 2015. – № 3. – С. 5–9.";
        String book = "Сидоров, С. С. Каталог монет Беларуси / С. С. Сидоров. – Минск : Беларусь, 2018. – 200 с.";

        assertEquals(CitationCategory.JOURNAL_ARTICLE, CitationClassifier.classify(article));
        assertEquals(CitationCategory.BOOK_FEW_AUTHORS, CitationClassifier.classify(book));
    }

    @Test
    void classify_archiveWithoutFondReference() {
        String text = "Государственный архив Минской области за 2010 г. – Уголовное дело № 12/10.";
        assertEquals(CitationCategory.ARCHIVE, CitationClassifier.classify(text));
    }

    @Test
    void classify_latinVolumeAndNumberMarkJournalArticle() {
        String text = "Smith, J. Deep learning / J. Smith // Nature. – 2020. – Vol. 5, No. 3. – P. 10–20.";
        assertEquals(CitationCategory.JOURNAL_ARTICLE, CitationClassifier.classify(text));
    }

    @Test
    void classify_unnormalizedInputMatchesNormalized() {
        String messy = "Иванов, И.И. Методы обучения / И.И.Иванов // Нар. асвета.–2013. – №5. – С. 88 - 91.";
        assertEquals(CitationCategory.JOURNAL_ARTICLE, CitationClassifier.classify(messy));
    }

    @Test
    void rules_narrowerRulesComeFirst() {
        List<String> names = CitationClassifier.rules().stream().map(CitationClassifier.Rule::name).toList();

        assertTrue(names.indexOf("abstract") < names.indexOf("dissertation"));
        assertTrue(names.indexOf("law") < names.indexOf("journal-article"));
        assertTrue(names.indexOf("many-authors") < names.indexOf("few-authors"));
        assertTrue(names.indexOf("few-authors") < names.indexOf("archive"));
        assertTrue(names.indexOf("few-authors") < names.indexOf("catalog"));
        assertEquals("electronic-resource", names.get(names.size() - 1));
    }

    @Test
    void countInvertedSurnames_countsDistinctHeadings() {
        assertEquals(1, CitationClassifier.countInvertedSurnames("Иванов, И. Книга. Иванов, И."));
        assertEquals(4, CitationClassifier.countInvertedSurnames(
                "Иванов, И. Петров, П. Сидоров, С. Козлов, К. Книга"));
    }

    @Test
    void classifyRecord_typeHintWins() {
        var record = SourceRecord.builder().title("Статья").journal("Вестник").type("journal_article").build();
        assertEquals(CitationCategory.JOURNAL_ARTICLE, CitationClassifier.classify(record));
    }

    @Test
    void classifyRecord_bookHintWithManyAuthors() {
        var record = SourceRecord.builder()
                .authors(List.of("А. А. Первый", "Б. Б. Второй", "В. В. Третий", "Г. Г. Четвертый"))
                .title("Книга")
                .type("book")
                .build();
        assertEquals(CitationCategory.BOOK_MANY_AUTHORS, CitationClassifier.classify(record));
    }

    @Test
    void classifyRecord_inferredFromFields() {
        var article = SourceRecord.builder().authors(List.of("Иванов, И. И.")).journal("Вестник").issue("3").build();
        var part = SourceRecord.builder().authors(List.of("Иванов, И. И.")).journal("Сборник").build();
        var site = SourceRecord.builder().title("Портал").url("https://example.by").build();
        var book = SourceRecord.builder().authors(List.of("Иванов, И. И.")).title("Книга").build();

        assertEquals(CitationCategory.JOURNAL_ARTICLE, CitationClassifier.classify(article));
        assertEquals(CitationCategory.COLLECTION_ARTICLE, CitationClassifier.classify(part));
        assertEquals(CitationCategory.ELECTRONIC_RESOURCE, CitationClassifier.classify(site));
        assertEquals(CitationCategory.BOOK_FEW_AUTHORS, CitationClassifier.classify(book));
        assertEquals(CitationCategory.UNKNOWN, CitationClassifier.classify(SourceRecord.builder().build()));
    }
}
