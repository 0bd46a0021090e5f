package com.citationformatter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PunctuationNormalizerJUnitTest {

    @Test
    void normalize_tightensSpacedRanges() {
        assertEquals("С. 45–52.", PunctuationNormalizer.normalize("С. 45 – 52."));
        assertEquals("С. 45–52.", PunctuationNormalizer.normalize("С. 45– 52."));
        assertEquals("С. 45–52.", PunctuationNormalizer.normalize("С. 45 –52."));
    }

    @Test
    void normalize_tightensBareRange() {
        assertEquals("45–52", PunctuationNormalizer.normalize("45 – 52"));
    }

    @Test
    void normalize_separatorDashBeforeRangeIsLeftAlone() {
        assertEquals("Т. 5. –88–91", PunctuationNormalizer.normalize("Т. 5. –88–91"));
        assertEquals("Минск, 2013. – 415 с.", PunctuationNormalizer.normalize("Минск, 2013. –415 с."));
    }

    @Test
    void normalize_hyphenatedPageRangeGetsDash() {
        assertEquals("С. 10–15.", PunctuationNormalizer.normalize("С. 10 - 15."));
    }

    @Test
    void normalize_insertsSpaceAfterSeparatorDash() {
        assertEquals("Минск. – Амалфея", PunctuationNormalizer.normalize("Минск. –Амалфея"));
        assertEquals("Минск. – Амалфея", PunctuationNormalizer.normalize("Минск.– Амалфея"));
        assertEquals("Минск. – Амалфея", PunctuationNormalizer.normalize("Минск. —Амалфея"));
    }

    @Test
    void normalize_preservesEllipsis() {
        String text = "Иванов, И. И. История : дыс. ... канд. гіст. навук : 07.00.09";
        assertEquals(text, PunctuationNormalizer.normalize(text));
    }

    @Test
    void normalize_collapsesDoublePeriod() {
        assertEquals("Минск : Наука.", PunctuationNormalizer.normalize("Минск : Наука.."));
        assertEquals("учеб. пособие", PunctuationNormalizer.normalize("учеб.. пособие"));
    }

    @Test
    void normalize_leavesUrlsAlone() {
        String text = "Режим доступа: http://www.pravo.by/document/?guid=3871&p0=v19402875. – Дата доступа: 24.06.2024.";
        assertEquals(text, PunctuationNormalizer.normalize(text));
    }

    @Test
    void normalize_spacesInitials() {
        assertEquals("Н. П. Дробышевский", PunctuationNormalizer.normalize("Н.П.Дробышевский"));
        assertEquals("Дробышевский, Н. П.", PunctuationNormalizer.normalize("Дробышевский, Н.П."));
    }

    @Test
    void normalize_spacesAfterVolumeAndNumberMarkers() {
        assertEquals("Т. 5, № 3", PunctuationNormalizer.normalize("Т.5, №3"));
        assertEquals("Вып. 2", PunctuationNormalizer.normalize("Вып.2"));
    }

    @Test
    void normalize_removesSpaceBeforePunctuation() {
        assertEquals("Иванов, И. И.", PunctuationNormalizer.normalize("Иванов , И. И ."));
    }

    @Test
    void normalize_collapsesWhitespace() {
        assertEquals("Минск : Амалфея, 2013", PunctuationNormalizer.normalize("  Минск :\tАмалфея,\n2013  "));
    }

    @Test
    void normalize_addsSpaceAfterColonBeforeWord() {
        assertEquals("Ревизия: учеб. пособие", PunctuationNormalizer.normalize("Ревизия:учеб. пособие"));
    }

    @Test
    void normalizeDetailed_plausibleYearRangeGetsDash() {
        var result = PunctuationNormalizer.normalizeDetailed("Минск, 2015-2018.");

        assertEquals("Минск, 2015–2018.", result.text());
        assertTrue(result.issues().isEmpty());
    }

    @Test
    void normalizeDetailed_implausibleYearRangeIsReported() {
        var result = PunctuationNormalizer.normalizeDetailed("Переписка 1885-1890 гг.");

        assertEquals("Переписка 1885-1890 гг.", result.text(), "Range outside 1990..2030 must stay as written");
        assertEquals(1, result.issues().size());
        assertEquals(Issue.IssueType.AMBIGUOUS_RANGE, result.issues().get(0).type());
    }

    @Test
    void normalizeDetailed_standardDesignationIsNotARange() {
        var result = PunctuationNormalizer.normalizeDetailed("ТКП 7696-2024. – Минск, 2024.");

        assertTrue(result.text().contains("7696-2024"));
        assertTrue(result.issues().isEmpty(), "Standard numbers are not ambiguous ranges");
    }

    @Test
    void normalize_isIdempotent() {
        List<String> samples = List.of(
                "Дробышевский, Н.П. Ревизия и аудит:учеб.-метод. пособие / Н.П.Дробышевский.–Минск : Амалфея, 2013.-415 с.",
                "Иванов, И. И. Статья // Нар. асвета. –2013. – №5. – С.88 - 91 .",
                "Сайт [Электронный ресурс]. – Режим доступа: https://example.by/a:b. – Дата доступа: 01.02.2024.",
                "Тема : дыс. ... канд. навук .. 2015-2018",
                "");
        for (String s : samples) {
            String once = PunctuationNormalizer.normalize(s);
            assertEquals(once, PunctuationNormalizer.normalize(once), "Not idempotent for: " + s);
        }
    }

    @Test
    void normalize_nullStaysNull() {
        assertNull(PunctuationNormalizer.normalize(null));
    }

    @Test
    void rules_ellipsisIsProtectedFirstAndRestoredLast() {
        var rules = PunctuationNormalizer.rules();

        assertEquals("protect-ellipsis", rules.get(0).name());
        assertEquals("restore-ellipsis", rules.get(rules.size() - 1).name());
    }
}
