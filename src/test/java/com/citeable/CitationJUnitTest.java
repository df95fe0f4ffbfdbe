package com.citeable;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CitationJUnitTest {

    @Test
    void article_missingVolume_failsNamingVariantAndField() {
        ValidationException e = assertThrows(ValidationException.class, () -> Article.builder()
                .author("Smith, John")
                .title("A Paper")
                .year(2020)
                .journal("Nature")
                .build());

        assertEquals("Article", e.variant());
        assertEquals("volume", e.field());
        assertEquals("Article requires 'volume'; received none", e.getMessage());
    }

    @Test
    void article_withVolumeAndPages_succeeds() {
        Article a = Article.builder()
                .author("Smith, John")
                .title("A Paper")
                .year(2020)
                .journal("Nature")
                .volume(7)
                .pages("1--9")
                .build();

        assertEquals(7, a.volume());
        assertEquals("1--9", a.pages());
        assertNull(a.articleNumber());
        assertNull(a.number());
    }

    @Test
    void article_acceptsArticleNumberInsteadOfPages() {
        Article a = Article.builder()
                .author("Smith, John").title("A Paper").year(2020).journal("Nature").volume(7)
                .articleNumber("e42")
                .build();
        assertEquals("e42", a.articleNumber());
    }

    @Test
    void article_withoutPagesOrArticleNumber_fails() {
        ValidationException e = assertThrows(ValidationException.class, () -> Article.builder()
                .author("Smith, John").title("A Paper").year(2020).journal("Nature").volume(7)
                .build());
        assertEquals("pages", e.field());
        assertTrue(e.getMessage().contains("'pages' or 'article_number'"));
    }

    @Test
    void commonFields_areRequired() {
        assertEquals("author", assertThrows(ValidationException.class,
                () -> Misc.builder().title("T").year(2020).build()).field());
        assertEquals("author", assertThrows(ValidationException.class,
                () -> Misc.builder().author(List.of()).title("T").year(2020).build()).field());
        assertEquals("author", assertThrows(ValidationException.class,
                () -> Misc.builder().author("Smith, A", " ").title("T").year(2020).build()).field());
        assertEquals("title", assertThrows(ValidationException.class,
                () -> Misc.builder().author("Smith, A").title("  ").year(2020).build()).field());
        assertEquals("year", assertThrows(ValidationException.class,
                () -> Misc.builder().author("Smith, A").title("T").build()).field());
    }

    @Test
    void variantRequiredFields() {
        assertEquals("publisher", assertThrows(ValidationException.class,
                () -> Book.builder().author("Knuth, Donald").title("TAOCP").year(1997).build()).field());
        assertEquals("booktitle", assertThrows(ValidationException.class,
                () -> InProceedings.builder().author("Doe, John").title("P").year(2023).build()).field());
        assertEquals("institution", assertThrows(ValidationException.class,
                () -> TechReport.builder().author("Turing, Alan").title("P").year(1936).build()).field());
        assertEquals("school", assertThrows(ValidationException.class,
                () -> Thesis.builder().author("Student, A").title("P").year(2022).thesisType("phd").build()).field());
        assertEquals("thesis_type", assertThrows(ValidationException.class,
                () -> Thesis.builder().author("Student, A").title("P").year(2022).school("MIT").build()).field());
    }

    @Test
    void thesis_rejectsUnknownThesisType() {
        ValidationException e = assertThrows(ValidationException.class, () -> Thesis.builder()
                .author("Student, Alice").title("My Thesis").year(2022).school("MIT")
                .thesisType("bachelors")
                .build());
        assertEquals("Thesis", e.variant());
        assertEquals("thesis_type", e.field());
    }

    @Test
    void thesis_typeSelectsTag() {
        Thesis phd = Thesis.builder().author("A, B").title("T").year(2022).school("MIT").thesisType("phd").build();
        Thesis masters = Thesis.builder().author("A, B").title("T").year(2022).school("MIT").thesisType("masters").build();
        assertEquals("phdthesis", phd.tag());
        assertEquals("mastersthesis", masters.tag());
        assertNotEquals(phd, masters);
    }

    @Test
    void optionalFields_defaultToAbsent() {
        Software s = Software.builder().author("Dev, Jane").title("my-tool").year(2024).build();
        assertNull(s.doi());
        assertNull(s.url());
        assertNull(s.note());
        assertNull(s.version());
        assertNull(s.app());
    }

    @Test
    void key_defaultsToGeneratedAndIsNotExplicit() {
        Article a = Fixtures.article();
        assertEquals("Huttley.2025", a.key());
        assertFalse(a.isKeyExplicit());

        Misc m = Misc.builder().author("Smith, A").title("T").year(2024).key("my_custom_key").build();
        assertEquals("my_custom_key", m.key());
        assertTrue(m.isKeyExplicit());
    }

    @Test
    void setKey_marksKeyExplicit_andNullClears() {
        Misc m = Misc.builder().author("Smith, A").title("T").year(2024).build();
        m.setKey("chosen");
        assertEquals("chosen", m.key());
        assertTrue(m.isKeyExplicit());

        m.setKey(null);
        assertNull(m.key());
        assertFalse(m.isKeyExplicit());
    }

    @Test
    void equality_ignoresAppAndKey() {
        Misc a = Misc.builder().author("Smith, A").title("T").year(2024).app("one").build();
        Misc b = Misc.builder().author("Smith, A").title("T").year(2024).app("two").build();
        Misc c = Misc.builder().author("Smith, A").title("T").year(2024).key("other").build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(a, c);
        assertEquals(a.hashCode(), c.hashCode());
    }

    @Test
    void equality_comparesContentAndVariant() {
        Misc misc = Misc.builder().author("Smith, A").title("T").year(2024).build();
        Software software = Software.builder().author("Smith, A").title("T").year(2024).build();
        Misc otherTitle = Misc.builder().author("Smith, A").title("U").year(2024).build();
        Misc withDoi = Misc.builder().author("Smith, A").title("T").year(2024).doi("10.1/x").build();

        assertNotEquals(misc, software);
        assertNotEquals(misc, otherTitle);
        assertNotEquals(misc, withDoi);
    }

    @Test
    void authorOrder_isPreservedAndImmutable() {
        Misc m = Misc.builder().author("B, Second", "A, First").title("T").year(2024).build();
        assertEquals(List.of("B, Second", "A, First"), m.author());
        assertThrows(UnsupportedOperationException.class, () -> m.author().add("C, Third"));
    }

    @Test
    void summary_multipleAuthorsAndLongTitle() {
        Citation.Summary s = Fixtures.article().summary();
        assertEquals("diverse-seq", s.app());
        assertTrue(s.citation().startsWith("Huttley et al. 2025 diverse-seq"));
        assertTrue(s.citation().endsWith("…"));
    }

    @Test
    void summary_singleAuthorShortTitleNoApp() {
        Citation.Summary s = Misc.builder().author("Smith, Jane").title("Short title").year(2024).build().summary();
        assertEquals("", s.app());
        assertEquals("Smith 2024 Short title", s.citation());
    }

    @Test
    void toString_listsPopulatedFieldsAndExplicitKeyOnly() {
        Misc auto = Misc.builder().author("Smith, A").title("Thing").year(2024).build();
        assertEquals("Misc{author=[Smith, A], title=Thing, year=2024}", auto.toString());

        Misc explicit = Misc.builder().author("Smith, A").title("Thing").year(2024).key("k").build();
        assertTrue(explicit.toString().startsWith("Misc{key=k, "));
    }
}
