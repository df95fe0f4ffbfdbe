package com.citeable;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeyGeneratorJUnitTest {

    @Test
    void generateKey_surnameBeforeComma() {
        assertEquals("Huttley.2025", KeyGenerator.generateKey(Fixtures.article()));
    }

    @Test
    void generateKey_lastTokenWithoutComma() {
        Misc m = Misc.builder().author("Jane Smith").title("T").year(2024).build();
        assertEquals("Smith.2024", KeyGenerator.generateKey(m));
    }

    @Test
    void generateKey_titleCasesAndStripsNonAsciiAndWhitespace() {
        assertEquals("Mcarthur.2020", KeyGenerator.generateKey(List.of("McArthur, Robert"), 2020));
        assertEquals("Vandenberg.2020", KeyGenerator.generateKey(List.of("van den Berg, Jan"), 2020));
        assertEquals("Mller.2019", KeyGenerator.generateKey(List.of("Müller, Hans"), 2019));
        assertEquals("Aristotle.2024", KeyGenerator.generateKey(List.of("Aristotle"), 2024));
    }

    @Test
    void generateKey_onlyFirstAuthorAndYearMatter() {
        assertEquals(
                KeyGenerator.generateKey(List.of("Smith, A", "Jones, B"), 2024),
                KeyGenerator.generateKey(List.of("Smith, Z"), 2024));
    }

    @Test
    void generateKey_isDeterministic() {
        Article a = Fixtures.article();
        assertEquals(KeyGenerator.generateKey(a), KeyGenerator.generateKey(a));
    }

    @Test
    void generateKey_fallsBackWhenNoAsciiRemains() {
        assertEquals("Anon.2001", KeyGenerator.generateKey(List.of("李, 小龙"), 2001));
    }

    @Test
    void authorNames_normalizeOnlyTwoTokenNames() {
        assertEquals("Smith, John", AuthorNames.normalize("John Smith"));
        assertEquals("Huttley, Gavin", AuthorNames.normalize("Huttley, Gavin"));
        assertEquals("Aristotle", AuthorNames.normalize("Aristotle"));
        assertEquals("Jan van der Berg", AuthorNames.normalize("Jan van der Berg"));
    }

    @Test
    void authorNames_parseListSplitsOnAnd() {
        assertEquals(List.of("Plato", "Smith, Jane"), AuthorNames.parseList("Plato and Jane Smith"));
        assertEquals(List.of("Anderson, Pam"), AuthorNames.parseList("Anderson, Pam"));
    }
}
