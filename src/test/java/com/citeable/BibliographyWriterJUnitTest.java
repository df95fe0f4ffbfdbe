package com.citeable;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BibliographyWriterJUnitTest {

    private static Misc misc(String author, String title) {
        return Misc.builder().author(author).title(title).year(2024).build();
    }

    @Test
    void toBibliography_resolvesKeysAndSeparatesRecordsWithOneBlankLine() {
        String out = BibliographyWriter.toBibliography(List.of(
                misc("Smith, Jane", "First"),
                misc("Smith, Jane", "Second"),
                misc("Smith, Jane", "First")));

        String expected = """
                @misc{Smith.2024.a,
                  author    = {Smith, Jane},
                  title     = {First},
                  year      = {2024},
                }

                @misc{Smith.2024.b,
                  author    = {Smith, Jane},
                  title     = {Second},
                  year      = {2024},
                }
                """;
        assertEquals(expected, out);
    }

    @Test
    void toBibliography_empty() {
        assertEquals("", BibliographyWriter.toBibliography(List.of()));
    }

    @Test
    void write_createsFileAndReturnsResolvedCitations(@TempDir Path dir) throws Exception {
        Path bib = dir.resolve("refs.bib");
        List<Citation> input = Fixtures.allTypes();

        List<Citation> written = new BibliographyWriter().write(input, bib);

        String content = Files.readString(bib, StandardCharsets.UTF_8);
        assertEquals(BibliographyWriter.toBibliography(input), content);
        assertEquals(input.size(), written.size());
        for (Citation c : written) {
            assertTrue(content.contains("{" + c.key() + ",\n"), c.key());
        }
    }

    @Test
    void write_recordsParseBackIndividually(@TempDir Path dir) throws Exception {
        Path bib = dir.resolve("refs.bib");
        List<Citation> input = Fixtures.allTypes();
        new BibliographyWriter(StandardCharsets.UTF_8).write(input, bib);

        String[] records = Files.readString(bib).split("\n\n");
        assertEquals(input.size(), records.length);
        for (int i = 0; i < records.length; i++) {
            assertEquals(input.get(i), BibTeXParser.parse(records[i]));
        }
    }
}
