package com.citeable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Joins citations from many contributors into one {@code .bib} file body.
 *
 * <p>Citations are first passed through {@link CollisionResolver}, then formatted one record each,
 * with exactly one blank line between records.
 */
public final class BibliographyWriter {

    private static final Logger log = LoggerFactory.getLogger(BibliographyWriter.class);

    private final Charset charset;

    public BibliographyWriter() {
        this(StandardCharsets.UTF_8);
    }

    public BibliographyWriter(Charset charset) {
        this.charset = charset == null ? StandardCharsets.UTF_8 : charset;
    }

    /**
     * @return the bibliography text, newline-terminated, or the empty string for no citations
     */
    public static String toBibliography(List<? extends Citation> citations) {
        return render(CollisionResolver.assignUniqueKeys(citations));
    }

    /**
     * Resolves keys, formats, and writes the bibliography to {@code path}, replacing any existing
     * file.
     *
     * @return the citations as written, with their resolved keys
     */
    public List<Citation> write(List<? extends Citation> citations, Path path) throws IOException {
        List<Citation> resolved = CollisionResolver.assignUniqueKeys(citations);
        Files.writeString(path, render(resolved), charset);
        log.info("Wrote {} citation(s) to {}", resolved.size(), path);
        return resolved;
    }

    private static String render(List<Citation> resolved) {
        if (resolved.isEmpty()) return "";
        List<String> records = new ArrayList<>(resolved.size());
        for (Citation c : resolved) {
            records.add(BibTeXFormatter.format(c));
        }
        return String.join("\n\n", records) + "\n";
    }
}
