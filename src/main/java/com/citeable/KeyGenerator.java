package com.citeable;

import java.util.List;
import java.util.Locale;

/**
 * Derives the default citation key, {@code "Surname.Year"}, from the first author.
 *
 * <p>Pure and deterministic: the result depends only on {@code author[0]} and {@code year}.
 */
public final class KeyGenerator {

    /** Used when the first author's surname has no ASCII letters left after cleaning. */
    static final String ANONYMOUS = "Anon";

    private KeyGenerator() {
    }

    public static String generateKey(Citation citation) {
        return generateKey(citation.author(), citation.year());
    }

    public static String generateKey(List<String> authors, int year) {
        return cleanSurname(AuthorNames.surname(authors.get(0))) + "." + year;
    }

    /**
     * Drops non-ASCII and whitespace characters, then upper-cases the first character and
     * lower-cases the rest.
     */
    static String cleanSurname(String surname) {
        StringBuilder sb = new StringBuilder(surname.length());
        for (int i = 0; i < surname.length(); i++) {
            char c = surname.charAt(i);
            if (c < 128 && !Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        if (sb.length() == 0) return ANONYMOUS;
        String cleaned = sb.toString();
        return cleaned.substring(0, 1).toUpperCase(Locale.ROOT) + cleaned.substring(1).toLowerCase(Locale.ROOT);
    }
}
