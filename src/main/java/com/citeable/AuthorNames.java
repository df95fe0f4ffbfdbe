package com.citeable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Helpers for person-name lists as they appear in {@code author} and {@code editor} fields.
 */
final class AuthorNames {

    private static final Pattern AND = Pattern.compile(Pattern.quote(" and "));

    private AuthorNames() {
    }

    /**
     * The text before the first comma, or the last whitespace-delimited token when there is no comma.
     */
    static String surname(String name) {
        String n = name.trim();
        int comma = n.indexOf(',');
        if (comma >= 0) {
            return n.substring(0, comma).trim();
        }
        String[] tokens = n.split("\\s+");
        return tokens[tokens.length - 1];
    }

    /**
     * Rewrites {@code "First Last"} to {@code "Last, First"}.
     *
     * <p>Names that already hold a comma are kept. Anything other than exactly two tokens
     * ("Aristotle", "Jan van der Berg") is kept verbatim, since the surname boundary is ambiguous.
     */
    static String normalize(String name) {
        String n = name.trim();
        if (n.contains(",")) return n;
        String[] tokens = n.split("\\s+");
        if (tokens.length == 2) {
            return tokens[1] + ", " + tokens[0];
        }
        return n;
    }

    /**
     * Splits a raw {@code author}/{@code editor} value into normalized names. Line breaks and runs
     * of whitespace count as a single space.
     */
    static List<String> parseList(String raw) {
        List<String> names = new ArrayList<>();
        for (String part : AND.split(raw.replaceAll("\\s+", " ").trim(), -1)) {
            names.add(normalize(part));
        }
        return names;
    }

    static String join(List<String> names) {
        return String.join(" and ", names);
    }
}
