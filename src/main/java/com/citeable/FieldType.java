package com.citeable;

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Value shapes a citation field can take.
 */
public enum FieldType {
    STRING,
    INTEGER,
    /** Ordered person names in "Surname, Given" form, written joined by " and ". */
    NAME_LIST;

    private static final Pattern ASCII_INTEGER = Pattern.compile("[+-]?[0-9]+");

    /**
     * Converts a raw BibTeX field value to this shape.
     *
     * @throws NumberFormatException if an INTEGER field holds non-numeric text
     */
    Object fromText(String raw) {
        return switch (this) {
            case STRING -> raw;
            case INTEGER -> parseInteger(raw);
            case NAME_LIST -> AuthorNames.parseList(raw);
        };
    }

    String toText(Object value) {
        if (this == NAME_LIST) {
            return AuthorNames.join(asNames(value));
        }
        return String.valueOf(value);
    }

    /**
     * Converts a value decoded by Jackson (String, Number or List) to this shape. Numbers must be
     * integral and fit in an int.
     */
    Object fromJson(Object value) {
        if (value == null) return null;
        return switch (this) {
            case STRING -> value.toString();
            case INTEGER -> value instanceof Number n ? exactInteger(n) : parseInteger(value.toString());
            case NAME_LIST -> value instanceof List<?> l
                    ? l.stream().map(String::valueOf).toList()
                    : AuthorNames.parseList(value.toString());
        };
    }

    /** Accepts an optional sign followed by ASCII digits only. */
    static int parseInteger(String raw) {
        String s = raw.trim();
        if (!ASCII_INTEGER.matcher(s).matches()) {
            throw new NumberFormatException("For input string: \"" + s + "\"");
        }
        return Integer.parseInt(s);
    }

    static int exactInteger(Number n) {
        try {
            return new BigDecimal(n.toString()).intValueExact();
        } catch (ArithmeticException e) {
            NumberFormatException nfe = new NumberFormatException("Not an int: " + n);
            nfe.initCause(e);
            throw nfe;
        }
    }

    @SuppressWarnings("unchecked")
    static List<String> asNames(Object value) {
        return (List<String>) value;
    }
}
