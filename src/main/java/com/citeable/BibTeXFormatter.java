package com.citeable;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a citation as one BibTeX record.
 *
 * <p>Output is a pure function of the citation's tag, key and field values: fields appear in
 * schema order, absent optional fields are omitted, {@code app} and {@code thesis_type} never
 * appear.
 * <pre>
 * &#64;article{Huttley.2025,
 *   author    = {Huttley, Gavin and Caley, Katherine},
 *   title     = {diverse-seq},
 *   ...
 * }
 * </pre>
 */
public final class BibTeXFormatter {

    private BibTeXFormatter() {
    }

    /**
     * @throws ValidationException if the citation's key has been cleared, or the key or a field
     *                             value could not be read back from the record
     */
    public static String format(Citation citation) {
        String variant = citation.type().displayName();
        String key = citation.key();
        if (key == null || key.isBlank()) {
            throw ValidationException.missing(variant, "key");
        }
        requireWritableKey(variant, key);

        List<String> lines = new ArrayList<>();
        lines.add("@" + citation.tag() + "{" + key + ",");
        for (FieldSpec f : citation.type().schema().fields()) {
            if (!f.written()) continue;
            Object value = citation.get(f.name());
            if (value == null) continue;
            String text = f.type().toText(value);
            requireWritableValue(variant, f.name(), text);
            lines.add(field(f.name(), text));
        }
        lines.add("}");
        return String.join("\n", lines);
    }

    static String field(String name, String value) {
        return String.format("  %-10s= {%s},", name, value);
    }

    /** Keys end at the first comma or brace and may not hold whitespace, quotes or backslashes. */
    static void requireWritableKey(String variant, String key) {
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == ',' || c == '{' || c == '}' || c == '"' || c == '\\' || Character.isWhitespace(c)) {
                throw new ValidationException(variant, "key",
                        variant + " key '" + key + "' cannot be written to BibTeX: contains '" + c + "'");
            }
        }
    }

    /**
     * A braced value must balance its unescaped braces and must not end in an unpaired backslash,
     * which would escape the closing brace.
     */
    static void requireWritableValue(String variant, String field, String value) {
        int depth = 0;
        boolean escaped = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}' && --depth < 0) {
                break;
            }
        }
        if (depth != 0) {
            throw new ValidationException(variant, field,
                    variant + " field '" + field + "' cannot be written to BibTeX: unbalanced braces");
        }
        if (escaped) {
            throw new ValidationException(variant, field,
                    variant + " field '" + field + "' cannot be written to BibTeX: ends with a backslash");
        }
    }
}
