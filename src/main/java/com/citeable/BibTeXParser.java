package com.citeable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads one BibTeX record into a validated {@link Citation}.
 *
 * <p>The scanner works character by character rather than by regex, so that it can:
 * <ul>
 *   <li>Handle nested braces inside field values</li>
 *   <li>Ignore braces that occur inside top-level quoted values</li>
 *   <li>Handle escaped characters ({@code \{}, {@code \"})</li>
 *   <li>Accept both {@code @type{...}} and {@code @type(...)} bodies</li>
 *   <li>Skip @comment/@preamble/@string (not reference entries)</li>
 * </ul>
 *
 * <p>Fields the variant does not declare are ignored. Required fields are not defaulted: a
 * record without one fails validation exactly as direct construction would.
 */
public final class BibTeXParser {

    private BibTeXParser() {
    }

    /**
     * Parses text holding exactly one record.
     *
     * @throws BibTeXParseException if there is not exactly one record, braces do not balance, the
     *                              type is unsupported, or an integer field is not numeric
     * @throws ValidationException  if the record lacks a field its variant requires
     */
    public static Citation parse(String input) {
        List<RawRecord> records = scanRecords(input);
        if (records.isEmpty()) {
            throw new BibTeXParseException("No BibTeX entry found");
        }
        if (records.size() > 1) {
            throw new BibTeXParseException("Multiple BibTeX entries found (" + records.size() + "); expected exactly one");
        }
        return toCitation(records.get(0));
    }

    /**
     * A raw record: lower-cased type, key, and the field text between the key's comma and the
     * closing delimiter.
     */
    record RawRecord(String type, String key, String body, int index) {}

    static List<RawRecord> scanRecords(String input) {
        List<RawRecord> records = new ArrayList<>();
        if (input == null || input.isEmpty()) {
            return records;
        }

        int n = input.length();
        int i = 0;
        int outside = 0;

        while (i < n) {
            int at = input.indexOf('@', i);
            if (at < 0) break;

            int typeStart = at + 1;
            while (typeStart < n && Character.isWhitespace(input.charAt(typeStart))) typeStart++;

            int typeEnd = typeStart;
            while (typeEnd < n && isNameChar(input.charAt(typeEnd))) typeEnd++;

            if (typeEnd == typeStart) {
                // Not really an entry; skip this '@'
                i = at + 1;
                continue;
            }

            String type = input.substring(typeStart, typeEnd).toLowerCase(Locale.ROOT);

            int j = typeEnd;
            while (j < n && Character.isWhitespace(input.charAt(j))) j++;
            if (j >= n) break;

            char open = input.charAt(j);
            if (open != '{' && open != '(') {
                // Not an entry body
                i = j;
                continue;
            }
            char close = (open == '{') ? '}' : ')';

            // Key runs to the first comma outside braces.
            int k = j + 1;
            while (k < n && Character.isWhitespace(input.charAt(k))) k++;
            int keyStart = k;
            int nested = 0;
            boolean escaped = false;
            while (k < n) {
                char c = input.charAt(k);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '{') {
                    nested++;
                } else if (c == '}' && nested > 0) {
                    nested--;
                } else if (nested == 0 && (c == ',' || c == close)) {
                    break;
                }
                k++;
            }
            String key = k > keyStart ? input.substring(keyStart, k).trim() : "";

            // Find the delimiter closing the entry. Quotes only delimit values at the top level.
            int depth = 1;
            int braces = 0; // value braces inside a paren-delimited entry
            int p = j + 1;
            boolean inQuotes = false;
            escaped = false;
            while (p < n && depth > 0) {
                char c = input.charAt(p);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"' && depth == 1 && braces == 0) {
                    inQuotes = !inQuotes;
                } else if (!inQuotes) {
                    if (open == '(') {
                        if (c == '{') braces++;
                        else if (c == '}' && braces > 0) braces--;
                        else if (braces == 0 && c == '(') depth++;
                        else if (braces == 0 && c == ')') depth--;
                    } else if (c == '{') {
                        depth++;
                    } else if (c == '}') {
                        depth--;
                    }
                }
                p++;
            }

            if (depth != 0) {
                throw new BibTeXParseException("Unclosed entry starting at index " + at + " (@" + type + "): unbalanced braces");
            }

            requireNoStrayBraces(input, outside, at);
            outside = p;
            i = p;

            // Skip non-reference constructs
            if (type.equals("comment") || type.equals("preamble") || type.equals("string")) {
                continue;
            }
            if (key.isEmpty()) {
                throw new BibTeXParseException("Entry without key at index " + at + " (@" + type + ")");
            }

            String body = (k < p - 1 && input.charAt(k) == ',') ? input.substring(k + 1, p - 1) : "";
            records.add(new RawRecord(type, key, body, at));
        }

        requireNoStrayBraces(input, outside, n);
        return records;
    }

    /**
     * Parses the field list of a record body into lower-cased names and values. Braced and quoted
     * values are kept exactly as written between their delimiters; bare values are trimmed. The
     * first occurrence of a repeated field wins.
     *
     * <p>Supports:
     * <ul>
     *   <li>field = { ... } with nested braces</li>
     *   <li>field = "..." with escaped quotes</li>
     *   <li>field = bareValue (until comma or end of body)</li>
     * </ul>
     */
    static Map<String, String> parseFields(String body) {
        Map<String, String> fields = new LinkedHashMap<>();
        int n = body.length();
        int i = 0;

        while (i < n) {
            char c = body.charAt(i);
            if (Character.isWhitespace(c) || c == ',') {
                i++;
                continue;
            }

            int nameStart = i;
            while (i < n && isNameChar(body.charAt(i))) i++;
            if (i == nameStart) {
                throw new BibTeXParseException("Unexpected '" + c + "' where a field name was expected");
            }
            String name = body.substring(nameStart, i).toLowerCase(Locale.ROOT);

            while (i < n && Character.isWhitespace(body.charAt(i))) i++;
            if (i >= n || body.charAt(i) != '=') {
                throw new BibTeXParseException("Expected '=' after field '" + name + "'");
            }
            i++;
            while (i < n && Character.isWhitespace(body.charAt(i))) i++;
            if (i >= n) {
                throw new BibTeXParseException("Field '" + name + "' has no value");
            }

            char open = body.charAt(i);
            String value;
            if (open == '{') {
                int depth = 1;
                int p = i + 1;
                boolean esc = false;
                while (p < n && depth > 0) {
                    char pc = body.charAt(p);
                    if (esc) {
                        esc = false;
                    } else if (pc == '\\') {
                        esc = true;
                    } else if (pc == '{') {
                        depth++;
                    } else if (pc == '}') {
                        depth--;
                    }
                    p++;
                }
                if (depth != 0) {
                    throw new BibTeXParseException("Unbalanced braces in field '" + name + "'");
                }
                value = body.substring(i + 1, p - 1);
                i = p;
            } else if (open == '"') {
                int p = i + 1;
                boolean esc = false;
                while (p < n) {
                    char pc = body.charAt(p);
                    if (esc) {
                        esc = false;
                    } else if (pc == '\\') {
                        esc = true;
                    } else if (pc == '"') {
                        break;
                    }
                    p++;
                }
                if (p >= n) {
                    throw new BibTeXParseException("Unterminated quoted value in field '" + name + "'");
                }
                value = body.substring(i + 1, p);
                i = p + 1;
            } else {
                int p = i;
                while (p < n && body.charAt(p) != ',') p++;
                value = body.substring(i, p).trim();
                i = p;
            }

            fields.putIfAbsent(name, value);
        }

        return fields;
    }

    private static Citation toCitation(RawRecord r) {
        EntryType type = EntryType.fromTag(r.type());
        if (type == null) {
            throw new BibTeXParseException("Unsupported BibTeX entry type '" + r.type() + "' at index " + r.index());
        }

        Citation.Builder<?> b = type.newBuilder().key(r.key());
        if (type == EntryType.THESIS) {
            b.field("thesis_type", Thesis.thesisTypeForTag(r.type()));
        }

        for (Map.Entry<String, String> field : parseFields(r.body()).entrySet()) {
            FieldSpec spec = type.schema().field(field.getKey());
            // Unknown fields and empty values are left unset
            if (spec == null || !spec.written() || field.getValue().isBlank()) continue;
            b.field(spec.name(), coerce(spec, field.getValue(), r));
        }

        return b.build();
    }

    private static Object coerce(FieldSpec spec, String raw, RawRecord r) {
        try {
            return spec.type().fromText(raw);
        } catch (NumberFormatException e) {
            throw new BibTeXParseException("Field '" + spec.name() + "' of @" + r.type() + "{" + r.key()
                    + "} must be an integer; got '" + raw + "'", e);
        }
    }

    private static void requireNoStrayBraces(String input, int from, int to) {
        for (int x = from; x < to; x++) {
            char c = input.charAt(x);
            if (c == '{' || c == '}') {
                throw new BibTeXParseException("Unbalanced braces: stray '" + c + "' at index " + x);
            }
        }
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }
}
