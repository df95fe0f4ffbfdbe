package com.citeable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.citeable.FieldType.INTEGER;
import static com.citeable.FieldType.NAME_LIST;
import static com.citeable.FieldType.STRING;

/**
 * Declares, per variant, which fields exist, their shape, and whether they are required.
 *
 * <p>Field order is significant: it is the order fields are validated, compared and written.
 */
public final class FieldSchema {

    private static final FieldSpec AUTHOR = FieldSpec.required("author", NAME_LIST);
    private static final FieldSpec TITLE = FieldSpec.required("title", STRING);
    private static final FieldSpec YEAR = FieldSpec.required("year", INTEGER);
    private static final FieldSpec DOI = FieldSpec.optional("doi", STRING);
    private static final FieldSpec URL = FieldSpec.optional("url", STRING);
    private static final FieldSpec NOTE = FieldSpec.optional("note", STRING);

    public static final FieldSchema ARTICLE = new FieldSchema("Article",
            AUTHOR, TITLE,
            FieldSpec.required("journal", STRING),
            YEAR,
            FieldSpec.required("volume", INTEGER),
            FieldSpec.optional("number", INTEGER),
            FieldSpec.optional("pages", STRING),
            FieldSpec.optional("article_number", STRING),
            DOI, URL, NOTE);

    public static final FieldSchema BOOK = new FieldSchema("Book",
            AUTHOR, TITLE,
            FieldSpec.required("publisher", STRING),
            YEAR,
            FieldSpec.optional("edition", STRING),
            FieldSpec.optional("editor", NAME_LIST),
            DOI, URL, NOTE);

    public static final FieldSchema IN_PROCEEDINGS = new FieldSchema("InProceedings",
            AUTHOR, TITLE,
            FieldSpec.required("booktitle", STRING),
            YEAR,
            FieldSpec.optional("pages", STRING),
            FieldSpec.optional("publisher", STRING),
            FieldSpec.optional("editor", NAME_LIST),
            DOI, URL, NOTE);

    public static final FieldSchema TECH_REPORT = new FieldSchema("TechReport",
            AUTHOR, TITLE,
            FieldSpec.required("institution", STRING),
            YEAR,
            // report numbers are identifiers like "TR-42", not integers
            FieldSpec.optional("number", STRING),
            DOI, URL, NOTE);

    public static final FieldSchema THESIS = new FieldSchema("Thesis",
            AUTHOR, TITLE,
            FieldSpec.required("school", STRING),
            YEAR,
            FieldSpec.unwritten("thesis_type", STRING),
            DOI, URL, NOTE);

    public static final FieldSchema SOFTWARE = new FieldSchema("Software",
            AUTHOR, TITLE, YEAR,
            FieldSpec.optional("publisher", STRING),
            FieldSpec.optional("version", STRING),
            FieldSpec.optional("license", STRING),
            DOI, URL, NOTE);

    public static final FieldSchema MISC = new FieldSchema("Misc",
            AUTHOR, TITLE, YEAR,
            DOI, URL, NOTE);

    private final String variant;
    private final List<FieldSpec> fields;
    private final Map<String, FieldSpec> byName;

    private FieldSchema(String variant, FieldSpec... fields) {
        this.variant = variant;
        this.fields = List.of(fields);
        Map<String, FieldSpec> index = new LinkedHashMap<>();
        for (FieldSpec f : fields) {
            index.put(f.name(), f);
        }
        this.byName = Collections.unmodifiableMap(index);
    }

    public String variant() {
        return variant;
    }

    public List<FieldSpec> fields() {
        return fields;
    }

    /**
     * @return the spec for {@code name}, or null if this variant has no such field
     */
    public FieldSpec field(String name) {
        return name == null ? null : byName.get(name);
    }

    /**
     * Checks every required field of {@code citation} in schema order.
     *
     * @throws ValidationException naming the first required field that is null, blank or an empty list
     */
    void requireFields(Citation citation) {
        for (FieldSpec f : fields) {
            if (f.required() && isAbsent(citation.get(f.name()))) {
                throw ValidationException.missing(variant, f.name());
            }
        }
    }

    static boolean isAbsent(Object value) {
        if (value == null) return true;
        if (value instanceof String s) return s.isBlank();
        if (value instanceof List<?> list) {
            if (list.isEmpty()) return true;
            for (Object name : list) {
                if (name == null || name.toString().isBlank()) return true;
            }
        }
        return false;
    }
}
