package com.citeable;

/**
 * One field of a variant's schema.
 *
 * @param name     BibTeX field name, lower case
 * @param type     value shape
 * @param required whether construction fails without it
 * @param written  whether the field appears in a serialized record
 */
public record FieldSpec(String name, FieldType type, boolean required, boolean written) {

    static FieldSpec required(String name, FieldType type) {
        return new FieldSpec(name, type, true, true);
    }

    static FieldSpec optional(String name, FieldType type) {
        return new FieldSpec(name, type, false, true);
    }

    /** Required, compared and exported to JSON, but consumed by the record's type tag instead of being written. */
    static FieldSpec unwritten(String name, FieldType type) {
        return new FieldSpec(name, type, true, false);
    }
}
