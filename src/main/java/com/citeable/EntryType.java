package com.citeable;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * The closed set of citation variants.
 */
public enum EntryType {
    ARTICLE(FieldSchema.ARTICLE, Article::builder),
    BOOK(FieldSchema.BOOK, Book::builder),
    IN_PROCEEDINGS(FieldSchema.IN_PROCEEDINGS, InProceedings::builder),
    TECH_REPORT(FieldSchema.TECH_REPORT, TechReport::builder),
    THESIS(FieldSchema.THESIS, Thesis::builder),
    SOFTWARE(FieldSchema.SOFTWARE, Software::builder),
    MISC(FieldSchema.MISC, Misc::builder);

    private final FieldSchema schema;
    private final Supplier<? extends Citation.Builder<?>> builders;

    EntryType(FieldSchema schema, Supplier<? extends Citation.Builder<?>> builders) {
        this.schema = schema;
        this.builders = builders;
    }

    /** Variant name, e.g. {@code "InProceedings"}. */
    public String displayName() {
        return schema.variant();
    }

    public FieldSchema schema() {
        return schema;
    }

    public Citation.Builder<?> newBuilder() {
        return builders.get();
    }

    /**
     * Maps a BibTeX entry type (case-insensitive) to its variant.
     *
     * @return the variant, or null for an unsupported tag
     */
    public static EntryType fromTag(String tag) {
        if (tag == null) return null;
        return switch (tag.trim().toLowerCase(Locale.ROOT)) {
            case "article" -> ARTICLE;
            case "book" -> BOOK;
            case "inproceedings" -> IN_PROCEEDINGS;
            case "techreport" -> TECH_REPORT;
            case "phdthesis", "mastersthesis" -> THESIS;
            case "software" -> SOFTWARE;
            case "misc" -> MISC;
            default -> null;
        };
    }

    /**
     * @return the variant whose {@link #displayName()} is {@code name}, or null
     */
    public static EntryType fromName(String name) {
        for (EntryType t : values()) {
            if (t.displayName().equals(name)) return t;
        }
        return null;
    }
}
