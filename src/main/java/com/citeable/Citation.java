package com.citeable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A structured bibliographic citation.
 *
 * <p>Each concrete subclass is one variant of a closed set (see {@link EntryType}) and is built
 * through its {@code builder()}. A citation is validated when built: no instance is ever observable
 * with a required field missing.
 *
 * <p>Identity rules:
 * <ul>
 *   <li>{@link #equals(Object)} and {@link #hashCode()} compare every schema field and ignore
 *   {@code key} and {@code app}.</li>
 *   <li>The key is the only mutable field. Left unset, it is generated from the first author and the
 *   year, and the generated key never counts as explicit.</li>
 *   <li>{@code app} names the plugin that contributed the citation. It is never serialized to BibTeX.</li>
 * </ul>
 */
public abstract class Citation {

    private static final int EXCERPT_LENGTH = 50;

    private final List<String> author;
    private final String title;
    private final Integer year;
    private final String doi;
    private final String url;
    private final String note;
    private final String app;

    private String key;
    private String explicitKey;

    protected Citation(Builder<?> b) {
        this.author = b.author == null ? null : Collections.unmodifiableList(new ArrayList<>(b.author));
        this.title = b.title;
        this.year = b.year;
        this.doi = b.doi;
        this.url = b.url;
        this.note = b.note;
        this.app = b.app;
        String k = (b.key == null || b.key.isBlank()) ? null : b.key;
        this.key = k;
        this.explicitKey = k;
    }

    /**
     * Runs schema and variant checks, then fills in the generated key if none was supplied.
     * Subclass constructors call this once all of their own fields are set.
     */
    protected final void validate() {
        type().schema().requireFields(this);
        validateVariant();
        if (key == null) {
            key = KeyGenerator.generateKey(this);
        }
    }

    /** Checks that go beyond "required field present". */
    protected void validateVariant() {
    }

    public abstract EntryType type();

    /** BibTeX entry type written in the record's opening line. */
    public String tag() {
        return type().displayName().toLowerCase(Locale.ROOT);
    }

    /**
     * Value of a schema field by its BibTeX name, or null if unset or unknown to this variant.
     */
    public Object get(String name) {
        return switch (name) {
            case "author" -> author;
            case "title" -> title;
            case "year" -> year;
            case "doi" -> doi;
            case "url" -> url;
            case "note" -> note;
            default -> null;
        };
    }

    public List<String> author() {
        return author;
    }

    public String title() {
        return title;
    }

    public int year() {
        return year;
    }

    public String doi() {
        return doi;
    }

    public String url() {
        return url;
    }

    public String note() {
        return note;
    }

    public String app() {
        return app;
    }

    public String key() {
        return key;
    }

    /**
     * Replaces the key. A key set here is treated as chosen by the caller, so
     * {@link CollisionResolver} keeps it as the base key instead of regenerating one.
     * Passing null clears it.
     */
    public void setKey(String key) {
        String k = (key == null || key.isBlank()) ? null : key;
        this.key = k;
        this.explicitKey = k;
    }

    public boolean isKeyExplicit() {
        return explicitKey != null;
    }

    String explicitKey() {
        return explicitKey;
    }

    /** Sets the current key without changing whether the citation has an explicit key. */
    void assignKey(String key) {
        this.key = key;
    }

    /**
     * A validated copy carrying the same key and the same explicit/generated key status.
     */
    Citation copy() {
        Builder<?> b = type().newBuilder();
        for (FieldSpec f : type().schema().fields()) {
            Object v = get(f.name());
            if (v != null) b.field(f.name(), v);
        }
        Citation c = b.key(explicitKey).app(app).build();
        c.key = key;
        return c;
    }

    public String toBibTeX() {
        return BibTeXFormatter.format(this);
    }

    /**
     * Short form for listings: {@code ("diverse-seq", "Huttley et al. 2025 diverse-seq: an ...")}.
     */
    public Summary summary() {
        String surname = AuthorNames.surname(author.get(0));
        String who = author.size() > 1 ? surname + " et al." : surname;
        String excerpt = title.length() <= EXCERPT_LENGTH
                ? title
                : title.substring(0, EXCERPT_LENGTH) + "…";
        return new Summary(app == null ? "" : app, who + " " + year + " " + excerpt);
    }

    public record Summary(String app, String citation) {}

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Citation other = (Citation) o;
        for (FieldSpec f : type().schema().fields()) {
            if (!Objects.equals(get(f.name()), other.get(f.name()))) return false;
        }
        return true;
    }

    @Override
    public final int hashCode() {
        int h = type().ordinal();
        for (FieldSpec f : type().schema().fields()) {
            h = 31 * h + Objects.hashCode(get(f.name()));
        }
        return h;
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        if (explicitKey != null) parts.add("key=" + key);
        for (FieldSpec f : type().schema().fields()) {
            Object v = get(f.name());
            if (v != null) parts.add(f.name() + "=" + v);
        }
        return type().displayName() + "{" + String.join(", ", parts) + "}";
    }

    /**
     * Collects fields for one variant; {@link #build()} validates.
     *
     * @param <B> the concrete builder, for chaining
     */
    public abstract static class Builder<B extends Builder<B>> {

        private List<String> author;
        private String title;
        private Integer year;
        private String doi;
        private String url;
        private String note;
        private String key;
        private String app;

        protected Builder() {
        }

        public B author(List<String> author) {
            this.author = author;
            return self();
        }

        public B author(String... author) {
            this.author = Arrays.asList(author);
            return self();
        }

        public B title(String title) {
            this.title = title;
            return self();
        }

        public B year(int year) {
            this.year = year;
            return self();
        }

        public B doi(String doi) {
            this.doi = doi;
            return self();
        }

        public B url(String url) {
            this.url = url;
            return self();
        }

        public B note(String note) {
            this.note = note;
            return self();
        }

        public B key(String key) {
            this.key = key;
            return self();
        }

        public B app(String app) {
            this.app = app;
            return self();
        }

        /**
         * Sets a field by its BibTeX name. {@code value} must already have the field's
         * {@link FieldType} shape (String, Integer or List of String). Names the variant does not
         * declare are ignored.
         */
        public B field(String name, Object value) {
            switch (name) {
                case "author" -> author = FieldType.asNames(value);
                case "title" -> title = (String) value;
                case "year" -> year = (Integer) value;
                case "doi" -> doi = (String) value;
                case "url" -> url = (String) value;
                case "note" -> note = (String) value;
                default -> variantField(name, value);
            }
            return self();
        }

        protected void variantField(String name, Object value) {
        }

        protected abstract B self();

        /**
         * @throws ValidationException if a required field is missing or malformed
         */
        public abstract Citation build();
    }
}
