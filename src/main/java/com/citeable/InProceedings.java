package com.citeable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A conference paper ({@code @inproceedings}). Requires {@code booktitle}.
 */
public final class InProceedings extends Citation {

    private final String booktitle;
    private final String pages;
    private final String publisher;
    private final List<String> editor;

    private InProceedings(Builder b) {
        super(b);
        this.booktitle = b.booktitle;
        this.pages = b.pages;
        this.publisher = b.publisher;
        this.editor = b.editor == null ? null : Collections.unmodifiableList(new ArrayList<>(b.editor));
        validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public EntryType type() {
        return EntryType.IN_PROCEEDINGS;
    }

    @Override
    public Object get(String name) {
        return switch (name) {
            case "booktitle" -> booktitle;
            case "pages" -> pages;
            case "publisher" -> publisher;
            case "editor" -> editor;
            default -> super.get(name);
        };
    }

    public String booktitle() {
        return booktitle;
    }

    public String pages() {
        return pages;
    }

    public String publisher() {
        return publisher;
    }

    public List<String> editor() {
        return editor;
    }

    public static final class Builder extends Citation.Builder<Builder> {

        private String booktitle;
        private String pages;
        private String publisher;
        private List<String> editor;

        private Builder() {
        }

        public Builder booktitle(String booktitle) {
            this.booktitle = booktitle;
            return this;
        }

        public Builder pages(String pages) {
            this.pages = pages;
            return this;
        }

        public Builder publisher(String publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder editor(List<String> editor) {
            this.editor = editor;
            return this;
        }

        public Builder editor(String... editor) {
            this.editor = Arrays.asList(editor);
            return this;
        }

        @Override
        protected void variantField(String name, Object value) {
            switch (name) {
                case "booktitle" -> booktitle = (String) value;
                case "pages" -> pages = (String) value;
                case "publisher" -> publisher = (String) value;
                case "editor" -> editor = FieldType.asNames(value);
                default -> { }
            }
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public InProceedings build() {
            return new InProceedings(this);
        }
    }
}
