package com.citeable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A book ({@code @book}). Requires {@code publisher}.
 */
public final class Book extends Citation {

    private final String publisher;
    private final String edition;
    private final List<String> editor;

    private Book(Builder b) {
        super(b);
        this.publisher = b.publisher;
        this.edition = b.edition;
        this.editor = b.editor == null ? null : Collections.unmodifiableList(new ArrayList<>(b.editor));
        validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public EntryType type() {
        return EntryType.BOOK;
    }

    @Override
    public Object get(String name) {
        return switch (name) {
            case "publisher" -> publisher;
            case "edition" -> edition;
            case "editor" -> editor;
            default -> super.get(name);
        };
    }

    public String publisher() {
        return publisher;
    }

    public String edition() {
        return edition;
    }

    public List<String> editor() {
        return editor;
    }

    public static final class Builder extends Citation.Builder<Builder> {

        private String publisher;
        private String edition;
        private List<String> editor;

        private Builder() {
        }

        public Builder publisher(String publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder edition(String edition) {
            this.edition = edition;
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
                case "publisher" -> publisher = (String) value;
                case "edition" -> edition = (String) value;
                case "editor" -> editor = FieldType.asNames(value);
                default -> { }
            }
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public Book build() {
            return new Book(this);
        }
    }
}
