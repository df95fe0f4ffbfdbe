package com.citeable;

/**
 * A software release ({@code @software}). No fields beyond the common ones are required.
 */
public final class Software extends Citation {

    private final String publisher;
    private final String version;
    private final String license;

    private Software(Builder b) {
        super(b);
        this.publisher = b.publisher;
        this.version = b.version;
        this.license = b.license;
        validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public EntryType type() {
        return EntryType.SOFTWARE;
    }

    @Override
    public Object get(String name) {
        return switch (name) {
            case "publisher" -> publisher;
            case "version" -> version;
            case "license" -> license;
            default -> super.get(name);
        };
    }

    public String publisher() {
        return publisher;
    }

    public String version() {
        return version;
    }

    public String license() {
        return license;
    }

    public static final class Builder extends Citation.Builder<Builder> {

        private String publisher;
        private String version;
        private String license;

        private Builder() {
        }

        public Builder publisher(String publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder license(String license) {
            this.license = license;
            return this;
        }

        @Override
        protected void variantField(String name, Object value) {
            switch (name) {
                case "publisher" -> publisher = (String) value;
                case "version" -> version = (String) value;
                case "license" -> license = (String) value;
                default -> { }
            }
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public Software build() {
            return new Software(this);
        }
    }
}
