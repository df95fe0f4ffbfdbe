package com.citeable;

/**
 * A technical report ({@code @techreport}). Requires {@code institution}.
 */
public final class TechReport extends Citation {

    private final String institution;
    private final String number;

    private TechReport(Builder b) {
        super(b);
        this.institution = b.institution;
        this.number = b.number;
        validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public EntryType type() {
        return EntryType.TECH_REPORT;
    }

    @Override
    public Object get(String name) {
        return switch (name) {
            case "institution" -> institution;
            case "number" -> number;
            default -> super.get(name);
        };
    }

    public String institution() {
        return institution;
    }

    /** Report number such as {@code "TR-42"}, or null. */
    public String number() {
        return number;
    }

    public static final class Builder extends Citation.Builder<Builder> {

        private String institution;
        private String number;

        private Builder() {
        }

        public Builder institution(String institution) {
            this.institution = institution;
            return this;
        }

        public Builder number(String number) {
            this.number = number;
            return this;
        }

        @Override
        protected void variantField(String name, Object value) {
            switch (name) {
                case "institution" -> institution = (String) value;
                case "number" -> number = (String) value;
                default -> { }
            }
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public TechReport build() {
            return new TechReport(this);
        }
    }
}
