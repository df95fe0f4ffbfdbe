package com.citeable;

/**
 * A doctoral or master's thesis.
 *
 * <p>{@code thesis_type} is {@code "phd"} or {@code "masters"} and selects the record tag
 * ({@code @phdthesis} or {@code @mastersthesis}); it is never written as a field.
 */
public final class Thesis extends Citation {

    public static final String PHD = "phd";
    public static final String MASTERS = "masters";

    private final String school;
    private final String thesisType;

    private Thesis(Builder b) {
        super(b);
        this.school = b.school;
        this.thesisType = b.thesisType;
        validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Inverse of {@link #tag()}: the thesis type a record tag stands for. */
    static String thesisTypeForTag(String tag) {
        return "phdthesis".equalsIgnoreCase(tag) ? PHD : MASTERS;
    }

    @Override
    protected void validateVariant() {
        if (!PHD.equals(thesisType) && !MASTERS.equals(thesisType)) {
            throw new ValidationException("Thesis", "thesis_type",
                    "Thesis thesis_type must be 'phd' or 'masters'; received '" + thesisType + "'");
        }
    }

    @Override
    public EntryType type() {
        return EntryType.THESIS;
    }

    @Override
    public String tag() {
        return PHD.equals(thesisType) ? "phdthesis" : "mastersthesis";
    }

    @Override
    public Object get(String name) {
        return switch (name) {
            case "school" -> school;
            case "thesis_type" -> thesisType;
            default -> super.get(name);
        };
    }

    public String school() {
        return school;
    }

    public String thesisType() {
        return thesisType;
    }

    public static final class Builder extends Citation.Builder<Builder> {

        private String school;
        private String thesisType;

        private Builder() {
        }

        public Builder school(String school) {
            this.school = school;
            return this;
        }

        public Builder thesisType(String thesisType) {
            this.thesisType = thesisType;
            return this;
        }

        @Override
        protected void variantField(String name, Object value) {
            switch (name) {
                case "school" -> school = (String) value;
                case "thesis_type" -> thesisType = (String) value;
                default -> { }
            }
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public Thesis build() {
            return new Thesis(this);
        }
    }
}
