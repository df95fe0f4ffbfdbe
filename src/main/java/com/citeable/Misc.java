package com.citeable;

/**
 * Anything that fits no other variant ({@code @misc}).
 */
public final class Misc extends Citation {

    private Misc(Builder b) {
        super(b);
        validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public EntryType type() {
        return EntryType.MISC;
    }

    public static final class Builder extends Citation.Builder<Builder> {

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public Misc build() {
            return new Misc(this);
        }
    }
}
