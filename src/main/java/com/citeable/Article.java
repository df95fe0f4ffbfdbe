package com.citeable;

/**
 * A journal article ({@code @article}).
 *
 * <p>Requires {@code journal}, {@code volume}, and at least one of {@code pages} or
 * {@code article_number}.
 */
public final class Article extends Citation {

    private final String journal;
    private final Integer volume;
    private final Integer number;
    private final String pages;
    private final String articleNumber;

    private Article(Builder b) {
        super(b);
        this.journal = b.journal;
        this.volume = b.volume;
        this.number = b.number;
        this.pages = b.pages;
        this.articleNumber = b.articleNumber;
        validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected void validateVariant() {
        if (pages == null && articleNumber == null) {
            throw new ValidationException("Article", "pages",
                    "Article requires 'pages' or 'article_number'; received neither");
        }
    }

    @Override
    public EntryType type() {
        return EntryType.ARTICLE;
    }

    @Override
    public Object get(String name) {
        return switch (name) {
            case "journal" -> journal;
            case "volume" -> volume;
            case "number" -> number;
            case "pages" -> pages;
            case "article_number" -> articleNumber;
            default -> super.get(name);
        };
    }

    public String journal() {
        return journal;
    }

    public int volume() {
        return volume;
    }

    /** Issue number, or null. */
    public Integer number() {
        return number;
    }

    public String pages() {
        return pages;
    }

    public String articleNumber() {
        return articleNumber;
    }

    public static final class Builder extends Citation.Builder<Builder> {

        private String journal;
        private Integer volume;
        private Integer number;
        private String pages;
        private String articleNumber;

        private Builder() {
        }

        public Builder journal(String journal) {
            this.journal = journal;
            return this;
        }

        public Builder volume(int volume) {
            this.volume = volume;
            return this;
        }

        public Builder number(int number) {
            this.number = number;
            return this;
        }

        public Builder pages(String pages) {
            this.pages = pages;
            return this;
        }

        public Builder articleNumber(String articleNumber) {
            this.articleNumber = articleNumber;
            return this;
        }

        @Override
        protected void variantField(String name, Object value) {
            switch (name) {
                case "journal" -> journal = (String) value;
                case "volume" -> volume = (Integer) value;
                case "number" -> number = (Integer) value;
                case "pages" -> pages = (String) value;
                case "article_number" -> articleNumber = (String) value;
                default -> { }
            }
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        public Article build() {
            return new Article(this);
        }
    }
}
