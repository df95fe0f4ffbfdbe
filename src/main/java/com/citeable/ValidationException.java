package com.citeable;

/**
 * Raised when a citation is missing a required field, or a field holds a value its variant
 * does not accept.
 *
 * <p>Always names the variant and the offending field, e.g.
 * {@code "Article requires 'volume'; received none"}.
 */
public class ValidationException extends IllegalArgumentException {

    private final String variant;
    private final String field;

    public ValidationException(String variant, String field, String message) {
        super(message);
        this.variant = variant;
        this.field = field;
    }

    public ValidationException(String variant, String field, String message, Throwable cause) {
        super(message, cause);
        this.variant = variant;
        this.field = field;
    }

    static ValidationException missing(String variant, String field) {
        return new ValidationException(variant, field,
                variant + " requires '" + field + "'; received none");
    }

    public String variant() {
        return variant;
    }

    public String field() {
        return field;
    }
}
