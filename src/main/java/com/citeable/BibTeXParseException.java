package com.citeable;

/**
 * Raised when text does not hold exactly one well-formed BibTeX record of a supported type.
 */
public class BibTeXParseException extends IllegalArgumentException {

    public BibTeXParseException(String message) {
        super(message);
    }

    public BibTeXParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
