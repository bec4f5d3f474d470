package org.pragmatica.querylang.peg.error;

/**
 * Raised when grammar text or parser input cannot be parsed.
 * The structured cause is available through {@link #error()}.
 */
public final class ParseException extends Exception {
    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }
}
