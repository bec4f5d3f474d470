package org.pragmatica.querylang;

import org.pragmatica.querylang.peg.error.ParseError;
import org.pragmatica.querylang.peg.error.ParseException;
import org.pragmatica.querylang.peg.source.SourceLocation;

import java.util.Optional;

/**
 * Malformed query text. The location refers to the query after comment stripping.
 */
public final class QuerySyntaxException extends QueryCompilationException {
    private final SourceLocation location;
    private final Optional<String> found;
    private final String expected;

    private QuerySyntaxException(String message,
                                 SourceLocation location,
                                 Optional<String> found,
                                 String expected,
                                 ParseException cause) {
        super(message, cause);
        this.location = location;
        this.found = found;
        this.expected = expected;
    }

    public static QuerySyntaxException from(ParseException cause) {
        var error = cause.error();
        if (error instanceof ParseError.UnexpectedInput input) {
            return new QuerySyntaxException("Syntax error: " + error.message(),
                                            input.location(),
                                            Optional.of(input.found()),
                                            input.expected(),
                                            cause);
        }
        if (error instanceof ParseError.UnexpectedEof eof) {
            return new QuerySyntaxException("Syntax error: " + error.message(),
                                            eof.location(),
                                            Optional.empty(),
                                            eof.expected(),
                                            cause);
        }
        return new QuerySyntaxException("Syntax error: " + error.message(),
                                        error.location(),
                                        Optional.empty(),
                                        "",
                                        cause);
    }

    public SourceLocation location() {
        return location;
    }

    /**
     * Offset into the stripped query text.
     */
    public int offset() {
        return location.offset();
    }

    /**
     * Offending text, empty at end of input.
     */
    public Optional<String> found() {
        return found;
    }

    public boolean atEndOfInput() {
        return found.isEmpty();
    }

    public String expected() {
        return expected;
    }
}
