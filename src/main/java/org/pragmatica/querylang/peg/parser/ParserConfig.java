package org.pragmatica.querylang.peg.parser;

/**
 * Parser configuration options.
 */
public record ParserConfig(boolean packratEnabled) {
    public static final ParserConfig DEFAULT = new ParserConfig(true);
}
