package org.pragmatica.querylang.peg.parser;

import org.pragmatica.querylang.peg.error.ParseException;

/**
 * Parser interface - parses input text according to a grammar.
 */
public interface Parser {

    /**
     * Parse the whole input from the start rule and return the semantic value built by actions.
     * When the start rule produces no value, the matched text is returned.
     */
    Object parse(String input) throws ParseException;

    /**
     * Parse the whole input starting from a specific rule.
     */
    Object parse(String input, String startRule) throws ParseException;
}
