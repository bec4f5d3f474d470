package org.pragmatica.querylang.peg.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameterizes parsing behavior: whitespace skipping and where semantic values are collected.
 *
 * <p>Two modes exist:
 * <ul>
 *   <li>{@link #collecting(List, String[])} - skip whitespace, collect semantic values of child rules</li>
 *   <li>{@link #noWhitespace()} - don't skip whitespace (for the %whitespace expression itself)</li>
 * </ul>
 */
record ParseMode(
 boolean skipWhitespace,
 List<Object> semanticValues,
 String[] tokenCapture) {

    static ParseMode collecting(List<Object> values, String[] tokenCapture) {
        return new ParseMode(true, values, tokenCapture);
    }

    static ParseMode noWhitespace() {
        return new ParseMode(false, new ArrayList<>(), new String[1]);
    }

    /**
     * Create a child mode with local collectors, merged into this one only on success.
     */
    ParseMode childMode() {
        return new ParseMode(skipWhitespace, new ArrayList<>(), new String[1]);
    }

    /**
     * Merge values and token capture collected by a successful child mode.
     */
    void merge(ParseMode child) {
        semanticValues.addAll(child.semanticValues);
        if (child.tokenCapture[0] != null) {
            tokenCapture[0] = child.tokenCapture[0];
        }
    }
}
