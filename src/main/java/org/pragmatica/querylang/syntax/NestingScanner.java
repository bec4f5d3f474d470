package org.pragmatica.querylang.syntax;

import org.pragmatica.querylang.QuerySyntaxException;
import org.pragmatica.querylang.peg.error.ParseError;
import org.pragmatica.querylang.peg.error.ParseException;
import org.pragmatica.querylang.peg.source.SourceLocation;

import java.util.ArrayDeque;

/**
 * Measures how deeply groups and negations nest before the recursive parser sees the text.
 *
 * <p>Every open parenthesis counts one level, and so does every {@code NOT} still waiting for its operand.
 * Phrases and literals are skipped whole. Malformed text is left for the parser to report.
 */
final class NestingScanner {
    private final String literalOpen;
    private final String literalClose;
    private final int maxDepth;

    NestingScanner(String literalOpen, String literalClose, int maxDepth) {
        this.literalOpen = literalOpen;
        this.literalClose = literalClose;
        this.maxDepth = maxDepth;
    }

    /**
     * @throws QuerySyntaxException pointing at the group or negation that crosses the limit
     */
    void check(String text) throws QuerySyntaxException {
        int depth = 0;
        int negations = 0;
        var groups = new ArrayDeque<Integer>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (text.startsWith(literalOpen, i)) {
                int close = text.indexOf(literalClose, i + literalOpen.length());
                if (close < 0) {
                    return;
                }
                i = close + literalClose.length();
                depth -= negations;
                negations = 0;
            } else if (c == '"') {
                i = skipPhrase(text, i);
                if (i < 0) {
                    return;
                }
                depth -= negations;
                negations = 0;
            } else if (c == '(') {
                groups.push(negations);
                negations = 0;
                depth++;
                requireWithinLimit(text, i, depth);
                i++;
            } else if (c == ')') {
                if (groups.isEmpty()) {
                    return;
                }
                // the group closes together with the negations in front of it
                depth -= 1 + negations + groups.peek();
                negations = 0;
                groups.pop();
                i++;
            } else if (isSpace(c)) {
                i++;
            } else {
                int end = i;
                while (end < text.length() && isWordChar(text.charAt(end))) {
                    end++;
                }
                var word = text.substring(i, end);
                if (word.equalsIgnoreCase("NOT")) {
                    negations++;
                    depth++;
                    requireWithinLimit(text, i, depth);
                } else if (!isBinaryOperator(word)) {
                    depth -= negations;
                    negations = 0;
                }
                i = end;
            }
        }
    }

    private void requireWithinLimit(String text, int offset, int depth) throws QuerySyntaxException {
        if (depth <= maxDepth) {
            return;
        }
        var error = new ParseError.UnexpectedInput(locate(text, offset),
                                                   String.valueOf(text.charAt(offset)),
                                                   "at most " + maxDepth + " nested groups or negations");
        throw QuerySyntaxException.from(new ParseException(error));
    }

    /**
     * @return offset just past the closing quote, or -1 when the phrase is unterminated
     */
    private static int skipPhrase(String text, int start) {
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '"') {
                return i + 1;
            } else {
                i++;
            }
        }
        return -1;
    }

    private static SourceLocation locate(String text, int offset) {
        int line = 1;
        int column = 1;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return SourceLocation.at(line, column, offset);
    }

    private static boolean isBinaryOperator(String word) {
        return word.equalsIgnoreCase("AND")
               || word.equalsIgnoreCase("OR")
               || word.regionMatches(true, 0, "NEAR/", 0, 5);
    }

    private static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    private static boolean isWordChar(char c) {
        return !isSpace(c) && c != '(' && c != ')' && c != '"';
    }
}
