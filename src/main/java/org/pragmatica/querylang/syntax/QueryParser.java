package org.pragmatica.querylang.syntax;

import org.pragmatica.querylang.QuerySyntaxException;
import org.pragmatica.querylang.ast.QueryNode;
import org.pragmatica.querylang.peg.PegParser;
import org.pragmatica.querylang.peg.error.ParseException;
import org.pragmatica.querylang.peg.parser.Parser;
import org.pragmatica.querylang.peg.parser.ParserConfig;

/**
 * Parses comment-free query text into a {@link QueryNode} tree.
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class QueryParser {
    public static final String DEFAULT_LITERAL_OPEN = "{";
    public static final String DEFAULT_LITERAL_CLOSE = "}";
    public static final int DEFAULT_MAX_DEPTH = 128;

    private final Parser parser;
    private final NestingScanner nesting;

    private QueryParser(Parser parser, NestingScanner nesting) {
        this.parser = parser;
        this.nesting = nesting;
    }

    public static QueryParser create() {
        return create(DEFAULT_LITERAL_OPEN, DEFAULT_LITERAL_CLOSE, true);
    }

    public static QueryParser create(String literalOpen, String literalClose, boolean caseFold) {
        return create(literalOpen, literalClose, caseFold, DEFAULT_MAX_DEPTH);
    }

    /**
     * @param literalOpen  opening delimiter of exact-match literals
     * @param literalClose closing delimiter of exact-match literals
     * @param caseFold     lowercase bare words and phrases
     * @param maxDepth     deepest accepted nesting of parentheses and negations
     */
    public static QueryParser create(String literalOpen, String literalClose, boolean caseFold, int maxDepth) {
        if (literalOpen.isEmpty() || literalClose.isEmpty()) {
            throw new IllegalArgumentException("Literal delimiters must not be empty");
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Nesting depth limit must be positive: " + maxDepth);
        }
        try {
            return new QueryParser(PegParser.fromGrammar(QueryGrammar.grammarText(literalOpen, literalClose),
                                                         QueryGrammar.actions(caseFold),
                                                         ParserConfig.DEFAULT),
                                   new NestingScanner(literalOpen, literalClose, maxDepth));
        } catch (ParseException e) {
            throw new IllegalStateException("Query grammar does not compile: " + e.getMessage(), e);
        }
    }

    /**
     * Parse the whole input as one expression.
     *
     * @throws QuerySyntaxException on trailing text, unbalanced parentheses, dangling operators,
     *                              unterminated phrases or literals, empty input, or nesting deeper than the limit
     */
    public QueryNode parse(String text) throws QuerySyntaxException {
        nesting.check(text);
        try {
            return (QueryNode) parser.parse(text);
        } catch (ParseException e) {
            throw QuerySyntaxException.from(e);
        }
    }
}
