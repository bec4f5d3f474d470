package org.pragmatica.querylang.peg;

import org.pragmatica.querylang.peg.action.Action;
import org.pragmatica.querylang.peg.error.ParseException;
import org.pragmatica.querylang.peg.grammar.Grammar;
import org.pragmatica.querylang.peg.grammar.GrammarParser;
import org.pragmatica.querylang.peg.parser.Parser;
import org.pragmatica.querylang.peg.parser.ParserConfig;
import org.pragmatica.querylang.peg.parser.PegEngine;

import java.util.HashMap;
import java.util.Map;

/**
 * Entry point for creating PEG parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = PegParser.fromGrammar("""
 *     Number <- < [0-9]+ >
 *     %whitespace <- [ \\t]*
 *     """, Map.of("Number", sv -> Integer.parseInt(sv.token())));
 *
 * var result = parser.parse("123");
 * }</pre>
 */
public final class PegParser {
    private PegParser() {}

    /**
     * Create a parser from grammar text, without semantic actions.
     */
    public static Parser fromGrammar(String grammarText) throws ParseException {
        return fromGrammar(grammarText, Map.of(), ParserConfig.DEFAULT);
    }

    /**
     * Create a parser from grammar text whose rules run the given actions, keyed by rule name.
     */
    public static Parser fromGrammar(String grammarText, Map<String, Action> actions) throws ParseException {
        return fromGrammar(grammarText, actions, ParserConfig.DEFAULT);
    }

    /**
     * Create a parser from grammar text with custom configuration.
     */
    public static Parser fromGrammar(String grammarText, Map<String, Action> actions, ParserConfig config) throws ParseException {
        return fromGrammar(GrammarParser.parse(grammarText), actions, config);
    }

    /**
     * Create a parser from a pre-parsed grammar with custom configuration.
     */
    public static Parser fromGrammar(Grammar grammar, Map<String, Action> actions, ParserConfig config) throws ParseException {
        return PegEngine.create(grammar.validate(), actions, config);
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder(String grammarText) {
        return new Builder(grammarText);
    }

    public static final class Builder {
        private final String grammarText;
        private final Map<String, Action> actions = new HashMap<>();
        private boolean packratEnabled = true;

        private Builder(String grammarText) {
            this.grammarText = grammarText;
        }

        public Builder packrat(boolean enabled) {
            this.packratEnabled = enabled;
            return this;
        }

        public Builder action(String ruleName, Action action) {
            actions.put(ruleName, action);
            return this;
        }

        public Parser build() throws ParseException {
            return fromGrammar(grammarText, actions, new ParserConfig(packratEnabled));
        }
    }
}
