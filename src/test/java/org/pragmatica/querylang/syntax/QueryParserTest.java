package org.pragmatica.querylang.syntax;

import org.junit.jupiter.api.Test;
import org.pragmatica.querylang.QuerySyntaxException;
import org.pragmatica.querylang.ast.QueryNode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class QueryParserTest {
    private final QueryParser parser = QueryParser.create();

    // === Precedence and folding ===

    @Test
    void parse_andChain_foldsLeft() throws QuerySyntaxException {
        assertThat(parser.parse("a AND b AND c"))
            .hasToString("AND(AND(TERM(a), TERM(b)), TERM(c))");
    }

    @Test
    void parse_orChain_foldsLeft() throws QuerySyntaxException {
        assertThat(parser.parse("a OR b OR c"))
            .hasToString("OR(OR(TERM(a), TERM(b)), TERM(c))");
    }

    @Test
    void parse_andBindsTighterThanOr() throws QuerySyntaxException {
        assertThat(parser.parse("a OR b AND c"))
            .hasToString("OR(TERM(a), AND(TERM(b), TERM(c)))");
    }

    @Test
    void parse_notBindsTighterThanAnd() throws QuerySyntaxException {
        assertThat(parser.parse("NOT a AND b"))
            .hasToString("AND(NOT(TERM(a)), TERM(b))");
    }

    @Test
    void parse_notIsRightAssociative() throws QuerySyntaxException {
        assertThat(parser.parse("NOT NOT a"))
            .hasToString("NOT(NOT(TERM(a)))");
    }

    @Test
    void parse_near_collapsesToAndAndBindsTighterThanAnd() throws QuerySyntaxException {
        assertThat(parser.parse("a AND b NEAR/5 c"))
            .hasToString("AND(TERM(a), AND(TERM(b), TERM(c)))");
        assertThat(parser.parse("a near/10f b"))
            .isEqualTo(QueryNode.and(QueryNode.term("a"), QueryNode.term("b")));
    }

    @Test
    void parse_notBindsTighterThanNear() throws QuerySyntaxException {
        assertThat(parser.parse("NOT a NEAR/2 b"))
            .hasToString("AND(NOT(TERM(a)), TERM(b))");
    }

    @Test
    void parse_parentheses_overridePrecedence() throws QuerySyntaxException {
        assertThat(parser.parse("(a OR b) AND c"))
            .hasToString("AND(OR(TERM(a), TERM(b)), TERM(c))");
        assertThat(parser.parse("NOT(a OR b)"))
            .hasToString("NOT(OR(TERM(a), TERM(b)))");
    }

    @Test
    void parse_keywords_areCaseInsensitive() throws QuerySyntaxException {
        assertThat(parser.parse("a and b oR NoT c"))
            .hasToString("OR(AND(TERM(a), TERM(b)), NOT(TERM(c)))");
    }

    @Test
    void parse_keywordPrefix_isPartOfWord() throws QuerySyntaxException {
        assertThat(parser.parse("android AND ORegon OR notice"))
            .hasToString("OR(AND(TERM(android), TERM(oregon)), TERM(notice))");
    }

    // === Tokens ===

    @Test
    void parse_bareWord_isCaseFolded() throws QuerySyntaxException {
        assertThat(parser.parse("Hello")).isEqualTo(new QueryNode.Term("hello", false));
    }

    @Test
    void parse_bareWord_keepsPunctuation() throws QuerySyntaxException {
        assertThat(parser.parse("c++ AND node.js"))
            .hasToString("AND(TERM(c++), TERM(node.js))");
    }

    @Test
    void parse_phrase_dropsQuotesAndFoldsCase() throws QuerySyntaxException {
        assertThat(parser.parse("\"Hello World\"")).isEqualTo(QueryNode.term("hello world"));
    }

    @Test
    void parse_phrase_resolvesEscapes() throws QuerySyntaxException {
        assertThat(parser.parse("\"say \\\"hi\\\" \\\\ bye\"")).isEqualTo(QueryNode.term("say \"hi\" \\ bye"));
    }

    @Test
    void parse_phrase_keepsKeywordsAndParentheses() throws QuerySyntaxException {
        assertThat(parser.parse("\"cats AND (dogs)\" OR b"))
            .hasToString("OR(TERM(cats and (dogs)), TERM(b))");
    }

    @Test
    void parse_literal_keepsDelimitersAndCase() throws QuerySyntaxException {
        assertThat(parser.parse("{Exact Match} AND b"))
            .isEqualTo(QueryNode.and(QueryNode.literal("{Exact Match}"), QueryNode.term("b")));
    }

    @Test
    void parse_literal_withCustomDelimiters() throws QuerySyntaxException {
        var custom = QueryParser.create("[[", "]]", true);

        assertThat(custom.parse("[[ABC]] OR {Word}"))
            .isEqualTo(QueryNode.or(QueryNode.literal("[[ABC]]"), QueryNode.term("{word}")));
    }

    @Test
    void parse_withoutCaseFold_keepsCase() throws QuerySyntaxException {
        var preserving = QueryParser.create("{", "}", false);

        assertThat(preserving.parse("Hello AND \"New York\""))
            .hasToString("AND(TERM(Hello), TERM(New York))");
    }

    @Test
    void parse_surroundingWhitespaceAndNewlines_areIgnored() throws QuerySyntaxException {
        assertThat(parser.parse("\n  a\tAND\r\n b  "))
            .hasToString("AND(TERM(a), TERM(b))");
    }

    // === Errors ===

    @Test
    void parse_danglingOperator_failsAtEndOfInput() {
        var error = syntaxError("a AND");

        assertThat(error.atEndOfInput()).isTrue();
        assertThat(error.offset()).isEqualTo(5);
    }

    @Test
    void parse_leadingOperator_failsAtOperator() {
        var error = syntaxError("AND b");

        assertThat(error.offset()).isZero();
        assertThat(error.found()).contains("A");
    }

    @Test
    void parse_missingOperator_failsAtSecondOperand() {
        var error = syntaxError("a b");

        assertThat(error.offset()).isEqualTo(2);
        assertThat(error.found()).contains("b");
        assertThat(error.expected()).contains("end of input");
    }

    @Test
    void parse_unbalancedParentheses_fail() {
        assertThat(syntaxError("(a OR b").atEndOfInput()).isTrue();
        assertThat(syntaxError("(a OR b").expected()).contains("')'");

        var error = syntaxError("a)");
        assertThat(error.offset()).isEqualTo(1);
        assertThat(error.found()).contains(")");
    }

    @Test
    void parse_unterminatedPhrase_fails() {
        var error = syntaxError("\"abc");

        assertThat(error.atEndOfInput()).isTrue();
        assertThat(error.offset()).isEqualTo(4);
    }

    @Test
    void parse_emptyPhrase_fails() {
        assertThat(syntaxError("\"\"").offset()).isEqualTo(1);
    }

    @Test
    void parse_unterminatedLiteral_fails() {
        var error = syntaxError("{abc");

        assertThat(error.atEndOfInput()).isTrue();
        assertThat(error.expected()).contains("'}'");
    }

    @Test
    void parse_emptyInput_fails() {
        assertThat(syntaxError("").offset()).isZero();
        assertThat(syntaxError("   ").offset()).isEqualTo(3);
    }

    @Test
    void parse_errorOnLaterLine_reportsLineAndColumn() {
        var error = syntaxError("a AND\nb OR");

        assertThat(error.location().line()).isEqualTo(2);
        assertThat(error.location().column()).isEqualTo(5);
        assertThat(error.getMessage()).startsWith("Syntax error");
    }

    // === Nesting limit ===

    @Test
    void parse_nestingAtDefaultLimit_parses() throws QuerySyntaxException {
        int depth = QueryParser.DEFAULT_MAX_DEPTH;

        assertThat(parser.parse(nested(depth, "a"))).isEqualTo(QueryNode.term("a"));
    }

    @Test
    void parse_groupsBeyondLimit_failAtCrossingParenthesis() throws QuerySyntaxException {
        var shallow = QueryParser.create("{", "}", true, 8);

        assertThat(shallow.parse(nested(8, "a"))).isEqualTo(QueryNode.term("a"));

        var error = catchThrowableOfType(() -> shallow.parse(nested(9, "a")), QuerySyntaxException.class);
        assertThat(error).isNotNull();
        assertThat(error.offset()).isEqualTo(8);
        assertThat(error.found()).contains("(");
        assertThat(error.expected()).contains("at most 8");
    }

    @Test
    void parse_negationChainBeyondLimit_failsAtCrossingNot() throws QuerySyntaxException {
        var shallow = QueryParser.create("{", "}", true, 3);

        assertThat(shallow.parse("NOT NOT NOT a")).hasToString("NOT(NOT(NOT(TERM(a))))");

        var error = catchThrowableOfType(() -> shallow.parse("NOT NOT (NOT a)"), QuerySyntaxException.class);
        assertThat(error).isNotNull();
        assertThat(error.offset()).isEqualTo(9);
        assertThat(error.found()).contains("N");
    }

    @Test
    void parse_siblingGroupsAndNegations_doNotAccumulate() throws QuerySyntaxException {
        var shallow = QueryParser.create("{", "}", true, 2);

        assertThat(shallow.parse("(a) AND ((b)) OR NOT c AND NOT (d) AND (NOT e)")).isInstanceOf(QueryNode.Or.class);
    }

    @Test
    void parse_parenthesesInsidePhrasesAndLiterals_areNotGroups() throws QuerySyntaxException {
        var shallow = QueryParser.create("{", "}", true, 1);

        assertThat(shallow.parse("\"((((\" AND {((((} AND (x)"))
            .hasToString("AND(AND(TERM(((((), TERM({((((})), TERM(x))");
    }

    @Test
    void parse_thousandsOfNestedGroups_failWithSyntaxError() {
        var error = syntaxError(nested(2000, "a"));

        assertThat(error.offset()).isEqualTo(QueryParser.DEFAULT_MAX_DEPTH);
    }

    private static String nested(int depth, String inner) {
        return "(".repeat(depth) + inner + ")".repeat(depth);
    }

    private QuerySyntaxException syntaxError(String text) {
        var error = catchThrowableOfType(() -> parser.parse(text), QuerySyntaxException.class);
        assertThat(error).as("syntax error for '%s'", text).isNotNull();
        return error;
    }
}
