package org.pragmatica.querylang.peg.parser;

import org.pragmatica.querylang.peg.action.Action;
import org.pragmatica.querylang.peg.action.SemanticValues;
import org.pragmatica.querylang.peg.error.ParseError;
import org.pragmatica.querylang.peg.error.ParseException;
import org.pragmatica.querylang.peg.grammar.Expression;
import org.pragmatica.querylang.peg.grammar.Grammar;
import org.pragmatica.querylang.peg.grammar.Rule;
import org.pragmatica.querylang.peg.source.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * PEG parsing engine - interprets Grammar to parse input text, running semantic actions bound by rule name.
 *
 * <p>The engine holds no per-parse state; one instance may serve concurrent parse calls.
 */
public final class PegEngine implements Parser {

    private final Grammar grammar;
    private final ParserConfig config;
    private final Map<String, Rule> rules;
    private final Map<String, Action> actions;

    private PegEngine(Grammar grammar, ParserConfig config, Map<String, Action> actions) {
        this.grammar = grammar;
        this.config = config;
        this.rules = grammar.ruleMap();
        this.actions = Map.copyOf(actions);
    }

    public static PegEngine create(Grammar grammar, Map<String, Action> actions, ParserConfig config) throws ParseException {
        for (var ruleName : actions.keySet()) {
            if (grammar.rule(ruleName).isEmpty()) {
                throw new ParseException(new ParseError.SemanticError(
                    SourceLocation.START,
                    "Action bound to undefined rule: '" + ruleName + "'"
                ));
            }
        }
        return new PegEngine(grammar, config, actions);
    }

    @Override
    public Object parse(String input) throws ParseException {
        var startRule = grammar.effectiveStartRule()
                               .orElseThrow(() -> new ParseException(new ParseError.SemanticError(
                                   SourceLocation.START,
                                   "No start rule defined in grammar"
                               )));
        return parse(input, startRule.name());
    }

    @Override
    public Object parse(String input, String startRule) throws ParseException {
        var rule = grammar.rule(startRule)
                          .orElseThrow(() -> new ParseException(new ParseError.SemanticError(
                              SourceLocation.START,
                              "Unknown rule: " + startRule
                          )));

        var ctx = ParsingContext.create(input, config);
        var result = parseRule(ctx, rule);

        if (result.isFailure()) {
            throw furthestFailure(ctx);
        }

        // Skip trailing whitespace before checking end
        skipWhitespace(ctx);

        if (!ctx.isAtEnd()) {
            ctx.updateFurthest("end of input");
            throw furthestFailure(ctx);
        }

        var success = (ParseResult.Success) result;
        return success.semanticValue()
                      .orElseGet(() -> input.strip());
    }

    /**
     * Report the failure at the furthest position any alternative reached.
     */
    private ParseException furthestFailure(ParsingContext ctx) {
        var location = ctx.furthestLocation();
        var expected = ctx.furthestExpected()
                          .isEmpty()
                       ? "end of input"
                       : ctx.furthestExpected();
        if (location.offset() >= ctx.input()
                                    .length()) {
            return new ParseException(new ParseError.UnexpectedEof(location, expected));
        }
        var found = String.valueOf(ctx.input()
                                      .charAt(location.offset()));
        return new ParseException(new ParseError.UnexpectedInput(location, found, expected));
    }

    // === Rule Parsing ===

    private ParseResult parseRule(ParsingContext ctx, Rule rule) {
        var startPos = ctx.pos();
        var memoize = !ctx.inTokenBoundary() && !ctx.inPredicate();

        if (memoize) {
            var cached = ctx.getCachedAt(rule.name(), startPos);
            if (cached.isPresent()) {
                var result = cached.get();
                if (result instanceof ParseResult.Success success) {
                    ctx.restoreLocation(success.endLocation());
                }
                return result;
            }
        }

        var result = parseRuleWithActions(ctx, rule);

        if (memoize) {
            ctx.cacheAt(rule.name(), startPos, result);
        }
        return result;
    }

    /**
     * Parse rule with action execution.
     * Collects child semantic values and executes rule action if present.
     */
    private ParseResult parseRuleWithActions(ParsingContext ctx, Rule rule) {
        var startLoc = ctx.location();

        skipWhitespace(ctx);
        var textStart = ctx.location();

        var mode = ParseMode.collecting(new ArrayList<>(), new String[1]);
        var result = parseExpression(ctx, rule.expression(), mode);

        if (result.isFailure()) {
            ctx.restoreLocation(startLoc);
            return result;
        }

        var values = mode.semanticValues();
        var action = actions.get(rule.name());
        if (action != null) {
            // Use token capture if available, otherwise full match
            var matchedText = mode.tokenCapture()[0] != null
                              ? mode.tokenCapture()[0]
                              : ctx.substring(textStart.offset(), ctx.pos());
            var sv = SemanticValues.of(matchedText, ctx.spanFrom(textStart), values);
            try {
                return ParseResult.Success.withValue(ctx.location(), action.apply(sv));
            } catch (RuntimeException e) {
                ctx.restoreLocation(startLoc);
                ctx.updateFurthest(rule.name() + " (" + e.getMessage() + ")");
                return ParseResult.Failure.at(startLoc, "action error in " + rule.name() + ": " + e.getMessage());
            }
        }

        // No action - pass child values through
        if (values.isEmpty()) {
            return ParseResult.Success.of(ctx.location());
        }
        return ParseResult.Success.withValue(ctx.location(),
                                             values.size() == 1 ? values.get(0) : List.copyOf(values));
    }

    // === Expression Parsing ===

    private ParseResult parseExpression(ParsingContext ctx, Expression expr, ParseMode mode) {
        if (expr instanceof Expression.Literal lit) {
            return parseLiteral(ctx, lit);
        }
        if (expr instanceof Expression.CharClass cc) {
            return parseCharClass(ctx, cc);
        }
        if (expr instanceof Expression.Any) {
            return parseAny(ctx);
        }
        if (expr instanceof Expression.Reference ref) {
            return parseReference(ctx, ref, mode);
        }
        if (expr instanceof Expression.Sequence seq) {
            return parseSequence(ctx, seq, mode);
        }
        if (expr instanceof Expression.Choice choice) {
            return parseChoice(ctx, choice, mode);
        }
        if (expr instanceof Expression.ZeroOrMore zom) {
            return parseRepeated(ctx, zom.expression(), 0, mode);
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return parseRepeated(ctx, oom.expression(), 1, mode);
        }
        if (expr instanceof Expression.Optional opt) {
            return parseOptional(ctx, opt, mode);
        }
        if (expr instanceof Expression.And and) {
            return parseAnd(ctx, and);
        }
        if (expr instanceof Expression.Not not) {
            return parseNot(ctx, not);
        }
        if (expr instanceof Expression.TokenBoundary tb) {
            return parseTokenBoundary(ctx, tb, mode);
        }
        if (expr instanceof Expression.Group grp) {
            return parseExpression(ctx, grp.expression(), mode);
        }
        throw new IllegalStateException("Unsupported expression: " + expr);
    }

    // === Terminal Parsers ===

    private ParseResult parseLiteral(ParsingContext ctx, Expression.Literal lit) {
        var text = lit.text();
        var expected = "'" + text + "'";
        if (!matchesText(ctx, text, lit.caseInsensitive())) {
            ctx.updateFurthest(expected);
            return ParseResult.Failure.at(ctx.location(), expected);
        }

        for (int i = 0; i < text.length(); i++) {
            ctx.advance();
        }
        return ParseResult.Success.of(ctx.location());
    }

    private boolean matchesText(ParsingContext ctx, String text, boolean caseInsensitive) {
        if (ctx.remaining() < text.length()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char expected = text.charAt(i);
            char actual = ctx.peek(i);
            if (caseInsensitive) {
                if (Character.toLowerCase(expected) != Character.toLowerCase(actual)) {
                    return false;
                }
            } else if (expected != actual) {
                return false;
            }
        }
        return true;
    }

    private ParseResult parseCharClass(ParsingContext ctx, Expression.CharClass cc) {
        var expected = "[" + (cc.negated() ? "^" : "") + cc.pattern() + "]";
        if (ctx.isAtEnd()) {
            ctx.updateFurthest(expected);
            return ParseResult.Failure.at(ctx.location(), expected);
        }

        boolean matches = CharClassMatcher.matches(ctx.peek(), cc.pattern(), cc.caseInsensitive());
        if (cc.negated()) {
            matches = !matches;
        }

        if (!matches) {
            ctx.updateFurthest(expected);
            return ParseResult.Failure.at(ctx.location(), expected);
        }

        ctx.advance();
        return ParseResult.Success.of(ctx.location());
    }

    private ParseResult parseAny(ParsingContext ctx) {
        if (ctx.isAtEnd()) {
            ctx.updateFurthest("any character");
            return ParseResult.Failure.at(ctx.location(), "any character");
        }

        ctx.advance();
        return ParseResult.Success.of(ctx.location());
    }

    // === Combinator Parsers ===

    private ParseResult parseReference(ParsingContext ctx, Expression.Reference ref, ParseMode mode) {
        var rule = rules.get(ref.ruleName());
        if (rule == null) {
            return ParseResult.Failure.at(ctx.location(), "rule '" + ref.ruleName() + "'");
        }
        var result = mode.skipWhitespace()
                     ? parseRule(ctx, rule)
                     : parseExpression(ctx, rule.expression(), mode);
        if (result instanceof ParseResult.Success success && success.hasSemanticValue()) {
            mode.semanticValues()
                .add(success.semanticValue()
                            .get());
        }
        return result;
    }

    private ParseResult parseSequence(ParsingContext ctx, Expression.Sequence seq, ParseMode mode) {
        var startLoc = ctx.location();

        for (var element : seq.elements()) {
            // Skip whitespace between elements, but NOT before predicates
            if (mode.skipWhitespace() && !isPredicate(element)) {
                skipWhitespace(ctx);
            }
            var result = parseExpression(ctx, element, mode);
            if (result.isFailure()) {
                ctx.restoreLocation(startLoc);
                return result;
            }
        }

        return ParseResult.Success.of(ctx.location());
    }

    private ParseResult parseChoice(ParsingContext ctx, Expression.Choice choice, ParseMode mode) {
        var startLoc = ctx.location();
        ParseResult lastFailure = null;

        for (var alt : choice.alternatives()) {
            // Local collectors - only merged on success
            var localMode = mode.childMode();
            var result = parseExpression(ctx, alt, localMode);
            if (result.isSuccess()) {
                mode.merge(localMode);
                return result;
            }
            lastFailure = result;
            ctx.restoreLocation(startLoc);
        }

        return lastFailure != null
            ? lastFailure
            : ParseResult.Failure.at(ctx.location(), "one of alternatives");
    }

    /**
     * Shared loop of {@code e*} and {@code e+}.
     */
    private ParseResult parseRepeated(ParsingContext ctx, Expression expression, int min, ParseMode mode) {
        var startLoc = ctx.location();
        int count = 0;

        while (true) {
            var beforeLoc = ctx.location();
            if (count > 0 && mode.skipWhitespace()) {
                skipWhitespace(ctx);
            }

            var localMode = mode.childMode();
            var result = parseExpression(ctx, expression, localMode);

            if (result.isFailure()) {
                ctx.restoreLocation(beforeLoc);
                break;
            }
            mode.merge(localMode);
            count++;

            if (ctx.pos() == beforeLoc.offset()) {
                break;
            }
        }

        if (count < min) {
            ctx.restoreLocation(startLoc);
            return ParseResult.Failure.at(startLoc, "at least " + min + " repetition");
        }
        return ParseResult.Success.of(ctx.location());
    }

    private ParseResult parseOptional(ParsingContext ctx, Expression.Optional opt, ParseMode mode) {
        var startLoc = ctx.location();
        var localMode = mode.childMode();
        var result = parseExpression(ctx, opt.expression(), localMode);

        if (result.isSuccess()) {
            mode.merge(localMode);
            return result;
        }

        // Optional always succeeds
        ctx.restoreLocation(startLoc);
        return ParseResult.Success.of(startLoc);
    }

    private boolean isPredicate(Expression expr) {
        if (expr instanceof Expression.And || expr instanceof Expression.Not) {
            return true;
        }
        return expr instanceof Expression.Group grp && isPredicate(grp.expression());
    }

    // === Predicate Parsers ===

    private ParseResult parseAnd(ParsingContext ctx, Expression.And and) {
        var startLoc = ctx.location();
        var result = lookahead(ctx, and.expression());

        if (result.isSuccess()) {
            return new ParseResult.PredicateSuccess(startLoc);
        }
        return ParseResult.Failure.at(startLoc, describeExpression(and.expression()));
    }

    private ParseResult parseNot(ParsingContext ctx, Expression.Not not) {
        var startLoc = ctx.location();
        var result = lookahead(ctx, not.expression());

        if (result.isSuccess()) {
            return ParseResult.Failure.at(startLoc, "not " + describeExpression(not.expression()));
        }
        return new ParseResult.PredicateSuccess(startLoc);
    }

    /**
     * Evaluate an expression without consuming input or collecting values.
     */
    private ParseResult lookahead(ParsingContext ctx, Expression expr) {
        var startLoc = ctx.location();
        ctx.enterPredicate();
        try {
            return parseExpression(ctx, expr, ParseMode.collecting(new ArrayList<>(), new String[1]));
        } finally {
            ctx.exitPredicate();
            ctx.restoreLocation(startLoc);
        }
    }

    // === Special Parsers ===

    private ParseResult parseTokenBoundary(ParsingContext ctx, Expression.TokenBoundary tb, ParseMode mode) {
        var startPos = ctx.pos();

        // Disable whitespace skipping inside token boundary
        ctx.enterTokenBoundary();
        try {
            var result = parseExpression(ctx, tb.expression(), mode.childMode());
            if (result.isFailure()) {
                return result;
            }
            mode.tokenCapture()[0] = ctx.substring(startPos, ctx.pos());
            return ParseResult.Success.of(ctx.location());
        } finally {
            ctx.exitTokenBoundary();
        }
    }

    // === Helpers ===

    private void skipWhitespace(ParsingContext ctx) {
        // Lookahead sees the input exactly where it stands; no skipping in token boundaries either
        if (grammar.whitespace().isEmpty()
            || ctx.isSkippingWhitespace()
            || ctx.inTokenBoundary()
            || ctx.inPredicate()) {
            return;
        }

        ctx.enterWhitespaceSkip();
        ctx.enterPredicate();
        try {
            var wsExpr = grammar.whitespace().get();
            while (!ctx.isAtEnd()) {
                var startLoc = ctx.location();
                var result = parseExpression(ctx, wsExpr, ParseMode.noWhitespace());
                if (result.isFailure()) {
                    ctx.restoreLocation(startLoc);
                    break;
                }
                if (ctx.pos() == startLoc.offset()) {
                    break;
                }
            }
        } finally {
            ctx.exitPredicate();
            ctx.exitWhitespaceSkip();
        }
    }

    private String describeExpression(Expression expr) {
        if (expr instanceof Expression.Literal lit) {
            return "'" + lit.text() + "'";
        }
        if (expr instanceof Expression.CharClass cc) {
            return "[" + cc.pattern() + "]";
        }
        if (expr instanceof Expression.Any) {
            return ".";
        }
        if (expr instanceof Expression.Reference ref) {
            return ref.ruleName();
        }
        return "expression";
    }
}
