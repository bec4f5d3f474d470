package org.pragmatica.querylang.peg.grammar;

import org.pragmatica.querylang.peg.error.ParseError;
import org.pragmatica.querylang.peg.error.ParseException;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A complete PEG grammar - collection of rules with the whitespace directive.
 */
public record Grammar(
 List<Rule> rules,
 Optional<Expression> whitespace) {
    /**
     * Get rule by name.
     */
    public Optional<Rule> rule(String name) {
        return rules.stream()
                    .filter(r -> r.name()
                                  .equals(name))
                    .findFirst();
    }

    /**
     * The start rule is the first rule of the grammar.
     */
    public Optional<Rule> effectiveStartRule() {
        return rules.isEmpty()
               ? Optional.empty()
               : Optional.of(rules.get(0));
    }

    /**
     * Build a lookup map for efficient rule access.
     */
    public Map<String, Rule> ruleMap() {
        return rules.stream()
                    .collect(Collectors.toMap(Rule::name, r -> r, (first, second) -> first));
    }

    /**
     * Validate the grammar for undefined references and duplicate rule names.
     */
    public Grammar validate() throws ParseException {
        var ruleNames = rules.stream()
                             .map(Rule::name)
                             .collect(Collectors.toSet());
        if (ruleNames.size() != rules.size()) {
            var duplicate = findDuplicate();
            throw new ParseException(new ParseError.SemanticError(
            duplicate.span()
                     .start(),
            "Duplicate rule: '" + duplicate.name() + "'"));
        }
        for (var rule : rules) {
            var undefinedRef = findUndefinedReference(rule.expression(), ruleNames);
            if (undefinedRef.isPresent()) {
                var ref = undefinedRef.get();
                throw new ParseException(new ParseError.SemanticError(
                ref.span()
                   .start(),
                "Undefined rule reference: '" + ref.ruleName() + "'"));
            }
        }
        return this;
    }

    private Rule findDuplicate() {
        var seen = new HashSet<String>();
        return rules.stream()
                    .filter(r -> !seen.add(r.name()))
                    .findFirst()
                    .orElseThrow();
    }

    /**
     * Recursively find the first undefined rule reference in an expression.
     */
    private Optional<Expression.Reference> findUndefinedReference(Expression expr, Set<String> ruleNames) {
        if (expr instanceof Expression.Reference ref) {
            return ruleNames.contains(ref.ruleName())
                   ? Optional.empty()
                   : Optional.of(ref);
        }
        if (expr instanceof Expression.Sequence seq) {
            return firstUndefined(seq.elements(), ruleNames);
        }
        if (expr instanceof Expression.Choice choice) {
            return firstUndefined(choice.alternatives(), ruleNames);
        }
        return inner(expr).flatMap(e -> findUndefinedReference(e, ruleNames));
    }

    private Optional<Expression.Reference> firstUndefined(List<Expression> expressions, Set<String> ruleNames) {
        return expressions.stream()
                          .map(e -> findUndefinedReference(e, ruleNames))
                          .flatMap(Optional::stream)
                          .findFirst();
    }

    /**
     * The single wrapped expression of unary operators; terminals have none.
     */
    static Optional<Expression> inner(Expression expr) {
        if (expr instanceof Expression.ZeroOrMore zom) {
            return Optional.of(zom.expression());
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return Optional.of(oom.expression());
        }
        if (expr instanceof Expression.Optional opt) {
            return Optional.of(opt.expression());
        }
        if (expr instanceof Expression.And and) {
            return Optional.of(and.expression());
        }
        if (expr instanceof Expression.Not not) {
            return Optional.of(not.expression());
        }
        if (expr instanceof Expression.TokenBoundary tb) {
            return Optional.of(tb.expression());
        }
        if (expr instanceof Expression.Group grp) {
            return Optional.of(grp.expression());
        }
        return Optional.empty();
    }
}
