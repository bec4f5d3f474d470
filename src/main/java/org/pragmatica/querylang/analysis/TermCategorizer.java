package org.pragmatica.querylang.analysis;

import org.pragmatica.querylang.ast.QueryNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classifies the term values of a normalized query tree.
 *
 * <ul>
 *   <li>A term under a negation is excluded.</li>
 *   <li>A term under neither a negation nor a conjunction is standalone.</li>
 *   <li>Every conjunction pairs all distinct values of its whole subtree, negated ones included.</li>
 * </ul>
 * Pairs touching a standalone value are dropped at the end, regardless of where that value occurred.
 */
public final class TermCategorizer {

    private TermCategorizer() {}

    public static TermSummary categorize(QueryNode root) {
        var standalone = new TreeSet<String>();
        var excluded = new TreeSet<String>();
        var pairs = new TreeSet<TermPair>();

        walk(root, standalone, excluded, pairs);
        pairs.removeIf(pair -> standalone.contains(pair.first()) || standalone.contains(pair.second()));

        return new TermSummary(standalone, excluded, pairs);
    }

    private static void walk(QueryNode root,
                             Set<String> standalone,
                             Set<String> excluded,
                             Set<TermPair> pairs) {
        var pending = new ArrayDeque<Visit>();
        pending.push(new Visit(root, Context.EMPTY));
        while (!pending.isEmpty()) {
            var visit = pending.pop();
            var node = visit.node();
            var context = visit.context();
            if (node instanceof QueryNode.Term term) {
                if (context.contains(Tag.NOT)) {
                    excluded.add(term.value());
                } else if (!context.contains(Tag.AND)) {
                    standalone.add(term.value());
                }
                continue;
            }
            if (node instanceof QueryNode.Not) {
                context = context.push(Tag.NOT);
            } else if (node instanceof QueryNode.And and) {
                addPairs(and, pairs);
                context = context.push(Tag.AND);
            }
            for (var child : node.children()) {
                pending.push(new Visit(child, context));
            }
        }
    }

    private static void addPairs(QueryNode.And and, Set<TermPair> pairs) {
        var values = new ArrayList<>(new LinkedHashSet<>(and.termValues()));
        for (int i = 0; i < values.size(); i++) {
            for (int j = i + 1; j < values.size(); j++) {
                pairs.add(TermPair.of(values.get(i), values.get(j)));
            }
        }
    }

    private record Visit(QueryNode node, Context context) {}

    enum Tag {
        NOT,
        AND
    }

    /**
     * Persistent stack of tags; pushing returns a new stack and leaves the receiver untouched.
     */
    record Context(Tag head, Context tail) {
        static final Context EMPTY = new Context(null, null);

        Context push(Tag tag) {
            return new Context(tag, this);
        }

        boolean contains(Tag tag) {
            for (var current = this; current.head != null; current = current.tail) {
                if (current.head == tag) {
                    return true;
                }
            }
            return false;
        }
    }
}
