package org.pragmatica.querylang.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Abstract syntax tree of a boolean query.
 *
 * <p>Nodes are immutable. {@code And} and {@code Or} are binary right after parsing and n-ary after
 * normalization.
 */
public sealed interface QueryNode {

    /**
     * Leaf term. {@code literal} marks a delimited exact-match token whose case is kept verbatim.
     */
    record Term(String value, boolean literal) implements QueryNode {
        public Term {
            if (value == null || value.isEmpty()) {
                throw new IllegalArgumentException("Term value must not be empty");
            }
        }

        @Override
        public String toString() {
            return "TERM(" + value + ")";
        }
    }

    record Not(QueryNode child) implements QueryNode {
        @Override
        public String toString() {
            return "NOT(" + child + ")";
        }
    }

    record And(List<QueryNode> children) implements QueryNode {
        public And {
            children = List.copyOf(children);
        }

        @Override
        public String toString() {
            return render("AND", children);
        }
    }

    record Or(List<QueryNode> children) implements QueryNode {
        public Or {
            children = List.copyOf(children);
        }

        @Override
        public String toString() {
            return render("OR", children);
        }
    }

    static Term term(String value) {
        return new Term(value, false);
    }

    static Term literal(String value) {
        return new Term(value, true);
    }

    static Not not(QueryNode child) {
        return new Not(child);
    }

    static And and(QueryNode... children) {
        return new And(List.of(children));
    }

    static Or or(QueryNode... children) {
        return new Or(List.of(children));
    }

    /**
     * Direct children in order; empty for terms. {@code And} and {@code Or} answer with their record component.
     */
    default List<QueryNode> children() {
        if (this instanceof Not not) {
            return List.of(not.child());
        }
        return List.of();
    }

    /**
     * Values of every term leaf of this subtree, in depth-first order, duplicates included.
     */
    default List<String> termValues() {
        var values = new ArrayList<String>();
        var pending = new ArrayDeque<QueryNode>();
        pending.push(this);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (node instanceof Term term) {
                values.add(term.value());
                continue;
            }
            var children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return values;
    }

    default int nodeCount() {
        int count = 0;
        var pending = new ArrayDeque<QueryNode>();
        pending.push(this);
        while (!pending.isEmpty()) {
            count++;
            pending.pop()
                   .children()
                   .forEach(pending::push);
        }
        return count;
    }

    private static String render(String tag, List<QueryNode> children) {
        return children.stream()
                       .map(QueryNode::toString)
                       .collect(Collectors.joining(", ", tag + "(", ")"));
    }
}
