package org.pragmatica.querylang.rewrite;

import org.pragmatica.querylang.ast.QueryNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable working copy of a query tree, with nodes addressed by index.
 *
 * <p>Parent links live outside the nodes, in a map rebuilt by {@link #breadthFirst()} on every pass and kept
 * current by the edit operations. Nodes removed from the tree are marked dead and never reused.
 */
final class NodeArena {
    enum Kind {
        TERM,
        NOT,
        AND,
        OR
    }

    private static final int NO_PARENT = -1;

    private final List<Slot> slots = new ArrayList<>();
    private final Map<Integer, Integer> parents = new HashMap<>();
    private final Map<Integer, Integer> positions = new HashMap<>();
    private int root;
    private int liveCount;

    private NodeArena() {}

    static NodeArena from(QueryNode node) {
        var arena = new NodeArena();
        arena.root = arena.importTree(node);
        return arena;
    }

    int root() {
        return root;
    }

    int liveCount() {
        return liveCount;
    }

    Kind kind(int id) {
        return slots.get(id).kind;
    }

    boolean isLive(int id) {
        return slots.get(id).live;
    }

    List<Integer> children(int id) {
        return slots.get(id).children;
    }

    /**
     * Live nodes in breadth-first order from the root. Resets the parent map.
     */
    List<Integer> breadthFirst() {
        parents.clear();
        positions.clear();
        parents.put(root, NO_PARENT);

        var order = new ArrayList<Integer>(liveCount);
        var queue = new ArrayDeque<Integer>();
        queue.add(root);
        while (!queue.isEmpty()) {
            int id = queue.poll();
            order.add(id);
            var children = children(id);
            for (int i = 0; i < children.size(); i++) {
                parents.put(children.get(i), id);
                positions.put(children.get(i), i);
                queue.add(children.get(i));
            }
        }
        return order;
    }

    /**
     * Splice every direct child of the same kind into this node, in place and in order.
     *
     * @return whether any child was spliced
     */
    boolean flatten(int id) {
        var slot = slots.get(id);
        var flattened = new ArrayList<Integer>(slot.children.size());
        boolean changed = false;
        for (int child : slot.children) {
            if (kind(child) == slot.kind) {
                flattened.addAll(children(child));
                kill(child);
                changed = true;
            } else {
                flattened.add(child);
            }
        }
        if (changed) {
            slot.children = flattened;
            reindexChildren(id);
        }
        return changed;
    }

    /**
     * Index of the first direct child of the given kind, or -1.
     */
    int firstChild(int id, Kind kind) {
        var children = children(id);
        for (int i = 0; i < children.size(); i++) {
            if (kind(children.get(i)) == kind) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Rewrite {@code AND(before, OR(c1..cn), after)} as {@code OR(AND(before, c1, after) .. AND(before, cn, after))}.
     * Siblings shared between the new conjunctions are copied, so the arena stays a tree.
     *
     * @return id of the disjunction that took the conjunction's place
     */
    int distribute(int andId, int orIndex) {
        var siblings = children(andId);
        var disjunction = siblings.get(orIndex);

        var conjunctions = new ArrayList<Integer>();
        for (int alternative : children(disjunction)) {
            var operands = new ArrayList<Integer>(siblings.size());
            for (int i = 0; i < siblings.size(); i++) {
                operands.add(copy(i == orIndex ? alternative : siblings.get(i)));
            }
            conjunctions.add(allocate(Kind.AND, null, false, operands));
        }
        int replacement = allocate(Kind.OR, null, false, conjunctions);
        replace(andId, replacement);
        killSubtree(andId);
        return replacement;
    }

    /**
     * Rebuild the immutable tree under {@code id}. Children are built before their parents, without recursion.
     */
    QueryNode toNode(int id) {
        var built = new HashMap<Integer, QueryNode>();
        var order = preOrder(id);
        for (int i = order.size() - 1; i >= 0; i--) {
            int current = order.get(i);
            var slot = slots.get(current);
            var children = new ArrayList<QueryNode>(slot.children.size());
            for (int child : slot.children) {
                children.add(built.remove(child));
            }
            built.put(current, build(slot, children));
        }
        return built.get(id);
    }

    private static QueryNode build(Slot slot, List<QueryNode> children) {
        switch (slot.kind) {
            case TERM:
                return new QueryNode.Term(slot.value, slot.literal);
            case NOT:
                return new QueryNode.Not(children.get(0));
            case AND:
                return new QueryNode.And(children);
            default:
                return new QueryNode.Or(children);
        }
    }

    private List<Integer> preOrder(int id) {
        var order = new ArrayList<Integer>();
        var pending = new ArrayDeque<Integer>();
        pending.push(id);
        while (!pending.isEmpty()) {
            int current = pending.pop();
            order.add(current);
            for (int child : children(current)) {
                pending.push(child);
            }
        }
        return order;
    }

    /**
     * Copy a query tree into the arena depth-first with an explicit stack; parsed chains are as deep as they are long.
     */
    private int importTree(QueryNode top) {
        int topId = NO_PARENT;
        var pending = new ArrayDeque<Pending>();
        pending.push(new Pending(top, NO_PARENT));
        while (!pending.isEmpty()) {
            var next = pending.pop();
            var node = next.node();
            int id = node instanceof QueryNode.Term term
                     ? allocate(Kind.TERM, term.value(), term.literal(), List.of())
                     : allocate(kindOf(node), null, false, List.of());
            attach(next.parent(), id);
            if (next.parent() == NO_PARENT) {
                topId = id;
            }
            var children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(new Pending(children.get(i), id));
            }
        }
        return topId;
    }

    private static Kind kindOf(QueryNode node) {
        if (node instanceof QueryNode.Not) {
            return Kind.NOT;
        }
        return node instanceof QueryNode.And ? Kind.AND : Kind.OR;
    }

    private int copy(int id) {
        int copyId = NO_PARENT;
        var pending = new ArrayDeque<PendingCopy>();
        pending.push(new PendingCopy(id, NO_PARENT));
        while (!pending.isEmpty()) {
            var next = pending.pop();
            var slot = slots.get(next.source());
            int copied = allocate(slot.kind, slot.value, slot.literal, List.of());
            attach(next.parent(), copied);
            if (next.parent() == NO_PARENT) {
                copyId = copied;
            }
            for (int i = slot.children.size() - 1; i >= 0; i--) {
                pending.push(new PendingCopy(slot.children.get(i), copied));
            }
        }
        return copyId;
    }

    private void attach(int parent, int child) {
        if (parent != NO_PARENT) {
            slots.get(parent).children.add(child);
        }
    }

    private int allocate(Kind kind, String value, boolean literal, List<Integer> children) {
        slots.add(new Slot(kind, value, literal, new ArrayList<>(children)));
        liveCount++;
        return slots.size() - 1;
    }

    private void replace(int oldId, int newId) {
        int parent = parents.getOrDefault(oldId, NO_PARENT);
        if (parent == NO_PARENT) {
            root = newId;
            parents.put(newId, NO_PARENT);
            return;
        }
        int position = positions.get(oldId);
        children(parent).set(position, newId);
        parents.put(newId, parent);
        positions.put(newId, position);
    }

    private void reindexChildren(int id) {
        var children = children(id);
        for (int i = 0; i < children.size(); i++) {
            parents.put(children.get(i), id);
            positions.put(children.get(i), i);
        }
    }

    private void kill(int id) {
        var slot = slots.get(id);
        if (slot.live) {
            slot.live = false;
            liveCount--;
        }
    }

    private void killSubtree(int id) {
        for (int node : preOrder(id)) {
            kill(node);
        }
    }

    private record Pending(QueryNode node, int parent) {}

    private record PendingCopy(int source, int parent) {}

    private static final class Slot {
        private final Kind kind;
        private final String value;
        private final boolean literal;
        private List<Integer> children;
        private boolean live = true;

        private Slot(Kind kind, String value, boolean literal, List<Integer> children) {
            this.kind = kind;
            this.value = value;
            this.literal = literal;
            this.children = children;
        }
    }
}
