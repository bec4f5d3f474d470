package org.pragmatica.querylang.rewrite;

import org.pragmatica.querylang.ast.QueryNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Normalizes a query tree toward a disjunction of conjunctions.
 *
 * <p>Each pass walks the tree breadth-first. Every conjunction splices nested conjunctions into itself and then
 * distributes over its first disjunction child; every disjunction splices nested disjunctions. Passes repeat until
 * one changes nothing or the pass limit is reached.
 *
 * <p>Distribution is exponential in the number of disjunctions under one conjunction. The optional node limit
 * bounds the size of the rewritten tree.
 */
public final class QueryRewriter {
    private static final Logger log = LoggerFactory.getLogger(QueryRewriter.class);

    public static final int DEFAULT_PASS_LIMIT = 1000;

    private final int passLimit;
    private final Optional<Integer> nodeLimit;

    private QueryRewriter(int passLimit, Optional<Integer> nodeLimit) {
        this.passLimit = passLimit;
        this.nodeLimit = nodeLimit;
    }

    public static QueryRewriter create() {
        return create(DEFAULT_PASS_LIMIT, Optional.empty());
    }

    public static QueryRewriter create(int passLimit, Optional<Integer> nodeLimit) {
        if (passLimit < 1) {
            throw new IllegalArgumentException("Pass limit must be positive: " + passLimit);
        }
        nodeLimit.ifPresent(limit -> {
            if (limit < 1) {
                throw new IllegalArgumentException("Node limit must be positive: " + limit);
            }
        });
        return new QueryRewriter(passLimit, nodeLimit);
    }

    public RewriteResult normalize(QueryNode root) throws NodeBudgetExceededException {
        var arena = NodeArena.from(root);
        int initialCount = arena.liveCount();
        checkBudget(arena, 0);

        int passes = 0;
        boolean changed = true;
        while (changed && passes < passLimit) {
            passes++;
            changed = runPass(arena, passes);
            log.trace("Pass {}: changed={}, nodes={}", passes, changed, arena.liveCount());
        }

        boolean converged = !changed;
        if (!converged) {
            log.warn("Normalization did not converge within {} passes, returning best-effort tree of {} nodes",
                     passLimit,
                     arena.liveCount());
        }
        log.debug("Normalized {} nodes into {} nodes in {} passes", initialCount, arena.liveCount(), passes);
        return new RewriteResult(arena.toNode(arena.root()), passes, converged, arena.liveCount());
    }

    private boolean runPass(NodeArena arena, int pass) throws NodeBudgetExceededException {
        boolean changed = false;
        for (int id : arena.breadthFirst()) {
            if (!arena.isLive(id)) {
                continue;
            }
            var kind = arena.kind(id);
            if (kind == NodeArena.Kind.OR) {
                changed |= arena.flatten(id);
            } else if (kind == NodeArena.Kind.AND) {
                changed |= arena.flatten(id);
                int orIndex = arena.firstChild(id, NodeArena.Kind.OR);
                if (orIndex >= 0) {
                    arena.distribute(id, orIndex);
                    changed = true;
                    checkBudget(arena, pass);
                }
            }
        }
        return changed;
    }

    private void checkBudget(NodeArena arena, int pass) throws NodeBudgetExceededException {
        if (nodeLimit.isPresent() && arena.liveCount() > nodeLimit.get()) {
            throw new NodeBudgetExceededException(nodeLimit.get(), arena.liveCount(), pass);
        }
    }
}
