package org.pragmatica.querylang.rewrite;

import org.pragmatica.querylang.QueryCompilationException;

/**
 * Normalization was aborted because the tree grew past the configured node limit.
 */
public final class NodeBudgetExceededException extends QueryCompilationException {
    private final int nodeLimit;
    private final int nodeCount;
    private final int pass;

    public NodeBudgetExceededException(int nodeLimit, int nodeCount, int pass) {
        super("Normalization exceeded node limit " + nodeLimit + " (reached " + nodeCount + " nodes in pass " + pass + ")");
        this.nodeLimit = nodeLimit;
        this.nodeCount = nodeCount;
        this.pass = pass;
    }

    public int nodeLimit() {
        return nodeLimit;
    }

    public int nodeCount() {
        return nodeCount;
    }

    public int pass() {
        return pass;
    }
}
