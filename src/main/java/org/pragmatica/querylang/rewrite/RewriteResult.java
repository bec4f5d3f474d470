package org.pragmatica.querylang.rewrite;

import org.pragmatica.querylang.ast.QueryNode;

/**
 * Outcome of normalization.
 *
 * @param normalized the rewritten tree, best effort when not converged
 * @param passes     passes run, including the final pass that found nothing to change
 * @param converged  false when the pass limit was reached while passes still changed the tree
 * @param nodeCount  nodes in the rewritten tree
 */
public record RewriteResult(QueryNode normalized, int passes, boolean converged, int nodeCount) {}
