package org.pragmatica.querylang;

import org.pragmatica.querylang.analysis.TermSummary;
import org.pragmatica.querylang.ast.QueryNode;
import org.pragmatica.querylang.report.SummaryFormatter;
import org.pragmatica.querylang.rewrite.RewriteResult;

/**
 * Everything produced for one query.
 *
 * @param source     query text with annotation blocks removed
 * @param parsed     tree as built by the parser
 * @param normalized normalization outcome
 * @param summary    term classification of the normalized tree
 */
public record CompiledQuery(String source, QueryNode parsed, RewriteResult normalized, TermSummary summary) {

    public QueryNode tree() {
        return normalized.normalized();
    }

    public boolean converged() {
        return normalized.converged();
    }

    public String report() {
        return SummaryFormatter.format(summary);
    }
}
