package org.pragmatica.querylang;

import org.pragmatica.querylang.analysis.TermCategorizer;
import org.pragmatica.querylang.analysis.TermSummary;
import org.pragmatica.querylang.ast.QueryNode;
import org.pragmatica.querylang.rewrite.NodeBudgetExceededException;
import org.pragmatica.querylang.rewrite.QueryRewriter;
import org.pragmatica.querylang.rewrite.RewriteResult;
import org.pragmatica.querylang.syntax.CommentStripper;
import org.pragmatica.querylang.syntax.QueryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the query pipeline: strip annotations, parse, normalize, categorize.
 *
 * <p>Example usage:
 * <pre>{@code
 * var compiler = QueryCompiler.create();
 * var query = compiler.compile("a AND (b OR c) <<<note>>>");
 *
 * System.out.println(query.report());
 * }</pre>
 *
 * <p>A compiler is immutable; one instance may compile queries from several threads.
 */
public final class QueryCompiler {
    private static final Logger log = LoggerFactory.getLogger(QueryCompiler.class);

    private final QueryCompilerConfig config;
    private final CommentStripper stripper;
    private final QueryParser parser;
    private final QueryRewriter rewriter;

    private QueryCompiler(QueryCompilerConfig config) {
        this.config = config;
        this.stripper = CommentStripper.create(config.commentOpen(), config.commentClose());
        this.parser = QueryParser.create(config.literalOpen(),
                                         config.literalClose(),
                                         config.caseFold(),
                                         config.maxDepth());
        this.rewriter = QueryRewriter.create(config.passLimit(), config.nodeLimit());
    }

    public static QueryCompiler create() {
        return create(QueryCompilerConfig.DEFAULT);
    }

    public static QueryCompiler create(QueryCompilerConfig config) {
        return new QueryCompiler(config);
    }

    public QueryCompilerConfig config() {
        return config;
    }

    public String strip(String text) {
        return stripper.strip(text);
    }

    /**
     * Strip annotations and parse, without normalizing.
     */
    public QueryNode parse(String text) throws QuerySyntaxException {
        return parser.parse(strip(text));
    }

    public RewriteResult normalize(QueryNode node) throws NodeBudgetExceededException {
        return rewriter.normalize(node);
    }

    public TermSummary categorize(QueryNode node) {
        return TermCategorizer.categorize(node);
    }

    /**
     * Run the whole pipeline.
     *
     * @throws QuerySyntaxException        if the query text is malformed
     * @throws NodeBudgetExceededException if normalization outgrows the node limit
     */
    public CompiledQuery compile(String text) throws QueryCompilationException {
        log.debug("Compiling query of {} characters", text.length());
        var source = strip(text);
        var parsed = parser.parse(source);
        var normalized = rewriter.normalize(parsed);
        var summary = categorize(normalized.normalized());
        log.debug("Compiled {}: {} standalone, {} excluded, {} pairs",
                  normalized.normalized(),
                  summary.standalone()
                         .size(),
                  summary.excluded()
                         .size(),
                  summary.requiresPairs()
                         .size());
        return new CompiledQuery(source, parsed, normalized, summary);
    }
}
