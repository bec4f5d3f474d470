package org.pragmatica.querylang;

import org.junit.jupiter.api.Test;
import org.pragmatica.querylang.analysis.TermPair;
import org.pragmatica.querylang.rewrite.NodeBudgetExceededException;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.pragmatica.querylang.ast.QueryNode.and;
import static org.pragmatica.querylang.ast.QueryNode.or;
import static org.pragmatica.querylang.ast.QueryNode.term;

class QueryCompilerTest {
    private final QueryCompiler compiler = QueryCompiler.create();

    @Test
    void compile_conjunction_requiresBothTerms() throws QueryCompilationException {
        var query = compiler.compile("a AND b");

        assertThat(query.tree()).isEqualTo(and(term("a"), term("b")));
        assertThat(query.summary().requiresPairs()).containsExactly(TermPair.of("a", "b"));
        assertThat(query.summary().standalone()).isEmpty();
        assertThat(query.summary().excluded()).isEmpty();
    }

    @Test
    void compile_conjunctionOverDisjunction_distributes() throws QueryCompilationException {
        var query = compiler.compile("a AND (b OR c)");

        assertThat(query.tree()).isEqualTo(or(and(term("a"), term("b")), and(term("a"), term("c"))));
        assertThat(query.summary().requiresPairs()).containsExactly(TermPair.of("a", "b"), TermPair.of("a", "c"));
    }

    @Test
    void compile_negation_excludes() throws QueryCompilationException {
        var summary = compiler.compile("NOT a").summary();

        assertThat(summary.excluded()).containsExactly("a");
        assertThat(summary.standalone()).isEmpty();
    }

    @Test
    void compile_disjunction_isStandalone() throws QueryCompilationException {
        var summary = compiler.compile("a OR b").summary();

        assertThat(summary.standalone()).containsExactly("a", "b");
        assertThat(summary.requiresPairs()).isEmpty();
    }

    @Test
    void compile_literalAndFoldedWord_stayUnrelated() throws QueryCompilationException {
        var summary = compiler.compile("{ABC} AND abc").summary();

        assertThat(summary.requiresPairs()).containsExactly(TermPair.of("{ABC}", "abc"));
        assertThat(summary.requiresPairs().first().first()).isEqualTo("abc");
    }

    @Test
    void compile_danglingOperator_failsAtEndOfInput() {
        var error = catchThrowableOfType(() -> compiler.compile("a AND"), QuerySyntaxException.class);

        assertThat(error).isNotNull();
        assertThat(error.offset()).isEqualTo(5);
        assertThat(error.atEndOfInput()).isTrue();
    }

    @Test
    void compile_stripsAnnotationsBeforeParsing() throws QueryCompilationException {
        var query = compiler.compile("a AND <<<why: see ticket\n(b OR c)>>> b");

        assertThat(query.source()).isEqualTo("a AND  b");
        assertThat(query.parsed()).isEqualTo(and(term("a"), term("b")));
    }

    @Test
    void compile_errorOffset_refersToStrippedText() {
        var error = catchThrowableOfType(() -> compiler.compile("a AND <<<b>>>"), QuerySyntaxException.class);

        assertThat(error).isNotNull();
        assertThat(error.offset()).isEqualTo(6);
    }

    @Test
    void compile_report_rendersSummary() throws QueryCompilationException {
        var report = compiler.compile("(a AND (b OR c)) OR d OR NOT e").report();

        assertThat(report).isEqualTo("""
            Standalone Terms:
             - d

            Excluded Terms:
             - e

            Requires Another:
             - a must appear with (b, c)
            """);
    }

    @Test
    void pipelineSteps_matchCompile() throws QueryCompilationException {
        var text = "x NEAR/2 (y OR z) AND NOT w";

        var parsed = compiler.parse(text);
        var normalized = compiler.normalize(parsed);
        var summary = compiler.categorize(normalized.normalized());
        var compiled = compiler.compile(text);

        assertThat(compiled.parsed()).isEqualTo(parsed);
        assertThat(compiled.normalized()).isEqualTo(normalized);
        assertThat(compiled.summary()).isEqualTo(summary);
        assertThat(compiled.converged()).isTrue();
    }

    @Test
    void compile_customDelimiters_areHonored() throws QueryCompilationException {
        var custom = QueryCompiler.create(QueryCompilerConfig.builder()
                                                             .literalDelimiters("[", "]")
                                                             .commentDelimiters("/*", "*/")
                                                             .build());

        var query = custom.compile("[Exact] AND {word} /* <<<not a comment>>> */");

        assertThat(query.tree()).hasToString("AND(TERM([Exact]), TERM({word}))");
    }

    @Test
    void compile_withoutCaseFold_keepsCase() throws QueryCompilationException {
        var preserving = QueryCompiler.create(QueryCompilerConfig.builder()
                                                                 .caseFold(false)
                                                                 .build());

        assertThat(preserving.compile("Apple OR \"Big Apple\"").summary().standalone())
            .containsExactly("Apple", "Big Apple");
    }

    @Test
    void compile_nodeLimitExceeded_failsWithBudgetError() {
        var limited = QueryCompiler.create(QueryCompilerConfig.builder()
                                                              .nodeLimit(5)
                                                              .build());

        assertThatThrownBy(() -> limited.compile("a AND (b OR c)"))
            .isInstanceOf(NodeBudgetExceededException.class)
            .hasMessageContaining("node limit 5");
    }

    @Test
    void compile_passLimitReached_stillSummarizes() throws QueryCompilationException {
        var limited = QueryCompiler.create(QueryCompilerConfig.builder()
                                                              .passLimit(1)
                                                              .build());

        var query = limited.compile("(a OR b) AND (c OR d)");

        assertThat(query.converged()).isFalse();
        assertThat(query.normalized().passes()).isEqualTo(1);
        assertThat(query.summary().requiresPairs()).isNotEmpty();
    }

    @Test
    void compile_longDisjunction_keepsEveryTermStandalone() throws QueryCompilationException {
        var text = IntStream.range(0, 20_000)
                            .mapToObj(i -> "t" + i)
                            .collect(Collectors.joining(" OR "));

        var query = compiler.compile(text);

        assertThat(query.tree().children()).hasSize(20_000);
        assertThat(query.summary().standalone()).hasSize(20_000);
        assertThat(query.summary().requiresPairs()).isEmpty();
    }

    @Test
    void compile_deeplyNestedGroups_failWithSyntaxError() {
        var text = "(".repeat(2000) + "a" + ")".repeat(2000);

        var error = catchThrowableOfType(() -> compiler.compile(text), QuerySyntaxException.class);

        assertThat(error).isNotNull();
        assertThat(error.offset()).isEqualTo(QueryCompilerConfig.DEFAULT.maxDepth());
    }

    @Test
    void compile_customNestingLimit_isApplied() {
        var shallow = QueryCompiler.create(QueryCompilerConfig.builder()
                                                              .maxDepth(2)
                                                              .build());

        assertThatThrownBy(() -> shallow.compile("NOT (NOT a)"))
            .isInstanceOf(QuerySyntaxException.class)
            .hasMessageContaining("at most 2");
    }

    @Test
    void compile_fromSeveralThreads_givesSameResults() {
        var queries = List.of("a AND (b OR c)", "NOT x OR y", "{L} NEAR/1 m AND (n OR o OR p)");

        var reports = IntStream.range(0, 60)
                               .parallel()
                               .mapToObj(i -> reportOf(queries.get(i % queries.size())))
                               .toList();

        for (int i = 0; i < reports.size(); i++) {
            assertThat(reports.get(i)).isEqualTo(reportOf(queries.get(i % queries.size())));
        }
    }

    @Test
    void config_defaults() {
        var config = QueryCompilerConfig.DEFAULT;

        assertThat(config.passLimit()).isEqualTo(1000);
        assertThat(config.nodeLimit()).isEmpty();
        assertThat(config.caseFold()).isTrue();
        assertThat(config.literalOpen()).isEqualTo("{");
        assertThat(config.literalClose()).isEqualTo("}");
        assertThat(config.commentOpen()).isEqualTo("<<<");
        assertThat(config.commentClose()).isEqualTo(">>>");
        assertThat(config.maxDepth()).isEqualTo(128);
        assertThat(compiler.config()).isEqualTo(config);
    }

    @Test
    void config_invalidValues_areRejected() {
        assertThatThrownBy(() -> QueryCompilerConfig.builder().passLimit(0).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QueryCompilerConfig.builder().nodeLimit(-1).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QueryCompilerConfig.builder().literalDelimiters("", "}").build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QueryCompilerConfig.builder().commentDelimiters("<<<", "").build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> QueryCompilerConfig.builder().maxDepth(0).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    private String reportOf(String query) {
        try {
            return compiler.compile(query).report();
        } catch (QueryCompilationException e) {
            throw new IllegalStateException(e);
        }
    }
}
