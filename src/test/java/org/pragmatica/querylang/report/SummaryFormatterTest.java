package org.pragmatica.querylang.report;

import org.junit.jupiter.api.Test;
import org.pragmatica.querylang.analysis.TermPair;
import org.pragmatica.querylang.analysis.TermSummary;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class SummaryFormatterTest {

    @Test
    void format_emptySummary_marksEverySectionNone() {
        var summary = new TermSummary(sorted(), sorted(), sorted());

        assertThat(SummaryFormatter.format(summary)).isEqualTo("""
            Standalone Terms:
             (none)

            Excluded Terms:
             (none)

            Requires Another:
             (none)
            """);
    }

    @Test
    void format_sortsTermsCaseInsensitively() {
        var summary = new TermSummary(sorted("beta", "Alpha", "gamma"), sorted("Zulu", "echo"), sorted());

        assertThat(SummaryFormatter.format(summary)).isEqualTo("""
            Standalone Terms:
             - Alpha
             - beta
             - gamma

            Excluded Terms:
             - echo
             - Zulu

            Requires Another:
             (none)
            """);
    }

    @Test
    void format_groupsPairsByFirstMember() {
        var summary = new TermSummary(sorted(),
                                      sorted(),
                                      sorted(TermPair.of("a", "b"),
                                             TermPair.of("c", "e"),
                                             TermPair.of("c", "d"),
                                             TermPair.of("c", "F")));

        assertThat(SummaryFormatter.format(summary)).isEqualTo("""
            Standalone Terms:
             (none)

            Excluded Terms:
             (none)

            Requires Another:
             - a must appear with b
             - c must appear with (d, e)
             - F must appear with c
            """);
    }

    @Test
    void format_caseVariants_keepDeterministicOrder() {
        var summary = new TermSummary(sorted("b", "B", "a"), sorted(), sorted());

        assertThat(SummaryFormatter.format(summary)).startsWith("""
            Standalone Terms:
             - a
             - B
             - b
            """);
    }

    @SafeVarargs
    private static <T extends Comparable<T>> SortedSet<T> sorted(T... values) {
        return new TreeSet<>(List.of(values));
    }
}
