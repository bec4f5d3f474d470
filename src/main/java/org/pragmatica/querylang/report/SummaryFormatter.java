package org.pragmatica.querylang.report;

import org.pragmatica.querylang.analysis.TermPair;
import org.pragmatica.querylang.analysis.TermSummary;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Renders a {@link TermSummary} as a plain-text report with three sections.
 *
 * <pre>
 * Standalone Terms:
 *  - a
 *
 * Excluded Terms:
 *  (none)
 *
 * Requires Another:
 *  - b must appear with c
 *  - d must appear with (e, f)
 * </pre>
 *
 * Terms are sorted case-insensitively, ties broken by natural order. Pairs are grouped by their first member.
 */
public final class SummaryFormatter {
    static final Comparator<String> TERM_ORDER = String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

    private static final String NONE = " (none)";

    private SummaryFormatter() {}

    public static String format(TermSummary summary) {
        var sb = new StringBuilder();
        section(sb, "Standalone Terms:", sorted(summary.standalone()));
        sb.append('\n');
        section(sb, "Excluded Terms:", sorted(summary.excluded()));
        sb.append('\n');
        section(sb, "Requires Another:", requirements(summary.requiresPairs()));
        return sb.toString();
    }

    private static void section(StringBuilder sb, String title, List<String> entries) {
        sb.append(title)
          .append('\n');
        if (entries.isEmpty()) {
            sb.append(NONE)
              .append('\n');
            return;
        }
        for (var entry : entries) {
            sb.append(" - ")
              .append(entry)
              .append('\n');
        }
    }

    private static List<String> requirements(Collection<TermPair> pairs) {
        Map<String, TreeSet<String>> partners = new TreeMap<>(TERM_ORDER);
        for (var pair : pairs) {
            partners.computeIfAbsent(pair.first(), key -> new TreeSet<>(TERM_ORDER))
                    .add(pair.second());
        }
        return partners.entrySet()
                       .stream()
                       .map(entry -> entry.getKey() + " must appear with " + describe(entry.getValue()))
                       .toList();
    }

    private static String describe(TreeSet<String> partners) {
        return partners.size() == 1
               ? partners.first()
               : "(" + String.join(", ", partners) + ")";
    }

    private static List<String> sorted(Collection<String> terms) {
        return terms.stream()
                    .sorted(TERM_ORDER)
                    .toList();
    }
}
