package org.pragmatica.querylang.analysis;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Classification of the term values of a normalized query.
 *
 * @param standalone    values relevant on their own
 * @param excluded      values found under a negation
 * @param requiresPairs values that only matter together with another value
 */
public record TermSummary(SortedSet<String> standalone, SortedSet<String> excluded, SortedSet<TermPair> requiresPairs) {

    public TermSummary {
        standalone = Collections.unmodifiableSortedSet(new TreeSet<>(standalone));
        excluded = Collections.unmodifiableSortedSet(new TreeSet<>(excluded));
        requiresPairs = Collections.unmodifiableSortedSet(new TreeSet<>(requiresPairs));
    }
}
