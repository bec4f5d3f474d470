package org.pragmatica.querylang.analysis;

/**
 * Unordered pair of distinct term values, stored with {@code first < second}.
 */
public record TermPair(String first, String second) implements Comparable<TermPair> {
    public TermPair {
        if (first.compareTo(second) >= 0) {
            throw new IllegalArgumentException("Pair must be ordered and distinct: (" + first + ", " + second + ")");
        }
    }

    public static TermPair of(String a, String b) {
        return a.compareTo(b) < 0
               ? new TermPair(a, b)
               : new TermPair(b, a);
    }

    @Override
    public int compareTo(TermPair other) {
        int result = first.compareTo(other.first);
        return result != 0
               ? result
               : second.compareTo(other.second);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
