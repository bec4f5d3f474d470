package org.pragmatica.querylang.peg.action;

import org.pragmatica.querylang.peg.source.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Semantic values passed to actions during parsing.
 * Provides access to matched text and child values.
 */
public final class SemanticValues {
    private final String matchedText;
    private final SourceSpan span;
    private final List<Object> values;

    private SemanticValues(String matchedText, SourceSpan span, List<Object> values) {
        this.matchedText = matchedText;
        this.span = span;
        this.values = values;
    }

    public static SemanticValues of(String matchedText, SourceSpan span, List<Object> values) {
        return new SemanticValues(matchedText, span, List.copyOf(values));
    }

    /**
     * Get the full matched text, or the text captured by a token boundary.
     */
    public String token() {
        return matchedText;
    }

    /**
     * Get source span of the match.
     */
    public SourceSpan span() {
        return span;
    }

    /**
     * Get the number of child values.
     */
    public int size() {
        return values.size();
    }

    /**
     * Check if there are child values.
     */
    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Get child value by index.
     *
     * <p>The cast is unchecked; actions know the value types their sub-rules produce.
     * For checked access use {@link #get(int, Class)}.
     */
    @SuppressWarnings("unchecked")
    public <T> T get(int index) {
        return (T) values.get(index);
    }

    /**
     * Get child value by index with type checking.
     * Returns empty if index is out of bounds or type doesn't match.
     */
    public <T> Optional<T> get(int index, Class<T> type) {
        if (index < 0 || index >= values.size()) {
            return Optional.empty();
        }
        var value = values.get(index);
        if (type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        return Optional.empty();
    }

    /**
     * Get all child values.
     */
    public List<Object> values() {
        return values;
    }

    /**
     * Cast all child values to a specific type.
     */
    @SuppressWarnings("unchecked")
    public <T> List<T> transform() {
        return values.stream()
                     .map(v -> (T) v)
                     .toList();
    }

    @Override
    public String toString() {
        return "SemanticValues{token='" + matchedText + "', values=" + values + "}";
    }
}
