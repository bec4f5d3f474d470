package org.pragmatica.querylang.peg.parser;

import org.pragmatica.querylang.peg.source.SourceLocation;

import java.util.Optional;

/**
 * Result of parsing an expression - either success with a new position or failure.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Successful parse with new position and the semantic value, if the match produced one.
     */
    record Success(
        SourceLocation endLocation,
        Optional<Object> semanticValue
    ) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return true;
        }

        public static Success of(SourceLocation endLocation) {
            return new Success(endLocation, Optional.empty());
        }

        public static Success withValue(SourceLocation endLocation, Object value) {
            return new Success(endLocation, Optional.ofNullable(value));
        }

        public boolean hasSemanticValue() {
            return semanticValue.isPresent();
        }
    }

    /**
     * Failed parse - no match at current position.
     */
    record Failure(
        SourceLocation location,
        String expected
    ) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return false;
        }

        public static Failure at(SourceLocation location, String expected) {
            return new Failure(location, expected);
        }
    }

    /**
     * Special result for predicates - matched but consumed no input.
     */
    record PredicateSuccess(
        SourceLocation location
    ) implements ParseResult {

        @Override
        public boolean isSuccess() {
            return true;
        }
    }
}
