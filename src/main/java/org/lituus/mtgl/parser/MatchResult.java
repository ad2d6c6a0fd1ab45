package org.lituus.mtgl.parser;

/**
 * Result of matching an expression - either success with a new position or failure.
 */
public sealed interface MatchResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Successful match ending before token index {@code end}.
     */
    record Success(int end) implements MatchResult {

        @Override
        public boolean isSuccess() {
            return true;
        }

        public static Success at(int end) {
            return new Success(end);
        }
    }

    /**
     * Failed match - no match at the token index.
     */
    record Failure(
        int position,
        String expected
    ) implements MatchResult {

        @Override
        public boolean isSuccess() {
            return false;
        }

        public static Failure at(int position, String expected) {
            return new Failure(position, expected);
        }
    }

    /**
     * Special result for predicates and anchors - matched but consumed no tokens.
     */
    record PredicateSuccess(int position) implements MatchResult {

        @Override
        public boolean isSuccess() {
            return true;
        }
    }
}
