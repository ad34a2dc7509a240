package com.ethnicthv.domain.processor.model;

/**
 * How a single member takes part in equality. A member carries at most one strategy.
 */
public sealed interface EqualityStrategy {

    /**
     * Evaluation order; {@code 0} when not given.
     */
    int order();

    /**
     * Whether {@link #order()} was written in source rather than defaulted.
     */
    boolean explicitOrder();

    /** Annotation simple name, used in messages. */
    String annotationName();

    record Include(int order, boolean explicitOrder) implements EqualityStrategy {
        @Override
        public String annotationName() {
            return "@IncludeInEquality";
        }
    }

    record Ignore() implements EqualityStrategy {
        @Override
        public int order() {
            return 0;
        }

        @Override
        public boolean explicitOrder() {
            return false;
        }

        @Override
        public String annotationName() {
            return "@IgnoreEquality";
        }
    }

    record Sequence(int order, boolean explicitOrder, boolean orderMatters, boolean deepEquality)
            implements EqualityStrategy {
        @Override
        public String annotationName() {
            return "@SequenceEquality";
        }
    }

    record Custom(int order, boolean explicitOrder) implements EqualityStrategy {
        @Override
        public String annotationName() {
            return "@CustomEquality";
        }
    }
}
