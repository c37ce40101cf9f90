package com.safepocket.forecast.operation;

/**
 * How far an actual amount may stray from the expected one.
 */
public sealed interface AmountTolerance permits AmountTolerance.Ratio, AmountTolerance.Unbounded {

    boolean accepts(double actual, double expected);

    static AmountTolerance ratio(double ratio) {
        return new Ratio(ratio);
    }

    static AmountTolerance unbounded() {
        return Unbounded.INSTANCE;
    }

    /**
     * Accepts amounts whose distance to the expected one is at most {@code ratio} times the expected magnitude.
     */
    record Ratio(double ratio) implements AmountTolerance {

        public Ratio {
            if (Double.isNaN(ratio) || Double.isInfinite(ratio) || ratio < 0) {
                throw new IllegalArgumentException("ratio must be a finite, non-negative number");
            }
        }

        @Override
        public boolean accepts(double actual, double expected) {
            return Math.abs(actual - expected) <= Math.abs(expected) * ratio;
        }
    }

    /**
     * Accepts any amount.
     */
    record Unbounded() implements AmountTolerance {

        private static final Unbounded INSTANCE = new Unbounded();

        @Override
        public boolean accepts(double actual, double expected) {
            return true;
        }
    }
}
