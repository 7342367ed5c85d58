package com.purchasingpower.itemgraph.normalize;

/**
 * Expected domain of a numeric field. A value outside it is reported, never clamped.
 */
public enum RangeRule {
    ANY {
        @Override
        public boolean accepts(double value) {
            return true;
        }
    },
    NON_NEGATIVE {
        @Override
        public boolean accepts(double value) {
            return value >= 0;
        }
    },
    CHANCE {
        @Override
        public boolean accepts(double value) {
            return value >= 0 && value <= 1;
        }
    };

    public abstract boolean accepts(double value);
}
