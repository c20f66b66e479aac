package com.dcruver.goldenset.nlp;

import java.util.Arrays;

/**
 * Fixed-size min-hash signature of a shingle set.
 * Only sketches built with the same seed and permutation count are comparable.
 */
public final class MinHashSketch {

    private final long seed;
    private final long[] values;

    MinHashSketch(long seed, long[] values) {
        this.seed = seed;
        this.values = values;
    }

    public long getSeed() {
        return seed;
    }

    public int size() {
        return values.length;
    }

    public long[] values() {
        return values.clone();
    }

    /**
     * Fraction of slots holding the same minimum
     */
    public double estimateJaccard(MinHashSketch other) {
        if (other.seed != seed || other.values.length != values.length) {
            throw new IllegalArgumentException(String.format(
                "Cannot compare sketches with different parameters (seed %d/%d, size %d/%d)",
                seed, other.seed, values.length, other.values.length));
        }
        int equal = 0;
        for (int i = 0; i < values.length; i++) {
            if (values[i] == other.values[i]) {
                equal++;
            }
        }
        return (double) equal / values.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MinHashSketch that)) {
            return false;
        }
        return seed == that.seed && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(seed) + Arrays.hashCode(values);
    }
}
