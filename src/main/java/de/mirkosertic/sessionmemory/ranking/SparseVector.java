package de.mirkosertic.sessionmemory.ranking;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Term-keyed weight vector. Terms that are not present have an implicit weight of zero.
 */
public final class SparseVector {

    private static final SparseVector EMPTY = new SparseVector(Map.of());

    private final Map<String, Double> weights;

    private SparseVector(final Map<String, Double> weights) {
        this.weights = weights;
    }

    public static SparseVector of(final Map<String, Double> weights) {
        if (weights.isEmpty()) {
            return EMPTY;
        }
        return new SparseVector(Collections.unmodifiableMap(new LinkedHashMap<>(weights)));
    }

    public static SparseVector empty() {
        return EMPTY;
    }

    public double weight(final String term) {
        return weights.getOrDefault(term, 0.0);
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    public int size() {
        return weights.size();
    }

    public Map<String, Double> asMap() {
        return weights;
    }

    /**
     * Dot product. Only terms present in both vectors contribute.
     */
    public double dot(final SparseVector other) {
        final SparseVector smaller = size() <= other.size() ? this : other;
        final SparseVector larger = smaller == this ? other : this;
        double sum = 0.0;
        for (final Map.Entry<String, Double> entry : smaller.weights.entrySet()) {
            final Double w = larger.weights.get(entry.getKey());
            if (w != null) {
                sum += entry.getValue() * w;
            }
        }
        return sum;
    }

    /**
     * Euclidean (L2) norm over this vector's own terms.
     */
    public double norm() {
        double sum = 0.0;
        for (final double w : weights.values()) {
            sum += w * w;
        }
        return Math.sqrt(sum);
    }

    @Override
    public String toString() {
        return "SparseVector" + weights;
    }
}
