package com.riskgate.risk.correlation;

import com.riskgate.risk.RiskMath;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Immutable snapshot of pairwise return correlations for an ordered set of tickers.
 *
 * <p>Built fresh by {@link CorrelationGuard#computeMatrix} on every call. The ticker-to-index
 * map is built once at construction so pair lookups are O(1). The matrix is symmetric with a
 * diagonal of 1.0; clusters are groups of two or more tickers whose correlation met the
 * guard's cluster threshold.
 *
 * <p><b>Thread safety:</b> all state is copied on the way in and on the way out, so an instance
 * can be shared freely.
 */
public final class CorrelationMatrix {

    private static final CorrelationMatrix EMPTY =
            new CorrelationMatrix(List.of(), new double[0][0], List.of(), 0.0, Instant.EPOCH);

    private final List<String> tickers;
    private final double[][] matrix;
    private final Map<String, Integer> indexByTicker;
    private final List<List<String>> clusters;
    private final double maxCorrelation;
    private final Instant computedAt;

    public CorrelationMatrix(
            List<String> tickers,
            double[][] matrix,
            List<List<String>> clusters,
            double maxCorrelation,
            Instant computedAt) {
        if (matrix.length != tickers.size()) {
            throw new IllegalArgumentException(
                    "Matrix has " + matrix.length + " rows for " + tickers.size() + " tickers");
        }
        this.tickers = List.copyOf(tickers);
        this.matrix = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            if (matrix[i].length != tickers.size()) {
                throw new IllegalArgumentException("Matrix row " + i + " is not square");
            }
            this.matrix[i] = matrix[i].clone();
        }
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < this.tickers.size(); i++) {
            index.put(this.tickers.get(i), i);
        }
        this.indexByTicker = Collections.unmodifiableMap(index);
        List<List<String>> clusterCopy = new ArrayList<>();
        for (List<String> cluster : clusters) {
            clusterCopy.add(List.copyOf(cluster));
        }
        this.clusters = Collections.unmodifiableList(clusterCopy);
        this.maxCorrelation = maxCorrelation;
        this.computedAt = computedAt;
    }

    /**
     * Matrix without clusters, mostly useful for hand-built fixtures.
     */
    public static CorrelationMatrix of(List<String> tickers, double[][] matrix) {
        return new CorrelationMatrix(tickers, matrix, List.of(), 0.0, Instant.now());
    }

    public static CorrelationMatrix empty() {
        return EMPTY;
    }

    public List<String> getTickers() {
        return tickers;
    }

    /**
     * Returns a copy of the full matrix, rows and columns in {@link #getTickers()} order.
     */
    public double[][] getMatrix() {
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i].clone();
        }
        return copy;
    }

    public List<List<String>> getClusters() {
        return clusters;
    }

    /** Signed value of the pair with the largest absolute correlation (0.0 if no pairs). */
    public double getMaxCorrelation() {
        return maxCorrelation;
    }

    public Instant getComputedAt() {
        return computedAt;
    }

    public int size() {
        return tickers.size();
    }

    public boolean isEmpty() {
        return tickers.isEmpty();
    }

    public boolean contains(String ticker) {
        return indexByTicker.containsKey(ticker);
    }

    /**
     * Correlation between two tickers, or empty if either is not in the matrix.
     */
    public OptionalDouble getCorrelation(String first, String second) {
        Integer i = indexByTicker.get(first);
        Integer j = indexByTicker.get(second);
        if (i == null || j == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(matrix[i][j]);
    }

    /**
     * Clusters that contain {@code ticker}, in cluster order.
     */
    public List<List<String>> clustersContaining(String ticker) {
        List<List<String>> result = new ArrayList<>();
        for (List<String> cluster : clusters) {
            if (cluster.contains(ticker)) {
                result.add(cluster);
            }
        }
        return result;
    }

    /**
     * Plain key-value view for logging and telemetry.
     */
    public Map<String, Object> toMap() {
        List<List<Double>> rows = new ArrayList<>();
        for (double[] row : matrix) {
            List<Double> values = new ArrayList<>(row.length);
            for (double value : row) {
                values.add(RiskMath.round(value, 4));
            }
            rows.add(values);
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("tickers", tickers);
        map.put("matrix", rows);
        map.put("clusters", clusters);
        map.put("max_correlation", RiskMath.round(maxCorrelation, 4));
        map.put("computed_at", computedAt.toString());
        return map;
    }

    @Override
    public String toString() {
        return "CorrelationMatrix{tickers=" + tickers + ", clusters=" + clusters + ", maxCorrelation="
                + maxCorrelation + "}";
    }
}
