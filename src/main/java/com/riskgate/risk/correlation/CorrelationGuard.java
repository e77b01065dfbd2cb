package com.riskgate.risk.correlation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Correlation-based concentration guard.
 *
 * <p>Answers two questions for the unified risk pipeline:
 * <ul>
 *   <li>Would adding a ticker create an over-correlated pair with an existing holding, or
 *       push a correlated cluster to its size limit? ({@link #checkNewTrade})</li>
 *   <li>How correlated is a set of holdings overall? ({@link #getPortfolioConcentrationScore})</li>
 * </ul>
 *
 * <p>Every {@link #computeMatrix} call is a fresh O(n^2) pass over the supplied return series;
 * nothing is cached between calls.
 *
 * <p><b>Thread safety:</b> stateless apart from the immutable config, so a single instance can
 * serve concurrent assessments without locking.
 */
public class CorrelationGuard {

    private static final Logger log = LoggerFactory.getLogger(CorrelationGuard.class);

    private final CorrelationConfig config;

    public CorrelationGuard() {
        this(CorrelationConfig.defaults());
    }

    public CorrelationGuard(CorrelationConfig config) {
        config.validate();
        this.config = config;
    }

    public CorrelationConfig getConfig() {
        return config;
    }

    // ========================
    // MATRIX
    // ========================

    /**
     * Computes the pairwise Pearson correlation matrix for the supplied return series.
     *
     * <p>Tickers are ordered lexicographically. Each series is first cut to its most recent
     * {@code lookbackDays} observations; each pair is then compared over the most recent
     * {@code min(len(a), len(b))} observations. Pairs with fewer than {@code minDataPoints}
     * common observations, or with a zero-variance side, report 0.0.
     *
     * @param returns daily returns per ticker, oldest first
     * @return a new matrix (empty for empty input)
     */
    public CorrelationMatrix computeMatrix(Map<String, List<Double>> returns) {
        if (returns == null || returns.isEmpty()) {
            return CorrelationMatrix.empty();
        }

        TreeMap<String, List<Double>> ordered = new TreeMap<>();
        for (Map.Entry<String, List<Double>> entry : returns.entrySet()) {
            List<Double> series = entry.getValue() != null ? entry.getValue() : List.of();
            ordered.put(entry.getKey(), applyLookback(series));
        }

        List<String> tickers = new ArrayList<>(ordered.keySet());
        int n = tickers.size();
        double[][] matrix = new double[n][n];
        double maxCorrelation = 0.0;

        for (int i = 0; i < n; i++) {
            matrix[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double correlation = pearson(ordered.get(tickers.get(i)), ordered.get(tickers.get(j)));
                matrix[i][j] = correlation;
                matrix[j][i] = correlation;
                if (Math.abs(correlation) > Math.abs(maxCorrelation)) {
                    maxCorrelation = correlation;
                }
            }
        }

        List<List<String>> clusters = findClusters(tickers, matrix);
        log.debug("Correlation matrix computed for {} tickers, {} clusters, max |corr| {}",
                n, clusters.size(), maxCorrelation);
        return new CorrelationMatrix(tickers, matrix, clusters, maxCorrelation, Instant.now());
    }

    /**
     * Pearson correlation over the most recent common observations of two series.
     *
     * @return correlation in [-1, 1]; 0.0 for insufficient data or zero variance
     */
    public double pearson(List<Double> first, List<Double> second) {
        int length = Math.min(first.size(), second.size());
        if (length < config.getMinDataPoints()) {
            return 0.0;
        }
        List<Double> a = first.subList(first.size() - length, first.size());
        List<Double> b = second.subList(second.size() - length, second.size());

        double meanA = 0.0;
        double meanB = 0.0;
        for (int k = 0; k < length; k++) {
            meanA += a.get(k);
            meanB += b.get(k);
        }
        meanA /= length;
        meanB /= length;

        double covariance = 0.0;
        double varianceA = 0.0;
        double varianceB = 0.0;
        for (int k = 0; k < length; k++) {
            double diffA = a.get(k) - meanA;
            double diffB = b.get(k) - meanB;
            covariance += diffA * diffB;
            varianceA += diffA * diffA;
            varianceB += diffB * diffB;
        }

        if (varianceA == 0.0 || varianceB == 0.0) {
            return 0.0;
        }
        double correlation = covariance / Math.sqrt(varianceA * varianceB);
        if (Double.isNaN(correlation)) {
            return 0.0;
        }
        // Floating drift can push identical series just past 1.0
        return Math.max(-1.0, Math.min(1.0, correlation));
    }

    /**
     * Greedy single-pass clustering: each unvisited ticker (in matrix order) seeds a cluster
     * and absorbs every later unvisited ticker whose |corr| with the seed meets the threshold.
     */
    private List<List<String>> findClusters(List<String> tickers, double[][] matrix) {
        int n = tickers.size();
        boolean[] visited = new boolean[n];
        List<List<String>> clusters = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (visited[i]) {
                continue;
            }
            visited[i] = true;
            List<String> cluster = new ArrayList<>();
            cluster.add(tickers.get(i));
            for (int j = i + 1; j < n; j++) {
                if (!visited[j] && Math.abs(matrix[i][j]) >= config.getClusterThreshold()) {
                    cluster.add(tickers.get(j));
                    visited[j] = true;
                }
            }
            if (cluster.size() >= 2) {
                clusters.add(cluster);
            }
        }
        return clusters;
    }

    private List<Double> applyLookback(List<Double> series) {
        int lookback = config.getLookbackDays();
        if (lookback <= 0 || series.size() <= lookback) {
            return series;
        }
        return series.subList(series.size() - lookback, series.size());
    }

    // ========================
    // PRE-TRADE CHECK
    // ========================

    /**
     * Decides whether {@code ticker} may be added to {@code currentHoldings}.
     *
     * <p>Checks (in order, first failure wins):
     * <ol>
     *   <li>|corr(ticker, holding)| above {@code maxPairwiseCorrelation} for any holding, in
     *       holdings order</li>
     *   <li>for each cluster containing the ticker, the number of holdings already in it is at
     *       least {@code maxClusterSize - 1}</li>
     * </ol>
     *
     * <p>The cluster test uses the clusters of the snapshot matrix as computed; the candidate's
     * own effect on cluster membership is not recomputed. Holdings are taken as given: a
     * holding in the candidate ticker itself correlates at 1.0 and rejects, and repeated
     * holdings each count toward a cluster.
     *
     * @return approved when holdings are empty or the ticker is not in the matrix
     */
    public CorrelationCheckResult checkNewTrade(
            String ticker, CorrelationMatrix matrix, List<String> currentHoldings) {
        if (currentHoldings == null || currentHoldings.isEmpty() || !matrix.contains(ticker)) {
            return CorrelationCheckResult.approved();
        }

        for (String holding : currentHoldings) {
            OptionalDouble correlation = matrix.getCorrelation(ticker, holding);
            if (correlation.isPresent()
                    && Math.abs(correlation.getAsDouble()) > config.getMaxPairwiseCorrelation()) {
                String reason = String.format(
                        Locale.ROOT,
                        "Correlation %s/%s = %.2f exceeds limit %.2f",
                        ticker,
                        holding,
                        correlation.getAsDouble(),
                        config.getMaxPairwiseCorrelation());
                log.debug("Correlation guard rejected {}: {}", ticker, reason);
                return CorrelationCheckResult.rejected(reason);
            }
        }

        for (List<String> cluster : matrix.clustersContaining(ticker)) {
            long overlap = currentHoldings.stream().filter(cluster::contains).count();
            if (overlap >= config.getMaxClusterSize() - 1) {
                String reason = String.format(
                        Locale.ROOT,
                        "Adding %s would create a correlated cluster of %d positions (max %d): %s",
                        ticker,
                        overlap + 1,
                        config.getMaxClusterSize(),
                        cluster);
                log.debug("Correlation guard rejected {}: {}", ticker, reason);
                return CorrelationCheckResult.rejected(reason);
            }
        }

        return CorrelationCheckResult.approved();
    }

    // ========================
    // CONCENTRATION
    // ========================

    /**
     * Scores how correlated a set of holdings is, from 0 (uncorrelated or fewer than two
     * holdings) to 100 (perfectly correlated).
     *
     * <p>Average |corr| over all unordered pairs of holdings present in the matrix, times 100,
     * capped at 100. A ticker listed twice pairs with itself at 1.0. Pairs with a ticker missing
     * from the matrix are skipped rather than counted as zero.
     */
    public double getPortfolioConcentrationScore(CorrelationMatrix matrix, List<String> holdings) {
        if (holdings == null || holdings.size() < 2) {
            return 0.0;
        }

        double total = 0.0;
        int pairs = 0;
        for (int i = 0; i < holdings.size(); i++) {
            for (int j = i + 1; j < holdings.size(); j++) {
                OptionalDouble correlation = matrix.getCorrelation(holdings.get(i), holdings.get(j));
                if (correlation.isPresent()) {
                    total += Math.abs(correlation.getAsDouble());
                    pairs++;
                }
            }
        }
        if (pairs == 0) {
            return 0.0;
        }
        return Math.min(100.0, total / pairs * 100.0);
    }
}
