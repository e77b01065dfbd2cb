package com.riskgate.unit.correlation;

import static com.riskgate.unit.ReturnFixtures.constant;
import static com.riskgate.unit.ReturnFixtures.mix;
import static com.riskgate.unit.ReturnFixtures.scale;
import static com.riskgate.unit.ReturnFixtures.wave;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.riskgate.exception.InvalidRiskConfigException;
import com.riskgate.risk.correlation.CorrelationCheckResult;
import com.riskgate.risk.correlation.CorrelationConfig;
import com.riskgate.risk.correlation.CorrelationGuard;
import com.riskgate.risk.correlation.CorrelationMatrix;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for CorrelationGuard covering matrix construction, greedy clustering, the
 * pairwise and cluster pre-trade rules, and the portfolio concentration score.
 */
class CorrelationGuardTest {

    private static final double EPS = 1e-9;

    private CorrelationGuard guard;

    @BeforeEach
    void setUp() {
        guard = new CorrelationGuard();
    }

    // ==============================
    // MATRIX
    // ==============================

    @Nested
    @DisplayName("Correlation Matrix")
    class Matrix {

        @Test
        @DisplayName("Empty input gives an empty matrix")
        void emptyInput_emptyMatrix() {
            assertThat(guard.computeMatrix(Map.of()).isEmpty()).isTrue();
            assertThat(guard.computeMatrix(null).isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Tickers are sorted, diagonal is 1.0 and the matrix is symmetric")
        void tickersSorted_symmetricWithUnitDiagonal() {
            Map<String, List<Double>> returns = new HashMap<>();
            returns.put("MSFT", wave(1, 60));
            returns.put("AAPL", mix(0.5, wave(1, 60), wave(2, 60)));
            returns.put("GOOG", wave(3, 60));

            CorrelationMatrix matrix = guard.computeMatrix(returns);
            double[][] values = matrix.getMatrix();

            assertThat(matrix.getTickers()).containsExactly("AAPL", "GOOG", "MSFT");
            for (int i = 0; i < 3; i++) {
                assertThat(values[i][i]).isEqualTo(1.0);
                for (int j = 0; j < 3; j++) {
                    assertThat(values[i][j]).isEqualTo(values[j][i]);
                }
            }
            assertThat(matrix.getCorrelation("AAPL", "MSFT").getAsDouble()).isCloseTo(0.5, within(EPS));
        }

        @Test
        @DisplayName("Identical series correlate at exactly 1.0, negated series at -1.0")
        void identicalAndNegated() {
            List<Double> base = wave(1, 60);
            CorrelationMatrix matrix = guard.computeMatrix(Map.of(
                    "A", base,
                    "B", base,
                    "C", scale(-1.0, base)));

            assertThat(matrix.getCorrelation("A", "B").getAsDouble()).isCloseTo(1.0, within(EPS));
            assertThat(matrix.getCorrelation("A", "C").getAsDouble()).isCloseTo(-1.0, within(EPS));
            assertThat(Math.abs(matrix.getMaxCorrelation())).isCloseTo(1.0, within(EPS));
        }

        @Test
        @DisplayName("Max correlation keeps the sign of the strongest pair")
        void maxCorrelation_isSigned() {
            List<Double> base = wave(1, 60);
            CorrelationMatrix matrix = guard.computeMatrix(Map.of(
                    "A", base,
                    "B", scale(-1.0, base),
                    "C", wave(2, 60)));

            assertThat(matrix.getMaxCorrelation()).isCloseTo(-1.0, within(EPS));
        }

        @Test
        @DisplayName("A single series correlates with itself at exactly 1.0")
        void singleSeries_selfCorrelationOne() {
            CorrelationMatrix matrix = guard.computeMatrix(Map.of("A", wave(1, 5)));

            assertThat(matrix.getCorrelation("A", "A").getAsDouble()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Repeated computation is bit-identical")
        void repeatedComputation_identical() {
            List<Double> u = wave(1, 60);
            Map<String, List<Double>> returns = Map.of(
                    "A", u,
                    "B", mix(0.75, u, wave(2, 60)),
                    "C", wave(3, 60));

            CorrelationMatrix first = guard.computeMatrix(returns);
            CorrelationMatrix second = guard.computeMatrix(returns);

            assertThat(second.getMatrix()).isDeepEqualTo(first.getMatrix());
            assertThat(second.getClusters()).isEqualTo(first.getClusters());
            assertThat(second.getMaxCorrelation()).isEqualTo(first.getMaxCorrelation());
        }

        @Test
        @DisplayName("Fewer common observations than minDataPoints report 0.0")
        void insufficientData_zero() {
            CorrelationMatrix matrix = guard.computeMatrix(Map.of(
                    "A", wave(1, 15),
                    "B", wave(1, 15)));

            assertThat(matrix.getCorrelation("A", "B").getAsDouble()).isZero();
            assertThat(matrix.getClusters()).isEmpty();
        }

        @Test
        @DisplayName("Zero-variance series report 0.0")
        void zeroVariance_zero() {
            CorrelationMatrix matrix = guard.computeMatrix(Map.of(
                    "FLAT", constant(0.001, 60),
                    "B", wave(1, 60)));

            assertThat(matrix.getCorrelation("FLAT", "B").getAsDouble()).isZero();
        }

        @Test
        @DisplayName("Pairs of different lengths use the most recent common observations")
        void differentLengths_alignedOnMostRecent() {
            List<Double> longSeries = wave(1, 80);
            List<Double> shortSeries = longSeries.subList(30, 80);

            assertThat(guard.pearson(longSeries, shortSeries)).isCloseTo(1.0, within(EPS));
        }

        @Test
        @DisplayName("Only the most recent lookbackDays observations are used")
        void lookback_trimsOldObservations() {
            List<Double> a = wave(3, 100);
            List<Double> b = new ArrayList<>(scale(-1.0, a.subList(0, 40)));
            b.addAll(a.subList(40, 100));

            CorrelationMatrix recent = guard.computeMatrix(Map.of("A", a, "B", b));
            CorrelationGuard unlimited =
                    new CorrelationGuard(CorrelationConfig.builder().lookbackDays(0).build());
            CorrelationMatrix full = unlimited.computeMatrix(Map.of("A", a, "B", b));

            assertThat(recent.getCorrelation("A", "B").getAsDouble()).isCloseTo(1.0, within(EPS));
            assertThat(full.getCorrelation("A", "B").getAsDouble()).isLessThan(0.5);
        }
    }

    // ==============================
    // CLUSTERS
    // ==============================

    @Nested
    @DisplayName("Greedy Clustering")
    class Clustering {

        @Test
        @DisplayName("Tickers at or above the cluster threshold are grouped with the seed")
        void correlatedTickers_grouped() {
            List<Double> u = wave(1, 60);
            CorrelationMatrix matrix = guard.computeMatrix(Map.of(
                    "A", u,
                    "B", mix(0.75, u, wave(2, 60)),
                    "C", wave(3, 60)));

            assertThat(matrix.getClusters()).containsExactly(List.of("A", "B"));
        }

        @Test
        @DisplayName("Membership is decided against the seed only, not transitively")
        void clustering_notTransitive() {
            List<Double> u = wave(1, 60);
            List<Double> v = wave(2, 60);
            // B correlates ~0.707 with both A and C; A and C are orthogonal
            CorrelationMatrix matrix = guard.computeMatrix(Map.of(
                    "A", u,
                    "B", mix(Math.sqrt(0.5), u, v),
                    "C", v));

            assertThat(matrix.getCorrelation("B", "C").getAsDouble()).isGreaterThan(0.70);
            assertThat(matrix.getClusters()).containsExactly(List.of("A", "B"));
        }

        @Test
        @DisplayName("Singletons are not reported as clusters")
        void singletons_dropped() {
            CorrelationMatrix matrix = guard.computeMatrix(Map.of(
                    "A", wave(1, 60),
                    "B", wave(2, 60)));

            assertThat(matrix.getClusters()).isEmpty();
        }
    }

    // ==============================
    // PRE-TRADE CHECK
    // ==============================

    @Nested
    @DisplayName("New Trade Check")
    class NewTradeCheck {

        @Test
        @DisplayName("No holdings is always approved")
        void noHoldings_approved() {
            CorrelationMatrix matrix = guard.computeMatrix(Map.of("X", wave(1, 60)));

            CorrelationCheckResult result = guard.checkNewTrade("X", matrix, List.of());

            assertThat(result.isApproved()).isTrue();
            assertThat(result.getReason()).isEqualTo("approved");
        }

        @Test
        @DisplayName("Ticker missing from the matrix is approved")
        void unknownTicker_approved() {
            CorrelationMatrix matrix = guard.computeMatrix(Map.of("A", wave(1, 60)));

            assertThat(guard.checkNewTrade("X", matrix, List.of("A")).isApproved()).isTrue();
        }

        @Test
        @DisplayName("Pairwise correlation above the limit rejects with both tickers named")
        void pairwiseAboveLimit_rejected() {
            List<Double> u = wave(1, 60);
            CorrelationMatrix matrix = guard.computeMatrix(Map.of(
                    "X", u,
                    "H", mix(0.9, u, wave(2, 60))));

            CorrelationCheckResult result = guard.checkNewTrade("X", matrix, List.of("H"));

            assertThat(result.isApproved()).isFalse();
            assertThat(result.getReason()).isEqualTo("Correlation X/H = 0.90 exceeds limit 0.80");
        }

        @Test
        @DisplayName("Negative correlation beyond the limit also rejects")
        void negativePairwise_rejected() {
            List<Double> u = wave(1, 60);
            CorrelationMatrix matrix = guard.computeMatrix(Map.of("X", u, "H", scale(-1.0, u)));

            CorrelationCheckResult result = guard.checkNewTrade("X", matrix, List.of("H"));

            assertThat(result.isApproved()).isFalse();
            assertThat(result.getReason()).isEqualTo("Correlation X/H = -1.00 exceeds limit 0.80");
        }

        @Test
        @DisplayName("Correlation exactly at the limit passes the pairwise rule")
        void exactlyAtLimit_approved() {
            CorrelationMatrix matrix = CorrelationMatrix.of(
                    List.of("H", "X"), new double[][] {{1.0, 0.80}, {0.80, 1.0}});

            assertThat(guard.checkNewTrade("X", matrix, List.of("H")).isApproved()).isTrue();
        }

        @Test
        @DisplayName("First offending holding in holdings order is reported")
        void firstOffendingHolding_reported() {
            CorrelationMatrix matrix = CorrelationMatrix.of(
                    List.of("A", "B", "X"),
                    new double[][] {{1.0, 0.0, 0.85}, {0.0, 1.0, 0.95}, {0.85, 0.95, 1.0}});

            CorrelationCheckResult result = guard.checkNewTrade("X", matrix, List.of("B", "A"));

            assertThat(result.getReason()).startsWith("Correlation X/B");
        }

        @Test
        @DisplayName("Holding the candidate itself rejects on its diagonal correlation of 1.0")
        void sameTickerHolding_rejected() {
            CorrelationMatrix matrix = guard.computeMatrix(Map.of("X", wave(1, 60)));

            CorrelationCheckResult result = guard.checkNewTrade("X", matrix, List.of("X"));

            assertThat(result.isApproved()).isFalse();
            assertThat(result.getReason()).isEqualTo("Correlation X/X = 1.00 exceeds limit 0.80");
        }

        @Test
        @DisplayName("Cluster already holding maxClusterSize - 1 members rejects")
        void fullCluster_rejected() {
            CorrelationMatrix matrix = clusterMatrix(List.of(List.of("A", "B", "C", "X")));

            CorrelationCheckResult result = guard.checkNewTrade("X", matrix, List.of("A", "B", "C"));

            assertThat(result.isApproved()).isFalse();
            assertThat(result.getReason())
                    .isEqualTo("Adding X would create a correlated cluster of 4 positions (max 4): [A, B, C, X]");
        }

        @Test
        @DisplayName("Cluster with room left is approved")
        void clusterWithRoom_approved() {
            CorrelationMatrix matrix = clusterMatrix(List.of(List.of("A", "B", "C", "X")));

            assertThat(guard.checkNewTrade("X", matrix, List.of("A", "B")).isApproved()).isTrue();
        }

        @Test
        @DisplayName("Every holding entry counts toward a cluster, repeats included")
        void duplicateHoldings_eachCounted() {
            CorrelationMatrix matrix = clusterMatrix(List.of(List.of("A", "B", "C", "X")));

            CorrelationCheckResult result = guard.checkNewTrade("X", matrix, List.of("A", "A", "B"));

            assertThat(result.isApproved()).isFalse();
            assertThat(result.getReason()).startsWith("Adding X would create a correlated cluster of 4 positions");
        }

        @Test
        @DisplayName("Cluster rule uses the snapshot clusters: a candidate outside every cluster passes")
        void candidateOutsideSnapshotClusters_approved() {
            // X correlates 0.75 with B, C and D, but greedy seeding put B, C, D with A
            CorrelationMatrix matrix = clusterMatrix(List.of(List.of("A", "B", "C", "D")));

            assertThat(guard.checkNewTrade("X", matrix, List.of("B", "C", "D")).isApproved()).isTrue();
        }

        private CorrelationMatrix clusterMatrix(List<List<String>> clusters) {
            List<String> tickers = List.of("A", "B", "C", "D", "X");
            double[][] values = new double[5][5];
            for (int i = 0; i < 5; i++) {
                for (int j = 0; j < 5; j++) {
                    values[i][j] = i == j ? 1.0 : 0.75;
                }
            }
            return new CorrelationMatrix(tickers, values, clusters, 0.75, Instant.now());
        }
    }

    // ==============================
    // CONCENTRATION
    // ==============================

    @Nested
    @DisplayName("Portfolio Concentration Score")
    class Concentration {

        private final CorrelationMatrix matrix = CorrelationMatrix.of(
                List.of("A", "B", "C"),
                new double[][] {{1.0, 0.5, -0.9}, {0.5, 1.0, 0.1}, {-0.9, 0.1, 1.0}});

        @Test
        @DisplayName("Fewer than two holdings scores 0")
        void fewerThanTwo_zero() {
            assertThat(guard.getPortfolioConcentrationScore(matrix, List.of("A"))).isZero();
            assertThat(guard.getPortfolioConcentrationScore(matrix, List.of())).isZero();
        }

        @Test
        @DisplayName("Score is the mean absolute pairwise correlation times 100")
        void meanAbsoluteCorrelation() {
            double score = guard.getPortfolioConcentrationScore(matrix, List.of("A", "B", "C"));

            assertThat(score).isCloseTo((0.5 + 0.9 + 0.1) / 3 * 100.0, within(EPS));
        }

        @Test
        @DisplayName("Pairs with a ticker missing from the matrix are skipped")
        void missingTicker_skipped() {
            assertThat(guard.getPortfolioConcentrationScore(matrix, List.of("A", "B", "ZZZ")))
                    .isCloseTo(50.0, within(EPS));
        }

        @Test
        @DisplayName("A repeated holding pairs with itself at 1.0")
        void duplicates_pairWithThemselves() {
            // pairs (A,A)=1.0, (A,B)=0.5, (A,B)=0.5
            assertThat(guard.getPortfolioConcentrationScore(matrix, List.of("A", "A", "B")))
                    .isCloseTo(2.0 / 3 * 100.0, within(EPS));
            assertThat(guard.getPortfolioConcentrationScore(matrix, List.of("A", "A")))
                    .isCloseTo(100.0, within(EPS));
        }

        @Test
        @DisplayName("No scorable pairs gives 0")
        void noPairs_zero() {
            assertThat(guard.getPortfolioConcentrationScore(matrix, List.of("Y", "Z"))).isZero();
        }
    }

    // ==============================
    // CONFIG
    // ==============================

    @Nested
    @DisplayName("Config Validation")
    class ConfigValidation {

        @Test
        @DisplayName("Cluster threshold above the pairwise limit is rejected")
        void clusterThresholdAbovePairwise_rejected() {
            CorrelationConfig config = CorrelationConfig.builder()
                    .maxPairwiseCorrelation(0.6)
                    .clusterThreshold(0.7)
                    .build();

            assertThatThrownBy(() -> new CorrelationGuard(config))
                    .isInstanceOf(InvalidRiskConfigException.class)
                    .hasMessageContaining("clusterThreshold");
        }

        @Test
        @DisplayName("Cluster size below 2 is rejected")
        void clusterSizeBelowTwo_rejected() {
            CorrelationConfig config = CorrelationConfig.builder().maxClusterSize(1).build();

            assertThatThrownBy(config::validate).isInstanceOf(InvalidRiskConfigException.class);
        }
    }
}
