package com.riskgate.unit.correlation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.riskgate.risk.correlation.CorrelationMatrix;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CorrelationMatrixTest {

    private final CorrelationMatrix matrix = new CorrelationMatrix(
            List.of("AAPL", "MSFT", "XOM"),
            new double[][] {{1.0, 0.812345, 0.1}, {0.812345, 1.0, 0.2}, {0.1, 0.2, 1.0}},
            List.of(List.of("AAPL", "MSFT")),
            0.812345,
            Instant.parse("2024-03-01T14:30:00Z"));

    @Test
    @DisplayName("Pair lookup works in both directions and is empty for unknown tickers")
    void getCorrelation() {
        assertThat(matrix.getCorrelation("AAPL", "MSFT").getAsDouble()).isEqualTo(0.812345);
        assertThat(matrix.getCorrelation("MSFT", "AAPL").getAsDouble()).isEqualTo(0.812345);
        assertThat(matrix.getCorrelation("AAPL", "TSLA")).isEmpty();
    }

    @Test
    @DisplayName("Matrix is copied on the way in and on the way out")
    void defensiveCopies() {
        double[][] source = {{1.0, 0.3}, {0.3, 1.0}};
        List<String> tickers = new ArrayList<>(List.of("A", "B"));
        CorrelationMatrix copy = CorrelationMatrix.of(tickers, source);

        source[0][1] = 0.99;
        tickers.add("C");
        copy.getMatrix()[0][1] = 0.99;

        assertThat(copy.getCorrelation("A", "B").getAsDouble()).isEqualTo(0.3);
        assertThat(copy.getTickers()).containsExactly("A", "B");
    }

    @Test
    @DisplayName("Non-square input is rejected")
    void nonSquare_rejected() {
        assertThatThrownBy(() -> CorrelationMatrix.of(List.of("A", "B"), new double[][] {{1.0}}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CorrelationMatrix.of(List.of("A", "B"), new double[][] {{1.0, 0.1}, {0.1}}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("clustersContaining returns only clusters with the ticker")
    void clustersContaining() {
        assertThat(matrix.clustersContaining("MSFT")).containsExactly(List.of("AAPL", "MSFT"));
        assertThat(matrix.clustersContaining("XOM")).isEmpty();
    }

    @Test
    @DisplayName("toMap rounds correlations to four decimals")
    void toMap() {
        Map<String, Object> map = matrix.toMap();

        assertThat(map).containsKeys("tickers", "matrix", "clusters", "max_correlation", "computed_at");
        assertThat(map.get("max_correlation")).isEqualTo(0.8123);
        assertThat(map.get("computed_at")).isEqualTo("2024-03-01T14:30:00Z");
        @SuppressWarnings("unchecked")
        List<List<Double>> rows = (List<List<Double>>) map.get("matrix");
        assertThat(rows.get(0)).containsExactly(1.0, 0.8123, 0.1);
    }

    @Test
    @DisplayName("Empty matrix has no tickers and no clusters")
    void empty() {
        CorrelationMatrix empty = CorrelationMatrix.empty();

        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.size()).isZero();
        assertThat(empty.contains("AAPL")).isFalse();
        assertThat(empty.getClusters()).isEmpty();
    }
}
