package com.riskgate.unit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Deterministic return series for risk tests.
 *
 * <p>Sine waves of different integer frequencies over one full period are orthogonal with
 * zero mean and equal variance, so {@code mix(rho, wave(1), wave(2))} correlates with
 * {@code wave(1)} at exactly {@code rho} (up to floating error).
 */
public final class ReturnFixtures {

    private ReturnFixtures() {}

    /** 0.01 * sin(2 pi f i / n) for i in [0, n). */
    public static List<Double> wave(int frequency, int length) {
        List<Double> series = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            series.add(0.01 * Math.sin(2.0 * Math.PI * frequency * i / length));
        }
        return series;
    }

    /** rho * a + sqrt(1 - rho^2) * b, element-wise. */
    public static List<Double> mix(double rho, List<Double> a, List<Double> b) {
        double other = Math.sqrt(1.0 - rho * rho);
        List<Double> series = new ArrayList<>(a.size());
        for (int i = 0; i < a.size(); i++) {
            series.add(rho * a.get(i) + other * b.get(i));
        }
        return series;
    }

    public static List<Double> scale(double factor, List<Double> a) {
        List<Double> series = new ArrayList<>(a.size());
        for (Double value : a) {
            series.add(factor * value);
        }
        return series;
    }

    public static List<Double> constant(double value, int length) {
        return new ArrayList<>(Collections.nCopies(length, value));
    }

    /**
     * Twenty returns: -3% and -1% losses up front, +0.5% on every other day. At 95% confidence
     * VaR is 1.0% and CVaR 2.0%.
     */
    public static List<Double> twoLossDays() {
        List<Double> series = new ArrayList<>();
        series.add(-0.03);
        series.add(-0.01);
        series.addAll(Collections.nCopies(18, 0.005));
        return series;
    }

    /**
     * Twenty returns with -30% and -10% losses on days 10 and 11, +5% otherwise. VaR 10%,
     * CVaR 20%; nearly uncorrelated with {@link #twoLossDays()}.
     */
    public static List<Double> heavyLossDays() {
        List<Double> series = new ArrayList<>(Collections.nCopies(10, 0.05));
        series.add(-0.30);
        series.add(-0.10);
        series.addAll(Collections.nCopies(8, 0.05));
        return series;
    }
}
