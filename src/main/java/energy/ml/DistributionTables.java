package energy.ml;

import static energy.ml.EstimationException.Kind.INVALID_DEGREES_OF_FREEDOM;
import static energy.ml.EstimationException.Kind.INVALID_PROBABILITY;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Critical values of Student's t and Fisher's F distributions from fixed tables.
 * <p>
 * t: exact table hits, linear interpolation between tabulated degrees of freedom, and a normal
 * approximation for large samples. F: alpha = 0.05 only; every combination outside the table
 * returns {@link #F_FALLBACK}. That constant is a known approximation, callers must tolerate it.
 */
public final class DistributionTables {

    /** Returned by {@link #fCritical(double, int, int)} for any untabulated combination. */
    public static final double F_FALLBACK = 3.0;

    /** Above this many degrees of freedom t is replaced by the normal quantile. */
    public static final int T_LARGE_SAMPLE_DF = 30;

    private static final double[] T_PROBABILITIES = {0.95, 0.975};
    private static final double PROBABILITY_MATCH = 1e-9;

    // df -> {t(0.95), t(0.975)}
    private static final NavigableMap<Integer, double[]> T_TABLE;

    private static final double F_ALPHA = 0.05;
    private static final int[] F_DF2 = {1, 2, 3, 4, 5, 10, 20, 30};
    // df1 -> values aligned with F_DF2
    private static final Map<Integer, double[]> F_TABLE;

    static {
        TreeMap<Integer, double[]> t = new TreeMap<>();
        t.put(1, new double[] {6.314, 12.706});
        t.put(2, new double[] {2.920, 4.303});
        t.put(3, new double[] {2.353, 3.182});
        t.put(4, new double[] {2.132, 2.776});
        t.put(5, new double[] {2.015, 2.571});
        t.put(6, new double[] {1.943, 2.447});
        t.put(7, new double[] {1.895, 2.365});
        t.put(8, new double[] {1.860, 2.306});
        t.put(9, new double[] {1.833, 2.262});
        t.put(10, new double[] {1.812, 2.228});
        t.put(15, new double[] {1.753, 2.131});
        t.put(20, new double[] {1.725, 2.086});
        t.put(25, new double[] {1.708, 2.060});
        t.put(30, new double[] {1.697, 2.042});
        T_TABLE = Collections.unmodifiableNavigableMap(t);

        TreeMap<Integer, double[]> f = new TreeMap<>();
        f.put(1, new double[] {161.4, 18.51, 10.13, 7.71, 6.61, 4.96, 4.35, 4.17});
        f.put(2, new double[] {199.5, 19.00, 9.55, 6.94, 5.79, 4.10, 3.49, 3.32});
        f.put(3, new double[] {215.7, 19.16, 9.28, 6.59, 5.41, 3.71, 3.10, 2.92});
        f.put(4, new double[] {224.6, 19.25, 9.12, 6.39, 5.19, 3.48, 2.87, 2.69});
        f.put(5, new double[] {230.2, 19.30, 9.01, 6.26, 5.05, 3.33, 2.71, 2.53});
        F_TABLE = Collections.unmodifiableMap(f);
    }

    // Abramowitz & Stegun 26.2.23
    private static final double C0 = 2.515517;
    private static final double C1 = 0.802853;
    private static final double C2 = 0.010328;
    private static final double D1 = 1.432788;
    private static final double D2 = 0.189269;
    private static final double D3 = 0.001308;

    private DistributionTables() {}

    /**
     * One-sided critical value of Student's t distribution.
     *
     * @param probability cumulative probability, 0.95 or 0.975 when {@code df <= 30}
     * @param df          degrees of freedom
     * @throws EstimationException {@code INVALID_DEGREES_OF_FREEDOM} if {@code df <= 0},
     *                             {@code INVALID_PROBABILITY} if the probability is not tabulated
     */
    public static double tCritical(double probability, int df) {
        if (df <= 0) {
            throw new EstimationException(INVALID_DEGREES_OF_FREEDOM, "Degrees of freedom must be positive, got " + df);
        }
        if (df > T_LARGE_SAMPLE_DF) {
            return normalQuantile(probability);
        }
        int column = tColumn(probability);

        double[] exact = T_TABLE.get(df);
        if (exact != null) {
            return exact[column];
        }

        Map.Entry<Integer, double[]> lower = T_TABLE.floorEntry(df);
        Map.Entry<Integer, double[]> upper = T_TABLE.ceilingEntry(df);
        if (lower == null || upper == null) {
            return normalQuantile(probability);
        }
        double weight = (double) (df - lower.getKey()) / (upper.getKey() - lower.getKey());
        double lo = lower.getValue()[column];
        double hi = upper.getValue()[column];
        return lo + weight * (hi - lo);
    }

    /**
     * Upper critical value of the F distribution from the alpha = 0.05 table.
     * <p>
     * Untabulated (alpha, df1, df2) combinations return {@link #F_FALLBACK} rather than an interpolated value.
     */
    public static double fCritical(double alpha, int df1, int df2) {
        if (Math.abs(alpha - F_ALPHA) > PROBABILITY_MATCH) return F_FALLBACK;
        double[] row = F_TABLE.get(df1);
        if (row == null) return F_FALLBACK;
        for (int i = 0; i < F_DF2.length; i++) {
            if (F_DF2[i] == df2) return row[i];
        }
        return F_FALLBACK;
    }

    /**
     * Quantile of the standard normal distribution.
     * <p>
     * Uses Φ⁻¹(p) = -Φ⁻¹(1-p) below 0.5 and a rational approximation above it; absolute error is
     * under 4.5e-4.
     *
     * @throws EstimationException {@code INVALID_PROBABILITY} unless {@code 0 < p < 1}
     */
    public static double normalQuantile(double p) {
        if (!(p > 0.0 && p < 1.0)) {
            throw new EstimationException(INVALID_PROBABILITY, "Probability must lie in (0, 1), got " + p);
        }
        if (p < 0.5) {
            return -normalQuantile(1.0 - p);
        }
        double t = Math.sqrt(-2.0 * Math.log(1.0 - p));
        return t - (C0 + C1 * t + C2 * t * t) / (1.0 + D1 * t + D2 * t * t + D3 * t * t * t);
    }

    private static int tColumn(double probability) {
        for (int i = 0; i < T_PROBABILITIES.length; i++) {
            if (Math.abs(T_PROBABILITIES[i] - probability) < PROBABILITY_MATCH) return i;
        }
        throw new EstimationException(INVALID_PROBABILITY, "No tabulated t value for probability " + probability
            + "; expected 0.95 or 0.975");
    }
}
