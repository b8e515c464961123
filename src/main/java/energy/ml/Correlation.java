package energy.ml;

import static energy.ml.EstimationException.Kind.LENGTH_MISMATCH;

import org.apache.commons.math3.distribution.TDistribution;

/**
 * Pearson correlation between two samples.
 */
public final class Correlation {

    private static final double CONSTANT_TOLERANCE = 1e-12;

    private Correlation() {}

    /**
     * r = (nΣxy - ΣxΣy) / sqrt((nΣx² - (Σx)²)(nΣy² - (Σy)²))
     * <p>
     * Returns 0 when either series is constant. Rounding leaves a constant series with a variance term
     * that is tiny, or even negative, relative to nΣx², so such terms count as zero. This is an approximation
     * for an undefined correlation, not an error.
     *
     * @throws EstimationException {@code LENGTH_MISMATCH} if the samples differ in length
     */
    public static double pearson(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new EstimationException(LENGTH_MISMATCH, "Samples must have equal length: " + x.length + " vs " + y.length);
        }
        int n = x.length;
        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0, sumY2 = 0;
        for (int i = 0; i < n; i++) {
            sumX += x[i];
            sumY += y[i];
            sumXY += x[i] * y[i];
            sumX2 += x[i] * x[i];
            sumY2 += y[i] * y[i];
        }
        double numerator = n * sumXY - sumX * sumY;
        double sxx = n * sumX2 - sumX * sumX;
        double syy = n * sumY2 - sumY * sumY;
        if (isConstant(sxx, n * sumX2) || isConstant(syy, n * sumY2)) {
            return 0.0;
        }
        double denominator = Math.sqrt(sxx * syy);
        if (!(denominator > 0.0)) {
            return 0.0;
        }
        return numerator / denominator;
    }

    // spread n·Σx² - (Σx)² lost in the rounding of its own terms
    private static boolean isConstant(double spread, double scale) {
        return spread <= CONSTANT_TOLERANCE * scale;
    }

    /**
     * Two-sided p-value of the null hypothesis "no correlation" for coefficient {@code r}
     * over {@code n} pairs, from t = r·sqrt((n-2)/(1-r²)) with n-2 degrees of freedom.
     *
     * @return NaN when {@code n < 3}
     */
    public static double pValue(double r, int n) {
        if (n < 3) return Double.NaN;
        double r2 = r * r;
        if (r2 >= 1.0) return 0.0;
        double t = Math.abs(r) * Math.sqrt((n - 2) / (1.0 - r2));
        return 2.0 * (1.0 - new TDistribution(n - 2).cumulativeProbability(t));
    }
}
