package energy.ml;

import static energy.ml.EstimationException.Kind.DIMENSION_MISMATCH;

/**
 * Second-order polynomial features of a (day, temperature) observation.
 * <p>
 * Row [day, temp] becomes [1, day, day², temp, day·temp]: intercept, linear and quadratic trend,
 * temperature effect and the day/temperature interaction.
 */
public final class FeatureAugmentation {

    /** Number of design-matrix columns, i.e. model coefficients. */
    public static final int FEATURES = 5;

    private FeatureAugmentation() {}

    /**
     * @param x N×2 matrix of [day, temperature]
     * @return N×5 design matrix
     */
    public static Matrix augment(Matrix x) {
        if (x.getCols() != 2) {
            throw new EstimationException(DIMENSION_MISMATCH, "Observations need 2 columns [day, temperature], got "
                + x.getCols());
        }
        int n = x.getRows();
        double[] data = new double[n * FEATURES];
        for (int i = 0; i < n; i++) {
            System.arraycopy(augmentRow(x.get(i, 0), x.get(i, 1)), 0, data, i * FEATURES, FEATURES);
        }
        return new Matrix(n, FEATURES, data);
    }

    /** Design row for a single observation. */
    public static double[] augmentRow(double day, double temperature) {
        return new double[] {1.0, day, day * day, temperature, day * temperature};
    }
}
