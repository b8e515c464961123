package energy.ml;

import static energy.ml.EstimationException.Kind.DEGENERATE_SAMPLE;
import static energy.ml.EstimationException.Kind.DIMENSION_MISMATCH;
import static energy.ml.LinearAlgebra.inverse;
import static energy.ml.LinearAlgebra.multiply;
import static energy.ml.LinearAlgebra.transpose;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordinary Least Squares (OLS) regression of energy consumption on day and temperature.
 * <p>
 * Model: y = B₀ + B₁·day + B₂·day² + B₃·temp + B₄·day·temp
 * <p>
 * Closed-form solution (normal equation): B = (DᵀD)⁻¹DᵀY where D is the design matrix built by
 * {@link FeatureAugmentation}. Adequacy is judged by the F-test DY/Dad against F(0.05; 4, N-5),
 * and each fitted value gets a 95% confidence interval YR ± t·sqrt(xᵢ(DᵀD)⁻¹xᵢᵀ·Dad) plus the
 * prediction-interval half-width t·sqrt((1 + xᵢ(DᵀD)⁻¹xᵢᵀ)·Dad) of a new observation at xᵢ.
 */
public class PolynomialRegression {
    private static final Logger LOGGER = LoggerFactory.getLogger(PolynomialRegression.class);

    public static final double CONFIDENCE = 0.95;
    public static final double SIGNIFICANCE = 0.05;

    private final CriticalValueSource criticalValues;

    public PolynomialRegression() {
        this(CriticalValueSource.TABULATED);
    }

    public PolynomialRegression(CriticalValueSource criticalValues) {
        this.criticalValues = criticalValues;
    }

    public CriticalValueSource getCriticalValues() { return criticalValues; }

    /**
     * Fit the model.
     *
     * @param x N×2 observations [day, temperature]
     * @param y N×1 response
     * @throws EstimationException {@code DIMENSION_MISMATCH} for inconsistent shapes,
     *                             {@code DEGENERATE_SAMPLE} when N ≤ 5,
     *                             {@code SINGULAR_MATRIX} when DᵀD cannot be inverted
     */
    public RegressionResult run(Matrix x, Matrix y) {
        checkObservations(x, y);
        int n = x.getRows();
        int k = FeatureAugmentation.FEATURES;
        int df = n - k;

        Matrix design = FeatureAugmentation.augment(x);
        Matrix g = normalMatrixInverse(design);
        Matrix b = multiply(g, multiply(transpose(design), y));
        Matrix yrMatrix = multiply(design, b);

        double[] observed = y.columnValues(0);
        double[] fitted = yrMatrix.columnValues(0);

        double residual = residualVariance(observed, fitted, df);
        double meanY = mean(observed);
        double totalSumSquares = 0.0;
        for (double v : observed) {
            totalSumSquares += (v - meanY) * (v - meanY);
        }
        double totalVariance = totalSumSquares / (n - 1);

        double fStatistic = totalVariance / residual;
        double fCritical = criticalValues.fCritical(SIGNIFICANCE, k - 1, df);
        Adequacy adequacy = fStatistic > fCritical ? Adequacy.ADEQUATE : Adequacy.INADEQUATE;

        double correlation = Correlation.pearson(observed, fitted);
        double pValue = Correlation.pValue(correlation, n);

        double t = criticalValues.tCritical((1 + CONFIDENCE) / 2, df);
        double[] low = new double[n];
        double[] high = new double[n];
        double[] predictionHalfWidths = new double[n];
        for (int i = 0; i < n; i++) {
            double[] row = design.row(i);
            double se = standardError(row, g, residual);
            low[i] = fitted[i] - t * se;
            high[i] = fitted[i] + t * se;
            predictionHalfWidths[i] = t * predictionError(row, g, residual);
        }

        double[] halfWidths = new double[k];
        for (int j = 0; j < k; j++) {
            halfWidths[j] = t * Math.sqrt(g.get(j, j) * residual);
        }

        LOGGER.debug("Fitted {} observations: Dad={} DY={} F={} Fcrit={} -> {}, r={}", n, residual, totalVariance,
            fStatistic, fCritical, adequacy, correlation);

        return RegressionResult.builder()
            .fitted(fitted)
            .coefficients(b)
            .confidence(low, high)
            .correlation(correlation, pValue)
            .adequacy(adequacy)
            .meanY(meanY)
            .variances(residual, totalVariance)
            .fTest(fStatistic, fCritical)
            .tCritical(t)
            .degreesOfFreedom(df)
            .coefficientHalfWidths(halfWidths)
            .predictionHalfWidths(predictionHalfWidths)
            .build();
    }

    /** ŷ = augmentRow(day, temperature)·B */
    public static double predict(Matrix coefficients, double day, double temperature) {
        Matrix row = new Matrix(1, FeatureAugmentation.FEATURES, FeatureAugmentation.augmentRow(day, temperature));
        return multiply(row, coefficients).get(0, 0);
    }

    /** G = (DᵀD)⁻¹ */
    static Matrix normalMatrixInverse(Matrix design) {
        return inverse(multiply(transpose(design), design));
    }

    /** Σ(y - ŷ)² / df */
    static double residualVariance(double[] observed, double[] fitted, int df) {
        if (df <= 0) {
            throw new EstimationException(DEGENERATE_SAMPLE, "Residual variance needs positive degrees of freedom, got " + df);
        }
        double sum = 0.0;
        for (int i = 0; i < observed.length; i++) {
            double e = observed[i] - fitted[i];
            sum += e * e;
        }
        return sum / df;
    }

    /** sqrt(x·G·xᵀ·Dad) */
    static double standardError(double[] designRow, Matrix g, double residualVariance) {
        return Math.sqrt(LinearAlgebra.quadraticForm(designRow, g) * residualVariance);
    }

    /** sqrt((1 + x·G·xᵀ)·Dad) */
    static double predictionError(double[] designRow, Matrix g, double residualVariance) {
        return Math.sqrt((1.0 + LinearAlgebra.quadraticForm(designRow, g)) * residualVariance);
    }

    static void checkObservations(Matrix x, Matrix y) {
        if (x.getRows() != y.getRows()) {
            throw new EstimationException(DIMENSION_MISMATCH, "X has " + x.getRows() + " rows but Y has " + y.getRows());
        }
        if (y.getCols() != 1) {
            throw new EstimationException(DIMENSION_MISMATCH, "Y must be a single column, got " + y.getCols());
        }
        if (x.getRows() <= FeatureAugmentation.FEATURES) {
            throw new EstimationException(DEGENERATE_SAMPLE, "Need more than " + FeatureAugmentation.FEATURES
                + " observations to estimate the residual variance, got " + x.getRows());
        }
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }
}
