package energy.ml;

import static energy.ml.EstimationException.Kind.DEGENERATE_SAMPLE;
import static energy.ml.EstimationException.Kind.DIMENSION_MISMATCH;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequential one-step-ahead forecasting over a fixed-size window of the most recent observations.
 * <p>
 * Each step refits {@link PolynomialRegression} on the window, predicts the next observation with a
 * 95% confidence interval and the wider 95% prediction corridor, then slides the window: the oldest row is dropped and the new observation
 * is appended, so the window always holds exactly {@code windowSize} rows.
 * <p>
 * An instance owns mutable window state and is not thread-safe. Steps must run in arrival order.
 */
public class RollingWindowForecaster {
    private static final Logger LOGGER = LoggerFactory.getLogger(RollingWindowForecaster.class);

    private final PolynomialRegression regression;
    private final int windowSize;
    private final Matrix xWindow;
    private final Matrix yWindow;
    private final List<ForecastStep> steps = new ArrayList<>();

    /**
     * @param initialX   observations [day, temperature]; the last {@code windowSize} rows seed the window
     * @param initialY   response values aligned with {@code initialX}
     * @param windowSize number of observations each fit uses; must exceed the 5 model coefficients
     */
    public RollingWindowForecaster(Matrix initialX, Matrix initialY, int windowSize, PolynomialRegression regression) {
        if (windowSize <= FeatureAugmentation.FEATURES) {
            throw new EstimationException(DEGENERATE_SAMPLE, "Window size must exceed " + FeatureAugmentation.FEATURES
                + " observations, got " + windowSize);
        }
        if (initialX.getRows() != initialY.getRows() || initialX.getCols() != 2 || initialY.getCols() != 1) {
            throw new EstimationException(DIMENSION_MISMATCH, "Initial observations must be N×2 and N×1, got "
                + initialX.getRows() + "x" + initialX.getCols() + " and " + initialY.getRows() + "x" + initialY.getCols());
        }
        if (initialX.getRows() < windowSize) {
            throw new EstimationException(DIMENSION_MISMATCH, "Window of " + windowSize + " needs at least as many initial observations, got "
                + initialX.getRows());
        }
        this.regression = regression;
        this.windowSize = windowSize;
        this.xWindow = new Matrix(windowSize, 2);
        this.yWindow = new Matrix(windowSize, 1);
        int offset = initialX.getRows() - windowSize;
        for (int i = 0; i < windowSize; i++) {
            xWindow.set(i, 0, initialX.get(offset + i, 0));
            xWindow.set(i, 1, initialX.get(offset + i, 1));
            yWindow.set(i, 0, initialY.get(offset + i, 0));
        }
    }

    public RollingWindowForecaster(Matrix initialX, Matrix initialY, int windowSize) {
        this(initialX, initialY, windowSize, new PolynomialRegression());
    }

    /**
     * Run the forecaster over every row of the new-data stream, in order.
     *
     * @return one {@link ForecastStep} per row of {@code newX}
     */
    public static PredictionResult rollingWindowPredict(Matrix initialX, Matrix initialY, Matrix newX, Matrix newY,
                                                        int windowSize) {
        return new RollingWindowForecaster(initialX, initialY, windowSize).forecast(newX, newY);
    }

    /**
     * Feed every row of {@code newX}/{@code newY} through {@link #step(double, double, double)}.
     *
     * @return all steps this forecaster has made so far, including earlier calls
     */
    public PredictionResult forecast(Matrix newX, Matrix newY) {
        if (newX.getRows() != newY.getRows() || newX.getCols() != 2 || newY.getCols() != 1) {
            throw new EstimationException(DIMENSION_MISMATCH, "New observations must be M×2 and M×1, got "
                + newX.getRows() + "x" + newX.getCols() + " and " + newY.getRows() + "x" + newY.getCols());
        }
        for (int i = 0; i < newX.getRows(); i++) {
            step(newX.get(i, 0), newX.get(i, 1), newY.get(i, 0));
        }
        return getResult();
    }

    /**
     * Predict one new observation from the current window, record it, then slide the window.
     *
     * @param day         the new observation's day (feature value)
     * @param temperature the new observation's temperature
     * @param actual      the consumption actually observed, appended to the window after predicting
     */
    public ForecastStep step(double day, double temperature, double actual) {
        int dayIndex = windowSize + steps.size() + 1;
        RegressionResult fit = regression.run(xWindow, yWindow);
        Matrix b = fit.getCoefficients();

        double[] newRow = FeatureAugmentation.augmentRow(day, temperature);
        double predicted = PolynomialRegression.predict(b, day, temperature);

        // refit quantities over the current window, independent of the fit above
        Matrix design = FeatureAugmentation.augment(xWindow);
        Matrix g = PolynomialRegression.normalMatrixInverse(design);
        int df = windowSize - FeatureAugmentation.FEATURES;
        double residual = PolynomialRegression.residualVariance(yWindow.columnValues(0),
            LinearAlgebra.multiply(design, b).columnValues(0), df);
        double se = PolynomialRegression.standardError(newRow, g, residual);
        double corridor = PolynomialRegression.predictionError(newRow, g, residual);
        double t = regression.getCriticalValues().tCritical((1 + PolynomialRegression.CONFIDENCE) / 2, df);

        ForecastStep step = new ForecastStep(dayIndex, temperature, predicted, predicted - t * se, predicted + t * se,
            predicted - t * corridor, predicted + t * corridor, actual);
        steps.add(step);
        LOGGER.debug("Day {}: temperature={} actual={} predicted={} [{}, {}] corridor [{}, {}]", dayIndex, temperature,
            actual, predicted, step.getLower(), step.getUpper(), step.getPredictionLower(), step.getPredictionUpper());

        slide(day, temperature, actual);
        return step;
    }

    private void slide(double day, double temperature, double actual) {
        for (int i = 1; i < windowSize; i++) {
            xWindow.set(i - 1, 0, xWindow.get(i, 0));
            xWindow.set(i - 1, 1, xWindow.get(i, 1));
            yWindow.set(i - 1, 0, yWindow.get(i, 0));
        }
        xWindow.set(windowSize - 1, 0, day);
        xWindow.set(windowSize - 1, 1, temperature);
        yWindow.set(windowSize - 1, 0, actual);
    }

    public PredictionResult getResult() {
        return new PredictionResult(steps);
    }

    public int getWindowSize() { return windowSize; }

    /** Copy of the current window's observations [day, temperature]. */
    public Matrix getXWindow() { return xWindow.copy(); }

    /** Copy of the current window's response values. */
    public Matrix getYWindow() { return yWindow.copy(); }
}
