package energy.ml;

/**
 * Combines the polynomial regression (statistical modeling) and the rolling-window forecaster
 * (predictive modeling) for one series of daily energy consumption.
 */
public class EnergyPredictor {

    /** Observations [day, temperature], one row per day. */
    private final Matrix observations;
    /** Energy consumption per day. */
    private final Matrix consumption;
    private final PolynomialRegression regression;
    private RegressionResult fit;

    public EnergyPredictor(Matrix observations, Matrix consumption, CriticalValueSource criticalValues) {
        if (observations == null || consumption == null) throw new IllegalArgumentException("observations and consumption required");
        if (observations.getRows() != consumption.getRows()) {
            throw new EstimationException(EstimationException.Kind.DIMENSION_MISMATCH, "observations has "
                + observations.getRows() + " rows but consumption has " + consumption.getRows());
        }
        this.observations = observations.copy();
        this.consumption = consumption.copy();
        this.regression = new PolynomialRegression(criticalValues);
    }

    public EnergyPredictor(Matrix observations, Matrix consumption) {
        this(observations, consumption, CriticalValueSource.TABULATED);
    }

    /** Fit the regression over every observation. */
    public RegressionResult fitRegression() {
        fit = regression.run(observations, consumption);
        return fit;
    }

    public RegressionResult getRegression() { return fit; }

    /**
     * Predict each new day in turn, refitting on the last {@code windowSize} observations before every step.
     */
    public PredictionResult forecast(Matrix newObservations, Matrix newConsumption, int windowSize) {
        return new RollingWindowForecaster(observations, consumption, windowSize, regression)
            .forecast(newObservations, newConsumption);
    }

    public Matrix getObservations() { return observations.copy(); }
    public Matrix getConsumption() { return consumption.copy(); }
}
