package energy.ml;

/**
 * One out-of-sample prediction made by the rolling-window forecaster, together with the
 * observation that actually arrived.
 * <p>
 * {@link #getLower()}/{@link #getUpper()} bound the mean response at the new point. The wider
 * corridor {@link #getPredictionLower()}/{@link #getPredictionUpper()} bounds a single new
 * observation, so it also covers the residual scatter.
 */
public class ForecastStep {

    private final int day;
    private final double temperature;
    private final double prediction;
    private final double lower;
    private final double upper;
    private final double predictionLower;
    private final double predictionUpper;
    private final double actual;

    public ForecastStep(int day, double temperature, double prediction, double lower, double upper,
                        double predictionLower, double predictionUpper, double actual) {
        this.day = day;
        this.temperature = temperature;
        this.prediction = prediction;
        this.lower = lower;
        this.upper = upper;
        this.predictionLower = predictionLower;
        this.predictionUpper = predictionUpper;
        this.actual = actual;
    }

    public int getDay() { return day; }
    public double getTemperature() { return temperature; }
    public double getPrediction() { return prediction; }
    public double getLower() { return lower; }
    public double getUpper() { return upper; }

    /** Ymin = ŷ - t·sqrt((1 + x·G·xᵀ)·Dad) */
    public double getPredictionLower() { return predictionLower; }

    /** Ymax = ŷ + t·sqrt((1 + x·G·xᵀ)·Dad) */
    public double getPredictionUpper() { return predictionUpper; }

    public double getActual() { return actual; }

    /** prediction - actual */
    public double getError() { return prediction - actual; }

    public double getAbsoluteError() { return Math.abs(prediction - actual); }

    /** Absolute error as a percentage of the actual value; NaN when the actual value is 0. */
    public double getRelativeError() {
        return actual == 0.0 ? Double.NaN : 100.0 * getAbsoluteError() / Math.abs(actual);
    }

    public boolean isWithinInterval() { return actual >= lower && actual <= upper; }

    public boolean isWithinCorridor() { return actual >= predictionLower && actual <= predictionUpper; }

    @Override
    public String toString() {
        return "ForecastStep[day=" + day + ", prediction=" + prediction + ", interval=[" + lower + ", " + upper
            + "], corridor=[" + predictionLower + ", " + predictionUpper + "], actual=" + actual + "]";
    }
}
