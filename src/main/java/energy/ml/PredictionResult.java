package energy.ml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulated output of a rolling-window forecast, one {@link ForecastStep} per new observation
 * in arrival order.
 */
public class PredictionResult {

    private final List<ForecastStep> steps;

    public PredictionResult(List<ForecastStep> steps) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public List<ForecastStep> getSteps() { return steps; }
    public int size() { return steps.size(); }

    public double[] getPredictions() {
        return steps.stream().mapToDouble(ForecastStep::getPrediction).toArray();
    }

    public double[] getPredictionsLow() {
        return steps.stream().mapToDouble(ForecastStep::getLower).toArray();
    }

    public double[] getPredictionsHigh() {
        return steps.stream().mapToDouble(ForecastStep::getUpper).toArray();
    }

    public double[] getActuals() {
        return steps.stream().mapToDouble(ForecastStep::getActual).toArray();
    }

    public int[] getDays() {
        return steps.stream().mapToInt(ForecastStep::getDay).toArray();
    }

    /** Mean absolute error; NaN for an empty result. */
    public double getMeanAbsoluteError() {
        return steps.stream().mapToDouble(ForecastStep::getAbsoluteError).average().orElse(Double.NaN);
    }

    /** Mean absolute percentage error over the steps whose actual value is non-zero; NaN if there are none. */
    public double getMeanAbsolutePercentageError() {
        return steps.stream()
            .mapToDouble(ForecastStep::getRelativeError)
            .filter(d -> !Double.isNaN(d))
            .average()
            .orElse(Double.NaN);
    }
}
