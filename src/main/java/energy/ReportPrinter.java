package energy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import energy.ml.ForecastStep;
import energy.ml.Matrix;
import energy.ml.PredictionResult;
import energy.ml.RegressionResult;

/**
 * Formats regression and forecast results for people (a text report) or for other programs (JSON).
 * Nothing in {@code energy.ml} prints; this is the only place results are turned into text.
 */
public class ReportPrinter {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeSpecialFloatingPointValues()
        .create();

    private ReportPrinter() {}

    /**
     * Text report: model summary, coefficients, per-day forecast statistics and a combined table of the
     * training days and the forecast days.
     *
     * @param actualConsumption consumption of the training days, aligned with {@code fit}
     */
    public static String text(RegressionResult fit, Matrix actualConsumption, PredictionResult forecast) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Regression on initial data (").append(fit.size()).append(" days) ===\n");
        sb.append(fmt("Model %s. Correlation: %.4f, p-value: %.4f%n", fit.isAdequate() ? "adequate" : "inadequate",
            fit.getCorrelation(), fit.getCorrelationPValue()));
        sb.append(fmt("Dad = %.4f, DY = %.4f, F = %.4f, F critical = %.4f, df = %d%n", fit.getResidualVariance(),
            fit.getTotalVariance(), fit.getFStatistic(), fit.getFCritical(), fit.getDegreesOfFreedom()));
        sb.append('\n');

        sb.append("=== Coefficients ===\n");
        double[] halfWidths = fit.getCoefficientHalfWidths();
        for (int i = 0; i < halfWidths.length; i++) {
            double b = fit.getCoefficient(i);
            sb.append(fmt("B%d = %.4f  (%.4f .. %.4f)%n", i, b, b - halfWidths[i], b + halfWidths[i]));
        }
        sb.append('\n');

        sb.append("=== Rolling-window forecast ===\n");
        for (ForecastStep s : forecast.getSteps()) {
            sb.append(fmt("Day %d: temperature = %.2f, forecast = %.2f, actual = %.2f, error = %.2f (%.2f%%), "
                    + "corridor %.2f .. %.2f%n",
                s.getDay(), s.getTemperature(), s.getPrediction(), s.getActual(), s.getError(), s.getRelativeError(),
                s.getPredictionLower(), s.getPredictionUpper()));
        }
        sb.append(fmt("MAE = %.2f, MAPE = %.2f%%%n", forecast.getMeanAbsoluteError(),
            forecast.getMeanAbsolutePercentageError()));
        sb.append('\n');

        sb.append("Day  | Actual Y | Fitted YR | Forecast | Conf.Min | Conf.Max\n");
        sb.append("-----|----------|-----------|----------|----------|---------\n");
        double[] fitted = fit.getFitted();
        double[] low = fit.getConfLow();
        double[] high = fit.getConfHigh();
        for (int i = 0; i < fitted.length; i++) {
            sb.append(fmt("%4d | %8.1f | %9.1f | %8s | %8.1f | %8.1f%n", i + 1, actualConsumption.get(i, 0), fitted[i],
                "-", low[i], high[i]));
        }
        for (ForecastStep s : forecast.getSteps()) {
            sb.append(fmt("%4d | %8.1f | %9s | %8.1f | %8.1f | %8.1f%n", s.getDay(), s.getActual(), "-",
                s.getPrediction(), s.getLower(), s.getUpper()));
        }
        return sb.toString();
    }

    /** The same content as {@link #text(RegressionResult, Matrix, PredictionResult)} as a JSON document. */
    public static String json(RegressionResult fit, PredictionResult forecast) {
        Map<String, Object> out = new LinkedHashMap<>();

        Map<String, Object> regression = new LinkedHashMap<>();
        regression.put("adequate", fit.isAdequate());
        regression.put("correlation", fit.getCorrelation());
        regression.put("correlationPValue", fit.getCorrelationPValue());
        regression.put("residualVariance", fit.getResidualVariance());
        regression.put("totalVariance", fit.getTotalVariance());
        regression.put("fStatistic", fit.getFStatistic());
        regression.put("fCritical", fit.getFCritical());
        regression.put("degreesOfFreedom", fit.getDegreesOfFreedom());
        regression.put("coefficients", fit.getCoefficients().columnValues(0));
        regression.put("coefficientHalfWidths", fit.getCoefficientHalfWidths());
        regression.put("fitted", fit.getFitted());
        regression.put("confLow", fit.getConfLow());
        regression.put("confHigh", fit.getConfHigh());
        regression.put("predictionHalfWidths", fit.getPredictionHalfWidths());
        out.put("regression", regression);

        List<Map<String, Object>> steps = new ArrayList<>(forecast.size());
        for (ForecastStep s : forecast.getSteps()) {
            Map<String, Object> step = new LinkedHashMap<>();
            step.put("day", s.getDay());
            step.put("temperature", s.getTemperature());
            step.put("prediction", s.getPrediction());
            step.put("lower", s.getLower());
            step.put("upper", s.getUpper());
            step.put("predictionLower", s.getPredictionLower());
            step.put("predictionUpper", s.getPredictionUpper());
            step.put("actual", s.getActual());
            step.put("relativeError", s.getRelativeError());
            steps.add(step);
        }
        Map<String, Object> forecastOut = new LinkedHashMap<>();
        forecastOut.put("steps", steps);
        forecastOut.put("meanAbsoluteError", forecast.getMeanAbsoluteError());
        forecastOut.put("meanAbsolutePercentageError", forecast.getMeanAbsolutePercentageError());
        out.put("forecast", forecastOut);

        return GSON.toJson(out);
    }

    private static String fmt(String format, Object... args) {
        return String.format(Locale.ROOT, format, args);
    }
}
