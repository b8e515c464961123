package energy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import energy.ml.EnergyPredictor;
import energy.ml.PredictionResult;
import energy.ml.RegressionResult;

/**
 * Demo: polynomial regression (statistical modeling) and rolling-window forecasting (predictive
 * modeling) of daily energy consumption on the sample dataset.
 * Run with: mvn exec:java [-Dexec.args=--json]
 */
public class Main {
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ForecastConfig config = ForecastConfig.load();
        for (String arg : args) {
            if ("--json".equals(arg)) config = config.withOutputFormat(ForecastConfig.OutputFormat.JSON);
        }
        LOGGER.info("Running with {}", config);

        EnergyPredictor predictor = new EnergyPredictor(SampleData.initialObservations(), SampleData.initialConsumption(),
            config.getCriticalValues());
        RegressionResult fit = predictor.fitRegression();
        PredictionResult forecast = predictor.forecast(SampleData.additionalObservations(),
            SampleData.additionalConsumption(), config.getWindowSize());

        if (config.getOutputFormat() == ForecastConfig.OutputFormat.JSON) {
            System.out.println(ReportPrinter.json(fit, forecast));
        } else {
            System.out.print(ReportPrinter.text(fit, SampleData.initialConsumption(), forecast));
        }
    }
}
