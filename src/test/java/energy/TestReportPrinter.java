package energy;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import energy.ml.EnergyPredictor;
import energy.ml.PredictionResult;
import energy.ml.RegressionResult;

public class TestReportPrinter {

    private final EnergyPredictor predictor = new EnergyPredictor(SampleData.initialObservations(),
        SampleData.initialConsumption());
    private final RegressionResult fit = predictor.fitRegression();
    private final PredictionResult forecast = predictor.forecast(SampleData.additionalObservations(),
        SampleData.additionalConsumption(), 20);

    @Test
    public void testText() {
        final String text = ReportPrinter.text(fit, SampleData.initialConsumption(), forecast);
        assertTrue(text, text.contains("Model adequate."));
        assertTrue(text, text.contains("B0 = "));
        assertTrue(text, text.contains("B4 = "));
        assertTrue(text, text.contains("Day 21: temperature = 21.30"));
        assertTrue(text, text.contains("Day 26: "));
        // header + separator + 20 fitted rows + 6 forecast rows
        final long tableRows = text.lines().filter(l -> l.matches("\\s*\\d+ \\|.*")).count();
        assertEquals(26, tableRows);
    }

    @Test
    public void testJson() {
        final JsonObject root = JsonParser.parseString(ReportPrinter.json(fit, forecast)).getAsJsonObject();
        final JsonObject regression = root.getAsJsonObject("regression");
        assertTrue(regression.get("adequate").getAsBoolean());
        assertEquals(5, regression.getAsJsonArray("coefficients").size());
        assertEquals(20, regression.getAsJsonArray("fitted").size());
        assertEquals(fit.getCorrelation(), regression.get("correlation").getAsDouble(), 1e-12);

        final JsonArray steps = root.getAsJsonObject("forecast").getAsJsonArray("steps");
        assertEquals(6, steps.size());
        assertEquals(21, steps.get(0).getAsJsonObject().get("day").getAsInt());
        assertEquals(4027.65, steps.get(0).getAsJsonObject().get("actual").getAsDouble(), 0.0);
        assertEquals(forecast.getMeanAbsoluteError(),
            root.getAsJsonObject("forecast").get("meanAbsoluteError").getAsDouble(), 1e-9);
    }
}
