package energy.ml;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import energy.SampleData;

public class TestRollingWindowForecaster {
    private static final int WINDOW = 20;

    private static RollingWindowForecaster reference() {
        return new RollingWindowForecaster(SampleData.initialObservations(), SampleData.initialConsumption(), WINDOW);
    }

    @Test
    public void testReferenceForecast() {
        final PredictionResult result = RollingWindowForecaster.rollingWindowPredict(SampleData.initialObservations(),
            SampleData.initialConsumption(), SampleData.additionalObservations(), SampleData.additionalConsumption(), WINDOW);

        assertEquals(6, result.size());
        assertArrayEquals(new int[] {21, 22, 23, 24, 25, 26}, result.getDays());
        assertArrayEquals(SampleData.additionalConsumption().columnValues(0), result.getActuals(), 0.0);

        final double[] expected = {4163.39, 3986.65, 3872.14, 3861.15, 4073.34, 3853.83};
        assertArrayEquals(expected, result.getPredictions(), 1e-2);

        final double[] low = result.getPredictionsLow();
        final double[] high = result.getPredictionsHigh();
        assertEquals(3575.04, low[0], 1e-2);
        assertEquals(4751.75, high[0], 1e-2);
        for (final ForecastStep s : result.getSteps()) {
            assertTrue(s.getLower() < s.getPrediction());
            assertTrue(s.getUpper() > s.getPrediction());
            assertTrue(s.toString(), s.isWithinInterval());
        }
    }

    @Test
    public void testFirstStepMatchesRegressionOnInitialWindow() {
        final RegressionResult fit = new PolynomialRegression().run(SampleData.initialObservations(),
            SampleData.initialConsumption());
        final ForecastStep step = reference().step(21, 21.3, 4027.65);
        assertEquals(PolynomialRegression.predict(fit.getCoefficients(), 21, 21.3), step.getPrediction(), 1e-9);
        assertEquals(21, step.getDay());
    }

    @Test
    public void testFirstStepCorridor() {
        final RegressionResult fit = new PolynomialRegression().run(SampleData.initialObservations(),
            SampleData.initialConsumption());
        final RollingWindowForecaster forecaster = reference();
        assertEquals(WINDOW, forecaster.getWindowSize());
        final ForecastStep step = forecaster.step(21, 21.3, 4027.65);

        final Matrix g = PolynomialRegression.normalMatrixInverse(FeatureAugmentation.augment(SampleData.initialObservations()));
        final double q = LinearAlgebra.quadraticForm(FeatureAugmentation.augmentRow(21, 21.3), g);
        final double half = 2.131 * Math.sqrt((1 + q) * fit.getResidualVariance());
        assertEquals(step.getPrediction() - half, step.getPredictionLower(), 1e-6);
        assertEquals(step.getPrediction() + half, step.getPredictionUpper(), 1e-6);
        assertTrue(step.getPredictionLower() < step.getLower());
        assertTrue(step.getPredictionUpper() > step.getUpper());
        assertTrue(step.isWithinCorridor());
    }

    @Test
    public void testWindowSlidesFifo() {
        final RollingWindowForecaster forecaster = reference();
        final Matrix newX = SampleData.additionalObservations();
        final Matrix newY = SampleData.additionalConsumption();

        for (int i = 0; i < newX.getRows(); i++) {
            final Matrix before = forecaster.getXWindow();
            final Matrix beforeY = forecaster.getYWindow();
            forecaster.step(newX.get(i, 0), newX.get(i, 1), newY.get(i, 0));
            final Matrix after = forecaster.getXWindow();
            final Matrix afterY = forecaster.getYWindow();

            assertEquals(WINDOW, after.getRows());
            assertEquals(WINDOW, afterY.getRows());
            // oldest day is gone, everything else moved up one row
            for (int r = 0; r < WINDOW; r++)
                assertTrue(after.get(r, 0) != before.get(0, 0));
            for (int r = 1; r < WINDOW; r++) {
                assertArrayEquals(before.row(r), after.row(r - 1), 0.0);
                assertEquals(beforeY.get(r, 0), afterY.get(r - 1, 0), 0.0);
            }
            assertArrayEquals(newX.row(i), after.row(WINDOW - 1), 0.0);
            assertEquals(newY.get(i, 0), afterY.get(WINDOW - 1, 0), 0.0);
        }
        assertEquals(7.0, forecaster.getXWindow().get(0, 0), 0.0);
        assertEquals(26.0, forecaster.getXWindow().get(WINDOW - 1, 0), 0.0);
    }

    @Test
    public void testWindowAccessorsReturnCopies() {
        final RollingWindowForecaster forecaster = reference();
        forecaster.getXWindow().set(0, 0, -100);
        forecaster.getYWindow().set(0, 0, -100);
        assertEquals(1.0, forecaster.getXWindow().get(0, 0), 0.0);
        assertEquals(2357.85, forecaster.getYWindow().get(0, 0), 0.0);
    }

    @Test
    public void testLongerInitialSeriesSeedsWithMostRecentRows() {
        final int window = 10;
        final RollingWindowForecaster forecaster = new RollingWindowForecaster(SampleData.initialObservations(),
            SampleData.initialConsumption(), window);
        assertEquals(window, forecaster.getXWindow().getRows());
        assertEquals(11.0, forecaster.getXWindow().get(0, 0), 0.0);
        assertEquals(20.0, forecaster.getXWindow().get(window - 1, 0), 0.0);

        // day index counts from the window size, not from the day feature
        final ForecastStep step = forecaster.step(21, 21.3, 4027.65);
        assertEquals(11, step.getDay());
    }

    @Test
    public void testStepsAccumulateAcrossCalls() {
        final RollingWindowForecaster forecaster = reference();
        final Matrix newX = SampleData.additionalObservations();
        final Matrix newY = SampleData.additionalConsumption();
        forecaster.step(newX.get(0, 0), newX.get(0, 1), newY.get(0, 0));
        final PredictionResult first = forecaster.getResult();
        forecaster.step(newX.get(1, 0), newX.get(1, 1), newY.get(1, 0));

        assertEquals(1, first.size());
        assertEquals(2, forecaster.getResult().size());
        assertArrayEquals(new int[] {21, 22}, forecaster.getResult().getDays());
    }

    @Test
    public void testWindowTooSmall() {
        for (final int size : new int[] {0, 3, 5}) {
            final EstimationException e = assertThrows(EstimationException.class,
                () -> new RollingWindowForecaster(SampleData.initialObservations(), SampleData.initialConsumption(), size));
            assertEquals(EstimationException.Kind.DEGENERATE_SAMPLE, e.getKind());
        }
    }

    @Test
    public void testNotEnoughInitialObservations() {
        final EstimationException e = assertThrows(EstimationException.class,
            () -> new RollingWindowForecaster(SampleData.initialObservations(), SampleData.initialConsumption(), 25));
        assertEquals(EstimationException.Kind.DIMENSION_MISMATCH, e.getKind());
    }

    @Test
    public void testMismatchedNewData() {
        final EstimationException e = assertThrows(EstimationException.class,
            () -> reference().forecast(SampleData.additionalObservations(), Matrix.column(1, 2)));
        assertEquals(EstimationException.Kind.DIMENSION_MISMATCH, e.getKind());
    }

    @Test
    public void testAccuracySummary() {
        final PredictionResult result = reference().forecast(SampleData.additionalObservations(),
            SampleData.additionalConsumption());
        double abs = 0;
        double rel = 0;
        for (final ForecastStep s : result.getSteps()) {
            abs += Math.abs(s.getPrediction() - s.getActual());
            rel += 100.0 * Math.abs(s.getPrediction() - s.getActual()) / s.getActual();
        }
        assertEquals(abs / 6, result.getMeanAbsoluteError(), 1e-9);
        assertEquals(rel / 6, result.getMeanAbsolutePercentageError(), 1e-9);
        assertTrue(Double.isNaN(new PredictionResult(java.util.Collections.emptyList()).getMeanAbsoluteError()));
    }
}
