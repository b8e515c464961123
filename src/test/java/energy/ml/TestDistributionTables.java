package energy.ml;

import static energy.ml.DistributionTables.fCritical;
import static energy.ml.DistributionTables.normalQuantile;
import static energy.ml.DistributionTables.tCritical;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

public class TestDistributionTables {

    @Test
    public void testTExactTableHit() {
        assertEquals(2.228, tCritical(0.975, 10), 0.0);
        assertEquals(1.812, tCritical(0.95, 10), 0.0);
        assertEquals(12.706, tCritical(0.975, 1), 0.0);
        assertEquals(2.042, tCritical(0.975, 30), 0.0);
    }

    @Test
    public void testTComputedProbabilityMatchesTable() {
        assertEquals(2.131, tCritical((1 + 0.95) / 2, 15), 0.0);
    }

    @Test
    public void testTInterpolation() {
        final double expected = 2.228 + (12.0 - 10.0) / (15.0 - 10.0) * (2.131 - 2.228);
        assertEquals(expected, tCritical(0.975, 12), 1e-12);

        // between 20 and 25
        assertEquals(1.725 + 0.6 * (1.708 - 1.725), tCritical(0.95, 23), 1e-12);
    }

    @Test
    public void testTLargeSampleUsesNormal() {
        assertEquals(normalQuantile(0.975), tCritical(0.975, 31), 0.0);
        assertEquals(normalQuantile(0.95), tCritical(0.95, 1000), 0.0);
    }

    @Test
    public void testTInvalidDegreesOfFreedom() {
        EstimationException e = assertThrows(EstimationException.class, () -> tCritical(0.975, 0));
        assertEquals(EstimationException.Kind.INVALID_DEGREES_OF_FREEDOM, e.getKind());
        e = assertThrows(EstimationException.class, () -> tCritical(0.975, -3));
        assertEquals(EstimationException.Kind.INVALID_DEGREES_OF_FREEDOM, e.getKind());
    }

    @Test
    public void testTUntabulatedProbability() {
        final EstimationException e = assertThrows(EstimationException.class, () -> tCritical(0.99, 10));
        assertEquals(EstimationException.Kind.INVALID_PROBABILITY, e.getKind());
    }

    @Test
    public void testFTableHit() {
        assertEquals(3.48, fCritical(0.05, 4, 10), 0.0);
        assertEquals(161.4, fCritical(0.05, 1, 1), 0.0);
        assertEquals(2.53, fCritical(0.05, 5, 30), 0.0);
    }

    @Test
    public void testFFallback() {
        // df2 = 15 is not tabulated
        assertEquals(DistributionTables.F_FALLBACK, fCritical(0.05, 4, 15), 0.0);
        assertEquals(DistributionTables.F_FALLBACK, fCritical(0.05, 6, 10), 0.0);
        assertEquals(DistributionTables.F_FALLBACK, fCritical(0.01, 4, 10), 0.0);
    }

    @Test
    public void testNormalQuantile() {
        assertEquals(0.0, normalQuantile(0.5), 1e-3);
        assertEquals(1.959964, normalQuantile(0.975), 4.5e-4);
        assertEquals(1.644854, normalQuantile(0.95), 4.5e-4);
        assertEquals(2.326348, normalQuantile(0.99), 4.5e-4);
    }

    @Test
    public void testNormalQuantileSymmetry() {
        for (final double p : new double[] {0.6, 0.75, 0.9, 0.975, 0.999})
            assertEquals(-normalQuantile(p), normalQuantile(1 - p), 1e-12);
    }

    @Test
    public void testNormalQuantileInvalidProbability() {
        for (final double p : new double[] {0.0, 1.0, -0.1, 1.5, Double.NaN}) {
            final EstimationException e = assertThrows(EstimationException.class, () -> normalQuantile(p));
            assertEquals(EstimationException.Kind.INVALID_PROBABILITY, e.getKind());
        }
    }
}
