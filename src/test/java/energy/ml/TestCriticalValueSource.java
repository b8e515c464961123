package energy.ml;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

public class TestCriticalValueSource {

    @Test
    public void testTabulatedDelegatesToTables() {
        assertEquals(DistributionTables.tCritical(0.975, 12), CriticalValueSource.TABULATED.tCritical(0.975, 12), 0.0);
        assertEquals(DistributionTables.F_FALLBACK, CriticalValueSource.TABULATED.fCritical(0.05, 4, 15), 0.0);
    }

    @Test
    public void testExactAgreesWithTables() {
        // published tables are rounded to 3 decimals (t) and 2 decimals (F)
        assertEquals(2.228, CriticalValueSource.EXACT.tCritical(0.975, 10), 1e-3);
        assertEquals(2.131, CriticalValueSource.EXACT.tCritical(0.975, 15), 1e-3);
        assertEquals(3.48, CriticalValueSource.EXACT.fCritical(0.05, 4, 10), 1e-2);
        assertEquals(5.05, CriticalValueSource.EXACT.fCritical(0.05, 5, 5), 1e-2);
    }

    @Test
    public void testExactCoversUntabulatedCombinations() {
        assertEquals(3.056, CriticalValueSource.EXACT.fCritical(0.05, 4, 15), 1e-3);
    }

    @Test
    public void testExactValidatesArguments() {
        EstimationException e = assertThrows(EstimationException.class, () -> CriticalValueSource.EXACT.tCritical(0.975, 0));
        assertEquals(EstimationException.Kind.INVALID_DEGREES_OF_FREEDOM, e.getKind());
        e = assertThrows(EstimationException.class, () -> CriticalValueSource.EXACT.fCritical(1.0, 4, 10));
        assertEquals(EstimationException.Kind.INVALID_PROBABILITY, e.getKind());
    }
}
