package energy.ml;

import static energy.ml.EstimationException.Kind.INVALID_DEGREES_OF_FREEDOM;
import static energy.ml.EstimationException.Kind.INVALID_PROBABILITY;

import org.apache.commons.math3.distribution.FDistribution;
import org.apache.commons.math3.distribution.TDistribution;

/**
 * Where the regression gets its t and F critical values from.
 */
public enum CriticalValueSource {

    /** Fixed lookup tables, see {@link DistributionTables}. */
    TABULATED {
        @Override
        public double tCritical(double probability, int df) {
            return DistributionTables.tCritical(probability, df);
        }

        @Override
        public double fCritical(double alpha, int df1, int df2) {
            return DistributionTables.fCritical(alpha, df1, df2);
        }
    },

    /** Inverse CDFs of the t and F distributions (Commons Math). */
    EXACT {
        @Override
        public double tCritical(double probability, int df) {
            checkDf(df);
            checkProbability(probability);
            return new TDistribution(df).inverseCumulativeProbability(probability);
        }

        @Override
        public double fCritical(double alpha, int df1, int df2) {
            checkDf(df1);
            checkDf(df2);
            checkProbability(alpha);
            return new FDistribution(df1, df2).inverseCumulativeProbability(1.0 - alpha);
        }
    };

    /** Value t with P(T &lt;= t) = {@code probability} for {@code df} degrees of freedom. */
    public abstract double tCritical(double probability, int df);

    /** Upper {@code alpha} critical value of F(df1, df2). */
    public abstract double fCritical(double alpha, int df1, int df2);

    private static void checkDf(int df) {
        if (df <= 0) {
            throw new EstimationException(INVALID_DEGREES_OF_FREEDOM, "Degrees of freedom must be positive, got " + df);
        }
    }

    private static void checkProbability(double p) {
        if (!(p > 0.0 && p < 1.0)) {
            throw new EstimationException(INVALID_PROBABILITY, "Probability must lie in (0, 1), got " + p);
        }
    }
}
