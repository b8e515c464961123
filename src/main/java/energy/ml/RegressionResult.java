package energy.ml;

/**
 * Outcome of one polynomial least-squares fit. Immutable; every array accessor returns a copy.
 */
public class RegressionResult {

    private final double[] fitted;
    private final Matrix coefficients;
    private final double[] confLow;
    private final double[] confHigh;
    private final double correlation;
    private final double correlationPValue;
    private final Adequacy adequacy;
    private final double meanY;
    private final double residualVariance;
    private final double totalVariance;
    private final double fStatistic;
    private final double fCritical;
    private final double tCritical;
    private final int degreesOfFreedom;
    private final double[] coefficientHalfWidths;
    private final double[] predictionHalfWidths;

    private RegressionResult(Builder b) {
        this.fitted = b.fitted;
        this.coefficients = b.coefficients;
        this.confLow = b.confLow;
        this.confHigh = b.confHigh;
        this.correlation = b.correlation;
        this.correlationPValue = b.correlationPValue;
        this.adequacy = b.adequacy;
        this.meanY = b.meanY;
        this.residualVariance = b.residualVariance;
        this.totalVariance = b.totalVariance;
        this.fStatistic = b.fStatistic;
        this.fCritical = b.fCritical;
        this.tCritical = b.tCritical;
        this.degreesOfFreedom = b.degreesOfFreedom;
        this.coefficientHalfWidths = b.coefficientHalfWidths;
        this.predictionHalfWidths = b.predictionHalfWidths;
    }

    /** Fitted values YR = D·B, one per observation. */
    public double[] getFitted() { return fitted.clone(); }

    /** Coefficients B₀..B₄ as a 5×1 matrix. */
    public Matrix getCoefficients() { return coefficients.copy(); }

    /** Coefficient Bᵢ, 0-based. */
    public double getCoefficient(int i) { return coefficients.get(i, 0); }

    /** Lower 95% confidence bound of each fitted value. */
    public double[] getConfLow() { return confLow.clone(); }

    /** Upper 95% confidence bound of each fitted value. */
    public double[] getConfHigh() { return confHigh.clone(); }

    /** Pearson correlation between observed and fitted values. */
    public double getCorrelation() { return correlation; }
    public double getCorrelationPValue() { return correlationPValue; }

    public Adequacy getAdequacy() { return adequacy; }
    public boolean isAdequate() { return adequacy == Adequacy.ADEQUATE; }

    public double getMeanY() { return meanY; }

    /** Dad = Σ(Y-YR)² / (N-5) */
    public double getResidualVariance() { return residualVariance; }

    /** DY = Σ(Y-Ȳ)² / (N-1) */
    public double getTotalVariance() { return totalVariance; }

    /** FR = DY / Dad */
    public double getFStatistic() { return fStatistic; }
    public double getFCritical() { return fCritical; }
    public double getTCritical() { return tCritical; }

    /** Residual degrees of freedom, N-5. */
    public int getDegreesOfFreedom() { return degreesOfFreedom; }

    /** Half-width t·sqrt(Gⱼⱼ·Dad) of the 95% confidence interval of each coefficient. */
    public double[] getCoefficientHalfWidths() { return coefficientHalfWidths.clone(); }

    /**
     * Half-width t·sqrt((1 + xᵢGxᵢᵀ)·Dad) of the 95% prediction interval (error corridor) of a new
     * observation at each design point. Always wider than the confidence band of the fitted value.
     */
    public double[] getPredictionHalfWidths() { return predictionHalfWidths.clone(); }

    public int size() { return fitted.length; }

    static Builder builder() {
        return new Builder();
    }

    static class Builder {
        private double[] fitted;
        private Matrix coefficients;
        private double[] confLow;
        private double[] confHigh;
        private double correlation;
        private double correlationPValue;
        private Adequacy adequacy;
        private double meanY;
        private double residualVariance;
        private double totalVariance;
        private double fStatistic;
        private double fCritical;
        private double tCritical;
        private int degreesOfFreedom;
        private double[] coefficientHalfWidths;
        private double[] predictionHalfWidths;

        Builder fitted(double[] v) { fitted = v; return this; }
        Builder coefficients(Matrix v) { coefficients = v; return this; }
        Builder confidence(double[] low, double[] high) { confLow = low; confHigh = high; return this; }
        Builder correlation(double r, double p) { correlation = r; correlationPValue = p; return this; }
        Builder adequacy(Adequacy v) { adequacy = v; return this; }
        Builder meanY(double v) { meanY = v; return this; }
        Builder variances(double residual, double total) { residualVariance = residual; totalVariance = total; return this; }
        Builder fTest(double statistic, double critical) { fStatistic = statistic; fCritical = critical; return this; }
        Builder tCritical(double v) { tCritical = v; return this; }
        Builder degreesOfFreedom(int v) { degreesOfFreedom = v; return this; }
        Builder coefficientHalfWidths(double[] v) { coefficientHalfWidths = v; return this; }
        Builder predictionHalfWidths(double[] v) { predictionHalfWidths = v; return this; }

        RegressionResult build() {
            return new RegressionResult(this);
        }
    }
}
