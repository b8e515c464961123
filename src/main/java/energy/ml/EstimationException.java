package energy.ml;

/**
 * Raised when an estimation step cannot proceed on the given input.
 * <p>
 * Every failure is a deterministic input-validity error, so callers should not retry.
 * The {@link Kind} tells them which check failed.
 */
public class EstimationException extends RuntimeException {
    private static final long serialVersionUID = 4810527330960153729L;

    public enum Kind {
        /** Incompatible matrix shapes. */
        DIMENSION_MISMATCH,
        /** Inverse requested on a non-square matrix. */
        NOT_SQUARE,
        /** Pivot below tolerance during inversion. */
        SINGULAR_MATRIX,
        /** Non-positive degrees of freedom for a critical value. */
        INVALID_DEGREES_OF_FREEDOM,
        /** Too few observations to estimate the residual variance. */
        DEGENERATE_SAMPLE,
        /** Probability outside (0, 1) or not tabulated. */
        INVALID_PROBABILITY,
        /** Sample series of unequal length. */
        LENGTH_MISMATCH
    }

    private final Kind kind;

    public EstimationException(Kind kind, String msg) {
        super(msg);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
