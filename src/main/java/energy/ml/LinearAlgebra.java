package energy.ml;

import static energy.ml.EstimationException.Kind.DIMENSION_MISMATCH;
import static energy.ml.EstimationException.Kind.NOT_SQUARE;
import static energy.ml.EstimationException.Kind.SINGULAR_MATRIX;

/**
 * The handful of dense matrix operations the least-squares fit needs:
 * product, transpose and Gauss-Jordan inversion.
 * <p>
 * None of them modify their arguments.
 */
public final class LinearAlgebra {

    /** Pivots smaller than this in absolute value mark the matrix as singular. */
    public static final double SINGULAR_TOLERANCE = 1e-10;

    private LinearAlgebra() {}

    /**
     * C = A·B
     *
     * @throws EstimationException {@code DIMENSION_MISMATCH} when {@code a.cols != b.rows}
     */
    public static Matrix multiply(Matrix a, Matrix b) {
        if (a.getCols() != b.getRows()) {
            throw new EstimationException(DIMENSION_MISMATCH, "Cannot multiply " + a.getRows() + "x" + a.getCols()
                + " by " + b.getRows() + "x" + b.getCols());
        }
        Matrix result = new Matrix(a.getRows(), b.getCols());
        for (int i = 0; i < a.getRows(); i++) {
            for (int j = 0; j < b.getCols(); j++) {
                double sum = 0.0;
                for (int k = 0; k < a.getCols(); k++) {
                    sum += a.get(i, k) * b.get(k, j);
                }
                result.set(i, j, sum);
            }
        }
        return result;
    }

    public static Matrix transpose(Matrix m) {
        Matrix result = new Matrix(m.getCols(), m.getRows());
        for (int i = 0; i < m.getRows(); i++) {
            for (int j = 0; j < m.getCols(); j++) {
                result.set(j, i, m.get(i, j));
            }
        }
        return result;
    }

    /**
     * Inverse by Gauss-Jordan elimination on the augmented matrix [A | I] with partial pivoting.
     * <p>
     * For each column the row with the largest absolute value at or below the diagonal is swapped
     * into the pivot position (the first such row wins a tie). The pivot row is normalized and the
     * column is eliminated from every other row, leaving A⁻¹ in the right half.
     *
     * @throws EstimationException {@code NOT_SQUARE} for a non-square matrix,
     *                             {@code SINGULAR_MATRIX} when a pivot falls below {@link #SINGULAR_TOLERANCE}
     */
    public static Matrix inverse(Matrix m) {
        if (m.getRows() != m.getCols()) {
            throw new EstimationException(NOT_SQUARE, "Only square matrices can be inverted, got "
                + m.getRows() + "x" + m.getCols());
        }
        int n = m.getRows();
        int width = 2 * n;
        Matrix aug = new Matrix(n, width);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                aug.set(i, j, m.get(i, j));
            }
            aug.set(i, i + n, 1.0);
        }

        for (int i = 0; i < n; i++) {
            int maxRow = i;
            for (int k = i + 1; k < n; k++) {
                if (Math.abs(aug.get(k, i)) > Math.abs(aug.get(maxRow, i))) {
                    maxRow = k;
                }
            }
            if (maxRow != i) {
                for (int j = 0; j < width; j++) {
                    double tmp = aug.get(i, j);
                    aug.set(i, j, aug.get(maxRow, j));
                    aug.set(maxRow, j, tmp);
                }
            }

            double pivot = aug.get(i, i);
            if (Math.abs(pivot) < SINGULAR_TOLERANCE) {
                throw new EstimationException(SINGULAR_MATRIX, "Matrix is singular: pivot " + pivot + " in column " + i);
            }
            for (int j = 0; j < width; j++) {
                aug.set(i, j, aug.get(i, j) / pivot);
            }

            for (int k = 0; k < n; k++) {
                if (k == i) continue;
                double factor = aug.get(k, i);
                if (factor == 0.0) continue;
                for (int j = 0; j < width; j++) {
                    aug.set(k, j, aug.get(k, j) - factor * aug.get(i, j));
                }
            }
        }

        Matrix result = new Matrix(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                result.set(i, j, aug.get(i, j + n));
            }
        }
        return result;
    }

    /** x·M·xᵀ for a row vector x of length {@code m.rows}. */
    public static double quadraticForm(double[] x, Matrix m) {
        if (m.getRows() != m.getCols() || x.length != m.getRows()) {
            throw new EstimationException(DIMENSION_MISMATCH, "Quadratic form needs a square matrix of order "
                + x.length + ", got " + m.getRows() + "x" + m.getCols());
        }
        double sum = 0.0;
        for (int j = 0; j < x.length; j++) {
            for (int l = 0; l < x.length; l++) {
                sum += x[j] * m.get(j, l) * x[l];
            }
        }
        return sum;
    }
}
