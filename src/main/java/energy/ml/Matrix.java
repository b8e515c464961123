package energy.ml;

import java.util.Arrays;

/**
 * Dense row-major matrix of doubles.
 * <p>
 * Element (i, j) lives at {@code data[i * cols + j]}. The shape is fixed at construction,
 * element values may be changed in place with {@link #set(int, int, double)}.
 */
public class Matrix {

    private final int rows;
    private final int cols;
    private final double[] data;

    /**
     * @param rows number of rows
     * @param cols number of columns
     * @param data elements in row-major order; must hold exactly {@code rows * cols} values.
     *             The array is used as-is, not copied.
     */
    public Matrix(int rows, int cols, double[] data) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Matrix dimensions must be non-negative: " + rows + "x" + cols);
        }
        if (data == null || data.length != (long) rows * cols) {
            throw new EstimationException(EstimationException.Kind.DIMENSION_MISMATCH,
                "Matrix " + rows + "x" + cols + " needs " + ((long) rows * cols) + " values, got "
                    + (data == null ? "null" : String.valueOf(data.length)));
        }
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    /** Zero-filled matrix. */
    public Matrix(int rows, int cols) {
        this(rows, cols, new double[elementCount(rows, cols)]);
    }

    private static int elementCount(int rows, int cols) {
        if (rows < 0 || cols < 0) {
            throw new IllegalArgumentException("Matrix dimensions must be non-negative: " + rows + "x" + cols);
        }
        long count = (long) rows * cols;
        if (count > Integer.MAX_VALUE) {
            throw new EstimationException(EstimationException.Kind.DIMENSION_MISMATCH,
                "Matrix " + rows + "x" + cols + " has too many elements: " + count);
        }
        return (int) count;
    }

    /** Build from row arrays; every row must have the same length. */
    public static Matrix of(double[]... rowValues) {
        int r = rowValues.length;
        int c = r == 0 ? 0 : rowValues[0].length;
        double[] d = new double[r * c];
        for (int i = 0; i < r; i++) {
            if (rowValues[i].length != c) {
                throw new EstimationException(EstimationException.Kind.DIMENSION_MISMATCH,
                    "Row " + i + " has " + rowValues[i].length + " values, expected " + c);
            }
            System.arraycopy(rowValues[i], 0, d, i * c, c);
        }
        return new Matrix(r, c, d);
    }

    /** Single-column matrix holding {@code values}. */
    public static Matrix column(double... values) {
        return new Matrix(values.length, 1, values.clone());
    }

    public static Matrix identity(int n) {
        Matrix m = new Matrix(n, n);
        for (int i = 0; i < n; i++) m.set(i, i, 1.0);
        return m;
    }

    public int getRows() { return rows; }
    public int getCols() { return cols; }

    public double get(int i, int j) {
        return data[index(i, j)];
    }

    public void set(int i, int j, double value) {
        data[index(i, j)] = value;
    }

    /** Copy of row {@code i}. */
    public double[] row(int i) {
        checkRow(i);
        return Arrays.copyOfRange(data, i * cols, (i + 1) * cols);
    }

    /** Copy of column {@code j}. */
    public double[] columnValues(int j) {
        if (j < 0 || j >= cols) throw new IndexOutOfBoundsException("Column " + j + " outside 0.." + (cols - 1));
        double[] out = new double[rows];
        for (int i = 0; i < rows; i++) out[i] = data[i * cols + j];
        return out;
    }

    /** Copy of all elements in row-major order. */
    public double[] toArray() {
        return data.clone();
    }

    public Matrix copy() {
        return new Matrix(rows, cols, data.clone());
    }

    private int index(int i, int j) {
        checkRow(i);
        if (j < 0 || j >= cols) throw new IndexOutOfBoundsException("Column " + j + " outside 0.." + (cols - 1));
        return i * cols + j;
    }

    private void checkRow(int i) {
        if (i < 0 || i >= rows) throw new IndexOutOfBoundsException("Row " + i + " outside 0.." + (rows - 1));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Matrix)) return false;
        Matrix other = (Matrix) o;
        return rows == other.rows && cols == other.cols && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Matrix ").append(rows).append('x').append(cols).append(" [");
        for (int i = 0; i < rows; i++) {
            if (i > 0) sb.append("; ");
            for (int j = 0; j < cols; j++) {
                if (j > 0) sb.append(", ");
                sb.append(data[i * cols + j]);
            }
        }
        return sb.append(']').toString();
    }
}
