package org.janelia.psf.project;

import java.io.Serializable;

import org.ejml.data.DMatrixRMaj;
import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;
import org.ejml.sparse.csc.CommonOps_DSCC;

/**
 * Immutable sparse matrix stored in compressed column form.
 * Only non-zero values are stored and row indices within each column are unique.
 *
 * @author Eric Trautman
 */
public class SparseMatrix implements Serializable {

    private final DMatrixSparseCSC csc;

    private SparseMatrix(final DMatrixSparseCSC csc) {
        this.csc = csc;
    }

    public int getNumberOfRows() {
        return csc.numRows;
    }

    public int getNumberOfColumns() {
        return csc.numCols;
    }

    public int getNonZeroCount() {
        return csc.nz_length;
    }

    /**
     * @return value at the specified position (zero if no value is stored there).
     *
     * @throws IndexOutOfBoundsException
     *   if the position is outside the matrix.
     */
    public double get(final int row,
                      final int column)
            throws IndexOutOfBoundsException {
        validateIndex("row", row, csc.numRows);
        validateIndex("column", column, csc.numCols);
        return csc.unsafe_get(row, column);
    }

    /**
     * Columns are visited in ascending order so each result element accumulates its
     * contributions in column order.
     *
     * @return this matrix multiplied by the specified column vector.
     *
     * @throws IllegalArgumentException
     *   if the vector length does not match the number of columns.
     */
    public double[] multiply(final double[] x)
            throws IllegalArgumentException {

        if (x.length != csc.numCols) {
            throw new IllegalArgumentException("vector has " + x.length + " values but matrix has " +
                                               csc.numCols + " columns");
        }

        final DMatrixRMaj y = new DMatrixRMaj(csc.numRows, 1);
        CommonOps_DSCC.mult(csc, DMatrixRMaj.wrap(x.length, 1, x), y);
        return y.data;
    }

    /**
     * @return the transpose of this matrix multiplied by the specified column vector.
     *
     * @throws IllegalArgumentException
     *   if the vector length does not match the number of rows.
     */
    public double[] transposeMultiply(final double[] y)
            throws IllegalArgumentException {

        if (y.length != csc.numRows) {
            throw new IllegalArgumentException("vector has " + y.length + " values but matrix has " +
                                               csc.numRows + " rows");
        }

        final DMatrixRMaj x = new DMatrixRMaj(csc.numCols, 1);
        CommonOps_DSCC.multTransA(csc, DMatrixRMaj.wrap(y.length, 1, y), x, null);
        return x.data;
    }

    /**
     * @return dense copy of this matrix ordered [row][column].
     */
    public double[][] toDense() {
        final DMatrixRMaj denseMatrix = new DMatrixRMaj(csc.numRows, csc.numCols);
        DConvertMatrixStruct.convert(csc, denseMatrix);
        final double[][] dense = new double[csc.numRows][csc.numCols];
        for (int row = 0; row < dense.length; row++) {
            System.arraycopy(denseMatrix.data, row * csc.numCols, dense[row], 0, csc.numCols);
        }
        return dense;
    }

    @Override
    public String toString() {
        return "SparseMatrix{rows=" + csc.numRows + ", columns=" + csc.numCols +
               ", nonZeroCount=" + getNonZeroCount() + '}';
    }

    private static void validateIndex(final String context,
                                      final int index,
                                      final int size)
            throws IndexOutOfBoundsException {
        if ((index < 0) || (index >= size)) {
            throw new IndexOutOfBoundsException(context + " " + index + " is outside valid range [0, " + size + ")");
        }
    }

    /**
     * Builds a matrix one column at a time.
     */
    public static class Builder {

        private final DMatrixSparseTriplet triplet;
        private int currentColumn;

        public Builder(final int numberOfRows,
                       final int numberOfColumns) {
            if ((numberOfRows < 0) || (numberOfColumns < 0)) {
                throw new IllegalArgumentException("invalid matrix size " + numberOfRows + "x" + numberOfColumns);
            }
            this.triplet = new DMatrixSparseTriplet(numberOfRows, numberOfColumns, 16);
            this.currentColumn = 0;
        }

        /**
         * Adds a value to the current column.  Zero values are ignored.
         */
        public Builder add(final int row,
                           final double value)
                throws IndexOutOfBoundsException {
            validateColumnAvailable();
            validateIndex("row", row, triplet.numRows);
            if (value != 0.0) {
                triplet.addItem(row, currentColumn, value);
            }
            return this;
        }

        /**
         * Completes the current column and starts the next one.
         */
        public Builder nextColumn() {
            validateColumnAvailable();
            currentColumn++;
            return this;
        }

        /**
         * @throws IllegalStateException
         *   if some columns have not been completed.
         */
        public SparseMatrix build()
                throws IllegalStateException {
            if (currentColumn != triplet.numCols) {
                throw new IllegalStateException("only " + currentColumn + " of " + triplet.numCols +
                                                " columns have been built");
            }
            final DMatrixSparseCSC csc = new DMatrixSparseCSC(triplet.numRows, triplet.numCols, triplet.nz_length);
            DConvertMatrixStruct.convert(triplet, csc);
            return new SparseMatrix(csc);
        }

        private void validateColumnAvailable()
                throws IllegalStateException {
            if (currentColumn >= triplet.numCols) {
                throw new IllegalStateException("all " + triplet.numCols + " columns have already been built");
            }
        }
    }
}
