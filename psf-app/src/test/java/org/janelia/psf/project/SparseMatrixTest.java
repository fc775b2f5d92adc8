package org.janelia.psf.project;

import java.util.Random;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link SparseMatrix} class.
 *
 * @author Eric Trautman
 */
public class SparseMatrixTest {

    @Test
    public void testBuildAndMultiply() {

        // [ 1 0 2 ]
        // [ 0 0 3 ]
        // [ 4 0 0 ]
        // [ 0 0 5 ]
        final SparseMatrix matrix = new SparseMatrix.Builder(4, 3)
                .add(0, 1.0).add(2, 4.0).nextColumn()
                .add(1, 0.0).nextColumn()
                .add(0, 2.0).add(1, 3.0).add(3, 5.0).nextColumn()
                .build();

        Assert.assertEquals("invalid number of rows", 4, matrix.getNumberOfRows());
        Assert.assertEquals("invalid number of columns", 3, matrix.getNumberOfColumns());
        Assert.assertEquals("zero values should not be stored", 5, matrix.getNonZeroCount());

        Assert.assertEquals("invalid value", 4.0, matrix.get(2, 0), 0.0);
        Assert.assertEquals("invalid value", 5.0, matrix.get(3, 2), 0.0);
        Assert.assertEquals("missing value should be zero", 0.0, matrix.get(1, 1), 0.0);

        final double[] y = matrix.multiply(new double[] { 1.0, 10.0, 100.0 });
        Assert.assertArrayEquals("invalid product", new double[] { 201.0, 300.0, 4.0, 500.0 }, y, 0.0);

        final double[] x = matrix.transposeMultiply(new double[] { 1.0, 2.0, 3.0, 4.0 });
        Assert.assertArrayEquals("invalid transpose product", new double[] { 13.0, 0.0, 28.0 }, x, 0.0);

        final double[][] dense = matrix.toDense();
        Assert.assertArrayEquals("invalid dense row", new double[] { 1.0, 0.0, 2.0 }, dense[0], 0.0);
        Assert.assertArrayEquals("invalid dense row", new double[] { 0.0, 0.0, 5.0 }, dense[3], 0.0);
    }

    @Test
    public void testTransposeProductMatchesDense() {
        final int rows = 37;
        final int columns = 23;
        final Random random = new Random(11);
        final SparseMatrix.Builder builder = new SparseMatrix.Builder(rows, columns);
        for (int column = 0; column < columns; column++) {
            for (int row = 0; row < rows; row++) {
                if (random.nextDouble() < 0.2) {
                    builder.add(row, random.nextDouble());
                }
            }
            builder.nextColumn();
        }
        final SparseMatrix matrix = builder.build();
        final double[][] dense = matrix.toDense();

        final double[] y = new double[rows];
        for (int row = 0; row < rows; row++) {
            y[row] = random.nextDouble() - 0.5;
        }

        final double[] x = matrix.transposeMultiply(y);
        Assert.assertEquals("invalid transpose product length", columns, x.length);
        for (int column = 0; column < columns; column++) {
            double expected = 0.0;
            for (int row = 0; row < rows; row++) {
                expected += dense[row][column] * y[row];
            }
            Assert.assertEquals("invalid transpose product for column " + column, expected, x[column], 1.0e-12);
        }

        try {
            matrix.transposeMultiply(new double[columns]);
            Assert.fail("vector with wrong length should have been rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue("message should name row count", e.getMessage().contains(String.valueOf(rows)));
        }
    }

    @Test
    public void testGrowsBeyondInitialCapacity() {
        final int size = 100;
        final SparseMatrix.Builder builder = new SparseMatrix.Builder(size, size);
        for (int column = 0; column < size; column++) {
            builder.add(column, column + 1.0).nextColumn();
        }
        final SparseMatrix identityLike = builder.build();
        Assert.assertEquals("invalid non-zero count", size, identityLike.getNonZeroCount());
        Assert.assertEquals("invalid diagonal value", 100.0, identityLike.get(99, 99), 0.0);
    }

    @Test
    public void testInvalidUsage() {
        final SparseMatrix.Builder builder = new SparseMatrix.Builder(2, 2);

        try {
            builder.add(2, 1.0);
            Assert.fail("row outside matrix should have been rejected");
        } catch (final IndexOutOfBoundsException e) {
            Assert.assertNotNull(e.getMessage());
        }

        builder.add(1, 1.0).nextColumn();
        try {
            builder.build();
            Assert.fail("incomplete matrix should not be built");
        } catch (final IllegalStateException e) {
            Assert.assertNotNull(e.getMessage());
        }

        builder.nextColumn();
        try {
            builder.nextColumn();
            Assert.fail("extra column should have been rejected");
        } catch (final IllegalStateException e) {
            Assert.assertNotNull(e.getMessage());
        }

        final SparseMatrix matrix = builder.build();
        try {
            matrix.get(0, 2);
            Assert.fail("column outside matrix should have been rejected");
        } catch (final IndexOutOfBoundsException e) {
            Assert.assertNotNull(e.getMessage());
        }
        try {
            matrix.multiply(new double[3]);
            Assert.fail("vector with wrong length should have been rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertNotNull(e.getMessage());
        }
    }

}
