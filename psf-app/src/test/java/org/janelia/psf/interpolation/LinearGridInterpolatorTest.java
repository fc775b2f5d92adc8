package org.janelia.psf.interpolation;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link LinearGridInterpolator} class.
 *
 * @author Eric Trautman
 */
public class LinearGridInterpolatorTest {

    // two values per point: v0 = x + 10y, v1 = 2xy
    private static final double[] X_AXIS = { 0.0, 1.0, 3.0 };
    private static final double[] Y_AXIS = { 100.0, 200.0 };

    private static double[] buildValues() {
        final double[] values = new double[X_AXIS.length * Y_AXIS.length * 2];
        int i = 0;
        for (final double x : X_AXIS) {
            for (final double y : Y_AXIS) {
                values[i++] = x + (10 * y);
                values[i++] = 2 * x * y;
            }
        }
        return values;
    }

    @Test
    public void testInterpolateAtGridPoints() {
        final LinearGridInterpolator interpolator = new LinearGridInterpolator(X_AXIS, Y_AXIS, buildValues(), 2);
        for (final double x : X_AXIS) {
            for (final double y : Y_AXIS) {
                final double[] result = interpolator.interpolate(x, y);
                Assert.assertEquals("invalid v0 at (" + x + ", " + y + ")", x + (10 * y), result[0], 1.0e-9);
                Assert.assertEquals("invalid v1 at (" + x + ", " + y + ")", 2 * x * y, result[1], 1.0e-9);
            }
        }
    }

    @Test
    public void testInterpolateBetweenGridPoints() {
        final LinearGridInterpolator interpolator = new LinearGridInterpolator(X_AXIS, Y_AXIS, buildValues(), 2);

        // bilinear interpolation reproduces functions that are linear in each axis
        final double[] result = interpolator.interpolate(2.0, 125.0);
        Assert.assertEquals("invalid v0", 2.0 + 1250.0, result[0], 1.0e-9);
        Assert.assertEquals("invalid v1", 2 * 2.0 * 125.0, result[1], 1.0e-9);
    }

    @Test
    public void testExtrapolation() {
        final LinearGridInterpolator interpolator = new LinearGridInterpolator(X_AXIS, Y_AXIS, buildValues(), 2);
        final double[] result = interpolator.interpolate(4.0, 250.0);
        Assert.assertEquals("invalid extrapolated v0", 4.0 + 2500.0, result[0], 1.0e-9);
    }

    @Test
    public void testFindCell() {
        Assert.assertEquals(0, LinearGridInterpolator.findCell(X_AXIS, -5.0));
        Assert.assertEquals(0, LinearGridInterpolator.findCell(X_AXIS, 0.0));
        Assert.assertEquals(0, LinearGridInterpolator.findCell(X_AXIS, 0.5));
        Assert.assertEquals(1, LinearGridInterpolator.findCell(X_AXIS, 1.0));
        Assert.assertEquals(1, LinearGridInterpolator.findCell(X_AXIS, 3.0));
        Assert.assertEquals(1, LinearGridInterpolator.findCell(X_AXIS, 9.0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testValueCountMismatch() {
        new LinearGridInterpolator(X_AXIS, Y_AXIS, new double[5], 2);
    }

}
