package org.janelia.psf.resample;

import java.util.Arrays;

import org.janelia.psf.spec.PixelStamp;
import org.janelia.psf.spec.PixelWindow;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link SpotResampler} class.
 *
 * @author Eric Trautman
 */
public class SpotResamplerTest {

    @Test
    public void testAlignedCenter() {
        final double[][] spot = filledSpot(3, 3, 1.0);

        final PixelStamp stamp = SpotResampler.resample(spot, 10.0, 20.0, 3);

        Assert.assertEquals("invalid window", new PixelWindow(10, 12, 20, 22), stamp.getWindow());
        final double[][] values = stamp.getValues();
        Assert.assertEquals("all flux should land in first pixel", 1.0, values[0][0], 0.0);
        Assert.assertEquals("invalid pixel [0][1]", 0.0, values[0][1], 0.0);
        Assert.assertEquals("invalid pixel [1][0]", 0.0, values[1][0], 0.0);
        Assert.assertEquals("invalid pixel [1][1]", 0.0, values[1][1], 0.0);
    }

    @Test
    public void testHalfPixelShift() {
        final double[][] spot = filledSpot(3, 3, 1.0);

        // x center 10.5 with rebin 3 is 1.5 spot pixels into detector pixel 10
        final PixelStamp stamp = SpotResampler.resample(spot, 10.5, 20.0, 3);

        final double[][] values = stamp.getValues();
        Assert.assertEquals("invalid pixel [0][0]", 0.5, values[0][0], 1.0e-12);
        Assert.assertEquals("invalid pixel [0][1]", 0.5, values[0][1], 1.0e-12);
        Assert.assertEquals("invalid pixel [1][0]", 0.0, values[1][0], 1.0e-12);
        Assert.assertEquals("invalid pixel [1][1]", 0.0, values[1][1], 1.0e-12);
    }

    @Test
    public void testStampShapeAndNormalization() {
        final double[][] spot = gaussianSpot(30, 24, 4.0, 3.0);
        final double[][] centers = {
                { 100.0, 200.0 }, { 100.37, 200.81 }, { 0.999999, 5.5 }, { 57.333333, 12.666667 }, { -3.2, -7.9 }
        };

        for (final double[] center : centers) {
            final PixelStamp stamp = SpotResampler.resample(spot, center[0], center[1], 3);
            final PixelWindow window = stamp.getWindow();
            final String context = "center (" + center[0] + ", " + center[1] + ")";

            Assert.assertEquals("invalid columns for " + context, 11, stamp.getColumns());
            Assert.assertEquals("invalid rows for " + context, 9, stamp.getRows());
            Assert.assertEquals("window width does not match stamp for " + context,
                                stamp.getColumns(), window.getWidth());
            Assert.assertEquals("window height does not match stamp for " + context,
                                stamp.getRows(), window.getHeight());
            Assert.assertEquals("invalid window x start for " + context,
                                (int) Math.floor(center[0]) - 4, window.getXStart());
            Assert.assertEquals("invalid window y start for " + context,
                                (int) Math.floor(center[1]) - 3, window.getYStart());
            Assert.assertEquals("stamp should be normalized for " + context, 1.0, stamp.getSum(), 1.0e-12);
        }
    }

    @Test
    public void testIntegralShiftTranslatesStamp() {
        final double[][] spot = gaussianSpot(15, 15, 2.0, 2.0);

        final PixelStamp stamp = SpotResampler.resample(spot, 40.25, 60.75, 5);
        final PixelStamp shiftedStamp = SpotResampler.resample(spot, 43.25, 58.75, 5);

        Assert.assertEquals("shifted window should be translated",
                            stamp.getWindow().translate(3, -2), shiftedStamp.getWindow());
        for (int row = 0; row < stamp.getRows(); row++) {
            Assert.assertArrayEquals("invalid shifted row " + row,
                                     stamp.getValues()[row], shiftedStamp.getValues()[row], 1.0e-12);
        }
    }

    @Test
    public void testZeroSpot() {
        final PixelStamp stamp = SpotResampler.resample(filledSpot(6, 6, 0.0), 10.4, 20.6, 3);
        Assert.assertEquals("invalid columns", 3, stamp.getColumns());
        Assert.assertEquals("zero spot should produce zero stamp", 0.0, stamp.getSum(), 0.0);
    }

    @Test
    public void testNegativeValuesAreClipped() {
        final double[][] spot = filledSpot(6, 6, 0.0);
        spot[0][0] = -4.0;
        spot[5][5] = 2.0;

        final PixelStamp stamp = SpotResampler.resample(spot, 10.0, 20.0, 3);

        for (final double[] row : stamp.getValues()) {
            for (final double value : row) {
                Assert.assertTrue("negative value " + value + " should have been clipped", value >= 0.0);
            }
        }
        Assert.assertEquals("invalid sum", 1.0, stamp.getSum(), 1.0e-12);
        Assert.assertEquals("positive flux should be in last block", 1.0, stamp.getValues()[1][1], 1.0e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidRebinFactor() {
        SpotResampler.resample(filledSpot(3, 3, 1.0), 1.0, 1.0, 0);
    }

    @Test
    public void testGetCcdLength() {
        Assert.assertEquals(11, SpotResampler.getCcdLength(30, 3));
        Assert.assertEquals(11, SpotResampler.getCcdLength(29, 3));
        Assert.assertEquals(12, SpotResampler.getCcdLength(31, 3));
        Assert.assertEquals(31, SpotResampler.getCcdLength(30, 1));
    }

    static double[][] filledSpot(final int rows,
                                 final int columns,
                                 final double value) {
        final double[][] spot = new double[rows][columns];
        for (final double[] row : spot) {
            Arrays.fill(row, value);
        }
        return spot;
    }

    static double[][] gaussianSpot(final int columns,
                                   final int rows,
                                   final double sigmaX,
                                   final double sigmaY) {
        final double[][] spot = new double[rows][columns];
        for (int row = 0; row < rows; row++) {
            final double dy = (row - ((rows - 1) / 2.0)) / sigmaY;
            for (int column = 0; column < columns; column++) {
                final double dx = (column - ((columns - 1) / 2.0)) / sigmaX;
                spot[row][column] = Math.exp(-0.5 * ((dx * dx) + (dy * dy)));
            }
        }
        return spot;
    }
}
