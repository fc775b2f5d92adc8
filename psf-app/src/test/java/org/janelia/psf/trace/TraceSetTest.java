package org.janelia.psf.trace;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link TraceSet} and {@link CalibrationOffset} classes.
 *
 * @author Eric Trautman
 */
public class TraceSetTest {

    @Test
    public void testLinearTraces() {
        final double[][] traceWavelength = {
                { 4000.0, 4100.0, 4200.0, 4300.0 },
                { 4050.0, 4150.0, 4250.0, 4350.0 }
        };
        final double[][] traceX = {
                { 10.0, 10.0, 10.0, 10.0 },
                { 20.0, 21.0, 22.0, 23.0 }
        };
        final double[][] traceY = {
                { 5.0, 25.0, 45.0, 65.0 },
                { 6.0, 26.0, 46.0, 66.0 }
        };

        final TraceSet traces = new TraceSet(traceX, traceY, traceWavelength);

        Assert.assertEquals("invalid nspec", 2, traces.getNspec());
        Assert.assertEquals("invalid nwave", 4, traces.getNwave());
        Assert.assertEquals("invalid min wavelength", 4000.0, traces.getWavelengthMin(), 0.0);
        Assert.assertEquals("invalid max wavelength", 4350.0, traces.getWavelengthMax(), 0.0);

        Assert.assertEquals("invalid x", 21.5, traces.x(1, 4200.0), 1.0e-9);
        Assert.assertEquals("invalid y", 35.0, traces.y(0, 4150.0), 1.0e-9);
        Assert.assertEquals("invalid wavelength", 4150.0, traces.wavelength(0, 35.0), 1.0e-9);
        Assert.assertEquals("invalid dx/dw", 0.01, traces.dxdw(1, 4200.0), 1.0e-9);
        Assert.assertEquals("invalid dy/dw", 0.2, traces.dydw(0, 4200.0), 1.0e-9);

        final double[] nativeWavelengths = traces.getNativeWavelengths(1);
        nativeWavelengths[0] = 0.0;
        Assert.assertEquals("native wavelengths should be copied", 4050.0, traces.getNativeWavelengths(1)[0], 0.0);

        try {
            traces.getNativeWavelengths(2);
            Assert.fail("invalid fiber should have been rejected");
        } catch (final IndexOutOfBoundsException e) {
            Assert.assertTrue("message should identify fiber", e.getMessage().contains("2"));
        }
    }

    @Test
    public void testNonMonotonicY() {
        final double[][] traceWavelength = { { 4000.0, 4100.0, 4200.0, 4300.0 } };
        final double[][] traceX = { { 10.0, 10.0, 10.0, 10.0 } };
        final double[][] traceY = { { 5.0, 25.0, 15.0, 65.0 } };
        try {
            new TraceSet(traceX, traceY, traceWavelength);
            Assert.fail("non-monotonic y should have been rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue("message should identify fiber", e.getMessage().contains("fiber 0"));
        }
    }

    @Test
    public void testOffsetComposition() {
        final CalibrationOffset offset = CalibrationOffset.NONE.plus(1.5, -0.5).plus(0.5, 0.25);
        Assert.assertEquals("invalid dx", 2.0, offset.getDx(), 0.0);
        Assert.assertEquals("invalid dy", -0.25, offset.getDy(), 0.0);
        Assert.assertEquals("invalid version", 2, offset.getVersion());
        Assert.assertEquals("NONE should not change", 0.0, CalibrationOffset.NONE.getDx(), 0.0);
    }
}
