package org.janelia.psf.trace;

import org.janelia.psf.interpolation.TraceSpline;

/**
 * Per fiber trace solution built from sampled X, Y and WAVELENGTH grids:
 * wavelength to x, wavelength to y and (the inverse) y to wavelength.
 * Values returned here are raw, no {@link CalibrationOffset} is applied.
 *
 * Instances are immutable and may be shared by PSF copies.
 *
 * @author Eric Trautman
 */
public class TraceSet {

    private final double[][] nativeWavelengths;
    private final TraceSpline[] xOfWavelength;
    private final TraceSpline[] yOfWavelength;
    private final TraceSpline[] wavelengthOfY;
    private final double wavelengthMin;
    private final double wavelengthMax;

    /**
     * @param  traceX           x centroids ordered [ispec][sample].
     * @param  traceY           y centroids ordered [ispec][sample], ascending for each fiber.
     * @param  traceWavelength  wavelengths ordered [ispec][sample], ascending for each fiber.
     *
     * @throws IllegalArgumentException
     *   if any fiber's samples cannot be interpolated.
     */
    public TraceSet(final double[][] traceX,
                    final double[][] traceY,
                    final double[][] traceWavelength)
            throws IllegalArgumentException {

        final int nspec = traceWavelength.length;
        if (nspec == 0) {
            throw new IllegalArgumentException("traces must contain at least one fiber");
        }
        if ((traceX.length != nspec) || (traceY.length != nspec)) {
            throw new IllegalArgumentException("x, y and wavelength traces must have the same number of fibers");
        }

        this.nativeWavelengths = new double[nspec][];
        this.xOfWavelength = new TraceSpline[nspec];
        this.yOfWavelength = new TraceSpline[nspec];
        this.wavelengthOfY = new TraceSpline[nspec];

        double minWavelength = Double.MAX_VALUE;
        double maxWavelength = -Double.MAX_VALUE;
        for (int ispec = 0; ispec < nspec; ispec++) {
            final double[] wavelengths = traceWavelength[ispec];
            try {
                xOfWavelength[ispec] = new TraceSpline(wavelengths, traceX[ispec]);
                yOfWavelength[ispec] = new TraceSpline(wavelengths, traceY[ispec]);
                wavelengthOfY[ispec] = new TraceSpline(traceY[ispec], wavelengths);
            } catch (final IllegalArgumentException e) {
                throw new IllegalArgumentException("invalid trace for fiber " + ispec, e);
            }
            nativeWavelengths[ispec] = wavelengths.clone();
            minWavelength = Math.min(minWavelength, wavelengths[0]);
            maxWavelength = Math.max(maxWavelength, wavelengths[wavelengths.length - 1]);
        }

        this.wavelengthMin = minWavelength;
        this.wavelengthMax = maxWavelength;
    }

    public int getNspec() {
        return nativeWavelengths.length;
    }

    /**
     * @return number of native wavelength samples for each fiber.
     */
    public int getNwave() {
        return nativeWavelengths[0].length;
    }

    public double getWavelengthMin() {
        return wavelengthMin;
    }

    public double getWavelengthMax() {
        return wavelengthMax;
    }

    /**
     * @return copy of the native wavelength grid for the specified fiber.
     *
     * @throws IndexOutOfBoundsException
     *   if the fiber index is invalid.
     */
    public double[] getNativeWavelengths(final int ispec)
            throws IndexOutOfBoundsException {
        validateFiberIndex(ispec);
        return nativeWavelengths[ispec].clone();
    }

    public double x(final int ispec,
                    final double wavelength) {
        return xOfWavelength[ispec].value(wavelength);
    }

    public double y(final int ispec,
                    final double wavelength) {
        return yOfWavelength[ispec].value(wavelength);
    }

    public double wavelength(final int ispec,
                             final double y) {
        return wavelengthOfY[ispec].value(y);
    }

    public double dxdw(final int ispec,
                       final double wavelength) {
        return xOfWavelength[ispec].derivative(wavelength);
    }

    public double dydw(final int ispec,
                       final double wavelength) {
        return yOfWavelength[ispec].derivative(wavelength);
    }

    /**
     * @throws IndexOutOfBoundsException
     *   if the fiber index is outside [0, nspec).
     */
    public void validateFiberIndex(final int ispec)
            throws IndexOutOfBoundsException {
        if ((ispec < 0) || (ispec >= nativeWavelengths.length)) {
            throw new IndexOutOfBoundsException("fiber index " + ispec + " is outside valid range [0, " +
                                                nativeWavelengths.length + ")");
        }
    }

}
