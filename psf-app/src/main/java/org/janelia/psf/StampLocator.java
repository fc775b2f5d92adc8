package org.janelia.psf;

import java.util.Arrays;
import java.util.TreeSet;

import org.janelia.psf.spec.PixelStamp;
import org.janelia.psf.spec.PixelWindow;
import org.janelia.psf.spec.XYRange;

/**
 * Locates PSF stamps on (a sub-region of) the detector and computes
 * bounding boxes for groups of fibers and wavelengths.
 *
 * @author Eric Trautman
 */
public class StampLocator {

    private final PsfModel psf;

    public StampLocator(final PsfModel psf) {
        this.psf = psf;
    }

    /**
     * @return stamp for the specified fiber and wavelength clipped to the full detector.
     */
    public PixelStamp xypix(final int ispec,
                            final double wavelength)
            throws IndexOutOfBoundsException {
        return xypix(ispec, wavelength, null, null, null, null);
    }

    /**
     * Clips the natural stamp for the specified fiber and wavelength to the specified bounds.
     * Null bounds default to the detector edges.
     *
     * Wavelengths below the PSF minimum produce an empty stamp at x=[0,0), y=[0,0) while
     * wavelengths above the PSF maximum produce an empty stamp at x=[0,0), y=[yMax,yMax).
     * Stamps that fall completely outside the bounds are empty and collapsed onto the edge they fall off.
     *
     * @return the clipped stamp with a window expressed relative to (xMin, yMin).
     *
     * @throws IndexOutOfBoundsException
     *   if the fiber index is invalid.
     */
    public PixelStamp xypix(final int ispec,
                            final double wavelength,
                            final Integer xMin,
                            final Integer xMax,
                            final Integer yMin,
                            final Integer yMax)
            throws IndexOutOfBoundsException {

        validateFiberIndex(ispec);

        final int x0 = xMin == null ? 0 : xMin;
        final int x1 = xMax == null ? psf.getNpixX() : xMax;
        final int y0 = yMin == null ? 0 : yMin;
        final int y1 = yMax == null ? psf.getNpixY() : yMax;

        if (wavelength < psf.getWavelengthMin()) {
            return emptyStamp(0, 0);
        } else if (wavelength > psf.getWavelengthMax()) {
            return emptyStamp(0, y1);
        }

        final PixelStamp stamp = psf.stampFor(ispec, wavelength);
        final PixelWindow window = stamp.getWindow();
        final PixelWindow clippedWindow = clip(window, x0, x1, y0, y1);

        if (clippedWindow.isEmpty()) {
            return PixelStamp.empty(clippedWindow);
        }

        final double[][] values = stamp.getValues();
        final int columnOffset = clippedWindow.getXStart() + x0 - window.getXStart();
        final int rowOffset = clippedWindow.getYStart() + y0 - window.getYStart();
        final double[][] clippedValues = new double[clippedWindow.getHeight()][];
        for (int row = 0; row < clippedValues.length; row++) {
            clippedValues[row] = Arrays.copyOfRange(values[row + rowOffset],
                                                    columnOffset,
                                                    columnOffset + clippedWindow.getWidth());
        }

        return new PixelStamp(clippedWindow, clippedValues);
    }

    /**
     * @return bounding box for a single fiber.
     */
    public XYRange xyrange(final int ispec,
                           final double[] wavelengths)
            throws IndexOutOfBoundsException, IllegalArgumentException {
        return xyrange(ispec, ispec, wavelengths);
    }

    /**
     * Computes the tight detector bounding box of all (detector clipped) stamps for fibers
     * specFirst through specLast (inclusive) between the minimum and maximum of the specified wavelengths.
     * Stamps are located at the range end points, every native wavelength sample (and
     * the midpoint between consecutive samples) inside the range and any explicitly specified wavelength.
     * Stamp windows are located without rendering the stamps.
     *
     * @param  specFirst    first fiber.
     * @param  specLast     last fiber (included in the box).
     * @param  wavelengths  a (min, max) pair or an explicit list of wavelengths.
     *
     * @return bounding box with exclusive max values or {@link XYRange#EMPTY} if no stamp lands on the detector.
     *
     * @throws IndexOutOfBoundsException
     *   if either fiber is invalid or specLast is less than specFirst.
     *
     * @throws IllegalArgumentException
     *   if no wavelengths are specified.
     */
    public XYRange xyrange(final int specFirst,
                           final int specLast,
                           final double[] wavelengths)
            throws IndexOutOfBoundsException, IllegalArgumentException {

        if ((specFirst < 0) || (specLast >= psf.getNspec()) || (specLast < specFirst)) {
            throw new IndexOutOfBoundsException("fibers " + specFirst + " through " + specLast +
                                                " are not within valid range [0, " + psf.getNspec() + ")");
        }
        if ((wavelengths == null) || (wavelengths.length == 0)) {
            throw new IllegalArgumentException("at least one wavelength must be specified");
        }

        double minWavelength = wavelengths[0];
        double maxWavelength = wavelengths[0];
        for (final double w : wavelengths) {
            minWavelength = Math.min(minWavelength, w);
            maxWavelength = Math.max(maxWavelength, w);
        }

        final int npixX = psf.getNpixX();
        final int npixY = psf.getNpixY();

        XYRange range = XYRange.EMPTY;
        for (int ispec = specFirst; ispec <= specLast; ispec++) {

            final TreeSet<Double> samples = new TreeSet<>();
            samples.add(minWavelength);
            samples.add(maxWavelength);
            if (wavelengths.length > 2) {
                for (final double w : wavelengths) {
                    samples.add(w);
                }
            }

            final double[] nativeWavelengths = psf.getNativeWavelengths(ispec);
            for (int i = 0; i < nativeWavelengths.length; i++) {
                addIfInside(samples, nativeWavelengths[i], minWavelength, maxWavelength);
                if (i > 0) {
                    final double midpoint = (nativeWavelengths[i - 1] + nativeWavelengths[i]) / 2.0;
                    addIfInside(samples, midpoint, minWavelength, maxWavelength);
                }
            }

            for (final Double w : samples) {
                if ((w >= psf.getWavelengthMin()) && (w <= psf.getWavelengthMax())) {
                    final PixelWindow window = clip(psf.windowFor(ispec, w), 0, npixX, 0, npixY);
                    if (! window.isEmpty()) {
                        range = range.union(window);
                    }
                }
            }
        }

        return range;
    }

    /**
     * @throws IndexOutOfBoundsException
     *   if the fiber index is outside [0, nspec).
     */
    public void validateFiberIndex(final int ispec)
            throws IndexOutOfBoundsException {
        if ((ispec < 0) || (ispec >= psf.getNspec())) {
            throw new IndexOutOfBoundsException("fiber index " + ispec + " is outside valid range [0, " +
                                                psf.getNspec() + ")");
        }
    }

    /**
     * @throws IndexOutOfBoundsException
     *   if [specMin, specMax) is empty or is not within [0, nspec).
     */
    public void validateFiberRange(final int specMin,
                                   final int specMax)
            throws IndexOutOfBoundsException {
        if ((specMin < 0) || (specMax > psf.getNspec()) || (specMin >= specMax)) {
            throw new IndexOutOfBoundsException("fiber range [" + specMin + ", " + specMax +
                                                ") is not within valid range [0, " + psf.getNspec() + ")");
        }
    }

    private static void addIfInside(final TreeSet<Double> samples,
                                    final double wavelength,
                                    final double minWavelength,
                                    final double maxWavelength) {
        if ((wavelength > minWavelength) && (wavelength < maxWavelength)) {
            samples.add(wavelength);
        }
    }

    /**
     * @return the part of the natural window inside [x0, x1) x [y0, y1) expressed relative to (x0, y0),
     *         or a collapsed window on the edge the natural window falls off.
     */
    private static PixelWindow clip(final PixelWindow window,
                                    final int x0,
                                    final int x1,
                                    final int y0,
                                    final int y1) {
        if (window.getYStart() >= y1) {
            return PixelWindow.collapsed(0, y1);
        } else if (window.getYStop() <= y0) {
            return PixelWindow.collapsed(0, y0);
        } else if (window.getXStart() >= x1) {
            return PixelWindow.collapsed(x1, 0);
        } else if (window.getXStop() <= x0) {
            return PixelWindow.collapsed(x0, 0);
        }
        return new PixelWindow(Math.max(window.getXStart(), x0) - x0,
                               Math.min(window.getXStop(), x1) - x0,
                               Math.max(window.getYStart(), y0) - y0,
                               Math.min(window.getYStop(), y1) - y0);
    }

    private static PixelStamp emptyStamp(final int x,
                                         final int y) {
        return PixelStamp.empty(PixelWindow.collapsed(x, y));
    }

}
