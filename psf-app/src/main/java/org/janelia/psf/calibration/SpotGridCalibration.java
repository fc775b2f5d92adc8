package org.janelia.psf.calibration;

import java.io.Serializable;

/**
 * In-memory spot library and trace grids for a spot grid PSF.
 *
 * The spot library holds one high resolution PSF image for each sampled (slit position, wavelength) pair
 * and is stored in a flat array ordered [slitPosition][wavelength][row][column].
 * The trace grids hold the sampled x, y, and wavelength values for each fiber and are ordered [fiber][sample].
 *
 * Instances are immutable once constructed.
 * Accessors for array data return copies unless noted otherwise.
 *
 * @author Eric Trautman
 */
public class SpotGridCalibration implements Serializable {

    /** Maximum relative distance of the detector to spot pixel size ratio from an integer. */
    public static final double REBIN_TOLERANCE = 1.0e-6;

    private final double[] spots;
    private final int spotColumns;
    private final int spotRows;
    private final double[] spotPositions;
    private final double[] spotWavelengths;
    private final double[] fiberPositions;
    private final double ccdPixelSize;
    private final double spotPixelSize;
    private final int rebinFactor;
    private final int npixX;
    private final int npixY;
    private final double[][] traceX;
    private final double[][] traceY;
    private final double[][] traceWavelength;

    /**
     * @param  spots            flattened spot images ordered [slitPosition][wavelength][row][column].
     * @param  spotColumns      number of columns in each spot image.
     * @param  spotRows         number of rows in each spot image.
     * @param  spotPositions    ascending slit positions sampled by the spot library.
     * @param  spotWavelengths  ascending wavelengths sampled by the spot library.
     * @param  fiberPositions   slit position of each fiber.
     * @param  ccdPixelSize     detector pixel pitch.
     * @param  spotPixelSize    spot image pixel pitch (same units as ccdPixelSize).
     * @param  npixX            detector width in pixels.
     * @param  npixY            detector height in pixels.
     * @param  traceX           sampled x centroids [fiber][sample].
     * @param  traceY           sampled y centroids [fiber][sample].
     * @param  traceWavelength  wavelengths of the trace samples [fiber][sample].
     *
     * @throws IllegalArgumentException
     *   if any of the data shapes are inconsistent or the pixel sizes do not have an integral ratio.
     */
    public SpotGridCalibration(final double[] spots,
                               final int spotColumns,
                               final int spotRows,
                               final double[] spotPositions,
                               final double[] spotWavelengths,
                               final double[] fiberPositions,
                               final double ccdPixelSize,
                               final double spotPixelSize,
                               final int npixX,
                               final int npixY,
                               final double[][] traceX,
                               final double[][] traceY,
                               final double[][] traceWavelength)
            throws IllegalArgumentException {

        if ((spotColumns < 1) || (spotRows < 1)) {
            throw new IllegalArgumentException("spot images must have at least one row and column");
        }

        final long expectedSpotValueCount =
                (long) spotPositions.length * spotWavelengths.length * spotRows * spotColumns;
        if (spots.length != expectedSpotValueCount) {
            throw new IllegalArgumentException(
                    "spot library has " + spots.length + " values but " + spotPositions.length + " positions x " +
                    spotWavelengths.length + " wavelengths x " + spotRows + " rows x " + spotColumns +
                    " columns requires " + expectedSpotValueCount);
        }

        validateAscending("spot positions", spotPositions);
        validateAscending("spot wavelengths", spotWavelengths);

        if ((npixX < 1) || (npixY < 1)) {
            throw new IllegalArgumentException("invalid detector size " + npixX + "x" + npixY);
        }

        final int nspec = fiberPositions.length;
        if (nspec == 0) {
            throw new IllegalArgumentException("no fiber positions specified");
        }
        validateTraceShape("wavelength", traceWavelength, nspec, traceWavelength);
        validateTraceShape("x", traceX, nspec, traceWavelength);
        validateTraceShape("y", traceY, nspec, traceWavelength);

        this.spots = spots;
        this.spotColumns = spotColumns;
        this.spotRows = spotRows;
        this.spotPositions = spotPositions.clone();
        this.spotWavelengths = spotWavelengths.clone();
        this.fiberPositions = fiberPositions.clone();
        this.ccdPixelSize = ccdPixelSize;
        this.spotPixelSize = spotPixelSize;
        this.rebinFactor = deriveRebinFactor(ccdPixelSize, spotPixelSize);
        this.npixX = npixX;
        this.npixY = npixY;
        this.traceX = copy(traceX);
        this.traceY = copy(traceY);
        this.traceWavelength = copy(traceWavelength);
    }

    /**
     * @return the integral number of spot pixels per detector pixel.
     *
     * @throws IllegalArgumentException
     *   if either size is not positive or if the ratio of the sizes is not (within tolerance) an integer >= 1.
     */
    public static int deriveRebinFactor(final double ccdPixelSize,
                                        final double spotPixelSize)
            throws IllegalArgumentException {

        if (! (ccdPixelSize > 0) || ! (spotPixelSize > 0)) {
            throw new IllegalArgumentException("pixel sizes must be positive, ccdPixelSize=" + ccdPixelSize +
                                               ", spotPixelSize=" + spotPixelSize);
        }

        final double ratio = ccdPixelSize / spotPixelSize;
        final long rebin = Math.round(ratio);
        if ((rebin < 1) || (Math.abs(ratio - rebin) > REBIN_TOLERANCE * ratio)) {
            throw new IllegalArgumentException(
                    "ccdPixelSize / spotPixelSize ratio " + ratio + " is not an integer >= 1, " +
                    "spot images cannot be rebinned to detector resolution");
        }

        return (int) rebin;
    }

    public int getNspec() {
        return fiberPositions.length;
    }

    public int getNumberOfSpotPositions() {
        return spotPositions.length;
    }

    public int getNumberOfSpotWavelengths() {
        return spotWavelengths.length;
    }

    public int getSpotColumns() {
        return spotColumns;
    }

    public int getSpotRows() {
        return spotRows;
    }

    /**
     * @return the flattened spot library (not a copy, do not modify).
     */
    public double[] getSpots() {
        return spots;
    }

    /**
     * @return offset of the first value for the specified spot image within the flattened spot library.
     */
    public int getSpotOffset(final int positionIndex,
                             final int wavelengthIndex) {
        return ((positionIndex * spotWavelengths.length) + wavelengthIndex) * spotRows * spotColumns;
    }

    /**
     * @return copy of the spot image at the specified grid indexes, ordered [row][column].
     */
    public double[][] getSpot(final int positionIndex,
                              final int wavelengthIndex) {
        final double[][] spot = new double[spotRows][spotColumns];
        int offset = getSpotOffset(positionIndex, wavelengthIndex);
        for (int row = 0; row < spotRows; row++) {
            System.arraycopy(spots, offset, spot[row], 0, spotColumns);
            offset += spotColumns;
        }
        return spot;
    }

    public double[] getSpotPositions() {
        return spotPositions.clone();
    }

    public double[] getSpotWavelengths() {
        return spotWavelengths.clone();
    }

    public double[] getFiberPositions() {
        return fiberPositions.clone();
    }

    public double getFiberPosition(final int ispec) {
        return fiberPositions[ispec];
    }

    public double getCcdPixelSize() {
        return ccdPixelSize;
    }

    public double getSpotPixelSize() {
        return spotPixelSize;
    }

    public int getRebinFactor() {
        return rebinFactor;
    }

    public int getNpixX() {
        return npixX;
    }

    public int getNpixY() {
        return npixY;
    }

    public double[][] getTraceX() {
        return copy(traceX);
    }

    public double[][] getTraceY() {
        return copy(traceY);
    }

    public double[][] getTraceWavelength() {
        return copy(traceWavelength);
    }

    @Override
    public String toString() {
        return "SpotGridCalibration{nspec=" + getNspec() +
               ", spotGrid=" + spotPositions.length + "x" + spotWavelengths.length +
               ", spotSize=" + spotColumns + "x" + spotRows +
               ", rebinFactor=" + rebinFactor +
               ", detector=" + npixX + "x" + npixY +
               '}';
    }

    private static void validateAscending(final String context,
                                          final double[] values)
            throws IllegalArgumentException {
        if (values.length < 2) {
            throw new IllegalArgumentException(context + " must contain at least two values");
        }
        for (int i = 1; i < values.length; i++) {
            if (! (values[i] > values[i - 1])) {
                throw new IllegalArgumentException(context + " must be strictly ascending but value " + i +
                                                   " (" + values[i] + ") follows " + values[i - 1]);
            }
        }
    }

    private static void validateTraceShape(final String context,
                                           final double[][] trace,
                                           final int nspec,
                                           final double[][] traceWavelength)
            throws IllegalArgumentException {

        if (trace.length != nspec) {
            throw new IllegalArgumentException(context + " trace has " + trace.length +
                                               " fibers but there are " + nspec + " fiber positions");
        }

        final int nwave = traceWavelength[0].length;
        for (int ispec = 0; ispec < nspec; ispec++) {
            if (trace[ispec].length != nwave) {
                throw new IllegalArgumentException(context + " trace for fiber " + ispec + " has " +
                                                   trace[ispec].length + " samples instead of " + nwave);
            }
        }
    }

    private static double[][] copy(final double[][] values) {
        final double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }

}
