package org.janelia.psf;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;

import java.util.function.IntFunction;

import org.janelia.psf.project.ProjectionEngine;
import org.janelia.psf.project.SparseMatrix;
import org.janelia.psf.spec.PixelStamp;
import org.janelia.psf.spec.XYRange;
import org.janelia.psf.trace.CalibrationOffset;
import org.janelia.psf.trace.TraceSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for PSF variants whose centroids come from sampled traces.
 * Provides the coordinate solution (wavelength, x, y and their combinations), widths,
 * the global {@link CalibrationOffset}, stamp location and projection.
 * Subclasses only need to render natural stamps.
 *
 * <p>
 * Array variants of each accessor do the work, scalar variants unwrap single values.
 * Omitting the wavelength means the fiber's native wavelength grid and
 * omitting the fiber means every fiber.
 * </p>
 *
 * <p>
 * Instances are not thread safe: {@link #shiftXY} must not run while other threads read from the same instance.
 * Use {@link #copy()} to give each thread its own instance.
 * </p>
 *
 * @author Eric Trautman
 */
public abstract class AbstractTracePsf
        implements PsfModel {

    public static final long DEFAULT_WIDTH_CACHE_SIZE = 100_000;

    private final TraceSet traces;
    private final int npixX;
    private final int npixY;
    private final StampLocator stampLocator;
    private final ProjectionEngine projectionEngine;
    private final Cache<WidthKey, PsfWidths> widthCache;

    private CalibrationOffset offset;

    protected AbstractTracePsf(final TraceSet traces,
                               final int npixX,
                               final int npixY,
                               final CalibrationOffset offset) {
        this.traces = traces;
        this.npixX = npixX;
        this.npixY = npixY;
        this.offset = offset;
        this.stampLocator = new StampLocator(this);
        this.projectionEngine = new ProjectionEngine(this);
        this.widthCache = CacheBuilder.newBuilder()
                .maximumSize(DEFAULT_WIDTH_CACHE_SIZE)
                .recordStats()
                .build();
    }

    /**
     * @return an independent copy of this PSF that shares immutable calibration data,
     *         starts with this PSF's current offset and has its own width cache.
     */
    public abstract AbstractTracePsf copy();

    protected TraceSet getTraces() {
        return traces;
    }

    @Override
    public int getNspec() {
        return traces.getNspec();
    }

    /**
     * @return number of native wavelength samples per fiber.
     */
    public int getNwave() {
        return traces.getNwave();
    }

    @Override
    public int getNpixX() {
        return npixX;
    }

    @Override
    public int getNpixY() {
        return npixY;
    }

    @Override
    public double getWavelengthMin() {
        return traces.getWavelengthMin();
    }

    @Override
    public double getWavelengthMax() {
        return traces.getWavelengthMax();
    }

    @Override
    public double[] getNativeWavelengths(final int ispec)
            throws IndexOutOfBoundsException {
        return traces.getNativeWavelengths(ispec);
    }

    public CalibrationOffset getOffset() {
        return offset;
    }

    public CacheStats getWidthCacheStats() {
        return widthCache.stats();
    }

    /**
     * Adds the specified shift to all subsequently computed centroids (and stamps) for every fiber.
     * Shifts compose additively.
     */
    public void shiftXY(final double dx,
                        final double dy) {
        offset = offset.plus(dx, dy);
        LOG.debug("shiftXY: offset is now {}", offset);
    }

    // ---------------------------------------------------------------------------------------------
    // wavelength and log wavelength

    /**
     * @return native wavelength grids ordered [ispec][sample].
     */
    public double[][] wavelength() {
        final double[][] wavelengths = new double[getNspec()][];
        for (int ispec = 0; ispec < wavelengths.length; ispec++) {
            wavelengths[ispec] = wavelength(ispec);
        }
        return wavelengths;
    }

    /**
     * @return native wavelength grid for the specified fiber.
     */
    public double[] wavelength(final int ispec)
            throws IndexOutOfBoundsException {
        return traces.getNativeWavelengths(ispec);
    }

    /**
     * @return wavelength at the specified detector row.
     */
    public double wavelength(final int ispec,
                             final double y)
            throws IndexOutOfBoundsException {
        return wavelength(ispec, new double[] { y })[0];
    }

    /**
     * @return wavelengths at the specified detector rows.
     */
    public double[] wavelength(final int ispec,
                              final double[] y)
            throws IndexOutOfBoundsException {
        stampLocator.validateFiberIndex(ispec);
        final double dy = offset.getDy();
        final double[] wavelengths = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            wavelengths[i] = traces.wavelength(ispec, y[i] - dy);
        }
        return wavelengths;
    }

    public double[][] loglam() {
        return log10(wavelength());
    }

    public double[] loglam(final int ispec)
            throws IndexOutOfBoundsException {
        return log10(wavelength(ispec));
    }

    public double loglam(final int ispec,
                         final double y)
            throws IndexOutOfBoundsException {
        return Math.log10(wavelength(ispec, y));
    }

    public double[] loglam(final int ispec,
                           final double[] y)
            throws IndexOutOfBoundsException {
        return log10(wavelength(ispec, y));
    }

    /**
     * @return wavelength of every fiber at the specified detector row.
     */
    public double[] wavelengthForAllSpectra(final double y) {
        return firstColumn(wavelengthForAllSpectra(new double[] { y }));
    }

    /**
     * @return wavelengths of every fiber at the specified detector rows ordered [ispec][row].
     */
    public double[][] wavelengthForAllSpectra(final double[] y) {
        return forAllSpectra(ispec -> wavelength(ispec, y));
    }

    public double[] loglamForAllSpectra(final double y) {
        return log10(wavelengthForAllSpectra(y));
    }

    public double[][] loglamForAllSpectra(final double[] y) {
        return log10(wavelengthForAllSpectra(y));
    }

    // ---------------------------------------------------------------------------------------------
    // x and y centroids

    /**
     * @return x centroids for every fiber at its native wavelengths ordered [ispec][sample].
     */
    public double[][] x() {
        final double[][] values = new double[getNspec()][];
        for (int ispec = 0; ispec < values.length; ispec++) {
            values[ispec] = x(ispec);
        }
        return values;
    }

    public double[] x(final int ispec)
            throws IndexOutOfBoundsException {
        return x(ispec, wavelength(ispec));
    }

    public double x(final int ispec,
                    final double wavelength)
            throws IndexOutOfBoundsException {
        return x(ispec, new double[] { wavelength })[0];
    }

    public double[] x(final int ispec,
                      final double[] wavelengths)
            throws IndexOutOfBoundsException {
        stampLocator.validateFiberIndex(ispec);
        final double dx = offset.getDx();
        final double[] values = new double[wavelengths.length];
        for (int i = 0; i < wavelengths.length; i++) {
            values[i] = traces.x(ispec, wavelengths[i]) + dx;
        }
        return values;
    }

    /**
     * @return x centroid of every fiber at the specified wavelength.
     */
    public double[] xForAllSpectra(final double wavelength) {
        final double[] values = new double[getNspec()];
        for (int ispec = 0; ispec < values.length; ispec++) {
            values[ispec] = x(ispec, wavelength);
        }
        return values;
    }

    /**
     * @return x centroids of every fiber at the specified wavelengths ordered [ispec][wavelength].
     */
    public double[][] xForAllSpectra(final double[] wavelengths) {
        final double[][] values = new double[getNspec()][];
        for (int ispec = 0; ispec < values.length; ispec++) {
            values[ispec] = x(ispec, wavelengths);
        }
        return values;
    }

    public double[][] y() {
        final double[][] values = new double[getNspec()][];
        for (int ispec = 0; ispec < values.length; ispec++) {
            values[ispec] = y(ispec);
        }
        return values;
    }

    public double[] y(final int ispec)
            throws IndexOutOfBoundsException {
        return y(ispec, wavelength(ispec));
    }

    public double y(final int ispec,
                    final double wavelength)
            throws IndexOutOfBoundsException {
        return y(ispec, new double[] { wavelength })[0];
    }

    public double[] y(final int ispec,
                      final double[] wavelengths)
            throws IndexOutOfBoundsException {
        stampLocator.validateFiberIndex(ispec);
        final double dy = offset.getDy();
        final double[] values = new double[wavelengths.length];
        for (int i = 0; i < wavelengths.length; i++) {
            values[i] = traces.y(ispec, wavelengths[i]) + dy;
        }
        return values;
    }

    public double[] yForAllSpectra(final double wavelength) {
        final double[] values = new double[getNspec()];
        for (int ispec = 0; ispec < values.length; ispec++) {
            values[ispec] = y(ispec, wavelength);
        }
        return values;
    }

    public double[][] yForAllSpectra(final double[] wavelengths) {
        final double[][] values = new double[getNspec()][];
        for (int ispec = 0; ispec < values.length; ispec++) {
            values[ispec] = y(ispec, wavelengths);
        }
        return values;
    }

    /**
     * @return { x, y } centroid.
     */
    public double[] xy(final int ispec,
                       final double wavelength)
            throws IndexOutOfBoundsException {
        return new double[] { x(ispec, wavelength), y(ispec, wavelength) };
    }

    /**
     * @return { x[], y[] } centroids at the specified wavelengths.
     */
    public double[][] xy(final int ispec,
                         final double[] wavelengths)
            throws IndexOutOfBoundsException {
        return new double[][] { x(ispec, wavelengths), y(ispec, wavelengths) };
    }

    /**
     * @return { x[], y[] } centroids at the native wavelengths.
     */
    public double[][] xy(final int ispec)
            throws IndexOutOfBoundsException {
        return xy(ispec, wavelength(ispec));
    }

    /**
     * @return { x[], y[], wavelength[] } at the native wavelengths.
     */
    public double[][] xyw(final int ispec)
            throws IndexOutOfBoundsException {
        final double[] wavelengths = wavelength(ispec);
        return new double[][] { x(ispec, wavelengths), y(ispec, wavelengths), wavelengths };
    }

    /**
     * @return { x, y, wavelength } at the specified wavelength.
     */
    public double[] xyw(final int ispec,
                        final double wavelength)
            throws IndexOutOfBoundsException {
        return new double[] { x(ispec, wavelength), y(ispec, wavelength), wavelength };
    }

    /**
     * @return { x[], y[], wavelength[] } at the specified wavelengths.
     */
    public double[][] xyw(final int ispec,
                          final double[] wavelengths)
            throws IndexOutOfBoundsException {
        return new double[][] { x(ispec, wavelengths), y(ispec, wavelengths), wavelengths.clone() };
    }

    /**
     * @return { x[], y[] } centroids of every fiber at its native wavelengths ordered [ispec][x or y][sample].
     */
    public double[][][] xy() {
        final double[][][] values = new double[getNspec()][][];
        for (int ispec = 0; ispec < values.length; ispec++) {
            values[ispec] = xy(ispec);
        }
        return values;
    }

    /**
     * @return { x, y } centroid of every fiber at the specified wavelength ordered [ispec][x or y].
     */
    public double[][] xyForAllSpectra(final double wavelength) {
        return forAllSpectra(ispec -> xy(ispec, wavelength));
    }

    /**
     * @return { x[], y[] } centroids of every fiber ordered [ispec][x or y][wavelength].
     */
    public double[][][] xyForAllSpectra(final double[] wavelengths) {
        final double[][][] values = new double[getNspec()][][];
        for (int ispec = 0; ispec < values.length; ispec++) {
            values[ispec] = xy(ispec, wavelengths);
        }
        return values;
    }

    /**
     * @return { x[], y[], wavelength[] } of every fiber at its native wavelengths ordered [ispec][x, y or w][sample].
     */
    public double[][][] xyw() {
        final double[][][] values = new double[getNspec()][][];
        for (int ispec = 0; ispec < values.length; ispec++) {
            values[ispec] = xyw(ispec);
        }
        return values;
    }

    @Override
    public double[] centroidFor(final int ispec,
                                final double wavelength)
            throws IndexOutOfBoundsException {
        return xy(ispec, wavelength);
    }

    /**
     * @return trace angle (radians) at the specified wavelength, zero when the trace runs along the y axis.
     */
    public double angle(final int ispec,
                        final double wavelength)
            throws IndexOutOfBoundsException {
        stampLocator.validateFiberIndex(ispec);
        return Math.atan2(traces.dxdw(ispec, wavelength), traces.dydw(ispec, wavelength));
    }

    // ---------------------------------------------------------------------------------------------
    // widths

    public double xsigma(final int ispec,
                         final double wavelength)
            throws IndexOutOfBoundsException, IllegalStateException {
        return widthsFor(ispec, wavelength).getXSigma();
    }

    public double[] xsigma(final int ispec,
                           final double[] wavelengths)
            throws IndexOutOfBoundsException, IllegalStateException {
        final double[] values = new double[wavelengths.length];
        for (int i = 0; i < wavelengths.length; i++) {
            values[i] = xsigma(ispec, wavelengths[i]);
        }
        return values;
    }

    public double wdisp(final int ispec,
                        final double wavelength)
            throws IndexOutOfBoundsException, IllegalStateException {
        return widthsFor(ispec, wavelength).getWavelengthDispersion();
    }

    public double[] wdisp(final int ispec,
                          final double[] wavelengths)
            throws IndexOutOfBoundsException, IllegalStateException {
        final double[] values = new double[wavelengths.length];
        for (int i = 0; i < wavelengths.length; i++) {
            values[i] = wdisp(ispec, wavelengths[i]);
        }
        return values;
    }

    /**
     * @return x sigma at the fiber's native wavelengths.
     */
    public double[] xsigma(final int ispec)
            throws IndexOutOfBoundsException, IllegalStateException {
        return xsigma(ispec, wavelength(ispec));
    }

    /**
     * @return x sigma of every fiber at its native wavelengths ordered [ispec][sample].
     */
    public double[][] xsigma()
            throws IllegalStateException {
        return forAllSpectra(this::xsigma);
    }

    public double[] xsigmaForAllSpectra(final double wavelength)
            throws IllegalStateException {
        return firstColumn(xsigmaForAllSpectra(new double[] { wavelength }));
    }

    /**
     * @return x sigma of every fiber at the specified wavelengths ordered [ispec][wavelength].
     */
    public double[][] xsigmaForAllSpectra(final double[] wavelengths)
            throws IllegalStateException {
        return forAllSpectra(ispec -> xsigma(ispec, wavelengths));
    }

    public double[] wdisp(final int ispec)
            throws IndexOutOfBoundsException, IllegalStateException {
        return wdisp(ispec, wavelength(ispec));
    }

    public double[][] wdisp()
            throws IllegalStateException {
        return forAllSpectra(this::wdisp);
    }

    public double[] wdispForAllSpectra(final double wavelength)
            throws IllegalStateException {
        return firstColumn(wdispForAllSpectra(new double[] { wavelength }));
    }

    public double[][] wdispForAllSpectra(final double[] wavelengths)
            throws IllegalStateException {
        return forAllSpectra(ispec -> wdisp(ispec, wavelengths));
    }

    /**
     * Derives widths from the second moments of the natural stamp.
     * The x sigma is in pixels while the dispersion is the wavelength span of one
     * y sigma on each side of the stamp's y centroid (halved).
     * Results are cached for the current offset.
     */
    @Override
    public PsfWidths widthsFor(final int ispec,
                               final double wavelength)
            throws IndexOutOfBoundsException, IllegalStateException {

        stampLocator.validateFiberIndex(ispec);

        final WidthKey key = new WidthKey(offset.getVersion(), ispec, wavelength);
        PsfWidths widths = widthCache.getIfPresent(key);

        if (widths == null) {
            widths = deriveWidths(ispec, wavelength);
            widthCache.put(key, widths);
        }

        return widths;
    }

    private PsfWidths deriveWidths(final int ispec,
                                   final double wavelength)
            throws IllegalStateException {

        final PixelStamp stamp = stampFor(ispec, wavelength);
        final double[][] values = stamp.getValues();
        final int rows = stamp.getRows();
        final int columns = stamp.getColumns();

        final double[] rowSums = new double[rows];
        final double[] columnSums = new double[columns];
        for (int row = 0; row < rows; row++) {
            for (int column = 0; column < columns; column++) {
                rowSums[row] += values[row][column];
                columnSums[column] += values[row][column];
            }
        }

        final double[] columnMoments = moments(columnSums);
        final double[] rowMoments = moments(rowSums);
        if ((columnMoments == null) || (rowMoments == null)) {
            throw new IllegalStateException("cannot derive widths for fiber " + ispec + " at wavelength " +
                                            wavelength + " from degenerate stamp " + stamp);
        }

        final double xSigma = Math.sqrt(columnMoments[1]);
        final double ySigma = Math.sqrt(rowMoments[1]);
        final double yCenter = stamp.getWindow().getYStart() + rowMoments[0];
        final double wavelengthDispersion = Math.abs(wavelength(ispec, yCenter + ySigma) -
                                                     wavelength(ispec, yCenter - ySigma)) / 2.0;

        return new PsfWidths(xSigma, wavelengthDispersion);
    }

    /**
     * @return { mean, variance } of the index weighted by the specified sums,
     *         or null if the sums are not positive or have no spread.
     */
    private static double[] moments(final double[] sums) {
        double total = 0.0;
        double weightedTotal = 0.0;
        for (int i = 0; i < sums.length; i++) {
            total += sums[i];
            weightedTotal += i * sums[i];
        }
        if (! (total > 0)) {
            return null;
        }
        final double mean = weightedTotal / total;
        double variance = 0.0;
        for (int i = 0; i < sums.length; i++) {
            variance += sums[i] * (i - mean) * (i - mean);
        }
        variance = variance / total;
        return variance > 0 ? new double[] { mean, variance } : null;
    }

    // ---------------------------------------------------------------------------------------------
    // stamps, bounding boxes and projection

    /**
     * @return stamp clipped to the detector.
     *
     * @see StampLocator#xypix(int, double, Integer, Integer, Integer, Integer)
     */
    public PixelStamp xypix(final int ispec,
                            final double wavelength)
            throws IndexOutOfBoundsException {
        return stampLocator.xypix(ispec, wavelength);
    }

    /**
     * @see StampLocator#xypix(int, double, Integer, Integer, Integer, Integer)
     */
    public PixelStamp xypix(final int ispec,
                            final double wavelength,
                            final Integer xMin,
                            final Integer xMax,
                            final Integer yMin,
                            final Integer yMax)
            throws IndexOutOfBoundsException {
        return stampLocator.xypix(ispec, wavelength, xMin, xMax, yMin, yMax);
    }

    /**
     * @return values of the stamp clipped to the detector.
     */
    public double[][] pix(final int ispec,
                          final double wavelength)
            throws IndexOutOfBoundsException {
        return xypix(ispec, wavelength).getValues();
    }

    /**
     * @see StampLocator#xyrange(int, double[])
     */
    public XYRange xyrange(final int ispec,
                           final double[] wavelengths)
            throws IndexOutOfBoundsException, IllegalArgumentException {
        return stampLocator.xyrange(ispec, wavelengths);
    }

    /**
     * @return bounding box for fibers specFirst through specLast (inclusive).
     *
     * @see StampLocator#xyrange(int, int, double[])
     */
    public XYRange xyrange(final int specFirst,
                           final int specLast,
                           final double[] wavelengths)
            throws IndexOutOfBoundsException, IllegalArgumentException {
        return stampLocator.xyrange(specFirst, specLast, wavelengths);
    }

    /**
     * @return full detector image of a single spectrum.
     */
    public double[][] project(final double[] photons,
                              final double[] wavelengths,
                              final int ispec)
            throws IndexOutOfBoundsException, IllegalArgumentException {
        return projectionEngine.project(photons, wavelengths, ispec);
    }

    /**
     * @see ProjectionEngine#project(double[], double[], int, XYRange)
     */
    public double[][] project(final double[] photons,
                              final double[] wavelengths,
                              final int ispec,
                              final XYRange range)
            throws IndexOutOfBoundsException, IllegalArgumentException {
        return projectionEngine.project(photons, wavelengths, ispec, range);
    }

    /**
     * @see ProjectionEngine#project(double[][], double[], int, XYRange)
     */
    public double[][] project(final double[][] photons,
                              final double[] wavelengths,
                              final int specMin,
                              final XYRange range)
            throws IndexOutOfBoundsException, IllegalArgumentException {
        return projectionEngine.project(photons, wavelengths, specMin, range);
    }

    /**
     * @see ProjectionEngine#project(double[][], double[][], int, XYRange)
     */
    public double[][] project(final double[][] photons,
                              final double[][] wavelengths,
                              final int specMin,
                              final XYRange range)
            throws IndexOutOfBoundsException, IllegalArgumentException {
        return projectionEngine.project(photons, wavelengths, specMin, range);
    }

    /**
     * @see ProjectionEngine#projectionMatrix(int, int, double[], XYRange)
     */
    public SparseMatrix projectionMatrix(final int specMin,
                                         final int specMax,
                                         final double[] wavelengths,
                                         final XYRange range)
            throws IndexOutOfBoundsException {
        return projectionEngine.projectionMatrix(specMin, specMax, wavelengths, range);
    }

    private double[][] forAllSpectra(final IntFunction<double[]> valuesForFiber) {
        final double[][] values = new double[getNspec()][];
        for (int ispec = 0; ispec < values.length; ispec++) {
            values[ispec] = valuesForFiber.apply(ispec);
        }
        return values;
    }

    private static double[] firstColumn(final double[][] values) {
        final double[] column = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            column[i] = values[i][0];
        }
        return column;
    }

    private static double[] log10(final double[] values) {
        final double[] logValues = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            logValues[i] = Math.log10(values[i]);
        }
        return logValues;
    }

    private static double[][] log10(final double[][] values) {
        final double[][] logValues = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            logValues[i] = log10(values[i]);
        }
        return logValues;
    }

    private static class WidthKey {

        private final long offsetVersion;
        private final int ispec;
        private final double wavelength;

        WidthKey(final long offsetVersion,
                 final int ispec,
                 final double wavelength) {
            this.offsetVersion = offsetVersion;
            this.ispec = ispec;
            this.wavelength = wavelength;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) {
                return true;
            }
            if (! (o instanceof WidthKey)) {
                return false;
            }
            final WidthKey that = (WidthKey) o;
            return (offsetVersion == that.offsetVersion) &&
                   (ispec == that.ispec) &&
                   (Double.compare(wavelength, that.wavelength) == 0);
        }

        @Override
        public int hashCode() {
            int result = Long.hashCode(offsetVersion);
            result = 31 * result + ispec;
            result = 31 * result + Double.hashCode(wavelength);
            return result;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(AbstractTracePsf.class);
}
