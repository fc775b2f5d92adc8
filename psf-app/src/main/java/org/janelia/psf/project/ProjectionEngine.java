package org.janelia.psf.project;

import org.janelia.psf.PsfModel;
import org.janelia.psf.StampLocator;
import org.janelia.psf.spec.PixelStamp;
import org.janelia.psf.spec.PixelWindow;
import org.janelia.psf.spec.XYRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders spectra onto (a window of) the detector and builds the equivalent sparse projection operator.
 *
 * Both paths fetch stamps from the same {@link StampLocator} and visit samples in
 * (fiber, wavelength) order, so multiplying a projection matrix by a flattened photon array
 * reproduces the rendered image exactly.
 *
 * @author Eric Trautman
 */
public class ProjectionEngine {

    private final PsfModel psf;
    private final StampLocator stampLocator;

    public ProjectionEngine(final PsfModel psf) {
        this.psf = psf;
        this.stampLocator = new StampLocator(psf);
    }

    /**
     * Renders a single spectrum onto the full detector.
     */
    public double[][] project(final double[] photons,
                              final double[] wavelengths,
                              final int ispec)
            throws IndexOutOfBoundsException, IllegalArgumentException {
        return project(photons, wavelengths, ispec, null);
    }

    /**
     * Renders a single spectrum.
     *
     * @param  range  detector window to render or null for the full detector.
     */
    public double[][] project(final double[] photons,
                              final double[] wavelengths,
                              final int ispec,
                              final XYRange range)
            throws IndexOutOfBoundsException, IllegalArgumentException {
        return project(new double[][] { photons }, new double[][] { wavelengths }, ispec, range);
    }

    /**
     * Renders spectra [specMin, specMin + photons.length) that share one wavelength grid.
     *
     * @param  range  detector window to render or null for the full detector.
     */
    public double[][] project(final double[][] photons,
                              final double[] wavelengths,
                              final int specMin,
                              final XYRange range)
            throws IndexOutOfBoundsException, IllegalArgumentException {
        final double[][] sharedWavelengths = new double[photons.length][];
        for (int i = 0; i < photons.length; i++) {
            sharedWavelengths[i] = wavelengths;
        }
        return project(photons, sharedWavelengths, specMin, range);
    }

    /**
     * Renders spectra [specMin, specMin + photons.length) by accumulating each
     * stamp scaled by its photon count.  Samples with zero photons are skipped.
     *
     * @param  photons      photon counts ordered [spectrum][sample].
     * @param  wavelengths  wavelengths ordered [spectrum][sample].
     * @param  specMin      fiber index of the first spectrum.
     * @param  range        detector window to render or null for the full detector.
     *
     * @return image ordered [row][column] with the size of the window (or detector).
     *
     * @throws IndexOutOfBoundsException
     *   if the spectra do not map to valid fibers.
     *
     * @throws IllegalArgumentException
     *   if the photon and wavelength shapes differ.
     */
    public double[][] project(final double[][] photons,
                              final double[][] wavelengths,
                              final int specMin,
                              final XYRange range)
            throws IndexOutOfBoundsException, IllegalArgumentException {

        stampLocator.validateFiberRange(specMin, specMin + Math.max(1, photons.length));
        validateShapes(photons, wavelengths);

        final XYRange window = range == null ? XYRange.forDetector(psf.getNpixX(), psf.getNpixY()) : range;

        LOG.debug("project: entry, specMin={}, numberOfSpectra={}, window={}", specMin, photons.length, window);

        final double[][] image = new double[window.getHeight()][window.getWidth()];

        for (int i = 0; i < photons.length; i++) {
            final int ispec = specMin + i;
            for (int iw = 0; iw < photons[i].length; iw++) {
                final double photonCount = photons[i][iw];
                if (photonCount == 0.0) {
                    continue;
                }
                final PixelStamp stamp = locate(ispec, wavelengths[i][iw], window);
                if (stamp.isEmpty()) {
                    continue;
                }
                final PixelWindow stampWindow = stamp.getWindow();
                final double[][] values = stamp.getValues();
                for (int row = 0; row < values.length; row++) {
                    final double[] imageRow = image[stampWindow.getYStart() + row];
                    final int xStart = stampWindow.getXStart();
                    for (int column = 0; column < values[row].length; column++) {
                        imageRow[xStart + column] += values[row][column] * photonCount;
                    }
                }
            }
        }

        return image;
    }

    /**
     * Builds the sparse operator that maps flattened photons for fibers [specMin, specMax) sampled at
     * the specified wavelengths (index (ispec - specMin) * wavelengths.length + iw) to
     * flattened window pixels (index row * window width + column).
     *
     * @param  range  detector window or null for the full detector.
     *
     * @throws IndexOutOfBoundsException
     *   if the fiber range is invalid.
     */
    public SparseMatrix projectionMatrix(final int specMin,
                                         final int specMax,
                                         final double[] wavelengths,
                                         final XYRange range)
            throws IndexOutOfBoundsException {

        stampLocator.validateFiberRange(specMin, specMax);

        final XYRange window = range == null ? XYRange.forDetector(psf.getNpixX(), psf.getNpixY()) : range;
        final int windowWidth = window.getWidth();
        final int numberOfRows = windowWidth * window.getHeight();
        final int numberOfColumns = (specMax - specMin) * wavelengths.length;

        LOG.debug("projectionMatrix: entry, specMin={}, specMax={}, numberOfWavelengths={}, window={}",
                  specMin, specMax, wavelengths.length, window);

        final SparseMatrix.Builder builder = new SparseMatrix.Builder(numberOfRows, numberOfColumns);

        for (int ispec = specMin; ispec < specMax; ispec++) {
            for (final double wavelength : wavelengths) {
                final PixelStamp stamp = locate(ispec, wavelength, window);
                if (! stamp.isEmpty()) {
                    final PixelWindow stampWindow = stamp.getWindow();
                    final double[][] values = stamp.getValues();
                    for (int row = 0; row < values.length; row++) {
                        final int rowStart = ((stampWindow.getYStart() + row) * windowWidth) +
                                             stampWindow.getXStart();
                        for (int column = 0; column < values[row].length; column++) {
                            builder.add(rowStart + column, values[row][column]);
                        }
                    }
                }
                builder.nextColumn();
            }
        }

        final SparseMatrix matrix = builder.build();

        LOG.debug("projectionMatrix: exit, built {}", matrix);

        return matrix;
    }

    private PixelStamp locate(final int ispec,
                              final double wavelength,
                              final XYRange window) {
        return stampLocator.xypix(ispec,
                                  wavelength,
                                  window.getXMin(),
                                  window.getXMax(),
                                  window.getYMin(),
                                  window.getYMax());
    }

    private static void validateShapes(final double[][] photons,
                                       final double[][] wavelengths)
            throws IllegalArgumentException {
        if (photons.length != wavelengths.length) {
            throw new IllegalArgumentException("photons have " + photons.length + " spectra but wavelengths have " +
                                               wavelengths.length);
        }
        for (int i = 0; i < photons.length; i++) {
            if (photons[i].length != wavelengths[i].length) {
                throw new IllegalArgumentException("spectrum " + i + " has " + photons[i].length +
                                                   " photon samples but " + wavelengths[i].length +
                                                   " wavelengths");
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(ProjectionEngine.class);
}
