package org.janelia.psf.calibration;

/**
 * Builds small but physically plausible calibrations with gaussian spots and gently curved
 * traces.  Useful for exercising tools and tests without a real spectrograph calibration.
 *
 * Fibers are spaced {@link #FIBER_SPACING} pixels apart across the detector, every fiber covers
 * wavelengths [{@link #WAVELENGTH_MIN}, {@link #WAVELENGTH_MAX}] and the dispersion direction
 * spans the detector rows leaving a {@link #Y_MARGIN} pixel margin at each end.
 *
 * @author Eric Trautman
 */
public class SyntheticCalibration {

    public static final double CCD_PIXEL_SIZE = 0.015;
    public static final double SPOT_PIXEL_SIZE = 0.005;

    public static final double WAVELENGTH_MIN = 5000.0;
    public static final double WAVELENGTH_MAX = 6000.0;

    public static final int FIBER_SPACING = 7;
    public static final int X_MARGIN = 12;
    public static final int Y_MARGIN = 10;

    public static final int SPOT_SIZE = 30;

    private static final double[] SPOT_POSITIONS = { -1.1, -0.55, 0.0, 0.55, 1.1 };
    private static final double[] SPOT_WAVELENGTHS = { 4950.0, 5170.0, 5390.0, 5610.0, 5830.0, 6050.0 };

    private SyntheticCalibration() {
    }

    /**
     * @param  nspec  number of fibers.
     * @param  nwave  number of trace samples per fiber.
     * @param  npixY  number of detector rows.
     *
     * @return calibration for a detector wide enough to hold all fibers.
     */
    public static SpotGridCalibration build(final int nspec,
                                            final int nwave,
                                            final int npixY) {

        if ((nspec < 1) || (nwave < 3) || (npixY <= 2 * Y_MARGIN)) {
            throw new IllegalArgumentException("invalid synthetic calibration nspec=" + nspec + ", nwave=" +
                                               nwave + ", npixY=" + npixY);
        }

        final int npixX = (2 * X_MARGIN) + (FIBER_SPACING * (nspec - 1)) + 1;

        final double[] fiberPositions = new double[nspec];
        final double[][] traceX = new double[nspec][nwave];
        final double[][] traceY = new double[nspec][nwave];
        final double[][] traceWavelength = new double[nspec][nwave];

        final double yExtent = npixY - (2.0 * Y_MARGIN) - 1.0;
        for (int ispec = 0; ispec < nspec; ispec++) {
            fiberPositions[ispec] = nspec == 1 ? 0.0 : -1.0 + (2.0 * ispec / (nspec - 1));
            for (int j = 0; j < nwave; j++) {
                final double t = (double) j / (nwave - 1);
                final double bow = (t - 0.5) * (t - 0.5);
                traceWavelength[ispec][j] = WAVELENGTH_MIN + (t * (WAVELENGTH_MAX - WAVELENGTH_MIN));
                traceX[ispec][j] = X_MARGIN + (FIBER_SPACING * ispec) + 0.37 + (1.5 * bow * fiberPositions[ispec]);
                traceY[ispec][j] = Y_MARGIN + 0.21 + (t * yExtent) + (0.25 * bow);
            }
        }

        final int spotValueCount = SPOT_SIZE * SPOT_SIZE;
        final double[] spots = new double[SPOT_POSITIONS.length * SPOT_WAVELENGTHS.length * spotValueCount];
        int offset = 0;
        for (final double position : SPOT_POSITIONS) {
            for (final double wavelength : SPOT_WAVELENGTHS) {
                final double sigmaX = 2.5 + (0.5 * Math.abs(position));
                final double sigmaY = 2.0 + ((wavelength - SPOT_WAVELENGTHS[0]) / 1100.0);
                addGaussianSpot(spots, offset, sigmaX, sigmaY);
                offset += spotValueCount;
            }
        }

        return new SpotGridCalibration(spots,
                                       SPOT_SIZE,
                                       SPOT_SIZE,
                                       SPOT_POSITIONS,
                                       SPOT_WAVELENGTHS,
                                       fiberPositions,
                                       CCD_PIXEL_SIZE,
                                       SPOT_PIXEL_SIZE,
                                       npixX,
                                       npixY,
                                       traceX,
                                       traceY,
                                       traceWavelength);
    }

    private static void addGaussianSpot(final double[] spots,
                                        final int offset,
                                        final double sigmaX,
                                        final double sigmaY) {
        final double center = (SPOT_SIZE - 1) / 2.0;
        int i = offset;
        for (int row = 0; row < SPOT_SIZE; row++) {
            final double dy = (row - center) / sigmaY;
            for (int column = 0; column < SPOT_SIZE; column++) {
                final double dx = (column - center) / sigmaX;
                spots[i] = Math.exp(-0.5 * ((dx * dx) + (dy * dy)));
                i++;
            }
        }
    }

}
