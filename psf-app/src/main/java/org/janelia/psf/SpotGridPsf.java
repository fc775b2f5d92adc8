package org.janelia.psf;

import net.imglib2.RealRandomAccess;
import net.imglib2.RealRandomAccessible;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

import org.janelia.psf.calibration.SpotGridCalibration;
import org.janelia.psf.calibration.SpotGridCalibrationLoader;
import org.janelia.psf.interpolation.LinearGridInterpolator;
import org.janelia.psf.resample.SpotResampler;
import org.janelia.psf.spec.PixelStamp;
import org.janelia.psf.spec.PixelWindow;
import org.janelia.psf.trace.CalibrationOffset;
import org.janelia.psf.trace.TraceSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PSF that renders stamps from a grid of high resolution spot images sampled at
 * (slit position, wavelength) points.  The spot for a fiber is interpolated at the fiber's
 * slit position and the requested wavelength and then resampled onto the detector at the
 * fiber's trace centroid.
 *
 * @author Eric Trautman
 */
public class SpotGridPsf
        extends AbstractTracePsf {

    /**
     * @return PSF built from the calibration container at the specified path.
     *
     * @throws IllegalArgumentException
     *   if the calibration cannot be loaded.
     */
    public static SpotGridPsf load(final String calibrationPath)
            throws IllegalArgumentException {
        return new SpotGridPsf(SpotGridCalibrationLoader.INSTANCE.load(calibrationPath));
    }

    private final SpotGridCalibration calibration;
    private final LinearGridInterpolator spotInterpolator;

    /**
     * @throws IllegalArgumentException
     *   if the calibration traces cannot be interpolated.
     */
    public SpotGridPsf(final SpotGridCalibration calibration)
            throws IllegalArgumentException {
        this(calibration,
             new TraceSet(calibration.getTraceX(), calibration.getTraceY(), calibration.getTraceWavelength()),
             buildSpotInterpolator(calibration),
             CalibrationOffset.NONE);
        LOG.info("SpotGridPsf: built for {}", calibration);
    }

    private SpotGridPsf(final SpotGridCalibration calibration,
                        final TraceSet traces,
                        final LinearGridInterpolator spotInterpolator,
                        final CalibrationOffset offset) {
        super(traces, calibration.getNpixX(), calibration.getNpixY(), offset);
        this.calibration = calibration;
        this.spotInterpolator = spotInterpolator;
    }

    @Override
    public SpotGridPsf copy() {
        return new SpotGridPsf(calibration, getTraces(), spotInterpolator, getOffset());
    }

    public SpotGridCalibration getCalibration() {
        return calibration;
    }

    /**
     * @return high resolution spot for the specified fiber and wavelength in row major order.
     */
    public double[] interpolateSpot(final int ispec,
                                    final double wavelength)
            throws IndexOutOfBoundsException {
        getTraces().validateFiberIndex(ispec);
        return spotInterpolator.interpolate(calibration.getFiberPosition(ispec), wavelength);
    }

    @Override
    public PixelStamp stampFor(final int ispec,
                               final double wavelength)
            throws IndexOutOfBoundsException {
        final double[] spot = interpolateSpot(ispec, wavelength);
        final double[] center = centroidFor(ispec, wavelength);
        return SpotResampler.resample(spot,
                                      0,
                                      calibration.getSpotColumns(),
                                      calibration.getSpotRows(),
                                      center[0],
                                      center[1],
                                      calibration.getRebinFactor());
    }

    @Override
    public PixelWindow windowFor(final int ispec,
                                 final double wavelength)
            throws IndexOutOfBoundsException {
        final double[] center = centroidFor(ispec, wavelength);
        return SpotResampler.locateWindow(calibration.getSpotColumns(),
                                          calibration.getSpotRows(),
                                          center[0],
                                          center[1],
                                          calibration.getRebinFactor());
    }

    /**
     * Evaluates the (not pixel integrated) PSF at arbitrary detector positions, intended for display.
     * The high resolution spot is linearly interpolated with its center placed at the fiber's centroid.
     *
     * @param  x  detector x coordinates.
     * @param  y  detector y coordinates (same length as x).
     *
     * @return PSF value at each (x, y) position, zero outside the spot.
     *
     * @throws IllegalArgumentException
     *   if the coordinate arrays have different lengths.
     */
    public double[] value(final double[] x,
                          final double[] y,
                          final int ispec,
                          final double wavelength)
            throws IndexOutOfBoundsException, IllegalArgumentException {

        if (x.length != y.length) {
            throw new IllegalArgumentException("x has " + x.length + " values but y has " + y.length);
        }

        final int spotColumns = calibration.getSpotColumns();
        final int spotRows = calibration.getSpotRows();
        final ArrayImg<DoubleType, DoubleArray> spotImg =
                ArrayImgs.doubles(interpolateSpot(ispec, wavelength), spotColumns, spotRows);
        final RealRandomAccessible<DoubleType> interpolant =
                Views.interpolate(Views.extendZero(spotImg), new NLinearInterpolatorFactory<>());
        final RealRandomAccess<DoubleType> access = interpolant.realRandomAccess();

        final double[] center = centroidFor(ispec, wavelength);
        final double ratio = calibration.getCcdPixelSize() / calibration.getSpotPixelSize();
        final double spotCenterX = spotColumns / 2;
        final double spotCenterY = spotRows / 2;

        final double[] values = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            access.setPosition(((x[i] - center[0]) * ratio) + spotCenterX, 0);
            access.setPosition(((y[i] - center[1]) * ratio) + spotCenterY, 1);
            values[i] = access.get().getRealDouble();
        }

        return values;
    }

    private static LinearGridInterpolator buildSpotInterpolator(final SpotGridCalibration calibration) {
        return new LinearGridInterpolator(calibration.getSpotPositions(),
                                          calibration.getSpotWavelengths(),
                                          calibration.getSpots(),
                                          calibration.getSpotColumns() * calibration.getSpotRows());
    }

    private static final Logger LOG = LoggerFactory.getLogger(SpotGridPsf.class);
}
