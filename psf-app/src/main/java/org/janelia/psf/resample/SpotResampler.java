package org.janelia.psf.resample;

import org.janelia.psf.spec.PixelStamp;
import org.janelia.psf.spec.PixelWindow;

/**
 * Resamples high resolution spot images to detector resolution.
 * <p>
 * The spot is first shifted by the sub-pixel part of the requested center: the fractional part
 * (in spot pixels) is applied by bilinear splatting of each spot pixel onto its four nearest
 * neighbours and the integral part (in spot pixels, modulo one detector pixel) by offsetting the
 * splat within a padded working grid.  The working grid is then summed in rebin x rebin blocks,
 * negative values are clipped and the result is normalized to a sum of 1.
 * <p>
 * The returned stamp is placed so that the detector pixel containing the center lies near the
 * middle of the stamp window.
 *
 * @author Eric Trautman
 */
public class SpotResampler {

    /**
     * @param  spot         high resolution spot image ordered [row][column] (not modified).
     * @param  centerX      detector column coordinate of the spot center.
     * @param  centerY      detector row coordinate of the spot center.
     * @param  rebinFactor  number of spot pixels per detector pixel.
     *
     * @return normalized detector resolution stamp and its (unclipped) detector window.
     *
     * @throws IllegalArgumentException
     *   if the rebin factor is less than 1.
     */
    public static PixelStamp resample(final double[][] spot,
                                      final double centerX,
                                      final double centerY,
                                      final int rebinFactor)
            throws IllegalArgumentException {

        final int spotRows = spot.length;
        final int spotColumns = spotRows == 0 ? 0 : spot[0].length;
        final double[] flatSpot = new double[spotRows * spotColumns];
        for (int row = 0; row < spotRows; row++) {
            System.arraycopy(spot[row], 0, flatSpot, row * spotColumns, spotColumns);
        }
        return resample(flatSpot, 0, spotColumns, spotRows, centerX, centerY, rebinFactor);
    }

    /**
     * @param  spotValues   buffer containing a high resolution spot image in row major order (not modified).
     * @param  offset       index of the first spot value within the buffer.
     * @param  spotColumns  number of spot image columns.
     * @param  spotRows     number of spot image rows.
     * @param  centerX      detector column coordinate of the spot center.
     * @param  centerY      detector row coordinate of the spot center.
     * @param  rebinFactor  number of spot pixels per detector pixel.
     *
     * @return normalized detector resolution stamp and its (unclipped) detector window.
     *
     * @throws IllegalArgumentException
     *   if the rebin factor is less than 1.
     */
    public static PixelStamp resample(final double[] spotValues,
                                      final int offset,
                                      final int spotColumns,
                                      final int spotRows,
                                      final double centerX,
                                      final double centerY,
                                      final int rebinFactor)
            throws IllegalArgumentException {

        if (rebinFactor < 1) {
            throw new IllegalArgumentException("rebinFactor must be at least 1 but was " + rebinFactor);
        }

        final int ccdColumns = getCcdLength(spotColumns, rebinFactor);
        final int ccdRows = getCcdLength(spotRows, rebinFactor);

        // fractional (sub spot pixel) part of the offset
        final double scaledX = centerX * rebinFactor;
        final double scaledY = centerY * rebinFactor;
        double dx = scaledX - Math.floor(scaledX);
        double dy = scaledY - Math.floor(scaledY);

        // integral part of the offset in [0, rebinFactor)
        int ix = (int) (Math.floor(scaledX) - (Math.floor(centerX) * rebinFactor));
        int iy = (int) (Math.floor(scaledY) - (Math.floor(centerY) * rebinFactor));

        // centers just below a pixel edge can round up to the next pixel once scaled
        if (ix >= rebinFactor) {
            ix = rebinFactor - 1;
            dx = 1.0;
        }
        if (iy >= rebinFactor) {
            iy = rebinFactor - 1;
            dy = 1.0;
        }

        final double w00 = (1 - dy) * (1 - dx);
        final double w10 = dy * (1 - dx);
        final double w01 = (1 - dy) * dx;
        final double w11 = dy * dx;

        final int paddedColumns = ccdColumns * rebinFactor;
        final int paddedRows = ccdRows * rebinFactor;
        final double[] padded = new double[paddedRows * paddedColumns];

        splat(spotValues, offset, spotColumns, spotRows, w00, ix, iy, padded, paddedColumns);
        splat(spotValues, offset, spotColumns, spotRows, w10, ix, iy + 1, padded, paddedColumns);
        splat(spotValues, offset, spotColumns, spotRows, w01, ix + 1, iy, padded, paddedColumns);
        splat(spotValues, offset, spotColumns, spotRows, w11, ix + 1, iy + 1, padded, paddedColumns);

        final double[][] ccdValues = rebin(padded, paddedColumns, ccdColumns, ccdRows, rebinFactor);

        // clip negative interpolation noise
        double norm = 0.0;
        for (final double[] ccdRow : ccdValues) {
            for (int column = 0; column < ccdColumns; column++) {
                if (ccdRow[column] < 0) {
                    ccdRow[column] = 0.0;
                }
                norm += ccdRow[column];
            }
        }

        if (norm > 0) {
            for (final double[] ccdRow : ccdValues) {
                for (int column = 0; column < ccdColumns; column++) {
                    ccdRow[column] /= norm;
                }
            }
        }

        return new PixelStamp(locateWindow(spotColumns, spotRows, centerX, centerY, rebinFactor), ccdValues);
    }

    /**
     * @return detector window for a spot of the specified size resampled at the specified center,
     *         derived without resampling the spot.
     */
    public static PixelWindow locateWindow(final int spotColumns,
                                           final int spotRows,
                                           final double centerX,
                                           final double centerY,
                                           final int rebinFactor) {
        final int ccdColumns = getCcdLength(spotColumns, rebinFactor);
        final int ccdRows = getCcdLength(spotRows, rebinFactor);
        final int xStart = (int) Math.floor(centerX) - (ccdColumns / 2) + 1;
        final int yStart = (int) Math.floor(centerY) - (ccdRows / 2) + 1;
        return new PixelWindow(xStart, xStart + ccdColumns, yStart, yStart + ccdRows);
    }

    /**
     * @return number of detector pixels needed to hold a resampled spot of the specified length.
     *         Spot lengths that are a multiple of the rebin factor need (length / rebin) + 1 pixels,
     *         the extra pixel absorbing the sub-pixel shift.
     */
    public static int getCcdLength(final int spotLength,
                                   final int rebinFactor) {
        return ((spotLength + rebinFactor - 1) / rebinFactor) + 1;
    }

    private static void splat(final double[] spotValues,
                              final int offset,
                              final int spotColumns,
                              final int spotRows,
                              final double weight,
                              final int columnOffset,
                              final int rowOffset,
                              final double[] padded,
                              final int paddedColumns) {
        for (int row = 0; row < spotRows; row++) {
            final int spotRowStart = offset + (row * spotColumns);
            final int paddedRowStart = ((row + rowOffset) * paddedColumns) + columnOffset;
            for (int column = 0; column < spotColumns; column++) {
                padded[paddedRowStart + column] += weight * spotValues[spotRowStart + column];
            }
        }
    }

    /**
     * Sums rebin x rebin blocks, first along each padded row and then across the rows of each block.
     */
    private static double[][] rebin(final double[] padded,
                                    final int paddedColumns,
                                    final int ccdColumns,
                                    final int ccdRows,
                                    final int rebinFactor) {

        final int paddedRows = ccdRows * rebinFactor;
        final double[] rowSums = new double[paddedRows * ccdColumns];
        for (int row = 0; row < paddedRows; row++) {
            for (int ccdColumn = 0; ccdColumn < ccdColumns; ccdColumn++) {
                final int start = (row * paddedColumns) + (ccdColumn * rebinFactor);
                double sum = 0.0;
                for (int i = 0; i < rebinFactor; i++) {
                    sum += padded[start + i];
                }
                rowSums[(row * ccdColumns) + ccdColumn] = sum;
            }
        }

        final double[][] ccdValues = new double[ccdRows][ccdColumns];
        for (int ccdRow = 0; ccdRow < ccdRows; ccdRow++) {
            for (int ccdColumn = 0; ccdColumn < ccdColumns; ccdColumn++) {
                double sum = 0.0;
                for (int i = 0; i < rebinFactor; i++) {
                    sum += rowSums[(((ccdRow * rebinFactor) + i) * ccdColumns) + ccdColumn];
                }
                ccdValues[ccdRow][ccdColumn] = sum;
            }
        }

        return ccdValues;
    }

    private SpotResampler() {
    }
}
