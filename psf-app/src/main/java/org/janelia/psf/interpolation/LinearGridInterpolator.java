package org.janelia.psf.interpolation;

import java.util.Arrays;

/**
 * Bilinear interpolation of images sampled on an irregular (but ordered) 2D grid.
 * The grid axes are typically slit position and wavelength and each grid point holds
 * one high resolution spot image.
 *
 * Queries outside the grid are linearly extrapolated from the nearest grid cell.
 *
 * @author Eric Trautman
 */
public class LinearGridInterpolator {

    private final double[] xAxis;
    private final double[] yAxis;
    private final double[] values;
    private final int valuesPerPoint;

    /**
     * @param  xAxis           ascending grid coordinates along the first axis (at least 2).
     * @param  yAxis           ascending grid coordinates along the second axis (at least 2).
     * @param  values          flattened grid data ordered [x][y][valuesPerPoint]; not copied.
     * @param  valuesPerPoint  number of values (e.g. image pixels) stored for each grid point.
     *
     * @throws IllegalArgumentException
     *   if the axes are too short or the values do not match the grid size.
     */
    public LinearGridInterpolator(final double[] xAxis,
                                  final double[] yAxis,
                                  final double[] values,
                                  final int valuesPerPoint)
            throws IllegalArgumentException {

        if ((xAxis.length < 2) || (yAxis.length < 2)) {
            throw new IllegalArgumentException("grid axes must each have at least 2 values");
        }
        if (values.length != (long) xAxis.length * yAxis.length * valuesPerPoint) {
            throw new IllegalArgumentException("grid of " + xAxis.length + "x" + yAxis.length + " points with " +
                                               valuesPerPoint + " values per point does not match " +
                                               values.length + " values");
        }

        this.xAxis = xAxis.clone();
        this.yAxis = yAxis.clone();
        this.values = values;
        this.valuesPerPoint = valuesPerPoint;
    }

    public int getValuesPerPoint() {
        return valuesPerPoint;
    }

    /**
     * @return newly allocated interpolated values for the specified grid coordinates.
     */
    public double[] interpolate(final double x,
                                final double y) {

        final int ix = findCell(xAxis, x);
        final int iy = findCell(yAxis, y);

        final double dx = (x - xAxis[ix]) / (xAxis[ix + 1] - xAxis[ix]);
        final double dy = (y - yAxis[iy]) / (yAxis[iy + 1] - yAxis[iy]);

        final int offset00 = pointOffset(ix, iy);
        final int offset10 = pointOffset(ix + 1, iy);
        final int offset01 = pointOffset(ix, iy + 1);
        final int offset11 = pointOffset(ix + 1, iy + 1);

        final double[] result = new double[valuesPerPoint];
        for (int i = 0; i < valuesPerPoint; i++) {
            final double lowY = (values[offset00 + i] * (1 - dx)) + (values[offset10 + i] * dx);
            final double highY = (values[offset01 + i] * (1 - dx)) + (values[offset11 + i] * dx);
            result[i] = (lowY * (1 - dy)) + (highY * dy);
        }

        return result;
    }

    private int pointOffset(final int ix,
                            final int iy) {
        return ((ix * yAxis.length) + iy) * valuesPerPoint;
    }

    /**
     * @return index i of the grid cell [axis[i], axis[i+1]] used to interpolate the value,
     *         clamped to the first or last cell for values outside the axis range.
     */
    static int findCell(final double[] axis,
                        final double value) {
        int index = Arrays.binarySearch(axis, value);
        if (index < 0) {
            // insertion point - 1 is the last axis value below the query
            index = -index - 2;
        }
        return Math.max(0, Math.min(index, axis.length - 2));
    }

}
