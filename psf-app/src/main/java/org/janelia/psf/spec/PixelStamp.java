package org.janelia.psf.spec;

import java.io.Serializable;

/**
 * A small image of one fiber's PSF footprint at one wavelength along with the
 * detector window where it belongs.  Stamp values are indexed [row][column],
 * so the number of rows matches the window height and the number of columns
 * matches the window width.
 *
 * @author Eric Trautman
 */
public class PixelStamp implements Serializable {

    private static final double[][] NO_VALUES = new double[0][0];

    private final PixelWindow window;
    private final double[][] values;

    /**
     * @throws IllegalArgumentException
     *   if the value dimensions do not match the window dimensions.
     */
    public PixelStamp(final PixelWindow window,
                      final double[][] values)
            throws IllegalArgumentException {

        final int columns = values.length == 0 ? 0 : values[0].length;
        if ((values.length != window.getHeight()) || (columns != window.getWidth())) {
            throw new IllegalArgumentException("stamp with " + values.length + " rows and " + columns +
                                               " columns does not fit window " + window);
        }

        this.window = window;
        this.values = values;
    }

    /**
     * @return a stamp with no values whose window is collapsed onto the start of the specified window.
     */
    public static PixelStamp empty(final PixelWindow window) {
        return new PixelStamp(PixelWindow.collapsed(window.getXStart(), window.getYStart()), NO_VALUES);
    }

    public PixelWindow getWindow() {
        return window;
    }

    /**
     * @return this stamp's values (not a copy).
     */
    public double[][] getValues() {
        return values;
    }

    public int getRows() {
        return values.length;
    }

    public int getColumns() {
        return values.length == 0 ? 0 : values[0].length;
    }

    public boolean isEmpty() {
        return (getRows() == 0) || (getColumns() == 0);
    }

    public double getSum() {
        double sum = 0.0;
        for (final double[] row : values) {
            for (final double value : row) {
                sum += value;
            }
        }
        return sum;
    }

    /**
     * @return a deep copy of this stamp.
     */
    public PixelStamp copy() {
        final double[][] copiedValues = new double[values.length][];
        for (int row = 0; row < values.length; row++) {
            copiedValues[row] = values[row].clone();
        }
        return new PixelStamp(window, copiedValues);
    }

    @Override
    public String toString() {
        return "PixelStamp{window=" + window + ", rows=" + getRows() + ", columns=" + getColumns() + '}';
    }
}
