package org.janelia.psf.spec;

import java.io.Serializable;

/**
 * Integer bounding box of detector pixels with exclusive max values (xmin, xmax, ymin, ymax).
 *
 * @author Eric Trautman
 */
public class XYRange implements Serializable {

    public static final XYRange EMPTY = new XYRange(0, 0, 0, 0);

    private final int xMin;
    private final int xMax;
    private final int yMin;
    private final int yMax;

    public XYRange(final int xMin,
                   final int xMax,
                   final int yMin,
                   final int yMax) {
        if ((xMax < xMin) || (yMax < yMin)) {
            throw new IllegalArgumentException("invalid range [" + xMin + ", " + xMax + ", " +
                                               yMin + ", " + yMax + "]");
        }
        this.xMin = xMin;
        this.xMax = xMax;
        this.yMin = yMin;
        this.yMax = yMax;
    }

    /**
     * @return range covering an entire detector with the specified dimensions.
     */
    public static XYRange forDetector(final int npixX,
                                      final int npixY) {
        return new XYRange(0, npixX, 0, npixY);
    }

    public int getXMin() {
        return xMin;
    }

    public int getXMax() {
        return xMax;
    }

    public int getYMin() {
        return yMin;
    }

    public int getYMax() {
        return yMax;
    }

    public int getWidth() {
        return xMax - xMin;
    }

    public int getHeight() {
        return yMax - yMin;
    }

    public boolean isEmpty() {
        return (getWidth() == 0) || (getHeight() == 0);
    }

    /**
     * @return the smallest range containing both this range and the specified (global) window.
     */
    public XYRange union(final PixelWindow window) {
        if (isEmpty()) {
            return new XYRange(window.getXStart(), window.getXStop(), window.getYStart(), window.getYStop());
        }
        return new XYRange(Math.min(xMin, window.getXStart()),
                           Math.max(xMax, window.getXStop()),
                           Math.min(yMin, window.getYStart()),
                           Math.max(yMax, window.getYStop()));
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final XYRange that = (XYRange) o;
        return (xMin == that.xMin) && (xMax == that.xMax) && (yMin == that.yMin) && (yMax == that.yMax);
    }

    @Override
    public int hashCode() {
        int result = xMin;
        result = 31 * result + xMax;
        result = 31 * result + yMin;
        result = 31 * result + yMax;
        return result;
    }

    @Override
    public String toString() {
        return "[" + xMin + ", " + xMax + ", " + yMin + ", " + yMax + "]";
    }
}
