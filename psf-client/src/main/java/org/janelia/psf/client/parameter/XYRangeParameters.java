package org.janelia.psf.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.janelia.psf.spec.XYRange;

/**
 * Parameters for specifying a detector window.
 * Max values are exclusive and unspecified values default to the detector edges.
 *
 * @author Eric Trautman
 */
public class XYRangeParameters
        implements Serializable {

    @Parameter(
            names = "--minX",
            description = "Minimum detector column to render")
    public Integer minX;

    @Parameter(
            names = "--maxX",
            description = "Detector column after the last column to render")
    public Integer maxX;

    @Parameter(
            names = "--minY",
            description = "Minimum detector row to render")
    public Integer minY;

    @Parameter(
            names = "--maxY",
            description = "Detector row after the last row to render")
    public Integer maxY;

    public boolean isDefined() {
        return (minX != null) || (maxX != null) || (minY != null) || (maxY != null);
    }

    /**
     * @return window with unspecified values taken from the detector edges
     *         or null if no values were specified.
     *
     * @throws IllegalArgumentException
     *   if the window is not within the detector.
     */
    public XYRange toXYRange(final int npixX,
                             final int npixY)
            throws IllegalArgumentException {

        if (! isDefined()) {
            return null;
        }

        final XYRange range = new XYRange(minX == null ? 0 : minX,
                                          maxX == null ? npixX : maxX,
                                          minY == null ? 0 : minY,
                                          maxY == null ? npixY : maxY);

        if ((range.getXMin() < 0) || (range.getXMax() > npixX) ||
            (range.getYMin() < 0) || (range.getYMax() > npixY)) {
            throw new IllegalArgumentException("window " + range + " is not within the " + npixX + "x" + npixY +
                                               " detector");
        }

        return range;
    }

}
