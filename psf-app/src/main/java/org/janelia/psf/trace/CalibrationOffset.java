package org.janelia.psf.trace;

import java.io.Serializable;

/**
 * Global (dx, dy) offset applied to every computed trace centroid.
 * Each composed offset gets a new version number so that values derived
 * from centroids (e.g. cached widths) can be tied to the offset they were built with.
 *
 * @author Eric Trautman
 */
public class CalibrationOffset implements Serializable {

    public static final CalibrationOffset NONE = new CalibrationOffset(0.0, 0.0, 0);

    private final double dx;
    private final double dy;
    private final long version;

    private CalibrationOffset(final double dx,
                              final double dy,
                              final long version) {
        this.dx = dx;
        this.dy = dy;
        this.version = version;
    }

    public double getDx() {
        return dx;
    }

    public double getDy() {
        return dy;
    }

    public long getVersion() {
        return version;
    }

    /**
     * @return a new offset that adds the specified shift to this offset.
     */
    public CalibrationOffset plus(final double shiftX,
                                  final double shiftY) {
        return new CalibrationOffset(dx + shiftX, dy + shiftY, version + 1);
    }

    @Override
    public String toString() {
        return "{dx=" + dx + ", dy=" + dy + ", version=" + version + '}';
    }
}
