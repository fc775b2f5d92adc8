package org.janelia.psf;

import java.io.Serializable;

/**
 * Spatial and spectral widths of a PSF at one (fiber, wavelength) position.
 *
 * @author Eric Trautman
 */
public class PsfWidths implements Serializable {

    /** Cross dispersion (x) sigma in detector pixels. */
    private final double xSigma;

    /** Dispersion width in wavelength units. */
    private final double wavelengthDispersion;

    public PsfWidths(final double xSigma,
                     final double wavelengthDispersion) {
        this.xSigma = xSigma;
        this.wavelengthDispersion = wavelengthDispersion;
    }

    public double getXSigma() {
        return xSigma;
    }

    public double getWavelengthDispersion() {
        return wavelengthDispersion;
    }

    @Override
    public String toString() {
        return "{xSigma=" + xSigma + ", wavelengthDispersion=" + wavelengthDispersion + '}';
    }
}
