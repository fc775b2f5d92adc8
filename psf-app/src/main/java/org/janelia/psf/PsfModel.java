package org.janelia.psf;

import org.janelia.psf.spec.PixelStamp;
import org.janelia.psf.spec.PixelWindow;

/**
 * Capabilities shared by every PSF variant.
 * Bounding box logic ({@link StampLocator}) and projection
 * ({@link org.janelia.psf.project.ProjectionEngine}) only rely upon this interface.
 *
 * @author Eric Trautman
 */
public interface PsfModel {

    /** @return number of fibers. */
    int getNspec();

    /** @return number of detector columns. */
    int getNpixX();

    /** @return number of detector rows. */
    int getNpixY();

    double getWavelengthMin();

    double getWavelengthMax();

    /**
     * @return copy of the native wavelength grid for the specified fiber.
     *
     * @throws IndexOutOfBoundsException
     *   if the fiber index is invalid.
     */
    double[] getNativeWavelengths(int ispec)
            throws IndexOutOfBoundsException;

    /**
     * @return natural (unclipped) normalized stamp for the specified fiber and wavelength
     *         located in global detector coordinates.
     *
     * @throws IndexOutOfBoundsException
     *   if the fiber index is invalid.
     */
    PixelStamp stampFor(int ispec,
                        double wavelength)
            throws IndexOutOfBoundsException;

    /**
     * @return the (x, y) detector centroid for the specified fiber and wavelength.
     *
     * @throws IndexOutOfBoundsException
     *   if the fiber index is invalid.
     */
    double[] centroidFor(int ispec,
                         double wavelength)
            throws IndexOutOfBoundsException;

    /**
     * @throws IndexOutOfBoundsException
     *   if the fiber index is invalid.
     *
     * @throws IllegalStateException
     *   if the widths cannot be derived from the PSF at the specified position.
     */
    PsfWidths widthsFor(int ispec,
                        double wavelength)
            throws IndexOutOfBoundsException, IllegalStateException;

    /**
     * @return natural (unclipped) window for the specified fiber and wavelength.
     *         Variants that can locate a stamp without rendering it should override this.
     */
    default PixelWindow windowFor(final int ispec,
                                  final double wavelength)
            throws IndexOutOfBoundsException {
        return stampFor(ispec, wavelength).getWindow();
    }

}
