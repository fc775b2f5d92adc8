package org.janelia.psf.util;

import ij.ImagePlus;
import ij.io.FileSaver;
import ij.io.Opener;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.io.File;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utilities for converting detector images ordered [row][column] to and from ImageJ processors and TIFF files.
 *
 * @author Eric Trautman
 */
public class DetectorImageUtil {

    /**
     * @return 32-bit processor with the specified image's values.
     */
    public static FloatProcessor toFloatProcessor(final double[][] image) {
        final int height = image.length;
        final int width = height == 0 ? 0 : image[0].length;
        final float[] pixels = new float[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                pixels[(y * width) + x] = (float) image[y][x];
            }
        }
        return new FloatProcessor(width, height, pixels);
    }

    /**
     * @return image values ordered [row][column].
     */
    public static double[][] toArray(final ImageProcessor processor) {
        final double[][] image = new double[processor.getHeight()][processor.getWidth()];
        for (int y = 0; y < image.length; y++) {
            for (int x = 0; x < image[y].length; x++) {
                image[y][x] = processor.getf(x, y);
            }
        }
        return image;
    }

    /**
     * @return file for the specified path with any missing parent directories created.
     *
     * @throws IllegalArgumentException
     *   if a missing parent directory cannot be created.
     */
    public static File prepareFileForWrite(final String path)
            throws IllegalArgumentException {

        final File file = new File(path).getAbsoluteFile();

        final File parentDirectory = file.getParentFile();
        if ((parentDirectory != null) && (! parentDirectory.exists())) {
            if (! parentDirectory.mkdirs()) {
                // another process may have created it
                if (! parentDirectory.exists()) {
                    throw new IllegalArgumentException("failed to create directory " +
                                                       parentDirectory.getAbsolutePath());
                }
            }
        }

        return file;
    }

    /**
     * Saves the specified image as a 32-bit TIFF.
     *
     * @throws IOException
     *   if the file cannot be written.
     */
    public static void saveTiff(final double[][] image,
                                final String path)
            throws IOException {

        final File file = prepareFileForWrite(path);
        final ImagePlus imagePlus = new ImagePlus(file.getName(), toFloatProcessor(image));
        final FileSaver fileSaver = new FileSaver(imagePlus);

        if (! fileSaver.saveAsTiff(file.getAbsolutePath())) {
            throw new IOException("failed to save " + file.getAbsolutePath());
        }

        LOG.info("saveTiff: exit, saved {}", file.getAbsolutePath());
    }

    /**
     * @return values of the TIFF image at the specified path ordered [row][column].
     *
     * @throws IllegalArgumentException
     *   if the image cannot be opened.
     */
    public static double[][] openTiff(final String path)
            throws IllegalArgumentException {
        final ImagePlus imagePlus = new Opener().openImage(path);
        if (imagePlus == null) {
            throw new IllegalArgumentException("failed to open image " + path);
        }
        return toArray(imagePlus.getProcessor());
    }

    private DetectorImageUtil() {
    }

    private static final Logger LOG = LoggerFactory.getLogger(DetectorImageUtil.class);
}
