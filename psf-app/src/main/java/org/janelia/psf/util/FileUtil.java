package org.janelia.psf.util;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File system utilities for calibration containers and rendered output.
 *
 * @author Eric Trautman
 */
public class FileUtil {

    /**
     * Deletes the specified file or directory (including everything within it).
     *
     * @return true if everything was deleted.
     */
    public static boolean deleteRecursive(final File file) {

        boolean deleteSuccessful = true;

        final File[] children = file.isDirectory() ? file.listFiles() : null;
        if (children != null) {
            for (final File child : children) {
                deleteSuccessful = deleteRecursive(child) && deleteSuccessful;
            }
        }

        if (file.delete()) {
            LOG.debug("deleteRecursive: deleted {}", file.getAbsolutePath());
        } else {
            LOG.warn("deleteRecursive: failed to delete {}", file.getAbsolutePath());
            deleteSuccessful = false;
        }

        return deleteSuccessful;
    }

    private FileUtil() {
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);
}
