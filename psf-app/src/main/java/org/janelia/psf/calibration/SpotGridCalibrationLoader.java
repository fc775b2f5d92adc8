package org.janelia.psf.calibration;

import java.io.File;
import java.util.Arrays;
import java.util.List;

import org.janelia.psf.util.Grid;
import org.janelia.saalfeldlab.n5.DataBlock;
import org.janelia.saalfeldlab.n5.DataType;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.N5FSReader;
import org.janelia.saalfeldlab.n5.N5Reader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@link SpotGridCalibration} from an n5 container with the following layout:
 * <pre>
 *     /                  attributes CCDPIXSZ, PIXSIZE, NPIX_X, NPIX_Y
 *     /SPOTS             [nx, ny, nwave, npos]   spot images
 *     /SPOTPOS           [npos]                  slit positions of the spot grid
 *     /SPOTWAVE          [nwave]                 wavelengths of the spot grid
 *     /FIBERPOS          [nspec]                 slit position of each fiber
 *     /X, /Y, /WAVELENGTH  [ntrace, nspec]       sampled trace of each fiber
 * </pre>
 * Dimensions are listed in n5 order (fastest varying first).
 * Datasets may be stored as FLOAT64 or FLOAT32 with any block size.
 *
 * @author Eric Trautman
 */
public class SpotGridCalibrationLoader {

    public static final String CCD_PIXEL_SIZE_KEY = "CCDPIXSZ";
    public static final String SPOT_PIXEL_SIZE_KEY = "PIXSIZE";
    public static final String NPIX_X_KEY = "NPIX_X";
    public static final String NPIX_Y_KEY = "NPIX_Y";

    public static final String SPOTS_DATASET = "SPOTS";
    public static final String SPOT_POSITIONS_DATASET = "SPOTPOS";
    public static final String SPOT_WAVELENGTHS_DATASET = "SPOTWAVE";
    public static final String FIBER_POSITIONS_DATASET = "FIBERPOS";
    public static final String TRACE_X_DATASET = "X";
    public static final String TRACE_Y_DATASET = "Y";
    public static final String TRACE_WAVELENGTH_DATASET = "WAVELENGTH";

    /** Shareable instance of this loader. */
    public static final SpotGridCalibrationLoader INSTANCE = new SpotGridCalibrationLoader();

    /**
     * @param  basePath  path of the n5 container.
     *
     * @return calibration loaded from the container.
     *
     * @throws IllegalArgumentException
     *   if the container cannot be read or is missing any required data.
     */
    public SpotGridCalibration load(final String basePath)
            throws IllegalArgumentException {

        LOG.info("load: entry, basePath={}", basePath);

        if (! new File(basePath).isDirectory()) {
            throw new IllegalArgumentException("calibration container " + basePath + " does not exist");
        }

        final SpotGridCalibration calibration;
        try {
            final N5Reader reader = buildReader(basePath);
            calibration = load(reader, basePath);
        } catch (final IllegalArgumentException e) {
            throw e;
        } catch (final Exception e) {
            throw new IllegalArgumentException("failed to load calibration from " + basePath, e);
        }

        LOG.info("load: exit, loaded {}", calibration);

        return calibration;
    }

    public N5Reader buildReader(final String basePath)
            throws Exception {
        return new N5FSReader(basePath);
    }

    SpotGridCalibration load(final N5Reader reader,
                             final String context)
            throws Exception {

        final double ccdPixelSize = getRequiredAttribute(reader, CCD_PIXEL_SIZE_KEY, Double.class, context);
        final double spotPixelSize = getRequiredAttribute(reader, SPOT_PIXEL_SIZE_KEY, Double.class, context);
        final int npixX = getRequiredAttribute(reader, NPIX_X_KEY, Integer.class, context);
        final int npixY = getRequiredAttribute(reader, NPIX_Y_KEY, Integer.class, context);

        final Dataset spots = readDataset(reader, SPOTS_DATASET, 4, context);
        final double[] spotPositions = readDataset(reader, SPOT_POSITIONS_DATASET, 1, context).values;
        final double[] spotWavelengths = readDataset(reader, SPOT_WAVELENGTHS_DATASET, 1, context).values;
        final double[] fiberPositions = readDataset(reader, FIBER_POSITIONS_DATASET, 1, context).values;

        if ((spots.dimensions[2] != spotWavelengths.length) || (spots.dimensions[3] != spotPositions.length)) {
            throw new IllegalArgumentException(
                    SPOTS_DATASET + " grid dimensions " + spots.dimensions[2] + "x" + spots.dimensions[3] +
                    " do not match " + spotWavelengths.length + " " + SPOT_WAVELENGTHS_DATASET + " values and " +
                    spotPositions.length + " " + SPOT_POSITIONS_DATASET + " values in " + context);
        }

        final double[][] traceX = readTrace(reader, TRACE_X_DATASET, context);
        final double[][] traceY = readTrace(reader, TRACE_Y_DATASET, context);
        final double[][] traceWavelength = readTrace(reader, TRACE_WAVELENGTH_DATASET, context);

        return new SpotGridCalibration(spots.values,
                                       (int) spots.dimensions[0],
                                       (int) spots.dimensions[1],
                                       spotPositions,
                                       spotWavelengths,
                                       fiberPositions,
                                       ccdPixelSize,
                                       spotPixelSize,
                                       npixX,
                                       npixY,
                                       traceX,
                                       traceY,
                                       traceWavelength);
    }

    private static <T> T getRequiredAttribute(final N5Reader reader,
                                              final String key,
                                              final Class<T> clazz,
                                              final String context)
            throws Exception {
        final T value = reader.getAttribute("/", key, clazz);
        if (value == null) {
            throw new IllegalArgumentException("attribute '" + key + "' not found in " + context);
        }
        return value;
    }

    private static double[][] readTrace(final N5Reader reader,
                                        final String dataSet,
                                        final String context)
            throws Exception {

        final Dataset trace = readDataset(reader, dataSet, 2, context);
        final int nwave = (int) trace.dimensions[0];
        final int nspec = (int) trace.dimensions[1];
        final double[][] values = new double[nspec][nwave];
        for (int ispec = 0; ispec < nspec; ispec++) {
            System.arraycopy(trace.values, ispec * nwave, values[ispec], 0, nwave);
        }
        return values;
    }

    static Dataset readDataset(final N5Reader reader,
                               final String dataSet,
                               final int expectedNumberOfDimensions,
                               final String context)
            throws Exception {

        if (! reader.datasetExists(dataSet)) {
            throw new IllegalArgumentException("dataset '" + dataSet + "' not found in " + context);
        }

        final DatasetAttributes attributes = reader.getDatasetAttributes(dataSet);
        final long[] dimensions = attributes.getDimensions();
        if (dimensions.length != expectedNumberOfDimensions) {
            throw new IllegalArgumentException("dataset '" + dataSet + "' in " + context + " has " +
                                               dimensions.length + " dimensions instead of " +
                                               expectedNumberOfDimensions);
        }

        final DataType dataType = attributes.getDataType();
        if ((dataType != DataType.FLOAT64) && (dataType != DataType.FLOAT32)) {
            throw new IllegalArgumentException("dataType " + dataType + " of dataset '" + dataSet + "' in " +
                                               context + " is not supported");
        }

        long size = 1;
        for (final long dimension : dimensions) {
            size *= dimension;
        }
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("dataset '" + dataSet + "' in " + context + " is too large");
        }

        final double[] values = new double[(int) size];
        final List<Grid.Block> blocks = Grid.create(dimensions, attributes.getBlockSize());

        for (final Grid.Block block : blocks) {
            final DataBlock<?> dataBlock = reader.readBlock(dataSet, attributes, block.gridPosition);
            if (dataBlock == null) {
                throw new IllegalArgumentException("block " + Arrays.toString(block.gridPosition) +
                                                   " of dataset '" + dataSet + "' is missing from " + context);
            }
            Grid.copyBlock(block, dataBlock.getSize(), toDoubles(dataBlock.getData()), dimensions, values);
        }

        LOG.debug("readDataset: read {} values from {} blocks of {}", values.length, blocks.size(), dataSet);

        return new Dataset(dimensions, values);
    }

    private static double[] toDoubles(final Object data) {
        if (data instanceof double[]) {
            return (double[]) data;
        } else if (data instanceof float[]) {
            final float[] floats = (float[]) data;
            final double[] doubles = new double[floats.length];
            for (int i = 0; i < floats.length; i++) {
                doubles[i] = floats[i];
            }
            return doubles;
        }
        throw new IllegalArgumentException("unsupported block data type " +
                                           (data == null ? null : data.getClass().getName()));
    }

    static class Dataset {
        final long[] dimensions;
        final double[] values;

        Dataset(final long[] dimensions,
                final double[] values) {
            this.dimensions = dimensions;
            this.values = values;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(SpotGridCalibrationLoader.class);
}
