package org.janelia.psf.calibration;

import java.io.IOException;

import org.janelia.psf.util.Grid;
import org.janelia.saalfeldlab.n5.DataType;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.DoubleArrayDataBlock;
import org.janelia.saalfeldlab.n5.GzipCompression;
import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.janelia.psf.calibration.SpotGridCalibrationLoader.CCD_PIXEL_SIZE_KEY;
import static org.janelia.psf.calibration.SpotGridCalibrationLoader.FIBER_POSITIONS_DATASET;
import static org.janelia.psf.calibration.SpotGridCalibrationLoader.NPIX_X_KEY;
import static org.janelia.psf.calibration.SpotGridCalibrationLoader.NPIX_Y_KEY;
import static org.janelia.psf.calibration.SpotGridCalibrationLoader.SPOTS_DATASET;
import static org.janelia.psf.calibration.SpotGridCalibrationLoader.SPOT_PIXEL_SIZE_KEY;
import static org.janelia.psf.calibration.SpotGridCalibrationLoader.SPOT_POSITIONS_DATASET;
import static org.janelia.psf.calibration.SpotGridCalibrationLoader.SPOT_WAVELENGTHS_DATASET;
import static org.janelia.psf.calibration.SpotGridCalibrationLoader.TRACE_WAVELENGTH_DATASET;
import static org.janelia.psf.calibration.SpotGridCalibrationLoader.TRACE_X_DATASET;
import static org.janelia.psf.calibration.SpotGridCalibrationLoader.TRACE_Y_DATASET;

/**
 * Writes a {@link SpotGridCalibration} to an n5 container using the layout
 * read by {@link SpotGridCalibrationLoader}.
 *
 * @author Eric Trautman
 */
public class SpotGridCalibrationWriter {

    public static final int DEFAULT_MAX_BLOCK_LENGTH = 64;

    private final int maxBlockLength;

    public SpotGridCalibrationWriter() {
        this(DEFAULT_MAX_BLOCK_LENGTH);
    }

    /**
     * @param  maxBlockLength  maximum block size for every dimension of the written datasets.
     */
    public SpotGridCalibrationWriter(final int maxBlockLength) {
        if (maxBlockLength < 1) {
            throw new IllegalArgumentException("maxBlockLength must be positive");
        }
        this.maxBlockLength = maxBlockLength;
    }

    /**
     * Writes the specified calibration to a (new or existing) n5 container.
     *
     * @throws IOException
     *   if any of the data cannot be written.
     */
    public void write(final SpotGridCalibration calibration,
                      final String basePath)
            throws IOException {

        LOG.info("write: entry, basePath={}, calibration={}", basePath, calibration);

        try {
            final N5Writer writer = new N5FSWriter(basePath);

            writer.setAttribute("/", CCD_PIXEL_SIZE_KEY, calibration.getCcdPixelSize());
            writer.setAttribute("/", SPOT_PIXEL_SIZE_KEY, calibration.getSpotPixelSize());
            writer.setAttribute("/", NPIX_X_KEY, calibration.getNpixX());
            writer.setAttribute("/", NPIX_Y_KEY, calibration.getNpixY());

            writeDataset(writer,
                         SPOTS_DATASET,
                         new long[] {
                                 calibration.getSpotColumns(),
                                 calibration.getSpotRows(),
                                 calibration.getNumberOfSpotWavelengths(),
                                 calibration.getNumberOfSpotPositions()
                         },
                         calibration.getSpots());

            writeVector(writer, SPOT_POSITIONS_DATASET, calibration.getSpotPositions());
            writeVector(writer, SPOT_WAVELENGTHS_DATASET, calibration.getSpotWavelengths());
            writeVector(writer, FIBER_POSITIONS_DATASET, calibration.getFiberPositions());

            writeTrace(writer, TRACE_X_DATASET, calibration.getTraceX());
            writeTrace(writer, TRACE_Y_DATASET, calibration.getTraceY());
            writeTrace(writer, TRACE_WAVELENGTH_DATASET, calibration.getTraceWavelength());

        } catch (final IOException e) {
            throw e;
        } catch (final Exception e) {
            throw new IOException("failed to write calibration to " + basePath, e);
        }

        LOG.info("write: exit");
    }

    private void writeVector(final N5Writer writer,
                             final String dataSet,
                             final double[] values)
            throws Exception {
        writeDataset(writer, dataSet, new long[] { values.length }, values);
    }

    private void writeTrace(final N5Writer writer,
                            final String dataSet,
                            final double[][] trace)
            throws Exception {

        final int nspec = trace.length;
        final int nwave = trace[0].length;
        final double[] values = new double[nspec * nwave];
        for (int ispec = 0; ispec < nspec; ispec++) {
            System.arraycopy(trace[ispec], 0, values, ispec * nwave, nwave);
        }

        writeDataset(writer, dataSet, new long[] { nwave, nspec }, values);
    }

    private void writeDataset(final N5Writer writer,
                              final String dataSet,
                              final long[] dimensions,
                              final double[] values)
            throws Exception {

        final int[] blockSize = new int[dimensions.length];
        for (int d = 0; d < dimensions.length; d++) {
            blockSize[d] = (int) Math.max(1, Math.min(dimensions[d], maxBlockLength));
        }

        final DatasetAttributes attributes = new DatasetAttributes(dimensions,
                                                                   blockSize,
                                                                   DataType.FLOAT64,
                                                                   new GzipCompression());
        writer.createDataset(dataSet, attributes);

        for (final Grid.Block block : Grid.create(dimensions, blockSize)) {
            final int[] croppedSize = new int[dimensions.length];
            for (int d = 0; d < dimensions.length; d++) {
                croppedSize[d] = (int) block.dimensions[d];
            }
            final double[] blockValues = Grid.extractBlock(block, values, dimensions);
            writer.writeBlock(dataSet,
                              attributes,
                              new DoubleArrayDataBlock(croppedSize, block.gridPosition, blockValues));
        }

        LOG.debug("writeDataset: wrote {}", dataSet);
    }

    private static final Logger LOG = LoggerFactory.getLogger(SpotGridCalibrationWriter.class);
}
