package org.janelia.psf.client;

import com.beust.jcommander.Parameter;

import java.io.File;
import java.io.IOException;

import org.janelia.psf.calibration.SpotGridCalibration;
import org.janelia.psf.calibration.SpotGridCalibrationWriter;
import org.janelia.psf.calibration.SyntheticCalibration;
import org.janelia.psf.client.parameter.CommandLineParameters;
import org.janelia.psf.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for writing a synthetic spot grid calibration (gaussian spots, gently curved traces)
 * to an n5 container.
 *
 * @author Eric Trautman
 */
public class SyntheticCalibrationClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--out",
                description = "Path of the n5 container to write",
                required = true)
        public String out;

        @Parameter(
                names = "--nspec",
                description = "Number of fibers")
        public int nspec = 25;

        @Parameter(
                names = "--nwave",
                description = "Number of trace samples per fiber")
        public int nwave = 11;

        @Parameter(
                names = "--npixY",
                description = "Number of detector rows")
        public int npixY = 400;

        @Parameter(
                names = "--maxBlockLength",
                description = "Maximum n5 block size for every dataset dimension")
        public int maxBlockLength = SpotGridCalibrationWriter.DEFAULT_MAX_BLOCK_LENGTH;

        @Parameter(
                names = "--overwrite",
                description = "Remove any existing container at the output path before writing")
        public boolean overwrite = false;

        @Override
        public void validate() throws IllegalArgumentException {
            if ((nspec < 1) || (nwave < 3) || (npixY <= 2 * SyntheticCalibration.Y_MARGIN)) {
                throw new IllegalArgumentException("--nspec must be positive, --nwave must be at least 3, " +
                                                   "and --npixY must exceed " + (2 * SyntheticCalibration.Y_MARGIN));
            }
            if (maxBlockLength < 1) {
                throw new IllegalArgumentException("--maxBlockLength must be positive");
            }
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args, SyntheticCalibrationClient.class);

                LOG.info("runClient: entry, parameters={}", parameters);

                writeCalibration(parameters);
            }
        };
        clientRunner.run();
    }

    /**
     * Builds the synthetic calibration and writes it to the output container.
     *
     * @throws IOException
     *   if the output container exists (and overwrite was not requested) or cannot be written.
     */
    public static SpotGridCalibration writeCalibration(final Parameters parameters)
            throws IOException {

        final File outDirectory = new File(parameters.out).getAbsoluteFile();
        if (outDirectory.exists()) {
            if (! parameters.overwrite) {
                throw new IOException(outDirectory + " already exists, specify --overwrite to replace it");
            }
            LOG.info("writeCalibration: removing existing container {}", outDirectory);
            if (! FileUtil.deleteRecursive(outDirectory)) {
                throw new IOException("failed to remove existing container " + outDirectory);
            }
        }

        final SpotGridCalibration calibration =
                SyntheticCalibration.build(parameters.nspec, parameters.nwave, parameters.npixY);

        new SpotGridCalibrationWriter(parameters.maxBlockLength).write(calibration, outDirectory.getPath());

        return calibration;
    }

    private static final Logger LOG = LoggerFactory.getLogger(SyntheticCalibrationClient.class);
}
