package org.janelia.psf.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import org.janelia.psf.SpotGridPsf;
import org.janelia.psf.client.parameter.CommandLineParameters;
import org.janelia.psf.client.parameter.XYRangeParameters;
import org.janelia.psf.spec.XYRange;
import org.janelia.psf.util.DetectorImageUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for rendering flat spectra onto a detector image (or a window of it)
 * and saving the result as a 32-bit TIFF.
 *
 * @author Eric Trautman
 */
public class ProjectSpectraClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--calibration",
                description = "Path of the n5 spot grid calibration container",
                required = true)
        public String calibration;

        @Parameter(
                names = "--out",
                description = "Path of the TIFF file to write",
                required = true)
        public String out;

        @Parameter(
                names = "--specMin",
                description = "Index of the first fiber to render")
        public int specMin = 0;

        @Parameter(
                names = "--numberOfSpectra",
                description = "Number of fibers to render")
        public int numberOfSpectra = 1;

        @Parameter(
                names = "--wavelengthRange",
                description = "Rendered wavelengths as min,max,step (omit to use the native grid of --specMin)")
        public List<Double> wavelengthRange;

        @Parameter(
                names = "--photons",
                description = "Number of photons for every rendered sample")
        public double photons = 1000.0;

        @Parameter(
                names = "--shiftX",
                description = "Offset added to every x centroid")
        public double shiftX = 0.0;

        @Parameter(
                names = "--shiftY",
                description = "Offset added to every y centroid")
        public double shiftY = 0.0;

        @ParametersDelegate
        public XYRangeParameters window = new XYRangeParameters();

        @Override
        public void validate() throws IllegalArgumentException {
            if (numberOfSpectra < 1) {
                throw new IllegalArgumentException("--numberOfSpectra must be positive");
            }
            if (! (photons >= 0)) {
                throw new IllegalArgumentException("--photons must not be negative");
            }
            if (wavelengthRange != null) {
                if (wavelengthRange.size() != 3) {
                    throw new IllegalArgumentException("--wavelengthRange must be specified as min,max,step");
                }
                if (! (wavelengthRange.get(2) > 0) || (wavelengthRange.get(1) < wavelengthRange.get(0))) {
                    throw new IllegalArgumentException("--wavelengthRange " + wavelengthRange +
                                                       " must have min <= max and a positive step");
                }
            }
        }

        /**
         * @return wavelengths from min to max (inclusive) in step increments.
         */
        public double[] buildWavelengths() {
            final double min = wavelengthRange.get(0);
            final double max = wavelengthRange.get(1);
            final double step = wavelengthRange.get(2);
            final int count = (int) Math.floor(((max - min) / step) + 1.0e-9) + 1;
            final double[] wavelengths = new double[count];
            for (int i = 0; i < count; i++) {
                wavelengths[i] = min + (i * step);
            }
            return wavelengths;
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args, ProjectSpectraClient.class);

                LOG.info("runClient: entry, parameters={}", parameters);

                final ProjectSpectraClient client = new ProjectSpectraClient(parameters);
                client.renderAndSave();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public ProjectSpectraClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    /**
     * @return image of the requested spectra ordered [row][column].
     */
    public double[][] render()
            throws IllegalArgumentException, IndexOutOfBoundsException {

        final SpotGridPsf psf = SpotGridPsf.load(parameters.calibration);
        if ((parameters.shiftX != 0.0) || (parameters.shiftY != 0.0)) {
            psf.shiftXY(parameters.shiftX, parameters.shiftY);
        }

        final double[] wavelengths = parameters.wavelengthRange == null ?
                                     psf.wavelength(parameters.specMin) : parameters.buildWavelengths();

        final double[][] photons = new double[parameters.numberOfSpectra][wavelengths.length];
        for (final double[] spectrum : photons) {
            Arrays.fill(spectrum, parameters.photons);
        }

        final XYRange range = parameters.window.toXYRange(psf.getNpixX(), psf.getNpixY());

        LOG.info("render: projecting {} spectra with {} wavelengths each onto {}",
                 photons.length, wavelengths.length, range == null ? "full detector" : range);

        return psf.project(photons, wavelengths, parameters.specMin, range);
    }

    public void renderAndSave()
            throws IOException, IllegalArgumentException, IndexOutOfBoundsException {
        DetectorImageUtil.saveTiff(render(), parameters.out);
    }

    private static final Logger LOG = LoggerFactory.getLogger(ProjectSpectraClient.class);
}
