package org.janelia.psf.client;

import com.beust.jcommander.Parameter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.janelia.psf.SpotGridPsf;
import org.janelia.psf.client.parameter.CommandLineParameters;
import org.janelia.psf.spec.PixelStamp;
import org.janelia.psf.spec.PixelWindow;
import org.janelia.psf.spec.XYRange;
import org.janelia.psf.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for reporting (as JSON) centroids, widths and stamp locations of one fiber
 * at a set of wavelengths, optionally along with the bounding box of a group of fibers.
 *
 * @author Eric Trautman
 */
public class PsfInfoClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--calibration",
                description = "Path of the n5 spot grid calibration container",
                required = true)
        public String calibration;

        @Parameter(
                names = "--spectrum",
                description = "Index of the fiber to describe")
        public int spectrum = 0;

        @Parameter(
                names = "--wavelength",
                description = "Wavelength to describe (omit to describe the fiber's min, mean and max native wavelengths)",
                variableArity = true)
        public List<Double> wavelengths;

        @Parameter(
                names = "--xyrangeSpecMax",
                description = "If specified, include the bounding box of fibers spectrum through xyrangeSpecMax " +
                              "(inclusive) for the described wavelength range")
        public Integer xyrangeSpecMax;

        @Parameter(
                names = "--out",
                description = "Path of the JSON file to write (omit to write to standard out)")
        public String out;
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args, PsfInfoClient.class);

                LOG.info("runClient: entry, parameters={}", parameters);

                final PsfInfoClient client = new PsfInfoClient(parameters);
                client.describeAndWrite();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public PsfInfoClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    public PsfInfo describe()
            throws IllegalArgumentException, IndexOutOfBoundsException {

        final SpotGridPsf psf = SpotGridPsf.load(parameters.calibration);
        final int ispec = parameters.spectrum;

        final double[] wavelengths;
        if ((parameters.wavelengths == null) || parameters.wavelengths.isEmpty()) {
            final double[] nativeWavelengths = psf.wavelength(ispec);
            final double min = nativeWavelengths[0];
            final double max = nativeWavelengths[nativeWavelengths.length - 1];
            wavelengths = new double[] { min, (min + max) / 2.0, max };
        } else {
            wavelengths = new double[parameters.wavelengths.size()];
            for (int i = 0; i < wavelengths.length; i++) {
                wavelengths[i] = parameters.wavelengths.get(i);
            }
        }

        final PsfInfo info = new PsfInfo(parameters.calibration, psf, ispec);
        for (final double wavelength : wavelengths) {
            info.wavelengths.add(describeWavelength(psf, ispec, wavelength));
        }

        if (parameters.xyrangeSpecMax != null) {
            info.xyrange = psf.xyrange(ispec, parameters.xyrangeSpecMax, wavelengths);
        }

        return info;
    }

    public void describeAndWrite()
            throws IOException, IllegalArgumentException, IndexOutOfBoundsException {

        final PsfInfo info = describe();

        if (parameters.out == null) {
            System.out.println(JSON_HELPER.toJson(info));
        } else {
            JSON_HELPER.writeFile(info, parameters.out);
        }
    }

    private static WavelengthInfo describeWavelength(final SpotGridPsf psf,
                                                     final int ispec,
                                                     final double wavelength) {

        final WavelengthInfo info = new WavelengthInfo();
        info.wavelength = wavelength;
        info.inBand = (wavelength >= psf.getWavelengthMin()) && (wavelength <= psf.getWavelengthMax());

        final double[] xy = psf.xy(ispec, wavelength);
        info.x = xy[0];
        info.y = xy[1];
        info.angle = psf.angle(ispec, wavelength);

        if (info.inBand) {
            try {
                info.xSigma = psf.xsigma(ispec, wavelength);
                info.wavelengthDispersion = psf.wdisp(ispec, wavelength);
            } catch (final IllegalStateException e) {
                LOG.warn("describeWavelength: widths are not available for fiber {} at wavelength {}, {}",
                         ispec, wavelength, e.getMessage());
            }
        }

        final PixelStamp stamp = psf.xypix(ispec, wavelength);
        info.window = stamp.getWindow();
        info.stampSum = stamp.getSum();

        return info;
    }

    /**
     * Description of one fiber.
     */
    public static class PsfInfo {

        private String calibration;
        private int spectrum;
        private int nspec;
        private int npixX;
        private int npixY;
        private double wavelengthMin;
        private double wavelengthMax;
        private final List<WavelengthInfo> wavelengths;
        private XYRange xyrange;

        @SuppressWarnings("unused")
        private PsfInfo() {
            this.wavelengths = new ArrayList<>();
        }

        PsfInfo(final String calibration,
                final SpotGridPsf psf,
                final int spectrum) {
            this();
            this.calibration = calibration;
            this.spectrum = spectrum;
            this.nspec = psf.getNspec();
            this.npixX = psf.getNpixX();
            this.npixY = psf.getNpixY();
            this.wavelengthMin = psf.getWavelengthMin();
            this.wavelengthMax = psf.getWavelengthMax();
        }

        public String getCalibration() {
            return calibration;
        }

        public int getSpectrum() {
            return spectrum;
        }

        public int getNspec() {
            return nspec;
        }

        public int getNpixX() {
            return npixX;
        }

        public int getNpixY() {
            return npixY;
        }

        public double getWavelengthMin() {
            return wavelengthMin;
        }

        public double getWavelengthMax() {
            return wavelengthMax;
        }

        public List<WavelengthInfo> getWavelengths() {
            return wavelengths;
        }

        /**
         * @return bounding box of the requested fibers or null if not requested.
         */
        public XYRange getXyrange() {
            return xyrange;
        }
    }

    /**
     * Description of one fiber at one wavelength.
     */
    public static class WavelengthInfo {

        private double wavelength;
        private boolean inBand;
        private double x;
        private double y;
        private double angle;
        private Double xSigma;
        private Double wavelengthDispersion;
        private PixelWindow window;
        private double stampSum;

        public double getWavelength() {
            return wavelength;
        }

        public boolean isInBand() {
            return inBand;
        }

        public double getX() {
            return x;
        }

        public double getY() {
            return y;
        }

        public double getAngle() {
            return angle;
        }

        public Double getXSigma() {
            return xSigma;
        }

        public Double getWavelengthDispersion() {
            return wavelengthDispersion;
        }

        /**
         * @return detector clipped stamp window.
         */
        public PixelWindow getWindow() {
            return window;
        }

        public double getStampSum() {
            return stampSum;
        }
    }

    public static final JsonUtils.Helper<PsfInfo> JSON_HELPER = new JsonUtils.Helper<>(PsfInfo.class);

    private static final Logger LOG = LoggerFactory.getLogger(PsfInfoClient.class);
}
