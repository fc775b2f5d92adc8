package org.janelia.psf.client;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.List;

import org.janelia.psf.SpotGridPsf;
import org.janelia.psf.calibration.SpotGridCalibrationWriter;
import org.janelia.psf.calibration.SyntheticCalibration;
import org.janelia.psf.client.parameter.CommandLineParameters;
import org.janelia.psf.spec.XYRange;
import org.janelia.psf.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link PsfInfoClient} class.
 *
 * @author Eric Trautman
 */
public class PsfInfoClientTest {

    private File testDirectory;
    private String calibrationPath;

    @Before
    public void setup() throws Exception {
        final SimpleDateFormat sdf = new SimpleDateFormat("'test_psf_info_'yyyyMMdd_HHmmss_SSS");
        testDirectory = Paths.get(sdf.format(new Date())).toAbsolutePath().toFile();
        calibrationPath = new File(testDirectory, "calibration.n5").getAbsolutePath();
        new SpotGridCalibrationWriter().write(SyntheticCalibration.build(8, 11, 200), calibrationPath);
    }

    @After
    public void tearDown() {
        if (testDirectory.exists()) {
            FileUtil.deleteRecursive(testDirectory);
        }
    }

    @Test
    public void testParameterParsing() {
        CommandLineParameters.parseHelp(new PsfInfoClient.Parameters());
    }

    @Test
    public void testDescribeDefaultWavelengths() {
        final PsfInfoClient.Parameters parameters = parse("--spectrum", "2");

        final PsfInfoClient.PsfInfo info = new PsfInfoClient(parameters).describe();

        Assert.assertEquals("invalid spectrum", 2, info.getSpectrum());
        Assert.assertEquals("invalid nspec", 8, info.getNspec());
        Assert.assertNull("bounding box should not be included", info.getXyrange());

        final List<PsfInfoClient.WavelengthInfo> wavelengths = info.getWavelengths();
        Assert.assertEquals("invalid number of wavelengths", 3, wavelengths.size());
        Assert.assertEquals("invalid first wavelength",
                            SyntheticCalibration.WAVELENGTH_MIN, wavelengths.get(0).getWavelength(), 0.0);
        Assert.assertEquals("invalid middle wavelength", 5500.0, wavelengths.get(1).getWavelength(), 0.0);

        final SpotGridPsf psf = SpotGridPsf.load(calibrationPath);
        for (final PsfInfoClient.WavelengthInfo wavelengthInfo : wavelengths) {
            final double w = wavelengthInfo.getWavelength();
            Assert.assertTrue("wavelength " + w + " should be in band", wavelengthInfo.isInBand());
            Assert.assertEquals("invalid x for " + w, psf.x(2, w), wavelengthInfo.getX(), 0.0);
            Assert.assertEquals("invalid y for " + w, psf.y(2, w), wavelengthInfo.getY(), 0.0);
            Assert.assertEquals("invalid xSigma for " + w, psf.xsigma(2, w), wavelengthInfo.getXSigma(), 0.0);
            Assert.assertEquals("invalid stamp sum for " + w, 1.0, wavelengthInfo.getStampSum(), 1.0e-9);
            Assert.assertEquals("invalid window for " + w,
                                psf.xypix(2, w).getWindow(), wavelengthInfo.getWindow());
        }
    }

    @Test
    public void testDescribeWithBoundingBoxAndWrite() throws Exception {
        final String outPath = new File(testDirectory, "info.json").getAbsolutePath();
        final PsfInfoClient.Parameters parameters = parse("--spectrum", "1",
                                                          "--wavelength", "5100", "5300", "6100",
                                                          "--xyrangeSpecMax", "4",
                                                          "--out", outPath);

        final PsfInfoClient client = new PsfInfoClient(parameters);
        final PsfInfoClient.PsfInfo info = client.describe();

        final List<PsfInfoClient.WavelengthInfo> wavelengths = info.getWavelengths();
        Assert.assertEquals("invalid number of wavelengths", 3, wavelengths.size());

        final PsfInfoClient.WavelengthInfo outOfBand = wavelengths.get(2);
        Assert.assertFalse("6100 should be out of band", outOfBand.isInBand());
        Assert.assertNull("out of band xSigma should be omitted", outOfBand.getXSigma());
        Assert.assertEquals("out of band stamp should be empty", 0.0, outOfBand.getStampSum(), 0.0);

        final SpotGridPsf psf = SpotGridPsf.load(calibrationPath);
        final XYRange expectedRange = psf.xyrange(1, 4, new double[] { 5100.0, 5300.0, 6100.0 });
        Assert.assertEquals("invalid bounding box", expectedRange, info.getXyrange());
        Assert.assertTrue("last requested fiber should be inside bounding box",
                          psf.xypix(4, 5300.0).getWindow().isWithin(info.getXyrange()));

        client.describeAndWrite();

        final String json = new String(Files.readAllBytes(Paths.get(outPath)), StandardCharsets.UTF_8);
        Assert.assertTrue("window should be written as a bounds array",
                          json.replaceAll("\\s", "").contains("\"xyrange\":[" + expectedRange.getXMin() + ","));

        final PsfInfoClient.PsfInfo loadedInfo = PsfInfoClient.JSON_HELPER.readFile(outPath);

        Assert.assertEquals("invalid loaded calibration", calibrationPath, loadedInfo.getCalibration());
        Assert.assertEquals("invalid loaded wavelength count", 3, loadedInfo.getWavelengths().size());
        Assert.assertEquals("invalid loaded wdisp",
                            wavelengths.get(1).getWavelengthDispersion(),
                            loadedInfo.getWavelengths().get(1).getWavelengthDispersion());
        Assert.assertEquals("invalid loaded bounding box", expectedRange, loadedInfo.getXyrange());
        Assert.assertEquals("invalid loaded window",
                                 wavelengths.get(0).getWindow(),
                                 loadedInfo.getWavelengths().get(0).getWindow());
    }

    private PsfInfoClient.Parameters parse(final String... additionalArgs) {
        final String[] args = new String[additionalArgs.length + 2];
        args[0] = "--calibration";
        args[1] = calibrationPath;
        System.arraycopy(additionalArgs, 0, args, 2, additionalArgs.length);

        final PsfInfoClient.Parameters parameters = new PsfInfoClient.Parameters();
        if (! parameters.parse(args, PsfInfoClient.class, false)) {
            throw new IllegalArgumentException("failed to parse arguments");
        }
        return parameters;
    }
}
