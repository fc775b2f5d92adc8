package org.janelia.psf.client;

import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;
import java.text.SimpleDateFormat;
import java.util.Date;

import org.janelia.psf.SpotGridPsf;
import org.janelia.psf.client.parameter.CommandLineParameters;
import org.janelia.psf.util.FileUtil;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link SyntheticCalibrationClient} class.
 *
 * @author Eric Trautman
 */
public class SyntheticCalibrationClientTest {

    private File testDirectory;

    @Before
    public void setup() {
        final SimpleDateFormat sdf = new SimpleDateFormat("'test_synthetic_'yyyyMMdd_HHmmss_SSS");
        testDirectory = Paths.get(sdf.format(new Date())).toAbsolutePath().toFile();
    }

    @After
    public void tearDown() {
        if (testDirectory.exists()) {
            FileUtil.deleteRecursive(testDirectory);
        }
    }

    @Test
    public void testParameterParsing() {
        CommandLineParameters.parseHelp(new SyntheticCalibrationClient.Parameters());
    }

    @Test
    public void testDefaults() {
        final SyntheticCalibrationClient.Parameters parameters = new SyntheticCalibrationClient.Parameters();
        final boolean parsed = parameters.parse(new String[] { "--out", "synthetic.n5", "--nspec", "40" },
                                                SyntheticCalibrationClient.class,
                                                false);
        Assert.assertTrue("arguments should have been parsed", parsed);
        Assert.assertEquals("invalid nspec", 40, parameters.nspec);
        Assert.assertEquals("invalid default nwave", 11, parameters.nwave);
        Assert.assertEquals("invalid default npixY", 400, parameters.npixY);
    }

    @Test
    public void testMissingRequiredParameter() {
        final SyntheticCalibrationClient.Parameters parameters = new SyntheticCalibrationClient.Parameters();
        Assert.assertFalse("missing --out should fail",
                           parameters.parse(new String[] { "--nspec", "3" }, SyntheticCalibrationClient.class, false));
    }

    @Test
    public void testInvalidSizes() {
        final SyntheticCalibrationClient.Parameters parameters = new SyntheticCalibrationClient.Parameters();
        Assert.assertFalse("too few wavelength samples should fail",
                           parameters.parse(new String[] { "--out", "synthetic.n5", "--nwave", "2" },
                                            SyntheticCalibrationClient.class,
                                            false));
    }

    @Test
    public void testWriteAndOverwrite() throws Exception {
        final String outPath = new File(testDirectory, "synthetic.n5").getAbsolutePath();

        final SyntheticCalibrationClient.Parameters parameters = new SyntheticCalibrationClient.Parameters();
        parameters.parse(new String[] { "--out", outPath, "--nspec", "3", "--nwave", "5", "--npixY", "60" },
                         SyntheticCalibrationClient.class,
                         false);

        SyntheticCalibrationClient.writeCalibration(parameters);
        Assert.assertEquals("invalid nspec after first write", 3, SpotGridPsf.load(outPath).getNspec());

        try {
            SyntheticCalibrationClient.writeCalibration(parameters);
            Assert.fail("existing container should not be replaced without --overwrite");
        } catch (final IOException e) {
            Assert.assertTrue("message should mention option", e.getMessage().contains("--overwrite"));
        }

        parameters.overwrite = true;
        parameters.nspec = 2;
        SyntheticCalibrationClient.writeCalibration(parameters);
        Assert.assertEquals("invalid nspec after overwrite", 2, SpotGridPsf.load(outPath).getNspec());
    }
}
