package org.janelia.psf.util;

import com.fasterxml.jackson.databind.JsonMappingException;

import org.janelia.psf.spec.PixelWindow;
import org.janelia.psf.spec.XYRange;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link JsonUtils} class.
 *
 * @author Eric Trautman
 */
public class JsonUtilsTest {

    @Test
    public void testBoundsArrays() throws Exception {

        Assert.assertEquals("invalid window json",
                            "[3,7,10,25]",
                            JsonUtils.FAST_MAPPER.writeValueAsString(new PixelWindow(3, 7, 10, 25)));

        final XYRange range = JsonUtils.FAST_MAPPER.readValue("[0,12,4,4]", XYRange.class);
        Assert.assertEquals("invalid range", new XYRange(0, 12, 4, 4), range);
    }

    @Test
    public void testInvalidBounds() {
        for (final String json : new String[] { "[1,2,3]", "[5,4,0,1]" }) {
            try {
                JsonUtils.FAST_MAPPER.readValue(json, PixelWindow.class);
                Assert.fail("window " + json + " should have been rejected");
            } catch (final Exception e) {
                Assert.assertTrue("unexpected exception type " + e.getClass(),
                                  e instanceof JsonMappingException);
            }
        }
    }
}
