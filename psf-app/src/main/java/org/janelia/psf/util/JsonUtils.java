package org.janelia.psf.util;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import org.janelia.psf.spec.PixelWindow;
import org.janelia.psf.spec.XYRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON mapping for reports and command line parameters.
 *
 * Fields are serialized directly (getters are ignored).
 * {@link PixelWindow} and {@link XYRange} instances are written as
 * [xMin, xMax, yMin, yMax] arrays with exclusive max values.
 *
 * @author Eric Trautman
 */
public class JsonUtils {

    /** Compact mapper for log messages. */
    public static final ObjectMapper FAST_MAPPER = buildMapper();

    /** Indented mapper for files. */
    public static final ObjectMapper MAPPER = FAST_MAPPER.copy().enable(SerializationFeature.INDENT_OUTPUT);

    private static ObjectMapper buildMapper() {

        final SimpleModule detectorModule = new SimpleModule("DetectorBoundsModule");
        detectorModule.addSerializer(PixelWindow.class, new BoundsSerializer<>(PixelWindow.class) {
            @Override
            int[] toBounds(final PixelWindow window) {
                return new int[] { window.getXStart(), window.getXStop(), window.getYStart(), window.getYStop() };
            }
        });
        detectorModule.addSerializer(XYRange.class, new BoundsSerializer<>(XYRange.class) {
            @Override
            int[] toBounds(final XYRange range) {
                return new int[] { range.getXMin(), range.getXMax(), range.getYMin(), range.getYMax() };
            }
        });
        detectorModule.addDeserializer(PixelWindow.class, new BoundsDeserializer<>(PixelWindow.class) {
            @Override
            PixelWindow fromBounds(final int[] b) {
                return new PixelWindow(b[0], b[1], b[2], b[3]);
            }
        });
        detectorModule.addDeserializer(XYRange.class, new BoundsDeserializer<>(XYRange.class) {
            @Override
            XYRange fromBounds(final int[] b) {
                return new XYRange(b[0], b[1], b[2], b[3]);
            }
        });

        return new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
                .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .registerModule(detectorModule);
    }

    /**
     * Reads and writes one type of value.
     */
    public static class Helper<T> {

        private final ObjectMapper mapper;
        private final Class<T> valueType;

        public Helper(final Class<T> valueType) {
            this.mapper = MAPPER;
            this.valueType = valueType;
        }

        public String toJson(final T value)
                throws IllegalArgumentException {
            try {
                return mapper.writeValueAsString(value);
            } catch (final IOException e) {
                throw new IllegalArgumentException("failed to serialize " + valueType.getSimpleName(), e);
            }
        }

        public T fromJson(final String json)
                throws IllegalArgumentException {
            try {
                return mapper.readValue(json, valueType);
            } catch (final IOException e) {
                throw new IllegalArgumentException("failed to parse " + valueType.getSimpleName(), e);
            }
        }

        /**
         * Writes the value to the specified path, creating parent directories as needed.
         *
         * @return the written file.
         */
        public File writeFile(final T value,
                              final String path)
                throws IOException {
            final File file = DetectorImageUtil.prepareFileForWrite(path);
            mapper.writeValue(file, value);
            LOG.info("writeFile: saved {}", file.getAbsolutePath());
            return file;
        }

        public T readFile(final String path)
                throws IOException {
            return mapper.readValue(new File(path), valueType);
        }

    }

    private abstract static class BoundsSerializer<T> extends StdSerializer<T> {

        BoundsSerializer(final Class<T> type) {
            super(type);
        }

        abstract int[] toBounds(final T value);

        @Override
        public void serialize(final T value,
                              final JsonGenerator generator,
                              final SerializerProvider provider)
                throws IOException {
            final int[] bounds = toBounds(value);
            generator.writeArray(bounds, 0, bounds.length);
        }
    }

    private abstract static class BoundsDeserializer<T> extends StdDeserializer<T> {

        BoundsDeserializer(final Class<T> type) {
            super(type);
        }

        abstract T fromBounds(final int[] bounds);

        @Override
        public T deserialize(final JsonParser parser,
                             final DeserializationContext context)
                throws IOException {
            final int[] bounds = context.readValue(parser, int[].class);
            if ((bounds == null) || (bounds.length != 4)) {
                throw JsonMappingException.from(parser, "expected [xMin, xMax, yMin, yMax] for " +
                                                        handledType().getSimpleName() + " but found " +
                                                        Arrays.toString(bounds));
            }
            try {
                return fromBounds(bounds);
            } catch (final IllegalArgumentException e) {
                throw JsonMappingException.from(parser, e.getMessage(), e);
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(JsonUtils.class);
}
