package com.github.provjsonld.utils;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * A bunch of functions to make loading and writing JSON easy. Objects are
 * read as {@link java.util.LinkedHashMap}s, so member order survives; a
 * repeated member name is an error. Decimal numbers are read as
 * {@link java.math.BigDecimal}s and written back unchanged.
 */
public class JSONUtils {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static {
        MAPPER.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        MAPPER.getFactory().enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
        MAPPER.getFactory().enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
        MAPPER.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        MAPPER.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    public static Object fromString(String jsonString) throws JsonProcessingException {
        return MAPPER.readValue(jsonString, Object.class);
    }

    public static Object fromReader(Reader r) throws IOException {
        return MAPPER.readValue(r, Object.class);
    }

    public static Object fromInputStream(InputStream content) throws IOException {
        // no readers from inputstreams without an encoding
        return fromReader(new InputStreamReader(content, StandardCharsets.UTF_8));
    }

    public static void write(Writer w, Object jsonObject) throws IOException {
        MAPPER.writeValue(w, jsonObject);
    }

    public static void writePrettyPrint(Writer w, Object jsonObject) throws IOException {
        final ObjectWriter objectWriter = MAPPER.writerWithDefaultPrettyPrinter();
        objectWriter.writeValue(w, jsonObject);
    }

    public static String toPrettyString(Object obj) {
        final StringWriter sw = new StringWriter();
        try {
            writePrettyPrint(sw, obj);
        } catch (final IOException e) {
            // a StringWriter does not fail, the value is not serializable
            throw new IllegalArgumentException("cannot serialize " + obj, e);
        }
        return sw.toString();
    }

    public static String toString(Object obj) {
        final StringWriter sw = new StringWriter();
        try {
            write(sw, obj);
        } catch (final IOException e) {
            throw new IllegalArgumentException("cannot serialize " + obj, e);
        }
        return sw.toString();
    }
}
