package com.github.provjsonld.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.github.provjsonld.core.ProvJsonLdError.Error;
import com.github.provjsonld.utils.JSONUtils;

/**
 * Entry points of the PROV-JSON to PROV-JSONLD conversion.
 * <p>
 * Each call runs on its own {@link ProvJsonLdApi} and on a copy of the
 * options, so concurrent conversions are independent.
 */
public class ProvJsonLdProcessor {

    /**
     * Converts an already parsed PROV-JSON document (as produced by
     * {@link JSONUtils}: maps, lists, strings, numbers, booleans).
     *
     * @param input
     *            the PROV-JSON document
     * @param opts
     *            conversion options, null for the defaults
     * @return the PROV-JSONLD document and the warnings of the conversion
     * @throws ProvJsonLdError
     *             if the input is not a PROV-JSON document or holds a fatal
     *             defect
     */
    public static ConversionResult convert(Object input, ProvJsonLdOptions opts)
            throws ProvJsonLdError {
        final ProvJsonLdOptions copy = opts == null ? new ProvJsonLdOptions() : opts.clone();
        return new ProvJsonLdApi(copy).convert(input);
    }

    public static ConversionResult convert(Object input) throws ProvJsonLdError {
        return convert(input, null);
    }

    public static ConversionResult fromProvJson(String json, ProvJsonLdOptions opts)
            throws ProvJsonLdError {
        final Object input;
        try {
            input = JSONUtils.fromString(json);
        } catch (final JsonProcessingException e) {
            throw new ProvJsonLdError(Error.PARSE_ERROR, "input is not well-formed JSON: "
                    + e.getOriginalMessage(), e);
        }
        return convert(input, opts);
    }

    public static ConversionResult fromProvJson(Reader reader, ProvJsonLdOptions opts)
            throws ProvJsonLdError {
        return convert(read(reader), opts);
    }

    public static ConversionResult fromProvJson(InputStream in, ProvJsonLdOptions opts)
            throws ProvJsonLdError {
        final Object input;
        try {
            input = JSONUtils.fromInputStream(in);
        } catch (final JsonProcessingException e) {
            throw new ProvJsonLdError(Error.PARSE_ERROR, "input is not well-formed JSON: "
                    + e.getOriginalMessage(), e);
        } catch (final IOException e) {
            throw new ProvJsonLdError(Error.IO_ERROR, "cannot read input: " + e.getMessage(), e);
        }
        return convert(input, opts);
    }

    private static Object read(Reader reader) throws ProvJsonLdError {
        try {
            return JSONUtils.fromReader(reader);
        } catch (final JsonProcessingException e) {
            throw new ProvJsonLdError(Error.PARSE_ERROR, "input is not well-formed JSON: "
                    + e.getOriginalMessage(), e);
        } catch (final IOException e) {
            throw new ProvJsonLdError(Error.IO_ERROR, "cannot read input: " + e.getMessage(), e);
        }
    }
}
