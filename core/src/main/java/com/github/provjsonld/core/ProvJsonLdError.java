package com.github.provjsonld.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal failure of a conversion. The details carry the path of the
 * offending record (bundle, kind, identifier, field) when one is known.
 */
public class ProvJsonLdError extends Exception {

    private static final long serialVersionUID = 1L;

    private final Map<String, Object> details = new LinkedHashMap<String, Object>();
    private Error type;

    public ProvJsonLdError(Error type, String message) {
        super(message);
        this.type = type;
    }

    public ProvJsonLdError(Error type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public ProvJsonLdError(Error type, String message, RecordPath path) {
        this(type, message);
        setPath(path);
    }

    public ProvJsonLdError setDetail(String key, Object val) {
        details.put(key, val);
        return this;
    }

    public ProvJsonLdError setPath(RecordPath path) {
        if (path != null) {
            details.putAll(path.toDetails());
        }
        return this;
    }

    public enum Error {
        PARSE_ERROR, PREFIX_RESOLUTION_ERROR, MALFORMED_ATTRIBUTE, UNQUALIFIED_ATTRIBUTE,
        ATTRIBUTE_COLLISION, DUPLICATE_IDENTIFIER, UNKNOWN_RELATION_KIND, UNKNOWN_ELEMENT_KIND,
        DANGLING_REFERENCE, IO_ERROR
    }

    public ProvJsonLdError setType(Error error) {
        this.type = error;
        return this;
    }

    public Error getType() {
        return type;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String getMessage() {
        String msg = type + ": " + super.getMessage();
        for (final String key : details.keySet()) {
            msg += " {" + key + ":" + details.get(key) + "}";
        }
        return msg;
    }
}
