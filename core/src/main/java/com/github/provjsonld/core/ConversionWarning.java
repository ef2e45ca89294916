package com.github.provjsonld.core;

import com.github.provjsonld.core.ProvJsonLdError.Error;

/**
 * A recoverable condition met during a conversion. The affected record or
 * attribute was skipped or emitted in a best-effort form.
 */
public final class ConversionWarning {

    private final Error type;
    private final RecordPath path;
    private final String message;

    public ConversionWarning(Error type, RecordPath path, String message) {
        this.type = type;
        this.path = path;
        this.message = message;
    }

    public Error getType() {
        return type;
    }

    public RecordPath getPath() {
        return path;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Turns this warning into the error thrown when the options ask for a
     * strict conversion.
     */
    public ProvJsonLdError toError() {
        return new ProvJsonLdError(type, message, path);
    }

    @Override
    public String toString() {
        return type + " at " + path + ": " + message;
    }
}
