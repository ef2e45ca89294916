package com.github.provjsonld.core;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.github.provjsonld.core.ProvJsonLdError.Error;

/**
 * Outcome of a successful conversion: the PROV-JSONLD document and the
 * warnings collected while building it.
 */
public final class ConversionResult {

    private final Map<String, Object> document;
    private final List<ConversionWarning> warnings;

    ConversionResult(Map<String, Object> document, List<ConversionWarning> warnings) {
        this.document = document;
        this.warnings = Collections.unmodifiableList(warnings);
    }

    /**
     * @return the {@code {"@context": ..., "@graph": ...}} object
     */
    public Map<String, Object> getDocument() {
        return document;
    }

    @SuppressWarnings("unchecked")
    public List<Object> getGraph() {
        return (List<Object>) document.get(ProvJsonLdConsts.GRAPH);
    }

    public List<ConversionWarning> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean hasWarning(Error type) {
        for (final ConversionWarning warning : warnings) {
            if (warning.getType() == type) {
                return true;
            }
        }
        return false;
    }
}
