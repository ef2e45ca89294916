package com.github.provjsonld.core;

/**
 * Settings of a PROV-JSON to PROV-JSONLD conversion.
 * <p>
 * The processor works on a {@link #clone()} of the instance it is given, so
 * changing an options object never affects a conversion already running.
 */
public class ProvJsonLdOptions implements Cloneable {

    public ProvJsonLdOptions() {
        this.setContextUrl(ProvJsonLdConsts.DEFAULT_CONTEXT_URL);
    }

    public ProvJsonLdOptions(String contextUrl) {
        this.setContextUrl(contextUrl);
    }

    private String contextUrl = null;
    private boolean strict = false;
    private boolean lenientPrefixes = false;
    private boolean typedBundles = false;
    private boolean checkReferences = false;

    @Override
    public ProvJsonLdOptions clone() {
        final ProvJsonLdOptions rval = new ProvJsonLdOptions(getContextUrl());
        rval.setStrict(isStrict());
        rval.setLenientPrefixes(isLenientPrefixes());
        rval.setTypedBundles(isTypedBundles());
        rval.setCheckReferences(isCheckReferences());
        return rval;
    }

    /**
     * URL of the canonical PROV-JSONLD context, always the last entry of
     * every emitted {@code @context}. It is referenced, never fetched.
     */
    public String getContextUrl() {
        return contextUrl;
    }

    public ProvJsonLdOptions setContextUrl(String contextUrl) {
        if (contextUrl == null || contextUrl.isEmpty()) {
            throw new IllegalArgumentException("context URL must not be empty");
        }
        this.contextUrl = contextUrl;
        return this;
    }

    /**
     * When set, every recoverable condition (malformed attribute, unknown
     * record kind, ...) aborts the conversion instead of producing a warning.
     */
    public boolean isStrict() {
        return strict;
    }

    public ProvJsonLdOptions setStrict(boolean strict) {
        this.strict = strict;
        return this;
    }

    /**
     * When set, names using an undeclared prefix are emitted verbatim with a
     * warning. Ignored in strict mode.
     */
    public boolean isLenientPrefixes() {
        return lenientPrefixes;
    }

    public ProvJsonLdOptions setLenientPrefixes(boolean lenientPrefixes) {
        this.lenientPrefixes = lenientPrefixes;
        return this;
    }

    /**
     * Adds {@code "@type": "prov:Bundle"} to the named graph of each bundle.
     */
    public boolean isTypedBundles() {
        return typedBundles;
    }

    public ProvJsonLdOptions setTypedBundles(boolean typedBundles) {
        this.typedBundles = typedBundles;
        return this;
    }

    /**
     * Reports role values naming no node of the enclosing scopes.
     */
    public boolean isCheckReferences() {
        return checkReferences;
    }

    public ProvJsonLdOptions setCheckReferences(boolean checkReferences) {
        this.checkReferences = checkReferences;
        return this;
    }
}
