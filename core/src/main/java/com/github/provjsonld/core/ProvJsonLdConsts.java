package com.github.provjsonld.core;

/**
 * Keywords of the two serializations handled by the converter.
 */
public final class ProvJsonLdConsts {

    public static final String DEFAULT_CONTEXT_URL = "https://openprovenance.org/prov-jsonld/context.json";

    // JSON-LD keywords
    public static final String CONTEXT = "@context";
    public static final String GRAPH = "@graph";
    public static final String ID = "@id";
    public static final String TYPE = "@type";
    public static final String VALUE = "@value";
    public static final String LANGUAGE = "@language";

    // PROV-JSON top-level keys
    public static final String PREFIX = "prefix";
    public static final String BUNDLE = "bundle";
    public static final String DEFAULT_PREFIX = "default";

    // PROV-JSON literal markers
    public static final String LITERAL_VALUE = "$";
    public static final String LITERAL_TYPE = "type";
    public static final String LITERAL_LANG = "lang";

    public static final String BLANK_PREFIX = "_";

    // prefixes declared by the canonical PROV-JSONLD context
    public static final String PROV = "prov";
    public static final String PROVEXT = "provext";
    public static final String XSD = "xsd";

    public static final String PROV_BUNDLE = "prov:Bundle";
    public static final String PROV_START_TIME = "prov:startTime";
    public static final String PROV_END_TIME = "prov:endTime";
    public static final String START_TIME = "startTime";
    public static final String END_TIME = "endTime";

    public static final String PROV_QUALIFIED_NAME = "prov:QUALIFIED_NAME";
    public static final String XSD_QNAME = "xsd:QName";

    private ProvJsonLdConsts() {
    }
}
