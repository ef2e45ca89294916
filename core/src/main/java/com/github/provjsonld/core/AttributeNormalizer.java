package com.github.provjsonld.core;

import static com.github.provjsonld.core.ProvJsonLdUtils.isArray;
import static com.github.provjsonld.core.ProvJsonLdUtils.isObject;
import static com.github.provjsonld.core.ProvJsonLdUtils.isString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.provjsonld.core.ProvJsonLdError.Error;
import com.github.provjsonld.utils.JSONUtils;

/**
 * Turns PROV-JSON attribute values into JSON-LD values.
 * <p>
 * <pre>
 * {"$": "12.5", "type": "xsd:float"}  ->  {"@value": "12.5", "@type": "xsd:float"}
 * {"$": "bonjour", "lang": "fr"}      ->  {"@value": "bonjour", "@language": "fr"}
 * 42, true, "text"                    ->  unchanged
 * </pre>
 * Arrays hold several values of one attribute and are normalized member by
 * member.
 */
class AttributeNormalizer {

    private final ProvJsonLdApi api;

    AttributeNormalizer(ProvJsonLdApi api) {
        this.api = api;
    }

    /**
     * Checks an attribute key. PROV keys are kept, other qualified keys must
     * resolve in the active context. Unqualified keys are only accepted when
     * a default namespace is declared. JSON-LD keywords are never attributes.
     *
     * @return the key to emit, or null if the attribute is dropped
     */
    String normalizeKey(Context activeCtx, String key, RecordPath path) throws ProvJsonLdError {
        if (key.startsWith("@")) {
            api.warn(Error.UNQUALIFIED_ATTRIBUTE, path.withField(key), "attribute '" + key
                    + "' is a JSON-LD keyword; dropped");
            return null;
        }
        final QualifiedName qname = QualifiedName.parse(key);
        if (ProvJsonLdConsts.PROV.equals(qname.getPrefix())) {
            return key;
        }
        if (qname.getPrefix() == null
                && !activeCtx.containsKey(ProvJsonLdConsts.DEFAULT_PREFIX)) {
            api.warn(Error.UNQUALIFIED_ATTRIBUTE, path.withField(key), "attribute '" + key
                    + "' has no prefix and no default namespace is declared; dropped");
            return null;
        }
        api.resolveName(activeCtx, key, path.withField(key));
        return key;
    }

    /**
     * Normalizes the value of one attribute.
     *
     * @param activeCtx
     *            context resolving datatypes and qualified name literals
     * @param value
     *            the PROV-JSON value
     * @param path
     *            the attribute being normalized
     * @return the JSON-LD value
     */
    @SuppressWarnings("unchecked")
    Object normalize(Context activeCtx, Object value, RecordPath path) throws ProvJsonLdError {
        if (isArray(value)) {
            final List<Object> rval = new ArrayList<Object>();
            for (final Object item : (List<Object>) value) {
                rval.add(normalize(activeCtx, item, path));
            }
            return rval;
        }
        if (isObject(value)) {
            return normalizeLiteral(activeCtx, (Map<String, Object>) value, path);
        }
        return value;
    }

    private Object normalizeLiteral(Context activeCtx, Map<String, Object> literal,
            RecordPath path) throws ProvJsonLdError {
        final boolean hasValue = literal.containsKey(ProvJsonLdConsts.LITERAL_VALUE);
        final boolean hasType = literal.containsKey(ProvJsonLdConsts.LITERAL_TYPE);
        final boolean hasLang = literal.containsKey(ProvJsonLdConsts.LITERAL_LANG);
        final Object lexical = literal.get(ProvJsonLdConsts.LITERAL_VALUE);

        if (hasType && hasLang) {
            return malformed(literal, path, "both a datatype and a language tag");
        }
        if (!hasValue) {
            return malformed(literal, path, hasType || hasLang ? "no literal form ('$')"
                    : "neither a literal form nor a datatype or language");
        }
        if (!hasType && !hasLang) {
            return lexical;
        }

        final Map<String, Object> rval = new LinkedHashMap<String, Object>();
        rval.put(ProvJsonLdConsts.VALUE, lexical);
        if (hasType) {
            final Object datatype = literal.get(ProvJsonLdConsts.LITERAL_TYPE);
            if (!isString(datatype)) {
                return malformed(literal, path, "a datatype that is not a string");
            }
            api.resolveName(activeCtx, (String) datatype, path);
            if (isQualifiedNameType((String) datatype) && isString(lexical)) {
                api.resolveName(activeCtx, (String) lexical, path);
            }
            rval.put(ProvJsonLdConsts.TYPE, datatype);
        } else {
            final Object language = literal.get(ProvJsonLdConsts.LITERAL_LANG);
            if (!isString(language)) {
                return malformed(literal, path, "a language tag that is not a string");
            }
            rval.put(ProvJsonLdConsts.LANGUAGE, language);
        }
        return rval;
    }

    private Object malformed(Map<String, Object> literal, RecordPath path, String problem)
            throws ProvJsonLdError {
        api.warn(Error.MALFORMED_ATTRIBUTE, path, "value " + JSONUtils.toString(literal)
                + " has " + problem + "; emitted as a plain value");
        if (literal.containsKey(ProvJsonLdConsts.LITERAL_VALUE)) {
            return literal.get(ProvJsonLdConsts.LITERAL_VALUE);
        }
        return JSONUtils.toString(literal);
    }

    private static boolean isQualifiedNameType(String datatype) {
        return ProvJsonLdConsts.PROV_QUALIFIED_NAME.equals(datatype)
                || ProvJsonLdConsts.XSD_QNAME.equals(datatype);
    }
}
