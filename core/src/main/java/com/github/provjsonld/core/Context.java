package com.github.provjsonld.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.github.provjsonld.core.ProvJsonLdError.Error;

/**
 * The prefix table of one document scope. Stores the local prefix
 * declarations in a map (declaration order) and resolves qualified names
 * against them.
 * <p>
 * A bundle declaring its own {@code prefix} gets a fresh table; a bundle
 * without one shares the table of its parent.
 */
public class Context extends LinkedHashMap<String, String> {

    private static final long serialVersionUID = 1L;

    /** Prefixes declared by the canonical PROV-JSONLD context. */
    private static final Set<String> PREDEFINED = Collections.unmodifiableSet(new HashSet<String>(
            Arrays.asList(ProvJsonLdConsts.PROV, ProvJsonLdConsts.PROVEXT, ProvJsonLdConsts.XSD)));

    private final ProvJsonLdOptions options;
    private boolean declared;

    public Context(ProvJsonLdOptions options) {
        super();
        this.options = options;
        this.declared = false;
    }

    /**
     * Prefix processing. Returns the context of a document whose
     * {@code prefix} member is {@code prefixes}: this context if the member
     * is absent, a new one holding exactly the given declarations otherwise.
     *
     * @param prefixes
     *            the {@code prefix} member, possibly null
     * @param path
     *            scope being processed, for error reporting
     * @return the active context of the scope
     * @throws ProvJsonLdError
     *             if the member is not an object of strings
     */
    @SuppressWarnings("unchecked")
    public Context parse(Object prefixes, RecordPath path) throws ProvJsonLdError {
        if (prefixes == null) {
            return this;
        }
        final RecordPath prefixPath = path.withKind(ProvJsonLdConsts.PREFIX);
        if (!(prefixes instanceof Map)) {
            throw new ProvJsonLdError(Error.PARSE_ERROR, "prefix declarations must be an object",
                    prefixPath);
        }
        final Context result = new Context(options);
        result.declared = true;
        for (final Map.Entry<String, Object> entry : ((Map<String, Object>) prefixes).entrySet()) {
            if (!(entry.getValue() instanceof String)) {
                throw new ProvJsonLdError(Error.PARSE_ERROR, "namespace IRI must be a string",
                        prefixPath.withIdentifier(entry.getKey()));
            }
            result.put(entry.getKey(), (String) entry.getValue());
        }
        return result;
    }

    /**
     * @return true if this context was built from a {@code prefix} member
     *         rather than inherited or empty
     */
    public boolean isDeclared() {
        return declared;
    }

    public boolean isPrefixDefined(String prefix) {
        return PREDEFINED.contains(prefix) || containsKey(prefix);
    }

    /**
     * Checks that a qualified name can be expanded in this context.
     *
     * @param name
     *            the name as written in the input
     * @param path
     *            where the name occurs
     * @return the parsed name
     * @throws ProvJsonLdError
     *             {@link Error#PREFIX_RESOLUTION_ERROR} if its prefix is not
     *             declared
     */
    public QualifiedName resolve(String name, RecordPath path) throws ProvJsonLdError {
        final QualifiedName qname = QualifiedName.parse(name);
        if (qname.isBlank() || qname.isAbsoluteIri()) {
            return qname;
        }
        if (qname.getPrefix() == null) {
            if (!containsKey(ProvJsonLdConsts.DEFAULT_PREFIX)) {
                throw new ProvJsonLdError(Error.PREFIX_RESOLUTION_ERROR, "unprefixed name '" + name
                        + "' but no default namespace is declared", path);
            }
            return qname;
        }
        if (!isPrefixDefined(qname.getPrefix())) {
            throw new ProvJsonLdError(Error.PREFIX_RESOLUTION_ERROR, "undeclared prefix '"
                    + qname.getPrefix() + "' in name '" + name + "'", path);
        }
        return qname;
    }

    /**
     * Builds the {@code @context} value of the scope: the local declarations
     * (when there are any) followed by the canonical context URL.
     */
    public List<Object> serialize() {
        final List<Object> rval = new ArrayList<Object>();
        if (!isEmpty()) {
            rval.add(new LinkedHashMap<String, Object>(this));
        }
        rval.add(options.getContextUrl());
        return rval;
    }
}
