package com.github.provjsonld.core;

import static com.github.provjsonld.core.ProvJsonLdUtils.addValue;
import static com.github.provjsonld.core.ProvJsonLdUtils.hasValue;
import static com.github.provjsonld.core.ProvJsonLdUtils.isArray;
import static com.github.provjsonld.core.ProvJsonLdUtils.isObject;
import static com.github.provjsonld.core.ProvJsonLdUtils.isString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.provjsonld.core.ProvJsonLdError.Error;

/**
 * The conversion algorithm. An instance converts one document: it holds the
 * warnings and the identifier counters of that conversion and must not be
 * reused or shared between threads.
 */
public class ProvJsonLdApi {

    private static final Logger LOG = LoggerFactory.getLogger(ProvJsonLdApi.class);

    private final ProvJsonLdOptions opts;
    private final AttributeNormalizer normalizer;
    private final List<ConversionWarning> warnings = new ArrayList<ConversionWarning>();

    /**
     * Counters of the relation identifier synthesis, one per kind.
     */
    private final Map<RelationKind, Integer> identifierCounters = new EnumMap<RelationKind, Integer>(
            RelationKind.class);

    public ProvJsonLdApi() {
        this(new ProvJsonLdOptions());
    }

    public ProvJsonLdApi(ProvJsonLdOptions opts) {
        this.opts = opts == null ? new ProvJsonLdOptions() : opts;
        this.normalizer = new AttributeNormalizer(this);
    }

    /**
     * Graph assembly.
     *
     * @param input
     *            the parsed PROV-JSON document
     * @return the PROV-JSONLD document with the warnings collected
     * @throws ProvJsonLdError
     *             on the first fatal condition
     */
    public ConversionResult convert(Object input) throws ProvJsonLdError {
        if (input == null) {
            throw new ProvJsonLdError(Error.PARSE_ERROR, "no PROV-JSON document", RecordPath.ROOT);
        }
        final Map<String, Object> document = asRecord(input, RecordPath.ROOT,
                "a PROV-JSON document must be an object");

        // 1) prefix resolution, once for the top-level scope
        final Context activeCtx = new Context(opts).parse(document.get(ProvJsonLdConsts.PREFIX),
                RecordPath.ROOT);

        // 2) elements, relations and bundles
        final List<Object> graph = convertScope(activeCtx, document, RecordPath.ROOT,
                Collections.<Set<String>>emptyList());

        final Map<String, Object> rval = new LinkedHashMap<String, Object>();
        rval.put(ProvJsonLdConsts.CONTEXT, activeCtx.serialize());
        rval.put(ProvJsonLdConsts.GRAPH, graph);
        LOG.debug("Converted document: {} top-level objects, {} warnings", graph.size(),
                warnings.size());
        return new ConversionResult(rval, warnings);
    }

    /**
     * Converts the records of one scope (the document or a bundle).
     *
     * @param activeCtx
     *            prefix table of the scope
     * @param document
     *            the records of the scope
     * @param path
     *            the scope
     * @param enclosingIds
     *            identifiers of the enclosing scopes, innermost last
     * @return the {@code @graph} of the scope
     */
    private List<Object> convertScope(Context activeCtx, Map<String, Object> document,
            RecordPath path, List<Set<String>> enclosingIds) throws ProvJsonLdError {
        final Scope scope = new Scope(declaredIdentifiers(document), bundleIdentifiers(document));

        checkKinds(document, path);
        mapElements(activeCtx, document, scope, path);
        mapRelations(activeCtx, document, scope, path);
        if (opts.isCheckReferences()) {
            checkReferences(scope, path, enclosingIds);
        }

        final Set<String> scopeIds = new HashSet<String>(scope.nodes.keySet());
        scopeIds.addAll(scope.bundles);
        final List<Set<String>> nestedIds = new ArrayList<Set<String>>(enclosingIds);
        nestedIds.add(scopeIds);
        mapBundles(activeCtx, document, scope, path, nestedIds);

        LOG.debug("Converted {}: {} objects", path, scope.graph.size());
        return scope.graph;
    }

    /**
     * Element mapping: one node object per entity, activity and agent, in
     * kind order then declaration order. An identifier declared under several
     * kinds yields a single node carrying all the types.
     */
    private void mapElements(Context activeCtx, Map<String, Object> document, Scope scope,
            RecordPath path) throws ProvJsonLdError {
        for (final ElementKind kind : ElementKind.values()) {
            final RecordPath kindPath = path.withKind(kind.getKey());
            final Map<String, Object> records = asRecordCollection(document.get(kind.getKey()),
                    kindPath);
            for (final Map.Entry<String, Object> entry : records.entrySet()) {
                final String id = entry.getKey();
                final RecordPath idPath = kindPath.withIdentifier(id);
                resolveName(activeCtx, id, idPath);

                Map<String, Object> node = scope.nodes.get(id);
                if (node == null) {
                    node = new LinkedHashMap<String, Object>();
                    node.put(ProvJsonLdConsts.TYPE, kind.getType());
                    node.put(ProvJsonLdConsts.ID, id);
                    scope.add(id, node);
                } else {
                    LOG.debug("Merging {} into node {}", kind.getType(), id);
                    addValue(node, ProvJsonLdConsts.TYPE, kind.getType());
                }

                for (final Map<String, Object> record : asRecords(entry.getValue(), idPath)) {
                    for (final Map.Entry<String, Object> attribute : record.entrySet()) {
                        mapElementAttribute(activeCtx, kind, node, attribute.getKey(),
                                attribute.getValue(), idPath);
                    }
                }
            }
        }
    }

    private void mapElementAttribute(Context activeCtx, ElementKind kind,
            Map<String, Object> node, String key, Object value, RecordPath path)
            throws ProvJsonLdError {
        String outputKey;
        if (kind == ElementKind.ACTIVITY && ProvJsonLdConsts.PROV_START_TIME.equals(key)) {
            outputKey = ProvJsonLdConsts.START_TIME;
        } else if (kind == ElementKind.ACTIVITY && ProvJsonLdConsts.PROV_END_TIME.equals(key)) {
            outputKey = ProvJsonLdConsts.END_TIME;
        } else {
            outputKey = normalizer.normalizeKey(activeCtx, key, path);
            if (outputKey == null) {
                return;
            }
        }
        final Object normalized = normalizer.normalize(activeCtx, value, path.withField(key));
        if (node.containsKey(outputKey)) {
            addValue(node, outputKey, normalized);
        } else {
            node.put(outputKey, normalized);
        }
    }

    /**
     * Relation mapping: one link object per relation record, kinds in
     * canonical order, role keys renamed through the kind's table.
     */
    private void mapRelations(Context activeCtx, Map<String, Object> document, Scope scope,
            RecordPath path) throws ProvJsonLdError {
        for (final RelationKind kind : RelationKind.values()) {
            final RecordPath kindPath = path.withKind(kind.getKey());
            final Map<String, Object> records = asRecordCollection(document.get(kind.getKey()),
                    kindPath);
            for (final Map.Entry<String, Object> entry : records.entrySet()) {
                final String id = entry.getKey();
                final RecordPath idPath = kindPath.withIdentifier(id);
                boolean first = true;
                for (final Map<String, Object> record : asRecords(entry.getValue(), idPath)) {
                    String linkId = id;
                    if (id.isEmpty() || !first) {
                        linkId = generateRelationIdentifier(kind, scope);
                    } else if (scope.nodes.containsKey(id) || scope.bundles.contains(id)) {
                        linkId = generateRelationIdentifier(kind, scope);
                        warn(Error.DUPLICATE_IDENTIFIER, idPath, "identifier already used in this "
                                + "scope; relation emitted as " + linkId);
                    } else {
                        resolveName(activeCtx, id, idPath);
                    }
                    first = false;
                    scope.add(linkId, mapRelation(activeCtx, kind, linkId, record, idPath));
                }
            }
        }
    }

    private Map<String, Object> mapRelation(Context activeCtx, RelationKind kind, String linkId,
            Map<String, Object> record, RecordPath path) throws ProvJsonLdError {
        final Map<String, Object> link = new LinkedHashMap<String, Object>();
        link.put(ProvJsonLdConsts.TYPE, kind.getType());
        link.put(ProvJsonLdConsts.ID, linkId);

        // roles first, in the order of the kind's table
        for (final Map.Entry<String, String> role : kind.getRoles().entrySet()) {
            if (!record.containsKey(role.getKey())) {
                continue;
            }
            final Object value = record.get(role.getKey());
            final RecordPath rolePath = path.withField(role.getKey());
            if (value == null) {
                continue;
            }
            if (RelationKind.TIME_ROLE.equals(role.getValue())) {
                link.put(role.getValue(), normalizer.normalize(activeCtx, value, rolePath));
            } else if (isString(value)) {
                resolveName(activeCtx, (String) value, rolePath);
                link.put(role.getValue(), value);
            } else {
                throw new ProvJsonLdError(Error.PARSE_ERROR,
                        "a role must hold a qualified name, not " + value, rolePath);
            }
        }

        for (final Map.Entry<String, Object> attribute : record.entrySet()) {
            final String key = attribute.getKey();
            if (kind.renameRole(key) != null) {
                continue;
            }
            if (kind.hasShortRole(key)) {
                warn(Error.ATTRIBUTE_COLLISION, path.withField(key), "attribute '" + key
                        + "' collides with the role of the same name; dropped");
                continue;
            }
            final String outputKey = normalizer.normalizeKey(activeCtx, key, path);
            if (outputKey != null) {
                link.put(outputKey,
                        normalizer.normalize(activeCtx, attribute.getValue(), path.withField(key)));
            }
        }
        return link;
    }

    /**
     * Synthesizes the identifier of a relation record that has none, or whose
     * identifier is taken: {@code _:<kind><n>}, skipping identifiers declared
     * in the scope.
     */
    String generateRelationIdentifier(RelationKind kind, Scope scope) {
        String id;
        do {
            final Integer last = identifierCounters.get(kind);
            final int next = last == null ? 1 : last + 1;
            identifierCounters.put(kind, next);
            id = ProvJsonLdConsts.BLANK_PREFIX + ":" + kind.getKey() + next;
        } while (scope.declared.contains(id) || scope.nodes.containsKey(id));
        return id;
    }

    /**
     * Bundle recursion: each bundle becomes a named graph appended to the
     * scope's graph. An entity of the scope with the bundle identifier turns
     * into the named graph. Any other node with that identifier keeps it and
     * the bundle is skipped.
     */
    private void mapBundles(Context activeCtx, Map<String, Object> document, Scope scope,
            RecordPath path, List<Set<String>> enclosingIds) throws ProvJsonLdError {
        final RecordPath kindPath = path.withKind(ProvJsonLdConsts.BUNDLE);
        final Map<String, Object> bundles = asRecordCollection(
                document.get(ProvJsonLdConsts.BUNDLE), kindPath);
        for (final Map.Entry<String, Object> entry : bundles.entrySet()) {
            final String bundleId = entry.getKey();
            final RecordPath idPath = kindPath.withIdentifier(bundleId);
            resolveName(activeCtx, bundleId, idPath);
            Map<String, Object> named = scope.nodes.get(bundleId);
            if (named != null && !hasValue(named, ProvJsonLdConsts.TYPE,
                    ElementKind.ENTITY.getType())) {
                warn(Error.DUPLICATE_IDENTIFIER, idPath, "identifier already used by a "
                        + named.get(ProvJsonLdConsts.TYPE) + " node; bundle skipped");
                continue;
            }
            final Map<String, Object> content = asRecord(entry.getValue(), idPath,
                    "a bundle must be an object");

            final RecordPath bundlePath = path.inBundle(bundleId);
            final Context bundleCtx = activeCtx.parse(content.get(ProvJsonLdConsts.PREFIX),
                    bundlePath);
            final List<Object> bundleGraph = convertScope(bundleCtx, content, bundlePath,
                    enclosingIds);

            if (named == null) {
                named = new LinkedHashMap<String, Object>();
                if (opts.isTypedBundles()) {
                    named.put(ProvJsonLdConsts.TYPE, ProvJsonLdConsts.PROV_BUNDLE);
                }
                named.put(ProvJsonLdConsts.ID, bundleId);
                scope.add(bundleId, named);
            } else if (opts.isTypedBundles()) {
                addValue(named, ProvJsonLdConsts.TYPE, ProvJsonLdConsts.PROV_BUNDLE);
            }
            if (bundleCtx != activeCtx) {
                named.put(ProvJsonLdConsts.CONTEXT, bundleCtx.serialize());
            }
            named.put(ProvJsonLdConsts.GRAPH, bundleGraph);
        }
    }

    /**
     * Reports the kinds of records the converter does not model. Those
     * records are left out of the graph.
     */
    private void checkKinds(Map<String, Object> document, RecordPath path) throws ProvJsonLdError {
        for (final Map.Entry<String, Object> entry : document.entrySet()) {
            final String key = entry.getKey();
            if (ProvJsonLdConsts.PREFIX.equals(key) || ProvJsonLdConsts.BUNDLE.equals(key)
                    || ElementKind.forKey(key) != null || RelationKind.forKey(key) != null) {
                continue;
            }
            if (hasRoleKeys(entry.getValue())) {
                warn(Error.UNKNOWN_RELATION_KIND, path.withKind(key),
                        "unknown relation kind; records skipped");
            } else {
                warn(Error.UNKNOWN_ELEMENT_KIND, path.withKind(key),
                        "unknown element kind; records skipped");
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static boolean hasRoleKeys(Object records) {
        if (!isObject(records)) {
            return false;
        }
        for (final Object record : ((Map<String, Object>) records).values()) {
            final List<Object> items = isArray(record) ? (List<Object>) record
                    : Collections.singletonList(record);
            for (final Object item : items) {
                if (!isObject(item)) {
                    continue;
                }
                for (final String key : ((Map<String, Object>) item).keySet()) {
                    if (RelationKind.isRoleKey(key)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /**
     * Reports role values naming no node of this scope or of an enclosing
     * one. Never fatal: PROV allows references to undeclared nodes.
     */
    private void checkReferences(Scope scope, RecordPath path, List<Set<String>> enclosingIds) {
        for (final Map<String, Object> object : scope.nodes.values()) {
            final RelationKind kind = relationKindOf(object);
            if (kind == null) {
                continue;
            }
            for (final String role : kind.getRoles().values()) {
                final Object value = object.get(role);
                if (RelationKind.TIME_ROLE.equals(role) || !isString(value)
                        || scope.nodes.containsKey(value) || scope.bundles.contains(value)) {
                    continue;
                }
                boolean found = false;
                for (final Set<String> ids : enclosingIds) {
                    found |= ids.contains(value);
                }
                if (!found) {
                    final ConversionWarning warning = new ConversionWarning(
                            Error.DANGLING_REFERENCE, path.withKind(kind.getKey())
                                    .withIdentifier((String) object.get(ProvJsonLdConsts.ID))
                                    .withField(role), "'" + value + "' names no node");
                    LOG.warn("{}", warning);
                    warnings.add(warning);
                }
            }
        }
    }

    private static RelationKind relationKindOf(Map<String, Object> object) {
        for (final RelationKind kind : RelationKind.values()) {
            if (kind.getType().equals(object.get(ProvJsonLdConsts.TYPE))) {
                return kind;
            }
        }
        return null;
    }

    /**
     * Checks a qualified name against the active context. Unresolved prefixes
     * are fatal unless the options relax them.
     */
    void resolveName(Context activeCtx, String name, RecordPath path) throws ProvJsonLdError {
        try {
            activeCtx.resolve(name, path);
        } catch (final ProvJsonLdError e) {
            if (opts.isStrict() || !opts.isLenientPrefixes()) {
                throw e;
            }
            final ConversionWarning warning = new ConversionWarning(e.getType(), path,
                    "'" + name + "' emitted unresolved");
            LOG.warn("{}", warning);
            warnings.add(warning);
        }
    }

    /**
     * Records a recoverable condition, or fails when the conversion is
     * strict.
     */
    void warn(Error type, RecordPath path, String message) throws ProvJsonLdError {
        final ConversionWarning warning = new ConversionWarning(type, path, message);
        if (opts.isStrict()) {
            throw warning.toError();
        }
        LOG.warn("{}", warning);
        warnings.add(warning);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asRecord(Object value, RecordPath path, String message)
            throws ProvJsonLdError {
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!isObject(value)) {
            throw new ProvJsonLdError(Error.PARSE_ERROR, message, path);
        }
        return (Map<String, Object>) value;
    }

    private static Map<String, Object> asRecordCollection(Object value, RecordPath path)
            throws ProvJsonLdError {
        return asRecord(value, path, "records must be an object keyed by identifier");
    }

    /**
     * The records stored under one identifier: one object, or an array of
     * objects when several records share the identifier.
     */
    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> asRecords(Object value, RecordPath path)
            throws ProvJsonLdError {
        final List<Map<String, Object>> rval = new ArrayList<Map<String, Object>>();
        if (isArray(value)) {
            for (final Object item : (List<Object>) value) {
                rval.add(asRecord(item, path, "a record must be an object"));
            }
        } else {
            rval.add(asRecord(value, path, "a record must be an object"));
        }
        return rval;
    }

    /**
     * The objects of one {@code @graph} under construction, indexed by
     * identifier.
     */
    static final class Scope {

        final Set<String> declared;
        final Set<String> bundles;
        final Map<String, Map<String, Object>> nodes = new LinkedHashMap<String, Map<String, Object>>();
        final List<Object> graph = new ArrayList<Object>();

        Scope(Set<String> declared, Set<String> bundles) {
            this.declared = declared;
            this.bundles = bundles;
        }

        void add(String id, Map<String, Object> object) {
            nodes.put(id, object);
            graph.add(object);
        }
    }

    @SuppressWarnings("unchecked")
    private static Set<String> declaredIdentifiers(Map<String, Object> document) {
        final Set<String> rval = new HashSet<String>();
        for (final RelationKind kind : RelationKind.values()) {
            final Object records = document.get(kind.getKey());
            if (isObject(records)) {
                rval.addAll(((Map<String, ?>) records).keySet());
            }
        }
        for (final ElementKind kind : ElementKind.values()) {
            final Object records = document.get(kind.getKey());
            if (isObject(records)) {
                rval.addAll(((Map<String, ?>) records).keySet());
            }
        }
        rval.addAll(bundleIdentifiers(document));
        return rval;
    }

    @SuppressWarnings("unchecked")
    private static Set<String> bundleIdentifiers(Map<String, Object> document) {
        final Object bundles = document.get(ProvJsonLdConsts.BUNDLE);
        if (!isObject(bundles)) {
            return Collections.emptySet();
        }
        return new HashSet<String>(((Map<String, ?>) bundles).keySet());
    }
}
