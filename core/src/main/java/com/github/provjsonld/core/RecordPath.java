package com.github.provjsonld.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Location of a record inside a PROV-JSON document: the chain of enclosing
 * bundles, then record kind, identifier and attribute key. Immutable; every
 * {@code with*} call returns a new path.
 */
public final class RecordPath {

    public static final RecordPath ROOT = new RecordPath(Collections.<String>emptyList(), null,
            null, null);

    private final List<String> bundles;
    private final String kind;
    private final String identifier;
    private final String field;

    private RecordPath(List<String> bundles, String kind, String identifier, String field) {
        this.bundles = bundles;
        this.kind = kind;
        this.identifier = identifier;
        this.field = field;
    }

    /**
     * Path of the scope of the given bundle, nested in the scope of this path.
     */
    public RecordPath inBundle(String bundleId) {
        final List<String> nested = new ArrayList<String>(bundles);
        nested.add(bundleId);
        return new RecordPath(Collections.unmodifiableList(nested), null, null, null);
    }

    public RecordPath withKind(String kind) {
        return new RecordPath(bundles, kind, null, null);
    }

    public RecordPath withIdentifier(String identifier) {
        return new RecordPath(bundles, kind, identifier, null);
    }

    public RecordPath withField(String field) {
        return new RecordPath(bundles, kind, identifier, field);
    }

    public List<String> getBundles() {
        return bundles;
    }

    public String getKind() {
        return kind;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getField() {
        return field;
    }

    Map<String, Object> toDetails() {
        final Map<String, Object> rval = new LinkedHashMap<String, Object>();
        if (!bundles.isEmpty()) {
            rval.put("bundle", join(bundles));
        }
        if (kind != null) {
            rval.put("kind", kind);
        }
        if (identifier != null) {
            rval.put("identifier", identifier);
        }
        if (field != null) {
            rval.put("field", field);
        }
        return rval;
    }

    private static String join(List<String> parts) {
        final StringBuilder sb = new StringBuilder();
        for (final String part : parts) {
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(part);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof RecordPath)) {
            return false;
        }
        final RecordPath other = (RecordPath) object;
        return bundles.equals(other.bundles) && equal(kind, other.kind)
                && equal(identifier, other.identifier) && equal(field, other.field);
    }

    private static boolean equal(Object v1, Object v2) {
        return v1 == null ? v2 == null : v1.equals(v2);
    }

    @Override
    public int hashCode() {
        int hash = bundles.hashCode();
        hash = 31 * hash + (kind == null ? 0 : kind.hashCode());
        hash = 31 * hash + (identifier == null ? 0 : identifier.hashCode());
        return 31 * hash + (field == null ? 0 : field.hashCode());
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        for (final String bundle : bundles) {
            sb.append("bundle ").append(bundle).append(" / ");
        }
        if (kind == null) {
            sb.append("document");
        } else {
            sb.append(kind);
        }
        if (identifier != null) {
            sb.append(' ').append(identifier);
        }
        if (field != null) {
            sb.append(" / ").append(field);
        }
        return sb.toString();
    }
}
