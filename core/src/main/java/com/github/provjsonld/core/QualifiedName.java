package com.github.provjsonld.core;

/**
 * A PROV qualified name: {@code prefix:local}, a blank identifier
 * {@code _:local}, an absolute IRI, or an unprefixed name in the default
 * namespace.
 */
public final class QualifiedName {

    private final String prefix;
    private final String localPart;

    private QualifiedName(String prefix, String localPart) {
        this.prefix = prefix;
        this.localPart = localPart;
    }

    public static QualifiedName parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("qualified name must not be null");
        }
        final int colon = name.indexOf(':');
        if (colon < 0) {
            return new QualifiedName(null, name);
        }
        return new QualifiedName(name.substring(0, colon), name.substring(colon + 1));
    }

    /**
     * @return the prefix, or null for a name in the default namespace
     */
    public String getPrefix() {
        return prefix;
    }

    public String getLocalPart() {
        return localPart;
    }

    public boolean isBlank() {
        return ProvJsonLdConsts.BLANK_PREFIX.equals(prefix);
    }

    /**
     * Names such as {@code http://example.org/x} or {@code urn:uuid:...}
     * are IRIs and need no prefix lookup.
     */
    public boolean isAbsoluteIri() {
        return prefix != null && (localPart.startsWith("//") || "urn".equals(prefix));
    }

    @Override
    public boolean equals(Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof QualifiedName)) {
            return false;
        }
        final QualifiedName other = (QualifiedName) object;
        return (prefix == null ? other.prefix == null : prefix.equals(other.prefix))
                && localPart.equals(other.localPart);
    }

    @Override
    public int hashCode() {
        return (prefix == null ? 0 : prefix.hashCode() * 31) + localPart.hashCode();
    }

    @Override
    public String toString() {
        return prefix == null ? localPart : prefix + ":" + localPart;
    }
}
