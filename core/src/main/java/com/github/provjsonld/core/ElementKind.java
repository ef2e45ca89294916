package com.github.provjsonld.core;

import java.util.HashMap;
import java.util.Map;

/**
 * The PROV-JSON element record kinds, in the order they are emitted.
 */
public enum ElementKind {

    ENTITY("entity", "prov:Entity"),

    ACTIVITY("activity", "prov:Activity"),

    AGENT("agent", "prov:Agent");

    private static final Map<String, ElementKind> BY_KEY = new HashMap<String, ElementKind>();

    static {
        for (final ElementKind kind : values()) {
            BY_KEY.put(kind.key, kind);
        }
    }

    private final String key;
    private final String type;

    private ElementKind(String key, String type) {
        this.key = key;
        this.type = type;
    }

    /**
     * @return the top-level PROV-JSON key holding records of this kind
     */
    public String getKey() {
        return key;
    }

    /**
     * @return the {@code @type} of the emitted node
     */
    public String getType() {
        return type;
    }

    public static ElementKind forKey(String key) {
        return BY_KEY.get(key);
    }
}
