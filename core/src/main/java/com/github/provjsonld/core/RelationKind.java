package com.github.provjsonld.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The 14 PROV-JSON relation record kinds, in canonical emission order. Each
 * kind carries its PROV-JSONLD {@code @type} and the table renaming its
 * qualified role keys to the PROV-JSONLD short keys.
 */
public enum RelationKind {

    WAS_GENERATED_BY("wasGeneratedBy", "prov:Generation", "entity", "activity", "time"),

    USED("used", "prov:Usage", "entity", "activity", "time"),

    WAS_INFORMED_BY("wasInformedBy", "prov:Communication", "informed", "informant"),

    WAS_STARTED_BY("wasStartedBy", "prov:Start", "activity", "trigger", "starter", "time"),

    WAS_ENDED_BY("wasEndedBy", "prov:End", "activity", "trigger", "ender", "time"),

    WAS_INVALIDATED_BY("wasInvalidatedBy", "prov:Invalidation", "entity", "activity", "time"),

    WAS_DERIVED_FROM("wasDerivedFrom", "prov:Derivation", "generatedEntity", "usedEntity",
            "activity", "generation", "usage"),

    WAS_ATTRIBUTED_TO("wasAttributedTo", "prov:Attribution", "entity", "agent"),

    WAS_ASSOCIATED_WITH("wasAssociatedWith", "prov:Association", "activity", "agent", "plan"),

    ACTED_ON_BEHALF_OF("actedOnBehalfOf", "prov:Delegation", "delegate", "responsible",
            "activity"),

    WAS_INFLUENCED_BY("wasInfluencedBy", "prov:Influence", "influencee", "influencer"),

    SPECIALIZATION_OF("specializationOf", "provext:Specialization", "specificEntity",
            "generalEntity"),

    ALTERNATE_OF("alternateOf", "provext:Alternate", "alternate1", "alternate2"),

    HAD_MEMBER("hadMember", "provext:Membership", "collection", "entity");

    /** The only role whose value is a time instant rather than a node reference. */
    public static final String TIME_ROLE = "time";

    private static final Map<String, RelationKind> BY_KEY = new HashMap<String, RelationKind>();

    private static final Set<String> ALL_ROLE_KEYS = new HashSet<String>();

    static {
        for (final RelationKind kind : values()) {
            BY_KEY.put(kind.key, kind);
            ALL_ROLE_KEYS.addAll(kind.roles.keySet());
        }
    }

    private final String key;
    private final String type;
    private final Map<String, String> roles;

    private RelationKind(String key, String type, String... roles) {
        this.key = key;
        this.type = type;
        final Map<String, String> table = new LinkedHashMap<String, String>();
        for (final String role : roles) {
            table.put(ProvJsonLdConsts.PROV + ":" + role, role);
        }
        this.roles = Collections.unmodifiableMap(table);
    }

    /**
     * @return the top-level PROV-JSON key holding records of this kind
     */
    public String getKey() {
        return key;
    }

    /**
     * @return the {@code @type} of the emitted link
     */
    public String getType() {
        return type;
    }

    /**
     * @return qualified role key to short key, in declaration order
     */
    public Map<String, String> getRoles() {
        return roles;
    }

    /**
     * @return the short key of the given qualified role key, or null if the
     *         key is no role of this kind
     */
    public String renameRole(String qualifiedKey) {
        return roles.get(qualifiedKey);
    }

    /**
     * @return true if the short key is a role of this kind
     */
    public boolean hasShortRole(String shortKey) {
        return roles.containsValue(shortKey);
    }

    public static RelationKind forKey(String key) {
        return BY_KEY.get(key);
    }

    /**
     * @return true if the key is a role of any relation kind
     */
    public static boolean isRoleKey(String qualifiedKey) {
        return ALL_ROLE_KEYS.contains(qualifiedKey);
    }
}
