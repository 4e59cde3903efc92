// file: core/src/main/java/io/schemasync/core/model/EntityType.java
package io.schemasync.core.model;

import java.util.List;

/**
 * Closed set of object kinds the reconciler manages.
 * <p>
 * Each type carries its small behavior table:
 *  - key:            plural name used in declared files and logs ("tables"),
 *  - childTypes:     the types that may appear directly below it,
 *  - matchRule:      how a live object is paired with a declaration,
 *  - creatable:      whether a missing object may be created,
 *  - autoDeletable:  whether an undeclared live object may be dropped.
 * <p>
 * Logins are never created (password provisioning is not the engine's job).
 * Databases are never dropped automatically.
 */
public enum EntityType {
    SERVER("servers", MatchRule.NAME, false, false),
    LOGIN("logins", MatchRule.NAME, false, true),
    DATABASE("databases", MatchRule.NAME, true, false),
    SCHEMA("schemas", MatchRule.NAME, true, true),
    TABLE("tables", MatchRule.NAME, true, true),
    COLUMN("columns", MatchRule.NAME, true, true),
    PRIMARY_KEY("primary_keys", MatchRule.KEY_COLUMNS, true, true),
    INDEX("indexes", MatchRule.KEY_COLUMNS, true, true),
    FOREIGN_KEY("foreign_keys", MatchRule.REFERENCE, true, true),
    PARTITION("partitions", MatchRule.PARTITION_COLUMN, true, true),
    USER("users", MatchRule.LOGIN, true, true);

    /**
     * How a live object is recognised as the counterpart of a declared one.
     */
    public enum MatchRule {
        /** Case-insensitive name equal to the declared name or old name. */
        NAME,
        /** Same ordered key columns, whatever the name. */
        KEY_COLUMNS,
        /** Same (column, foreign schema, foreign table, foreign column). */
        REFERENCE,
        /** Partitions the same column. */
        PARTITION_COLUMN,
        /** Mapped to the same login, whatever the user name. */
        LOGIN
    }

    private final String key;
    private final MatchRule matchRule;
    private final boolean creatable;
    private final boolean autoDeletable;

    EntityType(String key, MatchRule matchRule, boolean creatable, boolean autoDeletable) {
        this.key = key;
        this.matchRule = matchRule;
        this.creatable = creatable;
        this.autoDeletable = autoDeletable;
    }

    public String key() {
        return key;
    }

    public MatchRule matchRule() {
        return matchRule;
    }

    public boolean creatable() {
        return creatable;
    }

    public boolean autoDeletable() {
        return autoDeletable;
    }

    /** Child types in the order alignment visits them. */
    public List<EntityType> childTypes() {
        return switch (this) {
            case SERVER -> List.of(LOGIN, DATABASE);
            case DATABASE -> List.of(SCHEMA, USER);
            case SCHEMA -> List.of(TABLE);
            case TABLE -> List.of(COLUMN, PRIMARY_KEY, INDEX, FOREIGN_KEY, PARTITION);
            default -> List.of();
        };
    }

    public boolean allowsChild(EntityType child) {
        return childTypes().contains(child);
    }

    public boolean isLeaf() {
        return childTypes().isEmpty();
    }

    /**
     * Resolve a type from its key ("tables") or its enum name ("TABLE"), case-insensitive.
     */
    public static EntityType fromKey(String key) {
        if (key == null || key.isBlank()) throw new IllegalArgumentException("entity type key must not be blank");
        for (EntityType t : values()) {
            if (t.key.equalsIgnoreCase(key) || t.name().equalsIgnoreCase(key)) {
                return t;
            }
        }
        throw new IllegalArgumentException("unknown entity type: " + key);
    }

    @Override
    public String toString() {
        return key;
    }
}
