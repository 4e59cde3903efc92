// file: core/src/main/java/io/schemasync/core/model/AttributeSpec.java
package io.schemasync.core.model;

import java.util.Objects;

/**
 * One registered attribute of an entity type.
 *
 * @param name         attribute name, shared by declared nodes and live readers/writers
 * @param kind         value kind, drives canonical equality
 * @param defaultValue value used by convenience factories and file readers when none is given
 * @param optional     a declared null leaves the live value unconstrained
 */
public record AttributeSpec(String name, AttributeKind kind, Object defaultValue, boolean optional) {

    public AttributeSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (name.isBlank()) throw new IllegalArgumentException("attribute name must not be blank");
    }

    static AttributeSpec of(String name, AttributeKind kind) {
        return new AttributeSpec(name, kind, null, false);
    }

    static AttributeSpec of(String name, AttributeKind kind, Object defaultValue) {
        return new AttributeSpec(name, kind, defaultValue, false);
    }

    static AttributeSpec optional(String name, AttributeKind kind) {
        return new AttributeSpec(name, kind, null, true);
    }

    /**
     * Whether a declared value and a live value are the same under this attribute's rule.
     */
    public boolean sameValue(Object declared, Object live) {
        if (optional && declared == null) return true;
        return AttributeValues.equivalent(kind, declared, live);
    }
}
