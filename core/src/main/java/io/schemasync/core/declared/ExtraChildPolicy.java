// file: core/src/main/java/io/schemasync/core/declared/ExtraChildPolicy.java
package io.schemasync.core.declared;

import io.schemasync.core.model.EntityType;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Which undeclared live children of a declared node must be left alone.
 * <p>
 * Three shapes:
 *  - none():      every child type is pruned of undeclared live objects,
 *  - all():       nothing undeclared is ever deleted below this node,
 *  - of(types):   only the listed child types are protected.
 */
public final class ExtraChildPolicy {

    private static final ExtraChildPolicy NONE = new ExtraChildPolicy(false, Set.of());
    private static final ExtraChildPolicy ALL = new ExtraChildPolicy(true, Set.of());

    private final boolean all;
    private final Set<EntityType> types;

    private ExtraChildPolicy(boolean all, Set<EntityType> types) {
        this.all = all;
        this.types = types;
    }

    public static ExtraChildPolicy none() {
        return NONE;
    }

    public static ExtraChildPolicy all() {
        return ALL;
    }

    public static ExtraChildPolicy of(EntityType first, EntityType... rest) {
        return new ExtraChildPolicy(false, Set.copyOf(EnumSet.of(first, rest)));
    }

    public static ExtraChildPolicy of(Collection<EntityType> types) {
        if (types.isEmpty()) return NONE;
        return new ExtraChildPolicy(false, Set.copyOf(types));
    }

    /** Whether undeclared live children of this type are kept. */
    public boolean ignores(EntityType childType) {
        return all || types.contains(childType);
    }

    public boolean ignoresAll() {
        return all;
    }

    public Set<EntityType> types() {
        return types;
    }

    @Override
    public String toString() {
        if (all) return "ignore all";
        if (types.isEmpty()) return "ignore none";
        return "ignore " + types;
    }
}
