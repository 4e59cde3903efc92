// file: core/src/main/java/io/schemasync/core/live/BehaviorTable.java
package io.schemasync.core.live;

import io.schemasync.core.model.AttributeRegistry;
import io.schemasync.core.model.EntityType;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Entity type -> {@link EntityBehavior}. Complete over all types.
 * <p>
 * Built once per backend; validated eagerly so a reader or writer keyed by a
 * name the registry does not know fails at startup, not mid-run.
 */
public final class BehaviorTable {

    private final Map<EntityType, EntityBehavior> behaviors;

    private BehaviorTable(Map<EntityType, EntityBehavior> behaviors) {
        this.behaviors = behaviors;
    }

    public static BehaviorTable of(Collection<? extends EntityBehavior> behaviors) {
        Map<EntityType, EntityBehavior> m = new EnumMap<>(EntityType.class);
        for (EntityBehavior b : behaviors) {
            if (m.put(b.type(), b) != null) {
                throw new IllegalArgumentException("duplicate behavior for " + b.type());
            }
            for (String attr : b.readers().keySet()) {
                checkAttribute(b.type(), attr, "reader");
            }
            for (String attr : b.writers().keySet()) {
                checkAttribute(b.type(), attr, "writer");
            }
        }
        for (EntityType t : EntityType.values()) {
            if (!m.containsKey(t)) {
                throw new IllegalArgumentException("no behavior registered for " + t);
            }
        }
        return new BehaviorTable(m);
    }

    private static void checkAttribute(EntityType type, String attr, String role) {
        if (!AttributeRegistry.isAttribute(type, attr)) {
            throw new IllegalArgumentException(role + " registered for unknown attribute " + type + "." + attr);
        }
    }

    public EntityBehavior behavior(EntityType type) {
        return behaviors.get(type);
    }
}
