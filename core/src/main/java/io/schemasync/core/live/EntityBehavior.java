// file: core/src/main/java/io/schemasync/core/live/EntityBehavior.java
package io.schemasync.core.live;

import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.model.EntityType;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Dialect behavior for one entity type: how live objects of that type are
 * listed, probed, created, read, altered, renamed and dropped.
 * <p>
 * Responsibilities:
 *  - listing and existence checks run against the parent node's context,
 *  - {@link #fetchDetail(ReflectedNode)} returns the single row attributes are
 *    derived from (empty means the object is gone),
 *  - readers/writers are keyed by registry attribute name,
 *  - mutations only execute statements; committing, gating and verifying is
 *    done by {@link ReflectedNode}.
 */
public interface EntityBehavior {

    EntityType type();

    /** Live names never reported as children (system objects). Compared case-insensitively. */
    default Set<String> reservedNames() {
        return Set.of();
    }

    List<String> listNames(ReflectedNode parent);

    boolean exists(ReflectedNode parent, String name);

    /** Execute the statements creating {@code declared} below {@code parent}. */
    default void create(ReflectedNode parent, DeclaredNode declared) {
        throw new UnsupportedOperationException(type() + " cannot be created");
    }

    Optional<Row> fetchDetail(ReflectedNode node);

    default Map<String, AttributeReader> readers() {
        return Map.of();
    }

    default Map<String, AttributeWriter> writers() {
        return Map.of();
    }

    default boolean supportsRename() {
        return true;
    }

    default void rename(ReflectedNode node, String newName) {
        throw new UnsupportedOperationException(type() + " cannot be renamed");
    }

    /**
     * Execute the statements dropping {@code node}.
     *
     * @return false when the drop was skipped (e.g. a dependent object refused to go)
     */
    boolean delete(ReflectedNode node);

    /** Dialect-level veto on top of the type's deletion policy. */
    default boolean canDelete(ReflectedNode node) {
        return true;
    }
}
