// file: core/src/main/java/io/schemasync/core/live/MutationJournal.java
package io.schemasync.core.live;

import io.schemasync.core.model.EntityType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of what happened to the live server during a session,
 * in execution order. Applied mutations and recoverable skips alike.
 */
public final class MutationJournal {

    public enum Kind {
        ATTRIBUTE_SET(true),
        ATTRIBUTE_SKIPPED(false),
        CREATED(true),
        CREATE_REFUSED(false),
        RENAMED(true),
        RENAME_SKIPPED(false),
        DELETED(true),
        DELETE_DECLINED(false);

        private final boolean mutation;

        Kind(boolean mutation) {
            this.mutation = mutation;
        }

        /** True when the server was actually changed. */
        public boolean mutation() {
            return mutation;
        }
    }

    /**
     * @param path   qualified path of the entity (for creations: of the new entity)
     * @param detail attribute name, new name or reason; free text
     */
    public record Outcome(Kind kind, EntityType type, String path, String detail) {
        @Override
        public String toString() {
            return kind + " " + type + " " + path + (detail == null || detail.isEmpty() ? "" : " (" + detail + ")");
        }
    }

    private final List<Outcome> outcomes = new ArrayList<>();

    public void record(Kind kind, EntityType type, String path, String detail) {
        outcomes.add(new Outcome(kind, type, path, detail));
    }

    public int size() {
        return outcomes.size();
    }

    /** Outcomes recorded at or after position {@code mark}. */
    public List<Outcome> since(int mark) {
        return List.copyOf(outcomes.subList(mark, outcomes.size()));
    }

    public List<Outcome> all() {
        return Collections.unmodifiableList(outcomes);
    }
}
