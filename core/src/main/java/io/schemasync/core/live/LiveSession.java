// file: core/src/main/java/io/schemasync/core/live/LiveSession.java
package io.schemasync.core.live;

import java.util.Objects;

/**
 * Everything a live tree needs to talk to one server: the driver, the
 * confirmation gate, the per-type behaviors and the journal of outcomes.
 * One session per connection; not thread-safe.
 */
public final class LiveSession {

    private final BackendDriver driver;
    private final ConfirmationProvider confirmer;
    private final BehaviorTable behaviors;
    private final MutationJournal journal = new MutationJournal();

    public LiveSession(BackendDriver driver, ConfirmationProvider confirmer, BehaviorTable behaviors) {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.confirmer = Objects.requireNonNull(confirmer, "confirmer");
        this.behaviors = Objects.requireNonNull(behaviors, "behaviors");
    }

    public BackendDriver driver() {
        return driver;
    }

    public ConfirmationProvider confirmer() {
        return confirmer;
    }

    public BehaviorTable behaviors() {
        return behaviors;
    }

    public MutationJournal journal() {
        return journal;
    }

    /** Root of the live tree for the connected server. */
    public ReflectedNode root(String serverName) {
        return ReflectedNode.root(this, serverName);
    }
}
