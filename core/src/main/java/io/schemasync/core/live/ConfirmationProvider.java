// file: core/src/main/java/io/schemasync/core/live/ConfirmationProvider.java
package io.schemasync.core.live;

/**
 * Approves or declines a pending mutation. Asked synchronously before every
 * attribute change, rename and delete.
 */
@FunctionalInterface
public interface ConfirmationProvider {

    boolean confirm(String description);

    /** Batch mode: everything is approved. */
    static ConfirmationProvider alwaysApprove() {
        return description -> true;
    }

    /** Dry inspection: nothing is approved. */
    static ConfirmationProvider alwaysDecline() {
        return description -> false;
    }
}
