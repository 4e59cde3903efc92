// file: core/src/main/java/io/schemasync/core/live/BackendDriver.java
package io.schemasync.core.live;

import java.util.List;
import java.util.Optional;

/**
 * Executes statements against the live server.
 * <p>
 * Contract:
 *  - one connection, one logical thread; calls block until the server answers,
 *  - statements run inside an open transaction until {@link #commit()},
 *  - {@link #inAutoCommit(Runnable)} commits pending work, runs the action with
 *    autocommit on (for statements that refuse a transaction, e.g. CREATE DATABASE)
 *    and restores the previous mode,
 *  - failures surface as {@link io.schemasync.core.BackendException}.
 * Retry, backoff and timeouts are the implementation's business.
 */
public interface BackendDriver {

    /** Run a statement that returns rows. */
    List<Row> query(String sql, Object... params);

    /** Run a statement for its side effect. */
    void execute(String sql, Object... params);

    void commit();

    void inAutoCommit(Runnable action);

    /** First row of a query, if any. */
    default Optional<Row> queryOne(String sql, Object... params) {
        List<Row> rows = query(sql, params);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    default boolean any(String sql, Object... params) {
        return !query(sql, params).isEmpty();
    }
}
