// file: sqlserver/src/test/java/io/schemasync/sqlserver/ScriptedBackendDriver.java
package io.schemasync.sqlserver;

import io.schemasync.core.live.BackendDriver;
import io.schemasync.core.live.Row;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Driver answering queries from a script keyed by the exact statement text.
 * Unscripted queries return no rows. Executed statements are recorded with
 * their parameters appended.
 */
final class ScriptedBackendDriver implements BackendDriver {

    private final Map<String, Function<List<Object>, List<Row>>> answers = new HashMap<>();
    final List<String> executed = new ArrayList<>();
    final List<String> queried = new ArrayList<>();
    int commits;
    int autoCommitBlocks;

    ScriptedBackendDriver on(String sql, Row... rows) {
        List<Row> fixed = List.of(rows);
        answers.put(sql, params -> fixed);
        return this;
    }

    ScriptedBackendDriver on(String sql, Function<List<Object>, List<Row>> answer) {
        answers.put(sql, answer);
        return this;
    }

    /** Executed statements other than database switches. */
    List<String> changes() {
        return executed.stream().filter(s -> !s.startsWith("USE ")).toList();
    }

    @Override
    public List<Row> query(String sql, Object... params) {
        queried.add(sql);
        return answers.getOrDefault(sql, p -> List.of()).apply(Arrays.asList(params));
    }

    @Override
    public void execute(String sql, Object... params) {
        executed.add(params.length == 0 ? sql : sql + " " + Arrays.toString(params));
    }

    @Override
    public void commit() {
        commits++;
    }

    @Override
    public void inAutoCommit(Runnable action) {
        autoCommitBlocks++;
        action.run();
    }
}
