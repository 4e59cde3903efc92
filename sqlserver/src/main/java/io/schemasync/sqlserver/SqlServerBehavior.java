// file: sqlserver/src/main/java/io/schemasync/sqlserver/SqlServerBehavior.java
package io.schemasync.sqlserver;

import io.schemasync.core.live.BackendDriver;
import io.schemasync.core.live.EntityBehavior;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.live.Row;
import io.schemasync.core.model.EntityType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Shared plumbing for the SQL Server behaviors: database scoping and the
 * schema/table coordinates most statements are keyed by.
 */
abstract class SqlServerBehavior implements EntityBehavior {

    protected final DatabaseScope scope;

    protected SqlServerBehavior(DatabaseScope scope) {
        this.scope = Objects.requireNonNull(scope, "scope");
    }

    /** Driver switched into the database of {@code node}. */
    protected BackendDriver db(ReflectedNode node) {
        return scope.enter(node);
    }

    protected static String schemaOf(ReflectedNode node) {
        return node.ancestorName(EntityType.SCHEMA);
    }

    protected static String tableOf(ReflectedNode node) {
        return node.ancestorName(EntityType.TABLE);
    }

    /** {@code [schema].[table]} of the table {@code node} belongs to (or is). */
    protected static String objectId(ReflectedNode node) {
        return SqlServerStatements.qualified(schemaOf(node), tableOf(node));
    }

    protected static List<String> column(List<Row> rows, String field) {
        List<String> out = new ArrayList<>(rows.size());
        for (Row r : rows) {
            out.add(r.string(field));
        }
        return out;
    }
}
