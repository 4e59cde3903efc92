// file: sqlserver/src/main/java/io/schemasync/sqlserver/TableBehavior.java
package io.schemasync.sqlserver;

import io.schemasync.core.DeclarationException;
import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.live.Row;
import io.schemasync.core.model.EntityType;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static io.schemasync.sqlserver.SqlServerStatements.*;

/**
 * Tables. A table is created together with its declared columns; keys,
 * indexes and partitions follow when the aligner reaches them.
 */
final class TableBehavior extends SqlServerBehavior {

    TableBehavior(DatabaseScope scope) {
        super(scope);
    }

    @Override
    public EntityType type() {
        return EntityType.TABLE;
    }

    @Override
    public List<String> listNames(ReflectedNode schema) {
        return column(db(schema).query(LIST_TABLES, schema.name()), "name");
    }

    @Override
    public boolean exists(ReflectedNode schema, String name) {
        return db(schema).any(TABLE_EXISTS, schema.name(), name);
    }

    @Override
    public void create(ReflectedNode schema, DeclaredNode declared) {
        List<DeclaredNode> columns = declared.children(EntityType.COLUMN);
        if (columns.isEmpty()) {
            throw new DeclarationException("table " + schema.fullName() + "." + declared.name() + " must declare at least one column");
        }
        String definitions = columns.stream()
                .map(SqlServerStatements::columnDefinition)
                .collect(Collectors.joining(", "));
        db(schema).execute(format(CREATE_TABLE, quote(schema.name()), quote(declared.name()), definitions));
    }

    @Override
    public Optional<Row> fetchDetail(ReflectedNode table) {
        return db(table).queryOne(TABLE_DETAIL, schemaOf(table), table.name());
    }

    @Override
    public void rename(ReflectedNode table, String newName) {
        db(table).execute(RENAME_OBJECT, qualified(schemaOf(table), table.name()), newName);
    }

    @Override
    public boolean delete(ReflectedNode table) {
        db(table).execute(format(DROP_TABLE, quote(schemaOf(table)), quote(table.name())));
        return true;
    }
}
