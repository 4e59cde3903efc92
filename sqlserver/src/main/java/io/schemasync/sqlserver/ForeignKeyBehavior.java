// file: sqlserver/src/main/java/io/schemasync/sqlserver/ForeignKeyBehavior.java
package io.schemasync.sqlserver;

import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.live.Row;
import io.schemasync.core.model.EntityType;

import java.util.List;
import java.util.Optional;

import static io.schemasync.core.model.AttributeRegistry.*;
import static io.schemasync.sqlserver.SqlServerStatements.*;

/**
 * Single-column foreign keys. Every attribute takes part in matching, so a
 * changed reference shows up as one key to drop and another to create.
 */
final class ForeignKeyBehavior extends SqlServerBehavior {

    ForeignKeyBehavior(DatabaseScope scope) {
        super(scope);
    }

    @Override
    public EntityType type() {
        return EntityType.FOREIGN_KEY;
    }

    @Override
    public List<String> listNames(ReflectedNode table) {
        return column(db(table).query(LIST_FOREIGN_KEYS, objectId(table)), "name");
    }

    @Override
    public boolean exists(ReflectedNode table, String name) {
        return db(table).any(FOREIGN_KEY_EXISTS, objectId(table), name);
    }

    /** {@code FK_<schema>_<table>_<column>_<foreign schema>_<foreign table>}. */
    static String constraintName(String schema, String table, DeclaredNode declared) {
        return String.join("_", "FK", schema, table, declared.text(KEY_COLUMN),
                declared.text(FOREIGN_SCHEMA), declared.text(FOREIGN_TABLE));
    }

    @Override
    public void create(ReflectedNode table, DeclaredNode declared) {
        String schema = table.parent().name();
        String name = declared.name().isEmpty() ? constraintName(schema, table.name(), declared) : declared.name();
        db(table).execute(format(CREATE_FOREIGN_KEY, quote(schema), quote(table.name()), quote(name),
                quote(declared.text(KEY_COLUMN)),
                quote(declared.text(FOREIGN_SCHEMA)), quote(declared.text(FOREIGN_TABLE)),
                quote(declared.text(FOREIGN_COLUMN))));
    }

    @Override
    public Optional<Row> fetchDetail(ReflectedNode foreignKey) {
        return db(foreignKey).queryOne(FOREIGN_KEY_DETAIL, objectId(foreignKey), foreignKey.name());
    }

    @Override
    public void rename(ReflectedNode foreignKey, String newName) {
        db(foreignKey).execute(RENAME_TYPED_OBJECT, qualified(schemaOf(foreignKey), foreignKey.name()), newName, "OBJECT");
    }

    @Override
    public boolean delete(ReflectedNode foreignKey) {
        db(foreignKey).execute(format(DROP_CONSTRAINT,
                quote(schemaOf(foreignKey)), quote(tableOf(foreignKey)), quote(foreignKey.name())));
        return true;
    }
}
