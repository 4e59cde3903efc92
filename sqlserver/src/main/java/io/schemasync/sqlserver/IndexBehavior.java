// file: sqlserver/src/main/java/io/schemasync/sqlserver/IndexBehavior.java
package io.schemasync.sqlserver;

import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.declared.Declarations;
import io.schemasync.core.live.AttributeReader;
import io.schemasync.core.live.AttributeWriter;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.model.EntityType;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static io.schemasync.core.model.AttributeRegistry.*;
import static io.schemasync.sqlserver.SqlServerStatements.*;

/**
 * Clustered and nonclustered indexes other than primary keys. Structural
 * changes rebuild the index in place with {@code DROP_EXISTING = ON}.
 */
final class IndexBehavior extends IndexSupport {

    IndexBehavior(DatabaseScope scope) {
        super(scope);
    }

    @Override
    public EntityType type() {
        return EntityType.INDEX;
    }

    @Override
    public List<String> listNames(ReflectedNode table) {
        return column(db(table).query(LIST_INDEXES, objectId(table)), "name");
    }

    @Override
    public boolean exists(ReflectedNode table, String name) {
        return db(table).any(INDEX_EXISTS, objectId(table), name);
    }

    static String indexName(DeclaredNode declared) {
        return declared.name().isEmpty()
                ? Declarations.generatedName("IX", declared.names(COLUMNS), declared.names(INCLUDED_COLUMNS))
                : declared.name();
    }

    @Override
    public void create(ReflectedNode table, DeclaredNode declared) {
        db(table).execute(statement(table.parent().name(), table.name(), indexName(declared), declared, false, createOn(table)));
    }

    @Override
    public Map<String, AttributeReader> readers() {
        Map<String, AttributeReader> readers = super.readers();
        readers.put(INCLUDED_COLUMNS, (index, detail) -> new TreeSet<>(
                column(db(index).query(INDEX_INCLUDED_COLUMNS, objectId(index), index.name()), "column_name")));
        readers.put(UNIQUE, (index, detail) -> detail.flag(UNIQUE));
        return readers;
    }

    @Override
    public Map<String, AttributeWriter> writers() {
        return Map.of(
                COMPRESSION, this::rebuildWithCompression,
                CLUSTERED, this::recreate,
                INCLUDED_COLUMNS, this::recreate,
                UNIQUE, this::recreate);
    }

    private boolean recreate(ReflectedNode index, DeclaredNode declared) {
        ReflectedNode table = index.parent();
        db(index).execute(statement(schemaOf(index), tableOf(index), index.name(), declared, true, createOn(table)));
        index.resetAttributes();
        return true;
    }

    private static String statement(String schema, String table, String name, DeclaredNode declared,
                                    boolean dropExisting, String createOn) {
        return createIndex(schema, table, name, declared.names(COLUMNS), declared.names(INCLUDED_COLUMNS),
                declared.flag(UNIQUE), declared.flag(CLUSTERED), declared.text(COMPRESSION), dropExisting, createOn);
    }
}
