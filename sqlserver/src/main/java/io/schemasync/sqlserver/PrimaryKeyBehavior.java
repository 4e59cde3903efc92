// file: sqlserver/src/main/java/io/schemasync/sqlserver/PrimaryKeyBehavior.java
package io.schemasync.sqlserver;

import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.declared.Declarations;
import io.schemasync.core.live.AttributeWriter;
import io.schemasync.core.live.BackendDriver;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.live.Row;
import io.schemasync.core.model.EntityType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.schemasync.core.model.AttributeRegistry.*;
import static io.schemasync.sqlserver.SqlServerStatements.*;

/**
 * Primary key constraints. A key is matched by its columns, so only the
 * clustering and the compression can differ.
 * <p>
 * Clustering a key rebuilds it in place with DROP_EXISTING. Unclustering
 * cannot be done that way: the constraint is dropped and re-added, with the
 * foreign keys that reference it dropped before and restored after, all in
 * the same transaction.
 */
final class PrimaryKeyBehavior extends IndexSupport {
    private static final Logger log = Logger.getLogger(PrimaryKeyBehavior.class.getName());

    PrimaryKeyBehavior(DatabaseScope scope) {
        super(scope);
    }

    @Override
    public EntityType type() {
        return EntityType.PRIMARY_KEY;
    }

    @Override
    public List<String> listNames(ReflectedNode table) {
        return column(db(table).query(LIST_PRIMARY_KEYS, objectId(table)), "name");
    }

    @Override
    public boolean exists(ReflectedNode table, String name) {
        return db(table).any(PRIMARY_KEY_EXISTS, objectId(table), name);
    }

    static String keyName(DeclaredNode declared) {
        return declared.name().isEmpty()
                ? Declarations.generatedName("PK", declared.names(COLUMNS), List.of())
                : declared.name();
    }

    @Override
    public void create(ReflectedNode table, DeclaredNode declared) {
        db(table).execute(createPrimaryKey(table.parent().name(), table.name(), keyName(declared),
                declared.names(COLUMNS), declared.flag(CLUSTERED), declared.text(COMPRESSION)));
    }

    @Override
    public Map<String, AttributeWriter> writers() {
        return Map.of(
                COMPRESSION, this::rebuildWithCompression,
                CLUSTERED, this::recreate);
    }

    private boolean recreate(ReflectedNode key, DeclaredNode declared) {
        boolean clustered = declared.flag(CLUSTERED);
        log.log(Level.INFO, "Re-creating primary key " + key.fullName() + (clustered ? " clustered" : " nonclustered"));
        BackendDriver driver = db(key);
        String schema = schemaOf(key);
        String table = tableOf(key);
        // the full key, partitioning column included, so the rebuilt index still matches the constraint
        List<String> columns = column(driver.query(INDEX_KEY_COLUMNS, objectId(key), key.name()), "column_name");
        if (clustered) {
            driver.execute(createIndex(schema, table, key.name(), columns, null, true, true,
                    declared.text(COMPRESSION), true, createOn(key.parent())));
        } else {
            List<ReferencingKey> referencing = referencingKeys(driver, key);
            for (ReferencingKey fk : referencing) {
                log.log(Level.INFO, "Dropping foreign key " + fk.name() + " on " + fk.schema() + "." + fk.table()
                        + " while " + key.fullName() + " is re-added");
                driver.execute(format(DROP_CONSTRAINT, quote(fk.schema()), quote(fk.table()), quote(fk.name())));
            }
            driver.execute(format(DROP_CONSTRAINT, quote(schema), quote(table), quote(key.name())));
            driver.execute(createPrimaryKey(schema, table, key.name(), columns, false, declared.text(COMPRESSION)));
            for (ReferencingKey fk : referencing) {
                driver.execute(format(CREATE_FOREIGN_KEY, quote(fk.schema()), quote(fk.table()), quote(fk.name()),
                        quotedList(fk.columns()), quote(schema), quote(table), quotedList(fk.foreignColumns())));
            }
        }
        key.resetAttributes();
        return true;
    }

    private static List<ReferencingKey> referencingKeys(BackendDriver driver, ReflectedNode key) {
        Map<String, ReferencingKey> byName = new LinkedHashMap<>();
        for (Row row : driver.query(REFERENCING_FOREIGN_KEYS, objectId(key), key.name())) {
            ReferencingKey fk = byName.computeIfAbsent(row.string("name"), name ->
                    new ReferencingKey(name, row.string("schema"), row.string("table"), new ArrayList<>(), new ArrayList<>()));
            fk.columns().add(row.string("column"));
            fk.foreignColumns().add(row.string("foreignColumn"));
        }
        return List.copyOf(byName.values());
    }

    /** A foreign key pointing at a primary key, as needed to restore it. */
    private record ReferencingKey(String name, String schema, String table,
                                  List<String> columns, List<String> foreignColumns) {
    }
}
