// file: sqlserver/src/main/java/io/schemasync/sqlserver/SchemaBehavior.java
package io.schemasync.sqlserver;

import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.live.Row;
import io.schemasync.core.model.EntityType;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.schemasync.sqlserver.SqlServerStatements.*;

/**
 * Schemas. Not renamable; only dropped once they hold no objects.
 */
final class SchemaBehavior extends SqlServerBehavior {
    private static final Logger log = Logger.getLogger(SchemaBehavior.class.getName());

    private static final Set<String> RESERVED = Set.of("sys", "guest", "INFORMATION_SCHEMA");

    SchemaBehavior(DatabaseScope scope) {
        super(scope);
    }

    @Override
    public EntityType type() {
        return EntityType.SCHEMA;
    }

    @Override
    public Set<String> reservedNames() {
        return RESERVED;
    }

    @Override
    public List<String> listNames(ReflectedNode database) {
        return column(db(database).query(LIST_SCHEMAS), "name");
    }

    @Override
    public boolean exists(ReflectedNode database, String name) {
        return db(database).any(SCHEMA_DETAIL, name);
    }

    @Override
    public void create(ReflectedNode database, DeclaredNode declared) {
        db(database).execute(format(CREATE_SCHEMA, quote(declared.name())));
    }

    @Override
    public Optional<Row> fetchDetail(ReflectedNode schema) {
        return db(schema).queryOne(SCHEMA_DETAIL, schema.name());
    }

    @Override
    public boolean supportsRename() {
        return false;
    }

    @Override
    public boolean canDelete(ReflectedNode schema) {
        Optional<Row> object = db(schema).queryOne(SCHEMA_HAS_OBJECTS, schema.name());
        if (object.isPresent()) {
            log.log(Level.INFO, "Schema " + schema.fullName() + " still holds " + object.get().string("name") + "; not dropping it");
            return false;
        }
        return true;
    }

    @Override
    public boolean delete(ReflectedNode schema) {
        db(schema).execute(format(DROP_SCHEMA, quote(schema.name())));
        return true;
    }
}
