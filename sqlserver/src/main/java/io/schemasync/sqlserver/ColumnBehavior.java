// file: sqlserver/src/main/java/io/schemasync/sqlserver/ColumnBehavior.java
package io.schemasync.sqlserver;

import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.live.AttributeReader;
import io.schemasync.core.live.AttributeWriter;
import io.schemasync.core.live.BackendDriver;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.live.Row;
import io.schemasync.core.model.ColumnTypes;
import io.schemasync.core.model.EntityType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.schemasync.core.model.AttributeRegistry.*;
import static io.schemasync.sqlserver.SqlServerStatements.*;

/**
 * Table columns.
 * <p>
 * Responsibilities:
 *  - precision attributes read as null for types that do not carry them
 *    (the catalog reports e.g. a numeric precision of 10 for {@code int}),
 *  - type changes drop the indexes built on the column first; the aligner
 *    recreates them when it reaches the table's keys and indexes,
 *  - identity changes drop and re-add the column.
 */
final class ColumnBehavior extends SqlServerBehavior {
    private static final Logger log = Logger.getLogger(ColumnBehavior.class.getName());

    ColumnBehavior(DatabaseScope scope) {
        super(scope);
    }

    @Override
    public EntityType type() {
        return EntityType.COLUMN;
    }

    @Override
    public List<String> listNames(ReflectedNode table) {
        return column(db(table).query(LIST_COLUMNS, objectId(table)), "name");
    }

    @Override
    public boolean exists(ReflectedNode table, String name) {
        return db(table).any(COLUMN_EXISTS, objectId(table), name);
    }

    @Override
    public void create(ReflectedNode table, DeclaredNode declared) {
        db(table).execute(format(ADD_COLUMN, quote(schemaOf(table)), quote(table.name()), columnDefinition(declared)));
    }

    @Override
    public Optional<Row> fetchDetail(ReflectedNode column) {
        return db(column).queryOne(COLUMN_DETAIL, schemaOf(column), tableOf(column), column.name());
    }

    // ---------- readers ----------

    @Override
    public Map<String, AttributeReader> readers() {
        return Map.of(
                CHAR_MAX_LEN, (c, d) -> carried(d, CHAR_MAX_LEN, ColumnTypes::carriesCharLength),
                DATETIME_PRECISION, (c, d) -> carried(d, DATETIME_PRECISION, ColumnTypes::carriesDatetimePrecision),
                NUMERIC_PRECISION, (c, d) -> carried(d, NUMERIC_PRECISION, ColumnTypes::carriesNumericPrecision),
                NUMERIC_SCALE, (c, d) -> carried(d, NUMERIC_SCALE, ColumnTypes::carriesNumericScale),
                NULLABLE, (c, d) -> d.flag(NULLABLE),
                IDENTITY, (c, d) -> d.flag(IDENTITY));
    }

    static Integer carried(Row detail, String field, Predicate<String> carries) {
        String dataType = detail.string(DATA_TYPE);
        if (!ColumnTypes.known(dataType) || !carries.test(dataType)) {
            return null;
        }
        return detail.integer(field);
    }

    // ---------- writers ----------

    @Override
    public Map<String, AttributeWriter> writers() {
        return Map.of(
                DATA_TYPE, this::changeType,
                CHAR_MAX_LEN, this::changeType,
                DATETIME_PRECISION, this::changeType,
                NUMERIC_PRECISION, this::changeType,
                NUMERIC_SCALE, this::changeType,
                NULLABLE, this::alterColumn,
                IDENTITY, this::changeIdentity);
    }

    private boolean changeType(ReflectedNode column, DeclaredNode declared) {
        if (!dropDependentIndexes(column)) {
            return false;
        }
        return alterColumn(column, declared);
    }

    private boolean alterColumn(ReflectedNode column, DeclaredNode declared) {
        db(column).execute(format(ALTER_COLUMN, quote(schemaOf(column)), quote(tableOf(column)),
                alterColumnDefinition(declared)));
        // one ALTER COLUMN rewrites every parameter of the type
        column.resetAttributes();
        return true;
    }

    private boolean changeIdentity(ReflectedNode column, DeclaredNode declared) {
        if (!dropDependentIndexes(column)) {
            return false;
        }
        log.log(Level.WARNING, "Changing identity of " + column.fullName() + " drops and re-adds the column; its data is lost");
        BackendDriver driver = db(column);
        driver.execute(format(DROP_COLUMN, quote(schemaOf(column)), quote(tableOf(column)), quote(column.name())));
        driver.execute(format(ADD_COLUMN, quote(schemaOf(column)), quote(tableOf(column)), columnDefinition(declared)));
        column.resetAttributes();
        return true;
    }

    /**
     * Drop every primary key and index of the table that uses the column.
     *
     * @return false when one of them was not dropped
     */
    boolean dropDependentIndexes(ReflectedNode column) {
        ReflectedNode table = column.parent();
        List<ReflectedNode> dependents = new ArrayList<>();
        for (EntityType type : List.of(EntityType.PRIMARY_KEY, EntityType.INDEX)) {
            for (ReflectedNode index : table.children(type)) {
                if (uses(index, column.name())) {
                    dependents.add(index);
                }
            }
        }
        for (ReflectedNode index : dependents) {
            log.log(Level.INFO, index.type() + " " + index.fullName() + " depends on column " + column.name());
            if (!index.delete()) {
                log.log(Level.WARNING, "Column " + column.fullName() + " left unchanged: " + index.fullName() + " was not dropped");
                return false;
            }
        }
        return true;
    }

    private static boolean uses(ReflectedNode index, String columnName) {
        if (containsIgnoreCase(names(index.attribute(COLUMNS)), columnName)) {
            return true;
        }
        return index.type() == EntityType.INDEX
                && containsIgnoreCase(names(index.attribute(INCLUDED_COLUMNS)), columnName);
    }

    private static boolean containsIgnoreCase(List<String> names, String name) {
        for (String n : names) {
            if (n.equalsIgnoreCase(name)) return true;
        }
        return false;
    }

    // ---------- rename / delete ----------

    @Override
    public void rename(ReflectedNode column, String newName) {
        db(column).execute(RENAME_TYPED_OBJECT, objectId(column) + "." + quote(column.name()), newName, "COLUMN");
    }

    @Override
    public boolean delete(ReflectedNode column) {
        if (!dropDependentIndexes(column)) {
            return false;
        }
        db(column).execute(format(DROP_COLUMN, quote(schemaOf(column)), quote(tableOf(column)), quote(column.name())));
        return true;
    }
}
