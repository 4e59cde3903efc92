// file: core/src/main/java/io/schemasync/core/declared/Declarations.java
package io.schemasync.core.declared;

import io.schemasync.core.DeclarationException;
import io.schemasync.core.ObjectNotFoundException;
import io.schemasync.core.model.EntityType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static io.schemasync.core.model.AttributeRegistry.*;

/**
 * Shorthand factories for building declared trees in code.
 * <p>
 * Column, key and index factories return builders pre-seeded with registry
 * defaults so callers only state what differs:
 * <pre>{@code
 * var person = Declarations.table("Person",
 *         Declarations.identityColumn("ID").build(),
 *         Declarations.varcharColumn("Name", 255).build(),
 *         Declarations.primaryKey("ID").build()).build();
 * }</pre>
 */
public final class Declarations {

    public static final String DEFAULT_SCHEMA = "dbo";

    private static final Set<String> RECOVERY_MODELS = Set.of("full", "simple", "bulk_logged");

    private Declarations() {
    }

    // ---------- columns ----------

    public static DeclaredNode.Builder column(String name, String dataType) {
        return DeclaredNode.builder(EntityType.COLUMN, name).withDefaults().attribute(DATA_TYPE, dataType);
    }

    public static DeclaredNode.Builder intColumn(String name) {
        return column(name, "int");
    }

    /** int IDENTITY(1,1) NOT NULL. */
    public static DeclaredNode.Builder identityColumn(String name) {
        return intColumn(name).attribute(IDENTITY, true).attribute(NULLABLE, false);
    }

    /** real when small (4 bytes), float(53) otherwise. */
    public static DeclaredNode.Builder floatColumn(String name, boolean small) {
        return small
                ? column(name, "real").attribute(NUMERIC_PRECISION, 24)
                : column(name, "float").attribute(NUMERIC_PRECISION, 53);
    }

    public static DeclaredNode.Builder floatColumn(String name) {
        return floatColumn(name, false);
    }

    public static DeclaredNode.Builder varcharColumn(String name, int charMaxLen) {
        return column(name, "varchar").attribute(CHAR_MAX_LEN, charMaxLen);
    }

    public static DeclaredNode.Builder dateColumn(String name) {
        return column(name, "date");
    }

    public static DeclaredNode.Builder dateTimeColumn(String name) {
        return dateTimeColumn(name, 7);
    }

    public static DeclaredNode.Builder dateTimeColumn(String name, int datetimePrecision) {
        return column(name, "datetime2").attribute(DATETIME_PRECISION, datetimePrecision);
    }

    public static DeclaredNode.Builder numericColumn(String name, int numericPrecision, int numericScale) {
        if (numericScale >= numericPrecision) {
            throw new DeclarationException("column \"" + name + "\": numeric scale must be less than numeric precision");
        }
        return column(name, "numeric")
                .attribute(NUMERIC_PRECISION, numericPrecision)
                .attribute(NUMERIC_SCALE, numericScale);
    }

    // ---------- keys, indexes, partitions ----------

    /** Clustered primary key named {@code PK_<columns>}. */
    public static DeclaredNode.Builder primaryKey(String... columns) {
        List<String> cols = lower(Arrays.asList(columns));
        return DeclaredNode.builder(EntityType.PRIMARY_KEY, generatedName("PK", cols, List.of()))
                .withDefaults()
                .attribute(COLUMNS, cols);
    }

    /** Non-clustered index named {@code IX_<columns>}. */
    public static DeclaredNode.Builder index(String... columns) {
        return index(Arrays.asList(columns), List.of());
    }

    /** Non-clustered index named {@code IX_<columns>__<included>}. */
    public static DeclaredNode.Builder index(List<String> columns, List<String> includedColumns) {
        List<String> cols = lower(columns);
        List<String> included = lower(includedColumns);
        return DeclaredNode.builder(EntityType.INDEX, generatedName("IX", cols, included))
                .withDefaults()
                .attribute(COLUMNS, cols)
                .attribute(INCLUDED_COLUMNS, included.isEmpty() ? null : Set.copyOf(included));
    }

    /**
     * Name given to a key or index declared without one.
     */
    public static String generatedName(String prefix, List<String> columns, List<String> includedColumns) {
        StringBuilder sb = new StringBuilder(prefix);
        for (String c : columns) {
            sb.append('_').append(c.toLowerCase(Locale.ROOT));
        }
        if (includedColumns != null && !includedColumns.isEmpty()) {
            sb.append("__").append(String.join("_", lower(includedColumns)));
        }
        return sb.toString();
    }

    /** Foreign key into the default schema. Named by the server on creation. */
    public static DeclaredNode foreignKey(String column, String foreignTable, String foreignColumn) {
        return foreignKey(column, DEFAULT_SCHEMA, foreignTable, foreignColumn);
    }

    public static DeclaredNode foreignKey(String column, String foreignSchema, String foreignTable, String foreignColumn) {
        return DeclaredNode.builder(EntityType.FOREIGN_KEY, "")
                .attribute(KEY_COLUMN, column)
                .attribute(FOREIGN_SCHEMA, foreignSchema)
                .attribute(FOREIGN_TABLE, foreignTable)
                .attribute(FOREIGN_COLUMN, foreignColumn)
                .build();
    }

    /** Daily time-range partition on a datetime column. Scheme and function names are generated on creation. */
    public static DeclaredNode partition(String column) {
        return DeclaredNode.builder(EntityType.PARTITION, "")
                .attribute(KEY_COLUMN, column.toLowerCase(Locale.ROOT))
                .build();
    }

    // ---------- containers ----------

    public static DeclaredNode.Builder table(String name, DeclaredNode... children) {
        return DeclaredNode.builder(EntityType.TABLE, name).children(Arrays.asList(children));
    }

    public static DeclaredNode.Builder schema(String name, DeclaredNode... tables) {
        return DeclaredNode.builder(EntityType.SCHEMA, name).children(Arrays.asList(tables));
    }

    /**
     * Database with server-default file placement.
     *
     * @param recoveryModel FULL, SIMPLE or BULK_LOGGED
     */
    public static DeclaredNode.Builder database(String name, String owner, String recoveryModel) {
        if (recoveryModel == null || !RECOVERY_MODELS.contains(recoveryModel.toLowerCase(Locale.ROOT))) {
            throw new DeclarationException("invalid database recovery model: " + recoveryModel);
        }
        return DeclaredNode.builder(EntityType.DATABASE, name)
                .withDefaults()
                .attribute(OWNER, owner)
                .attribute(RECOVERY_MODEL, recoveryModel);
    }

    public static DeclaredNode.Builder database(String name, String owner) {
        return database(name, owner, "FULL");
    }

    /**
     * Place the data and log files explicitly. The log defaults to a tenth of the data size,
     * file names to {@code <db>.mdf} and {@code <db>_log.ldf}.
     */
    public static DeclaredNode.Builder withFiles(DeclaredNode.Builder database, String databaseName,
                                                 String dataFileDir, String logFileDir,
                                                 int dataSizeMb, Integer logSizeMb) {
        if (dataSizeMb <= 0) {
            throw new DeclarationException("data size must be specified when a data file directory is given");
        }
        return database
                .attribute(DATA_SIZE, dataSizeMb)
                .attribute(LOG_SIZE, logSizeMb != null ? logSizeMb : Math.max(1, dataSizeMb / 10))
                .attribute(DATA_FILE_PATH, windowsPath(dataFileDir, databaseName + ".mdf"))
                .attribute(LOG_FILE_PATH, windowsPath(logFileDir == null ? dataFileDir : logFileDir, databaseName + "_log.ldf"));
    }

    /** Shorthand: tables go straight into the {@code dbo} schema. */
    public static DeclaredNode.Builder databaseWithTables(String name, String owner, DeclaredNode... tables) {
        return database(name, owner).child(schema(DEFAULT_SCHEMA, tables).build());
    }

    /** Find a declared table of a database by schema and table name. */
    public static DeclaredNode table(DeclaredNode database, String schemaName, String tableName) {
        return database.child(EntityType.SCHEMA, schemaName).child(EntityType.TABLE, tableName);
    }

    /** Add a table to a database, declaring the schema if it is not there yet. */
    public static void addTable(DeclaredNode database, DeclaredNode table, String schemaName) {
        DeclaredNode schema;
        try {
            schema = database.child(EntityType.SCHEMA, schemaName);
        } catch (ObjectNotFoundException e) {
            schema = schema(schemaName).build();
            database.addChild(schema);
        }
        schema.addChild(table);
    }

    // ---------- principals ----------

    public static DeclaredNode login(String name, String... serverRoles) {
        return DeclaredNode.builder(EntityType.LOGIN, name)
                .withDefaults()
                .attribute(SERVER_ROLES, Set.of(serverRoles))
                .build();
    }

    public static DeclaredNode user(String name, String loginName, String... dbRoles) {
        return DeclaredNode.builder(EntityType.USER, name)
                .attribute(LOGIN_NAME, loginName)
                .attribute(DB_ROLES, Set.of(dbRoles))
                .build();
    }

    public static DeclaredNode userForLogin(DeclaredNode login, String... dbRoles) {
        return user(login.name(), login.name(), dbRoles);
    }

    public static DeclaredNode.Builder server(DeclaredNode... children) {
        return DeclaredNode.builder(EntityType.SERVER, "").children(Arrays.asList(children));
    }

    // ---------- helpers ----------

    private static List<String> lower(List<String> in) {
        List<String> out = new ArrayList<>(in.size());
        for (String s : in) {
            out.add(s.toLowerCase(Locale.ROOT));
        }
        return out;
    }

    private static String windowsPath(String dir, String file) {
        String d = dir.replace('/', '\\');
        return d.endsWith("\\") ? d + file : d + "\\" + file;
    }
}
