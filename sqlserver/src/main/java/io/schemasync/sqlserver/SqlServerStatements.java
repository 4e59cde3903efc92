// file: sqlserver/src/main/java/io/schemasync/sqlserver/SqlServerStatements.java
package io.schemasync.sqlserver;

import io.schemasync.core.DeclarationException;
import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.model.AttributeValues;
import io.schemasync.core.model.ColumnTypes;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import static io.schemasync.core.model.AttributeRegistry.*;

/**
 * T-SQL text used by the SQL Server behaviors.
 * <p>
 * Values travel as {@code ?} parameters. Identifiers cannot be parameters, so
 * statements that name objects are rendered with {@link #quote(String)} and
 * {@code %s} placeholders. Keyword-valued settings (recovery model, compression)
 * are checked against their closed sets before they are spliced in.
 */
public final class SqlServerStatements {

    private SqlServerStatements() {
    }

    // ---------- server ----------

    public static final String SERVER_NAME = "SELECT @@SERVERNAME AS name";

    public static final String CURRENT_DATABASE = "SELECT DB_NAME() AS name";

    public static final String USE_DATABASE = "USE %s";

    // ---------- logins ----------

    public static final String LIST_LOGINS = """
            SELECT sl.name, sp.type_desc AS [typeDesc], sl.sysadmin, sl.securityadmin, sl.serveradmin,
                   sl.setupadmin, sl.processadmin, sl.diskadmin, sl.dbcreator, sl.bulkadmin
            FROM master.dbo.syslogins sl
            JOIN sys.server_principals sp ON sp.sid = sl.sid
            WHERE sl.isntuser = 0 AND sp.type_desc = 'SQL_LOGIN'""";

    public static final String LOGIN_DETAIL = LIST_LOGINS + " AND sl.name = ?";

    public static final String LOGIN_EXISTS = "SELECT 1 AS found FROM master.dbo.syslogins WHERE name = ?";

    public static final String ALTER_SERVER_ROLE = "ALTER SERVER ROLE %s %s MEMBER %s";

    public static final String RENAME_LOGIN = "ALTER LOGIN %s WITH NAME = %s";

    public static final String DROP_LOGIN = "DROP LOGIN %s";

    // ---------- databases ----------

    public static final String LIST_DATABASES = "SELECT name FROM master.sys.databases";

    public static final String DATABASE_EXISTS = "SELECT 1 AS found FROM master.sys.databases WHERE name = ?";

    public static final String DATABASE_DETAIL = """
            SELECT name, recovery_model_desc AS [recoveryModel], suser_sname(owner_sid) AS [owner]
            FROM master.sys.databases
            WHERE name = ?""";

    public static final String DATABASE_SIZES = """
            SELECT CAST(SUM(CASE WHEN type_desc = 'ROWS' THEN size END) * 8. / 1024 AS DECIMAL(10,2)) AS row_size_mb,
                   CAST(SUM(CASE WHEN type_desc = 'LOG' THEN size END) * 8. / 1024 AS DECIMAL(10,2)) AS log_size_mb
            FROM sys.master_files
            WHERE database_id = DB_ID(?)""";

    public static final String DATABASE_FILE = """
            SELECT name, CAST(size / 128.0 AS INT) AS current_size_mb, physical_name
            FROM sys.master_files
            WHERE database_id = DB_ID(?) AND type_desc = ?""";

    public static final String DATABASE_IN_AVAILABILITY_GROUP =
            "SELECT 1 AS found FROM sys.dm_hadr_database_replica_states WHERE database_id = DB_ID(?)";

    public static final String CREATE_DATABASE = "CREATE DATABASE %s";

    public static final String CREATE_DATABASE_WITH_FILES = """
            CREATE DATABASE %1$s
             CONTAINMENT = NONE
             ON PRIMARY
            ( NAME = N'%2$s', FILENAME = N'%3$s', SIZE = %4$dMB, MAXSIZE = UNLIMITED, FILEGROWTH = 10%%)
             LOG ON
            ( NAME = N'%2$s_log', FILENAME = N'%5$s', SIZE = %6$dMB, MAXSIZE = UNLIMITED, FILEGROWTH = 10%%)""";

    public static final String SET_RECOVERY_MODEL = "ALTER DATABASE %s SET RECOVERY %s";

    public static final String SET_DATABASE_OWNER = "ALTER AUTHORIZATION ON DATABASE::%s TO %s";

    public static final String GROW_FILE = "ALTER DATABASE %s MODIFY FILE (NAME = %s, SIZE = %dMB)";

    public static final String SHRINK_FILE = "DBCC SHRINKFILE (%s, %d)";

    public static final String MOVE_FILE = "ALTER DATABASE %s MODIFY FILE (NAME = %s, FILENAME = N'%s')";

    public static final String SET_OFFLINE = "ALTER DATABASE %s SET OFFLINE WITH ROLLBACK IMMEDIATE";

    public static final String SET_ONLINE = "ALTER DATABASE %s SET ONLINE";

    public static final String RENAME_DATABASE = "ALTER DATABASE %s MODIFY NAME = %s";

    // ---------- schemas ----------

    public static final String LIST_SCHEMAS = "SELECT name FROM sys.schemas WHERE schema_id < 16384";

    public static final String SCHEMA_DETAIL = "SELECT name, schema_id, principal_id FROM sys.schemas WHERE schema_id < 16384 AND name = ?";

    public static final String SCHEMA_HAS_OBJECTS = """
            SELECT TOP 1 o.name
            FROM sys.objects o
            JOIN sys.schemas s ON s.schema_id = o.schema_id
            WHERE s.name = ?""";

    public static final String CREATE_SCHEMA = "CREATE SCHEMA %s";

    public static final String DROP_SCHEMA = "DROP SCHEMA %s";

    // ---------- users ----------

    public static final String LIST_USERS = """
            SELECT dp.name AS name, sp.name AS [loginName]
            FROM sys.database_principals dp
            JOIN sys.server_principals sp ON dp.sid = sp.sid
            WHERE dp.type_desc = 'SQL_USER'""";

    public static final String USER_DETAIL = LIST_USERS + " AND dp.name = ?";

    public static final String USER_EXISTS = "SELECT 1 AS found FROM sys.database_principals WHERE type = 'S' AND name = ?";

    public static final String USER_ROLES = """
            SELECT role.name AS role_name
            FROM sys.database_role_members drm
            JOIN sys.database_principals role ON drm.role_principal_id = role.principal_id
            JOIN sys.database_principals member ON drm.member_principal_id = member.principal_id
            WHERE role.type = 'R' AND member.name = ?""";

    public static final String CREATE_USER = "CREATE USER %s FOR LOGIN %s WITH DEFAULT_SCHEMA = [dbo]";

    public static final String ALTER_DATABASE_ROLE = "ALTER ROLE %s %s MEMBER %s";

    public static final String RENAME_USER = "ALTER USER %s WITH NAME = %s";

    public static final String DROP_USER = "DROP USER %s";

    // ---------- tables ----------

    public static final String LIST_TABLES = """
            SELECT t.name, t.type_desc
            FROM sys.tables t
            JOIN sys.schemas s ON t.schema_id = s.schema_id
            WHERE s.name = ?""";

    public static final String TABLE_DETAIL = LIST_TABLES + " AND t.name = ?";

    public static final String TABLE_EXISTS = """
            SELECT 1 AS found
            FROM sys.tables t
            JOIN sys.schemas s ON t.schema_id = s.schema_id
            WHERE s.name = ? AND t.name = ?""";

    public static final String CREATE_TABLE = "CREATE TABLE %s.%s (%s) ON [PRIMARY]";

    public static final String DROP_TABLE = "DROP TABLE %s.%s";

    public static final String RENAME_OBJECT = "EXEC sp_rename ?, ?";

    public static final String RENAME_TYPED_OBJECT = "EXEC sp_rename ?, ?, ?";

    public static final String MIN_VALUE = "SELECT MIN(%s) AS value FROM %s.%s";

    public static final String MAX_VALUE = "SELECT MAX(%s) AS value FROM %s.%s";

    // ---------- columns ----------

    public static final String LIST_COLUMNS = "SELECT name FROM sys.columns WHERE object_id = OBJECT_ID(?) ORDER BY column_id";

    public static final String COLUMN_EXISTS = "SELECT 1 AS found FROM sys.columns WHERE object_id = OBJECT_ID(?) AND name = ?";

    public static final String COLUMN_DETAIL = """
            SELECT sc.name,
                   isc.DATA_TYPE AS [dataType],
                   isc.CHARACTER_MAXIMUM_LENGTH AS [charMaxLen],
                   isc.DATETIME_PRECISION AS [datetimePrecision],
                   isc.NUMERIC_PRECISION AS [numericPrecision],
                   isc.NUMERIC_SCALE AS [numericScale],
                   sc.is_nullable AS [nullable],
                   sc.is_identity AS [identity]
            FROM sys.columns sc
            JOIN sys.tables t ON t.object_id = sc.object_id
            JOIN sys.schemas s ON s.schema_id = t.schema_id
            JOIN INFORMATION_SCHEMA.COLUMNS isc
              ON isc.TABLE_SCHEMA = s.name AND isc.TABLE_NAME = t.name AND isc.COLUMN_NAME = sc.name
            WHERE s.name = ? AND t.name = ? AND sc.name = ?""";

    public static final String ADD_COLUMN = "ALTER TABLE %s.%s ADD %s";

    public static final String ALTER_COLUMN = "ALTER TABLE %s.%s ALTER COLUMN %s";

    public static final String DROP_COLUMN = "ALTER TABLE %s.%s DROP COLUMN %s";

    // ---------- constraints ----------

    public static final String DROP_CONSTRAINT = "ALTER TABLE %s.%s DROP CONSTRAINT %s";

    public static final String LIST_FOREIGN_KEYS = "SELECT name FROM sys.foreign_keys WHERE parent_object_id = OBJECT_ID(?)";

    public static final String FOREIGN_KEY_EXISTS = LIST_FOREIGN_KEYS + " AND name = ?";

    public static final String FOREIGN_KEY_DETAIL = """
            SELECT fk.name AS name,
                   OBJECT_SCHEMA_NAME(fkc.referenced_object_id) AS [foreignSchema],
                   OBJECT_NAME(fkc.referenced_object_id) AS [foreignTable],
                   COL_NAME(fkc.referenced_object_id, fkc.referenced_column_id) AS [foreignColumn],
                   COL_NAME(fkc.parent_object_id, fkc.parent_column_id) AS [column]
            FROM sys.foreign_key_columns fkc
            JOIN sys.foreign_keys fk ON fk.object_id = fkc.constraint_object_id
            WHERE fkc.parent_object_id = OBJECT_ID(?) AND fk.name = ?""";

    /** Foreign keys of any table that reference the given key, one row per column pair. */
    public static final String REFERENCING_FOREIGN_KEYS = """
            SELECT fk.name AS name,
                   OBJECT_SCHEMA_NAME(fk.parent_object_id) AS [schema],
                   OBJECT_NAME(fk.parent_object_id) AS [table],
                   COL_NAME(fkc.parent_object_id, fkc.parent_column_id) AS [column],
                   COL_NAME(fkc.referenced_object_id, fkc.referenced_column_id) AS [foreignColumn]
            FROM sys.foreign_keys fk
            JOIN sys.foreign_key_columns fkc ON fkc.constraint_object_id = fk.object_id
            JOIN sys.indexes ind ON ind.object_id = fk.referenced_object_id AND ind.index_id = fk.key_index_id
            WHERE fk.referenced_object_id = OBJECT_ID(?) AND ind.name = ?
            ORDER BY fk.name, fkc.constraint_column_id""";

    public static final String CREATE_FOREIGN_KEY = "ALTER TABLE %s.%s ADD CONSTRAINT %s FOREIGN KEY (%s) REFERENCES %s.%s (%s)";

    // ---------- primary keys / indexes ----------

    public static final String LIST_PRIMARY_KEYS = "SELECT name FROM sys.indexes WHERE is_primary_key = 1 AND object_id = OBJECT_ID(?)";

    public static final String PRIMARY_KEY_EXISTS = LIST_PRIMARY_KEYS + " AND name = ?";

    public static final String LIST_INDEXES =
            "SELECT name FROM sys.indexes WHERE is_primary_key = 0 AND type IN (1, 2) AND object_id = OBJECT_ID(?)";

    public static final String INDEX_EXISTS = "SELECT name FROM sys.indexes WHERE object_id = OBJECT_ID(?) AND name = ?";

    public static final String INDEX_DETAIL = """
            SELECT ind.name AS name,
                   ind.type_desc AS type_desc,
                   ind.is_primary_key AS is_primary_key,
                   ind.is_unique AS [unique],
                   ind.is_unique_constraint AS is_unique_constraint,
                   sp.data_compression_desc AS [compression]
            FROM sys.indexes ind
            JOIN sys.partitions sp ON sp.object_id = ind.object_id AND sp.index_id = ind.index_id
            WHERE ind.object_id = OBJECT_ID(?) AND ind.name = ?""";

    private static final String INDEX_COLUMNS = """
            SELECT col.name AS column_name
            FROM sys.indexes ind
            JOIN sys.index_columns ic ON ind.object_id = ic.object_id AND ind.index_id = ic.index_id
            JOIN sys.columns col ON ic.object_id = col.object_id AND ic.column_id = col.column_id
            WHERE ind.object_id = OBJECT_ID(?) AND ind.name = ?""";

    public static final String INDEX_KEY_COLUMNS_WITHOUT_PARTITION =
            INDEX_COLUMNS + " AND ic.is_included_column = 0 AND ic.partition_ordinal = 0 ORDER BY ic.key_ordinal";

    public static final String INDEX_KEY_COLUMNS =
            INDEX_COLUMNS + " AND ic.is_included_column = 0 ORDER BY ic.key_ordinal";

    public static final String INDEX_INCLUDED_COLUMNS =
            INDEX_COLUMNS + " AND ic.is_included_column = 1 ORDER BY ic.index_column_id";

    public static final String CREATE_PRIMARY_KEY =
            "ALTER TABLE %s.%s ADD CONSTRAINT %s PRIMARY KEY %s (%s) WITH (DATA_COMPRESSION = %s)";

    public static final String CREATE_INDEX =
            "CREATE %sINDEX %s ON %s.%s (%s)%s WITH (DATA_COMPRESSION = %s, DROP_EXISTING = %s) ON %s";

    public static final String REBUILD_INDEX =
            "ALTER INDEX %s ON %s.%s REBUILD PARTITION = ALL WITH (DATA_COMPRESSION = %s, ONLINE = OFF)";

    public static final String DROP_INDEX = "DROP INDEX %s ON %s.%s";

    // ---------- partitions ----------

    private static final String TABLE_PARTITIONS = """
            SELECT c.name AS column_name, ps.name AS ps_name, pf.name AS pf_name
            FROM sys.tables t
            JOIN sys.indexes i ON i.object_id = t.object_id
            JOIN sys.index_columns ic ON ic.index_id = i.index_id AND ic.object_id = t.object_id
            JOIN sys.columns c ON c.object_id = ic.object_id AND c.column_id = ic.column_id
            JOIN sys.partition_schemes ps ON ps.data_space_id = i.data_space_id
            JOIN sys.partition_functions pf ON pf.function_id = ps.function_id
            WHERE t.object_id = OBJECT_ID(?) AND ic.partition_ordinal > 0 AND i.index_id < 2""";

    public static final String LIST_PARTITIONS = TABLE_PARTITIONS;

    public static final String PARTITION_DETAIL = TABLE_PARTITIONS + " AND ps.name = ?";

    public static final String CREATE_PARTITION_FUNCTION = "CREATE PARTITION FUNCTION %s (%s) AS RANGE RIGHT FOR VALUES (%s)";

    public static final String CREATE_PARTITION_SCHEME = "CREATE PARTITION SCHEME %s AS PARTITION %s ALL TO ([PRIMARY])";

    public static final String DROP_PARTITION_SCHEME = "DROP PARTITION SCHEME %s";

    public static final String DROP_PARTITION_FUNCTION = "DROP PARTITION FUNCTION %s";

    public static final String PRIMARY_FILEGROUP = "[PRIMARY]";

    // ---------- rendering ----------

    private static final Set<String> RECOVERY_MODELS = Set.of("FULL", "SIMPLE", "BULK_LOGGED");
    private static final Set<String> COMPRESSIONS = Set.of("NONE", "ROW", "PAGE");

    /** Bracket-quote an identifier, doubling any closing bracket inside it. */
    public static String quote(String identifier) {
        return "[" + identifier.replace("]", "]]") + "]";
    }

    /** {@code [schema].[table]}, the form OBJECT_ID and the DDL statements expect. */
    public static String qualified(String schema, String object) {
        return quote(schema) + "." + quote(object);
    }

    public static String quotedList(Collection<String> identifiers) {
        return identifiers.stream().map(SqlServerStatements::quote).collect(Collectors.joining(", "));
    }

    public static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }

    public static String recoveryModel(String value) {
        return keyword(value, RECOVERY_MODELS, "recovery model");
    }

    public static String compression(String value) {
        return keyword(value == null ? "NONE" : value, COMPRESSIONS, "data compression");
    }

    private static String keyword(String value, Set<String> allowed, String what) {
        String v = value == null ? "" : value.strip().toUpperCase(Locale.ROOT);
        if (!allowed.contains(v)) {
            throw new DeclarationException("invalid " + what + ": " + value + " (expected one of " + allowed + ")");
        }
        return v;
    }

    /** File paths and file names end up inside N'...' literals. */
    public static String literal(String value) {
        return value.replace("'", "''");
    }

    /** Data type with its parameters, e.g. {@code numeric(10,2)}. */
    public static String dataType(DeclaredNode column) {
        return ColumnTypes.render(column.text(DATA_TYPE),
                column.integer(CHAR_MAX_LEN),
                column.integer(DATETIME_PRECISION),
                column.integer(NUMERIC_PRECISION),
                column.integer(NUMERIC_SCALE));
    }

    /**
     * Column definition for CREATE TABLE / ADD, e.g. {@code [ID] int IDENTITY(1,1) NOT NULL}.
     */
    public static String columnDefinition(DeclaredNode column) {
        return columnDefinition(column, true);
    }

    /** ALTER COLUMN cannot carry IDENTITY; identity changes go through drop and re-add. */
    public static String alterColumnDefinition(DeclaredNode column) {
        return columnDefinition(column, false);
    }

    private static String columnDefinition(DeclaredNode column, boolean withIdentity) {
        StringBuilder sb = new StringBuilder(quote(column.name())).append(' ').append(dataType(column));
        if (withIdentity && column.flag(IDENTITY)) {
            sb.append(" IDENTITY(1,1)");
        }
        sb.append(column.flag(NULLABLE) ? " NULL" : " NOT NULL");
        return sb.toString();
    }

    public static String createPrimaryKey(String schema, String table, String name, List<String> columns,
                                          boolean clustered, String compression) {
        return format(CREATE_PRIMARY_KEY, quote(schema), quote(table), quote(name),
                clustered ? "CLUSTERED" : "NONCLUSTERED", quotedList(columns), compression(compression));
    }

    /**
     * @param createOn filegroup or partition scheme clause, e.g. {@code [PRIMARY]} or {@code [ps_x]([col])}
     */
    public static String createIndex(String schema, String table, String name, List<String> columns,
                                     Collection<String> includedColumns, boolean unique, boolean clustered,
                                     String compression, boolean dropExisting, String createOn) {
        String include = includedColumns == null || includedColumns.isEmpty()
                ? ""
                : " INCLUDE (" + quotedList(includedColumns) + ")";
        String kind = (unique ? "UNIQUE " : "") + (clustered ? "CLUSTERED " : "NONCLUSTERED ");
        return format(CREATE_INDEX, kind, quote(name), quote(schema), quote(table), quotedList(columns),
                include, compression(compression), dropExisting ? "ON" : "OFF", createOn);
    }

    public static String partitionClause(String scheme, String column) {
        return quote(scheme) + "(" + quote(column) + ")";
    }

    public static List<String> names(Object value) {
        return AttributeValues.names(value);
    }
}
