// file: core/src/main/java/io/schemasync/core/model/AttributeRegistry.java
package io.schemasync.core.model;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.schemasync.core.model.AttributeKind.*;

/**
 * Static table: entity type -> ordered attributes that are read on both trees
 * and may be altered on the live side.
 * <p>
 * Declared nodes must carry exactly these attributes; live nodes may only read
 * and write these; the aligner compares them in this order.
 */
public final class AttributeRegistry {

    // Login
    public static final String TYPE_DESC = "typeDesc";
    public static final String SERVER_ROLES = "serverRoles";
    // Database
    public static final String RECOVERY_MODEL = "recoveryModel";
    public static final String DATA_SIZE = "dataSize";
    public static final String LOG_SIZE = "logSize";
    public static final String OWNER = "owner";
    public static final String DATA_FILE_PATH = "dataFilePath";
    public static final String LOG_FILE_PATH = "logFilePath";
    // Column
    public static final String DATA_TYPE = "dataType";
    public static final String CHAR_MAX_LEN = "charMaxLen";
    public static final String DATETIME_PRECISION = "datetimePrecision";
    public static final String NUMERIC_PRECISION = "numericPrecision";
    public static final String NUMERIC_SCALE = "numericScale";
    public static final String NULLABLE = "nullable";
    public static final String IDENTITY = "identity";
    // Foreign key
    public static final String FOREIGN_SCHEMA = "foreignSchema";
    public static final String FOREIGN_TABLE = "foreignTable";
    public static final String FOREIGN_COLUMN = "foreignColumn";
    public static final String KEY_COLUMN = "column";
    // Primary key / index
    public static final String COLUMNS = "columns";
    public static final String CLUSTERED = "clustered";
    public static final String COMPRESSION = "compression";
    public static final String INCLUDED_COLUMNS = "includedColumns";
    public static final String UNIQUE = "unique";
    // User
    public static final String LOGIN_NAME = "loginName";
    public static final String DB_ROLES = "dbRoles";

    private static final Map<EntityType, List<AttributeSpec>> REGISTRY = build();

    private AttributeRegistry() {
        // static table
    }

    private static Map<EntityType, List<AttributeSpec>> build() {
        Map<EntityType, List<AttributeSpec>> m = new EnumMap<>(EntityType.class);
        m.put(EntityType.SERVER, List.of());
        m.put(EntityType.SCHEMA, List.of());
        m.put(EntityType.TABLE, List.of());
        m.put(EntityType.LOGIN, List.of(
                AttributeSpec.of(TYPE_DESC, TEXT, "SQL_LOGIN"),
                AttributeSpec.of(SERVER_ROLES, NAME_SET)
        ));
        m.put(EntityType.DATABASE, List.of(
                AttributeSpec.of(RECOVERY_MODEL, TEXT, "FULL"),
                AttributeSpec.optional(DATA_SIZE, NUMBER),
                AttributeSpec.optional(LOG_SIZE, NUMBER),
                AttributeSpec.optional(OWNER, TEXT),
                AttributeSpec.optional(DATA_FILE_PATH, PATH),
                AttributeSpec.optional(LOG_FILE_PATH, PATH)
        ));
        m.put(EntityType.COLUMN, List.of(
                AttributeSpec.of(DATA_TYPE, TEXT),
                AttributeSpec.of(CHAR_MAX_LEN, NUMBER),
                AttributeSpec.of(DATETIME_PRECISION, NUMBER),
                AttributeSpec.of(NUMERIC_PRECISION, NUMBER),
                AttributeSpec.of(NUMERIC_SCALE, NUMBER),
                AttributeSpec.of(NULLABLE, FLAG, false),
                AttributeSpec.of(IDENTITY, FLAG, false)
        ));
        m.put(EntityType.FOREIGN_KEY, List.of(
                AttributeSpec.of(FOREIGN_SCHEMA, TEXT, "dbo"),
                AttributeSpec.of(FOREIGN_TABLE, TEXT),
                AttributeSpec.of(FOREIGN_COLUMN, TEXT),
                AttributeSpec.of(KEY_COLUMN, TEXT)
        ));
        m.put(EntityType.PRIMARY_KEY, List.of(
                AttributeSpec.of(COLUMNS, ORDERED_NAMES),
                AttributeSpec.of(CLUSTERED, FLAG, true),
                AttributeSpec.of(COMPRESSION, TEXT, "NONE")
        ));
        m.put(EntityType.INDEX, List.of(
                AttributeSpec.of(COLUMNS, ORDERED_NAMES),
                AttributeSpec.of(CLUSTERED, FLAG, false),
                AttributeSpec.of(COMPRESSION, TEXT, "NONE"),
                AttributeSpec.of(INCLUDED_COLUMNS, NAME_SET),
                AttributeSpec.of(UNIQUE, FLAG, false)
        ));
        m.put(EntityType.USER, List.of(
                AttributeSpec.of(LOGIN_NAME, TEXT),
                AttributeSpec.of(DB_ROLES, NAME_SET)
        ));
        m.put(EntityType.PARTITION, List.of(
                AttributeSpec.of(KEY_COLUMN, TEXT)
        ));
        return m;
    }

    /**
     * Ordered attribute specs for a type.
     *
     * @throws IllegalStateException if the type has no entry (programming error)
     */
    public static List<AttributeSpec> specs(EntityType type) {
        List<AttributeSpec> specs = REGISTRY.get(type);
        if (specs == null) {
            throw new IllegalStateException("no attribute registry entry for " + type);
        }
        return specs;
    }

    /** Ordered attribute names for a type. */
    public static List<String> names(EntityType type) {
        return specs(type).stream().map(AttributeSpec::name).toList();
    }

    public static Optional<AttributeSpec> find(EntityType type, String name) {
        return specs(type).stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public static AttributeSpec spec(EntityType type, String name) {
        return find(type, name).orElseThrow(() ->
                new IllegalArgumentException("\"" + name + "\" is not an attribute of " + type));
    }

    public static boolean isAttribute(EntityType type, String name) {
        return find(type, name).isPresent();
    }

    /**
     * Registry defaults for a type, in registry order. Null defaults are kept.
     */
    public static Map<String, Object> defaults(EntityType type) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (AttributeSpec s : specs(type)) {
            out.put(s.name(), s.defaultValue());
        }
        return out;
    }
}
