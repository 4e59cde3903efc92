// file: sqlserver/src/main/java/io/schemasync/sqlserver/PartitionBehavior.java
package io.schemasync.sqlserver;

import io.schemasync.core.DeclarationException;
import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.live.AttributeReader;
import io.schemasync.core.live.BackendDriver;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.live.Row;
import io.schemasync.core.model.ColumnTypes;
import io.schemasync.core.model.EntityType;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.schemasync.core.model.AttributeRegistry.*;
import static io.schemasync.sqlserver.SqlServerStatements.*;

/**
 * Daily time-range partitioning of a table on one datetime column.
 * <p>
 * Creating a partition:
 *  - builds a RANGE RIGHT function with one boundary per day, from five days
 *    before the oldest row to five days after the newest (around today when
 *    the table is empty),
 *  - maps every partition to the primary filegroup through a scheme,
 *  - rebuilds the table's indexes on the scheme, clustered first, which is
 *    what actually moves the rows.
 * Dropping reverses this: indexes go back to the primary filegroup, then the
 * scheme and the function are dropped.
 */
final class PartitionBehavior extends SqlServerBehavior {
    private static final Logger log = Logger.getLogger(PartitionBehavior.class.getName());

    static final int MARGIN_DAYS = 5;
    private static final DateTimeFormatter BOUNDARY = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Clock clock;

    PartitionBehavior(DatabaseScope scope, Clock clock) {
        super(scope);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public EntityType type() {
        return EntityType.PARTITION;
    }

    @Override
    public List<String> listNames(ReflectedNode table) {
        // one row per partitioned index column; a table has at most one scheme on its clustered index
        return new ArrayList<>(new LinkedHashSet<>(column(db(table).query(LIST_PARTITIONS, objectId(table)), "ps_name")));
    }

    @Override
    public boolean exists(ReflectedNode table, String name) {
        return db(table).any(PARTITION_DETAIL, objectId(table), name);
    }

    @Override
    public Optional<Row> fetchDetail(ReflectedNode partition) {
        return db(partition).queryOne(PARTITION_DETAIL, objectId(partition), partition.name());
    }

    @Override
    public Map<String, AttributeReader> readers() {
        return Map.of(KEY_COLUMN, (partition, detail) -> detail.string("column_name"));
    }

    @Override
    public boolean supportsRename() {
        return false;
    }

    static String functionName(String schema, String table, String column) {
        return "pf_" + schema + "_" + table + "_" + column;
    }

    static String schemeName(String schema, String table, String column) {
        return "ps_" + schema + "_" + table + "_" + column;
    }

    /** Day boundaries as {@code 'yyyyMMdd'} literals, from min - 5 days up to (excluding) max + 5 days. */
    static List<String> boundaries(LocalDate min, LocalDate max) {
        LocalDate start = min.minusDays(MARGIN_DAYS);
        LocalDate end = max.plusDays(MARGIN_DAYS);
        List<String> out = new ArrayList<>();
        for (LocalDate d = start; d.isBefore(end); d = d.plusDays(1)) {
            out.add("'" + BOUNDARY.format(d) + "'");
        }
        return out;
    }

    // ---------- create ----------

    @Override
    public void create(ReflectedNode table, DeclaredNode declared) {
        String schema = table.parent().name();
        String columnName = declared.text(KEY_COLUMN);
        ReflectedNode column = table.child(EntityType.COLUMN, columnName);
        String dataType = Objects.toString(column.attribute(DATA_TYPE), null);
        if (!ColumnTypes.partitionable(dataType)) {
            throw new DeclarationException("cannot partition " + table.fullName() + " on " + columnName
                    + ": only datetime and datetime2 columns can be partitioned, not " + dataType);
        }
        List<IndexDefinition> indexes = indexes(table);
        if (indexes.stream().noneMatch(IndexDefinition::clustered)) {
            throw new DeclarationException("cannot partition " + table.fullName() + ": the table has no clustered index to move");
        }

        BackendDriver driver = db(table);
        String quotedColumn = quote(columnName);
        LocalDate today = LocalDate.now(clock);
        LocalDate min = date(driver.queryOne(format(MIN_VALUE, quotedColumn, quote(schema), quote(table.name()))), today);
        LocalDate max = date(driver.queryOne(format(MAX_VALUE, quotedColumn, quote(schema), quote(table.name()))), today);

        String pf = functionName(schema, table.name(), columnName);
        String ps = schemeName(schema, table.name(), columnName);
        String functionType = ColumnTypes.render(dataType, null, toInteger(column.attribute(DATETIME_PRECISION)), null, null);
        log.log(Level.INFO, "Partitioning " + table.fullName() + " on " + columnName + " from " + min + " to " + max);
        driver.execute(format(CREATE_PARTITION_FUNCTION, quote(pf), functionType, String.join(", ", boundaries(min, max))));
        driver.execute(format(CREATE_PARTITION_SCHEME, quote(ps), quote(pf)));
        rebuild(table, indexes, partitionClause(ps, columnName));
    }

    private static Integer toInteger(Object v) {
        return v instanceof Number n ? n.intValue() : null;
    }

    /** MIN/MAX of the column as a day; the fallback when the table is empty. */
    static LocalDate date(Optional<Row> row, LocalDate fallback) {
        if (row.isEmpty() || row.get().get("value") == null) return fallback;
        Object v = row.get().get("value");
        if (v instanceof java.sql.Timestamp ts) return ts.toLocalDateTime().toLocalDate();
        if (v instanceof java.sql.Date d) return d.toLocalDate();
        if (v instanceof LocalDateTime ldt) return ldt.toLocalDate();
        if (v instanceof LocalDate ld) return ld;
        if (v instanceof OffsetDateTime odt) return odt.toLocalDate();
        if (v instanceof java.util.Date d) return d.toInstant().atZone(ZoneId.systemDefault()).toLocalDate();
        return LocalDate.parse(v.toString().substring(0, 10));
    }

    // ---------- delete ----------

    @Override
    public boolean delete(ReflectedNode partition) {
        Row detail = partition.detail();
        ReflectedNode table = partition.parent();
        BackendDriver driver = db(partition);
        rebuild(table, indexes(table), PRIMARY_FILEGROUP);
        driver.execute(format(DROP_PARTITION_SCHEME, quote(detail.string("ps_name"))));
        driver.execute(format(DROP_PARTITION_FUNCTION, quote(detail.string("pf_name"))));
        return true;
    }

    // ---------- index moves ----------

    /** Live shape of one key or index, enough to rebuild it elsewhere. */
    record IndexDefinition(String name, List<String> columns, List<String> includedColumns,
                           boolean unique, boolean clustered, String compression) {
    }

    static List<IndexDefinition> indexes(ReflectedNode table) {
        List<IndexDefinition> out = new ArrayList<>();
        for (ReflectedNode key : table.children(EntityType.PRIMARY_KEY)) {
            out.add(new IndexDefinition(key.name(), names(key.attribute(COLUMNS)), List.of(), true,
                    Boolean.TRUE.equals(key.attribute(CLUSTERED)), Objects.toString(key.attribute(COMPRESSION), null)));
        }
        for (ReflectedNode index : table.children(EntityType.INDEX)) {
            out.add(new IndexDefinition(index.name(), names(index.attribute(COLUMNS)), names(index.attribute(INCLUDED_COLUMNS)),
                    Boolean.TRUE.equals(index.attribute(UNIQUE)), Boolean.TRUE.equals(index.attribute(CLUSTERED)),
                    Objects.toString(index.attribute(COMPRESSION), null)));
        }
        // the clustered index carries the rows and has to move first
        out.sort(Comparator.comparing(IndexDefinition::clustered).reversed());
        return out;
    }

    private void rebuild(ReflectedNode table, List<IndexDefinition> indexes, String createOn) {
        BackendDriver driver = db(table);
        String schema = table.parent().name();
        for (IndexDefinition index : indexes) {
            log.log(Level.FINE, "Rebuilding " + index.name() + " on " + createOn);
            driver.execute(createIndex(schema, table.name(), index.name(), index.columns(), index.includedColumns(),
                    index.unique(), index.clustered(), index.compression(), true, createOn));
        }
    }
}
