// file: sqlserver/src/main/java/io/schemasync/sqlserver/IndexSupport.java
package io.schemasync.sqlserver;

import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.live.AttributeReader;
import io.schemasync.core.live.BackendDriver;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.live.Row;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.schemasync.core.model.AttributeRegistry.*;
import static io.schemasync.sqlserver.SqlServerStatements.*;

/**
 * What primary keys and indexes share: both are rows of {@code sys.indexes},
 * read the same way and dropped the same way.
 */
abstract class IndexSupport extends SqlServerBehavior {

    protected IndexSupport(DatabaseScope scope) {
        super(scope);
    }

    @Override
    public Optional<Row> fetchDetail(ReflectedNode index) {
        return db(index).queryOne(INDEX_DETAIL, objectId(index), index.name());
    }

    @Override
    public Map<String, AttributeReader> readers() {
        Map<String, AttributeReader> readers = new HashMap<>();
        readers.put(COLUMNS, (index, detail) -> keyColumns(index));
        readers.put(CLUSTERED, (index, detail) -> "CLUSTERED".equalsIgnoreCase(detail.string("type_desc")));
        return readers;
    }

    /**
     * Key columns in key order. The partitioning column is appended to keys of
     * a partitioned table and is left out, unless it is the only key column.
     */
    List<String> keyColumns(ReflectedNode index) {
        BackendDriver driver = db(index);
        String objectId = objectId(index);
        List<String> columns = column(driver.query(INDEX_KEY_COLUMNS_WITHOUT_PARTITION, objectId, index.name()), "column_name");
        if (columns.isEmpty()) {
            columns = column(driver.query(INDEX_KEY_COLUMNS, objectId, index.name()), "column_name");
        }
        return columns;
    }

    /** Where a new index of the table goes: its partition scheme when partitioned, else the primary filegroup. */
    String createOn(ReflectedNode table) {
        Optional<Row> partition = db(table).queryOne(LIST_PARTITIONS, objectId(table));
        return partition
                .map(p -> partitionClause(p.string("ps_name"), p.string("column_name")))
                .orElse(PRIMARY_FILEGROUP);
    }

    boolean rebuildWithCompression(ReflectedNode index, DeclaredNode declared) {
        db(index).execute(format(REBUILD_INDEX, quote(index.name()), quote(schemaOf(index)), quote(tableOf(index)),
                compression(declared.text(COMPRESSION))));
        return true;
    }

    @Override
    public void rename(ReflectedNode index, String newName) {
        db(index).execute(RENAME_TYPED_OBJECT, objectId(index) + "." + quote(index.name()), newName, "INDEX");
    }

    /** Constraint-backed indexes go through DROP CONSTRAINT, plain indexes through DROP INDEX. */
    @Override
    public boolean delete(ReflectedNode index) {
        Row detail = index.detail();
        BackendDriver driver = db(index);
        if (detail.flag("is_primary_key") || detail.flag("is_unique_constraint")) {
            driver.execute(format(DROP_CONSTRAINT, quote(schemaOf(index)), quote(tableOf(index)), quote(index.name())));
        } else {
            driver.execute(format(DROP_INDEX, quote(index.name()), quote(schemaOf(index)), quote(tableOf(index))));
        }
        return true;
    }
}
