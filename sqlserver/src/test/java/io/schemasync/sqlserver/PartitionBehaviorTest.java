// file: sqlserver/src/test/java/io/schemasync/sqlserver/PartitionBehaviorTest.java
package io.schemasync.sqlserver;

import io.schemasync.core.DeclarationException;
import io.schemasync.core.live.ConfirmationProvider;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.live.Row;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static io.schemasync.core.declared.Declarations.partition;
import static io.schemasync.core.model.EntityType.*;
import static io.schemasync.sqlserver.SqlServerStatements.*;
import static org.junit.jupiter.api.Assertions.*;

class PartitionBehaviorTest {

    private static ScriptedBackendDriver events(String createdType) {
        return SqlServerTestSupport.shop()
                .on(TABLE_EXISTS, Row.of("found", 1))
                .on(COLUMN_EXISTS, Row.of("found", 1))
                .on(COLUMN_DETAIL, Row.of("name", "created", "dataType", createdType, "charMaxLen", null,
                        "datetimePrecision", 7, "numericPrecision", null, "numericScale", null,
                        "nullable", false, "identity", false))
                .on(LIST_PRIMARY_KEYS, Row.of("name", "PK_id"))
                .on(LIST_INDEXES, Row.of("name", "IX_created"))
                .on(INDEX_KEY_COLUMNS_WITHOUT_PARTITION, params -> List.of(
                        Row.of("column_name", params.get(1).equals("PK_id") ? "id" : "created")))
                .on(INDEX_DETAIL, params -> List.of(params.get(1).equals("PK_id")
                        ? Row.of("name", "PK_id", "type_desc", "CLUSTERED", "is_primary_key", true,
                                "unique", true, "is_unique_constraint", false, "compression", "NONE")
                        : Row.of("name", "IX_created", "type_desc", "NONCLUSTERED", "is_primary_key", false,
                                "unique", false, "is_unique_constraint", false, "compression", "ROW")));
    }

    private static ReflectedNode table(ScriptedBackendDriver driver) {
        return SqlServerTestSupport.root(driver, ConfirmationProvider.alwaysApprove())
                .child(DATABASE, "Shop").child(SCHEMA, "dbo").child(TABLE, "Events");
    }

    @Test
    void boundaries_span_five_days_around_the_data() {
        List<String> days = PartitionBehavior.boundaries(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 3));

        assertEquals(12, days.size());
        assertEquals("'20231227'", days.get(0));
        assertEquals("'20240107'", days.get(days.size() - 1));
    }

    @Test
    void empty_table_is_partitioned_around_today() {
        var driver = events("datetime2");
        var events = table(driver);

        events.session().behaviors().behavior(PARTITION).create(events, partition("created"));

        List<String> changes = driver.changes();
        assertEquals(4, changes.size());
        assertEquals("CREATE PARTITION FUNCTION [pf_dbo_Events_created] (datetime2(7)) AS RANGE RIGHT FOR VALUES ("
                + String.join(", ", PartitionBehavior.boundaries(LocalDate.of(2024, 3, 10), LocalDate.of(2024, 3, 10)))
                + ")", changes.get(0));
        assertEquals("CREATE PARTITION SCHEME [ps_dbo_Events_created] AS PARTITION [pf_dbo_Events_created] ALL TO ([PRIMARY])",
                changes.get(1));
        assertTrue(changes.get(2).startsWith("CREATE UNIQUE CLUSTERED INDEX [PK_id]"), changes.get(2));
        assertTrue(changes.get(2).endsWith("ON [ps_dbo_Events_created]([created])"), changes.get(2));
        assertTrue(changes.get(3).startsWith("CREATE NONCLUSTERED INDEX [IX_created]"), changes.get(3));
        assertTrue(changes.get(3).contains("DATA_COMPRESSION = ROW, DROP_EXISTING = ON"), changes.get(3));
    }

    @Test
    void only_datetime_columns_can_be_partitioned() {
        var driver = events("date");
        var events = table(driver);

        assertThrows(DeclarationException.class,
                () -> events.session().behaviors().behavior(PARTITION).create(events, partition("created")));
        assertTrue(driver.changes().isEmpty());
    }

    @Test
    void drop_moves_indexes_back_then_drops_scheme_and_function() {
        var driver = events("datetime2")
                .on(PARTITION_DETAIL, Row.of("column_name", "created",
                        "ps_name", "ps_dbo_Events_created", "pf_name", "pf_dbo_Events_created"));
        var events = table(driver);
        var partitionNode = events.child(PARTITION, "ps_dbo_Events_created");

        assertTrue(partitionNode.delete());

        List<String> changes = driver.changes();
        assertTrue(changes.get(0).endsWith("ON [PRIMARY]"));
        assertEquals("DROP PARTITION SCHEME [ps_dbo_Events_created]", changes.get(2));
        assertEquals("DROP PARTITION FUNCTION [pf_dbo_Events_created]", changes.get(3));
    }

    @Test
    void min_and_max_values_become_days() {
        var ts = java.sql.Timestamp.valueOf("2024-02-01 13:45:00");

        assertEquals(LocalDate.of(2024, 2, 1), PartitionBehavior.date(Optional.of(Row.of("value", ts)), LocalDate.MIN));
        assertEquals(LocalDate.MIN, PartitionBehavior.date(Optional.of(Row.of("value", null)), LocalDate.MIN));
    }
}
