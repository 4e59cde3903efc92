// file: core/src/test/java/io/schemasync/core/align/AlignerTest.java
package io.schemasync.core.align;

import io.schemasync.core.NotAlteredException;
import io.schemasync.core.TypeMismatchException;
import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.declared.ExtraChildPolicy;
import io.schemasync.core.live.ConfirmationProvider;
import io.schemasync.core.live.FakeCatalog;
import io.schemasync.core.live.FakeCatalog.FakeObject;
import io.schemasync.core.live.MutationJournal.Kind;
import io.schemasync.core.live.MutationJournal.Outcome;
import io.schemasync.core.live.ReflectedNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.schemasync.core.declared.Declarations.*;
import static io.schemasync.core.model.AttributeRegistry.*;
import static io.schemasync.core.model.EntityType.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Alignment against an in-memory server: what gets created, kept, renamed and dropped.
 */
class AlignerTest {

    private final Aligner aligner = new Aligner();
    private final ConfirmationProvider approve = ConfirmationProvider.alwaysApprove();
    private final ConfirmationProvider decline = ConfirmationProvider.alwaysDecline();

    private static DeclaredNode personTable() {
        return table("Person",
                identityColumn("ID").build(),
                varcharColumn("Name", 255).build(),
                primaryKey("ID").build(),
                index("Name").build()).build();
    }

    private static DeclaredNode serverWith(DeclaredNode... tables) {
        return server(databaseWithTables("MyDatabase", "sa", tables).build()).build();
    }

    /** Live state equivalent to {@link #personTable()}, with server-chosen key and index names. */
    private static FakeObject seedPerson(FakeCatalog catalog, String tableName) {
        FakeObject table = catalog.root()
                .add(DATABASE, "MyDatabase", OWNER, "sa")
                .add(SCHEMA, "dbo")
                .add(TABLE, tableName);
        table.add(COLUMN, "ID", DATA_TYPE, "int", IDENTITY, true);
        table.add(COLUMN, "Name", DATA_TYPE, "varchar", CHAR_MAX_LEN, 255);
        table.add(PRIMARY_KEY, "PK__Person__3214EC27", COLUMNS, List.of("ID"));
        table.add(INDEX, "IX_legacy_name", COLUMNS, List.of("Name"));
        return table;
    }

    private static List<String> paths(AlignmentReport report, Kind kind) {
        return report.outcomes(kind).stream().map(Outcome::path).toList();
    }

    @Test
    void person_scenario_creates_everything_then_is_idempotent() {
        var catalog = new FakeCatalog("srv");
        var declared = serverWith(personTable());

        var first = aligner.align(declared, catalog.reflectedRoot(approve));

        assertEquals(7, first.outcomes(Kind.CREATED).size(), first.outcomes().toString());
        assertEquals(7, first.mutationCount());
        var table = catalog.root().get(DATABASE, "MyDatabase").get(SCHEMA, "dbo").get(TABLE, "Person");
        assertEquals(true, table.get(COLUMN, "ID").attribute(IDENTITY));
        assertEquals(255, table.get(COLUMN, "Name").attribute(CHAR_MAX_LEN));
        assertEquals(1, table.children(PRIMARY_KEY).size());
        assertEquals(List.of("id"), table.children(PRIMARY_KEY).get(0).attribute(COLUMNS));
        assertEquals(1, table.children(INDEX).size());

        int before = catalog.mutations();
        var second = aligner.align(declared, catalog.reflectedRoot(approve));

        assertEquals(0, second.mutationCount(), second.outcomes().toString());
        assertEquals(before, catalog.mutations());
    }

    @Test
    void matching_server_is_left_untouched() {
        var catalog = new FakeCatalog("srv");
        seedPerson(catalog, "Person");

        var report = aligner.align(serverWith(personTable()), catalog.reflectedRoot(approve));

        assertTrue(report.outcomes().isEmpty(), report.outcomes().toString());
        assertEquals(0, catalog.mutations());
        assertEquals("no changes", report.summary());
    }

    @Test
    void index_is_matched_by_columns_not_by_name() {
        var catalog = new FakeCatalog("srv");
        var table = seedPerson(catalog, "Person");

        aligner.align(serverWith(personTable()), catalog.reflectedRoot(approve));

        assertEquals(1, table.children(INDEX).size());
        assertEquals("IX_legacy_name", table.children(INDEX).get(0).name());
        assertEquals("PK__Person__3214EC27", table.children(PRIMARY_KEY).get(0).name());
    }

    @Test
    void undeclared_column_is_only_dropped_when_confirmed() {
        var catalog = new FakeCatalog("srv");
        var table = seedPerson(catalog, "Person");
        table.add(COLUMN, "Extra", DATA_TYPE, "int");

        var declined = aligner.align(serverWith(personTable()), catalog.reflectedRoot(decline));

        assertTrue(table.find(COLUMN, "Extra").isPresent());
        assertEquals(List.of("MyDatabase.dbo.Person.Extra"), paths(declined, Kind.DELETE_DECLINED));
        assertEquals(0, declined.mutationCount());

        var approved = aligner.align(serverWith(personTable()), catalog.reflectedRoot(approve));

        assertFalse(table.find(COLUMN, "Extra").isPresent());
        assertEquals(List.of("MyDatabase.dbo.Person.Extra"), paths(approved, Kind.DELETED));
    }

    @Test
    void ignored_child_types_are_never_dropped() {
        var catalog = new FakeCatalog("srv");
        var table = seedPerson(catalog, "Person");
        table.add(COLUMN, "Extra", DATA_TYPE, "int");
        var declaredTable = table("Person",
                identityColumn("ID").build(),
                varcharColumn("Name", 255).build())
                .ignoreExtraChildren(ExtraChildPolicy.of(COLUMN))
                .build();

        var report = aligner.align(serverWith(declaredTable), catalog.reflectedRoot(approve));

        assertTrue(table.find(COLUMN, "Extra").isPresent());
        assertTrue(report.outcomes().isEmpty(), report.outcomes().toString());
    }

    @Test
    void databases_are_never_dropped_automatically() {
        var catalog = new FakeCatalog("srv");
        seedPerson(catalog, "Person");
        catalog.root().add(DATABASE, "Legacy", OWNER, "sa");

        var report = aligner.align(serverWith(personTable()), catalog.reflectedRoot(approve));

        assertTrue(catalog.root().find(DATABASE, "Legacy").isPresent());
        assertEquals(List.of("Legacy"), paths(report, Kind.DELETE_DECLINED));
        assertEquals(0, catalog.mutations());
    }

    @Test
    void child_types_without_declarations_are_left_alone() {
        var catalog = new FakeCatalog("srv");
        var table = seedPerson(catalog, "Person");
        var columnsOnly = table("Person",
                identityColumn("ID").build(),
                varcharColumn("Name", 255).build()).build();

        var report = aligner.align(serverWith(columnsOnly), catalog.reflectedRoot(approve));

        assertEquals(1, table.children(PRIMARY_KEY).size());
        assertEquals(1, table.children(INDEX).size());
        assertTrue(report.outcomes().isEmpty());
    }

    @Test
    void old_name_is_renamed_instead_of_recreated() {
        var catalog = new FakeCatalog("srv");
        var live = seedPerson(catalog, "OldPerson");
        var renamed = table("Person",
                identityColumn("ID").build(),
                varcharColumn("Name", 255).build(),
                primaryKey("ID").build(),
                index("Name").build())
                .oldName("OldPerson")
                .build();

        var report = aligner.align(serverWith(renamed), catalog.reflectedRoot(approve));

        assertEquals("Person", live.name());
        assertEquals(List.of("MyDatabase.dbo.Person"), paths(report, Kind.RENAMED));
        assertTrue(report.outcomes(Kind.CREATED).isEmpty());
        assertTrue(report.outcomes(Kind.DELETED).isEmpty());
        assertEquals(2, live.children(COLUMN).size());
    }

    @Test
    void missing_old_name_is_not_an_error() {
        var catalog = new FakeCatalog("srv");
        seedPerson(catalog, "Person");
        var declared = table("Person",
                identityColumn("ID").build(),
                varcharColumn("Name", 255).build())
                .oldName("Ghost")
                .build();

        var report = aligner.align(serverWith(declared), catalog.reflectedRoot(approve));

        assertEquals(0, report.mutationCount());
    }

    @Test
    void unsupported_rename_is_skipped_and_the_new_name_created() {
        var catalog = new FakeCatalog("srv").withoutRename(SCHEMA);
        catalog.root().add(DATABASE, "MyDatabase", OWNER, "sa").add(SCHEMA, "crm");
        var declared = server(database("MyDatabase", "sa")
                .child(schema("sales").oldName("crm").build())
                .build()).build();

        var report = aligner.align(declared, catalog.reflectedRoot(approve));

        assertEquals(List.of("MyDatabase.crm"), paths(report, Kind.RENAME_SKIPPED));
        assertEquals(List.of("MyDatabase.sales"), paths(report, Kind.CREATED));
        assertTrue(catalog.root().get(DATABASE, "MyDatabase").find(SCHEMA, "crm").isPresent());
    }

    @Test
    void attribute_differences_are_set_and_verified() {
        var catalog = new FakeCatalog("srv");
        var table = seedPerson(catalog, "Person");
        var wider = table("Person",
                identityColumn("ID").build(),
                varcharColumn("Name", 500).attribute(NULLABLE, true).build()).build();

        var report = aligner.align(serverWith(wider), catalog.reflectedRoot(approve));

        assertEquals(500, table.get(COLUMN, "Name").attribute(CHAR_MAX_LEN));
        assertEquals(true, table.get(COLUMN, "Name").attribute(NULLABLE));
        assertEquals(2, report.outcomes(Kind.ATTRIBUTE_SET).size());
    }

    @Test
    void declined_attribute_change_leaves_value_and_continues() {
        var catalog = new FakeCatalog("srv");
        var table = seedPerson(catalog, "Person");
        var wider = table("Person",
                identityColumn("ID").build(),
                varcharColumn("Name", 500).build()).build();

        var report = aligner.align(serverWith(wider), catalog.reflectedRoot(decline));

        assertEquals(255, table.get(COLUMN, "Name").attribute(CHAR_MAX_LEN));
        assertEquals(1, report.outcomes(Kind.ATTRIBUTE_SKIPPED).size());
        assertFalse(report.converged());
    }

    @Test
    void attribute_without_writer_is_a_recoverable_skip() {
        var catalog = new FakeCatalog("srv").withoutWriter(COLUMN, CHAR_MAX_LEN);
        var table = seedPerson(catalog, "Person");
        table.add(COLUMN, "Extra", DATA_TYPE, "int");
        var wider = table("Person",
                identityColumn("ID").build(),
                varcharColumn("Name", 500).build()).build();

        var report = aligner.align(serverWith(wider), catalog.reflectedRoot(approve));

        assertEquals(1, report.outcomes(Kind.ATTRIBUTE_SKIPPED).size());
        assertEquals(255, table.get(COLUMN, "Name").attribute(CHAR_MAX_LEN));
        // the run went on to the next steps
        assertFalse(table.find(COLUMN, "Extra").isPresent());
    }

    @Test
    void write_that_does_not_stick_aborts_with_the_entity_path() {
        var catalog = new FakeCatalog("srv").ignoringWrites(COLUMN, NULLABLE);
        seedPerson(catalog, "Person");
        var nullable = table("Person",
                identityColumn("ID").build(),
                varcharColumn("Name", 255).attribute(NULLABLE, true).build()).build();

        var ex = assertThrows(NotAlteredException.class,
                () -> aligner.align(serverWith(nullable), catalog.reflectedRoot(approve)));

        assertEquals("MyDatabase.dbo.Person.Name", ex.path());
        assertTrue(ex.getMessage().contains("nullable"));
    }

    @Test
    void logins_are_never_created() {
        var catalog = new FakeCatalog("srv");
        var declared = server(
                login("app_login", "dbcreator"),
                database("MyDatabase", "sa").build()).build();

        var report = aligner.align(declared, catalog.reflectedRoot(approve));

        assertTrue(catalog.root().children(LOGIN).isEmpty());
        assertEquals(1, report.outcomes(Kind.CREATE_REFUSED).size());
        assertTrue(catalog.root().find(DATABASE, "MyDatabase").isPresent());
    }

    @Test
    void declared_and_live_types_must_agree() {
        var catalog = new FakeCatalog("srv");
        ReflectedNode root = catalog.reflectedRoot(approve);

        assertThrows(TypeMismatchException.class, () -> aligner.align(personTable(), root));
    }

    @Test
    void attributes_only_alignment_does_not_touch_children() {
        var catalog = new FakeCatalog("srv");
        var db = catalog.root().add(DATABASE, "MyDatabase", OWNER, "sa");
        var declared = database("MyDatabase", "dbadmin")
                .child(schema("sales").build())
                .build();
        ReflectedNode liveDb = catalog.reflectedRoot(approve).child(DATABASE, "MyDatabase");

        var report = aligner.align(declared, liveDb, false);

        assertEquals("dbadmin", db.attribute(OWNER));
        assertTrue(db.children(SCHEMA).isEmpty());
        assertEquals(1, report.mutationCount());
    }
}
