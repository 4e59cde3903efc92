// file: core/src/test/java/io/schemasync/core/live/ReflectedNodeTest.java
package io.schemasync.core.live;

import io.schemasync.core.AttributeConfigurationException;
import io.schemasync.core.CreationMismatchException;
import io.schemasync.core.InvalidChildException;
import io.schemasync.core.MissingDetailException;
import io.schemasync.core.ObjectNotFoundException;
import io.schemasync.core.live.MutationJournal.Kind;
import io.schemasync.core.model.EntityType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.schemasync.core.declared.Declarations.*;
import static io.schemasync.core.model.AttributeRegistry.*;
import static io.schemasync.core.model.EntityType.*;
import static org.junit.jupiter.api.Assertions.*;

class ReflectedNodeTest {

    private final ConfirmationProvider approve = ConfirmationProvider.alwaysApprove();

    private static FakeCatalog catalogWithTable() {
        var catalog = new FakeCatalog("srv");
        var table = catalog.root()
                .add(DATABASE, "Shop", OWNER, "sa")
                .add(SCHEMA, "dbo")
                .add(TABLE, "Orders");
        table.add(COLUMN, "Id", DATA_TYPE, "int");
        table.add(COLUMN, "Total", DATA_TYPE, "numeric", NUMERIC_PRECISION, 10, NUMERIC_SCALE, 2);
        return catalog;
    }

    private static ReflectedNode orders(ReflectedNode root) {
        return root.child(DATABASE, "Shop").child(SCHEMA, "dbo").child(TABLE, "Orders");
    }

    @Test
    void full_name_starts_at_the_database() {
        var root = catalogWithTable().reflectedRoot(approve);
        var total = orders(root).child(COLUMN, "Total");

        assertEquals("Shop.dbo.Orders.Total", total.fullName());
        assertEquals("srv", root.fullName());
        assertEquals("Orders", total.ancestorName(TABLE));
        assertThrows(IllegalArgumentException.class, () -> root.ancestor(TABLE));
    }

    @Test
    void attributes_are_cached_until_reset() {
        var catalog = catalogWithTable();
        var total = orders(catalog.reflectedRoot(approve)).child(COLUMN, "Total");

        assertEquals(10, total.attribute(NUMERIC_PRECISION));
        assertEquals(2, total.attribute(NUMERIC_SCALE));
        assertEquals(1, catalog.detailFetches());

        catalog.root().get(DATABASE, "Shop").get(SCHEMA, "dbo").get(TABLE, "Orders")
                .get(COLUMN, "Total").set(NUMERIC_PRECISION, 12);
        assertEquals(10, total.attribute(NUMERIC_PRECISION));

        total.resetAttribute(NUMERIC_PRECISION);
        assertEquals(12, total.attribute(NUMERIC_PRECISION));
        assertEquals(2, catalog.detailFetches());
    }

    @Test
    void unknown_attribute_name_is_rejected() {
        var total = orders(catalogWithTable().reflectedRoot(approve)).child(COLUMN, "Total");

        assertThrows(IllegalArgumentException.class, () -> total.attribute("colour"));
    }

    @Test
    void vanished_object_has_no_detail() {
        var catalog = catalogWithTable();
        var id = orders(catalog.reflectedRoot(approve)).child(COLUMN, "Id");
        var table = catalog.root().get(DATABASE, "Shop").get(SCHEMA, "dbo").get(TABLE, "Orders");
        table.remove(table.get(COLUMN, "Id"));

        var ex = assertThrows(MissingDetailException.class, () -> id.attribute(DATA_TYPE));
        assertEquals("Shop.dbo.Orders.Id", ex.path());
    }

    @Test
    void attribute_missing_from_detail_without_reader_is_a_configuration_error() {
        var catalog = catalogWithTable();
        var column = catalog.root().get(DATABASE, "Shop").get(SCHEMA, "dbo").get(TABLE, "Orders").get(COLUMN, "Id");
        column.attributes.remove(IDENTITY);
        var id = orders(catalog.reflectedRoot(approve)).child(COLUMN, "Id");

        assertThrows(AttributeConfigurationException.class, () -> id.attribute(IDENTITY));
    }

    @Test
    void reserved_names_are_not_children() {
        var catalog = new FakeCatalog("srv").reserving(DATABASE, "master", "TEMPDB");
        catalog.root().add(DATABASE, "master");
        catalog.root().add(DATABASE, "tempdb");
        catalog.root().add(DATABASE, "Shop");

        var names = catalog.reflectedRoot(approve).children(DATABASE).stream().map(ReflectedNode::name).toList();

        assertEquals(List.of("Shop"), names);
    }

    @Test
    void child_lookup_fails_for_missing_objects_and_foreign_types() {
        var root = catalogWithTable().reflectedRoot(approve);

        assertThrows(ObjectNotFoundException.class, () -> root.child(DATABASE, "Nope"));
        assertThrows(InvalidChildException.class, () -> root.children(EntityType.COLUMN));
    }

    @Test
    void get_or_create_matches_existing_child_without_creating() {
        var catalog = catalogWithTable();
        var table = orders(catalog.reflectedRoot(approve));

        Optional<ReflectedNode> id = table.getOrCreateChild(intColumn("ID").build());

        assertTrue(id.isPresent());
        assertEquals(0, catalog.mutations());
    }

    @Test
    void created_object_that_cannot_be_matched_is_fatal() {
        var catalog = new FakeCatalog("srv").misnamingCreations();
        catalog.root().add(DATABASE, "Shop", OWNER, "sa").add(SCHEMA, "dbo");
        var dbo = catalog.reflectedRoot(approve).child(DATABASE, "Shop").child(SCHEMA, "dbo");

        var ex = assertThrows(CreationMismatchException.class,
                () -> dbo.getOrCreateChild(table("Audit").build()));
        assertTrue(ex.path().startsWith("Shop.dbo/"));
    }

    @Test
    void every_mutation_is_put_to_the_gate_first() {
        List<String> asked = new ArrayList<>();
        var catalog = catalogWithTable();
        var root = catalog.reflectedRoot(description -> {
            asked.add(description);
            return false;
        });
        var table = orders(root);

        assertFalse(table.child(COLUMN, "Id").delete());
        assertFalse(table.rename("Purchases"));
        assertFalse(table.child(COLUMN, "Id").setAttribute(intColumn("Id").attribute(NULLABLE, true).build(), NULLABLE));

        assertEquals(3, asked.size());
        assertTrue(asked.get(0).startsWith("Delete columns Shop.dbo.Orders.Id"));
        assertEquals(0, catalog.mutations());
        assertEquals(List.of(Kind.DELETE_DECLINED, Kind.RENAME_SKIPPED, Kind.ATTRIBUTE_SKIPPED),
                root.session().journal().all().stream().map(MutationJournal.Outcome::kind).toList());
    }

    @Test
    void rename_updates_the_in_memory_name() {
        var catalog = catalogWithTable();
        var table = orders(catalog.reflectedRoot(approve));

        assertTrue(table.rename("Purchases"));

        assertEquals("Shop.dbo.Purchases", table.fullName());
        assertEquals(2, table.children(COLUMN).size());
    }

    @Test
    void behavior_table_rejects_readers_for_unknown_attributes() {
        var good = new FakeCatalog("srv");
        List<EntityBehavior> behaviors = new ArrayList<>();
        for (EntityType t : EntityType.values()) {
            EntityBehavior real = good.behaviors().behavior(t);
            behaviors.add(t != COLUMN ? real : new EntityBehavior() {
                @Override public EntityType type() { return COLUMN; }
                @Override public List<String> listNames(ReflectedNode parent) { return List.of(); }
                @Override public boolean exists(ReflectedNode parent, String name) { return false; }
                @Override public Optional<Row> fetchDetail(ReflectedNode node) { return Optional.empty(); }
                @Override public boolean delete(ReflectedNode node) { return false; }
                @Override public Map<String, AttributeReader> readers() {
                    return Map.of("colour", (node, detail) -> "red");
                }
            });
        }

        var ex = assertThrows(IllegalArgumentException.class, () -> BehaviorTable.of(behaviors));
        assertTrue(ex.getMessage().contains("columns.colour"));
    }
}
