// file: core/src/test/java/io/schemasync/core/model/AttributeRegistryTest.java
package io.schemasync.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static io.schemasync.core.model.AttributeRegistry.*;
import static org.junit.jupiter.api.Assertions.*;

class AttributeRegistryTest {

    @Test
    void every_type_has_an_entry() {
        for (EntityType t : EntityType.values()) {
            assertNotNull(AttributeRegistry.specs(t), t.toString());
        }
    }

    @Test
    void column_attributes_come_in_comparison_order() {
        assertEquals(List.of(DATA_TYPE, CHAR_MAX_LEN, DATETIME_PRECISION, NUMERIC_PRECISION,
                NUMERIC_SCALE, NULLABLE, IDENTITY), AttributeRegistry.names(EntityType.COLUMN));
    }

    @Test
    void login_password_is_not_an_attribute() {
        assertFalse(AttributeRegistry.isAttribute(EntityType.LOGIN, "password"));
        assertEquals(List.of(TYPE_DESC, SERVER_ROLES), AttributeRegistry.names(EntityType.LOGIN));
    }

    @Test
    void defaults_keep_null_entries() {
        var defaults = AttributeRegistry.defaults(EntityType.INDEX);

        assertEquals(List.of(COLUMNS, CLUSTERED, COMPRESSION, INCLUDED_COLUMNS, UNIQUE), List.copyOf(defaults.keySet()));
        assertNull(defaults.get(COLUMNS));
        assertEquals(false, defaults.get(CLUSTERED));
        assertEquals(true, AttributeRegistry.defaults(EntityType.PRIMARY_KEY).get(CLUSTERED));
    }

    @Test
    void unknown_attribute_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> AttributeRegistry.spec(EntityType.TABLE, "owner"));
    }

    @Test
    void type_keys_resolve_both_ways() {
        assertEquals(EntityType.PRIMARY_KEY, EntityType.fromKey("primary_keys"));
        assertEquals(EntityType.INDEX, EntityType.fromKey("INDEX"));
        assertThrows(IllegalArgumentException.class, () -> EntityType.fromKey("views"));
        assertFalse(EntityType.LOGIN.creatable());
        assertFalse(EntityType.DATABASE.autoDeletable());
        assertTrue(EntityType.TABLE.allowsChild(EntityType.FOREIGN_KEY));
    }
}
