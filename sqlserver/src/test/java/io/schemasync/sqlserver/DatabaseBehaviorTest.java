// file: sqlserver/src/test/java/io/schemasync/sqlserver/DatabaseBehaviorTest.java
package io.schemasync.sqlserver;

import io.schemasync.core.align.Aligner;
import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.live.ConfirmationProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.schemasync.core.declared.Declarations.*;
import static io.schemasync.core.model.AttributeRegistry.*;
import static io.schemasync.core.model.EntityType.*;
import static org.junit.jupiter.api.Assertions.*;

class DatabaseBehaviorTest {

    @Test
    void database_without_owner_leaves_the_live_owner_alone() {
        var driver = SqlServerTestSupport.shop();
        var shop = SqlServerTestSupport.root(driver, ConfirmationProvider.alwaysApprove()).child(DATABASE, "Shop");

        var report = new Aligner().align(DeclaredNode.builder(DATABASE, "Shop").withDefaults().build(), shop, false);

        assertEquals(0, report.mutationCount(), report::summary);
        assertTrue(driver.changes().isEmpty());
        assertFalse(shop.behavior().writers().get(OWNER).apply(shop, database("Shop", null).build()));
    }

    @Test
    void declared_owner_is_applied_through_authorization() {
        var driver = SqlServerTestSupport.shop();
        var shop = SqlServerTestSupport.root(driver, ConfirmationProvider.alwaysApprove()).child(DATABASE, "Shop");

        assertTrue(shop.behavior().writers().get(OWNER).apply(shop, database("Shop", "dbadmin").build()));

        assertEquals(List.of("ALTER AUTHORIZATION ON DATABASE::[Shop] TO [dbadmin]"), driver.changes());
        assertEquals(1, driver.autoCommitBlocks);
    }
}
