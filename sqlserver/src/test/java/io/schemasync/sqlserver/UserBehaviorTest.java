// file: sqlserver/src/test/java/io/schemasync/sqlserver/UserBehaviorTest.java
package io.schemasync.sqlserver;

import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.live.ConfirmationProvider;
import io.schemasync.core.live.MutationJournal.Kind;
import io.schemasync.core.live.Row;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.schemasync.core.model.AttributeRegistry.DB_ROLES;
import static io.schemasync.core.model.AttributeRegistry.LOGIN_NAME;
import static io.schemasync.core.model.EntityType.*;
import static io.schemasync.sqlserver.SqlServerStatements.*;
import static org.junit.jupiter.api.Assertions.*;

class UserBehaviorTest {

    private static DeclaredNode user(String name, String login, List<String> roles) {
        return DeclaredNode.builder(USER, name)
                .attribute(LOGIN_NAME, login)
                .attribute(DB_ROLES, roles)
                .build();
    }

    @Test
    void new_user_takes_the_login_name_and_its_roles() {
        var driver = SqlServerTestSupport.shop();
        var shop = SqlServerTestSupport.root(driver, ConfirmationProvider.alwaysApprove()).child(DATABASE, "Shop");

        shop.session().behaviors().behavior(USER).create(shop, user("", "reporting", List.of("db_datareader")));

        assertEquals(List.of(
                "CREATE USER [reporting] FOR LOGIN [reporting] WITH DEFAULT_SCHEMA = [dbo]",
                "ALTER ROLE [db_datareader] ADD MEMBER [reporting]"), driver.changes());
    }

    @Test
    void roles_of_the_database_owner_are_left_alone() {
        var driver = SqlServerTestSupport.shop()
                .on(DATABASE_DETAIL, Row.of("name", "Shop", "recoveryModel", "FULL", "owner", "app_login"))
                .on(USER_EXISTS, Row.of("found", 1))
                .on(USER_DETAIL, Row.of("name", "app", "loginName", "app_login"));
        var root = SqlServerTestSupport.root(driver, ConfirmationProvider.alwaysApprove());
        var app = root.child(DATABASE, "Shop").child(USER, "app");

        assertFalse(app.setAttribute(user("app", "app_login", List.of("db_owner")), DB_ROLES));

        assertTrue(driver.changes().isEmpty());
        assertEquals(1, app.session().journal().all().stream()
                .filter(o -> o.kind() == Kind.ATTRIBUTE_SKIPPED).count());
    }

    @Test
    void role_memberships_are_diffed() {
        var driver = SqlServerTestSupport.shop()
                .on(USER_EXISTS, Row.of("found", 1))
                .on(USER_DETAIL, Row.of("name", "app", "loginName", "app_login"))
                .on(USER_ROLES, Row.of("role_name", "db_datawriter"));
        var app = SqlServerTestSupport.root(driver, ConfirmationProvider.alwaysApprove())
                .child(DATABASE, "Shop").child(USER, "app");

        app.behavior().writers().get(DB_ROLES).apply(app, user("app", "app_login", List.of("db_datareader")));

        assertEquals(List.of(
                "ALTER ROLE [db_datareader] ADD MEMBER [app]",
                "ALTER ROLE [db_datawriter] DROP MEMBER [app]"), driver.changes());
    }
}
