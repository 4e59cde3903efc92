// file: sqlserver/src/test/java/io/schemasync/sqlserver/SqlServerTestSupport.java
package io.schemasync.sqlserver;

import io.schemasync.core.live.ConfirmationProvider;
import io.schemasync.core.live.LiveSession;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.live.Row;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static io.schemasync.sqlserver.SqlServerStatements.*;

/** Shared scripting for a server "srv" holding database "Shop" with schema "dbo". */
final class SqlServerTestSupport {

    static final Clock FIXED_CLOCK = Clock.fixed(
            LocalDate.of(2024, 3, 10).atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

    private SqlServerTestSupport() {
    }

    static ScriptedBackendDriver shop() {
        return new ScriptedBackendDriver()
                .on(DATABASE_EXISTS, Row.of("found", 1))
                .on(DATABASE_DETAIL, Row.of("name", "Shop", "recoveryModel", "FULL", "owner", "sa"))
                .on(SCHEMA_DETAIL, Row.of("name", "dbo", "schema_id", 1, "principal_id", 1));
    }

    static ReflectedNode root(ScriptedBackendDriver driver, ConfirmationProvider confirmer) {
        return new LiveSession(driver, confirmer, SqlServerBehaviors.create(FIXED_CLOCK)).root("srv");
    }
}
