// file: sqlserver/src/main/java/io/schemasync/sqlserver/SqlServerReflection.java
package io.schemasync.sqlserver;

import io.schemasync.core.live.LiveSession;
import io.schemasync.core.live.ReflectedNode;

/** Entry point for reflecting a connected SQL Server instance. */
public final class SqlServerReflection {

    private SqlServerReflection() {
    }

    /** Root of the live tree, named after {@code @@SERVERNAME}. */
    public static ReflectedNode serverRoot(LiveSession session) {
        String name = session.driver().queryOne(SqlServerStatements.SERVER_NAME)
                .map(r -> r.string("name"))
                .orElse(null);
        return session.root(name == null ? "server" : name);
    }
}
