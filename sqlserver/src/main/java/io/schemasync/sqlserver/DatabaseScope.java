// file: sqlserver/src/main/java/io/schemasync/sqlserver/DatabaseScope.java
package io.schemasync.sqlserver;

import io.schemasync.core.live.BackendDriver;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.model.EntityType;

import java.util.logging.Level;
import java.util.logging.Logger;

import static io.schemasync.sqlserver.SqlServerStatements.*;

/**
 * Tracks which database the connection is currently using and switches it
 * before statements that run against a database's own catalog views.
 * <p>
 * One scope per connection. The connection starts in an unknown database, so
 * the first entry always issues {@code USE}.
 */
public final class DatabaseScope {
    private static final Logger log = Logger.getLogger(DatabaseScope.class.getName());

    private String current;

    /**
     * Switch to the database {@code node} belongs to (or is).
     *
     * @return the driver, for chaining
     */
    public BackendDriver enter(ReflectedNode node) {
        return enter(node.driver(), node.ancestorName(EntityType.DATABASE));
    }

    public BackendDriver enter(BackendDriver driver, String database) {
        if (!database.equalsIgnoreCase(current)) {
            log.log(Level.FINE, "Switching to database " + database);
            driver.execute(format(USE_DATABASE, quote(database)));
            current = database;
        }
        return driver;
    }

    /** Leave any user database, e.g. before taking it offline or renaming it. */
    public BackendDriver enterMaster(BackendDriver driver) {
        return enter(driver, "master");
    }

    /** Database the connection was last switched to, or null when unknown. */
    public String current() {
        return current;
    }

    /** Forget the tracked database, e.g. after it was renamed. */
    public void reset() {
        current = null;
    }
}
