// file: sqlserver/src/main/java/io/schemasync/sqlserver/DatabaseBehavior.java
package io.schemasync.sqlserver;

import io.schemasync.core.DeclarationException;
import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.live.AttributeReader;
import io.schemasync.core.live.AttributeWriter;
import io.schemasync.core.live.BackendDriver;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.live.Row;
import io.schemasync.core.model.EntityType;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.schemasync.core.model.AttributeRegistry.*;
import static io.schemasync.sqlserver.SqlServerStatements.*;

/**
 * Databases. Creation, renaming and option changes run outside a transaction
 * (SQL Server refuses them inside one). Databases are never dropped.
 * <p>
 * Moving a data or log file takes the database offline; the operator moves the
 * file by hand between two confirmations.
 */
final class DatabaseBehavior extends SqlServerBehavior {
    private static final Logger log = Logger.getLogger(DatabaseBehavior.class.getName());

    private static final Set<String> RESERVED = Set.of(
            "master", "tempdb", "model", "msdb", "ReportServer", "ReportServerTempDB");

    static final String DATA_FILE = "ROWS";
    static final String LOG_FILE = "LOG";

    DatabaseBehavior(DatabaseScope scope) {
        super(scope);
    }

    @Override
    public EntityType type() {
        return EntityType.DATABASE;
    }

    @Override
    public Set<String> reservedNames() {
        return RESERVED;
    }

    @Override
    public List<String> listNames(ReflectedNode server) {
        return column(server.driver().query(LIST_DATABASES), "name");
    }

    @Override
    public boolean exists(ReflectedNode server, String name) {
        return server.driver().any(DATABASE_EXISTS, name);
    }

    @Override
    public void create(ReflectedNode server, DeclaredNode declared) {
        BackendDriver driver = server.driver();
        String name = declared.name();
        String statement;
        if (declared.text(DATA_FILE_PATH) == null) {
            statement = format(CREATE_DATABASE, quote(name));
        } else {
            Integer dataSize = declared.integer(DATA_SIZE);
            Integer logSize = declared.integer(LOG_SIZE);
            String logPath = declared.text(LOG_FILE_PATH);
            if (dataSize == null || logSize == null || logPath == null) {
                throw new DeclarationException("database " + name
                        + ": data size, log size and log file path are required with a data file path");
            }
            statement = format(CREATE_DATABASE_WITH_FILES, quote(name), literal(name),
                    literal(declared.text(DATA_FILE_PATH)), dataSize, literal(logPath), logSize);
        }
        driver.inAutoCommit(() -> driver.execute(statement));
    }

    @Override
    public Optional<Row> fetchDetail(ReflectedNode database) {
        return database.driver().queryOne(DATABASE_DETAIL, database.name());
    }

    @Override
    public Map<String, AttributeReader> readers() {
        return Map.of(
                DATA_SIZE, (db, detail) -> sizeMb(db, "row_size_mb"),
                LOG_SIZE, (db, detail) -> sizeMb(db, "log_size_mb"),
                DATA_FILE_PATH, (db, detail) -> file(db, DATA_FILE).string("physical_name"),
                LOG_FILE_PATH, (db, detail) -> file(db, LOG_FILE).string("physical_name"));
    }

    @Override
    public Map<String, AttributeWriter> writers() {
        return Map.of(
                RECOVERY_MODEL, this::setRecoveryModel,
                OWNER, this::setOwner,
                DATA_SIZE, (db, declared) -> resizeFile(db, DATA_FILE, declared.integer(DATA_SIZE)),
                LOG_SIZE, (db, declared) -> resizeFile(db, LOG_FILE, declared.integer(LOG_SIZE)),
                DATA_FILE_PATH, (db, declared) -> moveFile(db, DATA_FILE, declared.text(DATA_FILE_PATH)),
                LOG_FILE_PATH, (db, declared) -> moveFile(db, LOG_FILE, declared.text(LOG_FILE_PATH)));
    }

    private static int sizeMb(ReflectedNode db, String field) {
        // NULL when the login cannot see the file metadata
        Optional<Row> row = db.driver().queryOne(DATABASE_SIZES, db.name());
        if (row.isEmpty() || row.get().get(field) == null) return 0;
        Object v = row.get().get(field);
        return v instanceof BigDecimal bd ? bd.intValue() : Integer.parseInt(v.toString().split("\\.")[0]);
    }

    private static Row file(ReflectedNode db, String fileType) {
        return db.driver().queryOne(DATABASE_FILE, db.name(), fileType)
                .orElseThrow(() -> new IllegalStateException("database " + db.name() + " has no " + fileType + " file"));
    }

    private boolean setRecoveryModel(ReflectedNode db, DeclaredNode declared) {
        String model = recoveryModel(declared.text(RECOVERY_MODEL));
        BackendDriver driver = db.driver();
        driver.inAutoCommit(() -> driver.execute(format(SET_RECOVERY_MODEL, quote(db.name()), model)));
        return true;
    }

    private boolean setOwner(ReflectedNode db, DeclaredNode declared) {
        String owner = declared.text(OWNER);
        if (owner == null) return false;
        BackendDriver driver = db.driver();
        driver.inAutoCommit(() -> driver.execute(
                format(SET_DATABASE_OWNER, quote(db.name()), quote(owner))));
        return true;
    }

    private boolean resizeFile(ReflectedNode db, String fileType, Integer sizeMb) {
        if (sizeMb == null) return false;
        Row file = file(db, fileType);
        int current = file.integer("current_size_mb");
        String fileName = file.string("name");
        BackendDriver driver = db.driver();
        if (sizeMb < current) {
            // DBCC SHRINKFILE works on the current database's files
            scope.enter(driver, db.name());
            driver.inAutoCommit(() -> driver.execute(format(SHRINK_FILE, quote(fileName), sizeMb)));
        } else {
            driver.inAutoCommit(() -> driver.execute(format(GROW_FILE, quote(db.name()), quote(fileName), sizeMb)));
        }
        return true;
    }

    private boolean moveFile(ReflectedNode db, String fileType, String newPath) {
        BackendDriver driver = db.driver();
        if (driver.any(DATABASE_IN_AVAILABILITY_GROUP, db.name())) {
            log.log(Level.WARNING, "Cannot move files of " + db.name() + ": it is part of an availability group");
            return false;
        }
        var confirmer = db.session().confirmer();
        if (!confirmer.confirm("Database " + db.name() + " must not be in use and its " + fileType
                + " file has to be moved by hand. Continue?")) {
            return false;
        }
        Row file = file(db, fileType);
        String quotedDb = quote(db.name());
        scope.enterMaster(driver);
        driver.inAutoCommit(() -> {
            driver.execute(format(MOVE_FILE, quotedDb, quote(file.string("name")), literal(newPath)));
            driver.execute(format(SET_OFFLINE, quotedDb));
            if (!confirmer.confirm("Move " + file.string("physical_name") + " to " + newPath
                    + ", then confirm to bring " + db.name() + " back online")) {
                log.log(Level.WARNING, "Bringing " + db.name() + " online without confirmation that the file was moved");
            }
            driver.execute(format(SET_ONLINE, quotedDb));
        });
        return true;
    }

    @Override
    public void rename(ReflectedNode db, String newName) {
        BackendDriver driver = scope.enterMaster(db.driver());
        driver.inAutoCommit(() -> driver.execute(format(RENAME_DATABASE, quote(db.name()), quote(newName))));
    }

    @Override
    public boolean canDelete(ReflectedNode db) {
        return false;
    }

    @Override
    public boolean delete(ReflectedNode db) {
        return false;
    }
}
