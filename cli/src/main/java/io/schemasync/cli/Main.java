// file: cli/src/main/java/io/schemasync/cli/Main.java
package io.schemasync.cli;

import io.schemasync.core.DivergenceException;
import io.schemasync.core.align.Aligner;
import io.schemasync.core.align.AlignmentReport;
import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.live.ConfirmationProvider;
import io.schemasync.core.live.LiveSession;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.sqlserver.JdbcBackendDriver;
import io.schemasync.sqlserver.SqlServerBehaviors;
import io.schemasync.sqlserver.SqlServerReflection;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point: align one SQL Server instance with a declared schema file.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Load the declared tree and connect to the server.
 *  - Run the aligner and print the report summary.
 *  - Map the outcome onto the exit code: 0 aligned, 1 fatal divergence,
 *    2 usage or unexpected errors.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    static final int OK = 0;
    static final int DIVERGED = 1;
    static final int FAILED = 2;

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args));
    }

    static int run(String[] args) {
        CliConfig cfg;
        try {
            cfg = CliConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(CliConfig.USAGE);
            return FAILED;
        }
        if (cfg.help()) {
            System.out.println(CliConfig.USAGE);
            return OK;
        }

        try {
            DeclaredNode declared = new DeclaredSchemaReader().read(Path.of(cfg.schemaPath()));
            ConfirmationProvider confirmer = cfg.assumeYes()
                    ? ConfirmationProvider.alwaysApprove()
                    : ConsoleConfirmationProvider.system();
            String password = cfg.passwordEnv() == null ? null : System.getenv(cfg.passwordEnv());

            try (var driver = JdbcBackendDriver.connect(cfg.url(), cfg.user(), password)) {
                var session = new LiveSession(driver, confirmer, SqlServerBehaviors.create());
                ReflectedNode root = SqlServerReflection.serverRoot(session);
                AlignmentReport report = new Aligner().align(declared, root, cfg.alignChildren());
                System.out.println(root.name() + ": " + report.summary());
            }
            return OK;
        } catch (DivergenceException e) {
            log.log(Level.SEVERE, "Alignment stopped at " + e.path() + ": " + e.getMessage(), e);
            return DIVERGED;
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "Alignment failed: " + e.getMessage(), e);
            return FAILED;
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "Could not load logging.properties, using JDK defaults", e);
        }
    }
}
