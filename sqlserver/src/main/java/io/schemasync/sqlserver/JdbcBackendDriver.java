// file: sqlserver/src/main/java/io/schemasync/sqlserver/JdbcBackendDriver.java
package io.schemasync.sqlserver;

import io.schemasync.core.BackendException;
import io.schemasync.core.live.BackendDriver;
import io.schemasync.core.live.Row;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BackendDriver} over one JDBC connection to SQL Server.
 * <p>
 * Responsibilities:
 *  - the connection runs with autocommit off; work is committed explicitly,
 *  - parameterless statements go through a plain {@link Statement} so session
 *    settings such as {@code USE} outlive the call (a prepared batch is
 *    scoped by sp_executesql),
 *  - every {@link SQLException} is rethrown as {@link BackendException}.
 */
public final class JdbcBackendDriver implements BackendDriver, AutoCloseable {
    private static final Logger log = Logger.getLogger(JdbcBackendDriver.class.getName());

    static final String DRIVER_CLASS = "com.microsoft.sqlserver.jdbc.SQLServerDriver";

    private final Connection connection;

    public JdbcBackendDriver(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "connection");
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw new BackendException("SET IMPLICIT_TRANSACTIONS", e);
        }
    }

    /**
     * Open a connection, e.g. {@code jdbc:sqlserver://host:1433;encrypt=false}.
     * User and password may be null when the URL carries integrated security.
     */
    public static JdbcBackendDriver connect(String url, String user, String password) {
        try {
            Class.forName(DRIVER_CLASS);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("SQL Server JDBC driver not on the classpath", e);
        }
        try {
            Connection c = user == null
                    ? DriverManager.getConnection(url)
                    : DriverManager.getConnection(url, user, password);
            log.log(Level.INFO, "Connected to " + redact(url));
            return new JdbcBackendDriver(c);
        } catch (SQLException e) {
            throw new BackendException("connect " + redact(url), e);
        }
    }

    /** Drop any inline password from a JDBC URL before it is logged. */
    static String redact(String url) {
        return url.replaceAll("(?i)(password=)[^;]*", "$1***");
    }

    @Override
    public List<Row> query(String sql, Object... params) {
        log.log(Level.FINE, () -> "query: " + sql.strip() + paramsSuffix(params));
        try {
            if (params.length == 0) {
                try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(sql)) {
                    return rows(rs);
                }
            }
            try (PreparedStatement ps = prepare(sql, params); ResultSet rs = ps.executeQuery()) {
                return rows(rs);
            }
        } catch (SQLException e) {
            throw new BackendException(sql, e);
        }
    }

    @Override
    public void execute(String sql, Object... params) {
        log.log(Level.FINE, () -> "execute: " + sql.strip() + paramsSuffix(params));
        try {
            if (params.length == 0) {
                try (Statement st = connection.createStatement()) {
                    st.execute(sql);
                }
                return;
            }
            try (PreparedStatement ps = prepare(sql, params)) {
                ps.execute();
            }
        } catch (SQLException e) {
            throw new BackendException(sql, e);
        }
    }

    @Override
    public void commit() {
        try {
            if (!connection.getAutoCommit()) {
                connection.commit();
            }
        } catch (SQLException e) {
            throw new BackendException("COMMIT", e);
        }
    }

    @Override
    public void inAutoCommit(Runnable action) {
        boolean previous;
        try {
            previous = connection.getAutoCommit();
            if (!previous) {
                connection.commit();
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new BackendException("SET IMPLICIT_TRANSACTIONS OFF", e);
        }
        try {
            action.run();
        } finally {
            try {
                connection.setAutoCommit(previous);
            } catch (SQLException e) {
                log.log(Level.WARNING, "Could not restore autocommit mode", e);
            }
        }
    }

    @Override
    public void close() {
        try {
            if (!connection.getAutoCommit()) {
                connection.rollback();
            }
            connection.close();
        } catch (SQLException e) {
            throw new BackendException("close", e);
        }
    }

    private PreparedStatement prepare(String sql, Object[] params) throws SQLException {
        PreparedStatement ps = connection.prepareStatement(sql);
        for (int i = 0; i < params.length; i++) {
            ps.setObject(i + 1, params[i]);
        }
        return ps;
    }

    private static List<Row> rows(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int n = md.getColumnCount();
        List<Row> out = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> fields = new LinkedHashMap<>();
            for (int i = 1; i <= n; i++) {
                String label = md.getColumnLabel(i);
                if (label == null || label.isBlank()) label = md.getColumnName(i);
                fields.put(label, rs.getObject(i));
            }
            out.add(new Row(fields));
        }
        return out;
    }

    private static String paramsSuffix(Object[] params) {
        return params.length == 0 ? "" : " " + Arrays.toString(params);
    }
}
