// file: sqlserver/src/main/java/io/schemasync/sqlserver/LoginBehavior.java
package io.schemasync.sqlserver;

import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.live.AttributeReader;
import io.schemasync.core.live.AttributeWriter;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.live.Row;
import io.schemasync.core.model.EntityType;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.schemasync.core.model.AttributeRegistry.SERVER_ROLES;
import static io.schemasync.sqlserver.SqlServerStatements.*;

/**
 * SQL logins. Server roles are read from the syslogins role bits and
 * reconciled member by member. Logins are never created here.
 */
final class LoginBehavior extends SqlServerBehavior {
    private static final Logger log = Logger.getLogger(LoginBehavior.class.getName());

    static final List<String> SERVER_ROLE_NAMES = List.of(
            "sysadmin", "securityadmin", "serveradmin", "setupadmin",
            "processadmin", "diskadmin", "dbcreator", "bulkadmin");

    private static final Set<String> RESERVED = Set.of(
            "##MS_PolicyTsqlExecutionLogin##", "##MS_PolicyEventProcessingLogin##", "sa");

    LoginBehavior(DatabaseScope scope) {
        super(scope);
    }

    @Override
    public EntityType type() {
        return EntityType.LOGIN;
    }

    @Override
    public Set<String> reservedNames() {
        return RESERVED;
    }

    @Override
    public List<String> listNames(ReflectedNode server) {
        return column(server.driver().query(LIST_LOGINS), "name");
    }

    @Override
    public boolean exists(ReflectedNode server, String name) {
        return server.driver().any(LOGIN_EXISTS, name);
    }

    @Override
    public Optional<Row> fetchDetail(ReflectedNode login) {
        return login.driver().queryOne(LOGIN_DETAIL, login.name());
    }

    @Override
    public Map<String, AttributeReader> readers() {
        return Map.of(SERVER_ROLES, (login, detail) -> serverRoles(detail));
    }

    @Override
    public Map<String, AttributeWriter> writers() {
        return Map.of(SERVER_ROLES, this::setServerRoles);
    }

    static Set<String> serverRoles(Row detail) {
        Set<String> roles = new TreeSet<>();
        for (String role : SERVER_ROLE_NAMES) {
            if (detail.has(role) && detail.flag(role)) {
                roles.add(role);
            }
        }
        return roles;
    }

    private boolean setServerRoles(ReflectedNode login, DeclaredNode declared) {
        Set<String> wanted = lower(declared.names(SERVER_ROLES));
        Set<String> current = lower(names(login.attribute(SERVER_ROLES)));
        for (String role : wanted) {
            if (!current.contains(role)) {
                log.log(Level.INFO, "Adding login " + login.name() + " to server role " + role);
                login.driver().execute(format(ALTER_SERVER_ROLE, quote(role), "ADD", quote(login.name())));
            }
        }
        for (String role : current) {
            if (!wanted.contains(role)) {
                log.log(Level.INFO, "Dropping login " + login.name() + " from server role " + role);
                login.driver().execute(format(ALTER_SERVER_ROLE, quote(role), "DROP", quote(login.name())));
            }
        }
        return true;
    }

    @Override
    public void rename(ReflectedNode login, String newName) {
        login.driver().execute(format(RENAME_LOGIN, quote(login.name()), quote(newName)));
    }

    @Override
    public boolean delete(ReflectedNode login) {
        login.driver().execute(format(DROP_LOGIN, quote(login.name())));
        return true;
    }

    static Set<String> lower(List<String> names) {
        Set<String> out = new TreeSet<>();
        for (String n : names) {
            out.add(n.toLowerCase(Locale.ROOT));
        }
        return out;
    }
}
