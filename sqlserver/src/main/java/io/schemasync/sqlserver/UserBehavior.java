// file: sqlserver/src/main/java/io/schemasync/sqlserver/UserBehavior.java
package io.schemasync.sqlserver;

import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.live.AttributeReader;
import io.schemasync.core.live.AttributeWriter;
import io.schemasync.core.live.BackendDriver;
import io.schemasync.core.live.ReflectedNode;
import io.schemasync.core.live.Row;
import io.schemasync.core.model.EntityType;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.schemasync.core.model.AttributeRegistry.DB_ROLES;
import static io.schemasync.core.model.AttributeRegistry.LOGIN_NAME;
import static io.schemasync.core.model.AttributeRegistry.OWNER;
import static io.schemasync.sqlserver.SqlServerStatements.*;

/**
 * Database users mapped to SQL logins.
 * <p>
 * A user is matched by its login, so an empty declared name means "whatever
 * the user is called"; new users take the login's name in that case.
 * The login owning the database is {@code dbo} inside it and its role
 * memberships cannot be changed.
 */
final class UserBehavior extends SqlServerBehavior {
    private static final Logger log = Logger.getLogger(UserBehavior.class.getName());

    private static final Set<String> RESERVED = Set.of("dbo", "guest", "sys", "INFORMATION_SCHEMA");

    UserBehavior(DatabaseScope scope) {
        super(scope);
    }

    @Override
    public EntityType type() {
        return EntityType.USER;
    }

    @Override
    public Set<String> reservedNames() {
        return RESERVED;
    }

    @Override
    public List<String> listNames(ReflectedNode database) {
        return column(db(database).query(LIST_USERS), "name");
    }

    @Override
    public boolean exists(ReflectedNode database, String name) {
        return db(database).any(USER_EXISTS, name);
    }

    static String userName(DeclaredNode declared) {
        return declared.name().isEmpty() ? declared.text(LOGIN_NAME) : declared.name();
    }

    @Override
    public void create(ReflectedNode database, DeclaredNode declared) {
        BackendDriver driver = db(database);
        String user = userName(declared);
        driver.execute(format(CREATE_USER, quote(user), quote(declared.text(LOGIN_NAME))));
        for (String role : declared.names(DB_ROLES)) {
            driver.execute(format(ALTER_DATABASE_ROLE, quote(role), "ADD", quote(user)));
        }
    }

    @Override
    public Optional<Row> fetchDetail(ReflectedNode user) {
        return db(user).queryOne(USER_DETAIL, user.name());
    }

    @Override
    public Map<String, AttributeReader> readers() {
        return Map.of(DB_ROLES, (user, detail) -> new TreeSet<>(column(db(user).query(USER_ROLES, user.name()), "role_name")));
    }

    @Override
    public Map<String, AttributeWriter> writers() {
        return Map.of(DB_ROLES, this::setRoles);
    }

    private boolean setRoles(ReflectedNode user, DeclaredNode declared) {
        String login = user.attribute(LOGIN_NAME) == null ? null : user.attribute(LOGIN_NAME).toString();
        Object owner = user.ancestor(EntityType.DATABASE).attribute(OWNER);
        if (login != null && owner != null && login.equalsIgnoreCase(owner.toString())) {
            log.log(Level.WARNING, "Login " + login + " owns database " + user.ancestorName(EntityType.DATABASE)
                    + "; its roles cannot be changed");
            return false;
        }

        Set<String> wanted = LoginBehavior.lower(declared.names(DB_ROLES));
        Set<String> current = LoginBehavior.lower(names(user.attribute(DB_ROLES)));
        BackendDriver driver = db(user);
        for (String role : wanted) {
            if (!current.contains(role)) {
                log.log(Level.INFO, "Adding user " + user.fullName() + " to role " + role);
                driver.execute(format(ALTER_DATABASE_ROLE, quote(role), "ADD", quote(user.name())));
            }
        }
        for (String role : current) {
            if (!wanted.contains(role)) {
                log.log(Level.INFO, "Dropping user " + user.fullName() + " from role " + role);
                driver.execute(format(ALTER_DATABASE_ROLE, quote(role), "DROP", quote(user.name())));
            }
        }
        return true;
    }

    @Override
    public void rename(ReflectedNode user, String newName) {
        db(user).execute(format(RENAME_USER, quote(user.name()), quote(newName)));
    }

    @Override
    public boolean delete(ReflectedNode user) {
        db(user).execute(format(DROP_USER, quote(user.name())));
        return true;
    }
}
