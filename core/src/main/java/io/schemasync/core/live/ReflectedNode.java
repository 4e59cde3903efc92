// file: core/src/main/java/io/schemasync/core/live/ReflectedNode.java
package io.schemasync.core.live;

import io.schemasync.core.AttributeConfigurationException;
import io.schemasync.core.CreationMismatchException;
import io.schemasync.core.InvalidChildException;
import io.schemasync.core.MissingDetailException;
import io.schemasync.core.NotAlteredException;
import io.schemasync.core.ObjectNotFoundException;
import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.live.MutationJournal.Kind;
import io.schemasync.core.model.AttributeRegistry;
import io.schemasync.core.model.AttributeSpec;
import io.schemasync.core.model.EntityType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Handle on one object that exists on the live server.
 * <p>
 * Responsibilities:
 *  - lazily fetch and cache the object's detail row and derived attributes,
 *  - enumerate and match live children against declarations,
 *  - apply mutations (set attribute, create child, rename, delete) through the
 *    confirmation gate, commit them and verify the result by reading back.
 * <p>
 * The node holds only identity (type, name, parent); everything else is read
 * from the server on demand. A node is valid while the object exists; after a
 * rename its in-memory name follows the verified new name.
 */
public final class ReflectedNode {
    private static final Logger log = Logger.getLogger(ReflectedNode.class.getName());

    private final EntityType type;
    private final ReflectedNode parent;
    private final LiveSession session;
    private final EntityBehavior behavior;
    private String name;

    private Row detail;
    private final Map<String, Object> attributeCache = new HashMap<>();

    private ReflectedNode(LiveSession session, ReflectedNode parent, EntityType type, String name) {
        this.session = Objects.requireNonNull(session, "session");
        this.parent = parent;
        this.type = Objects.requireNonNull(type, "type");
        this.name = Objects.requireNonNull(name, "name");
        this.behavior = session.behaviors().behavior(type);
    }

    static ReflectedNode root(LiveSession session, String serverName) {
        return new ReflectedNode(session, null, EntityType.SERVER, serverName);
    }

    // ---------- identity ----------

    public EntityType type() {
        return type;
    }

    public String name() {
        return name;
    }

    public ReflectedNode parent() {
        return parent;
    }

    public LiveSession session() {
        return session;
    }

    public BackendDriver driver() {
        return session.driver();
    }

    public EntityBehavior behavior() {
        return behavior;
    }

    /**
     * Dotted path from the database level down ({@code db.schema.table.column}),
     * or from the server for objects that live outside any database.
     */
    public String fullName() {
        Deque<String> parts = new ArrayDeque<>();
        ReflectedNode n = this;
        while (n != null) {
            parts.addFirst(n.name);
            if (n.type == EntityType.DATABASE) break;
            n = n.parent;
        }
        return String.join(".", parts);
    }

    /**
     * Nearest ancestor (or this node) of the given type.
     *
     * @throws IllegalArgumentException if there is none
     */
    public ReflectedNode ancestor(EntityType ancestorType) {
        ReflectedNode n = this;
        while (n != null) {
            if (n.type == ancestorType) return n;
            n = n.parent;
        }
        throw new IllegalArgumentException(type + " " + fullName() + " has no " + ancestorType + " ancestor");
    }

    public String ancestorName(EntityType ancestorType) {
        return ancestor(ancestorType).name;
    }

    // ---------- children ----------

    /** Live children of one type, system objects excluded. */
    public List<ReflectedNode> children(EntityType childType) {
        EntityBehavior childBehavior = checkedChildBehavior(childType);
        Set<String> reserved = childBehavior.reservedNames().stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<ReflectedNode> out = new ArrayList<>();
        for (String childName : childBehavior.listNames(this)) {
            if (!reserved.contains(childName.toLowerCase(Locale.ROOT))) {
                out.add(new ReflectedNode(session, this, childType, childName));
            }
        }
        return out;
    }

    public boolean hasChild(EntityType childType, String childName) {
        return checkedChildBehavior(childType).exists(this, childName);
    }

    /**
     * Live child by name.
     *
     * @throws ObjectNotFoundException if the server has no such object
     */
    public ReflectedNode child(EntityType childType, String childName) {
        if (!hasChild(childType, childName)) {
            throw new ObjectNotFoundException(type + " " + fullName() + " has no " + childType + " named \"" + childName + "\"");
        }
        return new ReflectedNode(session, this, childType, childName);
    }

    /**
     * Live counterpart of a declared child: by name for name-matched types,
     * by scanning the live children for structurally-matched ones.
     *
     * @throws ObjectNotFoundException if nothing matches
     */
    public ReflectedNode matchChild(DeclaredNode declared) {
        EntityType childType = declared.type();
        if (childType.matchRule() == EntityType.MatchRule.NAME) {
            if (!declared.name().isEmpty() && hasChild(childType, declared.name())) {
                return new ReflectedNode(session, this, childType, declared.name());
            }
        } else {
            for (ReflectedNode candidate : children(childType)) {
                if (candidate.matches(declared)) {
                    return candidate;
                }
            }
        }
        throw new ObjectNotFoundException(type + " " + fullName() + " has no live match for " + declared);
    }

    /**
     * Match the declared child, creating it when missing.
     *
     * @return the live child, or empty when the type may not be created
     * @throws CreationMismatchException if the created object cannot be matched afterwards
     */
    public Optional<ReflectedNode> getOrCreateChild(DeclaredNode declared) {
        try {
            return Optional.of(matchChild(declared));
        } catch (ObjectNotFoundException missing) {
            log.log(Level.FINE, missing.getMessage());
        }

        EntityType childType = declared.type();
        String target = fullName() + "/" + declared;
        if (!childType.creatable()) {
            log.log(Level.INFO, "Unable to create " + target + ": " + childType + " are never created");
            session.journal().record(Kind.CREATE_REFUSED, childType, target, "type not creatable");
            return Optional.empty();
        }

        log.log(Level.INFO, "Creating " + target);
        checkedChildBehavior(childType).create(this, declared);
        driver().commit();

        ReflectedNode created;
        try {
            created = matchChild(declared);
        } catch (ObjectNotFoundException e) {
            throw new CreationMismatchException(target, "created object does not match its declaration");
        }
        session.journal().record(Kind.CREATED, childType, created.fullName(), null);
        return Optional.of(created);
    }

    /** Whether this live object is the counterpart of {@code declared}, per the type's match rule. */
    public boolean matches(DeclaredNode declared) {
        if (declared.type() != type) return false;
        return switch (type.matchRule()) {
            case NAME -> name.equalsIgnoreCase(declared.name())
                    || (declared.oldName() != null && name.equalsIgnoreCase(declared.oldName()));
            case KEY_COLUMNS -> sameAttribute(declared, AttributeRegistry.COLUMNS);
            case REFERENCE -> sameAttribute(declared, AttributeRegistry.KEY_COLUMN)
                    && sameAttribute(declared, AttributeRegistry.FOREIGN_SCHEMA)
                    && sameAttribute(declared, AttributeRegistry.FOREIGN_TABLE)
                    && sameAttribute(declared, AttributeRegistry.FOREIGN_COLUMN);
            case PARTITION_COLUMN -> sameAttribute(declared, AttributeRegistry.KEY_COLUMN);
            case LOGIN -> sameAttribute(declared, AttributeRegistry.LOGIN_NAME);
        };
    }

    private boolean sameAttribute(DeclaredNode declared, String attributeName) {
        return AttributeRegistry.spec(type, attributeName)
                .sameValue(declared.attribute(attributeName), attribute(attributeName));
    }

    private EntityBehavior checkedChildBehavior(EntityType childType) {
        if (!type.allowsChild(childType)) {
            throw new InvalidChildException(type + " " + fullName() + " cannot hold a child of type " + childType);
        }
        return session.behaviors().behavior(childType);
    }

    // ---------- attributes ----------

    /**
     * Detail row for this object, fetched once and cached.
     *
     * @throws MissingDetailException if the server returns nothing
     */
    public Row detail() {
        if (detail == null) {
            detail = behavior.fetchDetail(this).orElseThrow(() -> new MissingDetailException(fullName()));
        }
        return detail;
    }

    /**
     * Current live value of a registry attribute: from a registered reader if
     * there is one, else the detail field of the same name. Cached until reset.
     *
     * @throws AttributeConfigurationException if neither source can supply it
     */
    public Object attribute(String attributeName) {
        if (!AttributeRegistry.isAttribute(type, attributeName)) {
            throw new IllegalArgumentException("\"" + attributeName + "\" is not an attribute of " + type);
        }
        if (attributeCache.containsKey(attributeName)) {
            return attributeCache.get(attributeName);
        }
        Row row = detail();
        AttributeReader reader = behavior.readers().get(attributeName);
        Object value;
        if (reader != null) {
            value = reader.read(this, row);
        } else if (row.has(attributeName)) {
            value = row.get(attributeName);
        } else {
            throw new AttributeConfigurationException(fullName(),
                    "no reader and no detail field for attribute \"" + attributeName + "\" of " + type);
        }
        attributeCache.put(attributeName, value);
        return value;
    }

    /** Forget one cached attribute (and the detail row it may derive from). */
    public void resetAttribute(String attributeName) {
        attributeCache.remove(attributeName);
        detail = null;
    }

    public void resetAttributes() {
        attributeCache.clear();
        detail = null;
    }

    /**
     * Bring one attribute to the declared value.
     *
     * @return true if the change was applied and verified; false for a recoverable skip
     * @throws NotAlteredException if the committed change does not read back as declared
     */
    public boolean setAttribute(DeclaredNode declared, String attributeName) {
        AttributeSpec spec = AttributeRegistry.spec(type, attributeName);
        Object wanted = declared.attribute(attributeName);
        Object current = attribute(attributeName);
        String path = fullName();

        AttributeWriter writer = behavior.writers().get(attributeName);
        if (writer == null) {
            log.log(Level.WARNING, "No method defined for altering \"" + attributeName + "\" of " + type + " " + path);
            session.journal().record(Kind.ATTRIBUTE_SKIPPED, type, path, attributeName + ": no writer");
            return false;
        }

        String description = "Set " + type + " " + path + " \"" + attributeName + "\" from " + current + " to " + wanted;
        log.log(Level.INFO, description);
        if (!session.confirmer().confirm(description + "?")) {
            log.log(Level.INFO, "Declined: " + description);
            session.journal().record(Kind.ATTRIBUTE_SKIPPED, type, path, attributeName + ": declined");
            return false;
        }

        if (!writer.apply(this, declared)) {
            log.log(Level.INFO, "Skipped: " + description);
            session.journal().record(Kind.ATTRIBUTE_SKIPPED, type, path, attributeName + ": skipped by writer");
            return false;
        }
        driver().commit();

        resetAttribute(attributeName);
        Object after = attribute(attributeName);
        if (!spec.sameValue(wanted, after)) {
            throw new NotAlteredException(path,
                    "\"" + attributeName + "\" reads back as " + after + " after setting it to " + wanted);
        }
        session.journal().record(Kind.ATTRIBUTE_SET, type, path, attributeName + "=" + wanted);
        return true;
    }

    // ---------- rename / delete ----------

    /**
     * Rename this object and verify the new name exists.
     *
     * @return false when renaming is unsupported or declined
     * @throws NotAlteredException if the new name is not found after the commit
     */
    public boolean rename(String newName) {
        if (parent == null) {
            throw new IllegalStateException("the server root cannot be renamed");
        }
        String path = fullName();
        if (!behavior.supportsRename()) {
            log.log(Level.INFO, "Renaming " + type + " is not supported, leaving " + path);
            session.journal().record(Kind.RENAME_SKIPPED, type, path, "unsupported");
            return false;
        }
        String description = "Rename " + type + " " + path + " to " + newName;
        log.log(Level.INFO, description);
        if (!session.confirmer().confirm(description + "?")) {
            session.journal().record(Kind.RENAME_SKIPPED, type, path, "declined");
            return false;
        }

        behavior.rename(this, newName);
        driver().commit();
        if (!behavior.exists(parent, newName)) {
            throw new NotAlteredException(path, "not found under its new name " + newName + " after rename");
        }
        name = newName;
        resetAttributes();
        session.journal().record(Kind.RENAMED, type, fullName(), "from " + path);
        return true;
    }

    /**
     * Drop this object, subject to the deletion policy and the confirmation gate.
     *
     * @return true if the object was dropped
     */
    public boolean delete() {
        String path = fullName();
        if (!type.autoDeletable() || !behavior.canDelete(this)) {
            log.log(Level.INFO, "Delete not allowed for " + type + " " + path);
            session.journal().record(Kind.DELETE_DECLINED, type, path, "not allowed");
            return false;
        }
        String description = "Delete " + type + " " + path;
        log.log(Level.INFO, description);
        if (!session.confirmer().confirm(description + "?")) {
            session.journal().record(Kind.DELETE_DECLINED, type, path, "declined");
            return false;
        }
        if (!behavior.delete(this)) {
            log.log(Level.INFO, "Skipped: " + description);
            session.journal().record(Kind.DELETE_DECLINED, type, path, "skipped");
            return false;
        }
        driver().commit();
        session.journal().record(Kind.DELETED, type, path, null);
        return true;
    }

    @Override
    public String toString() {
        return type + ": " + fullName();
    }
}
