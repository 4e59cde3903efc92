// file: core/src/main/java/io/schemasync/core/declared/DeclaredNode.java
package io.schemasync.core.declared;

import io.schemasync.core.DeclarationException;
import io.schemasync.core.DuplicateChildException;
import io.schemasync.core.InvalidChildException;
import io.schemasync.core.ObjectNotFoundException;
import io.schemasync.core.model.AttributeRegistry;
import io.schemasync.core.model.AttributeValues;
import io.schemasync.core.model.ColumnTypes;
import io.schemasync.core.model.EntityType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Desired state of one database object and its desired children.
 * <p>
 * Invariants:
 *  - name is at most 128 characters (longer names are truncated),
 *  - the attribute key set is exactly the registry set for the type,
 *  - children are only of the type's allowed child types,
 *  - named siblings of one type are unique (case-insensitive).
 * <p>
 * Built once before an alignment run; the engine only reads it.
 */
public final class DeclaredNode {

    public static final int MAX_NAME_LENGTH = 128;

    private final EntityType type;
    private final String name;
    private final String oldName;
    private final ExtraChildPolicy extraChildPolicy;
    private final Map<String, Object> attributes;
    private final Map<EntityType, List<DeclaredNode>> children = new EnumMap<>(EntityType.class);

    public DeclaredNode(EntityType type,
                        String name,
                        String oldName,
                        ExtraChildPolicy extraChildPolicy,
                        Map<String, Object> attributes,
                        List<DeclaredNode> children) {
        this.type = Objects.requireNonNull(type, "type");
        if (name == null) {
            throw new DeclarationException("declared " + type + " must be defined with a name");
        }
        this.name = name.length() > MAX_NAME_LENGTH ? name.substring(0, MAX_NAME_LENGTH) : name;
        this.oldName = (oldName == null || oldName.isBlank()) ? null : oldName;
        this.extraChildPolicy = extraChildPolicy == null ? ExtraChildPolicy.none() : extraChildPolicy;
        this.attributes = checkAttributes(type, this.name, attributes == null ? Map.of() : attributes);
        if (children != null) {
            for (DeclaredNode child : children) {
                addChild(child);
            }
        }
    }

    public static Builder builder(EntityType type, String name) {
        return new Builder(type, name);
    }

    private static Map<String, Object> checkAttributes(EntityType type, String name, Map<String, Object> given) {
        List<String> expected = AttributeRegistry.names(type);

        Set<String> unexpected = new HashSet<>(given.keySet());
        unexpected.removeAll(expected);
        if (!unexpected.isEmpty()) {
            throw new DeclarationException("unexpected attributes for " + type + " \"" + name + "\": " + unexpected);
        }
        List<String> missing = expected.stream().filter(a -> !given.containsKey(a)).toList();
        if (!missing.isEmpty()) {
            throw new DeclarationException("missing attributes for " + type + " \"" + name + "\": " + missing);
        }

        // keep registry order, allow null values
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (String a : expected) {
            ordered.put(a, given.get(a));
        }
        if (type == EntityType.COLUMN) {
            checkColumn(name, ordered);
        }
        return Collections.unmodifiableMap(ordered);
    }

    /**
     * Validate a column's type parameters and fill in the values the server
     * reports when they are left out, so a fresh column compares equal to
     * what was created for it.
     */
    private static void checkColumn(String name, Map<String, Object> attrs) {
        Object rawType = attrs.get(AttributeRegistry.DATA_TYPE);
        if (rawType != null && !(rawType instanceof String)) {
            throw new DeclarationException("column \"" + name + "\": data type must be text, not " + rawType);
        }
        String dataType = (String) rawType;
        Integer charMaxLen = asInt(attrs.get(AttributeRegistry.CHAR_MAX_LEN));
        Integer dtPrecision = asInt(attrs.get(AttributeRegistry.DATETIME_PRECISION));
        Integer precision = asInt(attrs.get(AttributeRegistry.NUMERIC_PRECISION));
        Integer scale = asInt(attrs.get(AttributeRegistry.NUMERIC_SCALE));

        switch (ColumnTypes.category(dataType)) {
            case DATETIME_PRECISION -> {
                if (dtPrecision == null) {
                    dtPrecision = ColumnTypes.DEFAULT_DATETIME_PRECISION;
                    attrs.put(AttributeRegistry.DATETIME_PRECISION, dtPrecision);
                }
            }
            case NUMERIC -> {
                if (scale == null) {
                    scale = 0;
                    attrs.put(AttributeRegistry.NUMERIC_SCALE, scale);
                }
            }
            case APPROXIMATE -> {
                // float(1..24) is stored as real, float(25..53) as float(53)
                precision = ColumnTypes.approximatePrecision(dataType, precision);
                dataType = ColumnTypes.approximateType(precision);
                attrs.put(AttributeRegistry.DATA_TYPE, dataType);
                attrs.put(AttributeRegistry.NUMERIC_PRECISION, precision);
            }
            default -> {
            }
        }

        // throws for unknown types and missing mandatory parameters
        ColumnTypes.render(dataType, charMaxLen, dtPrecision, precision, scale);

        if (charMaxLen != null && !ColumnTypes.carriesCharLength(dataType)) {
            throw new DeclarationException("column \"" + name + "\": " + dataType + " takes no maximum length");
        }
        if (precision != null && !ColumnTypes.carriesNumericPrecision(dataType)) {
            throw new DeclarationException("column \"" + name + "\": " + dataType + " takes no numeric precision");
        }
        if (scale != null && !ColumnTypes.carriesNumericScale(dataType)) {
            throw new DeclarationException("column \"" + name + "\": " + dataType + " takes no numeric scale");
        }
        if (dtPrecision != null && !ColumnTypes.carriesDatetimePrecision(dataType)) {
            throw new DeclarationException("column \"" + name + "\": " + dataType + " takes no datetime precision");
        }
        if (precision != null && scale != null && scale >= precision) {
            throw new DeclarationException("column \"" + name + "\": numeric scale must be less than numeric precision");
        }
    }

    private static Integer asInt(Object v) {
        if (v == null) return null;
        if (v instanceof Number n) return n.intValue();
        try {
            return Integer.valueOf(v.toString().strip());
        } catch (NumberFormatException e) {
            throw new DeclarationException("not an integer: " + v);
        }
    }

    // ---------- children ----------

    /**
     * Add a declared child.
     *
     * @throws InvalidChildException   if this type cannot hold the child's type
     * @throws DuplicateChildException if a named sibling of the same type exists
     */
    public DeclaredNode addChild(DeclaredNode child) {
        Objects.requireNonNull(child, "child");
        if (!type.allowsChild(child.type)) {
            throw new InvalidChildException(
                    "declared " + type + " \"" + name + "\" cannot hold a child of type " + child.type);
        }
        List<DeclaredNode> siblings = children.computeIfAbsent(child.type, t -> new ArrayList<>());
        if (!child.name.isEmpty()) {
            for (DeclaredNode s : siblings) {
                if (s.name.equalsIgnoreCase(child.name)) {
                    throw new DuplicateChildException(
                            "declared " + type + " \"" + name + "\" already has a " + child.type + " named \"" + child.name + "\"");
                }
            }
        }
        siblings.add(child);
        return this;
    }

    /** Declared children of a type, in declaration order; empty when none were declared. */
    public List<DeclaredNode> children(EntityType childType) {
        List<DeclaredNode> list = children.get(childType);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    public boolean hasChildren(EntityType childType) {
        List<DeclaredNode> list = children.get(childType);
        return list != null && !list.isEmpty();
    }

    /**
     * Single declared child of a type by name (case-insensitive).
     *
     * @throws ObjectNotFoundException if there is none
     */
    public DeclaredNode child(EntityType childType, String childName) {
        for (DeclaredNode c : children(childType)) {
            if (c.name.equalsIgnoreCase(childName)) {
                return c;
            }
        }
        throw new ObjectNotFoundException(
                "declared " + type + " \"" + name + "\" has no " + childType + " named \"" + childName + "\"");
    }

    /** Child with this name of whichever allowed type has one (types tried in order). */
    public DeclaredNode childByName(String childName) {
        for (EntityType t : type.childTypes()) {
            for (DeclaredNode c : children(t)) {
                if (c.name.equalsIgnoreCase(childName)) {
                    return c;
                }
            }
        }
        throw new ObjectNotFoundException("declared " + type + " \"" + name + "\" has no child named \"" + childName + "\"");
    }

    /**
     * Resolve a chain of names into a descendant, e.g. {@code resolve("MyDatabase", "dbo", "Person")}.
     */
    public DeclaredNode resolve(String... names) {
        if (names.length == 0) throw new IllegalArgumentException("names must not be empty");
        DeclaredNode current = this;
        for (String n : names) {
            current = current.childByName(n);
        }
        return current;
    }

    /** Dotted form of {@link #resolve(String...)}: {@code "MyDatabase.dbo.Person"}. */
    public DeclaredNode resolvePath(String dottedPath) {
        return resolve(dottedPath.split("\\."));
    }

    // ---------- accessors ----------

    public EntityType type() {
        return type;
    }

    public String name() {
        return name;
    }

    public String oldName() {
        return oldName;
    }

    public ExtraChildPolicy extraChildPolicy() {
        return extraChildPolicy;
    }

    public boolean ignoresExtraChildren(EntityType childType) {
        return extraChildPolicy.ignores(childType);
    }

    /** Attribute values in registry order (values may be null). */
    public Map<String, Object> attributes() {
        return attributes;
    }

    public Object attribute(String attributeName) {
        if (!attributes.containsKey(attributeName)) {
            throw new IllegalArgumentException("\"" + attributeName + "\" is not an attribute of " + type);
        }
        return attributes.get(attributeName);
    }

    public String text(String attributeName) {
        Object v = attribute(attributeName);
        return v == null ? null : v.toString();
    }

    public Integer integer(String attributeName) {
        return asInt(attribute(attributeName));
    }

    public boolean flag(String attributeName) {
        Object v = attribute(attributeName);
        return v != null && AttributeValues.toFlag(v);
    }

    public List<String> names(String attributeName) {
        return AttributeValues.names(attribute(attributeName));
    }

    @Override
    public String toString() {
        return switch (type) {
            case FOREIGN_KEY -> type + " from " + attributes.get(AttributeRegistry.KEY_COLUMN) + " to "
                    + attributes.get(AttributeRegistry.FOREIGN_SCHEMA) + "." + attributes.get(AttributeRegistry.FOREIGN_TABLE)
                    + "." + attributes.get(AttributeRegistry.FOREIGN_COLUMN);
            case PRIMARY_KEY, INDEX -> type + ": " + name + " on " + attributes.get(AttributeRegistry.COLUMNS);
            case PARTITION -> type + " on " + attributes.get(AttributeRegistry.KEY_COLUMN);
            case USER -> name.isEmpty()
                    ? type + " for login " + attributes.get(AttributeRegistry.LOGIN_NAME)
                    : type + ": " + name;
            default -> type + ": " + name;
        };
    }

    public String displayDetails() {
        return this + " with attributes " + attributes;
    }

    /**
     * Fluent construction. {@link #withDefaults()} seeds the registry defaults;
     * without it every attribute must be supplied explicitly.
     */
    public static final class Builder {
        private final EntityType type;
        private final String name;
        private String oldName;
        private ExtraChildPolicy policy = ExtraChildPolicy.none();
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final List<DeclaredNode> children = new ArrayList<>();

        private Builder(EntityType type, String name) {
            this.type = type;
            this.name = name;
        }

        public Builder withDefaults() {
            AttributeRegistry.defaults(type).forEach(attributes::putIfAbsent);
            return this;
        }

        public Builder oldName(String oldName) {
            this.oldName = oldName;
            return this;
        }

        public Builder ignoreExtraChildren(ExtraChildPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder attribute(String attributeName, Object value) {
            attributes.put(attributeName, value);
            return this;
        }

        public Builder attributes(Map<String, ?> values) {
            attributes.putAll(values);
            return this;
        }

        public Builder child(DeclaredNode child) {
            children.add(child);
            return this;
        }

        public Builder children(List<DeclaredNode> more) {
            children.addAll(more);
            return this;
        }

        public DeclaredNode build() {
            return new DeclaredNode(type, name, oldName, policy, attributes, children);
        }
    }
}
