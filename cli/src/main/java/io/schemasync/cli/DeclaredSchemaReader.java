// file: cli/src/main/java/io/schemasync/cli/DeclaredSchemaReader.java
package io.schemasync.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.schemasync.cli.dto.NodeJson;
import io.schemasync.core.DeclarationException;
import io.schemasync.core.declared.DeclaredNode;
import io.schemasync.core.declared.Declarations;
import io.schemasync.core.declared.ExtraChildPolicy;
import io.schemasync.core.model.AttributeRegistry;
import io.schemasync.core.model.AttributeValues;
import io.schemasync.core.model.EntityType;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a declared server tree from JSON.
 * <p>
 * Responsibilities:
 *  - map the {@link NodeJson} tree onto {@link DeclaredNode}s,
 *  - fill attributes the file leaves out with the registry defaults,
 *  - name primary keys and indexes declared without a name.
 * Validation beyond that is {@link DeclaredNode}'s.
 */
public final class DeclaredSchemaReader {

    private final ObjectMapper mapper;

    public DeclaredSchemaReader() {
        this(new ObjectMapper());
    }

    public DeclaredSchemaReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws DeclarationException if the file cannot be read or describes an invalid tree
     */
    public DeclaredNode read(Path path) {
        try {
            return toServer(mapper.readValue(path.toFile(), NodeJson.class));
        } catch (IOException e) {
            throw new DeclarationException("Failed to load declared schema from " + path + ": " + e.getMessage(), e);
        }
    }

    public DeclaredNode readString(String json) {
        try {
            return toServer(mapper.readValue(json, NodeJson.class));
        } catch (IOException e) {
            throw new DeclarationException("Failed to parse declared schema: " + e.getMessage(), e);
        }
    }

    private DeclaredNode toServer(NodeJson root) {
        DeclaredNode server = toNode(root);
        if (server.type() != EntityType.SERVER) {
            throw new DeclarationException("the root of a declared schema must be of type servers, not " + server.type());
        }
        return server;
    }

    private DeclaredNode toNode(NodeJson json) {
        if (json.type == null) {
            throw new DeclarationException("declared node without a type: " + json.name);
        }
        EntityType type;
        try {
            type = EntityType.fromKey(json.type);
        } catch (IllegalArgumentException e) {
            throw new DeclarationException(e.getMessage(), e);
        }

        Map<String, Object> attributes = new LinkedHashMap<>(AttributeRegistry.defaults(type));
        if (json.attributes != null) {
            attributes.putAll(json.attributes);
        }

        List<DeclaredNode> children = new ArrayList<>();
        if (json.children != null) {
            for (NodeJson child : json.children) {
                children.add(toNode(child));
            }
        }

        return DeclaredNode.builder(type, name(type, json.name, attributes))
                .oldName(json.oldName)
                .ignoreExtraChildren(policy(json.ignoreExtraChildren))
                .attributes(attributes)
                .children(children)
                .build();
    }

    private static String name(EntityType type, String given, Map<String, Object> attributes) {
        if (given != null && !given.isBlank()) return given;
        return switch (type) {
            case PRIMARY_KEY -> Declarations.generatedName("PK",
                    AttributeValues.names(attributes.get(AttributeRegistry.COLUMNS)), List.of());
            case INDEX -> Declarations.generatedName("IX",
                    AttributeValues.names(attributes.get(AttributeRegistry.COLUMNS)),
                    AttributeValues.names(attributes.get(AttributeRegistry.INCLUDED_COLUMNS)));
            default -> "";
        };
    }

    static ExtraChildPolicy policy(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) return ExtraChildPolicy.none();
        if (Boolean.TRUE.equals(value)) return ExtraChildPolicy.all();
        if (value instanceof Collection<?> keys) {
            List<EntityType> types = new ArrayList<>();
            for (Object key : keys) {
                try {
                    types.add(EntityType.fromKey(String.valueOf(key)));
                } catch (IllegalArgumentException e) {
                    throw new DeclarationException("ignoreExtraChildren: " + e.getMessage(), e);
                }
            }
            return ExtraChildPolicy.of(types);
        }
        throw new DeclarationException("ignoreExtraChildren must be a boolean or a list of types, not " + value);
    }
}
