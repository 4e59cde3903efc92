// file: cli/src/main/java/io/schemasync/cli/dto/NodeJson.java
package io.schemasync.cli.dto;

import java.util.List;
import java.util.Map;

/**
 * One node of a declared schema file.
 * {@code ignoreExtraChildren} is either a boolean or a list of child type keys.
 */
public class NodeJson {
    public String type;
    public String name;
    public String oldName;
    public Object ignoreExtraChildren;
    public Map<String, Object> attributes;
    public List<NodeJson> children;
}
