// file: core/src/main/java/io/schemasync/core/AttributeConfigurationException.java
package io.schemasync.core;

/**
 * No way to derive an attribute for a live node: neither a reader is registered
 * for the (type, attribute) pair nor does the detail record carry the field.
 */
public class AttributeConfigurationException extends DivergenceException {

    public AttributeConfigurationException(String path, String message) {
        super(path, message);
    }
}
