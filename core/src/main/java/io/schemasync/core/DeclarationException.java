// file: core/src/main/java/io/schemasync/core/DeclarationException.java
package io.schemasync.core;

/**
 * A declared tree was built incorrectly: unexpected or missing attributes,
 * an invalid column definition, a child of a type the parent cannot hold.
 */
public class DeclarationException extends SchemaSyncException {

    public DeclarationException(String message) {
        super(message);
    }

    public DeclarationException(String message, Throwable cause) {
        super(message, cause);
    }
}
