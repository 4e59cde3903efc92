// file: core/src/main/java/io/schemasync/core/DuplicateChildException.java
package io.schemasync.core;

/** Two declared siblings of the same type share a name. */
public class DuplicateChildException extends DeclarationException {

    public DuplicateChildException(String message) {
        super(message);
    }
}
