// file: core/src/main/java/io/schemasync/core/InvalidChildException.java
package io.schemasync.core;

/** A child of a type that is not allowed under its parent. */
public class InvalidChildException extends DeclarationException {

    public InvalidChildException(String message) {
        super(message);
    }
}
