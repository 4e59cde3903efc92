// file: core/src/main/java/io/schemasync/core/TypeMismatchException.java
package io.schemasync.core;

/** A declared node was paired with a live node of another entity type. */
public class TypeMismatchException extends DivergenceException {

    public TypeMismatchException(String path, String message) {
        super(path, message);
    }
}
