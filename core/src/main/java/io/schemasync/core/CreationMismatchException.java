// file: core/src/main/java/io/schemasync/core/CreationMismatchException.java
package io.schemasync.core;

/** An object was created successfully but cannot be matched against its declaration afterwards. */
public class CreationMismatchException extends DivergenceException {

    public CreationMismatchException(String path, String message) {
        super(path, message);
    }
}
