// file: core/src/main/java/io/schemasync/core/SchemaSyncException.java
package io.schemasync.core;

/**
 * Root of all errors raised by the reconciler.
 * <p>
 * Unchecked: callers either let a failure abort the run or catch the
 * specific subtype they know how to recover from.
 */
public class SchemaSyncException extends RuntimeException {

    public SchemaSyncException(String message) {
        super(message);
    }

    public SchemaSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
