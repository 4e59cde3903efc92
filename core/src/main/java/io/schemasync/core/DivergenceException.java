// file: core/src/main/java/io/schemasync/core/DivergenceException.java
package io.schemasync.core;

/**
 * Fatal: the live server and the engine's model of it disagree in a way that
 * cannot be reasoned about further. Aborts the alignment run.
 * <p>
 * Always names the qualified path of the offending entity.
 */
public class DivergenceException extends SchemaSyncException {

    private final String path;

    public DivergenceException(String path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    /** Qualified path of the entity the failure was detected on. */
    public String path() {
        return path;
    }
}
