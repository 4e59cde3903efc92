// file: core/src/main/java/io/schemasync/core/NotAlteredException.java
package io.schemasync.core;

/**
 * A mutation was executed and committed, but reading the object back does not
 * show the requested value (attribute) or name (rename).
 */
public class NotAlteredException extends DivergenceException {

    public NotAlteredException(String path, String message) {
        super(path, message);
    }
}
