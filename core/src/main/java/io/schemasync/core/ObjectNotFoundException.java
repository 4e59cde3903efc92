// file: core/src/main/java/io/schemasync/core/ObjectNotFoundException.java
package io.schemasync.core;

/**
 * Lookup of a declared or live object by name (or by structural match) found nothing.
 * <p>
 * Recoverable in most call sites: get-or-create falls back to creation and
 * renames from an old name silently skip when the old object is gone.
 */
public class ObjectNotFoundException extends SchemaSyncException {

    public ObjectNotFoundException(String message) {
        super(message);
    }
}
