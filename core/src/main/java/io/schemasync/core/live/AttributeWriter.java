// file: core/src/main/java/io/schemasync/core/live/AttributeWriter.java
package io.schemasync.core.live;

import io.schemasync.core.declared.DeclaredNode;

/**
 * Alters one attribute of a live node to the declared value.
 * <p>
 * Returns false when the change was deliberately skipped (for example a
 * dependent index could not be dropped first); the caller then records a
 * recoverable skip instead of verifying the value.
 */
@FunctionalInterface
public interface AttributeWriter {

    boolean apply(ReflectedNode node, DeclaredNode declared);
}
