// file: core/src/main/java/io/schemasync/core/live/AttributeReader.java
package io.schemasync.core.live;

/**
 * Derives one attribute of a live node, usually from its cached detail row,
 * sometimes with an extra query (index columns, role memberships).
 */
@FunctionalInterface
public interface AttributeReader {

    Object read(ReflectedNode node, Row detail);
}
