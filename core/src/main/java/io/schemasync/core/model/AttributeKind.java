// file: core/src/main/java/io/schemasync/core/model/AttributeKind.java
package io.schemasync.core.model;

/**
 * Value kind of a registered attribute. Fixes the canonical equality rule
 * applied when a declared value is compared with a live one.
 */
public enum AttributeKind {
    /** Identifier-like text, compared case-insensitively after trimming. */
    TEXT,
    /** Numeric value, compared by value whatever the boxed type. */
    NUMBER,
    /** Boolean; drivers may hand back 0/1 or "true"/"false". */
    FLAG,
    /** Ordered list of names (index key columns), order significant. */
    ORDERED_NAMES,
    /** Unordered set of names (roles, included columns); null means empty. */
    NAME_SET,
    /** File system path; '/' and '\' are the same separator. */
    PATH
}
