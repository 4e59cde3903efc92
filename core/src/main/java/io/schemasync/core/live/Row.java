// file: core/src/main/java/io/schemasync/core/live/Row.java
package io.schemasync.core.live;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * One result row from the backend, with case-insensitive named field access.
 * <p>
 * Field names are the labels used in the query text (aliases included).
 * Null values are kept: {@link #has(String)} tells "column absent" from "column is NULL".
 */
public final class Row {

    private final Map<String, Object> fields;

    public Row(Map<String, ?> fields) {
        TreeMap<String, Object> m = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        m.putAll(fields);
        this.fields = Collections.unmodifiableMap(m);
    }

    public static Row of(Object... keyValues) {
        if (keyValues.length % 2 != 0) throw new IllegalArgumentException("keyValues must come in pairs");
        TreeMap<String, Object> m = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new Row(m);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /**
     * @throws IllegalArgumentException if the row has no such field
     */
    public Object get(String field) {
        if (!fields.containsKey(field)) {
            throw new IllegalArgumentException("row has no field \"" + field + "\"; fields: " + fields.keySet());
        }
        return fields.get(field);
    }

    public String string(String field) {
        Object v = get(field);
        return v == null ? null : v.toString();
    }

    public Integer integer(String field) {
        Object v = get(field);
        if (v == null) return null;
        if (v instanceof Number n) return n.intValue();
        return Integer.valueOf(v.toString().strip());
    }

    public boolean flag(String field) {
        Object v = get(field);
        if (v == null) return false;
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.intValue() != 0;
        return Boolean.parseBoolean(v.toString().strip()) || "1".equals(v.toString().strip());
    }

    public Set<String> fieldNames() {
        return fields.keySet();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
