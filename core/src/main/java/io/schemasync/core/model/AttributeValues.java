// file: core/src/main/java/io/schemasync/core/model/AttributeValues.java
package io.schemasync.core.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Canonical forms and equality for attribute values.
 * <p>
 * Values reach the comparison from two very different sources: declarations
 * (Java literals, JSON) and live queries (JDBC types). Each {@link AttributeKind}
 * is normalised to one canonical representation before comparing:
 *  - TEXT          -> trimmed lower-case string
 *  - NUMBER        -> BigDecimal with trailing zeros stripped
 *  - FLAG          -> Boolean
 *  - ORDERED_NAMES -> List of lower-case strings
 *  - NAME_SET      -> sorted Set of lower-case strings (null -> empty)
 *  - PATH          -> lower-case string with '/' as separator
 */
public final class AttributeValues {

    private AttributeValues() {
    }

    public static boolean equivalent(AttributeKind kind, Object a, Object b) {
        Object ca = canonical(kind, a);
        Object cb = canonical(kind, b);
        if (ca == null || cb == null) return ca == cb;
        if (ca instanceof BigDecimal x && cb instanceof BigDecimal y) return x.compareTo(y) == 0;
        return ca.equals(cb);
    }

    public static Object canonical(AttributeKind kind, Object v) {
        return switch (kind) {
            case TEXT -> v == null ? null : v.toString().strip().toLowerCase(Locale.ROOT);
            case NUMBER -> toNumber(v);
            case FLAG -> v == null ? null : toFlag(v);
            case ORDERED_NAMES -> v == null ? null : lowerList(names(v));
            case NAME_SET -> v == null ? Set.of() : new TreeSet<>(lowerList(names(v)));
            case PATH -> v == null ? null : v.toString().strip().replace('\\', '/').toLowerCase(Locale.ROOT);
        };
    }

    private static BigDecimal toNumber(Object v) {
        if (v == null) return null;
        if (v instanceof BigDecimal bd) return bd.stripTrailingZeros();
        if (v instanceof Number n) return new BigDecimal(n.toString()).stripTrailingZeros();
        try {
            return new BigDecimal(v.toString().strip()).stripTrailingZeros();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: " + v, e);
        }
    }

    /** Accepts Boolean, numbers (non-zero = true) and "true"/"false"/"1"/"0". */
    public static boolean toFlag(Object v) {
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.intValue() != 0;
        String s = v.toString().strip();
        if (s.equalsIgnoreCase("true") || s.equals("1")) return true;
        if (s.equalsIgnoreCase("false") || s.equals("0")) return false;
        throw new IllegalArgumentException("not a flag: " + v);
    }

    /**
     * Names from a collection, an array or a single comma-separated string.
     */
    public static List<String> names(Object v) {
        List<String> out = new ArrayList<>();
        if (v == null) return out;
        if (v instanceof Collection<?> c) {
            for (Object o : c) out.add(o.toString().strip());
        } else if (v instanceof Object[] arr) {
            for (Object o : arr) out.add(o.toString().strip());
        } else {
            for (String part : v.toString().split(",")) {
                if (!part.isBlank()) out.add(part.strip());
            }
        }
        return out;
    }

    private static List<String> lowerList(List<String> in) {
        return in.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
    }
}
