// file: core/src/main/java/io/schemasync/core/model/ColumnTypes.java
package io.schemasync.core.model;

import io.schemasync.core.DeclarationException;

import java.util.Locale;
import java.util.Set;

/**
 * Column data type categories and the parameters each category carries.
 * <p>
 * Precision attributes are only meaningful for the categories that carry them:
 *  - charMaxLen         -> CHAR
 *  - numericPrecision   -> NUMERIC, APPROXIMATE
 *  - numericScale       -> NUMERIC
 *  - datetimePrecision  -> DATETIME_PRECISION
 * Every other combination reads as null on both trees.
 */
public final class ColumnTypes {

    public enum Category {
        /** bigint, int, smallint, tinyint: no parameters. */
        INTEGER,
        /** decimal, numeric: precision and optional scale. */
        NUMERIC,
        /** money, smallmoney: no parameters. */
        MONEY,
        /** float, real: precision. */
        APPROXIMATE,
        /** date, datetime, smalldatetime: no parameters. */
        DATETIME,
        /** time, datetime2, datetimeoffset: fractional second precision. */
        DATETIME_PRECISION,
        /** char, varchar, nchar, nvarchar, binary, varbinary: maximum length. */
        CHAR
    }

    private static final Set<String> INTEGER = Set.of("bigint", "int", "smallint", "tinyint");
    private static final Set<String> NUMERIC = Set.of("decimal", "numeric");
    private static final Set<String> MONEY = Set.of("money", "smallmoney");
    private static final Set<String> APPROXIMATE = Set.of("float", "real");
    private static final Set<String> DATETIME = Set.of("date", "datetime", "smalldatetime");
    private static final Set<String> DATETIME_PRECISION = Set.of("time", "datetime2", "datetimeoffset");
    private static final Set<String> CHAR = Set.of("char", "varchar", "nchar", "nvarchar", "binary", "varbinary");

    /** Fractional second precision of time, datetime2 and datetimeoffset when none is given. */
    public static final int DEFAULT_DATETIME_PRECISION = 7;

    private static final int REAL_PRECISION = 24;
    private static final int FLOAT_PRECISION = 53;

    /** Types a time-range partition can be created on. */
    private static final Set<String> PARTITIONABLE = Set.of("datetime", "datetime2");

    private ColumnTypes() {
    }

    public static Category category(String dataType) {
        if (dataType == null) throw new DeclarationException("column data type must not be null");
        String t = dataType.strip().toLowerCase(Locale.ROOT);
        if (INTEGER.contains(t)) return Category.INTEGER;
        if (NUMERIC.contains(t)) return Category.NUMERIC;
        if (MONEY.contains(t)) return Category.MONEY;
        if (APPROXIMATE.contains(t)) return Category.APPROXIMATE;
        if (DATETIME.contains(t)) return Category.DATETIME;
        if (DATETIME_PRECISION.contains(t)) return Category.DATETIME_PRECISION;
        if (CHAR.contains(t)) return Category.CHAR;
        throw new DeclarationException("unsupported column type: \"" + dataType + "\"");
    }

    /** Whether the type belongs to a known category; live catalogs report types the model does not cover. */
    public static boolean known(String dataType) {
        if (dataType == null) return false;
        String t = dataType.strip().toLowerCase(Locale.ROOT);
        return INTEGER.contains(t) || NUMERIC.contains(t) || MONEY.contains(t) || APPROXIMATE.contains(t)
                || DATETIME.contains(t) || DATETIME_PRECISION.contains(t) || CHAR.contains(t);
    }

    public static boolean carriesCharLength(String dataType) {
        return category(dataType) == Category.CHAR;
    }

    public static boolean carriesNumericPrecision(String dataType) {
        Category c = category(dataType);
        return c == Category.NUMERIC || c == Category.APPROXIMATE;
    }

    public static boolean carriesNumericScale(String dataType) {
        return category(dataType) == Category.NUMERIC;
    }

    public static boolean carriesDatetimePrecision(String dataType) {
        return category(dataType) == Category.DATETIME_PRECISION;
    }

    public static boolean partitionable(String dataType) {
        return dataType != null && PARTITIONABLE.contains(dataType.strip().toLowerCase(Locale.ROOT));
    }

    /**
     * Precision the server stores for an approximate type: 24 for real and
     * float(1..24), 53 for float(25..53) and plain float.
     *
     * @throws DeclarationException when the precision is outside 1..53, or given for real as anything but 24
     */
    public static int approximatePrecision(String dataType, Integer numericPrecision) {
        boolean real = "real".equals(dataType.strip().toLowerCase(Locale.ROOT));
        if (numericPrecision == null) {
            return real ? REAL_PRECISION : FLOAT_PRECISION;
        }
        if (real && numericPrecision != REAL_PRECISION) {
            throw new DeclarationException("real has a fixed precision of 24, not " + numericPrecision);
        }
        if (numericPrecision < 1 || numericPrecision > FLOAT_PRECISION) {
            throw new DeclarationException("float precision must be between 1 and 53, not " + numericPrecision);
        }
        return numericPrecision <= REAL_PRECISION ? REAL_PRECISION : FLOAT_PRECISION;
    }

    /** The type name the catalog reports for a stored approximate precision. */
    public static String approximateType(int storedPrecision) {
        return storedPrecision <= REAL_PRECISION ? "real" : "float";
    }

    /**
     * Render a type with its parameters, e.g. {@code varchar(255)}, {@code numeric(10,2)}.
     *
     * @throws DeclarationException when a required parameter is missing
     */
    public static String render(String dataType, Integer charMaxLen, Integer datetimePrecision,
                                Integer numericPrecision, Integer numericScale) {
        Category category = category(dataType);
        String t = dataType.strip().toLowerCase(Locale.ROOT);
        return switch (category) {
            case INTEGER, MONEY, DATETIME -> t;
            case NUMERIC -> {
                if (numericPrecision == null) {
                    throw new DeclarationException("numeric precision must be provided for type " + t);
                }
                yield numericScale != null
                        ? t + "(" + numericPrecision + "," + numericScale + ")"
                        : t + "(" + numericPrecision + ")";
            }
            // real takes no parameter
            case APPROXIMATE -> "real".equals(t) ? t : t + "(" + approximatePrecision(t, numericPrecision) + ")";
            case DATETIME_PRECISION -> t + "("
                    + (datetimePrecision == null ? DEFAULT_DATETIME_PRECISION : datetimePrecision) + ")";
            case CHAR -> {
                if (charMaxLen == null) {
                    throw new DeclarationException("maximum length must be provided for type " + t);
                }
                // -1 is how the catalog reports (max)
                yield t + "(" + (charMaxLen < 0 ? "max" : charMaxLen.toString()) + ")";
            }
        };
    }
}
