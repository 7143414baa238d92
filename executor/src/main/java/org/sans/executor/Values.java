package org.sans.executor;

import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.expression.LiteralExpression;
import org.sans.compiler.ir.type.ScalarType;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;

/**
 * Operations on runtime scalar values.
 * A value is null (missing), a Boolean, a Long, a BigDecimal or a String.
 * Missing compares smaller than every other value; ints and decimals
 * compare numerically.
 */
public class Values {
    private Values() {}

    public static final Comparator<Object> COMPARATOR = Comparator.nullsFirst(Values::compareNonNull);

    /** Compares key tuples lexicographically with {@link #COMPARATOR}. */
    public static final Comparator<List<Object>> KEY_COMPARATOR = Values::compareKeys;

    public static int compare(@Nullable Object left, @Nullable Object right) {
        return COMPARATOR.compare(left, right);
    }

    static int compareNonNull(Object left, Object right) {
        if (left instanceof Long && right instanceof Long)
            return Long.compare((Long) left, (Long) right);
        if (isNumeric(left) && isNumeric(right))
            return toDecimal(left).compareTo(toDecimal(right));
        if (left instanceof String && right instanceof String)
            return ((String) left).compareTo((String) right);
        if (left instanceof Boolean && right instanceof Boolean)
            return Boolean.compare((Boolean) left, (Boolean) right);
        throw mismatch("Cannot compare " + describe(left) + " with " + describe(right));
    }

    public static int compareKeys(List<Object> left, List<Object> right) {
        for (int i = 0; i < left.size(); i++) {
            int compare = compare(left.get(i), right.get(i));
            if (compare != 0)
                return compare;
        }
        return Integer.compare(left.size(), right.size());
    }

    public static boolean isNumeric(@Nullable Object value) {
        return value instanceof Long || value instanceof BigDecimal;
    }

    public static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal)
            return (BigDecimal) value;
        if (value instanceof Long)
            return BigDecimal.valueOf((Long) value);
        throw mismatch("Expected a number, got " + describe(value));
    }

    /** Truth value of a predicate result: only true is true. */
    public static boolean isTrue(@Nullable Object value) {
        if (value == null)
            return false;
        if (value instanceof Boolean)
            return (Boolean) value;
        throw mismatch("Expected a boolean, got " + describe(value));
    }

    @Nullable
    public static Boolean asBool(@Nullable Object value) {
        if (value == null || value instanceof Boolean)
            return (Boolean) value;
        throw mismatch("Expected a boolean, got " + describe(value));
    }

    /** Text used to look a value up in a format. */
    public static String keyText(Object value) {
        if (value instanceof BigDecimal)
            return LiteralExpression.canonicalDecimal((BigDecimal) value);
        return value.toString();
    }

    /** Text of a value as written to output files. */
    public static String toText(@Nullable Object value) {
        if (value == null)
            return "";
        return keyText(value);
    }

    /** The runtime type of a value. */
    public static ScalarType typeOf(@Nullable Object value) {
        if (value == null)
            return ScalarType.NULL;
        if (value instanceof Boolean)
            return ScalarType.BOOL;
        if (value instanceof Long)
            return ScalarType.INT;
        if (value instanceof BigDecimal)
            return ScalarType.DECIMAL;
        if (value instanceof String)
            return ScalarType.STRING;
        throw new ExecutionError(ErrorCode.INTERNAL, "Unexpected runtime value " + value.getClass());
    }

    /**
     * Convert a value to the representation of a column type.
     * Ints widen to decimals; anything else that does not match is a type mismatch.
     */
    @Nullable
    public static Object conform(@Nullable Object value, ScalarType type, String column) {
        if (value == null)
            return null;
        ScalarType actual = typeOf(value);
        if (actual == type)
            return value;
        if (type == ScalarType.DECIMAL && actual == ScalarType.INT)
            return BigDecimal.valueOf((Long) value);
        if (type == ScalarType.UNKNOWN)
            throw new ExecutionError(ErrorCode.RUNTIME_UNTYPED_INPUT,
                    "Column " + column + " has no concrete type");
        throw mismatch("Column " + column + " has type " + type + " but the value " +
                describe(value) + " was produced");
    }

    static String describe(@Nullable Object value) {
        if (value == null)
            return "missing";
        if (value instanceof String)
            return "'" + value + "' (string)";
        return value + " (" + typeOf(value) + ")";
    }

    static ExecutionError mismatch(String message) {
        return new ExecutionError(ErrorCode.RUNTIME_TYPE_MISMATCH, message);
    }
}
