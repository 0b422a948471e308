package io.tabletree.kernel;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;

/**
 * Arithmetic and comparison helpers for loosely typed column values.
 * <p>
 * Integral boxes (Byte, Short, Integer, Long, BigInteger in long range) add up to a {@code Long};
 * any other numeric pair adds up to a {@code Double}.
 */
public final class Values {

    private static final double LONG_RANGE = 0x1p63;

    private Values() {
    }

    public static boolean isNumeric(Object value) {
        return value instanceof Number;
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte
                || (value instanceof BigInteger integer && integer.bitLength() < Long.SIZE);
    }

    /**
     * Integral sums that overflow a {@code long} are promoted to {@code Double}.
     */
    public static Number add(Number left, Number right) {
        if (isIntegral(left) && isIntegral(right)) {
            try {
                return Math.addExact(left.longValue(), right.longValue());
            } catch (ArithmeticException overflow) {
                return left.doubleValue() + right.doubleValue();
            }
        }
        return left.doubleValue() + right.doubleValue();
    }

    public static int compare(Number left, Number right) {
        if (isIntegral(left) && isIntegral(right)) {
            return Long.compare(left.longValue(), right.longValue());
        }
        return Double.compare(left.doubleValue(), right.doubleValue());
    }

    /**
     * Empty in the loose sense used by the {@code min} operator: null, zero, false or "".
     */
    public static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Number number) {
            return number.doubleValue() == 0d;
        }
        if (value instanceof Boolean bool) {
            return !bool;
        }
        if (value instanceof String string) {
            return string.isEmpty();
        }
        return false;
    }

    /**
     * Structural equality where numbers are compared by value regardless of their box type,
     * so {@code 5}, {@code 5L} and {@code 5.0} are equal.
     */
    public static boolean looselyEquals(Object left, Object right) {
        if (left == right) {
            return true;
        }
        if (left instanceof Number l && right instanceof Number r) {
            return toBigDecimal(l).compareTo(toBigDecimal(r)) == 0;
        }
        if (left instanceof Map<?, ?> l && right instanceof Map<?, ?> r) {
            if (l.size() != r.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : l.entrySet()) {
                if (!r.containsKey(entry.getKey()) || !looselyEquals(entry.getValue(), r.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(left, right);
    }

    /**
     * Map key used by label indexes: labels are compared by their string form.
     */
    public static String labelKey(Object label) {
        if (label instanceof Double || label instanceof Float) {
            double value = ((Number) label).doubleValue();
            if (value == Math.rint(value) && !Double.isInfinite(value)) {
                if (Math.abs(value) < LONG_RANGE) {
                    return Long.toString((long) value);
                }
                return BigDecimal.valueOf(value).toBigInteger().toString();
            }
        }
        return String.valueOf(label);
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (isIntegral(number)) {
            return BigDecimal.valueOf(number.longValue());
        }
        double value = number.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(value);
    }
}
