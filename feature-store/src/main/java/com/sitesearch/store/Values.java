package com.sitesearch.store;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * Text rendering and ordering of field values.
 */
public final class Values {

    /**
     * Ascending order: nulls first, numbers numerically, everything else by its text
     * ignoring case.
     */
    public static final Comparator<Object> ORDER = Values::compare;

    private Values() {
    }

    public static int compare(Object a, Object b) {
        if (a == null && b == null) {
            return 0;
        }
        if (a == null) {
            return -1;
        }
        if (b == null) {
            return 1;
        }
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        return String.CASE_INSENSITIVE_ORDER.compare(toText(a), toText(b));
    }

    /**
     * Text form of a value: null is empty, whole doubles lose their ".0".
     */
    public static String toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return String.valueOf(d);
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }
}
