package com.seqmine.core.model;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * Total ordering over opaque session keys.
 * 
 * Numbers compare by value, mutually comparable keys of one class by their natural
 * order, anything else by string form. Sorting and sequence-id assignment both use
 * this ordering, so the numbering of sessions is reproducible across runs.
 */
public final class SessionKeys {

    public static final Comparator<Object> ORDER = SessionKeys::compare;

    private SessionKeys() {
    }

    public static int compare(Object a, Object b) {
        if (a == b) {
            return 0;
        }
        if (a instanceof Number na && b instanceof Number nb) {
            return toBigDecimal(na).compareTo(toBigDecimal(nb));
        }
        if (a instanceof Comparable<?> && a.getClass() == b.getClass()) {
            return compareNatural(a, b);
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    @SuppressWarnings("unchecked")
    private static int compareNatural(Object a, Object b) {
        // same runtime class, so the cast holds
        Comparable<Object> comparable = (Comparable<Object>) a;
        return comparable.compareTo(b);
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                // NaN and infinities sort after every finite number
                return BigDecimal.valueOf(Double.MAX_VALUE).add(BigDecimal.ONE);
            }
            return BigDecimal.valueOf(d);
        }
        return new BigDecimal(n.toString());
    }
}
