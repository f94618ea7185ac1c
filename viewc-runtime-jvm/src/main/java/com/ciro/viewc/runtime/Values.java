package com.ciro.viewc.runtime;

import java.util.List;
import java.util.Objects;

/** Conversiones entre los valores del programa y Java. */
final class Values {

    private Values() {}

    /** Los enteros siempre como {@link Integer}; el resto tal cual. */
    static Object normalize(Object v) {
        if (v instanceof Long || v instanceof Short || v instanceof Byte) return ((Number) v).intValue();
        if (v instanceof Float f) return f.doubleValue();
        return v;
    }

    static boolean truthy(Object v) {
        if (v == null) return false;
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.doubleValue() != 0;
        if (v instanceof String s) return !s.isEmpty();
        if (v instanceof List<?> l) return !l.isEmpty();
        return true;
    }

    static int toInt(Object v) {
        if (v instanceof Number n) return n.intValue();
        throw new ViewRuntimeException("se esperaba un entero: " + v);
    }

    static String str(Object v) {
        if (v == null) return "";
        if (v instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) return String.valueOf(d.longValue());
        return String.valueOf(v);
    }

    static boolean same(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            if (a instanceof Integer && b instanceof Integer) return x.intValue() == y.intValue();
            return x.doubleValue() == y.doubleValue();
        }
        return Objects.equals(a, b);
    }

    @SuppressWarnings("unchecked")
    static List<Object> list(Object v) {
        if (v instanceof List<?> l) return (List<Object>) l;
        throw new ViewRuntimeException("se esperaba un array: " + v);
    }
}
