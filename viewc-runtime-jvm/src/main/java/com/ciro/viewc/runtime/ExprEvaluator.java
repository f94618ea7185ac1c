package com.ciro.viewc.runtime;

import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.runtime.dom.DomNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Evalúa expresiones en un frame. Las llamadas a métodos pasan por el intérprete. */
final class ExprEvaluator {

    private final Interpreter interpreter;

    ExprEvaluator(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    Object eval(Expr e, Frame f) {
        if (e == null) return null;
        if (e instanceof Expr.Literal l) return Values.normalize(l.value());
        if (e instanceof Expr.Ident id) return f.lookup(id.name());
        if (e instanceof Expr.Member m) return member(eval(m.target(), f), m.name());
        if (e instanceof Expr.Index ix) return index(eval(ix.target(), f), eval(ix.index(), f));
        if (e instanceof Expr.Unary u) return unary(u, f);
        if (e instanceof Expr.Binary b) return binary(b, f);
        if (e instanceof Expr.Call c) return call(c, f);
        if (e instanceof Expr.StringTemplate t) {
            StringBuilder sb = new StringBuilder();
            for (Expr p : t.parts()) sb.append(Values.str(eval(p, f)));
            return sb.toString();
        }
        if (e instanceof Expr.ArrayLit a) {
            List<Object> out = new ArrayList<>();
            for (Expr item : a.items()) out.add(eval(item, f));
            return out;
        }
        throw new ViewRuntimeException("expresión no soportada: " + e);
    }

    /** Escribe en un lvalue: variable, índice o miembro de una instancia. */
    void assign(Expr target, Object value, Frame f) {
        Object v = Values.normalize(value);
        if (target instanceof Expr.Ident id) {
            f.assign(id.name(), v);
        } else if (target instanceof Expr.Index ix) {
            List<Object> list = Values.list(eval(ix.target(), f));
            int i = Values.toInt(eval(ix.index(), f));
            if (i < 0 || i >= list.size()) throw new ViewRuntimeException("índice fuera de rango: " + i);
            list.set(i, v);
        } else if (target instanceof Expr.Member m) {
            Object obj = eval(m.target(), f);
            if (!(obj instanceof ComponentInstance inst)) {
                throw new ViewRuntimeException("asignación de miembro sobre " + obj);
            }
            inst.setField(m.name(), v);
        } else {
            throw new ViewRuntimeException("no es asignable: " + target);
        }
    }

    private Object member(Object target, String name) {
        if (target instanceof ComponentInstance inst) return inst.field(name);
        if (target instanceof List<?> l && name.equals("length")) return l.size();
        if (target instanceof String s && name.equals("length")) return s.length();
        throw new ViewRuntimeException("miembro '" + name + "' inexistente en " + target);
    }

    private Object index(Object target, Object index) {
        List<Object> list = Values.list(target);
        int i = Values.toInt(index);
        if (i < 0 || i >= list.size()) throw new ViewRuntimeException("índice fuera de rango: " + i);
        return list.get(i);
    }

    private Object unary(Expr.Unary u, Frame f) {
        switch (u.op()) {
            case "!":
                return !Values.truthy(eval(u.operand(), f));
            case "-": {
                Object v = eval(u.operand(), f);
                if (v instanceof Integer i) return -i;
                if (v instanceof Number n) return -n.doubleValue();
                throw new ViewRuntimeException("negación de un no número: " + v);
            }
            case "++":
            case "--": {
                Object v = eval(u.operand(), f);
                int delta = u.op().equals("++") ? 1 : -1;
                Object next = v instanceof Integer i ? (Object) (i + delta) : (Object) (((Number) v).doubleValue() + delta);
                assign(u.operand(), next, f);
                return next;
            }
            default:
                throw new ViewRuntimeException("operador desconocido: " + u.op());
        }
    }

    private Object binary(Expr.Binary b, Frame f) {
        String op = b.op();
        if (op.equals("&&")) return Values.truthy(eval(b.left(), f)) && Values.truthy(eval(b.right(), f));
        if (op.equals("||")) return Values.truthy(eval(b.left(), f)) || Values.truthy(eval(b.right(), f));

        Object l = eval(b.left(), f);
        Object r = eval(b.right(), f);
        switch (op) {
            case "==": return Values.same(l, r);
            case "!=": return !Values.same(l, r);
            case "+":
                if (l instanceof String || r instanceof String) return Values.str(l) + Values.str(r);
                return arithmetic(op, l, r);
            case "-": case "*": case "/": case "%":
                return arithmetic(op, l, r);
            case "<": return compare(l, r) < 0;
            case "<=": return compare(l, r) <= 0;
            case ">": return compare(l, r) > 0;
            case ">=": return compare(l, r) >= 0;
            default:
                throw new ViewRuntimeException("operador desconocido: " + op);
        }
    }

    private static Object arithmetic(String op, Object l, Object r) {
        if (!(l instanceof Number a) || !(r instanceof Number b)) {
            throw new ViewRuntimeException("operación '" + op + "' sobre " + l + " y " + r);
        }
        if (a instanceof Integer && b instanceof Integer) {
            int x = a.intValue();
            int y = b.intValue();
            switch (op) {
                case "+": return x + y;
                case "-": return x - y;
                case "*": return x * y;
                default:
                    if (y == 0) throw new ViewRuntimeException("división por cero");
                    return op.equals("/") ? x / y : x % y;
            }
        }
        double x = a.doubleValue();
        double y = b.doubleValue();
        switch (op) {
            case "+": return x + y;
            case "-": return x - y;
            case "*": return x * y;
            case "/": return x / y;
            default: return x % y;
        }
    }

    private static int compare(Object l, Object r) {
        if (l instanceof Number a && r instanceof Number b) return Double.compare(a.doubleValue(), b.doubleValue());
        if (l instanceof String a && r instanceof String b) return a.compareTo(b);
        throw new ViewRuntimeException("no comparables: " + l + " y " + r);
    }

    // ------------------------------------------------------------------ llamadas

    private Object call(Expr.Call c, Frame f) {
        List<Object> args = new ArrayList<>();
        for (Expr a : c.args()) args.add(eval(a, f));

        if (c.receiver() == null) return freeCall(c.name(), args, f);

        Object receiver = eval(c.receiver(), f);
        if (receiver instanceof ComponentInstance inst) return interpreter.invoke(inst, c.name(), args);
        if (receiver instanceof List<?>) return listCall(Values.list(receiver), c.name(), args);
        if (receiver instanceof String s) return stringCall(c, s, args, f);
        if (receiver instanceof DomNode node && c.name().equals("focus")) {
            interpreter.dom().focus(node);
            return null;
        }
        throw new ViewRuntimeException("método '" + c.name() + "' inexistente en " + receiver);
    }

    private Object freeCall(String name, List<Object> args, Frame f) {
        if (f.self.program().hasProcedure(name)) return interpreter.invoke(f.self, name, args);
        if (interpreter.host().isComponentType(name)) return interpreter.host().instantiate(name);
        switch (name) {
            case "str":
                return Values.str(args.isEmpty() ? null : args.get(0));
            case "len": {
                Object v = args.isEmpty() ? null : args.get(0);
                if (v instanceof String s) return s.length();
                return Values.list(v).size();
            }
            default:
                throw new ViewRuntimeException(f.self.type() + ": función desconocida '" + name + "'");
        }
    }

    private static Object listCall(List<Object> list, String name, List<Object> args) {
        switch (name) {
            case "push":
                list.add(Values.normalize(args.get(0)));
                return null;
            case "pop":
                if (list.isEmpty()) throw new ViewRuntimeException("pop sobre un array vacío");
                return list.remove(list.size() - 1);
            case "clear":
                list.clear();
                return null;
            case "size":
                return list.size();
            case "get":
                return list.get(Values.toInt(args.get(0)));
            case "contains":
                for (Object o : list) if (Values.same(o, args.get(0))) return true;
                return false;
            default:
                throw new ViewRuntimeException("método de array desconocido: " + name);
        }
    }

    private Object stringCall(Expr.Call c, String s, List<Object> args, Frame f) {
        switch (c.name()) {
            case "append": {
                String next = s + Values.str(args.get(0));
                assign(c.receiver(), next, f);
                return null;
            }
            case "length": return s.length();
            case "upper": return s.toUpperCase(Locale.ROOT);
            case "lower": return s.toLowerCase(Locale.ROOT);
            case "trim": return s.trim();
            default:
                throw new ViewRuntimeException("método de string desconocido: " + c.name());
        }
    }
}
