package com.ciro.viewc.target;

import com.ciro.viewc.ast.Expr;

/**
 * Referencia a una instancia de componente hijo.
 * MEMBER se nombra por posición ({@code Row#2}), ITEM vive en el item actual
 * de un bucle, ROUTE es el hijo montado por el router y EXPR es una instancia
 * que ya existe en el estado ({@code <{child}/>}).
 */
public record ChildRef(Kind kind, String type, int index, Expr expr) {

    public enum Kind { MEMBER, ITEM, ROUTE, EXPR }

    public static ChildRef member(String type, int index) { return new ChildRef(Kind.MEMBER, type, index, null); }

    public static ChildRef item(String type, int ordinal) { return new ChildRef(Kind.ITEM, type, ordinal, null); }

    public static ChildRef route() { return new ChildRef(Kind.ROUTE, null, -1, null); }

    public static ChildRef expr(Expr expr, String type) { return new ChildRef(Kind.EXPR, type, -1, expr); }

    /** Clave de la instancia dentro del padre, para MEMBER. */
    public String key() {
        return type + "#" + index;
    }

    @Override
    public String toString() {
        switch (kind) {
            case MEMBER: return "_" + type.toLowerCase() + "_" + index;
            case ITEM: return "item." + type.toLowerCase() + "_" + index;
            case ROUTE: return "_route_child";
            default: return ProgramPrinter.expr(expr);
        }
    }
}
