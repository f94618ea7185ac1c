package com.ciro.viewc.lower;

import com.ciro.viewc.ast.Expr;

/** Nombres internos del programa generado. */
public final class Names {

    private Names() {}

    public static String ifState(int ifId) { return "_if_" + ifId + "_state"; }

    public static String ifCond(int ifId) { return "_c" + ifId; }

    public static String loopCount(int loopId) { return "_loop_" + loopId + "_count"; }

    public static String loopMounted(int loopId) { return "_loop_" + loopId + "_mounted"; }

    public static String syncIf(int ifId) { return "_sync_if_" + ifId; }

    public static String syncLoop(int loopId) { return "_sync_loop_" + loopId; }

    public static String loopItems(int loopId) { return "_update_loop_" + loopId + "_items"; }

    public static String update(String var) { return "update_" + var; }

    public static String memberUpdate(String object, String member) { return "_update_" + object + "_" + member; }

    /** Posición del item en los recorridos de bucles con clave. */
    public static final String ITEM_INDEX = "_i";

    public static final String VIEW = "view";
    public static final String REBIND = "_rebind";
    public static final String DESTROY = "_destroy";
    public static final String REMOVE_VIEW = "_remove_view";
    public static final String SYNC_ROUTE = "_sync_route";
    public static final String NAVIGATE = "navigate";
    /** La vista del componente está construida. */
    public static final String VIEW_MOUNTED = "_view_mounted";
    public static final String ROUTE_PATH = "_route_path";
    public static final String ROUTE_CURRENT = "_route_current";
    public static final String INIT_HOOK = "init";
    public static final String MOUNT_HOOK = "mount";

    public static Expr ref(String name) { return new Expr.Ident(name); }
}
