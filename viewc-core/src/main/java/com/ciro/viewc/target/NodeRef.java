package com.ciro.viewc.target;

/**
 * Referencia a un nodo del DOM destino.
 * <ul>
 *   <li>ELEMENT: {@code el[id]} de la instancia (nodos creados fuera de bucles)</li>
 *   <li>LOCAL: variable local del frame, usada dentro de los items de bucle</li>
 *   <li>PARENT: punto de montaje recibido por {@code view(parent)}</li>
 *   <li>SLOT: ancla con nombre ({@code _if_3_anchor}, {@code _loop_1_anchor}, {@code _route_anchor})</li>
 * </ul>
 */
public record NodeRef(Kind kind, int id, String name) {

    public enum Kind { ELEMENT, LOCAL, PARENT, SLOT }

    private static final NodeRef PARENT_REF = new NodeRef(Kind.PARENT, -1, null);

    public static NodeRef element(int id) { return new NodeRef(Kind.ELEMENT, id, null); }

    public static NodeRef local(String name) { return new NodeRef(Kind.LOCAL, -1, name); }

    public static NodeRef parent() { return PARENT_REF; }

    public static NodeRef slot(String name) { return new NodeRef(Kind.SLOT, -1, name); }

    public static NodeRef ifAnchor(int ifId) { return slot("_if_" + ifId + "_anchor"); }

    public static NodeRef loopAnchor(int loopId) { return slot("_loop_" + loopId + "_anchor"); }

    public static NodeRef routeAnchor() { return slot("_route_anchor"); }

    @Override
    public String toString() {
        switch (kind) {
            case ELEMENT: return "el[" + id + "]";
            case PARENT: return "parent";
            default: return name;
        }
    }
}
