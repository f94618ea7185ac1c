package com.ciro.viewc.ast;

import java.util.List;

/**
 * Elemento HTML. Los atributos {@code onclick}, {@code oninput},
 * {@code onchange} y {@code onkeydown} son manejadores de eventos.
 *
 * @param refBinding variable de estado que recibe el handle del nodo creado, o null
 */
public record ElementNode(String tag, List<Attr> attrs, List<ViewNode> children, String refBinding)
        implements ViewNode {

    public ElementNode {
        attrs = attrs == null ? List.of() : List.copyOf(attrs);
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public <R> R accept(ViewVisitor<R> visitor) { return visitor.visitElement(this); }
}
