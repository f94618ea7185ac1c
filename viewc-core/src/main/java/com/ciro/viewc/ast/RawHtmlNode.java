package com.ciro.viewc.ast;

import java.util.List;

/** Contenido HTML sin escapar. Los hijos son solo {@link TextNode} y {@link ExprNode}. */
public record RawHtmlNode(List<ViewNode> children) implements ViewNode {

    public RawHtmlNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public <R> R accept(ViewVisitor<R> visitor) { return visitor.visitRawHtml(this); }
}
