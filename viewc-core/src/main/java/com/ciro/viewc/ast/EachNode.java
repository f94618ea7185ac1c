package com.ciro.viewc.ast;

import java.util.List;

/** {@code for var in iterable key(keyExpr)}. La clave es obligatoria. */
public record EachNode(String var, Expr iterable, Expr key, List<ViewNode> children, int line) implements ViewNode {

    public EachNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public <R> R accept(ViewVisitor<R> visitor) { return visitor.visitEach(this); }
}
