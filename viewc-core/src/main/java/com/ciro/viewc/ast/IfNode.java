package com.ciro.viewc.ast;

import java.util.List;

public record IfNode(Expr condition, List<ViewNode> thenChildren, List<ViewNode> elseChildren) implements ViewNode {

    public IfNode {
        thenChildren = thenChildren == null ? List.of() : List.copyOf(thenChildren);
        elseChildren = elseChildren == null ? List.of() : List.copyOf(elseChildren);
    }

    @Override
    public <R> R accept(ViewVisitor<R> visitor) { return visitor.visitIf(this); }
}
