package com.ciro.viewc.ast;

import java.util.List;

/** {@code for var in start:end} */
public record ForRangeNode(String var, Expr start, Expr end, List<ViewNode> children) implements ViewNode {

    public ForRangeNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public <R> R accept(ViewVisitor<R> visitor) { return visitor.visitForRange(this); }
}
