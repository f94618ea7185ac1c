package com.ciro.viewc.ast;

/** Interpolación {@code {expr}} dentro del contenido. */
public record ExprNode(Expr expr) implements ViewNode {

    @Override
    public <R> R accept(ViewVisitor<R> visitor) { return visitor.visitExpr(this); }
}
