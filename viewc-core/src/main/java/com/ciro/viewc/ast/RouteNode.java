package com.ciro.viewc.ast;

/** Punto donde el router monta el componente de la ruta activa. */
public record RouteNode() implements ViewNode {

    @Override
    public <R> R accept(ViewVisitor<R> visitor) { return visitor.visitRoute(this); }
}
