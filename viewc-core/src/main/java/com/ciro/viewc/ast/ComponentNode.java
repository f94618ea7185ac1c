package com.ciro.viewc.ast;

import java.util.List;

/**
 * Instancia de componente dentro de una vista.
 * Con {@code memberRef} ({@code <{child}/>}) no se crea nada: se proyecta la
 * vista de una instancia que ya existe en el estado o en la variable del bucle.
 */
public record ComponentNode(String type, List<Prop> props, Expr memberRef, int line) implements ViewNode {

    public ComponentNode {
        props = props == null ? List.of() : List.copyOf(props);
    }

    public boolean isProjection() { return memberRef != null; }

    @Override
    public <R> R accept(ViewVisitor<R> visitor) { return visitor.visitComponent(this); }
}
