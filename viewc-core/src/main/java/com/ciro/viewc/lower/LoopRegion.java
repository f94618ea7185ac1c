package com.ciro.viewc.lower;

import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.deps.Dependencies;
import com.ciro.viewc.target.Instr;
import com.ciro.viewc.target.Mount;
import com.ciro.viewc.target.NodeRef;

import java.util.ArrayList;
import java.util.List;

public final class LoopRegion {

    public enum Strategy { RANGE, KEYED }

    public enum ItemKind { COMPONENT, HTML, MIXED }

    public final int id;
    public final Strategy strategy;
    public final String var;
    /** RANGE */
    public final Expr start;
    public final Expr end;
    /** KEYED */
    public final Expr iterable;
    public final Expr key;
    public final List<BranchKey> guards;
    /** Elemento padre cuando el bucle es su único hijo, si no null. */
    public final Integer parentId;
    /** Items = instancias del propio array ({@code for c in children { <{c}/> }}). */
    public final boolean memberRef;

    /** Dependencias del tamaño (rango o iterable). */
    public Dependencies countDeps = Dependencies.NONE;
    /** Dependencias de estado dentro de cada item. */
    public Dependencies itemDeps = Dependencies.NONE;
    public boolean hasComponents;
    public boolean hasHtml;

    public final List<Instr> create = new ArrayList<>();
    public final List<Instr> update = new ArrayList<>();

    public LoopRegion(int id, Strategy strategy, String var, Expr start, Expr end, Expr iterable, Expr key,
                      List<BranchKey> guards, Integer parentId, boolean memberRef) {
        this.id = id;
        this.strategy = strategy;
        this.var = var;
        this.start = start;
        this.end = end;
        this.iterable = iterable;
        this.key = key;
        this.guards = List.copyOf(guards);
        this.parentId = parentId;
        this.memberRef = memberRef;
    }

    public boolean isOnlyChild() {
        return parentId != null;
    }

    public ItemKind itemKind() {
        if (hasComponents && hasHtml) return ItemKind.MIXED;
        return hasComponents ? ItemKind.COMPONENT : ItemKind.HTML;
    }

    public NodeRef anchor() {
        return NodeRef.loopAnchor(id);
    }

    public NodeRef parentRef() {
        return parentId == null ? null : NodeRef.element(parentId);
    }

    /** Punto donde se insertan los items. */
    public Mount itemMount() {
        return isOnlyChild() ? Mount.append(parentRef()) : Mount.before(anchor());
    }

    /** Nombre del array respaldo en bucles con clave sobre una variable. */
    public String backingArray() {
        return iterable instanceof Expr.Ident id ? id.name() : null;
    }
}
