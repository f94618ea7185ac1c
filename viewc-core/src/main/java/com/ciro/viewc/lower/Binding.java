package com.ciro.viewc.lower;

import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.deps.Dependencies;

import java.util.List;

/**
 * Un fragmento reactivo de un sitio.
 *
 * @param fragment  la expresión que aporta este fragmento
 * @param siteValue el valor completo del sitio (todos los fragmentos formateados)
 * @param guards    ramas condicionales que contienen el nodo, de fuera hacia dentro
 */
public record Binding(int nodeId,
                      SiteKind kind,
                      String name,
                      Expr fragment,
                      Expr siteValue,
                      Dependencies deps,
                      List<BranchKey> guards) {

    public Binding {
        guards = List.copyOf(guards);
    }

    /** Clave de deduplicación: mismo nodo, mismo sitio, misma región y rama. */
    public SiteKey siteKey() {
        return new SiteKey(nodeId, kind, name, guards);
    }

    public record SiteKey(int nodeId, SiteKind kind, String name, List<BranchKey> guards) {}
}
