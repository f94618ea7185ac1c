package com.ciro.viewc.lower;

import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.deps.Dependencies;

import java.util.List;

/** Sitio deduplicado: un procedimiento de actualización por sitio. */
public record Site(int nodeId, SiteKind kind, String name, Expr value, Dependencies deps, List<BranchKey> guards) {

    public Site {
        guards = List.copyOf(guards);
    }

    public String procedureName() {
        switch (kind) {
            case TEXT: return "_update_el" + nodeId + "_text";
            case INNER_HTML: return "_update_el" + nodeId + "_html";
            default: return "_update_el" + nodeId + "_" + name.replaceAll("[^A-Za-z0-9_]", "_");
        }
    }
}
