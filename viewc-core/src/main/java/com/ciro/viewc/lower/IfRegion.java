package com.ciro.viewc.lower;

import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.deps.Dependencies;
import com.ciro.viewc.target.NodeRef;

import java.util.List;

public final class IfRegion {

    public final int id;
    public final Expr condition;
    public final Dependencies deps;
    /** Ramas que contienen a esta región. */
    public final List<BranchKey> guards;
    public final Ownership then = new Ownership();
    public final Ownership otherwise = new Ownership();

    public IfRegion(int id, Expr condition, Dependencies deps, List<BranchKey> guards) {
        this.id = id;
        this.condition = condition;
        this.deps = deps;
        this.guards = List.copyOf(guards);
    }

    public NodeRef anchor() {
        return NodeRef.ifAnchor(id);
    }

    public Ownership branch(boolean thenBranch) {
        return thenBranch ? then : otherwise;
    }
}
