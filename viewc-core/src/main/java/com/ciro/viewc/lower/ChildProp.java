package com.ciro.viewc.lower;

import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.deps.Dependencies;
import com.ciro.viewc.target.ChildRef;

import java.util.List;

/**
 * Prop de un hijo que depende del estado del padre. Las de referencia no se
 * copian: solo se avisa al hijo.
 */
public record ChildProp(ChildRef child, String prop, Expr value, boolean reference,
                        Dependencies deps, List<BranchKey> guards) {

    public ChildProp {
        guards = List.copyOf(guards);
    }
}
