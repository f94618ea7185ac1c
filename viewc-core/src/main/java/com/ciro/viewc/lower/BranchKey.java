package com.ciro.viewc.lower;

import com.ciro.viewc.ast.Expr;

/** Rama de una región condicional: {@code (ifId, then)} o {@code (ifId, else)}. */
public record BranchKey(int ifId, boolean thenBranch) {

    /** {@code _if_N_state} o {@code !_if_N_state}. */
    public Expr guard() {
        Expr state = Names.ref(Names.ifState(ifId));
        return thenBranch ? state : new Expr.Unary("!", state);
    }

    @Override
    public String toString() {
        return ifId + (thenBranch ? ":then" : ":else");
    }
}
