package com.ciro.viewc.lower;

import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.target.EventKind;

public record EventHandler(int nodeId, EventKind kind, Expr handler) {}
