package com.ciro.viewc.ast;

/** Prop pasada a un componente hijo. {@code reference} = pasada como {@code &var}. */
public record Prop(String name, Expr value, boolean reference) {}
