package com.ciro.viewc.target;

/**
 * Dónde se inserta un nodo o la vista de un hijo: al final de {@code parent}
 * o justo antes de {@code before}. Siempre uno de los dos.
 */
public record Mount(NodeRef parent, NodeRef before) {

    public static Mount append(NodeRef parent) { return new Mount(parent, null); }

    public static Mount before(NodeRef anchor) { return new Mount(null, anchor); }

    public boolean isBefore() { return before != null; }

    /** Instrucción que coloca {@code node} en este punto. */
    public Instr place(NodeRef node) {
        return isBefore() ? new Instr.InsertBefore(before, node) : new Instr.AppendChild(parent, node);
    }

    @Override
    public String toString() {
        return isBefore() ? "before(" + before + ")" : parent.toString();
    }
}
