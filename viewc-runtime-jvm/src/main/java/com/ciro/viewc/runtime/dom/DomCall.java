package com.ciro.viewc.runtime.dom;

/** Una operación registrada en la traza del DOM. */
public record DomCall(Op op, int nodeId, String detail) {

    public enum Op {
        CREATE, SET_ATTRIBUTE, SET_PROPERTY, SET_TEXT, SET_HTML,
        APPEND, INSERT_BEFORE, REMOVE, CLEAR,
        REGISTER, UNREGISTER, FOCUS, FLUSH
    }

    @Override
    public String toString() {
        return op + "(" + nodeId + (detail == null ? "" : ", " + detail) + ")";
    }
}
