package com.ciro.viewc.deps;

/** Lectura {@code object.member} sobre un miembro de tipo componente. */
public record MemberDependency(String object, String member) {

    @Override
    public String toString() {
        return object + "." + member;
    }
}
