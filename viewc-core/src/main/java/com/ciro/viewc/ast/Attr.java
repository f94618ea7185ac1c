package com.ciro.viewc.ast;

public record Attr(String name, Expr value) {

    public boolean isEvent() {
        return name.startsWith("on") && name.length() > 2;
    }
}
