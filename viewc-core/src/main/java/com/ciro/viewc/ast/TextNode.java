package com.ciro.viewc.ast;

public record TextNode(String text) implements ViewNode {

    @Override
    public <R> R accept(ViewVisitor<R> visitor) { return visitor.visitText(this); }
}
