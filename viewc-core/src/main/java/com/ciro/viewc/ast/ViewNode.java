package com.ciro.viewc.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Nodo de la vista declarativa de un componente. El árbol es dueño de sus
 * hijos y no tiene ciclos. El despacho se hace con {@link ViewVisitor}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ElementNode.class, name = "element"),
    @JsonSubTypes.Type(value = ComponentNode.class, name = "component"),
    @JsonSubTypes.Type(value = IfNode.class, name = "if"),
    @JsonSubTypes.Type(value = ForRangeNode.class, name = "forRange"),
    @JsonSubTypes.Type(value = EachNode.class, name = "each"),
    @JsonSubTypes.Type(value = RawHtmlNode.class, name = "rawHtml"),
    @JsonSubTypes.Type(value = RouteNode.class, name = "route"),
    @JsonSubTypes.Type(value = TextNode.class, name = "text"),
    @JsonSubTypes.Type(value = ExprNode.class, name = "expr")
})
public sealed interface ViewNode
        permits ElementNode, ComponentNode, IfNode, ForRangeNode, EachNode,
                RawHtmlNode, RouteNode, TextNode, ExprNode {

    <R> R accept(ViewVisitor<R> visitor);
}
