package com.ciro.viewc.ast;

public interface ViewVisitor<R> {
    R visitElement(ElementNode node);
    R visitComponent(ComponentNode node);
    R visitIf(IfNode node);
    R visitForRange(ForRangeNode node);
    R visitEach(EachNode node);
    R visitRawHtml(RawHtmlNode node);
    R visitRoute(RouteNode node);
    R visitText(TextNode node);
    R visitExpr(ExprNode node);
}
