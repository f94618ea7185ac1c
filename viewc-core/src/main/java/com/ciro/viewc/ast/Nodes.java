package com.ciro.viewc.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * DSL para construir árboles de vista y componentes desde Java.
 * Lo usan los tests y quien quiera alimentar el compilador sin parser.
 */
public final class Nodes {

    private Nodes() {}

    // ---------------------------------------------------------------- expresiones

    public static Expr lit(Object value) { return new Expr.Literal(value); }

    public static Expr id(String name) { return new Expr.Ident(name); }

    public static Expr member(Expr target, String name) { return new Expr.Member(target, name); }

    public static Expr index(Expr target, Expr index) { return new Expr.Index(target, index); }

    public static Expr not(Expr e) { return new Expr.Unary("!", e); }

    public static Expr inc(Expr e) { return new Expr.Unary("++", e); }

    public static Expr bin(String op, Expr left, Expr right) { return new Expr.Binary(op, left, right); }

    public static Expr call(String name, Expr... args) { return new Expr.Call(null, name, Arrays.asList(args)); }

    public static Expr callOn(Expr receiver, String name, Expr... args) {
        return new Expr.Call(receiver, name, Arrays.asList(args));
    }

    public static Expr tpl(Expr... parts) { return new Expr.StringTemplate(Arrays.asList(parts)); }

    public static Expr array(Expr... items) { return new Expr.ArrayLit(Arrays.asList(items)); }

    // ---------------------------------------------------------------- vista

    public static Attr attr(String name, Expr value) { return new Attr(name, value); }

    public static Attr attr(String name, String constant) { return new Attr(name, lit(constant)); }

    public static Attr on(String event, Expr handler) { return new Attr("on" + event, handler); }

    public static List<Attr> attrs(Attr... attrs) { return Arrays.asList(attrs); }

    public static ElementNode el(String tag, ViewNode... children) {
        return new ElementNode(tag, List.of(), Arrays.asList(children), null);
    }

    public static ElementNode el(String tag, List<Attr> attrs, ViewNode... children) {
        return new ElementNode(tag, attrs, Arrays.asList(children), null);
    }

    public static ElementNode ref(ElementNode node, String stateVar) {
        return new ElementNode(node.tag(), node.attrs(), node.children(), stateVar);
    }

    public static TextNode text(String text) { return new TextNode(text); }

    public static ExprNode expr(Expr e) { return new ExprNode(e); }

    public static ExprNode expr(String var) { return new ExprNode(id(var)); }

    public static Prop prop(String name, Expr value) { return new Prop(name, value, false); }

    public static Prop refProp(String name, String var) { return new Prop(name, id(var), true); }

    public static ComponentNode component(String type, Prop... props) {
        return new ComponentNode(type, Arrays.asList(props), null, 0);
    }

    public static ComponentNode project(String type, Expr memberRef) {
        return new ComponentNode(type, List.of(), memberRef, 0);
    }

    public static IfNode when(Expr condition, List<ViewNode> then, List<ViewNode> otherwise) {
        return new IfNode(condition, then, otherwise);
    }

    public static IfNode when(Expr condition, ViewNode... then) {
        return new IfNode(condition, Arrays.asList(then), List.of());
    }

    public static List<ViewNode> nodes(ViewNode... nodes) { return Arrays.asList(nodes); }

    public static ForRangeNode range(String var, Expr start, Expr end, ViewNode... children) {
        return new ForRangeNode(var, start, end, Arrays.asList(children));
    }

    public static EachNode each(String var, Expr iterable, Expr key, ViewNode... children) {
        return new EachNode(var, iterable, key, Arrays.asList(children), 0);
    }

    public static RawHtmlNode raw(ViewNode... children) { return new RawHtmlNode(Arrays.asList(children)); }

    public static RouteNode route() { return new RouteNode(); }

    // ---------------------------------------------------------------- sentencias

    public static Stmt let(String name, Expr init) { return new Stmt.VarDecl(name, null, init); }

    public static Stmt assign(String name, Expr value) { return new Stmt.Assign(name, value); }

    public static Stmt assignIndex(Expr target, Expr index, Expr value) {
        return new Stmt.IndexAssign(target, index, value);
    }

    public static Stmt assignMember(Expr target, String member, Expr value) {
        return new Stmt.MemberAssign(target, member, value);
    }

    public static Stmt exec(Expr e) { return new Stmt.ExprStmt(e); }

    public static Stmt ifStmt(Expr cond, List<Stmt> then, List<Stmt> otherwise) {
        return new Stmt.If(cond, then, otherwise);
    }

    public static Stmt forRange(String var, Expr start, Expr end, Stmt... body) {
        return new Stmt.ForRange(var, start, end, Arrays.asList(body));
    }

    public static Stmt forEach(String var, Expr iterable, Stmt... body) {
        return new Stmt.ForEach(var, iterable, Arrays.asList(body));
    }

    public static Stmt ret(Expr value) { return new Stmt.Return(value); }

    // ---------------------------------------------------------------- componentes

    public static ComponentBuilder define(String name) { return new ComponentBuilder(name); }

    public static final class ComponentBuilder {
        private final String name;
        private final List<StateVar> state = new ArrayList<>();
        private final List<ComponentParam> params = new ArrayList<>();
        private final List<MethodDef> methods = new ArrayList<>();
        private final List<ViewNode> view = new ArrayList<>();
        private RouterDef router;
        private int line;

        private ComponentBuilder(String name) { this.name = name; }

        public ComponentBuilder state(String name, String type, Expr init) {
            state.add(new StateVar(name, type, true, false, false, init));
            return this;
        }

        public ComponentBuilder publicState(String name, String type, Expr init) {
            state.add(new StateVar(name, type, true, true, false, init));
            return this;
        }

        public ComponentBuilder constant(String name, String type, Expr init) {
            state.add(new StateVar(name, type, false, false, false, init));
            return this;
        }

        public ComponentBuilder param(String name, String type, Expr defaultValue) {
            params.add(new ComponentParam(name, type, false, false, false, defaultValue));
            return this;
        }

        public ComponentBuilder refParam(String name, String type) {
            params.add(new ComponentParam(name, type, true, true, false, null));
            return this;
        }

        public ComponentBuilder method(String name, List<String> params, Stmt... body) {
            methods.add(new MethodDef(name, params, "void", Arrays.asList(body)));
            return this;
        }

        public ComponentBuilder method(String name, Stmt... body) {
            return method(name, List.of(), body);
        }

        public ComponentBuilder view(ViewNode... roots) {
            view.addAll(Arrays.asList(roots));
            return this;
        }

        public ComponentBuilder route(String path, String component) {
            List<RouterDef.Route> routes = new ArrayList<>(router == null ? List.of() : router.routes());
            routes.add(new RouterDef.Route(path, component));
            router = new RouterDef(routes);
            return this;
        }

        public ComponentBuilder line(int line) {
            this.line = line;
            return this;
        }

        public ComponentDef build() {
            return new ComponentDef(name, state, params, methods, view, router, line);
        }
    }
}
