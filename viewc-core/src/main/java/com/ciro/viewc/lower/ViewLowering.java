package com.ciro.viewc.lower;

import com.ciro.viewc.CompilerOptions;
import com.ciro.viewc.ViewCompileException;
import com.ciro.viewc.ast.*;
import com.ciro.viewc.deps.Dependencies;
import com.ciro.viewc.deps.DependencyExtractor;
import com.ciro.viewc.target.ChildRef;
import com.ciro.viewc.target.EventKind;
import com.ciro.viewc.target.Instr;
import com.ciro.viewc.target.Mount;
import com.ciro.viewc.target.NodeKind;
import com.ciro.viewc.target.NodeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recorre la vista de un componente de arriba abajo y de izquierda a derecha
 * una sola vez. Emite el programa de construcción en orden de aparición,
 * recoge bindings y abre una región nueva por cada if/for que encuentra
 * fuera de un bucle. Dentro de un bucle, if y for se quedan como código
 * imperativo que se regenera con el item.
 */
public class ViewLowering {

    private static final Logger log = LoggerFactory.getLogger(ViewLowering.class);

    private final ComponentDef def;
    private final Map<String, ComponentDef> components;
    private final DependencyExtractor deps;
    private final CompilerOptions options;

    private int nextNode;
    private int nextLoop;
    private int nextIf;
    private final Map<String, Integer> typeCounters = new HashMap<>();

    private final List<Binding> bindings = new ArrayList<>();
    private final Map<Integer, IfRegion> ifs = new LinkedHashMap<>();
    private final Map<Integer, LoopRegion> loops = new LinkedHashMap<>();
    private final List<EventHandler> handlers = new ArrayList<>();
    private final List<ChildProp> childProps = new ArrayList<>();
    private final List<Instr.WireCallback> wires = new ArrayList<>();

    public ViewLowering(ComponentDef def, Map<String, ComponentDef> components,
                        DependencyExtractor deps, CompilerOptions options) {
        this.def = def;
        this.components = components;
        this.deps = deps;
        this.options = options;
    }

    public LoweredView lower() {
        Ownership root = new Ownership();
        LoweringContext ctx = LoweringContext.root(root, Mount.append(NodeRef.parent()), def.view().size());
        lowerAll(def.view(), ctx);

        Map<Binding.SiteKey, Site> sites = new LinkedHashMap<>();
        for (Binding b : bindings) {
            sites.merge(b.siteKey(),
                    new Site(b.nodeId(), b.kind(), b.name(), b.siteValue(), b.deps(), b.guards()),
                    (a, x) -> new Site(a.nodeId(), a.kind(), a.name(), a.value(), a.deps().union(x.deps()), a.guards()));
        }

        log.debug("Vista de {}: {} nodos, {} bindings, {} sitios, {} if, {} bucles, {} manejadores",
                def.name(), nextNode, bindings.size(), sites.size(), ifs.size(), loops.size(), handlers.size());

        return new LoweredView(List.copyOf(root.create), root, List.copyOf(bindings), List.copyOf(sites.values()),
                ifs, loops, List.copyOf(handlers), EventMasks.of(handlers), List.copyOf(childProps),
                List.copyOf(wires), nextNode);
    }

    private void lowerAll(List<ViewNode> nodes, LoweringContext ctx) {
        Lowerer v = new Lowerer(ctx);
        for (ViewNode n : nodes) n.accept(v);
    }

    private ViewCompileException error(String message, int line) {
        return new ViewCompileException(def.name() + ": " + message, line > 0 ? line : def.line());
    }

    private static Instr siteInstr(SiteKind kind, NodeRef ref, String name, Expr value) {
        switch (kind) {
            case TEXT: return new Instr.SetText(ref, value);
            case INNER_HTML: return new Instr.SetInnerHtml(ref, value);
            case PROPERTY: return new Instr.SetAttribute(ref, name, value, true);
            default: return new Instr.SetAttribute(ref, name, value, false);
        }
    }

    private static boolean isTextOnly(List<ViewNode> children) {
        if (children.isEmpty()) return false;
        for (ViewNode c : children) {
            if (!(c instanceof TextNode) && !(c instanceof ExprNode)) return false;
        }
        return true;
    }

    /** Fragmentos de texto e interpolaciones como una sola expresión. */
    private static Expr textValue(List<ViewNode> children) {
        List<Expr> parts = new ArrayList<>();
        for (ViewNode c : children) {
            if (c instanceof TextNode t) parts.add(new Expr.Literal(t.text()));
            else if (c instanceof ExprNode e) parts.add(e.expr());
        }
        if (parts.size() == 1 && children.get(0) instanceof ExprNode) return parts.get(0);
        return new Expr.StringTemplate(parts);
    }

    private static List<Expr> fragments(Expr value) {
        return value instanceof Expr.StringTemplate t ? t.parts() : List.of(value);
    }

    // ------------------------------------------------------------------

    private final class Lowerer implements ViewVisitor<Void> {

        private final LoweringContext ctx;

        Lowerer(LoweringContext ctx) {
            this.ctx = ctx;
        }

        // --- nodos ---------------------------------------------------------

        /** Handle para un nodo nuevo: {@code el[id]} fuera de bucles, local dentro. */
        private NodeRef newNode() {
            return ctx.inLoop() ? NodeRef.local(ctx.loop.nextLocal()) : NodeRef.element(nextNode++);
        }

        private void place(NodeRef ref) {
            ctx.out.add(ctx.mount.place(ref));
            if (ctx.inLoop()) {
                ctx.loop.region.hasHtml = true;
                if (ctx.regionRoot) ctx.out.add(new Instr.TrackItemNode(ctx.loop.region.id, ref));
            } else {
                ctx.owner.elements.add(ref.id());
                if (ctx.regionRoot) ctx.owner.roots.add(ref.id());
            }
        }

        private void placeSlot(NodeRef anchor) {
            ctx.out.add(ctx.mount.place(anchor));
            if (ctx.regionRoot) ctx.owner.rootSlots.add(anchor);
        }

        /** Registra el sitio si su valor no es constante. */
        private void bind(NodeRef ref, SiteKind kind, String name, Expr siteValue) {
            if (Expr.isConstant(siteValue)) return;
            if (ctx.inLoop()) {
                if (ctx.degraded) return;
                LoopRegion r = ctx.loop.region;
                r.update.add(siteInstr(kind, ref, name, siteValue));
                r.itemDeps = r.itemDeps.union(deps.reads(siteValue, ctx.shadowed));
                return;
            }
            for (Expr f : fragments(siteValue)) {
                if (Expr.isConstant(f)) continue;
                bindings.add(new Binding(ref.id(), kind, name, f, siteValue, deps.reads(f, ctx.shadowed), ctx.guards));
            }
        }

        private void scope(NodeRef ref) {
            if (options.scopeAttribute() != null) {
                ctx.out.add(new Instr.SetAttribute(ref, options.scopeAttribute(), new Expr.Literal(def.name()), false));
            }
        }

        @Override
        public Void visitElement(ElementNode n) {
            NodeRef ref = newNode();
            ctx.out.add(new Instr.CreateNode(ref, NodeKind.ELEMENT, n.tag()));
            scope(ref);

            for (Attr a : n.attrs()) {
                if (a.isEvent()) {
                    EventKind kind = EventKind.fromAttribute(a.name())
                            .orElseThrow(() -> error("evento desconocido '" + a.name() + "' en <" + n.tag() + ">", 0));
                    if (ctx.inLoop()) ctx.out.add(new Instr.RegisterHandler(ref, kind, a.value()));
                    else handlers.add(new EventHandler(ref.id(), kind, a.value()));
                    continue;
                }
                SiteKind kind = SiteKind.forAttribute(a.name());
                ctx.out.add(siteInstr(kind, ref, a.name(), a.value()));
                bind(ref, kind, a.name(), a.value());
            }

            if (isTextOnly(n.children())) {
                Expr value = textValue(n.children());
                ctx.out.add(new Instr.SetText(ref, value));
                bind(ref, SiteKind.TEXT, null, value);
            } else if (!n.children().isEmpty()) {
                Integer parentId = ctx.inLoop() ? null : ref.id();
                lowerAll(n.children(), ctx.insideElement(Mount.append(ref), parentId, n.children().size()));
            }

            if (n.refBinding() != null) {
                if (!def.declares(n.refBinding())) {
                    throw error("ref a una variable no declarada: " + n.refBinding(), 0);
                }
                ctx.out.add(new Instr.BindRef(n.refBinding(), ref));
            }
            place(ref);
            return null;
        }

        @Override
        public Void visitText(TextNode n) {
            NodeRef ref = newNode();
            ctx.out.add(new Instr.CreateNode(ref, NodeKind.TEXT, n.text()));
            place(ref);
            return null;
        }

        @Override
        public Void visitExpr(ExprNode n) {
            NodeRef ref = newNode();
            ctx.out.add(new Instr.CreateNode(ref, NodeKind.TEXT, ""));
            ctx.out.add(new Instr.SetText(ref, n.expr()));
            bind(ref, SiteKind.TEXT, null, n.expr());
            place(ref);
            return null;
        }

        @Override
        public Void visitRawHtml(RawHtmlNode n) {
            for (ViewNode c : n.children()) {
                if (!(c instanceof TextNode) && !(c instanceof ExprNode)) {
                    throw error("el contenido HTML crudo solo admite texto e interpolaciones", 0);
                }
            }
            NodeRef ref = newNode();
            ctx.out.add(new Instr.CreateNode(ref, NodeKind.ELEMENT, "span"));
            scope(ref);
            Expr value = n.children().isEmpty() ? new Expr.Literal("") : textValue(n.children());
            ctx.out.add(new Instr.SetInnerHtml(ref, value));
            bind(ref, SiteKind.INNER_HTML, null, value);
            place(ref);
            return null;
        }

        @Override
        public Void visitRoute(RouteNode n) {
            if (ctx.inLoop() || !ctx.guards.isEmpty()) {
                throw error("el placeholder de ruta solo puede ir fuera de bucles y condicionales", 0);
            }
            if (def.router() == null) {
                throw error("placeholder de ruta sin router declarado", 0);
            }
            NodeRef anchor = NodeRef.routeAnchor();
            ctx.out.add(new Instr.CreateComment(anchor, "route"));
            placeSlot(anchor);
            ctx.owner.route = true;
            return null;
        }

        // --- componentes ---------------------------------------------------

        @Override
        public Void visitComponent(ComponentNode n) {
            ComponentDef child = components.get(n.type());
            if (child == null) {
                throw error("tipo de componente desconocido: " + n.type(), n.line());
            }
            if (!child.hasView()) {
                throw error("el componente " + n.type() + " se usa en una vista pero no declara vista", n.line());
            }
            if (n.isProjection()) {
                project(n);
                return null;
            }

            ChildRef ref = ctx.inLoop()
                    ? ChildRef.item(n.type(), ctx.loop.nextOrdinal(n.type()))
                    : ChildRef.member(n.type(), typeCounters.merge(n.type(), 1, Integer::sum) - 1);
            ctx.out.add(new Instr.Instantiate(ref, n.type()));

            List<Instr.WireCallback> own = new ArrayList<>();
            for (Prop p : n.props()) {
                ComponentParam param = child.param(p.name())
                        .orElseThrow(() -> error("prop '" + p.name() + "' no declarada en " + n.type(), n.line()));
                if (p.reference() != param.reference()) {
                    throw error("la prop '" + p.name() + "' de " + n.type()
                            + (param.reference() ? " se declara por referencia" : " no se declara por referencia"), n.line());
                }
                if (p.reference()) referenceProp(n, ref, p, param, own);
                else valueProp(ref, p);
            }

            ctx.out.add(new Instr.CallChild(ref, Names.VIEW, ctx.mount, List.of()));
            ctx.out.addAll(own);
            if (ctx.inLoop()) {
                ctx.loop.region.hasComponents = true;
            } else {
                ctx.owner.components.add(ref);
                wires.addAll(own);
            }
            return null;
        }

        private void referenceProp(ComponentNode n, ChildRef ref, Prop p, ComponentParam param,
                                   List<Instr.WireCallback> own) {
            if (!(p.value() instanceof Expr.Ident id) || ctx.shadowed.contains(id.name()) || !def.declares(id.name())) {
                throw error("la prop por referencia '" + p.name() + "' debe nombrar una variable de estado", n.line());
            }
            String field = id.name();
            ctx.out.add(new Instr.ShareProp(ref, p.name(), field));
            if (param.mutable()) {
                own.add(new Instr.WireCallback(ref, Types.changeCallback(p.name()), Names.update(field)));
            }
            Dependencies d = new Dependencies(Set.of(field), Set.of());
            if (!ctx.inLoop()) {
                childProps.add(new ChildProp(ref, p.name(), p.value(), true, d, ctx.guards));
            } else if (!ctx.degraded) {
                LoopRegion r = ctx.loop.region;
                r.update.add(new Instr.CallChild(ref, Names.update(p.name())));
                r.itemDeps = r.itemDeps.union(d);
            }
        }

        private void valueProp(ChildRef ref, Prop p) {
            ctx.out.add(new Instr.SetProp(ref, p.name(), p.value()));
            if (Expr.isConstant(p.value())) return;
            Dependencies d = deps.reads(p.value(), ctx.shadowed);
            if (!ctx.inLoop()) {
                if (!d.isEmpty()) childProps.add(new ChildProp(ref, p.name(), p.value(), false, d, ctx.guards));
            } else if (!ctx.degraded) {
                LoopRegion r = ctx.loop.region;
                r.update.add(new Instr.SetProp(ref, p.name(), p.value()));
                r.update.add(new Instr.CallChild(ref, Names.update(p.name())));
                r.itemDeps = r.itemDeps.union(d);
            }
        }

        private void project(ComponentNode n) {
            String root = Expr.rootName(n.memberRef());
            if (root == null || (!ctx.shadowed.contains(root) && !def.declares(root))) {
                throw error("proyección de un miembro no declarado", n.line());
            }
            ChildRef ref = ChildRef.expr(n.memberRef(), n.type());
            ctx.out.add(new Instr.CallChild(ref, Names.VIEW, ctx.mount, List.of()));
            if (ctx.inLoop()) {
                ctx.out.add(new Instr.TrackItemInstance(ctx.loop.region.id, ref));
                ctx.loop.region.hasComponents = true;
            } else {
                ctx.owner.projections.add(ref);
            }
        }

        // --- regiones ------------------------------------------------------

        @Override
        public Void visitIf(IfNode n) {
            if (ctx.inLoop()) {
                List<Instr> then = new ArrayList<>();
                List<Instr> otherwise = new ArrayList<>();
                lowerAll(n.thenChildren(), ctx.degradedBlock(then, null));
                lowerAll(n.elseChildren(), ctx.degradedBlock(otherwise, null));
                ctx.out.add(new Instr.Branch(n.condition(), then, otherwise));
                return null;
            }

            int id = nextIf++;
            IfRegion r = new IfRegion(id, n.condition(), deps.reads(n.condition(), ctx.shadowed), ctx.guards);
            ifs.put(id, r);
            NodeRef anchor = r.anchor();
            ctx.out.add(new Instr.CreateComment(anchor, "if " + id));
            placeSlot(anchor);
            ctx.owner.ifs.add(id);

            lowerAll(n.thenChildren(), ctx.branch(r.then, new BranchKey(id, true), Mount.before(anchor)));
            lowerAll(n.elseChildren(), ctx.branch(r.otherwise, new BranchKey(id, false), Mount.before(anchor)));

            ctx.out.add(new Instr.Let(Names.ifCond(id), n.condition()));
            ctx.out.add(new Instr.Branch(Names.ref(Names.ifCond(id)), r.then.create, r.otherwise.create));
            ctx.out.add(new Instr.Assign(Names.ref(Names.ifState(id)), Names.ref(Names.ifCond(id))));
            return null;
        }

        @Override
        public Void visitForRange(ForRangeNode n) {
            if (ctx.inLoop()) {
                List<Instr> body = new ArrayList<>();
                lowerAll(n.children(), ctx.degradedBlock(body, n.var()));
                ctx.out.add(new Instr.Repeat(n.var(), n.start(), n.end(), body));
                return null;
            }
            LoopRegion r = new LoopRegion(nextLoop++, LoopRegion.Strategy.RANGE, n.var(), n.start(), n.end(),
                    null, null, ctx.guards, onlyChildParent(), false);
            r.countDeps = deps.reads(n.start(), ctx.shadowed).union(deps.reads(n.end(), ctx.shadowed));
            openLoop(r, n.children());
            return null;
        }

        @Override
        public Void visitEach(EachNode n) {
            if (ctx.inLoop()) {
                List<Instr> body = new ArrayList<>();
                lowerAll(n.children(), ctx.degradedBlock(body, n.var()));
                ctx.out.add(new Instr.Each(n.var(), n.iterable(), body));
                return null;
            }
            if (n.key() == null) {
                throw error("bucle 'for " + n.var() + "' sin clave", n.line());
            }
            LoopRegion r = new LoopRegion(nextLoop++, LoopRegion.Strategy.KEYED, n.var(), null, null,
                    n.iterable(), n.key(), ctx.guards, onlyChildParent(), isMemberRefLoop(n));
            r.countDeps = deps.reads(n.iterable(), ctx.shadowed);
            openLoop(r, n.children());
            return null;
        }

        private Integer onlyChildParent() {
            boolean only = options.detectOnlyChild() && ctx.parentElement != null && ctx.siblings == 1;
            return only ? ctx.parentElement : null;
        }

        /** {@code for c in children key(c.id) { <{c}/> }} sobre un array de componentes. */
        private boolean isMemberRefLoop(EachNode n) {
            if (!(n.iterable() instanceof Expr.Ident arr)) return false;
            if (!deps.keyedComponentArrays().contains(arr.name())) return false;
            return n.children().size() == 1
                    && n.children().get(0) instanceof ComponentNode c
                    && c.memberRef() instanceof Expr.Ident ref
                    && ref.name().equals(n.var());
        }

        private void openLoop(LoopRegion r, List<ViewNode> children) {
            loops.put(r.id, r);
            if (!r.isOnlyChild()) {
                ctx.out.add(new Instr.CreateComment(r.anchor(), "loop " + r.id));
                placeSlot(r.anchor());
            }
            LoweringContext.LoopScope scope = new LoweringContext.LoopScope(r);
            lowerAll(children, ctx.loopItem(scope, r.itemMount(), r.create, null, children.size()));
            ctx.owner.loops.add(r.id);

            ctx.out.add(new Instr.Assign(Names.ref(Names.loopCount(r.id)), new Expr.Literal(0)));
            ctx.out.add(new Instr.Assign(Names.ref(Names.loopMounted(r.id)), new Expr.Literal(true)));
            if (r.strategy == LoopRegion.Strategy.KEYED) firstRender(r);
            else ctx.out.add(new Instr.Call(Names.syncLoop(r.id)));
        }

        /** Con la vista a medio construir no hay nada que quitar ni manejadores que volver a registrar. */
        private void firstRender(LoopRegion r) {
            Expr size = new Expr.Call(r.iterable, "size", List.of());
            Expr item = new Expr.Index(r.iterable, Names.ref(Names.ITEM_INDEX));
            ctx.out.add(new Instr.Repeat(Names.ITEM_INDEX, new Expr.Literal(0), size,
                    List.of(new Instr.NewItem(r.id, r.var, item, r.create))));
            ctx.out.add(new Instr.Assign(Names.ref(Names.loopCount(r.id)), size));
        }
    }
}
