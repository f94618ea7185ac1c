package com.ciro.viewc.runtime;

import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.lower.EventHandler;
import com.ciro.viewc.lower.Names;
import com.ciro.viewc.runtime.dom.DomHost;
import com.ciro.viewc.runtime.dom.DomNode;
import com.ciro.viewc.target.ChildRef;
import com.ciro.viewc.target.DrainMode;
import com.ciro.viewc.target.Instr;
import com.ciro.viewc.target.Mount;
import com.ciro.viewc.target.NodeKind;
import com.ciro.viewc.target.NodeRef;
import com.ciro.viewc.target.Procedure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Ejecuta los procedimientos de un programa bajado contra un {@link DomHost}.
 * Un solo hilo; no hay reentrada salvo la que provocan los propios callbacks.
 */
final class Interpreter {

    private static final Logger log = LoggerFactory.getLogger(Interpreter.class);

    private final ComponentHost host;
    private final DomHost dom;
    private final ExprEvaluator evaluator;

    Interpreter(ComponentHost host, DomHost dom) {
        this.host = host;
        this.dom = dom;
        this.evaluator = new ExprEvaluator(this);
    }

    ComponentHost host() {
        return host;
    }

    DomHost dom() {
        return dom;
    }

    Object eval(Expr e, Frame f) {
        return evaluator.eval(e, f);
    }

    Object invoke(ComponentInstance inst, String name, List<Object> args) {
        Procedure p = inst.program().procedures().get(name);
        if (p == null) throw new ViewRuntimeException(inst.type() + ": procedimiento desconocido '" + name + "'");

        Frame f = Frame.of(inst);
        for (int i = 0; i < p.params().size(); i++) {
            f.define(p.params().get(i), i < args.size() ? Values.normalize(args.get(i)) : null);
        }
        if (name.equals(Names.VIEW)) {
            inst.destroyed = false;
            inst.roots.clear();
        }

        log.trace("{}.{}({})", inst, name, args);
        inst.enter(name);
        try {
            exec(p.body(), f);
        } finally {
            inst.exit(name);
        }

        if (name.equals(Names.VIEW) || name.equals(Names.DESTROY) || name.equals(Names.REMOVE_VIEW)) {
            host.lifecycle(name, inst);
        }
        if (name.equals(Names.DESTROY) || name.equals(Names.REMOVE_VIEW)) inst.roots.clear();
        if (name.equals(Names.DESTROY)) inst.destroyed = true;
        return f.result;
    }

    /** @return true si se ejecutó un {@code return} */
    boolean exec(List<Instr> body, Frame f) {
        for (Instr i : body) {
            if (step(i, f)) return true;
        }
        return false;
    }

    private boolean step(Instr in, Frame f) {
        ComponentInstance self = f.self;

        // --- primitivas de DOM
        if (in instanceof Instr.CreateNode c) {
            DomNode n = c.kind() == NodeKind.ELEMENT ? dom.createElement(c.value()) : dom.createText(c.value());
            bindNode(c.target(), n, f);
        } else if (in instanceof Instr.CreateComment c) {
            bindNode(c.target(), dom.createComment(c.label()), f);
        } else if (in instanceof Instr.SetAttribute a) {
            DomNode n = node(a.node(), f);
            Object v = eval(a.value(), f);
            if (a.property()) dom.setProperty(n, a.name(), v);
            else dom.setAttribute(n, a.name(), Values.str(v));
        } else if (in instanceof Instr.SetText t) {
            dom.setText(node(t.node(), f), Values.str(eval(t.value(), f)));
        } else if (in instanceof Instr.SetInnerHtml h) {
            dom.setInnerHtml(node(h.node(), f), Values.str(eval(h.value(), f)));
        } else if (in instanceof Instr.ClearChildren c) {
            dom.clearChildren(node(c.parent(), f));
        } else if (in instanceof Instr.AppendChild a) {
            DomNode child = node(a.child(), f);
            if (a.parent().kind() == NodeRef.Kind.PARENT) placeRoot(self, child);
            else dom.appendChild(node(a.parent(), f), child);
        } else if (in instanceof Instr.InsertBefore ib) {
            DomNode anchor = node(ib.anchor(), f);
            DomNode child = node(ib.child(), f);
            dom.insertBefore(anchor, child);
            int idx = self.roots.indexOf(anchor);
            if (idx >= 0) self.roots.add(idx, child);
        } else if (in instanceof Instr.RemoveNode r) {
            DomNode n = nodeOrNull(r.node(), f);
            if (n != null && n.isAlive()) {
                dom.remove(n);
                self.roots.remove(n);
            }
        } else if (in instanceof Instr.RegisterHandler h) {
            Frame captured = f;
            dom.register(node(h.node(), f), h.event(), payload -> handle(self, h.handler(), captured, payload));
        } else if (in instanceof Instr.UnregisterHandler u) {
            DomNode n = nodeOrNull(u.node(), f);
            if (n != null) dom.unregister(n, u.event());
        } else if (in instanceof Instr.RegisterMasked m) {
            registerMasked(self, m);
        } else if (in instanceof Instr.BindRef b) {
            self.setField(b.field(), node(b.node(), f));

        // --- control y estado
        } else if (in instanceof Instr.Assign a) {
            evaluator.assign(a.target(), eval(a.value(), f), f);
        } else if (in instanceof Instr.Let l) {
            f.define(l.name(), Values.normalize(eval(l.value(), f)));
        } else if (in instanceof Instr.Branch b) {
            return exec(Values.truthy(eval(b.condition(), f)) ? b.then() : b.otherwise(), f);
        } else if (in instanceof Instr.Repeat r) {
            int end = Values.toInt(eval(r.end(), f));
            for (int i = Values.toInt(eval(r.start(), f)); i < end; i++) {
                f.define(r.var(), i);
                if (exec(r.body(), f)) return true;
            }
        } else if (in instanceof Instr.Each e) {
            for (Object item : new ArrayList<>(Values.list(eval(e.iterable(), f)))) {
                f.define(e.var(), item);
                if (exec(e.body(), f)) return true;
            }
        } else if (in instanceof Instr.Return r) {
            Frame root = f.root();
            root.result = eval(r.value(), f);
            return true;
        } else if (in instanceof Instr.Call c) {
            invoke(self, c.procedure(), args(c.args(), f));
        } else if (in instanceof Instr.Eval e) {
            eval(e.expr(), f);
        } else if (in instanceof Instr.ViewDepth d) {
            host.viewDepth(d.delta());
        } else if (in instanceof Instr.Flush) {
            if (host.viewDepth(0) == 0) dom.flush();

        // --- hijos
        } else if (in instanceof Instr.Instantiate i) {
            instantiate(self, i.child(), i.type(), f);
        } else if (in instanceof Instr.CallChild c) {
            callChild(c, f);
        } else if (in instanceof Instr.SetProp p) {
            ComponentInstance child = child(p.child(), f);
            if (child != null) child.setField(p.prop(), Values.normalize(eval(p.value(), f)));
        } else if (in instanceof Instr.ShareProp s) {
            ComponentInstance child = child(s.child(), f);
            if (child != null) child.share(s.prop(), self, s.field());
        } else if (in instanceof Instr.WireCallback w) {
            ComponentInstance child = child(w.child(), f);
            if (child != null) child.callbacks.put(w.callback(), new ComponentInstance.Callback(self, w.procedure()));
        } else if (in instanceof Instr.Notify n) {
            notify(self, n.callback());

        // --- items de bucle
        } else if (in instanceof Instr.NewItem n) {
            LoopItem item = new LoopItem();
            Object value = n.var() == null ? null : eval(n.value(), f);
            self.items(n.loopId()).add(item);
            Frame itemFrame = f.forItem(item);
            if (n.var() != null) itemFrame.define(n.var(), value);
            exec(n.body(), itemFrame);
        } else if (in instanceof Instr.TrackItemNode t) {
            currentItem(f).nodes.add(node(t.node(), f));
        } else if (in instanceof Instr.TrackItemInstance t) {
            ComponentInstance c = child(t.child(), f);
            if (c != null) currentItem(f).tracked.add(c);
        } else if (in instanceof Instr.DrainItems d) {
            drain(self, d.loopId(), Values.toInt(eval(d.keep(), f)), d.mode());
        } else if (in instanceof Instr.RebindItems r) {
            List<LoopItem> items = self.items(r.loopId());
            int upTo = Math.min(Values.toInt(eval(r.upTo(), f)), items.size());
            for (int i = 0; i < upTo; i++) {
                for (ComponentInstance c : items.get(i).instances()) invoke(c, Names.REBIND, List.of());
            }
        } else if (in instanceof Instr.UpdateItems u) {
            List<LoopItem> items = self.items(u.loopId());
            for (int i = 0; i < items.size(); i++) {
                Frame itemFrame = f.forItem(items.get(i));
                itemFrame.define(Names.ITEM_INDEX, i);
                if (u.var() != null) itemFrame.define(u.var(), eval(u.value(), itemFrame));
                exec(u.body(), itemFrame);
            }
        } else if (in instanceof Instr.PlaceItem p) {
            placeItem(self, p, f);
        } else {
            throw new ViewRuntimeException("instrucción no soportada: " + in);
        }
        return false;
    }

    // ------------------------------------------------------------------ nodos

    private void bindNode(NodeRef ref, DomNode n, Frame f) {
        switch (ref.kind()) {
            case ELEMENT: f.self.el.put(ref.id(), n); break;
            case SLOT: f.self.slots.put(ref.name(), n); break;
            case LOCAL: f.define(ref.name(), n); break;
            default: throw new ViewRuntimeException("destino de creación inválido: " + ref);
        }
    }

    private DomNode node(NodeRef ref, Frame f) {
        DomNode n = nodeOrNull(ref, f);
        if (n == null) throw new ViewRuntimeException(f.self + ": nodo inexistente " + ref);
        return n;
    }

    private DomNode nodeOrNull(NodeRef ref, Frame f) {
        if (ref == null) return null;
        switch (ref.kind()) {
            case ELEMENT: return f.self.el.get(ref.id());
            case SLOT: return f.self.slots.get(ref.name());
            case LOCAL: {
                Object v = f.lookup(ref.name());
                return v instanceof DomNode n ? n : null;
            }
            default: return f.self.mount == null ? null : f.self.mount.parent();
        }
    }

    /** Coloca una raíz en el punto de montaje de la instancia. */
    private void placeRoot(ComponentInstance self, DomNode child) {
        ComponentInstance.Placement m = self.mount;
        if (m == null) throw new ViewRuntimeException(self + ": vista sin punto de montaje");
        if (m.before() != null) dom.insertBefore(m.before(), child);
        else dom.appendChild(m.parent(), child);
        self.roots.add(child);
    }

    private ComponentInstance.Placement placement(Mount mount, Frame f) {
        if (mount.isBefore()) {
            DomNode anchor = node(mount.before(), f);
            return new ComponentInstance.Placement(anchor.parent(), anchor);
        }
        if (mount.parent().kind() == NodeRef.Kind.PARENT) return f.self.mount;
        return new ComponentInstance.Placement(node(mount.parent(), f), null);
    }

    // ------------------------------------------------------------------ manejadores

    private void registerMasked(ComponentInstance self, Instr.RegisterMasked m) {
        for (EventHandler h : self.program().view().handlers()) {
            if (h.kind() != m.event()) continue;
            boolean inMask = h.nodeId() < 64 && (m.mask() & (1L << h.nodeId())) != 0;
            if (!inMask && !m.overflow().contains(h.nodeId())) continue;
            DomNode n = self.el.get(h.nodeId());
            if (n == null || !n.isAlive()) continue;
            dom.register(n, h.kind(), payload -> handle(self, h.handler(), Frame.of(self), payload));
        }
    }

    private void handle(ComponentInstance self, Expr handler, Frame captured, Object payload) {
        Frame f = captured.nested();
        f.define("event", payload);
        if (handler instanceof Expr.Ident id && !f.isLocal(id.name()) && self.program().hasProcedure(id.name())) {
            Procedure p = self.program().procedures().get(id.name());
            invoke(self, id.name(), p.params().isEmpty() ? List.of() : Collections.singletonList(payload));
        } else {
            eval(handler, f);
        }
    }

    private void notify(ComponentInstance self, String callback) {
        ComponentInstance.Callback cb = self.callbacks.get(callback);
        if (cb == null || cb.target().destroyed) return;
        // Un ciclo padre-hijo por props por referencia se corta aquí
        if (cb.target().isRunning(cb.procedure())) return;
        invoke(cb.target(), cb.procedure(), List.of());
    }

    // ------------------------------------------------------------------ hijos

    private void instantiate(ComponentInstance self, ChildRef ref, String type, Frame f) {
        switch (ref.kind()) {
            case MEMBER: {
                ComponentInstance old = self.members.get(ref.key());
                // Tras _remove_view la instancia se conserva con su estado
                if (old == null || old.destroyed) self.members.put(ref.key(), host.instantiate(type));
                break;
            }
            case ITEM:
                currentItem(f).children.put(ref.key(), host.instantiate(type));
                break;
            case ROUTE:
                self.routeChild = host.instantiate(type);
                break;
            default:
                throw new ViewRuntimeException("no se puede instanciar " + ref);
        }
    }

    private ComponentInstance child(ChildRef ref, Frame f) {
        switch (ref.kind()) {
            case MEMBER: return f.self.members.get(ref.key());
            case ITEM: {
                LoopItem item = f.currentItem();
                return item == null ? null : item.children.get(ref.key());
            }
            case ROUTE: return f.self.routeChild;
            default: {
                Object v = eval(ref.expr(), f);
                if (v == null || v instanceof ComponentInstance) return (ComponentInstance) v;
                throw new ViewRuntimeException("se esperaba una instancia de " + ref.type() + ": " + v);
            }
        }
    }

    private void callChild(Instr.CallChild c, Frame f) {
        ComponentInstance child = child(c.child(), f);
        if (child == null) return;
        if (c.mount() != null) child.mount = placement(c.mount(), f);
        invoke(child, c.procedure(), args(c.args(), f));
    }

    private List<Object> args(List<Expr> exprs, Frame f) {
        List<Object> out = new ArrayList<>();
        for (Expr e : exprs) out.add(eval(e, f));
        return out;
    }

    private static LoopItem currentItem(Frame f) {
        LoopItem item = f.currentItem();
        if (item == null) throw new ViewRuntimeException(f.self + ": instrucción de item fuera de un bucle");
        return item;
    }

    // ------------------------------------------------------------------ items

    private void drain(ComponentInstance self, int loopId, int keep, DrainMode mode) {
        List<LoopItem> items = self.items(loopId);
        for (int i = items.size() - 1; i >= Math.max(keep, 0); i--) {
            LoopItem item = items.remove(i);
            for (DomNode n : item.nodes) dom.unregisterSubtree(n);
            for (ComponentInstance c : item.instances()) {
                if (mode == DrainMode.DESTROY) {
                    invoke(c, Names.DESTROY, List.of());
                } else {
                    invoke(c, Names.REMOVE_VIEW, List.of(mode.isBulk()));
                    if (!mode.keepsInstances()) c.destroyed = true;
                }
            }
            if (!mode.isBulk()) {
                for (DomNode n : item.nodes) {
                    if (n.isAlive()) dom.remove(n);
                }
            }
        }
    }

    private void placeItem(ComponentInstance self, Instr.PlaceItem p, Frame f) {
        List<Object> array = Values.list(eval(p.array(), f));
        int index = Values.toInt(eval(p.index(), f));
        if (!(array.get(index) instanceof ComponentInstance moved)) return;

        DomNode before = null;
        for (int j = index + 1; j < array.size() && before == null; j++) {
            if (array.get(j) instanceof ComponentInstance next && next != moved && !next.roots.isEmpty()) {
                before = next.roots.get(0);
            }
        }
        DomNode parent = null;
        if (before == null) {
            if (p.end().isBefore()) before = node(p.end().before(), f);
            else parent = node(p.end().parent(), f);
        }
        for (DomNode root : new ArrayList<>(moved.roots)) {
            if (before != null) dom.insertBefore(before, root);
            else dom.appendChild(parent, root);
        }

        // Los items siguen el orden del array
        List<LoopItem> items = self.items(p.loopId());
        items.sort(Comparator.comparingInt(item -> position(array, item)));
    }

    private static int position(List<Object> array, LoopItem item) {
        for (ComponentInstance c : item.instances()) {
            for (int i = 0; i < array.size(); i++) {
                if (array.get(i) == c) return i;
            }
        }
        return Integer.MAX_VALUE;
    }
}
