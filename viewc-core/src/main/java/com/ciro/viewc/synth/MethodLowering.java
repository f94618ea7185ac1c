package com.ciro.viewc.synth;

import com.ciro.viewc.CompilerOptions;
import com.ciro.viewc.ast.ComponentDef;
import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.ast.MethodDef;
import com.ciro.viewc.ast.Stmt;
import com.ciro.viewc.deps.DependencyExtractor;
import com.ciro.viewc.lower.LoopRegion;
import com.ciro.viewc.lower.LoweredView;
import com.ciro.viewc.lower.Names;
import com.ciro.viewc.target.ChildRef;
import com.ciro.viewc.target.DrainMode;
import com.ciro.viewc.target.Instr;
import com.ciro.viewc.target.Procedure;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Métodos del componente a procedimientos. Al final (y antes de cada
 * {@code return}) se llama a {@code update_<var>} por cada variable escrita.
 *
 * <p>Sobre arrays que respaldan un bucle con clave, {@code push}, {@code pop},
 * {@code clear} y la reasignación completa tocan solo los items necesarios en
 * lugar de pasar por la reconciliación completa. Si el método solo escribe el
 * array por esos caminos, su actualización final no vuelve a sincronizar esos
 * bucles; el resto de lo que lee el array sí se actualiza.</p>
 */
public class MethodLowering {

    private static final String RET = "_ret";
    private static final Set<String> SHORTCUTS = Set.of("push", "pop", "clear");

    private final ComponentDef def;
    private final LoweredView view;
    private final DependencyExtractor deps;
    private final LoopSyncSynthesizer loops;
    private final ReactiveSynthesizer reactive;
    private final CompilerOptions options;
    private final Set<String> updatable;
    private final Map<String, ComponentDef> components;

    public MethodLowering(ComponentDef def, LoweredView view, DependencyExtractor deps, CompilerOptions options,
                          ReactiveSynthesizer reactive, Set<String> updatable, Map<String, ComponentDef> components) {
        this.def = def;
        this.view = view;
        this.deps = deps;
        this.loops = new LoopSyncSynthesizer(view, options);
        this.reactive = reactive;
        this.options = options;
        this.updatable = updatable;
        this.components = components;
    }

    public List<Procedure> synthesize() {
        List<Procedure> out = new ArrayList<>();
        for (MethodDef m : def.methods()) out.add(lower(m));
        return out;
    }

    public Procedure lower(MethodDef m) {
        Set<String> params = new HashSet<>(m.params());
        Set<String> direct = deps.writes(new MethodDef(m.name(), m.params(), m.returnType(),
                withoutShortcuts(m.body(), params)));
        List<Instr> updates = new ArrayList<>();
        for (String var : deps.writes(m)) {
            if (!updatable.contains(var)) continue;
            List<LoopRegion> handled = keyedLoops(var, params);
            if (direct.contains(var) || handled.isEmpty()) updates.add(new Instr.Call(Names.update(var)));
            else updates.addAll(reactive.updateBody(var, handled::contains));
        }
        List<Instr> body = new ArrayList<>();
        block(m.body(), new HashSet<>(m.params()), updates, body);
        body.addAll(updates);
        return new Procedure(m.name(), Procedure.Kind.METHOD, m.params(), body);
    }

    /**
     * El cuerpo sin los atajos de lista ni las reasignaciones de arrays con bucle:
     * lo que queda son las escrituras que sí necesitan la sincronización completa.
     * Los argumentos se conservan por si también escriben.
     */
    private List<Stmt> withoutShortcuts(List<Stmt> stmts, Set<String> scope) {
        Set<String> local = new HashSet<>(scope);
        List<Stmt> out = new ArrayList<>();
        for (Stmt s : stmts) {
            if (s instanceof Stmt.VarDecl v) {
                out.add(s);
                local.add(v.name());
            } else if (s instanceof Stmt.Assign a && !keyedLoops(a.name(), local).isEmpty()) {
                out.add(new Stmt.ExprStmt(a.value()));
            } else if (s instanceof Stmt.ExprStmt es && isShortcut(es.expr(), local)) {
                for (Expr arg : ((Expr.Call) es.expr()).args()) out.add(new Stmt.ExprStmt(arg));
            } else if (s instanceof Stmt.Block b) {
                out.add(new Stmt.Block(withoutShortcuts(b.body(), local)));
            } else if (s instanceof Stmt.If i) {
                out.add(new Stmt.If(i.condition(), withoutShortcuts(i.then(), local), withoutShortcuts(i.otherwise(), local)));
            } else if (s instanceof Stmt.ForRange f) {
                Set<String> inner = new HashSet<>(local);
                inner.add(f.var());
                out.add(new Stmt.ForRange(f.var(), f.start(), f.end(), withoutShortcuts(f.body(), inner)));
            } else if (s instanceof Stmt.ForEach f) {
                Set<String> inner = new HashSet<>(local);
                inner.add(f.var());
                out.add(new Stmt.ForEach(f.var(), f.iterable(), withoutShortcuts(f.body(), inner)));
            } else {
                out.add(s);
            }
        }
        return out;
    }

    private boolean isShortcut(Expr e, Set<String> scope) {
        return e instanceof Expr.Call c
                && c.receiver() instanceof Expr.Ident arr
                && SHORTCUTS.contains(c.name())
                && !keyedLoops(arr.name(), scope).isEmpty();
    }

    private void block(List<Stmt> stmts, Set<String> scope, List<Instr> updates, List<Instr> out) {
        Set<String> local = new HashSet<>(scope);
        for (Stmt s : stmts) stmt(s, local, updates, out);
    }

    private List<Instr> nested(List<Stmt> stmts, Set<String> scope, List<Instr> updates) {
        List<Instr> out = new ArrayList<>();
        block(stmts, scope, updates, out);
        return out;
    }

    private void stmt(Stmt s, Set<String> scope, List<Instr> updates, List<Instr> out) {
        if (s instanceof Stmt.VarDecl v) {
            out.add(new Instr.Let(v.name(), v.init()));
            scope.add(v.name());
        } else if (s instanceof Stmt.Assign a) {
            List<LoopRegion> keyed = keyedLoops(a.name(), scope);
            if (keyed.isEmpty()) out.add(new Instr.Assign(new Expr.Ident(a.name()), a.value()));
            else reassign(a.name(), a.value(), keyed, out);
        } else if (s instanceof Stmt.IndexAssign ia) {
            out.add(new Instr.Assign(new Expr.Index(ia.target(), ia.index()), ia.value()));
            if (ia.target() instanceof Expr.Ident arr) {
                for (LoopRegion r : keyedLoops(arr.name(), scope)) {
                    if (r.memberRef) out.add(new Instr.PlaceItem(r.id, arr, ia.index(), r.itemMount()));
                }
            }
        } else if (s instanceof Stmt.MemberAssign ma) {
            out.add(new Instr.Assign(new Expr.Member(ma.target(), ma.member()), ma.value()));
            childRefresh(ma, scope, out);
        } else if (s instanceof Stmt.ExprStmt es) {
            expression(es.expr(), scope, out);
        } else if (s instanceof Stmt.Block b) {
            block(b.body(), scope, updates, out);
        } else if (s instanceof Stmt.If i) {
            out.add(new Instr.Branch(i.condition(), nested(i.then(), scope, updates), nested(i.otherwise(), scope, updates)));
        } else if (s instanceof Stmt.ForRange f) {
            Set<String> inner = new HashSet<>(scope);
            inner.add(f.var());
            out.add(new Instr.Repeat(f.var(), f.start(), f.end(), nested(f.body(), inner, updates)));
        } else if (s instanceof Stmt.ForEach f) {
            Set<String> inner = new HashSet<>(scope);
            inner.add(f.var());
            out.add(new Instr.Each(f.var(), f.iterable(), nested(f.body(), inner, updates)));
        } else if (s instanceof Stmt.Return r) {
            if (r.value() != null && !updates.isEmpty()) {
                out.add(new Instr.Let(RET, r.value()));
                out.addAll(updates);
                out.add(new Instr.Return(new Expr.Ident(RET)));
            } else {
                out.addAll(updates);
                out.add(new Instr.Return(r.value()));
            }
        }
    }

    /** {@code child.count = 3} sobre un hijo del estado: el hijo también se entera. */
    private void childRefresh(Stmt.MemberAssign ma, Set<String> scope, List<Instr> out) {
        if (!(ma.target() instanceof Expr.Ident obj) || scope.contains(obj.name())) return;
        String type = def.typeOf(obj.name());
        ComponentDef child = type == null ? null : components.get(type);
        if (child != null && child.declares(ma.member())) {
            out.add(new Instr.CallChild(ChildRef.expr(obj, type), Names.update(ma.member())));
        }
    }

    private void expression(Expr e, Set<String> scope, List<Instr> out) {
        if (!isShortcut(e, scope)) {
            out.add(new Instr.Eval(e));
            return;
        }
        Expr.Call c = (Expr.Call) e;
        Expr.Ident arr = (Expr.Ident) c.receiver();
        List<LoopRegion> keyed = keyedLoops(arr.name(), scope);
        switch (c.name()) {
            case "push":
                push(arr, c, keyed, out);
                break;
            case "pop":
                pop(c, keyed, out);
                break;
            default:
                clear(c, keyed, out);
                break;
        }
    }

    // ------------------------------------------------------------------ atajos de lista

    private void push(Expr.Ident arr, Expr.Call call, List<LoopRegion> keyed, List<Instr> out) {
        for (LoopRegion r : keyed) out.add(new Instr.Let(old(r), count(r)));
        out.add(new Instr.Eval(call));
        for (LoopRegion r : keyed) {
            List<Instr> render = new ArrayList<>();
            if (r.hasComponents) render.add(new Instr.RebindItems(r.id, new Expr.Ident(old(r))));
            render.add(new Instr.NewItem(r.id, r.var, new Expr.Index(arr, new Expr.Ident(old(r))), r.create));
            render.add(new Instr.Assign(count(r), new Expr.Binary("+", count(r), new Expr.Literal(1))));
            out.add(new Instr.Branch(mounted(r), render, List.of()));
        }
    }

    private void pop(Expr.Call call, List<LoopRegion> keyed, List<Instr> out) {
        for (LoopRegion r : keyed) {
            Expr last = new Expr.Binary("-", count(r), new Expr.Literal(1));
            out.add(new Instr.Branch(
                    new Expr.Binary("&&", mounted(r), new Expr.Binary(">", count(r), new Expr.Literal(0))),
                    List.of(new Instr.DrainItems(r.id, last, DrainMode.of(r.memberRef, false)),
                            new Instr.Assign(count(r), last)),
                    List.of()));
        }
        out.add(new Instr.Eval(call));
    }

    private void clear(Expr.Call call, List<LoopRegion> keyed, List<Instr> out) {
        for (LoopRegion r : keyed) {
            List<Instr> drop = new ArrayList<>(loops.removeAll(r));
            drop.add(new Instr.Assign(count(r), new Expr.Literal(0)));
            out.add(new Instr.Branch(mounted(r), drop, List.of()));
        }
        out.add(new Instr.Eval(call));
    }

    /** {@code a = b}: quitar todo lo viejo, asignar, pintar todo lo nuevo. */
    private void reassign(String name, Expr value, List<LoopRegion> keyed, List<Instr> out) {
        for (LoopRegion r : keyed) {
            List<Instr> drop = new ArrayList<>(loops.removeAll(r));
            drop.add(new Instr.Assign(count(r), new Expr.Literal(0)));
            out.add(new Instr.Branch(mounted(r), drop, List.of()));
        }
        out.add(new Instr.Assign(new Expr.Ident(name), value));
        for (LoopRegion r : keyed) {
            List<Instr> render = new ArrayList<>();
            if (options.emitFlush()) render.add(new Instr.ViewDepth(1));
            render.addAll(loops.renderAll(r, LoopSyncSynthesizer.size(r.iterable)));
            if (options.emitFlush()) {
                render.add(new Instr.ViewDepth(-1));
                render.add(new Instr.Flush());
            }
            out.add(new Instr.Branch(mounted(r), render, List.of()));
        }
    }

    private List<LoopRegion> keyedLoops(String name, Set<String> scope) {
        List<LoopRegion> out = new ArrayList<>();
        if (scope.contains(name)) return out;
        for (LoopRegion r : view.loops().values()) {
            if (r.strategy == LoopRegion.Strategy.KEYED && name.equals(r.backingArray())) out.add(r);
        }
        return out;
    }

    private static String old(LoopRegion r) {
        return "_old_" + r.id;
    }

    private static Expr count(LoopRegion r) {
        return new Expr.Ident(Names.loopCount(r.id));
    }

    private static Expr mounted(LoopRegion r) {
        return new Expr.Ident(Names.loopMounted(r.id));
    }
}
