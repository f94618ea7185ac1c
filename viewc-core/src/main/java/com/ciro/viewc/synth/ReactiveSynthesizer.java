package com.ciro.viewc.synth;

import com.ciro.viewc.ast.ComponentDef;
import com.ciro.viewc.ast.ComponentParam;
import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.ast.StateVar;
import com.ciro.viewc.ast.Types;
import com.ciro.viewc.deps.Dependencies;
import com.ciro.viewc.deps.MemberDependency;
import com.ciro.viewc.lower.BranchKey;
import com.ciro.viewc.lower.ChildProp;
import com.ciro.viewc.lower.IfRegion;
import com.ciro.viewc.lower.LoopRegion;
import com.ciro.viewc.lower.LoweredView;
import com.ciro.viewc.lower.Names;
import com.ciro.viewc.lower.Site;
import com.ciro.viewc.target.ChildRef;
import com.ciro.viewc.target.Instr;
import com.ciro.viewc.target.NodeRef;
import com.ciro.viewc.target.Procedure;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Procedimientos de actualización: uno por sitio y un {@code update_<var>}
 * por cada variable de la que depende algo.
 *
 * <p>Orden dentro de {@code update_<var>}: sitios sin condición, sitios
 * dentro de ramas (agrupados bajo su guarda), sync de regiones, props de
 * hijos y al final el callback de cambio si la variable es observable.</p>
 */
public class ReactiveSynthesizer {

    private enum Category { SITE, SYNC, PROP }

    private record Action(Category category, List<BranchKey> guards, List<Instr> body) {}

    private final ComponentDef def;
    private final LoweredView view;

    public ReactiveSynthesizer(ComponentDef def, LoweredView view) {
        this.def = def;
        this.view = view;
    }

    public List<Procedure> siteProcedures() {
        List<Procedure> out = new ArrayList<>();
        for (Site s : view.sites()) {
            out.add(new Procedure(s.procedureName(), Procedure.Kind.SITE, List.of(siteWrite(s))));
        }
        return out;
    }

    private static Instr siteWrite(Site s) {
        NodeRef node = NodeRef.element(s.nodeId());
        switch (s.kind()) {
            case TEXT: return new Instr.SetText(node, s.value());
            case INNER_HTML: return new Instr.SetInnerHtml(node, s.value());
            case PROPERTY: return new Instr.SetAttribute(node, s.name(), s.value(), true);
            default: return new Instr.SetAttribute(node, s.name(), s.value(), false);
        }
    }

    /** Variables con {@code update_<var>}, en orden de declaración. */
    public Set<String> updatableVars() {
        Set<String> used = new LinkedHashSet<>();
        for (Site s : view.sites()) used.addAll(s.deps().names());
        for (IfRegion r : view.ifs().values()) used.addAll(r.deps.names());
        for (LoopRegion r : view.loops().values()) {
            used.addAll(r.countDeps.names());
            used.addAll(r.itemDeps.names());
        }
        for (ChildProp p : view.childProps()) used.addAll(p.deps().names());

        Set<String> out = new LinkedHashSet<>();
        for (StateVar s : def.state()) {
            if (used.contains(s.name()) || (s.isPublic() && s.mutable())) out.add(s.name());
        }
        for (ComponentParam p : def.params()) out.add(p.name());
        return out;
    }

    public List<Procedure> updateProcedures() {
        List<Procedure> out = new ArrayList<>();
        for (String var : updatableVars()) {
            out.add(new Procedure(Names.update(var), Procedure.Kind.UPDATE, updateBody(var, r -> false)));
        }
        return out;
    }

    /**
     * Cuerpo de {@code update_<var>} sin las regiones de bucle que {@code handled}
     * acepta: las que el llamador ya dejó al día.
     */
    public List<Instr> updateBody(String var, Predicate<LoopRegion> handled) {
        List<Instr> body = whileMounted(assemble(actions(d -> d.names().contains(var), handled)));
        if (def.isObservable(var)) body.add(new Instr.Notify(Types.changeCallback(var)));
        return body;
    }

    /** Lecturas {@code obj.member} sobre hijos del estado. */
    public Set<MemberDependency> memberDependencies() {
        Set<MemberDependency> out = new LinkedHashSet<>();
        for (Site s : view.sites()) out.addAll(s.deps().members());
        for (IfRegion r : view.ifs().values()) out.addAll(r.deps.members());
        for (LoopRegion r : view.loops().values()) {
            out.addAll(r.countDeps.members());
            out.addAll(r.itemDeps.members());
        }
        for (ChildProp p : view.childProps()) out.addAll(p.deps().members());
        return out;
    }

    public List<Procedure> memberProcedures() {
        List<Procedure> out = new ArrayList<>();
        for (MemberDependency md : memberDependencies()) {
            List<Instr> body = whileMounted(assemble(actions(d -> d.members().contains(md), r -> false)));
            out.add(new Procedure(Names.memberUpdate(md.object(), md.member()), Procedure.Kind.MEMBER_UPDATE, body));
        }
        return out;
    }

    /** El padre escucha los cambios de los miembros que lee. */
    public List<Instr.WireCallback> memberWires() {
        List<Instr.WireCallback> out = new ArrayList<>();
        for (MemberDependency md : memberDependencies()) {
            ChildRef child = ChildRef.expr(new Expr.Ident(md.object()), def.typeOf(md.object()));
            out.add(new Instr.WireCallback(child, Types.changeCallback(md.member()),
                    Names.memberUpdate(md.object(), md.member())));
        }
        return out;
    }

    // ------------------------------------------------------------------

    private List<Action> actions(Predicate<Dependencies> affected, Predicate<LoopRegion> handled) {
        List<Action> out = new ArrayList<>();
        for (Site s : view.sites()) {
            if (affected.test(s.deps())) {
                out.add(new Action(Category.SITE, s.guards(), List.of(new Instr.Call(s.procedureName()))));
            }
        }
        for (IfRegion r : view.ifs().values()) {
            if (affected.test(r.deps)) {
                out.add(new Action(Category.SYNC, r.guards, List.of(new Instr.Call(Names.syncIf(r.id)))));
            }
        }
        for (LoopRegion r : view.loops().values()) {
            if (handled.test(r)) continue;
            boolean count = affected.test(r.countDeps);
            boolean items = affected.test(r.itemDeps) && !r.update.isEmpty();
            if (count) {
                out.add(new Action(Category.SYNC, r.guards, List.of(new Instr.Call(Names.syncLoop(r.id)))));
            }
            // Con clave, el sync con el mismo tamaño ya actualiza los items
            if (items && !(count && r.strategy == LoopRegion.Strategy.KEYED)) {
                out.add(new Action(Category.SYNC, r.guards, List.of(new Instr.Call(Names.loopItems(r.id)))));
            }
        }
        for (ChildProp p : view.childProps()) {
            if (!affected.test(p.deps())) continue;
            List<Instr> refresh = new ArrayList<>();
            if (!p.reference()) refresh.add(new Instr.SetProp(p.child(), p.prop(), p.value()));
            refresh.add(new Instr.CallChild(p.child(), Names.update(p.prop())));
            out.add(new Action(Category.PROP, p.guards(), refresh));
        }
        return out;
    }

    /** Sin guarda primero; después un bloque {@code if} por cada combinación de ramas. */
    private static List<Instr> assemble(List<Action> actions) {
        List<Instr> body = new ArrayList<>();
        for (Category c : Category.values()) {
            Map<List<BranchKey>, List<Instr>> guarded = new LinkedHashMap<>();
            for (Action a : actions) {
                if (a.category() != c) continue;
                if (a.guards().isEmpty()) body.addAll(a.body());
                else guarded.computeIfAbsent(a.guards(), k -> new ArrayList<>()).addAll(a.body());
            }
            guarded.forEach((guards, instrs) -> body.add(new Instr.Branch(guard(guards), instrs, List.of())));
        }
        return body;
    }

    /** Antes de construir la vista (hook {@code init}) no hay nada que actualizar. */
    private static List<Instr> whileMounted(List<Instr> actions) {
        List<Instr> body = new ArrayList<>();
        if (!actions.isEmpty()) body.add(new Instr.Branch(Names.ref(Names.VIEW_MOUNTED), actions, List.of()));
        return body;
    }

    static Expr guard(List<BranchKey> guards) {
        Expr e = guards.get(0).guard();
        for (int i = 1; i < guards.size(); i++) e = new Expr.Binary("&&", e, guards.get(i).guard());
        return e;
    }
}
