package com.ciro.viewc.synth;

import com.ciro.viewc.CompilerOptions;
import com.ciro.viewc.ast.ComponentDef;
import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.lower.LoweredView;
import com.ciro.viewc.lower.Names;
import com.ciro.viewc.target.EventKind;
import com.ciro.viewc.target.Instr;
import com.ciro.viewc.target.Procedure;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code view}, {@code _rebind}, {@code _destroy} y {@code _remove_view}.
 */
public class LifecycleSynthesizer {

    private final ComponentDef def;
    private final LoweredView view;
    private final CompilerOptions options;
    private final List<Instr.WireCallback> memberWires;
    private final Teardown teardown;

    public LifecycleSynthesizer(ComponentDef def, LoweredView view, CompilerOptions options,
                                List<Instr.WireCallback> memberWires) {
        this.def = def;
        this.view = view;
        this.options = options;
        this.memberWires = memberWires;
        this.teardown = new Teardown(view, options);
    }

    public List<Procedure> synthesize() {
        return List.of(view(), rebind(), destroy(), removeView());
    }

    Procedure view() {
        List<Instr> body = new ArrayList<>();
        if (options.emitFlush()) body.add(new Instr.ViewDepth(1));
        if (def.method(Names.INIT_HOOK).isPresent()) body.add(new Instr.Call(Names.INIT_HOOK));
        body.addAll(view.construction());
        if (options.emitFlush()) {
            body.add(new Instr.ViewDepth(-1));
            body.add(new Instr.Flush());
        }
        body.add(new Instr.Assign(Names.ref(Names.VIEW_MOUNTED), new Expr.Literal(true)));
        body.addAll(bindings());
        if (def.method(Names.MOUNT_HOOK).isPresent()) body.add(new Instr.Call(Names.MOUNT_HOOK));
        if (def.router() != null) body.add(new Instr.Call(Names.SYNC_ROUTE));
        return new Procedure(Names.VIEW, Procedure.Kind.VIEW, body);
    }

    /** Manejadores enmascarados y callbacks hacia los hijos; se puede repetir sin efectos. */
    Procedure rebind() {
        return new Procedure(Names.REBIND, Procedure.Kind.LIFECYCLE, bindings());
    }

    Procedure destroy() {
        List<Instr> body = new ArrayList<>(teardown.of(view.root(), Teardown.Mode.DESTROY, false));
        body.add(unmounted());
        return new Procedure(Names.DESTROY, Procedure.Kind.LIFECYCLE, body);
    }

    /** Quita la vista pero conserva la instancia y su estado. */
    Procedure removeView() {
        Instr body = new Instr.Branch(Names.ref("bulk"),
                teardown.of(view.root(), Teardown.Mode.REMOVE_VIEW, true),
                teardown.of(view.root(), Teardown.Mode.REMOVE_VIEW, false));
        return new Procedure(Names.REMOVE_VIEW, Procedure.Kind.LIFECYCLE, List.of("bulk"), List.of(body, unmounted()));
    }

    private static Instr unmounted() {
        return new Instr.Assign(Names.ref(Names.VIEW_MOUNTED), new Expr.Literal(false));
    }

    private List<Instr> bindings() {
        List<Instr> out = new ArrayList<>();
        for (EventKind kind : EventKind.values()) {
            if (view.masks().has(kind)) {
                out.add(new Instr.RegisterMasked(kind, view.masks().mask(kind), view.masks().overflow(kind)));
            }
        }
        out.addAll(view.wires());
        out.addAll(memberWires);
        return out;
    }
}
