package com.ciro.viewc.synth;

import com.ciro.viewc.CompilerOptions;
import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.lower.IfRegion;
import com.ciro.viewc.lower.LoweredView;
import com.ciro.viewc.lower.Names;
import com.ciro.viewc.target.Instr;
import com.ciro.viewc.target.Procedure;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code _sync_if_N}: reevaluar, no hacer nada si coincide con el estado
 * guardado, desmontar la rama saliente, crear la entrante delante del ancla,
 * guardar el estado y volver a registrar manejadores.
 */
public class IfSyncSynthesizer {

    private final LoweredView view;
    private final CompilerOptions options;
    private final Teardown teardown;

    public IfSyncSynthesizer(LoweredView view, CompilerOptions options) {
        this.view = view;
        this.options = options;
        this.teardown = new Teardown(view, options);
    }

    public List<Procedure> synthesize() {
        List<Procedure> out = new ArrayList<>();
        for (IfRegion r : view.ifs().values()) out.add(sync(r));
        return out;
    }

    Procedure sync(IfRegion r) {
        Expr cond = Names.ref(Names.ifCond(r.id));
        Expr state = Names.ref(Names.ifState(r.id));
        List<Instr> body = new ArrayList<>();

        body.add(new Instr.Let(Names.ifCond(r.id), r.condition));
        body.add(new Instr.Branch(new Expr.Binary("==", cond, state), List.of(new Instr.Return(null)), List.of()));

        List<Instr> leaveThen = teardown.of(r.then, Teardown.Mode.DESTROY, false);
        List<Instr> leaveElse = teardown.of(r.otherwise, Teardown.Mode.DESTROY, false);
        if (!leaveThen.isEmpty() || !leaveElse.isEmpty()) {
            body.add(new Instr.Branch(state, leaveThen, leaveElse));
        }

        if (!r.then.isEmpty() || !r.otherwise.isEmpty()) {
            if (options.emitFlush()) body.add(new Instr.ViewDepth(1));
            body.add(new Instr.Branch(cond, r.then.create, r.otherwise.create));
            if (options.emitFlush()) {
                body.add(new Instr.ViewDepth(-1));
                body.add(new Instr.Flush());
            }
        }
        body.add(new Instr.Assign(state, cond));

        if (!view.handlers().isEmpty()) body.add(new Instr.Call(Names.REBIND));
        return new Procedure(Names.syncIf(r.id), Procedure.Kind.SYNC_IF, body);
    }
}
