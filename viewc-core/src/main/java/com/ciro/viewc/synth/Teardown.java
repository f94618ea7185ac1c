package com.ciro.viewc.synth;

import com.ciro.viewc.CompilerOptions;
import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.lower.EventHandler;
import com.ciro.viewc.lower.IfRegion;
import com.ciro.viewc.lower.LoopRegion;
import com.ciro.viewc.lower.LoweredView;
import com.ciro.viewc.lower.Names;
import com.ciro.viewc.lower.Ownership;
import com.ciro.viewc.target.ChildRef;
import com.ciro.viewc.target.DrainMode;
import com.ciro.viewc.target.Instr;
import com.ciro.viewc.target.NodeRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Programa que desmonta lo que posee una rama o la raíz de un componente.
 *
 * <p>Orden: regiones anidadas (cada una según su propio estado), manejadores
 * de los nodos propios, hijos, bucles, router y por último las raíces. Así
 * ningún manejador sobrevive a su nodo y nada se quita dos veces.</p>
 */
final class Teardown {

    enum Mode { DESTROY, REMOVE_VIEW }

    private final LoweredView view;
    private final CompilerOptions options;

    Teardown(LoweredView view, CompilerOptions options) {
        this.view = view;
        this.options = options;
    }

    /**
     * @param bulk el llamador va a vaciar el padre entero: no se quitan nodos uno a uno
     */
    List<Instr> of(Ownership owner, Mode mode, boolean bulk) {
        List<Instr> out = new ArrayList<>();

        for (int nested : owner.ifs) {
            IfRegion r = view.ifRegion(nested);
            List<Instr> then = of(r.then, mode, bulk);
            List<Instr> otherwise = of(r.otherwise, mode, bulk);
            if (!then.isEmpty() || !otherwise.isEmpty()) {
                out.add(new Instr.Branch(Names.ref(Names.ifState(nested)), then, otherwise));
            }
        }

        for (EventHandler h : view.handlers()) {
            if (owner.elements.contains(h.nodeId())) {
                out.add(new Instr.UnregisterHandler(NodeRef.element(h.nodeId()), h.kind()));
            }
        }

        for (ChildRef c : owner.components) {
            if (mode == Mode.DESTROY) out.add(new Instr.CallChild(c, Names.DESTROY));
            else out.add(removeView(c, bulk));
        }
        for (ChildRef p : owner.projections) {
            out.add(removeView(p, bulk));
        }

        for (int id : owner.loops) {
            LoopRegion r = view.loop(id);
            boolean loopBulk = bulk || (r.isOnlyChild() && options.bulkClear());
            out.add(new Instr.DrainItems(id, new Expr.Literal(0), DrainMode.of(r.memberRef, loopBulk)));
            out.add(new Instr.Assign(Names.ref(Names.loopCount(id)), new Expr.Literal(0)));
            out.add(new Instr.Assign(Names.ref(Names.loopMounted(id)), new Expr.Literal(false)));
        }

        if (owner.route) {
            Instr drop = mode == Mode.DESTROY ? new Instr.CallChild(ChildRef.route(), Names.DESTROY)
                                              : removeView(ChildRef.route(), bulk);
            out.add(new Instr.Branch(
                    new Expr.Binary("!=", Names.ref(Names.ROUTE_CURRENT), new Expr.Literal("")),
                    List.of(drop), List.of()));
            out.add(new Instr.Assign(Names.ref(Names.ROUTE_CURRENT), new Expr.Literal("")));
        }

        if (!bulk) {
            for (int root : owner.roots) out.add(new Instr.RemoveNode(NodeRef.element(root)));
            for (NodeRef slot : owner.rootSlots) out.add(new Instr.RemoveNode(slot));
        }
        return out;
    }

    private static Instr removeView(ChildRef c, boolean bulk) {
        return new Instr.CallChild(c, Names.REMOVE_VIEW, null, List.of(new Expr.Literal(bulk)));
    }
}
