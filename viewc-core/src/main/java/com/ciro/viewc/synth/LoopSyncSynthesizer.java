package com.ciro.viewc.synth;

import com.ciro.viewc.CompilerOptions;
import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.lower.LoopRegion;
import com.ciro.viewc.lower.LoweredView;
import com.ciro.viewc.lower.Names;
import com.ciro.viewc.target.DrainMode;
import com.ciro.viewc.target.Instr;
import com.ciro.viewc.target.Procedure;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code _sync_loop_N} y {@code _update_loop_N_items}.
 *
 * <p>Rango: el tamaño es {@code max(0, end - start)}; mismo tamaño no hace nada; crecer crea solo los items nuevos y
 * luego hace rebind de los anteriores; encoger destruye la cola y actualiza
 * los que quedan. Con clave: mismo tamaño actualiza por posición; si cambia,
 * se reconstruye todo.</p>
 */
public class LoopSyncSynthesizer {

    static final String COUNT = "_count";
    static final String OLD = "_old";
    static final String INDEX = Names.ITEM_INDEX;

    private final LoweredView view;
    private final CompilerOptions options;

    public LoopSyncSynthesizer(LoweredView view, CompilerOptions options) {
        this.view = view;
        this.options = options;
    }

    public List<Procedure> synthesize() {
        List<Procedure> out = new ArrayList<>();
        for (LoopRegion r : view.loops().values()) {
            out.add(r.strategy == LoopRegion.Strategy.RANGE ? syncRange(r) : syncKeyed(r));
            out.add(new Procedure(Names.loopItems(r.id), Procedure.Kind.LOOP_ITEMS, updateItems(r)));
        }
        return out;
    }

    private Procedure syncRange(LoopRegion r) {
        Expr count = Names.ref(Names.loopCount(r.id));
        Expr next = Names.ref(COUNT);
        List<Instr> body = new ArrayList<>();

        body.add(new Instr.Let(COUNT, new Expr.Binary("-", r.end, r.start)));
        // Un rango invertido no tiene items
        body.add(new Instr.Branch(new Expr.Binary("<", next, new Expr.Literal(0)),
                List.of(new Instr.Assign(next, new Expr.Literal(0))), List.of()));
        body.add(new Instr.Branch(new Expr.Binary("==", next, count), List.of(new Instr.Return(null)), List.of()));

        List<Instr> grow = new ArrayList<>();
        if (options.emitFlush()) grow.add(new Instr.ViewDepth(1));
        grow.add(new Instr.Let(OLD, count));
        grow.add(new Instr.Repeat(r.var,
                new Expr.Binary("+", r.start, Names.ref(OLD)), r.end,
                List.of(new Instr.NewItem(r.id, r.var, Names.ref(r.var), r.create))));
        // Los items nuevos pueden mover las instancias anteriores
        if (r.hasComponents) grow.add(new Instr.RebindItems(r.id, Names.ref(OLD)));
        if (options.emitFlush()) {
            grow.add(new Instr.ViewDepth(-1));
            grow.add(new Instr.Flush());
        }

        List<Instr> shrink = new ArrayList<>();
        shrink.add(new Instr.DrainItems(r.id, next, DrainMode.DESTROY));
        shrink.addAll(updateItems(r));

        body.add(new Instr.Branch(new Expr.Binary(">", next, count), grow, shrink));
        body.add(new Instr.Assign(count, next));
        return new Procedure(Names.syncLoop(r.id), Procedure.Kind.SYNC_LOOP, body);
    }

    private Procedure syncKeyed(LoopRegion r) {
        Expr count = Names.ref(Names.loopCount(r.id));
        Expr next = Names.ref(COUNT);
        List<Instr> body = new ArrayList<>();

        body.add(new Instr.Let(COUNT, size(r.iterable)));
        List<Instr> same = new ArrayList<>(updateItems(r));
        same.add(new Instr.Return(null));
        body.add(new Instr.Branch(new Expr.Binary("==", next, count), same, List.of()));

        if (options.emitFlush()) body.add(new Instr.ViewDepth(1));
        body.addAll(removeAll(r));
        body.addAll(renderAll(r, next));
        if (options.emitFlush()) {
            body.add(new Instr.ViewDepth(-1));
            body.add(new Instr.Flush());
        }
        if (!view.handlers().isEmpty()) body.add(new Instr.Call(Names.REBIND));
        return new Procedure(Names.syncLoop(r.id), Procedure.Kind.SYNC_LOOP, body);
    }

    /** Quita la vista de todos los items; vacía el padre de una vez si el bucle es su único hijo. */
    List<Instr> removeAll(LoopRegion r) {
        boolean bulk = bulk(r);
        List<Instr> out = new ArrayList<>();
        out.add(new Instr.DrainItems(r.id, new Expr.Literal(0), DrainMode.of(r.memberRef, bulk)));
        if (bulk) out.add(new Instr.ClearChildren(r.parentRef()));
        return out;
    }

    /** Crea un item por elemento de la colección y fija el contador. */
    List<Instr> renderAll(LoopRegion r, Expr size) {
        List<Instr> out = new ArrayList<>();
        out.add(new Instr.Repeat(INDEX, new Expr.Literal(0), size,
                List.of(new Instr.NewItem(r.id, r.var, itemValue(r, Names.ref(INDEX)), r.create))));
        out.add(new Instr.Assign(Names.ref(Names.loopCount(r.id)), size));
        return out;
    }

    boolean bulk(LoopRegion r) {
        return r.isOnlyChild() && options.bulkClear();
    }

    static Expr size(Expr iterable) {
        return new Expr.Call(iterable, "size", List.of());
    }

    static Expr itemValue(LoopRegion r, Expr index) {
        return new Expr.Index(r.iterable, index);
    }

    private static List<Instr> updateItems(LoopRegion r) {
        if (r.update.isEmpty()) return List.of();
        if (r.strategy == LoopRegion.Strategy.RANGE) {
            return List.of(new Instr.UpdateItems(r.id, null, null, r.update));
        }
        return List.of(new Instr.UpdateItems(r.id, r.var, itemValue(r, Names.ref(INDEX)), r.update));
    }
}
