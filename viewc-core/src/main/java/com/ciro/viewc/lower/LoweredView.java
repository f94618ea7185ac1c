package com.ciro.viewc.lower;

import com.ciro.viewc.LoweringDefect;
import com.ciro.viewc.target.Instr;

import java.util.List;
import java.util.Map;

/** Resultado del lowering de la vista de un componente. */
public record LoweredView(List<Instr> construction,
                          Ownership root,
                          List<Binding> bindings,
                          List<Site> sites,
                          Map<Integer, IfRegion> ifs,
                          Map<Integer, LoopRegion> loops,
                          List<EventHandler> handlers,
                          EventMasks masks,
                          List<ChildProp> childProps,
                          List<Instr.WireCallback> wires,
                          int nodeCount) {

    public IfRegion ifRegion(int id) {
        IfRegion r = ifs.get(id);
        if (r == null) throw new LoweringDefect("región if desconocida: " + id);
        return r;
    }

    public LoopRegion loop(int id) {
        LoopRegion r = loops.get(id);
        if (r == null) throw new LoweringDefect("región de bucle desconocida: " + id);
        return r;
    }
}
