package com.ciro.viewc.lower;

import com.ciro.viewc.target.Instr;
import com.ciro.viewc.target.Mount;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Estado que viaja por el recorrido de la vista. Cada nivel trabaja con una
 * copia; los contadores globales viven en {@link ViewLowering}.
 */
final class LoweringContext {

    /** Contadores locales de un item de bucle. */
    static final class LoopScope {
        final LoopRegion region;
        int nextLocal;
        final Map<String, Integer> typeCounters = new HashMap<>();

        LoopScope(LoopRegion region) { this.region = region; }

        String nextLocal() { return "_n" + nextLocal++; }

        int nextOrdinal(String type) { return typeCounters.merge(type, 1, Integer::sum) - 1; }
    }

    final Mount mount;
    final Ownership owner;
    final List<BranchKey> guards;
    final List<Instr> out;
    /** El nivel actual coloca nodos directamente en la raíz de la región o del item. */
    final boolean regionRoot;
    final Integer parentElement;
    final int siblings;
    final LoopScope loop;
    /** Dentro de un if/for degradado en un item: se regenera con el item, sin updates. */
    final boolean degraded;
    final Set<String> shadowed;

    private LoweringContext(Mount mount, Ownership owner, List<BranchKey> guards, List<Instr> out,
                            boolean regionRoot, Integer parentElement, int siblings, LoopScope loop,
                            boolean degraded, Set<String> shadowed) {
        this.mount = mount;
        this.owner = owner;
        this.guards = guards;
        this.out = out;
        this.regionRoot = regionRoot;
        this.parentElement = parentElement;
        this.siblings = siblings;
        this.loop = loop;
        this.degraded = degraded;
        this.shadowed = shadowed;
    }

    static LoweringContext root(Ownership owner, Mount mount, int siblings) {
        return new LoweringContext(mount, owner, List.of(), owner.create, true, null, siblings, null, false, Set.of());
    }

    boolean inLoop() {
        return loop != null;
    }

    /** Hijos de un elemento: se agregan al elemento, no a la raíz. */
    LoweringContext insideElement(Mount elementMount, Integer elementId, int childCount) {
        return new LoweringContext(elementMount, owner, guards, out, false, elementId, childCount, loop, degraded, shadowed);
    }

    /** Rama de una región condicional nueva. */
    LoweringContext branch(Ownership branch, BranchKey key, Mount anchorMount) {
        List<BranchKey> g = new ArrayList<>(guards);
        g.add(key);
        return new LoweringContext(anchorMount, branch, List.copyOf(g), branch.create, true, null, 0, null, false, shadowed);
    }

    /** Cuerpo de un item de una región de bucle nueva. */
    LoweringContext loopItem(LoopScope scope, Mount itemMount, List<Instr> body, Integer parentId, int siblings) {
        Set<String> s = new HashSet<>(shadowed);
        s.add(scope.region.var);
        return new LoweringContext(itemMount, owner, guards, body, true, parentId, siblings, scope, false, s);
    }

    /** if/for dentro de un item: mismo punto de montaje, código degradado. */
    LoweringContext degradedBlock(List<Instr> body, String boundVar) {
        Set<String> s = shadowed;
        if (boundVar != null) {
            s = new HashSet<>(shadowed);
            s.add(boundVar);
        }
        return new LoweringContext(mount, owner, guards, body, regionRoot, parentElement, siblings, loop, true, s);
    }
}
