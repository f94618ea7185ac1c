package com.ciro.viewc.lower;

import com.ciro.viewc.target.ChildRef;
import com.ciro.viewc.target.Instr;
import com.ciro.viewc.target.NodeRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Lo que crea directamente una rama (o el nivel raíz del componente). Lo que
 * pertenece a una región anidada queda fuera: esa región se limpia sola.
 */
public final class Ownership {

    /** Ids de todos los nodos creados en esta rama. */
    public final List<Integer> elements = new ArrayList<>();
    /** Ids colocados directamente en el punto de montaje de la rama. */
    public final List<Integer> roots = new ArrayList<>();
    /** Anclas colocadas directamente en el punto de montaje. */
    public final List<NodeRef> rootSlots = new ArrayList<>();
    public final List<ChildRef> components = new ArrayList<>();
    /** Instancias del estado proyectadas con {@code <{x}/>}. */
    public final List<ChildRef> projections = new ArrayList<>();
    public final List<Integer> loops = new ArrayList<>();
    public final List<Integer> ifs = new ArrayList<>();
    public boolean route;

    /** Programa de creación. */
    public final List<Instr> create = new ArrayList<>();

    public boolean isEmpty() {
        return create.isEmpty();
    }
}
