package com.ciro.viewc.runtime;

import com.ciro.viewc.runtime.dom.DomNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Un item vivo de un bucle: sus locales, sus nodos raíz y sus instancias. */
public final class LoopItem {

    final Map<String, Object> locals = new HashMap<>();
    final List<DomNode> nodes = new ArrayList<>();
    /** Instancias creadas en el item, por clave {@code Tipo#ordinal}. */
    final Map<String, ComponentInstance> children = new LinkedHashMap<>();
    /** Instancias proyectadas (que no son propiedad del item). */
    final List<ComponentInstance> tracked = new ArrayList<>();

    public List<DomNode> nodes() {
        return nodes;
    }

    public Object local(String name) {
        return locals.get(name);
    }

    /** Todas las instancias del item, creadas primero. */
    public List<ComponentInstance> instances() {
        List<ComponentInstance> out = new ArrayList<>(children.values());
        for (ComponentInstance c : tracked) if (!out.contains(c)) out.add(c);
        return out;
    }
}
