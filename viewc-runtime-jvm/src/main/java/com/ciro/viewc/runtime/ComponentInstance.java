package com.ciro.viewc.runtime;

import com.ciro.viewc.LoweredComponent;
import com.ciro.viewc.runtime.dom.DomNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Instancia viva de un componente compilado: campos, tabla de elementos,
 * anclas, hijos, items de bucle y callbacks que le han cableado los padres.
 */
public final class ComponentInstance {

    /** Dónde se colocan las raíces: antes de {@code before} o al final de {@code parent}. */
    record Placement(DomNode parent, DomNode before) {}

    /** {@code procedure} en {@code target} escucha un callback de cambio. */
    record Callback(ComponentInstance target, String procedure) {}

    /** Prop compartida por referencia con un campo del padre. */
    record Shared(ComponentInstance owner, String field) {}

    private final int id;
    private final LoweredComponent program;

    private final Map<String, Object> fields = new LinkedHashMap<>();
    private final Map<String, Shared> shared = new HashMap<>();

    final Map<Integer, DomNode> el = new HashMap<>();
    final Map<String, DomNode> slots = new HashMap<>();
    final Map<String, ComponentInstance> members = new LinkedHashMap<>();
    final Map<Integer, List<LoopItem>> loops = new HashMap<>();
    final List<DomNode> roots = new ArrayList<>();
    final Map<String, Callback> callbacks = new HashMap<>();
    final Map<String, Integer> running = new HashMap<>();

    ComponentInstance routeChild;
    Placement mount;
    boolean destroyed;

    ComponentInstance(int id, LoweredComponent program) {
        this.id = id;
        this.program = program;
    }

    public int id() {
        return id;
    }

    public String type() {
        return program.name();
    }

    public LoweredComponent program() {
        return program;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public boolean hasField(String name) {
        return fields.containsKey(name) || shared.containsKey(name);
    }

    public Object field(String name) {
        Shared s = shared.get(name);
        if (s != null) return s.owner().field(s.field());
        if (!fields.containsKey(name)) {
            throw new ViewRuntimeException(type() + ": variable desconocida '" + name + "'");
        }
        return fields.get(name);
    }

    public void setField(String name, Object value) {
        Shared s = shared.get(name);
        if (s != null) {
            s.owner().setField(s.field(), value);
            return;
        }
        if (!fields.containsKey(name)) {
            throw new ViewRuntimeException(type() + ": asignación a una variable desconocida '" + name + "'");
        }
        fields.put(name, value);
    }

    void defineField(String name, Object value) {
        fields.put(name, value);
    }

    void share(String prop, ComponentInstance owner, String field) {
        shared.put(prop, new Shared(owner, field));
    }

    public DomNode element(int nodeId) {
        return el.get(nodeId);
    }

    /** Raíces montadas en el punto de montaje, en orden de documento. */
    public List<DomNode> roots() {
        return Collections.unmodifiableList(roots);
    }

    public List<LoopItem> items(int loopId) {
        return loops.computeIfAbsent(loopId, k -> new ArrayList<>());
    }

    public ComponentInstance member(String key) {
        return members.get(key);
    }

    public ComponentInstance routeChild() {
        return routeChild;
    }

    boolean isRunning(String procedure) {
        return running.getOrDefault(procedure, 0) > 0;
    }

    void enter(String procedure) {
        running.merge(procedure, 1, Integer::sum);
    }

    void exit(String procedure) {
        running.computeIfPresent(procedure, (k, v) -> v > 1 ? v - 1 : null);
    }

    @Override
    public String toString() {
        return type() + "@" + id;
    }
}
