package com.ciro.viewc.runtime;

import com.ciro.viewc.CompiledProgram;
import com.ciro.viewc.LoweredComponent;
import com.ciro.viewc.ViewCompiler;
import com.ciro.viewc.ast.ComponentDef;
import com.ciro.viewc.ast.ComponentParam;
import com.ciro.viewc.ast.StateVar;
import com.ciro.viewc.ast.Types;
import com.ciro.viewc.lower.Names;
import com.ciro.viewc.runtime.dom.DomHost;
import com.ciro.viewc.runtime.dom.DomNode;
import com.ciro.viewc.store.LoweredProgramStore;
import com.ciro.viewc.target.EventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Punto de entrada del runtime: crea instancias, monta vistas, llama
 * métodos y despacha eventos. Lleva el contador de profundidad de vista que
 * comparten todas las instancias: el volcado ocurre al salir de la más externa.
 */
public class ComponentHost {

    private static final Logger log = LoggerFactory.getLogger(ComponentHost.class);

    private final CompiledProgram program;
    private final DomHost dom;
    private final Interpreter interpreter;
    private final List<String> lifecycle = new ArrayList<>();

    private int depth;
    private int nextId;

    public ComponentHost(CompiledProgram program, DomHost dom) {
        this.program = program;
        this.dom = dom;
        this.interpreter = new Interpreter(this, dom);
    }

    /** Compila el bundle solo si el almacén no lo tiene ya. */
    public static ComponentHost load(String bundleId, List<ComponentDef> defs, ViewCompiler compiler,
                                     LoweredProgramStore store, DomHost dom) {
        CompiledProgram program = store.get(bundleId);
        if (program == null) {
            log.debug("Bundle {} no está en el almacén, compilando", bundleId);
            program = compiler.compile(defs);
            store.put(bundleId, program);
        }
        return new ComponentHost(program, dom);
    }

    public CompiledProgram program() {
        return program;
    }

    public DomHost dom() {
        return dom;
    }

    /** Crea {@code type} y monta su vista al final de {@code parent}. */
    public ComponentInstance mount(String type, DomNode parent) {
        ComponentInstance inst = instantiate(type);
        inst.mount = new ComponentInstance.Placement(parent, null);
        interpreter.invoke(inst, Names.VIEW, List.of());
        return inst;
    }

    public ComponentInstance instantiate(String type) {
        LoweredComponent lc = program.require(type);
        ComponentInstance inst = new ComponentInstance(nextId++, lc);
        Frame f = Frame.of(inst);
        for (ComponentParam p : lc.def().params()) {
            inst.defineField(p.name(), initial(p.type(), p.defaultValue() == null ? null : interpreter.eval(p.defaultValue(), f)));
        }
        for (StateVar s : lc.def().state()) {
            inst.defineField(s.name(), initial(s.type(), s.init() == null ? null : interpreter.eval(s.init(), f)));
        }
        for (Map.Entry<String, Object> e : lc.internalState().entrySet()) {
            inst.defineField(e.getKey(), e.getValue());
        }
        log.trace("Instancia {}", inst);
        return inst;
    }

    private static Object initial(String type, Object value) {
        if (value != null) {
            // Los arrays del estado son mutables
            return value instanceof List<?> l ? new ArrayList<>(l) : Values.normalize(value);
        }
        if (Types.isArray(type)) return new ArrayList<>();
        if (type == null) return null;
        switch (type) {
            case "int": return 0;
            case "float": return 0.0;
            case "bool": return false;
            case "string": return "";
            default: return null;
        }
    }

    public Object call(ComponentInstance inst, String method, Object... args) {
        return interpreter.invoke(inst, method, Arrays.asList(args));
    }

    public boolean dispatch(DomNode node, EventKind event, Object payload) {
        return dom.dispatch(node, event, payload);
    }

    public void destroy(ComponentInstance inst) {
        interpreter.invoke(inst, Names.DESTROY, List.of());
    }

    public void removeView(ComponentInstance inst, boolean bulk) {
        interpreter.invoke(inst, Names.REMOVE_VIEW, List.of(bulk));
    }

    public void navigate(ComponentInstance inst, String path) {
        interpreter.invoke(inst, Names.NAVIGATE, List.of(path));
    }

    /** Entradas {@code "view Row@3"}, {@code "_destroy Row@3"}... en orden. */
    public List<String> lifecycle() {
        return Collections.unmodifiableList(lifecycle);
    }

    public int depth() {
        return depth;
    }

    boolean isComponentType(String name) {
        return program.component(name).isPresent();
    }

    int viewDepth(int delta) {
        depth += delta;
        if (depth < 0) throw new ViewRuntimeException("profundidad de vista negativa");
        return depth;
    }

    void lifecycle(String procedure, ComponentInstance inst) {
        lifecycle.add(procedure + " " + inst);
    }
}
