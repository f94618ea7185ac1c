package com.ciro.viewc;

import com.ciro.viewc.ast.ComponentDef;
import com.ciro.viewc.ast.MethodDef;
import com.ciro.viewc.ast.RouterDef;
import com.ciro.viewc.deps.DependencyExtractor;
import com.ciro.viewc.lower.LoweredView;
import com.ciro.viewc.lower.Names;
import com.ciro.viewc.lower.ViewLowering;
import com.ciro.viewc.spi.BuiltinSchema;
import com.ciro.viewc.spi.ComponentOrdering;
import com.ciro.viewc.spi.SchemaResolver;
import com.ciro.viewc.synth.IfSyncSynthesizer;
import com.ciro.viewc.synth.LifecycleSynthesizer;
import com.ciro.viewc.synth.LoopSyncSynthesizer;
import com.ciro.viewc.synth.MethodLowering;
import com.ciro.viewc.synth.ReactiveSynthesizer;
import com.ciro.viewc.synth.RouteSynthesizer;
import com.ciro.viewc.target.Procedure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fachada del compilador: ordena los componentes, baja cada vista y sintetiza
 * sus procedimientos. O salen todos los componentes o ninguno.
 */
public class ViewCompiler {

    private static final Logger log = LoggerFactory.getLogger(ViewCompiler.class);

    private final SchemaResolver schema;
    private final CompilerOptions options;

    public ViewCompiler() {
        this(new BuiltinSchema(), CompilerOptions.defaults());
    }

    public ViewCompiler(SchemaResolver schema, CompilerOptions options) {
        this.schema = schema;
        this.options = options;
    }

    public CompilerOptions options() {
        return options;
    }

    public CompiledProgram compile(List<ComponentDef> defs) {
        long start = System.nanoTime();
        List<ComponentDef> ordered = ComponentOrdering.order(defs);

        Map<String, ComponentDef> byName = new LinkedHashMap<>();
        for (ComponentDef d : ordered) byName.put(d.name(), d);

        List<LoweredComponent> out = new ArrayList<>();
        for (ComponentDef d : ordered) out.add(compile(d, byName));

        log.info("Compilados {} componentes en {} ms", out.size(), (System.nanoTime() - start) / 1_000_000);
        return new CompiledProgram(out);
    }

    private LoweredComponent compile(ComponentDef def, Map<String, ComponentDef> components) {
        if (def.router() != null) {
            for (RouterDef.Route r : def.router().routes()) {
                ComponentDef target = components.get(r.component());
                if (target == null || !target.hasView()) {
                    throw new ViewCompileException(def.name() + ": la ruta '" + r.path()
                            + "' apunta a un componente sin vista o desconocido: " + r.component(), def.line());
                }
            }
        }
        Set<String> types = components.keySet();
        DependencyExtractor deps = new DependencyExtractor(def, schema, types);
        LoweredView view = new ViewLowering(def, components, deps, options).lower();

        ReactiveSynthesizer reactive = new ReactiveSynthesizer(def, view);
        Set<String> updatable = reactive.updatableVars();

        Map<String, Procedure> procedures = new LinkedHashMap<>();
        add(procedures, new LifecycleSynthesizer(def, view, options, reactive.memberWires()).synthesize());
        add(procedures, reactive.siteProcedures());
        add(procedures, reactive.updateProcedures());
        add(procedures, reactive.memberProcedures());
        add(procedures, new IfSyncSynthesizer(view, options).synthesize());
        add(procedures, new LoopSyncSynthesizer(view, options).synthesize());
        add(procedures, new RouteSynthesizer(def).synthesize());

        MethodLowering methods = new MethodLowering(def, view, deps, options, reactive, updatable, components);
        for (MethodDef m : def.methods()) {
            if (procedures.containsKey(m.name())) {
                throw new ViewCompileException(def.name() + ": el método '" + m.name()
                        + "' choca con un procedimiento generado", def.line());
            }
            procedures.put(m.name(), methods.lower(m));
        }

        log.debug("{}: {} procedimientos, {} variables reactivas", def.name(), procedures.size(), updatable.size());
        return new LoweredComponent(def.name(), def, view, procedures, internalState(def, view));
    }

    private static void add(Map<String, Procedure> procedures, List<Procedure> list) {
        for (Procedure p : list) {
            if (procedures.putIfAbsent(p.name(), p) != null) {
                throw new LoweringDefect("procedimiento duplicado: " + p.name());
            }
        }
    }

    private static Map<String, Object> internalState(ComponentDef def, LoweredView view) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(Names.VIEW_MOUNTED, false);
        for (int id : view.ifs().keySet()) out.put(Names.ifState(id), false);
        for (int id : view.loops().keySet()) {
            out.put(Names.loopCount(id), 0);
            out.put(Names.loopMounted(id), false);
        }
        if (def.router() != null) {
            out.put(Names.ROUTE_PATH, "/");
            out.put(Names.ROUTE_CURRENT, "");
        }
        return out;
    }
}
