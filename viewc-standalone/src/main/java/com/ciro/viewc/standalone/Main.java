package com.ciro.viewc.standalone;

import com.ciro.viewc.CompiledProgram;
import com.ciro.viewc.ViewCompileException;
import com.ciro.viewc.ViewCompiler;
import com.ciro.viewc.runtime.ComponentHost;
import com.ciro.viewc.runtime.ViewRuntimeException;
import com.ciro.viewc.runtime.dom.DomNode;
import com.ciro.viewc.runtime.dom.MemoryDom;
import com.ciro.viewc.spi.BuiltinSchema;
import com.ciro.viewc.store.CaffeineProgramStore;
import com.ciro.viewc.store.LoweredProgramStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code viewc [-Dclave=valor ...] bundle.json [salida]}
 *
 * <p>Compila el bundle y escribe el listado en la salida indicada o en stdout.
 * Con {@code -Dviewc.run=Componente} monta ese componente y escribe su HTML.</p>
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int OK = 0;
    static final int USAGE = 2;
    static final int COMPILE_ERROR = 1;

    private final ObjectMapper mapper = ObjectMapperFactory.create();
    private final LoweredProgramStore store = new CaffeineProgramStore();

    public static void main(String[] args) {
        System.exit(new Main().run(args, System.out));
    }

    int run(String[] args, PrintStream out) {
        Map<String, String> overrides = new LinkedHashMap<>();
        List<String> files = new ArrayList<>();
        for (String a : args) {
            if (a.startsWith("-D") && a.contains("=")) {
                int eq = a.indexOf('=');
                overrides.put(a.substring(2, eq), a.substring(eq + 1));
            } else {
                files.add(a);
            }
        }
        if (files.isEmpty() || files.size() > 2) {
            out.println("uso: viewc [-Dclave=valor ...] bundle.json [salida]");
            return USAGE;
        }

        Settings settings = Settings.load(overrides);
        try {
            Bundle bundle = new BundleReader(mapper).read(Path.of(files.get(0)));
            CompiledProgram program = compile(bundle, settings);
            String run = settings.get(Settings.RUN);
            String listing = run != null && !run.isBlank()
                    ? render(program, run.trim())
                    : new ProgramWriter(mapper).write(program, settings.output());
            if (files.size() == 2) {
                Files.writeString(Path.of(files.get(1)), listing, StandardCharsets.UTF_8);
                log.info("Programa de {} escrito en {}", bundle.name(), files.get(1));
            } else {
                out.print(listing);
            }
            return OK;
        } catch (ViewCompileException e) {
            log.error("Error de compilación: {}", e.getMessage());
            return COMPILE_ERROR;
        } catch (ViewRuntimeException e) {
            log.error("Error al montar: {}", e.getMessage());
            return COMPILE_ERROR;
        } catch (UncheckedIOException | IOException e) {
            log.error("Error de E/S: {}", e.getMessage(), e);
            return COMPILE_ERROR;
        }
    }

    /** Monta {@code component} en un DOM en memoria y devuelve el HTML resultante. */
    String render(CompiledProgram program, String component) {
        if (program.component(component).isEmpty()) {
            throw new ViewRuntimeException("componente desconocido: " + component);
        }
        MemoryDom dom = new MemoryDom();
        DomNode body = dom.createRoot();
        new ComponentHost(program, dom).mount(component, body);
        if (dom.danglingHandlers() > 0) log.warn("{} manejadores colgantes al montar {}", dom.danglingHandlers(), component);
        return body.toHtml() + System.lineSeparator();
    }

    CompiledProgram compile(Bundle bundle, Settings settings) {
        CompiledProgram cached = store.get(bundle.name());
        if (cached != null) return cached;
        log.info("Compilando bundle {} ({} componentes)", bundle.name(), bundle.components().size());
        CompiledProgram program = new ViewCompiler(new BuiltinSchema(), settings.compilerOptions())
                .compile(bundle.components());
        store.put(bundle.name(), program);
        return program;
    }
}
