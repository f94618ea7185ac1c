package com.ciro.viewc.store;

import com.ciro.viewc.CompiledProgram;
import com.ciro.viewc.ViewCompiler;
import com.ciro.viewc.ast.ComponentDef;
import com.ciro.viewc.runtime.ComponentHost;
import com.ciro.viewc.runtime.dom.MemoryDom;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ciro.viewc.ast.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class CaffeineProgramStoreTest {

    private static final ComponentDef HELLO = define("Hello").view(el("p", text("hola"))).build();

    @Test
    void keepsProgramsByBundle() {
        CaffeineProgramStore store = new CaffeineProgramStore();
        CompiledProgram program = new ViewCompiler().compile(List.of(HELLO));

        store.put("demo", program);

        assertSame(program, store.get("demo"));
        assertNull(store.get("otro"));
        assertEquals(1, store.size());

        store.remove("demo");
        assertNull(store.get("demo"));
        assertEquals(0, store.size());
    }

    @Test
    void sizeLimitEvicts() {
        CaffeineProgramStore store = new CaffeineProgramStore(1, 30);
        ViewCompiler compiler = new ViewCompiler();
        for (int i = 0; i < 10; i++) store.put("b" + i, compiler.compile(List.of(HELLO)));

        assertTrue(store.size() <= 1, "tamaño " + store.size());
    }

    @Test
    void hostReusesStoredProgram() {
        CaffeineProgramStore store = new CaffeineProgramStore();
        ViewCompiler compiler = new ViewCompiler();

        ComponentHost first = ComponentHost.load("demo", List.of(HELLO), compiler, store, new MemoryDom());
        ComponentHost second = ComponentHost.load("demo", List.of(HELLO), compiler, store, new MemoryDom());

        assertSame(first.program(), second.program());
        assertEquals(1, store.size());
    }
}
