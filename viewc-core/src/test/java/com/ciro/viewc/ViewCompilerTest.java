package com.ciro.viewc;

import com.ciro.viewc.ast.ComponentDef;
import com.ciro.viewc.spi.BuiltinSchema;
import com.ciro.viewc.target.Instr;
import com.ciro.viewc.target.ProgramPrinter;
import com.ciro.viewc.target.Procedure;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.ciro.viewc.ast.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class ViewCompilerTest {

    private static final ComponentDef ROW = define("Row")
            .param("label", "string", lit(""))
            .view(el("li", expr("label")))
            .build();

    private static final ComponentDef APP = define("App")
            .state("flag", "bool", lit(false))
            .state("items", "string[]", array())
            .method("init", assign("flag", lit(true)))
            .method("toggle", assign("flag", not(id("flag"))))
            .view(el("main",
                    when(id("flag"), el("b", attrs(on("click", id("toggle"))))),
                    el("ul", each("it", id("items"), id("it"), component("Row", prop("label", id("it")))))))
            .build();

    @Test
    void compilesInTopologicalOrder() {
        CompiledProgram program = new ViewCompiler().compile(List.of(APP, ROW));
        List<String> names = program.components().stream().map(LoweredComponent::name).collect(Collectors.toList());
        assertEquals(List.of("Row", "App"), names);
        assertThrows(IllegalArgumentException.class, () -> program.require("Nope"));
    }

    @Test
    void everyComponentGetsItsLifecycle() {
        LoweredComponent app = new ViewCompiler().compile(List.of(APP, ROW)).require("App");
        for (String name : List.of("view", "_rebind", "_destroy", "_remove_view", "_sync_if_0", "_sync_loop_0", "toggle")) {
            assertTrue(app.hasProcedure(name), name);
        }
        assertEquals(List.of("bulk"), app.procedure("_remove_view").orElseThrow().params());
    }

    @Test
    void internalFieldsStartUnmounted() {
        LoweredComponent app = new ViewCompiler().compile(List.of(APP, ROW)).require("App");
        assertEquals(false, app.internalState().get("_view_mounted"));
        assertEquals(false, app.internalState().get("_if_0_state"));
        assertEquals(0, app.internalState().get("_loop_0_count"));
        assertEquals(false, app.internalState().get("_loop_0_mounted"));
        assertFalse(app.internalState().containsKey("_route_path"));
    }

    @Test
    void viewRunsInitBeforeBuildingAndFlushesAfter() {
        Procedure view = new ViewCompiler().compile(List.of(APP, ROW)).require("App").procedure("view").orElseThrow();
        List<Instr> body = view.body();

        assertEquals(new Instr.ViewDepth(1), body.get(0));
        assertEquals(new Instr.Call("init"), body.get(1));
        assertTrue(body.get(2) instanceof Instr.CreateNode);
        int flush = body.indexOf(new Instr.Flush());
        assertEquals(new Instr.ViewDepth(-1), body.get(flush - 1));
        assertEquals(new Instr.Assign(id("_view_mounted"), lit(true)), body.get(flush + 1));
        assertTrue(body.stream().anyMatch(i -> i instanceof Instr.RegisterMasked));
    }

    @Test
    void flushCanBeTurnedOff() {
        CompilerOptions options = CompilerOptions.defaults().withEmitFlush(false);
        Procedure view = new ViewCompiler(new BuiltinSchema(), options)
                .compile(List.of(APP, ROW)).require("App").procedure("view").orElseThrow();
        assertTrue(view.body().stream().noneMatch(i -> i instanceof Instr.Flush || i instanceof Instr.ViewDepth));
    }

    @Test
    void scopeAttributeIsOptional() {
        String on = ProgramPrinter.print(new ViewCompiler().compile(List.of(ROW)).require("Row").procedures().values());
        assertTrue(on.contains("data-scope"));

        CompilerOptions off = CompilerOptions.defaults().withScopeAttribute(null);
        String printed = ProgramPrinter.print(new ViewCompiler(new BuiltinSchema(), off)
                .compile(List.of(ROW)).require("Row").procedures().values());
        assertFalse(printed.contains("data-scope"));
    }

    @Test
    void methodCannotShadowGeneratedProcedure() {
        ComponentDef bad = define("Bad")
                .state("x", "int", lit(0))
                .method("update_x", assign("x", lit(1)))
                .view(el("p", expr("x")))
                .build();
        ViewCompileException ex = assertThrows(ViewCompileException.class,
                () -> new ViewCompiler().compile(List.of(bad)));
        assertTrue(ex.getMessage().contains("choca"), ex.getMessage());
    }

    @Test
    void routeMustPointToAComponentWithView() {
        ComponentDef shell = define("Shell").route("/", "Missing").view(el("div", route())).build();
        assertThrows(ViewCompileException.class, () -> new ViewCompiler().compile(List.of(shell)));
    }

    @Test
    void routerAddsRouteProcedures() {
        ComponentDef home = define("Home").view(el("h1", text("inicio"))).build();
        ComponentDef shell = define("Shell").route("/", "Home").view(el("div", route())).build();
        LoweredComponent c = new ViewCompiler().compile(List.of(shell, home)).require("Shell");

        assertTrue(c.hasProcedure("_sync_route"));
        assertEquals(List.of("path"), c.procedure("navigate").orElseThrow().params());
        assertEquals("/", c.internalState().get("_route_path"));
        List<Instr> view = c.procedure("view").orElseThrow().body();
        assertEquals(new Instr.Call("_sync_route"), view.get(view.size() - 1));
    }

    @Test
    void oneBadComponentFailsTheWholeProgram() {
        ComponentDef bad = define("Bad").view(el("div", component("Nope"))).build();
        assertThrows(ViewCompileException.class, () -> new ViewCompiler().compile(List.of(ROW, bad)));
    }
}
