package com.ciro.viewc.spi;

import com.ciro.viewc.ViewCompileException;
import com.ciro.viewc.ast.ComponentDef;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.ciro.viewc.ast.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class ComponentOrderingTest {

    private static List<String> names(List<ComponentDef> defs) {
        return defs.stream().map(ComponentDef::name).collect(Collectors.toList());
    }

    @Test
    void usedComponentsComeFirst() {
        ComponentDef app = define("App").view(el("main", component("Header"), component("Row"))).build();
        ComponentDef header = define("Header").view(el("h1", text("hola"))).build();
        ComponentDef row = define("Row").view(el("li")).build();

        assertEquals(List.of("Header", "Row", "App"), names(ComponentOrdering.order(List.of(app, header, row))));
    }

    @Test
    void stateTypesAndRoutesCountAsUses() {
        ComponentDef list = define("List").state("rows", "Row[]", array()).view(el("ul")).build();
        ComponentDef shell = define("Shell").route("/", "List").view(el("div", route())).build();
        ComponentDef row = define("Row").view(el("li")).build();

        assertEquals(List.of("Row", "List", "Shell"), names(ComponentOrdering.order(List.of(shell, list, row))));
    }

    @Test
    void cycleIsReportedWithItsPath() {
        ComponentDef a = define("A").view(el("div", component("B"))).build();
        ComponentDef b = define("B").view(el("div", component("A"))).build();

        ViewCompileException ex = assertThrows(ViewCompileException.class,
                () -> ComponentOrdering.order(List.of(a, b)));
        assertTrue(ex.getMessage().contains("A -> B -> A"), ex.getMessage());
    }

    @Test
    void selfUseIsACycle() {
        ComponentDef a = define("A").view(el("div", component("A"))).build();
        assertThrows(ViewCompileException.class, () -> ComponentOrdering.order(List.of(a)));
    }

    @Test
    void duplicateNamesAreRejected() {
        ComponentDef a1 = define("A").view(el("div")).build();
        ComponentDef a2 = define("A").view(el("span")).build();
        assertThrows(ViewCompileException.class, () -> ComponentOrdering.order(List.of(a1, a2)));
    }
}
