package com.ciro.viewc.lower;

import com.ciro.viewc.CompilerOptions;
import com.ciro.viewc.ViewCompileException;
import com.ciro.viewc.ast.ComponentDef;
import com.ciro.viewc.ast.ViewNode;
import com.ciro.viewc.deps.DependencyExtractor;
import com.ciro.viewc.spi.BuiltinSchema;
import com.ciro.viewc.target.EventKind;
import com.ciro.viewc.target.NodeRef;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.ciro.viewc.ast.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class ViewLoweringTest {

    private static final ComponentDef ROW = define("Row")
            .param("label", "string", lit(""))
            .refParam("selected", "int")
            .view(el("li", expr("label")))
            .build();

    private static final ComponentDef EMPTY = define("Empty").build();

    private static LoweredView lower(ComponentDef def) {
        return lower(def, CompilerOptions.defaults());
    }

    private static LoweredView lower(ComponentDef def, CompilerOptions options) {
        Map<String, ComponentDef> byName = new LinkedHashMap<>();
        byName.put(ROW.name(), ROW);
        byName.put(EMPTY.name(), EMPTY);
        byName.put(def.name(), def);
        DependencyExtractor deps = new DependencyExtractor(def, new BuiltinSchema(), byName.keySet());
        return new ViewLowering(def, byName, deps, options).lower();
    }

    private static void assertRejected(ComponentDef def, String fragment) {
        ViewCompileException ex = assertThrows(ViewCompileException.class, () -> lower(def));
        assertTrue(ex.getMessage().contains(fragment), ex.getMessage());
    }

    @Test
    void repeatedVariableInOneSiteGivesOneSite() {
        ComponentDef def = define("Pair")
                .state("a", "int", lit(1))
                .view(el("p", expr("a"), text(" / "), expr("a")))
                .build();
        LoweredView v = lower(def);

        assertEquals(2, v.bindings().size());
        assertEquals(1, v.sites().size());
        Site site = v.sites().get(0);
        assertEquals(SiteKind.TEXT, site.kind());
        assertEquals("_update_el0_text", site.procedureName());
        assertEquals(Set.of("a"), site.deps().names());
    }

    @Test
    void templateAttributeMergesDependencies() {
        ComponentDef def = define("Tag")
                .state("a", "string", lit("x"))
                .state("b", "string", lit("y"))
                .view(el("div", attrs(attr("class", tpl(id("a"), lit("-"), id("b"))), attr("id", "fijo"))))
                .build();
        LoweredView v = lower(def);

        assertEquals(2, v.bindings().size());
        assertEquals(1, v.sites().size());
        assertEquals(Set.of("a", "b"), v.sites().get(0).deps().names());
        assertEquals("_update_el0_class", v.sites().get(0).procedureName());
    }

    @Test
    void valueAttributeIsAProperty() {
        ComponentDef def = define("Input")
                .state("text", "string", lit(""))
                .view(el("input", attrs(attr("value", id("text")))))
                .build();
        assertEquals(SiteKind.PROPERTY, lower(def).sites().get(0).kind());
    }

    @Test
    void nodeIdsFollowSourceOrder() {
        ComponentDef def = define("Toggle")
                .state("flag", "bool", lit(false))
                .view(el("div", when(id("flag"), nodes(el("b")), nodes(el("i")))))
                .build();
        LoweredView v = lower(def);

        assertEquals(3, v.nodeCount());
        IfRegion r = v.ifRegion(0);
        assertEquals(List.of(1), r.then.roots);
        assertEquals(List.of(2), r.otherwise.roots);
        assertEquals(Set.of("flag"), r.deps.names());
        assertEquals(List.of(0), v.root().roots);
    }

    @Test
    void topLevelIfPlacesItsAnchorInTheRoot() {
        ComponentDef def = define("Maybe")
                .state("flag", "bool", lit(true))
                .view(when(id("flag"), el("b")))
                .build();
        LoweredView v = lower(def);

        assertTrue(v.root().rootSlots.contains(NodeRef.ifAnchor(0)));
        assertEquals(List.of(0), v.root().ifs);
    }

    @Test
    void nestedIfCarriesOuterGuard() {
        ComponentDef def = define("Nested")
                .state("a", "bool", lit(true))
                .state("b", "bool", lit(true))
                .state("t", "string", lit(""))
                .view(when(id("a"), when(id("b"), el("p", expr("t")))))
                .build();
        LoweredView v = lower(def);

        assertEquals(List.of(new BranchKey(0, true)), v.ifRegion(1).guards);
        assertEquals(List.of(new BranchKey(0, true), new BranchKey(1, true)), v.sites().get(0).guards());
        assertEquals(List.of(1), v.ifRegion(0).then.ifs);
    }

    @Test
    void loopAsOnlyChildUsesItsParent() {
        ComponentDef def = define("List")
                .state("items", "string[]", array())
                .view(el("ul", each("it", id("items"), id("it"), el("li", expr("it")))))
                .build();
        LoopRegion r = lower(def).loop(0);

        assertTrue(r.isOnlyChild());
        assertEquals(0, r.parentId);
        assertEquals(LoopRegion.Strategy.KEYED, r.strategy);
        assertEquals(LoopRegion.ItemKind.HTML, r.itemKind());
        assertEquals(Set.of("items"), r.countDeps.names());
        // la variable del bucle no es estado
        assertTrue(r.itemDeps.isEmpty());
        assertFalse(r.update.isEmpty());
    }

    @Test
    void loopWithSiblingsGetsAnAnchor() {
        ComponentDef def = define("List")
                .state("items", "string[]", array())
                .view(el("ul", el("li", text("cabecera")), each("it", id("items"), id("it"), el("li", expr("it")))))
                .build();
        LoopRegion r = lower(def).loop(0);
        assertFalse(r.isOnlyChild());
    }

    @Test
    void onlyChildDetectionCanBeTurnedOff() {
        ComponentDef def = define("List")
                .state("items", "string[]", array())
                .view(el("ul", each("it", id("items"), id("it"), el("li", expr("it")))))
                .build();
        LoopRegion r = lower(def, CompilerOptions.defaults().withDetectOnlyChild(false)).loop(0);
        assertFalse(r.isOnlyChild());
    }

    @Test
    void rangeLoopDependsOnItsBounds() {
        ComponentDef def = define("Grid")
                .state("n", "int", lit(3))
                .view(el("div", range("i", lit(0), id("n"), component("Row", prop("label", call("str", id("i")))))))
                .build();
        LoopRegion r = lower(def).loop(0);

        assertEquals(LoopRegion.Strategy.RANGE, r.strategy);
        assertEquals(Set.of("n"), r.countDeps.names());
        assertEquals(LoopRegion.ItemKind.COMPONENT, r.itemKind());
    }

    @Test
    void ifInsideLoopIsNotARegion() {
        ComponentDef def = define("List")
                .state("items", "int[]", array())
                .view(el("ul", each("it", id("items"), id("it"),
                        el("li", when(bin(">", id("it"), lit(0)), el("b"))))))
                .build();
        LoweredView v = lower(def);

        assertTrue(v.ifs().isEmpty());
        assertEquals(1, v.loops().size());
    }

    @Test
    void handlersFillMasksAndOverflow() {
        List<ViewNode> buttons = new ArrayList<>();
        for (int i = 0; i < 70; i++) buttons.add(el("button", attrs(on("click", id("go")))));
        ComponentDef def = define("Many")
                .method("go")
                .view(el("div", buttons.toArray(new ViewNode[0])))
                .build();
        LoweredView v = lower(def);

        assertEquals(70, v.handlers().size());
        assertTrue(v.masks().has(EventKind.CLICK));
        assertFalse(v.masks().has(EventKind.INPUT));
        assertFalse(v.masks().isSet(EventKind.CLICK, 0));
        assertTrue(v.masks().isSet(EventKind.CLICK, 1));
        assertTrue(v.masks().isSet(EventKind.CLICK, 63));
        assertEquals(List.of(64, 65, 66, 67, 68, 69, 70), v.masks().overflow(EventKind.CLICK));
    }

    @Test
    void dynamicPropsAreTrackedPerChild() {
        ComponentDef def = define("Parent")
                .state("name", "string", lit("x"))
                .state("sel", "int", lit(0))
                .view(el("ul", component("Row", prop("label", id("name")), refProp("selected", "sel"))))
                .build();
        LoweredView v = lower(def);

        assertEquals(2, v.childProps().size());
        ChildProp label = v.childProps().get(0);
        assertFalse(label.reference());
        assertEquals(Set.of("name"), label.deps().names());
        assertTrue(v.childProps().get(1).reference());
        assertEquals(1, v.wires().size());
        assertEquals("update_sel", v.wires().get(0).procedure());
    }

    @Test
    void rejectsUnknownComponent() {
        assertRejected(define("A").view(el("div", component("Nope"))).build(), "desconocido");
    }

    @Test
    void rejectsComponentWithoutView() {
        assertRejected(define("A").view(el("div", component("Empty"))).build(), "no declara vista");
    }

    @Test
    void rejectsUndeclaredProp() {
        assertRejected(define("A").view(component("Row", prop("color", lit("red")))).build(), "no declarada");
    }

    @Test
    void rejectsReferenceMismatch() {
        ComponentDef def = define("A").state("s", "int", lit(0))
                .view(component("Row", prop("selected", id("s"))))
                .build();
        assertRejected(def, "por referencia");
    }

    @Test
    void rejectsKeylessEach() {
        ComponentDef def = define("A").state("items", "int[]", array())
                .view(el("ul", each("it", id("items"), null, el("li"))))
                .build();
        assertRejected(def, "sin clave");
    }

    @Test
    void rejectsRouteWithoutRouter() {
        assertRejected(define("A").view(el("div", route())).build(), "sin router");
    }

    @Test
    void rejectsElementsInsideRawHtml() {
        assertRejected(define("A").view(raw(el("b"))).build(), "HTML crudo");
    }

    @Test
    void rejectsUnknownEvent() {
        assertRejected(define("A").method("go").view(el("div", attrs(on("hover", id("go"))))).build(), "evento desconocido");
    }
}
