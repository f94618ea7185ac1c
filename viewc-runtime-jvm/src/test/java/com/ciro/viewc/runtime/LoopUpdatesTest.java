package com.ciro.viewc.runtime;

import com.ciro.viewc.ViewCompiler;
import com.ciro.viewc.ast.ComponentDef;
import com.ciro.viewc.runtime.dom.DomCall;
import com.ciro.viewc.runtime.dom.DomNode;
import com.ciro.viewc.runtime.dom.MemoryDom;
import com.ciro.viewc.target.EventKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.ciro.viewc.ast.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class LoopUpdatesTest {

    private static final ComponentDef ROW = define("Row")
            .param("label", "string", lit(""))
            .method("pick")
            .view(el("li", attrs(on("click", id("pick"))), expr("label")))
            .build();

    private static final ComponentDef LIST = define("List")
            .state("items", "string[]", array(lit("a"), lit("b"), lit("c")))
            .method("add", List.of("v"), exec(callOn(id("items"), "push", id("v"))))
            .method("drop", exec(callOn(id("items"), "pop")))
            .method("wipe", exec(callOn(id("items"), "clear")))
            .method("reset", assign("items", array(lit("x"), lit("y"))))
            .view(el("ul", each("it", id("items"), id("it"), component("Row", prop("label", id("it"))))))
            .build();

    private static final ComponentDef CELL = define("Cell")
            .param("index", "int", lit(0))
            .method("pick")
            .view(el("span", attrs(on("click", id("pick"))), expr("index")))
            .build();

    private static final ComponentDef GRID = define("Grid")
            .state("n", "int", lit(3))
            .method("resize", List.of("v"), assign("n", id("v")))
            .view(el("div", range("i", lit(0), id("n"), component("Cell", prop("index", id("i"))))))
            .build();

    private MemoryDom dom;
    private DomNode body;

    @BeforeEach
    void setUp() {
        dom = new MemoryDom();
        body = dom.createRoot();
    }

    private ComponentHost host(ComponentDef... defs) {
        return new ComponentHost(new ViewCompiler().compile(List.of(defs)), dom);
    }

    private List<String> texts(String tag) {
        return body.findAll(tag).stream().map(DomNode::textContent).collect(Collectors.toList());
    }

    private static long entries(List<String> log, int from, String prefix) {
        return log.subList(from, log.size()).stream().filter(s -> s.startsWith(prefix)).count();
    }

    @Test
    void initialRenderFollowsTheArray() {
        ComponentHost host = host(ROW, LIST);
        ComponentInstance inst = host.mount("List", body);

        assertEquals(List.of("a", "b", "c"), texts("li"));
        assertEquals(3, inst.items(0).size());
        assertEquals(3, inst.field("_loop_0_count"));
        assertEquals(3, dom.handlerCount(EventKind.CLICK));
    }

    @Test
    void pushCreatesOnlyTheNewItem() {
        ComponentHost host = host(ROW, LIST);
        ComponentInstance inst = host.mount("List", body);
        int before = host.lifecycle().size();
        dom.clearTrace();

        host.call(inst, "add", "d");

        assertEquals(1, dom.count(DomCall.Op.CREATE));
        assertEquals(4, dom.count(DomCall.Op.REGISTER));
        assertEquals(0, dom.count(DomCall.Op.REMOVE));
        assertEquals(0, dom.count(DomCall.Op.CLEAR));
        // solo el texto de la fila nueva; las tres anteriores no se tocan
        assertEquals(1, dom.count(DomCall.Op.SET_TEXT));
        assertEquals(0, dom.count(DomCall.Op.SET_PROPERTY));
        assertEquals(1, entries(host.lifecycle(), before, "view Row@"));
        assertEquals(List.of("a", "b", "c", "d"), texts("li"));
        assertEquals(4, inst.field("_loop_0_count"));
    }

    @Test
    void pushOnHtmlItemsTouchesOnlyTheNewNode() {
        ComponentDef tags = define("Tags")
                .state("items", "string[]", array(lit("a"), lit("b"), lit("c")))
                .method("add", List.of("v"), exec(callOn(id("items"), "push", id("v"))))
                .view(el("ul", each("it", id("items"), id("it"), el("li", expr("it")))))
                .build();
        ComponentHost host = host(tags);
        ComponentInstance inst = host.mount("Tags", body);
        dom.clearTrace();

        host.call(inst, "add", "d");

        assertEquals(List.of("a", "b", "c", "d"), texts("li"));
        assertEquals(1, dom.count(DomCall.Op.CREATE));
        assertEquals(1, dom.count(DomCall.Op.SET_TEXT));
    }

    @Test
    void firstRenderRegistersEachHandlerOnce() {
        ComponentDef picker = define("Picker")
                .state("items", "string[]", array(lit("a"), lit("b")))
                .state("picked", "int", lit(0))
                .method("pick", exec(inc(id("picked"))))
                .view(el("button", attrs(on("click", id("pick"))), text("elegir")),
                      el("ul", each("it", id("items"), id("it"), el("li", expr("it")))))
                .build();
        ComponentHost host = host(picker);

        host.mount("Picker", body);

        assertEquals(1, dom.count(DomCall.Op.REGISTER));
        assertEquals(0, dom.count(DomCall.Op.CLEAR));
        assertEquals(1, dom.handlerCount(EventKind.CLICK));
        assertEquals(List.of("a", "b"), texts("li"));
    }

    @Test
    void emptyListRendersWithoutClearing() {
        ComponentDef tags = define("Tags")
                .state("items", "string[]", array())
                .view(el("ul", each("it", id("items"), id("it"), el("li", expr("it")))))
                .build();
        ComponentHost host = host(tags);

        ComponentInstance inst = host.mount("Tags", body);

        assertEquals(0, dom.count(DomCall.Op.CLEAR));
        assertTrue(body.findAll("li").isEmpty());
        assertEquals(0, inst.field("_loop_0_count"));
    }

    @Test
    void popDestroysOnlyTheLastItem() {
        ComponentHost host = host(ROW, LIST);
        ComponentInstance inst = host.mount("List", body);
        int before = host.lifecycle().size();

        host.call(inst, "drop");

        assertEquals(1, entries(host.lifecycle(), before, "_destroy Row@"));
        assertEquals(List.of("a", "b"), texts("li"));
        assertEquals(2, dom.handlerCount(EventKind.CLICK));
        assertEquals(0, dom.danglingHandlers());
        assertEquals(2, inst.field("_loop_0_count"));
    }

    @Test
    void clearEmptiesTheListWithoutLeaks() {
        ComponentHost host = host(ROW, LIST);
        ComponentInstance inst = host.mount("List", body);
        List<ComponentInstance> rows = inst.items(0).stream()
                .flatMap(i -> i.instances().stream()).collect(Collectors.toList());

        host.call(inst, "wipe");

        assertTrue(body.findAll("li").isEmpty());
        assertTrue(inst.items(0).isEmpty());
        assertEquals(0, dom.handlerCount(EventKind.CLICK));
        assertEquals(0, dom.danglingHandlers());
        assertTrue(rows.stream().allMatch(ComponentInstance::isDestroyed));

        host.call(inst, "add", "z");
        assertEquals(List.of("z"), texts("li"));
    }

    @Test
    void reassignmentRebuildsFromTheNewArray() {
        ComponentHost host = host(ROW, LIST);
        ComponentInstance inst = host.mount("List", body);
        int before = host.lifecycle().size();

        host.call(inst, "reset");

        assertEquals(List.of("x", "y"), texts("li"));
        assertEquals(3, entries(host.lifecycle(), before, "_remove_view Row@"));
        assertEquals(2, entries(host.lifecycle(), before, "view Row@"));
        assertEquals(0, dom.danglingHandlers());
        assertEquals(2, dom.handlerCount(EventKind.CLICK));
        assertEquals(2, inst.field("_loop_0_count"));
    }

    @Test
    void growingARangeCreatesOnlyTheTail() {
        ComponentHost host = host(CELL, GRID);
        ComponentInstance inst = host.mount("Grid", body);
        assertEquals(List.of("0", "1", "2"), texts("span"));
        dom.clearTrace();

        host.call(inst, "resize", 5);

        assertEquals(2, dom.count(DomCall.Op.CREATE));
        assertEquals(5, dom.count(DomCall.Op.REGISTER));
        assertEquals(5, inst.items(0).size());
        assertEquals(4, inst.items(0).get(4).instances().get(0).field("index"));
        assertEquals(List.of("0", "1", "2", "3", "4"), texts("span"));
    }

    @Test
    void shrinkingARangeDestroysTheTail() {
        ComponentHost host = host(CELL, GRID);
        ComponentInstance inst = host.mount("Grid", body);
        host.call(inst, "resize", 5);
        int before = host.lifecycle().size();

        host.call(inst, "resize", 1);

        assertEquals(4, entries(host.lifecycle(), before, "_destroy Cell@"));
        assertEquals(List.of("0"), texts("span"));
        assertEquals(1, dom.handlerCount(EventKind.CLICK));
        assertEquals(0, dom.danglingHandlers());
    }

    @Test
    void invertedRangeHasNoItems() {
        ComponentHost host = host(CELL, GRID);
        ComponentInstance inst = host.mount("Grid", body);

        host.call(inst, "resize", -2);
        assertTrue(body.findAll("span").isEmpty());
        assertEquals(0, inst.field("_loop_0_count"));
        assertEquals(0, dom.danglingHandlers());

        host.call(inst, "resize", 3);
        assertEquals(List.of("0", "1", "2"), texts("span"));
        assertEquals(3, inst.items(0).size());
    }

    @Test
    void sameRangeSizeIsANoOp() {
        ComponentHost host = host(CELL, GRID);
        ComponentInstance inst = host.mount("Grid", body);
        dom.clearTrace();

        host.call(inst, "resize", 3);

        assertTrue(dom.trace().isEmpty());
    }

    @Test
    void htmlItemsRefreshInPlace() {
        ComponentDef tags = define("Tags")
                .state("items", "string[]", array(lit("a"), lit("b")))
                .state("suffix", "string", lit("!"))
                .method("shout", assign("suffix", lit("!!")))
                .view(el("ul", each("it", id("items"), id("it"), el("li", expr(tpl(id("it"), id("suffix")))))))
                .build();
        ComponentHost host = host(tags);
        ComponentInstance inst = host.mount("Tags", body);
        assertEquals(List.of("a!", "b!"), texts("li"));
        dom.clearTrace();

        host.call(inst, "shout");

        assertEquals(List.of("a!!", "b!!"), texts("li"));
        assertEquals(0, dom.count(DomCall.Op.CREATE));
        assertEquals(2, dom.count(DomCall.Op.SET_TEXT));
    }

    @Test
    void swappingProjectedInstancesMovesTheirViews() {
        ComponentDef item = define("Item")
                .publicState("key", "int", lit(0))
                .state("name", "string", lit(""))
                .view(el("li", expr("name")))
                .build();
        ComponentDef rows = define("Rows")
                .state("rows", "Item[]", array())
                .method("init",
                        let("a", call("Item")),
                        assignMember(id("a"), "name", lit("A")),
                        exec(callOn(id("rows"), "push", id("a"))),
                        let("b", call("Item")),
                        assignMember(id("b"), "name", lit("B")),
                        exec(callOn(id("rows"), "push", id("b"))))
                .method("swap",
                        let("t", index(id("rows"), lit(0))),
                        assignIndex(id("rows"), lit(0), index(id("rows"), lit(1))),
                        assignIndex(id("rows"), lit(1), id("t")))
                .view(el("ul", each("r", id("rows"), member(id("r"), "key"), project("Item", id("r")))))
                .build();
        ComponentHost host = host(item, rows);
        ComponentInstance inst = host.mount("Rows", body);
        assertEquals(List.of("A", "B"), texts("li"));
        int before = host.lifecycle().size();

        host.call(inst, "swap");

        assertEquals(List.of("B", "A"), texts("li"));
        assertEquals("B", inst.items(0).get(0).instances().get(0).field("name"));
        // las instancias no se recrean
        assertEquals(before, host.lifecycle().size());
    }

    @Test
    void destroyingTheOwnerDestroysItsItems() {
        ComponentHost host = host(ROW, LIST);
        ComponentInstance inst = host.mount("List", body);

        host.destroy(inst);

        assertTrue(body.children().isEmpty());
        assertEquals(0, dom.handlerCount(EventKind.CLICK));
        assertEquals(0, dom.danglingHandlers());
        assertEquals(0, inst.field("_loop_0_count"));
        assertEquals(false, inst.field("_loop_0_mounted"));
    }
}
