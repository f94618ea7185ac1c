package com.ciro.viewc.deps;

import com.ciro.viewc.ast.ComponentDef;
import com.ciro.viewc.spi.BuiltinSchema;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.ciro.viewc.ast.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class DependencyExtractorTest {

    private static final ComponentDef CHILD = define("Child")
            .publicState("value", "int", lit(0))
            .view(el("span", expr("value")))
            .build();

    private static final ComponentDef COUNTER = define("Counter")
            .state("count", "int", lit(0))
            .state("items", "string[]", array())
            .state("name", "string", lit(""))
            .state("child", "Child", call("Child"))
            .method("inc", exec(inc(id("count"))))
            .method("add", List.of("x"), exec(callOn(id("items"), "push", id("x"))))
            .method("peek", exec(callOn(id("items"), "size")))
            .method("shadow", let("count", lit(1)), assign("count", lit(2)))
            .method("both", exec(call("inc")), exec(call("add", lit("a"))))
            .method("rec", exec(call("rec")), assign("name", lit("x")))
            .method("param", List.of("name"), assign("name", lit("y")))
            .view(el("p", expr("count")))
            .build();

    private final DependencyExtractor deps =
            new DependencyExtractor(COUNTER, new BuiltinSchema(), Set.of("Counter", "Child"));

    private Set<String> writesOf(String method) {
        return deps.writes(COUNTER.method(method).orElseThrow());
    }

    @Test
    void readsOnlyDeclaredState() {
        Dependencies d = deps.reads(bin("+", id("count"), id("x")));
        assertEquals(Set.of("count"), d.names());
        assertTrue(d.members().isEmpty());
    }

    @Test
    void shadowedNamesAreNotDependencies() {
        assertTrue(deps.reads(id("count"), Set.of("count")).isEmpty());
    }

    @Test
    void templateReadsEveryPart() {
        Dependencies d = deps.reads(tpl(id("name"), lit(" "), id("count")));
        assertEquals(Set.of("name", "count"), d.names());
    }

    @Test
    void memberReadOfComponentIsTracked() {
        Dependencies d = deps.reads(member(id("child"), "value"));
        assertEquals(Set.of(new MemberDependency("child", "value")), d.members());
        assertEquals(Set.of("child"), d.names());
    }

    @Test
    void incrementWritesItsTarget() {
        assertEquals(Set.of("count"), writesOf("inc"));
    }

    @Test
    void mutatingArrayCallWritesTheArray() {
        assertEquals(Set.of("items"), writesOf("add"));
        assertTrue(writesOf("peek").isEmpty());
    }

    @Test
    void localDeclarationShadowsState() {
        assertTrue(writesOf("shadow").isEmpty());
    }

    @Test
    void parameterShadowsState() {
        assertTrue(writesOf("param").isEmpty());
    }

    @Test
    void writesFollowOwnMethodCalls() {
        assertEquals(Set.of("count", "items"), writesOf("both"));
    }

    @Test
    void recursiveCallsTerminate() {
        assertEquals(Set.of("name"), writesOf("rec"));
    }

    @Test
    void keyedComponentArraysComeFromTheView() {
        ComponentDef list = define("List")
                .state("rows", "Child[]", array())
                .state("other", "int[]", array())
                .view(el("ul",
                        each("r", id("rows"), member(id("r"), "value"), project("Child", id("r"))),
                        each("n", id("other"), id("n"), el("li", expr("n")))))
                .build();
        DependencyExtractor d = new DependencyExtractor(list, new BuiltinSchema(), Set.of("List", "Child"));
        assertEquals(Set.of("rows"), d.keyedComponentArrays());

        // intercambiar instancias no es escritura observable
        assertTrue(d.writes(assignIndex(id("rows"), lit(0), index(id("rows"), lit(1)))).isEmpty());
        assertEquals(Set.of("other"), d.writes(assignIndex(id("other"), lit(0), lit(5))));
    }
}
