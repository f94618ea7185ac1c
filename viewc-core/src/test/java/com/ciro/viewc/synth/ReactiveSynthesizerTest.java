package com.ciro.viewc.synth;

import com.ciro.viewc.LoweredComponent;
import com.ciro.viewc.ViewCompiler;
import com.ciro.viewc.ast.ComponentDef;
import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.target.Instr;
import com.ciro.viewc.target.Procedure;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.ciro.viewc.ast.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class ReactiveSynthesizerTest {

    private static final ComponentDef ROW = define("Row")
            .param("label", "string", lit(""))
            .view(el("li", expr("label")))
            .build();

    private static final ComponentDef CHILD = define("Child")
            .publicState("value", "int", lit(0))
            .view(el("span", expr("value")))
            .build();

    private static LoweredComponent compile(ComponentDef def) {
        return new ViewCompiler().compile(List.of(ROW, CHILD, def)).require(def.name());
    }

    /** Nombres de lo que invoca un cuerpo, entrando en las ramas. */
    static List<String> invoked(List<Instr> body) {
        List<String> out = new ArrayList<>();
        for (Instr i : body) {
            if (i instanceof Instr.Call c) out.add(c.procedure());
            else if (i instanceof Instr.CallChild c) out.add(c.child() + "." + c.procedure());
            else if (i instanceof Instr.SetProp p) out.add(p.child() + "." + p.prop() + "=");
            else if (i instanceof Instr.Branch b) {
                out.addAll(invoked(b.then()));
                out.addAll(invoked(b.otherwise()));
            }
        }
        return out;
    }

    private static Procedure proc(LoweredComponent c, String name) {
        return c.procedure(name).orElseThrow(() -> new AssertionError("falta " + name));
    }

    @Test
    void updateCallsEachSiteOnce() {
        ComponentDef def = define("Pair")
                .state("a", "int", lit(1))
                .view(el("p", expr("a"), text(" / "), expr("a")),
                      el("span", attrs(attr("title", id("a")))))
                .build();
        Procedure update = proc(compile(def), "update_a");

        assertEquals(Procedure.Kind.UPDATE, update.kind());
        assertEquals(1, update.body().size());
        Instr.Branch mounted = (Instr.Branch) update.body().get(0);
        assertEquals(new Expr.Ident("_view_mounted"), mounted.condition());
        assertEquals(List.of("_update_el0_text", "_update_el1_title"), invoked(update.body()));
    }

    @Test
    void siteProcedureWritesOnlyItsSite() {
        ComponentDef def = define("Counter")
                .state("count", "int", lit(0))
                .view(el("p", expr("count")))
                .build();
        Procedure site = proc(compile(def), "_update_el0_text");

        assertEquals(Procedure.Kind.SITE, site.kind());
        assertEquals(1, site.body().size());
        assertTrue(site.body().get(0) instanceof Instr.SetText);
    }

    @Test
    void sitesInsideBranchesAreGuarded() {
        ComponentDef def = define("Maybe")
                .state("flag", "bool", lit(false))
                .state("t", "string", lit(""))
                .view(when(id("flag"), el("p", expr("t"))))
                .build();
        LoweredComponent c = compile(def);

        Instr.Branch mounted = (Instr.Branch) proc(c, "update_t").body().get(0);
        Instr.Branch guard = (Instr.Branch) mounted.then().get(0);
        assertEquals(new Expr.Ident("_if_0_state"), guard.condition());
        assertEquals(List.of("_update_el0_text"), invoked(guard.then()));

        assertEquals(List.of("_sync_if_0"), invoked(proc(c, "update_flag").body()));
    }

    @Test
    void elseBranchGuardIsNegated() {
        ComponentDef def = define("Maybe")
                .state("flag", "bool", lit(false))
                .state("t", "string", lit(""))
                .view(when(id("flag"), nodes(el("b")), nodes(el("p", expr("t")))))
                .build();
        Instr.Branch mounted = (Instr.Branch) proc(compile(def), "update_t").body().get(0);
        Instr.Branch guard = (Instr.Branch) mounted.then().get(0);
        assertEquals(not(id("_if_0_state")), guard.condition());
    }

    @Test
    void observableVariableNotifiesEvenWithoutView() {
        ComponentDef def = define("Source")
                .publicState("count", "int", lit(0))
                .state("hidden", "int", lit(0))
                .view(el("div"))
                .build();
        LoweredComponent c = compile(def);

        assertEquals(List.of(new Instr.Notify("onCountChange")), proc(c, "update_count").body());
        assertFalse(c.hasProcedure("update_hidden"));
    }

    @Test
    void keyedLoopSyncCoversItemRefresh() {
        ComponentDef def = define("List")
                .state("items", "string[]", array())
                .state("suffix", "string", lit("!"))
                .view(el("ul", each("it", id("items"), id("it"), el("li", expr(tpl(id("it"), id("suffix")))))))
                .build();
        LoweredComponent c = compile(def);

        assertEquals(List.of("_sync_loop_0"), invoked(proc(c, "update_items").body()));
        assertEquals(List.of("_update_loop_0_items"), invoked(proc(c, "update_suffix").body()));
    }

    @Test
    void childPropIsCopiedThenChildUpdated() {
        ComponentDef def = define("Parent")
                .state("name", "string", lit("x"))
                .view(el("ul", component("Row", prop("label", id("name")))))
                .build();
        List<String> calls = invoked(proc(compile(def), "update_name").body());
        assertEquals(Arrays.asList("_row_0.label=", "_row_0.update_label"), calls);
    }

    @Test
    void memberReadsGetTheirOwnUpdateAndWire() {
        ComponentDef def = define("Parent")
                .state("child", "Child", call("Child"))
                .view(el("p", expr(member(id("child"), "value"))), project("Child", id("child")))
                .build();
        LoweredComponent c = compile(def);

        Procedure member = proc(c, "_update_child_value");
        assertEquals(Procedure.Kind.MEMBER_UPDATE, member.kind());
        assertEquals(List.of("_update_el0_text"), invoked(member.body()));

        boolean wired = proc(c, "_rebind").body().stream()
                .anyMatch(i -> i instanceof Instr.WireCallback w
                        && w.callback().equals("onValueChange") && w.procedure().equals("_update_child_value"));
        assertTrue(wired);
    }
}
