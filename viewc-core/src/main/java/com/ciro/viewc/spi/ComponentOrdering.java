package com.ciro.viewc.spi;

import com.ciro.viewc.ViewCompileException;
import com.ciro.viewc.ast.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orden topológico de componentes: cada componente aparece después de los
 * que usa. Un ciclo es un error estructural.
 */
public final class ComponentOrdering {

    private ComponentOrdering() {}

    public static List<ComponentDef> order(List<ComponentDef> defs) {
        Map<String, ComponentDef> byName = new LinkedHashMap<>();
        for (ComponentDef d : defs) {
            if (byName.put(d.name(), d) != null) {
                throw new ViewCompileException("componente duplicado: " + d.name(), d.line());
            }
        }

        List<ComponentDef> out = new ArrayList<>();
        Set<String> done = new HashSet<>();
        Deque<String> path = new ArrayDeque<>();
        for (ComponentDef d : defs) visit(d, byName, done, path, out);
        return out;
    }

    private static void visit(ComponentDef def, Map<String, ComponentDef> byName,
                              Set<String> done, Deque<String> path, List<ComponentDef> out) {
        if (done.contains(def.name())) return;
        if (path.contains(def.name())) {
            List<String> cycle = new ArrayList<>();
            boolean in = false;
            for (var it = path.descendingIterator(); it.hasNext(); ) {
                String n = it.next();
                if (n.equals(def.name())) in = true;
                if (in) cycle.add(n);
            }
            cycle.add(def.name());
            throw new ViewCompileException("dependencia circular entre componentes: " + String.join(" -> ", cycle), def.line());
        }
        path.push(def.name());
        for (String dep : dependencies(def, byName.keySet())) {
            ComponentDef d = byName.get(dep);
            if (d != null) visit(d, byName, done, path, out);
        }
        path.pop();
        done.add(def.name());
        out.add(def);
    }

    /** Tipos de componente que {@code def} usa: en la vista, en el estado y en el router. */
    public static Set<String> dependencies(ComponentDef def, Set<String> known) {
        Set<String> deps = new LinkedHashSet<>();
        for (StateVar s : def.state()) {
            String t = Types.elementType(s.type());
            if (known.contains(t)) deps.add(t);
        }
        for (ComponentParam p : def.params()) {
            String t = Types.elementType(p.type());
            if (known.contains(t)) deps.add(t);
        }
        for (ViewNode n : def.view()) collect(n, deps);
        if (def.router() != null) {
            def.router().routes().forEach(r -> deps.add(r.component()));
        }
        deps.remove(def.name());
        // Autorreferencia también es ciclo
        if (usesItself(def)) deps.add(def.name());
        return deps;
    }

    private static boolean usesItself(ComponentDef def) {
        Set<String> used = new HashSet<>();
        for (ViewNode n : def.view()) collect(n, used);
        return used.contains(def.name());
    }

    private static void collect(ViewNode node, Set<String> out) {
        node.accept(new ViewVisitor<Void>() {
            @Override public Void visitElement(ElementNode n) { n.children().forEach(c -> collect(c, out)); return null; }
            @Override public Void visitComponent(ComponentNode n) { if (n.type() != null) out.add(n.type()); return null; }
            @Override public Void visitIf(IfNode n) {
                n.thenChildren().forEach(c -> collect(c, out));
                n.elseChildren().forEach(c -> collect(c, out));
                return null;
            }
            @Override public Void visitForRange(ForRangeNode n) { n.children().forEach(c -> collect(c, out)); return null; }
            @Override public Void visitEach(EachNode n) { n.children().forEach(c -> collect(c, out)); return null; }
            @Override public Void visitRawHtml(RawHtmlNode n) { return null; }
            @Override public Void visitRoute(RouteNode n) { return null; }
            @Override public Void visitText(TextNode n) { return null; }
            @Override public Void visitExpr(ExprNode n) { return null; }
        });
    }
}
