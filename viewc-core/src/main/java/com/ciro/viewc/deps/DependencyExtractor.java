package com.ciro.viewc.deps;

import com.ciro.viewc.ast.*;
import com.ciro.viewc.spi.MethodMapping;
import com.ciro.viewc.spi.SchemaResolver;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Lecturas y escrituras de estado de un componente.
 *
 * <p>Solo se reportan nombres declarados como estado o prop. Variables de
 * bucle, parámetros y locales los ocultan, así que nunca cuentan.</p>
 */
public class DependencyExtractor {

    private final ComponentDef def;
    private final SchemaResolver schema;
    private final Set<String> componentTypes;
    private final Set<String> keyedComponentArrays;

    public DependencyExtractor(ComponentDef def, SchemaResolver schema, Set<String> componentTypes) {
        this.def = def;
        this.schema = schema;
        this.componentTypes = componentTypes;
        this.keyedComponentArrays = findKeyedComponentArrays(def, componentTypes);
    }

    /** Arrays de componentes que respaldan un bucle con clave en la vista. */
    public Set<String> keyedComponentArrays() {
        return keyedComponentArrays;
    }

    public boolean isComponentType(String type) {
        return type != null && componentTypes.contains(type);
    }

    // ------------------------------------------------------------------ lecturas

    public Dependencies reads(Expr e) {
        return reads(e, Set.of());
    }

    public Dependencies reads(Expr e, Set<String> shadowed) {
        Set<String> names = new LinkedHashSet<>();
        Set<MemberDependency> members = new LinkedHashSet<>();
        collectReads(e, shadowed, names, members);
        return new Dependencies(names, members);
    }

    private void collectReads(Expr e, Set<String> shadowed, Set<String> names, Set<MemberDependency> members) {
        if (e == null || e instanceof Expr.Literal) return;
        if (e instanceof Expr.Ident id) {
            if (isState(id.name(), shadowed)) names.add(id.name());
        } else if (e instanceof Expr.Member m) {
            if (m.target() instanceof Expr.Ident obj && isState(obj.name(), shadowed)
                    && isComponentType(def.typeOf(obj.name()))) {
                members.add(new MemberDependency(obj.name(), m.name()));
            }
            collectReads(m.target(), shadowed, names, members);
        } else if (e instanceof Expr.Index ix) {
            collectReads(ix.target(), shadowed, names, members);
            collectReads(ix.index(), shadowed, names, members);
        } else if (e instanceof Expr.Unary u) {
            collectReads(u.operand(), shadowed, names, members);
        } else if (e instanceof Expr.Binary b) {
            collectReads(b.left(), shadowed, names, members);
            collectReads(b.right(), shadowed, names, members);
        } else if (e instanceof Expr.Call c) {
            collectReads(c.receiver(), shadowed, names, members);
            for (Expr a : c.args()) collectReads(a, shadowed, names, members);
        } else if (e instanceof Expr.StringTemplate t) {
            for (Expr p : t.parts()) collectReads(p, shadowed, names, members);
        } else if (e instanceof Expr.ArrayLit a) {
            for (Expr p : a.items()) collectReads(p, shadowed, names, members);
        }
    }

    // ------------------------------------------------------------------ escrituras

    /** Variables de estado que escribe un método, incluidos los métodos propios que llama. */
    public Set<String> writes(MethodDef method) {
        Set<String> out = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();
        visited.add(method.name());
        writes(method.body(), new HashSet<>(method.params()), out, visited);
        return out;
    }

    public Set<String> writes(List<Stmt> body) {
        Set<String> out = new LinkedHashSet<>();
        writes(body, new HashSet<>(), out, new HashSet<>());
        return out;
    }

    public Set<String> writes(Stmt stmt) {
        return writes(List.of(stmt));
    }

    private void writes(List<Stmt> body, Set<String> scope, Set<String> out, Set<String> visited) {
        Set<String> local = new HashSet<>(scope);
        for (Stmt s : body) write(s, local, out, visited);
    }

    private void write(Stmt s, Set<String> scope, Set<String> out, Set<String> visited) {
        if (s instanceof Stmt.VarDecl v) {
            mutations(v.init(), scope, out, visited);
            scope.add(v.name());
        } else if (s instanceof Stmt.Assign a) {
            mutations(a.value(), scope, out, visited);
            if (isState(a.name(), scope)) out.add(a.name());
        } else if (s instanceof Stmt.IndexAssign ia) {
            mutations(ia.target(), scope, out, visited);
            mutations(ia.index(), scope, out, visited);
            mutations(ia.value(), scope, out, visited);
            String root = Expr.rootName(ia.target());
            // Intercambiar instancias ya pintadas no necesita resync
            boolean keyedSwap = ia.target() instanceof Expr.Ident && keyedComponentArrays.contains(root);
            if (root != null && isState(root, scope) && !keyedSwap) out.add(root);
        } else if (s instanceof Stmt.MemberAssign ma) {
            mutations(ma.target(), scope, out, visited);
            mutations(ma.value(), scope, out, visited);
            String root = Expr.rootName(ma.target());
            if (root != null && isState(root, scope)) out.add(root);
        } else if (s instanceof Stmt.ExprStmt es) {
            mutations(es.expr(), scope, out, visited);
        } else if (s instanceof Stmt.Block b) {
            writes(b.body(), scope, out, visited);
        } else if (s instanceof Stmt.If i) {
            mutations(i.condition(), scope, out, visited);
            writes(i.then(), scope, out, visited);
            writes(i.otherwise(), scope, out, visited);
        } else if (s instanceof Stmt.ForRange f) {
            mutations(f.start(), scope, out, visited);
            mutations(f.end(), scope, out, visited);
            Set<String> inner = new HashSet<>(scope);
            inner.add(f.var());
            writes(f.body(), inner, out, visited);
        } else if (s instanceof Stmt.ForEach f) {
            mutations(f.iterable(), scope, out, visited);
            Set<String> inner = new HashSet<>(scope);
            inner.add(f.var());
            writes(f.body(), inner, out, visited);
        } else if (s instanceof Stmt.Return r) {
            mutations(r.value(), scope, out, visited);
        }
    }

    /** Escrituras escondidas en expresiones: {@code x++}, {@code arr.push(v)}, llamadas a métodos propios. */
    private void mutations(Expr e, Set<String> scope, Set<String> out, Set<String> visited) {
        if (e == null || e instanceof Expr.Literal || e instanceof Expr.Ident) return;
        if (e instanceof Expr.Unary u) {
            if ("++".equals(u.op()) || "--".equals(u.op())) {
                String root = Expr.rootName(u.operand());
                if (root != null && isState(root, scope)) out.add(root);
            }
            mutations(u.operand(), scope, out, visited);
        } else if (e instanceof Expr.Call c) {
            if (c.receiver() != null) {
                String root = Expr.rootName(c.receiver());
                if (root != null && isState(root, scope) && isMutatingCall(c)) out.add(root);
                mutations(c.receiver(), scope, out, visited);
            } else {
                def.method(c.name()).ifPresent(m -> {
                    if (visited.add(m.name())) {
                        writes(m.body(), new HashSet<>(m.params()), out, visited);
                    }
                });
            }
            for (Expr a : c.args()) mutations(a, scope, out, visited);
        } else if (e instanceof Expr.Member m) {
            mutations(m.target(), scope, out, visited);
        } else if (e instanceof Expr.Index ix) {
            mutations(ix.target(), scope, out, visited);
            mutations(ix.index(), scope, out, visited);
        } else if (e instanceof Expr.Binary b) {
            mutations(b.left(), scope, out, visited);
            mutations(b.right(), scope, out, visited);
        } else if (e instanceof Expr.StringTemplate t) {
            for (Expr p : t.parts()) mutations(p, scope, out, visited);
        } else if (e instanceof Expr.ArrayLit a) {
            for (Expr p : a.items()) mutations(p, scope, out, visited);
        }
    }

    private boolean isMutatingCall(Expr.Call c) {
        String type = staticType(c.receiver());
        if (type == null || schema.isHandle(type)) return false;
        return schema.lookup(type, c.name()).map(MethodMapping::isMutating).orElse(false);
    }

    /** Tipo estático de un receptor simple ({@code x} o {@code arr[i]}). */
    private String staticType(Expr e) {
        if (e instanceof Expr.Ident id) return def.typeOf(id.name());
        if (e instanceof Expr.Index ix) {
            String t = staticType(ix.target());
            return Types.isArray(t) ? Types.elementType(t) : null;
        }
        return null;
    }

    private boolean isState(String name, Set<String> shadowed) {
        return !shadowed.contains(name) && def.declares(name);
    }

    // ------------------------------------------------------------------

    private static Set<String> findKeyedComponentArrays(ComponentDef def, Set<String> componentTypes) {
        Set<String> out = new LinkedHashSet<>();
        for (ViewNode n : def.view()) scanEach(n, def, componentTypes, out);
        return out;
    }

    private static void scanEach(ViewNode node, ComponentDef def, Set<String> componentTypes, Set<String> out) {
        if (node instanceof EachNode each) {
            if (each.iterable() instanceof Expr.Ident arr) {
                String t = def.typeOf(arr.name());
                if (Types.isArray(t) && componentTypes.contains(Types.elementType(t))) out.add(arr.name());
            }
            each.children().forEach(c -> scanEach(c, def, componentTypes, out));
        } else if (node instanceof ElementNode el) {
            el.children().forEach(c -> scanEach(c, def, componentTypes, out));
        } else if (node instanceof IfNode i) {
            i.thenChildren().forEach(c -> scanEach(c, def, componentTypes, out));
            i.elseChildren().forEach(c -> scanEach(c, def, componentTypes, out));
        } else if (node instanceof ForRangeNode r) {
            r.children().forEach(c -> scanEach(c, def, componentTypes, out));
        }
    }
}
