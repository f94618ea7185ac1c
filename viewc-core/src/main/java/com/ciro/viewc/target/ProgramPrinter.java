package com.ciro.viewc.target;

import com.ciro.viewc.ast.Expr;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Listado en pseudo C de los procedimientos. Sirve para depurar y para tests
 * de forma; no es la serialización final.
 */
public final class ProgramPrinter {

    private static final String INDENT = "    ";

    private ProgramPrinter() {}

    public static String print(Collection<Procedure> procedures) {
        StringBuilder sb = new StringBuilder();
        for (Procedure p : procedures) {
            print(p, sb);
            sb.append('\n');
        }
        return sb.toString();
    }

    public static String print(Procedure p) {
        StringBuilder sb = new StringBuilder();
        print(p, sb);
        return sb.toString();
    }

    private static void print(Procedure p, StringBuilder sb) {
        sb.append("void ").append(p.name()).append('(').append(String.join(", ", p.params())).append(") {\n");
        block(p.body(), 1, sb);
        sb.append("}\n");
    }

    private static void block(List<Instr> body, int depth, StringBuilder sb) {
        for (Instr i : body) instr(i, depth, sb);
    }

    private static void line(int depth, StringBuilder sb, String text) {
        sb.append(INDENT.repeat(depth)).append(text).append('\n');
    }

    private static void instr(Instr in, int d, StringBuilder sb) {
        if (in instanceof Instr.CreateNode c) {
            String fn = c.kind() == NodeKind.ELEMENT ? "create_element" : "create_text";
            line(d, sb, c.target() + " = " + fn + "(" + quote(c.value()) + ");");
        } else if (in instanceof Instr.CreateComment c) {
            line(d, sb, c.target() + " = create_comment(" + quote(c.label()) + ");");
        } else if (in instanceof Instr.SetAttribute a) {
            String fn = a.property() ? "set_property" : "set_attribute";
            line(d, sb, fn + "(" + a.node() + ", " + quote(a.name()) + ", " + expr(a.value()) + ");");
        } else if (in instanceof Instr.SetText t) {
            line(d, sb, "set_text(" + t.node() + ", " + expr(t.value()) + ");");
        } else if (in instanceof Instr.SetInnerHtml h) {
            line(d, sb, "set_inner_html(" + h.node() + ", " + expr(h.value()) + ");");
        } else if (in instanceof Instr.AppendChild a) {
            line(d, sb, "append_child(" + a.parent() + ", " + a.child() + ");");
        } else if (in instanceof Instr.InsertBefore ib) {
            line(d, sb, "insert_before(" + ib.anchor() + ", " + ib.child() + ");");
        } else if (in instanceof Instr.RemoveNode r) {
            line(d, sb, "remove(" + r.node() + ");");
        } else if (in instanceof Instr.ClearChildren c) {
            line(d, sb, "clear_children(" + c.parent() + ");");
        } else if (in instanceof Instr.RegisterHandler r) {
            line(d, sb, r.event().domName() + "_dispatcher.set(" + r.node() + ", [&]{ " + expr(r.handler()) + "; });");
        } else if (in instanceof Instr.UnregisterHandler u) {
            line(d, sb, u.event().domName() + "_dispatcher.remove(" + u.node() + ");");
        } else if (in instanceof Instr.RegisterMasked m) {
            line(d, sb, "register_masked(" + m.event().domName() + ", 0x" + Long.toHexString(m.mask())
                    + (m.overflow().isEmpty() ? "" : ", overflow=" + m.overflow()) + ");");
        } else if (in instanceof Instr.BindRef b) {
            line(d, sb, b.field() + " = " + b.node() + ";");
        } else if (in instanceof Instr.Assign a) {
            line(d, sb, expr(a.target()) + " = " + expr(a.value()) + ";");
        } else if (in instanceof Instr.Let l) {
            line(d, sb, "auto " + l.name() + " = " + expr(l.value()) + ";");
        } else if (in instanceof Instr.Branch b) {
            line(d, sb, "if (" + expr(b.condition()) + ") {");
            block(b.then(), d + 1, sb);
            if (!b.otherwise().isEmpty()) {
                line(d, sb, "} else {");
                block(b.otherwise(), d + 1, sb);
            }
            line(d, sb, "}");
        } else if (in instanceof Instr.Repeat r) {
            line(d, sb, "for (int " + r.var() + " = " + expr(r.start()) + "; " + r.var() + " < " + expr(r.end())
                    + "; " + r.var() + "++) {");
            block(r.body(), d + 1, sb);
            line(d, sb, "}");
        } else if (in instanceof Instr.Each e) {
            line(d, sb, "for (auto& " + e.var() + " : " + expr(e.iterable()) + ") {");
            block(e.body(), d + 1, sb);
            line(d, sb, "}");
        } else if (in instanceof Instr.Return r) {
            line(d, sb, r.value() == null ? "return;" : "return " + expr(r.value()) + ";");
        } else if (in instanceof Instr.Call c) {
            line(d, sb, c.procedure() + "(" + args(c.args()) + ");");
        } else if (in instanceof Instr.Eval e) {
            line(d, sb, expr(e.expr()) + ";");
        } else if (in instanceof Instr.ViewDepth v) {
            line(d, sb, v.delta() > 0 ? "_view_depth++;" : "_view_depth--;");
        } else if (in instanceof Instr.Flush) {
            line(d, sb, "if (_view_depth == 0) flush();");
        } else if (in instanceof Instr.Instantiate n) {
            line(d, sb, n.child() + " = " + n.type() + "();");
        } else if (in instanceof Instr.CallChild c) {
            String a = c.mount() != null ? c.mount().toString() : args(c.args());
            line(d, sb, c.child() + "." + c.procedure() + "(" + a + ");");
        } else if (in instanceof Instr.SetProp p) {
            line(d, sb, p.child() + "." + p.prop() + " = " + expr(p.value()) + ";");
        } else if (in instanceof Instr.ShareProp p) {
            line(d, sb, p.child() + "." + p.prop() + " = &" + p.field() + ";");
        } else if (in instanceof Instr.WireCallback w) {
            line(d, sb, w.child() + "." + w.callback() + " = [this]{ " + w.procedure() + "(); };");
        } else if (in instanceof Instr.Notify n) {
            line(d, sb, "if (" + n.callback() + ") " + n.callback() + "();");
        } else if (in instanceof Instr.NewItem n) {
            line(d, sb, "{ // nuevo item _loop_" + n.loopId() + ", " + n.var() + " = " + expr(n.value()));
            block(n.body(), d + 1, sb);
            line(d, sb, "}");
        } else if (in instanceof Instr.TrackItemNode t) {
            line(d, sb, "_loop_" + t.loopId() + "_nodes.back().push_back(" + t.node() + ");");
        } else if (in instanceof Instr.TrackItemInstance t) {
            line(d, sb, "_loop_" + t.loopId() + "_items.push_back(&" + t.child() + ");");
        } else if (in instanceof Instr.DrainItems dr) {
            line(d, sb, "_drain_loop_" + dr.loopId() + "(" + expr(dr.keep()) + ", " + dr.mode() + ");");
        } else if (in instanceof Instr.RebindItems r) {
            line(d, sb, "for (int _k = 0; _k < " + expr(r.upTo()) + "; _k++) _loop_" + r.loopId() + "_items[_k]->_rebind();");
        } else if (in instanceof Instr.UpdateItems u) {
            line(d, sb, "for (auto& item : _loop_" + u.loopId() + "_items) {"
                    + (u.var() == null ? "" : " " + u.var() + " = " + expr(u.value()) + ";"));
            block(u.body(), d + 1, sb);
            line(d, sb, "}");
        } else if (in instanceof Instr.PlaceItem p) {
            line(d, sb, "_place_loop_" + p.loopId() + "(" + expr(p.array()) + ", " + expr(p.index()) + ", " + p.end() + ");");
        } else {
            line(d, sb, "/* " + in + " */");
        }
    }

    private static String args(List<Expr> args) {
        return args.stream().map(ProgramPrinter::expr).collect(Collectors.joining(", "));
    }

    private static String quote(String s) {
        return s == null ? "null" : "\"" + s.replace("\"", "\\\"") + "\"";
    }

    /** Expresión en notación infija. */
    public static String expr(Expr e) {
        if (e == null) return "null";
        if (e instanceof Expr.Literal l) {
            return l.value() instanceof String s ? quote(s) : String.valueOf(l.value());
        }
        if (e instanceof Expr.Ident id) return id.name();
        if (e instanceof Expr.Member m) return expr(m.target()) + "." + m.name();
        if (e instanceof Expr.Index ix) return expr(ix.target()) + "[" + expr(ix.index()) + "]";
        if (e instanceof Expr.Unary u) {
            boolean postfix = "++".equals(u.op()) || "--".equals(u.op());
            return postfix ? expr(u.operand()) + u.op() : u.op() + expr(u.operand());
        }
        if (e instanceof Expr.Binary b) return "(" + expr(b.left()) + " " + b.op() + " " + expr(b.right()) + ")";
        if (e instanceof Expr.Call c) {
            String recv = c.receiver() == null ? "" : expr(c.receiver()) + ".";
            return recv + c.name() + "(" + args(c.args()) + ")";
        }
        if (e instanceof Expr.StringTemplate t) {
            return "format(" + args(t.parts()) + ")";
        }
        if (e instanceof Expr.ArrayLit a) return "{" + args(a.items()) + "}";
        return e.toString();
    }
}
