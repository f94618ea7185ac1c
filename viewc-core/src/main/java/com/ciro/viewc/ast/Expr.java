package com.ciro.viewc.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Expresiones del lenguaje de componentes. Árbol cerrado: el parser entrega
 * estas formas y nada más.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Expr.Literal.class, name = "lit"),
    @JsonSubTypes.Type(value = Expr.Ident.class, name = "id"),
    @JsonSubTypes.Type(value = Expr.Member.class, name = "member"),
    @JsonSubTypes.Type(value = Expr.Index.class, name = "index"),
    @JsonSubTypes.Type(value = Expr.Unary.class, name = "unary"),
    @JsonSubTypes.Type(value = Expr.Binary.class, name = "binary"),
    @JsonSubTypes.Type(value = Expr.Call.class, name = "call"),
    @JsonSubTypes.Type(value = Expr.StringTemplate.class, name = "template"),
    @JsonSubTypes.Type(value = Expr.ArrayLit.class, name = "array")
})
public sealed interface Expr
        permits Expr.Literal, Expr.Ident, Expr.Member, Expr.Index, Expr.Unary,
                Expr.Binary, Expr.Call, Expr.StringTemplate, Expr.ArrayLit {

    /** Constante: número, texto, booleano o null. */
    record Literal(Object value) implements Expr {}

    record Ident(String name) implements Expr {}

    /** {@code target.name} */
    record Member(Expr target, String name) implements Expr {}

    /** {@code target[index]} */
    record Index(Expr target, Expr index) implements Expr {}

    /** {@code !x}, {@code -x}, {@code x++}, {@code x--}. */
    record Unary(String op, Expr operand) implements Expr {}

    record Binary(String op, Expr left, Expr right) implements Expr {}

    /**
     * Llamada. Sin receptor es una función libre, un método propio o la
     * construcción de un componente ({@code Row()}).
     */
    record Call(Expr receiver, String name, List<Expr> args) implements Expr {
        public Call {
            args = args == null ? List.of() : List.copyOf(args);
        }
    }

    /** Concatenación de fragmentos: {@code "Hola {name}!"}. */
    record StringTemplate(List<Expr> parts) implements Expr {
        public StringTemplate {
            parts = List.copyOf(parts);
        }
    }

    record ArrayLit(List<Expr> items) implements Expr {
        public ArrayLit {
            items = items == null ? List.of() : List.copyOf(items);
        }
    }

    // -------------------------------------------------------------------

    static boolean isConstant(Expr e) {
        if (e instanceof Literal) return true;
        if (e instanceof StringTemplate t) return t.parts().stream().allMatch(Expr::isConstant);
        return false;
    }

    /** Nombre raíz de una cadena {@code a.b[c].d}, o null si no empieza en un identificador. */
    static String rootName(Expr e) {
        Expr cur = e;
        while (true) {
            if (cur instanceof Ident id) return id.name();
            if (cur instanceof Member m) cur = m.target();
            else if (cur instanceof Index ix) cur = ix.target();
            else return null;
        }
    }
}
