package com.ciro.viewc.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Stmt.VarDecl.class, name = "var"),
    @JsonSubTypes.Type(value = Stmt.Assign.class, name = "assign"),
    @JsonSubTypes.Type(value = Stmt.IndexAssign.class, name = "indexAssign"),
    @JsonSubTypes.Type(value = Stmt.MemberAssign.class, name = "memberAssign"),
    @JsonSubTypes.Type(value = Stmt.ExprStmt.class, name = "expr"),
    @JsonSubTypes.Type(value = Stmt.Block.class, name = "block"),
    @JsonSubTypes.Type(value = Stmt.If.class, name = "if"),
    @JsonSubTypes.Type(value = Stmt.ForRange.class, name = "forRange"),
    @JsonSubTypes.Type(value = Stmt.ForEach.class, name = "forEach"),
    @JsonSubTypes.Type(value = Stmt.Return.class, name = "return")
})
public sealed interface Stmt
        permits Stmt.VarDecl, Stmt.Assign, Stmt.IndexAssign, Stmt.MemberAssign, Stmt.ExprStmt,
                Stmt.Block, Stmt.If, Stmt.ForRange, Stmt.ForEach, Stmt.Return {

    record VarDecl(String name, String type, Expr init) implements Stmt {}

    record Assign(String name, Expr value) implements Stmt {}

    /** {@code target[index] = value} */
    record IndexAssign(Expr target, Expr index, Expr value) implements Stmt {}

    /** {@code target.member = value} */
    record MemberAssign(Expr target, String member, Expr value) implements Stmt {}

    record ExprStmt(Expr expr) implements Stmt {}

    record Block(List<Stmt> body) implements Stmt {
        public Block { body = List.copyOf(body); }
    }

    record If(Expr condition, List<Stmt> then, List<Stmt> otherwise) implements Stmt {
        public If {
            then = then == null ? List.of() : List.copyOf(then);
            otherwise = otherwise == null ? List.of() : List.copyOf(otherwise);
        }
    }

    record ForRange(String var, Expr start, Expr end, List<Stmt> body) implements Stmt {
        public ForRange { body = List.copyOf(body); }
    }

    record ForEach(String var, Expr iterable, List<Stmt> body) implements Stmt {
        public ForEach { body = List.copyOf(body); }
    }

    record Return(Expr value) implements Stmt {}
}
