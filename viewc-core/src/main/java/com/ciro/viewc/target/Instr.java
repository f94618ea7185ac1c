package com.ciro.viewc.target;

import com.ciro.viewc.ast.Expr;

import java.util.List;

/**
 * Instrucciones del programa destino. Las ocho primeras son las primitivas
 * de DOM; el resto son control, estado y gestión de hijos e items de bucle.
 */
public sealed interface Instr {

    // ------------------------------------------------------------------ primitivas DOM

    /** Crea un elemento ({@code value} = tag) o un nodo de texto ({@code value} = texto inicial). */
    record CreateNode(NodeRef target, NodeKind kind, String value) implements Instr {}

    /** {@code property} = se escribe como propiedad ({@code value}, {@code checked}, {@code selected}). */
    record SetAttribute(NodeRef node, String name, Expr value, boolean property) implements Instr {}

    record SetText(NodeRef node, Expr value) implements Instr {}

    record AppendChild(NodeRef parent, NodeRef child) implements Instr {}

    /** Inserta {@code child} antes de {@code anchor}, dentro del padre del ancla. */
    record InsertBefore(NodeRef anchor, NodeRef child) implements Instr {}

    /** Sin efecto si el nodo ya no es válido. */
    record RemoveNode(NodeRef node) implements Instr {}

    record RegisterHandler(NodeRef node, EventKind event, Expr handler) implements Instr {}

    record UnregisterHandler(NodeRef node, EventKind event) implements Instr {}

    // ------------------------------------------------------------------ DOM extendido

    record CreateComment(NodeRef target, String label) implements Instr {}

    record SetInnerHtml(NodeRef node, Expr value) implements Instr {}

    record ClearChildren(NodeRef parent) implements Instr {}

    /** Registra los manejadores de {@code event} para cada {@code el[i]} válido con bit en la máscara, más los de overflow. */
    record RegisterMasked(EventKind event, long mask, List<Integer> overflow) implements Instr {
        public RegisterMasked { overflow = List.copyOf(overflow); }
    }

    /** Guarda el handle del nodo en una variable de estado. */
    record BindRef(String field, NodeRef node) implements Instr {}

    // ------------------------------------------------------------------ control y estado

    /** Escritura sobre un lvalue: variable, {@code a[i]} o {@code obj.m}. */
    record Assign(Expr target, Expr value) implements Instr {}

    record Let(String name, Expr value) implements Instr {}

    record Branch(Expr condition, List<Instr> then, List<Instr> otherwise) implements Instr {
        public Branch {
            then = List.copyOf(then);
            otherwise = otherwise == null ? List.of() : List.copyOf(otherwise);
        }
    }

    /** {@code for (var = start; var < end; var++)} */
    record Repeat(String var, Expr start, Expr end, List<Instr> body) implements Instr {
        public Repeat { body = List.copyOf(body); }
    }

    record Each(String var, Expr iterable, List<Instr> body) implements Instr {
        public Each { body = List.copyOf(body); }
    }

    record Return(Expr value) implements Instr {}

    /** Llama a un procedimiento propio. */
    record Call(String procedure, List<Expr> args) implements Instr {
        public Call { args = args == null ? List.of() : List.copyOf(args); }

        public Call(String procedure) { this(procedure, List.of()); }
    }

    record Eval(Expr expr) implements Instr {}

    record ViewDepth(int delta) implements Instr {}

    /** Vuelca los cambios pendientes si la profundidad de vista es cero. */
    record Flush() implements Instr {}

    // ------------------------------------------------------------------ hijos

    record Instantiate(ChildRef child, String type) implements Instr {}

    /** {@code mount} solo para {@code view}. No hace nada si la instancia no existe. */
    record CallChild(ChildRef child, String procedure, Mount mount, List<Expr> args) implements Instr {
        public CallChild { args = args == null ? List.of() : List.copyOf(args); }

        public CallChild(ChildRef child, String procedure) { this(child, procedure, null, List.of()); }
    }

    record SetProp(ChildRef child, String prop, Expr value) implements Instr {}

    /** Prop por referencia: el hijo comparte la celda de {@code field} del padre. */
    record ShareProp(ChildRef child, String prop, String field) implements Instr {}

    /** Conecta el callback {@code callback} del hijo a un procedimiento propio. */
    record WireCallback(ChildRef child, String callback, String procedure) implements Instr {}

    /** Invoca el callback de cambio si el padre lo conectó. */
    record Notify(String callback) implements Instr {}

    // ------------------------------------------------------------------ items de bucle

    /**
     * Agrega un item al final del bucle y ejecuta {@code body} en el frame del
     * item, con {@code var} ligado a {@code value}.
     */
    record NewItem(int loopId, String var, Expr value, List<Instr> body) implements Instr {
        public NewItem { body = List.copyOf(body); }
    }

    /** Nodo raíz del item actual (se quita al drenar). */
    record TrackItemNode(int loopId, NodeRef node) implements Instr {}

    /** Instancia que ya existía y que el item actual proyecta. */
    record TrackItemInstance(int loopId, ChildRef child) implements Instr {}

    /** Desmonta los items desde el final hasta que queden {@code keep}. */
    record DrainItems(int loopId, Expr keep, DrainMode mode) implements Instr {}

    /** {@code _rebind()} en las instancias de los items {@code [0, upTo)}. */
    record RebindItems(int loopId, Expr upTo) implements Instr {}

    /**
     * Ejecuta {@code body} en el frame de cada item vivo. Si {@code var} no es
     * null se vuelve a ligar a {@code value}, evaluado con {@code _i} = posición.
     */
    record UpdateItems(int loopId, String var, Expr value, List<Instr> body) implements Instr {
        public UpdateItems { body = List.copyOf(body); }
    }

    /**
     * Recoloca la vista de {@code array[index]} antes de la de su sucesor, o en
     * {@code end} si es el último.
     */
    record PlaceItem(int loopId, Expr array, Expr index, Mount end) implements Instr {}
}
