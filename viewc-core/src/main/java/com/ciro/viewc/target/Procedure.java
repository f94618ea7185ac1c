package com.ciro.viewc.target;

import java.util.List;

/** Unidad invocable del programa destino. */
public record Procedure(String name, Kind kind, List<String> params, List<Instr> body) {

    public enum Kind { VIEW, LIFECYCLE, UPDATE, SITE, SYNC_IF, SYNC_LOOP, LOOP_ITEMS, MEMBER_UPDATE, ROUTE, METHOD }

    public Procedure {
        params = params == null ? List.of() : List.copyOf(params);
        body = List.copyOf(body);
    }

    public Procedure(String name, Kind kind, List<Instr> body) {
        this(name, kind, List.of(), body);
    }
}
