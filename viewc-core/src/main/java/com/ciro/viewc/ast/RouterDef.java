package com.ciro.viewc.ast;

import java.util.List;

public record RouterDef(List<Route> routes) {

    public RouterDef {
        routes = routes == null ? List.of() : List.copyOf(routes);
    }

    public record Route(String path, String component) {}
}
