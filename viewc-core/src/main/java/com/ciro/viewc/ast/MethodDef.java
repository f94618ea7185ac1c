package com.ciro.viewc.ast;

import java.util.List;

public record MethodDef(String name, List<String> params, String returnType, List<Stmt> body) {

    public MethodDef {
        params = params == null ? List.of() : List.copyOf(params);
        body = body == null ? List.of() : List.copyOf(body);
    }
}
