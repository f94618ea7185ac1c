package com.ciro.viewc.ast;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Variable de estado declarada en el componente.
 *
 * @param isPublic  visible desde el padre (recibe callback {@code on<Name>Change} si además es mutable)
 * @param reference el valor se comparte por referencia con quien lo pase como prop
 */
public record StateVar(String name,
                       String type,
                       boolean mutable,
                       @JsonProperty("public") boolean isPublic,
                       boolean reference,
                       Expr init) {}
