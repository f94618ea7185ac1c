package com.ciro.viewc.ast;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ComponentParam(String name,
                             String type,
                             boolean reference,
                             boolean mutable,
                             @JsonProperty("public") boolean isPublic,
                             Expr defaultValue) {}
