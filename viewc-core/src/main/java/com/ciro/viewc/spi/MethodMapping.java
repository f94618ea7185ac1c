package com.ciro.viewc.spi;

import java.util.List;

/**
 * Cómo se traduce un método del lenguaje en el destino.
 *
 * @param target nombre destino (intrínseco, plantilla o función con namespace)
 */
public record MethodMapping(Kind kind, String target, List<String> paramTypes, String returnType) {

    public enum Kind { INTRINSIC, INLINE_TEMPLATE, NAMESPACED_CALL }

    public MethodMapping {
        paramTypes = paramTypes == null ? List.of() : List.copyOf(paramTypes);
    }

    /** Un método sin retorno sobre un valor lo modifica ({@code arr.push(x)}). */
    public boolean isMutating() {
        return returnType == null || "void".equals(returnType);
    }
}
