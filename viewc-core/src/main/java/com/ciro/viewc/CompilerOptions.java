package com.ciro.viewc;

/**
 * Opciones del compilador.
 *
 * @param scopeAttribute  atributo con el nombre del componente en cada elemento, null = apagado
 * @param bulkClear       vaciar el padre de una vez cuando un bucle es su único hijo
 * @param detectOnlyChild detectar bucles que son el único hijo de su elemento
 * @param emitFlush       emitir el volcado al salir de la vista más externa
 */
public record CompilerOptions(String scopeAttribute, boolean bulkClear, boolean detectOnlyChild, boolean emitFlush) {

    public static final String DEFAULT_SCOPE_ATTRIBUTE = "data-scope";

    public static CompilerOptions defaults() {
        return new CompilerOptions(DEFAULT_SCOPE_ATTRIBUTE, true, true, true);
    }

    public CompilerOptions withScopeAttribute(String attr) {
        return new CompilerOptions(attr, bulkClear, detectOnlyChild, emitFlush);
    }

    public CompilerOptions withBulkClear(boolean on) {
        return new CompilerOptions(scopeAttribute, on, detectOnlyChild, emitFlush);
    }

    public CompilerOptions withDetectOnlyChild(boolean on) {
        return new CompilerOptions(scopeAttribute, bulkClear, on, emitFlush);
    }

    public CompilerOptions withEmitFlush(boolean on) {
        return new CompilerOptions(scopeAttribute, bulkClear, detectOnlyChild, on);
    }
}
