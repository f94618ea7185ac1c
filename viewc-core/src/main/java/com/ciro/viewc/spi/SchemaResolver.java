package com.ciro.viewc.spi;

import java.util.Optional;

/**
 * Colaborador de nombres y tipos. El compilador solo lo consulta; la
 * resolución real de módulos vive fuera.
 */
public interface SchemaResolver {

    /** Método {@code name} sobre un receptor de tipo {@code receiverType}. */
    Optional<MethodMapping> lookup(String receiverType, String name);

    /** Tipo que representa un recurso primitivo (handle de nodo, timer...). */
    boolean isHandle(String type);

    boolean isAssignable(String derived, String base);
}
