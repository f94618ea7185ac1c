package com.ciro.viewc;

import com.ciro.viewc.ast.ComponentDef;
import com.ciro.viewc.lower.LoweredView;
import com.ciro.viewc.target.Procedure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resultado de compilar un componente: la vista bajada, los procedimientos
 * por nombre (en orden de emisión) y el valor inicial de los campos internos
 * ({@code _if_N_state}, {@code _loop_N_count}, ...).
 */
public record LoweredComponent(String name,
                               ComponentDef def,
                               LoweredView view,
                               Map<String, Procedure> procedures,
                               Map<String, Object> internalState) {

    public LoweredComponent {
        procedures = Collections.unmodifiableMap(new LinkedHashMap<>(procedures));
        internalState = Collections.unmodifiableMap(new LinkedHashMap<>(internalState));
    }

    public Optional<Procedure> procedure(String name) {
        return Optional.ofNullable(procedures.get(name));
    }

    public boolean hasProcedure(String name) {
        return procedures.containsKey(name);
    }
}
