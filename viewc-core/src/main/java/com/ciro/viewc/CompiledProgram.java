package com.ciro.viewc;

import java.util.List;
import java.util.Optional;

/** Todos los componentes de una compilación, en orden topológico. */
public record CompiledProgram(List<LoweredComponent> components) {

    public CompiledProgram {
        components = List.copyOf(components);
    }

    public Optional<LoweredComponent> component(String name) {
        for (LoweredComponent c : components) {
            if (c.name().equals(name)) return Optional.of(c);
        }
        return Optional.empty();
    }

    public LoweredComponent require(String name) {
        return component(name).orElseThrow(() -> new IllegalArgumentException("componente no compilado: " + name));
    }
}
