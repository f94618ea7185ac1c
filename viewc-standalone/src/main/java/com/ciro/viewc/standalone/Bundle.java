package com.ciro.viewc.standalone;

import com.ciro.viewc.ast.ComponentDef;

import java.util.List;

/**
 * Lo que entrega el parser: un nombre y los componentes ya resueltos.
 * El nombre es la clave en el almacén de programas.
 */
public record Bundle(String name, List<ComponentDef> components) {

    public Bundle {
        components = components == null ? List.of() : List.copyOf(components);
    }
}
