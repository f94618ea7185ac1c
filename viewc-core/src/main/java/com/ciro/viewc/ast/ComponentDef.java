package com.ciro.viewc.ast;

import java.util.List;
import java.util.Optional;

/**
 * Definición completa de un componente tal como la entrega el parser.
 * {@code view} vacía significa "sin cuerpo de vista".
 */
public record ComponentDef(String name,
                           List<StateVar> state,
                           List<ComponentParam> params,
                           List<MethodDef> methods,
                           List<ViewNode> view,
                           RouterDef router,
                           int line) {

    public ComponentDef {
        state = state == null ? List.of() : List.copyOf(state);
        params = params == null ? List.of() : List.copyOf(params);
        methods = methods == null ? List.of() : List.copyOf(methods);
        view = view == null ? List.of() : List.copyOf(view);
    }

    public boolean hasView() { return !view.isEmpty(); }

    public Optional<StateVar> stateVar(String name) {
        return state.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public Optional<ComponentParam> param(String name) {
        return params.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public Optional<MethodDef> method(String name) {
        return methods.stream().filter(m -> m.name().equals(name)).findFirst();
    }

    /** Nombre declarado como estado o como prop. */
    public boolean declares(String name) {
        return stateVar(name).isPresent() || param(name).isPresent();
    }

    /** Tipo declarado de un estado o prop, o null. */
    public String typeOf(String name) {
        return stateVar(name).map(StateVar::type)
                .orElseGet(() -> param(name).map(ComponentParam::type).orElse(null));
    }

    /** Público y mutable, o prop por referencia mutable: el padre puede querer enterarse. */
    public boolean isObservable(String name) {
        Optional<StateVar> s = stateVar(name);
        if (s.isPresent()) return s.get().isPublic() && s.get().mutable();
        return param(name).map(p -> p.mutable() && (p.isPublic() || p.reference())).orElse(false);
    }
}
