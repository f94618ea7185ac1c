package com.ciro.viewc.spi;

import com.ciro.viewc.ast.Types;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.ciro.viewc.spi.MethodMapping.Kind.INLINE_TEMPLATE;
import static com.ciro.viewc.spi.MethodMapping.Kind.INTRINSIC;
import static com.ciro.viewc.spi.MethodMapping.Kind.NAMESPACED_CALL;

/** Esquema por defecto: métodos de arrays, strings y handles de nodo. */
public class BuiltinSchema implements SchemaResolver {

    private static final Map<String, MethodMapping> ARRAY = Map.of(
        "push",  new MethodMapping(INTRINSIC, "push_back", List.of("T"), "void"),
        "pop",   new MethodMapping(INTRINSIC, "pop_back", List.of(), "void"),
        "clear", new MethodMapping(INTRINSIC, "clear", List.of(), "void"),
        "size",  new MethodMapping(INTRINSIC, "size", List.of(), "int"),
        "get",   new MethodMapping(INLINE_TEMPLATE, "{0}[{1}]", List.of("int"), "T"),
        "contains", new MethodMapping(NAMESPACED_CALL, "viewc::contains", List.of("T"), "bool")
    );

    private static final Map<String, MethodMapping> STRING = Map.of(
        "append", new MethodMapping(INTRINSIC, "append", List.of("string"), "void"),
        "length", new MethodMapping(INTRINSIC, "length", List.of(), "int"),
        "upper",  new MethodMapping(NAMESPACED_CALL, "viewc::upper", List.of(), "string"),
        "lower",  new MethodMapping(NAMESPACED_CALL, "viewc::lower", List.of(), "string"),
        "trim",   new MethodMapping(NAMESPACED_CALL, "viewc::trim", List.of(), "string")
    );

    private static final Map<String, MethodMapping> HANDLE = Map.of(
        "focus", new MethodMapping(NAMESPACED_CALL, "viewc::dom::focus", List.of(), "void")
    );

    @Override
    public Optional<MethodMapping> lookup(String receiverType, String name) {
        if (receiverType == null) return Optional.empty();
        if (Types.isArray(receiverType)) return Optional.ofNullable(ARRAY.get(name));
        if ("string".equals(receiverType)) return Optional.ofNullable(STRING.get(name));
        if (isHandle(receiverType)) return Optional.ofNullable(HANDLE.get(name));
        return Optional.empty();
    }

    @Override
    public boolean isHandle(String type) {
        return "handle".equals(type);
    }

    @Override
    public boolean isAssignable(String derived, String base) {
        if (derived == null || base == null) return false;
        if (derived.equals(base)) return true;
        if ("int".equals(derived) && "float".equals(base)) return true;
        return Types.isArray(derived) && Types.isArray(base)
                && isAssignable(Types.elementType(derived), Types.elementType(base));
    }
}
