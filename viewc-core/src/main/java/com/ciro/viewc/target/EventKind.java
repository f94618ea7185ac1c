package com.ciro.viewc.target;

import java.util.Locale;
import java.util.Optional;

/** Eventos con tabla de despacho propia en el destino. */
public enum EventKind {
    CLICK, INPUT, CHANGE, KEYDOWN;

    public String domName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** "onclick" -> CLICK */
    public static Optional<EventKind> fromAttribute(String attr) {
        if (attr == null || !attr.startsWith("on")) return Optional.empty();
        String ev = attr.substring(2).toUpperCase(Locale.ROOT);
        for (EventKind k : values()) {
            if (k.name().equals(ev)) return Optional.of(k);
        }
        return Optional.empty();
    }
}
