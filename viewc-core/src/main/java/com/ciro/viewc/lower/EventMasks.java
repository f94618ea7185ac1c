package com.ciro.viewc.lower;

import com.ciro.viewc.target.EventKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Una máscara de 64 bits por tipo de evento: bit {@code i} = {@code el[i]}
 * tiene manejador. Los ids a partir de 64 van a una lista de overflow.
 */
public final class EventMasks {

    public static final int MASK_BITS = 64;

    private final Map<EventKind, Long> masks = new EnumMap<>(EventKind.class);
    private final Map<EventKind, List<Integer>> overflow = new EnumMap<>(EventKind.class);

    public static EventMasks of(Collection<EventHandler> handlers) {
        EventMasks m = new EventMasks();
        for (EventHandler h : handlers) {
            if (h.nodeId() < MASK_BITS) {
                m.masks.merge(h.kind(), 1L << h.nodeId(), (a, b) -> a | b);
            } else {
                List<Integer> ids = m.overflow.computeIfAbsent(h.kind(), k -> new ArrayList<>());
                if (!ids.contains(h.nodeId())) ids.add(h.nodeId());
            }
        }
        return m;
    }

    public long mask(EventKind kind) {
        return masks.getOrDefault(kind, 0L);
    }

    public List<Integer> overflow(EventKind kind) {
        return overflow.getOrDefault(kind, List.of());
    }

    public boolean has(EventKind kind) {
        return mask(kind) != 0 || !overflow(kind).isEmpty();
    }

    public boolean isEmpty() {
        for (EventKind k : EventKind.values()) if (has(k)) return false;
        return true;
    }

    public boolean isSet(EventKind kind, int nodeId) {
        if (nodeId < MASK_BITS) return (mask(kind) & (1L << nodeId)) != 0;
        return overflow(kind).contains(nodeId);
    }
}
