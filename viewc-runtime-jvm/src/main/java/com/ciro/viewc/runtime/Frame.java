package com.ciro.viewc.runtime;

import java.util.HashMap;
import java.util.Map;

/**
 * Ámbito de ejecución. Un frame de item usa los locales del propio item,
 * así sobreviven entre llamadas.
 */
final class Frame {

    final ComponentInstance self;
    final Frame outer;
    final LoopItem item;
    private final Map<String, Object> locals;

    boolean returned;
    Object result;

    private Frame(ComponentInstance self, Frame outer, LoopItem item, Map<String, Object> locals) {
        this.self = self;
        this.outer = outer;
        this.item = item;
        this.locals = locals;
    }

    static Frame of(ComponentInstance self) {
        return new Frame(self, null, null, new HashMap<>());
    }

    Frame forItem(LoopItem item) {
        return new Frame(self, this, item, item.locals);
    }

    /** Frame hijo que ve los locales de este (manejadores de evento). */
    Frame nested() {
        return new Frame(self, this, null, new HashMap<>());
    }

    /** Frame del procedimiento en curso. */
    Frame root() {
        Frame f = this;
        while (f.outer != null && f.item != null) f = f.outer;
        return f;
    }

    LoopItem currentItem() {
        for (Frame f = this; f != null; f = f.outer) {
            if (f.item != null) return f.item;
        }
        return null;
    }

    void define(String name, Object value) {
        locals.put(name, value);
    }

    boolean isLocal(String name) {
        for (Frame f = this; f != null; f = f.outer) {
            if (f.locals.containsKey(name)) return true;
        }
        return false;
    }

    Object lookup(String name) {
        for (Frame f = this; f != null; f = f.outer) {
            if (f.locals.containsKey(name)) return f.locals.get(name);
        }
        return self.field(name);
    }

    void assign(String name, Object value) {
        for (Frame f = this; f != null; f = f.outer) {
            if (f.locals.containsKey(name)) {
                f.locals.put(name, value);
                return;
            }
        }
        self.setField(name, value);
    }
}
