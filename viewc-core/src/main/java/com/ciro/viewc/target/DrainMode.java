package com.ciro.viewc.target;

/**
 * Cómo se desmontan los items de un bucle.
 * Las variantes BULK no quitan nodos uno a uno: quien llama va a vaciar el
 * padre entero (o ya lo está quitando).
 */
public enum DrainMode {
    /** Instancias propias del item: se destruyen. */
    DESTROY,
    DESTROY_BULK,
    /** Instancias del array respaldo: solo se quita su vista, el estado sobrevive. */
    REMOVE_VIEW,
    REMOVE_VIEW_BULK;

    public boolean isBulk() {
        return this == DESTROY_BULK || this == REMOVE_VIEW_BULK;
    }

    public boolean keepsInstances() {
        return this == REMOVE_VIEW || this == REMOVE_VIEW_BULK;
    }

    public static DrainMode of(boolean keepInstances, boolean bulk) {
        if (keepInstances) return bulk ? REMOVE_VIEW_BULK : REMOVE_VIEW;
        return bulk ? DESTROY_BULK : DESTROY;
    }
}
