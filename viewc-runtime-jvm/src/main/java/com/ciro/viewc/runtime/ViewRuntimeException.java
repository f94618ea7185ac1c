package com.ciro.viewc.runtime;

/** Error al ejecutar un programa bajado: variable desconocida, tipo inesperado... */
public class ViewRuntimeException extends RuntimeException {

    public ViewRuntimeException(String message) {
        super(message);
    }

    public ViewRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
