package com.ciro.viewc;

/**
 * Error estructural del programa de entrada. Aborta la compilación completa:
 * no hay salida parcial.
 */
public class ViewCompileException extends RuntimeException {

    private final int line;

    public ViewCompileException(String message, int line) {
        super(line > 0 ? message + " (línea " + line + ")" : message);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
