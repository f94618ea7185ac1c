package com.ciro.viewc;

/** Invariante interna rota durante el lowering. Es un bug del compilador, nunca se captura. */
public class LoweringDefect extends IllegalStateException {

    public LoweringDefect(String message) {
        super(message);
    }
}
