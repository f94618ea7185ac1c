package com.ciro.viewc.runtime.dom;

@FunctionalInterface
public interface DomEventListener {
    void handle(Object payload);
}
