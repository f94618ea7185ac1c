package com.ciro.viewc.runtime.dom;

import com.ciro.viewc.target.EventKind;

/**
 * Las primitivas de DOM que ejecuta el intérprete. Los manejadores viven en
 * una tabla por tipo de evento: registrar dos veces el mismo nodo reemplaza.
 */
public interface DomHost {
    DomNode createElement(String tag);
    DomNode createText(String text);
    DomNode createComment(String label);
    void setAttribute(DomNode node, String name, String value);
    void setProperty(DomNode node, String name, Object value);
    void setText(DomNode node, String text);
    void setInnerHtml(DomNode node, String html);
    void appendChild(DomNode parent, DomNode child);
    void insertBefore(DomNode anchor, DomNode child);
    void remove(DomNode node);
    void clearChildren(DomNode parent);
    void register(DomNode node, EventKind event, DomEventListener listener);
    void unregister(DomNode node, EventKind event);
    void unregisterSubtree(DomNode node);
    void focus(DomNode node);
    void flush();
    boolean dispatch(DomNode node, EventKind event, Object payload);
}
