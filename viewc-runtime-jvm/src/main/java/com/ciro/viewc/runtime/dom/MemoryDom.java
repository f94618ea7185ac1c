package com.ciro.viewc.runtime.dom;

import com.ciro.viewc.target.EventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DOM en memoria con traza de llamadas. Cada tipo de evento tiene su propia
 * tabla de despacho nodo → manejador.
 *
 * <p>Quitar un nodo que aún tiene manejadores registrados (él o un
 * descendiente) cuenta como manejador colgante; los programas correctos
 * siempre desregistran antes de quitar.</p>
 */
public class MemoryDom implements DomHost {

    private static final Logger log = LoggerFactory.getLogger(MemoryDom.class);

    private final Map<EventKind, Map<DomNode, DomEventListener>> dispatch = new EnumMap<>(EventKind.class);
    private final List<DomCall> trace = new ArrayList<>();
    private int nextId;
    private int dangling;
    private int flushes;

    public MemoryDom() {
        for (EventKind k : EventKind.values()) dispatch.put(k, new LinkedHashMap<>());
    }

    /** Raíz de documento donde montar componentes. No aparece en la traza. */
    public DomNode createRoot() {
        return new DomNode(nextId++, DomNode.Type.ELEMENT, "body", null);
    }

    // --- traza --------------------------------------------------------------

    public List<DomCall> trace() {
        return Collections.unmodifiableList(trace);
    }

    public void clearTrace() {
        trace.clear();
    }

    public long count(DomCall.Op op) {
        return trace.stream().filter(c -> c.op() == op).count();
    }

    public int danglingHandlers() {
        return dangling;
    }

    public int flushes() {
        return flushes;
    }

    public int handlerCount(EventKind event) {
        return dispatch.get(event).size();
    }

    public boolean hasHandler(DomNode node, EventKind event) {
        return dispatch.get(event).containsKey(node);
    }

    private void record(DomCall.Op op, DomNode node, String detail) {
        trace.add(new DomCall(op, node == null ? -1 : node.id(), detail));
    }

    // --- primitivas ---------------------------------------------------------

    @Override
    public DomNode createElement(String tag) {
        DomNode n = new DomNode(nextId++, DomNode.Type.ELEMENT, tag, null);
        record(DomCall.Op.CREATE, n, tag);
        return n;
    }

    @Override
    public DomNode createText(String text) {
        DomNode n = new DomNode(nextId++, DomNode.Type.TEXT, null, text);
        record(DomCall.Op.CREATE, n, "#text");
        return n;
    }

    @Override
    public DomNode createComment(String label) {
        DomNode n = new DomNode(nextId++, DomNode.Type.COMMENT, label, null);
        record(DomCall.Op.CREATE, n, "#comment");
        return n;
    }

    @Override
    public void setAttribute(DomNode node, String name, String value) {
        node.setAttribute(name, value);
        record(DomCall.Op.SET_ATTRIBUTE, node, name + "=" + value);
    }

    @Override
    public void setProperty(DomNode node, String name, Object value) {
        node.setProperty(name, value);
        record(DomCall.Op.SET_PROPERTY, node, name + "=" + value);
    }

    @Override
    public void setText(DomNode node, String text) {
        node.setText(text);
        if (node.type() == DomNode.Type.ELEMENT) {
            drop(node.takeChildren());
            node.append(new DomNode(nextId++, DomNode.Type.TEXT, null, text));
        }
        record(DomCall.Op.SET_TEXT, node, text);
    }

    @Override
    public void setInnerHtml(DomNode node, String html) {
        drop(node.takeChildren());
        node.setInnerHtml(html);
        record(DomCall.Op.SET_HTML, node, html);
    }

    @Override
    public void appendChild(DomNode parent, DomNode child) {
        parent.append(child);
        record(DomCall.Op.APPEND, child, "parent=" + parent.id());
    }

    @Override
    public void insertBefore(DomNode anchor, DomNode child) {
        DomNode parent = anchor.parent();
        if (parent == null) throw new IllegalStateException("ancla sin padre: " + anchor);
        parent.insertBefore(anchor, child);
        record(DomCall.Op.INSERT_BEFORE, child, "anchor=" + anchor.id());
    }

    @Override
    public void remove(DomNode node) {
        node.detach();
        drop(List.of(node));
        record(DomCall.Op.REMOVE, node, null);
    }

    @Override
    public void clearChildren(DomNode parent) {
        drop(parent.takeChildren());
        parent.setInnerHtml(null);
        record(DomCall.Op.CLEAR, parent, null);
    }

    private void drop(List<DomNode> roots) {
        for (DomNode root : roots) {
            List<DomNode> all = new ArrayList<>();
            root.subtree(all);
            for (DomNode n : all) {
                for (Map.Entry<EventKind, Map<DomNode, DomEventListener>> e : dispatch.entrySet()) {
                    if (e.getValue().remove(n) != null) {
                        dangling++;
                        log.warn("Manejador {} colgante en {}", e.getKey().domName(), n);
                    }
                }
            }
            root.kill();
        }
    }

    @Override
    public void register(DomNode node, EventKind event, DomEventListener listener) {
        if (!node.isAlive()) throw new IllegalStateException("registro sobre un nodo muerto: " + node);
        dispatch.get(event).put(node, listener);
        record(DomCall.Op.REGISTER, node, event.domName());
    }

    @Override
    public void unregister(DomNode node, EventKind event) {
        if (dispatch.get(event).remove(node) != null) {
            record(DomCall.Op.UNREGISTER, node, event.domName());
        }
    }

    /** Desregistra todo lo que cuelga de {@code node}, incluido él. */
    @Override
    public void unregisterSubtree(DomNode node) {
        List<DomNode> all = new ArrayList<>();
        node.subtree(all);
        for (DomNode n : all) {
            for (EventKind k : EventKind.values()) unregister(n, k);
        }
    }

    @Override
    public void focus(DomNode node) {
        record(DomCall.Op.FOCUS, node, null);
    }

    @Override
    public void flush() {
        flushes++;
        record(DomCall.Op.FLUSH, null, null);
    }

    @Override
    public boolean dispatch(DomNode node, EventKind event, Object payload) {
        DomEventListener l = dispatch.get(event).get(node);
        if (l == null) {
            log.debug("Sin manejador {} en {}", event.domName(), node);
            return false;
        }
        l.handle(payload);
        return true;
    }
}
