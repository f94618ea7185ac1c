package com.ciro.viewc.runtime.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Nodo del DOM en memoria. Un nodo quitado queda muerto junto con su subárbol. */
public final class DomNode {

    public enum Type { ELEMENT, TEXT, COMMENT }

    private final int id;
    private final Type type;
    private final String name;
    private String text;
    private String innerHtml;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private final List<DomNode> children = new ArrayList<>();
    private DomNode parent;
    private boolean alive = true;

    DomNode(int id, Type type, String name, String text) {
        this.id = id;
        this.type = type;
        this.name = name;
        this.text = text;
    }

    public int id() { return id; }

    public Type type() { return type; }

    /** Tag para elementos, etiqueta para comentarios. */
    public String name() { return name; }

    public String text() { return text; }

    public String innerHtml() { return innerHtml; }

    public DomNode parent() { return parent; }

    public boolean isAlive() { return alive; }

    public List<DomNode> children() { return Collections.unmodifiableList(children); }

    public String attribute(String name) { return attributes.get(name); }

    public Object property(String name) { return properties.get(name); }

    public Map<String, String> attributes() { return Collections.unmodifiableMap(attributes); }

    /** Elementos hijos, sin texto ni comentarios. */
    public List<DomNode> elements() {
        List<DomNode> out = new ArrayList<>();
        for (DomNode c : children) if (c.type == Type.ELEMENT) out.add(c);
        return out;
    }

    /** Texto visible del subárbol. */
    public String textContent() {
        if (type == Type.TEXT) return text == null ? "" : text;
        if (type == Type.COMMENT) return "";
        if (innerHtml != null) return innerHtml;
        StringBuilder sb = new StringBuilder();
        for (DomNode c : children) sb.append(c.textContent());
        return sb.toString();
    }

    /** Primer descendiente (o este mismo) con ese tag. */
    public DomNode find(String tag) {
        if (type == Type.ELEMENT && tag.equals(name)) return this;
        for (DomNode c : children) {
            DomNode f = c.find(tag);
            if (f != null) return f;
        }
        return null;
    }

    public List<DomNode> findAll(String tag) {
        List<DomNode> out = new ArrayList<>();
        collect(tag, out);
        return out;
    }

    private void collect(String tag, List<DomNode> out) {
        if (type == Type.ELEMENT && tag.equals(name)) out.add(this);
        for (DomNode c : children) c.collect(tag, out);
    }

    /** Serialización compacta, útil en tests. */
    public String toHtml() {
        switch (type) {
            case TEXT: return text == null ? "" : text;
            case COMMENT: return "<!--" + name + "-->";
            default:
                StringBuilder sb = new StringBuilder("<").append(name);
                attributes.forEach((k, v) -> sb.append(' ').append(k).append("=\"").append(v).append('"'));
                sb.append('>');
                if (innerHtml != null) sb.append(innerHtml);
                else for (DomNode c : children) sb.append(c.toHtml());
                return sb.append("</").append(name).append('>').toString();
        }
    }

    // --- mutación (solo MemoryDom) ----------------------------------------

    void setText(String value) { this.text = value; }

    void setAttribute(String name, String value) { attributes.put(name, value); }

    void setProperty(String name, Object value) { properties.put(name, value); }

    void setInnerHtml(String html) { this.innerHtml = html; }

    void detach() {
        if (parent != null) {
            parent.children.remove(this);
            parent = null;
        }
    }

    void append(DomNode child) {
        child.detach();
        innerHtml = null;
        children.add(child);
        child.parent = this;
    }

    void insertBefore(DomNode anchor, DomNode child) {
        child.detach();
        int idx = children.indexOf(anchor);
        if (idx < 0) throw new IllegalStateException("el ancla no es hija de este nodo");
        children.add(idx, child);
        innerHtml = null;
        child.parent = this;
    }

    List<DomNode> takeChildren() {
        List<DomNode> out = new ArrayList<>(children);
        for (DomNode c : out) c.parent = null;
        children.clear();
        return out;
    }

    void kill() {
        alive = false;
        for (DomNode c : children) c.kill();
    }

    /** Este nodo y todos sus descendientes. */
    void subtree(List<DomNode> out) {
        out.add(this);
        for (DomNode c : children) c.subtree(out);
    }

    @Override
    public String toString() {
        return type == Type.ELEMENT ? "<" + name + "#" + id + ">" : type.name().toLowerCase(Locale.ROOT) + "#" + id;
    }
}
