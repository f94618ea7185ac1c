package com.ciro.viewc.lower;

/** Dónde escribe una binding dentro de su nodo. */
public enum SiteKind {
    ATTRIBUTE,
    /** {@code value}, {@code checked}, {@code selected}: se escriben como propiedad. */
    PROPERTY,
    TEXT,
    INNER_HTML;

    public static SiteKind forAttribute(String name) {
        switch (name) {
            case "value":
            case "checked":
            case "selected":
                return PROPERTY;
            default:
                return ATTRIBUTE;
        }
    }
}
