package com.ciro.viewc.ast;

/** Utilidades sobre los nombres de tipo ({@code int}, {@code Row[]}, ...). */
public final class Types {

    private Types() {}

    public static boolean isArray(String type) {
        return type != null && type.endsWith("[]");
    }

    public static String elementType(String type) {
        return isArray(type) ? type.substring(0, type.length() - 2) : type;
    }

    /** "count" -> "onCountChange" */
    public static String changeCallback(String name) {
        return "on" + Character.toUpperCase(name.charAt(0)) + name.substring(1) + "Change";
    }
}
