package com.ciro.viewc.deps;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** Conjunto de dependencias de una expresión: nombres de estado y pares objeto.miembro. */
public final class Dependencies {

    public static final Dependencies NONE = new Dependencies(Set.of(), Set.of());

    private final Set<String> names;
    private final Set<MemberDependency> members;

    public Dependencies(Set<String> names, Set<MemberDependency> members) {
        this.names = Collections.unmodifiableSet(new LinkedHashSet<>(names));
        this.members = Collections.unmodifiableSet(new LinkedHashSet<>(members));
    }

    public Set<String> names() { return names; }

    public Set<MemberDependency> members() { return members; }

    public boolean isEmpty() { return names.isEmpty() && members.isEmpty(); }

    public Dependencies union(Dependencies other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        Set<String> n = new LinkedHashSet<>(names);
        n.addAll(other.names);
        Set<MemberDependency> m = new LinkedHashSet<>(members);
        m.addAll(other.members);
        return new Dependencies(n, m);
    }

    public Dependencies without(Set<String> shadowed) {
        if (shadowed.isEmpty()) return this;
        Set<String> n = new LinkedHashSet<>(names);
        n.removeAll(shadowed);
        Set<MemberDependency> m = new LinkedHashSet<>();
        for (MemberDependency md : members) if (!shadowed.contains(md.object())) m.add(md);
        return new Dependencies(n, m);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Dependencies d && names.equals(d.names) && members.equals(d.members);
    }

    @Override
    public int hashCode() { return names.hashCode() * 31 + members.hashCode(); }

    @Override
    public String toString() { return "deps" + names + members; }
}
