package de.psi.stpa4smt.ast;

import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A possibly qualified name such as {@code sys.aircraft.landing}.
 * <p>
 * Identifiers are interned: {@link #of(Ident, String)} returns the same
 * instance for the same path, so identity equality and the default hash
 * code are structural.
 * <p>
 * The intern table is a process-lifetime cache and is never evicted. A host
 * that analyses an unbounded stream of unrelated systems keeps every name
 * it has seen.
 */
public final class Ident {

    private static final ConcurrentMap<Key, Ident> table = new ConcurrentHashMap<Key, Ident>();

    private final Ident qualifier;
    private final String name;
    private final String text;

    private Ident(Ident qualifier, String name) {
        this.qualifier = qualifier;
        this.name = name;
        this.text = qualifier == null ? name : qualifier.text + "." + name;
    }

    public static Ident of(Ident qualifier, String name) {
        if (name == null || name.isEmpty() || name.indexOf('.') >= 0)
            throw new IllegalArgumentException("bad identifier segment: '" + name + "'");
        final Key key = new Key(qualifier, name);
        Ident id = table.get(key);
        if (id == null) {
            final Ident fresh = new Ident(qualifier, name);
            id = table.putIfAbsent(key, fresh);
            if (id == null) id = fresh;
        }
        return id;
    }

    public static Ident of(String name) {
        return of(null, name);
    }

    public static Ident parse(String dotted) {
        Ident result = null;
        for (String seg : dotted.split("\\.", -1)) {
            result = of(result, seg);
        }
        return result;
    }

    public static Ident ofList(List<String> segments) {
        if (segments.isEmpty()) throw new IllegalArgumentException("empty identifier");
        Ident result = null;
        for (String seg : segments) result = of(result, seg);
        return result;
    }

    public Ident getQualifier() {
        return qualifier;
    }

    public String getName() {
        return name;
    }

    public Ident child(String name) {
        return of(this, name);
    }

    public List<String> toList() {
        LinkedList<String> result = new LinkedList<String>();
        for (Ident id = this; id != null; id = id.qualifier) result.addFirst(id.name);
        return result;
    }

    @Override
    public String toString() {
        return text;
    }

    private static final class Key {
        private final Ident qualifier;
        private final String name;

        Key(Ident qualifier, String name) {
            this.qualifier = qualifier;
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Key)) return false;
            Key k = (Key) o;
            return qualifier == k.qualifier && name.equals(k.name);
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(qualifier) + name.hashCode();
        }
    }
}
