package de.psi.stpa4smt;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import de.psi.stpa4smt.ast.Ident;

public final class Scenario {

    private final Map<Ident, Object> values;

    public Scenario(Map<Ident, Object> values) {
        for (Map.Entry<Ident, Object> e : values.entrySet()) {
            Object v = e.getValue();
            if (!(v instanceof Boolean || v instanceof BigInteger || v instanceof Ident))
                throw new IllegalArgumentException("unsupported value for " + e.getKey() + ": " + v);
        }
        this.values = Collections.unmodifiableMap(new LinkedHashMap<Ident, Object>(values));
    }

    public Map<Ident, Object> values() {
        return values;
    }

    public boolean has(Ident name) {
        return values.containsKey(name);
    }

    public Object get(Ident name) {
        return values.get(name);
    }

    public boolean getBool(Ident name) {
        return (Boolean) require(name, Boolean.class);
    }

    public BigInteger getInt(Ident name) {
        return (BigInteger) require(name, BigInteger.class);
    }

    public Ident getElement(Ident name) {
        return (Ident) require(name, Ident.class);
    }

    private Object require(Ident name, Class<?> kind) {
        Object v = values.get(name);
        if (v == null) throw new IllegalArgumentException("no value for " + name + " in " + this);
        if (!kind.isInstance(v))
            throw new IllegalArgumentException(name + " is " + v + ", not a " + kind.getSimpleName());
        return v;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Scenario && ((Scenario) o).values.equals(values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<Ident, Object> e : values.entrySet()) {
            if (first) first = false; else sb.append(", ");
            sb.append(e.getKey()).append(": ").append(e.getValue());
        }
        return sb.append("}").toString();
    }
}
