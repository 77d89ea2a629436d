package de.psi.stpa4smt.ast;

public final class Type {

    public enum Kind { INT, BOOL, NAMED }

    public static final Type INT = new Type(Kind.INT, null);
    public static final Type BOOL = new Type(Kind.BOOL, null);

    public final Kind kind;

    // null unless NAMED
    public final Ident name;

    private Type(Kind kind, Ident name) {
        this.kind = kind;
        this.name = name;
    }

    public static Type named(Ident name) {
        if (name == null) throw new IllegalArgumentException("finite type needs a name");
        return new Type(Kind.NAMED, name);
    }

    public boolean isNamed() {
        return kind == Kind.NAMED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Type)) return false;
        Type t = (Type) o;
        return kind == t.kind && name == t.name;
    }

    @Override
    public int hashCode() {
        return kind.hashCode() * 31 + (name == null ? 0 : name.hashCode());
    }

    @Override
    public String toString() {
        switch (kind) {
            case INT: return "int";
            case BOOL: return "bool";
            default: return name.toString();
        }
    }
}
