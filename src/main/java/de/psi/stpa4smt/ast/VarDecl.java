package de.psi.stpa4smt.ast;

public final class VarDecl {
    public final String name;
    public final Type type;

    public VarDecl(String name, Type type) {
        this.name = name;
        this.type = type;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof VarDecl)) return false;
        VarDecl d = (VarDecl) o;
        return name.equals(d.name) && type.equals(d.type);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + type.hashCode();
    }

    @Override
    public String toString() {
        return "var " + name + ": " + type;
    }
}
