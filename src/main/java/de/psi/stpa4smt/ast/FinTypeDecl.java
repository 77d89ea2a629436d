package de.psi.stpa4smt.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class FinTypeDecl {
    public final String name;
    public final List<String> elements;

    public FinTypeDecl(String name, List<String> elements) {
        this.name = name;
        this.elements = Collections.unmodifiableList(new ArrayList<String>(elements));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FinTypeDecl)) return false;
        FinTypeDecl d = (FinTypeDecl) o;
        return name.equals(d.name) && elements.equals(d.elements);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + elements.hashCode();
    }

    @Override
    public String toString() {
        return "type " + name + " " + elements;
    }
}
