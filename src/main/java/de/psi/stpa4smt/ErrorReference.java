package de.psi.stpa4smt;

import de.psi.stpa4smt.ast.Ident;

public final class ErrorReference extends Err {

    private static final long serialVersionUID = 1L;

    public final transient Ident name;

    public ErrorReference(String msg, Ident name) {
        super(msg);
        this.name = name;
    }
}
