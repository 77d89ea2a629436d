package de.psi.stpa4smt;

import de.psi.stpa4smt.ast.Ident;

public final class ErrorInvariant extends Err {

    private static final long serialVersionUID = 1L;

    public final transient Ident component;

    public ErrorInvariant(String msg, Ident component) {
        super(msg);
        this.component = component;
    }
}
