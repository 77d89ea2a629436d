package de.psi.stpa4smt;

import de.psi.stpa4smt.ast.Ident;

public final class ErrorSetup extends Err {

    private static final long serialVersionUID = 1L;

    public final transient Ident action;

    // null unless the action can be required while not allowed
    public final transient Scenario witness;

    public ErrorSetup(String msg, Ident action, Scenario witness) {
        super(msg);
        this.action = action;
        this.witness = witness;
    }
}
