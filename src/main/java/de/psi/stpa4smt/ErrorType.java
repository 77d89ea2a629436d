package de.psi.stpa4smt;

import de.psi.stpa4smt.ast.Expr;
import de.psi.stpa4smt.ast.Type;

public final class ErrorType extends Err {

    private static final long serialVersionUID = 1L;

    public final transient Expr expr;

    // null for an unknown name
    public final transient Type expected;

    public ErrorType(String msg, Expr expr, Type expected) {
        super(msg);
        this.expr = expr;
        this.expected = expected;
    }
}
