package de.psi.stpa4smt;

public final class ErrorConfig extends Err {

    private static final long serialVersionUID = 1L;

    public ErrorConfig(String msg) {
        super(msg);
    }
}
