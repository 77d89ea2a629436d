package de.psi.stpa4smt;

public final class ErrorFatal extends Err {

    private static final long serialVersionUID = 1L;

    public ErrorFatal(String msg) {
        super(msg);
    }

    public ErrorFatal(String msg, Throwable cause) {
        super(msg, cause);
    }
}
