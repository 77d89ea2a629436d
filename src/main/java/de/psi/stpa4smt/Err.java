package de.psi.stpa4smt;

public abstract class Err extends Exception {

    private static final long serialVersionUID = 1L;

    public final String msg;

    protected Err(String msg) {
        this(msg, null);
    }

    protected Err(String msg, Throwable cause) {
        super(msg == null ? "" : msg, cause);
        this.msg = msg == null ? "" : msg;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + ": " + msg;
    }
}
