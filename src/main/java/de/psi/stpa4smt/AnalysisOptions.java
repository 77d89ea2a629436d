package de.psi.stpa4smt;

public final class AnalysisOptions {

    // milliseconds per check, 0 for none
    public int timeoutMillis = 0;

    // null lets Z3 pick
    public String logic = null;

    public AnalysisOptions dup() {
        AnalysisOptions x = new AnalysisOptions();
        x.timeoutMillis = timeoutMillis;
        x.logic = logic;
        return x;
    }
}
