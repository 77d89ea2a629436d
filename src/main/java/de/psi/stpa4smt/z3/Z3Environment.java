package de.psi.stpa4smt.z3;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;

import de.psi.stpa4smt.Err;
import de.psi.stpa4smt.ErrorFatal;
import de.psi.stpa4smt.ast.ControlSystem;
import de.psi.stpa4smt.ast.Expr;
import de.psi.stpa4smt.ast.Ident;
import de.psi.stpa4smt.typing.TypingContext;

/**
 * The live solver state of one analysis run: the Z3 context and solver, the
 * term for every identifier, and the ordered elements of every finite type.
 * <p>
 * Not thread-safe. Every {@link #push()} must be matched by one
 * {@link #pop()} on every exit path, or later queries inherit stale
 * assertions.
 */
public final class Z3Environment implements AutoCloseable {

    public final ControlSystem system;
    public final TypingContext typing;
    public final Context ctx;
    public final Solver solver;

    /** Identifier to term, in declaration order. */
    public final Map<Ident, com.microsoft.z3.Expr> terms;

    /** Finite type to its elements, in declaration order. */
    public final Map<Ident, List<Ident>> elements;

    private final Z3Translator translator;
    private ScenarioEnumerator active;
    private boolean closed;

    Z3Environment(ControlSystem system, TypingContext typing, Context ctx, Solver solver,
                  Map<Ident, com.microsoft.z3.Expr> terms, Map<Ident, List<Ident>> elements) {
        this.system = system;
        this.typing = typing;
        this.ctx = ctx;
        this.solver = solver;
        this.terms = Collections.unmodifiableMap(terms);
        this.elements = Collections.unmodifiableMap(elements);
        this.translator = new Z3Translator(ctx, this.terms);
    }

    public BoolExpr translate(Expr e) throws Err {
        return translator.translateBool(e);
    }

    public com.microsoft.z3.Expr term(Ident name) {
        return terms.get(name);
    }

    public void push() {
        solver.push();
    }

    public void pop() {
        solver.pop();
    }

    /** Pops scopes until the solver is back at {@code depth}. */
    void popTo(int depth) {
        int n = solver.getNumScopes() - depth;
        if (n > 0) solver.pop(n);
    }

    public int scopeDepth() {
        return solver.getNumScopes();
    }

    public void add(BoolExpr formula) {
        solver.add(formula);
    }

    /**
     * Checks the current assertions.
     *
     * @return true if satisfiable, false if unsatisfiable
     * @throws ErrorFatal if the solver cannot decide
     */
    public boolean check(String what) throws ErrorFatal {
        final Status status = solver.check();
        switch (status) {
            case SATISFIABLE: return true;
            case UNSATISFIABLE: return false;
            default:
                throw new ErrorFatal("Solver could not decide " + what + ": " + solver.getReasonUnknown());
        }
    }

    public Model model() {
        return solver.getModel();
    }

    /** The enumerator currently holding a scope, or null. */
    public ScenarioEnumerator activeEnumerator() {
        return active;
    }

    void checkIdle(String what) {
        if (closed) throw new IllegalStateException("solver environment is closed");
        if (active != null)
            throw new IllegalStateException("cannot " + what + " while a scenario enumeration is open");
    }

    void acquire(ScenarioEnumerator e) {
        checkIdle("start a scenario enumeration");
        active = e;
    }

    void release(ScenarioEnumerator e) {
        if (active == e) active = null;
    }

    public boolean isClosed() {
        return closed;
    }

    /** Releases the native Z3 context. */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        active = null;
        ctx.close();
    }
}
