package de.psi.stpa4smt.z3;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.z3.BoolExpr;

import de.psi.stpa4smt.Err;
import de.psi.stpa4smt.Scenario;
import de.psi.stpa4smt.ast.Action;
import de.psi.stpa4smt.ast.Expr;
import de.psi.stpa4smt.ast.Helpers;
import de.psi.stpa4smt.ast.Ident;

/**
 * Enumerates, one solver call per {@link #step()}, every distinct scenario
 * satisfying an action's allowed (or required) constraints under the
 * asserted invariants.
 * <p>
 * Opening an enumerator pushes a scope on the shared solver; each scenario
 * found is blocked by asserting the negation of its pinned values inside
 * that scope. The scope is popped when the enumeration runs out or when
 * {@link #close()} is called. Only one enumerator may be open per
 * environment, and an abandoned enumerator must be closed by the caller.
 */
public final class ScenarioEnumerator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ScenarioEnumerator.class);

    private final Z3Environment env;
    private final String label;
    private final int depth;
    private final List<BoolExpr> blocking = new ArrayList<BoolExpr>();
    private boolean open;

    private ScenarioEnumerator(Z3Environment env, String label, Expr target) throws Err {
        this.env = env;
        this.label = label;
        final BoolExpr formula = env.translate(target);
        env.acquire(this);
        this.depth = env.scopeDepth();
        this.open = true;
        env.push();
        env.add(formula);
        logger.debug("Enumerating {}: {}", label, target);
    }

    /** Scenarios in which every allowed constraint of {@code action} holds. */
    public static ScenarioEnumerator allowed(Z3Environment env, Ident action) throws Err {
        final Action a = Helpers.getActionByName(env.system, action);
        return new ScenarioEnumerator(env, "scenarios allowing " + action, Expr.conj(a.allowed));
    }

    /** Scenarios in which some required constraint of {@code action} holds. */
    public static ScenarioEnumerator required(Z3Environment env, Ident action) throws Err {
        final Action a = Helpers.getActionByName(env.system, action);
        return new ScenarioEnumerator(env, "scenarios requiring " + action, Expr.disj(a.required));
    }

    /**
     * Finds the next scenario not returned before.
     *
     * @return the scenario, or null once no further scenario exists (the
     *         enumerator is then closed)
     */
    public Scenario step() throws Err {
        if (!open) return null;
        boolean ok = false;
        try {
            if (!env.check(label)) {
                logger.debug("{}: exhausted after {} scenarios", label, blocking.size());
                ok = true;
                close();
                return null;
            }
            final Scenario s = ScenarioDecoder.decode(env, env.model());
            final BoolExpr block = env.ctx.mkNot(ScenarioDecoder.pin(env, s));
            env.add(block);
            blocking.add(block);
            logger.debug("{}: {}", label, s);
            ok = true;
            return s;
        } finally {
            if (!ok) close();
        }
    }

    /** Runs the enumeration to the end. */
    public List<Scenario> drain() throws Err {
        final List<Scenario> result = new ArrayList<Scenario>();
        for (Scenario s = step(); s != null; s = step()) result.add(s);
        return result;
    }

    /** Blocking clauses asserted so far, one per scenario returned. */
    public List<BoolExpr> blockingClauses() {
        return Collections.unmodifiableList(blocking);
    }

    public boolean isOpen() {
        return open;
    }

    /** Pops the enumeration scope. Safe to call more than once. */
    @Override
    public void close() {
        if (!open) return;
        open = false;
        if (!env.isClosed()) env.popTo(depth);
        env.release(this);
    }
}
