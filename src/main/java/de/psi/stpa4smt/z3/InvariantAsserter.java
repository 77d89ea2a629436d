package de.psi.stpa4smt.z3;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.psi.stpa4smt.Err;
import de.psi.stpa4smt.ErrorInvariant;
import de.psi.stpa4smt.ast.ControlSystem;
import de.psi.stpa4smt.ast.Expr;
import de.psi.stpa4smt.ast.Ident;

/**
 * Asserts the invariants of every component permanently, top-down. Every
 * later query runs under the assumption that all invariants hold.
 */
public final class InvariantAsserter {

    private static final Logger logger = LoggerFactory.getLogger(InvariantAsserter.class);

    private InvariantAsserter() {
    }

    public static void assertInvariants(Z3Environment env) throws Err {
        env.checkIdle("assert invariants");
        go(env, env.system, null);
    }

    private static void go(Z3Environment env, ControlSystem s, Ident parent) throws Err {
        final Ident qualifier = Ident.of(parent, s.name);
        if (!s.invariants.isEmpty()) {
            final Expr inv = Expr.conj(s.invariants);
            logger.debug("assert invariant of {}: {}", qualifier, inv);
            env.add(env.translate(inv));
        }
        if (!env.check("invariants of " + qualifier))
            throw new ErrorInvariant("System assumptions are impossible: invariants of '" + qualifier
                    + "' contradict the invariants declared before them", qualifier);
        for (ControlSystem c : s.components) go(env, c, qualifier);
    }
}
