package de.psi.stpa4smt.z3;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.z3.BoolExpr;

import de.psi.stpa4smt.Err;
import de.psi.stpa4smt.Scenario;
import de.psi.stpa4smt.ast.Action;
import de.psi.stpa4smt.ast.Helpers;
import de.psi.stpa4smt.ast.Uca;

/**
 * Checks that the declared constraints rule out each UCA.
 * <p>
 * For a UCA issued in context C the query is
 * {@code C and (allowed or required)}; for a UCA not issued in context C it
 * is {@code C and not allowed and not required}. Each query runs in its own
 * scope on top of the invariants and indicator definitions. An unsatisfiable
 * query means the UCA is verified; a model is a counterexample.
 */
public final class UcaVerifier {

    private static final Logger logger = LoggerFactory.getLogger(UcaVerifier.class);

    private UcaVerifier() {
    }

    /**
     * Verifies {@code ucas} in order and stops at the first counterexample.
     *
     * @return the counterexample, or null if every UCA is verified
     */
    public static Scenario verify(Z3Environment env, List<Uca> ucas) throws Err {
        env.checkIdle("verify UCAs");
        for (Uca u : ucas) {
            final Scenario counterexample = verify(env, u);
            if (counterexample != null) return counterexample;
        }
        return null;
    }

    /**
     * Verifies one UCA.
     *
     * @return the counterexample, or null if the UCA is ruled out
     */
    public static Scenario verify(Z3Environment env, Uca u) throws Err {
        env.checkIdle("verify UCAs");
        logger.debug("Checking {}", u);
        Helpers.getActionByName(env.system, u.action);
        final BoolExpr allowed = (BoolExpr) env.term(Action.allowedIndicator(u.action));
        final BoolExpr required = (BoolExpr) env.term(Action.requiredIndicator(u.action));
        final BoolExpr context = env.translate(u.context);

        final BoolExpr query;
        switch (u.direction) {
            case ISSUED:
                query = env.ctx.mkAnd(context, env.ctx.mkOr(allowed, required));
                break;
            case NOT_ISSUED:
                query = env.ctx.mkAnd(context, env.ctx.mkNot(allowed), env.ctx.mkNot(required));
                break;
            default:
                throw new AssertionError(u.direction);
        }

        final int depth = env.scopeDepth();
        env.push();
        try {
            env.add(query);
            if (env.check(u.toString())) {
                final Scenario counterexample = ScenarioDecoder.decode(env, env.model());
                logger.info("Failed to verify {}. Counterexample: {}", u, counterexample);
                return counterexample;
            }
            logger.info("UCA verified: {}", u);
            return null;
        } finally {
            env.popTo(depth);
        }
    }
}
