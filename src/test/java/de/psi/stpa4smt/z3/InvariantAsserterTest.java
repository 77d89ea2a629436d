package de.psi.stpa4smt.z3;

import static de.psi.stpa4smt.ast.Expr.*;
import static org.junit.Assert.*;

import org.junit.Test;

import de.psi.stpa4smt.AnalysisOptions;
import de.psi.stpa4smt.Examples;
import de.psi.stpa4smt.ErrorInvariant;
import de.psi.stpa4smt.ast.ControlSystem;
import de.psi.stpa4smt.ast.Ident;
import de.psi.stpa4smt.ast.Type;
import de.psi.stpa4smt.typing.TypingContext;

public class InvariantAsserterTest {

    private static Z3Environment setup(ControlSystem sys) throws Exception {
        return Z3Setup.setup(sys, TypingContext.build(sys), new AnalysisOptions());
    }

    @Test
    public void aircraft() throws Exception {
        Z3Environment env = setup(Examples.aircraft());
        try {
            InvariantAsserter.assertInvariants(env);
            assertEquals(0, env.scopeDepth());
            // landing on a dry runway now forces weight on the wheels
            env.push();
            env.add(env.translate(and(and(ref(Examples.LANDING), eq(ref(Examples.RUNWAY), ref(Examples.DRY))),
                    not(ref(Examples.WOW)))));
            assertFalse(env.check("dry landing without weight"));
            env.pop();
            assertTrue(env.check("aircraft"));
        } finally {
            env.close();
        }
    }

    @Test
    public void contradictionAcrossComponents() throws Exception {
        Z3Environment env = setup(ControlSystem.builder("s")
                .var("x", Type.BOOL)
                .invariant(ref("s.x"))
                .component(ControlSystem.builder("ok").invariant(TRUE).build())
                .component(ControlSystem.builder("c").invariant(not(ref("s.x"))).build())
                .build());
        try {
            InvariantAsserter.assertInvariants(env);
            fail();
        } catch (ErrorInvariant ex) {
            assertSame(Ident.parse("s.c"), ex.component);
            assertTrue(ex.msg, ex.msg.startsWith("System assumptions are impossible: invariants of 's.c'"));
        } finally {
            env.close();
        }
    }

    @Test
    public void contradictionWithinComponent() throws Exception {
        Z3Environment env = setup(ControlSystem.builder("s")
                .var("n", Type.INT)
                .invariant(gt(ref("s.n"), num(3)))
                .invariant(lt(ref("s.n"), num(2)))
                .build());
        try {
            InvariantAsserter.assertInvariants(env);
            fail();
        } catch (ErrorInvariant ex) {
            assertSame(Ident.of("s"), ex.component);
        } finally {
            env.close();
        }
    }

    @Test(expected = IllegalStateException.class)
    public void closedEnvironment() throws Exception {
        Z3Environment env = setup(Examples.aircraft());
        env.close();
        InvariantAsserter.assertInvariants(env);
    }
}
