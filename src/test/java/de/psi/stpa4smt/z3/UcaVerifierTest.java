package de.psi.stpa4smt.z3;

import static de.psi.stpa4smt.Examples.*;
import static de.psi.stpa4smt.ast.Expr.*;
import static org.junit.Assert.*;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Test;

import de.psi.stpa4smt.Analysis;
import de.psi.stpa4smt.AnalysisOptions;
import de.psi.stpa4smt.BruteForce;
import de.psi.stpa4smt.ErrorReference;
import de.psi.stpa4smt.Scenario;
import de.psi.stpa4smt.ast.Action;
import de.psi.stpa4smt.ast.ControlSystem;
import de.psi.stpa4smt.ast.Ident;
import de.psi.stpa4smt.ast.Type;
import de.psi.stpa4smt.ast.Uca;

public class UcaVerifierTest {

    private Analysis analysis;

    private Z3Environment prepare(ControlSystem sys) throws Exception {
        analysis = Analysis.prepare(sys, new AnalysisOptions());
        return analysis.environment();
    }

    @After
    public void tearDown() {
        if (analysis != null) analysis.close();
    }

    @Test
    public void brakesWithoutWeightOnWheels() throws Exception {
        Z3Environment env = prepare(aircraft());
        Scenario cex = UcaVerifier.verify(env, brakesWithoutWeight());
        assertNotNull(cex);
        assertTrue(cex.getBool(LANDING));
        assertSame(WET, cex.getElement(RUNWAY));
        assertFalse(cex.getBool(WOW));
        assertTrue(cex.getBool(HIT_BRAKES_ALLOWED));
        assertFalse(cex.getBool(HIT_BRAKES_REQUIRED));
        assertFalse(cex.has(DRY));
        assertEquals(0, env.scopeDepth());
    }

    @Test
    public void landingWithoutBrakesIsRuledOut() throws Exception {
        Z3Environment env = prepare(aircraft());
        assertNull(UcaVerifier.verify(env, noBrakesWhileLanding()));
        assertNull(UcaVerifier.verify(env, Arrays.asList(noBrakesWhileLanding())));
        assertEquals(0, env.scopeDepth());
    }

    @Test
    public void firstCounterexampleWins() throws Exception {
        Z3Environment env = prepare(aircraft());
        Scenario expected = UcaVerifier.verify(env, brakesWithoutWeight());
        assertEquals(expected, UcaVerifier.verify(env, Arrays.asList(brakesWithoutWeight(), noBrakesWhileLanding())));
        assertEquals(expected, UcaVerifier.verify(env, Arrays.asList(noBrakesWhileLanding(), brakesWithoutWeight())));
        assertNull(UcaVerifier.verify(env, Collections.<Uca>emptyList()));
    }

    @Test
    public void repeatedVerificationAgrees() throws Exception {
        Z3Environment env = prepare(aircraft());
        List<Uca> ucas = Arrays.asList(noBrakesWhileLanding(), brakesWithoutWeight());
        Scenario first = UcaVerifier.verify(env, ucas);
        for (int i = 0; i < 3; ++i) {
            assertEquals(first, UcaVerifier.verify(env, ucas));
            assertEquals(0, env.scopeDepth());
        }
    }

    @Test
    public void pumpCounterexample() throws Exception {
        Z3Environment env = prepare(plant());
        Uca u = new Uca(START, Uca.Direction.NOT_ISSUED, and(ref(DEMAND), eq(ref(MODE), ref(IDLE))));
        Scenario cex = UcaVerifier.verify(env, u);
        assertNotNull(cex);
        assertTrue(cex.getBool(DEMAND));
        assertSame(IDLE, cex.getElement(MODE));
        assertTrue(cex.getBool(PRESSURE_HIGH));
        assertTrue(cex.getBool(ALARM));
        assertFalse(cex.getBool(Action.allowedIndicator(START)));
        assertFalse(cex.getBool(Action.requiredIndicator(START)));
        assertTrue(cex.getBool(Action.allowedIndicator(STOP)));
        assertFalse(cex.getBool(Action.requiredIndicator(STOP)));
    }

    private static List<Uca> plantUcas() {
        return Arrays.asList(
                new Uca(START, Uca.Direction.ISSUED, ref(PRESSURE_HIGH)),
                new Uca(START, Uca.Direction.NOT_ISSUED, and(ref(DEMAND), eq(ref(MODE), ref(IDLE)))),
                new Uca(STOP, Uca.Direction.ISSUED, eq(ref(MODE), ref(OFF))),
                new Uca(STOP, Uca.Direction.NOT_ISSUED, and(ref(ALARM), eq(ref(MODE), ref(RUN)))),
                new Uca(STOP, Uca.Direction.NOT_ISSUED, ref(ALARM)),
                new Uca(START, Uca.Direction.ISSUED, not(ref(DEMAND))));
    }

    @Test
    public void agreesWithExhaustiveSearch() throws Exception {
        Z3Environment env = prepare(plant());
        BruteForce bf = new BruteForce(plant());
        List<Map<Ident, Object>> states = bf.states();
        for (Uca u : plantUcas()) {
            Scenario cex = UcaVerifier.verify(env, u);
            List<Map<Ident, Object>> violations = bf.violations(u);
            if (cex == null) {
                assertTrue(u + " has violations " + violations, violations.isEmpty());
            } else {
                List<Map<Ident, Object>> matching = BruteForce.matching(states, cex);
                assertFalse(u + ": " + cex + " is not a reachable state", matching.isEmpty());
                for (Map<Ident, Object> s : matching) assertTrue(u + ": " + s, bf.violates(u, s));
            }
        }
    }

    @Test
    public void verdictsForPlant() throws Exception {
        Z3Environment env = prepare(plant());
        List<Uca> ucas = plantUcas();
        boolean[] verified = { true, false, true, true, false, false };
        for (int i = 0; i < ucas.size(); ++i) {
            assertEquals(ucas.get(i).toString(), verified[i], UcaVerifier.verify(env, ucas.get(i)) == null);
        }
        Scenario alarmed = UcaVerifier.verify(env, ucas.get(4));
        assertSame(OFF, alarmed.getElement(MODE));
        assertTrue(alarmed.getBool(ALARM));
        assertFalse(alarmed.getBool(DEMAND));
    }

    @Test
    public void integerCounterexample() throws Exception {
        Ident n = Ident.parse("s.n");
        Ident go = Ident.parse("s.go");
        Z3Environment env = prepare(ControlSystem.builder("s")
                .var("n", Type.INT)
                .action(new Action("go", Arrays.asList(gt(ref(n), num(0))), Arrays.asList(ge(ref(n), num(10)))))
                .build());
        assertNull(UcaVerifier.verify(env, new Uca(go, Uca.Direction.ISSUED, lt(ref(n), num(1)))));
        // n div 2 = 0 and n <= 0 leaves n = 0
        Scenario cex = UcaVerifier.verify(env, new Uca(go, Uca.Direction.NOT_ISSUED, eq(div(ref(n), num(2)), num(0))));
        assertEquals(BigInteger.ZERO, cex.getInt(n));
        cex = UcaVerifier.verify(env, new Uca(go, Uca.Direction.NOT_ISSUED, eq(minus(mult(ref(n), num(3)), num(1)), num(-16))));
        assertEquals(BigInteger.valueOf(-5), cex.getInt(n));
    }

    @Test
    public void unresolvedAction() throws Exception {
        Z3Environment env = prepare(aircraft());
        Ident missing = Ident.parse("sys.aircraft.deploy_spoilers");
        try {
            UcaVerifier.verify(env, Arrays.asList(noBrakesWhileLanding(), new Uca(missing, Uca.Direction.ISSUED, TRUE)));
            fail();
        } catch (ErrorReference ex) {
            assertSame(missing, ex.name);
        }
        assertEquals(0, env.scopeDepth());
        assertNotNull(UcaVerifier.verify(env, brakesWithoutWeight()));
    }

    @Test
    public void refusedWhileEnumerating() throws Exception {
        Z3Environment env = prepare(aircraft());
        ScenarioEnumerator e = ScenarioEnumerator.allowed(env, HIT_BRAKES);
        try {
            UcaVerifier.verify(env, brakesWithoutWeight());
            fail();
        } catch (IllegalStateException ex) {
            assertTrue(ex.getMessage().contains("scenario enumeration is open"));
        } finally {
            e.close();
        }
        assertNotNull(UcaVerifier.verify(env, brakesWithoutWeight()));
    }
}
