package de.psi.stpa4smt.ast;

import static de.psi.stpa4smt.ast.Expr.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.LinkedHashSet;

import org.junit.Test;

import de.psi.stpa4smt.Examples;
import de.psi.stpa4smt.ErrorReference;

public class HelpersTest {

    @Test
    public void actionByPath() throws Exception {
        ControlSystem sys = Examples.aircraft();
        Action a = Helpers.getActionByName(sys, Examples.HIT_BRAKES);
        assertEquals("hit_brakes", a.name);
        assertEquals(Arrays.asList(ref(Examples.LANDING)), a.allowed);
    }

    @Test
    public void componentByName() {
        ControlSystem sys = Examples.aircraft();
        assertEquals("wheels", Helpers.getComponentByName(sys.components, "wheels").name);
        assertNull(Helpers.getComponentByName(sys.components, "tower"));
        assertNull(Helpers.getActionByName(sys.actions, "hit_brakes"));
    }

    @Test
    public void unresolved() {
        ControlSystem sys = Examples.aircraft();
        String[] bad = {
            "hit_brakes",                    // no component
            "plane.aircraft.hit_brakes",     // wrong root
            "sys.tower.hit_brakes",          // no such component
            "sys.wheels.hit_brakes",         // action lives elsewhere
            "sys.aircraft.landing",          // a variable, not an action
        };
        for (String path : bad) {
            try {
                Helpers.getActionByName(sys, Ident.parse(path));
                fail(path);
            } catch (ErrorReference ex) {
                assertSame(Ident.parse(path), ex.name);
                assertTrue(ex.msg, ex.msg.contains(path));
            }
        }
    }

    @Test
    public void freeVars() {
        Expr e = when(and(ref("a"), eq(ref("m"), ref("x"))), or(not(ref("a")), gt(ref("n"), num(3))));
        assertEquals(new LinkedHashSet<Ident>(Arrays.asList(Ident.of("a"), Ident.of("m"), Ident.of("x"), Ident.of("n"))),
                Helpers.freeVars(e));
        assertTrue(Helpers.freeVars(TRUE).isEmpty());
        assertEquals(2, Helpers.freeVars(Arrays.asList(ref("a"), not(ref("b")), ref("a"))).size());
    }
}
