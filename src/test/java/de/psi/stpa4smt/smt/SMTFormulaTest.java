package de.psi.stpa4smt.smt;

import java.util.Arrays;

import org.junit.Test;

import de.psi.stpa4smt.ast.Ident;

import static org.junit.Assert.*;

public class SMTFormulaTest {

    private static final String HEADER = "(set-logic ALL)\n(set-info :smt-lib-version 2.6)\n";

    @Test
    public void simple() {
        SMTFormula form = new SMTFormula();
        assertEquals(HEADER, form.toString());
    }

    @Test
    public void constraints() {
        SMTFormula form = new SMTFormula();
        SExpr<Ident> c = SExpr.call("=", SExpr.<Ident>num(5), SExpr.call("+", SExpr.<Ident>num(2), SExpr.<Ident>num(3)));
        form.addConstraint(c);
        assertEquals(HEADER + "(assert (= 5 (+ 2 3)))\n", form.toString());
    }

    @Test
    public void variables() {
        SMTFormula form = new SMTFormula();
        Ident sup = Ident.of("super");
        Ident dup = Ident.of("duper");
        form.addBoolVariable(sup);
        form.addIntegerVariable(dup);
        SExpr<Ident> c = SExpr.eq(SExpr.leaf(sup), SExpr.eq(SExpr.leaf(dup), SExpr.<Ident>num(1)));
        form.addConstraint(c);
        assertEquals("(declare-fun super () Bool)\n" +
                "(declare-fun duper () Int)\n", form.getVariableDecls());
        assertEquals("(assert (= super (= duper 1)))\n", form.getConstraints());
        assertEquals(HEADER +
                "(declare-fun super () Bool)\n" +
                "(declare-fun duper () Int)\n" +
                "(assert (= super (= duper 1)))\n", form.toString());
    }

    @Test
    public void enumTypes() {
        SMTFormula form = new SMTFormula();
        Ident type = Ident.parse("sys.DryOrWet");
        Ident dry = Ident.parse("sys.dry");
        Ident runway = Ident.parse("sys.environment.runway_status");
        form.addEnumType(type, Arrays.asList(dry, Ident.parse("sys.wet")));
        form.addEnumVariable(runway, type);
        form.addConstraint(SExpr.eq(SExpr.leaf(runway), SExpr.leaf(dry)));
        assertEquals(HEADER +
                "(declare-datatype sys.DryOrWet ((sys.dry) (sys.wet)))\n" +
                "(declare-fun sys.environment.runway_status () sys.DryOrWet)\n" +
                "(assert (= sys.environment.runway_status sys.dry))\n", form.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void undeclaredSort() {
        new SMTFormula().addEnumVariable(Ident.of("x"), Ident.of("Nowhere"));
    }

    @Test
    public void undeclaredSymbol() {
        SMTFormula form = new SMTFormula();
        form.addBoolVariable(Ident.of("a"));
        try {
            form.addConstraint(SExpr.and(SExpr.leaf(Ident.of("a")), SExpr.leaf(Ident.of("b"))));
            fail();
        } catch (IllegalArgumentException ex) {
            assertTrue(ex.getMessage().contains("undeclared symbol b"));
        }
        assertEquals("", form.getConstraints());
    }

    @Test
    public void queries() {
        SMTFormula form = new SMTFormula();
        Ident a = Ident.of("a");
        form.addBoolVariable(a);
        form.addQuery("a can\nhold", SExpr.leaf(a));
        assertEquals(HEADER +
                "(declare-fun a () Bool)\n" +
                "; a can hold\n" +
                "(push 1)\n" +
                "(assert a)\n" +
                "(check-sat)\n" +
                "(pop 1)\n", form.toString());
    }

    @Test
    public void commandsKeepTheirOrder() {
        SMTFormula form = new SMTFormula();
        Ident a = Ident.of("a");
        Ident b = Ident.of("b");
        form.addBoolVariable(a);
        form.addBoolVariable(b);
        form.addConstraint(SExpr.leaf(a));
        form.addCheck("a holds");
        form.addQuery("b can fail", SExpr.not(SExpr.leaf(b)));
        form.addConstraint(SExpr.leaf(b));
        assertEquals("(assert a)\n(assert b)\n", form.getConstraints());
        assertEquals(HEADER +
                "(declare-fun a () Bool)\n" +
                "(declare-fun b () Bool)\n" +
                "(assert a)\n" +
                "; a holds\n" +
                "(check-sat)\n" +
                "; b can fail\n" +
                "(push 1)\n" +
                "(assert (not b))\n" +
                "(check-sat)\n" +
                "(pop 1)\n" +
                "(assert b)\n", form.toString());
    }
}
