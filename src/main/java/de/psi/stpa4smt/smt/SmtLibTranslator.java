package de.psi.stpa4smt.smt;

import java.util.List;

import de.psi.stpa4smt.Err;
import de.psi.stpa4smt.ast.Action;
import de.psi.stpa4smt.ast.ControlSystem;
import de.psi.stpa4smt.ast.Expr;
import de.psi.stpa4smt.ast.FinTypeDecl;
import de.psi.stpa4smt.ast.Helpers;
import de.psi.stpa4smt.ast.Ident;
import de.psi.stpa4smt.ast.Uca;
import de.psi.stpa4smt.ast.VarDecl;
import de.psi.stpa4smt.typing.TypingContext;

/**
 * Writes the analysis of a type-checked system as an SMT-LIB 2 script, so
 * the same queries can be replayed with any SMT-LIB solver.
 * <p>
 * Commands follow the order of the Z3 path: each indicator definition is
 * followed by a {@code (check-sat)} that must answer {@code sat}, then the
 * scoped required-but-not-allowed query of that action, which must answer
 * {@code unsat}; after all actions, each component's invariants followed by
 * a {@code (check-sat)} that must answer {@code sat}. Only if all of these
 * hold does an {@code unsat} UCA query mean the UCA is ruled out.
 */
public final class SmtLibTranslator extends Expr.Visitor<SExpr<Ident>> {

    private SmtLibTranslator() {
    }

    public static SExpr<Ident> translate(Expr e) {
        try {
            return new SmtLibTranslator().visitThis(e);
        } catch (Err ex) {
            throw new AssertionError(ex);
        }
    }

    public static SMTFormula translate(ControlSystem system, TypingContext typing, List<Uca> ucas) throws Err {
        final SMTFormula form = new SMTFormula();
        declare(form, typing, system, null);
        define(form, system, null);
        assertInvariants(form, system, null);
        for (Uca u : ucas) {
            Helpers.getActionByName(system, u.action);
            final SExpr<Ident> allowed = SExpr.leaf(Action.allowedIndicator(u.action));
            final SExpr<Ident> required = SExpr.leaf(Action.requiredIndicator(u.action));
            final SExpr<Ident> context = translate(u.context);
            switch (u.direction) {
                case ISSUED:
                    form.addQuery(u.toString(), SExpr.and(context, SExpr.or(allowed, required)));
                    break;
                case NOT_ISSUED:
                    form.addQuery(u.toString(), SExpr.and(context, SExpr.not(allowed), SExpr.not(required)));
                    break;
                default:
                    throw new AssertionError(u.direction);
            }
        }
        return form;
    }

    private static void declare(SMTFormula form, TypingContext typing, ControlSystem s, Ident parent) {
        final Ident qualifier = Ident.of(parent, s.name);
        for (FinTypeDecl tydecl : s.types) {
            final Ident name = qualifier.child(tydecl.name);
            form.addEnumType(name, typing.finTypes().get(name));
        }
        for (VarDecl vardecl : s.vars) {
            final Ident name = qualifier.child(vardecl.name);
            switch (vardecl.type.kind) {
                case BOOL: form.addBoolVariable(name); break;
                case INT: form.addIntegerVariable(name); break;
                case NAMED: form.addEnumVariable(name, vardecl.type.name); break;
                default: throw new AssertionError(vardecl.type);
            }
        }
        for (Action a : s.actions) {
            final Ident name = qualifier.child(a.name);
            form.addBoolVariable(Action.allowedIndicator(name));
            form.addBoolVariable(Action.requiredIndicator(name));
        }
        for (ControlSystem c : s.components) declare(form, typing, c, qualifier);
    }

    private static void define(SMTFormula form, ControlSystem s, Ident parent) {
        final Ident qualifier = Ident.of(parent, s.name);
        for (Action a : s.actions) {
            final Ident name = qualifier.child(a.name);
            final SExpr<Ident> allowed = SExpr.leaf(Action.allowedIndicator(name));
            final SExpr<Ident> required = SExpr.leaf(Action.requiredIndicator(name));
            form.addConstraint(SExpr.eq(allowed, translate(Expr.conj(a.allowed))));
            form.addCheck("allowed constraints of " + name + " (sat expected)");
            form.addConstraint(SExpr.eq(required, translate(Expr.disj(a.required))));
            form.addCheck("required constraints of " + name + " (sat expected)");
            form.addQuery("action " + name + " required but not allowed (unsat expected)",
                    SExpr.and(required, SExpr.not(allowed)));
        }
        for (ControlSystem c : s.components) define(form, c, qualifier);
    }

    private static void assertInvariants(SMTFormula form, ControlSystem s, Ident parent) {
        final Ident qualifier = Ident.of(parent, s.name);
        if (!s.invariants.isEmpty()) form.addConstraint(translate(Expr.conj(s.invariants)));
        form.addCheck("invariants of " + qualifier + " (sat expected)");
        for (ControlSystem c : s.components) assertInvariants(form, c, qualifier);
    }

    @Override
    public SExpr<Ident> visit(Expr.IntLit x) {
        return SExpr.num(x.value);
    }

    @Override
    public SExpr<Ident> visit(Expr.BoolLit x) {
        return SExpr.sym(x.value ? "true" : "false");
    }

    @Override
    public SExpr<Ident> visit(Expr.Ref x) {
        return SExpr.leaf(x.name);
    }

    @Override
    public SExpr<Ident> visit(Expr.Not x) throws Err {
        return SExpr.not(visitThis(x.sub));
    }

    @Override
    public SExpr<Ident> visit(Expr.Binary x) throws Err {
        final SExpr<Ident> l = visitThis(x.left);
        final SExpr<Ident> r = visitThis(x.right);
        switch (x.op) {
            case AND: return SExpr.call("and", l, r);
            case OR: return SExpr.call("or", l, r);
            case WHEN: return SExpr.call("=>", l, r);
            case EQ: return SExpr.eq(l, r);
            case LT: return SExpr.call("<", l, r);
            case LE: return SExpr.call("<=", l, r);
            case GT: return SExpr.call(">", l, r);
            case GE: return SExpr.call(">=", l, r);
            case PLUS: return SExpr.call("+", l, r);
            case MINUS: return SExpr.call("-", l, r);
            case MULT: return SExpr.call("*", l, r);
            case DIV: return SExpr.call("div", l, r);
            default: throw new AssertionError(x.op);
        }
    }
}
