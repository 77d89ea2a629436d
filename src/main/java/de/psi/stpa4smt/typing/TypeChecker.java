package de.psi.stpa4smt.typing;

import de.psi.stpa4smt.Err;
import de.psi.stpa4smt.ErrorType;
import de.psi.stpa4smt.ast.Action;
import de.psi.stpa4smt.ast.ControlSystem;
import de.psi.stpa4smt.ast.Expr;
import de.psi.stpa4smt.ast.Type;
import de.psi.stpa4smt.ast.Uca;

public final class TypeChecker extends Expr.Visitor<Type> {

    private final TypingContext ctx;

    private TypeChecker(TypingContext ctx) {
        this.ctx = ctx;
    }

    public static Type checkExpr(Expr e, TypingContext ctx) throws ErrorType {
        try {
            return new TypeChecker(ctx).visitThis(e);
        } catch (ErrorType ex) {
            throw ex;
        } catch (Err ex) {
            throw new AssertionError(ex);
        }
    }

    public static void checkAction(Action a, TypingContext ctx) throws ErrorType {
        for (Expr e : a.allowed) expectBool(e, ctx, "allowed constraint of action '" + a.name + "'");
        for (Expr e : a.required) expectBool(e, ctx, "required constraint of action '" + a.name + "'");
    }

    public static void checkSystem(ControlSystem s, TypingContext ctx) throws ErrorType {
        for (Expr e : s.invariants) expectBool(e, ctx, "invariant of component '" + s.name + "'");
        for (Action a : s.actions) checkAction(a, ctx);
        for (ControlSystem c : s.components) checkSystem(c, ctx);
    }

    public static void checkUca(Uca u, TypingContext ctx) throws ErrorType {
        expectBool(u.context, ctx, "context of " + u);
    }

    private static void expectBool(Expr e, TypingContext ctx, String where) throws ErrorType {
        final Type t = checkExpr(e, ctx);
        if (!t.equals(Type.BOOL))
            throw new ErrorType("Expected type bool for " + where + ", found " + t + ": " + e, e, Type.BOOL);
    }

    private Type expect(Expr e, Type expected, Expr whole) throws Err {
        final Type t = visitThis(e);
        if (!t.equals(expected))
            throw new ErrorType("Expected type " + expected + ", found " + t + " in " + whole, e, expected);
        return t;
    }

    @Override
    public Type visit(Expr.IntLit x) {
        return Type.INT;
    }

    @Override
    public Type visit(Expr.BoolLit x) {
        return Type.BOOL;
    }

    @Override
    public Type visit(Expr.Ref x) throws ErrorType {
        final Type t = ctx.lookup(x.name);
        if (t == null) throw new ErrorType("Unknown name '" + x.name + "'", x, null);
        return t;
    }

    @Override
    public Type visit(Expr.Not x) throws Err {
        expect(x.sub, Type.BOOL, x);
        return Type.BOOL;
    }

    @Override
    public Type visit(Expr.Binary x) throws Err {
        switch (x.op.category) {
            case LOGIC:
                expect(x.left, Type.BOOL, x);
                expect(x.right, Type.BOOL, x);
                return Type.BOOL;
            case COMPARE:
                expect(x.left, Type.INT, x);
                expect(x.right, Type.INT, x);
                return Type.BOOL;
            case ARITH:
                expect(x.left, Type.INT, x);
                expect(x.right, Type.INT, x);
                return Type.INT;
            case EQUALITY:
                expect(x.right, visitThis(x.left), x);
                return Type.BOOL;
            default:
                throw new AssertionError(x.op);
        }
    }
}
