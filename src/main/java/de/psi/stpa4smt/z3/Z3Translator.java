package de.psi.stpa4smt.z3;

import java.util.Map;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;

import de.psi.stpa4smt.Err;
import de.psi.stpa4smt.ErrorFatal;
import de.psi.stpa4smt.ast.Expr;
import de.psi.stpa4smt.ast.Ident;

public final class Z3Translator extends Expr.Visitor<com.microsoft.z3.Expr> {

    private final Context ctx;
    private final Map<Ident, com.microsoft.z3.Expr> env;

    public Z3Translator(Context ctx, Map<Ident, com.microsoft.z3.Expr> env) {
        this.ctx = ctx;
        this.env = env;
    }

    public BoolExpr translateBool(Expr e) throws Err {
        com.microsoft.z3.Expr t = visitThis(e);
        if (!(t instanceof BoolExpr)) throw new ErrorFatal("expected a boolean term for " + e + ", got " + t);
        return (BoolExpr) t;
    }

    private ArithExpr arith(Expr e) throws Err {
        com.microsoft.z3.Expr t = visitThis(e);
        if (!(t instanceof ArithExpr)) throw new ErrorFatal("expected an integer term for " + e + ", got " + t);
        return (ArithExpr) t;
    }

    @Override
    public com.microsoft.z3.Expr visit(Expr.IntLit x) {
        return ctx.mkInt(x.value);
    }

    @Override
    public com.microsoft.z3.Expr visit(Expr.BoolLit x) {
        return ctx.mkBool(x.value);
    }

    @Override
    public com.microsoft.z3.Expr visit(Expr.Ref x) throws ErrorFatal {
        com.microsoft.z3.Expr t = env.get(x.name);
        if (t == null) throw new ErrorFatal("'" + x.name + "' not found in solver environment");
        return t;
    }

    @Override
    public com.microsoft.z3.Expr visit(Expr.Not x) throws Err {
        return ctx.mkNot(translateBool(x.sub));
    }

    @Override
    public com.microsoft.z3.Expr visit(Expr.Binary x) throws Err {
        switch (x.op) {
            case AND: return ctx.mkAnd(translateBool(x.left), translateBool(x.right));
            case OR: return ctx.mkOr(translateBool(x.left), translateBool(x.right));
            case WHEN: return ctx.mkImplies(translateBool(x.left), translateBool(x.right));
            case EQ: return ctx.mkEq(visitThis(x.left), visitThis(x.right));
            case LT: return ctx.mkLt(arith(x.left), arith(x.right));
            case LE: return ctx.mkLe(arith(x.left), arith(x.right));
            case GT: return ctx.mkGt(arith(x.left), arith(x.right));
            case GE: return ctx.mkGe(arith(x.left), arith(x.right));
            case PLUS: return ctx.mkAdd(arith(x.left), arith(x.right));
            case MINUS: return ctx.mkSub(arith(x.left), arith(x.right));
            case MULT: return ctx.mkMul(arith(x.left), arith(x.right));
            case DIV: return ctx.mkDiv(integer(x.left), integer(x.right));
            default: throw new AssertionError(x.op);
        }
    }

    // Z3 div is integer division on Int operands only.
    private IntExpr integer(Expr e) throws Err {
        ArithExpr t = arith(e);
        if (t instanceof IntExpr) return (IntExpr) t;
        return ctx.mkReal2Int(t);
    }
}
