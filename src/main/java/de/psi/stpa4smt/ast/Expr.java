package de.psi.stpa4smt.ast;

import java.util.Iterator;
import java.util.List;

import de.psi.stpa4smt.Err;

public abstract class Expr {

    public static final Expr TRUE = new BoolLit(true);
    public static final Expr FALSE = new BoolLit(false);

    private Expr() {
    }

    public static Expr num(long value) {
        return new IntLit(value);
    }

    public static Expr bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Expr ref(Ident name) {
        return new Ref(name);
    }

    public static Expr ref(String dotted) {
        return new Ref(Ident.parse(dotted));
    }

    public static Expr not(Expr e) {
        return new Not(e);
    }

    public static Expr and(Expr left, Expr right) {
        return new Binary(BinaryOp.AND, left, right);
    }

    public static Expr or(Expr left, Expr right) {
        return new Binary(BinaryOp.OR, left, right);
    }

    public static Expr eq(Expr left, Expr right) {
        return new Binary(BinaryOp.EQ, left, right);
    }

    public static Expr when(Expr cond, Expr then) {
        return new Binary(BinaryOp.WHEN, cond, then);
    }

    public static Expr lt(Expr left, Expr right) {
        return new Binary(BinaryOp.LT, left, right);
    }

    public static Expr le(Expr left, Expr right) {
        return new Binary(BinaryOp.LE, left, right);
    }

    public static Expr gt(Expr left, Expr right) {
        return new Binary(BinaryOp.GT, left, right);
    }

    public static Expr ge(Expr left, Expr right) {
        return new Binary(BinaryOp.GE, left, right);
    }

    public static Expr plus(Expr left, Expr right) {
        return new Binary(BinaryOp.PLUS, left, right);
    }

    public static Expr minus(Expr left, Expr right) {
        return new Binary(BinaryOp.MINUS, left, right);
    }

    public static Expr mult(Expr left, Expr right) {
        return new Binary(BinaryOp.MULT, left, right);
    }

    public static Expr div(Expr left, Expr right) {
        return new Binary(BinaryOp.DIV, left, right);
    }

    // true if empty
    public static Expr conj(List<Expr> es) {
        return fold(BinaryOp.AND, es, TRUE);
    }

    // false if empty
    public static Expr disj(List<Expr> es) {
        return fold(BinaryOp.OR, es, FALSE);
    }

    private static Expr fold(BinaryOp op, List<Expr> es, Expr unit) {
        Iterator<Expr> it = es.iterator();
        if (!it.hasNext()) return unit;
        Expr result = it.next();
        while (it.hasNext()) result = new Binary(op, result, it.next());
        return result;
    }

    public abstract <T> T accept(Visitor<T> visitor) throws Err;

    public static final class IntLit extends Expr {
        public final long value;

        public IntLit(long value) {
            this.value = value;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) throws Err {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof IntLit && ((IntLit) o).value == value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    public static final class BoolLit extends Expr {
        public final boolean value;

        private BoolLit(boolean value) {
            this.value = value;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) throws Err {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BoolLit && ((BoolLit) o).value == value;
        }

        @Override
        public int hashCode() {
            return value ? 1231 : 1237;
        }

        @Override
        public String toString() {
            return value ? "true" : "false";
        }
    }

    public static final class Ref extends Expr {
        public final Ident name;

        public Ref(Ident name) {
            if (name == null) throw new IllegalArgumentException("null name");
            this.name = name;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) throws Err {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Ref && ((Ref) o).name == name;
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name.toString();
        }
    }

    public static final class Not extends Expr {
        public final Expr sub;

        public Not(Expr sub) {
            this.sub = sub;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) throws Err {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Not && ((Not) o).sub.equals(sub);
        }

        @Override
        public int hashCode() {
            return 17 * sub.hashCode() + 5;
        }

        @Override
        public String toString() {
            return "NOT " + sub;
        }
    }

    public static final class Binary extends Expr {
        public final BinaryOp op;
        public final Expr left;
        public final Expr right;

        public Binary(BinaryOp op, Expr left, Expr right) {
            this.op = op;
            this.left = left;
            this.right = right;
        }

        @Override
        public <T> T accept(Visitor<T> visitor) throws Err {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Binary)) return false;
            Binary b = (Binary) o;
            return op == b.op && left.equals(b.left) && right.equals(b.right);
        }

        @Override
        public int hashCode() {
            return (op.hashCode() * 31 + left.hashCode()) * 31 + right.hashCode();
        }

        @Override
        public String toString() {
            if (op == BinaryOp.WHEN) return "(WHEN " + left + ", " + right + ")";
            return "(" + left + " " + op.symbol + " " + right + ")";
        }
    }

    public static abstract class Visitor<T> {
        public final T visitThis(Expr x) throws Err { return x.accept(this); }

        public abstract T visit(IntLit x) throws Err;

        public abstract T visit(BoolLit x) throws Err;

        public abstract T visit(Ref x) throws Err;

        public abstract T visit(Not x) throws Err;

        public abstract T visit(Binary x) throws Err;
    }
}
