package de.psi.stpa4smt.ast;

public enum BinaryOp {
    AND("AND", Category.LOGIC),
    OR("OR", Category.LOGIC),
    WHEN("WHEN", Category.LOGIC),
    LT("<", Category.COMPARE),
    LE("<=", Category.COMPARE),
    GT(">", Category.COMPARE),
    GE(">=", Category.COMPARE),
    EQ("=", Category.EQUALITY),
    PLUS("+", Category.ARITH),
    MINUS("-", Category.ARITH),
    MULT("*", Category.ARITH),
    DIV("/", Category.ARITH);

    public enum Category {
        LOGIC,
        COMPARE,
        EQUALITY,
        ARITH
    }

    public final String symbol;
    public final Category category;

    BinaryOp(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }
}
