package de.psi.stpa4smt.ast;

public final class Uca {

    public enum Direction {
        ISSUED("issued"),
        NOT_ISSUED("not issued");

        private final String label;

        Direction(String label) {
            this.label = label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    public final Ident action;
    public final Direction direction;
    public final Expr context;

    public Uca(Ident action, Direction direction, Expr context) {
        this.action = action;
        this.direction = direction;
        this.context = context;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Uca)) return false;
        Uca u = (Uca) o;
        return action == u.action && direction == u.direction && context.equals(u.context);
    }

    @Override
    public int hashCode() {
        return (action.hashCode() * 31 + direction.hashCode()) * 31 + context.hashCode();
    }

    @Override
    public String toString() {
        return "UCA(action=" + action + ", type=" + direction + ", context={" + context + "})";
    }
}
