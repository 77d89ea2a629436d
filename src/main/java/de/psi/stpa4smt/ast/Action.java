package de.psi.stpa4smt.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A control action with its safety constraints.
 * <p>
 * {@code allowed} lists conditions that must all hold for issuing the action
 * to be safe. {@code required} lists conditions any one of which makes
 * issuing the action mandatory.
 */
public final class Action {

    public static final String ALLOWED = "allowed";
    public static final String REQUIRED = "required";

    public final String name;
    public final List<Expr> allowed;
    public final List<Expr> required;

    public Action(String name, List<Expr> allowed, List<Expr> required) {
        this.name = name;
        this.allowed = Collections.unmodifiableList(new ArrayList<Expr>(allowed));
        this.required = Collections.unmodifiableList(new ArrayList<Expr>(required));
    }

    public static Ident allowedIndicator(Ident action) {
        return action.child(ALLOWED);
    }

    public static Ident requiredIndicator(Ident action) {
        return action.child(REQUIRED);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Action)) return false;
        Action a = (Action) o;
        return name.equals(a.name) && allowed.equals(a.allowed) && required.equals(a.required);
    }

    @Override
    public int hashCode() {
        return (name.hashCode() * 31 + allowed.hashCode()) * 31 + required.hashCode();
    }

    @Override
    public String toString() {
        return "action " + name + " allowed " + allowed + " required " + required;
    }
}
