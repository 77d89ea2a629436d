package de.psi.stpa4smt.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class ControlSystem {
    public final String name;
    public final List<FinTypeDecl> types;
    public final List<VarDecl> vars;
    public final List<Expr> invariants;
    public final List<Action> actions;
    public final List<ControlSystem> components;

    public ControlSystem(String name, List<FinTypeDecl> types, List<VarDecl> vars, List<Expr> invariants,
                         List<Action> actions, List<ControlSystem> components) {
        this.name = name;
        this.types = Collections.unmodifiableList(new ArrayList<FinTypeDecl>(types));
        this.vars = Collections.unmodifiableList(new ArrayList<VarDecl>(vars));
        this.invariants = Collections.unmodifiableList(new ArrayList<Expr>(invariants));
        this.actions = Collections.unmodifiableList(new ArrayList<Action>(actions));
        this.components = Collections.unmodifiableList(new ArrayList<ControlSystem>(components));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ControlSystem)) return false;
        ControlSystem s = (ControlSystem) o;
        return name.equals(s.name) && types.equals(s.types) && vars.equals(s.vars)
                && invariants.equals(s.invariants) && actions.equals(s.actions)
                && components.equals(s.components);
    }

    @Override
    public int hashCode() {
        int h = name.hashCode();
        h = h * 31 + types.hashCode();
        h = h * 31 + vars.hashCode();
        h = h * 31 + invariants.hashCode();
        h = h * 31 + actions.hashCode();
        return h * 31 + components.hashCode();
    }

    @Override
    public String toString() {
        return "component " + name;
    }

    public static final class Builder {
        private final String name;
        private final List<FinTypeDecl> types = new ArrayList<FinTypeDecl>();
        private final List<VarDecl> vars = new ArrayList<VarDecl>();
        private final List<Expr> invariants = new ArrayList<Expr>();
        private final List<Action> actions = new ArrayList<Action>();
        private final List<ControlSystem> components = new ArrayList<ControlSystem>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder type(String typeName, String... elements) {
            types.add(new FinTypeDecl(typeName, Arrays.asList(elements)));
            return this;
        }

        public Builder var(String varName, Type type) {
            vars.add(new VarDecl(varName, type));
            return this;
        }

        public Builder invariant(Expr e) {
            invariants.add(e);
            return this;
        }

        public Builder action(Action a) {
            actions.add(a);
            return this;
        }

        public Builder component(ControlSystem c) {
            components.add(c);
            return this;
        }

        public ControlSystem build() {
            return new ControlSystem(name, types, vars, invariants, actions, components);
        }
    }
}
