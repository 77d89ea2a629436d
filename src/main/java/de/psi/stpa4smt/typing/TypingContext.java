package de.psi.stpa4smt.typing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import de.psi.stpa4smt.ErrorConfig;
import de.psi.stpa4smt.ast.Action;
import de.psi.stpa4smt.ast.ControlSystem;
import de.psi.stpa4smt.ast.FinTypeDecl;
import de.psi.stpa4smt.ast.Helpers;
import de.psi.stpa4smt.ast.Ident;
import de.psi.stpa4smt.ast.Type;
import de.psi.stpa4smt.ast.VarDecl;

/**
 * Flat map from qualified identifiers to types, built from a whole system
 * tree. Holds finite-type elements, state variables and the two indicators
 * of every action.
 */
public final class TypingContext {

    private final Map<Ident, Type> entries;
    private final Map<Ident, List<Ident>> finTypes;

    private TypingContext(Map<Ident, Type> entries, Map<Ident, List<Ident>> finTypes) {
        this.entries = Collections.unmodifiableMap(entries);
        this.finTypes = Collections.unmodifiableMap(finTypes);
    }

    /**
     * The type bound to {@code name}, or null if the name is unknown.
     * <p>
     * Every entry is visible from every expression, wherever the expression
     * sits in the tree. A scoped lookup would replace this method only.
     */
    public Type lookup(Ident name) {
        return entries.get(name);
    }

    public boolean contains(Ident name) {
        return entries.containsKey(name);
    }

    public Map<Ident, Type> entries() {
        return entries;
    }

    public Map<Ident, List<Ident>> finTypes() {
        return finTypes;
    }

    public boolean isElement(Ident name) {
        Type t = entries.get(name);
        return t != null && t.isNamed() && finTypes.get(t.name).contains(name);
    }

    public static TypingContext build(ControlSystem root) throws ErrorConfig {
        Collector c = new Collector();
        c.go(root, null);
        return new TypingContext(c.entries, c.finTypes);
    }

    private static final class Collector {
        final Map<Ident, Type> entries = new LinkedHashMap<Ident, Type>();
        final Map<Ident, List<Ident>> finTypes = new LinkedHashMap<Ident, List<Ident>>();
        final Set<String> elementNames = new HashSet<String>();

        void go(ControlSystem s, Ident parent) throws ErrorConfig {
            final Ident qualifier = Ident.of(parent, s.name);
            // Local names of everything declared directly in this node.
            final Set<String> seen = new HashSet<String>();

            for (FinTypeDecl tydecl : s.types) {
                final Ident tyname = qualifier.child(tydecl.name);
                if (!seen.add(tydecl.name))
                    throw new ErrorConfig("Name '" + tydecl.name + "' already used in component '" + qualifier + "'");
                if (tydecl.elements.isEmpty())
                    throw new ErrorConfig("FinType '" + tyname + "' has no elements");
                final Type ty = Type.named(tyname);
                final List<Ident> els = new ArrayList<Ident>();
                for (String el : tydecl.elements) {
                    if (!elementNames.add(el))
                        throw new ErrorConfig("Duplicate FinType element: '" + el + "'");
                    if (!seen.add(el))
                        throw new ErrorConfig("Name '" + el + "' already used in component '" + qualifier + "'");
                    final Ident elname = qualifier.child(el);
                    els.add(elname);
                    entries.put(elname, ty);
                }
                finTypes.put(tyname, Collections.unmodifiableList(els));
            }

            for (VarDecl vardecl : s.vars) {
                if (!seen.add(vardecl.name))
                    throw new ErrorConfig("Duplicate variable: '" + vardecl.name + "' in component '" + qualifier + "'");
                if (vardecl.type.isNamed() && !finTypes.containsKey(vardecl.type.name))
                    throw new ErrorConfig("Unknown type: '" + vardecl.type + "' of variable '"
                            + qualifier.child(vardecl.name) + "'");
                entries.put(qualifier.child(vardecl.name), vardecl.type);
            }

            // An action's own indicators may not occur in its constraints, which
            // would allow paradoxes such as "allowed iff not allowed".
            for (Action a : s.actions) {
                if (!seen.add(a.name))
                    throw new ErrorConfig("Duplicate action: '" + a.name + "' in component '" + qualifier + "'");
                final Ident actionName = qualifier.child(a.name);
                final Ident allowedName = Action.allowedIndicator(actionName);
                final Ident requiredName = Action.requiredIndicator(actionName);
                final Set<Ident> vars = Helpers.freeVars(a.allowed);
                vars.addAll(Helpers.freeVars(a.required));
                if (vars.contains(allowedName))
                    throw new ErrorConfig("'" + allowedName + "' appears in constraint for action '" + a.name + "'");
                if (vars.contains(requiredName))
                    throw new ErrorConfig("'" + requiredName + "' appears in constraint for action '" + a.name + "'");
                entries.put(allowedName, Type.BOOL);
                entries.put(requiredName, Type.BOOL);
            }

            for (ControlSystem c : s.components) {
                if (!seen.add(c.name))
                    throw new ErrorConfig("Component name '" + c.name + "' already used in '" + qualifier + "'");
                go(c, qualifier);
            }
        }
    }
}
