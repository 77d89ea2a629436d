package de.psi.stpa4smt.ast;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import de.psi.stpa4smt.Err;
import de.psi.stpa4smt.ErrorReference;

public class Helpers {

	public static ControlSystem getComponentByName(Iterable<ControlSystem> components, String name) {
	    ControlSystem result = null;
	    for (ControlSystem c : components) {
	        if (c.name.equals(name)) {
	            result = c;
	            break;
	        }
	    }
	    return result;
	}

	public static Action getActionByName(Iterable<Action> actions, String name) {
	    Action result = null;
	    for (Action a : actions) {
	        if (a.name.equals(name)) {
	            result = a;
	            break;
	        }
	    }
	    return result;
	}

	public static Action getActionByName(ControlSystem root, Ident path) throws ErrorReference {
	    final List<String> names = path.toList();
	    if (names.size() < 2)
	        throw new ErrorReference("'" + path + "' does not name an action inside a component", path);
	    if (!names.get(0).equals(root.name))
	        throw new ErrorReference("unresolved reference '" + path + "': expected system '" + names.get(0)
	                + "', found '" + root.name + "'", path);
	    ControlSystem s = root;
	    for (int i = 1; i < names.size() - 1; ++i) {
	        ControlSystem c = getComponentByName(s.components, names.get(i));
	        if (c == null)
	            throw new ErrorReference("unresolved reference '" + path + "': component '" + s.name
	                    + "' has no component named '" + names.get(i) + "'", path);
	        s = c;
	    }
	    final String last = names.get(names.size() - 1);
	    Action a = getActionByName(s.actions, last);
	    if (a == null)
	        throw new ErrorReference("unresolved reference '" + path + "': component '" + s.name
	                + "' has no action named '" + last + "'", path);
	    return a;
	}

	public static Set<Ident> freeVars(Expr e) {
	    final Set<Ident> result = new LinkedHashSet<Ident>();
	    Expr.Visitor<Void> collector = new Expr.Visitor<Void>() {
	        @Override public Void visit(Expr.IntLit x) { return null; }
	        @Override public Void visit(Expr.BoolLit x) { return null; }
	        @Override public Void visit(Expr.Ref x) { result.add(x.name); return null; }
	        @Override public Void visit(Expr.Not x) throws Err { return visitThis(x.sub); }
	        @Override public Void visit(Expr.Binary x) throws Err { visitThis(x.left); return visitThis(x.right); }
	    };
	    try {
	        collector.visitThis(e);
	    } catch (Err ex) {
	        throw new AssertionError(ex);
	    }
	    return result;
	}

	public static Set<Ident> freeVars(Iterable<Expr> es) {
	    final Set<Ident> result = new LinkedHashSet<Ident>();
	    for (Expr e : es) result.addAll(freeVars(e));
	    return result;
	}
}
