package de.psi.stpa4smt.smt;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.Vector;

import de.psi.stpa4smt.ast.Ident;

/**
 * An SMT-LIB 2 script: finite types as enumeration datatypes, constants,
 * permanent assertions, and scoped satisfiability queries.
 */
public class SMTFormula {
    private final List<SExpr<Ident>> datatypes = new Vector<SExpr<Ident>>();
    private final List<SExpr<Ident>> declarations = new Vector<SExpr<Ident>>();
    private final List<SExpr<Ident>> constraints = new Vector<SExpr<Ident>>();
    // assertions, checks and scoped queries, in the order they were added
    private final List<String> commands = new Vector<String>();
    private final Set<Ident> declared = new HashSet<Ident>();

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("(set-logic ALL)\n");
        sb.append("(set-info :smt-lib-version 2.6)\n");
        for (SExpr<Ident> d : datatypes)
            sb.append(d.toString() + "\n");
        sb.append(getVariableDecls());
        for (String c : commands)
            sb.append(c);
        return sb.toString();
    }

    public String getVariableDecls() {
        StringBuilder sb = new StringBuilder();
        for (SExpr<Ident> d : declarations)
            sb.append(d.toString() + "\n");
        return sb.toString();
    }

    public String getConstraints() {
        StringBuilder sb = new StringBuilder();
        for (SExpr<Ident> c : constraints)
            sb.append(c.toString() + "\n");
        return sb.toString();
    }

    public void addEnumType(Ident name, List<Ident> elements) {
        List<SExpr<Ident>> ctors = new Vector<SExpr<Ident>>();
        for (Ident el : elements) {
            ctors.add(SExpr.list(SExpr.leaf(el)));
            declared.add(el);
        }
        datatypes.add(SExpr.call("declare-datatype", SExpr.leaf(name), new SExpr.SList<Ident>(ctors)));
        declared.add(name);
    }

    public void addBoolVariable(Ident varname) {
        addVariable(varname, "Bool");
    }

    public void addIntegerVariable(Ident varname) {
        addVariable(varname, "Int");
    }

    public void addEnumVariable(Ident varname, Ident type) {
        if (!declared.contains(type)) throw new IllegalArgumentException("undeclared sort " + type);
        addVariable(varname, type.toString());
    }

    private void addVariable(Ident varname, String sort) {
        declarations.add(SExpr.call("declare-fun", SExpr.leaf(varname), SExpr.<Ident>list(), SExpr.<Ident>sym(sort)));
        declared.add(varname);
    }

    public void addConstraint(SExpr<Ident> expr) {
        checkDeclared(expr);
        SExpr<Ident> c = SExpr.call("assert", expr);
        constraints.add(c);
        commands.add(c.toString() + "\n");
    }

    public void addCheck(String comment) {
        commands.add(comment(comment) + "(check-sat)\n");
    }

    public void addQuery(String comment, SExpr<Ident> expr) {
        checkDeclared(expr);
        StringBuilder sb = new StringBuilder();
        sb.append(comment(comment));
        sb.append("(push 1)\n");
        sb.append(SExpr.call("assert", expr).toString()).append("\n");
        sb.append("(check-sat)\n");
        sb.append("(pop 1)\n");
        commands.add(sb.toString());
    }

    private static String comment(String text) {
        return "; " + text.replace('\n', ' ') + "\n";
    }

    private void checkDeclared(SExpr<Ident> expr) {
        Ident missing = new SExpr.Visitor<Ident, Ident>() {
            @Override public Ident visit(SExpr.Symbol<Ident> vSymbol) { return null; }
            @Override public Ident visit(SExpr.Leaf<Ident> vLeaf) {
                return declared.contains(vLeaf.getValue()) ? null : vLeaf.getValue();
            }
            @Override public Ident visit(SExpr.SList<Ident> vsList) {
                for (SExpr<Ident> item : vsList.getItems()) {
                    Ident m = visitThis(item);
                    if (m != null) return m;
                }
                return null;
            }
        }.visitThis(expr);
        if (missing != null) throw new IllegalArgumentException("undeclared symbol " + missing + " in " + expr);
    }
}
