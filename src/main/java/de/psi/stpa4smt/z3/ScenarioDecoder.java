package de.psi.stpa4smt.z3;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Model;

import de.psi.stpa4smt.ErrorFatal;
import de.psi.stpa4smt.Scenario;
import de.psi.stpa4smt.ast.Ident;
import de.psi.stpa4smt.ast.Type;

public final class ScenarioDecoder {

    private ScenarioDecoder() {
    }

    public static Scenario decode(Z3Environment env, Model model) throws ErrorFatal {
        final Map<Ident, Object> values = new LinkedHashMap<Ident, Object>();
        for (Map.Entry<Ident, com.microsoft.z3.Expr> e : env.terms.entrySet()) {
            final Ident name = e.getKey();
            if (env.typing.isElement(name)) continue;
            final com.microsoft.z3.Expr value = model.getConstInterp(e.getValue());
            if (value == null) continue;
            final Type ty = env.typing.lookup(name);
            switch (ty.kind) {
                case BOOL:
                    if (value.isTrue()) values.put(name, Boolean.TRUE);
                    else if (value.isFalse()) values.put(name, Boolean.FALSE);
                    else throw new ErrorFatal("no boolean value for " + name + " in model: " + value);
                    break;
                case INT:
                    if (!(value instanceof IntNum)) throw new ErrorFatal("no integer value for " + name + " in model: " + value);
                    values.put(name, ((IntNum) value).getBigInteger());
                    break;
                case NAMED:
                    values.put(name, elementOf(env, ty.name, value));
                    break;
                default:
                    throw new AssertionError(ty);
            }
        }
        return new Scenario(values);
    }

    private static Ident elementOf(Z3Environment env, Ident type, com.microsoft.z3.Expr value) throws ErrorFatal {
        final List<Ident> els = env.elements.get(type);
        for (int i = 0; i < els.size(); ++i) {
            if (value.equals(env.term(els.get(i)))) return els.get(i);
        }
        throw new ErrorFatal("value " + value + " is not an element of " + type);
    }

    public static BoolExpr pin(Z3Environment env, Scenario s) {
        final BoolExpr[] eqs = new BoolExpr[s.size()];
        int i = 0;
        for (Map.Entry<Ident, Object> e : s.values().entrySet()) {
            eqs[i++] = env.ctx.mkEq(env.term(e.getKey()), valueTerm(env, e.getValue()));
        }
        return env.ctx.mkAnd(eqs);
    }

    private static com.microsoft.z3.Expr valueTerm(Z3Environment env, Object v) {
        if (v instanceof Boolean) return env.ctx.mkBool((Boolean) v);
        if (v instanceof BigInteger) return env.ctx.mkInt(v.toString());
        return env.term((Ident) v);
    }
}
