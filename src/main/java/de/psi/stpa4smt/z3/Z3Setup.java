package de.psi.stpa4smt.z3;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.EnumSort;
import com.microsoft.z3.Solver;

import de.psi.stpa4smt.AnalysisOptions;
import de.psi.stpa4smt.Err;
import de.psi.stpa4smt.ErrorSetup;
import de.psi.stpa4smt.Scenario;
import de.psi.stpa4smt.ast.Action;
import de.psi.stpa4smt.ast.ControlSystem;
import de.psi.stpa4smt.ast.Expr;
import de.psi.stpa4smt.ast.FinTypeDecl;
import de.psi.stpa4smt.ast.Ident;
import de.psi.stpa4smt.ast.VarDecl;
import de.psi.stpa4smt.typing.TypingContext;

/**
 * Declares the Z3 sorts and constants of a type-checked system and defines
 * the action indicators.
 * <p>
 * Declarations are made in one pre-order pass over the whole tree before any
 * formula is asserted, so constraints may mention names declared anywhere.
 * A second pass then asserts, for every action,
 * {@code allowed <=> AND(allowed-exprs)} and
 * {@code required <=> OR(required-exprs)}, and rejects actions that can be
 * required without being allowed.
 */
public final class Z3Setup {

    private static final Logger logger = LoggerFactory.getLogger(Z3Setup.class);

    private final Context ctx;
    private final Solver solver;
    private final TypingContext typing;
    private final Map<Ident, com.microsoft.z3.Expr> terms = new LinkedHashMap<Ident, com.microsoft.z3.Expr>();
    private final Map<Ident, List<Ident>> elements = new LinkedHashMap<Ident, List<Ident>>();
    private final Map<Ident, EnumSort> sorts = new HashMap<Ident, EnumSort>();

    private Z3Setup(Context ctx, Solver solver, TypingContext typing) {
        this.ctx = ctx;
        this.solver = solver;
        this.typing = typing;
    }

    public static Z3Environment setup(ControlSystem system, TypingContext typing, AnalysisOptions opt) throws Err {
        final Map<String, String> cfg = new HashMap<String, String>();
        cfg.put("model", "true");
        if (opt.timeoutMillis > 0) cfg.put("timeout", String.valueOf(opt.timeoutMillis));
        final Context ctx = new Context(cfg);
        try {
            final Solver solver = opt.logic == null ? ctx.mkSolver() : ctx.mkSolver(opt.logic);
            final Z3Setup setup = new Z3Setup(ctx, solver, typing);
            setup.declare(system, null);
            final Z3Environment env = new Z3Environment(system, typing, ctx, solver, setup.terms, setup.elements);
            setup.define(env, system, null);
            logger.info("Solver environment for '{}' ready: {} terms, {} finite types",
                    system.name, setup.terms.size(), setup.elements.size());
            return env;
        } catch (Err ex) {
            ctx.close();
            throw ex;
        } catch (RuntimeException ex) {
            ctx.close();
            throw ex;
        }
    }

    private void declare(ControlSystem s, Ident parent) {
        final Ident qualifier = Ident.of(parent, s.name);

        for (FinTypeDecl tydecl : s.types) {
            final Ident name = qualifier.child(tydecl.name);
            final List<Ident> els = typing.finTypes().get(name);
            final String[] elnames = new String[els.size()];
            for (int i = 0; i < elnames.length; ++i) elnames[i] = els.get(i).toString();
            final EnumSort sort = ctx.mkEnumSort(name.toString(), elnames);
            final com.microsoft.z3.Expr[] consts = sort.getConsts();
            for (int i = 0; i < consts.length; ++i) terms.put(els.get(i), consts[i]);
            sorts.put(name, sort);
            elements.put(name, els);
        }

        for (VarDecl vardecl : s.vars) {
            final Ident name = qualifier.child(vardecl.name);
            switch (vardecl.type.kind) {
                case BOOL:
                    terms.put(name, ctx.mkBoolConst(name.toString()));
                    break;
                case INT:
                    terms.put(name, ctx.mkIntConst(name.toString()));
                    break;
                case NAMED:
                    terms.put(name, ctx.mkConst(name.toString(), sorts.get(vardecl.type.name)));
                    break;
                default:
                    throw new AssertionError(vardecl.type);
            }
        }

        for (Action a : s.actions) {
            final Ident name = qualifier.child(a.name);
            final Ident allowed = Action.allowedIndicator(name);
            final Ident required = Action.requiredIndicator(name);
            terms.put(allowed, ctx.mkBoolConst(allowed.toString()));
            terms.put(required, ctx.mkBoolConst(required.toString()));
        }

        for (ControlSystem c : s.components) declare(c, qualifier);
    }

    private void define(Z3Environment env, ControlSystem s, Ident parent) throws Err {
        final Ident qualifier = Ident.of(parent, s.name);
        for (Action a : s.actions) defineAction(env, qualifier.child(a.name), a);
        for (ControlSystem c : s.components) define(env, c, qualifier);
    }

    private void defineAction(Z3Environment env, Ident name, Action a) throws Err {
        final BoolExpr allowed = (BoolExpr) env.term(Action.allowedIndicator(name));
        final BoolExpr required = (BoolExpr) env.term(Action.requiredIndicator(name));

        final Expr allowedDef = Expr.conj(a.allowed);
        logger.debug("assert {} <=> {}", allowed, allowedDef);
        solver.add(ctx.mkIff(allowed, env.translate(allowedDef)));
        if (!env.check("allowed constraints of " + name))
            throw new ErrorSetup("Allowed constraints of action '" + name + "' are inconsistent", name, null);

        final Expr requiredDef = Expr.disj(a.required);
        logger.debug("assert {} <=> {}", required, requiredDef);
        solver.add(ctx.mkIff(required, env.translate(requiredDef)));
        if (!env.check("required constraints of " + name))
            throw new ErrorSetup("Required constraints of action '" + name + "' are inconsistent", name, null);

        final int depth = env.scopeDepth();
        env.push();
        try {
            env.add(ctx.mkAnd(required, ctx.mkNot(allowed)));
            if (env.check("required-but-not-allowed for " + name)) {
                final Scenario witness = ScenarioDecoder.decode(env, env.model());
                throw new ErrorSetup("Action '" + name + "' required but not allowed in scenario " + witness,
                        name, witness);
            }
        } finally {
            env.popTo(depth);
        }
    }
}
