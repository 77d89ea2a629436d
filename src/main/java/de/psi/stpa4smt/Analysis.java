package de.psi.stpa4smt;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.psi.stpa4smt.ast.Action;
import de.psi.stpa4smt.ast.ControlSystem;
import de.psi.stpa4smt.ast.Helpers;
import de.psi.stpa4smt.ast.Ident;
import de.psi.stpa4smt.ast.Uca;
import de.psi.stpa4smt.smt.SmtLibTranslator;
import de.psi.stpa4smt.typing.TypeChecker;
import de.psi.stpa4smt.typing.TypingContext;
import de.psi.stpa4smt.z3.InvariantAsserter;
import de.psi.stpa4smt.z3.ScenarioEnumerator;
import de.psi.stpa4smt.z3.UcaVerifier;
import de.psi.stpa4smt.z3.Z3Environment;
import de.psi.stpa4smt.z3.Z3Setup;

/**
 * One analysis run over a control system: type checking, solver setup and
 * invariant assertion, followed by any number of UCA verifications and
 * scenario enumerations against the same solver context.
 * <p>
 * <pre>
 * try (Analysis a = Analysis.prepare(system, new AnalysisOptions())) {
 *     Scenario cex = a.verify(ucas);
 *     ...
 * }
 * </pre>
 */
public final class Analysis implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Analysis.class);

    private final ControlSystem system;
    private final TypingContext typing;
    private final Z3Environment env;

    private Analysis(ControlSystem system, TypingContext typing, Z3Environment env) {
        this.system = system;
        this.typing = typing;
        this.env = env;
    }

    public static Analysis prepare(ControlSystem system, AnalysisOptions opt) throws Err {
        final TypingContext typing = TypingContext.build(system);
        TypeChecker.checkSystem(system, typing);
        logger.info("System '{}' is well-typed: {} names in context", system.name, typing.entries().size());

        final Z3Environment env = Z3Setup.setup(system, typing, opt == null ? new AnalysisOptions() : opt.dup());
        return start(system, typing, env);
    }

    // Takes ownership of env: it is closed if the invariants cannot be asserted.
    static Analysis start(ControlSystem system, TypingContext typing, Z3Environment env) throws Err {
        boolean ok = false;
        try {
            InvariantAsserter.assertInvariants(env);
            ok = true;
            return new Analysis(system, typing, env);
        } finally {
            if (!ok) env.close();
        }
    }

    public ControlSystem system() {
        return system;
    }

    public TypingContext typing() {
        return typing;
    }

    public Z3Environment environment() {
        return env;
    }

    public Scenario verify(List<Uca> ucas) throws Err {
        for (Uca u : ucas) {
            TypeChecker.checkUca(u, typing);
            Helpers.getActionByName(system, u.action);
        }
        return UcaVerifier.verify(env, ucas);
    }

    public ScenarioEnumerator allowedScenarios(Ident action) throws Err {
        return ScenarioEnumerator.allowed(env, action);
    }

    public ScenarioEnumerator requiredScenarios(Ident action) throws Err {
        return ScenarioEnumerator.required(env, action);
    }

    public Map<Ident, List<Scenario>> collectAllowedScenarios() throws Err {
        return collect(true);
    }

    public Map<Ident, List<Scenario>> collectRequiredScenarios() throws Err {
        return collect(false);
    }

    private Map<Ident, List<Scenario>> collect(boolean allowed) throws Err {
        final Map<Ident, List<Scenario>> result = new LinkedHashMap<Ident, List<Scenario>>();
        collect(system, null, allowed, result);
        return result;
    }

    private void collect(ControlSystem s, Ident parent, boolean allowed, Map<Ident, List<Scenario>> out) throws Err {
        final Ident qualifier = Ident.of(parent, s.name);
        for (Action a : s.actions) {
            final Ident name = qualifier.child(a.name);
            final ScenarioEnumerator e = allowed ? allowedScenarios(name) : requiredScenarios(name);
            try {
                out.put(name, e.drain());
            } finally {
                e.close();
            }
        }
        for (ControlSystem c : s.components) collect(c, qualifier, allowed, out);
    }

    public String toSmtLib(List<Uca> ucas) throws Err {
        for (Uca u : ucas) TypeChecker.checkUca(u, typing);
        return SmtLibTranslator.translate(system, typing, ucas).toString();
    }

    @Override
    public void close() {
        env.close();
    }
}
