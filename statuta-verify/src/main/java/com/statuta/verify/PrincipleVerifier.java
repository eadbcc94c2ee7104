package com.statuta.verify;

import com.statuta.compiler.analysis.ResolvedProgram;
import com.statuta.compiler.analysis.Scope;
import com.statuta.compiler.ast.item.Item;
import com.statuta.compiler.ast.item.PrincipleDecl;
import com.statuta.compiler.ast.item.ScopeDecl;
import com.statuta.verify.model.Counterexample;
import com.statuta.verify.model.CounterexampleExtractor;
import com.statuta.verify.solver.ProcessSolverBackend;
import com.statuta.verify.solver.SolverBackend;
import com.statuta.verify.solver.SolverInvocationException;
import com.statuta.verify.solver.SolverResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * principle 验证入口
 *
 * <p>每条 principle 规划一条查询、提交一次求解器并按 {@link QueryPlan.Interpretation}
 * 解读结果。无法翻译的 principle 得到 ERROR，不会启动求解器。</p>
 */
public class PrincipleVerifier {

    private static final Logger LOG = Logger.getLogger(PrincipleVerifier.class.getName());

    private final ResolvedProgram program;
    private final SmtTranslator translator;
    private final QuantifierPolarity polarity;
    private final SolverBackend backend;
    private final CounterexampleExtractor extractor = new CounterexampleExtractor();

    public PrincipleVerifier(ResolvedProgram program, VerifierConfig config) {
        this(program, config, new ProcessSolverBackend(config.getSolverCommand(), config.getTimeoutMillis()));
    }

    public PrincipleVerifier(ResolvedProgram program, VerifierConfig config, SolverBackend backend) {
        this.program = program;
        this.translator = new SmtTranslator(program, config.getDomainPolicy());
        this.polarity = new QuantifierPolarity(translator);
        this.backend = backend;
    }

    /** 程序中的全部 principle，含 scope 内声明的，按源码顺序 */
    public List<PrincipleDecl> getPrinciples() {
        List<PrincipleDecl> result = new ArrayList<>();
        collect(program.getProgram().getItems(), result);
        return result;
    }

    private static void collect(List<Item> items, List<PrincipleDecl> out) {
        for (Item item : items) {
            if (item instanceof PrincipleDecl) {
                out.add((PrincipleDecl) item);
            } else if (item instanceof ScopeDecl) {
                collect(((ScopeDecl) item).getItems(), out);
            }
        }
    }

    /** principle 所在 scope 的作用域帧，顶层为 null */
    private Scope enclosingFrame(PrincipleDecl principle) {
        return findFrame(program.getProgram().getItems(), principle, null);
    }

    private Scope findFrame(List<Item> items, PrincipleDecl target, Scope frame) {
        for (Item item : items) {
            if (item == target) {
                return frame;
            }
            if (item instanceof ScopeDecl) {
                Scope found = findFrame(((ScopeDecl) item).getItems(), target, program.getFrame(item));
                if (found != null) return found;
            }
        }
        return null;
    }

    public PrincipleDecl findPrinciple(String name) {
        for (PrincipleDecl p : getPrinciples()) {
            if (p.getName().equals(name)) return p;
        }
        return null;
    }

    public List<VerificationResult> verifyAll() throws SolverInvocationException {
        List<VerificationResult> results = new ArrayList<>();
        for (PrincipleDecl p : getPrinciples()) {
            results.add(verify(p));
        }
        return results;
    }

    public VerificationResult verify(PrincipleDecl principle) throws SolverInvocationException {
        String name = principle.getName();
        QueryPlan plan;
        try {
            plan = polarity.plan(principle.getBody(), enclosingFrame(principle));
        } catch (TranslationException e) {
            LOG.log(Level.FINE, "Principle '" + name + "' cannot be translated", e);
            return new VerificationResult(name, VerificationResult.Verdict.ERROR, null, e.getMessage(), null);
        }

        LOG.fine(() -> "Verifying principle '" + name + "':\n" + plan.getQuery());
        SolverResponse response = backend.solve(plan.getQuery());
        LOG.fine(() -> "Solver answered " + response.getStatus() + " for '" + name + "'");

        boolean refute = plan.getInterpretation() == QueryPlan.Interpretation.REFUTE_NEGATION;
        switch (response.getStatus()) {
            case UNSAT:
                return refute
                        ? new VerificationResult(name, VerificationResult.Verdict.VALID, null, null, plan.getQuery())
                        : new VerificationResult(name, VerificationResult.Verdict.NO_WITNESS, null,
                        "No value satisfies the existential claim", plan.getQuery());
            case SAT: {
                Counterexample model = decode(plan, response.getModel());
                return refute
                        ? new VerificationResult(name, VerificationResult.Verdict.DISPROVED, model, null, plan.getQuery())
                        : new VerificationResult(name, VerificationResult.Verdict.VALID, model.asWitness(), null,
                        plan.getQuery());
            }
            default:
                return new VerificationResult(name, VerificationResult.Verdict.UNKNOWN, null,
                        "The solver could not decide this principle", plan.getQuery());
        }
    }

    /**
     * 解析模型并把查询符号还原为源码变量名与源码写法的取值；只保留规划中的顶层常量
     */
    private Counterexample decode(QueryPlan plan, String modelText) throws SolverInvocationException {
        Counterexample raw;
        try {
            raw = extractor.extract(modelText);
        } catch (IllegalArgumentException e) {
            throw new SolverInvocationException(SolverInvocationException.Kind.MALFORMED_OUTPUT,
                    "Cannot read solver model: " + e.getMessage(), e);
        }
        if (plan.getVariables().isEmpty()) {
            return raw;
        }
        List<Counterexample.Assignment> assignments = new ArrayList<>();
        for (SmtTranslator.Binding b : plan.getVariables()) {
            String value = raw.get(unquote(b.getSmtName()));
            if (value != null) {
                assignments.add(new Counterexample.Assignment(b.getSourceName(), translator.renderValue(b, value)));
            }
        }
        return new Counterexample(assignments,
                assignments.isEmpty() ? CounterexampleExtractor.NO_ASSIGNMENTS : "", false);
    }

    private static String unquote(String symbol) {
        return symbol.startsWith("|") && symbol.endsWith("|") ? symbol.substring(1, symbol.length() - 1) : symbol;
    }
}
