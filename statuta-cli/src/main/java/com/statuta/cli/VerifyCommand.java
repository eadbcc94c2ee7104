package com.statuta.cli;

import com.statuta.compiler.ast.item.PrincipleDecl;
import com.statuta.compiler.pipeline.CompilationResult;
import com.statuta.verify.PrincipleExplainer;
import com.statuta.verify.PrincipleVerifier;
import com.statuta.verify.VerificationResult;
import com.statuta.verify.VerifierConfig;
import com.statuta.verify.solver.SolverInvocationException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * picocli verify 子命令：用 SMT 求解器验证 principle
 */
@Command(name = "verify", description = "用 SMT 求解器验证 principle",
         mixinStandardHelpOptions = true,
         exitCodeOnInvalidInput = Main.EXIT_PROBLEMS)
public class VerifyCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(VerifyCommand.class.getName());

    @ParentCommand
    Main parent;

    @Spec
    CommandSpec spec;

    @Mixin
    CommonOptions common;

    @Parameters(index = "0", paramLabel = "FILE", description = "源文件")
    Path file;

    @Option(names = {"-p", "--principle"}, paramLabel = "NAME", description = "只验证指定的 principle")
    String principle;

    @Option(names = "--solver", paramLabel = "COMMAND", description = "求解器命令行（默认 z3 -in -smt2）")
    String solver;

    @Option(names = "--timeout", paramLabel = "MILLIS", description = "单条查询的超时（毫秒）")
    Long timeout;

    @Option(names = "--explain", description = "在结果前输出 principle 的陈述")
    boolean explain;

    @Override
    public Integer call() {
        LoggingSetup.install(common.verbose);
        StatutaConfig config = common.loadConfig(parent.getEnv(), parent.getWorkingDir())
                .overrideSolver(solver)
                .overrideTimeout(timeout);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CompilationResult compiled = CheckCommand.compile(parent.getWorkingDir().resolve(file), config, err);
        if (compiled == null) {
            return Main.EXIT_PROBLEMS;
        }
        // 只验证通过检查的程序
        if (!compiled.isSuccess()) {
            err.print(DiagnosticRenderer.text(compiled));
            err.flush();
            return Main.EXIT_PROBLEMS;
        }

        VerifierConfig verifierConfig = config.toVerifierConfig();
        LOG.fine(() -> "Verifier configuration: " + verifierConfig);
        PrincipleVerifier verifier = new PrincipleVerifier(compiled.getResolved(), verifierConfig,
                parent.createBackend(verifierConfig));

        List<PrincipleDecl> targets;
        if (principle != null) {
            PrincipleDecl found = verifier.findPrinciple(principle);
            if (found == null) {
                err.println("error: No principle named '" + principle + "' in " + file);
                return Main.EXIT_PROBLEMS;
            }
            targets = Collections.singletonList(found);
        } else {
            targets = verifier.getPrinciples();
        }

        PrincipleExplainer explainer = new PrincipleExplainer();
        List<VerificationResult> results = new ArrayList<>();
        try {
            for (PrincipleDecl p : targets) {
                VerificationResult r = verifier.verify(p);
                results.add(r);
                if (!common.json) {
                    if (explain) {
                        out.print(explainer.explain(p));
                    }
                    out.println(r.format());
                }
            }
        } catch (SolverInvocationException e) {
            LOG.log(Level.WARNING, "Solver invocation failed", e);
            err.println("error: solver " + e.getKind().name().toLowerCase() + ": " + e.getMessage());
            out.flush();
            return Main.EXIT_SOLVER_FAILURE;
        }

        if (common.json) {
            out.println(DiagnosticRenderer.json(results));
        } else if (targets.isEmpty()) {
            out.println(file + ": no principles to verify");
        }
        out.flush();

        for (VerificationResult r : results) {
            if (!r.isValid()) return Main.EXIT_PROBLEMS;
        }
        return Main.EXIT_OK;
    }
}
