package com.statuta.cli;

import com.statuta.compiler.analysis.ConflictDetector;
import com.statuta.compiler.analysis.DefinitionConflict;
import com.statuta.compiler.pipeline.CompilationResult;
import com.statuta.compiler.pipeline.Diagnostic;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

/**
 * picocli conflicts 子命令：比较两个源文件中同名的枚举、结构体与 legal_test
 */
@Command(name = "conflicts", description = "比较两个法条源文件中同名定义是否一致",
         mixinStandardHelpOptions = true,
         exitCodeOnInvalidInput = Main.EXIT_PROBLEMS)
public class ConflictsCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(ConflictsCommand.class.getName());

    @ParentCommand
    Main parent;

    @Spec
    CommandSpec spec;

    @Mixin
    CommonOptions common;

    @Parameters(index = "0", paramLabel = "FIRST", description = "第一个源文件")
    Path first;

    @Parameters(index = "1", paramLabel = "SECOND", description = "第二个源文件")
    Path second;

    @Override
    public Integer call() {
        LoggingSetup.install(common.verbose);
        StatutaConfig config = common.loadConfig(parent.getEnv(), parent.getWorkingDir());
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CompilationResult a = CheckCommand.compile(parent.getWorkingDir().resolve(first), config, err);
        CompilationResult b = CheckCommand.compile(parent.getWorkingDir().resolve(second), config, err);
        if (a == null || b == null) {
            return Main.EXIT_PROBLEMS;
        }
        // 语法树不完整时无法比较
        if (a.isFatal() || b.isFatal()) {
            for (CompilationResult r : new CompilationResult[]{a, b}) {
                if (r.isFatal()) {
                    out.print(DiagnosticRenderer.text(r));
                }
            }
            out.flush();
            return Main.EXIT_PROBLEMS;
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (DefinitionConflict c : new ConflictDetector().detect(a.getProgram(), b.getProgram())) {
            diagnostics.add(Diagnostic.from(c));
        }
        LOG.fine(() -> "Found " + diagnostics.size() + " conflict(s) between " + first + " and " + second);

        if (common.json) {
            out.println(DiagnosticRenderer.json(a.getFileName(), b.getFileName(), diagnostics));
        } else {
            out.print(DiagnosticRenderer.text(a.getFileName(), b.getFileName(), diagnostics));
        }
        out.flush();
        return diagnostics.isEmpty() ? Main.EXIT_OK : Main.EXIT_PROBLEMS;
    }
}
