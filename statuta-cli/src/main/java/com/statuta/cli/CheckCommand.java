package com.statuta.cli;

import com.statuta.compiler.pipeline.CompilationResult;
import com.statuta.compiler.pipeline.StatutaCompiler;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

/**
 * picocli check 子命令：运行编译流水线并输出诊断
 */
@Command(name = "check", description = "检查法条源文件并输出诊断",
         mixinStandardHelpOptions = true,
         exitCodeOnInvalidInput = Main.EXIT_PROBLEMS)
public class CheckCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(CheckCommand.class.getName());

    @ParentCommand
    Main parent;

    @Spec
    CommandSpec spec;

    @Mixin
    CommonOptions common;

    @Parameters(index = "0", paramLabel = "FILE", description = "源文件")
    Path file;

    @Override
    public Integer call() {
        LoggingSetup.install(common.verbose);
        StatutaConfig config = common.loadConfig(parent.getEnv(), parent.getWorkingDir());
        PrintWriter out = spec.commandLine().getOut();

        CompilationResult result = compile(parent.getWorkingDir().resolve(file), config, spec.commandLine().getErr());
        if (result == null) {
            return Main.EXIT_PROBLEMS;
        }
        out.print(common.json ? DiagnosticRenderer.json(result) + "\n" : DiagnosticRenderer.text(result));
        out.flush();
        return result.isSuccess() ? Main.EXIT_OK : Main.EXIT_PROBLEMS;
    }

    /**
     * 读取并编译源文件；文件无法读取时打印错误并返回 null
     */
    static CompilationResult compile(Path source, StatutaConfig config, PrintWriter err) {
        StatutaCompiler compiler = new StatutaCompiler(config.toCompilerOptions());
        try {
            CompilationResult result = compiler.compile(source);
            LOG.fine(() -> "Compiled " + source + " with " + result.getDiagnostics().size() + " diagnostic(s)");
            return result;
        } catch (IOException e) {
            err.println("error: Cannot read " + source + ": " + e.getMessage());
            return null;
        }
    }
}
