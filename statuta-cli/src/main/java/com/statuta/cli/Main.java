package com.statuta.cli;

import com.statuta.compiler.StatutaException;
import com.statuta.verify.VerifierConfig;
import com.statuta.verify.solver.ProcessSolverBackend;
import com.statuta.verify.solver.SolverBackend;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.function.Function;

/**
 * Statuta CLI 入口点（picocli）
 */
@Command(name = "statuta", version = "Statuta v0.1.0",
         mixinStandardHelpOptions = true,
         exitCodeOnInvalidInput = Main.EXIT_PROBLEMS,
         subcommands = {CheckCommand.class, VerifyCommand.class, ConflictsCommand.class})
public class Main implements Runnable {

    /** 没有问题 */
    public static final int EXIT_OK = 0;
    /** 报告了诊断、principle 未通过，或参数与配置无效 */
    public static final int EXIT_PROBLEMS = 1;
    /** 求解器不可用、超时或输出无法识别 */
    public static final int EXIT_SOLVER_FAILURE = 2;

    @Spec
    CommandSpec spec;

    private final Map<String, String> env;
    private final Path workingDir;
    private final Function<VerifierConfig, SolverBackend> backendFactory;

    public Main() {
        this(System.getenv(), Paths.get("").toAbsolutePath(),
                config -> new ProcessSolverBackend(config.getSolverCommand(), config.getTimeoutMillis()));
    }

    Main(Map<String, String> env, Path workingDir, Function<VerifierConfig, SolverBackend> backendFactory) {
        this.env = env;
        this.workingDir = workingDir;
        this.backendFactory = backendFactory;
    }

    Map<String, String> getEnv() {
        return env;
    }

    Path getWorkingDir() {
        return workingDir;
    }

    SolverBackend createBackend(VerifierConfig config) {
        return backendFactory.apply(config);
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    /**
     * 构造命令行；命令内部抛出的编译错误与配置错误在此处打印并转为退出码 1
     */
    static CommandLine commandLine(Main main) {
        CommandLine cmd = new CommandLine(main);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof StatutaException || ex instanceof ConfigException) {
                commandLine.getErr().println("error: " + ex.getMessage());
                return EXIT_PROBLEMS;
            }
            throw ex;
        });
        return cmd;
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
