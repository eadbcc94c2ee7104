package com.statuta.compiler.pipeline;

import com.statuta.compiler.StatutaException;
import com.statuta.compiler.analysis.CheckError;
import com.statuta.compiler.analysis.Checker;
import com.statuta.compiler.analysis.ResolvedProgram;
import com.statuta.compiler.analysis.Resolver;
import com.statuta.compiler.ast.Program;
import com.statuta.compiler.ast.item.Item;
import com.statuta.compiler.hierarchy.HierarchyChecker;
import com.statuta.compiler.hierarchy.HierarchyError;
import com.statuta.compiler.parser.Parser;
import com.statuta.compiler.temporal.TemporalChecker;
import com.statuta.compiler.temporal.TemporalError;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 编译流水线：词法 → 语法 → 导入 → 解析 → 检查（语义、层级、时效）
 *
 * <p>前三个阶段的错误立即终止编译单元；三个检查器总是运行完毕并合并全部诊断。
 * 每个实例各自持有模块缓存，实例之间不共享可变状态；单个实例不是线程安全的。</p>
 */
public final class StatutaCompiler {

    private static final Logger LOG = Logger.getLogger(StatutaCompiler.class.getName());

    private final CompilerOptions options;
    private final ModuleLoader moduleLoader;

    public StatutaCompiler() {
        this(new CompilerOptions());
    }

    public StatutaCompiler(CompilerOptions options) {
        this.options = options;
        this.moduleLoader = new ModuleLoader(options.getModuleSearchPaths());
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /** 编译源文件；导入相对文件所在目录解析 */
    public CompilationResult compile(Path file) throws IOException {
        String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        Path dir = file.toAbsolutePath().getParent();
        return compile(source, file.toString(), dir);
    }

    /** 编译内存中的源码；导入只在搜索目录中查找 */
    public CompilationResult compile(String source, String fileName) {
        return compile(source, fileName, null);
    }

    public CompilationResult compile(String source, String fileName, Path baseDir) {
        long start = System.nanoTime();
        ResolvedProgram resolved;
        try {
            Program program = Parser.forSource(source, fileName).parse();
            List<Item> imported = moduleLoader.loadImports(program, baseDir);
            resolved = new Resolver().resolve(program, imported);
        } catch (StatutaException e) {
            LOG.log(Level.FINE, "Compilation of " + fileName + " stopped: " + e.getMessage(), e);
            return CompilationResult.failed(fileName, Diagnostic.from(e));
        }

        List<Diagnostic> diagnostics = options.isParallelChecks()
                ? runChecksInParallel(resolved)
                : runChecks(resolved);

        LOG.log(Level.FINE, "Compiled {0} in {1} ms with {2} diagnostics", new Object[]{
                fileName, (System.nanoTime() - start) / 1_000_000, diagnostics.size()});
        return new CompilationResult(fileName, resolved, diagnostics);
    }

    private List<Diagnostic> runChecks(ResolvedProgram resolved) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        diagnostics.addAll(checkSemantics(resolved));
        diagnostics.addAll(checkHierarchy(resolved.getProgram()));
        diagnostics.addAll(checkTemporal(resolved.getProgram(), options.getReferenceDate()));
        return diagnostics;
    }

    /**
     * 三个检查器只读同一棵已解析的树，各自在线程池中运行，结果按固定顺序合并
     */
    private List<Diagnostic> runChecksInParallel(final ResolvedProgram resolved) {
        final LocalDate reference = options.getReferenceDate();
        ExecutorService pool = Executors.newFixedThreadPool(3, r -> {
            Thread t = new Thread(r, "statuta-check");
            t.setDaemon(true);
            return t;
        });
        try {
            List<Callable<List<Diagnostic>>> tasks = new ArrayList<>();
            tasks.add(() -> checkSemantics(resolved));
            tasks.add(() -> checkHierarchy(resolved.getProgram()));
            tasks.add(() -> checkTemporal(resolved.getProgram(), reference));

            List<Diagnostic> diagnostics = new ArrayList<>();
            for (Future<List<Diagnostic>> future : pool.invokeAll(tasks)) {
                diagnostics.addAll(future.get());
            }
            return diagnostics;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while checking " + resolved.getProgram().getFileName(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Checker failed on " + resolved.getProgram().getFileName(), cause);
        } finally {
            pool.shutdownNow();
        }
    }

    private List<Diagnostic> checkSemantics(ResolvedProgram resolved) {
        List<Diagnostic> result = new ArrayList<>();
        Checker checker = new Checker(resolved, options.getPercentMin(), options.getPercentMax());
        for (CheckError e : checker.check()) {
            result.add(Diagnostic.from(e));
        }
        return result;
    }

    private static List<Diagnostic> checkHierarchy(Program program) {
        List<Diagnostic> result = new ArrayList<>();
        for (HierarchyError e : new HierarchyChecker(program).checkConflicts()) {
            result.add(Diagnostic.from(e));
        }
        return result;
    }

    private static List<Diagnostic> checkTemporal(Program program, LocalDate reference) {
        List<Diagnostic> result = new ArrayList<>();
        for (TemporalError e : new TemporalChecker(program).validate(reference)) {
            result.add(Diagnostic.from(e));
        }
        return result;
    }
}
