package com.statuta.compiler.pipeline;

import com.statuta.compiler.analysis.ResolvedProgram;
import com.statuta.compiler.ast.Program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个编译单元的结果
 *
 * <p>词法、语法或解析阶段失败时不暴露任何程序，只有一条致命诊断；
 * 否则暴露完整解析后的程序以及检查阶段收集到的全部诊断。</p>
 */
public final class CompilationResult {
    private final String fileName;
    private final ResolvedProgram resolved;
    private final List<Diagnostic> diagnostics;

    CompilationResult(String fileName, ResolvedProgram resolved, List<Diagnostic> diagnostics) {
        this.fileName = fileName;
        this.resolved = resolved;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    static CompilationResult failed(String fileName, Diagnostic fatal) {
        return new CompilationResult(fileName, null, Collections.singletonList(fatal));
    }

    public String getFileName() {
        return fileName;
    }

    /** 已解析的程序；致命错误时为 null */
    public ResolvedProgram getResolved() {
        return resolved;
    }

    /** 语法树；致命错误时为 null */
    public Program getProgram() {
        return resolved != null ? resolved.getProgram() : null;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> getDiagnostics(Diagnostic.Phase phase) {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (d.getPhase() == phase) result.add(d);
        }
        return result;
    }

    public boolean isFatal() {
        return resolved == null;
    }

    public boolean isSuccess() {
        return diagnostics.isEmpty();
    }
}
