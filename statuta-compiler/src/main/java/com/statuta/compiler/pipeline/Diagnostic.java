package com.statuta.compiler.pipeline;

import com.statuta.compiler.StatutaException;
import com.statuta.compiler.analysis.CheckError;
import com.statuta.compiler.analysis.DefinitionConflict;
import com.statuta.compiler.analysis.ResolveException;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.hierarchy.HierarchyError;
import com.statuta.compiler.lexer.LexException;
import com.statuta.compiler.parser.ParseException;
import com.statuta.compiler.temporal.TemporalError;

/**
 * 统一的诊断条目：阶段、机器可读的种类、位置与消息
 */
public final class Diagnostic {

    public enum Phase {
        LEX,
        PARSE,
        RESOLVE,
        CHECK,
        HIERARCHY,
        TEMPORAL,
        CONFLICT
    }

    private final Phase phase;
    private final String kind;
    private final SourceLocation location;
    private final String message;

    public Diagnostic(Phase phase, String kind, SourceLocation location, String message) {
        this.phase = phase;
        this.kind = kind;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.message = message;
    }

    public static Diagnostic from(StatutaException e) {
        Phase phase;
        if (e instanceof LexException) {
            phase = Phase.LEX;
        } else if (e instanceof ParseException) {
            phase = Phase.PARSE;
        } else if (e instanceof ResolveException) {
            phase = Phase.RESOLVE;
        } else {
            throw new IllegalArgumentException("Unknown compiler error type: " + e.getClass().getName(), e);
        }
        return new Diagnostic(phase, e.getKind(), e.getLocation(), e.getRawMessage());
    }

    public static Diagnostic from(CheckError e) {
        return new Diagnostic(Phase.CHECK, e.getKind().name(), e.getLocation(), e.getMessage());
    }

    public static Diagnostic from(HierarchyError e) {
        return new Diagnostic(Phase.HIERARCHY, e.getKind().name(), e.getLocation(), e.getMessage());
    }

    public static Diagnostic from(TemporalError e) {
        return new Diagnostic(Phase.TEMPORAL, e.getKind().name(), e.getLocation(), e.getMessage());
    }

    /** 位置取第二个程序中的定义，消息附上第一个定义的位置 */
    public static Diagnostic from(DefinitionConflict c) {
        return new Diagnostic(Phase.CONFLICT, c.getKind().name(), c.getSecondLocation(),
                c.getMessage() + " (first defined at " + c.getFirstLocation() + ")");
    }

    public Phase getPhase() { return phase; }
    public String getKind() { return kind; }
    public SourceLocation getLocation() { return location; }
    public String getMessage() { return message; }

    /** 错误阶段是否终止了编译单元 */
    public boolean isFatal() {
        return phase == Phase.LEX || phase == Phase.PARSE || phase == Phase.RESOLVE;
    }

    @Override
    public String toString() {
        return location + ": " + phase.name().toLowerCase() + " " + kind + ": " + message;
    }
}
