package com.statuta.compiler.analysis;

import com.statuta.compiler.ast.SourceLocation;

/**
 * 检查器诊断条目
 */
public final class CheckError {

    public enum Kind {
        UNDEFINED_SYMBOL,
        DUPLICATE_DEFINITION,
        TYPE_ERROR,
        NON_EXHAUSTIVE_MATCH,
        UNREACHABLE_PATTERN,
        INVALID_CITATION,
        CONSTRAINT_VIOLATION
    }

    private final Kind kind;
    private final String name;
    private final String message;
    private final SourceLocation location;

    public CheckError(Kind kind, String name, String message, SourceLocation location) {
        this.kind = kind;
        this.name = name;
        this.message = message;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public Kind getKind() { return kind; }

    /** 相关的标识符名；与具体名称无关的诊断为 null */
    public String getName() { return name; }

    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }

    @Override
    public String toString() {
        return kind + " at " + location + ": " + message;
    }
}
