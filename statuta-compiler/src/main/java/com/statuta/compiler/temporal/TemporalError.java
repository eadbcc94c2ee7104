package com.statuta.compiler.temporal;

import com.statuta.compiler.ast.SourceLocation;

/**
 * 时效检查诊断
 */
public final class TemporalError {

    public enum Kind {
        INVERTED_BOUNDS,
        EXPIRED_SUNSET,
        RETROACTIVE_CONFLICT,
        MISSING_EFFECTIVE_DATE,
        SUNSET_BEFORE_EFFECTIVE,
        INVALID_DATE
    }

    private final Kind kind;
    private final String key;
    private final String message;
    private final SourceLocation location;

    public TemporalError(Kind kind, String key, String message, SourceLocation location) {
        this.kind = kind;
        this.key = key;
        this.message = message;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public Kind getKind() { return kind; }

    /** 出错字段的键 {@code Struct.field} */
    public String getKey() { return key; }

    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }

    @Override
    public String toString() {
        return kind + " at " + location + ": " + message;
    }
}
