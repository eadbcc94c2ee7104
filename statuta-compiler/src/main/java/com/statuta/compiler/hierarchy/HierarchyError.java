package com.statuta.compiler.hierarchy;

import com.statuta.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 层级检查诊断
 */
public final class HierarchyError {

    public enum Kind {
        CYCLE,
        DANGLING_REFERENCE,
        LEVEL_INVERSION,
        DUPLICATE_NODE
    }

    private final Kind kind;
    private final List<String> keys;
    private final String message;
    private final SourceLocation location;

    public HierarchyError(Kind kind, List<String> keys, String message, SourceLocation location) {
        this.kind = kind;
        this.keys = Collections.unmodifiableList(keys);
        this.message = message;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public Kind getKind() { return kind; }

    /** 涉及的节点键；环按环上顺序排列 */
    public List<String> getKeys() { return keys; }

    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }

    @Override
    public String toString() {
        return kind + " at " + location + ": " + message;
    }
}
