package com.statuta.compiler.analysis;

import com.statuta.compiler.ast.SourceLocation;

/**
 * 两个程序中同名定义的冲突
 */
public final class DefinitionConflict {

    public enum Kind {
        ENUM_VARIANTS,
        STRUCT_FIELDS,
        LEGAL_TEST_REQUIREMENTS
    }

    private final Kind kind;
    private final String name;
    private final String message;
    private final SourceLocation firstLocation;
    private final SourceLocation secondLocation;

    public DefinitionConflict(Kind kind, String name, String message,
                              SourceLocation firstLocation, SourceLocation secondLocation) {
        this.kind = kind;
        this.name = name;
        this.message = message;
        this.firstLocation = firstLocation != null ? firstLocation : SourceLocation.UNKNOWN;
        this.secondLocation = secondLocation != null ? secondLocation : SourceLocation.UNKNOWN;
    }

    public Kind getKind() { return kind; }

    /** 冲突定义的限定名 */
    public String getName() { return name; }

    public String getMessage() { return message; }

    /** 第一个程序中的定义位置 */
    public SourceLocation getFirstLocation() { return firstLocation; }

    /** 第二个程序中的定义位置 */
    public SourceLocation getSecondLocation() { return secondLocation; }

    @Override
    public String toString() {
        return kind + " " + name + " at " + firstLocation + " and " + secondLocation + ": " + message;
    }
}
