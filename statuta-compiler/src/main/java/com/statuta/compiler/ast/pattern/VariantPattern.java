package com.statuta.compiler.ast.pattern;

import com.statuta.compiler.ast.SourceLocation;

/**
 * 枚举成员模式：{@code Variant} 或 {@code Enum.Variant}
 */
public class VariantPattern extends Pattern {
    private final String enumName;
    private final String variant;

    public VariantPattern(SourceLocation location, String enumName, String variant) {
        super(location);
        this.enumName = enumName;
        this.variant = variant;
    }

    /** 限定的枚举名，未限定时为 null */
    public String getEnumName() {
        return enumName;
    }

    public String getVariant() {
        return variant;
    }

    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
        return visitor.visitVariant(this);
    }
}
