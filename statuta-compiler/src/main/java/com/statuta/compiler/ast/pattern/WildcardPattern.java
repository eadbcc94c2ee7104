package com.statuta.compiler.ast.pattern;

import com.statuta.compiler.ast.SourceLocation;

/**
 * 通配模式 {@code _}
 */
public class WildcardPattern extends Pattern {

    public WildcardPattern(SourceLocation location) {
        super(location);
    }

    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
        return visitor.visitWildcard(this);
    }
}
