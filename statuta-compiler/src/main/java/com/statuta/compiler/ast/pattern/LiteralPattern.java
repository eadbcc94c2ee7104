package com.statuta.compiler.ast.pattern;

import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.expr.Literal;

/**
 * 字面量模式
 */
public class LiteralPattern extends Pattern {
    private final Literal literal;

    public LiteralPattern(SourceLocation location, Literal literal) {
        super(location);
        this.literal = literal;
    }

    public Literal getLiteral() {
        return literal;
    }

    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
