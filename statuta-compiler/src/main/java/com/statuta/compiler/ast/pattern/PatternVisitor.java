package com.statuta.compiler.ast.pattern;

/**
 * Pattern 访问者
 */
public interface PatternVisitor<R> {
    R visitLiteral(LiteralPattern pattern);
    R visitWildcard(WildcardPattern pattern);
    R visitVariant(VariantPattern pattern);
    R visitSatisfies(SatisfiesPattern pattern);
}
