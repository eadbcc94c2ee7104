package com.statuta.compiler.ast.pattern;

import com.statuta.compiler.ast.AstNode;
import com.statuta.compiler.ast.SourceLocation;

/**
 * match 模式基类
 */
public abstract class Pattern extends AstNode {

    protected Pattern(SourceLocation location) {
        super(location);
    }

    public abstract <R> R accept(PatternVisitor<R> visitor);
}
