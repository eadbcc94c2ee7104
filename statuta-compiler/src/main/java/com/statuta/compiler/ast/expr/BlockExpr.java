package com.statuta.compiler.ast.expr;

import com.statuta.compiler.ast.ExprVisitor;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.item.VariableDecl;

import java.util.Collections;
import java.util.List;

/**
 * 函数体块：若干局部声明后跟 {@code := result}
 */
public class BlockExpr extends Expression {
    private final List<VariableDecl> declarations;
    private final Expression result;

    public BlockExpr(SourceLocation location, List<VariableDecl> declarations, Expression result) {
        super(location);
        this.declarations = Collections.unmodifiableList(declarations);
        this.result = result;
    }

    public List<VariableDecl> getDeclarations() {
        return declarations;
    }

    public Expression getResult() {
        return result;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
