package com.statuta.compiler.ast.expr;

import com.statuta.compiler.ast.ExprVisitor;
import com.statuta.compiler.ast.SourceLocation;

/**
 * {@code pass}：尚未规定结果，可与任何类型统一
 */
public class PassExpr extends Expression {

    public PassExpr(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitPass(this, context);
    }

    @Override
    public String toString() {
        return "pass";
    }
}
