package com.statuta.compiler.ast.expr;

import com.statuta.compiler.ast.ExprVisitor;
import com.statuta.compiler.ast.SourceLocation;

/**
 * 字段访问：{@code target.field}
 */
public class FieldAccessExpr extends Expression {
    private final Expression target;
    private final String fieldName;

    public FieldAccessExpr(SourceLocation location, Expression target, String fieldName) {
        super(location);
        this.target = target;
        this.fieldName = fieldName;
    }

    public Expression getTarget() {
        return target;
    }

    public String getFieldName() {
        return fieldName;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitFieldAccess(this, context);
    }

    @Override
    public String toString() {
        return target + "." + fieldName;
    }
}
