package com.statuta.compiler.ast.expr;

import com.statuta.compiler.ast.ExprVisitor;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.type.TypeRef;

/**
 * 存在量词
 */
public class ExistsExpr extends QuantifierExpr {

    public ExistsExpr(SourceLocation location, String variable, TypeRef variableType,
                      Expression guard, Expression body) {
        super(location, variable, variableType, guard, body);
    }

    @Override
    public Kind getKind() {
        return Kind.EXISTS;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitExists(this, context);
    }
}
