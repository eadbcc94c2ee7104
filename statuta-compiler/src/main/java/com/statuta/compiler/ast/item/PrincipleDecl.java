package com.statuta.compiler.ast.item;

import com.statuta.compiler.ast.ItemVisitor;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.expr.Expression;

/**
 * 原则：以量化表达式表述的法律不变式
 */
public class PrincipleDecl extends Item {
    private final Expression body;

    public PrincipleDecl(SourceLocation location, String name, Expression body) {
        super(location, name);
        this.body = body;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(ItemVisitor<R, C> visitor, C context) {
        return visitor.visitPrinciple(this, context);
    }
}
