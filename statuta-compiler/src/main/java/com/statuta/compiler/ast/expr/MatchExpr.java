package com.statuta.compiler.ast.expr;

import com.statuta.compiler.ast.ExprVisitor;
import com.statuta.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * match 表达式
 */
public class MatchExpr extends Expression {
    private final Expression scrutinee;
    private final List<MatchArm> arms;

    public MatchExpr(SourceLocation location, Expression scrutinee, List<MatchArm> arms) {
        super(location);
        this.scrutinee = scrutinee;
        this.arms = Collections.unmodifiableList(arms);
    }

    public Expression getScrutinee() {
        return scrutinee;
    }

    public List<MatchArm> getArms() {
        return arms;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitMatch(this, context);
    }
}
