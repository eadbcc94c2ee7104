package com.statuta.compiler.ast.expr;

import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.type.TypeRef;

/**
 * 量词表达式基类：{@code forall x: T where guard, body}
 */
public abstract class QuantifierExpr extends Expression {
    private final String variable;
    private final TypeRef variableType;
    private final Expression guard;
    private final Expression body;

    protected QuantifierExpr(SourceLocation location, String variable, TypeRef variableType,
                             Expression guard, Expression body) {
        super(location);
        this.variable = variable;
        this.variableType = variableType;
        this.guard = guard;
        this.body = body;
    }

    public abstract Kind getKind();

    public String getVariable() {
        return variable;
    }

    public TypeRef getVariableType() {
        return variableType;
    }

    /** where 守卫，可能为 null */
    public Expression getGuard() {
        return guard;
    }

    public boolean hasGuard() {
        return guard != null;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public String toString() {
        return (getKind() == Kind.FORALL ? "forall " : "exists ") + variable + ": " + variableType
                + (guard != null ? " where " + guard : "") + ", " + body;
    }

    public enum Kind {
        FORALL,
        EXISTS;

        public Kind dual() {
            return this == FORALL ? EXISTS : FORALL;
        }
    }
}
