package com.statuta.compiler.ast.expr;

import com.statuta.compiler.ast.ExprVisitor;
import com.statuta.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 函数调用：{@code name(args)}
 */
public class CallExpr extends Expression {
    private final Identifier callee;
    private final List<Expression> arguments;

    public CallExpr(SourceLocation location, Identifier callee, List<Expression> arguments) {
        super(location);
        this.callee = callee;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public Identifier getCallee() {
        return callee;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(callee.getName()).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(arguments.get(i));
        }
        return sb.append(')').toString();
    }
}
