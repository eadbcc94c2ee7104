package com.statuta.compiler.ast.expr;

import com.statuta.compiler.ast.AstNode;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.pattern.Pattern;

/**
 * match 分支：{@code case pattern where guard := consequence result}
 */
public class MatchArm extends AstNode {
    private final Pattern pattern;
    private final Expression guard;
    private final Expression result;

    public MatchArm(SourceLocation location, Pattern pattern, Expression guard, Expression result) {
        super(location);
        this.pattern = pattern;
        this.guard = guard;
        this.result = result;
    }

    public Pattern getPattern() {
        return pattern;
    }

    /** 守卫条件，可能为 null */
    public Expression getGuard() {
        return guard;
    }

    public boolean hasGuard() {
        return guard != null;
    }

    public Expression getResult() {
        return result;
    }
}
