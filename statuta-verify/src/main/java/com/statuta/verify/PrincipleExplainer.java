package com.statuta.verify;

import com.statuta.compiler.ast.expr.Expression;
import com.statuta.compiler.ast.expr.QuantifierExpr;
import com.statuta.compiler.ast.item.PrincipleDecl;

/**
 * 把 principle 渲染为分层的英文陈述，用于报告
 */
public final class PrincipleExplainer {

    private static final String INDENT = "  ";

    public String explain(PrincipleDecl principle) {
        StringBuilder sb = new StringBuilder();
        sb.append("Principle '").append(principle.getName()).append("' states that:\n\n");
        int depth = 1;
        Expression current = principle.getBody();
        while (current instanceof QuantifierExpr) {
            QuantifierExpr q = (QuantifierExpr) current;
            indent(sb, depth);
            if (q.getKind() == QuantifierExpr.Kind.FORALL) {
                sb.append("For all ").append(q.getVariable()).append(" of type ").append(q.getVariableType());
                if (q.hasGuard()) {
                    sb.append(" where ").append(q.getGuard());
                }
                sb.append(",\n");
            } else {
                sb.append("There exists a ").append(q.getVariable()).append(" of type ").append(q.getVariableType());
                if (q.hasGuard()) {
                    sb.append(" with ").append(q.getGuard());
                }
                sb.append(" such that\n");
            }
            depth++;
            current = q.getBody();
        }
        indent(sb, depth);
        sb.append(current).append('\n');
        return sb.toString();
    }

    private static void indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) sb.append(INDENT);
    }
}
