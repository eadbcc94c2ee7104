package com.statuta.verify;

import com.statuta.compiler.analysis.Scope;
import com.statuta.compiler.ast.expr.Expression;
import com.statuta.compiler.ast.expr.QuantifierExpr;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 按量词极性构造查询
 *
 * <p>全称命题 ∀x. G(x) → R(x) 的否定是 ∃x. G(x) ∧ ¬R(x)：把 x 提升为顶层常量，
 * 断言值域、守卫与 {@code (not R)}，sat 的模型即反例。存在命题 ∃x. G(x) ∧ R(x)
 * 直接断言，sat 的模型即见证。</p>
 *
 * <p>只剥离开头与顶层同种的连续量词；种类交替之后的量词留在主体内，
 * 由 {@link SmtTranslator} 输出为 SMT-LIB 绑定。</p>
 */
public final class QuantifierPolarity {

    private static final Logger LOG = Logger.getLogger(QuantifierPolarity.class.getName());

    private final SmtTranslator translator;

    public QuantifierPolarity(SmtTranslator translator) {
        this.translator = translator;
    }

    /**
     * 以主体的最外层量词决定极性；没有量词的命题按全称处理
     */
    public QueryPlan plan(Expression body) {
        return plan(body, null);
    }

    /**
     * @param scope 主体中名字查找所在的作用域帧，null 表示顶层
     */
    public QueryPlan plan(Expression body, Scope scope) {
        QuantifierExpr.Kind kind = body instanceof QuantifierExpr
                ? ((QuantifierExpr) body).getKind()
                : QuantifierExpr.Kind.FORALL;
        return plan(kind, body, scope);
    }

    public QueryPlan plan(QuantifierExpr.Kind kind, Expression body) {
        return plan(kind, body, null);
    }

    public QueryPlan plan(QuantifierExpr.Kind kind, Expression body, Scope scope) {
        Set<String> used = new HashSet<>();
        List<SmtTranslator.Binding> variables = new ArrayList<>();
        List<String> facts = new ArrayList<>();
        SmtTranslator.Env env = SmtTranslator.Env.in(scope);

        Expression current = body;
        while (current instanceof QuantifierExpr && ((QuantifierExpr) current).getKind() == kind) {
            QuantifierExpr q = (QuantifierExpr) current;
            SmtTranslator.Binding binding = translator.bind(q, fresh(q.getVariable(), used));
            variables.add(binding);
            env = env.with(binding);
            facts.addAll(binding.getDomain());
            if (q.hasGuard()) {
                facts.add(translator.translateBool(q.getGuard(), env).getText());
            }
            current = q.getBody();
        }

        String matrix = translator.translateBool(current, env).getText();
        QueryPlan.Interpretation interpretation;
        if (kind == QuantifierExpr.Kind.FORALL) {
            facts.add("(not " + matrix + ")");
            interpretation = QueryPlan.Interpretation.REFUTE_NEGATION;
        } else {
            facts.add(matrix);
            interpretation = QueryPlan.Interpretation.FIND_WITNESS;
        }

        StringBuilder sb = new StringBuilder();
        sb.append("(set-option :produce-models true)\n");
        sb.append("(set-logic ALL)\n");
        for (SmtTranslator.Binding b : variables) {
            sb.append(b.declaration()).append('\n');
        }
        for (String fact : facts) {
            sb.append("(assert ").append(fact).append(")\n");
        }
        sb.append("(check-sat)\n");
        sb.append("(get-model)\n");

        LOG.fine(() -> "Planned " + interpretation + " query with " + variables.size() + " free constants");
        return new QueryPlan(sb.toString(), interpretation, kind, variables);
    }

    /** 重名的变量改写为 x!1、x!2 ... */
    private static String fresh(String name, Set<String> used) {
        String candidate = name;
        int n = 0;
        while (!used.add(candidate)) {
            candidate = name + "!" + (++n);
        }
        return SmtTranslator.symbol(candidate);
    }
}
