package com.statuta.verify;

import com.statuta.compiler.ast.expr.QuantifierExpr;

import java.util.Collections;
import java.util.List;

/**
 * 一条待提交的求解器查询，以及解读其结果的方式
 */
public final class QueryPlan {

    /**
     * sat 结果的含义
     */
    public enum Interpretation {
        /** 断言了原命题的否定；sat 即反例，unsat 即命题成立 */
        REFUTE_NEGATION,
        /** 直接断言原命题；sat 即见证，unsat 即不存在见证 */
        FIND_WITNESS
    }

    private final String query;
    private final Interpretation interpretation;
    private final QuantifierExpr.Kind kind;
    private final List<SmtTranslator.Binding> variables;

    QueryPlan(String query, Interpretation interpretation, QuantifierExpr.Kind kind,
              List<SmtTranslator.Binding> variables) {
        this.query = query;
        this.interpretation = interpretation;
        this.kind = kind;
        this.variables = Collections.unmodifiableList(variables);
    }

    public String getQuery() {
        return query;
    }

    public Interpretation getInterpretation() {
        return interpretation;
    }

    public QuantifierExpr.Kind getKind() {
        return kind;
    }

    /** 提升为顶层常量的量词变量，按出现顺序 */
    public List<SmtTranslator.Binding> getVariables() {
        return variables;
    }

    /** 按查询中的符号查找变量 */
    public SmtTranslator.Binding findVariable(String smtName) {
        for (SmtTranslator.Binding b : variables) {
            if (b.getSmtName().equals(smtName)) return b;
        }
        return null;
    }

    @Override
    public String toString() {
        return interpretation + " " + variables;
    }
}
