package com.statuta.compiler.analysis;

import com.statuta.compiler.ast.expr.*;
import com.statuta.compiler.ast.item.VariableDecl;
import com.statuta.compiler.lexer.MoneyValue;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * 编译期数值常量求值
 *
 * <p>支持数值字面量、取负、四则运算和取模，以及引用已声明值常量的标识符。
 * 无法求值时返回 null。</p>
 */
public final class ConstantEvaluator {

    private final ResolvedProgram program;
    private final Set<VariableDecl> evaluating = Collections.newSetFromMap(new IdentityHashMap<VariableDecl, Boolean>());

    public ConstantEvaluator(ResolvedProgram program) {
        this.program = program;
    }

    public BigDecimal evaluate(Expression expr) {
        if (expr instanceof Literal) {
            return literalValue((Literal) expr);
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expr;
            if (unary.getOperator() != UnaryExpr.UnaryOp.NEG) return null;
            BigDecimal v = evaluate(unary.getOperand());
            return v != null ? v.negate() : null;
        }
        if (expr instanceof BinaryExpr) {
            return evaluateBinary((BinaryExpr) expr);
        }
        if (expr instanceof Identifier) {
            Symbol symbol = program.getBinding((Identifier) expr);
            if (symbol == null || !(symbol.getDeclaration() instanceof VariableDecl)) return null;
            VariableDecl decl = (VariableDecl) symbol.getDeclaration();
            if (!evaluating.add(decl)) return null;
            try {
                return evaluate(decl.getValue());
            } finally {
                evaluating.remove(decl);
            }
        }
        return null;
    }

    private BigDecimal evaluateBinary(BinaryExpr expr) {
        if (!expr.getOperator().isArithmetic()) return null;
        BigDecimal l = evaluate(expr.getLeft());
        if (l == null) return null;
        BigDecimal r = evaluate(expr.getRight());
        if (r == null) return null;
        switch (expr.getOperator()) {
            case ADD: return l.add(r);
            case SUB: return l.subtract(r);
            case MUL: return l.multiply(r);
            case DIV: return r.signum() == 0 ? null : l.divide(r, MathContext.DECIMAL64);
            case MOD: return r.signum() == 0 ? null : l.remainder(r);
            default: return null;
        }
    }

    static BigDecimal literalValue(Literal literal) {
        Object value = literal.getValue();
        switch (literal.getKind()) {
            case INT: return BigDecimal.valueOf((Long) value);
            case FLOAT: return BigDecimal.valueOf((Double) value);
            case PERCENT: return (BigDecimal) value;
            case MONEY: return ((MoneyValue) value).getAmount();
            default: return null;
        }
    }
}
