package com.statuta.compiler.ast.expr;

import com.statuta.compiler.ast.ExprVisitor;
import com.statuta.compiler.ast.SourceLocation;

import java.math.BigDecimal;

/**
 * 字面量表达式
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    /**
     * 字面量的值，类型取决于 {@link #getKind()}：
     * INT→Long，FLOAT→Double，STRING→String，BOOLEAN→Boolean，MONEY→MoneyValue，
     * PERCENT→BigDecimal，DATE→LocalDate，DURATION→Period
     */
    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    @Override
    public String toString() {
        switch (kind) {
            case STRING: return "\"" + value + "\"";
            case PERCENT: return ((BigDecimal) value).toPlainString() + "%";
            default: return String.valueOf(value);
        }
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INT,
        FLOAT,
        STRING,
        BOOLEAN,
        MONEY,
        PERCENT,
        DATE,
        DURATION;

        public boolean isNumeric() {
            return this == INT || this == FLOAT || this == MONEY || this == PERCENT;
        }
    }
}
