package com.statuta.compiler.ast.type;

import com.statuta.compiler.ast.SourceLocation;

import java.util.Objects;

/**
 * 金额类型 {@code money} / {@code money<SGD>}
 */
public class MoneyType extends TypeRef {
    private final String currency;

    public MoneyType(SourceLocation location, String currency) {
        super(location);
        this.currency = currency;
    }

    /** 币种代码，未指定时为 null */
    public String getCurrency() {
        return currency;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitMoney(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MoneyType && Objects.equals(((MoneyType) o).currency, currency);
    }

    @Override
    public int hashCode() {
        return Objects.hash("money", currency);
    }

    @Override
    public String toString() {
        return currency != null ? "money<" + currency + ">" : "money";
    }
}
