package com.statuta.compiler.lexer;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 金额字面量的值：精确的两位小数金额 + 可选币种代码。
 */
public final class MoneyValue {
    private final BigDecimal amount;
    private final String currency;

    public MoneyValue(BigDecimal amount, String currency) {
        this.amount = amount;
        this.currency = currency;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    /** 币种代码，未指定时为 null */
    public String getCurrency() {
        return currency;
    }

    /** 以分为单位的整数金额 */
    public long toCents() {
        return amount.movePointRight(2).longValueExact();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MoneyValue)) return false;
        MoneyValue that = (MoneyValue) o;
        return amount.compareTo(that.amount) == 0 && Objects.equals(currency, that.currency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount.stripTrailingZeros(), currency);
    }

    @Override
    public String toString() {
        return (currency != null ? currency : "") + "$" + amount.toPlainString();
    }
}
