package com.statuta.verify;

import java.math.BigDecimal;

/**
 * 量词变量的值域策略
 *
 * <p>金额、百分比和时长在求解器中只是普通的数，它们的合理取值范围由这里显式声明，
 * 翻译时作为断言加入查询。设为 null 或 false 即不加约束。</p>
 */
public final class DomainPolicy {

    private boolean moneyNonNegative = true;
    private BigDecimal percentMin = BigDecimal.ZERO;
    private BigDecimal percentMax = BigDecimal.valueOf(100);
    private boolean durationNonNegative = true;

    /** 默认策略：金额与时长非负，百分比在 0..100 */
    public static DomainPolicy defaults() {
        return new DomainPolicy();
    }

    /** 不附加任何策略约束 */
    public static DomainPolicy unconstrained() {
        return new DomainPolicy()
                .setMoneyNonNegative(false)
                .setPercentRange(null, null)
                .setDurationNonNegative(false);
    }

    public boolean isMoneyNonNegative() {
        return moneyNonNegative;
    }

    public DomainPolicy setMoneyNonNegative(boolean moneyNonNegative) {
        this.moneyNonNegative = moneyNonNegative;
        return this;
    }

    public BigDecimal getPercentMin() {
        return percentMin;
    }

    public BigDecimal getPercentMax() {
        return percentMax;
    }

    /** 任一端为 null 表示该端不设界 */
    public DomainPolicy setPercentRange(BigDecimal min, BigDecimal max) {
        if (min != null && max != null && min.compareTo(max) > 0) {
            throw new IllegalArgumentException("percent range " + min + ".." + max + " is empty");
        }
        this.percentMin = min;
        this.percentMax = max;
        return this;
    }

    public boolean isDurationNonNegative() {
        return durationNonNegative;
    }

    public DomainPolicy setDurationNonNegative(boolean durationNonNegative) {
        this.durationNonNegative = durationNonNegative;
        return this;
    }

    @Override
    public String toString() {
        return "DomainPolicy{money>=0=" + moneyNonNegative
                + ", percent=" + (percentMin != null ? percentMin.toPlainString() : "..")
                + ".." + (percentMax != null ? percentMax.toPlainString() : "..")
                + ", duration>=0=" + durationNonNegative + "}";
    }
}
