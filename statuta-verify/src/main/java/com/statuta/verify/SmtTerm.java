package com.statuta.verify;

import java.math.BigDecimal;

/**
 * 已翻译的 SMT-LIB 项及其排序
 *
 * <p>数值项另带计量单位：金额以分计，百分比以百分点计。字面量与值常量保留数值，
 * 换算时直接折叠为新的数值。</p>
 */
public final class SmtTerm {

    public enum Unit {
        PLAIN,
        MONEY,
        PERCENT
    }

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final String text;
    private final SmtSort sort;
    private final Unit unit;
    private final BigDecimal constant;

    public SmtTerm(String text, SmtSort sort) {
        this(text, sort, Unit.PLAIN, null);
    }

    public SmtTerm(String text, SmtSort sort, Unit unit) {
        this(text, sort, unit, null);
    }

    private SmtTerm(String text, SmtSort sort, Unit unit, BigDecimal constant) {
        this.text = text;
        this.sort = sort;
        this.unit = unit;
        this.constant = constant;
    }

    /** 数值常量项 */
    public static SmtTerm number(BigDecimal value, SmtSort sort, Unit unit) {
        return new SmtTerm(SmtTranslator.numeral(value, sort), sort, unit, value);
    }

    public String getText() { return text; }
    public SmtSort getSort() { return sort; }
    public Unit getUnit() { return unit; }

    /** 字面量或值常量的数值，其它项为 null */
    public BigDecimal getConstant() { return constant; }

    public SmtTerm withUnit(Unit newUnit) {
        return new SmtTerm(text, sort, newUnit, constant);
    }

    /** 整数项提升为实数，其它项原样返回 */
    public SmtTerm toReal() {
        return sort == SmtSort.INT ? new SmtTerm("(to_real " + text + ")", SmtSort.REAL, unit, constant) : this;
    }

    /** 乘以 100，用于把以元计的数值换算为分 */
    public SmtTerm centsOf() {
        if (constant != null) {
            BigDecimal v = constant.multiply(HUNDRED);
            SmtSort s = sort == SmtSort.INT || v.stripTrailingZeros().scale() > 0 ? sort : SmtSort.INT;
            return number(v, s, Unit.MONEY);
        }
        String factor = sort == SmtSort.REAL ? "100.0" : "100";
        return new SmtTerm("(* " + factor + " " + text + ")", sort, Unit.MONEY, null);
    }

    /** 百分点换算为比例，结果总是 Real */
    public SmtTerm fraction() {
        if (constant != null) {
            return number(constant.divide(HUNDRED), SmtSort.REAL, Unit.PLAIN);
        }
        return new SmtTerm("(/ " + toReal().text + " 100.0)", SmtSort.REAL, Unit.PLAIN, null);
    }

    @Override
    public String toString() {
        return text;
    }
}
