package com.statuta.compiler.temporal;

import com.statuta.compiler.ast.SourceLocation;

import java.time.LocalDate;

/**
 * 溯及既往规则：同一字段上的 {@code @retroactive} 与 {@code @effective}
 */
public final class RetroactiveRule {
    private final String key;
    private final LocalDate retroactiveFrom;
    private final LocalDate effectiveDate;
    private final SourceLocation location;

    public RetroactiveRule(String key, LocalDate retroactiveFrom, LocalDate effectiveDate, SourceLocation location) {
        this.key = key;
        this.retroactiveFrom = retroactiveFrom;
        this.effectiveDate = effectiveDate;
        this.location = location;
    }

    public String getKey() { return key; }
    public LocalDate getRetroactiveFrom() { return retroactiveFrom; }

    /** 生效日期；字段没有 {@code @effective} 时为 null */
    public LocalDate getEffectiveDate() { return effectiveDate; }

    public SourceLocation getLocation() { return location; }

    @Override
    public String toString() {
        return key + " retroactive from " + retroactiveFrom + " (effective " + effectiveDate + ")";
    }
}
