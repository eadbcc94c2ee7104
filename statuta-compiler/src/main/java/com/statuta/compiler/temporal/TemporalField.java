package com.statuta.compiler.temporal;

import com.statuta.compiler.ast.SourceLocation;

import java.time.LocalDate;

/**
 * 带有效期的字段：来自字段类型中出现的 {@code Temporal<T, valid_from = ..., valid_until = ...>}
 */
public final class TemporalField {
    private final String key;
    private final LocalDate validFrom;
    private final LocalDate validUntil;
    private final SourceLocation location;

    public TemporalField(String key, LocalDate validFrom, LocalDate validUntil, SourceLocation location) {
        this.key = key;
        this.validFrom = validFrom;
        this.validUntil = validUntil;
        this.location = location;
    }

    /** {@code Struct.field} */
    public String getKey() { return key; }
    public LocalDate getValidFrom() { return validFrom; }
    public LocalDate getValidUntil() { return validUntil; }
    public SourceLocation getLocation() { return location; }

    /** 给定日期是否在有效期内；未给出的边界视为无限 */
    public boolean isValidOn(LocalDate date) {
        return (validFrom == null || !date.isBefore(validFrom))
                && (validUntil == null || date.isBefore(validUntil));
    }

    @Override
    public String toString() {
        return key + " [" + (validFrom != null ? validFrom : "..") + ", " + (validUntil != null ? validUntil : "..") + ")";
    }
}
