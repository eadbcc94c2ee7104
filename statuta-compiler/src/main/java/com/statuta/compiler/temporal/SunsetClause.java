package com.statuta.compiler.temporal;

import com.statuta.compiler.ast.SourceLocation;

import java.time.LocalDate;

/**
 * 日落条款：{@code @sunset(dd-mm-yyyy)}
 */
public final class SunsetClause {
    private final String key;
    private final LocalDate expiryDate;
    private final SourceLocation location;

    public SunsetClause(String key, LocalDate expiryDate, SourceLocation location) {
        this.key = key;
        this.expiryDate = expiryDate;
        this.location = location;
    }

    public String getKey() { return key; }
    public LocalDate getExpiryDate() { return expiryDate; }
    public SourceLocation getLocation() { return location; }

    public boolean isExpiredOn(LocalDate reference) {
        return expiryDate.isBefore(reference);
    }

    @Override
    public String toString() {
        return key + " sunset " + expiryDate;
    }
}
