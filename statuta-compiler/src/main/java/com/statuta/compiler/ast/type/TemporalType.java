package com.statuta.compiler.ast.type;

import com.statuta.compiler.ast.SourceLocation;

import java.time.LocalDate;
import java.util.Objects;

/**
 * 时效类型 {@code Temporal<T, valid_from = 01-01-2020, valid_until = 31-12-2025>}
 */
public class TemporalType extends TypeRef {
    private final TypeRef inner;
    private final LocalDate validFrom;
    private final LocalDate validUntil;

    public TemporalType(SourceLocation location, TypeRef inner, LocalDate validFrom, LocalDate validUntil) {
        super(location);
        this.inner = inner;
        this.validFrom = validFrom;
        this.validUntil = validUntil;
    }

    public TypeRef getInner() {
        return inner;
    }

    /** 生效起始日，可能为 null */
    public LocalDate getValidFrom() {
        return validFrom;
    }

    /** 失效日，可能为 null */
    public LocalDate getValidUntil() {
        return validUntil;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitTemporal(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof TemporalType)) return false;
        TemporalType that = (TemporalType) o;
        return inner.equals(that.inner)
                && Objects.equals(validFrom, that.validFrom)
                && Objects.equals(validUntil, that.validUntil);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inner, validFrom, validUntil);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Temporal<").append(inner);
        if (validFrom != null) sb.append(", valid_from=").append(validFrom);
        if (validUntil != null) sb.append(", valid_until=").append(validUntil);
        return sb.append('>').toString();
    }
}
