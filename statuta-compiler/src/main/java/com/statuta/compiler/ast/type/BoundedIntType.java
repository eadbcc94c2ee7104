package com.statuta.compiler.ast.type;

import com.statuta.compiler.ast.SourceLocation;

/**
 * 有界整数 {@code BoundedInt<low, high>}；low &gt; high 由检查器报告，解析阶段原样保留。
 */
public class BoundedIntType extends TypeRef {
    private final long low;
    private final long high;

    public BoundedIntType(SourceLocation location, long low, long high) {
        super(location);
        this.low = low;
        this.high = high;
    }

    public long getLow() {
        return low;
    }

    public long getHigh() {
        return high;
    }

    public boolean contains(long value) {
        return value >= low && value <= high;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitBoundedInt(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BoundedIntType)) return false;
        BoundedIntType that = (BoundedIntType) o;
        return low == that.low && high == that.high;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(low) * 31 + Long.hashCode(high);
    }

    @Override
    public String toString() {
        return "BoundedInt<" + low + ", " + high + ">";
    }
}
