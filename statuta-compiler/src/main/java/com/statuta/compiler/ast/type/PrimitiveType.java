package com.statuta.compiler.ast.type;

import com.statuta.compiler.ast.SourceLocation;

/**
 * 基本类型
 */
public class PrimitiveType extends TypeRef {
    private final Kind kind;

    public PrimitiveType(SourceLocation location, Kind kind) {
        super(location);
        this.kind = kind;
    }

    public static PrimitiveType of(Kind kind) {
        return new PrimitiveType(SourceLocation.UNKNOWN, kind);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNumeric() {
        return kind == Kind.INT || kind == Kind.FLOAT || kind == Kind.PERCENT;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitPrimitive(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PrimitiveType && ((PrimitiveType) o).kind == kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }

    @Override
    public String toString() {
        return kind.getDisplayName();
    }

    public enum Kind {
        INT("int"),
        FLOAT("float"),
        STRING("string"),
        BOOL("bool"),
        PERCENT("percent"),
        DATE("date"),
        DURATION("duration"),
        PASS("pass");

        private final String displayName;

        Kind(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }
}
