package com.statuta.compiler.ast.type;

import com.statuta.compiler.ast.SourceLocation;

/**
 * 包装类型：{@code Array<T>}、{@code Positive<T>}、{@code NonEmpty<T>}
 */
public class WrapperType extends TypeRef {
    private final Kind kind;
    private final TypeRef inner;

    public WrapperType(SourceLocation location, Kind kind, TypeRef inner) {
        super(location);
        this.kind = kind;
        this.inner = inner;
    }

    public Kind getKind() {
        return kind;
    }

    public TypeRef getInner() {
        return inner;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitWrapper(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof WrapperType)) return false;
        WrapperType that = (WrapperType) o;
        return kind == that.kind && inner.equals(that.inner);
    }

    @Override
    public int hashCode() {
        return kind.hashCode() * 31 + inner.hashCode();
    }

    @Override
    public String toString() {
        return kind.getDisplayName() + "<" + inner + ">";
    }

    public enum Kind {
        ARRAY("Array"),
        POSITIVE("Positive"),
        NON_EMPTY("NonEmpty");

        private final String displayName;

        Kind(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }
}
