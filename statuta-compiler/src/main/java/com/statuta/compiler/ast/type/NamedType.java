package com.statuta.compiler.ast.type;

import com.statuta.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 命名类型：结构体、枚举、类型别名或类型参数，可带泛型实参 {@code Name<A, B>}
 */
public class NamedType extends TypeRef {
    private final String name;
    private final List<TypeRef> typeArgs;

    public NamedType(SourceLocation location, String name, List<TypeRef> typeArgs) {
        super(location);
        this.name = name;
        this.typeArgs = Collections.unmodifiableList(typeArgs);
    }

    public NamedType(SourceLocation location, String name) {
        this(location, name, Collections.<TypeRef>emptyList());
    }

    public String getName() {
        return name;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    public boolean isGeneric() {
        return !typeArgs.isEmpty();
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitNamed(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof NamedType)) return false;
        NamedType that = (NamedType) o;
        return name.equals(that.name) && typeArgs.equals(that.typeArgs);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + typeArgs.hashCode();
    }

    @Override
    public String toString() {
        if (typeArgs.isEmpty()) return name;
        StringBuilder sb = new StringBuilder(name).append('<');
        for (int i = 0; i < typeArgs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(typeArgs.get(i));
        }
        return sb.append('>').toString();
    }
}
