package com.statuta.compiler.ast.type;

import com.statuta.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 联合类型 {@code A || B}
 */
public class UnionType extends TypeRef {
    private final List<TypeRef> members;

    public UnionType(SourceLocation location, List<TypeRef> members) {
        super(location);
        this.members = Collections.unmodifiableList(members);
    }

    public List<TypeRef> getMembers() {
        return members;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitUnion(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UnionType && ((UnionType) o).members.equals(members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) sb.append(" || ");
            sb.append(members.get(i));
        }
        return sb.toString();
    }
}
