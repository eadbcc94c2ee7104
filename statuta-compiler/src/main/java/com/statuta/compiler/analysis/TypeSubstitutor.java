package com.statuta.compiler.analysis;

import com.statuta.compiler.ast.item.FieldDecl;
import com.statuta.compiler.ast.type.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 类型参数替换：把类型中出现的参数名替换为实参类型，生成新的 TypeRef。
 */
final class TypeSubstitutor implements TypeRefVisitor<TypeRef> {

    private final Map<String, TypeRef> bindings;

    TypeSubstitutor(Map<String, TypeRef> bindings) {
        this.bindings = bindings;
    }

    TypeRef apply(TypeRef type) {
        if (type == null || bindings.isEmpty()) return type;
        return type.accept(this);
    }

    @Override
    public TypeRef visitPrimitive(PrimitiveType type) {
        return type;
    }

    @Override
    public TypeRef visitMoney(MoneyType type) {
        return type;
    }

    @Override
    public TypeRef visitBoundedInt(BoundedIntType type) {
        return type;
    }

    @Override
    public TypeRef visitTemporal(TemporalType type) {
        return new TemporalType(type.getLocation(), apply(type.getInner()),
                type.getValidFrom(), type.getValidUntil());
    }

    @Override
    public TypeRef visitCitation(CitationType type) {
        return type;
    }

    @Override
    public TypeRef visitUnion(UnionType type) {
        List<TypeRef> members = new ArrayList<>();
        for (TypeRef member : type.getMembers()) {
            members.add(apply(member));
        }
        return new UnionType(type.getLocation(), members);
    }

    @Override
    public TypeRef visitRecord(RecordType type) {
        List<FieldDecl> fields = new ArrayList<>();
        for (FieldDecl f : type.getFields()) {
            fields.add(new FieldDecl(f.getLocation(), apply(f.getType()), f.getName(),
                    f.getConstraint(), f.getAnnotations()));
        }
        return new RecordType(type.getLocation(), fields);
    }

    @Override
    public TypeRef visitNamed(NamedType type) {
        if (!type.isGeneric()) {
            TypeRef bound = bindings.get(type.getName());
            if (bound != null) return bound;
            return type;
        }
        List<TypeRef> args = new ArrayList<>();
        for (TypeRef arg : type.getTypeArgs()) {
            args.add(apply(arg));
        }
        return new NamedType(type.getLocation(), type.getName(), args);
    }

    @Override
    public TypeRef visitWrapper(WrapperType type) {
        return new WrapperType(type.getLocation(), type.getKind(), apply(type.getInner()));
    }
}
