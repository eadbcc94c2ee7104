package com.statuta.compiler.ast.item;

import com.statuta.compiler.ast.ItemVisitor;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 类型别名：{@code type Name<T> := Type}
 */
public class TypeAliasDecl extends Item {
    private final List<String> typeParams;
    private final TypeRef target;

    public TypeAliasDecl(SourceLocation location, String name, List<String> typeParams, TypeRef target) {
        super(location, name);
        this.typeParams = Collections.unmodifiableList(typeParams);
        this.target = target;
    }

    public List<String> getTypeParams() {
        return typeParams;
    }

    public TypeRef getTarget() {
        return target;
    }

    @Override
    public <R, C> R accept(ItemVisitor<R, C> visitor, C context) {
        return visitor.visitTypeAlias(this, context);
    }
}
