package com.statuta.compiler.ast.item;

import com.statuta.compiler.ast.ItemVisitor;
import com.statuta.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 结构体声明
 */
public class StructDecl extends Item {
    private final List<String> typeParams;
    private final String extendsName;
    private final List<FieldDecl> fields;

    public StructDecl(SourceLocation location, String name, List<String> typeParams,
                      String extendsName, List<FieldDecl> fields) {
        super(location, name);
        this.typeParams = Collections.unmodifiableList(typeParams);
        this.extendsName = extendsName;
        this.fields = Collections.unmodifiableList(fields);
    }

    public List<String> getTypeParams() {
        return typeParams;
    }

    /** extends 的父结构体名，没有时为 null */
    public String getExtendsName() {
        return extendsName;
    }

    public boolean hasParent() {
        return extendsName != null;
    }

    /** 仅本结构体声明的字段（不含继承字段） */
    public List<FieldDecl> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(ItemVisitor<R, C> visitor, C context) {
        return visitor.visitStruct(this, context);
    }
}
