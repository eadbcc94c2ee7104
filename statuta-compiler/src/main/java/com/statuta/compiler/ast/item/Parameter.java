package com.statuta.compiler.ast.item;

import com.statuta.compiler.ast.AstNode;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.type.TypeRef;

/**
 * 带类型的名称：函数参数与 legal_test 的 requires 条目共用
 */
public class Parameter extends AstNode {
    private final TypeRef type;
    private final String name;

    public Parameter(SourceLocation location, TypeRef type, String name) {
        super(location);
        this.type = type;
        this.name = name;
    }

    public TypeRef getType() {
        return type;
    }

    public String getName() {
        return name;
    }
}
