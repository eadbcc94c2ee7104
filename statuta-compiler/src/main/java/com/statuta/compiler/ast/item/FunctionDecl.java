package com.statuta.compiler.ast.item;

import com.statuta.compiler.ast.ItemVisitor;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.expr.Expression;
import com.statuta.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 函数声明：{@code <type> func name<T>(type a, ...) { ... }}
 */
public class FunctionDecl extends Item {
    private final TypeRef returnType;
    private final List<String> typeParams;
    private final List<Parameter> params;
    private final Expression body;

    public FunctionDecl(SourceLocation location, TypeRef returnType, String name,
                        List<String> typeParams, List<Parameter> params, Expression body) {
        super(location, name);
        this.returnType = returnType;
        this.typeParams = Collections.unmodifiableList(typeParams);
        this.params = Collections.unmodifiableList(params);
        this.body = body;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public List<String> getTypeParams() {
        return typeParams;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(ItemVisitor<R, C> visitor, C context) {
        return visitor.visitFunction(this, context);
    }
}
