package com.statuta.compiler.ast.item;

import com.statuta.compiler.ast.ItemVisitor;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.expr.Expression;
import com.statuta.compiler.ast.type.TypeRef;

/**
 * 值声明：{@code int x := 42}
 *
 * <p>既可作为顶层/作用域条目，也可作为函数体块中的局部声明；只在声明位置之后可见。</p>
 */
public class VariableDecl extends Item {
    private final TypeRef type;
    private final Expression value;

    public VariableDecl(SourceLocation location, TypeRef type, String name, Expression value) {
        super(location, name);
        this.type = type;
        this.value = value;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(ItemVisitor<R, C> visitor, C context) {
        return visitor.visitVariable(this, context);
    }
}
