package com.statuta.compiler.ast.type;

import com.statuta.compiler.ast.AstNode;
import com.statuta.compiler.ast.SourceLocation;

/**
 * 类型引用基类
 *
 * <p>子类按结构实现 equals/hashCode（忽略源码位置），检查器据此比较类型。</p>
 */
public abstract class TypeRef extends AstNode {

    protected TypeRef(SourceLocation location) {
        super(location);
    }

    /** 接受轻量 TypeRefVisitor 进行类型引用分派 */
    public abstract <R> R accept(TypeRefVisitor<R> visitor);
}
