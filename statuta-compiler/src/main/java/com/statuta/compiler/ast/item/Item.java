package com.statuta.compiler.ast.item;

import com.statuta.compiler.ast.AstNode;
import com.statuta.compiler.ast.ItemVisitor;
import com.statuta.compiler.ast.SourceLocation;

/**
 * 顶层条目基类（struct / enum / func / type / scope / principle / legal_test / 声明）
 */
public abstract class Item extends AstNode {
    protected final String name;

    protected Item(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public abstract <R, C> R accept(ItemVisitor<R, C> visitor, C context);
}
