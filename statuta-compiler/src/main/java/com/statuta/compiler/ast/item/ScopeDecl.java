package com.statuta.compiler.ast.item;

import com.statuta.compiler.ast.ItemVisitor;
import com.statuta.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 命名作用域：递归容纳其它条目
 */
public class ScopeDecl extends Item {
    private final List<Item> items;

    public ScopeDecl(SourceLocation location, String name, List<Item> items) {
        super(location, name);
        this.items = Collections.unmodifiableList(items);
    }

    public List<Item> getItems() {
        return items;
    }

    @Override
    public <R, C> R accept(ItemVisitor<R, C> visitor, C context) {
        return visitor.visitScope(this, context);
    }
}
