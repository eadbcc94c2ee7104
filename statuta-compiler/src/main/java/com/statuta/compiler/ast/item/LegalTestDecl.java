package com.statuta.compiler.ast.item;

import com.statuta.compiler.ast.ItemVisitor;
import com.statuta.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 法律测试：按顺序排列的布尔要件 {@code requires bool name}
 */
public class LegalTestDecl extends Item {
    private final List<Parameter> requirements;

    public LegalTestDecl(SourceLocation location, String name, List<Parameter> requirements) {
        super(location, name);
        this.requirements = Collections.unmodifiableList(requirements);
    }

    public List<Parameter> getRequirements() {
        return requirements;
    }

    @Override
    public <R, C> R accept(ItemVisitor<R, C> visitor, C context) {
        return visitor.visitLegalTest(this, context);
    }
}
