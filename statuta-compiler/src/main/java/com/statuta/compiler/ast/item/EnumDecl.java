package com.statuta.compiler.ast.item;

import com.statuta.compiler.ast.ItemVisitor;
import com.statuta.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 枚举声明
 */
public class EnumDecl extends Item {
    private final List<Variant> variants;
    private final boolean mutuallyExclusive;

    public EnumDecl(SourceLocation location, String name, List<Variant> variants, boolean mutuallyExclusive) {
        super(location, name);
        this.variants = Collections.unmodifiableList(variants);
        this.mutuallyExclusive = mutuallyExclusive;
    }

    public List<Variant> getVariants() {
        return variants;
    }

    public List<String> getVariantNames() {
        List<String> names = new ArrayList<>(variants.size());
        for (Variant v : variants) {
            names.add(v.getName());
        }
        return names;
    }

    public boolean isMutuallyExclusive() {
        return mutuallyExclusive;
    }

    @Override
    public <R, C> R accept(ItemVisitor<R, C> visitor, C context) {
        return visitor.visitEnum(this, context);
    }

    /** 枚举成员 */
    public static final class Variant {
        private final SourceLocation location;
        private final String name;

        public Variant(SourceLocation location, String name) {
            this.location = location;
            this.name = name;
        }

        public SourceLocation getLocation() {
            return location;
        }

        public String getName() {
            return name;
        }
    }
}
