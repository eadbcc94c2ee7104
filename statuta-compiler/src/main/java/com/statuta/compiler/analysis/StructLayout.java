package com.statuta.compiler.analysis;

import com.statuta.compiler.ast.item.FieldDecl;
import com.statuta.compiler.ast.item.StructDecl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 结构体展开后的字段列表：父结构体的有效字段在前，本结构体声明的字段在后。
 *
 * <p>同名字段不会被去重，由检查器报告。</p>
 */
public final class StructLayout {
    private final Symbol struct;
    private final List<LayoutField> fields;

    public StructLayout(Symbol struct, List<LayoutField> fields) {
        this.struct = struct;
        this.fields = Collections.unmodifiableList(fields);
    }

    public Symbol getStruct() {
        return struct;
    }

    public StructDecl getDecl() {
        return (StructDecl) struct.getDeclaration();
    }

    public List<LayoutField> getFields() {
        return fields;
    }

    public List<String> getFieldNames() {
        List<String> names = new ArrayList<>(fields.size());
        for (LayoutField f : fields) {
            names.add(f.getName());
        }
        return names;
    }

    /** 按名称查找第一个匹配的字段 */
    public LayoutField findField(String name) {
        for (LayoutField f : fields) {
            if (f.getName().equals(name)) return f;
        }
        return null;
    }

    /**
     * 展开后的字段及其声明所在的结构体
     */
    public static final class LayoutField {
        private final FieldDecl decl;
        private final String owner;

        public LayoutField(FieldDecl decl, String owner) {
            this.decl = decl;
            this.owner = owner;
        }

        public FieldDecl getDecl() {
            return decl;
        }

        public String getName() {
            return decl.getName();
        }

        /** 声明该字段的结构体名 */
        public String getOwner() {
            return owner;
        }

        @Override
        public String toString() {
            return owner + "." + decl.getName();
        }
    }
}
