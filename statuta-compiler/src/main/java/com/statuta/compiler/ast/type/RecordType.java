package com.statuta.compiler.ast.type;

import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.item.FieldDecl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 内联字段集合类型 {@code { int a, bool b }}
 */
public class RecordType extends TypeRef {
    private final List<FieldDecl> fields;

    public RecordType(SourceLocation location, List<FieldDecl> fields) {
        super(location);
        this.fields = Collections.unmodifiableList(fields);
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    public FieldDecl findField(String name) {
        for (FieldDecl f : fields) {
            if (f.getName().equals(name)) return f;
        }
        return null;
    }

    @Override
    public <R> R accept(TypeRefVisitor<R> visitor) {
        return visitor.visitRecord(this);
    }

    private List<String> signature() {
        List<String> sig = new ArrayList<>();
        for (FieldDecl f : fields) {
            sig.add(f.getType() + " " + f.getName());
        }
        return sig;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RecordType && ((RecordType) o).signature().equals(signature());
    }

    @Override
    public int hashCode() {
        return signature().hashCode();
    }

    @Override
    public String toString() {
        return "{ " + String.join(", ", signature()) + " }";
    }
}
