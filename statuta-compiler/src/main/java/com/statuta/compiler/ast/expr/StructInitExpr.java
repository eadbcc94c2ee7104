package com.statuta.compiler.ast.expr;

import com.statuta.compiler.ast.ExprVisitor;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 结构体初始化：{@code Name<T> { field := value, ... }}
 */
public class StructInitExpr extends Expression {
    private final String structName;
    private final List<TypeRef> typeArgs;
    private final List<FieldInit> fields;

    public StructInitExpr(SourceLocation location, String structName, List<TypeRef> typeArgs, List<FieldInit> fields) {
        super(location);
        this.structName = structName;
        this.typeArgs = Collections.unmodifiableList(typeArgs);
        this.fields = Collections.unmodifiableList(fields);
    }

    public String getStructName() {
        return structName;
    }

    public List<TypeRef> getTypeArgs() {
        return typeArgs;
    }

    public List<FieldInit> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitStructInit(this, context);
    }

    /** 字段初始化项 */
    public static final class FieldInit {
        private final SourceLocation location;
        private final String name;
        private final Expression value;

        public FieldInit(SourceLocation location, String name, Expression value) {
            this.location = location;
            this.name = name;
            this.value = value;
        }

        public SourceLocation getLocation() {
            return location;
        }

        public String getName() {
            return name;
        }

        public Expression getValue() {
            return value;
        }
    }
}
