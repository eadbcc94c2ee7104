package com.statuta.compiler.ast.item;

import com.statuta.compiler.ast.AstNode;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.expr.Expression;
import com.statuta.compiler.ast.type.TypeRef;

import java.util.Collections;
import java.util.List;

/**
 * 结构体字段：{@code @annotation type name where constraint}
 */
public class FieldDecl extends AstNode {
    private final TypeRef type;
    private final String name;
    private final Expression constraint;
    private final List<Annotation> annotations;

    public FieldDecl(SourceLocation location, TypeRef type, String name,
                     Expression constraint, List<Annotation> annotations) {
        super(location);
        this.type = type;
        this.name = name;
        this.constraint = constraint;
        this.annotations = Collections.unmodifiableList(annotations);
    }

    public TypeRef getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    /** where 约束，可能为 null */
    public Expression getConstraint() {
        return constraint;
    }

    public List<Annotation> getAnnotations() {
        return annotations;
    }

    public Annotation findAnnotation(String annotationName) {
        for (Annotation a : annotations) {
            if (a.getName().equals(annotationName)) {
                return a;
            }
        }
        return null;
    }
}
