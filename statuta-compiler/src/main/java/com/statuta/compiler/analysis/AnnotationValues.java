package com.statuta.compiler.analysis;

import com.statuta.compiler.ast.expr.Expression;
import com.statuta.compiler.ast.expr.FieldAccessExpr;
import com.statuta.compiler.ast.expr.Identifier;
import com.statuta.compiler.ast.expr.Literal;
import com.statuta.compiler.ast.item.Annotation;
import com.statuta.compiler.parser.LiteralHelper;

import java.time.LocalDate;

/**
 * 注解参数取值工具
 */
public final class AnnotationValues {

    private AnnotationValues() {}

    /** 命名参数优先，其次取第 position 个位置参数 */
    public static Expression argument(Annotation annotation, String name, int position) {
        Expression value = annotation.getArgument(name);
        return value != null ? value : annotation.getPositional(position);
    }

    /**
     * 名称形式的参数：标识符、点分路径或字符串字面量，如 {@code Act.title}；其它形式返回 null
     */
    public static String nameOf(Expression expr) {
        if (expr instanceof Identifier) {
            return ((Identifier) expr).getName();
        }
        if (expr instanceof FieldAccessExpr) {
            FieldAccessExpr access = (FieldAccessExpr) expr;
            String target = nameOf(access.getTarget());
            return target != null ? target + "." + access.getFieldName() : null;
        }
        if (expr instanceof Literal && ((Literal) expr).getKind() == Literal.LiteralKind.STRING) {
            return (String) ((Literal) expr).getValue();
        }
        return null;
    }

    /**
     * 日期形式的参数：日期字面量或可解析的日期字符串；其它形式返回 null
     */
    public static LocalDate dateOf(Expression expr) {
        if (!(expr instanceof Literal)) return null;
        Literal literal = (Literal) expr;
        if (literal.getKind() == Literal.LiteralKind.DATE) {
            return (LocalDate) literal.getValue();
        }
        if (literal.getKind() == Literal.LiteralKind.STRING) {
            return LiteralHelper.parseDate((String) literal.getValue());
        }
        return null;
    }
}
