package com.statuta.compiler.parser;

import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.expr.Literal;
import com.statuta.compiler.ast.expr.Literal.LiteralKind;
import com.statuta.compiler.lexer.Token;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * 字面量解析辅助类：Token 到 Literal 的转换，以及日期字符串的解析
 */
public final class LiteralHelper {

    /** 日期字符串可接受的格式，按顺序尝试 */
    private static final DateTimeFormatter[] DATE_FORMATS = {
            DateTimeFormatter.ofPattern("dd-MM-uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("MM/dd/uuuu").withResolverStyle(ResolverStyle.STRICT)
    };

    private LiteralHelper() {
    }

    /**
     * 解析日期字符串（dd-MM-yyyy、yyyy-MM-dd 或 MM/dd/yyyy），无法解析时返回 null
     */
    public static LocalDate parseDate(String text) {
        if (text == null) return null;
        String trimmed = text.trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(trimmed, format);
            } catch (DateTimeParseException e) {
                // 尝试下一种格式
                continue;
            }
        }
        return null;
    }

    /** 字面量 Token 转为 Literal 节点 */
    static Literal toLiteral(Token token, SourceLocation loc) {
        switch (token.getType()) {
            case INT_LITERAL: return new Literal(loc, token.getLiteral(), LiteralKind.INT);
            case FLOAT_LITERAL: return new Literal(loc, token.getLiteral(), LiteralKind.FLOAT);
            case STRING_LITERAL: return new Literal(loc, token.getLiteral(), LiteralKind.STRING);
            case MONEY_LITERAL: return new Literal(loc, token.getLiteral(), LiteralKind.MONEY);
            case PERCENT_LITERAL: return new Literal(loc, token.getLiteral(), LiteralKind.PERCENT);
            case DATE_LITERAL: return new Literal(loc, token.getLiteral(), LiteralKind.DATE);
            case DURATION_LITERAL: return new Literal(loc, token.getLiteral(), LiteralKind.DURATION);
            case KW_TRUE: return new Literal(loc, Boolean.TRUE, LiteralKind.BOOLEAN);
            case KW_FALSE: return new Literal(loc, Boolean.FALSE, LiteralKind.BOOLEAN);
            default:
                throw new IllegalArgumentException("Not a literal token: " + token);
        }
    }

    /** 对数值字面量取负（用于模式与注解参数中的 -5） */
    static Literal negate(Literal literal, SourceLocation loc) {
        switch (literal.getKind()) {
            case INT: return new Literal(loc, -((Long) literal.getValue()), LiteralKind.INT);
            case FLOAT: return new Literal(loc, -((Double) literal.getValue()), LiteralKind.FLOAT);
            case PERCENT: return new Literal(loc, ((BigDecimal) literal.getValue()).negate(), LiteralKind.PERCENT);
            default: return null;
        }
    }
}
