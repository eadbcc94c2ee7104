package com.statuta.compiler.parser;

import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.expr.*;
import com.statuta.compiler.ast.pattern.*;
import com.statuta.compiler.ast.type.TypeRef;
import com.statuta.compiler.lexer.Token;
import com.statuta.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.statuta.compiler.lexer.TokenType.*;

/**
 * 表达式与模式解析辅助类
 *
 * <p>优先级（低到高）：{@code ||}、{@code &&}、相等、关系、加减、乘除模、一元、后缀。
 * 所有二元运算符左结合。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseDisjunctionExpr();
    }

    // 逻辑或 ||
    private Expression parseDisjunctionExpr() {
        Expression left = parseConjunctionExpr();

        while (parser.match(OR)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseConjunctionExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.OR, right);
        }

        return left;
    }

    // 逻辑与 &&
    private Expression parseConjunctionExpr() {
        Expression left = parseEqualityExpr();

        while (parser.match(AND)) {
            SourceLocation loc = parser.previousLocation();
            Expression right = parseEqualityExpr();
            left = new BinaryExpr(loc, left, BinaryExpr.BinaryOp.AND, right);
        }

        return left;
    }

    // 相等性 == !=
    private Expression parseEqualityExpr() {
        Expression left = parseComparisonExpr();

        while (parser.checkAny(EQ, NE)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseComparisonExpr();
            left = new BinaryExpr(loc, left, toBinaryOp(op), right);
        }

        return left;
    }

    // 比较 < > <= >=
    private Expression parseComparisonExpr() {
        Expression left = parseAdditiveExpr();

        while (parser.checkAny(LT, GT, LE, GE)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseAdditiveExpr();
            left = new BinaryExpr(loc, left, toBinaryOp(op), right);
        }

        return left;
    }

    // 加减 + -
    private Expression parseAdditiveExpr() {
        Expression left = parseMultiplicativeExpr();

        while (parser.checkAny(PLUS, MINUS)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseMultiplicativeExpr();
            left = new BinaryExpr(loc, left, toBinaryOp(op), right);
        }

        return left;
    }

    // 乘除模 * / %
    private Expression parseMultiplicativeExpr() {
        Expression left = parseUnaryExpr();

        while (parser.checkAny(MUL, DIV, MOD)) {
            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression right = parseUnaryExpr();
            left = new BinaryExpr(loc, left, toBinaryOp(op), right);
        }

        return left;
    }

    private BinaryExpr.BinaryOp toBinaryOp(Token op) {
        switch (op.getType()) {
            case PLUS: return BinaryExpr.BinaryOp.ADD;
            case MINUS: return BinaryExpr.BinaryOp.SUB;
            case MUL: return BinaryExpr.BinaryOp.MUL;
            case DIV: return BinaryExpr.BinaryOp.DIV;
            case MOD: return BinaryExpr.BinaryOp.MOD;
            case EQ: return BinaryExpr.BinaryOp.EQ;
            case NE: return BinaryExpr.BinaryOp.NE;
            case LT: return BinaryExpr.BinaryOp.LT;
            case GT: return BinaryExpr.BinaryOp.GT;
            case LE: return BinaryExpr.BinaryOp.LE;
            case GE: return BinaryExpr.BinaryOp.GE;
            default: throw new ParseException("Unexpected operator", parser.fileName, op);
        }
    }

    // 一元 ! -
    private Expression parseUnaryExpr() {
        if (parser.match(NOT)) {
            SourceLocation loc = parser.previousLocation();
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.NOT, parseUnaryExpr());
        }
        if (parser.match(MINUS)) {
            SourceLocation loc = parser.previousLocation();
            return new UnaryExpr(loc, UnaryExpr.UnaryOp.NEG, parseUnaryExpr());
        }
        return parsePostfixExpr();
    }

    // 后缀：字段访问
    private Expression parsePostfixExpr() {
        Expression expr = parsePrimaryExpr();
        while (parser.match(DOT)) {
            SourceLocation loc = parser.previousLocation();
            String field = parser.expectName("Expected field name after '.'");
            expr = new FieldAccessExpr(loc, expr, field);
        }
        return expr;
    }

    private Expression parsePrimaryExpr() {
        SourceLocation loc = parser.location();
        Token token = parser.current;
        TokenType type = token.getType();

        if (type.isLiteral() || type == KW_TRUE || type == KW_FALSE) {
            parser.advance();
            return LiteralHelper.toLiteral(token, loc);
        }

        switch (type) {
            case IDENTIFIER:
                return parseIdentifierExpr(loc);
            case LPAREN: {
                parser.advance();
                Expression inner = parseExpression();
                parser.expect(RPAREN, "Expected ')'");
                return inner;
            }
            case KW_MATCH:
                return parseMatchExpr(loc);
            case KW_FORALL:
            case KW_EXISTS:
                return parseQuantifierExpr(loc);
            case KW_PASS:
                parser.advance();
                return new PassExpr(loc);
            default:
                throw parser.error("Expected expression");
        }
    }

    private Expression parseIdentifierExpr(SourceLocation loc) {
        String name = parser.advance().getLexeme();
        Identifier identifier = new Identifier(loc, name);

        // 调用 name(args)
        if (parser.match(LPAREN)) {
            List<Expression> args = new ArrayList<>();
            if (!parser.check(RPAREN)) {
                do {
                    args.add(parseExpression());
                } while (parser.match(COMMA));
            }
            parser.expect(RPAREN, "Expected ')' after arguments");
            return new CallExpr(loc, identifier, args);
        }

        // 结构体初始化 Name { field := value, ... }
        if (parser.check(LBRACE) && isStructInitAhead()) {
            return parseStructInit(loc, name);
        }

        return identifier;
    }

    /** 只有 {@code { }} 或 {@code { name :=} 才视为结构体初始化，避免与 match 体混淆 */
    private boolean isStructInitAhead() {
        Token first = parser.peek(1);
        if (first.getType() == RBRACE) {
            return true;
        }
        return first.getType() == IDENTIFIER && parser.peek(2).getType() == ASSIGN;
    }

    private Expression parseStructInit(SourceLocation loc, String name) {
        parser.expect(LBRACE, "Expected '{'");
        List<StructInitExpr.FieldInit> fields = new ArrayList<>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation fieldLoc = parser.location();
            String field = parser.expect(IDENTIFIER, "Expected field name").getLexeme();
            parser.expect(ASSIGN, "Expected ':=' after field name");
            fields.add(new StructInitExpr.FieldInit(fieldLoc, field, parseExpression()));
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expect(RBRACE, "Expected '}' after struct fields");
        return new StructInitExpr(loc, name, Collections.<TypeRef>emptyList(), fields);
    }

    // ============ match ============

    private Expression parseMatchExpr(SourceLocation loc) {
        parser.expect(KW_MATCH, "Expected 'match'");
        Expression scrutinee = parseExpression();
        parser.expect(LBRACE, "Expected '{' after match scrutinee");
        List<MatchArm> arms = new ArrayList<>();
        while (parser.check(KW_CASE)) {
            arms.add(parseMatchArm());
        }
        if (arms.isEmpty()) {
            throw parser.error("Expected 'case' in match");
        }
        parser.expect(RBRACE, "Expected '}' after match arms");
        return new MatchExpr(loc, scrutinee, arms);
    }

    private MatchArm parseMatchArm() {
        SourceLocation loc = parser.location();
        parser.expect(KW_CASE, "Expected 'case'");
        Pattern pattern = parsePattern();
        Expression guard = null;
        if (parser.match(KW_WHERE)) {
            guard = parseExpression();
        }
        parser.expect(ASSIGN, "Expected ':=' after case pattern");
        parser.match(KW_CONSEQUENCE);
        Expression result = parseExpression();
        parser.matchAny(COMMA, SEMICOLON);
        return new MatchArm(loc, pattern, guard, result);
    }

    /**
     * 模式：{@code _}、字面量、负数、{@code Variant}、{@code Enum.Variant}、{@code satisfies Test}
     */
    Pattern parsePattern() {
        SourceLocation loc = parser.location();
        Token token = parser.current;

        if (parser.match(UNDERSCORE)) {
            return new WildcardPattern(loc);
        }
        if (token.getType().isLiteral() || token.isOneOf(KW_TRUE, KW_FALSE)) {
            parser.advance();
            return new LiteralPattern(loc, LiteralHelper.toLiteral(token, loc));
        }
        if (parser.match(MINUS)) {
            Token number = parser.current;
            if (!number.isOneOf(INT_LITERAL, FLOAT_LITERAL, PERCENT_LITERAL)) {
                throw parser.error("Expected number after '-' in pattern");
            }
            parser.advance();
            return new LiteralPattern(loc, LiteralHelper.negate(LiteralHelper.toLiteral(number, loc), loc));
        }
        if (parser.match(KW_SATISFIES)) {
            String test = parser.expect(IDENTIFIER, "Expected legal test name after 'satisfies'").getLexeme();
            return new SatisfiesPattern(loc, test);
        }
        if (parser.check(IDENTIFIER)) {
            String first = parser.advance().getLexeme();
            if (parser.match(DOT)) {
                String variant = parser.expect(IDENTIFIER, "Expected variant name").getLexeme();
                return new VariantPattern(loc, first, variant);
            }
            return new VariantPattern(loc, null, first);
        }
        throw parser.error("Expected pattern");
    }

    // ============ 量词 ============

    /**
     * {@code forall x: T (where guard)?, body}；嵌套深度超过上限时报错
     */
    private Expression parseQuantifierExpr(SourceLocation loc) {
        boolean universal = parser.advance().getType() == KW_FORALL;
        parser.quantifierDepth++;
        try {
            if (parser.quantifierDepth > Parser.MAX_QUANTIFIER_DEPTH) {
                throw new ParseException("Quantifier nesting too deep (max "
                        + Parser.MAX_QUANTIFIER_DEPTH + " levels)", parser.fileName, parser.previous);
            }
            String variable = parser.expect(IDENTIFIER, "Expected quantified variable").getLexeme();
            parser.expect(COLON, "Expected ':' after quantified variable");
            TypeRef type = parser.parseType();
            Expression guard = null;
            if (parser.match(KW_WHERE)) {
                guard = parseExpression();
            }
            parser.expect(COMMA, "Expected ',' before quantifier body");
            Expression body = parseExpression();
            return universal
                    ? new ForallExpr(loc, variable, type, guard, body)
                    : new ExistsExpr(loc, variable, type, guard, body);
        } finally {
            parser.quantifierDepth--;
        }
    }
}
