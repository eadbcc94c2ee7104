package com.statuta.compiler.parser;

import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.expr.BlockExpr;
import com.statuta.compiler.ast.expr.Expression;
import com.statuta.compiler.ast.expr.FieldAccessExpr;
import com.statuta.compiler.ast.expr.Identifier;
import com.statuta.compiler.ast.expr.PassExpr;
import com.statuta.compiler.ast.item.*;
import com.statuta.compiler.ast.type.TypeRef;
import com.statuta.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.statuta.compiler.lexer.TokenType.*;

/**
 * 条目（顶层声明）解析辅助类
 */
class ItemParser {

    static final String MUTUALLY_EXCLUSIVE = "mutually_exclusive";

    final Parser parser;

    ItemParser(Parser parser) {
        this.parser = parser;
    }

    Item parseItem() {
        SourceLocation loc = parser.location();
        List<Annotation> annotations = parseAnnotations();
        boolean mutuallyExclusive = false;
        for (Annotation annotation : annotations) {
            if (MUTUALLY_EXCLUSIVE.equals(annotation.getName())) {
                mutuallyExclusive = true;
            } else {
                throw new ParseException("Annotation '@" + annotation.getName()
                        + "' is only allowed on struct fields", parser.fileName, parser.current);
            }
        }
        if (parser.match(KW_MUTUALLY_EXCLUSIVE)) {
            mutuallyExclusive = true;
        }
        if (mutuallyExclusive && !parser.check(KW_ENUM)) {
            throw parser.error("Expected 'enum' after mutually_exclusive");
        }

        switch (parser.current.getType()) {
            case KW_STRUCT: return parseStruct();
            case KW_ENUM: return parseEnum(loc, mutuallyExclusive);
            case KW_SCOPE: return parseScope();
            case KW_PRINCIPLE: return parsePrinciple();
            case KW_LEGAL_TEST: return parseLegalTest();
            case KW_TYPE: return parseTypeAlias();
            default:
                break;
        }

        if (parser.typeParser.isTypeStart()) {
            TypeRef type = parser.parseType();
            if (parser.match(KW_FUNC)) {
                return parseFunction(loc, type);
            }
            return finishVariableDecl(loc, type);
        }
        throw parser.error("Expected declaration");
    }

    // ============ 导入 ============

    ImportDecl parseImport() {
        SourceLocation loc = parser.location();
        parser.expect(KW_REFERENCING, "Expected 'referencing'");
        List<String> names = new ArrayList<>();
        boolean wildcard = false;
        if (parser.match(MUL)) {
            wildcard = true;
        } else {
            do {
                names.add(parser.expect(IDENTIFIER, "Expected imported name").getLexeme());
            } while (parser.match(COMMA));
        }
        parser.expect(KW_FROM, "Expected 'from' after imported names");
        return new ImportDecl(loc, names, wildcard, parseModulePath());
    }

    private String parseModulePath() {
        if (parser.check(STRING_LITERAL)) {
            return (String) parser.advance().getLiteral();
        }
        StringBuilder path = new StringBuilder(parser.expectName("Expected module path"));
        while (parser.check(DIV) || parser.check(DOT)) {
            path.append(parser.advance().getType() == DIV ? '/' : '.');
            path.append(parser.expectName("Expected module path segment"));
        }
        return path.toString();
    }

    // ============ 结构体 ============

    private StructDecl parseStruct() {
        SourceLocation loc = parser.location();
        parser.expect(KW_STRUCT, "Expected 'struct'");
        String name = parser.expect(IDENTIFIER, "Expected struct name").getLexeme();
        List<String> typeParams = parser.check(LT) ? parser.parseTypeParams() : Collections.<String>emptyList();

        String extendsName = null;
        if (parser.match(KW_EXTENDS)) {
            extendsName = parser.expect(IDENTIFIER, "Expected parent struct name after 'extends'").getLexeme();
        }

        parser.expect(LBRACE, "Expected '{' after struct header");
        List<FieldDecl> fields = new ArrayList<>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            fields.add(parseField());
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expect(RBRACE, "Expected '}' after struct fields");
        return new StructDecl(loc, name, typeParams, extendsName, fields);
    }

    /**
     * 字段：{@code @annotation* type name (where constraint)?}
     */
    FieldDecl parseField() {
        SourceLocation loc = parser.location();
        List<Annotation> annotations = parseAnnotations();
        TypeRef type = parser.parseType();
        String name = parser.expect(IDENTIFIER, "Expected field name").getLexeme();
        Expression constraint = null;
        if (parser.match(KW_WHERE)) {
            constraint = parser.parseExpression();
        }
        return new FieldDecl(loc, type, name, constraint, annotations);
    }

    // ============ 注解 ============

    List<Annotation> parseAnnotations() {
        List<Annotation> annotations = new ArrayList<>();
        while (parser.check(AT)) {
            annotations.add(parseAnnotation());
        }
        return annotations;
    }

    private Annotation parseAnnotation() {
        SourceLocation loc = parser.location();
        parser.expect(AT, "Expected '@'");
        String name = parser.expectName("Expected annotation name");
        List<Annotation.Argument> arguments = new ArrayList<>();
        if (parser.match(LPAREN)) {
            if (!parser.check(RPAREN)) {
                do {
                    arguments.add(parseAnnotationArgument());
                } while (parser.match(COMMA));
            }
            parser.expect(RPAREN, "Expected ')' after annotation arguments");
        }
        return new Annotation(loc, name, arguments);
    }

    private Annotation.Argument parseAnnotationArgument() {
        String argName = null;
        if ((parser.check(IDENTIFIER) || parser.current.getType().isKeyword()) && parser.checkAhead(EQUALS)) {
            argName = parser.advance().getLexeme();
            parser.advance(); // =
        }
        return new Annotation.Argument(argName, parseAnnotationValue());
    }

    /** 注解参数值：字面量、负数或点分名称 */
    private Expression parseAnnotationValue() {
        SourceLocation loc = parser.location();
        if (parser.match(MINUS)) {
            Token number = parser.current;
            if (!number.isOneOf(INT_LITERAL, FLOAT_LITERAL, PERCENT_LITERAL)) {
                throw parser.error("Expected number after '-'");
            }
            parser.advance();
            return LiteralHelper.negate(LiteralHelper.toLiteral(number, loc), loc);
        }
        if (parser.current.getType().isLiteral() || parser.checkAny(KW_TRUE, KW_FALSE)) {
            Token token = parser.advance();
            return LiteralHelper.toLiteral(token, loc);
        }
        Expression value = new Identifier(loc, parser.expectName("Expected annotation value"));
        while (parser.match(DOT)) {
            value = new FieldAccessExpr(parser.previousLocation(), value,
                    parser.expectName("Expected name after '.'"));
        }
        return value;
    }

    // ============ 枚举 ============

    private EnumDecl parseEnum(SourceLocation loc, boolean mutuallyExclusive) {
        parser.expect(KW_ENUM, "Expected 'enum'");
        String name = parser.expect(IDENTIFIER, "Expected enum name").getLexeme();
        parser.expect(LBRACE, "Expected '{' after enum name");
        List<EnumDecl.Variant> variants = new ArrayList<>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            SourceLocation variantLoc = parser.location();
            String variant = parser.expect(IDENTIFIER, "Expected enum variant").getLexeme();
            variants.add(new EnumDecl.Variant(variantLoc, variant));
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expect(RBRACE, "Expected '}' after enum variants");
        return new EnumDecl(loc, name, variants, mutuallyExclusive);
    }

    // ============ 作用域 / 原则 / 法律测试 / 别名 ============

    private ScopeDecl parseScope() {
        SourceLocation loc = parser.location();
        parser.expect(KW_SCOPE, "Expected 'scope'");
        String name = parser.expect(IDENTIFIER, "Expected scope name").getLexeme();
        parser.expect(LBRACE, "Expected '{' after scope name");
        List<Item> items = new ArrayList<>();
        parser.skipSeparators();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            items.add(parseItem());
            parser.skipSeparators();
        }
        parser.expect(RBRACE, "Expected '}' to close scope '" + name + "'");
        return new ScopeDecl(loc, name, items);
    }

    private PrincipleDecl parsePrinciple() {
        SourceLocation loc = parser.location();
        parser.expect(KW_PRINCIPLE, "Expected 'principle'");
        String name = parser.expect(IDENTIFIER, "Expected principle name").getLexeme();
        parser.expect(LBRACE, "Expected '{' after principle name");
        Expression body = parser.parseExpression();
        parser.skipSeparators();
        parser.expect(RBRACE, "Expected '}' after principle body");
        return new PrincipleDecl(loc, name, body);
    }

    private LegalTestDecl parseLegalTest() {
        SourceLocation loc = parser.location();
        parser.expect(KW_LEGAL_TEST, "Expected 'legal_test'");
        String name = parser.expect(IDENTIFIER, "Expected legal test name").getLexeme();
        parser.expect(LBRACE, "Expected '{' after legal test name");
        List<Parameter> requirements = new ArrayList<>();
        while (parser.check(KW_REQUIRES)) {
            SourceLocation reqLoc = parser.location();
            parser.advance();
            TypeRef type = parser.parseType();
            String reqName = parser.expect(IDENTIFIER, "Expected requirement name").getLexeme();
            requirements.add(new Parameter(reqLoc, type, reqName));
            parser.matchAny(COMMA, SEMICOLON);
        }
        parser.expect(RBRACE, "Expected 'requires' or '}' in legal test");
        return new LegalTestDecl(loc, name, requirements);
    }

    private TypeAliasDecl parseTypeAlias() {
        SourceLocation loc = parser.location();
        parser.expect(KW_TYPE, "Expected 'type'");
        String name = parser.expect(IDENTIFIER, "Expected type alias name").getLexeme();
        List<String> typeParams = parser.check(LT) ? parser.parseTypeParams() : Collections.<String>emptyList();
        parser.expect(ASSIGN, "Expected ':=' in type alias");
        return new TypeAliasDecl(loc, name, typeParams, parser.parseType());
    }

    // ============ 函数与值声明 ============

    private FunctionDecl parseFunction(SourceLocation loc, TypeRef returnType) {
        String name = parser.expect(IDENTIFIER, "Expected function name").getLexeme();
        List<String> typeParams = parser.check(LT) ? parser.parseTypeParams() : Collections.<String>emptyList();
        parser.expect(LPAREN, "Expected '(' after function name");
        List<Parameter> params = new ArrayList<>();
        if (!parser.check(RPAREN)) {
            do {
                SourceLocation paramLoc = parser.location();
                TypeRef type = parser.parseType();
                String paramName = parser.expect(IDENTIFIER, "Expected parameter name").getLexeme();
                params.add(new Parameter(paramLoc, type, paramName));
            } while (parser.match(COMMA));
        }
        parser.expect(RPAREN, "Expected ')' after parameters");
        return new FunctionDecl(loc, returnType, name, typeParams, params, parseFunctionBody());
    }

    /**
     * 函数体：{@code { 局部声明* (:= result | pass | result) }}
     */
    private Expression parseFunctionBody() {
        SourceLocation loc = parser.location();
        parser.expect(LBRACE, "Expected '{' before function body");
        List<VariableDecl> locals = new ArrayList<>();
        parser.skipSeparators();
        while (isLocalDeclarationAhead()) {
            SourceLocation declLoc = parser.location();
            locals.add(finishVariableDecl(declLoc, parser.parseType()));
            parser.skipSeparators();
        }

        Expression result;
        if (parser.check(KW_PASS)) {
            result = new PassExpr(parser.location());
            parser.advance();
        } else {
            parser.match(ASSIGN);
            result = parser.parseExpression();
        }
        parser.skipSeparators();
        parser.expect(RBRACE, "Expected '}' after function body");
        return locals.isEmpty() ? result : new BlockExpr(loc, locals, result);
    }

    /** 向前试探：当前位置是否为 {@code type name :=} 形式的局部声明 */
    private boolean isLocalDeclarationAhead() {
        if (!parser.typeParser.isTypeStart() || parser.check(LBRACE)) {
            return false;
        }
        int mark = parser.mark();
        try {
            parser.parseType();
            return parser.check(IDENTIFIER) && parser.checkAhead(ASSIGN);
        } catch (ParseException e) {
            return false;
        } finally {
            parser.reset(mark);
        }
    }

    private VariableDecl finishVariableDecl(SourceLocation loc, TypeRef type) {
        String name = parser.expect(IDENTIFIER, "Expected declaration name").getLexeme();
        parser.expect(ASSIGN, "Expected ':=' after '" + name + "'");
        return new VariableDecl(loc, type, name, parser.parseExpression());
    }
}
