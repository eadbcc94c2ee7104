package com.statuta.compiler.parser;

import com.statuta.compiler.ast.Program;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.expr.Expression;
import com.statuta.compiler.ast.item.ImportDecl;
import com.statuta.compiler.ast.item.Item;
import com.statuta.compiler.ast.pattern.Pattern;
import com.statuta.compiler.ast.type.TypeRef;
import com.statuta.compiler.lexer.Lexer;
import com.statuta.compiler.lexer.Token;
import com.statuta.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.statuta.compiler.lexer.TokenType.*;

/**
 * Statuta 语法分析器（递归下降）
 *
 * <p>输入为词法分析完整产出的 Token 列表。{@link #parse()} 在第一个无法恢复的位置抛出
 * {@link ParseException}，不返回部分 AST。</p>
 */
public class Parser {

    /** 量词最大嵌套层数 */
    public static final int MAX_QUANTIFIER_DEPTH = 10;

    private final List<Token> tokens;
    final String fileName;
    private int position;
    Token current;
    Token previous;

    // 当前量词嵌套深度
    int quantifierDepth;

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final ItemParser itemParser = new ItemParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(List<Token> tokens, String fileName) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = tokens;
        this.fileName = fileName;
        this.position = 0;
        this.current = tokens.get(0);
    }

    /** 词法分析后直接构造解析器 */
    public static Parser forSource(String source, String fileName) {
        return new Parser(new Lexer(source, fileName).scanTokens(), fileName);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (position < tokens.size() - 1) {
            position++;
        }
        current = tokens.get(position);
        return previous;
    }

    /**
     * 查看当前之后第 distance 个 token（不消费）
     */
    Token peek(int distance) {
        int index = Math.min(position + distance, tokens.size() - 1);
        return tokens.get(index);
    }

    /**
     * 向前看一个 token（不消费当前）
     */
    boolean checkAhead(TokenType type) {
        return peek(1).getType() == type;
    }

    /** 记录当前位置，用于回溯 */
    int mark() {
        return position;
    }

    /** 回溯到 mark 记录的位置 */
    void reset(int mark) {
        position = mark;
        current = tokens.get(position);
        previous = position > 0 ? tokens.get(position - 1) : null;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配任一类型，则前进
     */
    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, fileName, current, type.name());
    }

    /**
     * 名称位置：标识符或关键字（注解名、命名参数名允许使用关键字）
     */
    String expectName(String message) {
        if (check(IDENTIFIER) || current.getType().isKeyword()) {
            return advance().getLexeme();
        }
        throw new ParseException(message, fileName, current, "IDENTIFIER");
    }

    ParseException error(String message) {
        return new ParseException(message, fileName, current);
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return new SourceLocation(fileName, current.getLine(), current.getColumn(),
                current.getOffset(), current.getLexeme().length());
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return new SourceLocation(fileName, previous.getLine(), previous.getColumn(),
                previous.getOffset(), previous.getLexeme().length());
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    void skipSeparators() {
        while (match(SEMICOLON)) {
            // 分号仅作可选分隔
        }
    }

    // ============ 程序解析 ============

    /**
     * 解析程序
     */
    public Program parse() {
        SourceLocation loc = location();
        skipSeparators();

        List<ImportDecl> imports = new ArrayList<>();
        while (check(KW_REFERENCING)) {
            imports.add(itemParser.parseImport());
            skipSeparators();
        }

        List<Item> items = new ArrayList<>();
        while (!isAtEnd()) {
            items.add(itemParser.parseItem());
            skipSeparators();
        }
        return new Program(loc, fileName, imports, items);
    }

    // ============ 委托 ============

    TypeRef parseType() { return typeParser.parseType(); }

    List<String> parseTypeParams() { return typeParser.parseTypeParams(); }

    Expression parseExpression() { return exprParser.parseExpression(); }

    Pattern parsePattern() { return exprParser.parsePattern(); }
}
