package com.statuta.compiler.lexer;

/**
 * Token 类型
 */
public enum TokenType {
    // ============ 字面量 ============
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    MONEY_LITERAL,      // $100.50 / SGD$100.50
    PERCENT_LITERAL,    // 15%
    DATE_LITERAL,       // 01-06-2020
    DURATION_LITERAL,   // 1y6m / 14d

    // ============ 标识符 ============
    IDENTIFIER,

    // ============ 声明关键词 ============
    KW_STRUCT,
    KW_ENUM,
    KW_SCOPE,
    KW_FUNC,
    KW_TYPE,
    KW_PRINCIPLE,
    KW_LEGAL_TEST,
    KW_REQUIRES,
    KW_EXTENDS,
    KW_WHERE,
    KW_REFERENCING,
    KW_FROM,

    // ============ 表达式关键词 ============
    KW_MATCH,
    KW_CASE,
    KW_CONSEQUENCE,
    KW_PASS,
    KW_SATISFIES,
    KW_FORALL,
    KW_EXISTS,
    KW_TRUE,
    KW_FALSE,

    // ============ 领域关键词 ============
    KW_MUTUALLY_EXCLUSIVE,
    KW_EFFECTIVE,
    KW_SUNSET,
    KW_RETROACTIVE,
    KW_PRESUMED,
    KW_PRECEDENT,

    // ============ 内置类型 ============
    KW_INT,
    KW_FLOAT,
    KW_BOOL,
    KW_STRING,
    KW_MONEY,
    KW_PERCENT,
    KW_DATE,
    KW_DURATION,
    KW_BOUNDED_INT,
    KW_TEMPORAL,
    KW_CITATION,
    KW_ARRAY,
    KW_POSITIVE,
    KW_NON_EMPTY,

    // ============ 运算符 ============
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %
    ASSIGN,         // :=
    EQUALS,         // = （仅用于命名参数）
    EQ,             // ==
    NE,             // !=
    LT,             // <
    GT,             // >
    LE,             // <=
    GE,             // >=
    AND,            // &&
    OR,             // ||
    NOT,            // !

    // ============ 分隔符 ============
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    COMMA,
    COLON,
    SEMICOLON,
    DOT,
    AT,
    UNDERSCORE,

    EOF;

    /** 是否为关键词 */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /** 是否为内置类型关键词 */
    public boolean isTypeKeyword() {
        return ordinal() >= KW_INT.ordinal() && ordinal() <= KW_NON_EMPTY.ordinal();
    }

    /** 是否为字面量 */
    public boolean isLiteral() {
        return ordinal() <= DURATION_LITERAL.ordinal();
    }
}
