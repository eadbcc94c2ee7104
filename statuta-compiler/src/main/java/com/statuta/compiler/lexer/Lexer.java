package com.statuta.compiler.lexer;

import com.statuta.compiler.ast.SourceLocation;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statuta 词法分析器
 *
 * <p>一次性将源码完整切分为 Token 列表；空白、行注释与（可嵌套的）块注释被丢弃。
 * 遇到无法识别的字符、未闭合的字符串或格式错误的领域字面量时抛出 {@link LexException}。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("struct", TokenType.KW_STRUCT);
        map.put("enum", TokenType.KW_ENUM);
        map.put("scope", TokenType.KW_SCOPE);
        map.put("func", TokenType.KW_FUNC);
        map.put("type", TokenType.KW_TYPE);
        map.put("principle", TokenType.KW_PRINCIPLE);
        map.put("legal_test", TokenType.KW_LEGAL_TEST);
        map.put("requires", TokenType.KW_REQUIRES);
        map.put("extends", TokenType.KW_EXTENDS);
        map.put("where", TokenType.KW_WHERE);
        map.put("referencing", TokenType.KW_REFERENCING);
        map.put("from", TokenType.KW_FROM);

        // 表达式
        map.put("match", TokenType.KW_MATCH);
        map.put("case", TokenType.KW_CASE);
        map.put("consequence", TokenType.KW_CONSEQUENCE);
        map.put("pass", TokenType.KW_PASS);
        map.put("satisfies", TokenType.KW_SATISFIES);
        map.put("forall", TokenType.KW_FORALL);
        map.put("exists", TokenType.KW_EXISTS);
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);

        // 领域术语
        map.put("mutually_exclusive", TokenType.KW_MUTUALLY_EXCLUSIVE);
        map.put("effective", TokenType.KW_EFFECTIVE);
        map.put("sunset", TokenType.KW_SUNSET);
        map.put("retroactive", TokenType.KW_RETROACTIVE);
        map.put("presumed", TokenType.KW_PRESUMED);
        map.put("precedent", TokenType.KW_PRECEDENT);

        // 内置类型（小写与首字母大写两种写法）
        map.put("int", TokenType.KW_INT);
        map.put("integer", TokenType.KW_INT);
        map.put("Int", TokenType.KW_INT);
        map.put("Integer", TokenType.KW_INT);
        map.put("float", TokenType.KW_FLOAT);
        map.put("Float", TokenType.KW_FLOAT);
        map.put("bool", TokenType.KW_BOOL);
        map.put("boolean", TokenType.KW_BOOL);
        map.put("Bool", TokenType.KW_BOOL);
        map.put("Boolean", TokenType.KW_BOOL);
        map.put("string", TokenType.KW_STRING);
        map.put("String", TokenType.KW_STRING);
        map.put("money", TokenType.KW_MONEY);
        map.put("Money", TokenType.KW_MONEY);
        map.put("percent", TokenType.KW_PERCENT);
        map.put("Percent", TokenType.KW_PERCENT);
        map.put("date", TokenType.KW_DATE);
        map.put("Date", TokenType.KW_DATE);
        map.put("duration", TokenType.KW_DURATION);
        map.put("Duration", TokenType.KW_DURATION);
        map.put("BoundedInt", TokenType.KW_BOUNDED_INT);
        map.put("Temporal", TokenType.KW_TEMPORAL);
        map.put("Citation", TokenType.KW_CITATION);
        map.put("Array", TokenType.KW_ARRAY);
        map.put("Positive", TokenType.KW_POSITIVE);
        map.put("NonEmpty", TokenType.KW_NON_EMPTY);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    /**
     * 执行词法分析，返回以 EOF 结尾的 Token 列表
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            markStart();
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return tokens;
    }

    private void markStart() {
        start = current;
        startLine = line;
        startColumn = column;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '.': addToken(TokenType.DOT); break;
            case '@': addToken(TokenType.AT); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.MUL); break;
            case '%': addToken(TokenType.MOD); break;
            case '_':
                if (isAlphaNumeric(peek())) {
                    identifier();
                } else {
                    addToken(TokenType.UNDERSCORE);
                }
                break;

            case ':':
                addToken(match('=') ? TokenType.ASSIGN : TokenType.COLON);
                break;

            case '/':
                if (match('/')) {
                    // 单行注释
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(TokenType.DIV);
                }
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.EQUALS);
                break;

            case '!':
                addToken(match('=') ? TokenType.NE : TokenType.NOT);
                break;

            case '<':
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '&':
                if (match('&')) {
                    addToken(TokenType.AND);
                } else {
                    throw error("Unexpected character '&'. Did you mean '&&'?");
                }
                break;

            case '|':
                if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    throw error("Unexpected character '|'. Did you mean '||'?");
                }
                break;

            case '$':
                money(null);
                break;

            case '"':
                string();
                break;

            // 空白字符
            case ' ':
            case '\r':
            case '\t':
            case '\n':
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw error("Unexpected character: " + c);
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int distance) {
        int index = current + distance;
        if (index >= source.length()) return '\0';
        return source.charAt(index);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, startLine, startColumn, start));
    }

    // === 复杂 Token 扫描 ===

    private void string() {
        StringBuilder value = new StringBuilder();

        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\n') {
                throw error("Unterminated string");
            }
            if (peek() == '\\') {
                advance();
                value.append(escapeChar());
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            throw error("Unterminated string");
        }

        advance(); // 闭合的 "
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private char escapeChar() {
        if (isAtEnd()) {
            throw error("Unterminated string");
        }
        char c = advance();
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case '"': return '"';
            case '\\': return '\\';
            default:
                throw error("Invalid escape character: \\" + c);
        }
    }

    /**
     * 金额：$ 后跟整数部分、小数点与恰好两位小数。
     * 调用时 '$' 已被消费。
     */
    private void money(String currency) {
        if (!isDigit(peek())) {
            throw error("Expected digits after '$' in money literal");
        }
        int amountStart = current;
        while (isDigit(peek())) advance();
        if (peek() != '.' || !isDigit(peekNext())) {
            throw error("Money literal must have exactly two fractional digits");
        }
        advance(); // 消费 .
        int fractionStart = current;
        while (isDigit(peek())) advance();
        if (current - fractionStart != 2) {
            throw error("Money literal must have exactly two fractional digits");
        }
        if (isAlpha(peek())) {
            throw error("Unexpected character after money literal: " + peek());
        }
        BigDecimal amount = new BigDecimal(source.substring(amountStart, current));
        addToken(TokenType.MONEY_LITERAL, new MoneyValue(amount, currency));
    }

    private void number() {
        // 日期：DD-MM-YYYY
        if (current - start == 1 && isDigit(peek()) && isDateAhead()) {
            date();
            return;
        }

        while (isDigit(peek())) advance();

        // 小数部分
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消费 .
            while (isDigit(peek())) advance();
            String text = source.substring(start, current);
            if (peek() == '%') {
                advance();
                addToken(TokenType.PERCENT_LITERAL, new BigDecimal(text));
            } else {
                addToken(TokenType.FLOAT_LITERAL, Double.parseDouble(text));
            }
            return;
        }

        if (peek() == '%') {
            String text = source.substring(start, current);
            advance();
            addToken(TokenType.PERCENT_LITERAL, new BigDecimal(text));
            return;
        }

        if (isDurationUnit(peek()) && !isAlphaNumeric(peekNext()) || isDurationUnit(peek()) && isDigit(peekNext())) {
            duration();
            return;
        }

        String text = source.substring(start, current);
        try {
            addToken(TokenType.INT_LITERAL, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw error("Invalid integer literal: " + text);
        }
    }

    /** 当前位置（已消费首位数字）之后是否为 D-MM-YYYY 的剩余部分 */
    private boolean isDateAhead() {
        // 形如 "1-06-2020" 的剩余：d-dd-dddd
        return peekAt(1) == '-'
                && isDigit(peekAt(2)) && isDigit(peekAt(3))
                && peekAt(4) == '-'
                && isDigit(peekAt(5)) && isDigit(peekAt(6))
                && isDigit(peekAt(7)) && isDigit(peekAt(8))
                && !isAlphaNumeric(peekAt(9));
    }

    private void date() {
        // DD-MM-YYYY 共 10 个字符，已消费 1 个
        for (int i = 0; i < 9; i++) advance();
        String text = source.substring(start, current);
        int day = Integer.parseInt(text.substring(0, 2));
        int month = Integer.parseInt(text.substring(3, 5));
        int year = Integer.parseInt(text.substring(6, 10));
        try {
            addToken(TokenType.DATE_LITERAL, LocalDate.of(year, month, day));
        } catch (DateTimeException e) {
            throw error("Invalid date literal: " + text);
        }
    }

    private boolean isDurationUnit(char c) {
        return c == 'y' || c == 'm' || c == 'w' || c == 'd';
    }

    /**
     * 时长：一个或多个 "数字+单位" 片段，如 1y6m、2w、30d。
     * 调用时第一个片段的数字已被消费。
     */
    private void duration() {
        int years = 0;
        int months = 0;
        int days = 0;
        int segmentStart = start;
        while (true) {
            int amount;
            try {
                amount = Integer.parseInt(source.substring(segmentStart, current));
            } catch (NumberFormatException e) {
                throw error("Invalid duration literal: " + source.substring(start, current));
            }
            char unit = advance();
            switch (unit) {
                case 'y': years += amount; break;
                case 'm': months += amount; break;
                case 'w': days += amount * 7; break;
                default: days += amount; break;
            }
            if (!isDigit(peek())) {
                break;
            }
            segmentStart = current;
            while (isDigit(peek())) advance();
            if (!isDurationUnit(peek())) {
                throw error("Expected duration unit (y, m, w, d) in " + source.substring(start, current));
            }
        }
        if (isAlphaNumeric(peek())) {
            throw error("Invalid duration literal: " + source.substring(start, current + 1));
        }
        addToken(TokenType.DURATION_LITERAL, Period.of(years, months, days));
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);

        // 带币种的金额：SGD$100.50
        if (peek() == '$' && isCurrencyCode(text)) {
            advance(); // 消费 $
            money(text);
            return;
        }

        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private static boolean isCurrencyCode(String text) {
        if (text.length() != 3) return false;
        for (int i = 0; i < 3; i++) {
            char ch = text.charAt(i);
            if (ch < 'A' || ch > 'Z') return false;
        }
        return true;
    }

    private void blockComment() {
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            if (peek() == '/' && peekNext() == '*') {
                advance();
                advance();
                depth++;
            } else if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                depth--;
            } else {
                advance();
            }
        }
        if (depth > 0) {
            throw error("Unterminated block comment");
        }
    }

    private LexException error(String message) {
        SourceLocation location = new SourceLocation(fileName, startLine, startColumn,
                start, Math.max(1, current - start));
        return new LexException(message, location);
    }
}
