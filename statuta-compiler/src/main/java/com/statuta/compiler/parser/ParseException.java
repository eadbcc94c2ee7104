package com.statuta.compiler.parser;

import com.statuta.compiler.StatutaException;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.lexer.Token;

/**
 * 解析异常：语法错误会终止整个编译单元，不产生部分 AST。
 */
public class ParseException extends StatutaException {
    private final Token token;
    private final String expected;

    public ParseException(String message, String fileName, Token token) {
        this(message, fileName, token, null);
    }

    public ParseException(String message, String fileName, Token token, String expected) {
        super(message, locationOf(fileName, token));
        this.token = token;
        this.expected = expected;
    }

    private static SourceLocation locationOf(String fileName, Token token) {
        if (token == null) return SourceLocation.UNKNOWN;
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getLexeme().length());
    }

    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    @Override
    public String getKind() {
        return "ParseError";
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (token != null) {
            sb.append(" (found '").append(token.getLexeme()).append("')");
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
