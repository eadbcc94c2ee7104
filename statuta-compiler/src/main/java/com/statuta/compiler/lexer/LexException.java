package com.statuta.compiler.lexer;

import com.statuta.compiler.StatutaException;
import com.statuta.compiler.ast.SourceLocation;

/**
 * 词法错误：未闭合的字符串、无法识别的字符或格式错误的领域字面量。
 */
public class LexException extends StatutaException {

    public LexException(String message, SourceLocation location) {
        super(message, location);
    }

    @Override
    public String getKind() {
        return "LexError";
    }
}
