package com.statuta.compiler.analysis;

import com.statuta.compiler.StatutaException;
import com.statuta.compiler.ast.SourceLocation;

/**
 * 解析错误：extends 目标不存在、extends 成环、导入失败等。会终止当前编译单元。
 */
public class ResolveException extends StatutaException {

    public enum Kind {
        UNRESOLVED_REFERENCE,
        EXTENDS_CYCLE,
        UNRESOLVED_IMPORT,
        IMPORT_CYCLE
    }

    private final Kind kind;
    private final String symbol;

    public ResolveException(Kind kind, String symbol, String message, SourceLocation location) {
        super(message, location);
        this.kind = kind;
        this.symbol = symbol;
    }

    public ResolveException(Kind kind, String symbol, String message, SourceLocation location, Throwable cause) {
        super(message, location, cause);
        this.kind = kind;
        this.symbol = symbol;
    }

    public Kind getResolveKind() {
        return kind;
    }

    /** 出错的符号名 */
    public String getSymbol() {
        return symbol;
    }

    @Override
    public String getKind() {
        return "ResolveError." + kind.name();
    }
}
