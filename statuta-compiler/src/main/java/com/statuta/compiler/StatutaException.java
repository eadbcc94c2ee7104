package com.statuta.compiler;

import com.statuta.compiler.ast.SourceLocation;

/**
 * 编译阶段致命错误的基类（词法、语法、解析）。
 *
 * <p>这些错误会立即终止当前编译单元，不会产生部分结果。</p>
 */
public abstract class StatutaException extends RuntimeException {
    private final SourceLocation location;

    protected StatutaException(String message, SourceLocation location) {
        super(message);
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    protected StatutaException(String message, SourceLocation location, Throwable cause) {
        super(message, cause);
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 机器可读的错误种类 */
    public abstract String getKind();

    /** 不带位置信息的原始消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (location != SourceLocation.UNKNOWN) {
            sb.append(" at line ").append(location.getLine());
            sb.append(", column ").append(location.getColumn());
        }
        return sb.toString();
    }
}
