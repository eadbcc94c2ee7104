package com.statuta.verify;

import com.statuta.compiler.StatutaException;
import com.statuta.compiler.ast.SourceLocation;

/**
 * 原则无法翻译为求解器查询：结构体类型的量词变量、函数调用等。
 *
 * <p>翻译发生在启动求解器之前，因此出现该异常时不会有任何外部进程被创建。</p>
 */
public class TranslationException extends StatutaException {

    public TranslationException(String message, SourceLocation location) {
        super(message, location);
    }

    @Override
    public String getKind() {
        return "TranslationError";
    }
}
