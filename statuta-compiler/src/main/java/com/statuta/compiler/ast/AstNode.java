package com.statuta.compiler.ast;

/**
 * AST 节点基类
 *
 * <p>节点在解析完成后不可变；解析结果、类型等信息保存在各分析阶段自己的旁路表中。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
