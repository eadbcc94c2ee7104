package com.statuta.compiler.analysis;

import com.statuta.compiler.ast.AstNode;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.type.TypeRef;

/**
 * 符号表中的符号
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final TypeRef type;           // 值符号的声明类型；其它符号为 null
    private final SourceLocation location;// 声明位置
    private final AstNode declaration;    // 声明的 AST 节点
    private final Scope scope;            // 声明所在作用域

    public Symbol(String name, SymbolKind kind, TypeRef type, AstNode declaration,
                  SourceLocation location, Scope scope) {
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.declaration = declaration;
        this.location = location;
        this.scope = scope;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public TypeRef getType() { return type; }
    public SourceLocation getLocation() { return location; }
    public AstNode getDeclaration() { return declaration; }
    public Scope getScope() { return scope; }

    /** 限定名：作用域路径 + 名称，如 {@code Penal.Theft} */
    public String getQualifiedName() {
        String path = scope != null ? scope.getPath() : "";
        return path.isEmpty() ? name : path + "." + name;
    }

    @Override
    public String toString() {
        return kind + " " + getQualifiedName();
    }
}
