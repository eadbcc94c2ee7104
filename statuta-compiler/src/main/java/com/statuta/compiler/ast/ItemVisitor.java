package com.statuta.compiler.ast;

import com.statuta.compiler.ast.item.*;

/**
 * 顶层条目访问者
 *
 * <p>每种条目都必须处理，新增条目种类时所有实现都会在编译期报错。</p>
 */
public interface ItemVisitor<R, C> {

    R visitStruct(StructDecl node, C ctx);

    R visitEnum(EnumDecl node, C ctx);

    R visitFunction(FunctionDecl node, C ctx);

    R visitTypeAlias(TypeAliasDecl node, C ctx);

    R visitScope(ScopeDecl node, C ctx);

    R visitPrinciple(PrincipleDecl node, C ctx);

    R visitLegalTest(LegalTestDecl node, C ctx);

    R visitVariable(VariableDecl node, C ctx);
}
