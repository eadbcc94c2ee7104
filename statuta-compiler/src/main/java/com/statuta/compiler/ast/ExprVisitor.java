package com.statuta.compiler.ast;

import com.statuta.compiler.ast.expr.*;

/**
 * 表达式访问者
 */
public interface ExprVisitor<R, C> {

    R visitIdentifier(Identifier node, C ctx);

    R visitLiteral(Literal node, C ctx);

    R visitBinary(BinaryExpr node, C ctx);

    R visitUnary(UnaryExpr node, C ctx);

    R visitCall(CallExpr node, C ctx);

    R visitFieldAccess(FieldAccessExpr node, C ctx);

    R visitStructInit(StructInitExpr node, C ctx);

    R visitMatch(MatchExpr node, C ctx);

    R visitForall(ForallExpr node, C ctx);

    R visitExists(ExistsExpr node, C ctx);

    R visitBlock(BlockExpr node, C ctx);

    R visitPass(PassExpr node, C ctx);
}
