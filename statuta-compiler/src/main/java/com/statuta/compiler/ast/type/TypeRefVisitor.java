package com.statuta.compiler.ast.type;

/**
 * TypeRef 轻量访问者接口，用于替代 instanceof 分派。
 */
public interface TypeRefVisitor<R> {
    R visitPrimitive(PrimitiveType type);
    R visitMoney(MoneyType type);
    R visitBoundedInt(BoundedIntType type);
    R visitTemporal(TemporalType type);
    R visitCitation(CitationType type);
    R visitUnion(UnionType type);
    R visitRecord(RecordType type);
    R visitNamed(NamedType type);
    R visitWrapper(WrapperType type);
}
