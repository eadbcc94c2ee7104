package com.statuta.compiler.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    STRUCT,             // struct 声明
    ENUM,               // enum 声明
    ENUM_VARIANT,       // 枚举成员
    FUNCTION,           // func 声明
    TYPE_ALIAS,         // type 别名
    SCOPE,              // scope 容器
    PRINCIPLE,          // principle
    LEGAL_TEST,         // legal_test
    VARIABLE,           // 值声明 int x := ...
    PARAMETER,          // 函数参数
    FIELD,              // 结构体字段
    REQUIREMENT,        // legal_test 的 requires 条目
    TYPE_PARAMETER,     // 泛型参数
    QUANTIFIED;         // forall/exists 绑定的变量

    /** 是否可作为表达式中的值被引用 */
    public boolean isValue() {
        return this == VARIABLE || this == PARAMETER || this == FIELD
                || this == REQUIREMENT || this == QUANTIFIED || this == ENUM_VARIANT;
    }

    /** 是否可作为类型名被引用 */
    public boolean isType() {
        return this == STRUCT || this == ENUM || this == TYPE_ALIAS || this == TYPE_PARAMETER;
    }
}
