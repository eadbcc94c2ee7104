package com.statuta.compiler.analysis;

import com.statuta.compiler.ast.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 作用域（解析帧）
 *
 * <p>同一帧内的重复声明不会覆盖首个声明，而是全部保留在 {@link #getDeclarations()} 中，
 * 由检查器报告为重复定义。</p>
 */
public final class Scope {

    public enum ScopeType {
        IMPORTS,    // 导入的外部条目（最外层）
        GLOBAL,     // 顶层
        SCOPE,      // scope 容器
        STRUCT,     // struct 字段与类型参数
        FUNCTION,   // 函数参数与类型参数
        BLOCK,      // 函数体块的局部声明
        QUANTIFIER, // forall/exists 绑定变量
        LEGAL_TEST, // requires 条目
        ALIAS       // 类型别名的类型参数
    }

    private final ScopeType type;
    private final Scope parent;
    private final AstNode node;
    private final String path;
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final List<Symbol> declarations = new ArrayList<>();
    private final Map<String, List<Symbol>> enumVariants = new LinkedHashMap<>();

    public Scope(ScopeType type, Scope parent, AstNode node, String path) {
        this.type = type;
        this.parent = parent;
        this.node = node;
        this.path = path;
    }

    public ScopeType getType() { return type; }
    public Scope getParent() { return parent; }
    public AstNode getNode() { return node; }

    /** 作用域路径，顶层为空串，scope 容器为 {@code Outer.Inner} */
    public String getPath() { return path; }

    /** 注册符号到当前作用域；同名时保留首个声明 */
    public void define(Symbol symbol) {
        declarations.add(symbol);
        if (!symbols.containsKey(symbol.getName())) {
            symbols.put(symbol.getName(), symbol);
        }
    }

    /** 注册枚举成员，供未限定的成员名查找 */
    public void defineVariant(Symbol variant) {
        List<Symbol> list = enumVariants.get(variant.getName());
        if (list == null) {
            list = new ArrayList<>();
            enumVariants.put(variant.getName(), list);
        }
        list.add(variant);
    }

    /** 从当前作用域向上查找 */
    public Symbol resolve(String name) {
        Symbol s = symbols.get(name);
        if (s != null) return s;
        if (parent != null) return parent.resolve(name);
        return null;
    }

    /** 仅查找当前作用域 */
    public Symbol resolveLocal(String name) {
        return symbols.get(name);
    }

    /** 向上查找类型名（struct / enum / 别名 / 类型参数） */
    public Symbol resolveType(String name) {
        Symbol s = symbols.get(name);
        if (s != null && s.getKind().isType()) return s;
        if (parent != null) return parent.resolveType(name);
        return null;
    }

    /** 向上查找未限定的枚举成员；在最近一层找到唯一匹配时返回，否则返回 null */
    public Symbol resolveVariant(String name) {
        List<Symbol> list = variantCandidates(name);
        return list.size() == 1 ? list.get(0) : null;
    }

    /** 最近一层声明了该成员名的全部枚举成员；多于一个即为歧义 */
    public List<Symbol> variantCandidates(String name) {
        List<Symbol> list = enumVariants.get(name);
        if (list != null) {
            return Collections.unmodifiableList(list);
        }
        if (parent != null) return parent.variantCandidates(name);
        return Collections.emptyList();
    }

    /** 本帧内的全部声明（按声明顺序，含重复） */
    public List<Symbol> getDeclarations() {
        return Collections.unmodifiableList(declarations);
    }

    public Map<String, Symbol> getSymbols() {
        return Collections.unmodifiableMap(symbols);
    }

    @Override
    public String toString() {
        return type + (path.isEmpty() ? "" : " " + path);
    }
}
