package com.statuta.compiler.analysis;

import com.statuta.compiler.ast.AstNode;
import com.statuta.compiler.ast.Program;
import com.statuta.compiler.ast.expr.Identifier;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 解析结果：AST 本身保持不变，标识符绑定、作用域帧与结构体展开均保存在旁路表中。
 */
public final class ResolvedProgram {
    private final Program program;
    private final Scope importScope;
    private final Scope globalScope;
    private final Map<Identifier, Symbol> bindings;
    private final Map<AstNode, Scope> frames;
    private final List<Scope> scopes;
    private final List<Identifier> unresolved;
    private final Map<Identifier, List<Symbol>> ambiguous;
    private final Map<Symbol, StructLayout> layouts;

    ResolvedProgram(Program program, Scope importScope, Scope globalScope,
                    Map<Identifier, Symbol> bindings, Map<AstNode, Scope> frames,
                    List<Scope> scopes, List<Identifier> unresolved,
                    Map<Identifier, List<Symbol>> ambiguous, Map<Symbol, StructLayout> layouts) {
        this.program = program;
        this.importScope = importScope;
        this.globalScope = globalScope;
        this.bindings = bindings;
        this.frames = frames;
        this.scopes = Collections.unmodifiableList(scopes);
        this.unresolved = Collections.unmodifiableList(unresolved);
        this.ambiguous = ambiguous;
        this.layouts = layouts;
    }

    public Program getProgram() {
        return program;
    }

    public Scope getImportScope() {
        return importScope;
    }

    public Scope getGlobalScope() {
        return globalScope;
    }

    /** 标识符绑定到的声明符号；未解析时返回 null */
    public Symbol getBinding(Identifier identifier) {
        return bindings.get(identifier);
    }

    public boolean isBound(Identifier identifier) {
        return bindings.containsKey(identifier);
    }

    /** 节点（scope / struct / func / 块 / 量词 / legal_test / 别名 / 程序）打开的作用域帧 */
    public Scope getFrame(AstNode node) {
        return frames.get(node);
    }

    /** 所有作用域帧（不含导入帧），按创建顺序 */
    public List<Scope> getScopes() {
        return scopes;
    }

    /** 没有可达声明的标识符使用点，按出现顺序 */
    public List<Identifier> getUnresolved() {
        return unresolved;
    }

    /** 未解析的标识符若是多个枚举共有的成员名，返回这些成员；否则为空列表 */
    public List<Symbol> getAmbiguousVariants(Identifier identifier) {
        List<Symbol> candidates = ambiguous.get(identifier);
        return candidates != null ? candidates : Collections.<Symbol>emptyList();
    }

    public StructLayout getLayout(Symbol struct) {
        return layouts.get(struct);
    }

    /** 按限定名查找结构体展开结果 */
    public StructLayout getLayout(String qualifiedName) {
        for (StructLayout layout : layouts.values()) {
            if (layout.getStruct().getQualifiedName().equals(qualifiedName)) {
                return layout;
            }
        }
        return null;
    }

    public Collection<StructLayout> getLayouts() {
        return Collections.unmodifiableCollection(layouts.values());
    }
}
