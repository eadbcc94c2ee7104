package com.statuta.compiler.analysis;

import com.statuta.compiler.ast.AstNode;
import com.statuta.compiler.ast.ExprVisitor;
import com.statuta.compiler.ast.ItemVisitor;
import com.statuta.compiler.ast.Program;
import com.statuta.compiler.ast.expr.*;
import com.statuta.compiler.ast.item.*;
import com.statuta.compiler.ast.type.RecordType;
import com.statuta.compiler.ast.type.TypeRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 名称解析器
 *
 * <p>作用域是词法嵌套的：scope、struct、func、函数体块、量词和 legal_test 各自打开一个帧，
 * 查找从最内层向外进行，内层同名声明遮蔽外层。除值声明（{@code int x := ...}）只在其位置之后可见外，
 * 其余条目在所在帧内提前可见。</p>
 *
 * <p>没有可达声明的标识符不会使解析失败，而是记录下来交由检查器报告；
 * 只有 extends 目标缺失或 extends 成环才抛出 {@link ResolveException}。</p>
 */
public final class Resolver implements ItemVisitor<Void, Scope>, ExprVisitor<Void, Scope> {

    private static final Logger LOG = Logger.getLogger(Resolver.class.getName());

    private final Map<Identifier, Symbol> bindings = new IdentityHashMap<>();
    private final Map<AstNode, Scope> frames = new IdentityHashMap<>();
    private final List<Scope> scopes = new ArrayList<>();
    private final List<Identifier> unresolved = new ArrayList<>();
    private final Map<Identifier, List<Symbol>> ambiguous = new IdentityHashMap<>();
    private final Map<Symbol, StructLayout> layouts = new LinkedHashMap<>();

    private boolean used;

    /** 解析不带导入的程序 */
    public ResolvedProgram resolve(Program program) {
        return resolve(program, Collections.<Item>emptyList());
    }

    /**
     * 解析程序
     *
     * @param program       待解析的程序
     * @param importedItems 由导入引入的外部条目，登记在最外层的导入帧中
     */
    public ResolvedProgram resolve(Program program, List<Item> importedItems) {
        if (used) {
            throw new IllegalStateException("Resolver instances are single-use");
        }
        used = true;

        Scope imports = new Scope(Scope.ScopeType.IMPORTS, null, null, "");
        for (Item item : importedItems) {
            declare(item, imports);
        }
        for (Symbol symbol : imports.getDeclarations()) {
            if (symbol.getKind() == SymbolKind.STRUCT) {
                layoutOf(symbol);
            }
        }

        Scope global = openFrame(Scope.ScopeType.GLOBAL, imports, program, "");
        declareAll(program.getItems(), global);
        for (Item item : program.getItems()) {
            item.accept(this, global);
        }

        LOG.log(Level.FINE, "Resolved {0}: {1} bindings, {2} unresolved, {3} struct layouts",
                new Object[]{program.getFileName(), bindings.size(), unresolved.size(), layouts.size()});
        return new ResolvedProgram(program, imports, global, bindings, frames, scopes, unresolved, ambiguous,
                layouts);
    }

    // ============ 帧与声明 ============

    private Scope openFrame(Scope.ScopeType type, Scope parent, AstNode node, String path) {
        Scope frame = new Scope(type, parent, node, path);
        scopes.add(frame);
        frames.put(node, frame);
        return frame;
    }

    private static String childPath(Scope parent, String name) {
        return parent.getPath().isEmpty() ? name : parent.getPath() + "." + name;
    }

    /** 提前登记帧内除值声明以外的全部条目 */
    private void declareAll(List<Item> items, Scope frame) {
        for (Item item : items) {
            if (!(item instanceof VariableDecl)) {
                declare(item, frame);
            }
        }
    }

    private void declare(Item item, Scope frame) {
        SymbolKind kind = item.accept(KIND_OF, null);
        TypeRef type = item instanceof VariableDecl ? ((VariableDecl) item).getType() : null;
        Symbol symbol = new Symbol(item.getName(), kind, type, item, item.getLocation(), frame);
        frame.define(symbol);

        if (item instanceof EnumDecl) {
            EnumDecl enumDecl = (EnumDecl) item;
            for (EnumDecl.Variant variant : enumDecl.getVariants()) {
                frame.defineVariant(new Symbol(variant.getName(), SymbolKind.ENUM_VARIANT,
                        null, enumDecl, variant.getLocation(), frame));
            }
        }
    }

    private static void defineTypeParams(List<String> typeParams, AstNode owner, Scope frame) {
        for (String param : typeParams) {
            frame.define(new Symbol(param, SymbolKind.TYPE_PARAMETER, null, owner, owner.getLocation(), frame));
        }
    }

    // ============ 结构体展开 ============

    /**
     * 计算结构体的有效字段列表：沿 extends 链向上收集，遇到已计算的祖先直接复用。
     * 每一轮显式记录已访问的结构体，链上出现重复即为成环。
     */
    StructLayout layoutOf(Symbol struct) {
        StructLayout cached = layouts.get(struct);
        if (cached != null) {
            return cached;
        }

        List<Symbol> chain = new ArrayList<>();
        LinkedHashSet<Symbol> seen = new LinkedHashSet<>();
        StructLayout base = null;
        Symbol cur = struct;
        while (true) {
            if (!seen.add(cur)) {
                throw extendsCycle(struct, seen, cur);
            }
            StructLayout known = layouts.get(cur);
            if (known != null) {
                base = known;
                break;
            }
            chain.add(cur);
            StructDecl decl = (StructDecl) cur.getDeclaration();
            if (!decl.hasParent()) {
                break;
            }
            Symbol parent = cur.getScope().resolveType(decl.getExtendsName());
            if (parent == null || parent.getKind() != SymbolKind.STRUCT) {
                throw new ResolveException(ResolveException.Kind.UNRESOLVED_REFERENCE, decl.getExtendsName(),
                        "Struct '" + decl.getName() + "' extends unknown struct '" + decl.getExtendsName() + "'",
                        decl.getLocation());
            }
            cur = parent;
        }

        List<StructLayout.LayoutField> fields = new ArrayList<>();
        if (base != null) {
            fields.addAll(base.getFields());
        }
        StructLayout result = base;
        for (int i = chain.size() - 1; i >= 0; i--) {
            Symbol s = chain.get(i);
            for (FieldDecl field : ((StructDecl) s.getDeclaration()).getFields()) {
                fields.add(new StructLayout.LayoutField(field, s.getName()));
            }
            result = new StructLayout(s, new ArrayList<>(fields));
            layouts.put(s, result);
        }
        return result;
    }

    private static ResolveException extendsCycle(Symbol start, LinkedHashSet<Symbol> seen, Symbol repeated) {
        StringBuilder path = new StringBuilder();
        boolean inCycle = false;
        for (Symbol s : seen) {
            if (s == repeated) inCycle = true;
            if (inCycle) path.append(s.getName()).append(" -> ");
        }
        path.append(repeated.getName());
        return new ResolveException(ResolveException.Kind.EXTENDS_CYCLE, start.getName(),
                "Cyclic extends chain: " + path, start.getLocation());
    }

    // ============ 条目 ============

    @Override
    public Void visitStruct(StructDecl node, Scope scope) {
        Symbol symbol = scope.resolveLocal(node.getName());
        if (symbol == null || symbol.getDeclaration() != node) {
            // 同帧重名的第二个声明：单独计算展开，不影响首个声明
            symbol = new Symbol(node.getName(), SymbolKind.STRUCT, null, node, node.getLocation(), scope);
        }
        StructLayout layout = layoutOf(symbol);

        Scope frame = openFrame(Scope.ScopeType.STRUCT, scope, node, childPath(scope, node.getName()));
        defineTypeParams(node.getTypeParams(), node, frame);
        for (StructLayout.LayoutField field : layout.getFields()) {
            FieldDecl decl = field.getDecl();
            frame.define(new Symbol(decl.getName(), SymbolKind.FIELD, decl.getType(), decl, decl.getLocation(), frame));
        }
        for (FieldDecl field : node.getFields()) {
            resolveField(field, frame);
        }
        return null;
    }

    private void resolveField(FieldDecl field, Scope frame) {
        if (field.getConstraint() != null) {
            field.getConstraint().accept(this, frame);
        }
        if (field.getType() instanceof RecordType) {
            for (FieldDecl nested : ((RecordType) field.getType()).getFields()) {
                resolveField(nested, frame);
            }
        }
    }

    @Override
    public Void visitEnum(EnumDecl node, Scope scope) {
        return null;
    }

    @Override
    public Void visitFunction(FunctionDecl node, Scope scope) {
        Scope frame = openFrame(Scope.ScopeType.FUNCTION, scope, node, scope.getPath());
        defineTypeParams(node.getTypeParams(), node, frame);
        for (Parameter param : node.getParams()) {
            frame.define(new Symbol(param.getName(), SymbolKind.PARAMETER, param.getType(),
                    param, param.getLocation(), frame));
        }
        node.getBody().accept(this, frame);
        return null;
    }

    @Override
    public Void visitTypeAlias(TypeAliasDecl node, Scope scope) {
        Scope frame = openFrame(Scope.ScopeType.ALIAS, scope, node, scope.getPath());
        defineTypeParams(node.getTypeParams(), node, frame);
        return null;
    }

    @Override
    public Void visitScope(ScopeDecl node, Scope scope) {
        Scope frame = openFrame(Scope.ScopeType.SCOPE, scope, node, childPath(scope, node.getName()));
        declareAll(node.getItems(), frame);
        for (Item item : node.getItems()) {
            item.accept(this, frame);
        }
        return null;
    }

    @Override
    public Void visitPrinciple(PrincipleDecl node, Scope scope) {
        node.getBody().accept(this, scope);
        return null;
    }

    @Override
    public Void visitLegalTest(LegalTestDecl node, Scope scope) {
        Scope frame = openFrame(Scope.ScopeType.LEGAL_TEST, scope, node, childPath(scope, node.getName()));
        for (Parameter req : node.getRequirements()) {
            frame.define(new Symbol(req.getName(), SymbolKind.REQUIREMENT, req.getType(),
                    req, req.getLocation(), frame));
        }
        return null;
    }

    @Override
    public Void visitVariable(VariableDecl node, Scope scope) {
        // 先解析右侧，再登记名称：声明对自身初始值不可见
        node.getValue().accept(this, scope);
        declare(node, scope);
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitIdentifier(Identifier node, Scope scope) {
        Symbol symbol = scope.resolve(node.getName());
        if (symbol == null) {
            symbol = scope.resolveVariant(node.getName());
        }
        if (symbol != null) {
            bindings.put(node, symbol);
        } else {
            unresolved.add(node);
            List<Symbol> candidates = scope.variantCandidates(node.getName());
            if (candidates.size() > 1) {
                ambiguous.put(node, candidates);
            }
        }
        return null;
    }

    @Override
    public Void visitLiteral(Literal node, Scope scope) {
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr node, Scope scope) {
        node.getLeft().accept(this, scope);
        node.getRight().accept(this, scope);
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpr node, Scope scope) {
        node.getOperand().accept(this, scope);
        return null;
    }

    @Override
    public Void visitCall(CallExpr node, Scope scope) {
        node.getCallee().accept(this, scope);
        for (Expression arg : node.getArguments()) {
            arg.accept(this, scope);
        }
        return null;
    }

    @Override
    public Void visitFieldAccess(FieldAccessExpr node, Scope scope) {
        node.getTarget().accept(this, scope);
        return null;
    }

    @Override
    public Void visitStructInit(StructInitExpr node, Scope scope) {
        for (StructInitExpr.FieldInit field : node.getFields()) {
            field.getValue().accept(this, scope);
        }
        return null;
    }

    @Override
    public Void visitMatch(MatchExpr node, Scope scope) {
        node.getScrutinee().accept(this, scope);
        for (MatchArm arm : node.getArms()) {
            if (arm.getGuard() != null) {
                arm.getGuard().accept(this, scope);
            }
            arm.getResult().accept(this, scope);
        }
        return null;
    }

    @Override
    public Void visitForall(ForallExpr node, Scope scope) {
        return visitQuantifier(node, scope);
    }

    @Override
    public Void visitExists(ExistsExpr node, Scope scope) {
        return visitQuantifier(node, scope);
    }

    private Void visitQuantifier(QuantifierExpr node, Scope scope) {
        Scope frame = openFrame(Scope.ScopeType.QUANTIFIER, scope, node, scope.getPath());
        frame.define(new Symbol(node.getVariable(), SymbolKind.QUANTIFIED, node.getVariableType(),
                node, node.getLocation(), frame));
        if (node.getGuard() != null) {
            node.getGuard().accept(this, frame);
        }
        node.getBody().accept(this, frame);
        return null;
    }

    @Override
    public Void visitBlock(BlockExpr node, Scope scope) {
        Scope frame = openFrame(Scope.ScopeType.BLOCK, scope, node, scope.getPath());
        for (VariableDecl local : node.getDeclarations()) {
            visitVariable(local, frame);
        }
        node.getResult().accept(this, frame);
        return null;
    }

    @Override
    public Void visitPass(PassExpr node, Scope scope) {
        return null;
    }

    // ============ 条目到符号类型 ============

    private static final ItemVisitor<SymbolKind, Void> KIND_OF = new ItemVisitor<SymbolKind, Void>() {
        @Override public SymbolKind visitStruct(StructDecl node, Void ctx) { return SymbolKind.STRUCT; }
        @Override public SymbolKind visitEnum(EnumDecl node, Void ctx) { return SymbolKind.ENUM; }
        @Override public SymbolKind visitFunction(FunctionDecl node, Void ctx) { return SymbolKind.FUNCTION; }
        @Override public SymbolKind visitTypeAlias(TypeAliasDecl node, Void ctx) { return SymbolKind.TYPE_ALIAS; }
        @Override public SymbolKind visitScope(ScopeDecl node, Void ctx) { return SymbolKind.SCOPE; }
        @Override public SymbolKind visitPrinciple(PrincipleDecl node, Void ctx) { return SymbolKind.PRINCIPLE; }
        @Override public SymbolKind visitLegalTest(LegalTestDecl node, Void ctx) { return SymbolKind.LEGAL_TEST; }
        @Override public SymbolKind visitVariable(VariableDecl node, Void ctx) { return SymbolKind.VARIABLE; }
    };
}
