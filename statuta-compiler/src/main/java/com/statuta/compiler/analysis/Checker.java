package com.statuta.compiler.analysis;

import com.statuta.compiler.ast.ExprVisitor;
import com.statuta.compiler.ast.ItemVisitor;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.expr.*;
import com.statuta.compiler.ast.item.*;
import com.statuta.compiler.ast.pattern.*;
import com.statuta.compiler.ast.type.*;
import com.statuta.compiler.lexer.MoneyValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 语义检查器
 *
 * <p>在已解析的程序上做一遍完整检查，收集全部诊断后一次性返回，不会在第一个错误处停止。
 * 类型未知（例如引用了未定义的符号）时以 null 表示，并抑制由此引发的连锁诊断。</p>
 */
public final class Checker implements ItemVisitor<Void, Scope>, ExprVisitor<TypeRef, Scope> {

    private static final Logger LOG = Logger.getLogger(Checker.class.getName());

    public static final BigDecimal DEFAULT_PERCENT_MIN = BigDecimal.ZERO;
    public static final BigDecimal DEFAULT_PERCENT_MAX = BigDecimal.valueOf(100);

    private static final int MAX_ALIAS_DEPTH = 32;

    private static final PrimitiveType INT = PrimitiveType.of(PrimitiveType.Kind.INT);
    private static final PrimitiveType FLOAT = PrimitiveType.of(PrimitiveType.Kind.FLOAT);
    private static final PrimitiveType BOOL = PrimitiveType.of(PrimitiveType.Kind.BOOL);
    private static final PrimitiveType PASS = PrimitiveType.of(PrimitiveType.Kind.PASS);

    private final ResolvedProgram program;
    private final BigDecimal percentMin;
    private final BigDecimal percentMax;
    private final ConstantEvaluator constants;
    private final Map<StructDecl, StructLayout> layouts = new IdentityHashMap<>();
    private final List<CheckError> errors = new ArrayList<>();

    public Checker(ResolvedProgram program) {
        this(program, DEFAULT_PERCENT_MIN, DEFAULT_PERCENT_MAX);
    }

    /**
     * @param percentMin 百分比常量允许的下限（含）
     * @param percentMax 百分比常量允许的上限（含）
     */
    public Checker(ResolvedProgram program, BigDecimal percentMin, BigDecimal percentMax) {
        this.program = program;
        this.percentMin = percentMin;
        this.percentMax = percentMax;
        this.constants = new ConstantEvaluator(program);
        for (StructLayout layout : program.getLayouts()) {
            layouts.put(layout.getDecl(), layout);
        }
    }

    public List<CheckError> check() {
        errors.clear();
        for (Identifier id : program.getUnresolved()) {
            List<Symbol> candidates = program.getAmbiguousVariants(id);
            if (candidates.isEmpty()) {
                report(CheckError.Kind.UNDEFINED_SYMBOL, id.getName(),
                        "Undefined symbol '" + id.getName() + "'", id.getLocation());
            } else {
                reportAmbiguous(id.getName(), candidates, id.getLocation());
            }
        }
        for (Scope frame : program.getScopes()) {
            if (frame.getType() != Scope.ScopeType.STRUCT) {
                reportDuplicates(frame.getDeclarations());
            }
        }
        Scope global = program.getGlobalScope();
        for (Item item : program.getProgram().getItems()) {
            item.accept(this, global);
        }
        LOG.log(Level.FINE, "Checked {0}: {1} diagnostics",
                new Object[]{program.getProgram().getFileName(), errors.size()});
        return Collections.unmodifiableList(new ArrayList<>(errors));
    }

    private void report(CheckError.Kind kind, String name, String message, SourceLocation location) {
        errors.add(new CheckError(kind, name, message, location));
    }

    /** 多个枚举共有的未限定成员名，按未定义符号报告并列出各枚举 */
    private void reportAmbiguous(String variant, List<Symbol> candidates, SourceLocation location) {
        List<String> owners = new ArrayList<>();
        for (Symbol candidate : candidates) {
            String path = candidate.getScope() != null ? candidate.getScope().getPath() : "";
            String enumName = ((EnumDecl) candidate.getDeclaration()).getName();
            owners.add("'" + (path.isEmpty() ? enumName : path + "." + enumName) + "'");
        }
        String list = owners.size() == 2
                ? owners.get(0) + " and " + owners.get(1)
                : String.join(", ", owners);
        report(CheckError.Kind.UNDEFINED_SYMBOL, variant, "Ambiguous enum variant '" + variant
                + "': it is declared by enums " + list + "; qualify it with the enum name", location);
    }

    private void typeError(String message, SourceLocation location) {
        report(CheckError.Kind.TYPE_ERROR, null, message, location);
    }

    private void reportDuplicates(List<Symbol> declarations) {
        Map<String, Symbol> first = new HashMap<>();
        for (Symbol s : declarations) {
            Symbol prev = first.get(s.getName());
            if (prev == null) {
                first.put(s.getName(), s);
            } else {
                report(CheckError.Kind.DUPLICATE_DEFINITION, s.getName(),
                        "Duplicate definition of '" + s.getName() + "' (first defined at line "
                                + prev.getLocation().getLine() + ")", s.getLocation());
            }
        }
    }

    // ============ 条目 ============

    @Override
    public Void visitStruct(StructDecl node, Scope scope) {
        Scope frame = program.getFrame(node);

        List<Symbol> typeParams = new ArrayList<>();
        for (Symbol s : frame.getDeclarations()) {
            if (s.getKind() == SymbolKind.TYPE_PARAMETER) typeParams.add(s);
        }
        reportDuplicates(typeParams);

        // 重复字段只在声明它的结构体上报告一次，子结构体继承时不再重复
        StructLayout layout = layouts.get(node);
        if (layout != null) {
            Map<String, StructLayout.LayoutField> seen = new HashMap<>();
            for (StructLayout.LayoutField f : layout.getFields()) {
                StructLayout.LayoutField prev = seen.get(f.getName());
                if (prev == null) {
                    seen.put(f.getName(), f);
                } else if (f.getOwner().equals(node.getName())) {
                    String where = prev.getOwner().equals(node.getName())
                            ? "" : " (inherited from '" + prev.getOwner() + "')";
                    report(CheckError.Kind.DUPLICATE_DEFINITION, f.getName(),
                            "Duplicate field '" + f.getName() + "' in struct '" + node.getName() + "'" + where,
                            f.getDecl().getLocation());
                }
            }
        }

        for (FieldDecl field : node.getFields()) {
            checkField(field, frame);
        }
        return null;
    }

    private void checkField(FieldDecl field, Scope frame) {
        checkTypeRef(field.getType(), frame);
        if (field.getConstraint() != null) {
            expectBool(field.getConstraint(), frame, "Constraint on field '" + field.getName() + "'");
        }
    }

    @Override
    public Void visitEnum(EnumDecl node, Scope scope) {
        Set<String> names = new HashSet<>();
        for (EnumDecl.Variant v : node.getVariants()) {
            if (!names.add(v.getName())) {
                report(CheckError.Kind.DUPLICATE_DEFINITION, v.getName(),
                        "Duplicate variant '" + v.getName() + "' in enum '" + node.getName() + "'", v.getLocation());
            }
        }
        if (node.isMutuallyExclusive() && node.getVariants().size() < 2) {
            typeError("Mutually exclusive enum '" + node.getName() + "' needs at least two variants",
                    node.getLocation());
        }
        return null;
    }

    @Override
    public Void visitFunction(FunctionDecl node, Scope scope) {
        Scope frame = program.getFrame(node);
        checkTypeRef(node.getReturnType(), frame);
        for (Parameter param : node.getParams()) {
            checkTypeRef(param.getType(), frame);
        }
        checkAssignable(node.getReturnType(), node.getBody(), frame,
                "Body of function '" + node.getName() + "'");
        return null;
    }

    @Override
    public Void visitTypeAlias(TypeAliasDecl node, Scope scope) {
        Scope frame = program.getFrame(node);
        checkTypeRef(node.getTarget(), frame);
        if (expand(new NamedType(node.getLocation(), node.getName(), typeParamRefs(node)), scope) == null) {
            typeError("Type alias '" + node.getName() + "' refers to itself", node.getLocation());
        }
        return null;
    }

    private static List<TypeRef> typeParamRefs(TypeAliasDecl node) {
        List<TypeRef> refs = new ArrayList<>();
        for (String p : node.getTypeParams()) {
            refs.add(new NamedType(node.getLocation(), p));
        }
        return refs;
    }

    @Override
    public Void visitScope(ScopeDecl node, Scope scope) {
        Scope frame = program.getFrame(node);
        for (Item item : node.getItems()) {
            item.accept(this, frame);
        }
        return null;
    }

    @Override
    public Void visitPrinciple(PrincipleDecl node, Scope scope) {
        expectBool(node.getBody(), scope, "Body of principle '" + node.getName() + "'");
        return null;
    }

    @Override
    public Void visitLegalTest(LegalTestDecl node, Scope scope) {
        Scope frame = program.getFrame(node);
        for (Parameter req : node.getRequirements()) {
            checkTypeRef(req.getType(), frame);
            TypeRef t = expand(req.getType(), frame);
            if (t != null && !isAssignable(BOOL, t, frame)) {
                typeError("Requirement '" + req.getName() + "' of legal test '" + node.getName()
                        + "' must be bool, found '" + req.getType() + "'", req.getLocation());
            }
        }
        return null;
    }

    @Override
    public Void visitVariable(VariableDecl node, Scope scope) {
        checkTypeRef(node.getType(), scope);
        checkAssignable(node.getType(), node.getValue(), scope, "Value of '" + node.getName() + "'");
        return null;
    }

    // ============ 赋值与常量 ============

    private TypeRef infer(Expression expr, Scope scope) {
        return expr.accept(this, scope);
    }

    private void expectBool(Expression expr, Scope scope, String context) {
        TypeRef t = expand(infer(expr, scope), scope);
        if (t != null && !isAssignable(BOOL, t, scope)) {
            typeError(context + " must be bool, found '" + t + "'", expr.getLocation());
        }
    }

    /**
     * 检查表达式能否赋给期望类型；数值字面量按上下文定型，可确定的常量再做取值范围检查
     */
    private void checkAssignable(TypeRef expected, Expression expr, Scope scope, String context) {
        TypeRef actual = infer(expr, scope);
        TypeRef target = expand(expected, scope);
        if (target == null) return;
        Literal literal = numericLiteral(expr);
        if (literal != null) {
            if (!acceptsNumericLiteral(target, literal.getKind() == Literal.LiteralKind.INT, scope)) {
                typeError(context + ": expected '" + expected + "' but found " + literal.getKind().name().toLowerCase()
                        + " literal " + literal, expr.getLocation());
                return;
            }
        } else if (!isAssignable(target, expand(actual, scope), scope)) {
            typeError(context + ": expected '" + expected + "' but found '" + actual + "'", expr.getLocation());
            return;
        }
        BigDecimal value = constants.evaluate(valueExpr(expr));
        if (value != null) {
            checkRange(target, value, scope, context, expr.getLocation());
        }
    }

    private void checkRange(TypeRef type, BigDecimal value, Scope scope, String context, SourceLocation loc) {
        TypeRef t = expand(type, scope);
        if (t instanceof TemporalType) {
            checkRange(((TemporalType) t).getInner(), value, scope, context, loc);
        } else if (t instanceof BoundedIntType) {
            BoundedIntType b = (BoundedIntType) t;
            boolean integral = value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
            if (!integral || value.compareTo(BigDecimal.valueOf(b.getLow())) < 0
                    || value.compareTo(BigDecimal.valueOf(b.getHigh())) > 0) {
                report(CheckError.Kind.CONSTRAINT_VIOLATION, null,
                        context + ": value " + value.toPlainString() + " is outside " + b, loc);
            }
        } else if (t instanceof WrapperType && ((WrapperType) t).getKind() == WrapperType.Kind.POSITIVE) {
            if (value.signum() <= 0) {
                report(CheckError.Kind.CONSTRAINT_VIOLATION, null,
                        context + ": value " + value.toPlainString() + " is not positive", loc);
            }
            checkRange(((WrapperType) t).getInner(), value, scope, context, loc);
        } else if (t instanceof PrimitiveType && ((PrimitiveType) t).getKind() == PrimitiveType.Kind.PERCENT) {
            if (value.compareTo(percentMin) < 0 || value.compareTo(percentMax) > 0) {
                report(CheckError.Kind.CONSTRAINT_VIOLATION, null,
                        context + ": value " + value.toPlainString() + "% is outside the percent range "
                                + percentMin.toPlainString() + ".." + percentMax.toPlainString(), loc);
            }
        }
    }

    /** 块表达式取其结果表达式 */
    private static Expression valueExpr(Expression expr) {
        Expression e = expr;
        while (e instanceof BlockExpr) {
            e = ((BlockExpr) e).getResult();
        }
        return e;
    }

    /** 整数或浮点字面量（含取负），否则返回 null */
    private static Literal numericLiteral(Expression expr) {
        Expression e = valueExpr(expr);
        while (e instanceof UnaryExpr && ((UnaryExpr) e).getOperator() == UnaryExpr.UnaryOp.NEG) {
            e = ((UnaryExpr) e).getOperand();
        }
        if (e instanceof Literal) {
            Literal.LiteralKind kind = ((Literal) e).getKind();
            if (kind == Literal.LiteralKind.INT || kind == Literal.LiteralKind.FLOAT) {
                return (Literal) e;
            }
        }
        return null;
    }

    private boolean acceptsNumericLiteral(TypeRef type, boolean integral, Scope scope) {
        TypeRef t = expand(type, scope);
        if (t == null || isWildcard(t, scope)) return true;
        if (t instanceof MoneyType) return true;
        if (t instanceof BoundedIntType) return integral;
        if (t instanceof TemporalType) return acceptsNumericLiteral(((TemporalType) t).getInner(), integral, scope);
        if (t instanceof WrapperType && ((WrapperType) t).getKind() != WrapperType.Kind.ARRAY) {
            return acceptsNumericLiteral(((WrapperType) t).getInner(), integral, scope);
        }
        if (t instanceof UnionType) {
            for (TypeRef m : ((UnionType) t).getMembers()) {
                if (acceptsNumericLiteral(m, integral, scope)) return true;
            }
            return false;
        }
        if (t instanceof PrimitiveType) {
            switch (((PrimitiveType) t).getKind()) {
                case INT: return integral;
                case FLOAT:
                case PERCENT:
                case PASS:
                    return true;
                default:
                    return false;
            }
        }
        return false;
    }

    // ============ 类型比较 ============

    /**
     * 展开类型别名；别名成环时返回 null
     */
    private TypeRef expand(TypeRef type, Scope scope) {
        TypeRef cur = type;
        Set<String> seen = new HashSet<>();
        while (cur instanceof NamedType) {
            NamedType named = (NamedType) cur;
            Symbol s = scope.resolveType(named.getName());
            if (s == null || s.getKind() != SymbolKind.TYPE_ALIAS) {
                return cur;
            }
            if (!seen.add(named.getName()) || seen.size() > MAX_ALIAS_DEPTH) {
                return null;
            }
            TypeAliasDecl alias = (TypeAliasDecl) s.getDeclaration();
            cur = new TypeSubstitutor(bind(alias.getTypeParams(), named.getTypeArgs())).apply(alias.getTarget());
        }
        return cur;
    }

    private static Map<String, TypeRef> bind(List<String> params, List<TypeRef> args) {
        Map<String, TypeRef> bindings = new HashMap<>();
        for (int i = 0; i < params.size(); i++) {
            bindings.put(params.get(i), i < args.size() ? args.get(i) : PASS);
        }
        return bindings;
    }

    private static boolean isPass(TypeRef t) {
        return t instanceof PrimitiveType && ((PrimitiveType) t).getKind() == PrimitiveType.Kind.PASS;
    }

    /** pass、类型参数与未定义的类型名与任何类型相容 */
    private boolean isWildcard(TypeRef t, Scope scope) {
        if (isPass(t)) return true;
        if (t instanceof NamedType) {
            Symbol s = scope.resolveType(((NamedType) t).getName());
            return s == null || s.getKind() == SymbolKind.TYPE_PARAMETER;
        }
        return false;
    }

    /**
     * 判断 source 能否赋给 target（两者均已展开别名）
     */
    boolean isAssignable(TypeRef target, TypeRef source, Scope scope) {
        if (target == null || source == null) return true;
        if (isWildcard(target, scope) || isWildcard(source, scope)) return true;
        if (target.equals(source)) return true;

        if (source instanceof UnionType) {
            for (TypeRef m : ((UnionType) source).getMembers()) {
                if (!isAssignable(target, expand(m, scope), scope)) return false;
            }
            return true;
        }
        if (target instanceof UnionType) {
            for (TypeRef m : ((UnionType) target).getMembers()) {
                if (isAssignable(expand(m, scope), source, scope)) return true;
            }
            return false;
        }
        if (target instanceof WrapperType && ((WrapperType) target).getKind() != WrapperType.Kind.ARRAY) {
            return isAssignable(expand(((WrapperType) target).getInner(), scope), source, scope);
        }
        if (source instanceof WrapperType && ((WrapperType) source).getKind() != WrapperType.Kind.ARRAY) {
            return isAssignable(target, expand(((WrapperType) source).getInner(), scope), scope);
        }
        if (target instanceof TemporalType) {
            return isAssignable(expand(((TemporalType) target).getInner(), scope), source, scope);
        }
        if (source instanceof TemporalType) {
            return isAssignable(target, expand(((TemporalType) source).getInner(), scope), scope);
        }
        if (target instanceof WrapperType && source instanceof WrapperType) {
            return isAssignable(expand(((WrapperType) target).getInner(), scope),
                    expand(((WrapperType) source).getInner(), scope), scope);
        }
        if (target instanceof MoneyType && source instanceof MoneyType) {
            String a = ((MoneyType) target).getCurrency();
            String b = ((MoneyType) source).getCurrency();
            return a == null || b == null || a.equals(b);
        }
        Category tc = categoryOf(target);
        Category sc = categoryOf(source);
        if (target instanceof BoundedIntType) return sc == Category.INT;
        if (tc == Category.INT) return sc == Category.INT;
        if (tc == Category.FLOAT) return sc == Category.INT;
        if (target instanceof NamedType && source instanceof NamedType) {
            NamedType a = (NamedType) target;
            NamedType b = (NamedType) source;
            if (!a.getName().equals(b.getName())) return false;
            if (!a.isGeneric() || !b.isGeneric()) return true;
            if (a.getTypeArgs().size() != b.getTypeArgs().size()) return false;
            for (int i = 0; i < a.getTypeArgs().size(); i++) {
                if (!isAssignable(expand(a.getTypeArgs().get(i), scope), expand(b.getTypeArgs().get(i), scope), scope)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    private boolean isBool(TypeRef t, Scope scope) {
        return t != null && isAssignable(BOOL, t, scope);
    }

    /** 运算用的类型类别；BoundedInt 归入 INT，精化与时效包装取内层 */
    private enum Category { INT, FLOAT, PERCENT, MONEY, DATE, DURATION, STRING, BOOL, PASS, OTHER }

    private static Category categoryOf(TypeRef t) {
        if (t instanceof BoundedIntType) return Category.INT;
        if (t instanceof MoneyType) return Category.MONEY;
        if (t instanceof PrimitiveType) {
            switch (((PrimitiveType) t).getKind()) {
                case INT: return Category.INT;
                case FLOAT: return Category.FLOAT;
                case PERCENT: return Category.PERCENT;
                case DATE: return Category.DATE;
                case DURATION: return Category.DURATION;
                case STRING: return Category.STRING;
                case BOOL: return Category.BOOL;
                case PASS: return Category.PASS;
                default: return Category.OTHER;
            }
        }
        return Category.OTHER;
    }

    private static boolean isPlainNumber(Category c) {
        return c == Category.INT || c == Category.FLOAT || c == Category.PERCENT;
    }

    /** 去掉 Positive / NonEmpty / Temporal 包装并展开别名 */
    private TypeRef base(TypeRef type, Scope scope) {
        TypeRef t = expand(type, scope);
        while (true) {
            if (t instanceof TemporalType) {
                t = expand(((TemporalType) t).getInner(), scope);
            } else if (t instanceof WrapperType && ((WrapperType) t).getKind() != WrapperType.Kind.ARRAY) {
                t = expand(((WrapperType) t).getInner(), scope);
            } else {
                return t;
            }
        }
    }

    // ============ 类型引用检查 ============

    private void checkTypeRef(TypeRef type, Scope scope) {
        if (type != null) {
            type.accept(new TypeRefChecker(scope));
        }
    }

    private final class TypeRefChecker implements TypeRefVisitor<Void> {
        private final Scope scope;

        TypeRefChecker(Scope scope) {
            this.scope = scope;
        }

        @Override
        public Void visitPrimitive(PrimitiveType type) {
            return null;
        }

        @Override
        public Void visitMoney(MoneyType type) {
            return null;
        }

        @Override
        public Void visitBoundedInt(BoundedIntType type) {
            if (type.getLow() > type.getHigh()) {
                typeError("BoundedInt lower bound " + type.getLow() + " exceeds upper bound " + type.getHigh(),
                        type.getLocation());
            }
            return null;
        }

        @Override
        public Void visitTemporal(TemporalType type) {
            return type.getInner().accept(this);
        }

        @Override
        public Void visitCitation(CitationType type) {
            String problem = CitationValidator.validate(type);
            if (problem != null) {
                report(CheckError.Kind.INVALID_CITATION, type.getSection(), problem, type.getLocation());
            }
            return null;
        }

        @Override
        public Void visitUnion(UnionType type) {
            for (TypeRef member : type.getMembers()) {
                member.accept(this);
            }
            return null;
        }

        @Override
        public Void visitRecord(RecordType type) {
            Set<String> names = new HashSet<>();
            for (FieldDecl field : type.getFields()) {
                if (!names.add(field.getName())) {
                    report(CheckError.Kind.DUPLICATE_DEFINITION, field.getName(),
                            "Duplicate field '" + field.getName() + "' in record type", field.getLocation());
                }
                checkField(field, scope);
            }
            return null;
        }

        @Override
        public Void visitNamed(NamedType type) {
            Symbol s = scope.resolveType(type.getName());
            if (s == null) {
                report(CheckError.Kind.UNDEFINED_SYMBOL, type.getName(),
                        "Undefined type '" + type.getName() + "'", type.getLocation());
            } else {
                int expected = declaredTypeParams(s).size();
                int actual = type.getTypeArgs().size();
                if (expected != actual) {
                    typeError("Type '" + type.getName() + "' expects " + expected
                            + " type argument(s) but got " + actual, type.getLocation());
                }
            }
            for (TypeRef arg : type.getTypeArgs()) {
                arg.accept(this);
            }
            return null;
        }

        @Override
        public Void visitWrapper(WrapperType type) {
            type.getInner().accept(this);
            if (type.getKind() == WrapperType.Kind.POSITIVE) {
                TypeRef inner = base(type.getInner(), scope);
                Category c = categoryOf(inner);
                boolean numeric = isPlainNumber(c) || c == Category.MONEY || c == Category.DURATION;
                if (inner != null && !numeric && !isWildcard(inner, scope)) {
                    typeError("Positive requires a numeric type, found '" + type.getInner() + "'", type.getLocation());
                }
            }
            return null;
        }
    }

    private static List<String> declaredTypeParams(Symbol s) {
        if (s.getKind() == SymbolKind.STRUCT) {
            return ((StructDecl) s.getDeclaration()).getTypeParams();
        }
        if (s.getKind() == SymbolKind.TYPE_ALIAS) {
            return ((TypeAliasDecl) s.getDeclaration()).getTypeParams();
        }
        return Collections.emptyList();
    }

    // ============ 表达式 ============

    /** 值符号的类型；非值符号报告类型错误 */
    private TypeRef valueType(Symbol s, String name, SourceLocation use) {
        switch (s.getKind()) {
            case VARIABLE:
            case PARAMETER:
            case FIELD:
            case REQUIREMENT:
            case QUANTIFIED:
                return s.getType();
            case ENUM_VARIANT:
                return new NamedType(use, ((EnumDecl) s.getDeclaration()).getName());
            default:
                typeError("'" + name + "' is a " + s.getKind().name().toLowerCase().replace('_', ' ')
                        + ", not a value", use);
                return null;
        }
    }

    @Override
    public TypeRef visitIdentifier(Identifier node, Scope scope) {
        Symbol s = program.getBinding(node);
        if (s == null) return null;
        return valueType(s, node.getName(), node.getLocation());
    }

    @Override
    public TypeRef visitLiteral(Literal node, Scope scope) {
        SourceLocation loc = node.getLocation();
        switch (node.getKind()) {
            case INT: return new PrimitiveType(loc, PrimitiveType.Kind.INT);
            case FLOAT: return new PrimitiveType(loc, PrimitiveType.Kind.FLOAT);
            case STRING: return new PrimitiveType(loc, PrimitiveType.Kind.STRING);
            case BOOLEAN: return new PrimitiveType(loc, PrimitiveType.Kind.BOOL);
            case PERCENT: return new PrimitiveType(loc, PrimitiveType.Kind.PERCENT);
            case DATE: return new PrimitiveType(loc, PrimitiveType.Kind.DATE);
            case DURATION: return new PrimitiveType(loc, PrimitiveType.Kind.DURATION);
            case MONEY: return new MoneyType(loc, ((MoneyValue) node.getValue()).getCurrency());
            default: return null;
        }
    }

    @Override
    public TypeRef visitBinary(BinaryExpr node, Scope scope) {
        BinaryExpr.BinaryOp op = node.getOperator();
        TypeRef left = infer(node.getLeft(), scope);
        TypeRef right = infer(node.getRight(), scope);

        if (op.isLogical()) {
            expectOperandBool(left, op, node.getLeft(), scope);
            expectOperandBool(right, op, node.getRight(), scope);
            return BOOL;
        }

        TypeRef l = base(left, scope);
        TypeRef r = base(right, scope);
        if (l == null || r == null) {
            return op.isArithmetic() ? null : BOOL;
        }

        // 数值字面量按另一侧定型；乘除取模时字面量保持原类型
        boolean scaling = op == BinaryExpr.BinaryOp.MUL || op == BinaryExpr.BinaryOp.DIV
                || op == BinaryExpr.BinaryOp.MOD;
        if (!scaling) {
            Literal ll = numericLiteral(node.getLeft());
            Literal rl = numericLiteral(node.getRight());
            if (ll != null && rl == null && acceptsNumericLiteral(r, ll.getKind() == Literal.LiteralKind.INT, scope)) {
                l = r;
            } else if (rl != null && ll == null && acceptsNumericLiteral(l, rl.getKind() == Literal.LiteralKind.INT, scope)) {
                r = l;
            }
        }

        if (op.isEquality()) {
            if (!isAssignable(l, r, scope) && !isAssignable(r, l, scope)) {
                typeError("Cannot compare '" + left + "' with '" + right + "'", node.getLocation());
            }
            return BOOL;
        }
        if (op.isRelational()) {
            if (!isOrdered(l, r, scope)) {
                typeError("Operator '" + op.getSymbol() + "' cannot be applied to '" + left
                        + "' and '" + right + "'", node.getLocation());
            }
            return BOOL;
        }
        TypeRef result = arithmeticResult(op, l, r, scope);
        if (result == null) {
            typeError("Operator '" + op.getSymbol() + "' cannot be applied to '" + left
                    + "' and '" + right + "'", node.getLocation());
        }
        return result;
    }

    private void expectOperandBool(TypeRef t, BinaryExpr.BinaryOp op, Expression operand, Scope scope) {
        TypeRef e = expand(t, scope);
        if (e != null && !isBool(e, scope)) {
            typeError("Operator '" + op.getSymbol() + "' requires bool operands, found '" + t + "'",
                    operand.getLocation());
        }
    }

    private boolean isOrdered(TypeRef l, TypeRef r, Scope scope) {
        if (isWildcard(l, scope) || isWildcard(r, scope)) return true;
        Category a = categoryOf(l);
        Category b = categoryOf(r);
        if (isPlainNumber(a) && isPlainNumber(b)) return true;
        return a == b && (a == Category.MONEY || a == Category.DATE
                || a == Category.DURATION || a == Category.STRING);
    }

    private TypeRef arithmeticResult(BinaryExpr.BinaryOp op, TypeRef l, TypeRef r, Scope scope) {
        if (isWildcard(l, scope)) return r;
        if (isWildcard(r, scope)) return l;
        Category a = categoryOf(l);
        Category b = categoryOf(r);
        boolean additive = op == BinaryExpr.BinaryOp.ADD || op == BinaryExpr.BinaryOp.SUB;

        if (isPlainNumber(a) && isPlainNumber(b)) {
            if (a == Category.INT && b == Category.INT) return INT;
            if (op == BinaryExpr.BinaryOp.MOD) return null;
            if (a == Category.PERCENT && b == Category.PERCENT && additive) return l;
            return FLOAT;
        }
        if (a == Category.MONEY && b == Category.MONEY) {
            if (additive) return isAssignable(l, r, scope) ? l : null;
            return op == BinaryExpr.BinaryOp.DIV ? FLOAT : null;
        }
        if (a == Category.MONEY && isPlainNumber(b)) {
            return op == BinaryExpr.BinaryOp.MUL || op == BinaryExpr.BinaryOp.DIV ? l : null;
        }
        if (isPlainNumber(a) && b == Category.MONEY) {
            return op == BinaryExpr.BinaryOp.MUL ? r : null;
        }
        if (a == Category.DATE && b == Category.DURATION && additive) return l;
        if (a == Category.DURATION && b == Category.DATE && op == BinaryExpr.BinaryOp.ADD) return r;
        if (a == Category.DATE && b == Category.DATE && op == BinaryExpr.BinaryOp.SUB) {
            return PrimitiveType.of(PrimitiveType.Kind.DURATION);
        }
        if (a == Category.DURATION && b == Category.DURATION && additive) return l;
        if (a == Category.DURATION && b == Category.INT && op == BinaryExpr.BinaryOp.MUL) return l;
        if (a == Category.STRING && b == Category.STRING && op == BinaryExpr.BinaryOp.ADD) return l;
        return null;
    }

    @Override
    public TypeRef visitUnary(UnaryExpr node, Scope scope) {
        TypeRef t = infer(node.getOperand(), scope);
        if (node.getOperator() == UnaryExpr.UnaryOp.NOT) {
            TypeRef e = expand(t, scope);
            if (e != null && !isBool(e, scope)) {
                typeError("Operator '!' requires a bool operand, found '" + t + "'", node.getLocation());
            }
            return BOOL;
        }
        TypeRef b = base(t, scope);
        if (b == null || isWildcard(b, scope)) return t;
        Category c = categoryOf(b);
        if (!isPlainNumber(c) && c != Category.MONEY && c != Category.DURATION) {
            typeError("Operator '-' cannot be applied to '" + t + "'", node.getLocation());
            return null;
        }
        return b;
    }

    @Override
    public TypeRef visitCall(CallExpr node, Scope scope) {
        String name = node.getCallee().getName();
        Symbol s = program.getBinding(node.getCallee());
        if (s == null || s.getKind() != SymbolKind.FUNCTION) {
            if (s != null) {
                typeError("'" + name + "' is not a function", node.getCallee().getLocation());
            }
            for (Expression arg : node.getArguments()) {
                infer(arg, scope);
            }
            return null;
        }

        FunctionDecl fn = (FunctionDecl) s.getDeclaration();
        // 函数自身的类型参数在调用处视为通配
        TypeSubstitutor generic = new TypeSubstitutor(bind(fn.getTypeParams(), Collections.<TypeRef>emptyList()));
        List<Parameter> params = fn.getParams();
        List<Expression> args = node.getArguments();
        if (params.size() != args.size()) {
            typeError("Function '" + name + "' expects " + params.size() + " argument(s) but got " + args.size(),
                    node.getLocation());
            for (Expression arg : args) {
                infer(arg, scope);
            }
        } else {
            for (int i = 0; i < args.size(); i++) {
                Parameter p = params.get(i);
                checkAssignable(generic.apply(p.getType()), args.get(i), scope,
                        "Argument '" + p.getName() + "' of '" + name + "'");
            }
        }
        return generic.apply(fn.getReturnType());
    }

    /**
     * 限定名前缀对应的符号：标识符或 scope 成员访问链，其它表达式返回 null
     */
    private Symbol qualifiedSymbol(Expression expr) {
        if (expr instanceof Identifier) {
            return program.getBinding((Identifier) expr);
        }
        if (expr instanceof FieldAccessExpr) {
            FieldAccessExpr access = (FieldAccessExpr) expr;
            Symbol owner = qualifiedSymbol(access.getTarget());
            if (owner != null && owner.getKind() == SymbolKind.SCOPE) {
                Scope frame = program.getFrame(owner.getDeclaration());
                return frame != null ? frame.resolveLocal(access.getFieldName()) : null;
            }
        }
        return null;
    }

    @Override
    public TypeRef visitFieldAccess(FieldAccessExpr node, Scope scope) {
        String field = node.getFieldName();
        Symbol owner = qualifiedSymbol(node.getTarget());
        if (owner != null && owner.getKind() == SymbolKind.ENUM) {
            EnumDecl e = (EnumDecl) owner.getDeclaration();
            if (!e.getVariantNames().contains(field)) {
                typeError("Enum '" + e.getName() + "' has no variant '" + field + "'", node.getLocation());
            }
            return new NamedType(node.getLocation(), e.getName());
        }
        if (owner != null && owner.getKind() == SymbolKind.SCOPE) {
            Scope frame = program.getFrame(owner.getDeclaration());
            Symbol member = frame != null ? frame.resolveLocal(field) : null;
            if (member == null) {
                report(CheckError.Kind.UNDEFINED_SYMBOL, field,
                        "Scope '" + owner.getName() + "' has no member '" + field + "'", node.getLocation());
                return null;
            }
            if (member.getKind() == SymbolKind.SCOPE || member.getKind() == SymbolKind.ENUM) {
                return null;
            }
            return valueType(member, field, node.getLocation());
        }

        TypeRef t = base(infer(node.getTarget(), scope), scope);
        if (t == null || isWildcard(t, scope)) return null;
        if (t instanceof RecordType) {
            FieldDecl f = ((RecordType) t).findField(field);
            if (f == null) {
                typeError("Record type has no field '" + field + "'", node.getLocation());
                return null;
            }
            return f.getType();
        }
        if (t instanceof NamedType) {
            NamedType named = (NamedType) t;
            Symbol s = scope.resolveType(named.getName());
            if (s != null && s.getKind() == SymbolKind.STRUCT) {
                StructDecl decl = (StructDecl) s.getDeclaration();
                StructLayout layout = layouts.get(decl);
                StructLayout.LayoutField f = layout != null ? layout.findField(field) : null;
                if (f == null) {
                    typeError("Struct '" + decl.getName() + "' has no field '" + field + "'", node.getLocation());
                    return null;
                }
                return new TypeSubstitutor(bind(decl.getTypeParams(), named.getTypeArgs()))
                        .apply(f.getDecl().getType());
            }
        }
        typeError("Type '" + t + "' has no field '" + field + "'", node.getLocation());
        return null;
    }

    @Override
    public TypeRef visitStructInit(StructInitExpr node, Scope scope) {
        String name = node.getStructName();
        Symbol s = scope.resolveType(name);
        if (s == null || s.getKind() != SymbolKind.STRUCT) {
            if (s == null) {
                report(CheckError.Kind.UNDEFINED_SYMBOL, name, "Undefined struct '" + name + "'", node.getLocation());
            } else {
                typeError("'" + name + "' is not a struct", node.getLocation());
            }
            for (StructInitExpr.FieldInit init : node.getFields()) {
                infer(init.getValue(), scope);
            }
            return null;
        }

        StructDecl decl = (StructDecl) s.getDeclaration();
        if (!node.getTypeArgs().isEmpty() && node.getTypeArgs().size() != decl.getTypeParams().size()) {
            typeError("Type '" + name + "' expects " + decl.getTypeParams().size()
                    + " type argument(s) but got " + node.getTypeArgs().size(), node.getLocation());
        }
        TypeSubstitutor subst = new TypeSubstitutor(bind(decl.getTypeParams(), node.getTypeArgs()));
        StructLayout layout = layouts.get(decl);

        Set<String> given = new HashSet<>();
        for (StructInitExpr.FieldInit init : node.getFields()) {
            if (!given.add(init.getName())) {
                report(CheckError.Kind.DUPLICATE_DEFINITION, init.getName(),
                        "Field '" + init.getName() + "' is initialised twice", init.getLocation());
            }
            StructLayout.LayoutField f = layout != null ? layout.findField(init.getName()) : null;
            if (f == null) {
                typeError("Struct '" + name + "' has no field '" + init.getName() + "'", init.getLocation());
                infer(init.getValue(), scope);
            } else {
                checkAssignable(subst.apply(f.getDecl().getType()), init.getValue(), scope,
                        "Field '" + init.getName() + "' of '" + name + "'");
            }
        }
        if (layout != null) {
            for (String field : new LinkedHashSet<>(layout.getFieldNames())) {
                if (!given.contains(field)) {
                    typeError("Missing field '" + field + "' in initialisation of '" + name + "'", node.getLocation());
                }
            }
        }
        return new NamedType(node.getLocation(), name, node.getTypeArgs());
    }

    @Override
    public TypeRef visitMatch(MatchExpr node, Scope scope) {
        TypeRef scrutinee = base(infer(node.getScrutinee(), scope), scope);
        EnumDecl enumDecl = enumOf(scrutinee, scope);
        boolean boolScrutinee = scrutinee != null && categoryOf(scrutinee) == Category.BOOL;

        boolean wildcardSeen = false;
        Set<String> covered = new HashSet<>();
        TypeRef resultType = null;
        PatternChecker patterns = new PatternChecker(scrutinee, enumDecl, scope);

        for (MatchArm arm : node.getArms()) {
            if (wildcardSeen) {
                report(CheckError.Kind.UNREACHABLE_PATTERN, null,
                        "Unreachable match arm after wildcard pattern", arm.getLocation());
            }
            String key = arm.getPattern().accept(patterns);
            if (arm.hasGuard()) {
                expectBool(arm.getGuard(), scope, "Match guard");
            } else if (arm.getPattern() instanceof WildcardPattern) {
                wildcardSeen = true;
            } else if (key != null && !covered.add(key) && !wildcardSeen) {
                report(CheckError.Kind.UNREACHABLE_PATTERN, key,
                        "Pattern '" + key + "' is already covered by an earlier arm", arm.getLocation());
            }

            TypeRef r = infer(arm.getResult(), scope);
            if (r == null || isPass(r)) continue;
            if (numericLiteral(arm.getResult()) != null) {
                if (resultType != null && !acceptsNumericLiteral(resultType, isIntLiteral(arm.getResult()), scope)) {
                    typeError("Match arm result '" + arm.getResult() + "' does not match '" + resultType + "'",
                            arm.getResult().getLocation());
                }
                continue;
            }
            if (resultType == null) {
                resultType = r;
            } else if (!isAssignable(expand(resultType, scope), expand(r, scope), scope)
                    && !isAssignable(expand(r, scope), expand(resultType, scope), scope)) {
                typeError("Match arm result type '" + r + "' does not match '" + resultType + "'",
                        arm.getResult().getLocation());
            }
        }

        boolean exhaustive = wildcardSeen
                || (enumDecl != null && covered.containsAll(enumDecl.getVariantNames()))
                || (boolScrutinee && covered.contains("true") && covered.contains("false"));
        if (!exhaustive) {
            String detail = "";
            if (enumDecl != null) {
                List<String> missing = new ArrayList<>(enumDecl.getVariantNames());
                missing.removeAll(covered);
                detail = ": missing " + String.join(", ", missing);
            }
            report(CheckError.Kind.NON_EXHAUSTIVE_MATCH, null,
                    "Match on '" + (scrutinee != null ? scrutinee : node.getScrutinee()) + "' is not exhaustive" + detail,
                    node.getLocation());
        }
        // 结果全为数值字面量时返回 null，由上下文定型
        return resultType;
    }

    private static boolean isIntLiteral(Expression expr) {
        Literal l = numericLiteral(expr);
        return l != null && l.getKind() == Literal.LiteralKind.INT;
    }

    private EnumDecl enumOf(TypeRef t, Scope scope) {
        if (t instanceof NamedType) {
            Symbol s = scope.resolveType(((NamedType) t).getName());
            if (s != null && s.getKind() == SymbolKind.ENUM) {
                return (EnumDecl) s.getDeclaration();
            }
        }
        return null;
    }

    /**
     * 模式检查；返回用于穷尽性统计的键（枚举成员名或布尔字面量），不参与统计时返回 null
     */
    private final class PatternChecker implements PatternVisitor<String> {
        private final TypeRef scrutinee;
        private final EnumDecl enumDecl;
        private final Scope scope;

        PatternChecker(TypeRef scrutinee, EnumDecl enumDecl, Scope scope) {
            this.scrutinee = scrutinee;
            this.enumDecl = enumDecl;
            this.scope = scope;
        }

        @Override
        public String visitLiteral(LiteralPattern pattern) {
            Literal lit = pattern.getLiteral();
            if (scrutinee != null) {
                boolean ok;
                if (lit.getKind() == Literal.LiteralKind.INT || lit.getKind() == Literal.LiteralKind.FLOAT) {
                    ok = acceptsNumericLiteral(scrutinee, lit.getKind() == Literal.LiteralKind.INT, scope);
                } else {
                    ok = isAssignable(scrutinee, Checker.this.visitLiteral(lit, scope), scope);
                }
                if (!ok) {
                    typeError("Pattern " + lit + " cannot match a value of type '" + scrutinee + "'",
                            pattern.getLocation());
                }
            }
            return lit.toString();
        }

        @Override
        public String visitWildcard(WildcardPattern pattern) {
            return null;
        }

        @Override
        public String visitVariant(VariantPattern pattern) {
            String variant = pattern.getVariant();
            EnumDecl target;
            if (pattern.getEnumName() != null) {
                Symbol s = scope.resolveType(pattern.getEnumName());
                if (s == null || s.getKind() != SymbolKind.ENUM) {
                    report(CheckError.Kind.UNDEFINED_SYMBOL, pattern.getEnumName(),
                            "Undefined enum '" + pattern.getEnumName() + "'", pattern.getLocation());
                    return null;
                }
                target = (EnumDecl) s.getDeclaration();
            } else if (enumDecl != null) {
                target = enumDecl;
            } else {
                List<Symbol> candidates = scope.variantCandidates(variant);
                if (candidates.size() > 1) {
                    reportAmbiguous(variant, candidates, pattern.getLocation());
                    return null;
                }
                Symbol v = scope.resolveVariant(variant);
                if (v == null) {
                    report(CheckError.Kind.UNDEFINED_SYMBOL, variant,
                            "Undefined enum variant '" + variant + "'", pattern.getLocation());
                    return null;
                }
                target = (EnumDecl) v.getDeclaration();
            }
            if (!target.getVariantNames().contains(variant)) {
                typeError("Enum '" + target.getName() + "' has no variant '" + variant + "'", pattern.getLocation());
                return null;
            }
            if (scrutinee != null && !isAssignable(scrutinee, new NamedType(pattern.getLocation(), target.getName()), scope)) {
                typeError("Pattern '" + target.getName() + "." + variant + "' cannot match a value of type '"
                        + scrutinee + "'", pattern.getLocation());
            }
            return variant;
        }

        @Override
        public String visitSatisfies(SatisfiesPattern pattern) {
            Symbol s = scope.resolve(pattern.getTestName());
            if (s == null) {
                report(CheckError.Kind.UNDEFINED_SYMBOL, pattern.getTestName(),
                        "Undefined legal test '" + pattern.getTestName() + "'", pattern.getLocation());
            } else if (s.getKind() != SymbolKind.LEGAL_TEST) {
                typeError("'" + pattern.getTestName() + "' is not a legal test", pattern.getLocation());
            }
            return null;
        }
    }

    @Override
    public TypeRef visitForall(ForallExpr node, Scope scope) {
        return visitQuantifier(node, scope);
    }

    @Override
    public TypeRef visitExists(ExistsExpr node, Scope scope) {
        return visitQuantifier(node, scope);
    }

    private TypeRef visitQuantifier(QuantifierExpr node, Scope scope) {
        checkTypeRef(node.getVariableType(), scope);
        Scope frame = program.getFrame(node);
        String what = node.getKind() == QuantifierExpr.Kind.FORALL ? "forall" : "exists";
        if (node.getGuard() != null) {
            expectBool(node.getGuard(), frame, "Guard of " + what + " " + node.getVariable());
        }
        expectBool(node.getBody(), frame, "Body of " + what + " " + node.getVariable());
        return BOOL;
    }

    @Override
    public TypeRef visitBlock(BlockExpr node, Scope scope) {
        Scope frame = program.getFrame(node);
        for (VariableDecl local : node.getDeclarations()) {
            visitVariable(local, frame);
        }
        return infer(node.getResult(), frame);
    }

    @Override
    public TypeRef visitPass(PassExpr node, Scope scope) {
        return PASS;
    }
}
