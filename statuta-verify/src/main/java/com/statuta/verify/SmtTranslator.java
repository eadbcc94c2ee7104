package com.statuta.verify;

import com.statuta.compiler.analysis.ConstantEvaluator;
import com.statuta.compiler.analysis.ResolvedProgram;
import com.statuta.compiler.analysis.Scope;
import com.statuta.compiler.analysis.Symbol;
import com.statuta.compiler.analysis.SymbolKind;
import com.statuta.compiler.ast.ExprVisitor;
import com.statuta.compiler.ast.SourceLocation;
import com.statuta.compiler.ast.expr.*;
import com.statuta.compiler.ast.item.EnumDecl;
import com.statuta.compiler.ast.item.TypeAliasDecl;
import com.statuta.compiler.ast.item.VariableDecl;
import com.statuta.compiler.ast.pattern.*;
import com.statuta.compiler.ast.type.*;
import com.statuta.compiler.lexer.MoneyValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Period;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 表达式到 SMT-LIB 的翻译
 *
 * <p>排序对应关系：int、BoundedInt、金额（分）、日期（纪元日）、时长（天）与枚举（成员下标）
 * 都是 Int；float 与 percent 是 Real。BoundedInt 与枚举的取值范围总是加入断言，
 * 金额、百分比和时长的范围由 {@link DomainPolicy} 决定。Int 与 Real 混合运算时整数一侧用
 * {@code to_real} 提升。</p>
 *
 * <p>量词的极性规则不在这里处理，见 {@link QuantifierPolarity}；这里遇到的量词都按
 * SMT-LIB 的 {@code forall}/{@code exists} 绑定原样输出。</p>
 */
public final class SmtTranslator {

    private static final int MAX_ALIAS_DEPTH = 32;

    // 时长折算为天数
    private static final int DAYS_PER_YEAR = 365;
    private static final int DAYS_PER_MONTH = 30;

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd-MM-uuuu");

    /** 与 SMT-LIB 关键字或内建函数重名的标识符需要加竖线引用 */
    private static final Set<String> RESERVED = new HashSet<>(Arrays.asList(
            "and", "or", "not", "xor", "ite", "let", "distinct", "div", "mod", "abs",
            "to_real", "to_int", "is_int", "par", "as", "select", "store", "assert", "declare-const"));

    private final ResolvedProgram program;
    private final DomainPolicy policy;
    private final ConstantEvaluator constants;

    public SmtTranslator(ResolvedProgram program, DomainPolicy policy) {
        this.program = program;
        this.policy = policy;
        this.constants = new ConstantEvaluator(program);
    }

    public ResolvedProgram getProgram() {
        return program;
    }

    public DomainPolicy getPolicy() {
        return policy;
    }

    // ============ 变量绑定 ============

    /** 取值在报告中的呈现方式 */
    public enum ValueKind {
        PLAIN,
        MONEY,
        PERCENT,
        DATE,
        DURATION,
        ENUM
    }

    /**
     * 量词变量在查询中的绑定：源码名、查询中的符号、排序与值域断言
     */
    public static final class Binding {
        private final String sourceName;
        private final String smtName;
        private final TypeRef type;
        private final SmtSort sort;
        private final List<String> domain;
        private final ValueKind valueKind;
        private final EnumDecl enumDecl;
        private final Scope frame;

        Binding(String sourceName, String smtName, TypeRef type, SmtSort sort, List<String> domain,
                ValueKind valueKind, EnumDecl enumDecl, Scope frame) {
            this.sourceName = sourceName;
            this.smtName = smtName;
            this.type = type;
            this.sort = sort;
            this.domain = Collections.unmodifiableList(domain);
            this.valueKind = valueKind;
            this.enumDecl = enumDecl;
            this.frame = frame;
        }

        public String getSourceName() { return sourceName; }
        public String getSmtName() { return smtName; }
        public TypeRef getType() { return type; }
        public SmtSort getSort() { return sort; }

        /** 值域断言，每条都是 Bool 项 */
        public List<String> getDomain() { return domain; }

        public ValueKind getValueKind() { return valueKind; }

        /** 变量类型为枚举时的声明，否则为 null */
        public EnumDecl getEnumDecl() { return enumDecl; }

        /** 量词打开的作用域帧 */
        public Scope getFrame() { return frame; }

        /** 该变量在项中的计量单位 */
        public SmtTerm.Unit getUnit() {
            switch (valueKind) {
                case MONEY: return SmtTerm.Unit.MONEY;
                case PERCENT: return SmtTerm.Unit.PERCENT;
                default: return SmtTerm.Unit.PLAIN;
            }
        }

        /** 声明语句 */
        public String declaration() {
            return "(declare-const " + smtName + " " + sort.getSmtName() + ")";
        }

        @Override
        public String toString() {
            return sourceName + " -> " + smtName + " : " + sort.getSmtName();
        }
    }

    /**
     * 翻译环境：源码变量名到绑定，内层绑定遮蔽外层；另记录名字查找所在的作用域帧
     */
    public static final class Env {
        private static final Env EMPTY = new Env(Collections.<String, Binding>emptyMap(), null);

        private final Map<String, Binding> bindings;
        private final Scope scope;

        private Env(Map<String, Binding> bindings, Scope scope) {
            this.bindings = bindings;
            this.scope = scope;
        }

        public static Env empty() {
            return EMPTY;
        }

        /** 在给定作用域帧内查找名字的空环境；null 表示顶层 */
        public static Env in(Scope scope) {
            return scope == null ? EMPTY : new Env(Collections.<String, Binding>emptyMap(), scope);
        }

        public Env with(Binding binding) {
            Map<String, Binding> copy = new HashMap<>(bindings);
            copy.put(binding.getSourceName(), binding);
            return new Env(copy, binding.getFrame() != null ? binding.getFrame() : scope);
        }

        /** 名字查找所在的作用域帧，顶层为 null */
        public Scope getScope() {
            return scope;
        }

        public Binding lookup(String name) {
            return bindings.get(name);
        }
    }

    /**
     * 为量词变量建立绑定；变量类型在量词所在作用域中解析
     *
     * @param smtName 查询中使用的符号，调用方负责避免重名
     */
    public Binding bind(QuantifierExpr quantifier, String smtName) {
        Scope scope = program.getFrame(quantifier);
        if (scope == null) {
            scope = program.getGlobalScope();
        }
        DomainCollector collector = new DomainCollector(quantifier.getVariable(), smtName, scope,
                quantifier.getLocation());
        SmtSort sort = quantifier.getVariableType().accept(collector);
        return new Binding(quantifier.getVariable(), smtName, quantifier.getVariableType(), sort,
                collector.assertions, collector.valueKind, collector.enumDecl, program.getFrame(quantifier));
    }

    /** 标识符在查询中的写法 */
    public static String symbol(String name) {
        return RESERVED.contains(name) ? "|" + name + "|" : name;
    }

    /**
     * 按量词变量的类型收集排序与值域断言
     */
    private final class DomainCollector implements TypeRefVisitor<SmtSort> {
        private final String variable;
        private final String smtName;
        private final SourceLocation location;
        private Scope scope;
        private int aliasDepth;

        final List<String> assertions = new ArrayList<>();
        ValueKind valueKind = ValueKind.PLAIN;
        EnumDecl enumDecl;

        DomainCollector(String variable, String smtName, Scope scope, SourceLocation location) {
            this.variable = variable;
            this.smtName = smtName;
            this.scope = scope;
            this.location = location;
        }

        private TranslationException unsupported(TypeRef type) {
            return new TranslationException("Quantifier variable '" + variable + "' has type '" + type
                    + "' which has no solver encoding", location);
        }

        @Override
        public SmtSort visitPrimitive(PrimitiveType type) {
            switch (type.getKind()) {
                case INT:
                    return SmtSort.INT;
                case FLOAT:
                    return SmtSort.REAL;
                case BOOL:
                    return SmtSort.BOOL;
                case STRING:
                    return SmtSort.STRING;
                case PERCENT:
                    valueKind = ValueKind.PERCENT;
                    if (policy.getPercentMin() != null) {
                        assertions.add("(>= " + smtName + " " + numeral(policy.getPercentMin(), SmtSort.REAL) + ")");
                    }
                    if (policy.getPercentMax() != null) {
                        assertions.add("(<= " + smtName + " " + numeral(policy.getPercentMax(), SmtSort.REAL) + ")");
                    }
                    return SmtSort.REAL;
                case DATE:
                    valueKind = ValueKind.DATE;
                    return SmtSort.INT;
                case DURATION:
                    valueKind = ValueKind.DURATION;
                    if (policy.isDurationNonNegative()) {
                        assertions.add("(>= " + smtName + " 0)");
                    }
                    return SmtSort.INT;
                default:
                    throw unsupported(type);
            }
        }

        @Override
        public SmtSort visitMoney(MoneyType type) {
            valueKind = ValueKind.MONEY;
            if (policy.isMoneyNonNegative()) {
                assertions.add("(>= " + smtName + " 0)");
            }
            return SmtSort.INT;
        }

        @Override
        public SmtSort visitBoundedInt(BoundedIntType type) {
            assertions.add("(>= " + smtName + " " + numeral(BigDecimal.valueOf(type.getLow()), SmtSort.INT) + ")");
            assertions.add("(<= " + smtName + " " + numeral(BigDecimal.valueOf(type.getHigh()), SmtSort.INT) + ")");
            return SmtSort.INT;
        }

        @Override
        public SmtSort visitTemporal(TemporalType type) {
            return type.getInner().accept(this);
        }

        @Override
        public SmtSort visitCitation(CitationType type) {
            throw unsupported(type);
        }

        @Override
        public SmtSort visitUnion(UnionType type) {
            throw unsupported(type);
        }

        @Override
        public SmtSort visitRecord(RecordType type) {
            throw unsupported(type);
        }

        @Override
        public SmtSort visitNamed(NamedType type) {
            Symbol s = scope.resolveType(type.getName());
            if (s == null) {
                throw new TranslationException("Undefined type '" + type.getName() + "' for quantifier variable '"
                        + variable + "'", location);
            }
            switch (s.getKind()) {
                case ENUM: {
                    enumDecl = (EnumDecl) s.getDeclaration();
                    valueKind = ValueKind.ENUM;
                    assertions.add("(>= " + smtName + " 0)");
                    assertions.add("(<= " + smtName + " " + (enumDecl.getVariantNames().size() - 1) + ")");
                    return SmtSort.INT;
                }
                case TYPE_ALIAS: {
                    TypeAliasDecl alias = (TypeAliasDecl) s.getDeclaration();
                    if (!alias.getTypeParams().isEmpty() || ++aliasDepth > MAX_ALIAS_DEPTH) {
                        throw unsupported(type);
                    }
                    if (s.getScope() != null) {
                        scope = s.getScope();
                    }
                    return alias.getTarget().accept(this);
                }
                default:
                    throw unsupported(type);
            }
        }

        @Override
        public SmtSort visitWrapper(WrapperType type) {
            SmtSort inner = type.getInner().accept(this);
            switch (type.getKind()) {
                case POSITIVE:
                    if (!inner.isNumeric()) throw unsupported(type);
                    assertions.add("(> " + smtName + " " + numeral(BigDecimal.ZERO, inner) + ")");
                    return inner;
                case NON_EMPTY:
                    if (inner != SmtSort.STRING) throw unsupported(type);
                    assertions.add("(> (str.len " + smtName + ") 0)");
                    return inner;
                default:
                    throw unsupported(type);
            }
        }
    }

    // ============ 表达式 ============

    public SmtTerm translate(Expression expr, Env env) {
        return expr.accept(new ExprTranslator(), env);
    }

    /** 翻译并要求结果为 Bool */
    public SmtTerm translateBool(Expression expr, Env env) {
        SmtTerm term = translate(expr, env);
        if (term.getSort() != SmtSort.BOOL) {
            throw new TranslationException("Expected a boolean condition but found " + term.getSort().getSmtName()
                    + " expression '" + expr + "'", expr.getLocation());
        }
        return term;
    }

    /** 多个 Bool 项的合取；空列表为 true */
    public static String conjunction(List<String> terms) {
        if (terms.isEmpty()) return "true";
        if (terms.size() == 1) return terms.get(0);
        return "(and " + String.join(" ", terms) + ")";
    }

    /**
     * 数值常量的写法：负数写作 {@code (- n)}，Real 总带小数点
     */
    static String numeral(BigDecimal value, SmtSort sort) {
        BigDecimal abs = value.abs();
        String text;
        if (sort == SmtSort.REAL) {
            text = abs.stripTrailingZeros().toPlainString();
            if (text.indexOf('.') < 0) {
                text = text + ".0";
            }
        } else {
            text = abs.toBigIntegerExact().toString();
        }
        return value.signum() < 0 ? "(- " + text + ")" : text;
    }

    private static String quote(String s) {
        return "\"" + s.replace("\"", "\"\"") + "\"";
    }

    private static long days(Period period) {
        return period.getYears() * (long) DAYS_PER_YEAR + period.getMonths() * (long) DAYS_PER_MONTH + period.getDays();
    }

    private final class ExprTranslator implements ExprVisitor<SmtTerm, Env> {

        @Override
        public SmtTerm visitIdentifier(Identifier node, Env env) {
            Symbol s = program.getBinding(node);
            if (s == null) {
                throw new TranslationException("Unresolved identifier '" + node.getName() + "'", node.getLocation());
            }
            switch (s.getKind()) {
                case QUANTIFIED: {
                    Binding b = env.lookup(node.getName());
                    if (b == null) {
                        throw new TranslationException("Quantified variable '" + node.getName()
                                + "' is used outside its quantifier", node.getLocation());
                    }
                    return new SmtTerm(b.getSmtName(), b.getSort(), b.getUnit());
                }
                case ENUM_VARIANT: {
                    EnumDecl decl = (EnumDecl) s.getDeclaration();
                    return new SmtTerm(String.valueOf(decl.getVariantNames().indexOf(node.getName())), SmtSort.INT);
                }
                case VARIABLE:
                    return constant(node, (VariableDecl) s.getDeclaration(), s.getScope());
                default:
                    throw new TranslationException("'" + node.getName() + "' is a "
                            + s.getKind().name().toLowerCase().replace('_', ' ')
                            + " and cannot appear in a solver query", node.getLocation());
            }
        }

        /** 引用的值常量直接展开为数值；金额换算为分 */
        private SmtTerm constant(Identifier node, VariableDecl decl, Scope declScope) {
            Expression value = decl.getValue();
            if (value instanceof Literal && ((Literal) value).getKind() == Literal.LiteralKind.BOOLEAN) {
                return new SmtTerm(String.valueOf(((Literal) value).getValue()), SmtSort.BOOL);
            }
            if (value instanceof Literal && ((Literal) value).getKind() != Literal.LiteralKind.MONEY
                    && !((Literal) value).getKind().isNumeric()) {
                return visitLiteral((Literal) value, Env.empty());
            }
            BigDecimal v = constants.evaluate(node);
            if (v == null) {
                throw new TranslationException("Value '" + node.getName() + "' is not a compile-time constant",
                        node.getLocation());
            }
            TypeRef type = unwrap(decl.getType(), declScope != null ? declScope : program.getGlobalScope());
            SmtTerm.Unit unit = SmtTerm.Unit.PLAIN;
            if (type instanceof MoneyType) {
                v = v.movePointRight(2);
                unit = SmtTerm.Unit.MONEY;
            } else if (isPrimitive(type, PrimitiveType.Kind.PERCENT)) {
                unit = SmtTerm.Unit.PERCENT;
            }
            SmtSort sort = isIntegral(type) ? SmtSort.INT : SmtSort.REAL;
            if (sort == SmtSort.INT && v.stripTrailingZeros().scale() > 0) {
                sort = SmtSort.REAL;
            }
            return SmtTerm.number(v, sort, unit);
        }

        /** 展开别名并去掉时效与精化包装，得到决定编码的类型 */
        private TypeRef unwrap(TypeRef type, Scope scope) {
            TypeRef t = type;
            Scope s = scope;
            for (int depth = 0; depth < MAX_ALIAS_DEPTH; depth++) {
                if (t instanceof TemporalType) {
                    t = ((TemporalType) t).getInner();
                } else if (t instanceof WrapperType && ((WrapperType) t).getKind() != WrapperType.Kind.ARRAY) {
                    t = ((WrapperType) t).getInner();
                } else if (t instanceof NamedType) {
                    Symbol alias = s.resolveType(((NamedType) t).getName());
                    if (alias == null || alias.getKind() != SymbolKind.TYPE_ALIAS) {
                        return t;
                    }
                    t = ((TypeAliasDecl) alias.getDeclaration()).getTarget();
                    if (alias.getScope() != null) {
                        s = alias.getScope();
                    }
                } else {
                    return t;
                }
            }
            return t;
        }

        private boolean isPrimitive(TypeRef type, PrimitiveType.Kind kind) {
            return type instanceof PrimitiveType && ((PrimitiveType) type).getKind() == kind;
        }

        private boolean isIntegral(TypeRef type) {
            if (type instanceof BoundedIntType || type instanceof MoneyType) return true;
            return isPrimitive(type, PrimitiveType.Kind.INT) || isPrimitive(type, PrimitiveType.Kind.DATE)
                    || isPrimitive(type, PrimitiveType.Kind.DURATION);
        }

        @Override
        public SmtTerm visitLiteral(Literal node, Env env) {
            Object value = node.getValue();
            switch (node.getKind()) {
                case INT:
                    return SmtTerm.number(BigDecimal.valueOf((Long) value), SmtSort.INT, SmtTerm.Unit.PLAIN);
                case FLOAT:
                    return SmtTerm.number(BigDecimal.valueOf((Double) value), SmtSort.REAL, SmtTerm.Unit.PLAIN);
                case BOOLEAN:
                    return new SmtTerm(String.valueOf(value), SmtSort.BOOL);
                case STRING:
                    return new SmtTerm(quote((String) value), SmtSort.STRING);
                case MONEY:
                    return SmtTerm.number(BigDecimal.valueOf(((MoneyValue) value).toCents()), SmtSort.INT,
                            SmtTerm.Unit.MONEY);
                case PERCENT:
                    return SmtTerm.number((BigDecimal) value, SmtSort.REAL, SmtTerm.Unit.PERCENT);
                case DATE:
                    return SmtTerm.number(BigDecimal.valueOf(((LocalDate) value).toEpochDay()), SmtSort.INT,
                            SmtTerm.Unit.PLAIN);
                case DURATION:
                    return SmtTerm.number(BigDecimal.valueOf(days((Period) value)), SmtSort.INT, SmtTerm.Unit.PLAIN);
                default:
                    throw new TranslationException("Unsupported literal " + node, node.getLocation());
            }
        }

        @Override
        public SmtTerm visitBinary(BinaryExpr node, Env env) {
            SmtTerm l = translate(node.getLeft(), env);
            SmtTerm r = translate(node.getRight(), env);
            BinaryExpr.BinaryOp op = node.getOperator();

            if (op.isLogical()) {
                if (l.getSort() != SmtSort.BOOL || r.getSort() != SmtSort.BOOL) {
                    throw mismatch(node, l, r);
                }
                return new SmtTerm("(" + (op == BinaryExpr.BinaryOp.AND ? "and" : "or") + " " + l + " " + r + ")",
                        SmtSort.BOOL);
            }

            boolean additive = op == BinaryExpr.BinaryOp.ADD || op == BinaryExpr.BinaryOp.SUB;
            if (op.isEquality() || op.isRelational() || additive) {
                SmtTerm[] aligned = alignUnits(l, r);
                l = aligned[0];
                r = aligned[1];
            }

            if (op.isEquality()) {
                SmtTerm[] pair = unify(node, l, r, true);
                String eq = "(= " + pair[0] + " " + pair[1] + ")";
                return new SmtTerm(op == BinaryExpr.BinaryOp.EQ ? eq : "(not " + eq + ")", SmtSort.BOOL);
            }

            if (op.isRelational()) {
                SmtTerm[] pair = unify(node, l, r, false);
                return new SmtTerm("(" + op.getSymbol() + " " + pair[0] + " " + pair[1] + ")", SmtSort.BOOL);
            }

            // 算术
            if (op == BinaryExpr.BinaryOp.ADD && l.getSort() == SmtSort.STRING && r.getSort() == SmtSort.STRING) {
                return new SmtTerm("(str.++ " + l + " " + r + ")", SmtSort.STRING);
            }
            // 乘除中的百分比按比例参与运算
            SmtTerm.Unit unit = l.getUnit();
            if (op == BinaryExpr.BinaryOp.MUL || op == BinaryExpr.BinaryOp.DIV) {
                boolean money = l.getUnit() == SmtTerm.Unit.MONEY || r.getUnit() == SmtTerm.Unit.MONEY;
                if (l.getUnit() == SmtTerm.Unit.PERCENT) l = l.fraction();
                if (r.getUnit() == SmtTerm.Unit.PERCENT) r = r.fraction();
                if (op == BinaryExpr.BinaryOp.MUL) {
                    unit = money ? SmtTerm.Unit.MONEY : SmtTerm.Unit.PLAIN;
                } else {
                    unit = l.getUnit() == SmtTerm.Unit.MONEY && r.getUnit() != SmtTerm.Unit.MONEY
                            ? SmtTerm.Unit.MONEY : SmtTerm.Unit.PLAIN;
                    if (money) {
                        l = l.toReal();
                        r = r.toReal();
                    }
                }
            }
            SmtTerm[] pair = unify(node, l, r, false);
            SmtSort sort = pair[0].getSort();
            switch (op) {
                case ADD:
                    return new SmtTerm("(+ " + pair[0] + " " + pair[1] + ")", sort, unit);
                case SUB:
                    return new SmtTerm("(- " + pair[0] + " " + pair[1] + ")", sort, unit);
                case MUL:
                    return new SmtTerm("(* " + pair[0] + " " + pair[1] + ")", sort, unit);
                case DIV:
                    return sort == SmtSort.INT
                            ? new SmtTerm("(div " + pair[0] + " " + pair[1] + ")", SmtSort.INT, unit)
                            : new SmtTerm("(/ " + pair[0] + " " + pair[1] + ")", SmtSort.REAL, unit);
                case MOD:
                    if (sort != SmtSort.INT) throw mismatch(node, l, r);
                    return new SmtTerm("(mod " + pair[0] + " " + pair[1] + ")", SmtSort.INT);
                default:
                    throw mismatch(node, l, r);
            }
        }

        /**
         * 使两侧计量单位一致：与金额相遇的数值按元换算为分，与百分比相遇的数值按百分点理解
         */
        private SmtTerm[] alignUnits(SmtTerm l, SmtTerm r) {
            SmtTerm.Unit target = commonUnit(l.getUnit(), r.getUnit());
            return new SmtTerm[]{alignTo(l, target), alignTo(r, target)};
        }

        /**
         * 使两侧排序一致；数值混合时提升为 Real
         */
        private SmtTerm[] unify(Expression node, SmtTerm l, SmtTerm r, boolean allowNonNumeric) {
            if (l.getSort().isNumeric() && r.getSort().isNumeric()) {
                if (l.getSort() != r.getSort()) {
                    return new SmtTerm[]{l.toReal(), r.toReal()};
                }
                return new SmtTerm[]{l, r};
            }
            if (allowNonNumeric && l.getSort() == r.getSort()) {
                return new SmtTerm[]{l, r};
            }
            throw mismatch(node, l, r);
        }

        private TranslationException mismatch(Expression node, SmtTerm l, SmtTerm r) {
            return new TranslationException("Operands of '" + node + "' have solver sorts "
                    + l.getSort().getSmtName() + " and " + r.getSort().getSmtName()
                    + " which the operator does not accept", node.getLocation());
        }

        @Override
        public SmtTerm visitUnary(UnaryExpr node, Env env) {
            SmtTerm operand = translate(node.getOperand(), env);
            if (node.getOperator() == UnaryExpr.UnaryOp.NOT) {
                if (operand.getSort() != SmtSort.BOOL) {
                    throw new TranslationException("'!' needs a boolean operand in '" + node + "'", node.getLocation());
                }
                return new SmtTerm("(not " + operand + ")", SmtSort.BOOL);
            }
            if (!operand.getSort().isNumeric()) {
                throw new TranslationException("'-' needs a numeric operand in '" + node + "'", node.getLocation());
            }
            if (operand.getConstant() != null) {
                return SmtTerm.number(operand.getConstant().negate(), operand.getSort(), operand.getUnit());
            }
            return new SmtTerm("(- " + operand + ")", operand.getSort(), operand.getUnit());
        }

        @Override
        public SmtTerm visitCall(CallExpr node, Env env) {
            throw new TranslationException("Function calls cannot be translated to a solver query: " + node,
                    node.getLocation());
        }

        @Override
        public SmtTerm visitFieldAccess(FieldAccessExpr node, Env env) {
            // Enum.Variant 形式的成员引用
            if (node.getTarget() instanceof Identifier) {
                Symbol owner = program.getBinding((Identifier) node.getTarget());
                if (owner != null && owner.getKind() == SymbolKind.ENUM) {
                    EnumDecl decl = (EnumDecl) owner.getDeclaration();
                    int index = decl.getVariantNames().indexOf(node.getFieldName());
                    if (index >= 0) {
                        return new SmtTerm(String.valueOf(index), SmtSort.INT);
                    }
                }
            }
            throw new TranslationException("Field access cannot be translated to a solver query: " + node,
                    node.getLocation());
        }

        @Override
        public SmtTerm visitStructInit(StructInitExpr node, Env env) {
            throw new TranslationException("Struct values cannot be translated to a solver query",
                    node.getLocation());
        }

        /**
         * match 翻译为 ite 链；最后一个分支作为兜底，穷尽性已由 Checker 保证
         */
        @Override
        public SmtTerm visitMatch(MatchExpr node, Env env) {
            SmtTerm scrutinee = translate(node.getScrutinee(), env);
            EnumDecl enumDecl = null;
            if (node.getScrutinee() instanceof Identifier) {
                Binding b = env.lookup(((Identifier) node.getScrutinee()).getName());
                if (b != null) enumDecl = b.getEnumDecl();
            }

            List<String> conditions = new ArrayList<>();
            List<SmtTerm> results = new ArrayList<>();
            SmtSort sort = null;
            SmtTerm.Unit unit = null;
            Scope scope = env.getScope() != null ? env.getScope() : program.getGlobalScope();
            for (MatchArm arm : node.getArms()) {
                String cond = arm.getPattern().accept(new PatternCondition(scrutinee, enumDecl, scope));
                if (arm.hasGuard()) {
                    String guard = translateBool(arm.getGuard(), env).getText();
                    cond = cond == null ? guard : "(and " + cond + " " + guard + ")";
                }
                SmtTerm result = translate(arm.getResult(), env);
                if (sort == null || (sort == SmtSort.INT && result.getSort() == SmtSort.REAL)) {
                    sort = result.getSort();
                } else if (sort != result.getSort() && !(sort == SmtSort.REAL && result.getSort() == SmtSort.INT)) {
                    throw new TranslationException("Match arms have different solver sorts", arm.getLocation());
                }
                unit = unit == null ? result.getUnit() : commonUnit(unit, result.getUnit());
                conditions.add(cond);
                results.add(result);
                if (cond == null) break;
            }

            // 换算单位后整数结果可能变为实数
            List<SmtTerm> aligned = new ArrayList<>();
            for (SmtTerm result : results) {
                SmtTerm a = alignTo(result, unit);
                if (a.getSort() == SmtSort.REAL) sort = SmtSort.REAL;
                aligned.add(a);
            }
            int last = aligned.size() - 1;
            String acc = coerce(aligned.get(last), sort);
            for (int i = last - 1; i >= 0; i--) {
                acc = "(ite " + conditions.get(i) + " " + coerce(aligned.get(i), sort) + " " + acc + ")";
            }
            return new SmtTerm(acc, sort, unit);
        }

        private String coerce(SmtTerm term, SmtSort sort) {
            return sort == SmtSort.REAL ? term.toReal().getText() : term.getText();
        }

        @Override
        public SmtTerm visitForall(ForallExpr node, Env env) {
            return binder(node, env);
        }

        @Override
        public SmtTerm visitExists(ExistsExpr node, Env env) {
            return binder(node, env);
        }

        @Override
        public SmtTerm visitBlock(BlockExpr node, Env env) {
            throw new TranslationException("Blocks cannot be translated to a solver query", node.getLocation());
        }

        @Override
        public SmtTerm visitPass(PassExpr node, Env env) {
            throw new TranslationException("'pass' has no truth value in a solver query", node.getLocation());
        }
    }

    // ============ 计量单位 ============

    /** 金额优先，其次百分比 */
    static SmtTerm.Unit commonUnit(SmtTerm.Unit a, SmtTerm.Unit b) {
        if (a == SmtTerm.Unit.MONEY || b == SmtTerm.Unit.MONEY) return SmtTerm.Unit.MONEY;
        if (a == SmtTerm.Unit.PERCENT || b == SmtTerm.Unit.PERCENT) return SmtTerm.Unit.PERCENT;
        return SmtTerm.Unit.PLAIN;
    }

    /**
     * 把数值项换算到目标单位：纯数值按元换算为分或按百分点理解，百分比换算为比例
     */
    static SmtTerm alignTo(SmtTerm term, SmtTerm.Unit target) {
        if (!term.getSort().isNumeric() || term.getUnit() == target) {
            return term;
        }
        switch (target) {
            case MONEY:
                return term.getUnit() == SmtTerm.Unit.PERCENT ? term.fraction().centsOf() : term.centsOf();
            case PERCENT:
                return term.withUnit(SmtTerm.Unit.PERCENT);
            default:
                return term.getUnit() == SmtTerm.Unit.PERCENT ? term.fraction() : term;
        }
    }

    /**
     * 嵌套量词输出为 SMT-LIB 绑定；全称的值域与守卫作为蕴含前件，存在的则并入合取
     */
    SmtTerm binder(QuantifierExpr node, Env env) {
        Binding b = bind(node, symbol(node.getVariable()));
        Env inner = env.with(b);
        List<String> conditions = new ArrayList<>(b.getDomain());
        if (node.hasGuard()) {
            conditions.add(translateBool(node.getGuard(), inner).getText());
        }
        String body = translateBool(node.getBody(), inner).getText();
        String matrix;
        if (node.getKind() == QuantifierExpr.Kind.FORALL) {
            matrix = conditions.isEmpty() ? body : "(=> " + conjunction(conditions) + " " + body + ")";
        } else {
            conditions.add(body);
            matrix = conjunction(conditions);
        }
        String keyword = node.getKind() == QuantifierExpr.Kind.FORALL ? "forall" : "exists";
        return new SmtTerm("(" + keyword + " ((" + b.getSmtName() + " " + b.getSort().getSmtName() + ")) "
                + matrix + ")", SmtSort.BOOL);
    }

    /**
     * 模式对应的条件；通配符返回 null
     */
    private final class PatternCondition implements PatternVisitor<String> {
        private final SmtTerm scrutinee;
        private final EnumDecl enumDecl;
        private final Scope scope;

        PatternCondition(SmtTerm scrutinee, EnumDecl enumDecl, Scope scope) {
            this.scrutinee = scrutinee;
            this.enumDecl = enumDecl;
            this.scope = scope;
        }

        @Override
        public String visitLiteral(LiteralPattern pattern) {
            SmtTerm raw = translate(pattern.getLiteral(), Env.empty());
            SmtTerm subject = scrutinee;
            SmtTerm value = raw;
            if (subject.getSort().isNumeric() && raw.getSort().isNumeric()) {
                SmtTerm.Unit target = commonUnit(subject.getUnit(), raw.getUnit());
                subject = alignTo(subject, target);
                value = alignTo(raw, target);
                if (subject.getSort() != value.getSort()) {
                    return "(= " + subject.toReal() + " " + value.toReal() + ")";
                }
            }
            if (subject.getSort() != value.getSort()) {
                throw new TranslationException("Pattern " + pattern.getLiteral() + " cannot match a "
                        + scrutinee.getSort().getSmtName() + " value", pattern.getLocation());
            }
            return "(= " + subject + " " + value + ")";
        }

        @Override
        public String visitWildcard(WildcardPattern pattern) {
            return null;
        }

        @Override
        public String visitVariant(VariantPattern pattern) {
            EnumDecl target = enumDecl;
            if (pattern.getEnumName() != null) {
                Symbol s = scope.resolveType(pattern.getEnumName());
                target = s != null && s.getKind() == SymbolKind.ENUM ? (EnumDecl) s.getDeclaration() : null;
            } else if (target == null) {
                Symbol v = scope.resolveVariant(pattern.getVariant());
                target = v != null ? (EnumDecl) v.getDeclaration() : null;
            }
            int index = target != null ? target.getVariantNames().indexOf(pattern.getVariant()) : -1;
            if (index < 0) {
                throw new TranslationException("Cannot resolve pattern '" + pattern.getVariant() + "'",
                        pattern.getLocation());
            }
            return "(= " + scrutinee + " " + index + ")";
        }

        @Override
        public String visitSatisfies(SatisfiesPattern pattern) {
            throw new TranslationException("'satisfies " + pattern.getTestName()
                    + "' cannot be translated to a solver query", pattern.getLocation());
        }
    }

    // ============ 模型取值 ============

    /**
     * 把模型中的原始取值还原为源码层面的写法：枚举下标还原为成员名，金额的分还原为元，纪元日还原为日期
     */
    public String renderValue(Binding binding, String raw) {
        try {
            switch (binding.getValueKind()) {
                case ENUM: {
                    int index = Integer.parseInt(raw);
                    List<String> variants = binding.getEnumDecl().getVariantNames();
                    return index >= 0 && index < variants.size() ? variants.get(index) : raw;
                }
                case MONEY:
                    return "$" + new BigDecimal(new BigInteger(raw), 2).toPlainString();
                case DATE:
                    return LocalDate.ofEpochDay(Long.parseLong(raw)).format(DATE_FORMAT);
                case DURATION:
                    return raw + "d";
                case PERCENT:
                    return raw + "%";
                default:
                    return raw;
            }
        } catch (NumberFormatException | DateTimeException e) {
            // 有理数等无法还原的取值保留原文
            return raw;
        }
    }
}
