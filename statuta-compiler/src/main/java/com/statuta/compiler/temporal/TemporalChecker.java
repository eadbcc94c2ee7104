package com.statuta.compiler.temporal;

import com.statuta.compiler.analysis.AnnotationValues;
import com.statuta.compiler.ast.Program;
import com.statuta.compiler.ast.item.Annotation;
import com.statuta.compiler.ast.item.FieldDecl;
import com.statuta.compiler.ast.item.Item;
import com.statuta.compiler.ast.item.ScopeDecl;
import com.statuta.compiler.ast.item.StructDecl;
import com.statuta.compiler.ast.item.TypeAliasDecl;
import com.statuta.compiler.ast.type.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 时效检查
 *
 * <p>收集带有效期的字段、日落条款和溯及既往规则，再以调用方给出的参考日期做一致性校验。
 * 参考日期由外部决定，检查器本身不读取系统时钟。字段键为 {@code Struct.field}，
 * scope 内的结构体前带 scope 路径；字段类型经类型别名间接引用的 Temporal 也会被收集。</p>
 */
public final class TemporalChecker {

    private static final Logger LOG = Logger.getLogger(TemporalChecker.class.getName());

    private static final int MAX_ALIAS_DEPTH = 32;

    public static final String EFFECTIVE = "effective";
    public static final String SUNSET = "sunset";
    public static final String RETROACTIVE = "retroactive";

    private final List<TemporalField> temporalFields = new ArrayList<>();
    private final List<SunsetClause> sunsetClauses = new ArrayList<>();
    private final List<RetroactiveRule> retroactiveRules = new ArrayList<>();
    // 字段的 @effective 日期，用于与日落日期交叉校验
    private final Map<String, LocalDate> effectiveDates = new HashMap<>();
    private final List<TemporalError> collectionErrors = new ArrayList<>();

    public TemporalChecker(Program program) {
        collect(program.getItems(), "", Collections.<List<Item>>emptyList());
        LOG.log(Level.FINE, "Collected {0} temporal fields, {1} sunset clauses, {2} retroactive rules from {3}",
                new Object[]{temporalFields.size(), sunsetClauses.size(), retroactiveRules.size(), program.getFileName()});
    }

    /**
     * @param levels 由外向内的各层条目，用于查找类型别名
     */
    private void collect(List<Item> items, String scopePath, List<List<Item>> levels) {
        List<List<Item>> inner = new ArrayList<>(levels);
        inner.add(items);
        for (Item item : items) {
            if (item instanceof ScopeDecl) {
                String path = scopePath.isEmpty() ? item.getName() : scopePath + "." + item.getName();
                collect(((ScopeDecl) item).getItems(), path, inner);
            } else if (item instanceof StructDecl) {
                StructDecl struct = (StructDecl) item;
                String prefix = scopePath.isEmpty() ? "" : scopePath + ".";
                for (FieldDecl field : struct.getFields()) {
                    collectField(prefix + struct.getName() + "." + field.getName(), field, inner);
                }
            }
        }
    }

    private void collectField(String key, FieldDecl field, List<List<Item>> levels) {
        field.getType().accept(new TemporalCollector(key, levels));

        LocalDate effective = dateArgument(key, field.findAnnotation(EFFECTIVE));
        LocalDate sunset = dateArgument(key, field.findAnnotation(SUNSET));
        Annotation retroactive = field.findAnnotation(RETROACTIVE);

        if (effective != null) {
            effectiveDates.put(key, effective);
        }
        if (sunset != null) {
            sunsetClauses.add(new SunsetClause(key, sunset, field.findAnnotation(SUNSET).getLocation()));
        }
        if (retroactive != null) {
            LocalDate from = dateArgument(key, retroactive);
            if (from != null) {
                retroactiveRules.add(new RetroactiveRule(key, from, effective, retroactive.getLocation()));
            }
        }
    }

    /** 注解的日期参数（位置参数或 {@code date = ...}）；格式不对时记录错误并返回 null */
    private LocalDate dateArgument(String key, Annotation annotation) {
        if (annotation == null) return null;
        LocalDate date = AnnotationValues.dateOf(AnnotationValues.argument(annotation, "date", 0));
        if (date == null) {
            collectionErrors.add(new TemporalError(TemporalError.Kind.INVALID_DATE, key,
                    "@" + annotation.getName() + " on '" + key + "' needs a date argument (dd-mm-yyyy)",
                    annotation.getLocation()));
        }
        return date;
    }

    /**
     * 递归查找字段类型中出现的全部 Temporal 类型
     */
    private final class TemporalCollector implements TypeRefVisitor<Void> {
        private final String key;
        private List<List<Item>> levels;
        private int aliasDepth;

        TemporalCollector(String key, List<List<Item>> levels) {
            this.key = key;
            this.levels = levels;
        }

        @Override
        public Void visitTemporal(TemporalType type) {
            temporalFields.add(new TemporalField(key, type.getValidFrom(), type.getValidUntil(), type.getLocation()));
            return type.getInner().accept(this);
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
            for (FieldDecl nested : type.getFields()) {
                collectField(key + "." + nested.getName(), nested, levels);
            }
            return null;
        }

        @Override
        public Void visitNamed(NamedType type) {
            for (TypeRef arg : type.getTypeArgs()) {
                arg.accept(this);
            }
            // 自引用或互相引用的别名由解析阶段报告，这里只按深度截断
            if (aliasDepth >= MAX_ALIAS_DEPTH) {
                return null;
            }
            for (int i = levels.size() - 1; i >= 0; i--) {
                for (Item item : levels.get(i)) {
                    if (item instanceof TypeAliasDecl && item.getName().equals(type.getName())) {
                        List<List<Item>> saved = levels;
                        levels = levels.subList(0, i + 1);
                        aliasDepth++;
                        ((TypeAliasDecl) item).getTarget().accept(this);
                        aliasDepth--;
                        levels = saved;
                        return null;
                    }
                }
            }
            return null;
        }

        @Override
        public Void visitWrapper(WrapperType type) {
            return type.getInner().accept(this);
        }

        @Override public Void visitPrimitive(PrimitiveType type) { return null; }
        @Override public Void visitMoney(MoneyType type) { return null; }
        @Override public Void visitBoundedInt(BoundedIntType type) { return null; }
        @Override public Void visitCitation(CitationType type) { return null; }
    }

    public List<TemporalField> getTemporalFields() {
        return Collections.unmodifiableList(temporalFields);
    }

    public List<SunsetClause> getSunsetClauses() {
        return Collections.unmodifiableList(sunsetClauses);
    }

    public List<RetroactiveRule> getRetroactiveRules() {
        return Collections.unmodifiableList(retroactiveRules);
    }

    /**
     * 以参考日期校验全部时效约束
     *
     * @param reference 参考日期（“今天”），由调用方提供
     */
    public List<TemporalError> validate(LocalDate reference) {
        if (reference == null) {
            throw new IllegalArgumentException("reference date must not be null");
        }
        List<TemporalError> errors = new ArrayList<>(collectionErrors);

        for (TemporalField field : temporalFields) {
            LocalDate from = field.getValidFrom();
            LocalDate until = field.getValidUntil();
            if (from != null && until != null && !from.isBefore(until)) {
                errors.add(new TemporalError(TemporalError.Kind.INVERTED_BOUNDS, field.getKey(),
                        "'" + field.getKey() + "' is valid from " + from + " which is not before valid_until " + until,
                        field.getLocation()));
            }
        }

        for (SunsetClause sunset : sunsetClauses) {
            if (sunset.isExpiredOn(reference)) {
                errors.add(new TemporalError(TemporalError.Kind.EXPIRED_SUNSET, sunset.getKey(),
                        "Sunset clause on '" + sunset.getKey() + "' expired on " + sunset.getExpiryDate()
                                + " (reference date " + reference + ")",
                        sunset.getLocation()));
            }
            LocalDate effective = effectiveDates.get(sunset.getKey());
            if (effective != null && !effective.isBefore(sunset.getExpiryDate())) {
                errors.add(new TemporalError(TemporalError.Kind.SUNSET_BEFORE_EFFECTIVE, sunset.getKey(),
                        "Sunset date " + sunset.getExpiryDate() + " of '" + sunset.getKey()
                                + "' is not after its effective date " + effective,
                        sunset.getLocation()));
            }
        }

        for (RetroactiveRule rule : retroactiveRules) {
            if (rule.getEffectiveDate() == null) {
                errors.add(new TemporalError(TemporalError.Kind.MISSING_EFFECTIVE_DATE, rule.getKey(),
                        "@retroactive on '" + rule.getKey() + "' has no matching @effective date",
                        rule.getLocation()));
            } else if (rule.getRetroactiveFrom().isAfter(rule.getEffectiveDate())) {
                errors.add(new TemporalError(TemporalError.Kind.RETROACTIVE_CONFLICT, rule.getKey(),
                        "'" + rule.getKey() + "' is retroactive from " + rule.getRetroactiveFrom()
                                + " which is after its effective date " + rule.getEffectiveDate(),
                        rule.getLocation()));
            }
        }

        LOG.log(Level.FINE, "Temporal validation against {0} found {1} errors",
                new Object[]{reference, errors.size()});
        return errors;
    }
}
