package com.statuta.compiler.hierarchy;

import com.statuta.compiler.analysis.AnnotationValues;
import com.statuta.compiler.ast.Program;
import com.statuta.compiler.ast.item.Annotation;
import com.statuta.compiler.ast.item.FieldDecl;
import com.statuta.compiler.ast.item.Item;
import com.statuta.compiler.ast.item.ScopeDecl;
import com.statuta.compiler.ast.item.StructDecl;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 法律层级检查
 *
 * <p>从字段上的 {@code @hierarchy(level = ..., subordinate_to = Struct.field)} 注解收集节点，
 * 以 {@code Struct.field} 为键建立父子关系；scope 内的结构体键前带 scope 路径，如
 * {@code Penal.Act.title}。subordinate_to 从所在 scope 起由内向外查找。所有遍历都是迭代式的，
 * 并显式记录当前路径上的键，因此 subordinate_to 成环时报告结构错误而不是无限递归。</p>
 */
public final class HierarchyChecker {

    private static final Logger LOG = Logger.getLogger(HierarchyChecker.class.getName());

    public static final String ANNOTATION = "hierarchy";

    private final Map<String, HierarchyNode> nodes = new LinkedHashMap<>();
    // 节点键到声明所在的 scope 路径
    private final Map<String, String> scopePaths = new HashMap<>();
    private final List<HierarchyError> collectionErrors = new ArrayList<>();

    public HierarchyChecker(Program program) {
        collect(program.getItems(), "");
        // 第二遍：所有节点登记后再解析 subordinate_to 并连接父子
        for (Map.Entry<String, HierarchyNode> entry : nodes.entrySet()) {
            HierarchyNode node = entry.getValue();
            if (node.getParentKey() != null) {
                String parent = resolveParent(scopePaths.get(entry.getKey()), node.getParentKey());
                entry.setValue(new HierarchyNode(node.getKey(), node.getLevelTag(), parent, node.getLocation()));
            }
        }
        for (HierarchyNode node : nodes.values()) {
            if (node.getParentKey() != null) {
                HierarchyNode parent = nodes.get(node.getParentKey());
                if (parent != null) {
                    parent.addChild(node.getKey());
                }
            }
        }
        LOG.log(Level.FINE, "Collected {0} hierarchy nodes from {1}",
                new Object[]{nodes.size(), program.getFileName()});
    }

    private void collect(List<Item> items, String scopePath) {
        for (Item item : items) {
            if (item instanceof ScopeDecl) {
                collect(((ScopeDecl) item).getItems(), qualify(scopePath, ((ScopeDecl) item).getName()));
            } else if (item instanceof StructDecl) {
                collectStruct((StructDecl) item, scopePath);
            }
        }
    }

    private static String qualify(String scopePath, String name) {
        return scopePath.isEmpty() ? name : scopePath + "." + name;
    }

    /**
     * 从 scope 路径起由内向外查找 subordinate_to 指向的节点；都找不到时保留原文
     */
    private String resolveParent(String scopePath, String reference) {
        String path = scopePath;
        while (true) {
            String candidate = qualify(path, reference);
            if (nodes.containsKey(candidate)) {
                return candidate;
            }
            if (path.isEmpty()) {
                return reference;
            }
            int dot = path.lastIndexOf('.');
            path = dot < 0 ? "" : path.substring(0, dot);
        }
    }

    private void collectStruct(StructDecl struct, String scopePath) {
        for (FieldDecl field : struct.getFields()) {
            Annotation annotation = field.findAnnotation(ANNOTATION);
            if (annotation == null) continue;

            String key = qualify(scopePath, struct.getName() + "." + field.getName());
            String level = AnnotationValues.nameOf(AnnotationValues.argument(annotation, "level", 0));
            String parent = AnnotationValues.nameOf(AnnotationValues.argument(annotation, "subordinate_to", 1));
            if (nodes.containsKey(key)) {
                collectionErrors.add(new HierarchyError(HierarchyError.Kind.DUPLICATE_NODE,
                        Collections.singletonList(key),
                        "Hierarchy node '" + key + "' is declared more than once", annotation.getLocation()));
                continue;
            }
            nodes.put(key, new HierarchyNode(key, level, parent, annotation.getLocation()));
            scopePaths.put(key, scopePath);
        }
    }

    public Map<String, HierarchyNode> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public HierarchyNode getNode(String key) {
        return nodes.get(key);
    }

    /**
     * 检查层级冲突：环（每个环只报告一次）、悬空引用、层级倒置，以及重复节点
     */
    public List<HierarchyError> checkConflicts() {
        List<HierarchyError> errors = new ArrayList<>(collectionErrors);

        // 每个节点至多一个父节点，沿父链行走即可找出全部环
        Map<String, Integer> state = new HashMap<>(); // 1 = 当前路径上，2 = 已完成
        for (String start : nodes.keySet()) {
            if (state.containsKey(start)) continue;
            List<String> path = new ArrayList<>();
            String cur = start;
            while (cur != null && nodes.containsKey(cur)) {
                Integer s = state.get(cur);
                if (s != null) {
                    if (s == 1) {
                        List<String> cycle = new ArrayList<>(path.subList(path.indexOf(cur), path.size()));
                        errors.add(cycleError(cycle));
                    }
                    break;
                }
                state.put(cur, 1);
                path.add(cur);
                cur = nodes.get(cur).getParentKey();
            }
            for (String key : path) {
                state.put(key, 2);
            }
        }

        for (HierarchyNode node : nodes.values()) {
            String parentKey = node.getParentKey();
            if (parentKey == null) continue;
            HierarchyNode parent = nodes.get(parentKey);
            if (parent == null) {
                errors.add(new HierarchyError(HierarchyError.Kind.DANGLING_REFERENCE,
                        Arrays.asList(node.getKey(), parentKey),
                        "'" + node.getKey() + "' is subordinate to unknown node '" + parentKey + "'",
                        node.getLocation()));
                continue;
            }
            if (node.getLevel() != null && parent.getLevel() != null
                    && !node.getLevel().isMoreSpecificThan(parent.getLevel())) {
                errors.add(new HierarchyError(HierarchyError.Kind.LEVEL_INVERSION,
                        Arrays.asList(node.getKey(), parentKey),
                        "'" + node.getKey() + "' at level " + node.getLevelTag()
                                + " must be more specific than its parent '" + parentKey
                                + "' at level " + parent.getLevelTag(),
                        node.getLocation()));
            }
        }
        LOG.log(Level.FINE, "Hierarchy check found {0} conflicts", errors.size());
        return errors;
    }

    private HierarchyError cycleError(List<String> cycle) {
        StringBuilder chain = new StringBuilder();
        for (String key : cycle) {
            chain.append(key).append(" -> ");
        }
        chain.append(cycle.get(0));
        return new HierarchyError(HierarchyError.Kind.CYCLE, cycle,
                "Cyclic subordination: " + chain, nodes.get(cycle.get(0)).getLocation());
    }

    /**
     * 计算每个节点到根的距离。行走时记录当前路径上的键，键重复出现即停止并报告结构错误；
     * 已算出的深度会被复用。
     */
    public HierarchyLevels getHierarchyLevels() {
        Map<String, Integer> depths = new LinkedHashMap<>();
        Map<String, HierarchyError.Kind> broken = new HashMap<>();
        List<HierarchyError> errors = new ArrayList<>();

        for (String start : nodes.keySet()) {
            if (depths.containsKey(start) || broken.containsKey(start)) continue;

            List<String> path = new ArrayList<>();
            Set<String> onPath = new HashSet<>();
            String cur = start;
            int base = 0;
            HierarchyError.Kind failure = null;
            String cause = null;
            while (true) {
                Integer known = depths.get(cur);
                if (known != null) {
                    base = known + 1;
                    break;
                }
                if (broken.containsKey(cur)) {
                    failure = broken.get(cur);
                    cause = cur;
                    break;
                }
                if (!onPath.add(cur)) {
                    failure = HierarchyError.Kind.CYCLE;
                    cause = cur;
                    break;
                }
                path.add(cur);
                String parent = nodes.get(cur).getParentKey();
                if (parent == null) {
                    break;
                }
                if (!nodes.containsKey(parent)) {
                    failure = HierarchyError.Kind.DANGLING_REFERENCE;
                    cause = parent;
                    break;
                }
                cur = parent;
            }

            if (failure != null) {
                for (String key : path) {
                    broken.put(key, failure);
                    String reason = failure == HierarchyError.Kind.CYCLE
                            ? "its subordination chain reaches a cycle at '" + cause + "'"
                            : "its subordination chain reaches unknown node '" + cause + "'";
                    errors.add(new HierarchyError(failure, Collections.singletonList(key),
                            "Cannot compute the level of '" + key + "': " + reason,
                            nodes.get(key).getLocation()));
                }
            } else {
                for (int i = path.size() - 1; i >= 0; i--) {
                    depths.put(path.get(i), base++);
                }
            }
        }
        return new HierarchyLevels(depths, errors);
    }
}
