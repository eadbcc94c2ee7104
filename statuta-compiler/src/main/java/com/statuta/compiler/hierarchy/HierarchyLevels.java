package com.statuta.compiler.hierarchy;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 层级深度计算结果：无环节点的深度（根为 0），以及环上或环以上节点的结构错误
 */
public final class HierarchyLevels {
    private final Map<String, Integer> depths;
    private final List<HierarchyError> errors;

    HierarchyLevels(Map<String, Integer> depths, List<HierarchyError> errors) {
        this.depths = Collections.unmodifiableMap(depths);
        this.errors = Collections.unmodifiableList(errors);
    }

    public Map<String, Integer> getDepths() {
        return depths;
    }

    /** 节点深度；无法计算时返回 null */
    public Integer depthOf(String key) {
        return depths.get(key);
    }

    public List<HierarchyError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
