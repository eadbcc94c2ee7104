package com.statuta.compiler.hierarchy;

import com.statuta.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 层级图节点，父子关系以键（{@code Struct.field}）相连
 */
public final class HierarchyNode {
    private final String key;
    private final String levelTag;
    private final StatutoryLevel level;
    private final String parentKey;
    private final SourceLocation location;
    private final List<String> children = new ArrayList<>();

    public HierarchyNode(String key, String levelTag, String parentKey, SourceLocation location) {
        this.key = key;
        this.levelTag = levelTag;
        this.level = StatutoryLevel.fromTag(levelTag);
        this.parentKey = parentKey;
        this.location = location;
    }

    public String getKey() { return key; }

    /** 原始层级标签，可能不在已知层级集合内 */
    public String getLevelTag() { return levelTag; }

    /** 已知层级；标签未知或缺失时为 null */
    public StatutoryLevel getLevel() { return level; }

    /** subordinate_to 指向的键，根节点为 null */
    public String getParentKey() { return parentKey; }

    public SourceLocation getLocation() { return location; }

    public List<String> getChildren() {
        return Collections.unmodifiableList(children);
    }

    void addChild(String childKey) {
        children.add(childKey);
    }

    @Override
    public String toString() {
        return key + (levelTag != null ? " [" + levelTag + "]" : "")
                + (parentKey != null ? " -> " + parentKey : "");
    }
}
