package com.statuta.compiler.hierarchy;

/**
 * 法律层级，从最宽泛到最具体排列
 */
public enum StatutoryLevel {
    CONSTITUTION,
    ACT,
    PART,
    DIVISION,
    CHAPTER,
    SECTION,
    SUBSECTION,
    PARAGRAPH,
    SUBPARAGRAPH,
    CLAUSE;

    /** 按名称查找层级（忽略大小写），未知标签返回 null */
    public static StatutoryLevel fromTag(String tag) {
        if (tag == null) return null;
        for (StatutoryLevel level : values()) {
            if (level.name().equalsIgnoreCase(tag)) {
                return level;
            }
        }
        return null;
    }

    /** 本层级是否比 other 更具体 */
    public boolean isMoreSpecificThan(StatutoryLevel other) {
        return ordinal() > other.ordinal();
    }
}
