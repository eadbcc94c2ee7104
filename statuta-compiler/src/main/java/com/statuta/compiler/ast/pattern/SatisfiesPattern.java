package com.statuta.compiler.ast.pattern;

import com.statuta.compiler.ast.SourceLocation;

/**
 * {@code satisfies LegalTest}：被匹配值满足指定法律测试
 */
public class SatisfiesPattern extends Pattern {
    private final String testName;

    public SatisfiesPattern(SourceLocation location, String testName) {
        super(location);
        this.testName = testName;
    }

    public String getTestName() {
        return testName;
    }

    @Override
    public <R> R accept(PatternVisitor<R> visitor) {
        return visitor.visitSatisfies(this);
    }
}
