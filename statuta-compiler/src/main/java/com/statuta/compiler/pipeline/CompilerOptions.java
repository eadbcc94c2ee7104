package com.statuta.compiler.pipeline;

import com.statuta.compiler.analysis.Checker;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译选项
 */
public final class CompilerOptions {

    private LocalDate referenceDate;
    private boolean parallelChecks = false;
    private BigDecimal percentMin = Checker.DEFAULT_PERCENT_MIN;
    private BigDecimal percentMax = Checker.DEFAULT_PERCENT_MAX;
    private final List<Path> moduleSearchPaths = new ArrayList<>();

    /** 时效检查的参考日期；未设置时为编译当天 */
    public LocalDate getReferenceDate() {
        return referenceDate != null ? referenceDate : LocalDate.now();
    }

    public CompilerOptions setReferenceDate(LocalDate referenceDate) {
        this.referenceDate = referenceDate;
        return this;
    }

    /** 是否并行运行三个检查器 */
    public boolean isParallelChecks() {
        return parallelChecks;
    }

    public CompilerOptions setParallelChecks(boolean parallelChecks) {
        this.parallelChecks = parallelChecks;
        return this;
    }

    public BigDecimal getPercentMin() {
        return percentMin;
    }

    public BigDecimal getPercentMax() {
        return percentMax;
    }

    /** 百分比常量的允许范围（含两端） */
    public CompilerOptions setPercentRange(BigDecimal min, BigDecimal max) {
        if (min.compareTo(max) > 0) {
            throw new IllegalArgumentException("percent range " + min + ".." + max + " is empty");
        }
        this.percentMin = min;
        this.percentMax = max;
        return this;
    }

    /** 导入模块时，在导入方所在目录之后依次查找的目录 */
    public List<Path> getModuleSearchPaths() {
        return Collections.unmodifiableList(moduleSearchPaths);
    }

    public CompilerOptions addModuleSearchPath(Path path) {
        moduleSearchPaths.add(path);
        return this;
    }
}
