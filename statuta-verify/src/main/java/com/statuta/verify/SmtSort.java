package com.statuta.verify;

/**
 * 求解器层面的排序（SMT-LIB sort）
 */
public enum SmtSort {
    INT("Int"),
    REAL("Real"),
    BOOL("Bool"),
    STRING("String");

    private final String smtName;

    SmtSort(String smtName) {
        this.smtName = smtName;
    }

    public String getSmtName() {
        return smtName;
    }

    public boolean isNumeric() {
        return this == INT || this == REAL;
    }
}
