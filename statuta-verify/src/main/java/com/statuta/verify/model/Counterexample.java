package com.statuta.verify.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 求解器模型中的变量赋值
 *
 * <p>同一结构既用于全称命题的反例，也用于存在命题的见证，区别只在 {@link #isWitness()}。</p>
 */
public final class Counterexample {

    /** 单个变量的取值 */
    public static final class Assignment {
        private final String name;
        private final String value;

        public Assignment(String name, String value) {
            this.name = name;
            this.value = value;
        }

        public String getName() { return name; }
        public String getValue() { return value; }

        @Override
        public String toString() {
            return name + " = " + value;
        }
    }

    private final List<Assignment> assignments;
    private final String explanation;
    private final boolean witness;

    public Counterexample(List<Assignment> assignments, String explanation, boolean witness) {
        this.assignments = Collections.unmodifiableList(new ArrayList<>(assignments));
        this.explanation = explanation;
        this.witness = witness;
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    public String getExplanation() {
        return explanation;
    }

    public boolean isWitness() {
        return witness;
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    /** 返回一个相同赋值、标记为见证的副本 */
    public Counterexample asWitness() {
        return new Counterexample(assignments, explanation, true);
    }

    public String get(String name) {
        for (Assignment a : assignments) {
            if (a.getName().equals(name)) return a.getValue();
        }
        return null;
    }

    public String format() {
        StringBuilder sb = new StringBuilder(witness ? "Witness found:" : "Counterexample found:");
        if (assignments.isEmpty()) {
            sb.append("\n  ").append(explanation);
        }
        for (Assignment a : assignments) {
            sb.append("\n  ").append(a);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
