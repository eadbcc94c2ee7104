package com.statuta.verify;

import com.statuta.verify.model.Counterexample;

/**
 * 单条 principle 的验证结论
 */
public final class VerificationResult {

    public enum Verdict {
        /** 全称命题成立，或存在命题找到了见证 */
        VALID,
        /** 全称命题有反例 */
        DISPROVED,
        /** 存在命题没有见证 */
        NO_WITNESS,
        UNKNOWN,
        /** 无法翻译为求解器查询 */
        ERROR
    }

    private final String principleName;
    private final Verdict verdict;
    private final Counterexample model;
    private final String message;
    private final String query;

    VerificationResult(String principleName, Verdict verdict, Counterexample model, String message, String query) {
        this.principleName = principleName;
        this.verdict = verdict;
        this.model = model;
        this.message = message;
        this.query = query;
    }

    public String getPrincipleName() {
        return principleName;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public boolean isValid() {
        return verdict == Verdict.VALID;
    }

    /** DISPROVED 时的反例，否则为 null */
    public Counterexample getCounterexample() {
        return model != null && !model.isWitness() ? model : null;
    }

    /** 存在命题 VALID 时的见证，否则为 null */
    public Counterexample getWitness() {
        return model != null && model.isWitness() ? model : null;
    }

    public String getMessage() {
        return message;
    }

    /** 提交给求解器的查询；ERROR 时为 null */
    public String getQuery() {
        return query;
    }

    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("principle ").append(principleName).append(": ").append(verdict);
        if (message != null && !message.isEmpty()) {
            sb.append("\n  ").append(message);
        }
        if (model != null) {
            sb.append('\n').append(model.format());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return principleName + ": " + verdict;
    }
}
