package com.statuta.verify.solver;

/**
 * 调用外部求解器失败
 */
public class SolverInvocationException extends Exception {

    public enum Kind {
        /** 求解器程序不存在或无法启动 */
        UNAVAILABLE,
        TIMEOUT,
        /** 输出不是 sat/unsat/unknown */
        MALFORMED_OUTPUT,
        /** 求解器报告了错误 */
        SOLVER_ERROR
    }

    private final Kind kind;

    public SolverInvocationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SolverInvocationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
