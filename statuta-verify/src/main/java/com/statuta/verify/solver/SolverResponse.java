package com.statuta.verify.solver;

/**
 * 求解器应答：判定结果与 sat 时的模型文本
 */
public final class SolverResponse {

    public enum Status {
        SAT,
        UNSAT,
        UNKNOWN
    }

    private final Status status;
    private final String model;

    public SolverResponse(Status status, String model) {
        this.status = status;
        this.model = model == null ? "" : model;
    }

    public static SolverResponse unsat() {
        return new SolverResponse(Status.UNSAT, "");
    }

    public static SolverResponse unknown() {
        return new SolverResponse(Status.UNKNOWN, "");
    }

    public static SolverResponse sat(String model) {
        return new SolverResponse(Status.SAT, model);
    }

    public Status getStatus() {
        return status;
    }

    /** sat 时 get-model 的输出，其余情况为空串 */
    public String getModel() {
        return model;
    }

    /**
     * 解析求解器的标准输出
     *
     * <p>第一个非空行必须是 sat、unsat 或 unknown。unsat 与 unknown 之后 get-model
     * 报告的错误不予理会。</p>
     */
    public static SolverResponse parse(String output) throws SolverInvocationException {
        String text = output == null ? "" : output;
        String[] lines = text.split("\\r?\\n");
        int i = 0;
        while (i < lines.length && lines[i].trim().isEmpty()) i++;
        if (i == lines.length) {
            throw new SolverInvocationException(SolverInvocationException.Kind.MALFORMED_OUTPUT,
                    "Solver produced no output");
        }

        String first = lines[i].trim();
        switch (first) {
            case "sat": {
                StringBuilder rest = new StringBuilder();
                for (int j = i + 1; j < lines.length; j++) {
                    rest.append(lines[j]).append('\n');
                }
                return sat(rest.toString().trim());
            }
            case "unsat":
                return unsat();
            case "unknown":
                return unknown();
            default:
                if (first.startsWith("(error")) {
                    throw new SolverInvocationException(SolverInvocationException.Kind.SOLVER_ERROR,
                            "Solver reported an error: " + first);
                }
                throw new SolverInvocationException(SolverInvocationException.Kind.MALFORMED_OUTPUT,
                        "Unexpected solver output: " + first);
        }
    }

    @Override
    public String toString() {
        return status.name().toLowerCase() + (model.isEmpty() ? "" : " " + model);
    }
}
