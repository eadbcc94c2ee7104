package com.statuta.verify.solver;

/**
 * SMT 求解器后端
 */
public interface SolverBackend {

    /**
     * 提交一条完整的 SMT-LIB 查询
     *
     * @param query 以 {@code (check-sat)} 与 {@code (get-model)} 结尾的脚本
     * @return 解析后的应答
     * @throws SolverInvocationException 求解器不可用、超时或输出无法识别
     */
    SolverResponse solve(String query) throws SolverInvocationException;
}
