package com.statuta.verify;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 验证器配置
 */
public class VerifierConfig {

    public static final List<String> DEFAULT_SOLVER_COMMAND =
            Collections.unmodifiableList(Arrays.asList("z3", "-in", "-smt2"));
    public static final long DEFAULT_TIMEOUT_MILLIS = 10_000L;

    private List<String> solverCommand = DEFAULT_SOLVER_COMMAND;
    private long timeoutMillis = DEFAULT_TIMEOUT_MILLIS;
    private DomainPolicy domainPolicy = DomainPolicy.defaults();

    public List<String> getSolverCommand() {
        return solverCommand;
    }

    public VerifierConfig setSolverCommand(List<String> solverCommand) {
        if (solverCommand == null || solverCommand.isEmpty()) {
            throw new IllegalArgumentException("solver command must not be empty");
        }
        this.solverCommand = Collections.unmodifiableList(new ArrayList<>(solverCommand));
        return this;
    }

    /** 按空白拆分命令行，如 {@code "cvc5 --lang smt2"} */
    public VerifierConfig setSolverCommand(String commandLine) {
        String trimmed = commandLine == null ? "" : commandLine.trim();
        return setSolverCommand(trimmed.isEmpty() ? Collections.<String>emptyList() : Arrays.asList(trimmed.split("\\s+")));
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    public VerifierConfig setTimeoutMillis(long timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("solver timeout must be positive: " + timeoutMillis);
        }
        this.timeoutMillis = timeoutMillis;
        return this;
    }

    public DomainPolicy getDomainPolicy() {
        return domainPolicy;
    }

    public VerifierConfig setDomainPolicy(DomainPolicy domainPolicy) {
        this.domainPolicy = domainPolicy != null ? domainPolicy : DomainPolicy.defaults();
        return this;
    }

    @Override
    public String toString() {
        return "VerifierConfig{solver=" + String.join(" ", solverCommand)
                + ", timeout=" + timeoutMillis + "ms, " + domainPolicy + "}";
    }
}
