package com.statuta.verify.solver;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * 以子进程方式调用求解器（默认 {@code z3 -in -smt2}），查询从标准输入写入
 */
public class ProcessSolverBackend implements SolverBackend {

    private static final Logger LOG = Logger.getLogger(ProcessSolverBackend.class.getName());

    private final List<String> command;
    private final long timeoutMillis;

    public ProcessSolverBackend(List<String> command, long timeoutMillis) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("solver command must not be empty");
        }
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("solver timeout must be positive: " + timeoutMillis);
        }
        this.command = Collections.unmodifiableList(new ArrayList<>(command));
        this.timeoutMillis = timeoutMillis;
    }

    public List<String> getCommand() {
        return command;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    @Override
    public SolverResponse solve(String query) throws SolverInvocationException {
        Process proc;
        try {
            proc = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new SolverInvocationException(SolverInvocationException.Kind.UNAVAILABLE,
                    "Cannot start solver '" + String.join(" ", command) + "': " + e.getMessage(), e);
        }

        ExecutorService readers = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "statuta-solver-io");
            t.setDaemon(true);
            return t;
        });
        try {
            Future<String> stdout = readers.submit(() -> readStream(proc.getInputStream()));
            Future<String> stderr = readers.submit(() -> readStream(proc.getErrorStream()));

            try (OutputStream in = proc.getOutputStream()) {
                in.write(query.getBytes(StandardCharsets.UTF_8));
                in.write("(exit)\n".getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                // 求解器提前退出时写入会失败，交给下面的退出码与输出判断
                LOG.fine(() -> "Writing query to solver failed: " + e.getMessage());
            }

            long start = System.nanoTime();
            if (!proc.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new SolverInvocationException(SolverInvocationException.Kind.TIMEOUT,
                        "Solver did not answer within " + timeoutMillis + " ms");
            }
            String out = stdout.get(timeoutMillis, TimeUnit.MILLISECONDS);
            String err = stderr.get(timeoutMillis, TimeUnit.MILLISECONDS);
            int exitCode = proc.exitValue();
            LOG.fine(() -> "Solver exited with " + exitCode + " after "
                    + TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) + " ms");

            try {
                return SolverResponse.parse(out);
            } catch (SolverInvocationException e) {
                if (exitCode != 0) {
                    String detail = err.trim().isEmpty() ? out.trim() : err.trim();
                    throw new SolverInvocationException(SolverInvocationException.Kind.SOLVER_ERROR,
                            "Solver exited with code " + exitCode + ": " + detail, e);
                }
                throw e;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SolverInvocationException(SolverInvocationException.Kind.TIMEOUT,
                    "Interrupted while waiting for the solver", e);
        } catch (TimeoutException e) {
            throw new SolverInvocationException(SolverInvocationException.Kind.TIMEOUT,
                    "Solver output was not closed within " + timeoutMillis + " ms", e);
        } catch (ExecutionException e) {
            throw new SolverInvocationException(SolverInvocationException.Kind.SOLVER_ERROR,
                    "Failed to read solver output: " + e.getCause().getMessage(), e.getCause());
        } finally {
            proc.destroyForcibly();
            readers.shutdownNow();
        }
    }

    private static String readStream(InputStream is) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[4096];
        int n;
        while ((n = is.read(chunk)) != -1) {
            buffer.write(chunk, 0, n);
        }
        return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "ProcessSolverBackend" + command;
    }
}
