package com.statuta.cli;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.statuta.compiler.pipeline.CompilerOptions;
import com.statuta.verify.DomainPolicy;
import com.statuta.verify.VerifierConfig;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * statuta.json 配置
 *
 * <p>查找顺序：{@code --config} 指定的文件、工作目录下的 statuta.json、默认值。
 * 环境变量 {@code STATUTA_SOLVER} 与 {@code STATUTA_SOLVER_TIMEOUT} 覆盖文件中的值，
 * 命令行参数再覆盖两者。</p>
 *
 * <pre>
 * {
 *   "referenceDate": "01-06-2024",
 *   "parallelChecks": true,
 *   "percentMin": 0,
 *   "percentMax": 100,
 *   "moduleSearchPaths": ["lib"],
 *   "solver": "z3 -in -smt2",
 *   "solverTimeoutMillis": 10000,
 *   "moneyNonNegative": true,
 *   "durationNonNegative": true
 * }
 * </pre>
 */
public class StatutaConfig {

    private static final Logger LOG = Logger.getLogger(StatutaConfig.class.getName());

    public static final String FILE_NAME = "statuta.json";
    public static final String ENV_SOLVER = "STATUTA_SOLVER";
    public static final String ENV_SOLVER_TIMEOUT = "STATUTA_SOLVER_TIMEOUT";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd-MM-uuuu");
    private static final Gson GSON = new Gson();

    // Gson 直接填充的字段；缺省为 null 表示沿用默认值
    String referenceDate;
    Boolean parallelChecks;
    BigDecimal percentMin;
    BigDecimal percentMax;
    List<String> moduleSearchPaths;
    String solver;
    Long solverTimeoutMillis;
    Boolean moneyNonNegative;
    Boolean durationNonNegative;

    /** 配置文件所在目录，相对的搜索路径以它为基准 */
    private transient Path baseDir;

    /**
     * 按查找顺序加载配置并应用环境变量
     *
     * @param explicit   {@code --config} 指定的文件，可为 null
     * @param workingDir 查找 statuta.json 的目录
     * @param env        环境变量
     */
    public static StatutaConfig load(Path explicit, Path workingDir, Map<String, String> env) {
        StatutaConfig config;
        if (explicit != null) {
            if (!Files.isRegularFile(explicit)) {
                throw new ConfigException("Config file not found: " + explicit);
            }
            config = read(explicit);
        } else {
            Path local = workingDir.resolve(FILE_NAME);
            config = Files.isRegularFile(local) ? read(local) : new StatutaConfig();
            if (config.baseDir == null) {
                config.baseDir = workingDir;
            }
        }
        config.applyEnvironment(env);
        return config;
    }

    static StatutaConfig read(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            StatutaConfig config = GSON.fromJson(reader, StatutaConfig.class);
            if (config == null) {
                config = new StatutaConfig();
            }
            Path parent = file.toAbsolutePath().getParent();
            config.baseDir = parent != null ? parent : Paths.get("");
            LOG.fine(() -> "Loaded configuration from " + file);
            return config;
        } catch (IOException e) {
            throw new ConfigException("Cannot read config file " + file + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new ConfigException("Invalid JSON in config file " + file + ": " + e.getMessage(), e);
        }
    }

    void applyEnvironment(Map<String, String> env) {
        String envSolver = env.get(ENV_SOLVER);
        if (envSolver != null && !envSolver.trim().isEmpty()) {
            solver = envSolver;
        }
        String envTimeout = env.get(ENV_SOLVER_TIMEOUT);
        if (envTimeout != null && !envTimeout.trim().isEmpty()) {
            try {
                solverTimeoutMillis = Long.parseLong(envTimeout.trim());
            } catch (NumberFormatException e) {
                throw new ConfigException(ENV_SOLVER_TIMEOUT + " must be a number of milliseconds: " + envTimeout, e);
            }
        }
    }

    // ============ 转换 ============

    public CompilerOptions toCompilerOptions() {
        CompilerOptions options = new CompilerOptions();
        if (referenceDate != null) {
            options.setReferenceDate(parseDate(referenceDate));
        }
        if (parallelChecks != null) {
            options.setParallelChecks(parallelChecks);
        }
        if (percentMin != null || percentMax != null) {
            try {
                options.setPercentRange(percentMin != null ? percentMin : options.getPercentMin(),
                        percentMax != null ? percentMax : options.getPercentMax());
            } catch (IllegalArgumentException e) {
                throw new ConfigException(e.getMessage(), e);
            }
        }
        if (moduleSearchPaths != null) {
            for (String p : moduleSearchPaths) {
                options.addModuleSearchPath(baseDir != null ? baseDir.resolve(p) : Paths.get(p));
            }
        }
        return options;
    }

    public VerifierConfig toVerifierConfig() {
        VerifierConfig config = new VerifierConfig();
        try {
            if (solver != null) {
                config.setSolverCommand(solver);
            }
            if (solverTimeoutMillis != null) {
                config.setTimeoutMillis(solverTimeoutMillis);
            }
            DomainPolicy policy = DomainPolicy.defaults();
            if (moneyNonNegative != null) {
                policy.setMoneyNonNegative(moneyNonNegative);
            }
            if (durationNonNegative != null) {
                policy.setDurationNonNegative(durationNonNegative);
            }
            if (percentMin != null || percentMax != null) {
                policy.setPercentRange(percentMin != null ? percentMin : policy.getPercentMin(),
                        percentMax != null ? percentMax : policy.getPercentMax());
            }
            config.setDomainPolicy(policy);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), e);
        }
        return config;
    }

    /** 接受 dd-MM-yyyy 与 yyyy-MM-dd */
    public static LocalDate parseDate(String text) {
        String t = text.trim();
        try {
            return t.length() == 10 && t.charAt(4) == '-' ? LocalDate.parse(t) : LocalDate.parse(t, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new ConfigException("Invalid date '" + text + "', expected DD-MM-YYYY", e);
        }
    }

    // ============ 命令行覆盖 ============

    public StatutaConfig overrideReferenceDate(String date) {
        if (date != null) referenceDate = date;
        return this;
    }

    public StatutaConfig overrideSolver(String command) {
        if (command != null) solver = command;
        return this;
    }

    public StatutaConfig overrideTimeout(Long millis) {
        if (millis != null) solverTimeoutMillis = millis;
        return this;
    }

    public StatutaConfig addSearchPaths(List<String> paths, Path workingDir) {
        if (paths == null || paths.isEmpty()) return this;
        if (moduleSearchPaths == null) {
            moduleSearchPaths = new ArrayList<>();
        }
        // 命令行给出的路径相对于工作目录
        for (String p : paths) {
            moduleSearchPaths.add(workingDir.resolve(p).toAbsolutePath().toString());
        }
        return this;
    }

    public String getSolver() {
        return solver;
    }

    public Long getSolverTimeoutMillis() {
        return solverTimeoutMillis;
    }

    public String getReferenceDate() {
        return referenceDate;
    }
}
