package com.statuta.cli;

import com.statuta.compiler.pipeline.CompilerOptions;
import com.statuta.verify.VerifierConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StatutaConfig 加载与覆盖顺序测试
 */
class StatutaConfigTest {

    @TempDir
    Path dir;

    private static final Map<String, String> NO_ENV = Collections.emptyMap();

    private Path write(String name, String json) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.write(file, json.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    // ================================================================
    // 查找顺序
    // ================================================================

    @Nested
    @DisplayName("查找顺序")
    class LookupTests {

        @Test
        @DisplayName("没有配置文件时使用默认值")
        void testDefaults() {
            StatutaConfig config = StatutaConfig.load(null, dir, NO_ENV);
            VerifierConfig verifier = config.toVerifierConfig();
            assertEquals(VerifierConfig.DEFAULT_SOLVER_COMMAND, verifier.getSolverCommand());
            assertEquals(VerifierConfig.DEFAULT_TIMEOUT_MILLIS, verifier.getTimeoutMillis());
            assertFalse(config.toCompilerOptions().isParallelChecks());
        }

        @Test
        @DisplayName("读取工作目录下的 statuta.json")
        void testWorkingDirectoryFile() throws IOException {
            write("statuta.json", "{ \"referenceDate\": \"01-06-2024\", \"parallelChecks\": true,"
                    + " \"solver\": \"cvc5 --lang smt2\", \"solverTimeoutMillis\": 2500 }");
            StatutaConfig config = StatutaConfig.load(null, dir, NO_ENV);

            CompilerOptions options = config.toCompilerOptions();
            assertEquals(LocalDate.of(2024, 6, 1), options.getReferenceDate());
            assertTrue(options.isParallelChecks());
            VerifierConfig verifier = config.toVerifierConfig();
            assertEquals(Arrays.asList("cvc5", "--lang", "smt2"), verifier.getSolverCommand());
            assertEquals(2500L, verifier.getTimeoutMillis());
        }

        @Test
        @DisplayName("--config 优先于工作目录下的文件")
        void testExplicitFileWins() throws IOException {
            write("statuta.json", "{ \"solverTimeoutMillis\": 1 }");
            Path explicit = write("conf/custom.json", "{ \"solverTimeoutMillis\": 7000 }");
            assertEquals(7000L, StatutaConfig.load(explicit, dir, NO_ENV).toVerifierConfig().getTimeoutMillis());
        }

        @Test
        @DisplayName("搜索目录相对于配置文件")
        void testSearchPathRelativeToConfig() throws IOException {
            Path explicit = write("conf/custom.json", "{ \"moduleSearchPaths\": [\"lib\"] }");
            CompilerOptions options = StatutaConfig.load(explicit, dir, NO_ENV).toCompilerOptions();
            assertEquals(Collections.singletonList(dir.resolve("conf").resolve("lib").toAbsolutePath()),
                    options.getModuleSearchPaths());
        }

        @Test
        @DisplayName("指定的配置文件不存在")
        void testMissingExplicitFile() {
            ConfigException e = assertThrows(ConfigException.class,
                    () -> StatutaConfig.load(dir.resolve("absent.json"), dir, NO_ENV));
            assertTrue(e.getMessage().startsWith("Config file not found"));
        }

        @Test
        @DisplayName("无效的 JSON")
        void testInvalidJson() throws IOException {
            write("statuta.json", "{ \"solverTimeoutMillis\": \"soon\" ");
            assertThrows(ConfigException.class, () -> StatutaConfig.load(null, dir, NO_ENV));
        }
    }

    // ================================================================
    // 覆盖
    // ================================================================

    @Nested
    @DisplayName("覆盖")
    class OverrideTests {

        @Test
        @DisplayName("环境变量覆盖文件，命令行覆盖环境变量")
        void testPrecedence() throws IOException {
            write("statuta.json", "{ \"solver\": \"from-file\", \"solverTimeoutMillis\": 100 }");
            Map<String, String> env = new HashMap<>();
            env.put(StatutaConfig.ENV_SOLVER, "from-env -q");
            env.put(StatutaConfig.ENV_SOLVER_TIMEOUT, "200");

            StatutaConfig config = StatutaConfig.load(null, dir, env);
            assertEquals(Arrays.asList("from-env", "-q"), config.toVerifierConfig().getSolverCommand());
            assertEquals(200L, config.toVerifierConfig().getTimeoutMillis());

            config.overrideSolver("from-flag").overrideTimeout(300L);
            assertEquals(Collections.singletonList("from-flag"), config.toVerifierConfig().getSolverCommand());
            assertEquals(300L, config.toVerifierConfig().getTimeoutMillis());
        }

        @Test
        @DisplayName("未给出的命令行参数不覆盖")
        void testNullOverridesIgnored() {
            Map<String, String> env = Collections.singletonMap(StatutaConfig.ENV_SOLVER_TIMEOUT, "450");
            StatutaConfig config = StatutaConfig.load(null, dir, env).overrideTimeout(null).overrideSolver(null);
            assertEquals(450L, config.toVerifierConfig().getTimeoutMillis());
        }

        @Test
        @DisplayName("环境变量中的超时不是数字")
        void testBadTimeoutVariable() {
            Map<String, String> env = Collections.singletonMap(StatutaConfig.ENV_SOLVER_TIMEOUT, "ten");
            assertThrows(ConfigException.class, () -> StatutaConfig.load(null, dir, env));
        }

        @Test
        @DisplayName("百分比范围同时作用于检查与验证")
        void testPercentRange() throws IOException {
            write("statuta.json", "{ \"percentMax\": 200, \"moneyNonNegative\": false }");
            StatutaConfig config = StatutaConfig.load(null, dir, NO_ENV);
            assertEquals(0, BigDecimal.valueOf(200).compareTo(config.toCompilerOptions().getPercentMax()));
            VerifierConfig verifier = config.toVerifierConfig();
            assertEquals(0, BigDecimal.valueOf(200).compareTo(verifier.getDomainPolicy().getPercentMax()));
            assertFalse(verifier.getDomainPolicy().isMoneyNonNegative());
        }

        @Test
        @DisplayName("空的百分比范围")
        void testEmptyPercentRange() throws IOException {
            write("statuta.json", "{ \"percentMin\": 50, \"percentMax\": 10 }");
            StatutaConfig config = StatutaConfig.load(null, dir, NO_ENV);
            assertThrows(ConfigException.class, config::toCompilerOptions);
        }
    }

    @Test
    @DisplayName("日期格式")
    void testParseDate() {
        assertEquals(LocalDate.of(2024, 6, 1), StatutaConfig.parseDate("01-06-2024"));
        assertEquals(LocalDate.of(2024, 6, 1), StatutaConfig.parseDate("2024-06-01"));
        assertThrows(ConfigException.class, () -> StatutaConfig.parseDate("June 1st"));
    }
}
