package com.statuta.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.statuta.verify.VerifierConfig;
import com.statuta.verify.solver.SolverBackend;
import com.statuta.verify.solver.SolverInvocationException;
import com.statuta.verify.solver.SolverResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 命令行端到端测试：求解器由脚本化后端代替
 */
class MainTest {

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private final List<String> queries = new ArrayList<>();
    private final List<VerifierConfig> configs = new ArrayList<>();

    private SolverBackend backend = query -> {
        throw new SolverInvocationException(SolverInvocationException.Kind.SOLVER_ERROR, "no backend scripted");
    };

    private int run(String... args) {
        return run(Collections.<String, String>emptyMap(), args);
    }

    private int run(Map<String, String> env, String... args) {
        Main main = new Main(env, dir, config -> {
            configs.add(config);
            return query -> {
                queries.add(query);
                return backend.solve(query);
            };
        });
        CommandLine cmd = Main.commandLine(main);
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private Path source(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static final String CLEAN = "enum Verdict { Guilty, Acquitted }\n"
            + "principle Positive { forall x: int, x > 0 }\n"
            + "principle Bounded { forall s: BoundedInt<0, 14>, s <= 14 }\n";

    private static final String BROKEN = "int total := missing + 1\n";

    @Test
    @DisplayName("没有子命令时输出用法")
    void testUsage() {
        assertEquals(Main.EXIT_OK, run());
        assertTrue(out.toString().contains("Usage: statuta"), out.toString());
    }

    @Test
    @DisplayName("未知选项是无效输入")
    void testInvalidInput() {
        assertEquals(Main.EXIT_PROBLEMS, run("check", "--no-such-flag", "x.sta"));
    }

    // ================================================================
    // check
    // ================================================================

    @Nested
    @DisplayName("check")
    class CheckTests {

        @Test
        @DisplayName("没有问题")
        void testClean() throws IOException {
            source("clean.sta", CLEAN);
            assertEquals(Main.EXIT_OK, run("check", "clean.sta"));
            assertTrue(out.toString().contains("no problems found"), out.toString());
        }

        @Test
        @DisplayName("报告诊断并以 1 退出")
        void testProblems() throws IOException {
            source("broken.sta", BROKEN);
            assertEquals(Main.EXIT_PROBLEMS, run("check", "broken.sta"));
            String text = out.toString();
            assertTrue(text.contains(":1:"), text);
            assertTrue(text.contains("[check UNDEFINED_SYMBOL]"), text);
            assertTrue(text.contains("1 problem"), text);
        }

        @Test
        @DisplayName("JSON 输出")
        void testJson() throws IOException {
            source("broken.sta", BROKEN);
            assertEquals(Main.EXIT_PROBLEMS, run("check", "--json", "broken.sta"));
            JsonObject report = JsonParser.parseString(out.toString()).getAsJsonObject();
            assertFalse(report.get("success").getAsBoolean());
            assertFalse(report.get("fatal").getAsBoolean());
            JsonArray diagnostics = report.getAsJsonArray("diagnostics");
            assertEquals(1, diagnostics.size());
            JsonObject first = diagnostics.get(0).getAsJsonObject();
            assertEquals("CHECK", first.get("phase").getAsString());
            assertEquals("UNDEFINED_SYMBOL", first.get("kind").getAsString());
            assertEquals(1, first.get("line").getAsInt());
        }

        @Test
        @DisplayName("语法错误是致命诊断")
        void testFatal() throws IOException {
            source("bad.sta", "struct { int a }");
            assertEquals(Main.EXIT_PROBLEMS, run("check", "bad.sta"));
            assertTrue(out.toString().contains("error [parse ParseError]"), out.toString());
        }

        @Test
        @DisplayName("参考日期来自命令行")
        void testReferenceDate() throws IOException {
            source("sunset.sta", "struct S { @sunset(01-01-2030) int x }");
            assertEquals(Main.EXIT_OK, run("check", "--reference-date", "01-01-2025", "sunset.sta"));
            assertEquals(Main.EXIT_PROBLEMS, run("check", "--reference-date", "01-01-2031", "sunset.sta"));
            assertTrue(out.toString().contains("EXPIRED_SUNSET"));
        }

        @Test
        @DisplayName("参考日期来自配置文件")
        void testReferenceDateFromConfig() throws IOException {
            source("sunset.sta", "struct S { @sunset(01-01-2030) int x }");
            source("statuta.json", "{ \"referenceDate\": \"2031-01-01\" }");
            assertEquals(Main.EXIT_PROBLEMS, run("check", "sunset.sta"));
        }

        @Test
        @DisplayName("无效的参考日期")
        void testBadReferenceDate() throws IOException {
            source("clean.sta", CLEAN);
            assertEquals(Main.EXIT_PROBLEMS, run("check", "--reference-date", "someday", "clean.sta"));
            assertTrue(err.toString().contains("error: Invalid date 'someday'"), err.toString());
        }

        @Test
        @DisplayName("文件不存在")
        void testMissingFile() {
            assertEquals(Main.EXIT_PROBLEMS, run("check", "absent.sta"));
            assertTrue(err.toString().contains("Cannot read"), err.toString());
        }

        @Test
        @DisplayName("命令行搜索目录")
        void testSearchPath() throws IOException {
            Files.createDirectories(dir.resolve("lib"));
            source("lib/rates.sta", "percent gst := 9%");
            source("main.sta", "referencing gst from \"rates\"\npercent copy := gst");
            assertEquals(Main.EXIT_PROBLEMS, run("check", "main.sta"));
            out.getBuffer().setLength(0);
            assertEquals(Main.EXIT_OK, run("check", "-I", "lib", "main.sta"), out.toString());
        }
    }

    // ================================================================
    // conflicts
    // ================================================================

    @Nested
    @DisplayName("conflicts")
    class ConflictsTests {

        @Test
        @DisplayName("定义一致")
        void testNoConflicts() throws IOException {
            source("a.sta", CLEAN);
            source("b.sta", CLEAN);
            assertEquals(Main.EXIT_OK, run("conflicts", "a.sta", "b.sta"));
            assertTrue(out.toString().contains("no conflicts found"), out.toString());
        }

        @Test
        @DisplayName("同名定义不一致")
        void testConflicts() throws IOException {
            source("statute1.sta", "enum Verdict { Guilty, NotGuilty }\nstruct Person { string name }\n");
            source("statute2.sta", "enum Verdict { Convicted, Acquitted }\nstruct Person { string name }\n");
            assertEquals(Main.EXIT_PROBLEMS, run("conflicts", "statute1.sta", "statute2.sta"));
            String text = out.toString();
            assertTrue(text.contains("[conflict ENUM_VARIANTS] Enum 'Verdict' has conflicting variants"), text);
            assertTrue(text.contains("1 conflict\n"), text);
        }

        @Test
        @DisplayName("JSON 输出")
        void testJson() throws IOException {
            source("f1.sta", "enum Status { A, B }");
            source("f2.sta", "enum Status { C, D }");
            assertEquals(Main.EXIT_PROBLEMS, run("conflicts", "--json", "f1.sta", "f2.sta"));
            JsonObject report = JsonParser.parseString(out.toString()).getAsJsonObject();
            assertEquals(1, report.get("conflictCount").getAsInt());
            JsonObject first = report.getAsJsonArray("conflicts").get(0).getAsJsonObject();
            assertEquals("CONFLICT", first.get("phase").getAsString());
            assertEquals("ENUM_VARIANTS", first.get("kind").getAsString());
        }

        @Test
        @DisplayName("语法错误时不比较")
        void testFatal() throws IOException {
            source("good.sta", CLEAN);
            source("bad.sta", "struct { int a }");
            assertEquals(Main.EXIT_PROBLEMS, run("conflicts", "good.sta", "bad.sta"));
            assertTrue(out.toString().contains("error [parse ParseError]"), out.toString());
            assertFalse(out.toString().contains("conflict"), out.toString());
        }
    }

    // ================================================================
    // verify
    // ================================================================

    @Nested
    @DisplayName("verify")
    class VerifyTests {

        @Test
        @DisplayName("反例使命令以 1 退出")
        void testDisproved() throws IOException {
            source("clean.sta", CLEAN);
            backend = query -> query.contains("declare-const x")
                    ? SolverResponse.sat("((define-fun x () Int 0))")
                    : SolverResponse.unsat();

            assertEquals(Main.EXIT_PROBLEMS, run("verify", "clean.sta"));
            String text = out.toString();
            assertTrue(text.contains("principle Positive: DISPROVED\nCounterexample found:\n  x = 0"), text);
            assertTrue(text.contains("principle Bounded: VALID"), text);
            assertEquals(2, queries.size());
        }

        @Test
        @DisplayName("全部成立")
        void testAllValid() throws IOException {
            source("clean.sta", CLEAN);
            backend = query -> SolverResponse.unsat();
            assertEquals(Main.EXIT_OK, run("verify", "clean.sta"));
        }

        @Test
        @DisplayName("只验证指定的 principle 并输出陈述")
        void testSinglePrinciple() throws IOException {
            source("clean.sta", CLEAN);
            backend = query -> SolverResponse.unsat();
            assertEquals(Main.EXIT_OK, run("verify", "--principle", "Bounded", "--explain", "clean.sta"));
            assertEquals(1, queries.size());
            assertTrue(out.toString().contains("Principle 'Bounded' states that:"), out.toString());
            assertFalse(out.toString().contains("Positive"));
        }

        @Test
        @DisplayName("principle 不存在")
        void testUnknownPrinciple() throws IOException {
            source("clean.sta", CLEAN);
            assertEquals(Main.EXIT_PROBLEMS, run("verify", "-p", "Missing", "clean.sta"));
            assertTrue(err.toString().contains("No principle named 'Missing'"));
            assertTrue(queries.isEmpty());
        }

        @Test
        @DisplayName("求解器故障以 2 退出")
        void testSolverFailure() throws IOException {
            source("clean.sta", CLEAN);
            backend = query -> {
                throw new SolverInvocationException(SolverInvocationException.Kind.UNAVAILABLE, "z3 not found");
            };
            assertEquals(Main.EXIT_SOLVER_FAILURE, run("verify", "clean.sta"));
            assertTrue(err.toString().contains("error: solver unavailable: z3 not found"), err.toString());
        }

        @Test
        @DisplayName("检查未通过时不调用求解器")
        void testBrokenFileNotVerified() throws IOException {
            source("broken.sta", BROKEN + "principle P { forall x: int, x > 0 }\n");
            assertEquals(Main.EXIT_PROBLEMS, run("verify", "broken.sta"));
            assertTrue(queries.isEmpty());
            assertTrue(err.toString().contains("UNDEFINED_SYMBOL"), err.toString());
        }

        @Test
        @DisplayName("求解器命令与超时按优先级合并")
        void testSolverSettings() throws IOException {
            source("clean.sta", CLEAN);
            backend = query -> SolverResponse.unsat();
            Map<String, String> env = Collections.singletonMap(StatutaConfig.ENV_SOLVER_TIMEOUT, "1234");
            assertEquals(Main.EXIT_OK, run(env, "verify", "--solver", "cvc5 --lang smt2", "clean.sta"));

            VerifierConfig config = configs.get(0);
            assertEquals(Arrays.asList("cvc5", "--lang", "smt2"), config.getSolverCommand());
            assertEquals(1234L, config.getTimeoutMillis());
        }

        @Test
        @DisplayName("JSON 输出")
        void testJson() throws IOException {
            source("clean.sta", CLEAN);
            backend = query -> query.contains("declare-const x")
                    ? SolverResponse.sat("((define-fun x () Int (- 2)))")
                    : SolverResponse.unsat();
            assertEquals(Main.EXIT_PROBLEMS, run("verify", "--json", "clean.sta"));

            JsonArray results = JsonParser.parseString(out.toString()).getAsJsonArray();
            assertEquals(2, results.size());
            JsonObject positive = results.get(0).getAsJsonObject();
            assertEquals("Positive", positive.get("principle").getAsString());
            assertEquals("DISPROVED", positive.get("verdict").getAsString());
            assertEquals("-2", positive.getAsJsonObject("counterexample").get("x").getAsString());
            assertEquals("VALID", results.get(1).getAsJsonObject().get("verdict").getAsString());
        }
    }
}
