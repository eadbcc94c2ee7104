package com.statuta.compiler.pipeline;

import com.statuta.compiler.ast.item.StructDecl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 编译流水线集成测试
 */
class StatutaCompilerTest {

    private static final LocalDate REFERENCE = LocalDate.of(2024, 6, 1);

    private static Path fixture(String name) throws URISyntaxException {
        return Paths.get(StatutaCompilerTest.class.getResource("/programs/" + name).toURI());
    }

    private static StatutaCompiler compiler(boolean parallel) {
        return new StatutaCompiler(new CompilerOptions()
                .setReferenceDate(REFERENCE)
                .setParallelChecks(parallel));
    }

    private static List<String> kinds(CompilationResult result) {
        List<String> kinds = new ArrayList<>();
        for (Diagnostic d : result.getDiagnostics()) {
            kinds.add(d.getPhase() + ":" + d.getKind());
        }
        return kinds;
    }

    // ================================================================
    // 完整流水线
    // ================================================================

    @Nested
    @DisplayName("检查阶段")
    class CheckPhaseTests {

        @Test
        @DisplayName("合法的法条文件编译成功")
        void testCleanFile() throws Exception {
            CompilationResult result = compiler(false).compile(fixture("penal.sta"));
            assertTrue(result.isSuccess(), result.getDiagnostics().toString());
            assertFalse(result.isFatal());
            assertNotNull(result.getResolved().getLayout("Offence"));
        }

        @Test
        @DisplayName("三个检查器的诊断按固定顺序合并")
        void testDiagnosticsMerged() throws Exception {
            CompilationResult result = compiler(false).compile(fixture("broken.sta"));
            assertFalse(result.isFatal());
            assertEquals(List.of("CHECK:UNDEFINED_SYMBOL", "HIERARCHY:LEVEL_INVERSION", "TEMPORAL:EXPIRED_SUNSET"),
                    kinds(result));
            assertEquals(1, result.getDiagnostics(Diagnostic.Phase.HIERARCHY).size());
            assertFalse(result.getDiagnostics().get(0).isFatal());
        }

        @Test
        @DisplayName("并行检查与串行检查结果一致")
        void testParallelMatchesSequential() throws Exception {
            List<String> sequential = kinds(compiler(false).compile(fixture("broken.sta")));
            List<String> parallel = kinds(compiler(true).compile(fixture("broken.sta")));
            assertEquals(sequential, parallel);
        }

        @Test
        @DisplayName("参考日期影响日落检查")
        void testReferenceDate() {
            String source = "struct S { @sunset(01-01-2030) int x }";
            assertTrue(compiler(false).compile(source, "s.sta").isSuccess());
            StatutaCompiler later = new StatutaCompiler(new CompilerOptions().setReferenceDate(LocalDate.of(2031, 1, 1)));
            assertEquals(1, later.compile(source, "s.sta").getDiagnostics(Diagnostic.Phase.TEMPORAL).size());
        }

        @Test
        @DisplayName("百分比范围来自编译选项")
        void testPercentRangeOption() {
            String source = "percent rate := 150%";
            assertFalse(compiler(false).compile(source, "r.sta").isSuccess());

            CompilerOptions wide = new CompilerOptions().setPercentRange(BigDecimal.ZERO, BigDecimal.valueOf(200));
            assertTrue(new StatutaCompiler(wide).compile(source, "r.sta").isSuccess());
            assertThrows(IllegalArgumentException.class,
                    () -> new CompilerOptions().setPercentRange(BigDecimal.TEN, BigDecimal.ONE));
        }
    }

    // ================================================================
    // 致命错误
    // ================================================================

    @Nested
    @DisplayName("致命错误")
    class FatalTests {

        @Test
        @DisplayName("词法错误终止编译")
        void testLexError() {
            CompilationResult result = compiler(false).compile("int x := 1 # 2", "bad.sta");
            assertTrue(result.isFatal());
            assertNull(result.getProgram());
            assertEquals(1, result.getDiagnostics().size());
            Diagnostic d = result.getDiagnostics().get(0);
            assertEquals(Diagnostic.Phase.LEX, d.getPhase());
            assertEquals("LexError", d.getKind());
            assertTrue(d.isFatal());
        }

        @Test
        @DisplayName("语法错误终止编译")
        void testParseError() {
            CompilationResult result = compiler(false).compile("struct { int a }", "bad.sta");
            assertTrue(result.isFatal());
            assertEquals("ParseError", result.getDiagnostics().get(0).getKind());
            assertEquals(1, result.getDiagnostics().get(0).getLocation().getLine());
        }

        @Test
        @DisplayName("继承成环终止编译，不运行检查器")
        void testResolveError() {
            CompilationResult result = compiler(false).compile(
                    "struct A extends B { int a }\nstruct B extends A { int b }\nint x := missing", "bad.sta");
            assertTrue(result.isFatal());
            assertEquals(1, result.getDiagnostics().size());
            assertEquals("ResolveError.EXTENDS_CYCLE", result.getDiagnostics().get(0).getKind());
        }
    }

    // ================================================================
    // 导入
    // ================================================================

    @Nested
    @DisplayName("导入")
    class ImportTests {

        @TempDir
        Path dir;

        @Test
        @DisplayName("导入相对于源文件所在目录解析")
        void testImportRelativeToFile() throws IOException {
            Files.write(dir.resolve("base.sta"),
                    "struct Person { string name }".getBytes(StandardCharsets.UTF_8));
            Path main = dir.resolve("main.sta");
            Files.write(main, ("referencing Person from \"base\"\n"
                    + "struct Accused extends Person { bool minor }\n"
                    + "Accused a := Accused { name := \"Tan\", minor := false }").getBytes(StandardCharsets.UTF_8));

            CompilationResult result = compiler(false).compile(main);
            assertTrue(result.isSuccess(), result.getDiagnostics().toString());
            assertEquals(List.of("name", "minor"), result.getResolved().getLayout("Accused").getFieldNames());
            assertTrue(result.getResolved().getImportScope().resolveLocal("Person").getDeclaration() instanceof StructDecl);
        }

        @Test
        @DisplayName("内存源码通过搜索目录导入")
        void testSearchPathForInMemorySource() throws IOException {
            Files.write(dir.resolve("rates.sta"), "percent gst := 9%".getBytes(StandardCharsets.UTF_8));
            StatutaCompiler compiler = new StatutaCompiler(new CompilerOptions()
                    .setReferenceDate(REFERENCE)
                    .addModuleSearchPath(dir));
            assertTrue(compiler.compile("referencing gst from \"rates\"\npercent copy := gst", "m.sta").isSuccess());
        }

        @Test
        @DisplayName("找不到导入模块是致命错误")
        void testMissingImport() {
            CompilationResult result = compiler(false).compile("referencing x from \"absent\"", "m.sta");
            assertTrue(result.isFatal());
            assertEquals("ResolveError.UNRESOLVED_IMPORT", result.getDiagnostics().get(0).getKind());
        }
    }
}
