package com.statuta.compiler.pipeline;

import com.statuta.compiler.analysis.ResolveException;
import com.statuta.compiler.ast.Program;
import com.statuta.compiler.ast.item.Item;
import com.statuta.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ModuleLoader 单元测试
 */
class ModuleLoaderTest {

    @TempDir
    Path dir;

    private void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    private List<String> names(List<Item> items) {
        List<String> result = new ArrayList<>();
        for (Item item : items) {
            result.add(item.getName());
        }
        return result;
    }

    private List<Item> load(String source, List<Path> searchPaths) {
        Program program = Parser.forSource(source, "main.sta").parse();
        return new ModuleLoader(searchPaths).loadImports(program, dir);
    }

    @Test
    @DisplayName("按名称导入，省略扩展名")
    void testNamedImport() throws IOException {
        write(dir.resolve("penal.sta"), "int maxYears := 7\nint minYears := 1\nenum Verdict { Guilty, Acquitted }");
        List<Item> items = load("referencing maxYears, Verdict from \"penal\"", Collections.emptyList());
        assertEquals(List.of("maxYears", "Verdict"), names(items));
    }

    @Test
    @DisplayName("通配导入带入全部条目")
    void testWildcardImport() throws IOException {
        write(dir.resolve("penal.sta"), "int a := 1\nint b := 2");
        assertEquals(List.of("a", "b"), names(load("referencing * from \"penal.sta\"", Collections.emptyList())));
    }

    @Test
    @DisplayName("导入结构体时带入其祖先")
    void testStructAncestors() throws IOException {
        write(dir.resolve("base.sta"), "struct Root { int id }\nstruct Mid extends Root { int m }\nstruct Leaf extends Mid { int l }");
        assertEquals(List.of("Leaf", "Mid", "Root"), names(load("referencing Leaf from \"base\"", Collections.emptyList())));
    }

    @Test
    @DisplayName("被导入模块自身的导入可继续转出")
    void testTransitiveImport() throws IOException {
        write(dir.resolve("a.sta"), "int rate := 5");
        write(dir.resolve("b.sta"), "referencing rate from \"a\"\nint other := 1");
        assertEquals(List.of("rate"), names(load("referencing rate from \"b\"", Collections.emptyList())));
    }

    @Test
    @DisplayName("在搜索目录中查找")
    void testSearchPath() throws IOException {
        Path lib = dir.resolve("lib");
        write(lib.resolve("common.sta"), "int base := 3");
        assertEquals(List.of("base"), names(load("referencing base from \"common\"", List.of(lib))));
    }

    @Test
    @DisplayName("模块不存在")
    void testMissingModule() {
        ResolveException e = assertThrows(ResolveException.class,
                () -> load("referencing x from \"nowhere\"", Collections.emptyList()));
        assertEquals(ResolveException.Kind.UNRESOLVED_IMPORT, e.getResolveKind());
        assertTrue(e.getRawMessage().contains("Module 'nowhere' not found"));
    }

    @Test
    @DisplayName("模块中没有该条目")
    void testMissingItem() throws IOException {
        write(dir.resolve("penal.sta"), "int a := 1");
        ResolveException e = assertThrows(ResolveException.class,
                () -> load("referencing b from \"penal\"", Collections.emptyList()));
        assertEquals(ResolveException.Kind.UNRESOLVED_IMPORT, e.getResolveKind());
        assertEquals("Module 'penal' has no item 'b'", e.getRawMessage());
    }

    @Test
    @DisplayName("循环导入")
    void testImportCycle() throws IOException {
        write(dir.resolve("a.sta"), "referencing y from \"b\"\nint x := 1");
        write(dir.resolve("b.sta"), "referencing x from \"a\"\nint y := 2");
        ResolveException e = assertThrows(ResolveException.class,
                () -> load("referencing x from \"a\"", Collections.emptyList()));
        assertEquals(ResolveException.Kind.IMPORT_CYCLE, e.getResolveKind());
        assertTrue(e.getRawMessage().contains("a.sta -> b.sta -> a.sta"), e.getRawMessage());
    }

    @Test
    @DisplayName("同一模块只读取一次")
    void testModuleCached() throws IOException {
        Path penal = dir.resolve("penal.sta");
        write(penal, "int a := 1");
        ModuleLoader loader = new ModuleLoader(Collections.emptyList());
        Program first = Parser.forSource("referencing a from \"penal\"", "one.sta").parse();
        Item before = loader.loadImports(first, dir).get(0);

        write(penal, "int a := 2");
        Program second = Parser.forSource("referencing a from \"penal\"", "two.sta").parse();
        assertSame(before, loader.loadImports(second, dir).get(0));
    }
}
