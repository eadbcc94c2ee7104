package com.statuta.compiler.hierarchy;

import com.statuta.compiler.ast.Program;
import com.statuta.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HierarchyChecker 单元测试
 */
class HierarchyCheckerTest {

    private HierarchyChecker checker(String source) {
        Program program = Parser.forSource(source, "<test>").parse();
        return new HierarchyChecker(program);
    }

    private static final String PENAL = "struct Act {\n"
            + "  @hierarchy(level = act) string title\n"
            + "}\n"
            + "struct Part {\n"
            + "  @hierarchy(level = part, subordinate_to = Act.title) string heading\n"
            + "}\n"
            + "struct Section {\n"
            + "  @hierarchy(section, Part.heading) string number,\n"
            + "  @hierarchy(level = section, subordinate_to = Act.title) string other\n"
            + "}\n";

    @Nested
    @DisplayName("节点收集")
    class CollectionTests {

        @Test
        @DisplayName("命名参数与位置参数都能识别")
        void testCollectNodes() {
            HierarchyChecker checker = checker(PENAL);
            assertEquals(4, checker.getNodes().size());

            HierarchyNode number = checker.getNode("Section.number");
            assertEquals(StatutoryLevel.SECTION, number.getLevel());
            assertEquals("Part.heading", number.getParentKey());

            HierarchyNode title = checker.getNode("Act.title");
            assertNull(title.getParentKey());
            assertEquals(Arrays.asList("Part.heading", "Section.other"), title.getChildren());
        }

        @Test
        @DisplayName("scope 内的结构体也被收集")
        void testNestedScope() {
            HierarchyChecker checker = checker("scope Penal {\n"
                    + "  struct Act { @hierarchy(level = act) string title }\n"
                    + "}");
            assertNotNull(checker.getNode("Penal.Act.title"));
            assertNull(checker.getNode("Act.title"));
        }

        @Test
        @DisplayName("不同 scope 中的同名结构体不冲突")
        void testSameStructInDifferentScopes() {
            HierarchyChecker checker = checker("scope A { struct S { @hierarchy(level = Act) int a, } }\n"
                    + "scope B { struct S { @hierarchy(level = Act) int a, } }");
            assertTrue(checker.checkConflicts().isEmpty());
            assertNotNull(checker.getNode("A.S.a"));
            assertNotNull(checker.getNode("B.S.a"));
        }

        @Test
        @DisplayName("subordinate_to 由内向外查找")
        void testParentResolvedInnermostFirst() {
            HierarchyChecker checker = checker("struct Act { @hierarchy(level = act) string title }\n"
                    + "scope Penal {\n"
                    + "  struct Act { @hierarchy(level = act) string title }\n"
                    + "  struct Part { @hierarchy(level = part, subordinate_to = Act.title) string heading }\n"
                    + "  scope Schedule {\n"
                    + "    struct Item { @hierarchy(level = section, subordinate_to = Part.heading) string name }\n"
                    + "  }\n"
                    + "}\n"
                    + "struct Chapter { @hierarchy(level = part, subordinate_to = Act.title) string name }");
            assertEquals("Penal.Act.title", checker.getNode("Penal.Part.heading").getParentKey());
            assertEquals("Penal.Part.heading", checker.getNode("Penal.Schedule.Item.name").getParentKey());
            assertEquals("Act.title", checker.getNode("Chapter.name").getParentKey());
            assertEquals(Arrays.asList("Penal.Part.heading"), checker.getNode("Penal.Act.title").getChildren());
            assertTrue(checker.checkConflicts().isEmpty());
        }

        @Test
        @DisplayName("限定路径的 subordinate_to")
        void testQualifiedParent() {
            HierarchyChecker checker = checker("scope Penal { struct Act { @hierarchy(level = act) string title } }\n"
                    + "struct Part { @hierarchy(level = part, subordinate_to = Penal.Act.title) string heading }");
            assertEquals("Penal.Act.title", checker.getNode("Part.heading").getParentKey());
        }

        @Test
        @DisplayName("未知层级标签保留原文")
        void testUnknownLevelTag() {
            HierarchyNode node = checker("struct A { @hierarchy(level = schedule) string s }").getNode("A.s");
            assertEquals("schedule", node.getLevelTag());
            assertNull(node.getLevel());
        }
    }

    // ================================================================
    // 冲突
    // ================================================================

    @Nested
    @DisplayName("冲突检查")
    class ConflictTests {

        @Test
        @DisplayName("结构良好的层级没有冲突")
        void testWellFormed() {
            assertTrue(checker(PENAL).checkConflicts().isEmpty());
        }

        @Test
        @DisplayName("两节点互为上级只报告一次环")
        void testTwoNodeCycle() {
            List<HierarchyError> errors = checker("struct A {\n"
                    + "  @hierarchy(level = section, subordinate_to = B.y) int x\n"
                    + "}\n"
                    + "struct B {\n"
                    + "  @hierarchy(level = section, subordinate_to = A.x) int y\n"
                    + "}").checkConflicts();

            long cycles = errors.stream().filter(e -> e.getKind() == HierarchyError.Kind.CYCLE).count();
            assertEquals(1, cycles, errors.toString());
            HierarchyError cycle = errors.get(0);
            assertEquals(Arrays.asList("A.x", "B.y"), cycle.getKeys());
            assertTrue(cycle.getMessage().contains("A.x -> B.y -> A.x"), cycle.getMessage());
        }

        @Test
        @DisplayName("自身为上级")
        void testSelfCycle() {
            List<HierarchyError> errors = checker(
                    "struct A { @hierarchy(subordinate_to = A.x) int x }").checkConflicts();
            assertEquals(1, errors.size());
            assertEquals(HierarchyError.Kind.CYCLE, errors.get(0).getKind());
            assertEquals(List.of("A.x"), errors.get(0).getKeys());
        }

        @Test
        @DisplayName("指向环的尾部节点不重复报告环")
        void testTailIntoCycle() {
            List<HierarchyError> errors = checker("struct A {\n"
                    + "  @hierarchy(subordinate_to = A.b) int a,\n"
                    + "  @hierarchy(subordinate_to = A.c) int b,\n"
                    + "  @hierarchy(subordinate_to = A.b) int c\n"
                    + "}").checkConflicts();
            assertEquals(1, errors.size(), errors.toString());
            assertEquals(Arrays.asList("A.b", "A.c"), errors.get(0).getKeys());
        }

        @Test
        @DisplayName("上级节点不存在")
        void testDanglingReference() {
            List<HierarchyError> errors = checker(
                    "struct S { @hierarchy(level = section, subordinate_to = Missing.title) string n }").checkConflicts();
            assertEquals(1, errors.size());
            HierarchyError e = errors.get(0);
            assertEquals(HierarchyError.Kind.DANGLING_REFERENCE, e.getKind());
            assertEquals("'S.n' is subordinate to unknown node 'Missing.title'", e.getMessage());
        }

        @Test
        @DisplayName("下级的层级不比上级更具体")
        void testLevelInversion() {
            List<HierarchyError> errors = checker("struct Act { @hierarchy(level = section) string title }\n"
                    + "struct Part { @hierarchy(level = act, subordinate_to = Act.title) string heading }")
                    .checkConflicts();
            assertEquals(1, errors.size());
            assertEquals(HierarchyError.Kind.LEVEL_INVERSION, errors.get(0).getKind());
            assertEquals(Arrays.asList("Part.heading", "Act.title"), errors.get(0).getKeys());
        }

        @Test
        @DisplayName("同级也算倒置")
        void testSameLevel() {
            List<HierarchyError> errors = checker("struct A { @hierarchy(level = part) string a }\n"
                    + "struct B { @hierarchy(level = part, subordinate_to = A.a) string b }").checkConflicts();
            assertEquals(HierarchyError.Kind.LEVEL_INVERSION, errors.get(0).getKind());
        }

        @Test
        @DisplayName("未知层级标签不参与倒置检查")
        void testUnknownLevelIgnored() {
            assertTrue(checker("struct A { @hierarchy(level = act) string a }\n"
                    + "struct B { @hierarchy(level = schedule, subordinate_to = A.a) string b }")
                    .checkConflicts().isEmpty());
        }

        @Test
        @DisplayName("重复声明的节点")
        void testDuplicateNode() {
            List<HierarchyError> errors = checker("struct A { @hierarchy(level = act) string a }\n"
                    + "struct A { @hierarchy(level = act) string a }").checkConflicts();
            assertEquals(1, errors.size());
            assertEquals(HierarchyError.Kind.DUPLICATE_NODE, errors.get(0).getKind());
        }
    }

    // ================================================================
    // 深度
    // ================================================================

    @Nested
    @DisplayName("层级深度")
    class LevelTests {

        @Test
        @DisplayName("根为 0，逐层加一")
        void testDepths() {
            HierarchyLevels levels = checker(PENAL).getHierarchyLevels();
            assertFalse(levels.hasErrors());
            assertEquals(0, levels.depthOf("Act.title"));
            assertEquals(1, levels.depthOf("Part.heading"));
            assertEquals(2, levels.depthOf("Section.number"));
            assertEquals(1, levels.depthOf("Section.other"));
        }

        @Test
        @DisplayName("环上与环以上的节点各自得到错误而不是无限递归")
        void testCycleDoesNotRecurse() {
            HierarchyLevels levels = checker("struct A {\n"
                    + "  @hierarchy(subordinate_to = A.y) int x,\n"
                    + "  @hierarchy(subordinate_to = A.x) int y,\n"
                    + "  @hierarchy(subordinate_to = A.x) int below\n"
                    + "}\n"
                    + "struct Free { @hierarchy(level = act) int root }").getHierarchyLevels();

            assertNull(levels.depthOf("A.x"));
            assertNull(levels.depthOf("A.y"));
            assertNull(levels.depthOf("A.below"));
            assertEquals(0, levels.depthOf("Free.root"));
            assertEquals(3, levels.getErrors().size());
            for (HierarchyError e : levels.getErrors()) {
                assertEquals(HierarchyError.Kind.CYCLE, e.getKind());
                assertEquals(1, e.getKeys().size());
            }
        }

        @Test
        @DisplayName("悬空引用之下的节点无法计算深度")
        void testDanglingDepth() {
            HierarchyLevels levels = checker("struct A { @hierarchy(subordinate_to = Gone.x) int a,\n"
                    + "  @hierarchy(subordinate_to = A.a) int b }").getHierarchyLevels();
            assertNull(levels.depthOf("A.a"));
            assertNull(levels.depthOf("A.b"));
            assertEquals(2, levels.getErrors().size());
            assertTrue(levels.getErrors().get(0).getMessage().contains("unknown node 'Gone.x'"));
        }

        @Test
        @DisplayName("长链迭代计算")
        void testLongChain() {
            int depth = 2000;
            StringBuilder sb = new StringBuilder("struct L {\n  @hierarchy(level = act) int n0");
            for (int i = 1; i < depth; i++) {
                sb.append(",\n  @hierarchy(subordinate_to = L.n").append(i - 1).append(") int n").append(i);
            }
            sb.append("\n}");
            HierarchyChecker checker = checker(sb.toString());
            assertEquals(depth - 1, checker.getHierarchyLevels().depthOf("L.n" + (depth - 1)));
            assertTrue(checker.checkConflicts().isEmpty());
        }
    }
}
