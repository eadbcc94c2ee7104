package com.statuta.compiler.temporal;

import com.statuta.compiler.ast.Program;
import com.statuta.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TemporalChecker 单元测试
 */
class TemporalCheckerTest {

    private static final LocalDate REFERENCE = LocalDate.of(2024, 6, 1);

    private TemporalChecker checker(String source) {
        Program program = Parser.forSource(source, "<test>").parse();
        return new TemporalChecker(program);
    }

    private List<TemporalError> validate(String source) {
        return checker(source).validate(REFERENCE);
    }

    private void assertSingle(String source, TemporalError.Kind kind, String key) {
        List<TemporalError> errors = validate(source);
        assertEquals(1, errors.size(), errors.toString());
        assertEquals(kind, errors.get(0).getKind());
        assertEquals(key, errors.get(0).getKey());
    }

    // ================================================================
    // 收集
    // ================================================================

    @Nested
    @DisplayName("收集")
    class CollectionTests {

        @Test
        @DisplayName("字段类型中的 Temporal")
        void testTemporalField() {
            TemporalChecker checker = checker("struct Levy {\n"
                    + "  Temporal<money, valid_from = 01-01-2020, valid_until = \"2025-12-31\"> rate\n"
                    + "}");
            List<TemporalField> fields = checker.getTemporalFields();
            assertEquals(1, fields.size());
            TemporalField rate = fields.get(0);
            assertEquals("Levy.rate", rate.getKey());
            assertEquals(LocalDate.of(2020, 1, 1), rate.getValidFrom());
            assertEquals(LocalDate.of(2025, 12, 31), rate.getValidUntil());
        }

        @Test
        @DisplayName("嵌套在包装类型与记录类型中的 Temporal")
        void testNestedTemporal() {
            TemporalChecker checker = checker("struct S {\n"
                    + "  Array<Temporal<int, valid_from = 01-01-2020>> history,\n"
                    + "  { Temporal<bool, valid_until = 01-01-2030> flag } detail\n"
                    + "}");
            List<TemporalField> fields = checker.getTemporalFields();
            assertEquals(2, fields.size());
            assertEquals("S.history", fields.get(0).getKey());
            assertEquals("S.detail.flag", fields.get(1).getKey());
        }

        @Test
        @DisplayName("经类型别名引用的 Temporal")
        void testTemporalThroughAlias() {
            assertSingle("type T := Temporal<int, valid_from = 01-01-2021, valid_until = 01-01-2020>\n"
                    + "struct S { T a, }", TemporalError.Kind.INVERTED_BOUNDS, "S.a");
        }

        @Test
        @DisplayName("别名链与外层 scope 的别名")
        void testAliasChainAcrossScopes() {
            TemporalChecker checker = checker("type Inner := Temporal<int, valid_from = 01-01-2020>\n"
                    + "scope Tax {\n"
                    + "  type Outer := Array<Inner>\n"
                    + "  struct Levy { Outer rates }\n"
                    + "}");
            List<TemporalField> fields = checker.getTemporalFields();
            assertEquals(1, fields.size());
            assertEquals("Tax.Levy.rates", fields.get(0).getKey());
        }

        @Test
        @DisplayName("自引用的别名不会无限展开")
        void testSelfReferentialAlias() {
            assertTrue(checker("type A := B\ntype B := A\nstruct S { A a }").getTemporalFields().isEmpty());
        }

        @Test
        @DisplayName("不同 scope 中的同名结构体分别登记")
        void testSameStructInDifferentScopes() {
            TemporalChecker checker = checker("scope A { struct S { @effective(01-01-2021) @sunset(01-01-2030) int a } }\n"
                    + "scope B { struct S { @sunset(01-01-2020) int a } }");
            List<TemporalError> errors = checker.validate(REFERENCE);
            assertEquals(1, errors.size(), errors.toString());
            assertEquals(TemporalError.Kind.EXPIRED_SUNSET, errors.get(0).getKind());
            assertEquals("B.S.a", errors.get(0).getKey());
        }

        @Test
        @DisplayName("日落与溯及既往注解")
        void testAnnotations() {
            TemporalChecker checker = checker("struct Relief {\n"
                    + "  @effective(01-01-2021) @sunset(01-01-2030) @retroactive(01-06-2020) money grant\n"
                    + "}");
            assertEquals(1, checker.getSunsetClauses().size());
            assertEquals(LocalDate.of(2030, 1, 1), checker.getSunsetClauses().get(0).getExpiryDate());
            RetroactiveRule rule = checker.getRetroactiveRules().get(0);
            assertEquals(LocalDate.of(2020, 6, 1), rule.getRetroactiveFrom());
            assertEquals(LocalDate.of(2021, 1, 1), rule.getEffectiveDate());
            assertTrue(checker.validate(REFERENCE).isEmpty());
        }
    }

    @Test
    @DisplayName("有效期为左闭右开区间")
    void testValidityInterval() {
        TemporalField field = new TemporalField("A.b", LocalDate.of(2020, 1, 1), LocalDate.of(2021, 1, 1), null);
        assertTrue(field.isValidOn(LocalDate.of(2020, 1, 1)));
        assertTrue(field.isValidOn(LocalDate.of(2020, 12, 31)));
        assertFalse(field.isValidOn(LocalDate.of(2021, 1, 1)));
        assertFalse(field.isValidOn(LocalDate.of(2019, 12, 31)));
        assertTrue(new TemporalField("A.c", null, null, null).isValidOn(LocalDate.MIN));
    }

    // ================================================================
    // 校验
    // ================================================================

    @Nested
    @DisplayName("校验")
    class ValidationTests {

        @Test
        @DisplayName("起止日期倒置")
        void testInvertedBounds() {
            assertSingle("struct S { Temporal<int, valid_from = 01-01-2025, valid_until = 01-01-2020> x }",
                    TemporalError.Kind.INVERTED_BOUNDS, "S.x");
        }

        @Test
        @DisplayName("起止日期相同也算倒置")
        void testEmptyInterval() {
            assertSingle("struct S { Temporal<int, valid_from = 01-01-2020, valid_until = 01-01-2020> x }",
                    TemporalError.Kind.INVERTED_BOUNDS, "S.x");
        }

        @Test
        @DisplayName("日落日期早于参考日期")
        void testExpiredSunset() {
            assertSingle("struct S { @sunset(31-05-2024) int x }", TemporalError.Kind.EXPIRED_SUNSET, "S.x");
        }

        @Test
        @DisplayName("日落日期等于参考日期尚未过期")
        void testSunsetOnReferenceDate() {
            assertTrue(validate("struct S { @sunset(01-06-2024) int x }").isEmpty());
        }

        @Test
        @DisplayName("参考日期由调用方决定")
        void testReferenceDateFromCaller() {
            TemporalChecker checker = checker("struct S { @sunset(01-01-2030) int x }");
            assertTrue(checker.validate(REFERENCE).isEmpty());
            assertEquals(1, checker.validate(LocalDate.of(2031, 1, 1)).size());
            assertThrows(IllegalArgumentException.class, () -> checker.validate(null));
        }

        @Test
        @DisplayName("日落日期不晚于生效日期")
        void testSunsetBeforeEffective() {
            assertSingle("struct S { @effective(01-01-2030) @sunset(01-01-2029) int x }",
                    TemporalError.Kind.SUNSET_BEFORE_EFFECTIVE, "S.x");
        }

        @Test
        @DisplayName("溯及日期晚于生效日期")
        void testRetroactiveConflict() {
            assertSingle("struct S { @effective(01-01-2020) @retroactive(01-01-2021) int x }",
                    TemporalError.Kind.RETROACTIVE_CONFLICT, "S.x");
        }

        @Test
        @DisplayName("溯及既往却没有生效日期")
        void testMissingEffective() {
            assertSingle("struct S { @retroactive(01-01-2021) int x }",
                    TemporalError.Kind.MISSING_EFFECTIVE_DATE, "S.x");
        }

        @Test
        @DisplayName("注解缺少日期参数")
        void testInvalidDateArgument() {
            List<TemporalError> errors = validate("struct S { @sunset(\"soon\") int x, @effective int y }");
            assertEquals(2, errors.size(), errors.toString());
            for (TemporalError e : errors) {
                assertEquals(TemporalError.Kind.INVALID_DATE, e.getKind());
            }
            assertTrue(errors.get(0).getMessage().contains("@sunset on 'S.x' needs a date argument"));
        }

        @Test
        @DisplayName("命名的日期参数")
        void testNamedDateArgument() {
            assertSingle("struct S { @sunset(date = \"2020-01-01\") int x }",
                    TemporalError.Kind.EXPIRED_SUNSET, "S.x");
        }
    }
}
