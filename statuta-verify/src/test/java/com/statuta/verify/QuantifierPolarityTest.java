package com.statuta.verify;

import com.statuta.compiler.analysis.ResolvedProgram;
import com.statuta.compiler.analysis.Resolver;
import com.statuta.compiler.ast.Program;
import com.statuta.compiler.ast.expr.QuantifierExpr;
import com.statuta.compiler.ast.item.Item;
import com.statuta.compiler.ast.item.PrincipleDecl;
import com.statuta.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QuantifierPolarity 与 SmtTranslator 查询输出测试
 */
class QuantifierPolarityTest {

    private QueryPlan plan(String source) {
        return plan(source, DomainPolicy.defaults());
    }

    private QueryPlan plan(String source, DomainPolicy policy) {
        Program program = Parser.forSource(source, "<test>").parse();
        ResolvedProgram resolved = new Resolver().resolve(program);
        PrincipleDecl principle = null;
        for (Item item : program.getItems()) {
            if (item instanceof PrincipleDecl) principle = (PrincipleDecl) item;
        }
        assertNotNull(principle, "no principle in source");
        return new QuantifierPolarity(new SmtTranslator(resolved, policy)).plan(principle.getBody());
    }

    private static void assertContains(QueryPlan plan, String fragment) {
        assertTrue(plan.getQuery().contains(fragment), () -> "missing '" + fragment + "' in\n" + plan.getQuery());
    }

    private static void assertNotContains(QueryPlan plan, String fragment) {
        assertFalse(plan.getQuery().contains(fragment), () -> "unexpected '" + fragment + "' in\n" + plan.getQuery());
    }

    // ================================================================
    // 极性
    // ================================================================

    @Nested
    @DisplayName("极性")
    class PolarityTests {

        @Test
        @DisplayName("全称命题断言其否定")
        void testForallRefutesNegation() {
            QueryPlan p = plan("principle P { forall x: int, x > 0 }");
            assertEquals(QueryPlan.Interpretation.REFUTE_NEGATION, p.getInterpretation());
            assertEquals(QuantifierExpr.Kind.FORALL, p.getKind());
            assertEquals("(set-option :produce-models true)\n"
                    + "(set-logic ALL)\n"
                    + "(declare-const x Int)\n"
                    + "(assert (not (> x 0)))\n"
                    + "(check-sat)\n"
                    + "(get-model)\n", p.getQuery());
        }

        @Test
        @DisplayName("全称守卫作为事实断言")
        void testForallGuardAsserted() {
            QueryPlan p = plan("principle P { forall x: int where x > 0, x > 0 }");
            assertContains(p, "(assert (> x 0))\n(assert (not (> x 0)))\n");
        }

        @Test
        @DisplayName("存在命题直接断言")
        void testExistsFindsWitness() {
            QueryPlan p = plan("principle P { exists y: int where y > 1, y < 3 }");
            assertEquals(QueryPlan.Interpretation.FIND_WITNESS, p.getInterpretation());
            assertContains(p, "(declare-const y Int)\n(assert (> y 1))\n(assert (< y 3))\n");
            assertNotContains(p, "(not ");
        }

        @Test
        @DisplayName("同种量词连续剥离")
        void testLeadingRunPeeled() {
            QueryPlan p = plan("principle P { forall a: int, forall b: int, a + b >= a }");
            assertEquals(2, p.getVariables().size());
            assertContains(p, "(declare-const a Int)\n(declare-const b Int)\n");
            assertContains(p, "(assert (not (>= (+ a b) a)))");
        }

        @Test
        @DisplayName("交替之后的量词输出为绑定")
        void testAlternationBecomesBinder() {
            QueryPlan p = plan("principle P { forall x: int where x > 0, exists y: int, y < x }");
            assertEquals(1, p.getVariables().size());
            assertNotContains(p, "(declare-const y");
            assertContains(p, "(assert (not (exists ((y Int)) (< y x))))");
        }

        @Test
        @DisplayName("嵌套全称的值域与守卫成为蕴含前件")
        void testNestedForallImplication() {
            QueryPlan p = plan("principle P { exists x: int, forall s: BoundedInt<0, 3> where s > 1, s > x }");
            assertContains(p, "(assert (forall ((s Int)) (=> (and (>= s 0) (<= s 3) (> s 1)) (> s x))))");
        }

        @Test
        @DisplayName("没有量词的命题按全称处理")
        void testNoQuantifier() {
            QueryPlan p = plan("principle P { 1 < 2 }");
            assertEquals(QueryPlan.Interpretation.REFUTE_NEGATION, p.getInterpretation());
            assertTrue(p.getVariables().isEmpty());
            assertContains(p, "(assert (not (< 1 2)))");
        }

        @Test
        @DisplayName("重名变量改写为新名字")
        void testFreshNames() {
            QueryPlan p = plan("principle P { forall x: int, forall x: int, x > 0 }");
            assertEquals("x", p.getVariables().get(0).getSmtName());
            assertEquals("x!1", p.getVariables().get(1).getSmtName());
            assertEquals("x", p.getVariables().get(1).getSourceName());
            assertContains(p, "(assert (not (> x!1 0)))");
        }
    }

    // ================================================================
    // 排序与值域
    // ================================================================

    @Nested
    @DisplayName("排序与值域")
    class DomainTests {

        @Test
        @DisplayName("BoundedInt 加入范围断言")
        void testBoundedIntRange() {
            QueryPlan p = plan("principle P { forall s: BoundedInt<0, 14>, s <= 14 }");
            assertContains(p, "(assert (>= s 0))\n(assert (<= s 14))\n(assert (not (<= s 14)))");
        }

        @Test
        @DisplayName("金额以分为单位且默认非负")
        void testMoneyCents() {
            QueryPlan p = plan("principle P { forall m: money<SGD>, m < SGD$10.50 }");
            assertContains(p, "(assert (>= m 0))");
            assertContains(p, "(assert (not (< m 1050)))");
            assertEquals(SmtTranslator.ValueKind.MONEY, p.getVariables().get(0).getValueKind());
        }

        @Test
        @DisplayName("百分比在乘法中按比例参与并与整数混合时提升")
        void testPercentCoercion() {
            QueryPlan p = plan("principle P { forall r: percent, r * 2 <= 2 }");
            assertContains(p, "(declare-const r Real)");
            assertContains(p, "(assert (>= r 0.0))\n(assert (<= r 100.0))");
            assertContains(p, "(assert (not (<= (* (/ r 100.0) (to_real 2)) (to_real 2))))");
        }

        @Test
        @DisplayName("与百分比比较的数值按百分点理解")
        void testPercentComparedWithNumber() {
            QueryPlan p = plan("principle P { forall r: percent, r <= 50 }");
            assertContains(p, "(assert (not (<= r (to_real 50))))");
        }

        @Test
        @DisplayName("与金额相加的数值按元换算为分")
        void testMoneyPlusNumber() {
            QueryPlan p = plan("principle P { forall m: money, m + 2 > m }");
            assertContains(p, "(assert (not (> (+ m 200) m)))");
        }

        @Test
        @DisplayName("不附加策略约束")
        void testUnconstrainedPolicy() {
            QueryPlan p = plan("principle P { forall m: money, m >= SGD$0.00 }", DomainPolicy.unconstrained());
            assertEquals("(set-option :produce-models true)\n"
                    + "(set-logic ALL)\n"
                    + "(declare-const m Int)\n"
                    + "(assert (not (>= m 0)))\n"
                    + "(check-sat)\n"
                    + "(get-model)\n", p.getQuery());
        }

        @Test
        @DisplayName("枚举成员翻译为下标")
        void testEnumIndex() {
            QueryPlan p = plan("enum Verdict { Guilty, Acquitted, Hung }\n"
                    + "principle P { forall v: Verdict, v != Hung }");
            assertContains(p, "(assert (>= v 0))\n(assert (<= v 2))\n(assert (not (not (= v 2))))");
        }

        @Test
        @DisplayName("时长按天计")
        void testDurationDays() {
            QueryPlan p = plan("principle P { forall d: duration, d >= 2w }");
            assertContains(p, "(assert (>= d 0))");
            assertContains(p, "(assert (not (>= d 14)))");
        }

        @Test
        @DisplayName("日期按纪元日计")
        void testDateEpochDay() {
            QueryPlan p = plan("principle P { forall d: date, d >= 02-01-1970 }");
            assertContains(p, "(assert (not (>= d 1)))");
        }

        @Test
        @DisplayName("Positive 加入大于零断言")
        void testPositive() {
            QueryPlan p = plan("principle P { forall n: Positive<int>, n >= 1 }");
            assertContains(p, "(assert (> n 0))");
        }

        @Test
        @DisplayName("类型别名展开")
        void testAlias() {
            QueryPlan p = plan("type Years := BoundedInt<1, 20>\nprinciple P { forall y: Years, y > 0 }");
            assertContains(p, "(assert (>= y 1))\n(assert (<= y 20))");
        }

        @Test
        @DisplayName("引用的值常量展开为数值")
        void testConstantReference() {
            QueryPlan p = plan("int limit := 7\nmoney<SGD> cap := SGD$50.00\n"
                    + "principle P { forall x: int, forall m: money<SGD>, x <= limit && m <= cap }");
            assertContains(p, "(and (<= x 7) (<= m 5000))");
        }

        @Test
        @DisplayName("负数写作一元减")
        void testNegativeNumber() {
            QueryPlan p = plan("principle P { forall x: int, x > -5 }");
            assertContains(p, "(- 5)");
        }

        @Test
        @DisplayName("match 翻译为 ite 链")
        void testMatchIte() {
            QueryPlan p = plan("enum Verdict { Guilty, Acquitted, Hung }\n"
                    + "principle P { forall v: Verdict, match v { case Guilty := 7 case _ := 0 } <= 7 }");
            assertContains(p, "(assert (not (<= (ite (= v 0) 7 0) 7)))");
        }
    }

    // ================================================================
    // 无法翻译
    // ================================================================

    @Nested
    @DisplayName("无法翻译")
    class UnsupportedTests {

        @Test
        @DisplayName("结构体类型的量词变量")
        void testStructVariable() {
            TranslationException e = assertThrows(TranslationException.class,
                    () -> plan("struct S { int a }\nprinciple P { forall s: S, true }"));
            assertTrue(e.getRawMessage().contains("'s' has type 'S'"), e.getRawMessage());
            assertEquals("TranslationError", e.getKind());
        }

        @Test
        @DisplayName("函数调用")
        void testCall() {
            assertThrows(TranslationException.class,
                    () -> plan("int func twice(int n) { := n * 2 }\nprinciple P { forall x: int, twice(x) > x }"));
        }

        @Test
        @DisplayName("非布尔主体")
        void testNonBooleanBody() {
            TranslationException e = assertThrows(TranslationException.class,
                    () -> plan("principle P { forall x: int, x + 1 }"));
            assertTrue(e.getRawMessage().startsWith("Expected a boolean condition"));
        }
    }
}
