package com.statuta.compiler.analysis;

import com.statuta.compiler.ast.Program;
import com.statuta.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checker 单元测试
 */
class CheckerTest {

    private static final String VERDICT = "enum Verdict { Guilty, Acquitted, Hung }\n";

    private List<CheckError> check(String source) {
        Program program = Parser.forSource(source, "<test>").parse();
        return new Checker(new Resolver().resolve(program)).check();
    }

    private static List<CheckError> ofKind(List<CheckError> errors, CheckError.Kind kind) {
        List<CheckError> result = new ArrayList<>();
        for (CheckError e : errors) {
            if (e.getKind() == kind) result.add(e);
        }
        return result;
    }

    /** 断言恰好一条诊断，且类型与消息片段匹配 */
    private CheckError assertSingle(String source, CheckError.Kind kind, String messagePart) {
        List<CheckError> errors = check(source);
        assertEquals(1, errors.size(), "diagnostics: " + errors);
        CheckError e = errors.get(0);
        assertEquals(kind, e.getKind(), e.toString());
        assertTrue(e.getMessage().contains(messagePart), e.getMessage());
        return e;
    }

    private void assertClean(String source) {
        List<CheckError> errors = check(source);
        assertTrue(errors.isEmpty(), "unexpected diagnostics: " + errors);
    }

    @Test
    @DisplayName("完整的合法程序没有诊断")
    void testCleanProgram() {
        assertClean(VERDICT
                + "struct Offence {\n"
                + "  string name,\n"
                + "  BoundedInt<0, 10> severity where severity > 0,\n"
                + "  money<SGD> fine,\n"
                + "  Citation<\"378\", \"Penal Code\"> section\n"
                + "}\n"
                + "legal_test Theft { requires bool dishonest, requires bool moveable }\n"
                + "int func penalty(Verdict v) { := match v { case Guilty := 7 case _ := 0 } }\n"
                + "principle NonNegative { forall s: BoundedInt<0, 10>, s >= 0 }\n"
                + "money<SGD> maxFine := SGD$5000.00\n"
                + "percent rate := 15%\n"
                + "date due := 01-01-2020 + 30d\n");
    }

    // ================================================================
    // 未定义与重复
    // ================================================================

    @Nested
    @DisplayName("未定义符号")
    class UndefinedTests {

        @Test
        @DisplayName("未定义的变量只报告一次，不引发类型错误")
        void testUndefinedReportedOnce() {
            CheckError e = assertSingle("int x := y + 1", CheckError.Kind.UNDEFINED_SYMBOL, "Undefined symbol 'y'");
            assertEquals("y", e.getName());
            assertEquals(1, e.getLocation().getLine());
        }

        @Test
        @DisplayName("未定义的函数")
        void testUndefinedFunction() {
            assertSingle("int x := missing(1)", CheckError.Kind.UNDEFINED_SYMBOL, "Undefined symbol 'missing'");
        }

        @Test
        @DisplayName("多个枚举共有的成员名报告为歧义")
        void testAmbiguousVariant() {
            CheckError e = assertSingle("enum E { A, B }\nenum F { A, C }\nE x := A",
                    CheckError.Kind.UNDEFINED_SYMBOL,
                    "Ambiguous enum variant 'A': it is declared by enums 'E' and 'F'");
            assertEquals("A", e.getName());
            assertClean("enum E { A, B }\nenum F { A, C }\nE x := E.A\nE y := B");
        }

        @Test
        @DisplayName("歧义成员名作为模式")
        void testAmbiguousVariantPattern() {
            List<CheckError> errors = check("enum E { A, B }\nenum F { A, C }\n"
                    + "int func f(int n) { := match n { case A := 1 case _ := 0 } }");
            assertFalse(errors.isEmpty());
            for (CheckError e : errors) {
                assertFalse(e.getMessage().contains("Undefined enum variant"), e.toString());
            }
            assertTrue(errors.get(0).getMessage().contains("declared by enums 'E' and 'F'"), errors.toString());
        }

        @Test
        @DisplayName("未定义的类型")
        void testUndefinedType() {
            assertSingle("Foo x := 1", CheckError.Kind.UNDEFINED_SYMBOL, "Undefined type 'Foo'");
        }

        @Test
        @DisplayName("scope 没有该成员")
        void testMissingScopeMember() {
            assertClean("scope Penal { int max := 7 }\nint m := Penal.max");
            assertSingle("scope Penal { int max := 7 }\nint m := Penal.min",
                    CheckError.Kind.UNDEFINED_SYMBOL, "Scope 'Penal' has no member 'min'");
        }
    }

    @Nested
    @DisplayName("重复定义")
    class DuplicateTests {

        @Test
        @DisplayName("同一作用域内重复")
        void testSameScope() {
            assertSingle("int x := 1\nint x := 2", CheckError.Kind.DUPLICATE_DEFINITION,
                    "Duplicate definition of 'x' (first defined at line 1)");
        }

        @Test
        @DisplayName("嵌套作用域中的同名声明不算重复")
        void testNestedScope() {
            assertClean("int x := 1\nscope Inner { int x := 2 }");
        }

        @Test
        @DisplayName("重复的结构体与参数")
        void testStructsAndParams() {
            assertSingle("struct S { int a }\nstruct S { int b }", CheckError.Kind.DUPLICATE_DEFINITION, "'S'");
            assertSingle("int func f(int a, int a) { := a }", CheckError.Kind.DUPLICATE_DEFINITION, "'a'");
        }

        @Test
        @DisplayName("同一结构体内的重复字段")
        void testDuplicateField() {
            assertSingle("struct S { int a, string a }", CheckError.Kind.DUPLICATE_DEFINITION,
                    "Duplicate field 'a' in struct 'S'");
        }

        @Test
        @DisplayName("与继承字段重名只在声明它的结构体上报告")
        void testInheritedDuplicate() {
            List<CheckError> errors = check("struct A { int a }\n"
                    + "struct B extends A { int a }\n"
                    + "struct C extends B { int c }");
            assertEquals(1, errors.size(), errors.toString());
            assertTrue(errors.get(0).getMessage().contains("in struct 'B' (inherited from 'A')"));
        }

        @Test
        @DisplayName("重复的枚举成员")
        void testDuplicateVariant() {
            assertSingle("enum E { A, A }", CheckError.Kind.DUPLICATE_DEFINITION, "Duplicate variant 'A'");
        }
    }

    // ================================================================
    // 类型
    // ================================================================

    @Nested
    @DisplayName("BoundedInt 边界")
    class BoundedIntTests {

        @Test
        @DisplayName("下界大于上界报错")
        void testInverted() {
            assertSingle("struct S { BoundedInt<5, 3> a }", CheckError.Kind.TYPE_ERROR,
                    "BoundedInt lower bound 5 exceeds upper bound 3");
        }

        @Test
        @DisplayName("上下界相等合法")
        void testEqualBounds() {
            assertClean("struct S { BoundedInt<3, 3> a }");
        }

        @Test
        @DisplayName("负数下界合法")
        void testNegativeLow() {
            assertClean("struct S { BoundedInt<-5, 5> a }");
        }
    }

    @Nested
    @DisplayName("类型检查")
    class TypeTests {

        @Test
        @DisplayName("字符串赋给 int")
        void testStringToInt() {
            assertSingle("int x := \"hello\"", CheckError.Kind.TYPE_ERROR, "Value of 'x'");
        }

        @Test
        @DisplayName("数值字面量按上下文定型")
        void testContextualLiterals() {
            assertClean("float f := 2\npercent p := 20\nmoney m := 100");
            assertSingle("int n := 2.5", CheckError.Kind.TYPE_ERROR, "float literal");
        }

        @Test
        @DisplayName("算术结果赋给 bool")
        void testArithmeticToBool() {
            assertSingle("bool b := 1 + 2", CheckError.Kind.TYPE_ERROR, "expected 'bool'");
        }

        @Test
        @DisplayName("逻辑运算要求布尔操作数")
        void testLogicalOperands() {
            assertSingle("bool b := 1 && true", CheckError.Kind.TYPE_ERROR, "requires bool operands");
        }

        @Test
        @DisplayName("不可比较的两侧")
        void testIncomparable() {
            assertSingle("bool b := \"a\" == 1", CheckError.Kind.TYPE_ERROR, "Cannot compare");
        }

        @Test
        @DisplayName("币种必须一致")
        void testCurrencyMismatch() {
            assertClean("money<SGD> total := SGD$10.00 + SGD$5.00");
            assertSingle("money<SGD> m := USD$1.00", CheckError.Kind.TYPE_ERROR, "money<SGD>");
        }

        @Test
        @DisplayName("枚举值不能赋给 int")
        void testEnumValue() {
            assertClean(VERDICT + "Verdict v := Guilty");
            assertSingle(VERDICT + "int v := Guilty", CheckError.Kind.TYPE_ERROR, "Value of 'v'");
        }

        @Test
        @DisplayName("Positive 只能包装数值类型")
        void testPositiveOfString() {
            assertSingle("struct S { Positive<string> name }", CheckError.Kind.TYPE_ERROR,
                    "Positive requires a numeric type");
        }

        @Test
        @DisplayName("原则与量词体必须为 bool")
        void testPrincipleBody() {
            assertSingle("principle P { 1 + 2 }", CheckError.Kind.TYPE_ERROR, "Body of principle 'P'");
            assertSingle("principle P { forall x: int, x + 1 }", CheckError.Kind.TYPE_ERROR, "Body of forall x");
        }

        @Test
        @DisplayName("legal_test 的条目必须为 bool")
        void testRequirementType() {
            assertSingle("legal_test T { requires int count }", CheckError.Kind.TYPE_ERROR, "must be bool");
        }

        @Test
        @DisplayName("单成员的互斥枚举")
        void testSingleVariantExclusiveEnum() {
            assertSingle("mutually_exclusive enum Only { One }", CheckError.Kind.TYPE_ERROR,
                    "needs at least two variants");
        }
    }

    @Nested
    @DisplayName("类型别名")
    class AliasTests {

        @Test
        @DisplayName("别名展开后参与比较")
        void testAliasExpansion() {
            assertClean("type Fine := money<SGD>\nFine f := SGD$10.00");
            assertSingle("type Fine := money<SGD>\nFine f := USD$10.00", CheckError.Kind.TYPE_ERROR, "Value of 'f'");
        }

        @Test
        @DisplayName("互相引用的别名")
        void testAliasCycle() {
            List<CheckError> errors = check("type A := B\ntype B := A");
            assertEquals(2, errors.size(), errors.toString());
            for (CheckError e : errors) {
                assertTrue(e.getMessage().contains("refers to itself"));
            }
        }

        @Test
        @DisplayName("泛型别名的参数个数")
        void testAliasArity() {
            assertSingle("type Boxed<A> := A\nBoxed x := 1", CheckError.Kind.TYPE_ERROR,
                    "Type 'Boxed' expects 1 type argument(s) but got 0");
        }
    }

    // ================================================================
    // 函数与结构体
    // ================================================================

    @Nested
    @DisplayName("函数调用")
    class CallTests {

        private static final String F = "int func f(int a) { := a }\n";

        @Test
        @DisplayName("参数个数不符")
        void testArity() {
            assertSingle(F + "int y := f(1, 2)", CheckError.Kind.TYPE_ERROR,
                    "Function 'f' expects 1 argument(s) but got 2");
        }

        @Test
        @DisplayName("参数类型不符")
        void testArgumentType() {
            assertSingle(F + "int y := f(\"x\")", CheckError.Kind.TYPE_ERROR, "Argument 'a' of 'f'");
        }

        @Test
        @DisplayName("调用非函数")
        void testNotAFunction() {
            assertSingle("int v := 1\nint y := v(2)", CheckError.Kind.TYPE_ERROR, "'v' is not a function");
        }

        @Test
        @DisplayName("函数的类型参数在调用处视为通配")
        void testGenericFunction() {
            assertClean("T func id<T>(T value) { := value }\nint y := id(3)\nstring s := id(\"x\")");
        }
    }

    @Nested
    @DisplayName("结构体初始化与字段访问")
    class StructTests {

        private static final String P = "struct P { int a, int b }\n";

        @Test
        @DisplayName("缺少字段")
        void testMissingField() {
            assertSingle(P + "P p := P { a := 1 }", CheckError.Kind.TYPE_ERROR,
                    "Missing field 'b' in initialisation of 'P'");
        }

        @Test
        @DisplayName("多余字段")
        void testUnknownField() {
            assertSingle(P + "P p := P { a := 1, b := 2, c := 3 }", CheckError.Kind.TYPE_ERROR,
                    "Struct 'P' has no field 'c'");
        }

        @Test
        @DisplayName("初始化继承来的字段")
        void testInheritedInit() {
            assertClean("struct A { int a }\nstruct B extends A { int b }\nB v := B { a := 1, b := 2 }");
        }

        @Test
        @DisplayName("字段访问")
        void testFieldAccess() {
            assertClean(P + "int func get(P p) { := p.a }");
            assertSingle(P + "int func get(P p) { := p.z }", CheckError.Kind.TYPE_ERROR,
                    "Struct 'P' has no field 'z'");
        }

        @Test
        @DisplayName("访问继承来的字段")
        void testInheritedAccess() {
            assertClean("struct A { int a }\nstruct B extends A { int b }\nint func get(B v) { := v.a }");
        }
    }

    // ================================================================
    // match
    // ================================================================

    @Nested
    @DisplayName("match 检查")
    class MatchTests {

        private String fn(String arms) {
            return VERDICT + "int func score(Verdict v, bool strict) { := match v { " + arms + " } }";
        }

        @Test
        @DisplayName("覆盖全部枚举成员")
        void testExhaustiveEnum() {
            assertClean(fn("case Guilty := 2 case Acquitted := 0 case Verdict.Hung := 1"));
        }

        @Test
        @DisplayName("缺少枚举成员")
        void testMissingVariant() {
            assertSingle(fn("case Guilty := 1 case Acquitted := 0"), CheckError.Kind.NON_EXHAUSTIVE_MATCH,
                    "missing Hung");
        }

        @Test
        @DisplayName("带守卫的分支不计入覆盖")
        void testGuardedArm() {
            assertSingle(fn("case Guilty where strict := 1 case Acquitted := 0 case Hung := 0"),
                    CheckError.Kind.NON_EXHAUSTIVE_MATCH, "missing Guilty");
        }

        @Test
        @DisplayName("通配符之后的分支不可达")
        void testAfterWildcard() {
            assertSingle(fn("case _ := 0 case Guilty := 1"), CheckError.Kind.UNREACHABLE_PATTERN,
                    "Unreachable match arm after wildcard pattern");
        }

        @Test
        @DisplayName("重复的模式不可达")
        void testRepeatedPattern() {
            assertSingle(fn("case Guilty := 1 case Guilty := 2 case _ := 0"), CheckError.Kind.UNREACHABLE_PATTERN,
                    "Pattern 'Guilty' is already covered by an earlier arm");
        }

        @Test
        @DisplayName("不存在的枚举成员")
        void testUnknownVariant() {
            assertSingle(fn("case Verdict.Maybe := 1 case _ := 0"), CheckError.Kind.TYPE_ERROR,
                    "Enum 'Verdict' has no variant 'Maybe'");
        }

        @Test
        @DisplayName("布尔 match 覆盖 true 与 false")
        void testBoolMatch() {
            assertClean("int func f(bool b) { := match b { case true := 1 case false := 0 } }");
            assertSingle("int func f(bool b) { := match b { case true := 1 } }",
                    CheckError.Kind.NON_EXHAUSTIVE_MATCH, "not exhaustive");
        }

        @Test
        @DisplayName("分支结果类型不一致")
        void testInconsistentResults() {
            assertSingle(VERDICT + "string func f(Verdict v) { := match v { case Guilty := \"g\" case _ := true } }",
                    CheckError.Kind.TYPE_ERROR, "Match arm result type");
        }

        @Test
        @DisplayName("satisfies 引用未定义的法律测试")
        void testUnknownLegalTest() {
            assertSingle(fn("case satisfies Nope := 1 case _ := 0"), CheckError.Kind.UNDEFINED_SYMBOL,
                    "Undefined legal test 'Nope'");
        }
    }

    // ================================================================
    // 引用与常量约束
    // ================================================================

    @Nested
    @DisplayName("法条引用")
    class CitationTests {

        private List<CheckError> citation(String args) {
            return ofKind(check("struct S { Citation<" + args + "> c }"), CheckError.Kind.INVALID_CITATION);
        }

        @Test
        @DisplayName("合法引用")
        void testValid() {
            assertTrue(citation("\"377A\", \"1\", \"Penal Code\"").isEmpty());
            assertTrue(citation("\"415\", \"Penal Code\"").isEmpty());
            assertTrue(citation("\"10000\", \"a\", \"Act\"").isEmpty());
        }

        @Test
        @DisplayName("条号超出范围")
        void testSectionRange() {
            assertEquals(1, citation("\"0\", \"Penal Code\"").size());
            assertEquals(1, citation("\"10001\", \"Penal Code\"").size());
            assertTrue(citation("\"99999999999999999999\", \"Act\"").get(0).getMessage().contains("outside 1..10000"));
        }

        @Test
        @DisplayName("格式错误的条号与款号")
        void testMalformed() {
            assertTrue(citation("\"abc\", \"Act\"").get(0).getMessage().contains("Invalid section number"));
            assertTrue(citation("\"12\", \"(a)\", \"Act\"").get(0).getMessage().contains("Invalid subsection"));
        }

        @Test
        @DisplayName("缺少法规名")
        void testBlankAct() {
            assertTrue(citation("\"12\", \"   \"").get(0).getMessage().contains("names no act"));
        }
    }

    @Nested
    @DisplayName("常量取值范围")
    class ConstraintTests {

        @Test
        @DisplayName("BoundedInt 常量越界")
        void testBoundedIntConstant() {
            assertClean("BoundedInt<0, 10> x := 10");
            assertSingle("BoundedInt<0, 10> x := 11", CheckError.Kind.CONSTRAINT_VIOLATION,
                    "value 11 is outside BoundedInt<0, 10>");
            assertSingle("BoundedInt<0, 10> x := -1", CheckError.Kind.CONSTRAINT_VIOLATION, "value -1");
        }

        @Test
        @DisplayName("通过常量折叠发现越界")
        void testFoldedConstant() {
            assertSingle("int base := 4\nBoundedInt<0, 10> x := base * 3", CheckError.Kind.CONSTRAINT_VIOLATION,
                    "value 12");
        }

        @Test
        @DisplayName("Positive 常量必须大于零")
        void testPositive() {
            assertClean("Positive<int> p := 1");
            assertSingle("Positive<int> p := 0", CheckError.Kind.CONSTRAINT_VIOLATION, "is not positive");
        }

        @Test
        @DisplayName("百分比范围可配置")
        void testPercentRange() {
            String source = "percent rate := 150%";
            assertSingle(source, CheckError.Kind.CONSTRAINT_VIOLATION, "outside the percent range 0..100");

            Program program = Parser.forSource(source, "<test>").parse();
            Checker wide = new Checker(new Resolver().resolve(program), BigDecimal.ZERO, BigDecimal.valueOf(200));
            assertTrue(wide.check().isEmpty());
        }

        @Test
        @DisplayName("结构体初始化中的常量")
        void testInitConstant() {
            assertSingle("struct Sentence { BoundedInt<0, 14> years }\nSentence s := Sentence { years := 20 }",
                    CheckError.Kind.CONSTRAINT_VIOLATION, "value 20");
        }
    }
}
