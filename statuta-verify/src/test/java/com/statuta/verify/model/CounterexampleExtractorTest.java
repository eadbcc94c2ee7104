package com.statuta.verify.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CounterexampleExtractor 单元测试
 */
class CounterexampleExtractorTest {

    private final CounterexampleExtractor extractor = new CounterexampleExtractor();

    @Test
    @DisplayName("跨行的定义")
    void testMultiLineDefinitions() {
        Counterexample ce = extractor.extract("(\n"
                + "  (define-fun years () Int\n"
                + "    15)\n"
                + "  (define-fun guilty () Bool\n"
                + "    true)\n"
                + ")");
        assertEquals(2, ce.getAssignments().size());
        assertEquals("years", ce.getAssignments().get(0).getName());
        assertEquals("15", ce.get("years"));
        assertEquals("true", ce.get("guilty"));
        assertEquals("Counterexample found:\n  years = 15\n  guilty = true", ce.format());
    }

    @Test
    @DisplayName("负数与有理数")
    void testNegativeAndRational() {
        Counterexample ce = extractor.extract("((define-fun a () Int (- 1))\n"
                + " (define-fun r () Real (/ 1.0 3.0))\n"
                + " (define-fun n () Real (- (/ 1.0 2.0))))");
        assertEquals("-1", ce.get("a"));
        assertEquals("1.0/3.0", ce.get("r"));
        assertEquals("-1.0/2.0", ce.get("n"));
    }

    @Test
    @DisplayName("旧式 model 包裹与引用符号")
    void testModelWrapperAndQuotedSymbol() {
        Counterexample ce = extractor.extract("(model\n  (define-fun |and| () Int 4)\n)");
        assertEquals("4", ce.get("and"));
    }

    @Test
    @DisplayName("字符串取值保留引号")
    void testStringValue() {
        Counterexample ce = extractor.extract("((define-fun s () String \"a \"\"b\"\" c\"))");
        assertEquals("\"a \"\"b\"\" c\"", ce.get("s"));
    }

    @Test
    @DisplayName("带参数的定义被忽略")
    void testFunctionDefinitionsIgnored() {
        Counterexample ce = extractor.extract("((define-fun f ((x Int)) Int (+ x 1)) (define-fun y () Int 3))");
        assertEquals(1, ce.getAssignments().size());
        assertNull(ce.get("f"));
    }

    @Test
    @DisplayName("没有赋值")
    void testNoAssignments() {
        Counterexample ce = extractor.extract("(\n)");
        assertTrue(ce.isEmpty());
        assertEquals("No assignments were found in the solver model", ce.getExplanation());
        assertEquals("Counterexample found:\n  No assignments were found in the solver model", ce.format());
        assertTrue(extractor.extract("").isEmpty());
    }

    @Test
    @DisplayName("注释被跳过")
    void testComments() {
        Counterexample ce = extractor.extract("; model follows\n((define-fun x () Int 7))");
        assertEquals("7", ce.get("x"));
    }

    @Test
    @DisplayName("括号不匹配")
    void testUnbalanced() {
        assertThrows(IllegalArgumentException.class, () -> extractor.extract("((define-fun x () Int 0)"));
        assertThrows(IllegalArgumentException.class, () -> extractor.extract(")"));
    }
}
