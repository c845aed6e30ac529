/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.utlx.runtime;

import io.utlx.parser.Diagnostic;
import io.utlx.parser.DiagnosticCode;
import io.utlx.parser.ScriptSection;
import io.utlx.udm.Udm;
import io.utlx.udm.UdmObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvalTest extends EvalBase {

    // ========== Operators ==========

    @Test
    void testArithmeticPrecedence() {
        matchEval("2 + 3 * 4", "14");
        matchEval("2 ** 3 ** 2", "512");
        matchEval("20 * 10 / 5 % 3", "1");
        matchEval("(2 + 3) * 4", "20");
        matchEval("-2 ** 2", "4");
        matchEval("7 / 2", "3.5");
        matchEval("10 - 2 - 3", "5");
        matchEval("0.1 * 3 > 0.3", "true");
    }

    @Test
    void testLongArithmetic() {
        matchEval("3000000000 * 4", "12000000000");
        matchEval("2147483647 + 1", "2147483648");
    }

    @Test
    void testStringConcatenation() {
        matchEval("'a' + 1", "'a1'");
        matchEval("1 + 'a'", "'1a'");
        matchEval("'x' + true", "'xtrue'");
        matchEval("'n=' + 2.0", "'n=2'");
        Diagnostic d = fault("'x' + null");
        assertEquals(DiagnosticCode.TYPE_MISMATCH, d.code());
    }

    @Test
    void testComparison() {
        matchEval("'a' < 'b'", "true");
        matchEval("2 >= 2", "true");
        matchEval("1 < 1.5", "true");
        Diagnostic d = fault("1 < 'a'");
        assertEquals(DiagnosticCode.TYPE_MISMATCH, d.code());
        assertEquals("cannot compare number with string using '<'", d.message());
    }

    @Test
    void testEquality() {
        matchEval("1 == 1.0", "true");
        matchEval("1 == '1'", "false");
        matchEval("{a: 1, b: [1, 2]} == {a: 1, b: [1, 2]}", "true");
        matchEval("[1, 2] != [1, 2]", "false");
        matchEval("null == null", "true");
        matchEval("$input.missing == null", "true");
    }

    @Test
    void testArithmeticFaults() {
        assertEquals(DiagnosticCode.ARITHMETIC, fault("1 / 0").code());
        assertEquals(DiagnosticCode.ARITHMETIC, fault("1 % 0").code());
        Diagnostic d = fault("'a' * 2");
        assertEquals(DiagnosticCode.TYPE_MISMATCH, d.code());
        assertEquals("operator '*' cannot be applied to string and number", d.message());
        assertEquals(DiagnosticCode.TYPE_MISMATCH, fault("-'a'").code());
    }

    @Test
    void testLogical() {
        matchEval("true && false", "false");
        matchEval("false || true", "true");
        matchEval("!false", "true");
        matchEval("!null", "true");
        matchEval("'TRUE' && true", "true");
        assertEquals(DiagnosticCode.TYPE_MISMATCH, fault("1 && true").code());
    }

    @Test
    void testShortCircuit() {
        EvalResult result = execute("false && undefinedFn()", null);
        assertTrue(result.isSuccess());
        UdmAssert.match(result.value(), "false");
        assertTrue(result.diagnostics().isEmpty());
        matchEval("true || undefinedFn()", "true");
    }

    @Test
    void testNullishCoalescing() {
        matchEval("null ?? 5", "5");
        matchEval("0 ?? 5", "0");
        matchEval("'' ?? 5", "''");
        matchEval("false ?? 5", "false");
        matchEval("$input.missing ?? 'default'", "'default'");
        matchEval("1 ?? undefinedFn()", "1");
    }

    // ========== Navigation ==========

    @Test
    void testSafeNavigation() {
        String input = "{a: null, b: {c: 1}}";
        matchEval("$input.a?.b", "null", input);
        matchEval("$input.b?.c", "1", input);
        matchEval("$input.missing?.x?.y", "null", input);
        Diagnostic d = fault("$input.a.b", input);
        assertEquals(DiagnosticCode.MISSING_PATH, d.code());
        assertEquals(ScriptSection.CONTENT, d.section());
        assertEquals(5, d.line());
        assertEquals("cannot read 'b' of null: $input.a is null", d.message());
        assertNotNull(d.hint());
    }

    @Test
    void testAbsentKeyIsNull() {
        matchEval("input.x", "null", "{a: 1}");
        matchEval("$input.a", "1", "{a: 1}");
        matchEval("input.@id", "null", "{a: 1}");
    }

    @Test
    void testMemberOnScalarIsTypeMismatch() {
        assertEquals(DiagnosticCode.TYPE_MISMATCH, fault("(1).a").code());
    }

    @Test
    void testProjectionOverArray() {
        String input = "{items: [{sku: 'a'}, {sku: 'b'}, {other: 1}, 5]}";
        matchEval("$input.items.sku", "['a','b']", input);
    }

    @Test
    void testIndex() {
        matchEval("[1, 2, 3][1]", "2");
        matchEval("[1][5]", "null");
        matchEval("[10, 20][-1]", "null");
        matchEval("[10, 20][4294967296]", "null");
        matchEval("[10, 20][4294967297]", "null");
        matchEval("[10, 20][1.0]", "20");
        matchEval("{a: 1}['a']", "1");
        matchEval("{a: 1}['b']", "null");
        assertEquals(DiagnosticCode.TYPE_MISMATCH, fault("[1]['a']").code());
        assertEquals(DiagnosticCode.MISSING_PATH, fault("$input.none[0]").code());
    }

    // ========== Literals ==========

    @Test
    void testSpreadMerge() {
        Udm value = eval("{...{a: 1, b: 2}, b: 3}");
        UdmAssert.match(value, "{a:1,b:3}");
        assertEquals(List.of("a", "b"), List.copyOf(((UdmObject) value).keys()));
        matchEval("{b: 0, ...{a: 1, b: 2}}", "{b:2,a:1}");
        matchEval("{...$input, extra: true}", "{x:1,extra:true}", "{x: 1}");
        assertEquals(DiagnosticCode.TYPE_MISMATCH, fault("{...[1]}").code());
    }

    @Test
    void testArraySpread() {
        matchEval("[0, ...[1, 2], 3]", "[0,1,2,3]");
        matchEval("[...[]]", "[]");
        assertEquals(DiagnosticCode.TYPE_MISMATCH, fault("[...{a: 1}]").code());
    }

    @Test
    void testAttributes() {
        Udm value = eval("{@id: 1, name: 'x'}");
        assertEquals("1", ((UdmObject) value).getAttribute("id"));
        UdmAssert.match(value, "{'@id':'1',name:'x'}");
        matchEval("{@id: 'A1'}.@id", "'A1'");
        assertEquals(DiagnosticCode.TYPE_MISMATCH, fault("{@id: [1]}").code());
    }

    @Test
    void testConditional() {
        matchEval("if (1 > 0) 'pos' else 'neg'", "'pos'");
        matchEval("1 > 2 ? 'a' : 'b'", "'b'");
        matchEval("if (false) 1", "null");
        // only the chosen branch runs
        matchEval("true ? 1 : undefinedFn()", "1");
        assertEquals(DiagnosticCode.TYPE_MISMATCH, fault("if ('x') 1 else 2").code());
    }

    // ========== Functions ==========

    @Test
    void testLetAndLambda() {
        matchEval("let add = (a, b) => a + b; add(2, 3)", "5");
        matchEval("let x = 2; let x = x * 10; x", "20");
        matchEval("(() => 42)()", "42");
    }

    @Test
    void testClosureCapturesScope() {
        matchEval("let k = 10; let f = x => x + k; let k = 20; f(1)", "11");
        matchEval("let adder = n => x => x + n; let add5 = adder(5); add5(1)", "6");
    }

    @Test
    void testRecursion() {
        matchEval("function fact(n) { if (n <= 1) 1 else n * fact(n - 1) } fact(10)", "3628800");
        matchEval("function fib(n) { n < 2 ? n : fib(n - 1) + fib(n - 2) } fib(15)", "610");
    }

    @Test
    void testInputBindings() {
        matchEval("{first: $input.name, second: input.name}", "{first:'x',second:'x'}", "{name: 'x'}");
    }

    @Test
    void testHyphenatedKeys() {
        matchEval("$input.order-id", "7", "{'order-id': 7}");
    }

    // ========== Pipes and Library Calls ==========

    @Test
    void testPipes() {
        matchEval("'abc' |> upper", "'ABC'");
        matchEval("[1, 2, 3] |> map(x => x * 2)", "[2,4,6]");
        matchEval("[1, 2, 3] |> map(x => x + 1) |> sum", "9");
        matchEval("5 |> (x => x * x)", "25");
        matchEval("'a' |> (s => s + 'b') |> upper", "'AB'");
    }

    @Test
    void testLibraryCalls() {
        matchEval("upper('x')", "'X'");
        matchEval("join('a', 'b', 'c')", "'abc'");
        matchEval("join(...['a', 'b'])", "'ab'");
        matchEval("pad('ab')", "'ab...'");
        matchEval("pad('ab', 3)", "'ab.'");
        matchEval("map([1, 2], upper2 => upper2 * 10)", "[10,20]");
        matchEval("let f = upper; f('q')", "'Q'");
    }

    @Test
    void testScopeShadowsLibrary() {
        matchEval("let upper = x => 'mine'; upper('a')", "'mine'");
    }

    @Test
    void testStringNumberCoercionInLibrary() {
        matchEval("num('12') + 1", "13");
        Diagnostic d = fault("num('x')");
        assertEquals(DiagnosticCode.FUNCTION_CALL, d.code());
        assertEquals("num() failed: cannot coerce string 'x' to number", d.message());
    }

}
