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
package io.utlx.parser;

import io.utlx.common.Config;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AstPrinterTest {

    private static Program parse(String text) {
        ParseResult result = UtlxParser.parse(text, Config.of(10));
        assertTrue(result.isSuccess(), () -> "parse failed: " + result.diagnostics());
        return result.program();
    }

    private static void roundTrip(String content) {
        Program program = parse("%utlx 1.0\ninput json\noutput json\n---\n" + content);
        String printed = AstPrinter.print(program);
        Program reparsed = parse(printed);
        assertTrue(Ast.same(program, reparsed), () -> "not the same after printing:\n" + printed);
    }

    @Test
    void testRoundTrip() {
        roundTrip("1 + 2 * 3 - 4 / 5 % 6");
        roundTrip("2 ** 3 ** 2");
        roundTrip("-2 ** 2");
        roundTrip("!a && b || c ?? d");
        roundTrip("a < b == c >= d != e");
        roundTrip("a ? b : c ? d : e");
        roundTrip("$input.order?.items[0].@id");
        roundTrip("$input.'first name'.'a-1'");
        roundTrip("items |> map(x => x * 2) |> sum");
        roundTrip("f(...xs, 1)(2)");
        roundTrip("{a: 1, 'b c': 'x\\n', @id: 3, ...rest, if: [1, [2], ...ys]}");
        roundTrip("(a, b) => () => a + b");
        roundTrip("if (a) 1");
        roundTrip("let x = 1; let y = x + 1; [x, y]");
        roundTrip("function fact(n) { if (n <= 1) 1 else n * fact(n - 1) } fact(5)");
        roundTrip("[null, true, false, 1.5, 10000000000]");
    }

    @Test
    void testPrintedForm() {
        assertEquals("(1 + (2 * 3))", AstPrinter.print(parse("%utlx 1.0\n---\n1 + 2 * 3").content()));
        assertEquals("%utlx 1.0\ninput json\n---\n{a: \"b\"}\n", AstPrinter.print(parse("%utlx 1.0\ninput json\n---\n{a: 'b'}")));
    }

    @Test
    void testErroredTreeCannotBePrinted() {
        ParseResult result = UtlxParser.parse("%utlx 1.0\n---\n{a: }", Config.of(10));
        Expr content = result.program().content();
        assertThrows(IllegalStateException.class, () -> AstPrinter.print(content));
        assertEquals("{a: <error>}", AstPrinter.describe(content));
    }

    @Test
    void testSameIgnoresLocations() {
        Expr a = parse("%utlx 1.0\n---\n1+2").content();
        Expr b = parse("%utlx 1.0\n---\n\n  1 +   2").content();
        assertTrue(Ast.same(a, b));
        assertFalse(Ast.same(a, parse("%utlx 1.0\n---\n2 + 1").content()));
    }

}
