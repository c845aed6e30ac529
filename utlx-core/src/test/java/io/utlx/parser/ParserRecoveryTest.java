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

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParserRecoveryTest {

    static final String HEADER = "%utlx 1.0\n---\n";

    private static ParseResult parse(String text, Config config) {
        return UtlxParser.parse(text, config);
    }

    private static ParseResult content(String text) {
        return parse(HEADER + text, Config.of(10));
    }

    private static List<String> messages(ParseResult result) {
        return result.getErrors().stream().map(Diagnostic::message).toList();
    }

    @Test
    void testMissingSeparator() {
        ParseResult result = parse("%utlx 1.0\ninput json\n{a: 1}", Config.of(10));
        assertEquals(ParseResult.Kind.PARTIAL, result.kind());
        List<Diagnostic> errors = result.getErrors();
        assertEquals(1, errors.size());
        assertEquals(ScriptSection.HEADER, errors.get(0).section());
        assertEquals("expected '---' separator", errors.get(0).message());
        assertEquals(3, errors.get(0).line());
        AstUtils.assertEquals("", result.program().content(), "{a:1}");
    }

    @Test
    void testSeparatorFoundLater() {
        // the stray line is skipped up to the separator
        ParseResult result = parse("%utlx 1.0\n1 + 2\n---\n3", Config.of(10));
        assertEquals(1, result.getErrors().size());
        assertEquals(3, ((Expr.Literal) result.program().content()).value());
    }

    @Test
    void testSecondSeparator() {
        ParseResult result = content("1\n---\n2");
        List<Diagnostic> errors = result.getErrors();
        assertEquals(1, errors.size());
        assertEquals(ScriptSection.SEPARATOR, errors.get(0).section());
        assertEquals(4, errors.get(0).line());
    }

    @Test
    void testThreeMalformedProperties() {
        ParseResult result = content("{ a 1, b: 2, c 3, d: 4, e 5 }");
        assertEquals(ParseResult.Kind.PARTIAL, result.kind());
        List<Diagnostic> errors = result.getErrors();
        assertEquals(3, errors.size(), () -> errors.toString());
        for (Diagnostic error : errors) {
            assertEquals(ScriptSection.CONTENT, error.section());
            assertEquals(3, error.line());
        }
        assertEquals(List.of(5, 16, 27), errors.stream().map(Diagnostic::column).toList());
        Expr content = result.program().content();
        assertEquals(ExprKind.OBJECT, content.kind());
        AstUtils.assertEquals("", content, "{a:'!err',b:2,c:'!err',d:4,e:'!err'}");
    }

    @Test
    void testMissingComma() {
        ParseResult result = content("[1 2, 3]");
        assertEquals(List.of("expected ',' or ']' but found '2'"), messages(result));
        AstUtils.assertEquals("", result.program().content(), "[1,3]");
    }

    @Test
    void testMissingCommaInArguments() {
        ParseResult result = content("f(a b, c)");
        assertEquals(1, result.getErrors().size());
        AstUtils.assertEquals("", result.program().content(), "[$f,'()',[$a,$c]]");
    }

    @Test
    void testResumeAtKeyword() {
        ParseResult result = content("[1 2 if (a) 3 else 4]");
        assertEquals(1, result.getErrors().size());
        AstUtils.assertEquals("", result.program().content(), "[1,[$a,'?',3,':',4]]");
    }

    @Test
    void testMissingValueReportedOnce() {
        ParseResult result = content("{a: }");
        assertEquals(List.of("expected expression but found '}'"), messages(result));
        AstUtils.assertEquals("", result.program().content(), "{a:'!err'}");
    }

    @Test
    void testUnclosedLiteralReportedOnce() {
        ParseResult result = content("{a: 1");
        assertEquals(List.of("expected ',' or '}' but found end of input"), messages(result));
        AstUtils.assertEquals("", result.program().content(), "{a:1}");
    }

    @Test
    void testErroredOperandDoesNotCascade() {
        ParseResult result = content("(1 + ) * 2");
        assertEquals(1, result.getErrors().size());
        AstUtils.assertEquals("", result.program().content(), "[[1,'+','!err'],'*',2]");
    }

    @Test
    void testTrailingTokens() {
        ParseResult result = content("1 2 3");
        assertEquals(List.of("unexpected '2' after expression"), messages(result));
    }

    @Test
    void testEmptyContent() {
        ParseResult result = content("");
        assertEquals(List.of("expected expression but found end of input"), messages(result));
        assertTrue(result.program().content().isErrored());
    }

    @Test
    void testLexErrorsAreReported() {
        ParseResult result = content("[1, # 2]");
        List<Diagnostic> errors = result.getErrors();
        assertEquals(1, errors.size());
        assertEquals(DiagnosticCode.LEX_ERROR, errors.get(0).code());
        assertEquals(ScriptSection.CONTENT, errors.get(0).section());
        AstUtils.assertEquals("", result.program().content(), "[1,2]");
    }

    @Test
    void testTooManyErrors() {
        ParseResult result = parse(HEADER + "[1 2, 3 4, 5 6, 7 8]", Config.of(2));
        assertEquals(ParseResult.Kind.ABORTED, result.kind());
        assertNull(result.program());
        List<Diagnostic> diagnostics = result.diagnostics();
        assertEquals(3, diagnostics.size());
        assertEquals(DiagnosticCode.TOO_MANY_ERRORS, diagnostics.get(2).code());
        assertTrue(diagnostics.get(2).code().terminal);
    }

    @Test
    void testErrorLimitNotExceeded() {
        ParseResult result = parse(HEADER + "[1 2, 3 4]", Config.of(2));
        assertEquals(ParseResult.Kind.PARTIAL, result.kind());
        assertEquals(2, result.diagnostics().size());
    }

    @Test
    void testFailFast() {
        ParseResult result = parse(HEADER + "[1 2, 3 4, 5 6]", Config.of(10).withFailFast(true));
        assertEquals(ParseResult.Kind.ABORTED, result.kind());
        assertEquals(1, result.diagnostics().size());
        assertEquals(DiagnosticCode.PARSE_ERROR, result.diagnostics().get(0).code());
    }

    @Test
    void testRecoveryDisabled() {
        ParseResult result = parse(HEADER + "[1 2, 3 4]", Config.of(10).withRecovery(false));
        assertEquals(ParseResult.Kind.ABORTED, result.kind());
        assertEquals(1, result.diagnostics().size());
    }

    @Test
    void testPrefixOperatorNestingLimit() {
        ParseResult result = parse(HEADER + "!".repeat(100_000) + "true", Config.of(10));
        assertEquals(ParseResult.Kind.ABORTED, result.kind());
        List<Diagnostic> diagnostics = result.diagnostics();
        Diagnostic last = diagnostics.get(diagnostics.size() - 1);
        assertEquals(DiagnosticCode.RESOURCE_EXHAUSTED, last.code());
        assertEquals(ScriptSection.CONTENT, last.section());
        ParseResult negated = parse(HEADER + "-".repeat(50) + "1", Config.of(10).withMaxDepth(20));
        assertEquals(ParseResult.Kind.ABORTED, negated.kind());
    }

    @Test
    void testPrefixOperatorsWithinLimit() {
        ParseResult result = parse(HEADER + "!".repeat(100) + "true", Config.of(10));
        assertTrue(result.isSuccess());
    }

    @Test
    void testNestingLimit() {
        String text = "[".repeat(40) + "]".repeat(40);
        ParseResult result = parse(HEADER + text, Config.of(10).withMaxDepth(20));
        assertEquals(ParseResult.Kind.ABORTED, result.kind());
        List<Diagnostic> diagnostics = result.diagnostics();
        assertEquals(DiagnosticCode.RESOURCE_EXHAUSTED, diagnostics.get(diagnostics.size() - 1).code());
    }

    @Test
    void testDiagnosticRendering() {
        ParseResult result = parse("%utlx 1.0\n{a: 1}", Config.of(10));
        assertEquals("[HEADER 2:1] error: expected '---' separator", result.getErrors().get(0).toString());
    }

}
