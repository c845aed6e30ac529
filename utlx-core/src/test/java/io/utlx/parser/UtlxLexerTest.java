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

import io.utlx.common.Resource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.utlx.parser.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

class UtlxLexerTest {

    private static List<Token> tokenize(String text) {
        return BaseLexer.tokenize(new UtlxLexer(Resource.text(text)));
    }

    private static List<TokenType> types(String text) {
        return tokenize(text).stream().map(t -> t.type).toList();
    }

    private static List<String> texts(String text) {
        return tokenize(text).stream().map(t -> t.text).toList();
    }

    private static List<Diagnostic> errors(String text) {
        UtlxLexer lexer = new UtlxLexer(Resource.text(text));
        BaseLexer.tokenize(lexer);
        return lexer.getErrors();
    }

    private static Object value(String text) {
        return tokenize(text).get(0).value;
    }

    // ========== Operators ==========

    @Test
    void testOperatorLongestMatch() {
        assertEquals(List.of(STAR_STAR, EOF), types("**"));
        assertEquals(List.of(STAR, EOF), types("*"));
        assertEquals(List.of(QUES_QUES, EOF), types("??"));
        assertEquals(List.of(QUES_DOT, EOF), types("?."));
        assertEquals(List.of(QUES, EOF), types("?"));
        assertEquals(List.of(EQ_GT, EOF), types("=>"));
        assertEquals(List.of(EQ_EQ, EOF), types("=="));
        assertEquals(List.of(EQ, EOF), types("="));
        assertEquals(List.of(NOT_EQ, EOF), types("!="));
        assertEquals(List.of(DOT_DOT_DOT, EOF), types("..."));
        assertEquals(List.of(PIPE_GT, EOF), types("|>"));
        assertEquals(List.of(PIPE_PIPE, EOF), types("||"));
        assertEquals(List.of(AMP_AMP, EOF), types("&&"));
        assertEquals(List.of(LT_EQ, GT_EQ, LT, GT, EOF), types("<= >= < >"));
    }

    @Test
    void testConditionalBeforeDecimal() {
        // a ?.5 : 1 is a conditional, not safe navigation
        assertEquals(List.of(IDENT, QUES, NUMBER, COLON, NUMBER, EOF), types("a ?.5 : 1"));
    }

    @Test
    void testPunctuation() {
        assertEquals(List.of(L_CURLY, R_CURLY, L_BRACKET, R_BRACKET, L_PAREN, R_PAREN,
                COMMA, COLON, SEMI, DOT, AT, EOF), types("{}[](),:;.@"));
    }

    // ========== Header Tokens ==========

    @Test
    void testSeparatorOnlyAtLineStart() {
        assertEquals(List.of(SEPARATOR, NUMBER, EOF), types("---\n1"));
        assertEquals(List.of(SEPARATOR, EOF), types("   ---"));
        assertEquals(List.of(NUMBER, MINUS, MINUS, MINUS, NUMBER, EOF), types("1 --- 2"));
    }

    @Test
    void testDirectiveOnlyAtLineStart() {
        assertEquals(List.of(DIRECTIVE, NUMBER, EOF), types("%utlx 1.0"));
        assertEquals(List.of("%utlx", "1.0", ""), texts("%utlx 1.0"));
        assertEquals(List.of(NUMBER, PERCENT, IDENT, EOF), types("10 %utlx"));
        assertEquals(List.of(NUMBER, PERCENT, NUMBER, EOF), types("10 % 3"));
    }

    @Test
    void testHeaderKeywords() {
        assertEquals(List.of(INPUT, IDENT, OUTPUT, IDENT, SEPARATOR, EOF), types("input json\noutput xml\n---"));
    }

    // ========== Literals ==========

    @Test
    void testNumbers() {
        assertEquals(42, value("42"));
        assertEquals(3.14, value("3.14"));
        assertEquals(1e10, value("1e10"));
        assertEquals(2.5e-3, value("2.5E-3"));
        assertEquals(10000000000L, value("10000000000"));
        assertEquals(0.5, value(".5"));
    }

    @Test
    void testStrings() {
        assertEquals("hello", value("'hello'"));
        assertEquals("hello", value("\"hello\""));
        assertEquals("a\nb\tc", value("'a\\nb\\tc'"));
        assertEquals("it's", value("'it\\'s'"));
        assertEquals("a/b", value("'a\\/b'"));
        assertEquals("é", value("'\\u00e9'"));
        assertEquals(List.of(), errors("'ok'"));
    }

    @Test
    void testIdentifiers() {
        assertEquals(List.of("$input", ".", "order-id", ""), texts("$input.order-id"));
        assertEquals(List.of(IDENT, MINUS, NUMBER, EOF), types("a-1"));
        assertEquals(List.of(IDENT, MINUS, IDENT, EOF), types("a - b"));
        assertEquals(List.of(LET, IN, IF, ELSE, FUNCTION, TRUE, FALSE, NULL, SCHEMA, EOF),
                types("let in if else function true false null schema"));
    }

    @Test
    void testComments() {
        assertEquals(List.of(NUMBER, NUMBER, EOF), types("1 // one\n2"));
        assertEquals(List.of(NUMBER, NUMBER, EOF), types("1 /* one\n */ 2"));
    }

    // ========== Errors ==========

    @Test
    void testInvalidCharacter() {
        List<Diagnostic> errors = errors("a # b");
        assertEquals(1, errors.size());
        Diagnostic error = errors.get(0);
        assertEquals(DiagnosticCode.LEX_ERROR, error.code());
        assertEquals(1, error.line());
        assertEquals(3, error.column());
        assertEquals(ScriptSection.HEADER, error.section());
        // scanning continues
        assertEquals(List.of(IDENT, IDENT, EOF), types("a # b"));
    }

    @Test
    void testErrorSectionAfterSeparator() {
        List<Diagnostic> errors = errors("%utlx 1.0\n---\n1 & 2");
        assertEquals(1, errors.size());
        assertEquals(ScriptSection.CONTENT, errors.get(0).section());
        assertEquals(3, errors.get(0).line());
    }

    @Test
    void testUnterminatedString() {
        List<Token> tokens = tokenize("'abc\n1");
        assertEquals(STRING, tokens.get(0).type);
        assertEquals("abc", tokens.get(0).value);
        assertEquals(NUMBER, tokens.get(1).type);
        List<Diagnostic> errors = errors("'abc\n1");
        assertEquals(1, errors.size());
        assertEquals("unterminated string", errors.get(0).message());
    }

    @Test
    void testInvalidEscapeKeepsCharacter() {
        assertEquals("aqb", value("'a\\qb'"));
        List<Diagnostic> errors = errors("'a\\qb'");
        assertEquals(1, errors.size());
        assertEquals(3, errors.get(0).column());
    }

    @Test
    void testUnterminatedBlockComment() {
        assertEquals(List.of(NUMBER, EOF), types("1 /* never closed"));
        assertEquals("unterminated block comment", errors("1 /* never closed").get(0).message());
    }

    @Test
    void testExponentWithoutDigits() {
        assertEquals(1, errors("1e+").size());
    }

    @Test
    void testPositions() {
        List<Token> tokens = tokenize("a\n  bb");
        Token bb = tokens.get(1);
        assertEquals(1, bb.line);
        assertEquals(2, bb.col);
        assertEquals(new Location(2, 3), bb.getLocation());
        assertEquals("2:3", bb.getPositionDisplay());
        assertEquals("  bb", bb.getLineText());
    }

}
