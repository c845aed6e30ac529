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

import java.util.ArrayList;
import java.util.List;

import static io.utlx.parser.TokenType.*;

/**
 * Abstract base class for lexers. Provides common utilities for character
 * handling, position tracking, error collection and tokenization.
 * A lexer never throws for bad input, problems are collected as diagnostics
 * and scanning continues.
 */
public abstract class BaseLexer {

    protected final Resource resource;
    protected final String source;
    protected final int length;

    protected int pos;
    protected int line;
    protected int col;
    protected int tokenStart;
    protected int tokenLine;
    protected int tokenCol;
    protected Object tokenValue;

    private final List<Diagnostic> errors = new ArrayList<>();

    protected BaseLexer(Resource resource) {
        this.resource = resource;
        this.source = resource.getText();
        this.length = source.length();
    }

    // ========== Public API ==========

    public Token nextToken() {
        tokenStart = pos;
        tokenLine = line;
        tokenCol = col;
        tokenValue = null;
        TokenType type = scanToken();
        String text = source.substring(tokenStart, pos);
        return new Token(resource, type, tokenStart, tokenLine, tokenCol, text, tokenValue);
    }

    protected abstract TokenType scanToken();

    /**
     * Section that lexical errors are attributed to at the current position.
     */
    protected abstract ScriptSection currentSection();

    public List<Diagnostic> getErrors() {
        return errors;
    }

    // ========== Tokenization Utilities ==========

    /**
     * Scans the whole source and returns the primary tokens, whitespace and
     * comments dropped. The list always ends with EOF.
     */
    public static List<Token> tokenize(BaseLexer lexer) {
        List<Token> list = new ArrayList<>();
        Token token;
        do {
            token = lexer.nextToken();
            if (token.type.primary) {
                list.add(token);
            }
        } while (token.type != EOF);
        return list;
    }

    // ========== Errors ==========

    protected void error(String message) {
        error(tokenLine, tokenCol, message);
    }

    protected void error(int errorLine, int errorCol, String message) {
        Location location = new Location(errorLine + 1, errorCol + 1);
        errors.add(Diagnostic.error(DiagnosticCode.LEX_ERROR, currentSection(), location, message));
    }

    // ========== Character Utilities ==========

    protected boolean isAtEnd() {
        return pos >= length;
    }

    protected char peek() {
        return pos >= length ? '\0' : source.charAt(pos);
    }

    protected char peek(int offset) {
        int index = pos + offset;
        return (index < 0 || index >= length) ? '\0' : source.charAt(index);
    }

    protected char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 0;
        } else {
            col++;
        }
        return c;
    }

    protected boolean match(char expected) {
        if (pos >= length || source.charAt(pos) != expected) {
            return false;
        }
        advance();
        return true;
    }

    // ========== Character Classification ==========

    protected static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    protected static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    protected static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c > 127 && Character.isLetter(c));
    }

    protected static boolean isIdentifierStart(char c) {
        return isLetter(c) || c == '_' || c == '$';
    }

    protected static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

}
