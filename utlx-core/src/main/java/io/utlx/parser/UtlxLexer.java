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

import static io.utlx.parser.TokenType.*;

/**
 * Hand-rolled lexer for transformation scripts. Two constructs are only
 * recognized at the start of a line (leading whitespace allowed): the
 * {@code ---} separator and {@code %name} directives. Everywhere else
 * {@code %} is the modulo operator.
 */
public class UtlxLexer extends BaseLexer {

    private boolean lineStart = true;
    private boolean separatorSeen;

    public UtlxLexer(Resource resource) {
        super(resource);
    }

    @Override
    public Token nextToken() {
        Token token = super.nextToken();
        switch (token.type) {
            case WS_LF:
                lineStart = true;
                break;
            case WS:
            case B_COMMENT:
                // does not change line start state
                break;
            case SEPARATOR:
                separatorSeen = true;
                lineStart = false;
                break;
            default:
                lineStart = false;
        }
        return token;
    }

    @Override
    protected ScriptSection currentSection() {
        return separatorSeen ? ScriptSection.CONTENT : ScriptSection.HEADER;
    }

    // ========== Main Scanner ==========

    @Override
    protected TokenType scanToken() {
        if (isAtEnd()) {
            return EOF;
        }
        char c = source.charAt(pos);
        if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
            return scanWhitespace();
        }
        if (c == '/') {
            return scanSlash();
        }
        if (c == '"' || c == '\'') {
            return scanString(c);
        }
        if (lineStart) {
            if (c == '-' && peek(1) == '-' && peek(2) == '-') {
                advance();
                advance();
                advance();
                return SEPARATOR;
            }
            if (c == '%' && isLetter(peek(1))) {
                advance();
                while (!isAtEnd() && isIdentifierPart(peek())) {
                    advance();
                }
                return DIRECTIVE;
            }
        }
        if (isIdentifierStart(c)) {
            return scanIdentifier();
        }
        if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            return scanNumber();
        }
        return scanOperator();
    }

    // ========== Whitespace and Comments ==========

    private TokenType scanWhitespace() {
        boolean hasNewline = false;
        while (pos < length) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
            } else if (c == '\n') {
                advance();
                hasNewline = true;
            } else {
                break;
            }
        }
        return hasNewline ? WS_LF : WS;
    }

    private TokenType scanSlash() {
        advance(); // consume '/'
        if (match('/')) {
            while (pos < length) {
                char c = source.charAt(pos);
                if (c == '\n' || c == '\r') {
                    break;
                }
                advance();
            }
            return L_COMMENT;
        }
        if (match('*')) {
            while (pos < length) {
                if (source.charAt(pos) == '*' && peek(1) == '/') {
                    advance();
                    advance();
                    return B_COMMENT;
                }
                advance();
            }
            error("unterminated block comment");
            return B_COMMENT;
        }
        return SLASH;
    }

    // ========== Strings ==========

    private TokenType scanString(char quote) {
        advance(); // opening quote
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (isAtEnd() || peek() == '\n' || peek() == '\r') {
                error("unterminated string");
                break;
            }
            char c = advance();
            if (c == quote) {
                break;
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (isAtEnd()) {
                error("unterminated string");
                break;
            }
            int escapeLine = line;
            int escapeCol = col - 1;
            char e = advance();
            switch (e) {
                case 'n':
                    sb.append('\n');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                case 'b':
                    sb.append('\b');
                    break;
                case 'f':
                    sb.append('\f');
                    break;
                case '\\':
                case '"':
                case '\'':
                case '/':
                    sb.append(e);
                    break;
                case 'u':
                    sb.append(scanUnicodeEscape(escapeLine, escapeCol));
                    break;
                default:
                    error(escapeLine, escapeCol, "invalid escape sequence '\\" + e + "'");
                    sb.append(e);
            }
        }
        tokenValue = sb.toString();
        return STRING;
    }

    private char scanUnicodeEscape(int escapeLine, int escapeCol) {
        int code = 0;
        for (int i = 0; i < 4; i++) {
            char h = peek();
            if (!isHexDigit(h)) {
                error(escapeLine, escapeCol, "invalid unicode escape sequence");
                return '?';
            }
            advance();
            code = code * 16 + Character.digit(h, 16);
        }
        return (char) code;
    }

    // ========== Identifiers and Numbers ==========

    private TokenType scanIdentifier() {
        while (!isAtEnd()) {
            char c = peek();
            if (isIdentifierPart(c)) {
                advance();
            } else if (c == '-' && isLetter(peek(1))) {
                // hyphenated names such as order-id, common in xml element names
                advance();
            } else {
                break;
            }
        }
        return switch (source.substring(tokenStart, pos)) {
            case "null" -> NULL;
            case "true" -> TRUE;
            case "false" -> FALSE;
            case "let" -> LET;
            case "in" -> IN;
            case "if" -> IF;
            case "else" -> ELSE;
            case "function" -> FUNCTION;
            case "input" -> INPUT;
            case "output" -> OUTPUT;
            case "schema" -> SCHEMA;
            default -> IDENT;
        };
    }

    private TokenType scanNumber() {
        boolean decimal = false;
        while (isDigit(peek())) {
            advance();
        }
        if (peek() == '.' && isDigit(peek(1))) {
            decimal = true;
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        char c = peek();
        if (c == 'e' || c == 'E') {
            decimal = true;
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            if (!isDigit(peek())) {
                error("invalid number, exponent has no digits");
                tokenValue = 0;
                return NUMBER;
            }
            while (isDigit(peek())) {
                advance();
            }
        }
        tokenValue = toNumber(source.substring(tokenStart, pos), decimal);
        return NUMBER;
    }

    static Number toNumber(String text, boolean decimal) {
        if (!decimal) {
            try {
                long l = Long.parseLong(text);
                if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                    return (int) l;
                }
                return l;
            } catch (NumberFormatException e) {
                // too large for a long
                return Double.parseDouble(text);
            }
        }
        return Double.parseDouble(text);
    }

    // ========== Operators ==========

    private TokenType scanOperator() {
        char c = advance();
        switch (c) {
            case '{':
                return L_CURLY;
            case '}':
                return R_CURLY;
            case '[':
                return L_BRACKET;
            case ']':
                return R_BRACKET;
            case '(':
                return L_PAREN;
            case ')':
                return R_PAREN;
            case ',':
                return COMMA;
            case ':':
                return COLON;
            case ';':
                return SEMI;
            case '@':
                return AT;
            case '.':
                if (peek() == '.' && peek(1) == '.') {
                    advance();
                    advance();
                    return DOT_DOT_DOT;
                }
                return DOT;
            case '?':
                if (peek() == '.' && !isDigit(peek(1))) {
                    advance();
                    return QUES_DOT;
                }
                return match('?') ? QUES_QUES : QUES;
            case '=':
                if (match('=')) {
                    return EQ_EQ;
                }
                return match('>') ? EQ_GT : EQ;
            case '!':
                return match('=') ? NOT_EQ : NOT;
            case '<':
                return match('=') ? LT_EQ : LT;
            case '>':
                return match('=') ? GT_EQ : GT;
            case '&':
                if (match('&')) {
                    return AMP_AMP;
                }
                break;
            case '|':
                if (match('|')) {
                    return PIPE_PIPE;
                }
                if (match('>')) {
                    return PIPE_GT;
                }
                break;
            case '+':
                return PLUS;
            case '-':
                return MINUS;
            case '*':
                return match('*') ? STAR_STAR : STAR;
            case '%':
                return PERCENT;
            default:
                break;
        }
        error("unexpected character '" + c + "'");
        return ILLEGAL;
    }

}
