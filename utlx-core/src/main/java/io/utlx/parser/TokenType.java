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

public enum TokenType {

    WS_LF,
    WS,
    EOF,
    L_CURLY,
    R_CURLY,
    L_BRACKET,
    R_BRACKET,
    L_PAREN,
    R_PAREN,
    COMMA,
    COLON,
    SEMI,
    AT,
    DOT_DOT_DOT,
    QUES_DOT,
    DOT,
    //==== header
    DIRECTIVE,
    SEPARATOR,
    //==== keywords
    NULL(true),
    TRUE(true),
    FALSE(true),
    LET(true),
    IN(true),
    IF(true),
    ELSE(true),
    FUNCTION(true),
    INPUT(true),
    OUTPUT(true),
    SCHEMA(true),
    //====
    EQ_EQ,
    EQ,
    EQ_GT, // arrow
    LT_EQ,
    LT,
    GT_EQ,
    GT,
    NOT_EQ,
    NOT,
    PIPE_PIPE,
    PIPE_GT,
    AMP_AMP,
    QUES_QUES,
    QUES,
    PLUS,
    MINUS,
    STAR_STAR,
    STAR,
    SLASH,
    PERCENT,
    //====
    L_COMMENT,
    B_COMMENT,
    STRING,
    NUMBER,
    IDENT,
    ILLEGAL;

    public final boolean primary;
    public final boolean keyword;

    TokenType() {
        this(false);
    }

    TokenType(boolean keyword) {
        this.primary = !isCommentOrWhitespace(this);
        this.keyword = keyword;
    }

    private static boolean isCommentOrWhitespace(TokenType type) {
        // by name, the constants themselves are not assigned yet while constructing
        return switch (type.name()) {
            // note that EOF is "primary" for parsing and not considered white-space
            // illegal characters are reported by the lexer and never reach the parser
            case "L_COMMENT", "B_COMMENT", "WS", "WS_LF", "ILLEGAL" -> true;
            default -> false;
        };
    }

}
