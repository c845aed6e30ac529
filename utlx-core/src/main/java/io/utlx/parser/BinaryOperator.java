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

/**
 * Infix operators with their binding level, lower binds tighter.
 * Pipe and the conditional are separate node types and not listed here.
 */
public enum BinaryOperator {

    POW("**", 3, true),
    MUL("*", 4, false),
    DIV("/", 4, false),
    MOD("%", 4, false),
    ADD("+", 5, false),
    SUB("-", 5, false),
    LT("<", 6, false),
    GT(">", 6, false),
    LT_EQ("<=", 6, false),
    GT_EQ(">=", 6, false),
    EQ("==", 7, false),
    NOT_EQ("!=", 7, false),
    AND("&&", 8, false),
    OR("||", 9, false),
    NULLISH("??", 10, false);

    public final String symbol;
    public final int level;
    public final boolean rightAssoc;

    BinaryOperator(String symbol, int level, boolean rightAssoc) {
        this.symbol = symbol;
        this.level = level;
        this.rightAssoc = rightAssoc;
    }

    public static BinaryOperator fromToken(TokenType type) {
        return switch (type) {
            case STAR_STAR -> POW;
            case STAR -> MUL;
            case SLASH -> DIV;
            case PERCENT -> MOD;
            case PLUS -> ADD;
            case MINUS -> SUB;
            case LT -> LT;
            case GT -> GT;
            case LT_EQ -> LT_EQ;
            case GT_EQ -> GT_EQ;
            case EQ_EQ -> EQ;
            case NOT_EQ -> NOT_EQ;
            case AMP_AMP -> AND;
            case PIPE_PIPE -> OR;
            case QUES_QUES -> NULLISH;
            default -> null;
        };
    }

    @Override
    public String toString() {
        return symbol;
    }

}
