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

import java.util.List;

/**
 * Expression tree of the content section. The variant set is closed, consumers
 * switch over {@link #kind()}. Nodes are immutable and carry the location of
 * their first token. Use {@link Ast#same(Expr, Expr)} to compare trees while
 * ignoring locations.
 */
public sealed interface Expr {

    ExprKind kind();

    Location location();

    default boolean isErrored() {
        return kind() == ExprKind.ERRORED;
    }

    /**
     * String, Number, Boolean or null.
     */
    record Literal(Object value, Location location) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.LITERAL;
        }
    }

    record Identifier(String name, Location location) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.IDENTIFIER;
        }
    }

    record Binary(BinaryOperator op, Expr left, Expr right, Location location) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.BINARY;
        }
    }

    record Unary(UnaryOperator op, Expr operand, Location location) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.UNARY;
        }
    }

    /**
     * {@code a.b}, {@code a?.b} and the attribute forms {@code a.@b}, {@code a?.@b}.
     */
    record Member(Expr object, String key, boolean safe, boolean attribute, Location location) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.MEMBER;
        }
    }

    record Index(Expr object, Expr index, Location location) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.INDEX;
        }
    }

    record Call(Expr callee, List<Expr> args, Location location) implements Expr {
        public Call {
            args = List.copyOf(args);
        }

        @Override
        public ExprKind kind() {
            return ExprKind.CALL;
        }
    }

    /**
     * @param name non-null for {@code function} declarations, which can call themselves
     */
    record Lambda(List<String> params, Expr body, String name, Location location) implements Expr {
        public Lambda {
            params = List.copyOf(params);
        }

        @Override
        public ExprKind kind() {
            return ExprKind.LAMBDA;
        }
    }

    record Pipe(Expr source, Expr target, Location location) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.PIPE;
        }
    }

    sealed interface ObjectEntry permits Property, Spread {
    }

    record Property(String key, Expr value, boolean attribute, Location location) implements ObjectEntry {
    }

    record ObjectLiteral(List<ObjectEntry> entries, Location location) implements Expr {
        public ObjectLiteral {
            entries = List.copyOf(entries);
        }

        @Override
        public ExprKind kind() {
            return ExprKind.OBJECT;
        }
    }

    /**
     * Elements may be {@link Spread}.
     */
    record ArrayLiteral(List<Expr> elements, Location location) implements Expr {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public ExprKind kind() {
            return ExprKind.ARRAY;
        }
    }

    /**
     * {@code ...source}, only valid as an object entry or array element.
     */
    record Spread(Expr source, Location location) implements Expr, ObjectEntry {
        @Override
        public ExprKind kind() {
            return ExprKind.SPREAD;
        }
    }

    record Conditional(Expr condition, Expr then, Expr otherwise, Location location) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.CONDITIONAL;
        }
    }

    record Let(String name, Expr value, Expr body, Location location) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.LET;
        }
    }

    /**
     * Placeholder for source that failed to parse. The error has already been
     * reported, nothing built on top of it reports again.
     *
     * @param text the skipped source text, may be empty
     */
    record Errored(String text, Location location) implements Expr {
        @Override
        public ExprKind kind() {
            return ExprKind.ERRORED;
        }
    }

}
