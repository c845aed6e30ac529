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
import java.util.Objects;

/**
 * Structural comparison of syntax trees, locations are not compared.
 */
public class Ast {

    private Ast() {
        // only static methods
    }

    public static boolean same(Program a, Program b) {
        if (a.directives().size() != b.directives().size()) {
            return false;
        }
        for (int i = 0; i < a.directives().size(); i++) {
            Directive da = a.directives().get(i);
            Directive db = b.directives().get(i);
            if (!da.name().equals(db.name()) || !da.value().equals(db.value())) {
                return false;
            }
        }
        return same(a.content(), b.content());
    }

    public static boolean same(Expr a, Expr b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null || a.kind() != b.kind()) {
            return false;
        }
        switch (a.kind()) {
            case LITERAL:
                return Objects.equals(((Expr.Literal) a).value(), ((Expr.Literal) b).value());
            case IDENTIFIER:
                return ((Expr.Identifier) a).name().equals(((Expr.Identifier) b).name());
            case BINARY: {
                Expr.Binary x = (Expr.Binary) a;
                Expr.Binary y = (Expr.Binary) b;
                return x.op() == y.op() && same(x.left(), y.left()) && same(x.right(), y.right());
            }
            case UNARY: {
                Expr.Unary x = (Expr.Unary) a;
                Expr.Unary y = (Expr.Unary) b;
                return x.op() == y.op() && same(x.operand(), y.operand());
            }
            case MEMBER: {
                Expr.Member x = (Expr.Member) a;
                Expr.Member y = (Expr.Member) b;
                return x.key().equals(y.key()) && x.safe() == y.safe() && x.attribute() == y.attribute()
                        && same(x.object(), y.object());
            }
            case INDEX: {
                Expr.Index x = (Expr.Index) a;
                Expr.Index y = (Expr.Index) b;
                return same(x.object(), y.object()) && same(x.index(), y.index());
            }
            case CALL: {
                Expr.Call x = (Expr.Call) a;
                Expr.Call y = (Expr.Call) b;
                return same(x.callee(), y.callee()) && same(x.args(), y.args());
            }
            case LAMBDA: {
                Expr.Lambda x = (Expr.Lambda) a;
                Expr.Lambda y = (Expr.Lambda) b;
                return x.params().equals(y.params()) && Objects.equals(x.name(), y.name()) && same(x.body(), y.body());
            }
            case PIPE: {
                Expr.Pipe x = (Expr.Pipe) a;
                Expr.Pipe y = (Expr.Pipe) b;
                return same(x.source(), y.source()) && same(x.target(), y.target());
            }
            case OBJECT:
                return sameEntries(((Expr.ObjectLiteral) a).entries(), ((Expr.ObjectLiteral) b).entries());
            case ARRAY:
                return same(((Expr.ArrayLiteral) a).elements(), ((Expr.ArrayLiteral) b).elements());
            case SPREAD:
                return same(((Expr.Spread) a).source(), ((Expr.Spread) b).source());
            case CONDITIONAL: {
                Expr.Conditional x = (Expr.Conditional) a;
                Expr.Conditional y = (Expr.Conditional) b;
                return same(x.condition(), y.condition()) && same(x.then(), y.then())
                        && same(x.otherwise(), y.otherwise());
            }
            case LET: {
                Expr.Let x = (Expr.Let) a;
                Expr.Let y = (Expr.Let) b;
                return x.name().equals(y.name()) && same(x.value(), y.value()) && same(x.body(), y.body());
            }
            case ERRORED:
                return ((Expr.Errored) a).text().equals(((Expr.Errored) b).text());
            default:
                throw new IllegalStateException("unexpected kind: " + a.kind());
        }
    }

    private static boolean same(List<Expr> a, List<Expr> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!same(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean sameEntries(List<Expr.ObjectEntry> a, List<Expr.ObjectEntry> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            Expr.ObjectEntry x = a.get(i);
            Expr.ObjectEntry y = b.get(i);
            if (x instanceof Expr.Spread && y instanceof Expr.Spread) {
                if (!same((Expr.Spread) x, (Expr.Spread) y)) {
                    return false;
                }
            } else if (x instanceof Expr.Property && y instanceof Expr.Property) {
                Expr.Property px = (Expr.Property) x;
                Expr.Property py = (Expr.Property) y;
                if (!px.key().equals(py.key()) || px.attribute() != py.attribute() || !same(px.value(), py.value())) {
                    return false;
                }
            } else {
                return false;
            }
        }
        return true;
    }

}
