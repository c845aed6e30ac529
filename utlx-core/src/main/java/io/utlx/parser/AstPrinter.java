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

import io.utlx.common.StringUtils;

import java.util.List;

/**
 * Renders a syntax tree back to script text. Every compound expression is
 * parenthesized, so the output parses back to the same tree regardless of
 * operator precedence. Trees that still contain errored nodes cannot be printed.
 */
public class AstPrinter {

    private final StringBuilder sb = new StringBuilder();
    private final boolean lenient;

    private AstPrinter(boolean lenient) {
        this.lenient = lenient;
    }

    public static String print(Program program) {
        AstPrinter printer = new AstPrinter(false);
        for (Directive directive : program.directives()) {
            if (Directive.UTLX.equals(directive.name())) {
                printer.sb.append('%');
            }
            printer.sb.append(directive.name()).append(' ').append(directive.value()).append('\n');
        }
        printer.sb.append("---\n");
        printer.expr(program.content());
        printer.sb.append('\n');
        return printer.sb.toString();
    }

    public static String print(Expr expr) {
        AstPrinter printer = new AstPrinter(false);
        printer.expr(expr);
        return printer.sb.toString();
    }

    /**
     * Like {@link #print(Expr)} but accepts errored nodes, for use in messages.
     */
    public static String describe(Expr expr) {
        AstPrinter printer = new AstPrinter(true);
        printer.expr(expr);
        return printer.sb.toString();
    }

    private void expr(Expr expr) {
        switch (expr.kind()) {
            case LITERAL -> literal(((Expr.Literal) expr).value());
            case IDENTIFIER -> sb.append(((Expr.Identifier) expr).name());
            case BINARY -> {
                Expr.Binary binary = (Expr.Binary) expr;
                sb.append('(');
                expr(binary.left());
                sb.append(' ').append(binary.op().symbol).append(' ');
                expr(binary.right());
                sb.append(')');
            }
            case UNARY -> {
                Expr.Unary unary = (Expr.Unary) expr;
                sb.append('(').append(unary.op().symbol);
                expr(unary.operand());
                sb.append(')');
            }
            case MEMBER -> {
                Expr.Member member = (Expr.Member) expr;
                expr(member.object());
                sb.append(member.safe() ? "?." : ".");
                if (member.attribute()) {
                    sb.append('@');
                }
                key(member.key());
            }
            case INDEX -> {
                Expr.Index index = (Expr.Index) expr;
                expr(index.object());
                sb.append('[');
                expr(index.index());
                sb.append(']');
            }
            case CALL -> {
                Expr.Call call = (Expr.Call) expr;
                expr(call.callee());
                sb.append('(');
                list(call.args());
                sb.append(')');
            }
            case LAMBDA -> {
                Expr.Lambda lambda = (Expr.Lambda) expr;
                sb.append("((").append(String.join(", ", lambda.params())).append(") => ");
                expr(lambda.body());
                sb.append(')');
            }
            case PIPE -> {
                Expr.Pipe pipe = (Expr.Pipe) expr;
                sb.append('(');
                expr(pipe.source());
                sb.append(" |> ");
                expr(pipe.target());
                sb.append(')');
            }
            case OBJECT -> {
                sb.append('{');
                boolean first = true;
                for (Expr.ObjectEntry entry : ((Expr.ObjectLiteral) expr).entries()) {
                    if (!first) {
                        sb.append(", ");
                    }
                    first = false;
                    if (entry instanceof Expr.Spread) {
                        expr((Expr.Spread) entry);
                    } else {
                        Expr.Property property = (Expr.Property) entry;
                        if (property.attribute()) {
                            sb.append('@');
                        }
                        key(property.key());
                        sb.append(": ");
                        expr(property.value());
                    }
                }
                sb.append('}');
            }
            case ARRAY -> {
                sb.append('[');
                list(((Expr.ArrayLiteral) expr).elements());
                sb.append(']');
            }
            case SPREAD -> {
                sb.append("...");
                expr(((Expr.Spread) expr).source());
            }
            case CONDITIONAL -> {
                Expr.Conditional conditional = (Expr.Conditional) expr;
                sb.append('(');
                expr(conditional.condition());
                sb.append(" ? ");
                expr(conditional.then());
                sb.append(" : ");
                expr(conditional.otherwise());
                sb.append(')');
            }
            case LET -> let((Expr.Let) expr);
            case ERRORED -> {
                if (!lenient) {
                    throw new IllegalStateException("cannot print errored expression at " + expr.location());
                }
                sb.append("<error>");
            }
        }
    }

    private void let(Expr.Let let) {
        sb.append('(');
        if (let.value() instanceof Expr.Lambda && let.name().equals(((Expr.Lambda) let.value()).name())) {
            Expr.Lambda lambda = (Expr.Lambda) let.value();
            sb.append("function ").append(let.name());
            sb.append('(').append(String.join(", ", lambda.params())).append(") { ");
            expr(lambda.body());
            sb.append(" } ");
        } else {
            sb.append("let ").append(let.name()).append(" = ");
            expr(let.value());
            sb.append("; ");
        }
        expr(let.body());
        sb.append(')');
    }

    private void list(List<Expr> exprs) {
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            expr(exprs.get(i));
        }
    }

    private void key(String key) {
        if (isIdentifier(key)) {
            sb.append(key);
        } else {
            sb.append(StringUtils.quote(key));
        }
    }

    private void literal(Object value) {
        if (value instanceof String) {
            sb.append(StringUtils.quote((String) value));
        } else {
            // null, booleans and numbers print as they are written
            sb.append(value);
        }
    }

    static boolean isIdentifier(String key) {
        if (key.isEmpty()) {
            return false;
        }
        char first = key.charAt(0);
        if (!(Character.isLetter(first) || first == '_' || first == '$')) {
            return false;
        }
        for (int i = 1; i < key.length(); i++) {
            char c = key.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == '$')) {
                return false;
            }
        }
        return true;
    }

}
