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

import net.minidev.json.JSONValue;
import org.junit.jupiter.api.Assertions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders syntax trees as JSON-shaped values so that parser tests can state the
 * expected tree compactly, for example {@code [1,'+',[2,'*',3]]}.
 * Identifiers render as {@code $name}, errored nodes as {@code !err}.
 */
public class AstUtils {

    static final Logger logger = LoggerFactory.getLogger(AstUtils.class);

    public static Object fromJson(String json) {
        return JSONValue.parseKeepingOrder(json);
    }

    public static String toJson(Object o) {
        return JSONValue.toJSONString(o);
    }

    public static Object ser(Expr expr) {
        switch (expr.kind()) {
            case LITERAL:
                return ((Expr.Literal) expr).value();
            case IDENTIFIER:
                return "$" + ((Expr.Identifier) expr).name();
            case BINARY: {
                Expr.Binary binary = (Expr.Binary) expr;
                return Arrays.asList(ser(binary.left()), binary.op().symbol, ser(binary.right()));
            }
            case UNARY: {
                Expr.Unary unary = (Expr.Unary) expr;
                return Arrays.asList(unary.op().symbol, ser(unary.operand()));
            }
            case MEMBER: {
                Expr.Member member = (Expr.Member) expr;
                String key = (member.safe() ? "?." : ".") + (member.attribute() ? "@" : "") + member.key();
                return Arrays.asList(ser(member.object()), key);
            }
            case INDEX: {
                Expr.Index index = (Expr.Index) expr;
                return Arrays.asList(ser(index.object()), "[]", ser(index.index()));
            }
            case CALL: {
                Expr.Call call = (Expr.Call) expr;
                return Arrays.asList(ser(call.callee()), "()", serList(call.args()));
            }
            case LAMBDA: {
                Expr.Lambda lambda = (Expr.Lambda) expr;
                return Arrays.asList(lambda.params(), "=>", ser(lambda.body()));
            }
            case PIPE: {
                Expr.Pipe pipe = (Expr.Pipe) expr;
                return Arrays.asList(ser(pipe.source()), "|>", ser(pipe.target()));
            }
            case OBJECT: {
                Map<String, Object> map = new LinkedHashMap<>();
                int spreads = 0;
                for (Expr.ObjectEntry entry : ((Expr.ObjectLiteral) expr).entries()) {
                    if (entry instanceof Expr.Spread) {
                        map.put("..." + spreads++, ser(((Expr.Spread) entry).source()));
                    } else {
                        Expr.Property property = (Expr.Property) entry;
                        map.put((property.attribute() ? "@" : "") + property.key(), ser(property.value()));
                    }
                }
                return map;
            }
            case ARRAY:
                return serList(((Expr.ArrayLiteral) expr).elements());
            case SPREAD:
                return Arrays.asList("...", ser(((Expr.Spread) expr).source()));
            case CONDITIONAL: {
                Expr.Conditional conditional = (Expr.Conditional) expr;
                return Arrays.asList(ser(conditional.condition()), "?", ser(conditional.then()), ":",
                        ser(conditional.otherwise()));
            }
            case LET: {
                Expr.Let let = (Expr.Let) expr;
                return Arrays.asList("let", let.name(), ser(let.value()), ser(let.body()));
            }
            default:
                return "!err";
        }
    }

    private static List<Object> serList(List<Expr> exprs) {
        List<Object> list = new ArrayList<>(exprs.size());
        for (Expr expr : exprs) {
            list.add(ser(expr));
        }
        return list;
    }

    public static void assertEquals(String text, Expr expr, String json) {
        String expected = toJson(fromJson(json));
        String actual = toJson(ser(expr));
        try {
            Assertions.assertEquals(expected, actual);
        } catch (Throwable t) {
            logger.debug("text:\n{}", text);
            throw t;
        }
    }

}
