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
package io.utlx.runtime;

import io.utlx.parser.AstPrinter;
import io.utlx.parser.BinaryOperator;
import io.utlx.parser.DiagnosticCode;
import io.utlx.parser.Expr;
import io.utlx.parser.ExprKind;
import io.utlx.parser.Location;
import io.utlx.parser.UnaryOperator;
import io.utlx.udm.Udm;
import io.utlx.udm.UdmArray;
import io.utlx.udm.UdmErrored;
import io.utlx.udm.UdmException;
import io.utlx.udm.UdmLambda;
import io.utlx.udm.UdmNull;
import io.utlx.udm.UdmObject;
import io.utlx.udm.UdmScalar;
import io.utlx.udm.UdmType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree walking evaluator. A failed sub-expression yields an {@link UdmErrored}
 * value which every consumer returns unchanged, so one fault is reported once
 * and the rest of the tree keeps being checked.
 */
class Interpreter {

    static final Logger logger = LoggerFactory.getLogger(Interpreter.class);

    private Interpreter() {
        // only static methods
    }

    static Udm eval(Expr expr, Scope scope, EvalContext context) {
        context.step(expr.location());
        if (logger.isTraceEnabled()) {
            logger.trace("{} {}", expr.kind(), expr.location());
        }
        return switch (expr.kind()) {
            case LITERAL -> literal(((Expr.Literal) expr).value());
            case IDENTIFIER -> evalIdentifier((Expr.Identifier) expr, scope, context);
            case BINARY -> evalBinary((Expr.Binary) expr, scope, context);
            case UNARY -> evalUnary((Expr.Unary) expr, scope, context);
            case MEMBER -> evalMember((Expr.Member) expr, scope, context);
            case INDEX -> evalIndex((Expr.Index) expr, scope, context);
            case CALL -> evalCall((Expr.Call) expr, null, scope, context);
            case LAMBDA -> new UdmLambda(new Closure((Expr.Lambda) expr, scope));
            case PIPE -> {
                Expr.Pipe pipe = (Expr.Pipe) expr;
                yield pipeInto(eval(pipe.source(), scope, context), pipe.target(), scope, context);
            }
            case OBJECT -> evalObject((Expr.ObjectLiteral) expr, scope, context);
            case ARRAY -> evalArray((Expr.ArrayLiteral) expr, scope, context);
            case CONDITIONAL -> evalConditional((Expr.Conditional) expr, scope, context);
            case LET -> {
                Expr.Let let = (Expr.Let) expr;
                Udm value = eval(let.value(), scope, context);
                // bound even when errored, uses of the name just carry the taint
                yield eval(let.body(), scope.bind(let.name(), value), context);
            }
            case ERRORED -> context.unparsed(expr.location());
            case SPREAD -> throw new IllegalStateException("spread outside of an object or array: " + expr.location());
        };
    }

    private static Udm literal(Object value) {
        if (value == null) {
            return UdmNull.INSTANCE;
        }
        if (value instanceof String) {
            return UdmScalar.of((String) value);
        }
        if (value instanceof Number) {
            return UdmScalar.of((Number) value);
        }
        if (value instanceof Boolean) {
            return UdmScalar.of((Boolean) value);
        }
        throw new IllegalStateException("unexpected literal: " + value.getClass());
    }

    private static Udm evalIdentifier(Expr.Identifier identifier, Scope scope, EvalContext context) {
        String name = identifier.name();
        Udm value = scope.lookup(name);
        if (value != null) {
            return value;
        }
        FunctionSignature signature = context.stdlib.resolve(name);
        if (signature != null) {
            return new UdmLambda(new NativeFunction(signature, context.stdlib));
        }
        return context.fault(DiagnosticCode.UNDEFINED_VARIABLE, identifier.location(), "'" + name + "' is not defined");
    }

    private static Udm evalBinary(Expr.Binary binary, Scope scope, EvalContext context) {
        BinaryOperator op = binary.op();
        Location location = binary.location();
        switch (op) {
            case AND:
            case OR: {
                Udm lhs = eval(binary.left(), scope, context);
                if (lhs.isErrored()) {
                    return lhs;
                }
                Udm left = Terms.truth(lhs, binary.left().location(), context);
                if (left.isErrored()) {
                    return left;
                }
                boolean value = left.asBoolean();
                if (op == BinaryOperator.AND ? !value : value) {
                    return left;
                }
                Udm rhs = eval(binary.right(), scope, context);
                if (rhs.isErrored()) {
                    return rhs;
                }
                return Terms.truth(rhs, binary.right().location(), context);
            }
            case NULLISH: {
                Udm lhs = eval(binary.left(), scope, context);
                if (lhs.isNull()) {
                    return eval(binary.right(), scope, context);
                }
                return lhs;
            }
            default: {
                Udm lhs = eval(binary.left(), scope, context);
                Udm rhs = eval(binary.right(), scope, context);
                if (lhs.isErrored()) {
                    return lhs;
                }
                if (rhs.isErrored()) {
                    return rhs;
                }
                return Terms.binary(op, lhs, rhs, location, context);
            }
        }
    }

    private static Udm evalUnary(Expr.Unary unary, Scope scope, EvalContext context) {
        Udm operand = eval(unary.operand(), scope, context);
        if (operand.isErrored()) {
            return operand;
        }
        if (unary.op() == UnaryOperator.NOT) {
            Udm truth = Terms.truth(operand, unary.location(), context);
            return truth.isErrored() ? truth : UdmScalar.of(!truth.asBoolean());
        }
        return Terms.negate(operand, unary.location(), context);
    }

    private static Udm evalMember(Expr.Member member, Scope scope, EvalContext context) {
        Udm object = eval(member.object(), scope, context);
        if (object.isErrored()) {
            return object;
        }
        String key = member.key();
        switch (object.getType()) {
            case NULL:
                if (member.safe()) {
                    return UdmNull.INSTANCE;
                }
                return context.fault(DiagnosticCode.MISSING_PATH, member.location(),
                        "cannot read '" + key + "' of null: " + AstPrinter.describe(member.object()) + " is null",
                        "use '?.' if the value may be absent");
            case OBJECT:
                return property((UdmObject) object, key, member.attribute());
            case ARRAY: {
                // projection over the elements that are objects
                List<Udm> values = new ArrayList<>();
                for (Udm element : (UdmArray) object) {
                    if (element instanceof UdmObject) {
                        UdmObject child = (UdmObject) element;
                        if (member.attribute() ? child.getAttribute(key) != null : child.has(key)) {
                            values.add(property(child, key, member.attribute()));
                        }
                    }
                }
                return UdmArray.of(values);
            }
            default:
                return context.fault(DiagnosticCode.TYPE_MISMATCH, member.location(),
                        "cannot read '" + key + "' of " + object.getType().displayName());
        }
    }

    private static Udm property(UdmObject object, String key, boolean attribute) {
        if (attribute) {
            String value = object.getAttribute(key);
            return value == null ? UdmNull.INSTANCE : UdmScalar.of(value);
        }
        Udm value = object.get(key);
        return value == null ? UdmNull.INSTANCE : value;
    }

    private static Udm evalIndex(Expr.Index index, Scope scope, EvalContext context) {
        Udm object = eval(index.object(), scope, context);
        Udm key = eval(index.index(), scope, context);
        if (object.isErrored()) {
            return object;
        }
        if (key.isErrored()) {
            return key;
        }
        if (object.getType() == UdmType.ARRAY && key.getType() == UdmType.NUMBER) {
            Number n = key.asNumber();
            if (n.doubleValue() % 1 != 0) {
                return context.fault(DiagnosticCode.TYPE_MISMATCH, index.location(), "array index must be an integer: " + key);
            }
            double i = n.doubleValue();
            if (i < 0 || i > Integer.MAX_VALUE) {
                return UdmNull.INSTANCE;
            }
            Udm value = ((UdmArray) object).get((int) i);
            return value == null ? UdmNull.INSTANCE : value;
        }
        if (object.getType() == UdmType.OBJECT && key.getType() == UdmType.STRING) {
            Udm value = ((UdmObject) object).get(key.asString());
            return value == null ? UdmNull.INSTANCE : value;
        }
        if (object.isNull()) {
            return context.fault(DiagnosticCode.MISSING_PATH, index.location(),
                    "cannot index null: " + AstPrinter.describe(index.object()) + " is null");
        }
        return context.fault(DiagnosticCode.TYPE_MISMATCH, index.location(),
                "cannot index " + object.getType().displayName() + " with " + key.getType().displayName());
    }

    /**
     * @param piped the value flowing in from a pipe, passed as the first argument, or null
     */
    private static Udm evalCall(Expr.Call call, Udm piped, Scope scope, EvalContext context) {
        Udm callee = eval(call.callee(), scope, context);
        List<Udm> args = new ArrayList<>(call.args().size() + 1);
        if (piped != null) {
            args.add(piped);
        }
        Udm errored = callee.isErrored() ? callee : null;
        for (Expr arg : call.args()) {
            if (arg.kind() == ExprKind.SPREAD) {
                Expr.Spread spread = (Expr.Spread) arg;
                Udm value = eval(spread.source(), scope, context);
                if (value.isErrored()) {
                    errored = errored == null ? value : errored;
                } else if (value instanceof UdmArray) {
                    args.addAll(((UdmArray) value).elements());
                } else {
                    Udm fault = context.fault(DiagnosticCode.TYPE_MISMATCH, spread.location(),
                            "cannot spread " + value.getType().displayName() + " into arguments, expected array");
                    errored = errored == null ? fault : errored;
                }
            } else {
                Udm value = eval(arg, scope, context);
                if (value.isErrored() && errored == null) {
                    errored = value;
                }
                args.add(value);
            }
        }
        if (errored != null) {
            return errored;
        }
        if (!(callee instanceof UdmLambda)) {
            return context.fault(DiagnosticCode.TYPE_MISMATCH, call.location(),
                    AstPrinter.describe(call.callee()) + " is not a function, it is " + callee.getType().displayName());
        }
        return apply((UdmLambda) callee, args, call.location(), context);
    }

    static Udm apply(UdmLambda function, List<Udm> args, Location location, EvalContext context) {
        UdmLambda.Target target = function.getTarget();
        if (target instanceof Closure) {
            Closure closure = (Closure) target;
            if (args.size() != closure.params.size()) {
                return context.fault(DiagnosticCode.FUNCTION_CALL, location, closure.describe() + " expects "
                        + closure.params.size() + " argument(s) but got " + args.size(), closure.describe());
            }
            Scope scope = closure.scope;
            if (closure.name != null) {
                scope = scope.bind(closure.name, function);
            }
            for (int i = 0; i < args.size(); i++) {
                scope = scope.bind(closure.params.get(i), args.get(i));
            }
            context.enter(location);
            try {
                return eval(closure.body, scope, context);
            } finally {
                context.exit();
            }
        }
        if (target instanceof NativeFunction) {
            return invokeNative((NativeFunction) target, args, location, context);
        }
        throw new IllegalStateException("unknown function target: " + target.getClass());
    }

    private static Udm invokeNative(NativeFunction function, List<Udm> args, Location location, EvalContext context) {
        FunctionSignature signature = function.signature;
        String mismatch = signature.check(args);
        if (mismatch != null) {
            return context.fault(DiagnosticCode.FUNCTION_CALL, location, mismatch, signature.toString());
        }
        Udm result;
        context.enter(location);
        try {
            result = function.stdlib.invoke(signature.name(), args, context.callContext(location));
        } catch (EngineException e) {
            throw e;
        } catch (StdlibException | UdmException e) {
            return context.fault(DiagnosticCode.FUNCTION_CALL, location, signature.name() + "() failed: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("function {}() threw unexpectedly: {}", signature.name(), e.toString());
            return context.fault(DiagnosticCode.FUNCTION_CALL, location, signature.name() + "() failed: " + e);
        } finally {
            context.exit();
        }
        if (result == null) {
            return context.fault(DiagnosticCode.FUNCTION_CALL, location, signature.name() + "() returned no value");
        }
        return result;
    }

    /**
     * {@code a |> f |> g} parses as {@code a |> (f |> g)} and is applied left to right.
     */
    private static Udm pipeInto(Udm value, Expr target, Scope scope, EvalContext context) {
        if (target.kind() == ExprKind.PIPE) {
            Expr.Pipe pipe = (Expr.Pipe) target;
            return pipeInto(pipeInto(value, pipe.source(), scope, context), pipe.target(), scope, context);
        }
        if (value.isErrored()) {
            return value;
        }
        if (target.kind() == ExprKind.CALL) {
            return evalCall((Expr.Call) target, value, scope, context);
        }
        Udm function = eval(target, scope, context);
        if (function.isErrored()) {
            return function;
        }
        if (!(function instanceof UdmLambda)) {
            return context.fault(DiagnosticCode.TYPE_MISMATCH, target.location(),
                    "cannot pipe into " + function.getType().displayName() + ", expected a function");
        }
        List<Udm> args = new ArrayList<>(1);
        args.add(value);
        return apply((UdmLambda) function, args, target.location(), context);
    }

    private static Udm evalObject(Expr.ObjectLiteral object, Scope scope, EvalContext context) {
        UdmObject.Builder builder = UdmObject.builder();
        Udm errored = null;
        for (Expr.ObjectEntry entry : object.entries()) {
            if (entry instanceof Expr.Spread) {
                Expr.Spread spread = (Expr.Spread) entry;
                Udm value = eval(spread.source(), scope, context);
                if (value.isErrored()) {
                    errored = errored == null ? value : errored;
                } else if (value instanceof UdmObject) {
                    builder.putAll((UdmObject) value);
                } else {
                    Udm fault = context.fault(DiagnosticCode.TYPE_MISMATCH, spread.location(),
                            "cannot spread " + value.getType().displayName() + " into an object");
                    errored = errored == null ? fault : errored;
                }
                continue;
            }
            Expr.Property property = (Expr.Property) entry;
            Udm value = eval(property.value(), scope, context);
            if (value.isErrored()) {
                errored = errored == null ? value : errored;
            } else if (property.attribute()) {
                try {
                    builder.attribute(property.key(), value.asString());
                } catch (UdmException e) {
                    Udm fault = context.fault(DiagnosticCode.TYPE_MISMATCH, property.location(),
                            "attribute '@" + property.key() + "' must be a scalar, got " + value.getType().displayName());
                    errored = errored == null ? fault : errored;
                }
            } else {
                builder.put(property.key(), value);
            }
        }
        return errored == null ? builder.build() : errored;
    }

    private static Udm evalArray(Expr.ArrayLiteral array, Scope scope, EvalContext context) {
        List<Udm> values = new ArrayList<>(array.elements().size());
        Udm errored = null;
        for (Expr element : array.elements()) {
            if (element.kind() == ExprKind.SPREAD) {
                Expr.Spread spread = (Expr.Spread) element;
                Udm value = eval(spread.source(), scope, context);
                if (value.isErrored()) {
                    errored = errored == null ? value : errored;
                } else if (value instanceof UdmArray) {
                    values.addAll(((UdmArray) value).elements());
                } else {
                    Udm fault = context.fault(DiagnosticCode.TYPE_MISMATCH, spread.location(),
                            "cannot spread " + value.getType().displayName() + " into an array");
                    errored = errored == null ? fault : errored;
                }
            } else {
                Udm value = eval(element, scope, context);
                if (value.isErrored() && errored == null) {
                    errored = value;
                }
                values.add(value);
            }
        }
        return errored == null ? UdmArray.of(values) : errored;
    }

    private static Udm evalConditional(Expr.Conditional conditional, Scope scope, EvalContext context) {
        Udm condition = eval(conditional.condition(), scope, context);
        if (condition.isErrored()) {
            return condition;
        }
        Udm truth = Terms.truth(condition, conditional.condition().location(), context);
        if (truth.isErrored()) {
            return truth;
        }
        return eval(truth.asBoolean() ? conditional.then() : conditional.otherwise(), scope, context);
    }

}
