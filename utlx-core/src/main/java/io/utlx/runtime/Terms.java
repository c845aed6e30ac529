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

import io.utlx.parser.BinaryOperator;
import io.utlx.parser.DiagnosticCode;
import io.utlx.parser.Location;
import io.utlx.udm.Udm;
import io.utlx.udm.UdmDate;
import io.utlx.udm.UdmDateTime;
import io.utlx.udm.UdmException;
import io.utlx.udm.UdmScalar;
import io.utlx.udm.UdmTime;
import io.utlx.udm.UdmType;

/**
 * Operator semantics over values. Operands are never errored here, the
 * interpreter returns early for those. Faults are reported through the context.
 */
class Terms {

    private Terms() {
        // only static methods
    }

    static Udm binary(BinaryOperator op, Udm lhs, Udm rhs, Location location, EvalContext context) {
        switch (op) {
            case EQ:
                return UdmScalar.of(lhs.equals(rhs));
            case NOT_EQ:
                return UdmScalar.of(!lhs.equals(rhs));
            case LT:
            case GT:
            case LT_EQ:
            case GT_EQ:
                return compare(op, lhs, rhs, location, context);
            case ADD:
                if (lhs.getType() == UdmType.STRING || rhs.getType() == UdmType.STRING) {
                    return concat(lhs, rhs, location, context);
                }
                // fall through
            default:
                if (lhs.getType() != UdmType.NUMBER || rhs.getType() != UdmType.NUMBER) {
                    return context.fault(DiagnosticCode.TYPE_MISMATCH, location, "operator '" + op
                            + "' cannot be applied to " + lhs.getType().displayName()
                            + " and " + rhs.getType().displayName());
                }
                return arithmetic(op, lhs.asNumber(), rhs.asNumber(), location, context);
        }
    }

    private static Udm concat(Udm lhs, Udm rhs, Location location, EvalContext context) {
        try {
            return UdmScalar.of(lhs.asString() + rhs.asString());
        } catch (UdmException e) {
            return context.fault(DiagnosticCode.TYPE_MISMATCH, location, "cannot concatenate "
                    + lhs.getType().displayName() + " and " + rhs.getType().displayName() + ": " + e.getMessage());
        }
    }

    private static Udm arithmetic(BinaryOperator op, Number a, Number b, Location location, EvalContext context) {
        boolean integral = isIntegral(a) && isIntegral(b);
        switch (op) {
            case ADD:
                if (integral) {
                    try {
                        return number(Math.addExact(a.longValue(), b.longValue()));
                    } catch (ArithmeticException e) {
                        // overflow, fall back to double
                    }
                }
                return number(a.doubleValue() + b.doubleValue());
            case SUB:
                if (integral) {
                    try {
                        return number(Math.subtractExact(a.longValue(), b.longValue()));
                    } catch (ArithmeticException e) {
                        // overflow, fall back to double
                    }
                }
                return number(a.doubleValue() - b.doubleValue());
            case MUL:
                if (integral) {
                    try {
                        return number(Math.multiplyExact(a.longValue(), b.longValue()));
                    } catch (ArithmeticException e) {
                        // overflow, fall back to double
                    }
                }
                return number(a.doubleValue() * b.doubleValue());
            case DIV:
                if (b.doubleValue() == 0) {
                    return context.fault(DiagnosticCode.ARITHMETIC, location, "division by zero");
                }
                return number(a.doubleValue() / b.doubleValue());
            case MOD:
                if (b.doubleValue() == 0) {
                    return context.fault(DiagnosticCode.ARITHMETIC, location, "modulo by zero");
                }
                if (integral) {
                    return number(a.longValue() % b.longValue());
                }
                return number(a.doubleValue() % b.doubleValue());
            case POW:
                return number(Math.pow(a.doubleValue(), b.doubleValue()));
            default:
                throw new IllegalStateException("not an arithmetic operator: " + op);
        }
    }

    private static Udm compare(BinaryOperator op, Udm lhs, Udm rhs, Location location, EvalContext context) {
        UdmType type = lhs.getType();
        int result;
        if (type != rhs.getType()) {
            result = Integer.MIN_VALUE;
        } else if (type == UdmType.NUMBER) {
            result = UdmScalar.compareNumbers(lhs.asNumber(), rhs.asNumber());
        } else if (type == UdmType.STRING) {
            result = lhs.asString().compareTo(rhs.asString());
        } else if (type == UdmType.DATETIME) {
            result = ((UdmDateTime) lhs).value().compareTo(((UdmDateTime) rhs).value());
        } else if (type == UdmType.DATE) {
            result = ((UdmDate) lhs).value().compareTo(((UdmDate) rhs).value());
        } else if (type == UdmType.TIME) {
            result = ((UdmTime) lhs).value().compareTo(((UdmTime) rhs).value());
        } else {
            result = Integer.MIN_VALUE;
        }
        if (result == Integer.MIN_VALUE) {
            return context.fault(DiagnosticCode.TYPE_MISMATCH, location, "cannot compare "
                    + lhs.getType().displayName() + " with " + rhs.getType().displayName()
                    + " using '" + op + "'");
        }
        return switch (op) {
            case LT -> UdmScalar.of(result < 0);
            case GT -> UdmScalar.of(result > 0);
            case LT_EQ -> UdmScalar.of(result <= 0);
            default -> UdmScalar.of(result >= 0);
        };
    }

    static Udm negate(Udm value, Location location, EvalContext context) {
        if (value.getType() != UdmType.NUMBER) {
            return context.fault(DiagnosticCode.TYPE_MISMATCH, location,
                    "operator '-' cannot be applied to " + value.getType().displayName());
        }
        Number n = value.asNumber();
        if (isIntegral(n) && n.longValue() != Long.MIN_VALUE) {
            return number(-n.longValue());
        }
        return number(-n.doubleValue());
    }

    /**
     * Boolean form of a value for conditions and logical operators.
     */
    static Udm truth(Udm value, Location location, EvalContext context) {
        try {
            return UdmScalar.of(value.asBoolean());
        } catch (UdmException e) {
            return context.fault(DiagnosticCode.TYPE_MISMATCH, location, "expected boolean but got "
                    + value.getType().displayName());
        }
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
    }

    private static Udm number(long l) {
        return UdmScalar.of(UdmScalar.narrow(l));
    }

    private static Udm number(double d) {
        return UdmScalar.of(narrow(d));
    }

    static Number narrow(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d) || d % 1 != 0) {
            return d;
        }
        if (d == 0 && 1 / d < 0) {
            return d; // negative zero
        }
        if (d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) {
            return (int) d;
        }
        if (d >= Long.MIN_VALUE && d <= Long.MAX_VALUE) {
            return (long) d;
        }
        return d;
    }

}
