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
package io.utlx.udm;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A string, number or boolean.
 */
public final class UdmScalar implements Udm {

    public static final UdmScalar TRUE = new UdmScalar(Boolean.TRUE);
    public static final UdmScalar FALSE = new UdmScalar(Boolean.FALSE);
    public static final UdmScalar EMPTY = new UdmScalar("");

    private final Object value;

    private UdmScalar(Object value) {
        this.value = value;
    }

    public static UdmScalar of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null, use UdmNull");
        }
        return value.isEmpty() ? EMPTY : new UdmScalar(value);
    }

    public static UdmScalar of(Number value) {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null, use UdmNull");
        }
        return new UdmScalar(value);
    }

    public static UdmScalar of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public UdmType getType() {
        if (value instanceof String) {
            return UdmType.STRING;
        }
        return value instanceof Number ? UdmType.NUMBER : UdmType.BOOLEAN;
    }

    @Override
    public String asString() {
        if (value instanceof Number) {
            return formatNumber((Number) value);
        }
        return value.toString();
    }

    @Override
    public Number asNumber() {
        if (value instanceof Number) {
            return (Number) value;
        }
        if (value instanceof String) {
            Number number = parseNumber((String) value);
            if (number != null) {
                return number;
            }
            throw new UdmException("cannot coerce string '" + value + "' to number");
        }
        throw UdmException.coercion(this, "number");
    }

    @Override
    public boolean asBoolean() {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String s = ((String) value).trim();
            if ("true".equalsIgnoreCase(s)) {
                return true;
            }
            if ("false".equalsIgnoreCase(s)) {
                return false;
            }
            throw new UdmException("cannot coerce string '" + value + "' to boolean");
        }
        throw UdmException.coercion(this, "boolean");
    }

    // ========== Number Utilities ==========

    /**
     * Integral values print without a fraction, 2.0 becomes "2".
     */
    public static String formatNumber(Number n) {
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (d % 1 == 0 && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        if (n instanceof BigDecimal) {
            return ((BigDecimal) n).stripTrailingZeros().toPlainString();
        }
        return n.toString();
    }

    /**
     * @return Integer, Long or Double, or null if the text is not a number
     */
    public static Number parseNumber(String text) {
        String s = text.trim();
        if (s.isEmpty()) {
            return null;
        }
        try {
            return narrow(Long.parseLong(s));
        } catch (NumberFormatException e) {
            // not an integer, try decimal below
        }
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Number narrow(long l) {
        if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
            return (int) l;
        }
        return l;
    }

    static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
    }

    public static int compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return Long.compare(a.longValue(), b.longValue());
        }
        if (a instanceof BigDecimal || b instanceof BigDecimal || a instanceof BigInteger || b instanceof BigInteger) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
        }
        double x = a.doubleValue();
        double y = b.doubleValue();
        return x == y ? 0 : Double.compare(x, y);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UdmScalar)) {
            return false;
        }
        Object other = ((UdmScalar) o).value;
        if (value instanceof Number && other instanceof Number) {
            return compareNumbers((Number) value, (Number) other) == 0;
        }
        return value.equals(other);
    }

    @Override
    public int hashCode() {
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (d % 1 == 0 && d >= Long.MIN_VALUE && d <= Long.MAX_VALUE) {
                return Long.hashCode((long) d);
            }
            return Double.hashCode(d);
        }
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value instanceof String ? "\"" + value + "\"" : asString();
    }

}
