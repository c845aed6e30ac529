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

import io.utlx.udm.Udm;
import io.utlx.udm.UdmType;

public enum ParamType {

    ANY,
    STRING,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT,
    FUNCTION,
    BINARY,
    // datetime, date or time
    TEMPORAL;

    /**
     * Only {@link #ANY} accepts null.
     */
    public boolean accepts(Udm value) {
        UdmType type = value.getType();
        return switch (this) {
            case ANY -> true;
            case STRING -> type == UdmType.STRING;
            case NUMBER -> type == UdmType.NUMBER;
            case BOOLEAN -> type == UdmType.BOOLEAN;
            case ARRAY -> type == UdmType.ARRAY;
            case OBJECT -> type == UdmType.OBJECT;
            case FUNCTION -> type == UdmType.LAMBDA;
            case BINARY -> type == UdmType.BINARY;
            case TEMPORAL -> type == UdmType.DATETIME || type == UdmType.DATE || type == UdmType.TIME;
        };
    }

    @Override
    public String toString() {
        return name().toLowerCase();
    }

}
