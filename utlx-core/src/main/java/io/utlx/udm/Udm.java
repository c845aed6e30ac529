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

/**
 * Universal Data Model: the immutable, format neutral value tree that input
 * documents are decoded into and output documents are encoded from.
 * <p>
 * Equality is structural and type sensitive: the number 1 equals the number 1.0
 * but not the string "1". Object names, attributes and metadata do not take part
 * in equality.
 * <p>
 * Navigation with {@link #get(String...)} distinguishes an absent path, which
 * returns Java {@code null}, from a present null value, which returns {@link UdmNull}.
 */
public sealed interface Udm permits UdmNull, UdmScalar, UdmDateTime, UdmDate, UdmTime, UdmBinary,
        UdmArray, UdmObject, UdmLambda, UdmErrored {

    UdmType getType();

    default boolean isNull() {
        return getType() == UdmType.NULL;
    }

    default boolean isErrored() {
        return getType() == UdmType.ERRORED;
    }

    /**
     * @throws UdmException if this kind has no string form
     */
    default String asString() {
        throw UdmException.coercion(this, "string");
    }

    /**
     * @throws UdmException if this kind has no numeric form
     */
    default Number asNumber() {
        throw UdmException.coercion(this, "number");
    }

    /**
     * @throws UdmException if this kind has no boolean form
     */
    default boolean asBoolean() {
        throw UdmException.coercion(this, "boolean");
    }

    /**
     * Each segment is a property name, an attribute name prefixed with {@code @},
     * or a numeric index when the value at that point is an array.
     *
     * @return the value, or null if the path does not exist
     */
    default Udm get(String... path) {
        return UdmPath.of(path).navigate(this);
    }

    default Udm get(UdmPath path) {
        return path.navigate(this);
    }

}
