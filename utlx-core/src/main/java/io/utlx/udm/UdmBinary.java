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

import java.util.Arrays;

/**
 * Raw bytes with an optional encoding hint such as "base64", kept so that an
 * encoder can write the bytes back the way they were read.
 */
public final class UdmBinary implements Udm {

    private final byte[] bytes;
    private final String encoding;

    public UdmBinary(byte[] bytes, String encoding) {
        this.bytes = bytes.clone();
        this.encoding = encoding;
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    public String getEncoding() {
        return encoding;
    }

    @Override
    public UdmType getType() {
        return UdmType.BINARY;
    }

    // the encoding is a hint, equal bytes are equal values
    @Override
    public boolean equals(Object o) {
        return o instanceof UdmBinary && Arrays.equals(bytes, ((UdmBinary) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "binary[" + bytes.length + "]";
    }

}
