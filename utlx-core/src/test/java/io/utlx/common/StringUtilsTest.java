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
package io.utlx.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StringUtilsTest {

    @Test
    void testLines() {
        assertArrayEquals(new String[]{""}, StringUtils.lines(null));
        assertArrayEquals(new String[]{"a", "", "b"}, StringUtils.lines("a\n\r\nb"));
        assertArrayEquals(new String[]{"a", ""}, StringUtils.lines("a\n"));
    }

    @Test
    void testBlank() {
        assertTrue(StringUtils.isBlank(null));
        assertTrue(StringUtils.isBlank(" \t"));
        assertFalse(StringUtils.isBlank(" x "));
        assertEquals("x", StringUtils.trimToEmpty(" x "));
        assertEquals("", StringUtils.trimToEmpty(null));
    }

    @Test
    void testQuote() {
        assertEquals("\"it's\"", StringUtils.quote("it's"));
        assertEquals("\"a\\\"b\\\\c\\nd\\te\"", StringUtils.quote("a\"b\\c\nd\te"));
        assertEquals("\"\\u0001\"", StringUtils.quote("\u0001"));
    }

}
