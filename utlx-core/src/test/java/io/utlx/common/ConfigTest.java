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

class ConfigTest {

    @Test
    void testDefaults() {
        Config config = Config.of(5);
        assertEquals(5, config.getMaxErrors());
        assertFalse(config.isFailFast());
        assertTrue(config.isRecovery());
        assertEquals(Config.DEFAULT_MAX_DEPTH, config.getMaxDepth());
        assertEquals(0, config.getMaxSteps());
    }

    @Test
    void testWithersReturnCopies() {
        Config base = Config.of(5);
        Config strict = base.withFailFast(true).withRecovery(false).withMaxDepth(10).withMaxSteps(1000);
        assertFalse(base.isFailFast());
        assertTrue(strict.isFailFast());
        assertFalse(strict.isRecovery());
        assertEquals(10, strict.getMaxDepth());
        assertEquals(1000, strict.getMaxSteps());
        assertEquals(5, strict.getMaxErrors());
    }

    @Test
    void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> Config.of(0));
        assertThrows(IllegalArgumentException.class, () -> Config.of(1).withMaxDepth(0));
        assertThrows(IllegalArgumentException.class, () -> Config.of(1).withMaxSteps(-1));
    }

}
