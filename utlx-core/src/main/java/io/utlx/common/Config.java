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

/**
 * Immutable settings shared by the parser and the evaluator. There is no default
 * error limit, callers always state one through {@link #of(int)}.
 */
public final class Config {

    public static final int DEFAULT_MAX_DEPTH = 512;

    private final int maxErrors;
    private final boolean failFast;
    private final boolean recovery;
    private final int maxDepth;
    private final long maxSteps;

    private Config(int maxErrors, boolean failFast, boolean recovery, int maxDepth, long maxSteps) {
        this.maxErrors = maxErrors;
        this.failFast = failFast;
        this.recovery = recovery;
        this.maxDepth = maxDepth;
        this.maxSteps = maxSteps;
    }

    public static Config of(int maxErrors) {
        if (maxErrors < 1) {
            throw new IllegalArgumentException("maxErrors must be at least 1, was: " + maxErrors);
        }
        return new Config(maxErrors, false, true, DEFAULT_MAX_DEPTH, 0);
    }

    public Config withFailFast(boolean failFast) {
        return new Config(maxErrors, failFast, recovery, maxDepth, maxSteps);
    }

    public Config withRecovery(boolean recovery) {
        return new Config(maxErrors, failFast, recovery, maxDepth, maxSteps);
    }

    public Config withMaxDepth(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, was: " + maxDepth);
        }
        return new Config(maxErrors, failFast, recovery, maxDepth, maxSteps);
    }

    /**
     * @param maxSteps evaluation step budget, zero means unlimited
     */
    public Config withMaxSteps(long maxSteps) {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must not be negative, was: " + maxSteps);
        }
        return new Config(maxErrors, failFast, recovery, maxDepth, maxSteps);
    }

    public int getMaxErrors() {
        return maxErrors;
    }

    public boolean isFailFast() {
        return failFast;
    }

    public boolean isRecovery() {
        return recovery;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public long getMaxSteps() {
        return maxSteps;
    }

    @Override
    public String toString() {
        return "Config{maxErrors=" + maxErrors + ", failFast=" + failFast + ", recovery=" + recovery
                + ", maxDepth=" + maxDepth + ", maxSteps=" + maxSteps + "}";
    }

}
