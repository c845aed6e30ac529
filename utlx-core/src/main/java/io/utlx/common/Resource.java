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

import java.nio.file.Path;

/**
 * Source of script text. Lexer tokens keep a reference to the resource they were
 * read from so that diagnostics can show the offending line.
 */
public interface Resource {

    /**
     * Returns true if this resource is backed by the file system.
     * PathResource returns true, MemoryResource returns false.
     */
    boolean isFile();

    /**
     * Returns the Path representation of this resource if it's file-based.
     * Returns null for in-memory resources.
     */
    Path getPath();

    /**
     * Display name used in diagnostics, never null.
     */
    String getRelativePath();

    String getText();

    /**
     * @param index 0-based line number
     * @return the line without its terminator, or an empty string if out of range
     */
    String getLine(int index);

    static Resource text(String text) {
        return new MemoryResource(text, "");
    }

    static Resource text(String text, String name) {
        return new MemoryResource(text, name);
    }

    static Resource path(Path path) {
        return new PathResource(path);
    }

}
