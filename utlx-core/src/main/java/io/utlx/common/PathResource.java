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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class PathResource implements Resource {

    private final Path path;
    private final String relativePath;

    // lazy
    private String text;
    private String[] lines;

    /**
     * Creates a PathResource with the working directory as root.
     *
     * @param path the path
     */
    public PathResource(Path path) {
        this(path, Path.of(""));
    }

    /**
     * Creates a PathResource with a custom root.
     *
     * @param path the path
     * @param root the root path for computing relative paths
     */
    public PathResource(Path path, Path root) {
        // Always work with absolute normalized paths internally for consistency
        this.path = path.toAbsolutePath().normalize();
        this.relativePath = computeRelativePath(root.toAbsolutePath().normalize());
    }

    private String computeRelativePath(Path root) {
        // Cross-drive on Windows cannot be relativized
        if (root.getRoot() != null && path.getRoot() != null && !root.getRoot().equals(path.getRoot())) {
            return path.toString().replace('\\', '/');
        }
        return root.relativize(path).toString().replace('\\', '/');
    }

    @Override
    public boolean isFile() {
        return true;
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public String getRelativePath() {
        return relativePath;
    }

    @Override
    public String getText() {
        if (text == null) {
            try {
                text = Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("failed to read text from: " + path, e);
            }
        }
        return text;
    }

    @Override
    public String getLine(int index) {
        if (lines == null) {
            lines = StringUtils.lines(getText());
        }
        if (index < 0 || index >= lines.length) {
            return "";
        }
        return lines[index];
    }

    @Override
    public String toString() {
        return relativePath;
    }

}
