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
package io.utlx.parser;

/**
 * A lexer, parser or evaluator finding. Parse and evaluation errors share this
 * shape so that tooling can merge and sort them without knowing where they came from.
 *
 * @param line 1-based, 0 when unknown
 * @param column 1-based, 0 when unknown
 * @param hint optional extra text such as the expected signature of a function
 */
public record Diagnostic(String message, int line, int column, ScriptSection section,
                         DiagnosticCode code, Severity severity, String hint) {

    public static Diagnostic error(DiagnosticCode code, ScriptSection section, Location location, String message) {
        return new Diagnostic(message, location.line(), location.column(), section, code, Severity.ERROR, null);
    }

    public static Diagnostic warning(DiagnosticCode code, ScriptSection section, Location location, String message) {
        return new Diagnostic(message, location.line(), location.column(), section, code, Severity.WARNING, null);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public Location getLocation() {
        return new Location(line, column);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(section).append(' ').append(line).append(':').append(column).append("] ");
        sb.append(severity).append(": ").append(message);
        if (hint != null) {
            sb.append(" (").append(hint).append(')');
        }
        return sb.toString();
    }

}
