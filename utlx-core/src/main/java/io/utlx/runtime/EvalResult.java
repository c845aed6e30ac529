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

import io.utlx.parser.Diagnostic;
import io.utlx.udm.Udm;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of a run. On success {@code value} is the output document, otherwise it
 * is null and {@code diagnostics} holds the errors this run found. A partially
 * parsed program may fail without new errors, its parse errors were already reported.
 */
public record EvalResult(Udm value, List<Diagnostic> diagnostics) {

    public EvalResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public static EvalResult pass(Udm value, List<Diagnostic> diagnostics) {
        return new EvalResult(value, diagnostics);
    }

    public static EvalResult fail(List<Diagnostic> diagnostics) {
        return new EvalResult(null, diagnostics);
    }

    public boolean isSuccess() {
        return value != null;
    }

    /**
     * True if the run stopped early on a terminal condition.
     */
    public boolean isAborted() {
        return !diagnostics.isEmpty() && diagnostics.get(diagnostics.size() - 1).code().terminal;
    }

    public List<Diagnostic> getErrors() {
        List<Diagnostic> errors = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.isError()) {
                errors.add(diagnostic);
            }
        }
        return errors;
    }

    @Override
    public String toString() {
        return isSuccess() ? "success: " + value : "failure: " + diagnostics;
    }

}
