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

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of parsing a script.
 * <ul>
 * <li>{@link Success}: no errors, warnings may be present</li>
 * <li>{@link Partial}: a best-effort tree containing {@link Expr.Errored} nodes, plus the errors</li>
 * <li>{@link Aborted}: parsing stopped early, there is no tree</li>
 * </ul>
 */
public sealed interface ParseResult {

    enum Kind {
        SUCCESS, PARTIAL, ABORTED
    }

    Kind kind();

    /**
     * All diagnostics in discovery order, warnings included.
     */
    List<Diagnostic> diagnostics();

    /**
     * @return the tree, or null if parsing was aborted
     */
    Program program();

    default boolean isSuccess() {
        return kind() == Kind.SUCCESS;
    }

    default List<Diagnostic> getErrors() {
        List<Diagnostic> errors = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics()) {
            if (diagnostic.isError()) {
                errors.add(diagnostic);
            }
        }
        return errors;
    }

    record Success(Program program, List<Diagnostic> diagnostics) implements ParseResult {
        public Success {
            diagnostics = List.copyOf(diagnostics);
        }

        @Override
        public Kind kind() {
            return Kind.SUCCESS;
        }
    }

    record Partial(Program program, List<Diagnostic> diagnostics) implements ParseResult {
        public Partial {
            diagnostics = List.copyOf(diagnostics);
        }

        @Override
        public Kind kind() {
            return Kind.PARTIAL;
        }
    }

    record Aborted(List<Diagnostic> diagnostics) implements ParseResult {
        public Aborted {
            diagnostics = List.copyOf(diagnostics);
        }

        @Override
        public Kind kind() {
            return Kind.ABORTED;
        }

        @Override
        public Program program() {
            return null;
        }
    }

}
