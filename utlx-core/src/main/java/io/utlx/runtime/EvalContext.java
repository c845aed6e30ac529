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

import io.utlx.common.Config;
import io.utlx.parser.Diagnostic;
import io.utlx.parser.DiagnosticCode;
import io.utlx.parser.Location;
import io.utlx.parser.ScriptSection;
import io.utlx.parser.Severity;
import io.utlx.udm.Udm;
import io.utlx.udm.UdmErrored;
import io.utlx.udm.UdmLambda;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-run state: collected diagnostics, error count, step and depth counters.
 * Created fresh for every run and never shared between threads.
 */
final class EvalContext {

    final Config config;
    final Stdlib stdlib;
    final CancellationToken cancellation;
    final boolean strict;

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int errorCount;
    private long steps;
    private int depth;

    EvalContext(Config config, Stdlib stdlib, CancellationToken cancellation, boolean strict) {
        this.config = config;
        this.stdlib = stdlib;
        this.cancellation = cancellation;
        this.strict = strict;
    }

    List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    UdmErrored fault(DiagnosticCode code, Location location, String message) {
        return fault(code, location, message, null);
    }

    /**
     * Reports an error and returns the value that stands in for the failed computation.
     *
     * @throws EngineException in strict mode, or when the error limit is exceeded
     */
    UdmErrored fault(DiagnosticCode code, Location location, String message, String hint) {
        Diagnostic diagnostic = new Diagnostic(message, location.line(), location.column(),
                ScriptSection.CONTENT, code, Severity.ERROR, hint);
        if (errorCount == config.getMaxErrors()) {
            abort(DiagnosticCode.TOO_MANY_ERRORS, location, "too many errors, stopped after " + errorCount);
        }
        errorCount++;
        diagnostics.add(diagnostic);
        if (strict) {
            throw new EngineException(diagnostic);
        }
        return new UdmErrored(diagnostic);
    }

    /**
     * Taint for source that did not parse. The parser already reported it, so
     * only a strict run, which returns nothing but its own diagnostics, reports it again.
     */
    UdmErrored unparsed(Location location) {
        if (strict) {
            return fault(DiagnosticCode.PARSE_ERROR, location, "cannot execute source that did not parse",
                    "fix the parse errors or use validate");
        }
        return new UdmErrored(Diagnostic.error(DiagnosticCode.PARSE_ERROR, ScriptSection.CONTENT, location,
                "expression did not parse"));
    }

    void abort(DiagnosticCode code, Location location, String message) {
        Diagnostic diagnostic = Diagnostic.error(code, ScriptSection.CONTENT, location, message);
        diagnostics.add(diagnostic);
        throw new EngineException(diagnostic);
    }

    void step(Location location) {
        if (cancellation.isCancelled()) {
            abort(DiagnosticCode.CANCELLED, location, "evaluation cancelled");
        }
        steps++;
        long maxSteps = config.getMaxSteps();
        if (maxSteps > 0 && steps > maxSteps) {
            abort(DiagnosticCode.RESOURCE_EXHAUSTED, location, "evaluation exceeded " + maxSteps + " steps");
        }
    }

    void enter(Location location) {
        if (depth == config.getMaxDepth()) {
            abort(DiagnosticCode.RESOURCE_EXHAUSTED, location, "call depth exceeded " + config.getMaxDepth());
        }
        depth++;
    }

    void exit() {
        depth--;
    }

    long getSteps() {
        return steps;
    }

    CallContext callContext(Location location) {
        return new CallContext() {
            @Override
            public Udm apply(UdmLambda function, List<Udm> args) {
                return Interpreter.apply(function, args, location, EvalContext.this);
            }

            @Override
            public void checkpoint() {
                step(location);
            }

            @Override
            public Config getConfig() {
                return config;
            }
        };
    }

}
