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
import io.utlx.common.Resource;
import io.utlx.parser.Diagnostic;
import io.utlx.parser.DiagnosticCode;
import io.utlx.parser.Expr;
import io.utlx.parser.Location;
import io.utlx.parser.ParseResult;
import io.utlx.parser.Program;
import io.utlx.parser.ScriptSection;
import io.utlx.parser.UtlxParser;
import io.utlx.udm.Udm;
import io.utlx.udm.UdmErrored;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for compiling and running transformations. An engine holds only
 * immutable state, a single instance can run any number of programs concurrently.
 */
public class Engine {

    static final Logger logger = LoggerFactory.getLogger(Engine.class);

    private final Config config;
    private final Stdlib stdlib;

    public Engine(Config config) {
        this(config, FunctionRegistry.EMPTY);
    }

    public Engine(Config config, Stdlib stdlib) {
        if (config == null || stdlib == null) {
            throw new IllegalArgumentException("config and stdlib are required");
        }
        this.config = config;
        this.stdlib = stdlib;
    }

    public Config getConfig() {
        return config;
    }

    public ParseResult compile(String text) {
        return compile(Resource.text(text));
    }

    public ParseResult compile(Resource resource) {
        long start = System.currentTimeMillis();
        ParseResult result = new UtlxParser(resource, config).parse();
        if (logger.isDebugEnabled()) {
            logger.debug("compiled {} in {} ms: {}, {} diagnostic(s)", resource.getRelativePath(),
                    System.currentTimeMillis() - start, result.kind(), result.diagnostics().size());
        }
        return result;
    }

    /**
     * Runs a program against an input document. Stops at the first fault. An
     * unparsed part of a partially parsed program is a PARSE_ERROR fault.
     */
    public EvalResult execute(Program program, Udm input) {
        return execute(program, input, CancellationToken.NONE);
    }

    public EvalResult execute(Program program, Udm input, CancellationToken cancellation) {
        return evaluate(program.content(), Scope.root(input), true, cancellation);
    }

    /**
     * Compiles and runs in one go. Parse errors are returned without evaluating.
     */
    public EvalResult execute(String text, Udm input) {
        ParseResult parsed = compile(text);
        if (!parsed.isSuccess()) {
            return EvalResult.fail(parsed.diagnostics());
        }
        EvalResult result = execute(parsed.program(), input);
        if (parsed.diagnostics().isEmpty()) {
            return result;
        }
        // keep parser warnings in front of the run's own diagnostics
        List<Diagnostic> diagnostics = new ArrayList<>(parsed.diagnostics());
        diagnostics.addAll(result.diagnostics());
        return new EvalResult(result.value(), diagnostics);
    }

    /**
     * Runs a program and collects as many independent faults as the error limit
     * allows. Accepts partially parsed programs, parts that did not parse are
     * skipped without further errors. With fail-fast set this runs like
     * {@link #execute(Program, Udm)}.
     */
    public EvalResult validate(Program program, Udm input) {
        return validate(program, input, CancellationToken.NONE);
    }

    public EvalResult validate(Program program, Udm input, CancellationToken cancellation) {
        return evaluate(program.content(), Scope.root(input), config.isFailFast(), cancellation);
    }

    /**
     * Evaluates an expression in a given scope, for embedding and tooling.
     *
     * @param strict stop at the first fault instead of collecting
     */
    public EvalResult evaluate(Expr expr, Scope scope, boolean strict, CancellationToken cancellation) {
        EvalContext context = new EvalContext(config, stdlib, cancellation, strict);
        long start = System.currentTimeMillis();
        Udm value;
        try {
            value = Interpreter.eval(expr, scope, context);
        } catch (EngineException e) {
            logger.debug("evaluation stopped: {}", e.getDiagnostic());
            return EvalResult.fail(context.getDiagnostics());
        } catch (StackOverflowError e) {
            Location location = expr.location();
            List<Diagnostic> diagnostics = new ArrayList<>(context.getDiagnostics());
            diagnostics.add(Diagnostic.error(DiagnosticCode.RESOURCE_EXHAUSTED, ScriptSection.CONTENT, location,
                    "evaluation too deeply nested"));
            logger.warn("stack overflow during evaluation, lower maxDepth in config: {}", config);
            return EvalResult.fail(diagnostics);
        }
        if (logger.isDebugEnabled()) {
            logger.debug("evaluated in {} ms, {} steps, {} diagnostic(s)", System.currentTimeMillis() - start,
                    context.getSteps(), context.getDiagnostics().size());
        }
        if (value instanceof UdmErrored || hasErrors(context.getDiagnostics())) {
            return EvalResult.fail(context.getDiagnostics());
        }
        return EvalResult.pass(value, context.getDiagnostics());
    }

    private static boolean hasErrors(List<Diagnostic> diagnostics) {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.isError()) {
                return true;
            }
        }
        return false;
    }

}
