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

import io.utlx.udm.Udm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Map backed {@link Stdlib}. Built once and immutable afterwards, so a single
 * registry can serve any number of concurrent evaluations.
 */
public final class FunctionRegistry implements Stdlib {

    static final Logger logger = LoggerFactory.getLogger(FunctionRegistry.class);

    public static final FunctionRegistry EMPTY = new FunctionRegistry(Collections.emptyMap());

    private record Entry(FunctionSignature signature, StdlibFunction function) {
    }

    private final Map<String, Entry> functions;

    private FunctionRegistry(Map<String, Entry> functions) {
        this.functions = functions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> names() {
        return functions.keySet();
    }

    @Override
    public FunctionSignature resolve(String name) {
        Entry entry = functions.get(name);
        return entry == null ? null : entry.signature;
    }

    @Override
    public Udm invoke(String name, List<Udm> args, CallContext context) {
        Entry entry = functions.get(name);
        if (entry == null) {
            throw new StdlibException("no such function: " + name);
        }
        return entry.function.invoke(args, context);
    }

    public static class Builder {

        private final Map<String, Entry> functions = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(FunctionSignature signature, StdlibFunction function) {
            if (functions.containsKey(signature.name())) {
                throw new IllegalArgumentException("function already registered: " + signature.name());
            }
            functions.put(signature.name(), new Entry(signature, function));
            return this;
        }

        public FunctionRegistry build() {
            logger.debug("function registry built with {} functions", functions.size());
            return new FunctionRegistry(Collections.unmodifiableMap(new LinkedHashMap<>(functions)));
        }

    }

}
