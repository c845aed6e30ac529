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

import java.util.ArrayList;
import java.util.List;

/**
 * Name, parameters and return type of a library function. Trailing parameters
 * may be optional, and with {@code varargs} the last parameter repeats.
 */
public record FunctionSignature(String name, List<Param> params, boolean varargs, ParamType returns) {

    public record Param(String name, ParamType type, boolean optional) {

        @Override
        public String toString() {
            return name + (optional ? "?" : "") + ": " + type;
        }

    }

    public FunctionSignature {
        params = List.copyOf(params);
        if (varargs && params.isEmpty()) {
            throw new IllegalArgumentException("varargs function needs at least one parameter: " + name);
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public int minArity() {
        int count = 0;
        for (Param param : params) {
            if (!param.optional()) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return -1 for varargs
     */
    public int maxArity() {
        return varargs ? -1 : params.size();
    }

    /**
     * @return a description of the first mismatch, or null if the arguments fit
     */
    public String check(List<Udm> args) {
        int min = minArity();
        int max = maxArity();
        if (args.size() < min || (max != -1 && args.size() > max)) {
            String expected;
            if (max == -1) {
                expected = "at least " + min;
            } else if (min == max) {
                expected = String.valueOf(min);
            } else {
                expected = min + " to " + max;
            }
            return name + "() expects " + expected + " argument(s) but got " + args.size();
        }
        for (int i = 0; i < args.size(); i++) {
            Param param = params.get(Math.min(i, params.size() - 1));
            Udm arg = args.get(i);
            if (!param.type().accepts(arg)) {
                return name + "() argument " + (i + 1) + " '" + param.name() + "' expects "
                        + param.type() + " but got " + arg.getType().displayName();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            if (varargs && i == params.size() - 1) {
                sb.append("...");
            }
            sb.append(params.get(i));
        }
        return sb.append("): ").append(returns).toString();
    }

    public static class Builder {

        private final String name;
        private final List<Param> params = new ArrayList<>();
        private boolean varargs;
        private ParamType returns = ParamType.ANY;

        private Builder(String name) {
            this.name = name;
        }

        public Builder param(String name, ParamType type) {
            params.add(new Param(name, type, false));
            return this;
        }

        public Builder optional(String name, ParamType type) {
            params.add(new Param(name, type, true));
            return this;
        }

        public Builder varargs(String name, ParamType type) {
            params.add(new Param(name, type, false));
            varargs = true;
            return this;
        }

        public Builder returns(ParamType returns) {
            this.returns = returns;
            return this;
        }

        public FunctionSignature build() {
            return new FunctionSignature(name, params, varargs, returns);
        }

    }

}
