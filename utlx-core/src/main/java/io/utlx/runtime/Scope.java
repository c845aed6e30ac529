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

/**
 * Immutable chain of bindings. Binding returns a new scope that shadows the
 * outer one, which is what closures capture.
 */
public final class Scope {

    public static final String INPUT = "input";
    public static final String DOLLAR_INPUT = "$input";

    private static final Scope EMPTY = new Scope(null, null, null);

    private final String name;
    private final Udm value;
    private final Scope parent;

    private Scope(String name, Udm value, Scope parent) {
        this.name = name;
        this.value = value;
        this.parent = parent;
    }

    public static Scope empty() {
        return EMPTY;
    }

    /**
     * Binds the document under both {@code $input} and {@code input}.
     */
    public static Scope root(Udm input) {
        return EMPTY.bind(DOLLAR_INPUT, input).bind(INPUT, input);
    }

    public Scope bind(String name, Udm value) {
        if (name == null || value == null) {
            throw new IllegalArgumentException("name and value are required");
        }
        return new Scope(name, value, this);
    }

    /**
     * @return the innermost binding, or null if the name is not bound
     */
    public Udm lookup(String name) {
        for (Scope scope = this; scope != EMPTY; scope = scope.parent) {
            if (scope.name.equals(name)) {
                return scope.value;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (Scope scope = this; scope != EMPTY; scope = scope.parent) {
            if (scope != this) {
                sb.append(", ");
            }
            sb.append(scope.name);
        }
        return sb.append(']').toString();
    }

}
