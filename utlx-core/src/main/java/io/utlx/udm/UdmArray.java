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
package io.utlx.udm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

public final class UdmArray implements Udm, Iterable<Udm> {

    public static final UdmArray EMPTY = new UdmArray(Collections.emptyList());

    private final List<Udm> elements;

    private UdmArray(List<Udm> elements) {
        this.elements = elements;
    }

    public static UdmArray of(Udm... elements) {
        return of(Arrays.asList(elements));
    }

    public static UdmArray of(List<? extends Udm> elements) {
        if (elements.isEmpty()) {
            return EMPTY;
        }
        List<Udm> copy = new ArrayList<>(elements.size());
        for (Udm element : elements) {
            if (element == null) {
                throw new IllegalArgumentException("array elements must not be null, use UdmNull");
            }
            copy.add(element);
        }
        return new UdmArray(Collections.unmodifiableList(copy));
    }

    public List<Udm> elements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * @return the element, or null if the index is out of range
     */
    public Udm get(int index) {
        return index < 0 || index >= elements.size() ? null : elements.get(index);
    }

    /**
     * @return a new array, this one is unchanged
     */
    public UdmArray append(Udm element) {
        List<Udm> copy = new ArrayList<>(elements.size() + 1);
        copy.addAll(elements);
        copy.add(element);
        return of(copy);
    }

    @Override
    public Iterator<Udm> iterator() {
        return elements.iterator();
    }

    @Override
    public UdmType getType() {
        return UdmType.ARRAY;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UdmArray && elements.equals(((UdmArray) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.toString();
    }

}
