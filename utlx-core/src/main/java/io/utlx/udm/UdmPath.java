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
import java.util.List;

/**
 * A navigation path such as {@code Order.Items[0].@id}.
 */
public record UdmPath(List<Segment> segments) {

    /**
     * @param attribute true for {@code @name} segments, which read an object attribute
     */
    public record Segment(String name, boolean attribute) {

        @Override
        public String toString() {
            return attribute ? "@" + name : name;
        }

    }

    public UdmPath {
        segments = List.copyOf(segments);
    }

    public static UdmPath of(String... names) {
        List<Segment> list = new ArrayList<>(names.length);
        for (String name : names) {
            list.add(segment(name));
        }
        return new UdmPath(list);
    }

    public static UdmPath parse(String path) {
        List<Segment> list = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < path.length()) {
            char c = path.charAt(i);
            if (c == '.') {
                flush(sb, list);
            } else if (c == '[') {
                flush(sb, list);
                int close = path.indexOf(']', i);
                if (close == -1) {
                    throw new IllegalArgumentException("unbalanced '[' in path: " + path);
                }
                list.add(new Segment(path.substring(i + 1, close).trim(), false));
                i = close;
            } else {
                sb.append(c);
            }
            i++;
        }
        flush(sb, list);
        return new UdmPath(list);
    }

    private static void flush(StringBuilder sb, List<Segment> list) {
        if (sb.length() > 0) {
            list.add(segment(sb.toString()));
            sb.setLength(0);
        }
    }

    private static Segment segment(String name) {
        if (name.startsWith("@")) {
            return new Segment(name.substring(1), true);
        }
        return new Segment(name, false);
    }

    /**
     * @return the value at this path, or null if some segment does not exist
     */
    public Udm navigate(Udm root) {
        Udm current = root;
        for (Segment segment : segments) {
            current = step(current, segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private static Udm step(Udm current, Segment segment) {
        if (current instanceof UdmObject) {
            UdmObject object = (UdmObject) current;
            if (segment.attribute()) {
                String value = object.getAttribute(segment.name());
                return value == null ? null : UdmScalar.of(value);
            }
            return object.get(segment.name());
        }
        if (current instanceof UdmArray && !segment.attribute()) {
            try {
                return ((UdmArray) current).get(Integer.parseInt(segment.name()));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(segment);
        }
        return sb.toString();
    }

}
