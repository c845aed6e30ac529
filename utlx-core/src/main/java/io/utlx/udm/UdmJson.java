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

import net.minidev.json.JSONValue;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversion between UDM and plain Java values (maps, lists, strings, numbers,
 * booleans) or JSON text. This is a convenience for tests, debugging and callers
 * that already hold Java collections, it is not a format codec: attributes are
 * written as {@code @name} keys and binary values as base64 strings.
 */
public class UdmJson {

    private UdmJson() {
        // only static methods
    }

    @SuppressWarnings("unchecked")
    public static Udm fromJava(Object o) {
        if (o == null) {
            return UdmNull.INSTANCE;
        }
        if (o instanceof Udm) {
            return (Udm) o;
        }
        if (o instanceof String) {
            return UdmScalar.of((String) o);
        }
        if (o instanceof Number) {
            return UdmScalar.of((Number) o);
        }
        if (o instanceof Boolean) {
            return UdmScalar.of((Boolean) o);
        }
        if (o instanceof Map) {
            UdmObject.Builder builder = UdmObject.builder();
            ((Map<Object, Object>) o).forEach((k, v) -> builder.put(String.valueOf(k), fromJava(v)));
            return builder.build();
        }
        if (o instanceof List) {
            List<Object> list = (List<Object>) o;
            List<Udm> elements = new ArrayList<>(list.size());
            for (Object item : list) {
                elements.add(fromJava(item));
            }
            return UdmArray.of(elements);
        }
        if (o instanceof Instant) {
            return new UdmDateTime((Instant) o);
        }
        if (o instanceof LocalDate) {
            return new UdmDate((LocalDate) o);
        }
        if (o instanceof LocalTime) {
            return new UdmTime((LocalTime) o);
        }
        if (o instanceof byte[]) {
            return new UdmBinary((byte[]) o, null);
        }
        throw new IllegalArgumentException("cannot convert to udm: " + o.getClass().getName());
    }

    public static Object toJava(Udm udm) {
        switch (udm.getType()) {
            case NULL:
                return null;
            case STRING:
            case NUMBER:
            case BOOLEAN:
                return ((UdmScalar) udm).getValue();
            case DATETIME:
            case DATE:
            case TIME:
                return udm.asString();
            case BINARY:
                return Base64.getEncoder().encodeToString(((UdmBinary) udm).getBytes());
            case ARRAY: {
                UdmArray array = (UdmArray) udm;
                List<Object> list = new ArrayList<>(array.size());
                for (Udm element : array) {
                    list.add(toJava(element));
                }
                return list;
            }
            case OBJECT: {
                UdmObject object = (UdmObject) udm;
                Map<String, Object> map = new LinkedHashMap<>();
                object.getAttributes().forEach((k, v) -> map.put("@" + k, v));
                object.getProperties().forEach((k, v) -> map.put(k, toJava(v)));
                return map;
            }
            case LAMBDA:
                return udm.toString();
            default:
                throw new IllegalStateException("cannot convert errored value: " + udm);
        }
    }

    public static String toJson(Udm udm) {
        return JSONValue.toJSONString(toJava(udm));
    }

    /**
     * Lenient parse that keeps object key order.
     */
    public static Udm fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new UdmException("invalid json: input is null or blank");
        }
        Object result = JSONValue.parseKeepingOrder(json);
        if (result == null && !"null".equals(json.trim())) {
            throw new UdmException("invalid json: " + json);
        }
        return fromJava(result);
    }

}
