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

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UdmTest {

    @Test
    void testEqualityIsTypeSensitive() {
        assertEquals(UdmScalar.of(1), UdmScalar.of(1.0));
        assertEquals(UdmScalar.of(1).hashCode(), UdmScalar.of(1.0).hashCode());
        assertEquals(UdmScalar.of(1), UdmScalar.of(1L));
        assertNotEquals(UdmScalar.of(1), UdmScalar.of("1"));
        assertNotEquals(UdmScalar.of(true), UdmScalar.of("true"));
        assertNotEquals(UdmNull.INSTANCE, UdmScalar.of(""));
        assertEquals(UdmArray.of(UdmScalar.of(1), UdmNull.INSTANCE), UdmArray.of(UdmScalar.of(1.0), UdmNull.INSTANCE));
    }

    @Test
    void testObjectEqualityIgnoresNameAttributesAndMetadata() {
        UdmObject a = UdmObject.builder().name("Order").attribute("id", "1").put("x", UdmScalar.of(1)).build();
        UdmObject b = UdmObject.builder().metadata("format", "json").put("x", UdmScalar.of(1)).build();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals("Order", a.getName());
        assertEquals("json", b.getMetadata().get("format"));
        UdmObject renamed = a.withName("Invoice").withMetadata("format", "xml");
        assertEquals("Invoice", renamed.getName());
        assertEquals("xml", renamed.getMetadata().get("format"));
        assertEquals("Order", a.getName());
        assertTrue(a.getMetadata().isEmpty());
    }

    @Test
    void testObjectIsImmutableAndOrdered() {
        UdmObject original = UdmObject.builder()
                .put("b", UdmScalar.of(1))
                .put("a", UdmScalar.of(2))
                .build();
        UdmObject changed = original.with("b", UdmScalar.of(3)).with("c", UdmScalar.of(4));
        assertEquals(List.of("b", "a"), List.copyOf(original.keys()));
        assertEquals(UdmScalar.of(1), original.get("b"));
        // an existing key keeps its position
        assertEquals(List.of("b", "a", "c"), List.copyOf(changed.keys()));
        assertEquals(UdmScalar.of(3), changed.get("b"));
        assertEquals(List.of("a", "c"), List.copyOf(changed.without("b").keys()));
        assertSame(changed, changed.without("missing"));
        assertThrows(UnsupportedOperationException.class, () -> original.getProperties().put("z", UdmNull.INSTANCE));
    }

    @Test
    void testUntouchedSubtreesAreShared() {
        UdmObject child = UdmObject.of(Map.of("x", UdmScalar.of(1)));
        UdmObject parent = UdmObject.builder().put("child", child).put("n", UdmScalar.of(1)).build();
        UdmObject changed = parent.with("n", UdmScalar.of(2));
        assertSame(child, changed.get("child"));
    }

    @Test
    void testAbsentVersusPresentNull() {
        Udm doc = UdmJson.fromJson("{a: null, b: {c: [10, 20]}}");
        assertSame(UdmNull.INSTANCE, doc.get("a"));
        assertNull(doc.get("missing"));
        assertNull(doc.get("a", "b"));
        assertEquals(UdmScalar.of(20), doc.get("b", "c", "1"));
        assertNull(doc.get("b", "c", "5"));
    }

    @Test
    void testPathParse() {
        UdmObject item = UdmObject.builder().attribute("id", "A1").put("qty", UdmScalar.of(2)).build();
        Udm order = UdmObject.builder().put("Order", UdmObject.builder()
                .put("Items", UdmArray.of(item)).build()).build();
        UdmPath path = UdmPath.parse("Order.Items[0].@id");
        assertEquals(4, path.segments().size());
        assertTrue(path.segments().get(3).attribute());
        assertEquals(UdmScalar.of("A1"), order.get(path));
        assertEquals(UdmScalar.of(2), order.get(UdmPath.parse("Order.Items[0].qty")));
        assertNull(order.get(UdmPath.parse("Order.Items[0].@missing")));
        assertEquals("Order.Items.0.@id", path.toString());
    }

    @Test
    void testStringCoercion() {
        assertEquals("2", UdmScalar.of(2.0).asString());
        assertEquals("2.5", UdmScalar.of(2.5).asString());
        assertEquals("true", UdmScalar.of(true).asString());
        assertEquals("2024-01-02", new UdmDate(LocalDate.of(2024, 1, 2)).asString());
        assertEquals("2024-01-02T03:04:05Z", new UdmDateTime(Instant.parse("2024-01-02T03:04:05Z")).asString());
        assertThrows(UdmException.class, () -> UdmNull.INSTANCE.asString());
        assertThrows(UdmException.class, () -> UdmArray.EMPTY.asString());
        assertThrows(UdmException.class, () -> UdmObject.EMPTY.asString());
    }

    @Test
    void testNumberCoercion() {
        assertEquals(42, UdmScalar.of("42").asNumber());
        assertEquals(4.5, UdmScalar.of(" 4.5 ").asNumber());
        UdmException e = assertThrows(UdmException.class, () -> UdmScalar.of("abc").asNumber());
        assertEquals("cannot coerce string 'abc' to number", e.getMessage());
        assertThrows(UdmException.class, () -> UdmScalar.of(true).asNumber());
        assertThrows(UdmException.class, () -> UdmNull.INSTANCE.asNumber());
    }

    @Test
    void testBooleanCoercion() {
        assertFalse(UdmNull.INSTANCE.asBoolean());
        assertTrue(UdmScalar.of("TRUE").asBoolean());
        assertFalse(UdmScalar.of("false").asBoolean());
        assertThrows(UdmException.class, () -> UdmScalar.of("yes").asBoolean());
        assertThrows(UdmException.class, () -> UdmScalar.of(1).asBoolean());
        assertThrows(UdmException.class, () -> UdmArray.EMPTY.asBoolean());
    }

    @Test
    void testBinary() {
        byte[] bytes = {1, 2, 3};
        UdmBinary binary = new UdmBinary(bytes, "base64");
        bytes[0] = 9;
        assertEquals(1, binary.getBytes()[0]);
        assertEquals(new UdmBinary(new byte[]{1, 2, 3}, null), binary);
        assertEquals("base64", binary.getEncoding());
        assertEquals("AQID", UdmJson.toJava(binary));
    }

    @Test
    void testArray() {
        UdmArray array = UdmArray.of(UdmScalar.of(1));
        UdmArray appended = array.append(UdmScalar.of(2));
        assertEquals(1, array.size());
        assertEquals(2, appended.size());
        assertNull(appended.get(2));
        assertNull(appended.get(-1));
        assertThrows(IllegalArgumentException.class, () -> UdmArray.of(UdmScalar.of(1), null));
    }

    @Test
    void testJson() {
        Udm doc = UdmJson.fromJson("{\"z\": 1, \"a\": [true, null, \"x\"], \"m\": {\"k\": 1.5}}");
        assertEquals(UdmType.OBJECT, doc.getType());
        assertEquals(List.of("z", "a", "m"), List.copyOf(((UdmObject) doc).keys()));
        assertEquals("{\"z\":1,\"a\":[true,null,\"x\"],\"m\":{\"k\":1.5}}", UdmJson.toJson(doc));
        UdmObject withAttribute = UdmObject.builder().attribute("id", "7").put("v", UdmScalar.of("x")).build();
        assertEquals("{\"@id\":\"7\",\"v\":\"x\"}", UdmJson.toJson(withAttribute));
        assertThrows(UdmException.class, () -> UdmJson.fromJson(" "));
    }

}
