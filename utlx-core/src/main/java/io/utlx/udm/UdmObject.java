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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Ordered properties plus the details that some formats carry alongside them:
 * an element name, attributes and free-form metadata (source format, namespaces
 * and the like). Property order is insertion order and is preserved by every
 * operation. Instances are immutable, {@link #with(String, Udm)} and friends
 * return new objects.
 */
public final class UdmObject implements Udm {

    public static final UdmObject EMPTY = new UdmObject(null, Collections.emptyMap(), Collections.emptyMap(),
            Collections.emptyMap());

    private final String name;
    private final Map<String, String> attributes;
    private final Map<String, Udm> properties;
    private final Map<String, String> metadata;

    private UdmObject(String name, Map<String, String> attributes, Map<String, Udm> properties,
                      Map<String, String> metadata) {
        this.name = name;
        this.attributes = attributes;
        this.properties = properties;
        this.metadata = metadata;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static UdmObject of(Map<String, ? extends Udm> properties) {
        Builder builder = builder();
        properties.forEach(builder::put);
        return builder.build();
    }

    /**
     * @return element name, may be null
     */
    public String getName() {
        return name;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }

    public Map<String, Udm> getProperties() {
        return properties;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public Set<String> keys() {
        return properties.keySet();
    }

    public int size() {
        return properties.size();
    }

    public boolean has(String key) {
        return properties.containsKey(key);
    }

    /**
     * @return the property value, or null if absent
     */
    public Udm get(String key) {
        return properties.get(key);
    }

    /**
     * Sets a property. An existing key keeps its position.
     */
    public UdmObject with(String key, Udm value) {
        return toBuilder().put(key, value).build();
    }

    public UdmObject without(String key) {
        if (!properties.containsKey(key)) {
            return this;
        }
        Builder builder = toBuilder();
        builder.properties.remove(key);
        return builder.build();
    }

    public UdmObject withName(String name) {
        return toBuilder().name(name).build();
    }

    public UdmObject withMetadata(String key, String value) {
        return toBuilder().metadata(key, value).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.name = name;
        builder.attributes.putAll(attributes);
        builder.properties.putAll(properties);
        builder.metadata.putAll(metadata);
        return builder;
    }

    @Override
    public UdmType getType() {
        return UdmType.OBJECT;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UdmObject && properties.equals(((UdmObject) o).properties);
    }

    @Override
    public int hashCode() {
        return properties.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (name != null) {
            sb.append(name);
        }
        if (!attributes.isEmpty()) {
            sb.append(attributes);
        }
        sb.append('{');
        boolean first = true;
        for (Map.Entry<String, Udm> entry : properties.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(entry.getKey()).append(": ").append(entry.getValue());
        }
        sb.append('}');
        return sb.toString();
    }

    public static class Builder {

        private String name;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final Map<String, Udm> properties = new LinkedHashMap<>();
        private final Map<String, String> metadata = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder attribute(String key, String value) {
            attributes.put(key, value);
            return this;
        }

        public Builder put(String key, Udm value) {
            if (key == null || value == null) {
                throw new IllegalArgumentException("key and value must not be null, use UdmNull");
            }
            properties.put(key, value);
            return this;
        }

        public Builder putAll(UdmObject other) {
            properties.putAll(other.properties);
            return this;
        }

        public Builder metadata(String key, String value) {
            metadata.put(key, value);
            return this;
        }

        public boolean has(String key) {
            return properties.containsKey(key);
        }

        public UdmObject build() {
            if (name == null && attributes.isEmpty() && properties.isEmpty() && metadata.isEmpty()) {
                return EMPTY;
            }
            return new UdmObject(name, freeze(attributes), freeze(properties), freeze(metadata));
        }

        private static <V> Map<String, V> freeze(Map<String, V> map) {
            return map.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
        }

    }

}
