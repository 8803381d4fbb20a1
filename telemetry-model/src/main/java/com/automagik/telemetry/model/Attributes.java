package com.automagik.telemetry.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/** Immutable, insertion-ordered attribute map. */
public final class Attributes {

    /** String values longer than this are cut by {@link #truncated()}. */
    public static final int MAX_STRING_LENGTH = 500;

    private static final Attributes EMPTY = new Attributes(new LinkedHashMap<>());

    private final Map<String, AttributeValue> values;

    private Attributes(LinkedHashMap<String, AttributeValue> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Attributes empty() {
        return EMPTY;
    }

    public static Attributes of(Map<String, AttributeValue> values) {
        if (values == null || values.isEmpty()) return EMPTY;
        Builder b = builder();
        values.forEach(b::put);
        return b.build();
    }

    /**
     * Converts an untyped map. Entries with a null key or a value that has no scalar form are skipped and
     * reported to {@code onRejected}. Strings are kept whole; see {@link #truncated()}.
     */
    public static Attributes fromRaw(Map<String, ?> raw, BiConsumer<String, RuntimeException> onRejected) {
        if (raw == null || raw.isEmpty()) return EMPTY;
        Builder b = builder();
        for (Map.Entry<String, ?> e : raw.entrySet()) {
            String key = e.getKey();
            if (key == null) {
                onRejected.accept(null, new UnsupportedAttributeException("null attribute key"));
                continue;
            }
            try {
                b.put(key, AttributeValue.from(e.getValue()));
            } catch (UnsupportedAttributeException ex) {
                onRejected.accept(key, ex);
            }
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Copy with string values cut to {@link #MAX_STRING_LENGTH}; returns {@code this} when nothing is cut. */
    public Attributes truncated() {
        boolean any = false;
        for (AttributeValue v : values.values()) {
            if (v instanceof AttributeValue.StringValue s && s.value().length() > MAX_STRING_LENGTH) {
                any = true;
                break;
            }
        }
        if (!any) return this;
        Builder b = builder();
        values.forEach((k, v) -> {
            if (v instanceof AttributeValue.StringValue s && s.value().length() > MAX_STRING_LENGTH) {
                b.put(k, s.value().substring(0, MAX_STRING_LENGTH));
            } else {
                b.put(k, v);
            }
        });
        return b.build();
    }

    public AttributeValue get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, AttributeValue> asMap() {
        return values;
    }

    /** Flattens every value to its string form. */
    public Map<String, String> asStringMap() {
        Map<String, String> out = new LinkedHashMap<>(values.size());
        values.forEach((k, v) -> out.put(k, v.asString()));
        return out;
    }

    public void forEach(BiConsumer<String, AttributeValue> action) {
        values.forEach(action);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Attributes other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static final class Builder {
        private final LinkedHashMap<String, AttributeValue> values = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String key, AttributeValue value) {
            values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder put(String key, String value) {
            return put(key, AttributeValue.of(value));
        }

        public Builder put(String key, long value) {
            return put(key, AttributeValue.of(value));
        }

        public Builder put(String key, double value) {
            return put(key, AttributeValue.of(value));
        }

        public Builder put(String key, boolean value) {
            return put(key, AttributeValue.of(value));
        }

        public Builder putAll(Attributes other) {
            if (other != null) other.forEach(this::put);
            return this;
        }

        public Builder remove(String key) {
            values.remove(key);
            return this;
        }

        public Attributes build() {
            return values.isEmpty() ? EMPTY : new Attributes(new LinkedHashMap<>(values));
        }
    }
}
