package com.automagik.telemetry.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Scalar attribute value. Exactly one of {@link StringValue}, {@link IntValue}, {@link DoubleValue} or
 * {@link BoolValue}; nested structures and arbitrary objects are not representable.
 */
public interface AttributeValue {

    /** Flat string rendering, as written into ClickHouse {@code Map(String, String)} columns. */
    String asString();

    static AttributeValue of(String value) {
        return new StringValue(value);
    }

    static AttributeValue of(long value) {
        return new IntValue(value);
    }

    static AttributeValue of(double value) {
        return new DoubleValue(value);
    }

    static AttributeValue of(boolean value) {
        return new BoolValue(value);
    }

    /**
     * Converts a raw Java value.
     *
     * @throws UnsupportedAttributeException for {@code null}, collections, maps and any other non-scalar
     */
    static AttributeValue from(Object value) {
        if (value instanceof AttributeValue av) return av;
        if (value instanceof CharSequence cs) return new StringValue(cs.toString());
        if (value instanceof Character c) return new StringValue(String.valueOf(c));
        if (value instanceof Enum<?> e) return new StringValue(e.name());
        if (value instanceof Boolean b) return new BoolValue(b);
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return new IntValue(((Number) value).longValue());
        }
        if (value instanceof AtomicInteger || value instanceof AtomicLong) {
            return new IntValue(((Number) value).longValue());
        }
        if (value instanceof BigInteger bi) {
            if (bi.bitLength() < Long.SIZE) return new IntValue(bi.longValue());
            throw new UnsupportedAttributeException("integer attribute exceeds 64 bits: " + bi);
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return new DoubleValue(((Number) value).doubleValue());
        }
        throw new UnsupportedAttributeException(
                value == null ? "null attribute value" : "unsupported attribute type " + value.getClass().getName());
    }

    record StringValue(String value) implements AttributeValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String asString() {
            return value;
        }
    }

    record IntValue(long value) implements AttributeValue {
        @Override
        public String asString() {
            return Long.toString(value);
        }
    }

    record DoubleValue(double value) implements AttributeValue {
        @Override
        public String asString() {
            return Double.toString(value);
        }
    }

    record BoolValue(boolean value) implements AttributeValue {
        @Override
        public String asString() {
            return Boolean.toString(value);
        }
    }
}
