package com.facthistory.contract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Typed attribute value. The set of value types is closed; on the wire each
 * value is written as {@code {"type": "string", "value": "..."}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = FactValue.StringValue.class, name = "string"),
    @JsonSubTypes.Type(value = FactValue.InstantValue.class, name = "instant"),
    @JsonSubTypes.Type(value = FactValue.UuidValue.class, name = "uuid"),
    @JsonSubTypes.Type(value = FactValue.LongValue.class, name = "long"),
    @JsonSubTypes.Type(value = FactValue.DoubleValue.class, name = "double"),
    @JsonSubTypes.Type(value = FactValue.BooleanValue.class, name = "boolean")
})
public sealed interface FactValue {

    /** The wrapped Java value. */
    @JsonIgnore
    Object raw();

    static FactValue of(Object value) {
        if (value instanceof FactValue factValue) {
            return factValue;
        }
        if (value instanceof String s) {
            return new StringValue(s);
        }
        if (value instanceof Instant instant) {
            return new InstantValue(instant);
        }
        if (value instanceof UUID uuid) {
            return new UuidValue(uuid);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short) {
            return new LongValue(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            return new DoubleValue(((Number) value).doubleValue());
        }
        if (value instanceof Boolean b) {
            return new BooleanValue(b);
        }
        throw new IllegalArgumentException("unsupported fact value type: "
            + (value == null ? "null" : value.getClass().getName()));
    }

    record StringValue(@JsonProperty("value") String value) implements FactValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record InstantValue(@JsonProperty("value") Instant value) implements FactValue {
        public InstantValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record UuidValue(@JsonProperty("value") UUID value) implements FactValue {
        public UuidValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record LongValue(@JsonProperty("value") long value) implements FactValue {
        @Override
        public Object raw() {
            return value;
        }
    }

    record DoubleValue(@JsonProperty("value") double value) implements FactValue {
        @Override
        public Object raw() {
            return value;
        }
    }

    record BooleanValue(@JsonProperty("value") boolean value) implements FactValue {
        @Override
        public Object raw() {
            return value;
        }
    }
}
