package com.eyelevel.imageprocessor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A small, open map of primitive values attached to a checkpoint record.
 * <p>
 * Values are limited to strings, booleans and numbers; integral numbers are normalized to {@link Long}
 * so a payload compares equal before and after a JSON round trip. The recognized keys per phase are:
 * <ul>
 *     <li>{@code extract} completed: {@link #COUNT}</li>
 *     <li>{@code <stage>_batch_<n>} started: {@link #INPUT_COUNT}, {@link #SUB_BATCH_SIZE}</li>
 *     <li>{@code <stage>_batch_<n>} completed: {@link #COUNT}, plus {@link #FAILED} for rename and convert,
 *     {@link #REJECTED} for filter</li>
 *     <li>{@code package} completed: {@link #COUNT}, {@link #PATH}</li>
 *     <li>{@code error}: {@link #ERROR}, {@link #FAILED_PHASE}</li>
 * </ul>
 */
public final class CheckpointPayload {

    public static final String COUNT = "count";
    public static final String INPUT_COUNT = "input_count";
    public static final String SUB_BATCH_SIZE = "sub_batch_size";
    public static final String FAILED = "failed";
    public static final String REJECTED = "rejected";
    public static final String PATH = "path";
    public static final String ERROR = "error";
    public static final String FAILED_PHASE = "failed_phase";

    private static final CheckpointPayload EMPTY = new CheckpointPayload(Map.of());

    private final Map<String, Object> values;

    private CheckpointPayload(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static CheckpointPayload empty() {
        return EMPTY;
    }

    public static CheckpointPayload ofCount(long count) {
        return builder().put(COUNT, count).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CheckpointPayload fromMap(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        final Builder builder = builder();
        raw.forEach(builder::putValue);
        return builder.build();
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    public Optional<Long> getLong(String key) {
        final Object value = values.get(key);
        return value instanceof Number number ? Optional.of(number.longValue()) : Optional.empty();
    }

    public Optional<String> getString(String key) {
        final Object value = values.get(key);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    public Optional<Boolean> getBoolean(String key) {
        final Object value = values.get(key);
        return value instanceof Boolean bool ? Optional.of(bool) : Optional.empty();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CheckpointPayload other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, long value) {
            values.put(requireKey(key), value);
            return this;
        }

        public Builder put(String key, boolean value) {
            values.put(requireKey(key), value);
            return this;
        }

        public Builder put(String key, String value) {
            if (value != null) {
                values.put(requireKey(key), value);
            }
            return this;
        }

        private Builder putValue(String key, Object value) {
            if (value == null) {
                return this;
            }
            if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
                return put(key, ((Number) value).longValue());
            }
            if (value instanceof Number number) {
                values.put(requireKey(key), number.doubleValue());
                return this;
            }
            if (value instanceof Boolean bool) {
                return put(key, bool.booleanValue());
            }
            if (value instanceof CharSequence text) {
                return put(key, text.toString());
            }
            throw new IllegalArgumentException("Checkpoint payload value for '" + key + "' must be a primitive, got "
                    + value.getClass().getSimpleName());
        }

        private static String requireKey(String key) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Checkpoint payload key must not be blank");
            }
            return key;
        }

        public CheckpointPayload build() {
            return values.isEmpty() ? EMPTY : new CheckpointPayload(new LinkedHashMap<>(values));
        }
    }
}
