package com.intentguard.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable parameter bag keyed by {@link ParamKey}.
 * A missing key means the field is unconstrained; values are never empty placeholders.
 */
public final class ExtractedParams {

    private static final ExtractedParams EMPTY = new ExtractedParams(new EnumMap<>(ParamKey.class));

    private final Map<ParamKey, String> values;

    private ExtractedParams(EnumMap<ParamKey, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static ExtractedParams empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Keeps the known keys of an agent-supplied map. Anything else (limit, body, ...)
     * is carried by the agent but never binds the action.
     */
    public static ExtractedParams fromRaw(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            ParamKey key = ParamKey.fromString(entry.getKey());
            if (key == null || entry.getValue() == null) {
                continue;
            }
            builder.put(key, String.valueOf(entry.getValue()));
        }
        return builder.build();
    }

    public Optional<String> get(ParamKey key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean has(ParamKey key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    @JsonValue
    public Map<String, String> asMap() {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<ParamKey, String> entry : values.entrySet()) {
            out.put(entry.getKey().getKey(), entry.getValue());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractedParams)) return false;
        return values.equals(((ExtractedParams) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return asMap().toString();
    }

    public static final class Builder {
        private final EnumMap<ParamKey, String> values = new EnumMap<>(ParamKey.class);

        private Builder() {
        }

        public Builder put(ParamKey key, String value) {
            if (key != null && value != null) {
                values.put(key, value);
            }
            return this;
        }

        public ExtractedParams build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new ExtractedParams(new EnumMap<>(values));
        }
    }
}
