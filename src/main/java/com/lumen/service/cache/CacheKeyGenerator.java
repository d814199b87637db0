package com.lumen.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives stable cache keys from (prompt, model, options).
 * <p>
 * The prompt and model are hashed exactly as given. Options are normalized first:
 * null values dropped, floating point numbers rounded to two decimals, option strings
 * trimmed with whitespace collapsed. Jackson writes the result with map keys sorted, and
 * the key is the SHA-256 of that JSON. Option order never changes the key.
 */
@Component
public class CacheKeyGenerator {

    private static final int FLOAT_PRECISION = 2;

    private final ObjectMapper objectMapper;
    private final ObjectWriter canonicalWriter;

    public CacheKeyGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.canonicalWriter = objectMapper.writer()
                .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .without(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return SHA-256 hex digest (64 chars)
     */
    public String generateKey(String prompt, String model, Map<String, Object> options) {
        return DigestUtils.sha256Hex(canonicalize(prompt, model, options));
    }

    /**
     * Canonical JSON string for the key inputs.
     */
    public String canonicalize(String prompt, String model, Map<String, Object> options) {
        Map<String, Object> input = new TreeMap<>();
        input.put("prompt", prompt);
        input.put("model", model);
        input.put("options", options == null ? Map.of() : normalizeOption(options));

        try {
            return canonicalWriter.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Generation options are not serializable", e);
        }
    }

    private Object normalizeOption(Object value) {
        if (value == null || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                Object normalized = normalizeOption(entry.getValue());
                if (normalized != null) {
                    sorted.put(String.valueOf(entry.getKey()), normalized);
                }
            }
            return sorted;
        }
        if (value instanceof Collection) {
            List<Object> elements = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                Object normalized = normalizeOption(element);
                if (normalized != null) {
                    elements.add(normalized);
                }
            }
            return elements;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return roundFloat((Number) value);
        }
        if (value instanceof Number) {
            return value;
        }
        if (value instanceof CharSequence) {
            return value.toString().trim().replaceAll("\\s+", " ");
        }
        // Enums, arrays and option beans are reduced to plain JSON values first
        return normalizeOption(objectMapper.convertValue(value, Object.class));
    }

    private static Object roundFloat(Number number) {
        double raw = number.doubleValue();
        if (Double.isNaN(raw) || Double.isInfinite(raw)) {
            return raw;
        }
        return BigDecimal.valueOf(raw).setScale(FLOAT_PRECISION, RoundingMode.HALF_UP).doubleValue();
    }
}
