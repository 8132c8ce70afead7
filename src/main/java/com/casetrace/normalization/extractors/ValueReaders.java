package com.casetrace.normalization.extractors;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Converters from raw record values to strings.
 */
public final class ValueReaders {

    private ValueReaders() {
    }

    /**
     * Strings, numbers and booleans. Integral numbers render without a
     * decimal part.
     */
    public static Optional<String> scalar(Object value) {
        if (value instanceof String) {
            String text = ((String) value).trim();
            return text.isEmpty() ? Optional.empty() : Optional.of(text);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return Optional.empty();
            }
            return Optional.of(new BigDecimal(value.toString()).stripTrailingZeros().toPlainString());
        }
        if (value instanceof Number || value instanceof Boolean) {
            return Optional.of(value.toString());
        }
        return Optional.empty();
    }

    /**
     * Scalar, or one level of {@code {name: ...}} / {@code {hostname: ...}}
     */
    public static Optional<String> scalarOrName(Object value) {
        if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            Optional<String> name = scalar(map.get("name"));
            return name.isPresent() ? name : scalar(map.get("hostname"));
        }
        return scalar(value);
    }

    /**
     * Scalar, or a text node as produced by XML-to-JSON conversion
     * ({@code {"#text": ...}} or {@code {"text": ...}})
     */
    public static Optional<String> scalarOrText(Object value) {
        if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            Optional<String> text = scalar(map.get("#text"));
            return text.isPresent() ? text : scalar(map.get("text"));
        }
        return scalar(value);
    }
}
