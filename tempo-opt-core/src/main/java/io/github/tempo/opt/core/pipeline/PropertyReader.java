package io.github.tempo.opt.core.pipeline;

import java.util.Properties;
import java.util.function.Consumer;

/**
 * Reads typed values of {@link OptimizerConfig#PROPERTY_PREFIX prefixed} keys.
 */
class PropertyReader {
    private final Properties properties;

    PropertyReader(Properties properties) {
        this.properties = properties;
    }

    private String get(String key) {
        String value = properties.getProperty(OptimizerConfig.PROPERTY_PREFIX + key);
        return value == null ? null : value.trim();
    }

    void readInt(String key, Consumer<Integer> setter) {
        String value = get(key);
        if (value == null) return;
        try {
            setter.accept(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            throw malformed(key, value, e);
        }
    }

    void readLong(String key, Consumer<Long> setter) {
        String value = get(key);
        if (value == null) return;
        try {
            setter.accept(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw malformed(key, value, e);
        }
    }

    void readDouble(String key, Consumer<Double> setter) {
        String value = get(key);
        if (value == null) return;
        try {
            setter.accept(Double.parseDouble(value));
        } catch (NumberFormatException e) {
            throw malformed(key, value, e);
        }
    }

    void readBoolean(String key, Consumer<Boolean> setter) {
        String value = get(key);
        if (value == null) return;
        if (value.equalsIgnoreCase("true")) {
            setter.accept(true);
        } else if (value.equalsIgnoreCase("false")) {
            setter.accept(false);
        } else {
            throw malformed(key, value, null);
        }
    }

    private static IllegalArgumentException malformed(String key, String value, Throwable cause) {
        return new IllegalArgumentException(
                String.format("malformed value for %s%s: %s", OptimizerConfig.PROPERTY_PREFIX, key, value),
                cause);
    }
}
