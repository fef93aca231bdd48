package io.github.tempo.opt.core.analysis;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Observed call frequencies: for a function name, how many times it ran per invocation of its root.
 * <p>
 * Frequencies only re-rank critical paths; they never change a WCET bound.
 */
public final class CallProfile {
    public static final CallProfile EMPTY = new CallProfile(Collections.emptyMap());

    private final Map<String, Long> frequencies;

    private CallProfile(Map<String, Long> frequencies) {
        this.frequencies = Collections.unmodifiableMap(new TreeMap<>(frequencies));
    }

    public static CallProfile of(Map<String, Long> frequencies) {
        for (Map.Entry<String, Long> entry : frequencies.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 0) {
                throw new IllegalArgumentException("invalid call frequency for " + entry.getKey() + ": " + entry.getValue());
            }
        }
        return new CallProfile(frequencies);
    }

    @Nullable
    public Long frequency(String function) {
        return frequencies.get(function);
    }

    public Map<String, Long> asMap() {
        return frequencies;
    }

    public boolean isEmpty() {
        return frequencies.isEmpty();
    }
}
