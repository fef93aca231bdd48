package io.github.tempo.opt.core.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The cost-dominant call chain starting at a function: each entry is the callee
 * contributing the most cycles to the previous one.
 */
public final class CriticalPath {
    /**
     * A function on the path, with how many times it runs per invocation of the first function.
     */
    public static final class Entry {
        public final int functionId;
        public final String function;
        public final long frequency;

        public Entry(int functionId, String function, long frequency) {
            this.functionId = functionId;
            this.function = function;
            this.frequency = frequency;
        }

        @Override
        public String toString() {
            return function + "x" + frequency;
        }
    }

    private final List<Entry> entries;

    public CriticalPath(List<Entry> entries) {
        if (entries.isEmpty()) throw new IllegalArgumentException("empty critical path");
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public Entry getHead() {
        return entries.get(0);
    }

    public List<String> functionNames() {
        return entries.stream().map(entry -> entry.function).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return entries.stream().map(Entry::toString).collect(Collectors.joining(" -> "));
    }
}
