package io.github.tempo.opt.core.tree;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A view of a {@link Program} as it was when {@link Program#beginRecording()} was called.
 * <p>
 * Only touched functions are copied: the first {@link Program#edit(Function) edit} of a function
 * stores a deep copy of it, and removals keep the removed object. Everything else is read
 * through to the live program, so the cost of a snapshot is proportional to the size of the change.
 */
public final class ProgramSnapshot implements ProgramView {
    private final Program program;
    private final SortedMap<Integer, Function> editedFunctions = new TreeMap<>();
    private final SortedMap<Integer, Function> removedFunctions = new TreeMap<>();
    private final SortedMap<Integer, GlobalVariable> removedGlobals = new TreeMap<>();
    private final Set<Integer> addedFunctions = new TreeSet<>();
    private final Set<Integer> addedGlobals = new TreeSet<>();

    ProgramSnapshot(Program program) {
        this.program = program;
    }

    void recordEdit(Function function) {
        int id = function.getId();
        if (addedFunctions.contains(id) || editedFunctions.containsKey(id)) return;
        editedFunctions.put(id, function.copy());
    }

    void recordRemoval(Function function) {
        int id = function.getId();
        if (addedFunctions.remove(id)) return;
        Function preImage = editedFunctions.remove(id);
        removedFunctions.put(id, preImage == null ? function : preImage);
    }

    void recordRemoval(GlobalVariable global) {
        if (addedGlobals.remove(global.getId())) return;
        removedGlobals.put(global.getId(), global);
    }

    void recordAdded(Function function) {
        addedFunctions.add(function.getId());
    }

    void recordAdded(GlobalVariable global) {
        addedGlobals.add(global.getId());
    }

    /**
     * The IDs of functions that were edited and still exist.
     *
     * @return The IDs, in ascending order.
     */
    public Set<Integer> editedFunctionIds() {
        return Collections.unmodifiableSet(editedFunctions.keySet());
    }

    public Set<Integer> removedFunctionIds() {
        return Collections.unmodifiableSet(removedFunctions.keySet());
    }

    public Set<Integer> removedGlobalIds() {
        return Collections.unmodifiableSet(removedGlobals.keySet());
    }

    /**
     * Whether nothing at all was recorded.
     *
     * @return True if the program is unchanged.
     */
    public boolean isEmpty() {
        return editedFunctions.isEmpty()
                && removedFunctions.isEmpty()
                && removedGlobals.isEmpty()
                && addedFunctions.isEmpty()
                && addedGlobals.isEmpty();
    }

    @Override
    public Collection<Function> functions() {
        SortedMap<Integer, Function> view = new TreeMap<>();
        for (Function function : program.functions()) {
            if (!addedFunctions.contains(function.getId())) {
                view.put(function.getId(), function);
            }
        }
        view.putAll(editedFunctions);
        view.putAll(removedFunctions);
        return Collections.unmodifiableCollection(view.values());
    }

    @Override
    public @Nullable Function function(int id) {
        Function function = editedFunctions.get(id);
        if (function != null) return function;
        function = removedFunctions.get(id);
        if (function != null) return function;
        if (addedFunctions.contains(id)) return null;
        return program.function(id);
    }

    @Override
    public @Nullable Function function(String name) {
        for (Function function : functions()) {
            if (function.getName().equals(name)) return function;
        }
        return null;
    }

    @Override
    public Collection<GlobalVariable> globals() {
        SortedMap<Integer, GlobalVariable> view = new TreeMap<>();
        for (GlobalVariable global : program.globals()) {
            if (!addedGlobals.contains(global.getId())) {
                view.put(global.getId(), global);
            }
        }
        view.putAll(removedGlobals);
        return Collections.unmodifiableCollection(view.values());
    }

    @Override
    public @Nullable GlobalVariable global(int id) {
        GlobalVariable global = removedGlobals.get(id);
        if (global != null) return global;
        if (addedGlobals.contains(id)) return null;
        return program.global(id);
    }
}
