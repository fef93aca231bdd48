package io.github.tempo.opt.core.tree;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The program tree: an arena of {@link Function}s and {@link GlobalVariable}s indexed by stable IDs.
 * <p>
 * IDs are handed out in insertion order and never reused, so every iteration over a program
 * is in a deterministic order. Calls and global accesses refer to IDs, not to objects.
 * <p>
 * While a {@link ProgramSnapshot recording} is active, edits and removals are recorded
 * so the pre-pass state can be inspected without copying the whole tree.
 */
public final class Program implements ProgramView {
    private final SortedMap<Integer, Function> functions = new TreeMap<>();
    private final Map<String, Integer> functionIds = new HashMap<>();
    private final SortedMap<Integer, GlobalVariable> globals = new TreeMap<>();
    private final Map<String, Integer> globalIds = new HashMap<>();
    private int nextFunctionId = 0;
    private int nextGlobalId = 0;

    @Nullable
    private ProgramSnapshot recording;
    private boolean frozen;

    public Function addFunction(String name, String... params) {
        return addFunction(name, Arrays.asList(params));
    }

    public Function addFunction(String name, List<String> params) {
        checkMutable();
        if (functionIds.containsKey(name)) {
            throw new IllegalArgumentException("duplicate function " + name);
        }
        Function function = new Function(nextFunctionId++, name, params);
        functions.put(function.getId(), function);
        functionIds.put(name, function.getId());
        if (recording != null) recording.recordAdded(function);
        return function;
    }

    public GlobalVariable addGlobal(String name, Literal initial) {
        checkMutable();
        if (globalIds.containsKey(name)) {
            throw new IllegalArgumentException("duplicate global " + name);
        }
        GlobalVariable global = new GlobalVariable(nextGlobalId++, name, initial.type, initial);
        globals.put(global.getId(), global);
        globalIds.put(name, global.getId());
        if (recording != null) recording.recordAdded(global);
        return global;
    }

    @Override
    public Collection<Function> functions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    @Override
    public @Nullable Function function(int id) {
        return functions.get(id);
    }

    @Override
    public @Nullable Function function(String name) {
        Integer id = functionIds.get(name);
        return id == null ? null : functions.get(id);
    }

    @Override
    public Collection<GlobalVariable> globals() {
        return Collections.unmodifiableCollection(globals.values());
    }

    @Override
    public @Nullable GlobalVariable global(int id) {
        return globals.get(id);
    }

    @Nullable
    public GlobalVariable global(String name) {
        Integer id = globalIds.get(name);
        return id == null ? null : globals.get(id);
    }

    /**
     * Announce that a function is about to be mutated.
     *
     * @param function The function.
     */
    public void edit(Function function) {
        checkMutable();
        if (functions.get(function.getId()) != function) {
            throw new IllegalArgumentException("function " + function.getName() + " is not part of this program");
        }
        if (recording != null) recording.recordEdit(function);
    }

    public void removeFunction(Function function) {
        checkMutable();
        if (functions.get(function.getId()) != function) {
            throw new IllegalArgumentException("function " + function.getName() + " is not part of this program");
        }
        functions.remove(function.getId());
        functionIds.remove(function.getName());
        if (recording != null) recording.recordRemoval(function);
    }

    public void removeGlobal(GlobalVariable global) {
        checkMutable();
        if (globals.get(global.getId()) != global) {
            throw new IllegalArgumentException("global " + global.getName() + " is not part of this program");
        }
        globals.remove(global.getId());
        globalIds.remove(global.getName());
        if (recording != null) recording.recordRemoval(global);
    }

    /**
     * Start recording changes. Only one recording may be active at a time.
     *
     * @return The snapshot, which views the program as it is now for as long as it is recording.
     */
    public ProgramSnapshot beginRecording() {
        checkMutable();
        if (recording != null) {
            throw new IllegalStateException("already recording");
        }
        recording = new ProgramSnapshot(this);
        return recording;
    }

    /**
     * Stop the active recording. The snapshot keeps its contents.
     *
     * @return The snapshot that was recording.
     */
    public ProgramSnapshot endRecording() {
        if (recording == null) {
            throw new IllegalStateException("not recording");
        }
        ProgramSnapshot snapshot = recording;
        recording = null;
        return snapshot;
    }

    /**
     * Deep-copy this program, keeping every ID. The copy is never frozen or recording.
     *
     * @return The copy.
     */
    public Program copy() {
        Program copy = new Program();
        for (Function function : functions.values()) {
            copy.functions.put(function.getId(), function.copy());
        }
        copy.functionIds.putAll(functionIds);
        copy.globals.putAll(globals);
        copy.globalIds.putAll(globalIds);
        copy.nextFunctionId = nextFunctionId;
        copy.nextGlobalId = nextGlobalId;
        return copy;
    }

    /**
     * Reject any further mutation of the arena, the function attributes and the child lists of every body.
     */
    public void freeze() {
        recording = null;
        frozen = true;
        for (Function function : functions.values()) {
            function.freeze();
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("program is frozen");
        }
    }
}
