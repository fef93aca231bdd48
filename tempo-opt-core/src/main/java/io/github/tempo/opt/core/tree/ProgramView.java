package io.github.tempo.opt.core.tree;

import org.jetbrains.annotations.Nullable;

import java.util.Collection;

/**
 * Read access to the functions and globals of a program, either the live {@link Program}
 * or the pre-pass state kept by a {@link ProgramSnapshot}.
 * <p>
 * Collections are always in ID order.
 */
public interface ProgramView {
    /**
     * The name of the entry point, always a root of the program.
     */
    String MAIN = "main";

    Collection<Function> functions();

    @Nullable
    Function function(int id);

    @Nullable
    Function function(String name);

    Collection<GlobalVariable> globals();

    @Nullable
    GlobalVariable global(int id);

    /**
     * Whether a function is a root: {@link #MAIN} or exported.
     *
     * @param function The function.
     * @return Whether it is a root.
     */
    static boolean isRoot(Function function) {
        return function.isExported() || MAIN.equals(function.getName());
    }
}
