package io.github.tempo.opt.core.tree;

import io.github.tempo.opt.core.ext.ExtHolder;
import io.github.tempo.opt.core.ops.TreeOps;
import io.github.tempo.opt.core.util.TreePrinter;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function of a {@link Program}. Created by {@link Program#addFunction(String, String...)}.
 * <p>
 * Passes must call {@link Program#edit(Function)} before mutating the body or attributes.
 * Once its program is frozen, the setters and the child lists of the body throw {@link IllegalStateException}.
 */
public final class Function extends ExtHolder implements Symbol {
    private final int id;
    private final String name;
    private final List<String> params;
    private boolean exported;
    @Nullable
    private Integer recursionDepth;
    private Node body;
    private boolean frozen;

    Function(int id, String name, List<String> params) {
        this.id = id;
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.body = TreeOps.block();
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    public List<String> getParams() {
        return params;
    }

    public boolean isExported() {
        return exported;
    }

    public Function setExported(boolean exported) {
        checkMutable();
        this.exported = exported;
        return this;
    }

    /**
     * The declared maximum depth of direct self-recursion, if the function recurses.
     *
     * @return The depth, or null if undeclared.
     */
    @Nullable
    public Integer getRecursionDepth() {
        return recursionDepth;
    }

    public Function setRecursionDepth(@Nullable Integer recursionDepth) {
        checkMutable();
        if (recursionDepth != null && recursionDepth < 1) {
            throw new IllegalArgumentException("recursion depth must be positive, got " + recursionDepth);
        }
        this.recursionDepth = recursionDepth;
        return this;
    }

    /**
     * The body, always a {@link TreeOps#BLOCK block}.
     *
     * @return The body.
     */
    public Node getBody() {
        return body;
    }

    public Function setBody(Node body) {
        checkMutable();
        if (body.op != TreeOps.BLOCK) {
            throw new IllegalArgumentException("function body must be a block, got " + body.op);
        }
        this.body = body;
        return this;
    }

    void freeze() {
        frozen = true;
        body.freeze();
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("function " + name + " is frozen");
        }
    }

    /**
     * Deep-copy this function, keeping its ID. The copy is never frozen.
     *
     * @return The copy.
     */
    public Function copy() {
        Function copy = new Function(id, name, params);
        copy.exported = exported;
        copy.recursionDepth = recursionDepth;
        copy.body = body.copy();
        copy.copyExtsFrom(this);
        return copy;
    }

    @Override
    public String toString() {
        return TreePrinter.print(this);
    }
}
