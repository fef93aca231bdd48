package io.github.tempo.opt.core.ops;

import io.github.tempo.opt.core.ext.CommonExts;
import io.github.tempo.opt.core.tree.*;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The node kinds of the program tree, and helpers for building nodes.
 */
public class TreeOps {
    /**
     * Expression: the literal.
     */
    public static final UnaryOpKey<Literal> CONST = new UnaryOpKey<>("const", 0);
    /**
     * Expression: reads the named local (parameters are locals).
     */
    public static final UnaryOpKey<String> LOCAL_GET = new UnaryOpKey<>("local.get", 0);
    /**
     * Statement: writes its only child to the named local.
     */
    public static final UnaryOpKey<String> LOCAL_SET = new UnaryOpKey<>("local.set", 1);
    /**
     * Expression: reads the global with the given ID.
     */
    public static final UnaryOpKey<Integer> GLOBAL_GET = new UnaryOpKey<>("global.get", 0, id -> "#" + id);
    /**
     * Statement: writes its only child to the global with the given ID.
     */
    public static final UnaryOpKey<Integer> GLOBAL_SET = new UnaryOpKey<>("global.set", 1, id -> "#" + id);
    /**
     * Expression: reads a value of the given type from the address in its only child.
     */
    public static final UnaryOpKey<NumType> LOAD = new UnaryOpKey<>("load", 1);
    /**
     * Statement: writes the second child to the address in the first child.
     */
    public static final UnaryOpKey<NumType> STORE = new UnaryOpKey<>("store", 2);
    /**
     * Expression: applies the operator to its two children.
     */
    public static final UnaryOpKey<BinOp> BINARY = new UnaryOpKey<>("binary", 2);
    /**
     * Expression: applies the operator to its only child.
     */
    public static final UnaryOpKey<UnOp> UNARY = new UnaryOpKey<>("unary", 1);
    /**
     * Expression: calls the function with the given ID, with its children as arguments.
     */
    public static final UnaryOpKey<Integer> CALL = new UnaryOpKey<>("call", OpKey.VARIADIC, id -> "#" + id);
    /**
     * Expression: invokes a runtime routine with its children as arguments.
     */
    public static final UnaryOpKey<Extern> EXTERN = new UnaryOpKey<>("extern", OpKey.VARIADIC);

    /**
     * Statement: executes its children in order.
     */
    public static final Op BLOCK = new SimpleOpKey("block", OpKey.VARIADIC).create();
    /**
     * Statement: evaluates its only child for its effects.
     */
    public static final Op EVAL = new SimpleOpKey("eval", 1).create();
    /**
     * Statement: children are the condition, the then-block and the else-block.
     */
    public static final Op IF = new SimpleOpKey("if", 3).create();
    /**
     * Statement: executes its only child exactly the given number of times.
     */
    public static final UnaryOpKey<Integer> REPEAT = new UnaryOpKey<>("repeat", 1);
    /**
     * Statement: children are the condition and the body. The intermediate is the
     * declared maximum number of iterations, or null if none was declared.
     */
    public static final UnaryOpKey<Integer> WHILE = new UnaryOpKey<Integer>("while", 2).allowNull();
    /**
     * Statement: returns, with its child as the value if it has one.
     */
    public static final Op RETURN = new SimpleOpKey("return", OpKey.VARIADIC).create();

    static {
        for (OpKey key : new OpKey[]{
                CONST,
                LOCAL_GET,
                GLOBAL_GET,
                LOAD,
                BINARY,
                UNARY,
        }) {
            CommonExts.markPure(key);
        }
        for (OpKey key : new OpKey[]{
                GLOBAL_SET,
                STORE,
                EXTERN,
        }) {
            CommonExts.markSideEffect(key);
        }
        BINARY.attachExt(CommonExts.CONSTANT_FOLDER, node -> {
            Literal lhs = literalOf(node.child(0));
            Literal rhs = literalOf(node.child(1));
            if (lhs == null || rhs == null) return null;
            return Arithmetic.evalBinary(BINARY.cast(node.op).arg, lhs, rhs);
        });
        UNARY.attachExt(CommonExts.CONSTANT_FOLDER, node -> {
            Literal operand = literalOf(node.child(0));
            if (operand == null) return null;
            return Arithmetic.evalUnary(UNARY.cast(node.op).arg, operand);
        });
    }

    /**
     * Get the literal of a {@link #CONST} node.
     *
     * @param node The node.
     * @return The literal, or null if the node is not a constant.
     */
    @Nullable
    public static Literal literalOf(Node node) {
        return CONST.argNullable(node.op);
    }

    public static Node constant(Literal literal) {
        return CONST.create(literal).node();
    }

    public static Node constant(NumType type, long value) {
        return constant(Literal.of(type, value));
    }

    public static Node i32(long value) {
        return constant(NumType.I32, value);
    }

    public static Node bool(boolean value) {
        return constant(Literal.bool(value));
    }

    public static Node localGet(String name) {
        return LOCAL_GET.create(name).node();
    }

    public static Node localSet(String name, Node value) {
        return LOCAL_SET.create(name).node(value);
    }

    public static Node globalGet(GlobalVariable global) {
        return GLOBAL_GET.create(global.getId()).node();
    }

    public static Node globalSet(GlobalVariable global, Node value) {
        return GLOBAL_SET.create(global.getId()).node(value);
    }

    public static Node load(NumType type, Node address) {
        return LOAD.create(type).node(address);
    }

    public static Node store(NumType type, Node address, Node value) {
        return STORE.create(type).node(address, value);
    }

    public static Node binary(BinOp op, Node lhs, Node rhs) {
        return BINARY.create(op).node(lhs, rhs);
    }

    public static Node unary(UnOp op, Node operand) {
        return UNARY.create(op).node(operand);
    }

    public static Node call(Function callee, Node... args) {
        return CALL.create(callee.getId()).node(args);
    }

    public static Node extern(String name, long cycles, Node... args) {
        return EXTERN.create(new Extern(name, cycles)).node(args);
    }

    public static Node block(Node... statements) {
        return BLOCK.node(statements);
    }

    public static Node block(List<Node> statements) {
        return BLOCK.node(statements);
    }

    public static Node eval(Node expression) {
        return EVAL.node(expression);
    }

    public static Node ifElse(Node cond, Node thenBlock, Node elseBlock) {
        return IF.node(cond, thenBlock, elseBlock);
    }

    public static Node repeat(int tripCount, Node body) {
        if (tripCount < 0) throw new IllegalArgumentException("negative trip count " + tripCount);
        return REPEAT.create(tripCount).node(body);
    }

    public static Node whileLoop(@Nullable Integer maxIterations, Node cond, Node body) {
        if (maxIterations != null && maxIterations < 0) {
            throw new IllegalArgumentException("negative iteration bound " + maxIterations);
        }
        return WHILE.create(maxIterations).node(cond, body);
    }

    public static Node ret() {
        return RETURN.node();
    }

    public static Node ret(Node value) {
        return RETURN.node(value);
    }
}
