package io.github.tempo.opt.core.analysis;

import io.github.tempo.opt.core.ops.TreeOps;
import io.github.tempo.opt.core.tree.BinOp;
import io.github.tempo.opt.core.tree.Literal;
import io.github.tempo.opt.core.tree.Node;
import io.github.tempo.opt.core.util.TreePrinter;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A statically decomposed memory address: {@code base + offset}, where the base is a local,
 * a global or absent (an absolute address), and the offset a literal.
 * <p>
 * Bases are assumed to be aligned to the cache line, as the target ABI lays out data.
 */
public final class MemoryAccess {
    /**
     * The printed base expression, empty for absolute addresses.
     */
    public final String base;
    /**
     * The local the base reads, if it is a local.
     */
    @Nullable
    public final String baseLocal;
    public final long offset;

    private MemoryAccess(String base, @Nullable String baseLocal, long offset) {
        this.base = base;
        this.baseLocal = baseLocal;
        this.offset = offset;
    }

    /**
     * Decompose an address expression.
     *
     * @param address The address expression.
     * @return The access, or null if the address has no static decomposition.
     */
    @Nullable
    public static MemoryAccess ofAddress(Node address) {
        Literal absolute = TreeOps.literalOf(address);
        if (absolute != null) return new MemoryAccess("", null, absolute.bits);
        if (isBase(address)) return base(address, 0);
        if (TreeOps.BINARY.argNullable(address.op) == BinOp.ADD) {
            Node lhs = address.child(0);
            Node rhs = address.child(1);
            Literal offset = TreeOps.literalOf(rhs);
            if (offset != null && isBase(lhs)) return base(lhs, offset.bits);
            offset = TreeOps.literalOf(lhs);
            if (offset != null && isBase(rhs)) return base(rhs, offset.bits);
        }
        return null;
    }

    /**
     * Decompose the address of a statement of the form {@code local.set(x, load(address))}.
     *
     * @param statement The statement.
     * @return The access, or null if the statement is not such a load or its address has no static decomposition.
     */
    @Nullable
    public static MemoryAccess ofLoadStatement(Node statement) {
        if (TreeOps.LOCAL_SET.checkNullable(statement.op) == null) return null;
        Node value = statement.child(0);
        if (TreeOps.LOAD.checkNullable(value.op) == null) return null;
        return ofAddress(value.child(0));
    }

    private static boolean isBase(Node node) {
        return TreeOps.LOCAL_GET.checkNullable(node.op) != null
                || TreeOps.GLOBAL_GET.checkNullable(node.op) != null;
    }

    private static MemoryAccess base(Node base, long offset) {
        return new MemoryAccess(TreePrinter.print(base), TreeOps.LOCAL_GET.argNullable(base.op), offset);
    }

    /**
     * Whether a load statement reads the cache line loaded by the statement directly before it.
     * It does not if that statement overwrote the local its address is based on.
     *
     * @param previous  The preceding statement.
     * @param statement The statement.
     * @param lineBytes The cache line size.
     * @return Whether both are loads and the second hits the line of the first.
     */
    public static boolean hitsPreviousLine(Node previous, Node statement, int lineBytes) {
        MemoryAccess first = ofLoadStatement(previous);
        MemoryAccess second = ofLoadStatement(statement);
        if (first == null || second == null) return false;
        if (second.baseLocal != null && second.baseLocal.equals(TreeOps.LOCAL_SET.cast(previous.op).arg)) {
            return false;
        }
        return second.sameLine(first, lineBytes);
    }

    /**
     * Whether two accesses certainly fall in the same cache line.
     *
     * @param other     The other access.
     * @param lineBytes The cache line size.
     * @return Whether they share a line.
     */
    public boolean sameLine(MemoryAccess other, int lineBytes) {
        return base.equals(other.base)
                && Math.floorDiv(offset, lineBytes) == Math.floorDiv(other.offset, lineBytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MemoryAccess that = (MemoryAccess) o;
        return offset == that.offset && base.equals(that.base);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, offset);
    }

    @Override
    public String toString() {
        return (base.isEmpty() ? "" : base + " + ") + offset;
    }
}
