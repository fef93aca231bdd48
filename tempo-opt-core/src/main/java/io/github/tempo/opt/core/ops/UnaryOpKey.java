package io.github.tempo.opt.core.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * An operation key whose operations carry a single intermediate argument.
 *
 * @param <T> The type of the intermediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;
    private boolean allowNull = false;

    public UnaryOpKey(String mnemonic, int arity, Function<T, String> printer) {
        super(mnemonic, arity);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic, int arity) {
        this(mnemonic, arity, Objects::toString);
    }

    public UnaryOpKey<T> allowNull() {
        allowNull = true;
        return this;
    }

    public class UnaryOp extends Op {
        public final T arg;

        public UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof UnaryOpKey.UnaryOp)) return false;
            UnaryOpKey<?>.UnaryOp other = (UnaryOpKey<?>.UnaryOp) o;
            return key == other.key && Objects.equals(arg, other.arg);
        }

        @Override
        public int hashCode() {
            return 31 * key.hashCode() + Objects.hashCode(arg);
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    public UnaryOp checkNullable(Op val) {
        if (val.key == this) {
            @SuppressWarnings("unchecked")
            UnaryOp ret = (UnaryOp) val;
            return ret;
        } else {
            return null;
        }
    }

    @Nullable
    public T argNullable(Op val) {
        UnaryOp op = checkNullable(val);
        if (op == null) return null;
        return op.arg;
    }

    public Optional<UnaryOp> check(Op val) {
        return Optional.ofNullable(checkNullable(val));
    }

    public UnaryOp cast(Op val) {
        return check(val).orElseThrow(ClassCastException::new);
    }

    public UnaryOp create(T arg) {
        if (!allowNull && arg == null) {
            throw new IllegalArgumentException("Argument is null");
        }
        return new UnaryOp(arg);
    }
}
