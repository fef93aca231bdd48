package io.github.tempo.opt.core.analysis;

import io.github.tempo.opt.core.tree.BinOp;

/**
 * The cycle cost of each node kind on the target, as used by {@link WcetAnalyzer}.
 * <p>
 * All costs are non-negative. Use {@link #builder()} to derive a model for another target.
 */
public final class CostModel {
    /**
     * The default model.
     */
    public static final CostModel DEFAULT = builder().build();

    public final long constant;
    public final long localAccess;
    public final long globalAccess;
    public final long load;
    /**
     * The cost of a load whose cache line was loaded by the directly preceding statement.
     */
    public final long loadLineHit;
    public final int cacheLineBytes;
    public final long store;
    public final long alu;
    public final long multiply;
    public final long divide;
    public final long unary;
    public final long branch;
    public final long loopIteration;
    public final long callOverhead;
    public final long ret;

    private CostModel(Builder builder) {
        constant = builder.constant;
        localAccess = builder.localAccess;
        globalAccess = builder.globalAccess;
        load = builder.load;
        loadLineHit = builder.loadLineHit;
        cacheLineBytes = builder.cacheLineBytes;
        store = builder.store;
        alu = builder.alu;
        multiply = builder.multiply;
        divide = builder.divide;
        unary = builder.unary;
        branch = builder.branch;
        loopIteration = builder.loopIteration;
        callOverhead = builder.callOverhead;
        ret = builder.ret;
    }

    public long binary(BinOp op) {
        switch (op) {
            case MUL:
                return multiply;
            case DIV:
            case REM:
                return divide;
            default:
                return alu;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long constant = 1;
        private long localAccess = 1;
        private long globalAccess = 2;
        private long load = 4;
        private long loadLineHit = 1;
        private int cacheLineBytes = 16;
        private long store = 4;
        private long alu = 1;
        private long multiply = 3;
        private long divide = 20;
        private long unary = 1;
        private long branch = 2;
        private long loopIteration = 2;
        private long callOverhead = 5;
        private long ret = 1;

        private static long checked(String what, long cycles) {
            if (cycles < 0) throw new IllegalArgumentException(what + " cost must not be negative, got " + cycles);
            return cycles;
        }

        public Builder setConstant(long constant) {
            this.constant = checked("constant", constant);
            return this;
        }

        public Builder setLocalAccess(long localAccess) {
            this.localAccess = checked("local access", localAccess);
            return this;
        }

        public Builder setGlobalAccess(long globalAccess) {
            this.globalAccess = checked("global access", globalAccess);
            return this;
        }

        public Builder setLoad(long load) {
            this.load = checked("load", load);
            return this;
        }

        public Builder setLoadLineHit(long loadLineHit) {
            this.loadLineHit = checked("line hit", loadLineHit);
            return this;
        }

        public Builder setCacheLineBytes(int cacheLineBytes) {
            if (cacheLineBytes <= 0) {
                throw new IllegalArgumentException("cache line size must be positive, got " + cacheLineBytes);
            }
            this.cacheLineBytes = cacheLineBytes;
            return this;
        }

        public Builder setStore(long store) {
            this.store = checked("store", store);
            return this;
        }

        public Builder setAlu(long alu) {
            this.alu = checked("alu", alu);
            return this;
        }

        public Builder setMultiply(long multiply) {
            this.multiply = checked("multiply", multiply);
            return this;
        }

        public Builder setDivide(long divide) {
            this.divide = checked("divide", divide);
            return this;
        }

        public Builder setUnary(long unary) {
            this.unary = checked("unary", unary);
            return this;
        }

        public Builder setBranch(long branch) {
            this.branch = checked("branch", branch);
            return this;
        }

        public Builder setLoopIteration(long loopIteration) {
            this.loopIteration = checked("loop iteration", loopIteration);
            return this;
        }

        public Builder setCallOverhead(long callOverhead) {
            this.callOverhead = checked("call overhead", callOverhead);
            return this;
        }

        public Builder setReturn(long ret) {
            this.ret = checked("return", ret);
            return this;
        }

        public CostModel build() {
            return new CostModel(this);
        }
    }
}
