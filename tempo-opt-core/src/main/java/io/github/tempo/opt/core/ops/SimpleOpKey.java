package io.github.tempo.opt.core.ops;

/**
 * A key for node kinds without intermediates, which all share one {@link Op}.
 */
public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    public SimpleOpKey(String mnemonic, int arity) {
        super(mnemonic, arity);
    }

    public Op create() {
        return op;
    }
}
