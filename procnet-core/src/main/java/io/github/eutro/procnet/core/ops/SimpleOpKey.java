package io.github.eutro.procnet.core.ops;

/**
 * A key for operations with no immediates, which therefore all share one {@link Op}.
 */
public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    public SimpleOpKey(String mnemonic) {
        super(mnemonic);
    }

    public Op create() {
        return op;
    }
}
