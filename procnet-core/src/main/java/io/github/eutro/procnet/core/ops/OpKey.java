package io.github.eutro.procnet.core.ops;

import io.github.eutro.procnet.core.ext.ExtHolder;

/**
 * The kind of an operation, without any immediates.
 * <p>
 * Op keys are compared by identity, so each kind of operation has exactly one key.
 */
public abstract class OpKey extends ExtHolder {
    public final String mnemonic;

    protected OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
