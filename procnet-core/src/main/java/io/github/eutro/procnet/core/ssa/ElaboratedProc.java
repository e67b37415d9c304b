package io.github.eutro.procnet.core.ssa;

/**
 * A concrete process, whose body refers to channels only by name.
 * <p>
 * The arguments of the body are the state of the process.
 */
public final class ElaboratedProc extends ModuleSymbol {
    public final Region body = new Region();

    public ElaboratedProc(String name) {
        super(name);
    }

    @Override
    public String toString() {
        return "eproc @" + getName() + body;
    }
}
