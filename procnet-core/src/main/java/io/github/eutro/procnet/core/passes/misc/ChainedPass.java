package io.github.eutro.procnet.core.passes.misc;

import io.github.eutro.procnet.core.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs one pass, then another on its result.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> firstPass;
    private final IRPass<B, C> nextPass;

    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
    }

    @Override
    public boolean isInPlace() {
        return firstPass.isInPlace() && nextPass.isInPlace();
    }

    // flattened, so long chains don't recurse deeply
    @SuppressWarnings("unchecked")
    private List<IRPass<Object, Object>> listPasses() {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        IRPass<?, ?> pass = this;
        while (pass instanceof ChainedPass) {
            ChainedPass<?, ?, ?> chained = (ChainedPass<?, ?, ?>) pass;
            passes.add(chained.nextPass);
            pass = chained.firstPass;
        }
        passes.add(pass);
        Collections.reverse(passes);
        return (List<IRPass<Object, Object>>) (Object) passes;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        List<IRPass<Object, Object>> passes = listPasses();
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            try {
                acc = passes.get(i).run(acc);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("running pass " + i + " in chain"));
                throw e;
            }
        }
        return (C) acc;
    }
}
