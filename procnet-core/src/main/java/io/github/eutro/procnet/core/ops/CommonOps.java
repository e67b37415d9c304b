package io.github.eutro.procnet.core.ops;

import io.github.eutro.procnet.core.ssa.Insn;

/**
 * Data operations that can appear in any process body.
 */
public class CommonOps {
    /**
     * Effect: returns its operands.
     */
    public static final Op IDENTITY = new SimpleOpKey("id").create();
    /**
     * Effect: returns the constant immediate.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("const");
    /**
     * Effect: returns a token ordered after all of its token operands.
     */
    public static final Op AFTER_ALL = new SimpleOpKey("after_all").create();

    /**
     * Return an instruction producing the constant {@code k}.
     *
     * @param k The constant.
     * @return The instruction.
     */
    public static Insn constant(Object k) {
        return CONST.create(k).insn();
    }
}
