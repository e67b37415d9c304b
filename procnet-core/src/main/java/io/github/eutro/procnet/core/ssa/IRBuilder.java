package io.github.eutro.procnet.core.ssa;

import io.github.eutro.procnet.core.types.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Appends instructions to the end of a {@link Region}.
 */
public class IRBuilder {
    /**
     * The region being inserted into.
     */
    public final Region region;

    public IRBuilder(Region region) {
        this.region = region;
    }

    /**
     * Insert an effect at the end of the region.
     *
     * @param effect The effect.
     */
    public void insert(Effect effect) {
        region.addEffect(effect);
    }

    /**
     * Insert an instruction with no results.
     *
     * @param insn The instruction.
     */
    public void insert(Insn insn) {
        insert(insn.assignTo());
    }

    /**
     * Assign the result of the instruction to a new var, and insert the effect.
     *
     * @param insn The instruction.
     * @param name The name of the new var.
     * @return The var.
     */
    public Var insert(Insn insn, String name) {
        Var var = region.newVar(name);
        insert(insn.assignTo(var));
        return var;
    }

    /**
     * Assign the result of the instruction to a new typed var, and insert the effect.
     *
     * @param insn The instruction.
     * @param name The name of the new var.
     * @param type The type of the new var.
     * @return The var.
     */
    public Var insert(Insn insn, String name, Type type) {
        Var var = region.newVar(name, type);
        insert(insn.assignTo(var));
        return var;
    }

    /**
     * Assign the results of the instruction to new vars, and insert the effect.
     *
     * @param insn  The instruction.
     * @param names The names of the new vars, one per result.
     * @return The vars.
     */
    public List<Var> insertMulti(Insn insn, String... names) {
        List<Var> vars = new ArrayList<>(names.length);
        for (String name : names) {
            vars.add(region.newVar(name));
        }
        insert(insn.assignTo(vars));
        return vars;
    }

    /**
     * Close the region with a terminator.
     *
     * @param terminator The terminator.
     */
    public void terminate(Insn terminator) {
        region.setTerminator(terminator);
    }
}
