package io.github.eutro.procnet.core.interp;

import io.github.eutro.procnet.core.ext.CommonExts;
import io.github.eutro.procnet.core.ops.OpKey;
import io.github.eutro.procnet.core.passes.meta.ComputeLiveness;
import io.github.eutro.procnet.core.ssa.Effect;
import io.github.eutro.procnet.core.ssa.Insn;
import io.github.eutro.procnet.core.ssa.Region;
import io.github.eutro.procnet.core.ssa.Var;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a region effect by effect, dispatching on the {@link OpKey} of each instruction.
 * <p>
 * Subclasses {@link #addRule(OpKey, Rule) add a rule} for each operation they understand.
 * Meeting any other operation is an error.
 *
 * @param <C> The type of the context.
 * @param <V> The type of values.
 */
public abstract class Interpreter<C extends InterpreterContext<V>, V> {
    /**
     * How to interpret one kind of operation.
     *
     * @param <C> The type of the context.
     */
    @FunctionalInterface
    public interface Rule<C> {
        /**
         * Interpret an effect, binding its results in the context.
         *
         * @param effect The effect.
         * @param ctx    The context.
         */
        void interpret(Effect effect, C ctx);
    }

    private final Map<OpKey, Rule<C>> rules = new HashMap<>();

    protected void addRule(OpKey key, Rule<C> rule) {
        rules.put(key, rule);
    }

    /**
     * Get the liveness of a region, computing it if it hasn't been yet.
     *
     * @param region The region.
     * @return Its liveness.
     */
    protected Liveness getOrCreateLiveness(Region region) {
        return region.getExtOrRun(CommonExts.LIVENESS, region, ComputeLiveness.INSTANCE);
    }

    /**
     * Interpret a region in the current frame of the context.
     *
     * @param region The region.
     * @param args   The values of the region's arguments.
     * @param ctx    The context.
     * @return The values of the terminator's operands.
     */
    public List<V> interpret(Region region, List<V> args, C ctx) {
        List<Var> params = region.getArgs();
        if (params.size() != args.size()) {
            throw new InterpretationException(String.format(
                    "region takes %d arguments but got %d", params.size(), args.size()));
        }
        for (int i = 0; i < params.size(); i++) {
            ctx.set(params.get(i), args.get(i));
        }
        List<Effect> effects = region.getEffects();
        for (int i = 0; i < effects.size(); i++) {
            Effect effect = effects.get(i);
            ruleFor(effect.insn()).interpret(effect, ctx);
            ctx.releaseDeadAfter(i);
        }
        Insn terminator = region.getTerminator();
        ruleFor(terminator).interpret(terminator.assignTo(Collections.emptyList()), ctx);
        List<V> results = ctx.get(terminator.args());
        ctx.releaseDeadAfter(effects.size());
        return results;
    }

    private Rule<C> ruleFor(Insn insn) {
        Rule<C> rule = rules.get(insn.op.key);
        if (rule == null) {
            throw new InterpretationException("cannot interpret " + insn.op);
        }
        return rule;
    }
}
