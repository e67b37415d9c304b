package io.github.eutro.procnet.core.interp;

import io.github.eutro.procnet.core.ssa.Var;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The state of an {@link Interpreter}: a stack of frames binding vars to values.
 * <p>
 * A frame is pushed for each region being interpreted, and holds the bindings of that
 * region's vars. Bindings are dropped as soon as the frame's {@link Liveness} says
 * they are dead.
 *
 * @param <V> The type of values.
 */
public class InterpreterContext<V> {
    private final Deque<Frame<V>> frames = new ArrayDeque<>();

    private static final class Frame<V> {
        final Liveness liveness;
        final Map<Var, V> bindings = new HashMap<>();

        Frame(Liveness liveness) {
            this.liveness = liveness;
        }
    }

    /**
     * A pushed frame, which is popped when closed.
     */
    public static final class Scope implements AutoCloseable {
        private final InterpreterContext<?> ctx;
        private final Frame<?> frame;
        private boolean closed = false;

        private Scope(InterpreterContext<?> ctx, Frame<?> frame) {
            this.ctx = ctx;
            this.frame = frame;
        }

        @Override
        public void close() {
            if (closed) return;
            ctx.pop(frame);
            closed = true;
        }
    }

    /**
     * Push a new frame, for a region with the given liveness.
     *
     * @param liveness The liveness of the region.
     * @return The scope, which pops the frame when closed.
     */
    public Scope pushLiveness(Liveness liveness) {
        Frame<V> frame = new Frame<>(liveness);
        frames.push(frame);
        return new Scope(this, frame);
    }

    private void pop(Frame<?> frame) {
        if (frames.peek() != frame) {
            throw new IllegalStateException("scopes closed out of order");
        }
        frames.pop();
    }

    /**
     * Get the number of frames pushed.
     *
     * @return The depth.
     */
    public int depth() {
        return frames.size();
    }

    private Frame<V> top() {
        Frame<V> frame = frames.peek();
        if (frame == null) {
            throw new InterpretationException("no frame is pushed");
        }
        return frame;
    }

    /**
     * Bind a var in the current frame.
     *
     * @param var   The var.
     * @param value Its value.
     */
    public void set(Var var, V value) {
        top().bindings.put(var, value);
    }

    /**
     * Get the value of a var in the current frame.
     *
     * @param var The var.
     * @return The value.
     * @throws InterpretationException If the var has no value.
     */
    public V get(Var var) {
        V value = top().bindings.get(var);
        if (value == null) {
            throw new InterpretationException("no value is bound to " + var);
        }
        return value;
    }

    /**
     * Get the values of some vars in the current frame.
     *
     * @param vars The vars.
     * @return The values, in order.
     * @throws InterpretationException If any var has no value.
     */
    public List<V> get(List<Var> vars) {
        List<V> values = new ArrayList<>(vars.size());
        for (Var var : vars) {
            values.add(get(var));
        }
        return values;
    }

    void releaseDeadAfter(int position) {
        Frame<V> frame = top();
        for (Var dead : frame.liveness.deadAfter(position)) {
            frame.bindings.remove(dead);
        }
    }
}
