package io.github.eutro.procnet.core.interp;

import io.github.eutro.procnet.core.ops.ChannelOps;
import io.github.eutro.procnet.core.ops.CommonOps;
import io.github.eutro.procnet.core.ops.Op;
import io.github.eutro.procnet.core.ops.SimpleOpKey;
import io.github.eutro.procnet.core.ssa.IRBuilder;
import io.github.eutro.procnet.core.ssa.Region;
import io.github.eutro.procnet.core.ssa.Var;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InterpreterTest {
    private static final Op ADD = new SimpleOpKey("add").create();
    private static final Op FAIL = new SimpleOpKey("fail").create();

    private static class Arith extends Interpreter<InterpreterContext<Integer>, Integer> {
        Arith() {
            addRule(CommonOps.CONST, (effect, ctx) ->
                    ctx.set(effect.getAssignsTo().get(0), (Integer) CommonOps.CONST.cast(effect.insn().op).arg));
            addRule(ADD.key, (effect, ctx) -> {
                int sum = 0;
                for (Integer value : ctx.get(effect.insn().args())) {
                    sum += value;
                }
                ctx.set(effect.getAssignsTo().get(0), sum);
            });
            addRule(FAIL.key, (effect, ctx) -> {
                throw new InterpretationException("failed");
            });
            addRule(ChannelOps.YIELD.key, (effect, ctx) -> {
            });
        }

        List<Integer> run(Region region, List<Integer> args, InterpreterContext<Integer> ctx) {
            try (InterpreterContext.Scope ignored = ctx.pushLiveness(getOrCreateLiveness(region))) {
                return interpret(region, args, ctx);
            }
        }
    }

    @Test
    void testInterpret() {
        Region region = new Region();
        Var x = region.addArg("x", null);
        IRBuilder ib = new IRBuilder(region);
        Var one = ib.insert(CommonOps.constant(1), "one");
        Var y = ib.insert(ADD.insn(x, one), "y");
        Var z = ib.insert(ADD.insn(y, y, x), "z");
        ib.terminate(ChannelOps.YIELD.insn(z, one));

        InterpreterContext<Integer> ctx = new InterpreterContext<>();
        assertEquals(Arrays.asList(14, 1), new Arith().run(region, Collections.singletonList(4), ctx));
        assertEquals(0, ctx.depth());
    }

    @Test
    void testDeadBindingsReleased() {
        Region region = new Region();
        IRBuilder ib = new IRBuilder(region);
        Var one = ib.insert(CommonOps.constant(1), "one");
        Var two = ib.insert(ADD.insn(one, one), "two");
        Op peek = new SimpleOpKey("peek").create();
        ib.insert(peek.insn(two), "three");
        ib.terminate(ChannelOps.YIELD.insn());

        Arith arith = new Arith();
        boolean[] released = new boolean[1];
        arith.addRule(peek.key, (effect, ctx) -> {
            InterpretationException e = assertThrows(InterpretationException.class, () -> ctx.get(one));
            released[0] = e.getMessage().startsWith("no value is bound to");
            ctx.set(effect.getAssignsTo().get(0), ctx.get(effect.insn().args().get(0)) + 1);
        });
        arith.run(region, Collections.emptyList(), new InterpreterContext<>());
        assertTrue(released[0]);
    }

    @Test
    void testScopePoppedOnFailure() {
        Region region = new Region();
        IRBuilder ib = new IRBuilder(region);
        ib.insert(FAIL.insn());

        InterpreterContext<Integer> ctx = new InterpreterContext<>();
        assertThrows(InterpretationException.class, () -> new Arith().run(region, Collections.emptyList(), ctx));
        assertEquals(0, ctx.depth());
    }

    @Test
    void testUnknownOp() {
        Region region = new Region();
        new IRBuilder(region).insert(new SimpleOpKey("mystery").create().insn());

        InterpreterContext<Integer> ctx = new InterpreterContext<>();
        InterpretationException e = assertThrows(InterpretationException.class,
                () -> new Arith().run(region, Collections.emptyList(), ctx));
        assertEquals("cannot interpret mystery", e.getMessage());
        assertEquals(0, ctx.depth());
    }

    @Test
    void testArgumentCount() {
        Region region = new Region();
        region.addArg("x", null);

        InterpretationException e = assertThrows(InterpretationException.class,
                () -> new Arith().run(region, Collections.emptyList(), new InterpreterContext<>()));
        assertEquals("region takes 1 arguments but got 0", e.getMessage());
    }

    @Test
    void testScopesCloseInOrder() {
        InterpreterContext<Integer> ctx = new InterpreterContext<>();
        Liveness liveness = new Liveness(1);
        InterpreterContext.Scope outer = ctx.pushLiveness(liveness);
        InterpreterContext.Scope inner = ctx.pushLiveness(liveness);
        assertEquals(2, ctx.depth());
        assertThrows(IllegalStateException.class, outer::close);
        inner.close();
        inner.close();
        outer.close();
        assertEquals(0, ctx.depth());
    }
}
