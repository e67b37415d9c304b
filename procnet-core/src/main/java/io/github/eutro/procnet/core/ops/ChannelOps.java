package io.github.eutro.procnet.core.ops;

import io.github.eutro.procnet.core.ext.CommonExts;
import io.github.eutro.procnet.core.ssa.Insn;
import io.github.eutro.procnet.core.ssa.Var;
import io.github.eutro.procnet.core.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Channel operations, in both their structured and flat forms.
 * <p>
 * Structured operations take the channel as their first operand, and only appear in
 * {@link io.github.eutro.procnet.core.ssa.ProcTemplate process templates}. Flat operations
 * name a {@link io.github.eutro.procnet.core.ssa.FlatChannel} in their immediate instead,
 * and only appear in {@link io.github.eutro.procnet.core.ssa.ElaboratedProc elaborated processes}.
 * <p>
 * The operands after the channel are always the token, then the data (for sends), then an
 * optional predicate. A send or receive whose predicate is false is skipped.
 */
public class ChannelOps {
    /**
     * Spawns region: declares a local channel. Returns the send end, then the receive end.
     */
    public static final UnaryOpKey<LocalDecl> SCHAN = new UnaryOpKey<>("schan");
    /**
     * Spawns region: instantiates the template named by the immediate, with the operands as its channels.
     */
    public static final UnaryOpKey<String> SPAWN = new UnaryOpKey<>("spawn", name -> "@" + name);
    /**
     * Terminator: hands the operands on, to the next region from the spawns region,
     * or to the next iteration from the next region.
     */
    public static final Op YIELD = new SimpleOpKey("yield").create();

    /**
     * Effect: {@code (chan, tkn, data[, pred]) -> tkn}.
     */
    public static final Op SSEND = new SimpleOpKey("ssend").create();
    /**
     * Effect: {@code (chan, tkn[, pred]) -> (tkn, data)}. Blocks until data is available.
     */
    public static final Op SRECV = new SimpleOpKey("srecv").create();
    /**
     * Effect: {@code (chan, tkn[, pred]) -> (tkn, data, valid)}. Never blocks.
     */
    public static final Op SRECV_NB = new SimpleOpKey("srecv_nb").create();

    /**
     * Effect: {@code (tkn, data[, pred]) -> tkn}, on the named channel.
     */
    public static final UnaryOpKey<String> SEND = new UnaryOpKey<>("send", name -> "@" + name);
    /**
     * Effect: {@code (tkn[, pred]) -> (tkn, data)}, on the named channel. Blocks until data is available.
     */
    public static final UnaryOpKey<String> RECV = new UnaryOpKey<>("recv", name -> "@" + name);
    /**
     * Effect: {@code (tkn[, pred]) -> (tkn, data, valid)}, on the named channel. Never blocks.
     */
    public static final UnaryOpKey<String> RECV_NB = new UnaryOpKey<>("recv_nb", name -> "@" + name);

    private static final List<UnaryOpKey<String>> FLAT_OPS = Arrays.asList(SEND, RECV, RECV_NB);

    static {
        for (OpKey key : new OpKey[]{SCHAN, SPAWN, SSEND.key, SRECV.key, SRECV_NB.key}) {
            key.attachExt(CommonExts.IS_STRUCTURED, true);
        }
    }

    /**
     * The immediate of {@link #SCHAN}: the requested name and payload type of a local channel.
     */
    public static final class LocalDecl {
        public final String name;
        public final Type elementType;

        public LocalDecl(String name, Type elementType) {
            this.name = Objects.requireNonNull(name);
            this.elementType = Objects.requireNonNull(elementType);
        }

        @Override
        public String toString() {
            return '"' + name + "\" : " + elementType;
        }
    }

    /**
     * Whether {@code insn} is a structured operation, which must not survive elaboration.
     *
     * @param insn The instruction.
     * @return Whether it is structured.
     */
    public static boolean isStructured(Insn insn) {
        return insn.getExt(CommonExts.IS_STRUCTURED).orElse(false);
    }

    /**
     * Get the name of the flat channel that {@code insn} communicates on.
     *
     * @param insn The instruction.
     * @return The channel name, or null if it isn't a flat channel operation.
     */
    public static @Nullable String flatChannelOf(Insn insn) {
        for (UnaryOpKey<String> key : FLAT_OPS) {
            UnaryOpKey<String>.UnaryOp op = key.checkNullable(insn.op);
            if (op != null) return op.arg;
        }
        return null;
    }

    /**
     * Get the index of the predicate operand of a channel operation, if it had one.
     *
     * @param key The key of the channel operation.
     * @return The index, or -1 if {@code key} isn't a send or receive.
     */
    public static int predicateIndex(OpKey key) {
        if (key == SSEND.key) return 3;
        if (key == SRECV.key || key == SRECV_NB.key || key == SEND) return 2;
        if (key == RECV || key == RECV_NB) return 1;
        return -1;
    }

    /**
     * Get the predicate of a send or receive.
     *
     * @param insn The instruction.
     * @return The predicate, or null if it is unconditional.
     */
    public static @Nullable Var predicateOf(Insn insn) {
        int idx = predicateIndex(insn.op.key);
        if (idx < 0 || insn.args().size() <= idx) return null;
        return insn.args().get(idx);
    }
}
