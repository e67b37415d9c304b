/**
 * The intermediate representation (IR) of process networks.
 * <p>
 * Before elaboration, a {@link io.github.eutro.procnet.core.ssa.Module} holds
 * {@link io.github.eutro.procnet.core.ssa.ProcTemplate process templates}, which
 * declare channels and spawn each other through
 * {@link io.github.eutro.procnet.core.ops.ChannelOps structured channel operations}.
 * After elaboration it holds only {@link io.github.eutro.procnet.core.ssa.FlatChannel flat channels}
 * and {@link io.github.eutro.procnet.core.ssa.ElaboratedProc elaborated processes}, which
 * name the channels they use.
 * <p>
 * Code lives in {@link io.github.eutro.procnet.core.ssa.Region regions}: straight-line
 * lists of {@link io.github.eutro.procnet.core.ssa.Effect effects}, closed by a terminator.
 * Each {@link io.github.eutro.procnet.core.ssa.Var} is assigned exactly once, either as an
 * argument of its region or by one effect, and is only used after that.
 */
package io.github.eutro.procnet.core.ssa;
