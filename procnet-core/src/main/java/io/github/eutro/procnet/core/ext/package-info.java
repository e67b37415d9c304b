/**
 * Exts associate typed, out-of-band data with IR objects.
 * <p>
 * Any {@link io.github.eutro.procnet.core.ext.ExtContainer} can carry a value for
 * any {@link io.github.eutro.procnet.core.ext.Ext}:
 *
 * <pre>{@code
 * Ext<Liveness> LIVENESS = Ext.create(Liveness.class, "LIVENESS");
 *
 * region.attachExt(LIVENESS, liveness);
 * region.getExt(LIVENESS); // => Optional[liveness]
 * }</pre>
 * <p>
 * Passes use this for analysis results they want to cache on the IR
 * (see {@link io.github.eutro.procnet.core.passes.meta.ComputeLiveness}), and the IR
 * itself uses it for back-references such as the owning module of a symbol.
 * Hot exts are stored in plain fields by the classes that own them.
 */
package io.github.eutro.procnet.core.ext;
