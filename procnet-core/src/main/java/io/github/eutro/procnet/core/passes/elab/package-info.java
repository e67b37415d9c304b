/**
 * Process elaboration, see {@link io.github.eutro.procnet.core.passes.elab.ProcElaboration}.
 */
package io.github.eutro.procnet.core.passes.elab;
