package io.github.eutro.procnet.core.diag;

import io.github.eutro.procnet.core.ext.CommonExts;
import io.github.eutro.procnet.core.ssa.Module;
import io.github.eutro.procnet.core.ssa.ModuleSymbol;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the {@link Diagnostic diagnostics} reported about the symbols of a module.
 * <p>
 * Reporting never throws, so passes can report a problem with one symbol and carry on with the rest.
 */
public final class Diagnostics {
    private static final Logger LOGGER = LogManager.getLogger();

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Get the diagnostics of a module, attaching an empty set if it has none yet.
     *
     * @param module The module.
     * @return Its diagnostics.
     */
    public static Diagnostics of(Module module) {
        Diagnostics diags = module.getNullable(CommonExts.DIAGNOSTICS);
        if (diags == null) {
            diags = new Diagnostics();
            module.attachExt(CommonExts.DIAGNOSTICS, diags);
        }
        return diags;
    }

    /**
     * Report a diagnostic about a symbol.
     *
     * @param severity The severity.
     * @param symbol   The symbol.
     * @param message  The message.
     * @return The diagnostic.
     */
    public Diagnostic emit(Diagnostic.Severity severity, ModuleSymbol symbol, String message) {
        Diagnostic diagnostic = new Diagnostic(severity, symbol.getName(), message);
        diagnostics.add(diagnostic);
        LOGGER.log(levelOf(severity), "{}", diagnostic);
        return diagnostic;
    }

    private static Level levelOf(Diagnostic.Severity severity) {
        return severity == Diagnostic.Severity.ERROR ? Level.ERROR : Level.WARN;
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Get the diagnostics about one symbol.
     *
     * @param symbol The name of the symbol.
     * @return Its diagnostics, in the order they were reported.
     */
    public List<Diagnostic> about(String symbol) {
        List<Diagnostic> ret = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.symbol.equals(symbol)) {
                ret.add(diagnostic);
            }
        }
        return ret;
    }

    public boolean hasErrors() {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.severity == Diagnostic.Severity.ERROR) return true;
        }
        return false;
    }

    /**
     * Render every diagnostic, one per line.
     *
     * @return The rendered diagnostics.
     */
    public String format() {
        StringBuilder sb = new StringBuilder("Detected ")
                .append(diagnostics.size())
                .append(" issue(s):");
        for (Diagnostic diagnostic : diagnostics) {
            sb.append('\n').append(diagnostic);
        }
        return sb.toString();
    }
}
