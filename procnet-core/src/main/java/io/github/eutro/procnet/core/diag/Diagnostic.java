package io.github.eutro.procnet.core.diag;

import java.util.Objects;

/**
 * A message about a symbol, reported while processing a module.
 */
public final class Diagnostic {
    public enum Severity {
        ERROR,
        WARNING,
    }

    public final Severity severity;
    /**
     * The name of the symbol this is about.
     */
    public final String symbol;
    public final String message;

    public Diagnostic(Severity severity, String symbol, String message) {
        this.severity = Objects.requireNonNull(severity);
        this.symbol = Objects.requireNonNull(symbol);
        this.message = Objects.requireNonNull(message);
    }

    @Override
    public String toString() {
        return "@" + symbol + ": " + severity.name().toLowerCase() + ": " + message;
    }
}
