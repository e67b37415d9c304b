package io.github.eutro.procnet.core.ssa;

import io.github.eutro.procnet.core.ext.CommonExts;
import io.github.eutro.procnet.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * An ordered collection of {@link ModuleSymbol top-level symbols}.
 * <p>
 * {@link ProcTemplate Templates} have their own namespace. Every other symbol
 * ({@link FlatChannel channels} and {@link ElaboratedProc processes}) shares one
 * flat namespace, since they are referred to from process bodies by name.
 * No two symbols in a namespace can have the same name.
 */
public final class Module extends ExtHolder {
    private final List<ModuleSymbol> symbols = new ArrayList<>();
    private final Map<String, ModuleSymbol> templates = new HashMap<>();
    private final Map<String, ModuleSymbol> flatSymbols = new HashMap<>();

    /**
     * Append a symbol to this module.
     *
     * @param symbol The symbol.
     * @param <T>    The type of the symbol.
     * @return The symbol.
     */
    public <T extends ModuleSymbol> T add(T symbol) {
        return insert(symbols.size(), symbol);
    }

    /**
     * Insert a symbol immediately before another.
     *
     * @param anchor The symbol to insert before, which must be in this module.
     * @param symbol The symbol to insert.
     * @param <T>    The type of the symbol.
     * @return The symbol.
     */
    public <T extends ModuleSymbol> T insertBefore(ModuleSymbol anchor, T symbol) {
        int index = symbols.indexOf(anchor);
        if (index < 0) {
            throw new IllegalArgumentException("@" + anchor.getName() + " is not in this module");
        }
        return insert(index, symbol);
    }

    private <T extends ModuleSymbol> T insert(int index, T symbol) {
        if (symbol.getNullable(CommonExts.OWNING_MODULE) != null) {
            throw new IllegalArgumentException("@" + symbol.getName() + " is already in a module");
        }
        Map<String, ModuleSymbol> namespace = namespaceOf(symbol);
        if (namespace.containsKey(symbol.getName())) {
            throw new IllegalArgumentException("symbol @" + symbol.getName() + " is already defined");
        }
        namespace.put(symbol.getName(), symbol);
        symbols.add(index, symbol);
        symbol.attachExt(CommonExts.OWNING_MODULE, this);
        return symbol;
    }

    private Map<String, ModuleSymbol> namespaceOf(ModuleSymbol symbol) {
        return symbol instanceof ProcTemplate ? templates : flatSymbols;
    }

    /**
     * Look up a channel or elaborated process by name.
     *
     * @param name The name.
     * @return The symbol, or null if there is none.
     */
    public @Nullable ModuleSymbol lookup(String name) {
        return flatSymbols.get(name);
    }

    /**
     * Look up a channel by name.
     *
     * @param name The name.
     * @return The channel, or null if there is none.
     */
    public @Nullable FlatChannel lookupChannel(String name) {
        ModuleSymbol symbol = flatSymbols.get(name);
        return symbol instanceof FlatChannel ? (FlatChannel) symbol : null;
    }

    /**
     * Look up a template by name.
     *
     * @param name The name.
     * @return The template, or null if there is none.
     */
    public @Nullable ProcTemplate lookupTemplate(String name) {
        return (ProcTemplate) templates.get(name);
    }

    /**
     * Get every symbol in this module, in order.
     *
     * @return An unmodifiable view of the symbols.
     */
    public List<ModuleSymbol> getSymbols() {
        return Collections.unmodifiableList(symbols);
    }

    /**
     * Get every symbol of a kind, in order.
     *
     * @param kind The class of symbols to get.
     * @param <T>  The kind.
     * @return A snapshot of the matching symbols, safe to hold while the module is modified.
     */
    public <T extends ModuleSymbol> List<T> getSymbols(Class<T> kind) {
        List<T> ret = new ArrayList<>();
        for (ModuleSymbol symbol : symbols) {
            if (kind.isInstance(symbol)) {
                ret.add(kind.cast(symbol));
            }
        }
        return ret;
    }

    /**
     * Remove a symbol from this module.
     *
     * @param symbol The symbol.
     * @return Whether it was in this module.
     */
    public boolean erase(ModuleSymbol symbol) {
        if (!symbols.remove(symbol)) return false;
        unregister(symbol);
        return true;
    }

    /**
     * Remove every symbol of a kind from this module.
     *
     * @param kind The class of symbols to remove.
     * @return The number of symbols removed.
     */
    public int eraseAll(Class<? extends ModuleSymbol> kind) {
        int count = 0;
        Iterator<ModuleSymbol> it = symbols.iterator();
        while (it.hasNext()) {
            ModuleSymbol symbol = it.next();
            if (kind.isInstance(symbol)) {
                it.remove();
                unregister(symbol);
                count++;
            }
        }
        return count;
    }

    private void unregister(ModuleSymbol symbol) {
        namespaceOf(symbol).remove(symbol.getName());
        symbol.removeExt(CommonExts.OWNING_MODULE);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("module {\n");
        for (ModuleSymbol symbol : symbols) {
            sb.append(symbol).append('\n');
        }
        return sb.append('}').toString();
    }
}
