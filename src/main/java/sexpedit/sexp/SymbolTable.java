// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.sexp;

import java.util.concurrent.ConcurrentHashMap;

/**
 * A table for interning Lisp symbols.
 * <p>
 * Interned symbols can be compared for equality using object identity.
 * <p>
 * This class is thread-safe.
 */
public final class SymbolTable {
    /**
     * Produces the canonical representation of the symbol with the given name in this table.
     * <p>
     * Known symbols are returned as is. Other names are mapped to a symbol created on first use.
     */
    public Sexp.Symbol intern(final String symbolName) {
        final var knownSymbol = Sexp.KnownSymbol.byName(symbolName);
        if (knownSymbol != null) {
            return knownSymbol;
        }
        return symbols.computeIfAbsent(symbolName, Sexp.RegularSymbol::new);
    }

    private final ConcurrentHashMap<String, Sexp.RegularSymbol> symbols = new ConcurrentHashMap<>();
}
